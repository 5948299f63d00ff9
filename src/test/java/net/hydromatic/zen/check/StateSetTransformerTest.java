/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.zen.check;

import static net.hydromatic.zen.ast.ZenBuilder.zen;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import net.hydromatic.zen.type.PrimitiveType;
import net.hydromatic.zen.type.RecordType;
import net.hydromatic.zen.util.ZenException;
import org.junit.jupiter.api.Test;

/** Tests for {@link StateSet} and {@link StateSetTransformer}. */
public class StateSetTransformerTest {
  private final StateSetTransformerManager manager =
      new StateSetTransformerManager();

  private StateSet bytes(int value) {
    return manager.createStateSet(x -> zen.eq(x, zen.byteLiteral(value)),
        PrimitiveType.BYTE);
  }

  @Test void testSetOperations() {
    final StateSet small =
        manager.createStateSet(x -> zen.lt(x, zen.byteLiteral(10)),
            PrimitiveType.BYTE);
    final StateSet large = small.complement();
    assertThat(small.isEmpty(), is(false));
    assertThat(small.union(large).isFull(), is(true));
    assertThat(small.intersect(large).isEmpty(), is(true));
    assertThat((Byte) small.element() < 10, is(true));
    assertThat((Byte) large.element() >= 10, is(true));

    final StateSet negative =
        manager.createStateSet(x -> zen.lt(x, zen.byteLiteral(0)),
            PrimitiveType.BYTE);
    assertThat(small.intersect(negative), is(negative));
    assertThat(small.union(negative), is(small));

    final StateSet all =
        manager.createStateSet(x -> zen.boolLiteral(true), PrimitiveType.BYTE);
    assertThat(all.isFull(), is(true));
  }

  @Test void testElementOfEmptySet() {
    final StateSet empty = bytes(3).intersect(bytes(4));
    assertThat(empty.isEmpty(), is(true));
    final ZenException e = assertThrows(ZenException.class, empty::element);
    assertThat(e.getMessage(), is("state set is empty"));
  }

  @Test void testForwardAndBackward() {
    final StateSetTransformer increment =
        manager.createTransformer(x -> zen.add(x, zen.byteLiteral(1)),
            PrimitiveType.BYTE, PrimitiveType.BYTE);
    final StateSet four = bytes(4);
    final StateSet image = increment.transformForward(four);
    assertThat(image.element(), is((byte) 5));
    assertThat(image, is(bytes(5)));
    assertThat(increment.transformBackwards(image), is(four));

    // 127 + 1 wraps around
    assertThat(increment.transformForward(bytes(127)).element(),
        is((byte) -128));
    assertThat(increment.transformBackwards(bytes(0)).element(),
        is((byte) -1));
    assertThat(increment.inputSet().isFull(), is(true));
    assertThat(increment.outputSet().isFull(), is(true));
  }

  /** A function that loses information has a pre-image larger than its
   * input. */
  @Test void testRecordInput() {
    final RecordType type =
        RecordType.of(
            ImmutableMap.of("a", PrimitiveType.BYTE, "b", PrimitiveType.BOOL));
    final StateSetTransformer project =
        manager.createTransformer(
            r -> zen.ifThenElse(zen.getField(r, "b"), zen.getField(r, "a"),
                zen.byteLiteral(0)),
            type, PrimitiveType.BYTE);

    final StateSet threes =
        project.inputSet((in, out) -> zen.eq(out, zen.byteLiteral(3)));
    assertThat(threes.element(),
        is(ImmutableMap.of("a", (byte) 3, "b", true)));
    assertThat(project.transformBackwards(bytes(3)), is(threes));

    final StateSet zeros = project.transformBackwards(bytes(0));
    final StateSet falses =
        manager.createStateSet(r -> zen.not(zen.getField(r, "b")), type);
    assertThat(falses.intersect(zeros), is(falses));

    final StateSet outputs =
        project.outputSet((in, out) -> zen.getField(in, "b"));
    assertThat(outputs.isFull(), is(true));
    assertThat(project.transformForward(falses), is(bytes(0)));
  }

  @Test void testIncompatibleSets() {
    final StateSetTransformerManager other = new StateSetTransformerManager();
    final StateSet mine = bytes(1);
    final StateSet theirs =
        other.createStateSet(x -> zen.eq(x, zen.byteLiteral(1)),
            PrimitiveType.BYTE);
    assertThrows(ZenException.class, () -> mine.union(theirs));

    final StateSet shorts =
        manager.createStateSet(x -> zen.eq(x, zen.shortLiteral(1)),
            PrimitiveType.SHORT);
    assertThrows(ZenException.class, () -> mine.intersect(shorts));

    final StateSetTransformer increment =
        manager.createTransformer(x -> zen.add(x, zen.byteLiteral(1)),
            PrimitiveType.BYTE, PrimitiveType.BYTE);
    assertThrows(ZenException.class,
        () -> increment.transformForward(shorts));
    assertThrows(ZenException.class,
        () -> increment.transformForward(theirs));
  }
}

// End StateSetTransformerTest.java
