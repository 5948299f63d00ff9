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
package net.hydromatic.zen.ast;

import static net.hydromatic.zen.ast.ZenBuilder.zen;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.zen.type.ConstMapType;
import net.hydromatic.zen.type.FSeqType;
import net.hydromatic.zen.type.ListType;
import net.hydromatic.zen.type.MapType;
import net.hydromatic.zen.type.PrimitiveType;
import net.hydromatic.zen.type.RecordType;
import net.hydromatic.zen.type.SeqType;
import org.junit.jupiter.api.Test;

/** Tests for {@link ZenBuilder}. */
public class ZenBuilderTest {
  @Test void testUnparse() {
    final Zen.Arbitrary x = zen.arbitrary(PrimitiveType.INT, "x");
    final Zen.Arbitrary y = zen.arbitrary(PrimitiveType.INT, "y");
    assertThat(zen.add(x, y), hasToString("(x + y)"));
    assertThat(zen.and(zen.eq(x, zen.intLiteral(5)), zen.le(x, y)),
        hasToString("((x == 5) && (x <= y))"));
    assertThat(zen.ifThenElse(zen.gt(x, y), x, y),
        hasToString("if !((x <= y)) then x else y"));
    assertThat(zen.stringLiteral("abc"), hasToString("\"abc\""));
  }

  @Test void testIdsAreUnique() {
    final Zen.Exp e0 = zen.intLiteral(1);
    final Zen.Exp e1 = zen.intLiteral(1);
    assertThat(e0.id == e1.id, is(false));
    assertThat(zen.boolLiteral(true), sameInstance(zen.boolLiteral(true)));
  }

  /** Nodes form a DAG; a shared node appears once per use. */
  @Test void testOperands() {
    final Zen.Arbitrary x = zen.arbitrary(PrimitiveType.INT, "x");
    final Zen.Exp sum = zen.add(x, x);
    assertThat(Zen.operands(sum), hasToString("[x, x]"));
    assertThat(Zen.operands(x).isEmpty(), is(true));
    final Zen.Exp anIf = zen.ifThenElse(zen.boolLiteral(true), sum, x);
    assertThat(Zen.operands(anIf).get(1), sameInstance(sum));
    final Zen.ListCase listCase =
        zen.listCase(zen.listEmpty(ListType.of(PrimitiveType.INT)), x,
            (head, tail) -> head);
    assertThat(Zen.operands(listCase), hasSize(2));
  }

  @Test void testTypeChecks() {
    final Zen.Arbitrary b = zen.arbitrary(PrimitiveType.BOOL);
    final Zen.Arbitrary i = zen.arbitrary(PrimitiveType.INT);
    final Zen.Arbitrary l = zen.arbitrary(PrimitiveType.LONG);
    assertThrows(IllegalArgumentException.class, () -> zen.add(i, l));
    assertThrows(IllegalArgumentException.class, () -> zen.add(b, b));
    assertThrows(IllegalArgumentException.class, () -> zen.not(i));
    assertThrows(IllegalArgumentException.class, () -> zen.le(b, b));
    assertThrows(IllegalArgumentException.class,
        () -> zen.ifThenElse(i, b, b));
    assertThrows(IllegalArgumentException.class,
        () -> zen.ifThenElse(b, b, i));
    assertThrows(IllegalArgumentException.class,
        () -> zen.arbitrary(ListType.of(PrimitiveType.INT)));
    assertThrows(IllegalArgumentException.class,
        () -> zen.getField(i, "x"));
  }

  @Test void testRecords() {
    final Zen.CreateObject point =
        zen.createObject(
            ImmutableMap.of("x", zen.intLiteral(1), "y", zen.intLiteral(2)));
    assertThat(point.type, hasToString("{x:int, y:int}"));
    assertThat(zen.getField(point, "y").type, is(PrimitiveType.INT));
    assertThat(zen.withField(point, "x", zen.intLiteral(3)),
        hasToString("{x = 1, y = 2} with {x = 3}"));
    assertThrows(IllegalArgumentException.class,
        () -> zen.getField(point, "z"));
    assertThrows(IllegalArgumentException.class,
        () -> zen.withField(point, "x", zen.boolLiteral(true)));

    final Zen.Exp some = zen.some(zen.byteLiteral(3));
    assertThat(some.type, is(RecordType.option(PrimitiveType.BYTE)));
    assertThat(zen.none(PrimitiveType.BYTE).type, is(some.type));
  }

  /** The non-empty case of a list case split is built once, when first
   * requested, from the node's own arguments. */
  @Test void testConsCaseIsMemoized() {
    final ListType type = ListType.of(PrimitiveType.INT);
    final AtomicInteger count = new AtomicInteger();
    final Zen.ListCase listCase =
        zen.listCase(zen.list(type, zen.intLiteral(1)), zen.intLiteral(0),
            (head, tail) -> {
              count.incrementAndGet();
              return head;
            });
    assertThat(count.get(), is(0));
    final Zen.Exp consCase = listCase.consCase();
    assertThat(consCase, sameInstance(listCase.head));
    assertThat(listCase.consCase(), sameInstance(consCase));
    assertThat(count.get(), is(1));
    assertThat(listCase.tail.type, is(type));

    final Zen.ListCase badCase =
        zen.listCase(zen.listEmpty(type), zen.boolLiteral(false),
            (head, tail) -> head);
    assertThrows(IllegalArgumentException.class, badCase::consCase);
  }

  @Test void testInput() {
    final RecordType type =
        RecordType.of(
            ImmutableMap.of("a", PrimitiveType.INT,
                "b", ListType.of(PrimitiveType.BOOL)));
    final List<Zen.Arbitrary> arbitraries = new ArrayList<>();
    final Zen.Exp input = zen.input(type, 2, arbitraries);
    assertThat(input.type, is(type));
    // "a", then a stop flag and an element for each of two list slots
    assertThat(arbitraries, hasSize(5));
    assertThat(arbitraries.get(0).type, is(PrimitiveType.INT));

    final Zen.Exp fseq = zen.input(FSeqType.of(PrimitiveType.INT), 3);
    assertThat(fseq.type, is(FSeqType.of(PrimitiveType.INT)));
    assertThrows(IllegalArgumentException.class,
        () -> zen.input(PrimitiveType.INT, -1));
  }

  @Test void testMaps() {
    final MapType type = MapType.of(PrimitiveType.INT, PrimitiveType.STRING);
    final Zen.Exp map =
        zen.mapSet(zen.mapEmpty(type), zen.intLiteral(1),
            zen.stringLiteral("one"));
    assertThat(map.type, is(type));
    assertThat(zen.mapGet(map, zen.intLiteral(1)).type,
        is(RecordType.option(PrimitiveType.STRING)));
    assertThrows(IllegalArgumentException.class,
        () -> zen.mapGet(map, zen.stringLiteral("one")));
    assertThrows(IllegalArgumentException.class,
        () -> zen.mapEmpty(
            MapType.of(PrimitiveType.INT, ListType.of(PrimitiveType.INT))));

    final ConstMapType constMapType =
        ConstMapType.of(PrimitiveType.STRING, PrimitiveType.INT,
            ImmutableList.of("a", "b"));
    final Zen.Exp constMap =
        zen.constMapSet(zen.constMapEmpty(constMapType), "a",
            zen.intLiteral(7));
    assertThat(zen.constMapGet(constMap, "b").type, is(PrimitiveType.INT));
    assertThrows(IllegalArgumentException.class,
        () -> zen.constMapGet(constMap, "c"));
  }

  @Test void testSequences() {
    final Zen.Exp s = zen.arbitrary(PrimitiveType.STRING, "s");
    assertThat(zen.length(s).type, is(PrimitiveType.BIG_INTEGER));
    assertThat(zen.concat(s, zen.stringLiteral("!")).type,
        is(PrimitiveType.STRING));
    assertThat(zen.matches(s, Regex.star(Regex.range('a', 'z'))),
        instanceOf(Zen.SeqMatches.class));
    final SeqType chars = SeqType.of(PrimitiveType.CHAR);
    assertThat(zen.cast(s, chars).type, is(chars));
    assertThat(zen.cast(zen.cast(s, chars), PrimitiveType.STRING).type,
        is(PrimitiveType.STRING));
    assertThat(zen.seqUnit(zen.intLiteral(1)).type,
        not(is(PrimitiveType.STRING)));
    assertThrows(IllegalArgumentException.class,
        () -> zen.concat(s, zen.seqUnit(zen.charLiteral('a'))));
  }
}

// End ZenBuilderTest.java
