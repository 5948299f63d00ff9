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
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.util.function.BinaryOperator;
import net.hydromatic.zen.ast.Zen;
import net.hydromatic.zen.type.ListType;
import net.hydromatic.zen.type.MapType;
import net.hydromatic.zen.type.PrimitiveType;
import net.hydromatic.zen.type.Type;
import net.hydromatic.zen.util.UnsupportedConstructException;
import net.hydromatic.zen.util.ZenException;
import org.junit.jupiter.api.Test;

/** Tests for {@link InterleavingHeuristic}. */
public class InterleavingHeuristicTest {
  private final Zen.Arbitrary x = zen.arbitrary(PrimitiveType.INT, "x");
  private final Zen.Arbitrary y = zen.arbitrary(PrimitiveType.INT, "y");

  private void checkBinary(BinaryOperator<Zen.Exp> op, String expected) {
    assertThat(InterleavingHeuristic.compute(op.apply(x, y)),
        hasToString(expected));
  }

  @Test void testCombiningOperations() {
    checkBinary(zen::add, "[[x, y]]");
    checkBinary(zen::subtract, "[[x, y]]");
    checkBinary(zen::bitwiseAnd, "[[x, y]]");
    checkBinary(zen::bitwiseXor, "[[x, y]]");
    checkBinary(zen::eq, "[[x, y]]");
    checkBinary(zen::le, "[[x, y]]");
    checkBinary(zen::gt, "[[x, y]]");
  }

  /** "Or" keeps each bit of its operands apart, so it need not
   * interleave. */
  @Test void testBitwiseOrDoesNotCombine() {
    checkBinary(zen::bitwiseOr, "[[x], [y]]");
    assertThat(
        InterleavingHeuristic.compute(
            zen.eq(zen.bitwiseOr(x, y), zen.intLiteral(3))),
        hasToString("[[x], [y]]"));
  }

  @Test void testBooleansDoNotCombine() {
    final Zen.Arbitrary b = zen.arbitrary(PrimitiveType.BOOL, "b");
    final Zen.Arbitrary c = zen.arbitrary(PrimitiveType.BOOL, "c");
    assertThat(InterleavingHeuristic.compute(zen.eq(b, c)),
        hasToString("[[b], [c]]"));
    assertThat(InterleavingHeuristic.compute(zen.and(b, zen.le(x, y))),
        hasToString("[[b], [x, y]]"));
  }

  /** Record equality combines only arbitraries of the same type. */
  @Test void testRecords() {
    final Zen.Arbitrary s = zen.arbitrary(PrimitiveType.SHORT, "s");
    final Zen.Arbitrary t = zen.arbitrary(PrimitiveType.SHORT, "t");
    final Zen.Exp r0 = zen.createObject(ImmutableMap.of("a", x, "b", s));
    final Zen.Exp r1 = zen.createObject(ImmutableMap.of("a", y, "b", t));
    assertThat(InterleavingHeuristic.compute(zen.eq(r0, r1)),
        hasToString("[[x, y], [s, t]]"));
    assertThat(
        InterleavingHeuristic.compute(
            zen.eq(zen.getField(r0, "a"), zen.getField(r1, "a"))),
        hasToString("[[x, y], [s], [t]]"));
  }

  @Test void testIfDoesNotCombineCondition() {
    final Zen.Arbitrary z = zen.arbitrary(PrimitiveType.INT, "z");
    final Zen.Arbitrary w = zen.arbitrary(PrimitiveType.INT, "w");
    assertThat(
        InterleavingHeuristic.compute(zen.ifThenElse(zen.le(x, y), z, w)),
        hasToString("[[x, y], [z], [w]]"));
    assertThat(
        InterleavingHeuristic.compute(
            zen.eq(zen.ifThenElse(zen.le(x, y), z, w), x)),
        hasToString("[[x, y, z, w]]"));
  }

  @Test void testArguments() {
    final Zen.Argument a = zen.argument(PrimitiveType.INT);
    assertThat(
        InterleavingHeuristic.compute(ImmutableList.of(zen.add(a, y)),
            ImmutableMap.of(a.id, x)),
        hasToString("[[x, y]]"));
    assertThrows(ZenException.class,
        () -> InterleavingHeuristic.compute(zen.add(a, y)));
  }

  @Test void testListCaseIgnoresNonEmptyCase() {
    final ListType type = ListType.of(PrimitiveType.INT);
    final Zen.Exp list = zen.input(type, 1);
    final Zen.Exp e =
        zen.listCase(list, x, (head, tail) -> zen.add(head, y));
    assertThat(InterleavingHeuristic.compute(e).size(), is(3));
  }

  @Test void testUnsupported() {
    final Zen.Arbitrary m =
        zen.arbitrary(MapType.of(PrimitiveType.INT, PrimitiveType.INT));
    final UnsupportedConstructException e =
        assertThrows(UnsupportedConstructException.class,
            () -> InterleavingHeuristic.compute(
                zen.mapGet(m, zen.intLiteral(1))));
    assertThat(e.construct, is("maps"));
    assertThat(e.getMessage(),
        is("maps is not supported by the decision diagram backend"));

    final Zen.Arbitrary s = zen.arbitrary(PrimitiveType.STRING, "s");
    assertThrows(UnsupportedConstructException.class,
        () -> InterleavingHeuristic.compute(
            zen.eq(zen.length(s), zen.bigIntegerLiteral(3))));
    assertThrows(UnsupportedConstructException.class,
        () -> InterleavingHeuristic.compute(
            zen.eq(zen.realLiteral(BigDecimal.ONE),
                zen.realLiteral(BigDecimal.ONE))));
  }

  /** An arbitrary whose type has no diagram representation is rejected
   * where it occurs, even if no operation on it is unsupported. */
  @Test void testUnsupportedArbitraries() {
    checkUnsupportedArbitrary(PrimitiveType.STRING, "strings");
    checkUnsupportedArbitrary(
        MapType.of(PrimitiveType.INT, PrimitiveType.BOOL), "maps");
    checkUnsupportedArbitrary(PrimitiveType.BIG_INTEGER,
        "unbounded integers");
    checkUnsupportedArbitrary(PrimitiveType.CHAR, "characters");
  }

  private static void checkUnsupportedArbitrary(Type type,
      String construct) {
    final Zen.Arbitrary a = zen.arbitrary(type, "a");
    final UnsupportedConstructException e =
        assertThrows(UnsupportedConstructException.class,
            () -> InterleavingHeuristic.compute(zen.eq(a, a)));
    assertThat(e.construct, is(construct));
  }
}

// End InterleavingHeuristicTest.java
