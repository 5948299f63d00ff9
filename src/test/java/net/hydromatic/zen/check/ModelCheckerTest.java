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
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.zen.ast.Regex;
import net.hydromatic.zen.ast.Zen;
import net.hydromatic.zen.type.ConstMapType;
import net.hydromatic.zen.type.FSeqType;
import net.hydromatic.zen.type.ListType;
import net.hydromatic.zen.type.MapType;
import net.hydromatic.zen.type.PrimitiveType;
import net.hydromatic.zen.type.RecordType;
import net.hydromatic.zen.type.SeqType;
import net.hydromatic.zen.util.UnsupportedConstructException;
import net.hydromatic.zen.util.ZenException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

/** Tests for {@link ModelChecker}. */
public class ModelCheckerTest {
  private static Map<Prop, Object> properties(Prop.Backend backend) {
    final Map<Prop, Object> properties = new HashMap<>();
    Prop.BACKEND.set(properties, backend);
    return properties;
  }

  private static ModelChecker checker(Prop.Backend backend) {
    return ModelCheckers.create(properties(backend));
  }

  private static ModelChecker smt() {
    return checker(Prop.Backend.SMT);
  }

  /** Builds an expression for the length of a list. */
  private static Zen.Exp length(Zen.Exp list) {
    return zen.listCase(list, zen.intLiteral(0),
        (head, tail) -> zen.add(zen.intLiteral(1), length(tail)));
  }

  @ParameterizedTest
  @EnumSource(Prop.Backend.class)
  void testEquality(Prop.Backend backend) {
    final Zen.Arbitrary x = zen.arbitrary(PrimitiveType.INT, "x");
    final Map<Zen.Arbitrary, Object> assignment =
        checker(backend).modelCheck(zen.eq(x, zen.intLiteral(5)),
            ImmutableMap.of());
    assertThat(assignment, notNullValue());
    assertThat(assignment.get(x), is(5));
  }

  @ParameterizedTest
  @EnumSource(Prop.Backend.class)
  void testByteArithmetic(Prop.Backend backend) {
    final Zen.Arbitrary x = zen.arbitrary(PrimitiveType.BYTE, "x");
    final Zen.Arbitrary y = zen.arbitrary(PrimitiveType.BYTE, "y");
    final Zen.Exp constraint =
        zen.and(zen.eq(zen.add(x, y), zen.byteLiteral(10)),
            zen.gt(x, zen.byteLiteral(0)),
            zen.gt(y, zen.byteLiteral(0)));
    final Map<Zen.Arbitrary, Object> assignment =
        checker(backend).modelCheck(constraint, ImmutableMap.of());
    assertThat(assignment, notNullValue());
    final byte xValue = (Byte) assignment.get(x);
    final byte yValue = (Byte) assignment.get(y);
    assertThat(xValue + yValue, is(10));
    assertThat(xValue > 0, is(true));
    assertThat(yValue > 0, is(true));

    // Both above 20 means the sum is between 42 and 254, so it cannot wrap
    // around to 10
    final Zen.Exp unsat =
        zen.and(constraint, zen.gt(x, zen.byteLiteral(20)),
            zen.gt(y, zen.byteLiteral(20)));
    assertThat(checker(backend).modelCheck(unsat, ImmutableMap.of()),
        nullValue());
  }

  @Test void testWithoutInterleaving() {
    final Map<Prop, Object> properties =
        properties(Prop.Backend.DECISION_DIAGRAMS);
    Prop.INTERLEAVE.set(properties, false);
    final Zen.Arbitrary x = zen.arbitrary(PrimitiveType.SHORT, "x");
    final Zen.Arbitrary y = zen.arbitrary(PrimitiveType.SHORT, "y");
    final Map<Zen.Arbitrary, Object> assignment =
        ModelCheckers.create(properties)
            .modelCheck(
                zen.and(zen.eq(zen.subtract(x, y), zen.shortLiteral(10)),
                    zen.lt(x, zen.shortLiteral(0))),
                ImmutableMap.of());
    assertThat(assignment, notNullValue());
    final short xValue = (Short) assignment.get(x);
    final short yValue = (Short) assignment.get(y);
    assertThat((short) (xValue - yValue), is((short) 10));
    assertThat(xValue < 0, is(true));
  }

  @ParameterizedTest
  @EnumSource(Prop.Backend.class)
  void testRecord(Prop.Backend backend) {
    final Map<Prop, Object> properties = properties(backend);
    final RecordType type =
        RecordType.of(
            ImmutableMap.of("a", PrimitiveType.INT, "b", PrimitiveType.INT));
    final Zen.Exp r = ModelCheckers.input(type, properties);
    final Zen.Exp a = zen.getField(r, "a");
    final Zen.Exp b = zen.getField(r, "b");
    final Zen.Exp constraint =
        zen.and(zen.eq(zen.add(a, b), zen.intLiteral(0)),
            zen.ne(a, zen.intLiteral(0)));
    final Object value =
        ModelCheckers.create(properties)
            .evaluate(constraint, r, ImmutableMap.of());
    assertThat(value, instanceOf(Map.class));
    final Map<?, ?> map = (Map<?, ?>) value;
    final int aValue = (Integer) map.get("a");
    final int bValue = (Integer) map.get("b");
    assertThat(aValue + bValue, is(0));
    assertThat(aValue != 0, is(true));
  }

  @ParameterizedTest
  @EnumSource(Prop.Backend.class)
  void testListLength(Prop.Backend backend) {
    final Map<Prop, Object> properties = properties(backend);
    Prop.LIST_SIZE.set(properties, 4);
    final Zen.Exp list =
        ModelCheckers.input(ListType.of(PrimitiveType.INT), properties);
    final Zen.Exp constraint = zen.eq(length(list), zen.intLiteral(3));
    final Object value =
        ModelCheckers.create(properties)
            .evaluate(constraint, list, ImmutableMap.of());
    assertThat(value, instanceOf(List.class));
    assertThat((List<?>) value, hasSize(3));

    // Lists are at most 4 long
    assertThat(
        ModelCheckers.create(properties)
            .modelCheck(zen.eq(length(list), zen.intLiteral(5)),
                ImmutableMap.of()),
        nullValue());
  }

  /** A list built from empty and three additions has length 3 in every
   * model, and no other length in any model. */
  @ParameterizedTest
  @EnumSource(Prop.Backend.class)
  void testListCaseSplit(Prop.Backend backend) {
    final ListType type = ListType.of(PrimitiveType.BYTE);
    Zen.Exp list = zen.listEmpty(type);
    for (int i = 0; i < 3; i++) {
      list = zen.listAddFront(list, zen.arbitrary(PrimitiveType.BYTE));
    }
    final Zen.Exp length = length(list);
    assertThat(
        checker(backend).modelCheck(zen.ne(length, zen.intLiteral(3)),
            ImmutableMap.of()),
        nullValue());
    for (int n = 0; n <= 5; n++) {
      final Map<Zen.Arbitrary, Object> assignment =
          checker(backend).modelCheck(zen.eq(length, zen.intLiteral(n)),
              ImmutableMap.of());
      assertThat(assignment == null, is(n != 3));
    }
  }

  /** Returns inputs of each composite type that a backend supports, and
   * that the decision diagram backend can order. */
  private static List<Zen.Exp> composites(Prop.Backend backend) {
    final List<Zen.Exp> list = new ArrayList<>();
    list.add(
        zen.input(
            RecordType.of(
                ImmutableMap.of("a", PrimitiveType.SHORT,
                    "b", RecordType.option(PrimitiveType.BYTE))), 2));
    list.add(zen.input(ListType.of(PrimitiveType.INT), 2));
    list.add(zen.input(ListType.of(ListType.of(PrimitiveType.BOOL)), 2));
    list.add(zen.input(FSeqType.of(PrimitiveType.BYTE), 2));
    if (backend == Prop.Backend.SMT) {
      list.add(
          zen.arbitrary(MapType.of(PrimitiveType.INT, PrimitiveType.INT)));
      list.add(
          zen.input(
              ConstMapType.of(PrimitiveType.STRING, PrimitiveType.INT,
                  ImmutableList.of("a", "b")), 2));
    }
    return list;
  }

  @ParameterizedTest
  @EnumSource(Prop.Backend.class)
  void testEqualityIsReflexive(Prop.Backend backend) {
    for (Zen.Exp e : composites(backend)) {
      assertThat(
          checker(backend).modelCheck(zen.ne(e, e), ImmutableMap.of()),
          nullValue());
    }
  }

  /** Merging a value with itself gives the same value; merging under a
   * constant condition gives one side. */
  @ParameterizedTest
  @EnumSource(Prop.Backend.class)
  void testMergeIsIdempotent(Prop.Backend backend) {
    final Zen.Arbitrary g = zen.arbitrary(PrimitiveType.BOOL, "g");
    for (Zen.Exp v : composites(backend)) {
      assertThat(
          checker(backend).modelCheck(zen.ne(zen.ifThenElse(g, v, v), v),
              ImmutableMap.of()),
          nullValue());
    }
    final List<Zen.Exp> vs = composites(backend);
    final List<Zen.Exp> ws = composites(backend);
    for (int i = 0; i < vs.size(); i++) {
      final Zen.Exp v = vs.get(i);
      final Zen.Exp w = ws.get(i);
      assertThat(
          checker(backend).modelCheck(
              zen.ne(zen.ifThenElse(zen.boolLiteral(true), v, w), v),
              ImmutableMap.of()),
          nullValue());
      assertThat(
          checker(backend).modelCheck(
              zen.ne(zen.ifThenElse(zen.boolLiteral(false), v, w), w),
              ImmutableMap.of()),
          nullValue());
    }
  }

  @Test void testSequenceValues() {
    final Zen.Arbitrary c = zen.arbitrary(PrimitiveType.CHAR, "c");
    final Map<Zen.Arbitrary, Object> assignment =
        smt().modelCheck(zen.eq(c, zen.charLiteral('z')), ImmutableMap.of());
    assertThat(assignment, notNullValue());
    assertThat(assignment.get(c), is('z'));

    final SeqType chars = SeqType.of(PrimitiveType.CHAR);
    final Zen.Arbitrary t = zen.arbitrary(chars, "t");
    final Map<Zen.Arbitrary, Object> assignment2 =
        smt().modelCheck(
            zen.eq(t, zen.cast(zen.stringLiteral("ok"), chars)),
            ImmutableMap.of());
    assertThat(assignment2, notNullValue());
    assertThat(assignment2.get(t), is(ImmutableList.of('o', 'k')));

    final SeqType ints = SeqType.of(PrimitiveType.INT);
    final Zen.Arbitrary q = zen.arbitrary(ints, "q");
    final Zen.Exp oneTwo =
        zen.concat(zen.seqUnit(zen.intLiteral(1)),
            zen.seqUnit(zen.intLiteral(2)));
    final Map<Zen.Arbitrary, Object> assignment3 =
        smt().modelCheck(zen.eq(q, oneTwo), ImmutableMap.of());
    assertThat(assignment3, notNullValue());
    assertThat(assignment3.get(q), is(ImmutableList.of(1, 2)));
    assertThat(
        smt().evaluate(zen.boolLiteral(true), zen.seqEmpty(ints),
            ImmutableMap.of()),
        is(ImmutableList.of()));
  }

  @ParameterizedTest
  @EnumSource(Prop.Backend.class)
  void testOption(Prop.Backend backend) {
    final Zen.Arbitrary x = zen.arbitrary(PrimitiveType.USHORT, "x");
    final Zen.Arbitrary b = zen.arbitrary(PrimitiveType.BOOL, "b");
    final Zen.Exp o =
        zen.ifThenElse(b, zen.some(x), zen.none(PrimitiveType.USHORT));
    final Zen.Exp constraint =
        zen.and(zen.getField(o, RecordType.HAS_VALUE),
            zen.eq(zen.getField(o, RecordType.VALUE),
                zen.constant(PrimitiveType.USHORT, 65535)));
    final Object value =
        checker(backend).evaluate(constraint, o, ImmutableMap.of());
    assertThat(value,
        is(ImmutableMap.of("hasValue", true, "value", 65535)));
  }

  @ParameterizedTest
  @EnumSource(Prop.Backend.class)
  void testArguments(Prop.Backend backend) {
    final Zen.Arbitrary x = zen.arbitrary(PrimitiveType.INT, "x");
    final Zen.Argument a = zen.argument(PrimitiveType.INT);
    final Map<Zen.Arbitrary, Object> assignment =
        checker(backend).modelCheck(zen.eq(a, zen.intLiteral(3)),
            ImmutableMap.of(a, x));
    assertThat(assignment, notNullValue());
    assertThat(assignment.get(x), is(3));
    assertThrows(ZenException.class,
        () -> checker(backend).modelCheck(zen.eq(a, zen.intLiteral(3)),
            ImmutableMap.of()));
  }

  @Test void testMaximizeMinimize() {
    final Zen.Arbitrary x = zen.arbitrary(PrimitiveType.BYTE, "x");
    final Map<Zen.Arbitrary, Object> max =
        smt().maximize(x, zen.le(x, zen.byteLiteral(100)), ImmutableMap.of());
    assertThat(max, notNullValue());
    assertThat(max.get(x), is((byte) 100));
    final Map<Zen.Arbitrary, Object> min =
        smt().minimize(x, zen.ge(x, zen.byteLiteral(-5)), ImmutableMap.of());
    assertThat(min, notNullValue());
    assertThat(min.get(x), is((byte) -5));

    final Zen.Arbitrary u = zen.arbitrary(PrimitiveType.UINT, "u");
    final Map<Zen.Arbitrary, Object> umax =
        smt().maximize(u, zen.boolLiteral(true), ImmutableMap.of());
    assertThat(umax, notNullValue());
    assertThat(umax.get(u).toString(), is("4294967295"));
  }

  @Test void testUnboundedNumbers() {
    final Zen.Arbitrary i = zen.arbitrary(PrimitiveType.BIG_INTEGER, "i");
    final Map<Zen.Arbitrary, Object> assignment =
        smt().modelCheck(
            zen.eq(zen.multiply(i, zen.bigIntegerLiteral(3)),
                zen.bigIntegerLiteral(-21)),
            ImmutableMap.of());
    assertThat(assignment, notNullValue());
    assertThat(assignment.get(i), is(BigInteger.valueOf(-7)));

    final Zen.Arbitrary r = zen.arbitrary(PrimitiveType.REAL, "r");
    final Map<Zen.Arbitrary, Object> assignment2 =
        smt().modelCheck(
            zen.eq(zen.add(r, r), zen.realLiteral(new BigDecimal("3"))),
            ImmutableMap.of());
    assertThat(assignment2, notNullValue());
    assertThat(
        ((BigDecimal) assignment2.get(r)).compareTo(new BigDecimal("1.5")),
        is(0));
  }

  @Test void testStrings() {
    final Zen.Arbitrary s = zen.arbitrary(PrimitiveType.STRING, "s");
    final Zen.Exp constraint =
        zen.and(zen.startsWith(s, zen.stringLiteral("ab")),
            zen.eq(zen.length(s), zen.bigIntegerLiteral(4)));
    final Map<Zen.Arbitrary, Object> assignment =
        smt().modelCheck(constraint, ImmutableMap.of());
    assertThat(assignment, notNullValue());
    final String value = (String) assignment.get(s);
    assertThat(value.length(), is(4));
    assertThat(value.startsWith("ab"), is(true));

    final Zen.Exp concat = zen.concat(s, zen.stringLiteral("!"));
    assertThat(
        smt().evaluate(zen.eq(s, zen.stringLiteral("hi")), concat,
            ImmutableMap.of()),
        is("hi!"));
  }

  @Test void testRegex() {
    final Zen.Arbitrary s = zen.arbitrary(PrimitiveType.STRING, "s");
    final Regex regex =
        Regex.concat(Regex.literal("a"), Regex.plus(Regex.range('0', '9')));
    final Zen.Exp constraint =
        zen.and(zen.matches(s, regex),
            zen.eq(zen.length(s), zen.bigIntegerLiteral(3)));
    final Map<Zen.Arbitrary, Object> assignment =
        smt().modelCheck(constraint, ImmutableMap.of());
    assertThat(assignment, notNullValue());
    assertThat(((String) assignment.get(s)).matches("a[0-9][0-9]"),
        is(true));

    final Zen.Exp never =
        zen.and(zen.matches(s, regex),
            zen.startsWith(s, zen.stringLiteral("b")));
    assertThat(smt().modelCheck(never, ImmutableMap.of()), nullValue());
  }

  @Test void testCast() {
    final Zen.Arbitrary s = zen.arbitrary(PrimitiveType.STRING, "s");
    final SeqType chars = SeqType.of(PrimitiveType.CHAR);
    final Zen.Exp constraint =
        zen.eq(zen.cast(s, chars), zen.cast(zen.stringLiteral("hi"), chars));
    final Map<Zen.Arbitrary, Object> assignment =
        smt().modelCheck(constraint, ImmutableMap.of());
    assertThat(assignment, notNullValue());
    assertThat(assignment.get(s), is("hi"));
  }

  @Test void testMaps() {
    final MapType type = MapType.of(PrimitiveType.INT, PrimitiveType.INT);
    final Zen.Arbitrary m = zen.arbitrary(type, "m");
    final Zen.Exp get = zen.mapGet(m, zen.intLiteral(1));
    final Object value =
        smt().evaluate(zen.eq(get, zen.some(zen.intLiteral(5))), get,
            ImmutableMap.of());
    assertThat(value, is(ImmutableMap.of("hasValue", true, "value", 5)));

    // Deleting a key makes it absent, whatever the map held
    final Zen.Exp deleted =
        zen.mapGet(zen.mapDelete(m, zen.intLiteral(1)), zen.intLiteral(1));
    assertThat(
        smt().modelCheck(zen.getField(deleted, RecordType.HAS_VALUE),
            ImmutableMap.of()),
        nullValue());

    final Zen.Exp set =
        zen.mapSet(zen.mapEmpty(type), zen.intLiteral(2), zen.intLiteral(3));
    assertThat(
        smt().evaluate(zen.boolLiteral(true),
            zen.mapGet(set, zen.intLiteral(2)), ImmutableMap.of()),
        is(ImmutableMap.of("hasValue", true, "value", 3)));
  }

  @Test void testDecisionDiagramsRejectUnsupported() {
    final ModelChecker checker = checker(Prop.Backend.DECISION_DIAGRAMS);
    final Zen.Arbitrary x = zen.arbitrary(PrimitiveType.INT, "x");
    final UnsupportedConstructException e =
        assertThrows(UnsupportedConstructException.class,
            () -> checker.modelCheck(
                zen.eq(zen.multiply(x, x), zen.intLiteral(4)),
                ImmutableMap.of()));
    assertThat(e.construct, is("multiplication"));

    final Zen.Arbitrary s = zen.arbitrary(PrimitiveType.STRING, "s");
    assertThrows(UnsupportedConstructException.class,
        () -> checker.modelCheck(zen.eq(s, zen.stringLiteral("a")),
            ImmutableMap.of()));
    final UnsupportedConstructException e2 =
        assertThrows(UnsupportedConstructException.class,
            () -> checker.maximize(x, zen.boolLiteral(true),
                ImmutableMap.of()));
    assertThat(e2.construct, is("optimization"));
  }

  @Test void testProperties() {
    assertThat(Prop.lookup("listSize"), is(Prop.LIST_SIZE));
    assertThat(Prop.lookup("LIST_SIZE"), is(Prop.LIST_SIZE));
    assertThrows(ZenException.class, () -> Prop.lookup("depth"));

    final Map<Prop, Object> properties = new HashMap<>();
    assertThat(Prop.BACKEND.enumValue(properties, Prop.Backend.class),
        is(Prop.Backend.SMT));
    assertThat(Prop.LIST_SIZE.intValue(properties), is(5));
    assertThat(Prop.SMT_TIMEOUT.get(properties), nullValue());

    Prop.BACKEND.setLenient(properties, "decision_diagrams");
    assertThat(Prop.BACKEND.enumValue(properties, Prop.Backend.class),
        is(Prop.Backend.DECISION_DIAGRAMS));
    final ZenException e =
        assertThrows(ZenException.class,
            () -> Prop.BACKEND.setLenient(properties, "bdd"));
    assertThat(e.getMessage(),
        is("value must be one of: 'SMT', 'DECISION_DIAGRAMS'"));
    assertThrows(ZenException.class,
        () -> Prop.BACKEND.set(properties, null));
    assertThrows(ZenException.class,
        () -> Prop.LIST_SIZE.set(properties, "3"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.LIST_SIZE.booleanValue(properties));

    Prop.SMT_TIMEOUT.set(properties, 60_000);
    Prop.BACKEND.set(properties, Prop.Backend.SMT);
    final Zen.Arbitrary x = zen.arbitrary(PrimitiveType.INT, "x");
    assertThat(
        ModelCheckers.create(properties)
            .modelCheck(zen.eq(x, zen.intLiteral(1)), ImmutableMap.of()),
        notNullValue());
  }

  @Test void testInputs() {
    final Map<Prop, Object> properties = properties(Prop.Backend.SMT);
    Prop.LIST_SIZE.set(properties, 2);
    final Zen.Exp list =
        ModelCheckers.input(ListType.of(PrimitiveType.BYTE), properties);
    final Zen.Exp constraint =
        zen.listCase(list, zen.boolLiteral(false),
            (head, tail) -> zen.eq(head, zen.byteLiteral(9)));
    final Object value =
        ModelCheckers.create(properties)
            .evaluate(constraint, list, ImmutableMap.of());
    assertThat(value, instanceOf(ImmutableList.class));
    assertThat(((List<?>) value).get(0), is((byte) 9));
  }
}

// End ModelCheckerTest.java
