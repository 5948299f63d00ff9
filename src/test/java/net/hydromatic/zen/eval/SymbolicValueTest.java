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
package net.hydromatic.zen.eval;

import static net.hydromatic.zen.ast.ZenBuilder.zen;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.BitSet;
import java.util.List;
import net.hydromatic.zen.ast.Zen;
import net.hydromatic.zen.solve.BitVector;
import net.hydromatic.zen.solve.DdSolver;
import net.hydromatic.zen.solve.DdVariable;
import net.hydromatic.zen.type.ConstMapType;
import net.hydromatic.zen.type.FSeqType;
import net.hydromatic.zen.type.ListType;
import net.hydromatic.zen.type.PrimitiveType;
import net.hydromatic.zen.type.RecordType;
import net.hydromatic.zen.type.Type;
import net.hydromatic.zen.util.ZenException;
import org.junit.jupiter.api.Test;

/** Tests for {@link SymbolicValue} and {@link SymbolicEvaluationVisitor},
 * using the decision diagram backend. */
public class SymbolicValueTest {
  private final DdSolver solver = new DdSolver();
  private final SymbolicEvaluationVisitor<BitSet, DdVariable, Integer,
      BitVector, Void, Void, Void, Void, Void> visitor =
      new SymbolicEvaluationVisitor<>(solver);
  private final Environment<Integer, BitVector, Void, Void, Void, Void, Void>
      env = Environment.empty();

  private SymbolicValue<Integer, BitVector, Void, Void, Void, Void, Void>
      eval(Zen.Exp exp) {
    return visitor.evaluate(exp, env);
  }

  /** Returns a model in which the given boolean arbitraries are true and
   * every other variable is false. */
  private BitSet model(Zen.Arbitrary... trueArbitraries) {
    final BitSet model = new BitSet();
    for (Zen.Arbitrary a : trueArbitraries) {
      model.set(visitor.arbitraryVariables().get(a).index(0));
    }
    return model;
  }

  @Test void testMergeWithConstantGuard() {
    final SymbolicValue<Integer, BitVector, Void, Void, Void, Void, Void> x =
        eval(zen.arbitrary(PrimitiveType.INT, "x"));
    final SymbolicValue<Integer, BitVector, Void, Void, Void, Void, Void> y =
        eval(zen.arbitrary(PrimitiveType.INT, "y"));
    assertThat(x.merge(solver.boolTrue(), y), sameInstance(x));
    assertThat(x.merge(solver.boolFalse(), y), sameInstance(y));
  }

  /** Merging under a constant guard selects one side, whatever the
   * kind of value. */
  @Test void testMergeWithConstantGuardForComposites() {
    final ConstMapType constMapType =
        ConstMapType.of(PrimitiveType.STRING, PrimitiveType.INT,
            ImmutableList.of("a", "b"));
    final List<Type> types =
        ImmutableList.of(PrimitiveType.BOOL,
            RecordType.of(
                ImmutableMap.of("a", PrimitiveType.SHORT,
                    "b", RecordType.option(PrimitiveType.BYTE))),
            ListType.of(PrimitiveType.INT),
            FSeqType.of(PrimitiveType.BYTE),
            constMapType);
    for (Type type : types) {
      final SymbolicValue<Integer, BitVector, Void, Void, Void, Void, Void>
          v = eval(zen.input(type, 2));
      final SymbolicValue<Integer, BitVector, Void, Void, Void, Void, Void>
          w = eval(zen.input(type, 2));
      assertThat(v.merge(solver.boolTrue(), w), sameInstance(v));
      assertThat(v.merge(solver.boolFalse(), w), sameInstance(w));
      // a symbolic guard over equal sides is equal to either side
      final Integer g = eval(zen.arbitrary(PrimitiveType.BOOL)).asBool().value;
      assertThat(solver.manager.isTrue(v.merge(g, v).eq(v).value), is(true));
    }
  }

  @Test void testEqualityIsReflexiveForComposites() {
    final List<Type> types =
        ImmutableList.of(ListType.of(PrimitiveType.SHORT),
            ListType.of(ListType.of(PrimitiveType.BOOL)),
            FSeqType.of(RecordType.option(PrimitiveType.INT)),
            ConstMapType.of(PrimitiveType.INT, PrimitiveType.BYTE,
                ImmutableList.of(1, 2, 3)));
    for (Type type : types) {
      final SymbolicValue<Integer, BitVector, Void, Void, Void, Void, Void>
          v = eval(zen.input(type, 3));
      assertThat(solver.manager.isTrue(v.eq(v).value), is(true));
    }
  }

  /** A list built from empty and three additions has a single length,
   * whose guard always holds, and a case split computes that length. */
  @Test void testListCaseSplitOfConcreteList() {
    final ListType type = ListType.of(PrimitiveType.BYTE);
    Zen.Exp list = zen.listEmpty(type);
    for (int i = 0; i < 3; i++) {
      list = zen.listAddFront(list, zen.arbitrary(PrimitiveType.BYTE));
    }
    final GuardedListGroup<Integer, BitVector, Void, Void, Void, Void, Void>
        group = eval(list).asList().group;
    assertThat(group.lists.keySet(), is(ImmutableSet.of(3)));
    assertThat(solver.manager.isTrue(group.lists.get(3).guard), is(true));
    final SymbolicValue<Integer, BitVector, Void, Void, Void, Void, Void>
        isThree = eval(zen.eq(length(list), zen.intLiteral(3)));
    assertThat(solver.manager.isTrue(isThree.asBool().value), is(true));

    // After merging with a list of length 1, the two lengths exclude each
    // other
    final Zen.Arbitrary g = zen.arbitrary(PrimitiveType.BOOL, "g");
    final Zen.Exp merged =
        zen.ifThenElse(g, list, zen.list(type, zen.byteLiteral(1)));
    final GuardedListGroup<Integer, BitVector, Void, Void, Void, Void, Void>
        group2 = eval(merged).asList().group;
    assertThat(group2.lists.keySet(), is(ImmutableSet.of(1, 3)));
    final Integer both =
        solver.manager.and(group2.lists.get(1).guard,
            group2.lists.get(3).guard);
    assertThat(solver.manager.isFalse(both), is(true));
    assertThat(eval(length(merged)).extract(solver, model(g)), is(3));
    assertThat(eval(length(merged)).extract(solver, model()), is(1));
  }

  @Test void testEqualityIsReflexive() {
    final RecordType type =
        RecordType.of(
            ImmutableMap.of("a", PrimitiveType.SHORT,
                "b", PrimitiveType.BOOL,
                "c", RecordType.option(PrimitiveType.BYTE)));
    final SymbolicValue<Integer, BitVector, Void, Void, Void, Void, Void> v =
        eval(zen.input(type, 0));
    assertThat(solver.manager.isTrue(v.eq(v).value), is(true));
  }

  @Test void testMergeConstMapsWithDisjointKeys() {
    final ConstMapType type =
        ConstMapType.of(PrimitiveType.STRING, PrimitiveType.INT,
            ImmutableList.of("a", "b"));
    final SymbolicConstMap<Integer, BitVector, Void, Void, Void, Void, Void>
        m1 = new SymbolicConstMap<>(visitor.context, type,
            ImmutableMap.of("a", visitor.constant(PrimitiveType.INT, 1)));
    final SymbolicConstMap<Integer, BitVector, Void, Void, Void, Void, Void>
        m2 = new SymbolicConstMap<>(visitor.context, type,
            ImmutableMap.of("b", visitor.constant(PrimitiveType.INT, 2)));
    final Zen.Arbitrary g = zen.arbitrary(PrimitiveType.BOOL, "g");
    final Integer guard = eval(g).asBool().value;
    final SymbolicConstMap<Integer, BitVector, Void, Void, Void, Void, Void>
        merged = m1.merge(guard, m2).asConstMap();

    final BitSet whenTrue = model(g);
    assertThat(merged.get("a").extract(solver, whenTrue), is(1));
    assertThat(merged.get("b").extract(solver, whenTrue), is(0));
    final BitSet whenFalse = model();
    assertThat(merged.get("a").extract(solver, whenFalse), is(0));
    assertThat(merged.get("b").extract(solver, whenFalse), is(2));
  }

  @Test void testMergeRecords() {
    final Zen.Arbitrary g = zen.arbitrary(PrimitiveType.BOOL, "g");
    final Zen.Exp e =
        zen.ifThenElse(g, zen.some(zen.byteLiteral(7)),
            zen.none(PrimitiveType.BYTE));
    final SymbolicValue<Integer, BitVector, Void, Void, Void, Void, Void> v =
        eval(e);
    assertThat(v.extract(solver, model(g)),
        is(ImmutableMap.of("hasValue", true, "value", (byte) 7)));
    assertThat(v.extract(solver, model()),
        is(ImmutableMap.of("hasValue", false, "value", (byte) 0)));
  }

  @Test void testListLength() {
    final Zen.Arbitrary g = zen.arbitrary(PrimitiveType.BOOL, "g");
    final ListType type = ListType.of(PrimitiveType.INT);
    final Zen.Exp list =
        zen.ifThenElse(g, zen.list(type, zen.intLiteral(4)),
            zen.list(type, zen.intLiteral(5), zen.intLiteral(6)));
    final SymbolicValue<Integer, BitVector, Void, Void, Void, Void, Void> v =
        eval(list);
    assertThat(v.extract(solver, model(g)), is(ImmutableList.of(4)));
    assertThat(v.extract(solver, model()), is(ImmutableList.of(5, 6)));
    assertThat(eval(length(list)).extract(solver, model()), is(2));
  }

  /** Builds an expression for the length of a list, recursing through the
   * non-empty case. */
  private static Zen.Exp length(Zen.Exp list) {
    return zen.listCase(list, zen.intLiteral(0),
        (head, tail) -> zen.add(zen.intLiteral(1), length(tail)));
  }

  @Test void testEvaluationIsMemoized() {
    final Zen.Arbitrary x = zen.arbitrary(PrimitiveType.INT, "x");
    final Zen.Exp e = zen.add(x, zen.intLiteral(1));
    final SymbolicValue<Integer, BitVector, Void, Void, Void, Void, Void> v =
        eval(e);
    assertThat(eval(e), sameInstance(v));
    assertThat(eval(x), sameInstance(eval(x)));
    assertThat(visitor.arbitraryVariables().size(), is(1));
  }

  @Test void testUnboundArgument() {
    final Zen.Argument a = zen.argument(PrimitiveType.INT);
    assertThrows(ZenException.class, () -> eval(a));

    final Environment<Integer, BitVector, Void, Void, Void, Void, Void> env2 =
        Environment.of(ImmutableMap.of(a, zen.intLiteral(3)));
    assertThat(visitor.evaluate(a, env2).extract(solver, new BitSet()),
        is(3));
  }
}

// End SymbolicValueTest.java
