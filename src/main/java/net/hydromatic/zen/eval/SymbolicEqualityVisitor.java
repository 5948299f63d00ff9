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

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import net.hydromatic.zen.solve.Solver;
import net.hydromatic.zen.type.ConstMapType;
import net.hydromatic.zen.type.FSeqType;
import net.hydromatic.zen.type.FixedIntegerType;
import net.hydromatic.zen.type.ListType;
import net.hydromatic.zen.type.MapType;
import net.hydromatic.zen.type.PrimitiveType;
import net.hydromatic.zen.type.RecordType;
import net.hydromatic.zen.type.SeqType;
import net.hydromatic.zen.type.TypeVisitor;
import net.hydromatic.zen.util.Pair;

/** Builds a formula that is true if two symbolic values of the same type
 * are equal. */
class SymbolicEqualityVisitor<B, X, I, S, A, C, R>
    extends TypeVisitor<B, Pair<SymbolicValue<B, X, I, S, A, C, R>,
        SymbolicValue<B, X, I, S, A, C, R>>> {
  private final Solver<?, ?, B, X, I, S, A, C, R> solver;

  SymbolicEqualityVisitor(SymbolicContext<B, X, I, S, A, C, R> context) {
    this.solver = context.solver;
  }

  @Override
  public B visit(PrimitiveType primitiveType,
      Pair<SymbolicValue<B, X, I, S, A, C, R>,
          SymbolicValue<B, X, I, S, A, C, R>> p) {
    switch (primitiveType) {
    case BOOL:
      return solver.iff(p.left.asBool().value, p.right.asBool().value);
    case BIG_INTEGER:
      return solver.intEq(p.left.asInteger().value,
          p.right.asInteger().value);
    case REAL:
      return solver.realEq(p.left.asReal().value, p.right.asReal().value);
    case CHAR:
      return solver.charEq(p.left.asChar().value, p.right.asChar().value);
    case STRING:
      return solver.seqEq(p.left.asSeq().value, p.right.asSeq().value);
    default:
      return solver.bvEq(p.left.asBitvec().value, p.right.asBitvec().value);
    }
  }

  @Override
  public B visit(FixedIntegerType fixedIntegerType,
      Pair<SymbolicValue<B, X, I, S, A, C, R>,
          SymbolicValue<B, X, I, S, A, C, R>> p) {
    return solver.bvEq(p.left.asBitvec().value, p.right.asBitvec().value);
  }

  @Override
  public B visit(SeqType seqType,
      Pair<SymbolicValue<B, X, I, S, A, C, R>,
          SymbolicValue<B, X, I, S, A, C, R>> p) {
    return solver.seqEq(p.left.asSeq().value, p.right.asSeq().value);
  }

  @Override
  public B visit(MapType mapType,
      Pair<SymbolicValue<B, X, I, S, A, C, R>,
          SymbolicValue<B, X, I, S, A, C, R>> p) {
    return solver.mapEq(p.left.asMap().value, p.right.asMap().value);
  }

  @Override
  public B visit(RecordType recordType,
      Pair<SymbolicValue<B, X, I, S, A, C, R>,
          SymbolicValue<B, X, I, S, A, C, R>> p) {
    final SymbolicObject<B, X, I, S, A, C, R> left = p.left.asObject();
    final SymbolicObject<B, X, I, S, A, C, R> right = p.right.asObject();
    B b = solver.boolTrue();
    for (String name : recordType.fieldTypes.keySet()) {
      b = solver.and(b, left.get(name).eq(right.get(name)).value);
    }
    return b;
  }

  /** {@inheritDoc}
   *
   * <p>Two lists are equal if, for some length that both may have, both
   * guards hold and the values are pairwise equal. */
  @Override
  public B visit(ListType listType,
      Pair<SymbolicValue<B, X, I, S, A, C, R>,
          SymbolicValue<B, X, I, S, A, C, R>> p) {
    final Map<Integer, GuardedList<B, X, I, S, A, C, R>> right =
        p.right.asList().group.lists;
    B b = solver.boolFalse();
    for (Map.Entry<Integer, GuardedList<B, X, I, S, A, C, R>> e
        : p.left.asList().group.lists.entrySet()) {
      final GuardedList<B, X, I, S, A, C, R> l = e.getValue();
      final GuardedList<B, X, I, S, A, C, R> r = right.get(e.getKey());
      if (r == null) {
        continue;
      }
      B same = solver.and(l.guard, r.guard);
      for (int i = 0; i < l.values.size(); i++) {
        same = solver.and(same, l.values.get(i).eq(r.values.get(i)).value);
      }
      b = solver.or(b, same);
    }
    return b;
  }

  /** {@inheritDoc}
   *
   * <p>Compares slot by slot: slots are equal if both are unused, or both
   * are used and hold equal values. */
  @Override
  public B visit(FSeqType fseqType,
      Pair<SymbolicValue<B, X, I, S, A, C, R>,
          SymbolicValue<B, X, I, S, A, C, R>> p) {
    final SymbolicFSeq<B, X, I, S, A, C, R> left = p.left.asFSeq();
    final SymbolicFSeq<B, X, I, S, A, C, R> right = p.right.asFSeq();
    final int size = Math.max(left.elements.size(), right.elements.size());
    B b = solver.boolTrue();
    for (int i = 0; i < size; i++) {
      final Pair<B, SymbolicValue<B, X, I, S, A, C, R>> l = left.slot(i);
      final Pair<B, SymbolicValue<B, X, I, S, A, C, R>> r = right.slot(i);
      final B valuesEqual =
          solver.or(solver.not(l.left), l.right.eq(r.right).value);
      b = solver.and(b, solver.and(solver.iff(l.left, r.left), valuesEqual));
    }
    return b;
  }

  @Override
  public B visit(ConstMapType constMapType,
      Pair<SymbolicValue<B, X, I, S, A, C, R>,
          SymbolicValue<B, X, I, S, A, C, R>> p) {
    final SymbolicConstMap<B, X, I, S, A, C, R> left = p.left.asConstMap();
    final SymbolicConstMap<B, X, I, S, A, C, R> right = p.right.asConstMap();
    final Set<Object> keys = new LinkedHashSet<>(left.values.keySet());
    keys.addAll(right.values.keySet());
    B b = solver.boolTrue();
    for (Object key : keys) {
      b = solver.and(b, left.get(key).eq(right.get(key)).value);
    }
    return b;
  }
}

// End SymbolicEqualityVisitor.java
