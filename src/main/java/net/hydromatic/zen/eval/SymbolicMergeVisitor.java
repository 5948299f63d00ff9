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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import net.hydromatic.zen.solve.Solver;
import net.hydromatic.zen.type.BitvectorType;
import net.hydromatic.zen.type.ConstMapType;
import net.hydromatic.zen.type.FSeqType;
import net.hydromatic.zen.type.FixedIntegerType;
import net.hydromatic.zen.type.ListType;
import net.hydromatic.zen.type.MapType;
import net.hydromatic.zen.type.PrimitiveType;
import net.hydromatic.zen.type.RecordType;
import net.hydromatic.zen.type.SeqType;
import net.hydromatic.zen.type.Type;
import net.hydromatic.zen.type.TypeVisitor;
import net.hydromatic.zen.util.Pair;

/** Merges two symbolic values of the same type: computes
 * "if guard then left else right", structurally.
 *
 * <p>A sequence slot or const map key that only one side has is
 * padded with default values on the other side. */
class SymbolicMergeVisitor<B, X, I, S, A, C, R>
    extends TypeVisitor<SymbolicValue<B, X, I, S, A, C, R>,
        Pair<SymbolicValue<B, X, I, S, A, C, R>,
            SymbolicValue<B, X, I, S, A, C, R>>> {
  private final SymbolicContext<B, X, I, S, A, C, R> context;
  private final Solver<?, ?, B, X, I, S, A, C, R> solver;
  private final B guard;

  SymbolicMergeVisitor(SymbolicContext<B, X, I, S, A, C, R> context,
      B guard) {
    this.context = context;
    this.solver = context.solver;
    this.guard = guard;
  }

  @Override
  public SymbolicValue<B, X, I, S, A, C, R> visit(PrimitiveType primitiveType,
      Pair<SymbolicValue<B, X, I, S, A, C, R>,
          SymbolicValue<B, X, I, S, A, C, R>> p) {
    switch (primitiveType) {
    case BOOL:
      return new SymbolicBool<>(context,
          solver.ite(guard, p.left.asBool().value, p.right.asBool().value));
    case BIG_INTEGER:
      return new SymbolicInteger<>(context,
          solver.intIte(guard, p.left.asInteger().value,
              p.right.asInteger().value));
    case REAL:
      return new SymbolicReal<>(context,
          solver.realIte(guard, p.left.asReal().value,
              p.right.asReal().value));
    case CHAR:
      return new SymbolicChar<>(context,
          solver.charIte(guard, p.left.asChar().value,
              p.right.asChar().value));
    case STRING:
      return seq(primitiveType, p);
    default:
      return bitvec(primitiveType, p);
    }
  }

  @Override
  public SymbolicValue<B, X, I, S, A, C, R> visit(
      FixedIntegerType fixedIntegerType,
      Pair<SymbolicValue<B, X, I, S, A, C, R>,
          SymbolicValue<B, X, I, S, A, C, R>> p) {
    return bitvec(fixedIntegerType, p);
  }

  private SymbolicValue<B, X, I, S, A, C, R> bitvec(BitvectorType type,
      Pair<SymbolicValue<B, X, I, S, A, C, R>,
          SymbolicValue<B, X, I, S, A, C, R>> p) {
    return new SymbolicBitvec<>(context, type,
        solver.bvIte(guard, p.left.asBitvec().value,
            p.right.asBitvec().value));
  }

  private SymbolicValue<B, X, I, S, A, C, R> seq(Type type,
      Pair<SymbolicValue<B, X, I, S, A, C, R>,
          SymbolicValue<B, X, I, S, A, C, R>> p) {
    return new SymbolicSeq<>(context, type,
        solver.seqIte(guard, p.left.asSeq().value, p.right.asSeq().value));
  }

  @Override
  public SymbolicValue<B, X, I, S, A, C, R> visit(SeqType seqType,
      Pair<SymbolicValue<B, X, I, S, A, C, R>,
          SymbolicValue<B, X, I, S, A, C, R>> p) {
    return seq(seqType, p);
  }

  @Override
  public SymbolicValue<B, X, I, S, A, C, R> visit(MapType mapType,
      Pair<SymbolicValue<B, X, I, S, A, C, R>,
          SymbolicValue<B, X, I, S, A, C, R>> p) {
    return new SymbolicMap<>(context, mapType,
        solver.mapIte(guard, p.left.asMap().value, p.right.asMap().value));
  }

  @Override
  public SymbolicValue<B, X, I, S, A, C, R> visit(RecordType recordType,
      Pair<SymbolicValue<B, X, I, S, A, C, R>,
          SymbolicValue<B, X, I, S, A, C, R>> p) {
    final SymbolicObject<B, X, I, S, A, C, R> left = p.left.asObject();
    final SymbolicObject<B, X, I, S, A, C, R> right = p.right.asObject();
    final ImmutableSortedMap.Builder<String,
        SymbolicValue<B, X, I, S, A, C, R>> b =
        ImmutableSortedMap.orderedBy(RecordType.ORDERING);
    for (String name : recordType.fieldTypes.keySet()) {
      b.put(name, left.get(name).merge(guard, right.get(name)));
    }
    return new SymbolicObject<>(context, recordType, b.build());
  }

  /** {@inheritDoc}
   *
   * <p>A length that both lists have gets guard
   * {@code ite(guard, g1, g2)} and merged values; a length that only the
   * left list has gets guard {@code guard ∧ g1}, and a length that only the
   * right list has gets guard {@code ¬guard ∧ g2}. */
  @Override
  public SymbolicValue<B, X, I, S, A, C, R> visit(ListType listType,
      Pair<SymbolicValue<B, X, I, S, A, C, R>,
          SymbolicValue<B, X, I, S, A, C, R>> p) {
    final Map<Integer, GuardedList<B, X, I, S, A, C, R>> left =
        p.left.asList().group.lists;
    final Map<Integer, GuardedList<B, X, I, S, A, C, R>> right =
        p.right.asList().group.lists;
    final Set<Integer> lengths = new TreeSet<>(left.keySet());
    lengths.addAll(right.keySet());
    final ImmutableSortedMap.Builder<Integer,
        GuardedList<B, X, I, S, A, C, R>> b =
        ImmutableSortedMap.naturalOrder();
    for (Integer length : lengths) {
      final GuardedList<B, X, I, S, A, C, R> l = left.get(length);
      final GuardedList<B, X, I, S, A, C, R> r = right.get(length);
      if (l != null && r != null) {
        final ImmutableList.Builder<SymbolicValue<B, X, I, S, A, C, R>>
            values = ImmutableList.builder();
        for (int i = 0; i < length; i++) {
          values.add(l.values.get(i).merge(guard, r.values.get(i)));
        }
        b.put(length,
            new GuardedList<>(solver.ite(guard, l.guard, r.guard),
                values.build()));
      } else if (l != null) {
        b.put(length, l.withGuard(solver.and(guard, l.guard)));
      } else {
        b.put(length, r.withGuard(solver.and(solver.not(guard), r.guard)));
      }
    }
    return new SymbolicList<>(context, listType,
        new GuardedListGroup<>(b.build()));
  }

  @Override
  public SymbolicValue<B, X, I, S, A, C, R> visit(FSeqType fseqType,
      Pair<SymbolicValue<B, X, I, S, A, C, R>,
          SymbolicValue<B, X, I, S, A, C, R>> p) {
    final SymbolicFSeq<B, X, I, S, A, C, R> left = p.left.asFSeq();
    final SymbolicFSeq<B, X, I, S, A, C, R> right = p.right.asFSeq();
    final ImmutableList.Builder<Pair<B, SymbolicValue<B, X, I, S, A, C, R>>>
        b = ImmutableList.builder();
    final int size = Math.max(left.elements.size(), right.elements.size());
    for (int i = 0; i < size; i++) {
      final Pair<B, SymbolicValue<B, X, I, S, A, C, R>> l = left.slot(i);
      final Pair<B, SymbolicValue<B, X, I, S, A, C, R>> r = right.slot(i);
      b.add(
          Pair.of(solver.ite(guard, l.left, r.left),
              l.right.merge(guard, r.right)));
    }
    return new SymbolicFSeq<>(context, fseqType, b.build());
  }

  @Override
  public SymbolicValue<B, X, I, S, A, C, R> visit(ConstMapType constMapType,
      Pair<SymbolicValue<B, X, I, S, A, C, R>,
          SymbolicValue<B, X, I, S, A, C, R>> p) {
    final SymbolicConstMap<B, X, I, S, A, C, R> left = p.left.asConstMap();
    final SymbolicConstMap<B, X, I, S, A, C, R> right = p.right.asConstMap();
    final Set<Object> keys = new LinkedHashSet<>(left.values.keySet());
    keys.addAll(right.values.keySet());
    final ImmutableMap.Builder<Object, SymbolicValue<B, X, I, S, A, C, R>> b =
        ImmutableMap.builder();
    for (Object key : keys) {
      b.put(key, left.get(key).merge(guard, right.get(key)));
    }
    return new SymbolicConstMap<>(context, constMapType, b.build());
  }
}

// End SymbolicMergeVisitor.java
