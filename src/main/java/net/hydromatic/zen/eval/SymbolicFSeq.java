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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import net.hydromatic.zen.solve.Solver;
import net.hydromatic.zen.type.FSeqType;
import net.hydromatic.zen.util.Pair;

/** Symbolic finite sequence: a list of slots, each holding a value and a
 * formula that says whether the slot is in use.
 *
 * <p>The elements of the sequence are the values of the slots that are in
 * use, in order. */
public class SymbolicFSeq<B, X, I, S, A, C, R>
    extends SymbolicValue<B, X, I, S, A, C, R> {
  public final ImmutableList<Pair<B, SymbolicValue<B, X, I, S, A, C, R>>>
      elements;

  public SymbolicFSeq(SymbolicContext<B, X, I, S, A, C, R> context,
      FSeqType type,
      ImmutableList<Pair<B, SymbolicValue<B, X, I, S, A, C, R>>> elements) {
    super(context, type);
    this.elements = requireNonNull(elements);
  }

  /** Returns a sequence with a value in use at the front. */
  public SymbolicFSeq<B, X, I, S, A, C, R> addFront(
      SymbolicValue<B, X, I, S, A, C, R> value) {
    return new SymbolicFSeq<>(context, (FSeqType) type,
        ImmutableList.<Pair<B, SymbolicValue<B, X, I, S, A, C, R>>>builder()
            .add(Pair.of(context.solver.boolTrue(), value))
            .addAll(elements)
            .build());
  }

  /** Returns the {@code i}th slot; past the end, returns an unused slot
   * holding the default value. */
  public Pair<B, SymbolicValue<B, X, I, S, A, C, R>> slot(int i) {
    if (i < elements.size()) {
      return elements.get(i);
    }
    return Pair.of(context.solver.boolFalse(),
        context.defaultValue(((FSeqType) type).elementType));
  }

  @Override
  public <M> Object extract(Solver<M, ?, B, X, I, S, A, C, R> solver,
      M model) {
    final ImmutableList.Builder<Object> b = ImmutableList.builder();
    for (Pair<B, SymbolicValue<B, X, I, S, A, C, R>> element : elements) {
      if (solver.evaluateBool(model, element.left)) {
        b.add(element.right.extract(solver, model));
      }
    }
    return b.build();
  }
}

// End SymbolicFSeq.java
