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

import java.util.function.Function;
import net.hydromatic.zen.solve.Solver;
import net.hydromatic.zen.type.Type;
import net.hydromatic.zen.util.Pair;

/** State shared by the symbolic values of one evaluation: the solver that
 * builds their formulas, and a source of default values.
 *
 * @param <B> boolean formula
 * @param <X> bit-vector term
 * @param <I> unbounded integer term
 * @param <S> sequence term
 * @param <A> map term
 * @param <C> character term
 * @param <R> real term
 */
public class SymbolicContext<B, X, I, S, A, C, R> {
  public final Solver<?, ?, B, X, I, S, A, C, R> solver;
  private final Function<Type, SymbolicValue<B, X, I, S, A, C, R>> defaults;
  private final SymbolicEqualityVisitor<B, X, I, S, A, C, R> equalityVisitor;

  /** Creates a context.
   *
   * @param solver Solver
   * @param defaults Function that returns the default value of a type
   */
  public SymbolicContext(Solver<?, ?, B, X, I, S, A, C, R> solver,
      Function<Type, SymbolicValue<B, X, I, S, A, C, R>> defaults) {
    this.solver = requireNonNull(solver);
    this.defaults = requireNonNull(defaults);
    this.equalityVisitor = new SymbolicEqualityVisitor<>(this);
  }

  /** Returns the symbolic value of the default value of a type. */
  public SymbolicValue<B, X, I, S, A, C, R> defaultValue(Type type) {
    return defaults.apply(type);
  }

  /** Returns "if guard then v1 else v2". */
  SymbolicValue<B, X, I, S, A, C, R> merge(B guard,
      SymbolicValue<B, X, I, S, A, C, R> v1,
      SymbolicValue<B, X, I, S, A, C, R> v2) {
    if (guard.equals(solver.boolTrue())) {
      return v1;
    }
    if (guard.equals(solver.boolFalse())) {
      return v2;
    }
    return v1.type.accept(new SymbolicMergeVisitor<>(this, guard),
        Pair.of(v1, v2));
  }

  /** Returns a formula that is true if two values are equal. */
  B eq(SymbolicValue<B, X, I, S, A, C, R> v1,
      SymbolicValue<B, X, I, S, A, C, R> v2) {
    return v1.type.accept(equalityVisitor,
        Pair.of(v1, v2));
  }
}

// End SymbolicContext.java
