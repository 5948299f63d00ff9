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

import net.hydromatic.zen.solve.Solver;
import net.hydromatic.zen.type.Type;

/** Value of an expression under all assignments of its variables,
 * represented by solver terms.
 *
 * <p>Each kind of type has its own sub-class; a composite value contains
 * the symbolic values of its parts.
 *
 * @param <B> boolean formula
 * @param <X> bit-vector term
 * @param <I> unbounded integer term
 * @param <S> sequence term
 * @param <A> map term
 * @param <C> character term
 * @param <R> real term
 */
public abstract class SymbolicValue<B, X, I, S, A, C, R> {
  public final SymbolicContext<B, X, I, S, A, C, R> context;
  public final Type type;

  SymbolicValue(SymbolicContext<B, X, I, S, A, C, R> context, Type type) {
    this.context = requireNonNull(context);
    this.type = requireNonNull(type);
  }

  /** Returns a value that is this value if {@code guard} holds, and
   * {@code other} if it does not. */
  public SymbolicValue<B, X, I, S, A, C, R> merge(B guard,
      SymbolicValue<B, X, I, S, A, C, R> other) {
    return context.merge(guard, this, other);
  }

  /** Returns a boolean value that is true if this value equals
   * {@code other}. */
  public SymbolicBool<B, X, I, S, A, C, R> eq(
      SymbolicValue<B, X, I, S, A, C, R> other) {
    return new SymbolicBool<>(context, context.eq(this, other));
  }

  /** Returns the solver term of a value whose type has a single term.
   *
   * @throws UnsupportedOperationException if the value is composite
   */
  public Object handle() {
    throw new UnsupportedOperationException("composite value of type "
        + type);
  }

  /** Reads this value back from a model, as a host value. */
  public abstract <M> Object extract(Solver<M, ?, B, X, I, S, A, C, R> solver,
      M model);

  public SymbolicBool<B, X, I, S, A, C, R> asBool() {
    return (SymbolicBool<B, X, I, S, A, C, R>) this;
  }

  public SymbolicBitvec<B, X, I, S, A, C, R> asBitvec() {
    return (SymbolicBitvec<B, X, I, S, A, C, R>) this;
  }

  public SymbolicInteger<B, X, I, S, A, C, R> asInteger() {
    return (SymbolicInteger<B, X, I, S, A, C, R>) this;
  }

  public SymbolicReal<B, X, I, S, A, C, R> asReal() {
    return (SymbolicReal<B, X, I, S, A, C, R>) this;
  }

  public SymbolicChar<B, X, I, S, A, C, R> asChar() {
    return (SymbolicChar<B, X, I, S, A, C, R>) this;
  }

  public SymbolicSeq<B, X, I, S, A, C, R> asSeq() {
    return (SymbolicSeq<B, X, I, S, A, C, R>) this;
  }

  public SymbolicMap<B, X, I, S, A, C, R> asMap() {
    return (SymbolicMap<B, X, I, S, A, C, R>) this;
  }

  public SymbolicObject<B, X, I, S, A, C, R> asObject() {
    return (SymbolicObject<B, X, I, S, A, C, R>) this;
  }

  public SymbolicList<B, X, I, S, A, C, R> asList() {
    return (SymbolicList<B, X, I, S, A, C, R>) this;
  }

  public SymbolicFSeq<B, X, I, S, A, C, R> asFSeq() {
    return (SymbolicFSeq<B, X, I, S, A, C, R>) this;
  }

  public SymbolicConstMap<B, X, I, S, A, C, R> asConstMap() {
    return (SymbolicConstMap<B, X, I, S, A, C, R>) this;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(" + type + ")";
  }
}

// End SymbolicValue.java
