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
package net.hydromatic.zen.solve;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import net.hydromatic.zen.ast.Regex;
import net.hydromatic.zen.ast.Zen;
import net.hydromatic.zen.type.BitvectorType;
import net.hydromatic.zen.type.MapType;
import net.hydromatic.zen.type.Type;
import net.hydromatic.zen.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Backend that builds formulas and decides their satisfiability.
 *
 * <p>Each kind of value has its own handle type, so that a backend that does
 * not support a kind can use a placeholder type for it. Operations are
 * named after the kind they work on because the Java compiler erases the
 * handle types.
 *
 * <p>Variable constructors are idempotent: calling one twice for the same
 * {@link Zen.Arbitrary} returns the same variable.
 *
 * @param <M> model (satisfying assignment)
 * @param <V> variable
 * @param <B> boolean formula
 * @param <X> bit-vector term
 * @param <I> unbounded integer term
 * @param <S> sequence term (also used for strings)
 * @param <A> map term
 * @param <C> character term
 * @param <R> real term
 */
public interface Solver<M, V, B, X, I, S, A, C, R> {
  /** Returns the name of this backend, for error messages. */
  String name();

  // booleans

  B boolTrue();

  B boolFalse();

  default B boolConst(boolean b) {
    return b ? boolTrue() : boolFalse();
  }

  B and(B x, B y);

  B or(B x, B y);

  B not(B x);

  B iff(B x, B y);

  B ite(B guard, B t, B f);

  // variables

  Pair<V, B> createBoolVar(Zen.Arbitrary e);

  Pair<V, X> createBitvecVar(Zen.Arbitrary e, BitvectorType type);

  Pair<V, I> createIntegerVar(Zen.Arbitrary e);

  Pair<V, R> createRealVar(Zen.Arbitrary e);

  Pair<V, C> createCharVar(Zen.Arbitrary e);

  /** Creates a string or sequence variable. */
  Pair<V, S> createSeqVar(Zen.Arbitrary e, Type type);

  Pair<V, A> createMapVar(Zen.Arbitrary e, MapType type);

  // constants

  /** Creates a bit-vector constant from a host value of {@code type}. */
  X bitvecConst(BitvectorType type, Object value);

  I integerConst(BigInteger value);

  R realConst(BigDecimal value);

  C charConst(char value);

  /** Creates a sequence constant; the value is a {@link String} if
   * {@code type} is the string type, otherwise a list of host values. */
  S seqConst(Type type, Object value);

  A mapEmpty(MapType type);

  // bit-vectors

  X bvAnd(X x, X y);

  X bvOr(X x, X y);

  X bvXor(X x, X y);

  X bvNot(X x);

  X bvAdd(X x, X y);

  X bvSubtract(X x, X y);

  X bvMultiply(X x, X y);

  B bvEq(X x, X y);

  B bvLeq(X x, X y, boolean signed);

  B bvGeq(X x, X y, boolean signed);

  X bvIte(B guard, X t, X f);

  // unbounded integers

  I intAdd(I x, I y);

  I intSubtract(I x, I y);

  I intMultiply(I x, I y);

  B intEq(I x, I y);

  B intLeq(I x, I y);

  B intGeq(I x, I y);

  I intIte(B guard, I t, I f);

  // reals

  R realAdd(R x, R y);

  R realSubtract(R x, R y);

  R realMultiply(R x, R y);

  B realEq(R x, R y);

  B realLeq(R x, R y);

  B realGeq(R x, R y);

  R realIte(B guard, R t, R f);

  // characters

  B charEq(C x, C y);

  B charLeq(C x, C y);

  B charGeq(C x, C y);

  C charIte(B guard, C t, C f);

  // sequences and strings

  /** Creates a sequence of one element, given the element's handle. */
  S seqUnit(Object element, Type type);

  S seqConcat(S x, S y);

  I seqLength(S x);

  S seqAt(S x, I index);

  B seqContains(S x, S sub);

  B seqStartsWith(S x, S prefix);

  B seqEndsWith(S x, S suffix);

  I seqIndexOf(S x, S sub, I offset);

  S seqSlice(S x, I offset, I length);

  S seqReplaceFirst(S x, S source, S target);

  B seqMatches(S x, Regex regex);

  B seqEq(S x, S y);

  S seqIte(B guard, S t, S f);

  // maps; keys and values are handles of the map type's key and value kinds

  A mapSet(A map, Object key, Object value, MapType type);

  A mapDelete(A map, Object key, MapType type);

  /** Looks up a key; returns whether the map has the key, and the value
   * (unspecified if it does not). */
  Pair<B, Object> mapGet(A map, Object key, MapType type);

  A mapUnion(A x, A y, MapType type);

  A mapIntersect(A x, A y, MapType type);

  B mapEq(A x, A y);

  A mapIte(B guard, A t, A f);

  // queries

  /** Returns a model of a formula, or null if it is unsatisfiable. */
  @Nullable M satisfiable(B x);

  /** Returns a model of a formula that maximizes an objective, or null if
   * the formula is unsatisfiable. */
  @Nullable M maximize(B x, Object objective, Type type);

  /** Returns a model of a formula that minimizes an objective, or null if
   * the formula is unsatisfiable. */
  @Nullable M minimize(B x, Object objective, Type type);

  // model extraction

  /** Returns the host value of a variable in a model. */
  Object get(M model, V variable, Type type);

  boolean evaluateBool(M model, B x);

  Object evaluateBitvec(M model, X x, BitvectorType type);

  BigInteger evaluateInteger(M model, I x);

  BigDecimal evaluateReal(M model, R x);

  char evaluateChar(M model, C x);

  /** Returns a {@link String} for the string type, otherwise a list. */
  Object evaluateSeq(M model, S x, Type type);

  Map<Object, Object> evaluateMap(M model, A x, MapType type);

  /** Prepares variables for the given groups of arbitraries, each of which
   * should be interleaved. The default implementation does nothing. */
  default void init(List<List<Zen.Arbitrary>> groups) {
  }
}

// End Solver.java
