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

import com.google.common.collect.ImmutableMap;
import net.hydromatic.zen.solve.Solver;
import net.hydromatic.zen.type.ConstMapType;

/** Symbolic map whose keys are constants: one symbolic value per key. */
public class SymbolicConstMap<B, X, I, S, A, C, R>
    extends SymbolicValue<B, X, I, S, A, C, R> {
  public final ImmutableMap<Object, SymbolicValue<B, X, I, S, A, C, R>>
      values;

  public SymbolicConstMap(SymbolicContext<B, X, I, S, A, C, R> context,
      ConstMapType type,
      ImmutableMap<Object, SymbolicValue<B, X, I, S, A, C, R>> values) {
    super(context, type);
    this.values = requireNonNull(values);
  }

  /** Returns the value of a key; the default value if the key has none. */
  public SymbolicValue<B, X, I, S, A, C, R> get(Object key) {
    final SymbolicValue<B, X, I, S, A, C, R> value = values.get(key);
    return value != null
        ? value
        : context.defaultValue(((ConstMapType) type).valueType);
  }

  /** Returns a copy of this map with the value of one key replaced. */
  public SymbolicConstMap<B, X, I, S, A, C, R> with(Object key,
      SymbolicValue<B, X, I, S, A, C, R> value) {
    final ImmutableMap.Builder<Object, SymbolicValue<B, X, I, S, A, C, R>> b =
        ImmutableMap.builder();
    values.forEach((k, v) -> b.put(k, k.equals(key) ? value : v));
    if (!values.containsKey(key)) {
      b.put(key, value);
    }
    return new SymbolicConstMap<>(context, (ConstMapType) type, b.build());
  }

  @Override
  public <M> Object extract(Solver<M, ?, B, X, I, S, A, C, R> solver,
      M model) {
    final ImmutableMap.Builder<Object, Object> b = ImmutableMap.builder();
    for (Object key : ((ConstMapType) type).keys) {
      b.put(key, get(key).extract(solver, model));
    }
    return b.build();
  }
}

// End SymbolicConstMap.java
