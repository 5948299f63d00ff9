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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.zen.ast.Zen;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Values of the arguments of an expression.
 *
 * <p>An argument is bound either to an expression, which the evaluator
 * evaluates when it first needs it, or to a symbolic value.
 *
 * <p>Environments compare by identity, so each environment has its own
 * entries in the evaluator's cache. */
public class Environment<B, X, I, S, A, C, R> {
  private final ImmutableMap<Integer, Zen.Exp> expressions;
  private final ImmutableMap<Integer, SymbolicValue<B, X, I, S, A, C, R>>
      values;

  private Environment(ImmutableMap<Integer, Zen.Exp> expressions,
      ImmutableMap<Integer, SymbolicValue<B, X, I, S, A, C, R>> values) {
    this.expressions = expressions;
    this.values = values;
  }

  /** Creates an empty environment. */
  public static <B, X, I, S, A, C, R> Environment<B, X, I, S, A, C, R>
      empty() {
    return new Environment<>(ImmutableMap.of(), ImmutableMap.of());
  }

  /** Creates an environment that binds arguments to expressions. */
  public static <B, X, I, S, A, C, R> Environment<B, X, I, S, A, C, R> of(
      Map<Zen.Argument, ? extends Zen.Exp> arguments) {
    final ImmutableMap.Builder<Integer, Zen.Exp> b = ImmutableMap.builder();
    arguments.forEach((argument, exp) -> {
      if (!argument.type.equals(exp.type)) {
        throw new IllegalArgumentException("argument " + argument
            + " has type " + argument.type + " but value has type "
            + exp.type);
      }
      b.put(argument.id, exp);
    });
    return new Environment<>(b.build(), ImmutableMap.of());
  }

  /** Returns an environment that is this environment plus two bindings. */
  public Environment<B, X, I, S, A, C, R> bind(Zen.Argument a0,
      SymbolicValue<B, X, I, S, A, C, R> v0, Zen.Argument a1,
      SymbolicValue<B, X, I, S, A, C, R> v1) {
    final Map<Integer, SymbolicValue<B, X, I, S, A, C, R>> map =
        new LinkedHashMap<>(values);
    map.put(a0.id, v0);
    map.put(a1.id, v1);
    return new Environment<>(expressions, ImmutableMap.copyOf(map));
  }

  /** Returns the symbolic value bound to an argument, or null. */
  public @Nullable SymbolicValue<B, X, I, S, A, C, R> value(
      Zen.Argument argument) {
    return values.get(argument.id);
  }

  /** Returns the expression bound to an argument, or null. */
  public Zen.@Nullable Exp expression(Zen.Argument argument) {
    return expressions.get(argument.id);
  }

  @Override
  public String toString() {
    return "Environment(" + expressions.keySet() + ", " + values.keySet()
        + ")";
  }
}

// End Environment.java
