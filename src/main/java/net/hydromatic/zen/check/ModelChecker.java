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

import java.util.Map;
import net.hydromatic.zen.ast.Zen;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Finds values of the arbitraries in an expression that satisfy it.
 *
 * <p>Create an instance using {@link ModelCheckers#create(Map)}. Each call
 * is independent: it builds a fresh solver, and releases it before
 * returning. */
public interface ModelChecker {
  /** Finds an assignment to the arbitraries of a boolean expression that
   * makes the expression true.
   *
   * @param constraint Boolean expression
   * @param arguments Expression bound to each argument of the constraint
   * @return Value of each arbitrary visited while evaluating the
   * constraint, or null if the constraint is unsatisfiable
   */
  @Nullable Map<Zen.Arbitrary, Object> modelCheck(Zen.Exp constraint,
      Map<Zen.Argument, ? extends Zen.Exp> arguments);

  /** Finds an assignment that makes a constraint true, and returns the
   * value of another expression under that assignment; or null if the
   * constraint is unsatisfiable. */
  @Nullable Object evaluate(Zen.Exp constraint, Zen.Exp exp,
      Map<Zen.Argument, ? extends Zen.Exp> arguments);

  /** Finds an assignment that makes a constraint true and the objective as
   * large as possible; or null if the constraint is unsatisfiable. */
  @Nullable Map<Zen.Arbitrary, Object> maximize(Zen.Exp objective,
      Zen.Exp constraint, Map<Zen.Argument, ? extends Zen.Exp> arguments);

  /** Finds an assignment that makes a constraint true and the objective as
   * small as possible; or null if the constraint is unsatisfiable. */
  @Nullable Map<Zen.Arbitrary, Object> minimize(Zen.Exp objective,
      Zen.Exp constraint, Map<Zen.Argument, ? extends Zen.Exp> arguments);
}

// End ModelChecker.java
