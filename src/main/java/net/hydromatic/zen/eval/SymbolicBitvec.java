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
import net.hydromatic.zen.type.BitvectorType;

/** Symbolic value of a fixed-width integer type. */
public class SymbolicBitvec<B, X, I, S, A, C, R>
    extends SymbolicValue<B, X, I, S, A, C, R> {
  public final X value;

  public SymbolicBitvec(SymbolicContext<B, X, I, S, A, C, R> context,
      BitvectorType type, X value) {
    super(context, type);
    this.value = requireNonNull(value);
  }

  @Override
  public Object handle() {
    return value;
  }

  @Override
  public <M> Object extract(Solver<M, ?, B, X, I, S, A, C, R> solver,
      M model) {
    return solver.evaluateBitvec(model, value, (BitvectorType) type);
  }
}

// End SymbolicBitvec.java
