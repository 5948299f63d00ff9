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
import net.hydromatic.zen.type.ListType;

/** Symbolic list. */
public class SymbolicList<B, X, I, S, A, C, R>
    extends SymbolicValue<B, X, I, S, A, C, R> {
  public final GuardedListGroup<B, X, I, S, A, C, R> group;

  public SymbolicList(SymbolicContext<B, X, I, S, A, C, R> context,
      ListType type, GuardedListGroup<B, X, I, S, A, C, R> group) {
    super(context, type);
    this.group = requireNonNull(group);
  }

  /** {@inheritDoc}
   *
   * <p>Returns the values of the shortest list whose guard holds, or an
   * empty list if no guard holds. */
  @Override
  public <M> Object extract(Solver<M, ?, B, X, I, S, A, C, R> solver,
      M model) {
    for (GuardedList<B, X, I, S, A, C, R> list : group.lists.values()) {
      if (solver.evaluateBool(model, list.guard)) {
        final ImmutableList.Builder<Object> b = ImmutableList.builder();
        list.values.forEach(v -> b.add(v.extract(solver, model)));
        return b.build();
      }
    }
    return ImmutableList.of();
  }
}

// End SymbolicList.java
