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

/** List of symbolic values of a known length, together with the condition
 * under which a symbolic list has that length. */
public class GuardedList<B, X, I, S, A, C, R> {
  public final B guard;
  public final ImmutableList<SymbolicValue<B, X, I, S, A, C, R>> values;

  public GuardedList(B guard,
      ImmutableList<SymbolicValue<B, X, I, S, A, C, R>> values) {
    this.guard = requireNonNull(guard);
    this.values = requireNonNull(values);
  }

  /** Returns a list with the same values and a different guard. */
  public GuardedList<B, X, I, S, A, C, R> withGuard(B guard) {
    return new GuardedList<>(guard, values);
  }

  @Override
  public String toString() {
    return guard + ": " + values;
  }
}

// End GuardedList.java
