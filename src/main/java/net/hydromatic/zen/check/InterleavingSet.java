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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSet;
import net.hydromatic.zen.ast.Zen;

/** Interleaving result that is a flat set of arbitraries. */
class InterleavingSet extends InterleavingResult {
  static final InterleavingSet EMPTY = new InterleavingSet(ImmutableSet.of());

  private final ImmutableSet<Zen.Arbitrary> variables;

  InterleavingSet(ImmutableSet<Zen.Arbitrary> variables) {
    this.variables = requireNonNull(variables);
  }

  @Override
  ImmutableSet<Zen.Arbitrary> variables() {
    return variables;
  }

  @Override
  InterleavingResult union(InterleavingResult other) {
    return new InterleavingSet(
        ImmutableSet.<Zen.Arbitrary>builder()
            .addAll(variables)
            .addAll(other.variables())
            .build());
  }

  @Override
  public String toString() {
    return variables.toString();
  }
}

// End InterleavingSet.java
