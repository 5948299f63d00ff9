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

import com.google.common.collect.ImmutableSet;
import net.hydromatic.zen.ast.Zen;
import net.hydromatic.zen.type.PrimitiveType;
import net.hydromatic.zen.util.UnionFind;

/** Abstract value computed by {@link InterleavingHeuristic} for an
 * expression: the arbitraries that the expression's value depends on. */
abstract class InterleavingResult {
  /** Returns all arbitraries this result depends on. */
  abstract ImmutableSet<Zen.Arbitrary> variables();

  /** Returns a result that depends on the arbitraries of both this and
   * another result. */
  abstract InterleavingResult union(InterleavingResult other);

  /** Records that the arbitraries of this result and another result are
   * combined by an operation, so that arbitraries of the same type must
   * be interleaved.
   *
   * <p>Does nothing if either side depends only on booleans. */
  void combine(InterleavingResult other,
      UnionFind<Zen.Arbitrary> disjointSets) {
    final ImmutableSet<Zen.Arbitrary> variables0 = variables();
    final ImmutableSet<Zen.Arbitrary> variables1 = other.variables();
    if (isBoolOnly(variables0) || isBoolOnly(variables1)) {
      return;
    }
    for (Zen.Arbitrary v0 : variables0) {
      for (Zen.Arbitrary v1 : variables1) {
        if (v0.type.equals(v1.type)) {
          disjointSets.union(v0, v1);
        }
      }
    }
  }

  private static boolean isBoolOnly(ImmutableSet<Zen.Arbitrary> variables) {
    return variables.stream().allMatch(v -> v.type == PrimitiveType.BOOL);
  }
}

// End InterleavingResult.java
