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
import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;

/** Symbolic list, as a map from each length that the list may have to the
 * guarded list of that length.
 *
 * <p>In a list built by the evaluator, the guards of different lengths are
 * mutually exclusive, and one of them holds. */
public class GuardedListGroup<B, X, I, S, A, C, R> {
  public final ImmutableSortedMap<Integer, GuardedList<B, X, I, S, A, C, R>>
      lists;

  public GuardedListGroup(
      ImmutableSortedMap<Integer, GuardedList<B, X, I, S, A, C, R>> lists) {
    this.lists = requireNonNull(lists);
  }

  /** Creates a group that has a single length. */
  public static <B, X, I, S, A, C, R> GuardedListGroup<B, X, I, S, A, C, R>
      of(B guard, ImmutableList<SymbolicValue<B, X, I, S, A, C, R>> values) {
    return new GuardedListGroup<>(
        ImmutableSortedMap.of(values.size(),
            new GuardedList<>(guard, values)));
  }

  /** Returns a group in which every list has an extra value at the
   * front. */
  public GuardedListGroup<B, X, I, S, A, C, R> addFront(
      SymbolicValue<B, X, I, S, A, C, R> value) {
    final ImmutableSortedMap.Builder<Integer,
        GuardedList<B, X, I, S, A, C, R>> b =
        ImmutableSortedMap.naturalOrder();
    for (Map.Entry<Integer, GuardedList<B, X, I, S, A, C, R>> e
        : lists.entrySet()) {
      final GuardedList<B, X, I, S, A, C, R> list = e.getValue();
      b.put(e.getKey() + 1,
          new GuardedList<>(list.guard,
              ImmutableList.<SymbolicValue<B, X, I, S, A, C, R>>builder()
                  .add(value).addAll(list.values).build()));
    }
    return new GuardedListGroup<>(b.build());
  }

  @Override
  public String toString() {
    return lists.toString();
  }
}

// End GuardedListGroup.java
