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
package net.hydromatic.zen.util;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Disjoint-set forest.
 *
 * <p>Elements are stored in an arena and addressed by their ordinal, the
 * order in which they were added. Union is by size, and {@link #find} halves
 * paths as it walks them.
 *
 * <p>An instance belongs to a single analysis pass; it is not thread-safe.
 *
 * @param <E> Element type
 */
public class UnionFind<E> {
  private final Map<E, Integer> ordinals = new HashMap<>();
  private final List<E> elements = new ArrayList<>();
  private final List<Integer> parents = new ArrayList<>();
  private final List<Integer> sizes = new ArrayList<>();

  /** Adds an element as a singleton set, if it is not already present. */
  public void add(E e) {
    if (ordinals.containsKey(e)) {
      return;
    }
    final int ordinal = elements.size();
    ordinals.put(e, ordinal);
    elements.add(e);
    parents.add(ordinal);
    sizes.add(1);
  }

  /** Returns whether an element has been added. */
  public boolean contains(E e) {
    return ordinals.containsKey(e);
  }

  /** Returns the number of elements. */
  public int size() {
    return elements.size();
  }

  /** Returns the representative element of the set that contains {@code e}. */
  public E find(E e) {
    return elements.get(root(ordinal(e)));
  }

  /** Merges the sets that contain two elements. */
  public void union(E e0, E e1) {
    int root0 = root(ordinal(e0));
    int root1 = root(ordinal(e1));
    if (root0 == root1) {
      return;
    }
    if (sizes.get(root0) < sizes.get(root1)) {
      final int swap = root0;
      root0 = root1;
      root1 = swap;
    }
    parents.set(root1, root0);
    sizes.set(root0, sizes.get(root0) + sizes.get(root1));
  }

  /**
   * Returns the disjoint sets.
   *
   * <p>Sets are ordered by their first-added element, and the elements within
   * each set are in the order they were added.
   */
  public List<List<E>> disjointSets() {
    final Map<Integer, List<E>> sets = new LinkedHashMap<>();
    for (int i = 0; i < elements.size(); i++) {
      sets.computeIfAbsent(root(i), r -> new ArrayList<>())
          .add(elements.get(i));
    }
    final ImmutableList.Builder<List<E>> b = ImmutableList.builder();
    sets.values().forEach(set -> b.add(ImmutableList.copyOf(set)));
    return b.build();
  }

  private int ordinal(E e) {
    final Integer ordinal = ordinals.get(e);
    checkArgument(ordinal != null, "element %s not found", e);
    return ordinal;
  }

  private int root(int ordinal) {
    int i = ordinal;
    while (parents.get(i) != i) {
      final int grandparent = parents.get(parents.get(i));
      parents.set(i, grandparent);
      i = grandparent;
    }
    return i;
  }
}

// End UnionFind.java
