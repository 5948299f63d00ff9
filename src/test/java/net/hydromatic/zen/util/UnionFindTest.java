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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests for {@link UnionFind}. */
public class UnionFindTest {
  @Test void testSingletons() {
    final UnionFind<String> unionFind = new UnionFind<>();
    unionFind.add("a");
    unionFind.add("b");
    unionFind.add("a");
    assertThat(unionFind.size(), is(2));
    assertThat(unionFind.contains("a"), is(true));
    assertThat(unionFind.contains("c"), is(false));
    assertThat(unionFind.disjointSets(), hasToString("[[a], [b]]"));
  }

  /** Sets come out in the order their first element was added, whatever
   * order the unions happened in. */
  @Test void testUnionOrder() {
    final UnionFind<String> unionFind = new UnionFind<>();
    for (String s : new String[] {"a", "b", "c", "d", "e"}) {
      unionFind.add(s);
    }
    unionFind.union("e", "b");
    unionFind.union("d", "c");
    unionFind.union("b", "d");
    assertThat(unionFind.disjointSets(), hasToString("[[a], [b, c, d, e]]"));
    assertThat(unionFind.find("e"), is(unionFind.find("c")));
    assertThat(unionFind.find("a"), is("a"));
  }

  @Test void testUnionIsIdempotent() {
    final UnionFind<Integer> unionFind = new UnionFind<>();
    unionFind.add(1);
    unionFind.add(2);
    unionFind.union(1, 2);
    unionFind.union(2, 1);
    unionFind.union(1, 1);
    assertThat(unionFind.disjointSets(), hasToString("[[1, 2]]"));
  }

  @Test void testUnknownElement() {
    final UnionFind<String> unionFind = new UnionFind<>();
    unionFind.add("a");
    assertThrows(IllegalArgumentException.class,
        () -> unionFind.union("a", "z"));
  }
}

// End UnionFindTest.java
