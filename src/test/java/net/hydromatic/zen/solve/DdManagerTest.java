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
package net.hydromatic.zen.solve;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.BitSet;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link DdManager}. */
public class DdManagerTest {
  private static BitVector constant(DdManager manager, int width, long v) {
    return manager.constant(width, BigInteger.valueOf(v));
  }

  @Test void testAddWraps() {
    final DdManager manager = new DdManager();
    final BitVector sum =
        manager.add(constant(manager, 8, 200), constant(manager, 8, 100));
    assertThat(manager.value(sum, new BitSet()), is(BigInteger.valueOf(44)));
    final BitVector difference =
        manager.subtract(constant(manager, 8, 3), constant(manager, 8, 5));
    assertThat(manager.value(difference, new BitSet()),
        is(BigInteger.valueOf(254)));
  }

  @Test void testSignedLeq() {
    final DdManager manager = new DdManager();
    final BitVector minusOne = constant(manager, 8, 255);
    final BitVector one = constant(manager, 8, 1);
    assertThat(manager.isTrue(manager.leq(minusOne, one, true)), is(true));
    assertThat(manager.isFalse(manager.leq(minusOne, one, false)), is(true));
    assertThat(manager.isTrue(manager.geq(minusOne, one, false)), is(true));
    assertThat(manager.isTrue(manager.leq(one, one, true)), is(true));
  }

  /** Most significant bits come first in the variable order, alternating
   * between the variables. */
  @Test void testInterleavedVariables() {
    final DdManager manager = new DdManager();
    final List<DdVariable> variables = manager.createVariables(2, 3);
    assertThat(manager.numberOfVariables(), is(6));
    assertThat(variables.get(0).index(2), is(0));
    assertThat(variables.get(1).index(2), is(1));
    assertThat(variables.get(0).index(1), is(2));
    assertThat(variables.get(1).index(0), is(5));
  }

  @Test void testSatisfyingAssignment() {
    final DdManager manager = new DdManager();
    final DdVariable x = manager.createVariables(1, 4).get(0);
    final int node = manager.eq(x.vector, constant(manager, 4, 9));
    final BitSet assignment = manager.satisfyingAssignment(node);
    assertThat(assignment, notNullValue());
    assertThat(manager.value(x, assignment), is(BigInteger.valueOf(9)));
    assertThat(manager.satisfyingAssignment(manager.falseNode()) == null,
        is(true));

    final BitSet bits = x.addTo(new BitSet());
    assertThat(manager.isTrue(manager.exists(node, bits)), is(true));
  }

  @Test void testRename() {
    final DdManager manager = new DdManager();
    final List<DdVariable> variables = manager.createVariables(2, 1);
    final DdVariable a = variables.get(0);
    final DdVariable b = variables.get(1);
    final int renamed =
        manager.rename(a.node(), ImmutableMap.of(a.index(0), b.index(0)));
    assertThat(renamed, is(b.node()));
    assertThat(manager.rename(a.node(), ImmutableMap.of()), is(a.node()));
  }
}

// End DdManagerTest.java
