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

import static net.hydromatic.zen.ast.ZenBuilder.zen;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import net.hydromatic.zen.ast.Zen;
import net.hydromatic.zen.type.PrimitiveType;
import org.junit.jupiter.api.Test;

/** Tests for {@link DdSolver}. */
public class DdSolverTest {
  /** Arbitraries of the same type in a group are interleaved; types of
   * equal width still get their own block. */
  @Test void testInitAllocatesOneBlockPerType() {
    final Zen.Arbitrary a = zen.arbitrary(PrimitiveType.SHORT, "a");
    final Zen.Arbitrary b = zen.arbitrary(PrimitiveType.USHORT, "b");
    final Zen.Arbitrary c = zen.arbitrary(PrimitiveType.SHORT, "c");
    final DdSolver solver = new DdSolver();
    solver.init(ImmutableList.of(ImmutableList.of(a, b, c)));
    assertThat(solver.manager.numberOfVariables(), is(48));

    // a and c share the first block, bit by bit
    assertThat(solver.getVariable(a).index(15), is(0));
    assertThat(solver.getVariable(c).index(15), is(1));
    assertThat(solver.getVariable(a).index(0), is(30));
    assertThat(solver.getVariable(c).index(0), is(31));

    // b is alone in the next block
    assertThat(solver.getVariable(b).index(15), is(32));
    assertThat(solver.getVariable(b).index(0), is(47));
  }

  @Test void testInitSkipsAllocatedArbitraries() {
    final Zen.Arbitrary x = zen.arbitrary(PrimitiveType.BYTE, "x");
    final DdSolver solver = new DdSolver();
    solver.init(ImmutableList.of(ImmutableList.of(x)));
    final DdVariable v = solver.getVariable(x);
    solver.init(ImmutableList.of(ImmutableList.of(x)));
    assertThat(solver.getVariable(x), is(v));
    assertThat(solver.manager.numberOfVariables(), is(8));
  }
}

// End DdSolverTest.java
