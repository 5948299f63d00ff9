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

import com.google.common.collect.ImmutableList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.Map;
import net.hydromatic.zen.ast.Zen;
import net.hydromatic.zen.solve.DdVariable;

/** Decision diagram variables that represent a value of a type.
 *
 * <p>{@code expression} is a value built from {@code arbitraries};
 * arbitrary {@code i} is represented by variable {@code i}. */
class VariableLayout {
  final Zen.Exp expression;
  final ImmutableList<Zen.Arbitrary> arbitraries;
  final ImmutableList<DdVariable> variables;

  VariableLayout(Zen.Exp expression, ImmutableList<Zen.Arbitrary> arbitraries,
      ImmutableList<DdVariable> variables) {
    this.expression = requireNonNull(expression);
    this.arbitraries = requireNonNull(arbitraries);
    this.variables = requireNonNull(variables);
    if (arbitraries.size() != variables.size()) {
      throw new IllegalArgumentException("arbitraries " + arbitraries
          + " do not match variables " + variables);
    }
  }

  /** Returns the indices of all bits of all variables. */
  BitSet bits() {
    final BitSet bits = new BitSet();
    variables.forEach(v -> v.addTo(bits));
    return bits;
  }

  /** Returns a map from the bits of this layout to the corresponding bits
   * of another layout of the same type. */
  Map<Integer, Integer> renamesTo(VariableLayout target) {
    final Map<Integer, Integer> renames = new HashMap<>();
    for (int i = 0; i < variables.size(); i++) {
      final DdVariable from = variables.get(i);
      final DdVariable to = target.variables.get(i);
      for (int bit = 0; bit < from.width(); bit++) {
        if (from.index(bit) != to.index(bit)) {
          renames.put(from.index(bit), to.index(bit));
        }
      }
    }
    return renames;
  }

  @Override
  public String toString() {
    return variables.toString();
  }
}

// End VariableLayout.java
