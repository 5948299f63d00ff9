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

import java.util.BitSet;
import net.hydromatic.zen.eval.Environment;
import net.hydromatic.zen.eval.SymbolicEvaluationVisitor;
import net.hydromatic.zen.solve.BitVector;
import net.hydromatic.zen.solve.DdManager;
import net.hydromatic.zen.solve.DdSolver;
import net.hydromatic.zen.solve.DdVariable;
import net.hydromatic.zen.type.Type;
import net.hydromatic.zen.util.ZenException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Set of values of a type, represented by a binary decision diagram.
 *
 * <p>State sets are immutable. They are created by a
 * {@link StateSetTransformerManager}, and may only be combined with sets
 * from the same manager. */
public class StateSet {
  final StateSetTransformerManager manager;
  public final Type type;
  final int node;
  final VariableLayout layout;

  StateSet(StateSetTransformerManager manager, Type type, int node,
      VariableLayout layout) {
    this.manager = requireNonNull(manager);
    this.type = requireNonNull(type);
    this.node = node;
    this.layout = requireNonNull(layout);
  }

  private DdManager dd() {
    return manager.ddManager;
  }

  /** Returns a set with the same members whose diagram uses different
   * variables. */
  StateSet convertTo(VariableLayout target) {
    if (target == layout || target.variables.equals(layout.variables)) {
      return this;
    }
    return new StateSet(manager, type,
        dd().rename(node, layout.renamesTo(target)), target);
  }

  private StateSet check(StateSet other) {
    if (other.manager != manager) {
      throw new ZenException("cannot combine state sets from different "
          + "managers");
    }
    if (!other.type.equals(type)) {
      throw new ZenException("cannot combine state sets of types " + type
          + " and " + other.type);
    }
    return other.convertTo(layout);
  }

  /** Returns the union of this set and another. */
  public StateSet union(StateSet other) {
    final StateSet o = check(other);
    return new StateSet(manager, type, dd().or(node, o.node), layout);
  }

  /** Returns the intersection of this set and another. */
  public StateSet intersect(StateSet other) {
    final StateSet o = check(other);
    return new StateSet(manager, type, dd().and(node, o.node), layout);
  }

  /** Returns the set of values of this set's type that are not in this
   * set. */
  public StateSet complement() {
    return new StateSet(manager, type, dd().not(node), layout);
  }

  public boolean isEmpty() {
    return dd().isFalse(node);
  }

  public boolean isFull() {
    return dd().isTrue(node);
  }

  /** Returns a member of this set.
   *
   * @throws ZenException if the set is empty
   */
  public Object element() {
    final BitSet model = dd().satisfyingAssignment(node);
    if (model == null) {
      throw new ZenException("state set is empty");
    }
    final DdSolver solver = new DdSolver(dd());
    for (int i = 0; i < layout.arbitraries.size(); i++) {
      solver.setVariable(layout.arbitraries.get(i), layout.variables.get(i));
    }
    final SymbolicEvaluationVisitor<BitSet, DdVariable, Integer, BitVector,
        Void, Void, Void, Void, Void> visitor =
        new SymbolicEvaluationVisitor<>(solver);
    return visitor.evaluate(layout.expression, Environment.empty())
        .extract(solver, model);
  }

  @Override
  public int hashCode() {
    return node;
  }

  @Override
  public boolean equals(@Nullable Object obj) {
    return this == obj
        || obj instanceof StateSet
            && manager == ((StateSet) obj).manager
            && type.equals(((StateSet) obj).type)
            && node == ((StateSet) obj).convertTo(layout).node;
  }

  @Override
  public String toString() {
    return "StateSet{type: " + type + ", node: " + node + "}";
  }
}

// End StateSet.java
