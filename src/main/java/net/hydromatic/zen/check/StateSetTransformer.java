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

import java.util.function.BiFunction;
import net.hydromatic.zen.ast.Zen;
import net.hydromatic.zen.type.PrimitiveType;
import net.hydromatic.zen.type.Type;
import net.hydromatic.zen.util.ZenException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Relation between the values of an input type and an output type,
 * {@code f(input) == output} for some function {@code f}, represented by a
 * binary decision diagram.
 *
 * <p>Create an instance using
 * {@link StateSetTransformerManager#createTransformer}. */
public class StateSetTransformer {
  private final StateSetTransformerManager manager;
  public final Type inputType;
  public final Type outputType;
  private final int relation;
  private final VariableLayout input;
  private final VariableLayout output;

  StateSetTransformer(StateSetTransformerManager manager, Type inputType,
      Type outputType, int relation, VariableLayout input,
      VariableLayout output) {
    this.manager = requireNonNull(manager);
    this.inputType = requireNonNull(inputType);
    this.outputType = requireNonNull(outputType);
    this.relation = relation;
    this.input = requireNonNull(input);
    this.output = requireNonNull(output);
  }

  private void check(StateSet set, Type type) {
    if (set.manager != manager) {
      throw new ZenException("cannot combine a transformer and a state set "
          + "from different managers");
    }
    if (!set.type.equals(type)) {
      throw new ZenException("expected a state set of type " + type
          + ", got " + set.type);
    }
  }

  /** Returns the image of a set of inputs: the outputs of the function for
   * those inputs. */
  public StateSet transformForward(StateSet inputs) {
    check(inputs, inputType);
    final int set = inputs.convertTo(input).node;
    final int image = manager.ddManager.exists(
        manager.ddManager.and(set, relation), input.bits());
    return manager.canonical(
        new StateSet(manager, outputType, image, output));
  }

  /** Returns the pre-image of a set of outputs: the inputs for which the
   * function returns one of those outputs. */
  public StateSet transformBackwards(StateSet outputs) {
    check(outputs, outputType);
    final int set = outputs.convertTo(output).node;
    final int preImage = manager.ddManager.exists(
        manager.ddManager.and(set, relation), output.bits());
    return manager.canonical(
        new StateSet(manager, inputType, preImage, input));
  }

  /** Returns the set of inputs that have an output, and for which an
   * invariant holds.
   *
   * @param invariant Function of input and output that returns a boolean
   *                  expression, or null
   */
  public StateSet inputSet(
      @Nullable BiFunction<Zen.Exp, Zen.Exp, Zen.Exp> invariant) {
    return manager.canonical(
        new StateSet(manager, inputType,
            manager.ddManager.exists(restrict(invariant), output.bits()),
            input));
  }

  /** Returns the set of inputs that have an output. */
  public StateSet inputSet() {
    return inputSet(null);
  }

  /** Returns the set of outputs that have an input, and for which an
   * invariant holds.
   *
   * @param invariant Function of input and output that returns a boolean
   *                  expression, or null
   */
  public StateSet outputSet(
      @Nullable BiFunction<Zen.Exp, Zen.Exp, Zen.Exp> invariant) {
    return manager.canonical(
        new StateSet(manager, outputType,
            manager.ddManager.exists(restrict(invariant), input.bits()),
            output));
  }

  /** Returns the set of outputs that have an input. */
  public StateSet outputSet() {
    return outputSet(null);
  }

  /** Returns the relation, restricted by an invariant. */
  private int restrict(
      @Nullable BiFunction<Zen.Exp, Zen.Exp, Zen.Exp> invariant) {
    if (invariant == null) {
      return relation;
    }
    final Zen.Exp exp = invariant.apply(input.expression, output.expression);
    if (exp.type != PrimitiveType.BOOL) {
      throw new IllegalArgumentException("invariant must be boolean: "
          + exp);
    }
    return manager.ddManager.and(relation,
        manager.evaluate(exp, input, output));
  }
}

// End StateSetTransformer.java
