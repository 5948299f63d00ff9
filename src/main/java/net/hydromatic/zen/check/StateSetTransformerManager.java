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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.zen.ast.ZenBuilder.zen;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import net.hydromatic.zen.ast.Zen;
import net.hydromatic.zen.eval.Environment;
import net.hydromatic.zen.eval.SymbolicEvaluationVisitor;
import net.hydromatic.zen.solve.BitVector;
import net.hydromatic.zen.solve.DdManager;
import net.hydromatic.zen.solve.DdSolver;
import net.hydromatic.zen.solve.DdVariable;
import net.hydromatic.zen.type.PrimitiveType;
import net.hydromatic.zen.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Creates and owns {@link StateSet} and {@link StateSetTransformer}
 * objects.
 *
 * <p>All sets and transformers created by a manager share one
 * {@link DdManager}. The manager remembers, for each type, the layout of
 * the variables of the first set or transformer that used it (its
 * canonical layout), and converts each set it returns to that layout, so
 * that sets of the same type can be combined directly.
 *
 * <p>A manager only grows. It is not thread-safe.
 *
 * <p>Supported types are booleans, fixed-width integers, and records of
 * these. */
public class StateSetTransformerManager {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(StateSetTransformerManager.class);

  final DdManager ddManager = new DdManager();

  /** Canonical layout of each type. */
  private final Map<Type, VariableLayout> canonicalLayouts = new HashMap<>();

  /** Layout of the output of a transformer whose variables need not be
   * interleaved, for each output type. */
  private final Map<Type, VariableLayout> dependencyFreeOutputs =
      new HashMap<>();

  /** Creates the set of values for which a predicate holds.
   *
   * @param predicate Function that returns a boolean expression
   * @param type Type of the values
   */
  public StateSet createStateSet(Function<Zen.Exp, Zen.Exp> predicate,
      Type type) {
    final List<Zen.Arbitrary> arbitraries = new ArrayList<>();
    final Zen.Exp input = zen.input(type, 0, arbitraries);
    final Zen.Exp exp = predicate.apply(input);
    checkArgument(exp.type == PrimitiveType.BOOL,
        "predicate must be boolean: %s", exp);

    final List<List<Zen.Arbitrary>> groups =
        InterleavingHeuristic.compute(exp);
    final DdSolver solver = new DdSolver(ddManager);
    if (isDependencyFree(groups)) {
      bind(solver, arbitraries, canonicalLayouts.get(type));
    }
    solver.init(groups);

    final Evaluation evaluation = new Evaluation(solver);
    final int node = evaluation.evaluate(exp);
    final VariableLayout layout = evaluation.layout(input, arbitraries);
    canonicalLayouts.putIfAbsent(type, layout);
    return canonical(
        new StateSet(this, type, evaluation.removeTransients(node, layout),
            layout));
  }

  /** Creates a transformer for a function.
   *
   * @param function Function from an expression of the input type to an
   *                 expression of the output type
   * @param inputType Input type
   * @param outputType Output type
   */
  public StateSetTransformer createTransformer(
      Function<Zen.Exp, Zen.Exp> function, Type inputType, Type outputType) {
    final List<Zen.Arbitrary> inputArbitraries = new ArrayList<>();
    final Zen.Exp input = zen.input(inputType, 0, inputArbitraries);
    final Zen.Exp result = function.apply(input);
    checkArgument(result.type.equals(outputType),
        "function returns %s, expected %s", result.type, outputType);
    final List<Zen.Arbitrary> outputArbitraries = new ArrayList<>();
    final Zen.Exp output = zen.input(outputType, 0, outputArbitraries);
    final Zen.Exp exp = zen.eq(result, output);

    final List<List<Zen.Arbitrary>> groups =
        InterleavingHeuristic.compute(exp);
    final boolean dependencyFree = isDependencyFree(groups);
    final DdSolver solver = new DdSolver(ddManager);
    if (dependencyFree) {
      final VariableLayout canonicalInput = canonicalLayouts.get(inputType);
      final VariableLayout freeOutput = dependencyFreeOutputs.get(outputType);
      bind(solver, inputArbitraries, canonicalInput);
      // Input and output must not share variables
      if (canonicalInput == null || freeOutput == null
          || !canonicalInput.variables.equals(freeOutput.variables)) {
        bind(solver, outputArbitraries, freeOutput);
      }
    }
    solver.init(groups);

    final Evaluation evaluation = new Evaluation(solver);
    final int node = evaluation.evaluate(exp);
    final VariableLayout inputLayout =
        evaluation.layout(input, inputArbitraries);
    final VariableLayout outputLayout =
        evaluation.layout(output, outputArbitraries);
    if (dependencyFree) {
      dependencyFreeOutputs.putIfAbsent(outputType, outputLayout);
    }
    canonicalLayouts.putIfAbsent(inputType, inputLayout);
    canonicalLayouts.putIfAbsent(outputType, outputLayout);
    LOGGER.debug("transformer from {} to {}; input {}, output {}",
        inputType, outputType, inputLayout, outputLayout);
    return new StateSetTransformer(this, inputType, outputType,
        evaluation.removeTransients(node, inputLayout, outputLayout),
        inputLayout, outputLayout);
  }

  /** Converts a set to the canonical layout of its type. */
  StateSet canonical(StateSet set) {
    return set.convertTo(requireNonNull(canonicalLayouts.get(set.type)));
  }

  /** Evaluates a boolean expression whose arbitraries belong to some
   * layouts. */
  int evaluate(Zen.Exp exp, VariableLayout... layouts) {
    final DdSolver solver = new DdSolver(ddManager);
    for (VariableLayout layout : layouts) {
      bind(solver, layout.arbitraries, layout);
    }
    final Evaluation evaluation = new Evaluation(solver);
    return evaluation.removeTransients(evaluation.evaluate(exp), layouts);
  }

  /** Uses the variables of an existing layout for some arbitraries. */
  private static void bind(DdSolver solver, List<Zen.Arbitrary> arbitraries,
      @Nullable VariableLayout layout) {
    if (layout == null || layout.arbitraries.size() != arbitraries.size()) {
      return;
    }
    for (int i = 0; i < arbitraries.size(); i++) {
      solver.setVariable(arbitraries.get(i), layout.variables.get(i));
    }
  }

  /** Whether no group requires two arbitraries of the same type to be
   * interleaved. */
  private static boolean isDependencyFree(List<List<Zen.Arbitrary>> groups) {
    for (List<Zen.Arbitrary> group : groups) {
      final Map<Type, Integer> counts = new HashMap<>();
      for (Zen.Arbitrary arbitrary : group) {
        if (counts.merge(arbitrary.type, 1, Integer::sum) > 1) {
          return false;
        }
      }
    }
    return true;
  }

  /** Symbolic evaluation of expressions using one solver. */
  private class Evaluation {
    final DdSolver solver;
    final SymbolicEvaluationVisitor<BitSet, DdVariable, Integer, BitVector,
        Void, Void, Void, Void, Void> visitor;

    Evaluation(DdSolver solver) {
      this.solver = solver;
      this.visitor = new SymbolicEvaluationVisitor<>(solver);
    }

    int evaluate(Zen.Exp exp) {
      return visitor.evaluate(exp, Environment.empty()).asBool().value;
    }

    /** Returns the layout of some arbitraries; allocates variables for
     * arbitraries that evaluation did not reach. */
    VariableLayout layout(Zen.Exp exp, List<Zen.Arbitrary> arbitraries) {
      final ImmutableList.Builder<DdVariable> variables =
          ImmutableList.builder();
      for (Zen.Arbitrary arbitrary : arbitraries) {
        visitor.evaluate(arbitrary, Environment.empty());
        variables.add(requireNonNull(solver.getVariable(arbitrary)));
      }
      return new VariableLayout(exp, ImmutableList.copyOf(arbitraries),
          variables.build());
    }

    /** Quantifies away the variables of arbitraries that are not in any of
     * the given layouts. */
    int removeTransients(int node, VariableLayout... layouts) {
      final BitSet transients = new BitSet();
      visitor.arbitraryVariables().values()
          .forEach(v -> v.addTo(transients));
      for (VariableLayout layout : layouts) {
        transients.andNot(layout.bits());
      }
      if (transients.isEmpty()) {
        return node;
      }
      LOGGER.debug("quantifying transient variables {}", transients);
      return ddManager.exists(node, transients);
    }
  }
}

// End StateSetTransformerManager.java
