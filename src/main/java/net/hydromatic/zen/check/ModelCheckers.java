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

import static net.hydromatic.zen.ast.ZenBuilder.zen;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.zen.ast.Zen;
import net.hydromatic.zen.eval.Environment;
import net.hydromatic.zen.eval.SymbolicEvaluationVisitor;
import net.hydromatic.zen.eval.SymbolicValue;
import net.hydromatic.zen.solve.DdSolver;
import net.hydromatic.zen.solve.SmtSolver;
import net.hydromatic.zen.solve.Solver;
import net.hydromatic.zen.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Utilities for {@link ModelChecker}. */
public abstract class ModelCheckers {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(ModelCheckers.class);

  private ModelCheckers() {
  }

  /** Creates a model checker.
   *
   * <p>Uses the properties {@link Prop#BACKEND}, {@link Prop#INTERLEAVE}
   * and {@link Prop#SMT_TIMEOUT}. */
  public static ModelChecker create(Map<Prop, Object> properties) {
    final Prop.Backend backend =
        Prop.BACKEND.enumValue(properties, Prop.Backend.class);
    switch (backend) {
    case DECISION_DIAGRAMS:
      return new DdModelChecker(Prop.INTERLEAVE.booleanValue(properties));
    case SMT:
      return new SmtModelChecker(
          (Integer) Prop.SMT_TIMEOUT.get(properties));
    default:
      throw new AssertionError(backend);
    }
  }

  /** Returns an expression whose value is any value of a given type; lists
   * are at most {@link Prop#LIST_SIZE} long. */
  public static Zen.Exp input(Type type, Map<Prop, Object> properties) {
    return zen.input(type, Prop.LIST_SIZE.intValue(properties));
  }

  /** Converts a map of argument bindings to a map keyed by argument id. */
  static Map<Integer, Zen.Exp> ids(
      Map<Zen.Argument, ? extends Zen.Exp> arguments) {
    final Map<Integer, Zen.Exp> map = new LinkedHashMap<>();
    arguments.forEach((argument, exp) -> map.put(argument.id, exp));
    return map;
  }

  /** What a query asks of the solver. */
  enum Goal {
    SATISFY, MAXIMIZE, MINIMIZE
  }

  /** Result of a successful query. */
  static class Solution {
    final Map<Zen.Arbitrary, Object> assignment;
    final @Nullable Object value;

    Solution(Map<Zen.Arbitrary, Object> assignment, @Nullable Object value) {
      this.assignment = assignment;
      this.value = value;
    }
  }

  /** Evaluates a constraint, and an optional output expression, using a
   * solver; asks the solver for a model; and reads the values of the
   * arbitraries and the output from the model. */
  static <M, V, B, X, I, S, A, C, R> @Nullable Solution solve(
      Solver<M, V, B, X, I, S, A, C, R> solver, Goal goal,
      Zen.Exp constraint, Zen.@Nullable Exp output,
      Map<Zen.Argument, ? extends Zen.Exp> arguments) {
    final Stopwatch stopwatch = Stopwatch.createStarted();
    final SymbolicEvaluationVisitor<M, V, B, X, I, S, A, C, R> visitor =
        new SymbolicEvaluationVisitor<>(solver);
    final Environment<B, X, I, S, A, C, R> env = Environment.of(arguments);
    final B b = visitor.evaluate(constraint, env).asBool().value;
    final SymbolicValue<B, X, I, S, A, C, R> out =
        output == null ? null : visitor.evaluate(output, env);
    LOGGER.debug("{} backend evaluated {} in {}", solver.name(), constraint,
        stopwatch);

    final M model;
    switch (goal) {
    case SATISFY:
      model = solver.satisfiable(b);
      break;
    case MAXIMIZE:
      model = solver.maximize(b, out.handle(), out.type);
      break;
    case MINIMIZE:
      model = solver.minimize(b, out.handle(), out.type);
      break;
    default:
      throw new AssertionError(goal);
    }
    if (model == null) {
      return null;
    }
    final Map<Zen.Arbitrary, Object> assignment = new LinkedHashMap<>();
    visitor.arbitraryVariables().forEach((arbitrary, variable) ->
        assignment.put(arbitrary, solver.get(model, variable, arbitrary.type)));
    return new Solution(assignment,
        out == null ? null : out.extract(solver, model));
  }

  /** Model checker that all implementations extend. */
  abstract static class AbstractModelChecker implements ModelChecker {
    abstract @Nullable Solution solve(Goal goal, Zen.Exp constraint,
        Zen.@Nullable Exp output,
        Map<Zen.Argument, ? extends Zen.Exp> arguments);

    @Override
    public @Nullable Map<Zen.Arbitrary, Object> modelCheck(
        Zen.Exp constraint, Map<Zen.Argument, ? extends Zen.Exp> arguments) {
      final Solution solution =
          solve(Goal.SATISFY, constraint, null, arguments);
      return solution == null ? null : solution.assignment;
    }

    @Override
    public @Nullable Object evaluate(Zen.Exp constraint, Zen.Exp exp,
        Map<Zen.Argument, ? extends Zen.Exp> arguments) {
      final Solution solution =
          solve(Goal.SATISFY, constraint, exp, arguments);
      return solution == null ? null : solution.value;
    }

    @Override
    public @Nullable Map<Zen.Arbitrary, Object> maximize(Zen.Exp objective,
        Zen.Exp constraint, Map<Zen.Argument, ? extends Zen.Exp> arguments) {
      final Solution solution =
          solve(Goal.MAXIMIZE, constraint, objective, arguments);
      return solution == null ? null : solution.assignment;
    }

    @Override
    public @Nullable Map<Zen.Arbitrary, Object> minimize(Zen.Exp objective,
        Zen.Exp constraint, Map<Zen.Argument, ? extends Zen.Exp> arguments) {
      final Solution solution =
          solve(Goal.MINIMIZE, constraint, objective, arguments);
      return solution == null ? null : solution.assignment;
    }
  }

  /** Model checker that uses Z3. */
  static class SmtModelChecker extends AbstractModelChecker {
    private final @Nullable Integer timeoutMillis;

    SmtModelChecker(@Nullable Integer timeoutMillis) {
      this.timeoutMillis = timeoutMillis;
    }

    @Override
    @Nullable Solution solve(Goal goal, Zen.Exp constraint,
        Zen.@Nullable Exp output,
        Map<Zen.Argument, ? extends Zen.Exp> arguments) {
      try (SmtSolver solver = new SmtSolver(timeoutMillis)) {
        return ModelCheckers.solve(solver, goal, constraint, output,
            arguments);
      }
    }
  }

  /** Model checker that uses binary decision diagrams.
   *
   * <p>Before evaluating, it runs {@link InterleavingHeuristic} and
   * allocates interleaved variables for each group of arbitraries. */
  static class DdModelChecker extends AbstractModelChecker {
    private final boolean interleave;

    DdModelChecker(boolean interleave) {
      this.interleave = interleave;
    }

    @Override
    @Nullable Solution solve(Goal goal, Zen.Exp constraint,
        Zen.@Nullable Exp output,
        Map<Zen.Argument, ? extends Zen.Exp> arguments) {
      final DdSolver solver = new DdSolver();
      if (interleave) {
        final ImmutableList<Zen.Exp> exps = output == null
            ? ImmutableList.of(constraint)
            : ImmutableList.of(constraint, output);
        solver.init(InterleavingHeuristic.compute(exps, ids(arguments)));
      }
      return ModelCheckers.solve(solver, goal, constraint, output, arguments);
    }
  }
}

// End ModelCheckers.java
