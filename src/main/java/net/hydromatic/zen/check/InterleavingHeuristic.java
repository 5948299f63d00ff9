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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.zen.ast.ExpVisitor;
import net.hydromatic.zen.ast.Zen;
import net.hydromatic.zen.solve.DdSolver;
import net.hydromatic.zen.type.ConstMapType;
import net.hydromatic.zen.type.FSeqType;
import net.hydromatic.zen.type.FixedIntegerType;
import net.hydromatic.zen.type.ListType;
import net.hydromatic.zen.type.MapType;
import net.hydromatic.zen.type.PrimitiveType;
import net.hydromatic.zen.type.RecordType;
import net.hydromatic.zen.type.SeqType;
import net.hydromatic.zen.type.Type;
import net.hydromatic.zen.type.TypeVisitor;
import net.hydromatic.zen.util.UnionFind;
import net.hydromatic.zen.util.UnsupportedConstructException;
import net.hydromatic.zen.util.ZenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Static analysis that decides which arbitraries must have interleaved
 * decision diagram variables.
 *
 * <p>Two arbitraries of the same type are placed in the same group if an
 * arithmetic operation, a bitwise "and" or "xor", an equality or a
 * comparison combines values that depend on them. Bitwise "or" does not
 * combine its operands. Operands that depend only on booleans never
 * combine.
 *
 * <p>A list case split analyzes the list and the empty case, but not the
 * non-empty case, whose body depends on the length of the list.
 *
 * <p>Maps, sequences, strings and reals cannot be represented by decision
 * diagrams; the analysis throws {@link UnsupportedConstructException} if
 * it meets them.
 */
public class InterleavingHeuristic {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(InterleavingHeuristic.class);

  private final UnionFind<Zen.Arbitrary> disjointSets = new UnionFind<>();
  private final Map<Integer, InterleavingResult> cache = new HashMap<>();
  private final Visitor visitor = new Visitor();

  /** Computes the groups of arbitraries in some expressions, in the order
   * they were first seen.
   *
   * @param exps Expressions
   * @param arguments Expression bound to each argument, keyed by argument
   *                  id
   */
  public static List<List<Zen.Arbitrary>> compute(
      Iterable<? extends Zen.Exp> exps, Map<Integer, Zen.Exp> arguments) {
    final InterleavingHeuristic heuristic = new InterleavingHeuristic();
    final ImmutableMap<Integer, Zen.Exp> arguments2 =
        ImmutableMap.copyOf(arguments);
    for (Zen.Exp exp : exps) {
      exp.accept(heuristic.visitor, arguments2);
    }
    final List<List<Zen.Arbitrary>> groups =
        heuristic.disjointSets.disjointSets();
    LOGGER.debug("interleaving groups {}", groups);
    return groups;
  }

  /** Computes the groups of arbitraries in an expression that has no
   * arguments. */
  public static List<List<Zen.Arbitrary>> compute(Zen.Exp exp) {
    return compute(ImmutableList.of(exp), ImmutableMap.of());
  }

  /** Returns the result for a constant of a given type, which depends on
   * no arbitraries. */
  static InterleavingResult empty(Type type) {
    return type.accept(EmptyResultVisitor.INSTANCE, null);
  }

  private static UnsupportedConstructException unsupported(String construct) {
    return new UnsupportedConstructException(DdSolver.NAME, construct);
  }

  /** Visitor that computes the result of each expression. */
  private class Visitor
      implements ExpVisitor<InterleavingResult, Map<Integer, Zen.Exp>> {
    private InterleavingResult visit(Zen.Exp exp,
        Map<Integer, Zen.Exp> arguments) {
      InterleavingResult result = cache.get(exp.id);
      if (result == null) {
        result = exp.accept(this, arguments);
        cache.put(exp.id, result);
      }
      return result;
    }

    @Override
    public InterleavingResult visit(Zen.Constant constant,
        Map<Integer, Zen.Exp> arguments) {
      return empty(constant.type);
    }

    @Override
    public InterleavingResult visit(Zen.Arbitrary arbitrary,
        Map<Integer, Zen.Exp> arguments) {
      // throws if the backend cannot represent the type
      empty(arbitrary.type);
      if (!disjointSets.contains(arbitrary)) {
        disjointSets.add(arbitrary);
      }
      return new InterleavingSet(ImmutableSet.of(arbitrary));
    }

    @Override
    public InterleavingResult visit(Zen.Argument argument,
        Map<Integer, Zen.Exp> arguments) {
      final Zen.Exp exp = arguments.get(argument.id);
      if (exp == null) {
        throw new ZenException("argument " + argument + " is not bound");
      }
      return visit(exp, arguments);
    }

    @Override
    public InterleavingResult visit(Zen.Call call,
        Map<Integer, Zen.Exp> arguments) {
      switch (call.op) {
      case NOT:
      case BITWISE_NOT:
        return visit(call.arg(0), arguments);
      case LIST_EMPTY:
        return empty(call.type);
      case AND:
      case OR:
      case BITWISE_OR:
      case LIST_ADD_FRONT:
        return visit(call.arg(0), arguments)
            .union(visit(call.arg(1), arguments));
      case PLUS:
      case MINUS:
      case TIMES:
      case BITWISE_AND:
      case BITWISE_XOR:
      case LE:
      case GE:
        final InterleavingResult x = visit(call.arg(0), arguments);
        final InterleavingResult y = visit(call.arg(1), arguments);
        x.combine(y, disjointSets);
        return x.union(y);
      case EQ:
        final InterleavingResult x2 = visit(call.arg(0), arguments);
        final InterleavingResult y2 = visit(call.arg(1), arguments);
        x2.combine(y2, disjointSets);
        return new InterleavingSet(x2.variables()).union(y2);
      case MAP_EMPTY:
      case MAP_GET:
      case MAP_SET:
      case MAP_DELETE:
      case MAP_UNION:
      case MAP_INTERSECT:
        throw unsupported("maps");
      default:
        throw unsupported("sequences");
      }
    }

    /** {@inheritDoc}
     *
     * <p>The condition is analyzed, but is not combined with the
     * branches. */
    @Override
    public InterleavingResult visit(Zen.If anIf,
        Map<Integer, Zen.Exp> arguments) {
      visit(anIf.condition, arguments);
      return visit(anIf.ifTrue, arguments)
          .union(visit(anIf.ifFalse, arguments));
    }

    @Override
    public InterleavingResult visit(Zen.CreateObject createObject,
        Map<Integer, Zen.Exp> arguments) {
      final ImmutableSortedMap.Builder<String, InterleavingResult> b =
          ImmutableSortedMap.orderedBy(RecordType.ORDERING);
      createObject.fields.forEach((name, exp) ->
          b.put(name, visit(exp, arguments)));
      return new InterleavingClass(b.build());
    }

    @Override
    public InterleavingResult visit(Zen.GetField getField,
        Map<Integer, Zen.Exp> arguments) {
      final InterleavingResult result = visit(getField.exp, arguments);
      if (result instanceof InterleavingClass) {
        return ((InterleavingClass) result).field(getField.fieldName);
      }
      return result;
    }

    @Override
    public InterleavingResult visit(Zen.WithField withField,
        Map<Integer, Zen.Exp> arguments) {
      final InterleavingResult result = visit(withField.exp, arguments);
      final InterleavingResult value = visit(withField.value, arguments);
      if (result instanceof InterleavingClass) {
        return ((InterleavingClass) result).with(withField.fieldName, value);
      }
      return result.union(value);
    }

    @Override
    public InterleavingResult visit(Zen.ListCase listCase,
        Map<Integer, Zen.Exp> arguments) {
      visit(listCase.list, arguments);
      return visit(listCase.emptyCase, arguments);
    }

    @Override
    public InterleavingResult visit(Zen.ConstMapGet constMapGet,
        Map<Integer, Zen.Exp> arguments) {
      throw unsupported("constant maps");
    }

    @Override
    public InterleavingResult visit(Zen.ConstMapSet constMapSet,
        Map<Integer, Zen.Exp> arguments) {
      throw unsupported("constant maps");
    }

    @Override
    public InterleavingResult visit(Zen.SeqMatches seqMatches,
        Map<Integer, Zen.Exp> arguments) {
      throw unsupported("sequences");
    }

    @Override
    public InterleavingResult visit(Zen.Cast cast,
        Map<Integer, Zen.Exp> arguments) {
      return visit(cast.exp, arguments);
    }
  }

  /** Computes the result of a constant; a record has a result per field,
   * and a list has the result of its element type. */
  private static class EmptyResultVisitor
      extends TypeVisitor<InterleavingResult, Void> {
    static final EmptyResultVisitor INSTANCE = new EmptyResultVisitor();

    @Override
    public InterleavingResult visit(PrimitiveType primitiveType, Void v) {
      switch (primitiveType) {
      case BIG_INTEGER:
        throw unsupported("unbounded integers");
      case CHAR:
        throw unsupported("characters");
      case REAL:
        throw unsupported("reals");
      case STRING:
        throw unsupported("strings");
      default:
        return InterleavingSet.EMPTY;
      }
    }

    @Override
    public InterleavingResult visit(
        FixedIntegerType fixedIntegerType, Void v) {
      return InterleavingSet.EMPTY;
    }

    @Override
    public InterleavingResult visit(RecordType recordType, Void v) {
      final ImmutableSortedMap.Builder<String, InterleavingResult> b =
          ImmutableSortedMap.orderedBy(RecordType.ORDERING);
      recordType.fieldTypes.forEach((name, type) ->
          b.put(name, type.accept(this, v)));
      return new InterleavingClass(b.build());
    }

    @Override
    public InterleavingResult visit(ListType listType, Void v) {
      return listType.elementType.accept(this, v);
    }

    @Override
    public InterleavingResult visit(FSeqType fseqType, Void v) {
      return fseqType.elementType.accept(this, v);
    }

    @Override
    public InterleavingResult visit(SeqType seqType, Void v) {
      throw unsupported("sequences");
    }

    @Override
    public InterleavingResult visit(MapType mapType, Void v) {
      throw unsupported("maps");
    }

    @Override
    public InterleavingResult visit(ConstMapType constMapType, Void v) {
      throw unsupported("constant maps");
    }
  }
}

// End InterleavingHeuristic.java
