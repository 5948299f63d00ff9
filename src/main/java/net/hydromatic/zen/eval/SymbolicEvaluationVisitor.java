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
package net.hydromatic.zen.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import net.hydromatic.zen.ast.ExpVisitor;
import net.hydromatic.zen.ast.Op;
import net.hydromatic.zen.ast.Zen;
import net.hydromatic.zen.solve.Solver;
import net.hydromatic.zen.type.BitvectorType;
import net.hydromatic.zen.type.ConstMapType;
import net.hydromatic.zen.type.DefaultValueVisitor;
import net.hydromatic.zen.type.FSeqType;
import net.hydromatic.zen.type.FixedIntegerType;
import net.hydromatic.zen.type.ListType;
import net.hydromatic.zen.type.MapType;
import net.hydromatic.zen.type.PrimitiveType;
import net.hydromatic.zen.type.RecordType;
import net.hydromatic.zen.type.SeqType;
import net.hydromatic.zen.type.Type;
import net.hydromatic.zen.type.TypeVisitor;
import net.hydromatic.zen.util.Pair;
import net.hydromatic.zen.util.ZenException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Evaluates an expression to a symbolic value.
 *
 * <p>The visitor caches the value of each node in each environment, so a
 * node that is shared by several parents is evaluated once. Each arbitrary
 * gets one solver variable however often it is visited; the visitor
 * records the variables so that callers can read their values from a
 * model.
 *
 * <p>Both branches of an {@code if} are evaluated, and their values merged
 * under the condition. A case split on a list evaluates the non-empty case
 * once for each length that the list may have.
 *
 * <p>A visitor holds the state of one evaluation run, and must not be
 * shared between runs or threads.
 *
 * @param <M> model
 * @param <V> variable
 * @param <B> boolean formula
 * @param <X> bit-vector term
 * @param <I> unbounded integer term
 * @param <S> sequence term
 * @param <A> map term
 * @param <C> character term
 * @param <R> real term
 */
public class SymbolicEvaluationVisitor<M, V, B, X, I, S, A, C, R>
    implements ExpVisitor<SymbolicValue<B, X, I, S, A, C, R>,
        Environment<B, X, I, S, A, C, R>> {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(SymbolicEvaluationVisitor.class);

  public final Solver<M, V, B, X, I, S, A, C, R> solver;
  public final SymbolicContext<B, X, I, S, A, C, R> context;

  private final Map<Pair<Integer, Environment<B, X, I, S, A, C, R>>,
      SymbolicValue<B, X, I, S, A, C, R>> cache = new HashMap<>();
  private final Map<Integer, SymbolicValue<B, X, I, S, A, C, R>>
      arbitraryValues = new HashMap<>();
  private final Map<Zen.Arbitrary, V> arbitraryVariables =
      new LinkedHashMap<>();
  private final Map<Type, SymbolicValue<B, X, I, S, A, C, R>> defaults =
      new HashMap<>();
  private final ConstantVisitor constantVisitor = new ConstantVisitor();

  public SymbolicEvaluationVisitor(Solver<M, V, B, X, I, S, A, C, R> solver) {
    this.solver = requireNonNull(solver);
    this.context = new SymbolicContext<>(solver, this::defaultValue);
  }

  /** Evaluates an expression. */
  public SymbolicValue<B, X, I, S, A, C, R> evaluate(Zen.Exp exp,
      Environment<B, X, I, S, A, C, R> env) {
    return exp.accept(this, env);
  }

  /** Returns the variable of each arbitrary visited so far, in the order
   * they were first visited. */
  public Map<Zen.Arbitrary, V> arbitraryVariables() {
    return Collections.unmodifiableMap(arbitraryVariables);
  }

  /** Returns the symbolic value of a type's default value. */
  public SymbolicValue<B, X, I, S, A, C, R> defaultValue(Type type) {
    SymbolicValue<B, X, I, S, A, C, R> v = defaults.get(type);
    if (v == null) {
      v = constant(type, DefaultValueVisitor.defaultValue(type));
      defaults.put(type, v);
    }
    return v;
  }

  /** Returns the symbolic value of a host value. */
  public SymbolicValue<B, X, I, S, A, C, R> constant(Type type,
      Object value) {
    return type.accept(constantVisitor, value);
  }

  private SymbolicValue<B, X, I, S, A, C, R> lookupOrCompute(Zen.Exp exp,
      Environment<B, X, I, S, A, C, R> env,
      Supplier<SymbolicValue<B, X, I, S, A, C, R>> supplier) {
    final Pair<Integer, Environment<B, X, I, S, A, C, R>> key =
        Pair.of(exp.id, env);
    SymbolicValue<B, X, I, S, A, C, R> value = cache.get(key);
    if (value != null) {
      LOGGER.trace("cache hit for node {}", exp.id);
      return value;
    }
    value = supplier.get();
    cache.put(key, value);
    return value;
  }

  private SymbolicValue<B, X, I, S, A, C, R> arg(Zen.Call call, int i,
      Environment<B, X, I, S, A, C, R> env) {
    return call.arg(i).accept(this, env);
  }

  private SymbolicBool<B, X, I, S, A, C, R> bool(B b) {
    return new SymbolicBool<>(context, b);
  }

  /** Wraps the term of a value whose type has a single term. */
  @SuppressWarnings("unchecked")
  private SymbolicValue<B, X, I, S, A, C, R> wrap(Type type, Object handle) {
    if (type.isBitvector()) {
      return new SymbolicBitvec<>(context, (BitvectorType) type, (X) handle);
    }
    if (type instanceof SeqType) {
      return new SymbolicSeq<>(context, type, (S) handle);
    }
    if (type instanceof MapType) {
      return new SymbolicMap<>(context, (MapType) type, (A) handle);
    }
    switch ((PrimitiveType) type) {
    case BOOL:
      return bool((B) handle);
    case BIG_INTEGER:
      return new SymbolicInteger<>(context, (I) handle);
    case REAL:
      return new SymbolicReal<>(context, (R) handle);
    case CHAR:
      return new SymbolicChar<>(context, (C) handle);
    case STRING:
      return new SymbolicSeq<>(context, type, (S) handle);
    default:
      throw new AssertionError(type);
    }
  }

  @Override
  public SymbolicValue<B, X, I, S, A, C, R> visit(Zen.Constant constant,
      Environment<B, X, I, S, A, C, R> env) {
    return lookupOrCompute(constant, env,
        () -> constant(constant.type, constant.value));
  }

  @Override
  public SymbolicValue<B, X, I, S, A, C, R> visit(Zen.Arbitrary arbitrary,
      Environment<B, X, I, S, A, C, R> env) {
    return arbitraryValues.computeIfAbsent(arbitrary.id,
        id -> allocate(arbitrary));
  }

  private SymbolicValue<B, X, I, S, A, C, R> allocate(
      Zen.Arbitrary arbitrary) {
    final Type type = arbitrary.type;
    final Pair<V, ?> p;
    if (type.isBitvector()) {
      p = solver.createBitvecVar(arbitrary, (BitvectorType) type);
    } else if (type instanceof SeqType) {
      p = solver.createSeqVar(arbitrary, type);
    } else if (type instanceof MapType) {
      p = solver.createMapVar(arbitrary, (MapType) type);
    } else if (type instanceof PrimitiveType) {
      switch ((PrimitiveType) type) {
      case BOOL:
        p = solver.createBoolVar(arbitrary);
        break;
      case BIG_INTEGER:
        p = solver.createIntegerVar(arbitrary);
        break;
      case REAL:
        p = solver.createRealVar(arbitrary);
        break;
      case CHAR:
        p = solver.createCharVar(arbitrary);
        break;
      case STRING:
        p = solver.createSeqVar(arbitrary, type);
        break;
      default:
        throw new AssertionError(type);
      }
    } else {
      throw new IllegalArgumentException("type " + type
          + " cannot be arbitrary");
    }
    LOGGER.debug("allocated variable {} for {}", p.left, arbitrary);
    arbitraryVariables.put(arbitrary, p.left);
    return wrap(type, p.right);
  }

  @Override
  public SymbolicValue<B, X, I, S, A, C, R> visit(Zen.Argument argument,
      Environment<B, X, I, S, A, C, R> env) {
    final SymbolicValue<B, X, I, S, A, C, R> value = env.value(argument);
    if (value != null) {
      return value;
    }
    final Zen.Exp exp = env.expression(argument);
    if (exp != null) {
      return lookupOrCompute(argument, env, () -> exp.accept(this, env));
    }
    throw new ZenException("argument " + argument + " is not bound");
  }

  @Override
  public SymbolicValue<B, X, I, S, A, C, R> visit(Zen.Call call,
      Environment<B, X, I, S, A, C, R> env) {
    return lookupOrCompute(call, env, () -> call(call, env));
  }

  private SymbolicValue<B, X, I, S, A, C, R> call(Zen.Call call,
      Environment<B, X, I, S, A, C, R> env) {
    switch (call.op) {
    case NOT:
      return bool(solver.not(arg(call, 0, env).asBool().value));
    case AND:
      return bool(
          solver.and(arg(call, 0, env).asBool().value,
              arg(call, 1, env).asBool().value));
    case OR:
      return bool(
          solver.or(arg(call, 0, env).asBool().value,
              arg(call, 1, env).asBool().value));
    case PLUS:
    case MINUS:
    case TIMES:
    case BITWISE_AND:
    case BITWISE_OR:
    case BITWISE_XOR:
      return arithmetic(call, arg(call, 0, env), arg(call, 1, env));
    case BITWISE_NOT:
      return new SymbolicBitvec<>(context, (BitvectorType) call.type,
          solver.bvNot(arg(call, 0, env).asBitvec().value));
    case EQ:
      return arg(call, 0, env).eq(arg(call, 1, env));
    case LE:
      return bool(compare(true, arg(call, 0, env), arg(call, 1, env)));
    case GE:
      return bool(compare(false, arg(call, 0, env), arg(call, 1, env)));
    case LIST_EMPTY:
      if (call.type instanceof ListType) {
        return new SymbolicList<>(context, (ListType) call.type,
            GuardedListGroup.of(solver.boolTrue(), ImmutableList.of()));
      }
      return new SymbolicFSeq<>(context, (FSeqType) call.type,
          ImmutableList.of());
    case LIST_ADD_FRONT:
      final SymbolicValue<B, X, I, S, A, C, R> list = arg(call, 0, env);
      final SymbolicValue<B, X, I, S, A, C, R> element = arg(call, 1, env);
      if (call.type instanceof ListType) {
        return new SymbolicList<>(context, (ListType) call.type,
            list.asList().group.addFront(element));
      }
      return list.asFSeq().addFront(element);
    case MAP_EMPTY:
    case MAP_GET:
    case MAP_SET:
    case MAP_DELETE:
    case MAP_UNION:
    case MAP_INTERSECT:
      return map(call, env);
    default:
      return seq(call, env);
    }
  }

  private SymbolicValue<B, X, I, S, A, C, R> arithmetic(Zen.Call call,
      SymbolicValue<B, X, I, S, A, C, R> v0,
      SymbolicValue<B, X, I, S, A, C, R> v1) {
    if (call.type.isBitvector()) {
      final X x = v0.asBitvec().value;
      final X y = v1.asBitvec().value;
      final X r;
      switch (call.op) {
      case PLUS:
        r = solver.bvAdd(x, y);
        break;
      case MINUS:
        r = solver.bvSubtract(x, y);
        break;
      case TIMES:
        r = solver.bvMultiply(x, y);
        break;
      case BITWISE_AND:
        r = solver.bvAnd(x, y);
        break;
      case BITWISE_OR:
        r = solver.bvOr(x, y);
        break;
      case BITWISE_XOR:
        r = solver.bvXor(x, y);
        break;
      default:
        throw new AssertionError(call.op);
      }
      return new SymbolicBitvec<>(context, (BitvectorType) call.type, r);
    }
    if (call.type == PrimitiveType.BIG_INTEGER) {
      final I x = v0.asInteger().value;
      final I y = v1.asInteger().value;
      switch (call.op) {
      case PLUS:
        return new SymbolicInteger<>(context, solver.intAdd(x, y));
      case MINUS:
        return new SymbolicInteger<>(context, solver.intSubtract(x, y));
      case TIMES:
        return new SymbolicInteger<>(context, solver.intMultiply(x, y));
      default:
        throw new AssertionError(call.op);
      }
    }
    final R x = v0.asReal().value;
    final R y = v1.asReal().value;
    switch (call.op) {
    case PLUS:
      return new SymbolicReal<>(context, solver.realAdd(x, y));
    case MINUS:
      return new SymbolicReal<>(context, solver.realSubtract(x, y));
    case TIMES:
      return new SymbolicReal<>(context, solver.realMultiply(x, y));
    default:
      throw new AssertionError(call.op);
    }
  }

  /** Compares two ordered values; {@code x <= y} if {@code leq}, otherwise
   * {@code x >= y}. */
  private B compare(boolean leq, SymbolicValue<B, X, I, S, A, C, R> v0,
      SymbolicValue<B, X, I, S, A, C, R> v1) {
    if (v0.type.isBitvector()) {
      final boolean signed = ((BitvectorType) v0.type).isSigned();
      final X x = v0.asBitvec().value;
      final X y = v1.asBitvec().value;
      return leq ? solver.bvLeq(x, y, signed) : solver.bvGeq(x, y, signed);
    }
    switch ((PrimitiveType) v0.type) {
    case BIG_INTEGER:
      final I i0 = v0.asInteger().value;
      final I i1 = v1.asInteger().value;
      return leq ? solver.intLeq(i0, i1) : solver.intGeq(i0, i1);
    case REAL:
      final R r0 = v0.asReal().value;
      final R r1 = v1.asReal().value;
      return leq ? solver.realLeq(r0, r1) : solver.realGeq(r0, r1);
    case CHAR:
      final C c0 = v0.asChar().value;
      final C c1 = v1.asChar().value;
      return leq ? solver.charLeq(c0, c1) : solver.charGeq(c0, c1);
    default:
      throw new AssertionError(v0.type);
    }
  }

  private SymbolicValue<B, X, I, S, A, C, R> map(Zen.Call call,
      Environment<B, X, I, S, A, C, R> env) {
    if (call.op == Op.MAP_EMPTY) {
      final MapType mapType = (MapType) call.type;
      return new SymbolicMap<>(context, mapType, solver.mapEmpty(mapType));
    }
    final MapType mapType = (MapType) call.arg(0).type;
    final A map = arg(call, 0, env).asMap().value;
    switch (call.op) {
    case MAP_GET:
      final Pair<B, Object> p =
          solver.mapGet(map, arg(call, 1, env).handle(), mapType);
      final ImmutableSortedMap.Builder<String,
          SymbolicValue<B, X, I, S, A, C, R>> b =
          ImmutableSortedMap.orderedBy(RecordType.ORDERING);
      b.put(RecordType.HAS_VALUE, bool(p.left));
      b.put(RecordType.VALUE, wrap(mapType.valueType, p.right));
      return new SymbolicObject<>(context, (RecordType) call.type, b.build());
    case MAP_SET:
      return new SymbolicMap<>(context, mapType,
          solver.mapSet(map, arg(call, 1, env).handle(),
              arg(call, 2, env).handle(), mapType));
    case MAP_DELETE:
      return new SymbolicMap<>(context, mapType,
          solver.mapDelete(map, arg(call, 1, env).handle(), mapType));
    case MAP_UNION:
      return new SymbolicMap<>(context, mapType,
          solver.mapUnion(map, arg(call, 1, env).asMap().value, mapType));
    case MAP_INTERSECT:
      return new SymbolicMap<>(context, mapType,
          solver.mapIntersect(map, arg(call, 1, env).asMap().value,
              mapType));
    default:
      throw new AssertionError(call.op);
    }
  }

  private SymbolicValue<B, X, I, S, A, C, R> seq(Zen.Call call,
      Environment<B, X, I, S, A, C, R> env) {
    switch (call.op) {
    case SEQ_EMPTY:
      return new SymbolicSeq<>(context, call.type,
          solver.seqConst(call.type,
              call.type == PrimitiveType.STRING ? "" : ImmutableList.of()));
    case SEQ_UNIT:
      return new SymbolicSeq<>(context, call.type,
          solver.seqUnit(arg(call, 0, env).handle(), call.type));
    default:
      break;
    }
    final S s = arg(call, 0, env).asSeq().value;
    switch (call.op) {
    case SEQ_CONCAT:
      return new SymbolicSeq<>(context, call.type,
          solver.seqConcat(s, arg(call, 1, env).asSeq().value));
    case SEQ_LENGTH:
      return new SymbolicInteger<>(context, solver.seqLength(s));
    case SEQ_AT:
      return new SymbolicSeq<>(context, call.type,
          solver.seqAt(s, arg(call, 1, env).asInteger().value));
    case SEQ_CONTAINS:
      return bool(solver.seqContains(s, arg(call, 1, env).asSeq().value));
    case SEQ_STARTS_WITH:
      return bool(solver.seqStartsWith(s, arg(call, 1, env).asSeq().value));
    case SEQ_ENDS_WITH:
      return bool(solver.seqEndsWith(s, arg(call, 1, env).asSeq().value));
    case SEQ_INDEX_OF:
      return new SymbolicInteger<>(context,
          solver.seqIndexOf(s, arg(call, 1, env).asSeq().value,
              arg(call, 2, env).asInteger().value));
    case SEQ_SLICE:
      return new SymbolicSeq<>(context, call.type,
          solver.seqSlice(s, arg(call, 1, env).asInteger().value,
              arg(call, 2, env).asInteger().value));
    case SEQ_REPLACE_FIRST:
      return new SymbolicSeq<>(context, call.type,
          solver.seqReplaceFirst(s, arg(call, 1, env).asSeq().value,
              arg(call, 2, env).asSeq().value));
    default:
      throw new AssertionError(call.op);
    }
  }

  @Override
  public SymbolicValue<B, X, I, S, A, C, R> visit(Zen.If anIf,
      Environment<B, X, I, S, A, C, R> env) {
    return lookupOrCompute(anIf, env, () -> {
      final B guard = anIf.condition.accept(this, env).asBool().value;
      final SymbolicValue<B, X, I, S, A, C, R> t =
          anIf.ifTrue.accept(this, env);
      final SymbolicValue<B, X, I, S, A, C, R> f =
          anIf.ifFalse.accept(this, env);
      return t.merge(guard, f);
    });
  }

  @Override
  public SymbolicValue<B, X, I, S, A, C, R> visit(
      Zen.CreateObject createObject, Environment<B, X, I, S, A, C, R> env) {
    return lookupOrCompute(createObject, env, () -> {
      final ImmutableSortedMap.Builder<String,
          SymbolicValue<B, X, I, S, A, C, R>> b =
          ImmutableSortedMap.orderedBy(RecordType.ORDERING);
      createObject.fields.forEach((name, exp) ->
          b.put(name, exp.accept(this, env)));
      return new SymbolicObject<>(context, (RecordType) createObject.type,
          b.build());
    });
  }

  @Override
  public SymbolicValue<B, X, I, S, A, C, R> visit(Zen.GetField getField,
      Environment<B, X, I, S, A, C, R> env) {
    return lookupOrCompute(getField, env, () ->
        getField.exp.accept(this, env).asObject().get(getField.fieldName));
  }

  @Override
  public SymbolicValue<B, X, I, S, A, C, R> visit(Zen.WithField withField,
      Environment<B, X, I, S, A, C, R> env) {
    return lookupOrCompute(withField, env, () ->
        withField.exp.accept(this, env).asObject()
            .with(withField.fieldName, withField.value.accept(this, env)));
  }

  @Override
  public SymbolicValue<B, X, I, S, A, C, R> visit(Zen.ListCase listCase,
      Environment<B, X, I, S, A, C, R> env) {
    return lookupOrCompute(listCase, env, () -> {
      final SymbolicValue<B, X, I, S, A, C, R> list =
          listCase.list.accept(this, env);
      if (list.type instanceof FSeqType) {
        return fseqCase(listCase, list.asFSeq(), env);
      }
      return listCase(listCase, list.asList(), env);
    });
  }

  private SymbolicValue<B, X, I, S, A, C, R> listCase(Zen.ListCase listCase,
      SymbolicList<B, X, I, S, A, C, R> list,
      Environment<B, X, I, S, A, C, R> env) {
    SymbolicValue<B, X, I, S, A, C, R> result = null;
    for (GuardedList<B, X, I, S, A, C, R> guardedList
        : list.group.lists.values()) {
      final ImmutableList<SymbolicValue<B, X, I, S, A, C, R>> values =
          guardedList.values;
      final SymbolicValue<B, X, I, S, A, C, R> r;
      if (values.isEmpty()) {
        r = listCase.emptyCase.accept(this, env);
      } else {
        // Bind the head, and the tail as a list of known length
        final SymbolicList<B, X, I, S, A, C, R> tail =
            new SymbolicList<>(context, (ListType) list.type,
                GuardedListGroup.of(solver.boolTrue(),
                    values.subList(1, values.size())));
        r = listCase.consCase().accept(this,
            env.bind(listCase.head, values.get(0), listCase.tail, tail));
      }
      result = result == null ? r : r.merge(guardedList.guard, result);
    }
    return requireNonNull(result);
  }

  /** Case split on a finite sequence. The head is the first slot in use;
   * the sequence is empty if no slot is in use. */
  private SymbolicValue<B, X, I, S, A, C, R> fseqCase(Zen.ListCase listCase,
      SymbolicFSeq<B, X, I, S, A, C, R> fseq,
      Environment<B, X, I, S, A, C, R> env) {
    final List<Pair<B, SymbolicValue<B, X, I, S, A, C, R>>> slots =
        fseq.elements;
    B noneBefore = solver.boolTrue();
    SymbolicValue<B, X, I, S, A, C, R> result = null;
    for (int i = 0; i < slots.size(); i++) {
      final Pair<B, SymbolicValue<B, X, I, S, A, C, R>> slot = slots.get(i);
      final B guard = solver.and(noneBefore, slot.left);
      final SymbolicFSeq<B, X, I, S, A, C, R> tail =
          new SymbolicFSeq<>(context, (FSeqType) fseq.type,
              fseq.elements.subList(i + 1, slots.size()));
      final SymbolicValue<B, X, I, S, A, C, R> r =
          listCase.consCase().accept(this,
              env.bind(listCase.head, slot.right, listCase.tail, tail));
      result = result == null ? r : r.merge(guard, result);
      noneBefore = solver.and(noneBefore, solver.not(slot.left));
    }
    final SymbolicValue<B, X, I, S, A, C, R> r =
        listCase.emptyCase.accept(this, env);
    return result == null ? r : r.merge(noneBefore, result);
  }

  @Override
  public SymbolicValue<B, X, I, S, A, C, R> visit(
      Zen.ConstMapGet constMapGet, Environment<B, X, I, S, A, C, R> env) {
    return lookupOrCompute(constMapGet, env, () ->
        constMapGet.map.accept(this, env).asConstMap().get(constMapGet.key));
  }

  @Override
  public SymbolicValue<B, X, I, S, A, C, R> visit(
      Zen.ConstMapSet constMapSet, Environment<B, X, I, S, A, C, R> env) {
    return lookupOrCompute(constMapSet, env, () ->
        constMapSet.map.accept(this, env).asConstMap()
            .with(constMapSet.key, constMapSet.value.accept(this, env)));
  }

  @Override
  public SymbolicValue<B, X, I, S, A, C, R> visit(Zen.SeqMatches seqMatches,
      Environment<B, X, I, S, A, C, R> env) {
    return lookupOrCompute(seqMatches, env, () ->
        bool(
            solver.seqMatches(seqMatches.seq.accept(this, env).asSeq().value,
                seqMatches.regex)));
  }

  /** {@inheritDoc}
   *
   * <p>A string and a sequence of characters have the same term. */
  @Override
  public SymbolicValue<B, X, I, S, A, C, R> visit(Zen.Cast cast,
      Environment<B, X, I, S, A, C, R> env) {
    return lookupOrCompute(cast, env, () ->
        new SymbolicSeq<>(context, cast.type,
            cast.exp.accept(this, env).asSeq().value));
  }

  /** Converts host values to symbolic values. */
  private class ConstantVisitor
      extends TypeVisitor<SymbolicValue<B, X, I, S, A, C, R>, Object> {
    @Override
    public SymbolicValue<B, X, I, S, A, C, R> visit(
        PrimitiveType primitiveType, Object value) {
      if (primitiveType.isBitvector()) {
        return new SymbolicBitvec<>(context, primitiveType,
            solver.bitvecConst(primitiveType, value));
      }
      switch (primitiveType) {
      case BOOL:
        return bool(solver.boolConst((Boolean) value));
      case BIG_INTEGER:
        return new SymbolicInteger<>(context,
            solver.integerConst((BigInteger) value));
      case REAL:
        return new SymbolicReal<>(context,
            solver.realConst((BigDecimal) value));
      case CHAR:
        return new SymbolicChar<>(context,
            solver.charConst((Character) value));
      case STRING:
        return new SymbolicSeq<>(context, primitiveType,
            solver.seqConst(primitiveType, value));
      default:
        throw new AssertionError(primitiveType);
      }
    }

    @Override
    public SymbolicValue<B, X, I, S, A, C, R> visit(
        FixedIntegerType fixedIntegerType, Object value) {
      return new SymbolicBitvec<>(context, fixedIntegerType,
          solver.bitvecConst(fixedIntegerType, value));
    }

    @Override
    public SymbolicValue<B, X, I, S, A, C, R> visit(RecordType recordType,
        Object value) {
      final Map<?, ?> map = (Map<?, ?>) value;
      final ImmutableSortedMap.Builder<String,
          SymbolicValue<B, X, I, S, A, C, R>> b =
          ImmutableSortedMap.orderedBy(RecordType.ORDERING);
      recordType.fieldTypes.forEach((name, type) ->
          b.put(name, type.accept(this, requireNonNull(map.get(name)))));
      return new SymbolicObject<>(context, recordType, b.build());
    }

    @Override
    public SymbolicValue<B, X, I, S, A, C, R> visit(ListType listType,
        Object value) {
      return new SymbolicList<>(context, listType,
          GuardedListGroup.of(solver.boolTrue(),
              elements(listType.elementType, value)));
    }

    @Override
    public SymbolicValue<B, X, I, S, A, C, R> visit(FSeqType fseqType,
        Object value) {
      final ImmutableList.Builder<Pair<B, SymbolicValue<B, X, I, S, A, C, R>>>
          b = ImmutableList.builder();
      elements(fseqType.elementType, value).forEach(v ->
          b.add(Pair.of(solver.boolTrue(), v)));
      return new SymbolicFSeq<>(context, fseqType, b.build());
    }

    private ImmutableList<SymbolicValue<B, X, I, S, A, C, R>> elements(
        Type elementType, Object value) {
      final ImmutableList.Builder<SymbolicValue<B, X, I, S, A, C, R>> b =
          ImmutableList.builder();
      for (Object element : (List<?>) value) {
        b.add(elementType.accept(this, element));
      }
      return b.build();
    }

    @Override
    public SymbolicValue<B, X, I, S, A, C, R> visit(SeqType seqType,
        Object value) {
      return new SymbolicSeq<>(context, seqType,
          solver.seqConst(seqType, value));
    }

    @Override
    public SymbolicValue<B, X, I, S, A, C, R> visit(MapType mapType,
        Object value) {
      A map = solver.mapEmpty(mapType);
      for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
        map = solver.mapSet(map,
            mapType.keyType.accept(this, e.getKey()).handle(),
            mapType.valueType.accept(this, e.getValue()).handle(),
            mapType);
      }
      return new SymbolicMap<>(context, mapType, map);
    }

    @Override
    public SymbolicValue<B, X, I, S, A, C, R> visit(
        ConstMapType constMapType, Object value) {
      final Map<?, ?> map = (Map<?, ?>) value;
      final ImmutableMap.Builder<Object, SymbolicValue<B, X, I, S, A, C, R>>
          b = ImmutableMap.builder();
      for (Object key : constMapType.keys) {
        final Object v = map.get(key);
        b.put(key,
            v == null
                ? defaultValue(constMapType.valueType)
                : constMapType.valueType.accept(this, v));
      }
      return new SymbolicConstMap<>(context, constMapType, b.build());
    }
  }
}

// End SymbolicEvaluationVisitor.java
