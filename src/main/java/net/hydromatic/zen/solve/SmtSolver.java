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

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.microsoft.z3.ArrayExpr;
import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.CharSort;
import com.microsoft.z3.Constructor;
import com.microsoft.z3.Context;
import com.microsoft.z3.DatatypeSort;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.FuncInterp;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.Lambda;
import com.microsoft.z3.Model;
import com.microsoft.z3.Optimize;
import com.microsoft.z3.Params;
import com.microsoft.z3.RatNum;
import com.microsoft.z3.ReExpr;
import com.microsoft.z3.RealExpr;
import com.microsoft.z3.SeqExpr;
import com.microsoft.z3.SeqSort;
import com.microsoft.z3.Sort;
import com.microsoft.z3.Status;
import com.microsoft.z3.enumerations.Z3_decl_kind;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.zen.ast.Regex;
import net.hydromatic.zen.ast.Zen;
import net.hydromatic.zen.type.BitvectorType;
import net.hydromatic.zen.type.MapType;
import net.hydromatic.zen.type.PrimitiveType;
import net.hydromatic.zen.type.SeqType;
import net.hydromatic.zen.type.Type;
import net.hydromatic.zen.util.Pair;
import net.hydromatic.zen.util.UnsupportedConstructException;
import net.hydromatic.zen.util.ZenException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Solver backed by the Z3 SMT solver.
 *
 * <p>A map is an array from keys to an option datatype; a key is absent if
 * the array maps it to "none". Strings are sequences of characters.
 *
 * <p>The solver owns a Z3 context, and must be closed. */
@SuppressWarnings({"unchecked", "rawtypes"})
public class SmtSolver
    implements Solver<Model, Expr<?>, BoolExpr, BitVecExpr, IntExpr,
        SeqExpr<?>, ArrayExpr<?, ?>, Expr<CharSort>, RealExpr>,
    AutoCloseable {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(SmtSolver.class);

  /** Name of this backend in error messages. */
  public static final String NAME = "smt";

  private final Context ctx;
  private final @Nullable Integer timeoutMillis;

  /** Variables, keyed by the id of the arbitrary they represent. */
  private final Map<Integer, Expr<?>> variables = new HashMap<>();

  /** Option datatypes, keyed by the sort of their value. */
  private final Map<Sort, OptionSort> optionSorts = new HashMap<>();

  public SmtSolver() {
    this(null);
  }

  /** Creates a solver.
   *
   * @param timeoutMillis Limit on the time of each query, or null
   */
  public SmtSolver(@Nullable Integer timeoutMillis) {
    this.ctx = new Context();
    this.timeoutMillis = timeoutMillis;
  }

  @Override
  public void close() {
    ctx.close();
  }

  @Override
  public String name() {
    return NAME;
  }

  private static SeqExpr<Sort> seq(Object x) {
    return (SeqExpr<Sort>) x;
  }

  private static ArrayExpr<Sort, Sort> array(Object x) {
    return (ArrayExpr<Sort, Sort>) x;
  }

  private static Expr<Sort> expr(Object x) {
    return (Expr<Sort>) x;
  }

  /** Returns the sort that represents a type. */
  Sort sort(Type type) {
    if (type.isBitvector()) {
      return ctx.mkBitVecSort(((BitvectorType) type).width());
    }
    if (type instanceof PrimitiveType) {
      switch ((PrimitiveType) type) {
      case BOOL:
        return ctx.mkBoolSort();
      case BIG_INTEGER:
        return ctx.mkIntSort();
      case REAL:
        return ctx.mkRealSort();
      case CHAR:
        return ctx.mkCharSort();
      case STRING:
        return ctx.mkStringSort();
      default:
        break;
      }
    }
    if (type instanceof SeqType) {
      return ctx.mkSeqSort(sort(((SeqType) type).elementType));
    }
    if (type instanceof MapType) {
      final MapType mapType = (MapType) type;
      return ctx.mkArraySort(sort(mapType.keyType),
          option(mapType.valueType).sort);
    }
    throw new UnsupportedConstructException(NAME, "type " + type);
  }

  private OptionSort option(Type valueType) {
    final Sort valueSort = sort(valueType);
    return optionSorts.computeIfAbsent(valueSort,
        s -> new OptionSort(ctx, s, "option" + optionSorts.size()));
  }

  private String symbol(Zen.Arbitrary e) {
    return e.name == null ? "$" + e.id : e.name + "$" + e.id;
  }

  private <E extends Expr<?>> Pair<Expr<?>, E> variable(Zen.Arbitrary e,
      Type type) {
    final Expr<?> v = variables.computeIfAbsent(e.id, id -> {
      LOGGER.debug("variable {} of type {}", symbol(e), type);
      return ctx.mkConst(symbol(e), sort(type));
    });
    return Pair.of(v, (E) v);
  }

  // booleans

  @Override
  public BoolExpr boolTrue() {
    return ctx.mkTrue();
  }

  @Override
  public BoolExpr boolFalse() {
    return ctx.mkFalse();
  }

  @Override
  public BoolExpr and(BoolExpr x, BoolExpr y) {
    return ctx.mkAnd(x, y);
  }

  @Override
  public BoolExpr or(BoolExpr x, BoolExpr y) {
    return ctx.mkOr(x, y);
  }

  @Override
  public BoolExpr not(BoolExpr x) {
    return ctx.mkNot(x);
  }

  @Override
  public BoolExpr iff(BoolExpr x, BoolExpr y) {
    return ctx.mkIff(x, y);
  }

  @Override
  public BoolExpr ite(BoolExpr guard, BoolExpr t, BoolExpr f) {
    return (BoolExpr) ctx.mkITE(guard, t, f);
  }

  // variables

  @Override
  public Pair<Expr<?>, BoolExpr> createBoolVar(Zen.Arbitrary e) {
    return variable(e, PrimitiveType.BOOL);
  }

  @Override
  public Pair<Expr<?>, BitVecExpr> createBitvecVar(Zen.Arbitrary e,
      BitvectorType type) {
    return variable(e, type);
  }

  @Override
  public Pair<Expr<?>, IntExpr> createIntegerVar(Zen.Arbitrary e) {
    return variable(e, PrimitiveType.BIG_INTEGER);
  }

  @Override
  public Pair<Expr<?>, RealExpr> createRealVar(Zen.Arbitrary e) {
    return variable(e, PrimitiveType.REAL);
  }

  @Override
  public Pair<Expr<?>, Expr<CharSort>> createCharVar(Zen.Arbitrary e) {
    return variable(e, PrimitiveType.CHAR);
  }

  @Override
  public Pair<Expr<?>, SeqExpr<?>> createSeqVar(Zen.Arbitrary e, Type type) {
    return variable(e, type);
  }

  @Override
  public Pair<Expr<?>, ArrayExpr<?, ?>> createMapVar(Zen.Arbitrary e,
      MapType type) {
    return variable(e, type);
  }

  // constants

  @Override
  public BitVecExpr bitvecConst(BitvectorType type, Object value) {
    return ctx.mkBV(type.toBits(value).toString(), type.width());
  }

  @Override
  public IntExpr integerConst(BigInteger value) {
    return ctx.mkInt(value.toString());
  }

  @Override
  public RealExpr realConst(BigDecimal value) {
    return ctx.mkReal(value.toPlainString());
  }

  @Override
  public Expr<CharSort> charConst(char value) {
    return ctx.mkNth(ctx.mkString(String.valueOf(value)), ctx.mkInt(0));
  }

  @Override
  public SeqExpr<?> seqConst(Type type, Object value) {
    if (type == PrimitiveType.STRING) {
      return ctx.mkString((String) value);
    }
    final Type elementType = ((SeqType) type).elementType;
    SeqExpr<Sort> s = ctx.mkEmptySeq(sort(type));
    for (Object element : (List<Object>) value) {
      s = ctx.mkConcat(s, ctx.mkUnit(scalar(elementType, element)));
    }
    return s;
  }

  /** Creates a constant of a type that has a single handle. */
  private Expr<Sort> scalar(Type type, Object value) {
    if (type.isBitvector()) {
      return expr(bitvecConst((BitvectorType) type, value));
    }
    switch ((PrimitiveType) type) {
    case BOOL:
      return expr(ctx.mkBool((Boolean) value));
    case BIG_INTEGER:
      return expr(integerConst((BigInteger) value));
    case REAL:
      return expr(realConst((BigDecimal) value));
    case CHAR:
      return expr(charConst((Character) value));
    case STRING:
      return expr(ctx.mkString((String) value));
    default:
      throw new AssertionError(type);
    }
  }

  @Override
  public ArrayExpr<?, ?> mapEmpty(MapType type) {
    return ctx.mkConstArray(sort(type.keyType), option(type.valueType).none);
  }

  // bit-vectors

  @Override
  public BitVecExpr bvAnd(BitVecExpr x, BitVecExpr y) {
    return ctx.mkBVAND(x, y);
  }

  @Override
  public BitVecExpr bvOr(BitVecExpr x, BitVecExpr y) {
    return ctx.mkBVOR(x, y);
  }

  @Override
  public BitVecExpr bvXor(BitVecExpr x, BitVecExpr y) {
    return ctx.mkBVXOR(x, y);
  }

  @Override
  public BitVecExpr bvNot(BitVecExpr x) {
    return ctx.mkBVNot(x);
  }

  @Override
  public BitVecExpr bvAdd(BitVecExpr x, BitVecExpr y) {
    return ctx.mkBVAdd(x, y);
  }

  @Override
  public BitVecExpr bvSubtract(BitVecExpr x, BitVecExpr y) {
    return ctx.mkBVSub(x, y);
  }

  @Override
  public BitVecExpr bvMultiply(BitVecExpr x, BitVecExpr y) {
    return ctx.mkBVMul(x, y);
  }

  @Override
  public BoolExpr bvEq(BitVecExpr x, BitVecExpr y) {
    return ctx.mkEq(x, y);
  }

  @Override
  public BoolExpr bvLeq(BitVecExpr x, BitVecExpr y, boolean signed) {
    return signed ? ctx.mkBVSLE(x, y) : ctx.mkBVULE(x, y);
  }

  @Override
  public BoolExpr bvGeq(BitVecExpr x, BitVecExpr y, boolean signed) {
    return signed ? ctx.mkBVSGE(x, y) : ctx.mkBVUGE(x, y);
  }

  @Override
  public BitVecExpr bvIte(BoolExpr guard, BitVecExpr t, BitVecExpr f) {
    return (BitVecExpr) ctx.mkITE(guard, t, f);
  }

  // unbounded integers

  @Override
  public IntExpr intAdd(IntExpr x, IntExpr y) {
    return (IntExpr) ctx.mkAdd(x, y);
  }

  @Override
  public IntExpr intSubtract(IntExpr x, IntExpr y) {
    return (IntExpr) ctx.mkSub(x, y);
  }

  @Override
  public IntExpr intMultiply(IntExpr x, IntExpr y) {
    return (IntExpr) ctx.mkMul(x, y);
  }

  @Override
  public BoolExpr intEq(IntExpr x, IntExpr y) {
    return ctx.mkEq(x, y);
  }

  @Override
  public BoolExpr intLeq(IntExpr x, IntExpr y) {
    return ctx.mkLe(x, y);
  }

  @Override
  public BoolExpr intGeq(IntExpr x, IntExpr y) {
    return ctx.mkGe(x, y);
  }

  @Override
  public IntExpr intIte(BoolExpr guard, IntExpr t, IntExpr f) {
    return (IntExpr) ctx.mkITE(guard, t, f);
  }

  // reals

  @Override
  public RealExpr realAdd(RealExpr x, RealExpr y) {
    return (RealExpr) ctx.mkAdd(x, y);
  }

  @Override
  public RealExpr realSubtract(RealExpr x, RealExpr y) {
    return (RealExpr) ctx.mkSub(x, y);
  }

  @Override
  public RealExpr realMultiply(RealExpr x, RealExpr y) {
    return (RealExpr) ctx.mkMul(x, y);
  }

  @Override
  public BoolExpr realEq(RealExpr x, RealExpr y) {
    return ctx.mkEq(x, y);
  }

  @Override
  public BoolExpr realLeq(RealExpr x, RealExpr y) {
    return ctx.mkLe(x, y);
  }

  @Override
  public BoolExpr realGeq(RealExpr x, RealExpr y) {
    return ctx.mkGe(x, y);
  }

  @Override
  public RealExpr realIte(BoolExpr guard, RealExpr t, RealExpr f) {
    return (RealExpr) ctx.mkITE(guard, t, f);
  }

  // characters

  @Override
  public BoolExpr charEq(Expr<CharSort> x, Expr<CharSort> y) {
    return ctx.mkEq(x, y);
  }

  @Override
  public BoolExpr charLeq(Expr<CharSort> x, Expr<CharSort> y) {
    return ctx.mkCharLe(x, y);
  }

  @Override
  public BoolExpr charGeq(Expr<CharSort> x, Expr<CharSort> y) {
    return ctx.mkCharLe(y, x);
  }

  @Override
  public Expr<CharSort> charIte(BoolExpr guard, Expr<CharSort> t,
      Expr<CharSort> f) {
    return ctx.mkITE(guard, t, f);
  }

  // sequences

  @Override
  public SeqExpr<?> seqUnit(Object element, Type type) {
    return ctx.mkUnit(expr(element));
  }

  @Override
  public SeqExpr<?> seqConcat(SeqExpr<?> x, SeqExpr<?> y) {
    return ctx.mkConcat(seq(x), seq(y));
  }

  @Override
  public IntExpr seqLength(SeqExpr<?> x) {
    return ctx.mkLength(seq(x));
  }

  @Override
  public SeqExpr<?> seqAt(SeqExpr<?> x, IntExpr index) {
    return ctx.mkAt(seq(x), index);
  }

  @Override
  public BoolExpr seqContains(SeqExpr<?> x, SeqExpr<?> sub) {
    return ctx.mkContains(seq(x), seq(sub));
  }

  @Override
  public BoolExpr seqStartsWith(SeqExpr<?> x, SeqExpr<?> prefix) {
    return ctx.mkPrefixOf(seq(prefix), seq(x));
  }

  @Override
  public BoolExpr seqEndsWith(SeqExpr<?> x, SeqExpr<?> suffix) {
    return ctx.mkSuffixOf(seq(suffix), seq(x));
  }

  @Override
  public IntExpr seqIndexOf(SeqExpr<?> x, SeqExpr<?> sub, IntExpr offset) {
    return ctx.mkIndexOf(seq(x), seq(sub), offset);
  }

  @Override
  public SeqExpr<?> seqSlice(SeqExpr<?> x, IntExpr offset, IntExpr length) {
    return ctx.mkExtract(seq(x), offset, length);
  }

  @Override
  public SeqExpr<?> seqReplaceFirst(SeqExpr<?> x, SeqExpr<?> source,
      SeqExpr<?> target) {
    return ctx.mkReplace(seq(x), seq(source), seq(target));
  }

  @Override
  public BoolExpr seqMatches(SeqExpr<?> x, Regex regex) {
    return ctx.mkInRe((SeqExpr<CharSort>) x, regex(regex));
  }

  private ReExpr<SeqSort<CharSort>> regex(Regex regex) {
    switch (regex.kind) {
    case EMPTY:
      // a range whose bounds are inverted matches nothing
      return ctx.mkRange(ctx.mkString("b"), ctx.mkString("a"));
    case EPSILON:
      return ctx.mkToRe(ctx.mkString(""));
    case RANGE:
      return ctx.mkRange(ctx.mkString(String.valueOf(regex.lo)),
          ctx.mkString(String.valueOf(regex.hi)));
    case CONCAT:
      return ctx.mkConcat(regex(regex.operands.get(0)),
          regex(regex.operands.get(1)));
    case UNION:
      return ctx.mkUnion(regex(regex.operands.get(0)),
          regex(regex.operands.get(1)));
    case INTERSECT:
      return ctx.mkIntersect(regex(regex.operands.get(0)),
          regex(regex.operands.get(1)));
    case STAR:
      return ctx.mkStar(regex(regex.operands.get(0)));
    case COMPLEMENT:
      return ctx.mkComplement(regex(regex.operands.get(0)));
    default:
      throw new AssertionError(regex.kind);
    }
  }

  @Override
  public BoolExpr seqEq(SeqExpr<?> x, SeqExpr<?> y) {
    return ctx.mkEq(seq(x), seq(y));
  }

  @Override
  public SeqExpr<?> seqIte(BoolExpr guard, SeqExpr<?> t, SeqExpr<?> f) {
    return (SeqExpr<?>) ctx.mkITE(guard, seq(t), seq(f));
  }

  // maps

  @Override
  public ArrayExpr<?, ?> mapSet(ArrayExpr<?, ?> map, Object key, Object value,
      MapType type) {
    return ctx.mkStore(array(map), expr(key),
        option(type.valueType).some(expr(value)));
  }

  @Override
  public ArrayExpr<?, ?> mapDelete(ArrayExpr<?, ?> map, Object key,
      MapType type) {
    return ctx.mkStore(array(map), expr(key), option(type.valueType).none);
  }

  @Override
  public Pair<BoolExpr, Object> mapGet(ArrayExpr<?, ?> map, Object key,
      MapType type) {
    final OptionSort option = option(type.valueType);
    final Expr<Sort> o = ctx.mkSelect(array(map), expr(key));
    return Pair.of(option.isSome(o), option.value(o));
  }

  @Override
  public ArrayExpr<?, ?> mapUnion(ArrayExpr<?, ?> x, ArrayExpr<?, ?> y,
      MapType type) {
    final OptionSort option = option(type.valueType);
    final Expr<Sort> k = ctx.mkFreshConst("k", sort(type.keyType));
    final Expr<Sort> xk = ctx.mkSelect(array(x), k);
    final Expr<Sort> yk = ctx.mkSelect(array(y), k);
    return ctx.mkLambda(new Expr[] {k},
        ctx.mkITE(option.isSome(xk), xk, yk));
  }

  @Override
  public ArrayExpr<?, ?> mapIntersect(ArrayExpr<?, ?> x, ArrayExpr<?, ?> y,
      MapType type) {
    final OptionSort option = option(type.valueType);
    final Expr<Sort> k = ctx.mkFreshConst("k", sort(type.keyType));
    final Expr<Sort> xk = ctx.mkSelect(array(x), k);
    final Expr<Sort> yk = ctx.mkSelect(array(y), k);
    return ctx.mkLambda(new Expr[] {k},
        ctx.mkITE(option.isSome(yk), xk, option.none));
  }

  @Override
  public BoolExpr mapEq(ArrayExpr<?, ?> x, ArrayExpr<?, ?> y) {
    return ctx.mkEq(array(x), array(y));
  }

  @Override
  public ArrayExpr<?, ?> mapIte(BoolExpr guard, ArrayExpr<?, ?> t,
      ArrayExpr<?, ?> f) {
    return (ArrayExpr<?, ?>) ctx.mkITE(guard, array(t), array(f));
  }

  // queries

  private @Nullable Params params() {
    if (timeoutMillis == null) {
      return null;
    }
    final Params params = ctx.mkParams();
    params.add("timeout", timeoutMillis);
    return params;
  }

  @Override
  public @Nullable Model satisfiable(BoolExpr x) {
    final Stopwatch stopwatch = Stopwatch.createStarted();
    final com.microsoft.z3.Solver solver = ctx.mkSolver();
    final Params params = params();
    if (params != null) {
      solver.setParameters(params);
    }
    solver.add(x);
    final Status status = solver.check();
    LOGGER.info("{} backend: {} in {}", NAME, status, stopwatch);
    switch (status) {
    case SATISFIABLE:
      return solver.getModel();
    case UNSATISFIABLE:
      return null;
    default:
      throw new ZenException("solver returned unknown: "
          + solver.getReasonUnknown());
    }
  }

  @Override
  public @Nullable Model maximize(BoolExpr x, Object objective, Type type) {
    return optimize(x, objective, type, true);
  }

  @Override
  public @Nullable Model minimize(BoolExpr x, Object objective, Type type) {
    return optimize(x, objective, type, false);
  }

  private @Nullable Model optimize(BoolExpr x, Object objective, Type type,
      boolean maximize) {
    if (!type.isBitvector()
        && type != PrimitiveType.BIG_INTEGER
        && type != PrimitiveType.REAL) {
      throw new UnsupportedConstructException(NAME,
          "optimization of " + type);
    }
    final Stopwatch stopwatch = Stopwatch.createStarted();
    final Optimize optimize = ctx.mkOptimize();
    final Params params = params();
    if (params != null) {
      optimize.setParameters(params);
    }
    optimize.Add(x);
    Expr<? extends Sort> goal = expr(objective);
    if (type.isBitvector() && ((BitvectorType) type).isSigned()) {
      // Z3 orders bit-vectors as unsigned; flipping the sign bit maps the
      // signed order onto it
      final int width = ((BitvectorType) type).width();
      goal = ctx.mkBVXOR((BitVecExpr) objective,
          ctx.mkBV(BigInteger.ONE.shiftLeft(width - 1).toString(), width));
    }
    if (maximize) {
      optimize.MkMaximize(goal);
    } else {
      optimize.MkMinimize(goal);
    }
    final Status status = optimize.Check();
    LOGGER.info("{} backend: {} {} in {}", NAME,
        maximize ? "maximize" : "minimize", status, stopwatch);
    switch (status) {
    case SATISFIABLE:
      return optimize.getModel();
    case UNSATISFIABLE:
      return null;
    default:
      throw new ZenException("optimizer returned unknown: "
          + optimize.getReasonUnknown());
    }
  }

  // model extraction

  @Override
  public Object get(Model model, Expr<?> variable, Type type) {
    if (type.isBitvector()) {
      return evaluateBitvec(model, (BitVecExpr) variable,
          (BitvectorType) type);
    }
    if (type instanceof MapType) {
      return evaluateMap(model, (ArrayExpr<?, ?>) variable, (MapType) type);
    }
    if (type instanceof SeqType || type == PrimitiveType.STRING) {
      return evaluateSeq(model, (SeqExpr<?>) variable, type);
    }
    switch ((PrimitiveType) type) {
    case BOOL:
      return evaluateBool(model, (BoolExpr) variable);
    case BIG_INTEGER:
      return evaluateInteger(model, (IntExpr) variable);
    case REAL:
      return evaluateReal(model, (RealExpr) variable);
    case CHAR:
      return evaluateChar(model, (Expr<CharSort>) variable);
    default:
      throw new AssertionError(type);
    }
  }

  @Override
  public boolean evaluateBool(Model model, BoolExpr x) {
    return model.eval(x, true).isTrue();
  }

  @Override
  public Object evaluateBitvec(Model model, BitVecExpr x,
      BitvectorType type) {
    final BitVecNum n = (BitVecNum) model.eval(x, true);
    return type.fromBits(n.getBigInteger());
  }

  @Override
  public BigInteger evaluateInteger(Model model, IntExpr x) {
    return ((IntNum) model.eval(x, true)).getBigInteger();
  }

  @Override
  public BigDecimal evaluateReal(Model model, RealExpr x) {
    final Expr<?> e = model.eval(x, true);
    if (!(e instanceof RatNum)) {
      throw new ZenException("not a rational value: " + e);
    }
    final RatNum n = (RatNum) e;
    return new BigDecimal(n.getBigIntNumerator())
        .divide(new BigDecimal(n.getBigIntDenominator()),
            MathContext.DECIMAL128);
  }

  @Override
  public char evaluateChar(Model model, Expr<CharSort> x) {
    final Expr<?> e = model.eval(x, true);
    if (e.isApp()
        && e.getFuncDecl().getDeclKind() == Z3_decl_kind.Z3_OP_CHAR_CONST) {
      // a character literal is written "(_ Char n)"
      return (char) e.getFuncDecl().getParameters()[0].getInt();
    }
    final Expr<?> s = model.eval(ctx.mkUnit(x), true);
    if (!s.isString() || s.getString().length() != 1) {
      throw new ZenException("not a character value: " + e);
    }
    return s.getString().charAt(0);
  }

  /** {@inheritDoc}
   *
   * <p>The sequence is evaluated once. A string (or a sequence of
   * characters) comes back as a string literal; any other sequence comes
   * back as a tree of units and concatenations. */
  @Override
  public Object evaluateSeq(Model model, SeqExpr<?> x, Type type) {
    final Expr<?> e = model.eval(x, true);
    if (type == PrimitiveType.STRING) {
      if (!e.isString()) {
        throw new ZenException("not a string value: " + e);
      }
      return e.getString();
    }
    final Type elementType = ((SeqType) type).elementType;
    final ImmutableList.Builder<Object> b = ImmutableList.builder();
    if (e.isString()) {
      for (char c : e.getString().toCharArray()) {
        b.add(c);
      }
      return b.build();
    }
    collectElements(model, e, elementType, b);
    return b.build();
  }

  private void collectElements(Model model, Expr<?> e, Type elementType,
      ImmutableList.Builder<Object> b) {
    if (!e.isApp()) {
      throw new ZenException("not a sequence value: " + e);
    }
    switch (e.getFuncDecl().getDeclKind()) {
    case Z3_OP_SEQ_EMPTY:
      return;
    case Z3_OP_SEQ_UNIT:
      b.add(get(model, e.getArgs()[0], elementType));
      return;
    case Z3_OP_SEQ_CONCAT:
      for (Expr<?> arg : e.getArgs()) {
        collectElements(model, arg, elementType, b);
      }
      return;
    default:
      throw new ZenException("not a sequence value: " + e);
    }
  }

  /** {@inheritDoc}
   *
   * <p>Z3 does not enumerate the keys of an array, so this method gathers
   * candidate keys from the structure of the array's value in the model,
   * and looks up each of them. */
  @Override
  public Map<Object, Object> evaluateMap(Model model, ArrayExpr<?, ?> x,
      MapType type) {
    final List<Expr<?>> keys = new ArrayList<>();
    collectKeys(model, model.eval(x, true), keys);
    final OptionSort option = option(type.valueType);
    final Map<Object, Object> map = new LinkedHashMap<>();
    for (Expr<?> key : keys) {
      final Expr<?> k = model.eval(key, true);
      if (!isValue(k)) {
        continue;
      }
      final Object hostKey = get(model, k, type.keyType);
      if (map.containsKey(hostKey)) {
        continue;
      }
      final Expr<Sort> o = ctx.mkSelect(array(x), expr(k));
      if (evaluateBool(model, option.isSome(o))) {
        map.put(hostKey, get(model, option.value(o), type.valueType));
      }
    }
    return ImmutableMap.copyOf(map);
  }

  private void collectKeys(Model model, Expr<?> e, List<Expr<?>> keys) {
    if (e instanceof Lambda) {
      collectKeys(model, ((Lambda<?>) e).getBody(), keys);
      return;
    }
    if (!e.isApp()) {
      return;
    }
    if (e.isStore()) {
      keys.add(e.getArgs()[1]);
    } else if (e.isAsArray()) {
      final FuncDecl<?> f = e.getFuncDecl().getParameters()[0].getFuncDecl();
      final FuncInterp<?> interp = model.getFuncInterp(f);
      if (interp != null) {
        for (FuncInterp.Entry<?> entry : interp.getEntries()) {
          keys.add(entry.getArgs()[0]);
        }
      }
    }
    for (Expr<?> arg : e.getArgs()) {
      collectKeys(model, arg, keys);
    }
  }

  private static boolean isValue(Expr<?> e) {
    return e.isNumeral() || e.isTrue() || e.isFalse() || e.isString()
        || e.isApp() && e.getNumArgs() == 0 && e.getSort() instanceof CharSort;
  }

  /** Option datatype for values of a given sort. */
  private static class OptionSort {
    final DatatypeSort<Object> sort;
    final Expr<Sort> none;
    private final Context ctx;
    private final FuncDecl<?> someDecl;
    private final FuncDecl<?> isSomeDecl;
    private final FuncDecl<?> valueDecl;

    OptionSort(Context ctx, Sort valueSort, String name) {
      this.ctx = ctx;
      final Constructor<Object> noneConstructor =
          ctx.mkConstructor("none_" + name, "is_none_" + name, null, null,
              null);
      final Constructor<Object> someConstructor =
          ctx.mkConstructor("some_" + name, "is_some_" + name,
              new String[] {"value_" + name}, new Sort[] {valueSort}, null);
      this.sort = ctx.mkDatatypeSort(name,
          new Constructor[] {noneConstructor, someConstructor});
      this.none = expr(ctx.mkApp(sort.getConstructors()[0]));
      this.someDecl = sort.getConstructors()[1];
      this.isSomeDecl = sort.getRecognizers()[1];
      this.valueDecl = sort.getAccessors()[1][0];
    }

    Expr<Sort> some(Expr<Sort> v) {
      return expr(ctx.mkApp(someDecl, v));
    }

    BoolExpr isSome(Expr<?> o) {
      return (BoolExpr) ctx.mkApp(isSomeDecl, o);
    }

    Expr<Sort> value(Expr<?> o) {
      return expr(ctx.mkApp(valueDecl, o));
    }
  }
}

// End SmtSolver.java
