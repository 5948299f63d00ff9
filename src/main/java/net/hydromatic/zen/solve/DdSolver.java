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

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.zen.ast.Regex;
import net.hydromatic.zen.ast.Zen;
import net.hydromatic.zen.type.BitvectorType;
import net.hydromatic.zen.type.MapType;
import net.hydromatic.zen.type.PrimitiveType;
import net.hydromatic.zen.type.Type;
import net.hydromatic.zen.util.Pair;
import net.hydromatic.zen.util.UnsupportedConstructException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Solver backed by binary decision diagrams.
 *
 * <p>Supports booleans and bit-vectors only. Models are assignments of
 * diagram variables. */
public class DdSolver
    implements Solver<BitSet, DdVariable, Integer, BitVector, Void, Void, Void,
        Void, Void> {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(DdSolver.class);

  /** Name of this backend in error messages. */
  public static final String NAME = "decision diagram";

  public final DdManager manager;

  /** Variables, keyed by the id of the arbitrary they represent. */
  private final Map<Integer, DdVariable> variables = new HashMap<>();

  public DdSolver() {
    this(new DdManager());
  }

  public DdSolver(DdManager manager) {
    this.manager = manager;
  }

  @Override
  public String name() {
    return NAME;
  }

  private UnsupportedConstructException unsupported(String construct) {
    return new UnsupportedConstructException(NAME, construct);
  }

  /** Uses an existing variable for an arbitrary. */
  public void setVariable(Zen.Arbitrary e, DdVariable variable) {
    variables.put(e.id, variable);
  }

  /** Returns the variable of an arbitrary, or null. */
  public @Nullable DdVariable getVariable(Zen.Arbitrary e) {
    return variables.get(e.id);
  }

  @Override
  public void init(List<List<Zen.Arbitrary>> groups) {
    for (List<Zen.Arbitrary> group : groups) {
      // One interleaved block per type; a SHORT and a USHORT in the same
      // group get separate blocks even though their widths are equal
      final Map<Type, List<Zen.Arbitrary>> buckets = new LinkedHashMap<>();
      for (Zen.Arbitrary e : group) {
        if (e.type.isBitvector() && !variables.containsKey(e.id)) {
          buckets.computeIfAbsent(e.type, t -> new ArrayList<>()).add(e);
        }
      }
      buckets.forEach((type, list) -> {
        final List<DdVariable> vars =
            manager.createVariables(list.size(),
                ((BitvectorType) type).width());
        for (int i = 0; i < list.size(); i++) {
          variables.put(list.get(i).id, vars.get(i));
        }
        LOGGER.debug("interleaved {}", list);
      });
    }
  }

  // booleans

  @Override
  public Integer boolTrue() {
    return manager.trueNode();
  }

  @Override
  public Integer boolFalse() {
    return manager.falseNode();
  }

  @Override
  public Integer and(Integer x, Integer y) {
    return manager.and(x, y);
  }

  @Override
  public Integer or(Integer x, Integer y) {
    return manager.or(x, y);
  }

  @Override
  public Integer not(Integer x) {
    return manager.not(x);
  }

  @Override
  public Integer iff(Integer x, Integer y) {
    return manager.iff(x, y);
  }

  @Override
  public Integer ite(Integer guard, Integer t, Integer f) {
    return manager.ite(guard, t, f);
  }

  // variables

  @Override
  public Pair<DdVariable, Integer> createBoolVar(Zen.Arbitrary e) {
    final DdVariable v =
        variables.computeIfAbsent(e.id, id -> manager.createBoolVariable());
    return Pair.of(v, v.node());
  }

  @Override
  public Pair<DdVariable, BitVector> createBitvecVar(Zen.Arbitrary e,
      BitvectorType type) {
    final DdVariable v = variables.computeIfAbsent(e.id, id ->
        manager.createVariables(1, type.width()).get(0));
    return Pair.of(v, v.vector);
  }

  @Override
  public Pair<DdVariable, Void> createIntegerVar(Zen.Arbitrary e) {
    throw unsupported("integer variable");
  }

  @Override
  public Pair<DdVariable, Void> createRealVar(Zen.Arbitrary e) {
    throw unsupported("real variable");
  }

  @Override
  public Pair<DdVariable, Void> createCharVar(Zen.Arbitrary e) {
    throw unsupported("char variable");
  }

  @Override
  public Pair<DdVariable, Void> createSeqVar(Zen.Arbitrary e, Type type) {
    throw unsupported("sequence variable");
  }

  @Override
  public Pair<DdVariable, Void> createMapVar(Zen.Arbitrary e, MapType type) {
    throw unsupported("map variable");
  }

  // constants

  @Override
  public BitVector bitvecConst(BitvectorType type, Object value) {
    return manager.constant(type.width(), type.toBits(value));
  }

  @Override
  public Void integerConst(BigInteger value) {
    throw unsupported("integer");
  }

  @Override
  public Void realConst(BigDecimal value) {
    throw unsupported("real");
  }

  @Override
  public Void charConst(char value) {
    throw unsupported("char");
  }

  @Override
  public Void seqConst(Type type, Object value) {
    throw unsupported("sequence");
  }

  @Override
  public Void mapEmpty(MapType type) {
    throw unsupported("map");
  }

  // bit-vectors

  @Override
  public BitVector bvAnd(BitVector x, BitVector y) {
    return manager.and(x, y);
  }

  @Override
  public BitVector bvOr(BitVector x, BitVector y) {
    return manager.or(x, y);
  }

  @Override
  public BitVector bvXor(BitVector x, BitVector y) {
    return manager.xor(x, y);
  }

  @Override
  public BitVector bvNot(BitVector x) {
    return manager.not(x);
  }

  @Override
  public BitVector bvAdd(BitVector x, BitVector y) {
    return manager.add(x, y);
  }

  @Override
  public BitVector bvSubtract(BitVector x, BitVector y) {
    return manager.subtract(x, y);
  }

  @Override
  public BitVector bvMultiply(BitVector x, BitVector y) {
    throw unsupported("multiplication");
  }

  @Override
  public Integer bvEq(BitVector x, BitVector y) {
    return manager.eq(x, y);
  }

  @Override
  public Integer bvLeq(BitVector x, BitVector y, boolean signed) {
    return manager.leq(x, y, signed);
  }

  @Override
  public Integer bvGeq(BitVector x, BitVector y, boolean signed) {
    return manager.geq(x, y, signed);
  }

  @Override
  public BitVector bvIte(Integer guard, BitVector t, BitVector f) {
    return manager.ite(guard, t, f);
  }

  // unbounded integers, reals, characters

  @Override
  public Void intAdd(Void x, Void y) {
    throw unsupported("integer addition");
  }

  @Override
  public Void intSubtract(Void x, Void y) {
    throw unsupported("integer subtraction");
  }

  @Override
  public Void intMultiply(Void x, Void y) {
    throw unsupported("multiplication");
  }

  @Override
  public Integer intEq(Void x, Void y) {
    throw unsupported("integer comparison");
  }

  @Override
  public Integer intLeq(Void x, Void y) {
    throw unsupported("integer comparison");
  }

  @Override
  public Integer intGeq(Void x, Void y) {
    throw unsupported("integer comparison");
  }

  @Override
  public Void intIte(Integer guard, Void t, Void f) {
    throw unsupported("integer");
  }

  @Override
  public Void realAdd(Void x, Void y) {
    throw unsupported("real addition");
  }

  @Override
  public Void realSubtract(Void x, Void y) {
    throw unsupported("real subtraction");
  }

  @Override
  public Void realMultiply(Void x, Void y) {
    throw unsupported("multiplication");
  }

  @Override
  public Integer realEq(Void x, Void y) {
    throw unsupported("real comparison");
  }

  @Override
  public Integer realLeq(Void x, Void y) {
    throw unsupported("real comparison");
  }

  @Override
  public Integer realGeq(Void x, Void y) {
    throw unsupported("real comparison");
  }

  @Override
  public Void realIte(Integer guard, Void t, Void f) {
    throw unsupported("real");
  }

  @Override
  public Integer charEq(Void x, Void y) {
    throw unsupported("char comparison");
  }

  @Override
  public Integer charLeq(Void x, Void y) {
    throw unsupported("char comparison");
  }

  @Override
  public Integer charGeq(Void x, Void y) {
    throw unsupported("char comparison");
  }

  @Override
  public Void charIte(Integer guard, Void t, Void f) {
    throw unsupported("char");
  }

  // sequences

  @Override
  public Void seqUnit(Object element, Type type) {
    throw unsupported("sequence");
  }

  @Override
  public Void seqConcat(Void x, Void y) {
    throw unsupported("concatenation");
  }

  @Override
  public Void seqLength(Void x) {
    throw unsupported("sequence length");
  }

  @Override
  public Void seqAt(Void x, Void index) {
    throw unsupported("sequence at");
  }

  @Override
  public Integer seqContains(Void x, Void sub) {
    throw unsupported("sequence contains");
  }

  @Override
  public Integer seqStartsWith(Void x, Void prefix) {
    throw unsupported("sequence prefix");
  }

  @Override
  public Integer seqEndsWith(Void x, Void suffix) {
    throw unsupported("sequence suffix");
  }

  @Override
  public Void seqIndexOf(Void x, Void sub, Void offset) {
    throw unsupported("sequence index");
  }

  @Override
  public Void seqSlice(Void x, Void offset, Void length) {
    throw unsupported("sequence slice");
  }

  @Override
  public Void seqReplaceFirst(Void x, Void source, Void target) {
    throw unsupported("sequence replace");
  }

  @Override
  public Integer seqMatches(Void x, Regex regex) {
    throw unsupported("regular expression");
  }

  @Override
  public Integer seqEq(Void x, Void y) {
    throw unsupported("sequence comparison");
  }

  @Override
  public Void seqIte(Integer guard, Void t, Void f) {
    throw unsupported("sequence");
  }

  // maps

  @Override
  public Void mapSet(Void map, Object key, Object value, MapType type) {
    throw unsupported("map");
  }

  @Override
  public Void mapDelete(Void map, Object key, MapType type) {
    throw unsupported("map");
  }

  @Override
  public Pair<Integer, Object> mapGet(Void map, Object key, MapType type) {
    throw unsupported("map");
  }

  @Override
  public Void mapUnion(Void x, Void y, MapType type) {
    throw unsupported("map");
  }

  @Override
  public Void mapIntersect(Void x, Void y, MapType type) {
    throw unsupported("map");
  }

  @Override
  public Integer mapEq(Void x, Void y) {
    throw unsupported("map");
  }

  @Override
  public Void mapIte(Integer guard, Void t, Void f) {
    throw unsupported("map");
  }

  // queries

  @Override
  public @Nullable BitSet satisfiable(Integer x) {
    final BitSet model = manager.satisfyingAssignment(x);
    LOGGER.info("{} backend: {}", NAME,
        model == null ? "unsatisfiable" : "satisfiable");
    return model;
  }

  @Override
  public @Nullable BitSet maximize(Integer x, Object objective, Type type) {
    throw unsupported("optimization");
  }

  @Override
  public @Nullable BitSet minimize(Integer x, Object objective, Type type) {
    throw unsupported("optimization");
  }

  // model extraction

  @Override
  public Object get(BitSet model, DdVariable variable, Type type) {
    if (type == PrimitiveType.BOOL) {
      return model.get(variable.index(0));
    }
    return ((BitvectorType) type).fromBits(manager.value(variable, model));
  }

  @Override
  public boolean evaluateBool(BitSet model, Integer x) {
    return manager.evaluate(x, model);
  }

  @Override
  public Object evaluateBitvec(BitSet model, BitVector x,
      BitvectorType type) {
    return type.fromBits(manager.value(x, model));
  }

  @Override
  public BigInteger evaluateInteger(BitSet model, Void x) {
    throw unsupported("integer");
  }

  @Override
  public BigDecimal evaluateReal(BitSet model, Void x) {
    throw unsupported("real");
  }

  @Override
  public char evaluateChar(BitSet model, Void x) {
    throw unsupported("char");
  }

  @Override
  public Object evaluateSeq(BitSet model, Void x, Type type) {
    throw unsupported("sequence");
  }

  @Override
  public Map<Object, Object> evaluateMap(BitSet model, Void x,
      MapType type) {
    throw unsupported("map");
  }

  /** Returns the variables allocated so far, in order of their ids. */
  public List<DdVariable> variables() {
    final List<Integer> ids = new ArrayList<>(variables.keySet());
    ids.sort(Integer::compare);
    final ImmutableList.Builder<DdVariable> b = ImmutableList.builder();
    ids.forEach(id -> b.add(variables.get(id)));
    return b.build();
  }
}

// End DdSolver.java
