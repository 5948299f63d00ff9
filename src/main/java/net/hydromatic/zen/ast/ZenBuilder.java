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
package net.hydromatic.zen.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.zen.type.DefaultValueVisitor.defaultValue;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
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

/** Builds expression nodes, checking the types of their operands. */
public enum ZenBuilder {
  /** The singleton instance of the builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  zen;

  private final Zen.Constant trueLiteral =
      new Zen.Constant(PrimitiveType.BOOL, true);

  private final Zen.Constant falseLiteral =
      new Zen.Constant(PrimitiveType.BOOL, false);

  // leaves

  /** Creates a constant. */
  public Zen.Constant constant(Type type, Object value) {
    checkValue(type, value);
    if (type == PrimitiveType.BOOL) {
      return boolLiteral((Boolean) value);
    }
    return new Zen.Constant(type, value);
  }

  public Zen.Constant boolLiteral(boolean b) {
    return b ? trueLiteral : falseLiteral;
  }

  public Zen.Constant byteLiteral(int b) {
    return new Zen.Constant(PrimitiveType.BYTE, (byte) b);
  }

  public Zen.Constant shortLiteral(int s) {
    return new Zen.Constant(PrimitiveType.SHORT, (short) s);
  }

  public Zen.Constant intLiteral(int i) {
    return new Zen.Constant(PrimitiveType.INT, i);
  }

  public Zen.Constant uintLiteral(long i) {
    return new Zen.Constant(PrimitiveType.UINT, UnsignedInteger.valueOf(i));
  }

  public Zen.Constant longLiteral(long l) {
    return new Zen.Constant(PrimitiveType.LONG, l);
  }

  public Zen.Constant ulongLiteral(long l) {
    return new Zen.Constant(PrimitiveType.ULONG, UnsignedLong.fromLongBits(l));
  }

  public Zen.Constant bigIntegerLiteral(long i) {
    return new Zen.Constant(PrimitiveType.BIG_INTEGER, BigInteger.valueOf(i));
  }

  public Zen.Constant realLiteral(BigDecimal d) {
    return new Zen.Constant(PrimitiveType.REAL, d);
  }

  public Zen.Constant charLiteral(char c) {
    return new Zen.Constant(PrimitiveType.CHAR, c);
  }

  public Zen.Constant stringLiteral(String s) {
    return new Zen.Constant(PrimitiveType.STRING, s);
  }

  /** Creates a free variable. Its type must be a primitive, sequence or map
   * type; use {@link #input} for other types. */
  public Zen.Arbitrary arbitrary(Type type) {
    checkArgument(type.isLeaf(), "type %s cannot be arbitrary", type);
    return new Zen.Arbitrary(type, null);
  }

  /** Creates a named free variable. */
  public Zen.Arbitrary arbitrary(Type type, String name) {
    checkArgument(type.isLeaf(), "type %s cannot be arbitrary", type);
    return new Zen.Arbitrary(type, name);
  }

  /** Creates an argument, whose value is bound by the evaluation
   * environment. */
  public Zen.Argument argument(Type type) {
    return new Zen.Argument(type);
  }

  /** Creates an expression that can take any value of a type, built from
   * arbitraries. Lists and finite sequences have up to {@code depth}
   * elements. */
  public Zen.Exp input(Type type, int depth) {
    return input(type, depth, new ArrayList<>());
  }

  /** Creates an expression that can take any value of a type, and adds the
   * arbitraries it creates to a list. */
  public Zen.Exp input(Type type, int depth,
      List<Zen.Arbitrary> arbitraries) {
    checkArgument(depth >= 0, "negative depth %s", depth);
    return type.accept(new InputGenerator(depth, arbitraries), null);
  }

  // boolean

  public Zen.Exp not(Zen.Exp e) {
    checkType(e, PrimitiveType.BOOL);
    return call(Op.NOT, PrimitiveType.BOOL, e);
  }

  public Zen.Exp and(Zen.Exp e0, Zen.Exp e1) {
    checkType(e0, PrimitiveType.BOOL);
    checkType(e1, PrimitiveType.BOOL);
    return call(Op.AND, PrimitiveType.BOOL, e0, e1);
  }

  /** Creates the conjunction of zero or more expressions. */
  public Zen.Exp and(Zen.Exp... es) {
    Zen.Exp e = trueLiteral;
    for (Zen.Exp e1 : es) {
      e = e == trueLiteral ? checkType(e1, PrimitiveType.BOOL) : and(e, e1);
    }
    return e;
  }

  public Zen.Exp or(Zen.Exp e0, Zen.Exp e1) {
    checkType(e0, PrimitiveType.BOOL);
    checkType(e1, PrimitiveType.BOOL);
    return call(Op.OR, PrimitiveType.BOOL, e0, e1);
  }

  public Zen.Exp implies(Zen.Exp e0, Zen.Exp e1) {
    return or(not(e0), e1);
  }

  // arithmetic and bitwise

  public Zen.Exp add(Zen.Exp e0, Zen.Exp e1) {
    return arithmetic(Op.PLUS, e0, e1);
  }

  public Zen.Exp subtract(Zen.Exp e0, Zen.Exp e1) {
    return arithmetic(Op.MINUS, e0, e1);
  }

  public Zen.Exp multiply(Zen.Exp e0, Zen.Exp e1) {
    return arithmetic(Op.TIMES, e0, e1);
  }

  private Zen.Exp arithmetic(Op op, Zen.Exp e0, Zen.Exp e1) {
    checkSameType(e0, e1);
    checkArgument(e0.type.isBitvector()
            || e0.type == PrimitiveType.BIG_INTEGER
            || e0.type == PrimitiveType.REAL,
        "type %s is not numeric", e0.type);
    return call(op, e0.type, e0, e1);
  }

  public Zen.Exp bitwiseNot(Zen.Exp e) {
    checkArgument(e.type.isBitvector(), "type %s is not a bit-vector",
        e.type);
    return call(Op.BITWISE_NOT, e.type, e);
  }

  public Zen.Exp bitwiseAnd(Zen.Exp e0, Zen.Exp e1) {
    return bitwise(Op.BITWISE_AND, e0, e1);
  }

  public Zen.Exp bitwiseOr(Zen.Exp e0, Zen.Exp e1) {
    return bitwise(Op.BITWISE_OR, e0, e1);
  }

  public Zen.Exp bitwiseXor(Zen.Exp e0, Zen.Exp e1) {
    return bitwise(Op.BITWISE_XOR, e0, e1);
  }

  private Zen.Exp bitwise(Op op, Zen.Exp e0, Zen.Exp e1) {
    checkSameType(e0, e1);
    checkArgument(e0.type.isBitvector(), "type %s is not a bit-vector",
        e0.type);
    return call(op, e0.type, e0, e1);
  }

  // comparison

  /** Creates an equality test; the operands may have any type. */
  public Zen.Exp eq(Zen.Exp e0, Zen.Exp e1) {
    checkSameType(e0, e1);
    return call(Op.EQ, PrimitiveType.BOOL, e0, e1);
  }

  public Zen.Exp ne(Zen.Exp e0, Zen.Exp e1) {
    return not(eq(e0, e1));
  }

  public Zen.Exp le(Zen.Exp e0, Zen.Exp e1) {
    return comparison(Op.LE, e0, e1);
  }

  public Zen.Exp ge(Zen.Exp e0, Zen.Exp e1) {
    return comparison(Op.GE, e0, e1);
  }

  public Zen.Exp lt(Zen.Exp e0, Zen.Exp e1) {
    return not(ge(e0, e1));
  }

  public Zen.Exp gt(Zen.Exp e0, Zen.Exp e1) {
    return not(le(e0, e1));
  }

  private Zen.Exp comparison(Op op, Zen.Exp e0, Zen.Exp e1) {
    checkSameType(e0, e1);
    checkArgument(e0.type.isBitvector()
            || e0.type instanceof PrimitiveType
                && ((PrimitiveType) e0.type).isOrdered(),
        "type %s is not ordered", e0.type);
    return call(op, PrimitiveType.BOOL, e0, e1);
  }

  public Zen.If ifThenElse(Zen.Exp condition, Zen.Exp ifTrue,
      Zen.Exp ifFalse) {
    checkType(condition, PrimitiveType.BOOL);
    checkSameType(ifTrue, ifFalse);
    return new Zen.If(condition, ifTrue, ifFalse);
  }

  // records

  /** Creates a record, deducing its type from the field expressions. */
  public Zen.CreateObject createObject(Map<String, ? extends Zen.Exp> fields) {
    final ImmutableSortedMap.Builder<String, Type> types =
        ImmutableSortedMap.orderedBy(RecordType.ORDERING);
    fields.forEach((name, exp) -> types.put(name, exp.type));
    return createObject(RecordType.of(types.build()), fields);
  }

  /** Creates a record of a given type. */
  public Zen.CreateObject createObject(RecordType type,
      Map<String, ? extends Zen.Exp> fields) {
    checkArgument(fields.keySet().equals(type.fieldTypes.keySet()),
        "fields %s do not match type %s", fields.keySet(), type);
    fields.forEach((name, exp) -> checkType(exp, type.fieldType(name)));
    return new Zen.CreateObject(type,
        ImmutableSortedMap.copyOf(fields, RecordType.ORDERING));
  }

  public Zen.GetField getField(Zen.Exp exp, String fieldName) {
    return new Zen.GetField(recordType(exp).fieldType(fieldName), exp,
        fieldName);
  }

  public Zen.WithField withField(Zen.Exp exp, String fieldName,
      Zen.Exp value) {
    checkType(value, recordType(exp).fieldType(fieldName));
    return new Zen.WithField(exp, fieldName, value);
  }

  /** Creates an option that has a value. */
  public Zen.CreateObject some(Zen.Exp value) {
    return createObject(RecordType.option(value.type),
        ImmutableSortedMap.of(RecordType.HAS_VALUE, trueLiteral,
            RecordType.VALUE, value));
  }

  /** Creates an option that has no value. */
  public Zen.Constant none(Type valueType) {
    final RecordType type = RecordType.option(valueType);
    return constant(type, defaultValue(type));
  }

  private static RecordType recordType(Zen.Exp exp) {
    checkArgument(exp.type instanceof RecordType, "type %s is not a record",
        exp.type);
    return (RecordType) exp.type;
  }

  // lists and finite sequences

  /** Creates an empty list or finite sequence. */
  public Zen.Exp listEmpty(Type type) {
    elementType(type);
    return call(Op.LIST_EMPTY, type);
  }

  /** Adds an element to the front of a list or finite sequence. */
  public Zen.Exp listAddFront(Zen.Exp list, Zen.Exp element) {
    checkType(element, elementType(list.type));
    return call(Op.LIST_ADD_FRONT, list.type, list, element);
  }

  /** Creates a list of the given elements. */
  public Zen.Exp list(Type type, Zen.Exp... elements) {
    Zen.Exp list = listEmpty(type);
    for (int i = elements.length - 1; i >= 0; i--) {
      list = listAddFront(list, elements[i]);
    }
    return list;
  }

  /** Creates a case split on a list or finite sequence.
   *
   * @param list List
   * @param emptyCase Value if the list is empty
   * @param consCase Function from head and tail to the value if the list is
   *                 not empty
   */
  public Zen.ListCase listCase(Zen.Exp list, Zen.Exp emptyCase,
      BiFunction<Zen.Exp, Zen.Exp, Zen.Exp> consCase) {
    return new Zen.ListCase(emptyCase.type, list, emptyCase,
        elementType(list.type), consCase);
  }

  private static Type elementType(Type type) {
    if (type instanceof ListType) {
      return ((ListType) type).elementType;
    }
    if (type instanceof FSeqType) {
      return ((FSeqType) type).elementType;
    }
    throw new IllegalArgumentException("type " + type
        + " is not a list or finite sequence");
  }

  // maps

  public Zen.Exp mapEmpty(MapType type) {
    checkMapType(type);
    return call(Op.MAP_EMPTY, type);
  }

  /** Looks up a key, returning an option. */
  public Zen.Exp mapGet(Zen.Exp map, Zen.Exp key) {
    final MapType type = mapType(map);
    checkType(key, type.keyType);
    return call(Op.MAP_GET, RecordType.option(type.valueType), map, key);
  }

  public Zen.Exp mapSet(Zen.Exp map, Zen.Exp key, Zen.Exp value) {
    final MapType type = mapType(map);
    checkType(key, type.keyType);
    checkType(value, type.valueType);
    return call(Op.MAP_SET, type, map, key, value);
  }

  public Zen.Exp mapDelete(Zen.Exp map, Zen.Exp key) {
    final MapType type = mapType(map);
    checkType(key, type.keyType);
    return call(Op.MAP_DELETE, type, map, key);
  }

  /** Combines two maps; where both have a key, the first map's value
   * wins. */
  public Zen.Exp mapUnion(Zen.Exp map0, Zen.Exp map1) {
    checkSameType(map0, map1);
    return call(Op.MAP_UNION, mapType(map0), map0, map1);
  }

  /** Restricts the first map to the keys that the second map has. */
  public Zen.Exp mapIntersect(Zen.Exp map0, Zen.Exp map1) {
    checkSameType(map0, map1);
    return call(Op.MAP_INTERSECT, mapType(map0), map0, map1);
  }

  private static MapType mapType(Zen.Exp map) {
    checkArgument(map.type instanceof MapType, "type %s is not a map",
        map.type);
    return (MapType) map.type;
  }

  private static void checkMapType(MapType type) {
    checkArgument(isScalar(type.keyType) && isScalar(type.valueType),
        "keys and values of map %s must be primitive", type);
  }

  /** Whether a type has a single solver handle. */
  private static boolean isScalar(Type type) {
    return type instanceof PrimitiveType || type instanceof FixedIntegerType;
  }

  // const maps

  /** Creates a const map in which every key has the default value. */
  public Zen.Constant constMapEmpty(ConstMapType type) {
    return constant(type, defaultValue(type));
  }

  public Zen.ConstMapGet constMapGet(Zen.Exp map, Object key) {
    checkKey(map, key);
    return new Zen.ConstMapGet(map, key);
  }

  public Zen.ConstMapSet constMapSet(Zen.Exp map, Object key,
      Zen.Exp value) {
    checkKey(map, key);
    checkType(value, ((ConstMapType) map.type).valueType);
    return new Zen.ConstMapSet(map, key, value);
  }

  private static void checkKey(Zen.Exp map, Object key) {
    checkArgument(map.type instanceof ConstMapType,
        "type %s is not a const map", map.type);
    checkArgument(((ConstMapType) map.type).keys.contains(key),
        "key %s is not declared by %s", key, map.type);
  }

  // sequences and strings

  /** Creates an empty sequence or string. */
  public Zen.Exp seqEmpty(Type type) {
    checkSeq(type);
    return call(Op.SEQ_EMPTY, type);
  }

  /** Creates a sequence of one element. */
  public Zen.Exp seqUnit(Zen.Exp element) {
    final SeqType type = SeqType.of(element.type);
    checkSeq(type);
    return call(Op.SEQ_UNIT, type, element);
  }

  public Zen.Exp concat(Zen.Exp s0, Zen.Exp s1) {
    checkSameType(s0, s1);
    checkSeq(s0.type);
    return call(Op.SEQ_CONCAT, s0.type, s0, s1);
  }

  /** Returns the length, an unbounded integer. */
  public Zen.Exp length(Zen.Exp s) {
    checkSeq(s.type);
    return call(Op.SEQ_LENGTH, PrimitiveType.BIG_INTEGER, s);
  }

  /** Returns the sub-sequence of length one at an index, or empty if the
   * index is out of range. */
  public Zen.Exp at(Zen.Exp s, Zen.Exp index) {
    checkSeq(s.type);
    checkType(index, PrimitiveType.BIG_INTEGER);
    return call(Op.SEQ_AT, s.type, s, index);
  }

  public Zen.Exp contains(Zen.Exp s, Zen.Exp sub) {
    return seqPredicate(Op.SEQ_CONTAINS, s, sub);
  }

  public Zen.Exp startsWith(Zen.Exp s, Zen.Exp prefix) {
    return seqPredicate(Op.SEQ_STARTS_WITH, s, prefix);
  }

  public Zen.Exp endsWith(Zen.Exp s, Zen.Exp suffix) {
    return seqPredicate(Op.SEQ_ENDS_WITH, s, suffix);
  }

  private Zen.Exp seqPredicate(Op op, Zen.Exp s0, Zen.Exp s1) {
    checkSameType(s0, s1);
    checkSeq(s0.type);
    return call(op, PrimitiveType.BOOL, s0, s1);
  }

  /** Returns the first index at or after {@code offset} where {@code sub}
   * occurs, or -1. */
  public Zen.Exp indexOf(Zen.Exp s, Zen.Exp sub, Zen.Exp offset) {
    checkSameType(s, sub);
    checkSeq(s.type);
    checkType(offset, PrimitiveType.BIG_INTEGER);
    return call(Op.SEQ_INDEX_OF, PrimitiveType.BIG_INTEGER, s, sub, offset);
  }

  /** Returns the sub-sequence that starts at {@code offset} and has at most
   * {@code length} elements. */
  public Zen.Exp slice(Zen.Exp s, Zen.Exp offset, Zen.Exp length) {
    checkSeq(s.type);
    checkType(offset, PrimitiveType.BIG_INTEGER);
    checkType(length, PrimitiveType.BIG_INTEGER);
    return call(Op.SEQ_SLICE, s.type, s, offset, length);
  }

  /** Replaces the first occurrence of {@code source} with
   * {@code target}. */
  public Zen.Exp replaceFirst(Zen.Exp s, Zen.Exp source, Zen.Exp target) {
    checkSameType(s, source);
    checkSameType(s, target);
    checkSeq(s.type);
    return call(Op.SEQ_REPLACE_FIRST, s.type, s, source, target);
  }

  public Zen.SeqMatches matches(Zen.Exp s, Regex regex) {
    checkType(s, PrimitiveType.STRING);
    return new Zen.SeqMatches(PrimitiveType.BOOL, s, regex);
  }

  private static void checkSeq(Type type) {
    checkArgument(type == PrimitiveType.STRING
            || type instanceof SeqType
                && isScalar(((SeqType) type).elementType),
        "type %s is not a string or sequence of primitives", type);
  }

  /** Converts between a string and a sequence of characters. */
  public Zen.Cast cast(Zen.Exp exp, Type type) {
    final SeqType chars = SeqType.of(PrimitiveType.CHAR);
    checkArgument(exp.type == PrimitiveType.STRING && type.equals(chars)
            || exp.type.equals(chars) && type == PrimitiveType.STRING,
        "cannot cast %s to %s", exp.type, type);
    return new Zen.Cast(type, exp);
  }

  // helpers

  private static Zen.Call call(Op op, Type type, Zen.Exp... args) {
    return new Zen.Call(op, type, ImmutableList.copyOf(args));
  }

  private static Zen.Exp checkType(Zen.Exp e, Type type) {
    checkArgument(e.type.equals(type), "expression %s has type %s, expected %s",
        e, e.type, type);
    return e;
  }

  private static void checkSameType(Zen.Exp e0, Zen.Exp e1) {
    checkArgument(e0.type.equals(e1.type), "type mismatch: %s vs %s",
        e0.type, e1.type);
  }

  private static void checkValue(Type type, Object value) {
    if (type instanceof PrimitiveType) {
      final Class<?> clazz;
      switch ((PrimitiveType) type) {
      case BOOL:
        clazz = Boolean.class;
        break;
      case BYTE:
        clazz = Byte.class;
        break;
      case SHORT:
        clazz = Short.class;
        break;
      case USHORT:
      case INT:
        clazz = Integer.class;
        break;
      case UINT:
        clazz = UnsignedInteger.class;
        break;
      case LONG:
        clazz = Long.class;
        break;
      case ULONG:
        clazz = UnsignedLong.class;
        break;
      case BIG_INTEGER:
        clazz = BigInteger.class;
        break;
      case REAL:
        clazz = BigDecimal.class;
        break;
      case CHAR:
        clazz = Character.class;
        break;
      default:
        clazz = String.class;
        break;
      }
      checkArgument(clazz.isInstance(value), "value %s is not a %s",
          value, type);
    } else if (type instanceof FixedIntegerType) {
      checkArgument(value instanceof BigInteger, "value %s is not a %s",
          value, type);
    } else if (type instanceof RecordType) {
      checkArgument(value instanceof Map
              && ((Map<?, ?>) value).keySet()
                  .equals(((RecordType) type).fieldTypes.keySet()),
          "value %s is not a %s", value, type);
    }
  }

  /** Generates input expressions. */
  private class InputGenerator extends TypeVisitor<Zen.Exp, Void> {
    private final int depth;
    private final List<Zen.Arbitrary> arbitraries;

    InputGenerator(int depth, List<Zen.Arbitrary> arbitraries) {
      this.depth = depth;
      this.arbitraries = arbitraries;
    }

    private Zen.Arbitrary leaf(Type type) {
      final Zen.Arbitrary arbitrary = arbitrary(type);
      arbitraries.add(arbitrary);
      return arbitrary;
    }

    @Override
    public Zen.Exp visit(PrimitiveType primitiveType, Void p) {
      return leaf(primitiveType);
    }

    @Override
    public Zen.Exp visit(FixedIntegerType fixedIntegerType, Void p) {
      return leaf(fixedIntegerType);
    }

    @Override
    public Zen.Exp visit(SeqType seqType, Void p) {
      return leaf(seqType);
    }

    @Override
    public Zen.Exp visit(MapType mapType, Void p) {
      return leaf(mapType);
    }

    @Override
    public Zen.Exp visit(RecordType recordType, Void p) {
      final ImmutableSortedMap.Builder<String, Zen.Exp> fields =
          ImmutableSortedMap.orderedBy(RecordType.ORDERING);
      recordType.fieldTypes.forEach((name, type) ->
          fields.put(name, type.accept(this, p)));
      return createObject(recordType, fields.build());
    }

    @Override
    public Zen.Exp visit(ListType listType, Void p) {
      return sequence(listType, listType.elementType);
    }

    @Override
    public Zen.Exp visit(FSeqType fseqType, Void p) {
      return sequence(fseqType, fseqType.elementType);
    }

    /** Builds "if b0 then [] else e0 :: (if b1 then [] else ...)", which
     * can have any length up to {@code depth}. */
    private Zen.Exp sequence(Type type, Type elementType) {
      Zen.Exp list = listEmpty(type);
      for (int i = 0; i < depth; i++) {
        final Zen.Exp stop = leaf(PrimitiveType.BOOL);
        final Zen.Exp element = elementType.accept(this, null);
        list = ifThenElse(stop, list, listAddFront(list, element));
      }
      return list;
    }

    @Override
    public Zen.Exp visit(ConstMapType constMapType, Void p) {
      Zen.Exp map = constMapEmpty(constMapType);
      for (Object key : constMapType.keys) {
        map = constMapSet(map, key, constMapType.valueType.accept(this, p));
      }
      return map;
    }
  }
}

// End ZenBuilder.java
