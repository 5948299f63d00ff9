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
package net.hydromatic.zen.type;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;
import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Computes the default value of a type.
 *
 * <p>The default value is used to pad shapes that do not match when two
 * symbolic values are merged or compared: a list that is shorter than the
 * other, or a const map key that one side lacks.
 */
public class DefaultValueVisitor extends TypeVisitor<Object, Void> {
  private static final DefaultValueVisitor INSTANCE =
      new DefaultValueVisitor();

  private DefaultValueVisitor() {}

  /** Returns the default host value of a type. */
  public static Object defaultValue(Type type) {
    return type.accept(INSTANCE, null);
  }

  @Override
  public Object visit(PrimitiveType primitiveType, Void p) {
    switch (primitiveType) {
    case BOOL:
      return false;
    case BYTE:
      return (byte) 0;
    case SHORT:
      return (short) 0;
    case USHORT:
    case INT:
      return 0;
    case UINT:
      return UnsignedInteger.ZERO;
    case LONG:
      return 0L;
    case ULONG:
      return UnsignedLong.ZERO;
    case BIG_INTEGER:
      return BigInteger.ZERO;
    case REAL:
      return BigDecimal.ZERO;
    case CHAR:
      return '\0';
    case STRING:
      return "";
    default:
      throw new AssertionError(primitiveType);
    }
  }

  @Override
  public Object visit(FixedIntegerType fixedIntegerType, Void p) {
    return BigInteger.ZERO;
  }

  @Override
  public Object visit(RecordType recordType, Void p) {
    final ImmutableSortedMap.Builder<String, Object> b =
        ImmutableSortedMap.orderedBy(RecordType.ORDERING);
    recordType.fieldTypes.forEach((name, type) ->
        b.put(name, type.accept(this, p)));
    return b.build();
  }

  @Override
  public Object visit(ListType listType, Void p) {
    return ImmutableList.of();
  }

  @Override
  public Object visit(FSeqType fseqType, Void p) {
    return ImmutableList.of();
  }

  @Override
  public Object visit(SeqType seqType, Void p) {
    return ImmutableList.of();
  }

  @Override
  public Object visit(MapType mapType, Void p) {
    return ImmutableMap.of();
  }

  @Override
  public Object visit(ConstMapType constMapType, Void p) {
    final Object value = constMapType.valueType.accept(this, p);
    final ImmutableMap.Builder<Object, Object> b = ImmutableMap.builder();
    constMapType.keys.forEach(key -> b.put(key, value));
    return b.build();
  }
}

// End DefaultValueVisitor.java
