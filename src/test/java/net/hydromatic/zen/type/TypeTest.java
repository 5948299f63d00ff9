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

import static net.hydromatic.zen.type.DefaultValueVisitor.defaultValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.UnsignedInteger;
import java.math.BigDecimal;
import java.math.BigInteger;
import org.junit.jupiter.api.Test;

/** Tests for types and their default values. */
public class TypeTest {
  @Test void testPrimitiveDefaults() {
    assertThat(defaultValue(PrimitiveType.BOOL), is(false));
    assertThat(defaultValue(PrimitiveType.BYTE), is((byte) 0));
    assertThat(defaultValue(PrimitiveType.INT), is(0));
    assertThat(defaultValue(PrimitiveType.UINT), is(UnsignedInteger.ZERO));
    assertThat(defaultValue(PrimitiveType.LONG), is(0L));
    assertThat(defaultValue(PrimitiveType.BIG_INTEGER), is(BigInteger.ZERO));
    assertThat(defaultValue(PrimitiveType.REAL), is(BigDecimal.ZERO));
    assertThat(defaultValue(PrimitiveType.CHAR), is('\0'));
    assertThat(defaultValue(PrimitiveType.STRING), is(""));
    assertThat(defaultValue(FixedIntegerType.of(48, false)),
        is(BigInteger.ZERO));
  }

  @Test void testCompositeDefaults() {
    final RecordType point =
        RecordType.of(
            ImmutableMap.of("y", PrimitiveType.INT, "x", PrimitiveType.BOOL));
    assertThat(point, hasToString("{x:bool, y:int}"));
    assertThat(defaultValue(point), hasToString("{x=false, y=0}"));
    assertThat(defaultValue(ListType.of(point)), is(ImmutableList.of()));
    assertThat(defaultValue(FSeqType.of(PrimitiveType.INT)),
        is(ImmutableList.of()));
    assertThat(defaultValue(MapType.of(PrimitiveType.INT, PrimitiveType.INT)),
        is(ImmutableMap.of()));

    final ConstMapType constMapType =
        ConstMapType.of(PrimitiveType.STRING, PrimitiveType.INT,
            ImmutableList.of("a", "b"));
    assertThat(defaultValue(constMapType),
        is(ImmutableMap.of("a", 0, "b", 0)));
  }

  @Test void testOption() {
    final RecordType option = RecordType.option(PrimitiveType.SHORT);
    assertThat(option.fieldType(RecordType.HAS_VALUE),
        is(PrimitiveType.BOOL));
    assertThat(option.fieldType(RecordType.VALUE), is(PrimitiveType.SHORT));
    assertThat(defaultValue(option),
        is(ImmutableMap.of("hasValue", false, "value", (short) 0)));
    assertThrows(IllegalArgumentException.class,
        () -> option.fieldType("other"));
  }

  @Test void testTypeEquality() {
    assertThat(ListType.of(PrimitiveType.INT),
        is(ListType.of(PrimitiveType.INT)));
    assertThat(FixedIntegerType.of(48, false).equals(
        FixedIntegerType.of(48, true)), is(false));
    assertThat(ListType.of(PrimitiveType.INT).equals(
        FSeqType.of(PrimitiveType.INT)), is(false));
  }

  @Test void testBits() {
    final BitvectorType int8 = PrimitiveType.BYTE;
    assertThat(int8.toBits((byte) -1), is(BigInteger.valueOf(255)));
    assertThat(int8.fromBits(BigInteger.valueOf(255)), is((byte) -1));
    final FixedIntegerType uint4 = FixedIntegerType.of(4, false);
    assertThat(uint4.toBits(BigInteger.valueOf(17)), is(BigInteger.ONE));
    final FixedIntegerType int4 = FixedIntegerType.of(4, true);
    assertThat(int4.fromBits(BigInteger.valueOf(15)),
        is(BigInteger.valueOf(-1)));
  }
}

// End TypeTest.java
