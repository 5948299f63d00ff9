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

import com.google.common.primitives.UnsignedInteger;
import com.google.common.primitives.UnsignedLong;
import java.math.BigInteger;
import java.util.Locale;

/**
 * Primitive type.
 *
 * <p>The integer types correspond to Java's integer types, plus unsigned
 * variants. Host values of unsigned types are {@link Integer} (for
 * {@link #USHORT}), {@link UnsignedInteger} and {@link UnsignedLong}.
 */
public enum PrimitiveType implements BitvectorType {
  BOOL,
  BYTE(8, true),
  SHORT(16, true),
  USHORT(16, false),
  INT(32, true),
  UINT(32, false),
  LONG(64, true),
  ULONG(64, false),
  /** Unbounded integer; host value is {@link BigInteger}. */
  BIG_INTEGER,
  /** Real number; host value is {@link java.math.BigDecimal}. */
  REAL,
  CHAR,
  STRING;

  /** The name in the language, e.g. {@code bool}. */
  public final String moniker =
      name().toLowerCase(Locale.ROOT).replace("_", "");

  /** Number of bits, or 0 if this is not a bit-vector type. */
  private final int width;

  private final boolean signed;

  PrimitiveType() {
    this(0, false);
  }

  PrimitiveType(int width, boolean signed) {
    this.width = width;
    this.signed = signed;
  }

  @Override
  public String toString() {
    return moniker;
  }

  @Override
  public String key() {
    return moniker;
  }

  @Override
  public <R, P> R accept(TypeVisitor<R, P> visitor, P p) {
    return visitor.visit(this, p);
  }

  @Override
  public boolean isBitvector() {
    return width > 0;
  }

  @Override
  public boolean isLeaf() {
    return true;
  }

  /** Whether values of this type have an ordering that the solvers can
   * compare. */
  public boolean isOrdered() {
    return isBitvector() || this == BIG_INTEGER || this == REAL
        || this == CHAR;
  }

  /** Whether values of this type support addition, subtraction and
   * multiplication. */
  public boolean isNumeric() {
    return isBitvector() || this == BIG_INTEGER || this == REAL;
  }

  @Override
  public int width() {
    if (width == 0) {
      throw new UnsupportedOperationException(moniker);
    }
    return width;
  }

  @Override
  public boolean isSigned() {
    return signed;
  }

  @Override
  public BigInteger toBits(Object value) {
    final BigInteger i;
    switch (this) {
    case BYTE:
    case SHORT:
    case USHORT:
    case INT:
    case LONG:
      i = BigInteger.valueOf(((Number) value).longValue());
      break;
    case UINT:
      i = ((UnsignedInteger) value).bigIntegerValue();
      break;
    case ULONG:
      i = ((UnsignedLong) value).bigIntegerValue();
      break;
    default:
      throw new UnsupportedOperationException(moniker);
    }
    return i.and(BitvectorType.mask(width));
  }

  @Override
  public Object fromBits(BigInteger bits) {
    switch (this) {
    case BYTE:
      return BitvectorType.signed(bits, width).byteValue();
    case SHORT:
      return BitvectorType.signed(bits, width).shortValue();
    case USHORT:
      return bits.intValue();
    case INT:
      return BitvectorType.signed(bits, width).intValue();
    case UINT:
      return UnsignedInteger.valueOf(bits);
    case LONG:
      return BitvectorType.signed(bits, width).longValue();
    case ULONG:
      return UnsignedLong.valueOf(bits);
    default:
      throw new UnsupportedOperationException(moniker);
    }
  }
}

// End PrimitiveType.java
