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

import static com.google.common.base.Preconditions.checkArgument;

import java.math.BigInteger;

/**
 * Integer type of arbitrary fixed width, for example the 48-bit unsigned
 * integer of a MAC address. Host values are {@link BigInteger}.
 */
public class FixedIntegerType extends BaseType implements BitvectorType {
  private final int width;
  private final boolean signed;

  private FixedIntegerType(int width, boolean signed) {
    super((signed ? "int" : "uint") + width);
    this.width = width;
    this.signed = signed;
  }

  /** Creates a fixed-width integer type. */
  public static FixedIntegerType of(int width, boolean signed) {
    checkArgument(width > 0, "width must be positive: %s", width);
    return new FixedIntegerType(width, signed);
  }

  @Override
  public <R, P> R accept(TypeVisitor<R, P> visitor, P p) {
    return visitor.visit(this, p);
  }

  @Override
  public boolean isBitvector() {
    return true;
  }

  @Override
  public boolean isLeaf() {
    return true;
  }

  @Override
  public int width() {
    return width;
  }

  @Override
  public boolean isSigned() {
    return signed;
  }

  @Override
  public BigInteger toBits(Object value) {
    return ((BigInteger) value).and(BitvectorType.mask(width));
  }

  @Override
  public Object fromBits(BigInteger bits) {
    return signed ? BitvectorType.signed(bits, width) : bits;
  }
}

// End FixedIntegerType.java
