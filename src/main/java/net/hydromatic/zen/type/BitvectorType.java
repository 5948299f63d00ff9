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

import java.math.BigInteger;

/**
 * Type whose values are fixed-width bit-vectors.
 *
 * <p>Host values are converted to and from their bit pattern, an unsigned
 * {@link BigInteger} in the range [0, 2<sup>width</sup>).
 */
public interface BitvectorType extends Type {
  /** Number of bits. */
  int width();

  /** Whether ordered comparisons are two's complement. */
  boolean isSigned();

  /** Converts a host value to its bit pattern. */
  BigInteger toBits(Object value);

  /** Converts a bit pattern to a host value. */
  Object fromBits(BigInteger bits);

  /** Returns a mask with the lowest {@code width} bits set. */
  static BigInteger mask(int width) {
    return BigInteger.ONE.shiftLeft(width).subtract(BigInteger.ONE);
  }

  /** Interprets a bit pattern as a two's complement number. */
  static BigInteger signed(BigInteger bits, int width) {
    return bits.testBit(width - 1)
        ? bits.subtract(BigInteger.ONE.shiftLeft(width))
        : bits;
  }
}

// End BitvectorType.java
