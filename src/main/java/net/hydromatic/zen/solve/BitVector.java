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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Arrays;

/** Vector of decision diagram nodes, one per bit; bit 0 is the least
 * significant. */
public final class BitVector {
  private final int[] bits;

  BitVector(int[] bits) {
    checkArgument(bits.length > 0, "empty bit-vector");
    this.bits = bits;
  }

  /** Returns the number of bits. */
  public int width() {
    return bits.length;
  }

  /** Returns the node of the {@code i}th bit. */
  public int bit(int i) {
    return bits[i];
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(bits);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof BitVector
            && Arrays.equals(bits, ((BitVector) o).bits);
  }

  @Override
  public String toString() {
    return Arrays.toString(bits);
  }
}

// End BitVector.java
