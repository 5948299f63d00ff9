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

import java.util.Arrays;
import java.util.BitSet;

/** Variable in a decision diagram: one diagram variable per bit.
 *
 * <p>A boolean variable has one bit. */
public final class DdVariable {
  private final int[] indices;
  public final BitVector vector;

  DdVariable(int[] indices, BitVector vector) {
    this.indices = indices;
    this.vector = vector;
  }

  public int width() {
    return indices.length;
  }

  /** Returns the index of the diagram variable for the {@code i}th bit. */
  public int index(int i) {
    return indices[i];
  }

  /** Returns the node of the first bit, which is the whole value of a
   * boolean variable. */
  public int node() {
    return vector.bit(0);
  }

  /** Adds the indices of this variable's diagram variables to a set. */
  public BitSet addTo(BitSet set) {
    for (int index : indices) {
      set.set(index);
    }
    return set;
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(indices);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof DdVariable
            && Arrays.equals(indices, ((DdVariable) o).indices);
  }

  @Override
  public String toString() {
    return "v" + Arrays.toString(indices);
  }
}

// End DdVariable.java
