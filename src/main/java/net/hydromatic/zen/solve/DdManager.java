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

import com.google.common.collect.ImmutableList;
import de.tum.in.jbdd.Bdd;
import de.tum.in.jbdd.BddFactory;
import java.math.BigInteger;
import java.util.BitSet;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Owns a binary decision diagram and builds boolean and bit-vector
 * diagrams in it.
 *
 * <p>Every node that this class returns has been referenced, and is never
 * dereferenced; a manager therefore only grows. Managers are not
 * thread-safe. */
public class DdManager {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(DdManager.class);

  private final Bdd bdd;

  public DdManager() {
    this(BddFactory.buildBdd());
  }

  DdManager(Bdd bdd) {
    this.bdd = bdd;
  }

  private int ref(int node) {
    if (node != bdd.trueNode() && node != bdd.falseNode()) {
      bdd.reference(node);
    }
    return node;
  }

  // variables

  public int numberOfVariables() {
    return bdd.numberOfVariables();
  }

  /** Returns the node that is true when a given variable is true. */
  public int variableNode(int index) {
    return bdd.variableNode(index);
  }

  /** Creates a one-bit variable. */
  public DdVariable createBoolVariable() {
    return createVariables(1, 1).get(0);
  }

  /** Creates {@code count} variables of {@code width} bits each, whose bits
   * are interleaved: the most significant bits of all variables come first
   * in the variable order, then the next bits, and so on. */
  public List<DdVariable> createVariables(int count, int width) {
    checkArgument(count >= 0 && width > 0);
    final int[][] indices = new int[count][width];
    for (int bit = width - 1; bit >= 0; bit--) {
      for (int k = 0; k < count; k++) {
        indices[k][bit] = bdd.numberOfVariables();
        bdd.createVariable();
      }
    }
    final ImmutableList.Builder<DdVariable> b = ImmutableList.builder();
    for (int k = 0; k < count; k++) {
      final int[] nodes = new int[width];
      for (int bit = 0; bit < width; bit++) {
        nodes[bit] = bdd.variableNode(indices[k][bit]);
      }
      b.add(new DdVariable(indices[k], new BitVector(nodes)));
    }
    LOGGER.debug("created {} interleaved variables of width {}; "
        + "diagram has {} variables", count, width, bdd.numberOfVariables());
    return b.build();
  }

  // booleans

  public int trueNode() {
    return bdd.trueNode();
  }

  public int falseNode() {
    return bdd.falseNode();
  }

  public boolean isTrue(int node) {
    return node == bdd.trueNode();
  }

  public boolean isFalse(int node) {
    return node == bdd.falseNode();
  }

  public int and(int x, int y) {
    return ref(bdd.and(x, y));
  }

  public int or(int x, int y) {
    return ref(bdd.or(x, y));
  }

  public int not(int x) {
    return ref(bdd.not(x));
  }

  public int xor(int x, int y) {
    return ref(bdd.xor(x, y));
  }

  public int iff(int x, int y) {
    return ref(bdd.equivalence(x, y));
  }

  public int ite(int guard, int t, int f) {
    return ref(bdd.ifThenElse(guard, t, f));
  }

  /** Existentially quantifies a set of variables. */
  public int exists(int node, BitSet variables) {
    return ref(bdd.exists(node, variables));
  }

  /** Renames variables; variables that are not keys of the map keep their
   * own names. */
  public int rename(int node, Map<Integer, Integer> renames) {
    if (renames.isEmpty()) {
      return node;
    }
    final int[] mapping = new int[bdd.numberOfVariables()];
    for (int i = 0; i < mapping.length; i++) {
      final Integer target = renames.get(i);
      mapping[i] = bdd.variableNode(target == null ? i : target);
    }
    return ref(bdd.compose(node, mapping));
  }

  /** Returns an assignment that satisfies a node, or null if the node is
   * false. Variables absent from the assignment are false. */
  public @Nullable BitSet satisfyingAssignment(int node) {
    if (node == bdd.falseNode()) {
      return null;
    }
    return bdd.getSatisfyingAssignment(node);
  }

  public boolean evaluate(int node, BitSet assignment) {
    return bdd.evaluate(node, assignment);
  }

  // bit-vectors

  /** Creates a constant bit-vector from the low {@code width} bits of a
   * value. */
  public BitVector constant(int width, BigInteger bits) {
    final int[] nodes = new int[width];
    for (int i = 0; i < width; i++) {
      nodes[i] = bits.testBit(i) ? bdd.trueNode() : bdd.falseNode();
    }
    return new BitVector(nodes);
  }

  public BitVector and(BitVector x, BitVector y) {
    final int[] nodes = new int[checkWidth(x, y)];
    for (int i = 0; i < nodes.length; i++) {
      nodes[i] = and(x.bit(i), y.bit(i));
    }
    return new BitVector(nodes);
  }

  public BitVector or(BitVector x, BitVector y) {
    final int[] nodes = new int[checkWidth(x, y)];
    for (int i = 0; i < nodes.length; i++) {
      nodes[i] = or(x.bit(i), y.bit(i));
    }
    return new BitVector(nodes);
  }

  public BitVector xor(BitVector x, BitVector y) {
    final int[] nodes = new int[checkWidth(x, y)];
    for (int i = 0; i < nodes.length; i++) {
      nodes[i] = xor(x.bit(i), y.bit(i));
    }
    return new BitVector(nodes);
  }

  public BitVector not(BitVector x) {
    final int[] nodes = new int[x.width()];
    for (int i = 0; i < nodes.length; i++) {
      nodes[i] = not(x.bit(i));
    }
    return new BitVector(nodes);
  }

  public BitVector ite(int guard, BitVector t, BitVector f) {
    final int[] nodes = new int[checkWidth(t, f)];
    for (int i = 0; i < nodes.length; i++) {
      nodes[i] = ite(guard, t.bit(i), f.bit(i));
    }
    return new BitVector(nodes);
  }

  /** Adds two bit-vectors, discarding the carry out of the top bit. */
  public BitVector add(BitVector x, BitVector y) {
    return add(x, y, bdd.falseNode());
  }

  /** Subtracts; computes {@code x + ~y + 1}. */
  public BitVector subtract(BitVector x, BitVector y) {
    return add(x, not(y), bdd.trueNode());
  }

  private BitVector add(BitVector x, BitVector y, int carryIn) {
    final int[] nodes = new int[checkWidth(x, y)];
    int carry = carryIn;
    for (int i = 0; i < nodes.length; i++) {
      final int halfSum = xor(x.bit(i), y.bit(i));
      nodes[i] = xor(halfSum, carry);
      carry = or(and(x.bit(i), y.bit(i)), and(carry, halfSum));
    }
    return new BitVector(nodes);
  }

  public int eq(BitVector x, BitVector y) {
    int r = bdd.trueNode();
    for (int i = checkWidth(x, y) - 1; i >= 0; i--) {
      r = and(r, iff(x.bit(i), y.bit(i)));
    }
    return r;
  }

  /** Returns a node that is true if {@code x <= y}. If {@code signed}, the
   * top bit is a sign bit. */
  public int leq(BitVector x, BitVector y, boolean signed) {
    final int width = checkWidth(x, y);
    int r = bdd.trueNode();
    for (int i = 0; i < width; i++) {
      int xi = x.bit(i);
      int yi = y.bit(i);
      if (signed && i == width - 1) {
        xi = not(xi);
        yi = not(yi);
      }
      // x[0..i] <= y[0..i] if bit i of x is less, or the bits are equal and
      // the lower bits compare less or equal
      r = or(and(not(xi), yi), and(iff(xi, yi), r));
    }
    return r;
  }

  public int geq(BitVector x, BitVector y, boolean signed) {
    return leq(y, x, signed);
  }

  /** Reads the bits of a variable from an assignment. */
  public BigInteger value(DdVariable variable, BitSet assignment) {
    BigInteger bits = BigInteger.ZERO;
    for (int i = 0; i < variable.width(); i++) {
      if (assignment.get(variable.index(i))) {
        bits = bits.setBit(i);
      }
    }
    return bits;
  }

  /** Evaluates each bit of a bit-vector under an assignment. */
  public BigInteger value(BitVector x, BitSet assignment) {
    BigInteger bits = BigInteger.ZERO;
    for (int i = 0; i < x.width(); i++) {
      if (bdd.evaluate(x.bit(i), assignment)) {
        bits = bits.setBit(i);
      }
    }
    return bits;
  }

  private static int checkWidth(BitVector x, BitVector y) {
    checkArgument(x.width() == y.width(), "width mismatch: %s vs %s",
        x.width(), y.width());
    return x.width();
  }
}

// End DdManager.java
