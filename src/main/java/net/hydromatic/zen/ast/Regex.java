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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;

/**
 * Regular expression over characters, for matching strings.
 *
 * <p>A regex is immutable; the SMT solver translates it into its native
 * regular expression theory.
 */
public final class Regex {
  /** Kind of regular expression. */
  public enum Kind {
    /** Matches nothing. */
    EMPTY,
    /** Matches the empty string. */
    EPSILON,
    /** Matches one character in the range [{@link #lo}, {@link #hi}]. */
    RANGE,
    CONCAT,
    UNION,
    INTERSECT,
    STAR,
    COMPLEMENT
  }

  private static final Regex EMPTY_REGEX =
      new Regex(Kind.EMPTY, '\0', '\0', ImmutableList.of());
  private static final Regex EPSILON_REGEX =
      new Regex(Kind.EPSILON, '\0', '\0', ImmutableList.of());

  public final Kind kind;
  public final char lo;
  public final char hi;
  public final ImmutableList<Regex> operands;

  private Regex(Kind kind, char lo, char hi, ImmutableList<Regex> operands) {
    this.kind = requireNonNull(kind);
    this.lo = lo;
    this.hi = hi;
    this.operands = requireNonNull(operands);
  }

  public static Regex empty() {
    return EMPTY_REGEX;
  }

  public static Regex epsilon() {
    return EPSILON_REGEX;
  }

  /** Matches a single character between {@code lo} and {@code hi},
   * inclusive. */
  public static Regex range(char lo, char hi) {
    checkArgument(lo <= hi, "empty range [%s, %s]", lo, hi);
    return new Regex(Kind.RANGE, lo, hi, ImmutableList.of());
  }

  /** Matches a single character. */
  public static Regex character(char c) {
    return range(c, c);
  }

  /** Matches exactly the given string. */
  public static Regex literal(String s) {
    Regex r = epsilon();
    for (int i = s.length() - 1; i >= 0; i--) {
      r = concat(character(s.charAt(i)), r);
    }
    return r;
  }

  public static Regex concat(Regex r0, Regex r1) {
    if (r1 == EPSILON_REGEX) {
      return r0;
    }
    if (r0 == EPSILON_REGEX) {
      return r1;
    }
    return new Regex(Kind.CONCAT, '\0', '\0', ImmutableList.of(r0, r1));
  }

  public static Regex union(Regex r0, Regex r1) {
    return new Regex(Kind.UNION, '\0', '\0', ImmutableList.of(r0, r1));
  }

  public static Regex intersect(Regex r0, Regex r1) {
    return new Regex(Kind.INTERSECT, '\0', '\0', ImmutableList.of(r0, r1));
  }

  /** Matches zero or more repetitions. */
  public static Regex star(Regex r) {
    return new Regex(Kind.STAR, '\0', '\0', ImmutableList.of(r));
  }

  /** Matches one or more repetitions. */
  public static Regex plus(Regex r) {
    return concat(r, star(r));
  }

  /** Matches zero or one occurrence. */
  public static Regex optional(Regex r) {
    return union(r, epsilon());
  }

  /** Matches every string that {@code r} does not. */
  public static Regex complement(Regex r) {
    return new Regex(Kind.COMPLEMENT, '\0', '\0', ImmutableList.of(r));
  }

  @Override
  public String toString() {
    switch (kind) {
    case EMPTY:
      return "∅";
    case EPSILON:
      return "ε";
    case RANGE:
      return lo == hi ? String.valueOf(lo) : "[" + lo + "-" + hi + "]";
    case CONCAT:
      return operands.get(0) + "" + operands.get(1);
    case UNION:
      return "(" + operands.get(0) + "|" + operands.get(1) + ")";
    case INTERSECT:
      return "(" + operands.get(0) + "&" + operands.get(1) + ")";
    case STAR:
      return "(" + operands.get(0) + ")*";
    case COMPLEMENT:
      return "~(" + operands.get(0) + ")";
    default:
      throw new AssertionError(kind);
    }
  }
}

// End Regex.java
