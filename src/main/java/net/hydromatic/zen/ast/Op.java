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

/** Kinds of {@link Zen.Exp} node. */
public enum Op {
  // leaves
  CONSTANT,
  ARBITRARY,
  ARGUMENT,

  // boolean
  NOT("!", 1),
  AND(" && ", 2),
  OR(" || ", 2),

  // arithmetic and bitwise; operands are bit-vectors, unbounded integers or
  // reals
  PLUS(" + ", 2),
  MINUS(" - ", 2),
  TIMES(" * ", 2),
  BITWISE_NOT("~", 1),
  BITWISE_AND(" & ", 2),
  BITWISE_OR(" | ", 2),
  BITWISE_XOR(" ^ ", 2),

  // comparison
  EQ(" == ", 2),
  LE(" <= ", 2),
  GE(" >= ", 2),

  IF,

  // records
  CREATE_OBJECT,
  GET_FIELD,
  WITH_FIELD,

  // lists and finite sequences
  LIST_EMPTY("[]", 0),
  LIST_ADD_FRONT(" :: ", 2),
  LIST_CASE,

  // maps
  MAP_EMPTY("{}", 0),
  MAP_GET("get", 2),
  MAP_SET("set", 3),
  MAP_DELETE("delete", 2),
  MAP_UNION("union", 2),
  MAP_INTERSECT("intersect", 2),

  // const maps
  CONST_MAP_GET,
  CONST_MAP_SET,

  // sequences and strings
  SEQ_EMPTY("seq", 0),
  SEQ_UNIT("unit", 1),
  SEQ_CONCAT(" ++ ", 2),
  SEQ_LENGTH("length", 1),
  SEQ_AT("at", 2),
  SEQ_CONTAINS("contains", 2),
  SEQ_STARTS_WITH("startsWith", 2),
  SEQ_ENDS_WITH("endsWith", 2),
  SEQ_INDEX_OF("indexOf", 3),
  SEQ_SLICE("slice", 3),
  SEQ_REPLACE_FIRST("replaceFirst", 3),
  SEQ_MATCHES,

  CAST;

  /** How the operator is printed; null for nodes that have their own
   * class. */
  public final String opString;

  /** Number of operands of a {@link Zen.Call} with this operator, or -1. */
  public final int arity;

  Op() {
    this(null, -1);
  }

  Op(String opString, int arity) {
    this.opString = opString;
    this.arity = arity;
  }

  /** Whether the operator is printed between its operands. */
  public boolean isInfix() {
    return arity == 2 && opString.startsWith(" ");
  }
}

// End Op.java
