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

/**
 * Type of a Zen expression.
 *
 * <p>Every expression node carries a type; the type determines the shape of
 * the expression's symbolic value and of the host value that a model
 * assigns to it.
 */
public interface Type {
  /** Description of the type, e.g. "{@code int}", "{@code int list}",
   * "{@code {a:int, b:bool}}". Two types are equal if and only if their
   * keys are equal. */
  String key();

  /** Accepts a visitor. */
  <R, P> R accept(TypeVisitor<R, P> visitor, P p);

  /** Whether values of this type are fixed-width bit-vectors. If so, this
   * type is a {@link BitvectorType}. */
  default boolean isBitvector() {
    return false;
  }

  /** Whether expressions of this type can be free variables
   * ({@link net.hydromatic.zen.ast.Zen.Arbitrary}); composite types are
   * built from arbitraries of their components instead. */
  default boolean isLeaf() {
    return false;
  }
}

// End Type.java
