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

import static java.util.Objects.requireNonNull;

/** The type of a list value.
 *
 * <p>A list is represented symbolically as a group of guarded lists, one
 * for each length that the list can have. */
public class ListType extends BaseType {
  public final Type elementType;

  private ListType(Type elementType) {
    super(elementType.key() + " list");
    this.elementType = requireNonNull(elementType);
  }

  /** Creates a list type. */
  public static ListType of(Type elementType) {
    return new ListType(elementType);
  }

  @Override
  public <R, P> R accept(TypeVisitor<R, P> visitor, P p) {
    return visitor.visit(this, p);
  }
}

// End ListType.java
