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

/**
 * The type of a map value.
 *
 * <p>A map is represented natively by the SMT solver as an array from keys
 * to optional values; the decision diagram backend does not support maps.
 */
public class MapType extends BaseType {
  public final Type keyType;
  public final Type valueType;

  private MapType(Type keyType, Type valueType) {
    super("(" + keyType.key() + ", " + valueType.key() + ") map");
    this.keyType = requireNonNull(keyType);
    this.valueType = requireNonNull(valueType);
  }

  /** Creates a map type. */
  public static MapType of(Type keyType, Type valueType) {
    return new MapType(keyType, valueType);
  }

  @Override
  public <R, P> R accept(TypeVisitor<R, P> visitor, P p) {
    return visitor.visit(this, p);
  }

  @Override
  public boolean isLeaf() {
    return true;
  }
}

// End MapType.java
