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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;

/**
 * The type of a map whose keys are known statically.
 *
 * <p>A const map is represented symbolically as one value per key, so it
 * works with both backends. Keys are host values of {@link #keyType}, held
 * in the order they were declared.
 */
public class ConstMapType extends BaseType {
  public final Type keyType;
  public final Type valueType;
  public final ImmutableList<Object> keys;

  private ConstMapType(Type keyType, Type valueType,
      ImmutableList<Object> keys) {
    super("(" + keyType.key() + ", " + valueType.key() + ") constmap "
        + keys);
    this.keyType = requireNonNull(keyType);
    this.valueType = requireNonNull(valueType);
    this.keys = keys;
  }

  /** Creates a const map type. */
  public static ConstMapType of(Type keyType, Type valueType,
      Collection<?> keys) {
    final ImmutableList<Object> keyList =
        ImmutableSet.<Object>copyOf(keys).asList();
    checkArgument(keyList.size() == keys.size(), "duplicate keys: %s", keys);
    return new ConstMapType(keyType, valueType, keyList);
  }

  @Override
  public <R, P> R accept(TypeVisitor<R, P> visitor, P p) {
    return visitor.visit(this, p);
  }
}

// End ConstMapType.java
