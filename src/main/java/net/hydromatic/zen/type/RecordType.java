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

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Ordering;
import java.util.Map;
import java.util.SortedMap;
import java.util.stream.Collectors;

/** The type of a record (object) value. Fields are sorted by name. */
public class RecordType extends BaseType {
  /** Name of the flag field of an option record. */
  public static final String HAS_VALUE = "hasValue";

  /** Name of the value field of an option record. */
  public static final String VALUE = "value";

  /** Ordering that compares integer values numerically,
   * string values lexicographically,
   * and integer values before string values.
   *
   * <p>Thus: 2, 22, 202, a, a2, a202, a22. */
  public static final Ordering<String> ORDERING =
      Ordering.from(RecordType::compareNames);

  public final SortedMap<String, Type> fieldTypes;

  private RecordType(ImmutableSortedMap<String, Type> fieldTypes) {
    super(
        fieldTypes.entrySet().stream()
            .map(e -> e.getKey() + ":" + e.getValue().key())
            .collect(Collectors.joining(", ", "{", "}")));
    this.fieldTypes = fieldTypes;
  }

  /** Creates a record type. */
  public static RecordType of(Map<String, ? extends Type> fieldTypes) {
    return new RecordType(ImmutableSortedMap.copyOf(fieldTypes, ORDERING));
  }

  /** Creates the type of an optional value: a record with a boolean
   * {@code hasValue} field and a {@code value} field. */
  public static RecordType option(Type valueType) {
    return of(ImmutableSortedMap.of(HAS_VALUE, PrimitiveType.BOOL,
        VALUE, valueType));
  }

  @Override
  public <R, P> R accept(TypeVisitor<R, P> visitor, P p) {
    return visitor.visit(this, p);
  }

  /** Returns the type of a field; throws if there is no such field. */
  public Type fieldType(String fieldName) {
    final Type type = fieldTypes.get(fieldName);
    checkArgument(type != null, "type %s has no field %s", this, fieldName);
    return type;
  }

  /** Helper for {@link #ORDERING}. */
  public static int compareNames(String o1, String o2) {
    int i1 = parseInt(o1);
    int i2 = parseInt(o2);
    int c = Integer.compare(i1, i2);
    if (c != 0) {
      return c;
    }
    return o1.compareTo(o2);
  }

  /** Parses a string that contains an integer value; returns
   * {@link Integer#MAX_VALUE} if the string does not contain an integer,
   * or if the value is less than zero,
   * or if the value is greater than or equal to 1 billion. */
  private static int parseInt(String s) {
    final int length = s.length();
    if (length > 9) {
      // Values of 1 billion or more sort as if they were Integer.MAX_VALUE,
      // so the loop below cannot overflow.
      return Integer.MAX_VALUE;
    }
    int n = 0;
    for (int i = 0; i < length; i++) {
      char c = s.charAt(i);
      if (c < '0' || c > '9') {
        return Integer.MAX_VALUE;
      }
      n = n * 10 + (c - '0');
    }
    return n;
  }
}

// End RecordType.java
