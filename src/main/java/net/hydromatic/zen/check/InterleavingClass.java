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
package net.hydromatic.zen.check;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import java.util.Map;
import net.hydromatic.zen.ast.Zen;
import net.hydromatic.zen.type.RecordType;

/** Interleaving result of a record, with a result per field.
 *
 * <p>Keeping the fields apart lets a field access depend only on the
 * arbitraries of that field. */
class InterleavingClass extends InterleavingResult {
  final ImmutableSortedMap<String, InterleavingResult> fields;

  InterleavingClass(ImmutableSortedMap<String, InterleavingResult> fields) {
    this.fields = requireNonNull(fields);
  }

  /** Returns the result of a field. */
  InterleavingResult field(String name) {
    return requireNonNull(fields.get(name), name);
  }

  /** Returns a copy of this result with one field replaced. */
  InterleavingClass with(String name, InterleavingResult result) {
    final ImmutableSortedMap.Builder<String, InterleavingResult> b =
        ImmutableSortedMap.orderedBy(RecordType.ORDERING);
    fields.forEach((name2, result2) ->
        b.put(name2, name2.equals(name) ? result : result2));
    return new InterleavingClass(b.build());
  }

  @Override
  ImmutableSet<Zen.Arbitrary> variables() {
    final ImmutableSet.Builder<Zen.Arbitrary> b = ImmutableSet.builder();
    fields.values().forEach(r -> b.addAll(r.variables()));
    return b.build();
  }

  @Override
  InterleavingResult union(InterleavingResult other) {
    if (other instanceof InterleavingClass) {
      final InterleavingClass o = (InterleavingClass) other;
      final ImmutableSortedMap.Builder<String, InterleavingResult> b =
          ImmutableSortedMap.orderedBy(RecordType.ORDERING);
      for (Map.Entry<String, InterleavingResult> e : fields.entrySet()) {
        b.put(e.getKey(), e.getValue().union(o.field(e.getKey())));
      }
      return new InterleavingClass(b.build());
    }
    return new InterleavingSet(variables()).union(other);
  }

  @Override
  public String toString() {
    return fields.toString();
  }
}

// End InterleavingClass.java
