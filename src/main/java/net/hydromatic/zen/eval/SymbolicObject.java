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
package net.hydromatic.zen.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSortedMap;
import net.hydromatic.zen.solve.Solver;
import net.hydromatic.zen.type.RecordType;

/** Symbolic record: one symbolic value per field, sorted by field name. */
public class SymbolicObject<B, X, I, S, A, C, R>
    extends SymbolicValue<B, X, I, S, A, C, R> {
  public final ImmutableSortedMap<String, SymbolicValue<B, X, I, S, A, C, R>>
      fields;

  public SymbolicObject(SymbolicContext<B, X, I, S, A, C, R> context,
      RecordType type,
      ImmutableSortedMap<String, SymbolicValue<B, X, I, S, A, C, R>> fields) {
    super(context, type);
    this.fields = requireNonNull(fields);
  }

  /** Returns the value of a field. */
  public SymbolicValue<B, X, I, S, A, C, R> get(String fieldName) {
    final SymbolicValue<B, X, I, S, A, C, R> value = fields.get(fieldName);
    if (value == null) {
      throw new IllegalArgumentException("no field " + fieldName + " in "
          + type);
    }
    return value;
  }

  /** Returns a copy of this record with one field replaced. */
  public SymbolicObject<B, X, I, S, A, C, R> with(String fieldName,
      SymbolicValue<B, X, I, S, A, C, R> value) {
    get(fieldName);
    final ImmutableSortedMap.Builder<String,
        SymbolicValue<B, X, I, S, A, C, R>> b =
        ImmutableSortedMap.orderedBy(RecordType.ORDERING);
    fields.forEach((name, v) ->
        b.put(name, name.equals(fieldName) ? value : v));
    return new SymbolicObject<>(context, (RecordType) type, b.build());
  }

  @Override
  public <M> Object extract(Solver<M, ?, B, X, I, S, A, C, R> solver,
      M model) {
    final ImmutableSortedMap.Builder<String, Object> b =
        ImmutableSortedMap.orderedBy(RecordType.ORDERING);
    fields.forEach((name, v) -> b.put(name, v.extract(solver, model)));
    return b.build();
  }
}

// End SymbolicObject.java
