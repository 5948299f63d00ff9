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

/** Visitor over {@link Type} objects.
 *
 * <p>The default implementations visit component types and return
 * {@code null}; sub-classes override the methods they need.
 *
 * @param <R> return type from {@code visit} methods
 * @param <P> type of the parameter passed to {@code visit} methods
 *
 * @see Type#accept(TypeVisitor, Object)
 */
public class TypeVisitor<R, P> {
  /** Visits a {@link PrimitiveType}. */
  public R visit(PrimitiveType primitiveType, P p) {
    return null;
  }

  /** Visits a {@link FixedIntegerType}. */
  public R visit(FixedIntegerType fixedIntegerType, P p) {
    return null;
  }

  /** Visits a {@link RecordType}. */
  public R visit(RecordType recordType, P p) {
    R r = null;
    for (Type type : recordType.fieldTypes.values()) {
      r = type.accept(this, p);
    }
    return r;
  }

  /** Visits a {@link ListType}. */
  public R visit(ListType listType, P p) {
    return listType.elementType.accept(this, p);
  }

  /** Visits a {@link FSeqType}. */
  public R visit(FSeqType fseqType, P p) {
    return fseqType.elementType.accept(this, p);
  }

  /** Visits a {@link SeqType}. */
  public R visit(SeqType seqType, P p) {
    return seqType.elementType.accept(this, p);
  }

  /** Visits a {@link MapType}. */
  public R visit(MapType mapType, P p) {
    mapType.keyType.accept(this, p);
    return mapType.valueType.accept(this, p);
  }

  /** Visits a {@link ConstMapType}. */
  public R visit(ConstMapType constMapType, P p) {
    constMapType.keyType.accept(this, p);
    return constMapType.valueType.accept(this, p);
  }
}

// End TypeVisitor.java
