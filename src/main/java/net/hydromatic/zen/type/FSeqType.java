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

/** The type of a finite sequence value.
 *
 * <p>A finite sequence is represented symbolically as a sequence of
 * elements, each guarded by a flag that says whether it is present. */
public class FSeqType extends BaseType {
  public final Type elementType;

  private FSeqType(Type elementType) {
    super(elementType.key() + " fseq");
    this.elementType = requireNonNull(elementType);
  }

  /** Creates a fseq type. */
  public static FSeqType of(Type elementType) {
    return new FSeqType(elementType);
  }

  @Override
  public <R, P> R accept(TypeVisitor<R, P> visitor, P p) {
    return visitor.visit(this, p);
  }
}

// End FSeqType.java
