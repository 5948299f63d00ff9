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

/** The type of a sequence value, represented natively by the solver.
 *
 * <p>Only the SMT backend supports sequences. A {@link PrimitiveType#STRING}
 * has the same representation as a sequence of {@link PrimitiveType#CHAR}. */
public class SeqType extends BaseType {
  public final Type elementType;

  private SeqType(Type elementType) {
    super(elementType.key() + " seq");
    this.elementType = requireNonNull(elementType);
  }

  /** Creates a seq type. */
  public static SeqType of(Type elementType) {
    return new SeqType(elementType);
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

// End SeqType.java
