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
package net.hydromatic.zen.util;

import static java.util.Objects.requireNonNull;

/**
 * Error thrown when a backend cannot express a construct, for example a map
 * or a multiplication under the decision diagram backend.
 *
 * <p>Backends never approximate such constructs, because the result of the
 * query would be unsound. The caller must choose another backend or
 * restructure the query.
 */
public class UnsupportedConstructException extends ZenException {
  /** Name of the backend, e.g. "decision diagram". */
  public final String backend;

  /** Description of the construct, e.g. "multiplication". */
  public final String construct;

  public UnsupportedConstructException(String backend, String construct) {
    super(
        requireNonNull(construct) + " is not supported by the "
            + requireNonNull(backend) + " backend");
    this.backend = backend;
    this.construct = construct;
  }
}

// End UnsupportedConstructException.java
