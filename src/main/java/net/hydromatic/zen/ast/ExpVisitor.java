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
package net.hydromatic.zen.ast;

/**
 * Visitor over {@link Zen.Exp} nodes.
 *
 * <p>Each kind of node calls the matching method from its
 * {@link Zen.Exp#accept} method.
 *
 * @param <R> return type from {@code visit} methods
 * @param <P> type of the parameter passed to {@code visit} methods
 */
public interface ExpVisitor<R, P> {
  R visit(Zen.Constant constant, P p);

  R visit(Zen.Arbitrary arbitrary, P p);

  R visit(Zen.Argument argument, P p);

  R visit(Zen.Call call, P p);

  R visit(Zen.If anIf, P p);

  R visit(Zen.CreateObject createObject, P p);

  R visit(Zen.GetField getField, P p);

  R visit(Zen.WithField withField, P p);

  R visit(Zen.ListCase listCase, P p);

  R visit(Zen.ConstMapGet constMapGet, P p);

  R visit(Zen.ConstMapSet constMapSet, P p);

  R visit(Zen.SeqMatches seqMatches, P p);

  R visit(Zen.Cast cast, P p);
}

// End ExpVisitor.java
