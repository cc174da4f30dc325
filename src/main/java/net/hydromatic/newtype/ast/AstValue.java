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
package net.hydromatic.newtype.ast;

import static java.util.Objects.requireNonNull;

import net.hydromatic.newtype.util.Pair;

/**
 * Value of an abstract syntax tree node.
 *
 * <p>The sub-classes, all nested in {@link Ast}, form a closed union whose
 * kind is given by {@link #op}. A value does not know its source location;
 * the {@link Node} that wraps it does.
 *
 * <p>Values are immutable, and equality is structural.
 */
public abstract class AstValue {
  public final Op op;

  AstValue(Op op) {
    this.op = requireNonNull(op);
  }

  /**
   * Converts this value into an s-expression.
   *
   * <p>The purpose of this string is debugging and test assertions; it cannot
   * be parsed.
   */
  @Override public final String toString() {
    // Marked final because you should override unparse, not toString
    return unparse(new AstWriter()).toString();
  }

  abstract AstWriter unparse(AstWriter w);

  /**
   * Accepts a shuttle, calling the {@link Shuttle#visit} method appropriate
   * to the type of this value, and returning the rebuilt node and the
   * context that flows out of it.
   *
   * @param shuttle Shuttle
   * @param node    Node that wraps this value
   * @param context Context the children of this node will see
   */
  abstract <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node, C context);
}

// End AstValue.java
