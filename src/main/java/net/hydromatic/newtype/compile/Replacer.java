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
package net.hydromatic.newtype.compile;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.newtype.ast.Ast;
import net.hydromatic.newtype.ast.Node;
import net.hydromatic.newtype.ast.Op;
import net.hydromatic.newtype.ast.Shuttle;
import net.hydromatic.newtype.util.Pair;

/** Replaces identifiers with the values they are bound to.
 *
 * <p>The context is the map of bindings in scope. When it replaces an
 * identifier, the replacer walks the copied value with an empty map, so
 * bindings never see each other. */
public class Replacer extends Shuttle<ImmutableMap<String, Node>> {
  private static final Replacer INSTANCE = new Replacer();

  private Replacer() {
  }

  /** Eliminates a "let" expression whose bindings and body are already
   * simplified, returning its body with each bound identifier replaced. */
  public static Node substitute(Ast.LetExpr letExpr) {
    return substitute(letExpr.bindings, letExpr.body);
  }

  /** Replaces each identifier in {@code body} that has an entry in
   * {@code bindings} with a copy of its value. */
  public static Node substitute(Map<String, Node> bindings, Node body) {
    if (bindings.isEmpty()) {
      return body;
    }
    return INSTANCE.walk(body, ImmutableMap.copyOf(bindings)).left;
  }

  @Override protected Pair<Node, ImmutableMap<String, Node>> pre(Node node,
      ImmutableMap<String, Node> context) {
    if (node.op() == Op.ID) {
      final Node value = context.get(node.value(Ast.Ident.class).name);
      if (value != null) {
        return Pair.of(value.deepCopy(), ImmutableMap.of());
      }
    }
    return Pair.of(node, context);
  }
}

// End Replacer.java
