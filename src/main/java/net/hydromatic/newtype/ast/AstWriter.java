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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Context for writing an AST out as an s-expression. */
public class AstWriter {
  private final StringBuilder b = new StringBuilder();
  private final int maxDepth;
  private int depth;

  /** Creates an AstWriter that writes every level of the tree. */
  public AstWriter() {
    this(-1);
  }

  /** Creates an AstWriter that writes "..." in place of nodes nested more
   * than {@code maxDepth} deep. A negative value means no limit. */
  public AstWriter(int maxDepth) {
    this.maxDepth = maxDepth;
  }

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node. */
  public AstWriter append(Node node) {
    if (maxDepth >= 0 && depth >= maxDepth) {
      return append("...");
    }
    ++depth;
    try {
      return node.value.unparse(this);
    } finally {
      --depth;
    }
  }

  /** Appends a space and a node, if the node is not null. */
  public AstWriter appendOpt(@Nullable Node node) {
    return node == null ? this : append(" ").append(node);
  }

  /** Appends a space and a string, if the string is not null. */
  public AstWriter appendOpt(@Nullable String s) {
    return s == null ? this : append(" ").append(s);
  }

  /** Appends each node in a list, each preceded by a space. */
  public AstWriter appendAll(Iterable<Node> nodes) {
    for (Node node : nodes) {
      append(" ").append(node);
    }
    return this;
  }

  /** Appends a string literal in double quotes. */
  public AstWriter quoted(String s) {
    b.append('"');
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
      case '"':
      case '\\':
        b.append('\\').append(c);
        break;
      case '\n':
        b.append("\\n");
        break;
      default:
        b.append(c);
      }
    }
    b.append('"');
    return this;
  }

  /** Appends a list whose elements are all nodes, e.g. "(tuple a b)". */
  public AstWriter list(String head, Node... args) {
    append("(").append(head);
    for (Node arg : args) {
      append(" ").append(arg);
    }
    return append(")");
  }

  /** Appends a list whose elements are all nodes, e.g. "(tuple a b)". */
  public AstWriter list(String head, Iterable<Node> args) {
    return append("(").append(head).appendAll(args).append(")");
  }

  @Override public String toString() {
    return b.toString();
  }
}

// End AstWriter.java
