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

import java.util.function.UnaryOperator;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Abstract syntax tree node: a value and the span of source text it came
 * from.
 *
 * <p>A node with a null {@link #span} is <em>generated</em>: it was created
 * by a compiler pass, not by the parser. The span records provenance, so
 * {@link #map} and {@link #replace} keep it and a pass that builds a new
 * construct uses {@link #generate}.
 *
 * <p>Nodes are immutable. Equality is structural, and compares values only.
 */
public final class Node {
  public final @Nullable Span span;
  public final AstValue value;

  private Node(@Nullable Span span, AstValue value) {
    this.span = span;
    this.value = requireNonNull(value);
  }

  /** Creates a node from a value and the span it was parsed from. */
  public static Node of(Span span, AstValue value) {
    return new Node(requireNonNull(span, "span"), value);
  }

  /** Creates a generated node, which has no span. */
  public static Node generate(AstValue value) {
    return new Node(null, value);
  }

  /** Returns a node with the same span and a value computed from this
   * node's value. */
  public Node map(UnaryOperator<AstValue> f) {
    return new Node(span, f.apply(value));
  }

  /** Returns a node with the same span and a different value. */
  public Node replace(AstValue value) {
    return new Node(span, value);
  }

  /** Returns whether this node was created by a pass rather than parsed. */
  public boolean isGenerated() {
    return span == null;
  }

  /** Returns the kind of this node's value. */
  public Op op() {
    return value.op;
  }

  /** Returns this node's value cast to a given type. */
  public <V extends AstValue> V value(Class<V> valueClass) {
    return valueClass.cast(value);
  }

  /** Returns a copy of this tree in which every node is a new object.
   *
   * <p>Spans are kept, and the copy is equal to this tree. */
  public Node deepCopy() {
    return Shuttle.transform(this, node -> node.replace(node.value));
  }

  @Override public int hashCode() {
    return value.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Node
        && value.equals(((Node) o).value);
  }

  /** Converts this node into an s-expression. */
  @Override public String toString() {
    return value.toString();
  }

  /** Converts this node into an s-expression, eliding subtrees more than
   * {@code maxDepth} levels deep; a negative depth means no limit. */
  public String describe(int maxDepth) {
    return new AstWriter(maxDepth).append(this).toString();
  }
}

// End Node.java
