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

import static java.util.Objects.requireNonNull;

import net.hydromatic.newtype.ast.Node;
import net.hydromatic.newtype.ast.Span;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A tree broke an invariant that simplification relies on.
 *
 * <p>The grammar should have rejected any tree that causes this exception, so
 * it indicates a mismatch between the parser and the simplifier, not a user
 * error that can be recovered from.
 */
public class CompileException extends RuntimeException {
  private final @Nullable Span span;
  private final String dump;

  public CompileException(String message, Node node, int printDepth) {
    super(message + ": " + node.describe(printDepth));
    this.span = node.span;
    this.dump = node.describe(printDepth);
  }

  @Override public String toString() {
    return super.toString() + " at " + describeSpan();
  }

  /** Returns the span of the offending node, or null if it was generated. */
  public @Nullable Span span() {
    return span;
  }

  /** Returns the s-expression of the offending node. */
  public String dump() {
    return dump;
  }

  private String describeSpan() {
    return span == null ? "<generated>" : span.toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    return buf.append(describeSpan())
        .append(" Error: ")
        .append(requireNonNull(getMessage()));
  }
}

// End CompileException.java
