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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Sub-types of {@link AstValue}. */
public enum Op {
  // identifiers
  ID,

  // literals
  NUMBER_LITERAL,
  STRING_LITERAL,
  BOOL_LITERAL,
  NULL_LITERAL("null"),
  UNDEFINED_LITERAL("undefined"),
  NEVER("never"),
  ANY("any"),
  UNKNOWN("unknown"),
  PRIMITIVE,
  TEMPLATE_STRING,

  // value constructors
  TUPLE,
  ARRAY,
  OBJECT_LITERAL,
  ACCESS,
  NAMESPACE_ACCESS,
  APPLICATION,

  // infix operators
  UNION("|"),
  INTERSECTION("&"),
  PLUS("+"),
  MINUS("-"),
  TIMES("*"),
  DIVIDE("/"),
  LT("<"),
  LE("<="),
  GT(">"),
  GE(">="),

  // extends operators
  EXTENDS("<:"),
  NOT_EXTENDS("!<:"),
  AND("and"),
  OR("or"),
  EQUALS("=="),
  NOT_EQUALS("!="),
  STRICT_EQUALS("==="),
  STRICT_NOT_EQUALS("!=="),
  NOT("not"),

  // conditionals; all but EXTENDS_EXPR are removed by simplification
  EXTENDS_EXPR,
  IF,
  MATCH,
  COND,
  LET,

  // declarations
  TYPE_ALIAS,
  TYPE_PARAMETER,
  MAPPED_TYPE,
  BUILTIN,
  IMPORT,
  STATEMENT,
  PROGRAM,
  NO_OP;

  /** Operator symbol, e.g. "&lt;:"; or the keyword of a keyword literal,
   * e.g. "never"; null for other kinds of node. */
  public final @Nullable String symbol;

  /** Operators allowed in {@link Ast.InfixCall}. */
  public static final ImmutableSet<Op> INFIX_OPS =
      Sets.immutableEnumSet(UNION, INTERSECTION, PLUS, MINUS, TIMES, DIVIDE,
          LT, LE, GT, GE);

  /** Operators allowed in {@link Ast.ExtendsInfixCall}. */
  public static final ImmutableSet<Op> EXTENDS_INFIX_OPS =
      Sets.immutableEnumSet(EXTENDS, NOT_EXTENDS, AND, OR, EQUALS, NOT_EQUALS,
          STRICT_EQUALS, STRICT_NOT_EQUALS);

  /** Kinds of {@link Ast.Literal}. */
  public static final ImmutableSet<Op> LITERAL_OPS =
      Sets.immutableEnumSet(NUMBER_LITERAL, STRING_LITERAL, BOOL_LITERAL,
          NULL_LITERAL, UNDEFINED_LITERAL, NEVER, ANY, UNKNOWN);

  /** Surface constructs, which do not occur in a simplified tree. */
  public static final ImmutableSet<Op> SURFACE_OPS =
      Sets.immutableEnumSet(IF, MATCH, COND, LET);

  Op() {
    this(null);
  }

  Op(@Nullable String symbol) {
    this.symbol = symbol;
  }

  /** Returns the name in lower case with hyphens, e.g. "extends-expr" for
   * {@link #EXTENDS_EXPR}. */
  public String lowerName() {
    return name().toLowerCase(Locale.ROOT).replace('_', '-');
  }

  /** Returns whether this operator is an equality test, which has no
   * lowering to a conditional type. */
  public boolean isEquality() {
    switch (this) {
    case EQUALS:
    case NOT_EQUALS:
    case STRICT_EQUALS:
    case STRICT_NOT_EQUALS:
      return true;
    default:
      return false;
    }
  }
}

// End Op.java
