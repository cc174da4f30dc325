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
package net.hydromatic.newtype;

import static net.hydromatic.newtype.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.newtype.ast.Ast;
import net.hydromatic.newtype.ast.AstValue;
import net.hydromatic.newtype.ast.Node;
import net.hydromatic.newtype.ast.Op;
import net.hydromatic.newtype.ast.Span;

/** Utilities for building trees in tests.
 *
 * <p>Nodes are generated (have no span) unless built using {@link #at}. */
public class TestUtils {
  private TestUtils() {}

  /** Wraps a value in a generated node. */
  public static Node gen(AstValue value) {
    return Node.generate(value);
  }

  /** Wraps a value in a node that spans the whole of a given source
   * string. */
  public static Node at(String source, AstValue value) {
    return Node.of(Span.of(source, 0, source.length()), value);
  }

  public static Node id(String name) {
    return gen(ast.ident(name));
  }

  public static Node num(long value) {
    return gen(ast.numberLiteral(value));
  }

  public static Node str(String value) {
    return gen(ast.stringLiteral(value));
  }

  public static Node never() {
    return gen(ast.never());
  }

  public static Node primitive(Ast.PrimitiveType type) {
    return gen(ast.primitive(type));
  }

  public static Node tuple(Node... items) {
    return gen(ast.tuple(items));
  }

  /** Returns "lhs &lt;: rhs". */
  public static Node ext(Node lhs, Node rhs) {
    return gen(ast.extendsCall(Op.EXTENDS, lhs, rhs));
  }

  /** Returns "lhs !&lt;: rhs". */
  public static Node notExt(Node lhs, Node rhs) {
    return gen(ast.extendsCall(Op.NOT_EXTENDS, lhs, rhs));
  }

  public static Node and(Node lhs, Node rhs) {
    return gen(ast.extendsCall(Op.AND, lhs, rhs));
  }

  public static Node or(Node lhs, Node rhs) {
    return gen(ast.extendsCall(Op.OR, lhs, rhs));
  }

  public static Node not(Node condition) {
    return gen(ast.not(condition));
  }

  public static Node ifThen(Node condition, Node thenBranch) {
    return gen(ast.ifExpr(condition, thenBranch, null));
  }

  public static Node ifThenElse(Node condition, Node thenBranch,
      Node elseBranch) {
    return gen(ast.ifExpr(condition, thenBranch, elseBranch));
  }

  public static Ast.MatchArm arm(Node pattern, Node body) {
    return ast.matchArm(pattern, body);
  }

  public static Node match(Node value, Ast.MatchArm... arms) {
    return gen(ast.matchExpr(value, ImmutableList.copyOf(arms)));
  }

  public static Node let(String name, Node value, Node body) {
    return gen(ast.letExpr(ImmutableMap.of(name, value), body));
  }

  public static Node let(String name0, Node value0, String name1,
      Node value1, Node body) {
    return gen(
        ast.letExpr(ImmutableMap.of(name0, value0, name1, value1), body));
  }

  /** Returns a program with one statement, "type name = body". */
  public static Node program(String name, Node body) {
    return gen(
        ast.program(
            ImmutableList.of(
                gen(
                    ast.statement(
                        gen(
                            ast.typeAlias(false, name, ImmutableList.of(),
                                body)))))));
  }
}

// End TestUtils.java
