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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.math.BigDecimal;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds values of parse tree nodes.
 *
 * <p>Wrap a value in a {@link Node} using {@link Node#of} (parser) or
 * {@link Node#generate} (compiler pass). */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  // identifiers and literals

  public Ast.Ident ident(String name) {
    return new Ast.Ident(name);
  }

  /** Returns the wildcard identifier, "_". */
  public Ast.Ident wildcard() {
    return new Ast.Ident(Ast.WILDCARD);
  }

  public Ast.Literal numberLiteral(BigDecimal value) {
    return new Ast.Literal(Op.NUMBER_LITERAL, value);
  }

  public Ast.Literal numberLiteral(long value) {
    return numberLiteral(BigDecimal.valueOf(value));
  }

  public Ast.Literal stringLiteral(String value) {
    return new Ast.Literal(Op.STRING_LITERAL, value);
  }

  public Ast.Literal boolLiteral(boolean value) {
    return new Ast.Literal(Op.BOOL_LITERAL, value);
  }

  public Ast.Literal nullLiteral() {
    return new Ast.Literal(Op.NULL_LITERAL, null);
  }

  public Ast.Literal undefinedLiteral() {
    return new Ast.Literal(Op.UNDEFINED_LITERAL, null);
  }

  /** Returns "never", the bottom type. */
  public Ast.Literal never() {
    return new Ast.Literal(Op.NEVER, null);
  }

  public Ast.Literal any() {
    return new Ast.Literal(Op.ANY, null);
  }

  public Ast.Literal unknown() {
    return new Ast.Literal(Op.UNKNOWN, null);
  }

  public Ast.Primitive primitive(Ast.PrimitiveType type) {
    return new Ast.Primitive(type);
  }

  public Ast.TemplateString templateString(String text) {
    return new Ast.TemplateString(text);
  }

  // value constructors

  public Ast.Tuple tuple(Iterable<Node> items) {
    return new Ast.Tuple(ImmutableList.copyOf(items));
  }

  public Ast.Tuple tuple(Node... items) {
    return new Ast.Tuple(ImmutableList.copyOf(items));
  }

  public Ast.Array array(Node element) {
    return new Ast.Array(element);
  }

  public Ast.ObjectProperty property(Ast.@Nullable Modifier readonly,
      Ast.@Nullable Modifier optional, String key, Node value) {
    return new Ast.ObjectProperty(readonly, optional, key, value);
  }

  public Ast.ObjectProperty property(String key, Node value) {
    return property(null, null, key, value);
  }

  public Ast.ObjectLiteral objectLiteral(
      Iterable<Ast.ObjectProperty> properties) {
    return new Ast.ObjectLiteral(ImmutableList.copyOf(properties));
  }

  public Ast.Access access(Node lhs, Node rhs, boolean isDot) {
    return new Ast.Access(lhs, rhs, isDot);
  }

  public Ast.NamespaceAccess namespaceAccess(Node lhs, Node rhs) {
    return new Ast.NamespaceAccess(lhs, rhs);
  }

  public Ast.Application application(String name, Iterable<Node> args) {
    return new Ast.Application(name, ImmutableList.copyOf(args));
  }

  // operators

  public Ast.InfixCall infixCall(Op op, Node lhs, Node rhs) {
    return new Ast.InfixCall(op, lhs, rhs);
  }

  public Ast.ExtendsInfixCall extendsCall(Op op, Node lhs, Node rhs) {
    return new Ast.ExtendsInfixCall(op, lhs, rhs);
  }

  public Ast.ExtendsPrefixCall not(Node value) {
    return new Ast.ExtendsPrefixCall(Op.NOT, value);
  }

  // conditionals

  public Ast.ExtendsExpr extendsExpr(Node lhs, Node rhs, Node thenBranch,
      Node elseBranch) {
    return new Ast.ExtendsExpr(lhs, rhs, thenBranch, elseBranch);
  }

  public Ast.IfExpr ifExpr(Node condition, Node thenBranch,
      @Nullable Node elseBranch) {
    return new Ast.IfExpr(condition, thenBranch, elseBranch);
  }

  public Ast.MatchArm matchArm(Node pattern, Node body) {
    return new Ast.MatchArm(pattern, body);
  }

  public Ast.MatchExpr matchExpr(Node value, Iterable<Ast.MatchArm> arms) {
    return new Ast.MatchExpr(value, ImmutableList.copyOf(arms));
  }

  public Ast.CondArm condArm(Node condition, Node body) {
    return new Ast.CondArm(condition, body);
  }

  public Ast.CondExpr condExpr(Iterable<Ast.CondArm> arms, Node elseArm) {
    return new Ast.CondExpr(ImmutableList.copyOf(arms), elseArm);
  }

  public Ast.LetExpr letExpr(Map<String, Node> bindings, Node body) {
    return new Ast.LetExpr(ImmutableSortedMap.copyOf(bindings), body);
  }

  // declarations

  public Ast.TypeAlias typeAlias(boolean export, String name,
      Iterable<Node> params, Node body) {
    return new Ast.TypeAlias(export, name, ImmutableList.copyOf(params), body);
  }

  public Ast.TypeParameter typeParameter(String name,
      @Nullable Node constraint, @Nullable Node defaultValue, boolean rest) {
    return new Ast.TypeParameter(name, constraint, defaultValue, rest);
  }

  public Ast.MappedType mappedType(String index, Node iterable,
      @Nullable Node remappedAs, Ast.@Nullable Modifier readonly,
      Ast.@Nullable Modifier optional, Node body) {
    return new Ast.MappedType(index, iterable, remappedAs, readonly, optional,
        body);
  }

  public Ast.Builtin builtin(String name, Node argument) {
    return new Ast.Builtin(name, argument);
  }

  public Ast.ImportSpecifier importSpecifier(String name,
      @Nullable String alias) {
    return new Ast.ImportSpecifier(name, alias);
  }

  public Ast.ImportStatement importStatement(@Nullable String defaultBinding,
      @Nullable String namespaceBinding,
      Iterable<Ast.ImportSpecifier> specifiers, String module) {
    return new Ast.ImportStatement(defaultBinding, namespaceBinding,
        ImmutableList.copyOf(specifiers), module);
  }

  public Ast.NoOp noOp() {
    return new Ast.NoOp();
  }

  public Ast.Statement statement(Node inner) {
    return new Ast.Statement(inner);
  }

  public Ast.Program program(Iterable<Node> statements) {
    return new Ast.Program(ImmutableList.copyOf(statements));
  }
}

// End AstBuilder.java
