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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import net.hydromatic.newtype.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST values. */
public class Ast {
  private Ast() {}

  /** Name of the identifier that marks the default arm of a match. */
  public static final String WILDCARD = "_";

  /** Identifier.
   *
   * <p>For example, "A" in "type B = A". */
  public static class Ident extends AstValue {
    public final String name;

    Ident(String name) {
      super(Op.ID);
      this.name = requireNonNull(name);
    }

    /** Returns whether this is the wildcard, "_". */
    public boolean isWildcard() {
      return name.equals(WILDCARD);
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Ident
          && name.equals(((Ident) o).name);
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append(name);
    }
  }

  /** Literal, or one of the keyword types "never", "any", "unknown".
   *
   * <p>The value is a {@link BigDecimal} for {@link Op#NUMBER_LITERAL}, a
   * {@link String} for {@link Op#STRING_LITERAL}, a {@link Boolean} for
   * {@link Op#BOOL_LITERAL}, and null for the others. */
  @SuppressWarnings("rawtypes")
  public static class Literal extends AstValue {
    public final @Nullable Comparable value;

    Literal(Op op, @Nullable Comparable value) {
      super(op);
      this.value = value;
      checkArgument(Op.LITERAL_OPS.contains(op), "not a literal: %s", op);
      switch (op) {
      case NUMBER_LITERAL:
        checkArgument(value instanceof BigDecimal);
        break;
      case STRING_LITERAL:
        checkArgument(value instanceof String);
        break;
      case BOOL_LITERAL:
        checkArgument(value instanceof Boolean);
        break;
      default:
        checkArgument(value == null);
      }
    }

    @Override public int hashCode() {
      return Objects.hash(op, value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
          && op == ((Literal) o).op
          && Objects.equals(value, ((Literal) o).value);
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      switch (op) {
      case NUMBER_LITERAL:
        return w.append(((BigDecimal) requireNonNull(value)).toPlainString());
      case STRING_LITERAL:
        return w.quoted((String) requireNonNull(value));
      case BOOL_LITERAL:
        return w.append(String.valueOf(value));
      default:
        return w.append(requireNonNull(op.symbol));
      }
    }
  }

  /** Primitive type name, such as "number". */
  public enum PrimitiveType {
    NUMBER, STRING, BOOLEAN, BIGINT, SYMBOL, OBJECT, VOID;

    public String lowerName() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  /** Primitive type, such as "string" in "type A = string". */
  public static class Primitive extends AstValue {
    public final PrimitiveType type;

    Primitive(PrimitiveType type) {
      super(Op.PRIMITIVE);
      this.type = requireNonNull(type);
    }

    @Override public int hashCode() {
      return type.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Primitive
          && type == ((Primitive) o).type;
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append(type.lowerName());
    }
  }

  /** Template string type, such as "`prefix-${A}`". The text is kept
   * verbatim; placeholders are not parsed. */
  public static class TemplateString extends AstValue {
    public final String text;

    TemplateString(String text) {
      super(Op.TEMPLATE_STRING);
      this.text = requireNonNull(text);
    }

    @Override public int hashCode() {
      return text.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof TemplateString
          && text.equals(((TemplateString) o).text);
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("(template ").quoted(text).append(")");
    }
  }

  /** Named import, "A" or "A as B". */
  public static class ImportSpecifier {
    public final String name;
    public final @Nullable String alias;

    ImportSpecifier(String name, @Nullable String alias) {
      this.name = requireNonNull(name);
      this.alias = alias;
    }

    @Override public int hashCode() {
      return Objects.hash(name, alias);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ImportSpecifier
          && name.equals(((ImportSpecifier) o).name)
          && Objects.equals(alias, ((ImportSpecifier) o).alias);
    }

    @Override public String toString() {
      return alias == null ? name : name + " as " + alias;
    }
  }

  /** Import statement.
   *
   * <p>For example, "import D, { A, B as C } from 'm'" has default binding
   * "D" and two named specifiers; "import * as N from 'm'" has namespace
   * binding "N". */
  public static class ImportStatement extends AstValue {
    public final @Nullable String defaultBinding;
    public final @Nullable String namespaceBinding;
    public final List<ImportSpecifier> specifiers;
    public final String module;

    ImportStatement(@Nullable String defaultBinding,
        @Nullable String namespaceBinding,
        ImmutableList<ImportSpecifier> specifiers, String module) {
      super(Op.IMPORT);
      this.defaultBinding = defaultBinding;
      this.namespaceBinding = namespaceBinding;
      this.specifiers = requireNonNull(specifiers);
      this.module = requireNonNull(module);
      checkArgument(namespaceBinding == null || specifiers.isEmpty(),
          "cannot have both namespace and named imports");
    }

    @Override public int hashCode() {
      return Objects.hash(defaultBinding, namespaceBinding, specifiers,
          module);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ImportStatement
          && Objects.equals(defaultBinding,
              ((ImportStatement) o).defaultBinding)
          && Objects.equals(namespaceBinding,
              ((ImportStatement) o).namespaceBinding)
          && specifiers.equals(((ImportStatement) o).specifiers)
          && module.equals(((ImportStatement) o).module);
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      w.append("(import").appendOpt(defaultBinding);
      if (namespaceBinding != null) {
        w.append(" (* as ").append(namespaceBinding).append(")");
      }
      if (!specifiers.isEmpty()) {
        w.append(" (");
        for (int i = 0; i < specifiers.size(); i++) {
          w.append(i == 0 ? "" : " ").append(specifiers.get(i).toString());
        }
        w.append(")");
      }
      return w.append(" ").quoted(module).append(")");
    }
  }

  /** Placeholder that does nothing. */
  public static class NoOp extends AstValue {
    NoOp() {
      super(Op.NO_OP);
    }

    @Override public int hashCode() {
      return Op.NO_OP.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o instanceof NoOp;
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("(noop)");
    }
  }

  /** Tuple type, such as "[A, B]". */
  public static class Tuple extends AstValue {
    public final List<Node> items;

    Tuple(ImmutableList<Node> items) {
      super(Op.TUPLE);
      this.items = requireNonNull(items);
    }

    @Override public int hashCode() {
      return items.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Tuple
          && items.equals(((Tuple) o).items);
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.list("tuple", items);
    }
  }

  /** Array type, such as "A[]". */
  public static class Array extends AstValue {
    public final Node element;

    Array(Node element) {
      super(Op.ARRAY);
      this.element = requireNonNull(element);
    }

    @Override public int hashCode() {
      return Objects.hash(op, element);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Array
          && element.equals(((Array) o).element);
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.list("array", element);
    }
  }

  /** Modifier on an object property or a mapped type, such as the "-" in
   * "-readonly" or the "?" in "a?: string". */
  public enum Modifier {
    /** Adds the modifier: "readonly", "?". */
    ADD,
    /** Removes the modifier: "-readonly", "-?". */
    REMOVE
  }

  /** Property of an object literal, such as "readonly a?: string". */
  public static class ObjectProperty {
    public final @Nullable Modifier readonly;
    public final @Nullable Modifier optional;
    public final String key;
    public final Node value;

    ObjectProperty(@Nullable Modifier readonly, @Nullable Modifier optional,
        String key, Node value) {
      this.readonly = readonly;
      this.optional = optional;
      this.key = requireNonNull(key);
      this.value = requireNonNull(value);
    }

    /** Returns a property with the same key and modifiers and a different
     * value. */
    public ObjectProperty withValue(Node value) {
      return new ObjectProperty(readonly, optional, key, value);
    }

    @Override public int hashCode() {
      return Objects.hash(readonly, optional, key, value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ObjectProperty
          && readonly == ((ObjectProperty) o).readonly
          && optional == ((ObjectProperty) o).optional
          && key.equals(((ObjectProperty) o).key)
          && value.equals(((ObjectProperty) o).value);
    }

    AstWriter unparse(AstWriter w) {
      w.append("(prop ");
      if (readonly != null) {
        w.append(readonly == Modifier.REMOVE ? "-readonly " : "readonly ");
      }
      w.append(key);
      if (optional != null) {
        w.append(optional == Modifier.REMOVE ? "-?" : "?");
      }
      return w.append(" ").append(value).append(")");
    }
  }

  /** Object literal type, such as "{ a: number, b: string }". */
  public static class ObjectLiteral extends AstValue {
    public final List<ObjectProperty> properties;

    ObjectLiteral(ImmutableList<ObjectProperty> properties) {
      super(Op.OBJECT_LITERAL);
      this.properties = requireNonNull(properties);
    }

    @Override public int hashCode() {
      return properties.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ObjectLiteral
          && properties.equals(((ObjectLiteral) o).properties);
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      w.append("(object");
      for (ObjectProperty property : properties) {
        property.unparse(w.append(" "));
      }
      return w.append(")");
    }
  }

  /** Member access, "A.b" (if {@link #isDot}) or "A[B]". */
  public static class Access extends AstValue {
    public final Node lhs;
    public final Node rhs;
    public final boolean isDot;

    Access(Node lhs, Node rhs, boolean isDot) {
      super(Op.ACCESS);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
      this.isDot = isDot;
    }

    @Override public int hashCode() {
      return Objects.hash(lhs, rhs, isDot);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Access
          && lhs.equals(((Access) o).lhs)
          && rhs.equals(((Access) o).rhs)
          && isDot == ((Access) o).isDot;
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.list(isDot ? "." : "[]", lhs, rhs);
    }
  }

  /** Namespace access, such as "N::A". */
  public static class NamespaceAccess extends AstValue {
    public final Node lhs;
    public final Node rhs;

    NamespaceAccess(Node lhs, Node rhs) {
      super(Op.NAMESPACE_ACCESS);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
    }

    @Override public int hashCode() {
      return Objects.hash(op, lhs, rhs);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof NamespaceAccess
          && lhs.equals(((NamespaceAccess) o).lhs)
          && rhs.equals(((NamespaceAccess) o).rhs);
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.list("::", lhs, rhs);
    }
  }

  /** Application of a generic type to arguments, such as "Map A B", which
   * becomes "Map&lt;A, B&gt;". */
  public static class Application extends AstValue {
    public final String name;
    public final List<Node> args;

    Application(String name, ImmutableList<Node> args) {
      super(Op.APPLICATION);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override public int hashCode() {
      return Objects.hash(name, args);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Application
          && name.equals(((Application) o).name)
          && args.equals(((Application) o).args);
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.list("apply " + name, args);
    }
  }

  /** Call to an infix type operator, such as "A | B" or "1 + 2". */
  public static class InfixCall extends AstValue {
    public final Node lhs;
    public final Node rhs;

    InfixCall(Op op, Node lhs, Node rhs) {
      super(op);
      checkArgument(Op.INFIX_OPS.contains(op), "not an infix operator: %s",
          op);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
    }

    @Override public int hashCode() {
      return Objects.hash(op, lhs, rhs);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof InfixCall
          && op == ((InfixCall) o).op
          && lhs.equals(((InfixCall) o).lhs)
          && rhs.equals(((InfixCall) o).rhs);
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.list(requireNonNull(op.symbol), lhs, rhs);
    }
  }

  /** Call to an extends operator, such as "A &lt;: B" or
   * "A &lt;: B and C &lt;: D".
   *
   * <p>These occur only as the condition of an {@link IfExpr} or in the arms
   * of a {@link CondExpr}. */
  public static class ExtendsInfixCall extends AstValue {
    public final Node lhs;
    public final Node rhs;

    ExtendsInfixCall(Op op, Node lhs, Node rhs) {
      super(op);
      checkArgument(Op.EXTENDS_INFIX_OPS.contains(op),
          "not an extends operator: %s", op);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
    }

    @Override public int hashCode() {
      return Objects.hash(op, lhs, rhs);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ExtendsInfixCall
          && op == ((ExtendsInfixCall) o).op
          && lhs.equals(((ExtendsInfixCall) o).lhs)
          && rhs.equals(((ExtendsInfixCall) o).rhs);
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.list(requireNonNull(op.symbol), lhs, rhs);
    }
  }

  /** Call to a prefix extends operator; the only one is "not". */
  public static class ExtendsPrefixCall extends AstValue {
    public final Node value;

    ExtendsPrefixCall(Op op, Node value) {
      super(op);
      checkArgument(op == Op.NOT, "not a prefix operator: %s", op);
      this.value = requireNonNull(value);
    }

    @Override public int hashCode() {
      return Objects.hash(op, value);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ExtendsPrefixCall
          && op == ((ExtendsPrefixCall) o).op
          && value.equals(((ExtendsPrefixCall) o).value);
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.list(requireNonNull(op.symbol), value);
    }
  }

  /** Conditional type, "lhs extends rhs ? thenBranch : elseBranch".
   *
   * <p>This is the only conditional that survives simplification. */
  public static class ExtendsExpr extends AstValue {
    public final Node lhs;
    public final Node rhs;
    public final Node thenBranch;
    public final Node elseBranch;

    ExtendsExpr(Node lhs, Node rhs, Node thenBranch, Node elseBranch) {
      super(Op.EXTENDS_EXPR);
      this.lhs = requireNonNull(lhs);
      this.rhs = requireNonNull(rhs);
      this.thenBranch = requireNonNull(thenBranch);
      this.elseBranch = requireNonNull(elseBranch);
    }

    @Override public int hashCode() {
      return Objects.hash(lhs, rhs, thenBranch, elseBranch);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof ExtendsExpr
          && lhs.equals(((ExtendsExpr) o).lhs)
          && rhs.equals(((ExtendsExpr) o).rhs)
          && thenBranch.equals(((ExtendsExpr) o).thenBranch)
          && elseBranch.equals(((ExtendsExpr) o).elseBranch);
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.list("extends-expr", lhs, rhs, thenBranch, elseBranch);
    }
  }

  /** "If ... then ... else" expression; the else branch is optional. */
  public static class IfExpr extends AstValue {
    public final Node condition;
    public final Node thenBranch;
    public final @Nullable Node elseBranch;

    IfExpr(Node condition, Node thenBranch, @Nullable Node elseBranch) {
      super(Op.IF);
      this.condition = requireNonNull(condition);
      this.thenBranch = requireNonNull(thenBranch);
      this.elseBranch = elseBranch;
    }

    @Override public int hashCode() {
      return Objects.hash(condition, thenBranch, elseBranch);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof IfExpr
          && condition.equals(((IfExpr) o).condition)
          && thenBranch.equals(((IfExpr) o).thenBranch)
          && Objects.equals(elseBranch, ((IfExpr) o).elseBranch);
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.append("(if ").append(condition)
          .append(" ").append(thenBranch)
          .appendOpt(elseBranch)
          .append(")");
    }
  }

  /** Arm of a match expression, "pattern => body". */
  public static class MatchArm {
    public final Node pattern;
    public final Node body;

    MatchArm(Node pattern, Node body) {
      this.pattern = requireNonNull(pattern);
      this.body = requireNonNull(body);
    }

    /** Returns whether this is the wildcard arm, "_ => body". */
    public boolean isWildcard() {
      return pattern.value instanceof Ident
          && ((Ident) pattern.value).isWildcard();
    }

    @Override public int hashCode() {
      return Objects.hash(pattern, body);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof MatchArm
          && pattern.equals(((MatchArm) o).pattern)
          && body.equals(((MatchArm) o).body);
    }

    @Override public String toString() {
      return unparse(new AstWriter()).toString();
    }

    AstWriter unparse(AstWriter w) {
      return w.list("arm", pattern, body);
    }
  }

  /** Match expression.
   *
   * <p>For example,
   *
   * <pre>{@code
   * match A do
   *   number => 1,
   *   string => 2,
   *   _ => 3,
   * end
   * }</pre>
   *
   * <p>At most one arm may have the wildcard pattern "_"; the simplifier,
   * not the constructor, enforces this. */
  public static class MatchExpr extends AstValue {
    public final Node value;
    public final List<MatchArm> arms;

    MatchExpr(Node value, ImmutableList<MatchArm> arms) {
      super(Op.MATCH);
      this.value = requireNonNull(value);
      this.arms = requireNonNull(arms);
    }

    @Override public int hashCode() {
      return Objects.hash(value, arms);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof MatchExpr
          && value.equals(((MatchExpr) o).value)
          && arms.equals(((MatchExpr) o).arms);
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      w.append("(match ").append(value);
      for (MatchArm arm : arms) {
        arm.unparse(w.append(" "));
      }
      return w.append(")");
    }
  }

  /** Arm of a cond expression, "condition => body". */
  public static class CondArm {
    public final Node condition;
    public final Node body;

    CondArm(Node condition, Node body) {
      this.condition = requireNonNull(condition);
      this.body = requireNonNull(body);
    }

    @Override public int hashCode() {
      return Objects.hash(condition, body);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof CondArm
          && condition.equals(((CondArm) o).condition)
          && body.equals(((CondArm) o).body);
    }

    AstWriter unparse(AstWriter w) {
      return w.list("arm", condition, body);
    }
  }

  /** Cond expression, a chain of conditions tested in order.
   *
   * <p>For example,
   *
   * <pre>{@code
   * cond do
   *   A <: number => 1,
   *   A <: string and B <: string => 2,
   *   else => 3
   * end
   * }</pre> */
  public static class CondExpr extends AstValue {
    public final List<CondArm> arms;
    public final Node elseArm;

    CondExpr(ImmutableList<CondArm> arms, Node elseArm) {
      super(Op.COND);
      this.arms = requireNonNull(arms);
      this.elseArm = requireNonNull(elseArm);
    }

    @Override public int hashCode() {
      return Objects.hash(arms, elseArm);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof CondExpr
          && arms.equals(((CondExpr) o).arms)
          && elseArm.equals(((CondExpr) o).elseArm);
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      w.append("(cond");
      for (CondArm arm : arms) {
        arm.unparse(w.append(" "));
      }
      return w.append(" (else ").append(elseArm).append("))");
    }
  }

  /** "Let ... in" expression, such as "let x = 1, y = 2 in [x, y]".
   *
   * <p>Bindings are sorted by name. A binding does not see the other
   * bindings of the same expression. */
  public static class LetExpr extends AstValue {
    public final ImmutableSortedMap<String, Node> bindings;
    public final Node body;

    LetExpr(ImmutableSortedMap<String, Node> bindings, Node body) {
      super(Op.LET);
      this.bindings = requireNonNull(bindings);
      this.body = requireNonNull(body);
    }

    @Override public int hashCode() {
      return Objects.hash(bindings, body);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof LetExpr
          && bindings.equals(((LetExpr) o).bindings)
          && body.equals(((LetExpr) o).body);
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      w.append("(let (");
      bindings.forEach((name, value) ->
          w.append(name.equals(bindings.firstKey()) ? "(" : " (")
              .append(name).append(" ").append(value).append(")"));
      return w.append(") ").append(body).append(")");
    }
  }

  /** Type alias declaration, such as "export type A T = [T]". */
  public static class TypeAlias extends AstValue {
    public final boolean export;
    public final String name;
    /** Type parameters; each has value {@link TypeParameter}. */
    public final List<Node> params;
    public final Node body;

    TypeAlias(boolean export, String name, ImmutableList<Node> params,
        Node body) {
      super(Op.TYPE_ALIAS);
      this.export = export;
      this.name = requireNonNull(name);
      this.params = requireNonNull(params);
      this.body = requireNonNull(body);
    }

    @Override public int hashCode() {
      return Objects.hash(export, name, params, body);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof TypeAlias
          && export == ((TypeAlias) o).export
          && name.equals(((TypeAlias) o).name)
          && params.equals(((TypeAlias) o).params)
          && body.equals(((TypeAlias) o).body);
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      w.append(export ? "(export-type " : "(type ").append(name);
      if (!params.isEmpty()) {
        w.append(" ").list("params", params);
      }
      return w.append(" ").append(body).append(")");
    }
  }

  /** Type parameter, such as "T extends string = 'a'" or "...T". */
  public static class TypeParameter extends AstValue {
    public final String name;
    public final @Nullable Node constraint;
    public final @Nullable Node defaultValue;
    public final boolean rest;

    TypeParameter(String name, @Nullable Node constraint,
        @Nullable Node defaultValue, boolean rest) {
      super(Op.TYPE_PARAMETER);
      this.name = requireNonNull(name);
      this.constraint = constraint;
      this.defaultValue = defaultValue;
      this.rest = rest;
    }

    @Override public int hashCode() {
      return Objects.hash(name, constraint, defaultValue, rest);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof TypeParameter
          && name.equals(((TypeParameter) o).name)
          && Objects.equals(constraint, ((TypeParameter) o).constraint)
          && Objects.equals(defaultValue, ((TypeParameter) o).defaultValue)
          && rest == ((TypeParameter) o).rest;
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      w.append("(param ").append(rest ? "..." : "").append(name);
      if (constraint != null) {
        w.append(" (extends ").append(constraint).append(")");
      }
      if (defaultValue != null) {
        w.append(" (default ").append(defaultValue).append(")");
      }
      return w.append(")");
    }
  }

  /** Mapped type, such as
   * "{ readonly [K in keyof T as Uppercase K]?: T[K] }". */
  public static class MappedType extends AstValue {
    public final String index;
    public final Node iterable;
    public final @Nullable Node remappedAs;
    public final @Nullable Modifier readonly;
    public final @Nullable Modifier optional;
    public final Node body;

    MappedType(String index, Node iterable, @Nullable Node remappedAs,
        @Nullable Modifier readonly, @Nullable Modifier optional, Node body) {
      super(Op.MAPPED_TYPE);
      this.index = requireNonNull(index);
      this.iterable = requireNonNull(iterable);
      this.remappedAs = remappedAs;
      this.readonly = readonly;
      this.optional = optional;
      this.body = requireNonNull(body);
    }

    @Override public int hashCode() {
      return Objects.hash(index, iterable, remappedAs, readonly, optional,
          body);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof MappedType
          && index.equals(((MappedType) o).index)
          && iterable.equals(((MappedType) o).iterable)
          && Objects.equals(remappedAs, ((MappedType) o).remappedAs)
          && readonly == ((MappedType) o).readonly
          && optional == ((MappedType) o).optional
          && body.equals(((MappedType) o).body);
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      w.append("(mapped-type ");
      if (readonly != null) {
        w.append(readonly == Modifier.REMOVE ? "-readonly " : "readonly ");
      }
      w.append(index).append(" ").append(iterable);
      if (remappedAs != null) {
        w.append(" (as ").append(remappedAs).append(")");
      }
      if (optional != null) {
        w.append(optional == Modifier.REMOVE ? " -?" : " ?");
      }
      return w.append(" ").append(body).append(")");
    }
  }

  /** Invocation of a builtin macro, such as "print A".
   *
   * <p>The simplifier does not evaluate it. */
  public static class Builtin extends AstValue {
    public final String name;
    public final Node argument;

    Builtin(String name, Node argument) {
      super(Op.BUILTIN);
      this.name = requireNonNull(name);
      this.argument = requireNonNull(argument);
    }

    @Override public int hashCode() {
      return Objects.hash(name, argument);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Builtin
          && name.equals(((Builtin) o).name)
          && argument.equals(((Builtin) o).argument);
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.list("builtin " + name, argument);
    }
  }

  /** Top-level statement. */
  public static class Statement extends AstValue {
    public final Node inner;

    Statement(Node inner) {
      super(Op.STATEMENT);
      this.inner = requireNonNull(inner);
    }

    @Override public int hashCode() {
      return Objects.hash(op, inner);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Statement
          && inner.equals(((Statement) o).inner);
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.list("statement", inner);
    }
  }

  /** Program, a list of statements. */
  public static class Program extends AstValue {
    public final List<Node> statements;

    Program(ImmutableList<Node> statements) {
      super(Op.PROGRAM);
      this.statements = requireNonNull(statements);
    }

    @Override public int hashCode() {
      return statements.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Program
          && statements.equals(((Program) o).statements);
    }

    @Override <C> Pair<Node, C> accept(Shuttle<C> shuttle, Node node,
        C context) {
      return shuttle.visit(this, node, context);
    }

    @Override AstWriter unparse(AstWriter w) {
      return w.list("program", statements);
    }
  }
}

// End Ast.java
