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
import static net.hydromatic.newtype.ast.AstBuilder.ast;
import static net.hydromatic.newtype.util.Static.transformEager;
import static net.hydromatic.newtype.util.Static.transformValuesEager;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.UnaryOperator;
import net.hydromatic.newtype.util.Pair;
import net.hydromatic.newtype.util.Unit;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Visits and transforms syntax trees, threading a context through the walk.
 *
 * <p>{@link #walk} calls {@link #pre} on a node, then walks the children of
 * the node that {@code pre} returns, rebuilding it, and finally calls
 * {@link #post} on the rebuilt node. Each hook may replace the node and the
 * context.
 *
 * <p>Children are walked in the order they are declared in their value
 * class, and each child sees the context that {@code pre} returned for its
 * parent. The context that flows out of a child is discarded, so siblings do
 * not see each other's changes; the exceptions are {@link Ast.Program},
 * which passes the context from each statement to the next, and
 * {@link Ast.Statement}, which passes on the context of its inner node.
 *
 * <p>Contexts must not be null, and should be immutable.
 *
 * @param <C> Context type
 */
public class Shuttle<C> {
  private final Hook<C> pre;
  private final Hook<C> post;

  /** Creates a Shuttle whose hooks do nothing; for sub-classes that
   * override {@link #pre} or {@link #post}. */
  protected Shuttle() {
    this(Hook.identity(), Hook.identity());
  }

  /** Creates a Shuttle with given pre-order and post-order hooks. */
  public Shuttle(Hook<C> pre, Hook<C> post) {
    this.pre = requireNonNull(pre);
    this.post = requireNonNull(post);
  }

  /** Walks a tree with pre-order and post-order hooks, returning the new
   * tree and the context that flows out of its root. */
  public static <C> Pair<Node, C> traverse(Node node, C context, Hook<C> pre,
      Hook<C> post) {
    return new Shuttle<>(pre, post).walk(node, context);
  }

  /** Walks a tree with a pre-order hook. */
  public static <C> Pair<Node, C> prewalk(Node node, C context, Hook<C> pre) {
    return traverse(node, context, pre, Hook.identity());
  }

  /** Walks a tree with a post-order hook. */
  public static <C> Pair<Node, C> postwalk(Node node, C context,
      Hook<C> post) {
    return traverse(node, context, Hook.identity(), post);
  }

  /** Rewrites a tree bottom-up: applies {@code f} to each node after its
   * children have been rewritten. */
  public static Node transform(Node node, UnaryOperator<Node> f) {
    return postwalk(node, Unit.INSTANCE,
        (Node n, Unit unit) -> Pair.of(f.apply(n), unit)).left;
  }

  /** Called before the children of a node are walked. */
  protected Pair<Node, C> pre(Node node, C context) {
    return pre.apply(node, context);
  }

  /** Called after the children of a node have been walked. */
  protected Pair<Node, C> post(Node node, C context) {
    return post.apply(node, context);
  }

  /** Walks a node and its descendants. */
  public final Pair<Node, C> walk(Node node, C context) {
    final Pair<Node, C> p = pre(node, context);
    final Pair<Node, C> p2 = p.left.value.accept(this, p.left, p.right);
    return post(p2.left, p2.right);
  }

  /** Walks a child, discarding the context that flows out of it. */
  protected Node child(Node node, C context) {
    return walk(node, context).left;
  }

  protected @Nullable Node childOpt(@Nullable Node node, C context) {
    return node == null ? null : child(node, context);
  }

  protected ImmutableList<Node> children(List<Node> nodes, C context) {
    return transformEager(nodes, node -> child(node, context));
  }

  private Pair<Node, C> result(Node node, AstValue value, C context) {
    return Pair.of(node.replace(value), context);
  }

  // leaves

  protected Pair<Node, C> visit(Ast.Ident ident, Node node, C context) {
    return Pair.of(node, context); // leaf
  }

  protected Pair<Node, C> visit(Ast.Literal literal, Node node, C context) {
    return Pair.of(node, context); // leaf
  }

  protected Pair<Node, C> visit(Ast.Primitive primitive, Node node,
      C context) {
    return Pair.of(node, context); // leaf
  }

  protected Pair<Node, C> visit(Ast.TemplateString templateString, Node node,
      C context) {
    return Pair.of(node, context); // leaf
  }

  protected Pair<Node, C> visit(Ast.ImportStatement importStatement,
      Node node, C context) {
    return Pair.of(node, context); // leaf
  }

  protected Pair<Node, C> visit(Ast.NoOp noOp, Node node, C context) {
    return Pair.of(node, context); // leaf
  }

  // value constructors

  protected Pair<Node, C> visit(Ast.Tuple tuple, Node node, C context) {
    return result(node, ast.tuple(children(tuple.items, context)), context);
  }

  protected Pair<Node, C> visit(Ast.Array array, Node node, C context) {
    return result(node, ast.array(child(array.element, context)), context);
  }

  protected Pair<Node, C> visit(Ast.ObjectLiteral objectLiteral, Node node,
      C context) {
    final List<Ast.ObjectProperty> properties =
        transformEager(objectLiteral.properties,
            property -> property.withValue(child(property.value, context)));
    return result(node, ast.objectLiteral(properties), context);
  }

  protected Pair<Node, C> visit(Ast.Access access, Node node, C context) {
    return result(node,
        ast.access(child(access.lhs, context), child(access.rhs, context),
            access.isDot),
        context);
  }

  protected Pair<Node, C> visit(Ast.NamespaceAccess namespaceAccess,
      Node node, C context) {
    return result(node,
        ast.namespaceAccess(child(namespaceAccess.lhs, context),
            child(namespaceAccess.rhs, context)),
        context);
  }

  protected Pair<Node, C> visit(Ast.Application application, Node node,
      C context) {
    return result(node,
        ast.application(application.name,
            children(application.args, context)),
        context);
  }

  // operators

  protected Pair<Node, C> visit(Ast.InfixCall infixCall, Node node,
      C context) {
    return result(node,
        ast.infixCall(infixCall.op, child(infixCall.lhs, context),
            child(infixCall.rhs, context)),
        context);
  }

  protected Pair<Node, C> visit(Ast.ExtendsInfixCall extendsInfixCall,
      Node node, C context) {
    return result(node,
        ast.extendsCall(extendsInfixCall.op,
            child(extendsInfixCall.lhs, context),
            child(extendsInfixCall.rhs, context)),
        context);
  }

  protected Pair<Node, C> visit(Ast.ExtendsPrefixCall extendsPrefixCall,
      Node node, C context) {
    return result(node, ast.not(child(extendsPrefixCall.value, context)),
        context);
  }

  // conditionals

  protected Pair<Node, C> visit(Ast.ExtendsExpr extendsExpr, Node node,
      C context) {
    return result(node,
        ast.extendsExpr(child(extendsExpr.lhs, context),
            child(extendsExpr.rhs, context),
            child(extendsExpr.thenBranch, context),
            child(extendsExpr.elseBranch, context)),
        context);
  }

  protected Pair<Node, C> visit(Ast.IfExpr ifExpr, Node node, C context) {
    return result(node,
        ast.ifExpr(child(ifExpr.condition, context),
            child(ifExpr.thenBranch, context),
            childOpt(ifExpr.elseBranch, context)),
        context);
  }

  protected Pair<Node, C> visit(Ast.MatchExpr matchExpr, Node node,
      C context) {
    final Node value = child(matchExpr.value, context);
    final List<Ast.MatchArm> arms =
        transformEager(matchExpr.arms, arm ->
            ast.matchArm(child(arm.pattern, context),
                child(arm.body, context)));
    return result(node, ast.matchExpr(value, arms), context);
  }

  protected Pair<Node, C> visit(Ast.CondExpr condExpr, Node node,
      C context) {
    final List<Ast.CondArm> arms =
        transformEager(condExpr.arms, arm ->
            ast.condArm(child(arm.condition, context),
                child(arm.body, context)));
    final Node elseArm = child(condExpr.elseArm, context);
    return result(node, ast.condExpr(arms, elseArm), context);
  }

  protected Pair<Node, C> visit(Ast.LetExpr letExpr, Node node, C context) {
    return result(node,
        ast.letExpr(
            transformValuesEager(letExpr.bindings,
                value -> child(value, context)),
            child(letExpr.body, context)),
        context);
  }

  // declarations

  protected Pair<Node, C> visit(Ast.TypeAlias typeAlias, Node node,
      C context) {
    return result(node,
        ast.typeAlias(typeAlias.export, typeAlias.name,
            children(typeAlias.params, context),
            child(typeAlias.body, context)),
        context);
  }

  protected Pair<Node, C> visit(Ast.TypeParameter typeParameter, Node node,
      C context) {
    return result(node,
        ast.typeParameter(typeParameter.name,
            childOpt(typeParameter.constraint, context),
            childOpt(typeParameter.defaultValue, context),
            typeParameter.rest),
        context);
  }

  protected Pair<Node, C> visit(Ast.MappedType mappedType, Node node,
      C context) {
    return result(node,
        ast.mappedType(mappedType.index,
            child(mappedType.iterable, context),
            childOpt(mappedType.remappedAs, context),
            mappedType.readonly,
            mappedType.optional,
            child(mappedType.body, context)),
        context);
  }

  protected Pair<Node, C> visit(Ast.Builtin builtin, Node node, C context) {
    return result(node,
        ast.builtin(builtin.name, child(builtin.argument, context)),
        context);
  }

  protected Pair<Node, C> visit(Ast.Statement statement, Node node,
      C context) {
    // A statement may change the context seen by the statements after it
    final Pair<Node, C> p = walk(statement.inner, context);
    return result(node, ast.statement(p.left), p.right);
  }

  protected Pair<Node, C> visit(Ast.Program program, Node node, C context) {
    final ImmutableList.Builder<Node> statements = ImmutableList.builder();
    C c = context;
    for (Node statement : program.statements) {
      final Pair<Node, C> p = walk(statement, c);
      statements.add(p.left);
      c = p.right;
    }
    return result(node, ast.program(statements.build()), c);
  }

  /** Hook called by a {@link Shuttle} before or after it walks the children
   * of a node.
   *
   * @param <C> Context type */
  @FunctionalInterface
  public interface Hook<C> {
    /** Returns the node to use in place of {@code node}, and the context to
     * use from now on. */
    Pair<Node, C> apply(Node node, C context);

    /** Returns a hook that changes nothing. */
    static <C> Hook<C> identity() {
      return Pair::of;
    }
  }
}

// End Shuttle.java
