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

import static net.hydromatic.newtype.Matchers.hasSpan;
import static net.hydromatic.newtype.Matchers.isCanonical;
import static net.hydromatic.newtype.Matchers.isGenerated;
import static net.hydromatic.newtype.TestUtils.and;
import static net.hydromatic.newtype.TestUtils.arm;
import static net.hydromatic.newtype.TestUtils.at;
import static net.hydromatic.newtype.TestUtils.ext;
import static net.hydromatic.newtype.TestUtils.gen;
import static net.hydromatic.newtype.TestUtils.id;
import static net.hydromatic.newtype.TestUtils.ifThen;
import static net.hydromatic.newtype.TestUtils.ifThenElse;
import static net.hydromatic.newtype.TestUtils.let;
import static net.hydromatic.newtype.TestUtils.match;
import static net.hydromatic.newtype.TestUtils.not;
import static net.hydromatic.newtype.TestUtils.notExt;
import static net.hydromatic.newtype.TestUtils.num;
import static net.hydromatic.newtype.TestUtils.or;
import static net.hydromatic.newtype.TestUtils.program;
import static net.hydromatic.newtype.TestUtils.tuple;
import static net.hydromatic.newtype.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.newtype.ast.Ast;
import net.hydromatic.newtype.ast.Node;
import net.hydromatic.newtype.ast.Op;
import net.hydromatic.newtype.ast.Span;
import org.junit.jupiter.api.Test;

/** Tests for {@link Simplifier} and {@link Conditions}. */
class SimplifierTest {
  private static final Node A = id("A");
  private static final Node B = id("B");
  private static final Node C = id("C");
  private static final Node D = id("D");
  private static final Node X = id("X");
  private static final Node Y = id("Y");

  private static void checkSimplify(Node node, String expected) {
    final Node result = Simplifier.simplify(node);
    assertThat(result, hasToString(expected));
    assertThat(result, isCanonical());

    // Simplifying again changes nothing
    assertThat(Simplifier.simplify(result), is(result));
  }

  @Test void testIf() {
    checkSimplify(ifThenElse(ext(A, B), X, Y), "(extends-expr A B X Y)");
    checkSimplify(ifThenElse(notExt(A, B), X, Y), "(extends-expr A B Y X)");
  }

  @Test void testIfWithoutElse() {
    checkSimplify(ifThen(ext(A, B), X), "(extends-expr A B X never)");
    checkSimplify(ifThen(not(ext(A, B)), X), "(extends-expr A B never X)");
  }

  /** "not" swaps the branches, and so "not (A &lt;: B)" is the same as
   * "A !&lt;: B". */
  @Test void testNot() {
    final Node notExtends = Simplifier.simplify(ifThenElse(not(ext(A, B)), X, Y));
    assertThat(notExtends, hasToString("(extends-expr A B Y X)"));
    assertThat(Simplifier.simplify(ifThenElse(notExt(A, B), X, Y)),
        is(notExtends));
    assertThat(Simplifier.simplify(ifThenElse(ext(A, B), Y, X)),
        is(notExtends));
    checkSimplify(ifThenElse(not(not(ext(A, B))), X, Y),
        "(extends-expr A B X Y)");
  }

  @Test void testAnd() {
    checkSimplify(ifThenElse(and(ext(A, B), ext(C, D)), X, Y),
        "(extends-expr A B (extends-expr C D X Y) Y)");
    checkSimplify(ifThenElse(and(ext(A, B), notExt(C, D)), X, Y),
        "(extends-expr A B (extends-expr C D Y X) Y)");

    // "if P and Q then T else E" is "if P then (if Q then T else E) else E"
    assertThat(
        Simplifier.simplify(ifThenElse(and(ext(A, B), ext(C, D)), X, Y)),
        is(
            Simplifier.simplify(
                ifThenElse(ext(A, B), ifThenElse(ext(C, D), X, Y), Y))));
  }

  @Test void testOr() {
    checkSimplify(ifThenElse(or(ext(A, B), ext(C, D)), X, Y),
        "(extends-expr A B X (extends-expr C D X Y))");

    // "if P or Q then T else E" is "if P then T else (if Q then T else E)"
    assertThat(
        Simplifier.simplify(ifThenElse(or(ext(A, B), ext(C, D)), X, Y)),
        is(
            Simplifier.simplify(
                ifThenElse(ext(A, B), X, ifThenElse(ext(C, D), X, Y)))));
  }

  /** De Morgan: "not (P and Q)" behaves as "(not P) or (not Q)". */
  @Test void testNotAnd() {
    final Node notAnd =
        Simplifier.simplify(ifThenElse(not(and(ext(A, B), ext(C, D))), X, Y));
    assertThat(notAnd,
        hasToString("(extends-expr A B (extends-expr C D Y X) X)"));
    assertThat(
        Simplifier.simplify(
            ifThenElse(or(notExt(A, B), notExt(C, D)), X, Y)),
        is(notAnd));
  }

  @Test void testNestedIf() {
    checkSimplify(
        ifThenElse(ext(A, B), ifThen(ext(C, D), X),
            tuple(ifThenElse(ext(X, Y), num(1), num(2)))),
        "(extends-expr A B (extends-expr C D X never)"
            + " (tuple (extends-expr X Y 1 2)))");
  }

  @Test void testConditionInsideBranch() {
    // The branches are simplified before the condition is lowered
    checkSimplify(
        ifThenElse(and(ext(A, B), ext(C, D)), ifThen(ext(X, Y), num(1)), Y),
        "(extends-expr A B (extends-expr C D (extends-expr X Y 1 never) Y)"
            + " Y)");
  }

  @Test void testProgram() {
    checkSimplify(
        program("T",
            let("x", ifThenElse(ext(A, B), num(1), num(2)),
                match(id("x"), arm(id("number"), id("x")),
                    arm(gen(ast.wildcard()), never())))),
        "(program (statement (type T"
            + " (extends-expr (extends-expr A B 1 2) number"
            + " (extends-expr A B 1 2) never))))");
  }

  private static Node never() {
    return gen(ast.never());
  }

  @Test void testUnsupportedOperator() {
    final Node equals = gen(ast.extendsCall(Op.EQUALS, A, B));
    final CompileException e =
        assertThrows(CompileException.class,
            () -> Simplifier.simplify(ifThenElse(equals, X, Y)));
    assertThat(e.getMessage(), is("unsupported operator ==: (== A B)"));
    assertThat(e.dump(), is("(== A B)"));
    assertThat(e.span(), nullValue());

    final Node strictNotEquals =
        gen(ast.extendsCall(Op.STRICT_NOT_EQUALS, A, B));
    final CompileException e2 =
        assertThrows(CompileException.class,
            () -> Simplifier.simplify(
                ifThenElse(and(ext(C, D), strictNotEquals), X, Y)));
    assertThat(e2.getMessage(), is("unsupported operator !==: (!== A B)"));
  }

  @Test void testExpectedExtendsOperator() {
    final String source = "A | B";
    final Node union = at(source, ast.infixCall(Op.UNION, A, B));
    final CompileException e =
        assertThrows(CompileException.class,
            () -> Simplifier.simplify(ifThenElse(not(union), X, Y)));
    assertThat(e.getMessage(), is("expected extends operator: (| A B)"));
    assertThat(e.span(), is(Span.of(source, 0, 5)));
    assertThat(e, hasToString(CompileException.class.getName()
        + ": expected extends operator: (| A B) at 1.1-1.6"));
    assertThat(e.describeTo(new StringBuilder()),
        hasToString("1.1-1.6 Error: expected extends operator: (| A B)"));

    final CompileException e2 =
        assertThrows(CompileException.class,
            () -> Simplifier.simplify(ifThenElse(A, X, Y)));
    assertThat(e2.getMessage(), is("expected extends operator: A"));
    assertThat(e2, hasToString(CompileException.class.getName()
        + ": expected extends operator: A at <generated>"));
  }

  @Test void testPrintDepth() {
    final Node condition =
        gen(ast.extendsCall(Op.EQUALS, tuple(A, tuple(B)), C));
    final Map<Prop, Object> props = new HashMap<>();
    Prop.PRINT_DEPTH.set(props, 2);
    final CompileException e =
        assertThrows(CompileException.class,
            () -> Simplifier.simplify(ifThenElse(condition, X, Y), props,
                Tracers.empty()));
    assertThat(e.getMessage(),
        is("unsupported operator ==: (== (tuple ... ...) C)"));
  }

  /** Nodes that are not rewritten keep their span; conditionals that
   * simplification creates have none. */
  @Test void testSpans() {
    final String source = "if A <: B then X else [Y]";
    final Node x = Node.of(Span.of(source, 15, 16), ast.ident("X"));
    final Node y = Node.of(Span.of(source, 23, 24), ast.ident("Y"));
    final Node tupleY = Node.of(Span.of(source, 22, 25), ast.tuple(y));
    final Node ifNode =
        at(source, ast.ifExpr(ext(A, B), x, tupleY));
    final Node result = Simplifier.simplify(ifNode);
    assertThat(result, isGenerated());

    final Ast.ExtendsExpr extendsExpr = result.value(Ast.ExtendsExpr.class);
    assertThat(extendsExpr.thenBranch, hasSpan(x.span));
    assertThat(extendsExpr.elseBranch, hasSpan(tupleY.span));
    assertThat(extendsExpr.elseBranch.value(Ast.Tuple.class).items.get(0),
        hasSpan(y.span));
  }

  @Test void testTracer() {
    final List<String> rewrites = new ArrayList<>();
    final List<Node> results = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnResult(
            Tracers.withOnRewrite(Tracers.empty(),
                (before, after) -> rewrites.add(before.op().lowerName()
                    + " => " + after)),
            results::add);
    final Node tree =
        tuple(ifThen(ext(A, B), X), let("x", Y, tuple(id("x"))));
    final Node result =
        Simplifier.create(new HashMap<>(), tracer).apply(tree);
    assertThat(rewrites,
        hasToString("[if => (extends-expr A B X never), let => (tuple Y)]"));
    assertThat(results, is(ImmutableList.of(result)));
  }

  @Test void testCheckCanonicalDisabled() {
    final Map<Prop, Object> props = new HashMap<>();
    Prop.CHECK_CANONICAL.set(props, false);
    final Node result =
        Simplifier.simplify(ifThenElse(ext(A, B), X, Y), props,
            Tracers.empty());
    assertThat(result, hasToString("(extends-expr A B X Y)"));
  }

  @Test void testCanonicalTreeIsUnchanged() {
    final Node tree =
        tuple(gen(ast.extendsExpr(A, B, X, Y)),
            gen(ast.infixCall(Op.UNION, C, D)));
    assertThat(Simplifier.simplify(tree), is(tree));
  }
}

// End SimplifierTest.java
