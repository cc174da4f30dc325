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
import static net.hydromatic.newtype.Matchers.isGenerated;
import static net.hydromatic.newtype.TestUtils.and;
import static net.hydromatic.newtype.TestUtils.arm;
import static net.hydromatic.newtype.TestUtils.ext;
import static net.hydromatic.newtype.TestUtils.gen;
import static net.hydromatic.newtype.TestUtils.id;
import static net.hydromatic.newtype.TestUtils.ifThenElse;
import static net.hydromatic.newtype.TestUtils.match;
import static net.hydromatic.newtype.TestUtils.num;
import static net.hydromatic.newtype.TestUtils.primitive;
import static net.hydromatic.newtype.TestUtils.tuple;
import static net.hydromatic.newtype.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.newtype.ast.Ast;
import net.hydromatic.newtype.ast.Node;
import net.hydromatic.newtype.ast.Span;
import org.junit.jupiter.api.Test;

/** Tests for {@link Matches}. */
class MatchesTest {
  private static final Node V = id("V");
  private static final Node NUMBER = primitive(Ast.PrimitiveType.NUMBER);
  private static final Node STRING = primitive(Ast.PrimitiveType.STRING);

  private static Ast.MatchArm wildcardArm(Node body) {
    return arm(gen(ast.wildcard()), body);
  }

  private static Node cond(Node elseArm, Ast.CondArm... arms) {
    return gen(ast.condExpr(ImmutableList.copyOf(arms), elseArm));
  }

  @Test void testMatch() {
    final Node match =
        match(V, arm(NUMBER, num(1)), arm(STRING, num(2)),
            wildcardArm(num(3)));
    assertThat(Simplifier.simplify(match),
        hasToString("(extends-expr V number 1 (extends-expr V string 2 3))"));
  }

  /** The wildcard arm is the default wherever it occurs. */
  @Test void testWildcardFirst() {
    final Node match =
        match(V, wildcardArm(num(3)), arm(NUMBER, num(1)),
            arm(STRING, num(2)));
    assertThat(Simplifier.simplify(match),
        hasToString("(extends-expr V number 1 (extends-expr V string 2 3))"));
  }

  @Test void testNoWildcard() {
    final Node match = match(V, arm(NUMBER, num(1)));
    assertThat(Simplifier.simplify(match),
        hasToString("(extends-expr V number 1 never)"));
  }

  @Test void testOnlyWildcard() {
    assertThat(Simplifier.simplify(match(V, wildcardArm(num(3)))),
        hasToString("3"));
    assertThat(Simplifier.simplify(match(V)), hasToString("never"));
  }

  /** A match is equivalent to nested "if" expressions. */
  @Test void testMatchIsNestedIf() {
    final Node match =
        match(V, arm(NUMBER, num(1)), arm(STRING, num(2)),
            wildcardArm(num(3)));
    final Node nestedIf =
        ifThenElse(ext(V, NUMBER), num(1),
            ifThenElse(ext(V, STRING), num(2), num(3)));
    assertThat(Simplifier.simplify(match), is(Simplifier.simplify(nestedIf)));
  }

  @Test void testDuplicateWildcard() {
    final String source = "match V do _ => 1, number => 2, _ => 3 end";
    final Node duplicate =
        Node.of(Span.of(source, 32, 33), ast.wildcard());
    final Node match =
        match(V, wildcardArm(num(1)), arm(NUMBER, num(2)),
            arm(duplicate, num(3)));
    final CompileException e =
        assertThrows(CompileException.class,
            () -> Simplifier.simplify(match));
    assertThat(e.getMessage(), is("duplicate wildcard arm (arm _ 3): _"));
    assertThat(e.span(), is(duplicate.span));
    assertThat(e.describeTo(new StringBuilder()),
        hasToString("1.33 Error: duplicate wildcard arm (arm _ 3): _"));
  }

  /** Each conditional gets its own copy of the value being matched. */
  @Test void testValueIsCopied() {
    final Node value =
        Node.of(Span.of("T", 0, 1), ast.ident("T"));
    final Ast.MatchExpr matchExpr =
        ast.matchExpr(value,
            ImmutableList.of(arm(NUMBER, num(1)), arm(STRING, num(2))));
    final Node result = Matches.lowerMatch(matchExpr, -1);
    assertThat(result, isGenerated());

    final Ast.ExtendsExpr outer = result.value(Ast.ExtendsExpr.class);
    final Ast.ExtendsExpr inner =
        outer.elseBranch.value(Ast.ExtendsExpr.class);
    assertThat(outer.lhs, is(value));
    assertThat(inner.lhs, is(value));
    assertThat(outer.lhs, not(sameInstance(value)));
    assertThat(outer.lhs, not(sameInstance(inner.lhs)));
    assertThat(inner.lhs, hasSpan(value.span));
  }

  @Test void testMatchInsideMatch() {
    final Node match =
        match(match(V, arm(NUMBER, STRING), wildcardArm(NUMBER)),
            arm(STRING, num(1)), wildcardArm(num(2)));
    assertThat(Simplifier.simplify(match),
        hasToString("(extends-expr (extends-expr V number string number)"
            + " string 1 2)"));
  }

  @Test void testCond() {
    final Node cond =
        cond(num(3), ast.condArm(ext(id("A"), id("B")), num(1)),
            ast.condArm(ext(id("C"), id("D")), num(2)));
    assertThat(Simplifier.simplify(cond),
        hasToString("(extends-expr A B 1 (extends-expr C D 2 3))"));

    final Node nestedIf =
        ifThenElse(ext(id("A"), id("B")), num(1),
            ifThenElse(ext(id("C"), id("D")), num(2), num(3)));
    assertThat(Simplifier.simplify(cond), is(Simplifier.simplify(nestedIf)));
  }

  @Test void testCondWithCompoundCondition() {
    final Node cond =
        cond(num(2),
            ast.condArm(and(ext(id("A"), id("B")), ext(id("C"), id("D"))),
                num(1)));
    assertThat(Simplifier.simplify(cond),
        hasToString("(extends-expr A B (extends-expr C D 1 2) 2)"));
  }

  @Test void testCondWithoutArms() {
    assertThat(Simplifier.simplify(cond(tuple(num(1)))),
        hasToString("(tuple 1)"));
  }

  @Test void testCondInvalidCondition() {
    final Node cond = cond(num(2), ast.condArm(id("A"), num(1)));
    final CompileException e =
        assertThrows(CompileException.class,
            () -> Simplifier.simplify(cond));
    assertThat(e.getMessage(), is("expected extends operator: A"));
  }
}

// End MatchesTest.java
