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

import static net.hydromatic.newtype.ast.AstBuilder.ast;

import net.hydromatic.newtype.ast.Ast;
import net.hydromatic.newtype.ast.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Lowers boolean conditions over the extends relation into nested
 * {@link Ast.ExtendsExpr} conditionals.
 *
 * <p>The conditions that the grammar allows are {@code A <: B},
 * {@code A !<: B}, {@code not C}, {@code C and D} and {@code C or D}.
 * Negation swaps the branches. Conjunction nests the right operand inside
 * the "then" branch of the left operand; disjunction nests it inside the
 * "else" branch. So
 *
 * <blockquote><pre>
 * if A &lt;: B and C &lt;: D then x else y
 * </pre></blockquote>
 *
 * <p>becomes
 *
 * <blockquote><pre>
 * A extends B ? (C extends D ? x : y) : y
 * </pre></blockquote>
 */
public class Conditions {
  private Conditions() {}

  /** Lowers an "if" expression whose children are already simplified. */
  public static Node lowerIf(Ast.IfExpr ifExpr, int printDepth) {
    return lower(ifExpr.condition, ifExpr.thenBranch, ifExpr.elseBranch,
        printDepth);
  }

  /**
   * Converts {@code if condition then thenBranch else elseBranch} into a
   * tree of extends-conditionals. If {@code elseBranch} is null, the "else"
   * branch is {@code never}.
   *
   * @throws CompileException if the condition is an equality, or is not a
   * condition over the extends relation
   */
  public static Node lower(Node condition, Node thenBranch,
      @Nullable Node elseBranch, int printDepth) {
    final Node elseNode =
        elseBranch != null ? elseBranch : Node.generate(ast.never());
    switch (condition.op()) {
    case NOT:
      final Ast.ExtendsPrefixCall not =
          condition.value(Ast.ExtendsPrefixCall.class);
      return lower(not.value, elseNode, thenBranch, printDepth);

    case EXTENDS:
      final Ast.ExtendsInfixCall extendsCall =
          condition.value(Ast.ExtendsInfixCall.class);
      return Node.generate(
          ast.extendsExpr(extendsCall.lhs, extendsCall.rhs, thenBranch,
              elseNode));

    case NOT_EXTENDS:
      final Ast.ExtendsInfixCall notExtendsCall =
          condition.value(Ast.ExtendsInfixCall.class);
      return Node.generate(
          ast.extendsExpr(notExtendsCall.lhs, notExtendsCall.rhs, elseNode,
              thenBranch));

    case AND:
      // "else" occurs twice in the result; each occurrence is a separate tree
      final Ast.ExtendsInfixCall and =
          condition.value(Ast.ExtendsInfixCall.class);
      final Node then2 =
          lower(and.rhs, thenBranch, elseNode.deepCopy(), printDepth);
      return lower(and.lhs, then2, elseNode, printDepth);

    case OR:
      final Ast.ExtendsInfixCall or =
          condition.value(Ast.ExtendsInfixCall.class);
      final Node else2 =
          lower(or.rhs, thenBranch.deepCopy(), elseNode, printDepth);
      return lower(or.lhs, thenBranch, else2, printDepth);

    default:
      if (condition.op().isEquality()) {
        throw new CompileException("unsupported operator "
            + condition.op().symbol, condition, printDepth);
      }
      throw new CompileException("expected extends operator", condition,
          printDepth);
    }
  }
}

// End Conditions.java
