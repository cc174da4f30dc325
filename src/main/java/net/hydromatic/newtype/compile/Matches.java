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

import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.newtype.ast.Ast;
import net.hydromatic.newtype.ast.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Compiles "match" and "cond" expressions into nested
 * {@link Ast.ExtendsExpr} conditionals.
 */
public class Matches {
  private Matches() {}

  /**
   * Converts a match expression whose children are already simplified.
   *
   * <p>The arm whose pattern is the wildcard "_", wherever it occurs, becomes
   * the final "else" branch; if there is no wildcard arm, the final branch is
   * {@code never}. The other arms are tested in order, so
   *
   * <blockquote><pre>
   * match V do P1 =&gt; B1, P2 =&gt; B2, _ =&gt; D end
   * </pre></blockquote>
   *
   * <p>becomes
   *
   * <blockquote><pre>
   * V extends P1 ? B1 : (V extends P2 ? B2 : D)
   * </pre></blockquote>
   *
   * <p>Each conditional gets its own copy of {@code V}.
   *
   * @throws CompileException if more than one arm is a wildcard
   */
  public static Node lowerMatch(Ast.MatchExpr matchExpr, int printDepth) {
    Ast.@Nullable MatchArm defaultArm = null;
    final List<Ast.MatchArm> arms = new ArrayList<>();
    for (Ast.MatchArm arm : matchExpr.arms) {
      if (arm.isWildcard()) {
        if (defaultArm != null) {
          throw new CompileException("duplicate wildcard arm " + arm,
              arm.pattern, printDepth);
        }
        defaultArm = arm;
      } else {
        arms.add(arm);
      }
    }

    Node acc =
        defaultArm != null ? defaultArm.body : Node.generate(ast.never());
    for (Ast.MatchArm arm : Lists.reverse(arms)) {
      acc =
          Node.generate(
              ast.extendsExpr(matchExpr.value.deepCopy(), arm.pattern,
                  arm.body, acc));
    }
    return acc;
  }

  /**
   * Converts a cond expression whose children are already simplified.
   *
   * <p>{@code cond do C1 => B1, C2 => B2, else => E end} has the same meaning
   * as {@code if C1 then B1 else if C2 then B2 else E}.
   *
   * @throws CompileException if a condition is not valid in an "if"
   */
  public static Node lowerCond(Ast.CondExpr condExpr, int printDepth) {
    Node acc = condExpr.elseArm;
    for (Ast.CondArm arm : Lists.reverse(condExpr.arms)) {
      acc = Conditions.lower(arm.condition, arm.body, acc, printDepth);
    }
    return acc;
  }
}

// End Matches.java
