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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.newtype.ast.Ast;
import net.hydromatic.newtype.ast.Node;
import net.hydromatic.newtype.ast.Op;
import net.hydromatic.newtype.ast.Shuttle;
import net.hydromatic.newtype.util.Pair;
import net.hydromatic.newtype.util.Unit;

/**
 * Rewrites a tree into canonical form.
 *
 * <p>A tree in canonical form contains no "if", "match", "cond" or "let"
 * expressions. Conditionals become nested {@link Ast.ExtendsExpr}
 * expressions, and bound identifiers are replaced by their values.
 *
 * <p>The rewrite is bottom-up: the children of a node are simplified before
 * the node itself. Among other things, this means that an inner "let" is
 * eliminated before the "let" that encloses it, so that the inner binding
 * shadows the outer one.
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public class Simplifier {
  private final ImmutableMap<Prop, Object> props;
  private final Tracer tracer;
  private final int printDepth;

  private Simplifier(ImmutableMap<Prop, Object> props, Tracer tracer) {
    this.props = requireNonNull(props);
    this.tracer = requireNonNull(tracer);
    this.printDepth = Prop.PRINT_DEPTH.intValue(props);
  }

  /** Creates a Simplifier. */
  public static Simplifier create(Map<Prop, Object> props, Tracer tracer) {
    return new Simplifier(ImmutableMap.copyOf(props), tracer);
  }

  /** Simplifies a tree using default properties. */
  public static Node simplify(Node node) {
    return simplify(node, ImmutableMap.of(), Tracers.empty());
  }

  /** Simplifies a tree. */
  public static Node simplify(Node node, Map<Prop, Object> props,
      Tracer tracer) {
    return create(props, tracer).apply(node);
  }

  /** Simplifies a tree, typically a {@link Ast.Program}. */
  public Node apply(Node node) {
    final Node result = Shuttle.transform(node, this::rewrite);
    if (Prop.CHECK_CANONICAL.booleanValue(props)) {
      checkCanonical(result);
    }
    tracer.onResult(result);
    return result;
  }

  /** Rewrites a node whose children are already simplified. */
  private Node rewrite(Node node) {
    final Node result;
    switch (node.op()) {
    case IF:
      result = Conditions.lowerIf(node.value(Ast.IfExpr.class), printDepth);
      break;
    case MATCH:
      result =
          Matches.lowerMatch(node.value(Ast.MatchExpr.class), printDepth);
      break;
    case COND:
      result = Matches.lowerCond(node.value(Ast.CondExpr.class), printDepth);
      break;
    case LET:
      result = Replacer.substitute(node.value(Ast.LetExpr.class));
      break;
    default:
      return node;
    }
    tracer.onRewrite(node, result);
    return result;
  }

  /** Throws if a tree is not in canonical form. */
  private void checkCanonical(Node node) {
    Shuttle.prewalk(node, Unit.INSTANCE, (Node n, Unit unit) -> {
      if (Op.SURFACE_OPS.contains(n.op())) {
        throw new CompileException("unexpected " + n.op().lowerName()
            + " expression after simplification", n, printDepth);
      }
      return Pair.of(n, unit);
    });
  }
}

// End Simplifier.java
