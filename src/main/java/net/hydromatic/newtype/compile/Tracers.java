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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.newtype.ast.Node;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each rewrite,
   * then calls the underlying tracer. */
  public static Tracer withOnRewrite(Tracer tracer,
      BiConsumer<Node, Node> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onRewrite(Node before, Node after) {
        consumer.accept(before, after);
        super.onRewrite(before, after);
      }
    };
  }

  /** Returns a tracer that performs the given action on the result of
   * simplification, then calls the underlying tracer. */
  public static Tracer withOnResult(Tracer tracer, Consumer<Node> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onResult(Node result) {
        consumer.accept(result);
        super.onResult(result);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onRewrite(Node before, Node after) {
    }

    @Override public void onResult(Node result) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onRewrite(Node before, Node after) {
      tracer.onRewrite(before, after);
    }

    @Override public void onResult(Node result) {
      tracer.onResult(result);
    }
  }
}

// End Tracers.java
