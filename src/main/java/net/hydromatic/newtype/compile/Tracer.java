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

import net.hydromatic.newtype.ast.Node;

/** Called on various events during simplification. */
public interface Tracer {
  /** Called when an "if", "match", "cond" or "let" expression has been
   * rewritten. {@code before} has simplified children; {@code after} is its
   * canonical replacement. */
  void onRewrite(Node before, Node after);

  /** Called on the result of simplifying a tree. */
  void onResult(Node result);
}

// End Tracer.java
