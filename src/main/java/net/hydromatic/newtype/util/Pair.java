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
package net.hydromatic.newtype.util;

import static java.util.Objects.requireNonNull;

import java.util.Map;
import java.util.Objects;

/**
 * Pair of objects.
 *
 * <p>Because a pair implements {@link Map.Entry}, it can be used in any map
 * entry context; but it is immutable, so {@link #setValue} throws.
 *
 * @param <T1> Left-hand type
 * @param <T2> Right-hand type
 */
public class Pair<T1, T2> implements Map.Entry<T1, T2> {
  public final T1 left;
  public final T2 right;

  /** Creates a Pair. Neither element may be null. */
  protected Pair(T1 left, T2 right) {
    this.left = requireNonNull(left, "left");
    this.right = requireNonNull(right, "right");
  }

  /** Creates a Pair. */
  public static <T1, T2> Pair<T1, T2> of(T1 left, T2 right) {
    return new Pair<>(left, right);
  }

  @Override public int hashCode() {
    return Objects.hash(left, right);
  }

  @Override public boolean equals(Object o) {
    return this == o
        || o instanceof Pair
        && left.equals(((Pair) o).left)
        && right.equals(((Pair) o).right);
  }

  @Override public String toString() {
    return "<" + left + ", " + right + ">";
  }

  @Override public T1 getKey() {
    return left;
  }

  @Override public T2 getValue() {
    return right;
  }

  @Override public T2 setValue(T2 value) {
    throw new UnsupportedOperationException();
  }
}

// End Pair.java
