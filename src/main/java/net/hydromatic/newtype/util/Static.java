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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import java.util.List;
import java.util.SortedMap;
import java.util.function.Function;

/** Utilities. */
public class Static {
  private Static() {}

  /**
   * Eagerly converts a List to an ImmutableList, applying a mapping function
   * to each element, in order.
   *
   * <p>Unlike {@link com.google.common.collect.Lists#transform}, the mapping
   * function is called exactly once per element, at the time of the call.
   */
  public static <E, T> ImmutableList<T> transformEager(
      List<? extends E> elements, Function<E, T> mapper) {
    switch (elements.size()) {
    case 0:
      return ImmutableList.of();

    case 1:
      return ImmutableList.of(mapper.apply(elements.get(0)));

    default:
      final ImmutableList.Builder<T> b =
          ImmutableList.builderWithExpectedSize(elements.size());
      elements.forEach(e -> b.add(mapper.apply(e)));
      return b.build();
    }
  }

  /**
   * Eagerly converts a SortedMap to an ImmutableSortedMap, applying a mapping
   * function to each value, in key order.
   */
  public static <K extends Comparable<K>, V, V2> ImmutableSortedMap<K, V2>
      transformValuesEager(SortedMap<K, V> map, Function<V, V2> mapper) {
    final ImmutableSortedMap.Builder<K, V2> b =
        ImmutableSortedMap.naturalOrder();
    map.forEach((k, v) -> b.put(k, mapper.apply(v)));
    return b.build();
  }
}

// End Static.java
