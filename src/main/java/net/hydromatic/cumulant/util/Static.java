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
package net.hydromatic.cumulant.util;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/** Utilities. */
public class Static {
  private Static() {}

  /** Prepends an element to a list. */
  public static <E> List<E> plus(E e, List<E> list) {
    return ImmutableList.<E>builder().add(e).addAll(list).build();
  }

  /** Returns whether a predicate is true for all elements of a list. */
  public static <E> boolean allMatch(
      Iterable<? extends E> iterable, Predicate<E> predicate) {
    for (E e : iterable) {
      if (!predicate.test(e)) {
        return false;
      }
    }
    return true;
  }

  /** Returns whether a predicate is true for at least one element of a list. */
  public static <E> boolean anyMatch(
      Iterable<? extends E> iterable, Predicate<E> predicate) {
    for (E e : iterable) {
      if (predicate.test(e)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Eagerly converts a Collection to an ImmutableList, applying a mapping
   * function to each element.
   */
  public static <E, T> ImmutableList<T> transformEager(
      Collection<? extends E> elements, Function<E, T> mapper) {
    if (elements.isEmpty()) {
      return ImmutableList.of();
    }
    final ImmutableList.Builder<T> b =
        ImmutableList.builderWithExpectedSize(elements.size());
    elements.forEach(e -> b.add(mapper.apply(e)));
    return b.build();
  }

  /**
   * Eagerly converts a List to an ImmutableList, keeping elements that pass a
   * predicate.
   */
  public static <E> ImmutableList<E> filterEager(
      List<? extends E> elements, Predicate<E> predicate) {
    for (int i = 0; i < elements.size(); i++) {
      E element = elements.get(i);
      if (predicate.test(element)) {
        continue;
      }
      final ImmutableList.Builder<E> b =
          ImmutableList.builderWithExpectedSize(elements.size());
      for (int j = 0; j < i; j++) {
        b.add(elements.get(j));
      }
      for (int j = i + 1; j < elements.size(); j++) {
        E e = elements.get(j);
        if (predicate.test(e)) {
          b.add(e);
        }
      }
      return b.build();
    }
    return ImmutableList.copyOf(elements);
  }

  /**
   * Groups elements by a key, preserving the order in which keys are first
   * seen and the order of elements within each group.
   */
  public static <E, K> ImmutableMap<K, List<E>> groupBy(
      Iterable<? extends E> elements, Function<E, K> keyFunction) {
    final Map<K, ImmutableList.Builder<E>> map = new LinkedHashMap<>();
    for (E e : elements) {
      map.computeIfAbsent(keyFunction.apply(e), k -> ImmutableList.builder())
          .add(e);
    }
    final ImmutableMap.Builder<K, List<E>> b = ImmutableMap.builder();
    map.forEach((k, list) -> b.put(k, list.build()));
    return b.build();
  }
}

// End Static.java
