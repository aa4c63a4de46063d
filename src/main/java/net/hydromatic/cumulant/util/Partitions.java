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
import java.util.ArrayList;
import java.util.List;

/** Set partitions. */
public abstract class Partitions {
  private Partitions() {}

  /**
   * Returns every partition of the positions {@code 0 .. n - 1} into
   * non-empty blocks.
   *
   * <p>Each block is ascending, and blocks are ordered by their first
   * position. There are Bell(n) partitions: 1, 1, 2, 5, 15, 52, ...
   */
  public static List<List<List<Integer>>> of(int n) {
    return of(0, n);
  }

  private static List<List<List<Integer>>> of(int start, int n) {
    if (start == n) {
      return ImmutableList.of(ImmutableList.of());
    }
    final List<List<List<Integer>>> result = new ArrayList<>();
    for (List<List<Integer>> partition : of(start + 1, n)) {
      // Position "start" in a block of its own.
      result.add(Static.plus(ImmutableList.of(start), partition));

      // Position "start" joins an existing block, which moves to the front.
      for (int i = 0; i < partition.size(); i++) {
        final List<List<Integer>> joined = new ArrayList<>(partition);
        joined.remove(i);
        joined.add(0, Static.plus(start, partition.get(i)));
        result.add(joined);
      }
    }
    return result;
  }

  /**
   * Returns every partition of a list into non-empty blocks, each block
   * keeping the order of the list.
   */
  public static <E> List<List<List<E>>> of(List<E> list) {
    return of(list, list.size());
  }

  /**
   * Returns every partition of a list into blocks that have at most
   * {@code max} elements.
   */
  public static <E> List<List<List<E>>> of(List<E> list, int max) {
    final List<List<List<E>>> result = new ArrayList<>();
    for (List<List<Integer>> partition : of(list.size())) {
      if (Static.allMatch(partition, block -> block.size() <= max)) {
        result.add(
            Static.transformEager(partition, block ->
                Static.transformEager(block, list::get)));
      }
    }
    return result;
  }
}

// End Partitions.java
