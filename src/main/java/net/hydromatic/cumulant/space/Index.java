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
package net.hydromatic.cumulant.space;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Comparator;
import java.util.Objects;
import net.hydromatic.cumulant.compile.IndexBindingException;

/**
 * Index over a family of identical subsystems.
 *
 * <p>An index ranges over {@code 1..size} copies of the subspace {@link #aon}.
 * The size is either a symbol (such as "N") or a fixed number. A symbolic
 * index has a name ("i", "j"); a concrete index has a value, and its name is
 * that value.
 */
public class Index implements Comparable<Index> {
  /**
   * Orders indices by subspace, then concrete indices (by value) before
   * symbolic indices (by name).
   */
  public static final Comparator<Index> ORDERING =
      Comparator.<Index>comparingInt(i -> i.aon)
          .thenComparing(i -> !i.isConcrete())
          .thenComparingInt(i -> i.value)
          .thenComparing(i -> i.name);

  public final String name;
  public final int aon;
  /** Name of the range; the size symbol, or the size if it is fixed. */
  public final String rangeName;
  /** Size of the range, or 0 if the size is symbolic. */
  public final int rangeSize;
  /** Value of a concrete index, or 0 if the index is symbolic. */
  public final int value;

  private Index(String name, int aon, String rangeName, int rangeSize,
      int value) {
    this.name = requireNonNull(name, "name");
    this.aon = aon;
    this.rangeName = requireNonNull(rangeName, "rangeName");
    this.rangeSize = rangeSize;
    this.value = value;
    checkArgument(!name.isEmpty(), "empty name");
  }

  /** Creates a symbolic index whose range has a symbolic size. */
  public static Index of(HilbertSpace space, String name, String rangeName,
      int aon) {
    checkSpace(space, name, aon);
    return new Index(name, aon, rangeName, 0, 0);
  }

  /** Creates a symbolic index whose range has a fixed size. */
  public static Index of(HilbertSpace space, String name, int size, int aon) {
    checkSpace(space, name, aon);
    checkArgument(size > 0, "size must be positive");
    return new Index(name, aon, Integer.toString(size), size, 0);
  }

  private static void checkSpace(HilbertSpace space, String name, int aon) {
    if (!space.contains(aon)) {
      throw new IndexBindingException(
          "index " + name + " bound to undeclared subspace " + aon, name);
    }
  }

  /** Returns whether this index has a concrete value. */
  public boolean isConcrete() {
    return value > 0;
  }

  /** Returns whether the size of the range is a symbol. */
  public boolean hasSymbolicRange() {
    return rangeSize == 0;
  }

  /** Returns a concrete index with the same range. */
  public Index withValue(int value) {
    checkArgument(value > 0, "index value must be positive");
    checkArgument(rangeSize == 0 || value <= rangeSize,
        "value %s out of range %s", value, rangeName);
    return new Index(Integer.toString(value), aon, rangeName, rangeSize,
        value);
  }

  /** Returns a symbolic index with the same range and a different name. */
  public Index withName(String name) {
    if (name.equals(this.name) && !isConcrete()) {
      return this;
    }
    return new Index(name, aon, rangeName, rangeSize, 0);
  }

  /** Returns whether this index ranges over the same subsystems as another. */
  public boolean sameRange(Index o) {
    return aon == o.aon
        && rangeName.equals(o.rangeName)
        && rangeSize == o.rangeSize;
  }

  @Override
  public int compareTo(Index o) {
    return ORDERING.compare(this, o);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, aon, rangeName, value);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Index
            && ((Index) o).name.equals(name)
            && ((Index) o).aon == aon
            && ((Index) o).rangeName.equals(rangeName)
            && ((Index) o).rangeSize == rangeSize
            && ((Index) o).value == value;
  }

  @Override
  public String toString() {
    return name;
  }
}

// End Index.java
