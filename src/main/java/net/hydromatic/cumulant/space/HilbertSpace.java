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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Composite Hilbert space, the tensor product of independent subspaces.
 *
 * <p>Immutable. The position of a subspace in the list (its "acts-on"
 * number, or {@code aon}) identifies it, and also fixes the order in which
 * operators on different subsystems are written in a canonical product.
 */
public class HilbertSpace {
  public final ImmutableList<Subspace> subspaces;

  private HilbertSpace(ImmutableList<Subspace> subspaces) {
    this.subspaces = requireNonNull(subspaces);
  }

  /** Creates a composite space. */
  public static HilbertSpace of(Subspace... subspaces) {
    return of(ImmutableList.copyOf(subspaces));
  }

  /** Creates a composite space. */
  public static HilbertSpace of(List<? extends Subspace> subspaces) {
    return new HilbertSpace(ImmutableList.copyOf(subspaces));
  }

  /** Returns the number of subspaces. */
  public int size() {
    return subspaces.size();
  }

  /** Returns whether {@code aon} is the number of a subspace. */
  public boolean contains(int aon) {
    return aon >= 0 && aon < subspaces.size();
  }

  /** Returns the subspace with a given acts-on number. */
  public Subspace get(int aon) {
    return subspaces.get(aon);
  }

  /**
   * Returns the acts-on number of the first subspace with a given name, or
   * -1.
   */
  public int aon(String name) {
    for (int i = 0; i < subspaces.size(); i++) {
      if (subspaces.get(i).name.equals(name)) {
        return i;
      }
    }
    return -1;
  }

  @Override
  public int hashCode() {
    return subspaces.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof HilbertSpace
            && ((HilbertSpace) o).subspaces.equals(subspaces);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    for (Subspace subspace : subspaces) {
      if (b.length() > 0) {
        b.append(" ⊗ ");
      }
      b.append(subspace);
    }
    return b.toString();
  }
}

// End HilbertSpace.java
