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

import java.util.Objects;

/**
 * Hilbert space of a single subsystem.
 *
 * <p>A {@link HilbertSpace} is an ordered list of subspaces; operators name
 * the subspace they act on by its position in that list.
 */
public abstract class Subspace {
  public final String name;

  Subspace(String name) {
    this.name = requireNonNull(name, "name");
    checkArgument(!name.isEmpty(), "empty name");
  }

  /** Returns whether this subspace holds a bosonic mode. */
  public abstract boolean isBosonic();

  /** Space of a single bosonic mode, on which the ladder operators act. */
  public static class Fock extends Subspace {
    public Fock(String name) {
      super(name);
    }

    @Override
    public boolean isBosonic() {
      return true;
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Fock && ((Fock) o).name.equals(name);
    }

    @Override
    public String toString() {
      return "Fock(" + name + ")";
    }
  }

  /**
   * Space of a system with a finite number of levels, numbered from 1. One
   * level is the ground state, whose projector is eliminated from canonical
   * products.
   */
  public static class NLevel extends Subspace {
    public final int levels;
    public final int ground;

    /** Creates an NLevel space whose ground state is level 1. */
    public NLevel(String name, int levels) {
      this(name, levels, 1);
    }

    public NLevel(String name, int levels, int ground) {
      super(name);
      checkArgument(levels >= 2, "need at least two levels, got %s", levels);
      checkArgument(
          ground >= 1 && ground <= levels, "ground level %s out of range",
          ground);
      this.levels = levels;
      this.ground = ground;
    }

    @Override
    public boolean isBosonic() {
      return false;
    }

    /** Returns whether a level is valid in this space. */
    public boolean isLevel(int level) {
      return level >= 1 && level <= levels;
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, levels, ground);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof NLevel
              && ((NLevel) o).name.equals(name)
              && ((NLevel) o).levels == levels
              && ((NLevel) o).ground == ground;
    }

    @Override
    public String toString() {
      return "NLevel(" + name + ", " + levels + ")";
    }
  }
}

// End Subspace.java
