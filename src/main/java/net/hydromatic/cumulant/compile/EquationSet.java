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
package net.hydromatic.cumulant.compile;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.cumulant.ast.Factor;
import net.hydromatic.cumulant.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Ordered list of equations whose left-hand sides are distinct.
 *
 * <p>Immutable. Closure returns a new set that extends the old one (earlier
 * equations keep their position); scaling and instantiation return a
 * different, smaller or larger, set.
 */
public class EquationSet {
  public final ImmutableList<Equation> equations;
  /** Generator that derived the equations, or null if they were derived
   * from another set. */
  public final @Nullable EquationGenerator generator;
  /** Averages that a filter rejected; they are zero. */
  public final ImmutableList<Factor.Average> rejected;
  /** Whether every average in a right-hand side has an equation. */
  public final boolean closed;
  /** Subspaces over which the set was scaled; empty if not scaled. */
  public final ImmutableSet<Integer> identicalAons;

  private EquationSet(ImmutableList<Equation> equations,
      @Nullable EquationGenerator generator,
      ImmutableList<Factor.Average> rejected, boolean closed,
      ImmutableSet<Integer> identicalAons) {
    this.equations = requireNonNull(equations, "equations");
    this.generator = generator;
    this.rejected = requireNonNull(rejected, "rejected");
    this.closed = closed;
    this.identicalAons = requireNonNull(identicalAons, "identicalAons");
    final Set<Factor.Average> lhs = new HashSet<>();
    for (Equation equation : equations) {
      checkArgument(lhs.add(equation.lhs), "duplicate equation for %s",
          equation.lhs);
    }
  }

  /** Creates an equation set that is not known to be closed. */
  public static EquationSet of(List<Equation> equations,
      @Nullable EquationGenerator generator) {
    return new EquationSet(ImmutableList.copyOf(equations), generator,
        ImmutableList.of(), false, ImmutableSet.of());
  }

  /** Creates an equation set. */
  public static EquationSet of(List<Equation> equations,
      @Nullable EquationGenerator generator, List<Factor.Average> rejected,
      boolean closed, Set<Integer> identicalAons) {
    return new EquationSet(ImmutableList.copyOf(equations), generator,
        ImmutableList.copyOf(rejected), closed,
        ImmutableSet.copyOf(identicalAons));
  }

  /** Returns whether this set was reduced by symmetry scaling. */
  public boolean isScaled() {
    return !identicalAons.isEmpty();
  }

  public int size() {
    return equations.size();
  }

  /** Returns the left-hand side averages, in order. */
  public List<Factor.Average> lhs() {
    return Static.transformEager(equations, e -> e.lhs);
  }

  /** Returns the equation for an average, or null. */
  public @Nullable Equation find(Factor.Average average) {
    for (Equation equation : equations) {
      if (equation.lhs.equals(average)) {
        return equation;
      }
    }
    return null;
  }

  /** Returns the distinct averages that occur in right-hand sides. */
  public Set<Factor.Average> rhsAverages() {
    final Set<Factor.Average> set = new LinkedHashSet<>();
    for (Equation equation : equations) {
      set.addAll(equation.rhs.averages());
    }
    return set;
  }

  /**
   * Returns the distinct parameters that occur in right-hand sides, in order
   * of appearance.
   */
  public List<Factor.Parameter> parameters() {
    final Set<Factor.Parameter> set = new LinkedHashSet<>();
    for (Equation equation : equations) {
      set.addAll(equation.rhs.parameters());
    }
    return ImmutableList.copyOf(set);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    for (Equation equation : equations) {
      b.append(equation).append('\n');
    }
    return b.toString();
  }
}

// End EquationSet.java
