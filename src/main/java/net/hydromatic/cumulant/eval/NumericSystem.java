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
package net.hydromatic.cumulant.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import net.hydromatic.cumulant.algebra.Averages;
import net.hydromatic.cumulant.ast.Expr;
import net.hydromatic.cumulant.ast.Factor;
import net.hydromatic.cumulant.ast.Num;
import net.hydromatic.cumulant.ast.Term;
import net.hydromatic.cumulant.compile.Equation;
import net.hydromatic.cumulant.compile.EquationSet;
import net.hydromatic.cumulant.compile.NonClosureException;
import net.hydromatic.cumulant.compile.ScalingPreconditionException;
import net.hydromatic.cumulant.space.Index;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Closed equation set prepared for numerical evaluation.
 *
 * <p>The state is a vector of complex numbers, one per left-hand side, in the
 * order of {@link #stateVariables()}. An average in a right-hand side is the
 * state variable of the same average, or the complex conjugate of the state
 * variable of its adjoint, or zero if a filter rejected it.
 *
 * <p>Integration and root finding are left to the caller.
 */
public class NumericSystem {
  public final EquationSet set;
  private final ImmutableMap<Factor.Average, Integer> positions;
  private final ImmutableSet<Factor.Average> rejected;

  private NumericSystem(EquationSet set) {
    this.set = requireNonNull(set, "set");
    final ImmutableMap.Builder<Factor.Average, Integer> b =
        ImmutableMap.builder();
    for (int i = 0; i < set.equations.size(); i++) {
      b.put(set.equations.get(i).lhs, i);
    }
    this.positions = b.build();
    this.rejected = ImmutableSet.copyOf(set.rejected);
  }

  /**
   * Creates a numeric system.
   *
   * @throws NonClosureException if the set is not closed, or if a
   *   right-hand side has an average that cannot be resolved
   * @throws ScalingPreconditionException if a symbolic index remains; the
   *   set must be scaled or instantiated first
   */
  public static NumericSystem of(EquationSet set) {
    if (!set.closed) {
      throw new NonClosureException("equation set is not closed", set);
    }
    checkConcrete(set);
    final NumericSystem system = new NumericSystem(set);
    for (Factor.Average average : set.rhsAverages()) {
      if (system.resolve(average) == null) {
        throw new NonClosureException("no equation for " + average, average);
      }
    }
    return system;
  }

  /** Throws if an equation set has a symbolic index. */
  static void checkConcrete(EquationSet set) {
    for (Equation equation : set.equations) {
      for (Index index : equation.lhs.indices()) {
        checkConcrete(index, equation);
      }
      for (Term term : equation.rhs.terms) {
        for (Index index : term.allIndices()) {
          checkConcrete(index, equation);
        }
      }
    }
  }

  private static void checkConcrete(Index index, Equation equation) {
    if (!index.isConcrete()) {
      throw new ScalingPreconditionException("symbolic index " + index
          + " remains in " + equation + "; scale or instantiate first",
          equation);
    }
  }

  /** Returns the state variables, in order. */
  public List<Factor.Average> stateVariables() {
    return set.lhs();
  }

  /** Returns the parameters that the right-hand sides use. */
  public List<Factor.Parameter> parameters() {
    return set.parameters();
  }

  /** Returns the number of state variables. */
  public int size() {
    return set.size();
  }

  /**
   * Evaluates the right-hand side of every equation.
   *
   * @param state Value of each state variable
   * @param parameters Values of parameters
   * @return Time derivative of each state variable
   */
  public Num[] derivatives(Num[] state, Parameters parameters) {
    checkState(state);
    final Num[] derivatives = new Num[set.size()];
    for (int i = 0; i < derivatives.length; i++) {
      derivatives[i] = evaluate(set.equations.get(i).rhs, state, parameters);
    }
    return derivatives;
  }

  /** Evaluates a scalar expression. */
  public Num evaluate(Expr expr, Num[] state, Parameters parameters) {
    Num sum = Num.ZERO;
    for (Term term : expr.terms) {
      if (!term.isScalar() || !term.bound.isEmpty()) {
        throw new IllegalArgumentException("cannot evaluate " + term);
      }
      Num product = term.coeff;
      for (Factor factor : term.factors) {
        if (factor instanceof Factor.Average) {
          product = product.times(value((Factor.Average) factor, state));
        } else {
          product = product.times(parameters.value((Factor.Parameter) factor));
        }
      }
      sum = sum.plus(product);
    }
    return sum;
  }

  /**
   * Returns the value of an average in a given state.
   *
   * <p>If the set is scaled, the average is first mapped to the
   * representative of its orbit.
   *
   * @throws NonClosureException if the average cannot be resolved
   */
  public Num value(Factor.Average average, Num[] state) {
    checkState(state);
    final Resolution resolution = resolve(average);
    if (resolution == null) {
      throw new NonClosureException("no equation for " + average, average);
    }
    if (resolution.position < 0) {
      return Num.ZERO;
    }
    final Num value = state[resolution.position];
    return resolution.conjugate ? value.conj() : value;
  }

  private void checkState(Num[] state) {
    if (state.length != set.size()) {
      throw new IllegalArgumentException("state has " + state.length
          + " values; expected " + set.size());
    }
  }

  private @Nullable Resolution resolve(Factor.Average average) {
    if (set.isScaled()) {
      average = Averages.representative(average, set.identicalAons);
    }
    Integer position = positions.get(average);
    if (position != null) {
      return new Resolution(position, false);
    }
    Factor.Average adjoint = Averages.adjoint(average);
    if (set.isScaled()) {
      adjoint = Averages.representative(adjoint, set.identicalAons);
    }
    position = positions.get(adjoint);
    if (position != null) {
      return new Resolution(position, true);
    }
    if (rejected.contains(average) || rejected.contains(adjoint)) {
      return new Resolution(-1, false);
    }
    return null;
  }

  /** Where the value of an average comes from. Position -1 means zero. */
  private static class Resolution {
    final int position;
    final boolean conjugate;

    Resolution(int position, boolean conjugate) {
      this.position = position;
      this.conjugate = conjugate;
    }
  }

  @Override
  public String toString() {
    return ImmutableList.copyOf(positions.keySet()).toString();
  }
}

// End NumericSystem.java
