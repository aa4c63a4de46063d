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

import com.google.common.collect.ImmutableMap;
import net.hydromatic.cumulant.algebra.Cumulants;
import net.hydromatic.cumulant.ast.Expr;
import net.hydromatic.cumulant.ast.Factor;
import net.hydromatic.cumulant.ast.Num;
import net.hydromatic.cumulant.ast.Term;
import net.hydromatic.cumulant.compile.Equation;
import net.hydromatic.cumulant.compile.EquationGenerator;
import net.hydromatic.cumulant.compile.EquationSet;
import net.hydromatic.cumulant.compile.NonClosureException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.CommonOps_ZDRM;

/**
 * Spectrum of a correlation function, S(ω) = 2 Re ∫<sub>0</sub><sup>∞</sup>
 * e<sup>−iωτ</sup> ⟨A(τ) B(0)⟩ dτ.
 *
 * <p>The correlation equations are linear in the correlation averages:
 * dx/dτ = M x + b, where M and b depend on the one-time averages of the
 * steady state. Their Laplace transform at s = ε + iω is
 * (sI − M) x̃ = x(0) + b/s, and S(ω) = 2 Re x̃<sub>0</sub>.
 *
 * <p>ε is the value of {@link Prop#SPECTRUM_EPSILON}.
 */
public class Spectrum {
  public final CorrelationFunction correlation;
  public final NumericSystem base;
  private final ImmutableMap<Factor.Average, Integer> positions;
  private final int baseOrder;
  private final double epsilon;

  private Spectrum(CorrelationFunction correlation, NumericSystem base) {
    this.correlation = requireNonNull(correlation, "correlation");
    this.base = requireNonNull(base, "base");
    final ImmutableMap.Builder<Factor.Average, Integer> b =
        ImmutableMap.builder();
    final EquationSet equations = correlation.equations;
    for (int i = 0; i < equations.size(); i++) {
      b.put(equations.equations.get(i).lhs, i);
    }
    this.positions = b.build();
    final EquationGenerator baseGenerator =
        requireNonNull(correlation.base.generator);
    this.baseOrder = baseGenerator.order;
    this.epsilon = Prop.SPECTRUM_EPSILON.doubleValue(baseGenerator.props);
  }

  /**
   * Creates a spectrum.
   *
   * @param correlation Closed correlation function with no symbolic index
   * @param base Numeric one-time system for the steady state
   *
   * @throws NonClosureException if the correlation equations are not closed
   * @throws net.hydromatic.cumulant.compile.ScalingPreconditionException if
   *   they have a symbolic index
   */
  public static Spectrum of(CorrelationFunction correlation,
      NumericSystem base) {
    if (!correlation.equations.closed) {
      throw new NonClosureException("correlation equations are not closed",
          correlation.equations);
    }
    NumericSystem.checkConcrete(correlation.equations);
    return new Spectrum(correlation, base);
  }

  /**
   * Evaluates the spectrum at a frequency.
   *
   * @param omega Frequency ω
   * @param steadyState Steady-state values of the base system's state
   *                    variables
   * @param parameters Values of parameters
   * @return S(ω); positive infinity if s = 0 and the system has a constant
   *   term
   */
  public double evaluate(double omega, Num[] steadyState,
      Parameters parameters) {
    final int n = positions.size();
    final Num[][] m = new Num[n][n];
    final Num[] b = new Num[n];
    final Num[] x0 = new Num[n];
    for (int r = 0; r < n; r++) {
      b[r] = Num.ZERO;
      for (int c = 0; c < n; c++) {
        m[r][c] = Num.ZERO;
      }
      final Equation equation = correlation.equations.equations.get(r);
      for (Term term : equation.rhs.terms) {
        addTerm(r, term, m, b, steadyState, parameters);
      }
      x0[r] = oneTime(correlation.initial(equation.lhs), steadyState,
          parameters);
    }

    final Num s = Num.of(epsilon, omega);
    boolean constant = false;
    for (Num v : b) {
      constant |= !v.isZero();
    }
    if (s.isZero() && constant) {
      return Double.POSITIVE_INFINITY;
    }
    final ZMatrixRMaj a = new ZMatrixRMaj(n, n);
    final ZMatrixRMaj y = new ZMatrixRMaj(n, 1);
    for (int r = 0; r < n; r++) {
      for (int c = 0; c < n; c++) {
        Num v = m[r][c].negate();
        if (r == c) {
          v = v.plus(s);
        }
        a.set(r, c, v.re, v.im);
      }
      Num v = x0[r];
      if (constant) {
        v = v.plus(b[r].divide(s));
      }
      y.set(r, 0, v.re, v.im);
    }
    final ZMatrixRMaj x = new ZMatrixRMaj(n, 1);
    if (!CommonOps_ZDRM.solve(a, y, x)) {
      throw new IllegalStateException("singular correlation system at ω = "
          + omega);
    }
    return 2 * x.getReal(0, 0);
  }

  /** Adds a term of row {@code r} to the matrix or the constant vector. */
  private void addTerm(int r, Term term, Num[][] m, Num[] b,
      Num[] steadyState, Parameters parameters) {
    Num coeff = term.coeff;
    Factor.@Nullable Average variable = null;
    for (Factor factor : term.factors) {
      if (factor instanceof Factor.Parameter) {
        coeff = coeff.times(parameters.value((Factor.Parameter) factor));
        continue;
      }
      final Factor.Average average = (Factor.Average) factor;
      if (correlation.isCorrelation(average)) {
        if (variable != null) {
          throw new IllegalStateException("term " + term
              + " is not linear in correlation averages");
        }
        variable = average;
      } else {
        coeff = coeff.times(oneTime(average, steadyState, parameters));
      }
    }
    if (variable == null) {
      b[r] = b[r].plus(coeff);
      return;
    }
    final Integer c = positions.get(variable);
    if (c == null) {
      throw new NonClosureException("no equation for " + variable, variable);
    }
    m[r][c] = m[r][c].plus(coeff);
  }

  /** Evaluates an expression in one-time averages. */
  private Num oneTime(Expr expr, Num[] steadyState, Parameters parameters) {
    Num sum = Num.ZERO;
    for (Term term : expr.terms) {
      Num product = term.coeff;
      for (Factor factor : term.factors) {
        product = factor instanceof Factor.Average
            ? product.times(
                oneTime((Factor.Average) factor, steadyState, parameters))
            : product.times(parameters.value((Factor.Parameter) factor));
      }
      sum = sum.plus(product);
    }
    return sum;
  }

  /**
   * Returns the value of a one-time average. An average of frozen operators
   * is the average of the operators they copy; an average of more operators
   * than the base system's order is expanded into cumulants.
   */
  private Num oneTime(Factor.Average average, Num[] steadyState,
      Parameters parameters) {
    if (!correlation.isFrozen(average.product.ops.get(0))) {
      Num sum = Num.ZERO;
      for (Cumulants.Monomial monomial
          : Cumulants.expand(average, baseOrder)) {
        Num product = monomial.coeff;
        for (Factor.Average a : monomial.averages) {
          product = product.times(base.value(a, steadyState));
        }
        sum = sum.plus(product);
      }
      return sum;
    }
    return oneTime(correlation.initial(average), steadyState, parameters);
  }
}

// End Spectrum.java
