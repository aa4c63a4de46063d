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
import static net.hydromatic.cumulant.ast.ExprBuilder.ex;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import net.hydromatic.cumulant.algebra.Filters;
import net.hydromatic.cumulant.algebra.NormalOrder;
import net.hydromatic.cumulant.ast.Expr;
import net.hydromatic.cumulant.ast.Factor;
import net.hydromatic.cumulant.ast.Operator;
import net.hydromatic.cumulant.compile.Closure;
import net.hydromatic.cumulant.compile.EquationGenerator;
import net.hydromatic.cumulant.compile.EquationSet;
import net.hydromatic.cumulant.compile.Scaler;
import net.hydromatic.cumulant.space.HilbertSpace;

/**
 * Two-time correlation function ⟨A(τ) B(0)⟩.
 *
 * <p>By the quantum regression theorem, ⟨A(τ) B(0)⟩ obeys the same equations
 * of motion in τ as ⟨A⟩ does in t. To derive them, B is replaced by a frozen
 * copy B₀, whose operators act on extra subspaces (numbered from
 * {@link #offset}) that commute with everything and on which the Hamiltonian
 * and the dissipation do not act.
 *
 * <p>Averages that contain both frozen and ordinary operators are the
 * correlation averages, and get equations. Averages of ordinary operators
 * only are one-time averages, whose values come from the base system;
 * averages of frozen operators only are one-time averages of B's operators.
 */
public class CorrelationFunction {
  /** Suffix of the name of a frozen operator. */
  static final String FROZEN_SUFFIX = "₀";

  public final Expr a;
  public final Expr b;
  /** One-time equation set; its generator derives the correlation
   * equations. */
  public final EquationSet base;
  /** Number of subspaces in the Hilbert space; a frozen operator acts on
   * subspace {@code offset + aon}. */
  public final int offset;
  /** Correlation equations; the first is for ⟨A B₀⟩. */
  public final EquationSet equations;

  private CorrelationFunction(Expr a, Expr b, EquationSet base, int offset,
      EquationSet equations) {
    this.a = requireNonNull(a, "a");
    this.b = requireNonNull(b, "b");
    this.base = requireNonNull(base, "base");
    this.offset = offset;
    this.equations = requireNonNull(equations, "equations");
  }

  /**
   * Creates the correlation function ⟨A(τ) B(0)⟩ and derives the equation
   * of its first average; the set is not closed.
   *
   * <p>The cumulant order is the larger of the base system's order and the
   * number of operators in A and B.
   *
   * @param a Operator at time τ, a product of operators
   * @param b Operator at time 0, a product of operators
   * @param base One-time equation set, with a generator
   * @param space Hilbert space of the base system
   */
  public static CorrelationFunction seed(Expr a, Expr b, EquationSet base,
      HilbertSpace space) {
    if (base.generator == null) {
      throw new IllegalArgumentException("base equation set has no generator");
    }
    final Operator.Product pa = ex.averageOf(a).product;
    final Operator.Product pb = ex.averageOf(b).product;
    final int offset = space.size();
    final List<Operator.Elementary> ops = new ArrayList<>(pa.ops);
    for (Operator.Elementary op : pb.ops) {
      ops.add(op.withAon(offset + op.aon, op.name + FROZEN_SUFFIX));
    }
    final int order =
        Math.max(base.generator.order, pa.order() + pb.order());
    final EquationGenerator generator = base.generator.withOrder(order);
    final Factor.Average seed = ex.averageOf(NormalOrder.product(ops));
    final EquationSet equations =
        EquationSet.of(ImmutableList.of(generator.derive(seed)), generator);
    return new CorrelationFunction(a, b, base, offset, equations);
  }

  /** Creates the correlation function and completes its equations. */
  public static CorrelationFunction of(Expr a, Expr b, EquationSet base,
      HilbertSpace space, Predicate<Factor.Average> filter) {
    return seed(a, b, base, space).complete(filter);
  }

  /**
   * Completes the correlation equations. Only correlation averages get
   * equations; one-time averages are left to the base system.
   */
  public CorrelationFunction complete(Predicate<Factor.Average> filter) {
    final EquationGenerator generator = requireNonNull(equations.generator);
    final EquationSet closed =
        new Closure(generator, filter, average -> !isCorrelation(average),
            false).close(equations);
    return withEquations(closed);
  }

  /** Completes the correlation equations, accepting every average. */
  public CorrelationFunction complete() {
    return complete(Filters.all());
  }

  /** Scales the correlation equations over every indexed subspace. */
  public CorrelationFunction scale() {
    return withEquations(
        Scaler.scale(equations, Scaler.indexedAons(equations),
            average -> !isCorrelation(average),
            false));
  }

  /** Instantiates the correlation equations for given range sizes. */
  public CorrelationFunction instantiate(Map<String, Integer> sizes) {
    return withEquations(Instantiator.instantiate(equations, sizes, false));
  }

  /** Returns a copy with different correlation equations. */
  CorrelationFunction withEquations(EquationSet equations) {
    return new CorrelationFunction(a, b, base, offset, equations);
  }

  /** Returns whether an operator is a frozen copy. */
  public boolean isFrozen(Operator.Elementary op) {
    return op.aon >= offset;
  }

  /** Returns whether an average contains both frozen and ordinary
   * operators. */
  public boolean isCorrelation(Factor.Average average) {
    boolean frozen = false;
    boolean ordinary = false;
    for (Operator.Elementary op : average.product.ops) {
      if (isFrozen(op)) {
        frozen = true;
      } else {
        ordinary = true;
      }
    }
    return frozen && ordinary;
  }

  /** Returns an operator with its frozen operators replaced by the
   * ordinary operators that they copy. */
  Operator.Elementary unfreeze(Operator.Elementary op) {
    if (!isFrozen(op)) {
      return op;
    }
    final String name = op.name.endsWith(FROZEN_SUFFIX)
        ? op.name.substring(0, op.name.length() - FROZEN_SUFFIX.length())
        : op.name;
    return op.withAon(op.aon - offset, name);
  }

  /**
   * Returns the value of a correlation average at τ = 0, as an expression
   * in one-time averages: ⟨X B₀⟩ becomes ⟨X B⟩.
   */
  public Expr initial(Factor.Average average) {
    final List<Operator.Elementary> ops = new ArrayList<>();
    for (Operator.Elementary op : average.product.ops) {
      ops.add(unfreeze(op));
    }
    return ex.average(NormalOrder.product(ops));
  }

  @Override
  public String toString() {
    return "⟨" + a + "(τ)*" + b + "(0)⟩";
  }
}

// End CorrelationFunction.java
