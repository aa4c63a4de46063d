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
import static net.hydromatic.cumulant.ast.ExprBuilder.ex;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.cumulant.algebra.Cumulants;
import net.hydromatic.cumulant.algebra.NormalOrder;
import net.hydromatic.cumulant.ast.Expr;
import net.hydromatic.cumulant.ast.Factor;
import net.hydromatic.cumulant.ast.Num;
import net.hydromatic.cumulant.ast.Term;
import net.hydromatic.cumulant.eval.Prop;
import net.hydromatic.cumulant.space.HilbertSpace;
import net.hydromatic.cumulant.space.Index;

/**
 * Derives equations of motion for averages.
 *
 * <p>For a target ⟨O⟩, the equation is
 *
 * <blockquote>d/dt ⟨O⟩ = i⟨[H, O]⟩ + Σ R (⟨J<sub>k</sub>† O J<sub>l</sub>⟩
 * − ½⟨J<sub>k</sub>† J<sub>l</sub> O⟩ − ½⟨O J<sub>k</sub>† J<sub>l</sub>⟩)
 * </blockquote>
 *
 * <p>(with ħ = 1), after which every average of more than {@link #order}
 * operators is replaced by its cumulant expansion.
 *
 * <p>Immutable and thread-safe, provided that the tracer is.
 */
public class EquationGenerator {
  public final HilbertSpace space;
  public final Expr hamiltonian;
  public final Dissipation dissipation;
  /** Order of the cumulant expansion. */
  public final int order;
  public final ImmutableMap<Prop, Object> props;
  public final Tracer tracer;

  /** Symbolic index names used by the Hamiltonian and the dissipation. */
  private final ImmutableSet<String> reservedNames;
  /** Symbolic indices used by the Hamiltonian and the dissipation. */
  private final ImmutableMap<String, Index> indices;

  private EquationGenerator(HilbertSpace space, Expr hamiltonian,
      Dissipation dissipation, int order, ImmutableMap<Prop, Object> props,
      Tracer tracer, ImmutableSet<String> reservedNames,
      ImmutableMap<String, Index> indices) {
    this.space = requireNonNull(space, "space");
    this.hamiltonian = requireNonNull(hamiltonian, "hamiltonian");
    this.dissipation = requireNonNull(dissipation, "dissipation");
    this.order = order;
    this.props = requireNonNull(props, "props");
    this.tracer = requireNonNull(tracer, "tracer");
    this.reservedNames = requireNonNull(reservedNames, "reservedNames");
    this.indices = requireNonNull(indices, "indices");
    checkArgument(order >= 1, "order must be at least 1, was %s", order);
  }

  /**
   * Creates a generator.
   *
   * @throws IndexBindingException if the Hamiltonian has an index that is
   *   not summed over, or if an index name is used for two different ranges
   */
  public static EquationGenerator create(HilbertSpace space,
      Expr hamiltonian, Dissipation dissipation, int order,
      Map<Prop, Object> props, Tracer tracer) {
    final Map<String, Index> indices = new HashMap<>();
    final Set<String> reserved = new LinkedHashSet<>();
    for (Term term : hamiltonian.terms) {
      final Set<Index> free = term.freeIndices();
      if (!free.isEmpty()) {
        throw new IndexBindingException("index " + free.iterator().next()
            + " in Hamiltonian is not bound by a sum", term);
      }
      for (Index index : term.allIndices()) {
        if (!index.isConcrete()) {
          register(indices, index);
          reserved.add(index.name);
        }
      }
    }
    for (Index index : dissipation.indices().values()) {
      register(indices, index);
    }
    reserved.addAll(dissipation.indexNames());
    return new EquationGenerator(space, hamiltonian, dissipation, order,
        ImmutableMap.copyOf(props), tracer, ImmutableSet.copyOf(reserved),
        ImmutableMap.copyOf(indices));
  }

  private static void register(Map<String, Index> indices, Index index) {
    final Index previous = indices.putIfAbsent(index.name, index);
    if (previous != null && !previous.sameRange(index)) {
      throw new IndexBindingException("index " + index.name
          + " is used for two different ranges", index);
    }
  }

  /** Returns a generator with a different cumulant order. */
  public EquationGenerator withOrder(int order) {
    if (order == this.order) {
      return this;
    }
    return new EquationGenerator(space, hamiltonian, dissipation, order,
        props, tracer, reservedNames, indices);
  }

  /** Returns a generator with a different tracer. */
  public EquationGenerator withTracer(Tracer tracer) {
    return new EquationGenerator(space, hamiltonian, dissipation, order,
        props, tracer, reservedNames, indices);
  }

  /**
   * Returns the symbolic index names that the Hamiltonian and dissipation
   * use. A target must not use them for its free indices.
   */
  public Set<String> reservedNames() {
    return reservedNames;
  }

  /**
   * Derives the equation for a target that is an expression. The
   * expression must be a single average with unit coefficient, such as
   * {@code ex.average(a)}.
   */
  public Equation derive(Expr target) {
    return derive(averageOf(target));
  }

  /** Derives equations for a list of targets; the result is not closed.
   * Targets equal to an earlier target are skipped. */
  public EquationSet deriveAll(List<Expr> targets) {
    final List<Equation> equations = new ArrayList<>();
    final Set<Factor.Average> seen = new LinkedHashSet<>();
    for (Expr target : targets) {
      final Factor.Average average = averageOf(target);
      if (seen.add(average)) {
        equations.add(derive(average));
      }
    }
    return EquationSet.of(equations, this);
  }

  /** Converts a target expression into an average. */
  static Factor.Average averageOf(Expr target) {
    if (target.terms.size() == 1) {
      final Term term = target.terms.get(0);
      if (term.coeff.isOne()
          && term.isScalar()
          && term.bound.isEmpty()
          && term.factors.size() == 1
          && term.factors.get(0) instanceof Factor.Average) {
        return (Factor.Average) term.factors.get(0);
      }
    }
    throw new IndexBindingException("target must be a single average with "
        + "unit coefficient and no sum: " + target, target);
  }

  /** Derives the equation for an average. */
  public Equation derive(Factor.Average target) {
    for (Index index : target.indices()) {
      if (index.isConcrete()) {
        continue;
      }
      if (reservedNames.contains(index.name)) {
        throw new IndexBindingException("index " + index.name + " of target "
            + target + " is also bound in the Hamiltonian or dissipation",
            target);
      }
    }
    final Expr o = Expr.of(Term.of(target.product));
    final Expr commutator =
        NormalOrder.multiply(hamiltonian, o)
            .minus(NormalOrder.multiply(o, hamiltonian))
            .times(Num.I);
    final Expr rhs =
        Cumulants.expand(
            ex.average(commutator.plus(dissipation.apply(o))), order);
    final Equation equation = new Equation(target, rhs);
    tracer.onEquation(equation);
    return equation;
  }
}

// End EquationGenerator.java
