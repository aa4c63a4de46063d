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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import net.hydromatic.cumulant.algebra.Averages;
import net.hydromatic.cumulant.algebra.NormalOrder;
import net.hydromatic.cumulant.ast.Expr;
import net.hydromatic.cumulant.ast.Factor;
import net.hydromatic.cumulant.ast.Term;
import net.hydromatic.cumulant.space.Index;
import net.hydromatic.cumulant.util.Static;

/**
 * Reduces an equation set over identical subsystems to one equation per
 * orbit.
 *
 * <p>If the subsystems that an index ranges over are identical, and the state
 * is symmetric under their permutations, an average depends only on which of
 * its indices are equal. Scaling splits every sum until each pair of indices
 * is known to be equal or distinct, replaces each sum by its multiplicity
 * ({@code N - m}), and then replaces each average and parameter by the
 * representative of its orbit, whose indices are {@code 1, 2, ...}.
 */
public abstract class Scaler {
  private Scaler() {}

  /** Tolerance for comparing the coefficients of two right-hand sides. */
  private static final double EPSILON = 1e-9;

  /** Scales an equation set over every subspace that is indexed. */
  public static EquationSet scale(EquationSet set) {
    return scale(set, indexedAons(set));
  }

  /**
   * Scales an equation set over the given subspaces.
   *
   * @throws ScalingPreconditionException if the set is not closed, is
   *   already scaled, has a concrete index on one of the subspaces, or if
   *   two equations of one orbit disagree, or if the result is not closed
   */
  public static EquationSet scale(EquationSet set, Set<Integer> aons) {
    return scale(set, aons, a -> false, true);
  }

  /**
   * Scales an equation set over the given subspaces.
   *
   * @param set Closed equation set
   * @param aons Subspaces whose subsystems are identical
   * @param external Averages that are resolved elsewhere, and need no
   *                 equation in the scaled set
   * @param identifyAdjoints Whether an equation also covers the adjoint of
   *                         its left-hand side
   */
  public static EquationSet scale(EquationSet set, Set<Integer> aons,
      Predicate<Factor.Average> external, boolean identifyAdjoints) {
    if (!set.closed) {
      throw new ScalingPreconditionException(
          "cannot scale an equation set that is not closed", set);
    }
    if (set.isScaled()) {
      throw new ScalingPreconditionException("equation set is already scaled",
          set);
    }
    if (aons.isEmpty()) {
      throw new ScalingPreconditionException(
          "no subspace to scale over", set);
    }
    checkNoConcrete(set, aons);

    final Map<Factor.Average, Expr> byRep = new LinkedHashMap<>();
    for (Equation equation : set.equations) {
      final Factor.Average rep = Averages.representative(equation.lhs, aons);
      final Expr rhs = scale(equation.rhs, aons);
      final Expr previous = byRep.get(rep);
      if (previous != null) {
        if (!same(previous, rhs)) {
          throw new ScalingPreconditionException("equations for " + rep
              + " differ: " + previous + " and " + rhs, equation);
        }
        continue;
      }
      final Factor.Average adjointRep =
          Averages.representative(Averages.adjoint(rep), aons);
      final Expr adjointPrevious =
          identifyAdjoints ? byRep.get(adjointRep) : null;
      if (adjointPrevious != null) {
        final Expr conjugate = representatives(Averages.conjugate(rhs), aons);
        if (!same(adjointPrevious, conjugate)) {
          throw new ScalingPreconditionException("equations for " + adjointRep
              + " differ: " + adjointPrevious + " and " + conjugate,
              equation);
        }
        continue;
      }
      byRep.put(rep, rhs);
    }

    final Set<Factor.Average> rejected = new LinkedHashSet<>();
    for (Factor.Average average : set.rejected) {
      rejected.add(Averages.representative(average, aons));
    }

    final List<Equation> equations = new ArrayList<>();
    byRep.forEach((lhs, rhs) -> equations.add(new Equation(lhs, rhs)));
    for (Equation equation : equations) {
      for (Factor.Average average : equation.rhs.averages()) {
        final Factor.Average adjoint =
            Averages.representative(Averages.adjoint(average), aons);
        final boolean covered = identifyAdjoints
            ? byRep.containsKey(average)
                || byRep.containsKey(adjoint)
                || rejected.contains(average)
                || rejected.contains(adjoint)
            : byRep.containsKey(average) || rejected.contains(average);
        if (!covered && !external.test(average)) {
          throw new ScalingPreconditionException("scaled system does not "
              + "close; no equation for " + average, average);
        }
      }
    }
    return EquationSet.of(equations, set.generator,
        ImmutableList.copyOf(rejected), true, aons);
  }

  /** Returns the subspaces on which indices occur in an equation set. */
  public static Set<Integer> indexedAons(EquationSet set) {
    final Set<Integer> aons = new LinkedHashSet<>();
    for (Equation equation : set.equations) {
      for (Index index : equation.lhs.indices()) {
        aons.add(index.aon);
      }
      for (Term term : equation.rhs.terms) {
        for (Index index : term.allIndices()) {
          aons.add(index.aon);
        }
      }
    }
    return ImmutableSet.copyOf(aons);
  }

  private static void checkNoConcrete(EquationSet set, Set<Integer> aons) {
    for (Equation equation : set.equations) {
      final List<Index> indices = new ArrayList<>(equation.lhs.indices());
      for (Term term : equation.rhs.terms) {
        indices.addAll(term.allIndices());
      }
      for (Index index : indices) {
        if (index.isConcrete() && aons.contains(index.aon)) {
          throw new ScalingPreconditionException("index " + index
              + " distinguishes a subsystem on subspace " + index.aon
              + ", so its subsystems are not identical", equation);
        }
      }
    }
  }

  /** Scales a right-hand side. */
  static Expr scale(Expr rhs, Set<Integer> aons) {
    final List<Term> terms = new ArrayList<>();
    for (Term term : rhs.terms) {
      for (Term term2 : NormalOrder.splitFully(term, aons)) {
        terms.addAll(removeSums(term2, aons));
      }
    }
    return representatives(Expr.of(terms), aons);
  }

  /**
   * Replaces each sum over one of the subspaces by its multiplicity,
   * innermost first. The summation index stays in the term, as an index
   * that is distinct from its partners.
   */
  private static List<Term> removeSums(Term term, Set<Integer> aons) {
    List<Term> terms = ImmutableList.of(term);
    for (int p = term.bound.size() - 1; p >= 0; p--) {
      final Index index = term.bound.get(p);
      if (!aons.contains(index.aon)) {
        continue;
      }
      int m = 0;
      for (Index partner : term.partners(index)) {
        final int q = term.bound.indexOf(partner);
        if (q < p) {
          ++m;
        }
      }
      final List<Term> next = new ArrayList<>();
      for (Term t : terms) {
        next.addAll(multiplicity(t, index, m));
      }
      terms = next;
    }
    return terms;
  }

  /** Multiplies a term by the size of an index's range minus {@code m},
   * and removes the index from the term's bound list. */
  private static List<Term> multiplicity(Term term, Index index, int m) {
    final List<Index> bound = new ArrayList<>(term.bound);
    bound.remove(index);
    final Set<Term.Unequal> unequal = new LinkedHashSet<>();
    for (Term.Unequal u : term.unequal) {
      if (Static.anyMatch(u.indices(), bound::contains)) {
        unequal.add(u);
      }
    }
    if (!index.hasSymbolicRange()) {
      return ImmutableList.of(
          Term.of(term.coeff.times(index.rangeSize - m), term.factors,
              term.product, bound, unequal));
    }
    final List<Factor> factors = new ArrayList<>(term.factors);
    factors.add(NormalOrder.size(index));
    final List<Term> list = new ArrayList<>();
    list.add(Term.of(term.coeff, factors, term.product, bound, unequal));
    if (m > 0) {
      list.add(
          Term.of(term.coeff.times(-m), term.factors, term.product, bound,
              unequal));
    }
    return list;
  }

  /** Replaces every average and parameter by its representative. */
  static Expr representatives(Expr expr, Set<Integer> aons) {
    final List<Term> terms = new ArrayList<>();
    for (Term term : expr.terms) {
      final List<Factor> factors = new ArrayList<>();
      for (Factor factor : term.factors) {
        if (factor instanceof Factor.Average) {
          factors.add(
              Averages.representative((Factor.Average) factor, aons));
        } else {
          factors.add(
              Averages.representative((Factor.Parameter) factor, aons));
        }
      }
      terms.add(
          Term.of(term.coeff, factors, term.product, term.bound,
              term.unequal));
    }
    return Expr.of(terms);
  }

  /** Returns whether two right-hand sides are equal, up to rounding. */
  private static boolean same(Expr e1, Expr e2) {
    return Static.allMatch(e1.minus(e2).terms,
        t -> t.coeff.abs() < EPSILON);
  }
}

// End Scaler.java
