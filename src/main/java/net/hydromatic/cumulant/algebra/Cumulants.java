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
package net.hydromatic.cumulant.algebra;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.cumulant.ast.Expr;
import net.hydromatic.cumulant.ast.Factor;
import net.hydromatic.cumulant.ast.Num;
import net.hydromatic.cumulant.ast.Operator;
import net.hydromatic.cumulant.ast.Term;
import net.hydromatic.cumulant.util.Partitions;
import net.hydromatic.cumulant.util.Static;

/**
 * Cumulant expansion.
 *
 * <p>The joint cumulant of a block of operators B is
 *
 * <blockquote>κ(B) = Σ<sub>π</sub> (−1)<sup>|π|−1</sup> (|π|−1)!
 * Π<sub>C∈π</sub> ⟨C⟩</blockquote>
 *
 * <p>summed over the partitions π of B. A moment is the sum, over partitions
 * of its operators, of the product of the cumulants of the blocks. The
 * expansion to order k keeps only partitions whose blocks have at most k
 * operators, that is, it assumes that every cumulant of order greater than
 * k is zero.
 */
public abstract class Cumulants {
  private Cumulants() {}

  /**
   * Replaces every average of more than {@code order} operators by its
   * cumulant expansion.
   */
  public static Expr expand(Expr expr, int order) {
    checkArgument(order >= 1, "order must be positive");
    final List<Term> terms = new ArrayList<>();
    for (Term term : expr.terms) {
      terms.addAll(expand(term, order));
    }
    return Expr.of(terms);
  }

  private static List<Term> expand(Term term, int order) {
    final List<Factor.Average> averages = term.averages();
    if (Static.allMatch(averages, a -> a.order() <= order)) {
      return ImmutableList.of(term);
    }
    final List<Factor> parameters = new ArrayList<>(term.parameters());
    final List<List<Monomial>> expansions = new ArrayList<>();
    for (Factor.Average average : averages) {
      expansions.add(expand(average, order));
    }
    final List<Term> terms = new ArrayList<>();
    for (List<Monomial> combination : Lists.cartesianProduct(expansions)) {
      Num coeff = term.coeff;
      final List<Factor> factors = new ArrayList<>(parameters);
      for (Monomial monomial : combination) {
        coeff = coeff.times(monomial.coeff);
        factors.addAll(monomial.averages);
      }
      terms.add(
          Term.of(coeff, factors, term.product, term.bound, term.unequal));
    }
    return terms;
  }

  /**
   * Returns the expansion of an average to a given order, as a list of
   * monomials in lower-order averages.
   */
  public static List<Monomial> expand(Factor.Average average, int order) {
    if (average.order() <= order) {
      return ImmutableList.of(new Monomial(Num.ONE, ImmutableList.of(average)));
    }
    final List<Operator.Elementary> ops = average.product.ops;
    final Map<List<Factor.Average>, Num> map = new LinkedHashMap<>();
    for (List<List<Operator.Elementary>> partition
        : Partitions.of(ops, order)) {
      final List<List<Monomial>> cumulants = new ArrayList<>();
      for (List<Operator.Elementary> block : partition) {
        cumulants.add(cumulant(block));
      }
      for (List<Monomial> combination : Lists.cartesianProduct(cumulants)) {
        Num coeff = Num.ONE;
        final List<Factor.Average> averages = new ArrayList<>();
        for (Monomial monomial : combination) {
          coeff = coeff.times(monomial.coeff);
          averages.addAll(monomial.averages);
        }
        map.merge(ImmutableList.sortedCopyOf(averages), coeff,
            Num::plus);
      }
    }
    final List<Monomial> list = new ArrayList<>();
    map.forEach((averages, coeff) -> {
      if (!coeff.isZero()) {
        list.add(new Monomial(coeff, ImmutableList.copyOf(averages)));
      }
    });
    return list;
  }

  /** Returns the joint cumulant of a block of operators, as moments. */
  static List<Monomial> cumulant(List<Operator.Elementary> block) {
    final List<Monomial> list = new ArrayList<>();
    for (List<List<Operator.Elementary>> partition : Partitions.of(block)) {
      final int n = partition.size();
      double coeff = factorial(n - 1);
      if (n % 2 == 0) {
        coeff = -coeff;
      }
      final List<Factor.Average> averages = new ArrayList<>();
      for (List<Operator.Elementary> part : partition) {
        averages.add(Factor.Average.of(Operator.Product.of(part)));
      }
      list.add(new Monomial(Num.of(coeff), ImmutableList.copyOf(averages)));
    }
    return list;
  }

  private static double factorial(int n) {
    double f = 1;
    for (int i = 2; i <= n; i++) {
      f *= i;
    }
    return f;
  }

  /** Product of averages with a coefficient. */
  public static class Monomial {
    public final Num coeff;
    public final ImmutableList<Factor.Average> averages;

    Monomial(Num coeff, ImmutableList<Factor.Average> averages) {
      this.coeff = coeff;
      this.averages = averages;
    }

    @Override
    public String toString() {
      final StringBuilder b = new StringBuilder();
      b.append(coeff);
      for (Factor.Average average : averages) {
        b.append('*').append(average);
      }
      return b.toString();
    }
  }
}

// End Cumulants.java
