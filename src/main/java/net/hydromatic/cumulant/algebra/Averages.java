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

import com.google.common.collect.Collections2;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import net.hydromatic.cumulant.ast.Expr;
import net.hydromatic.cumulant.ast.Factor;
import net.hydromatic.cumulant.ast.Operator;
import net.hydromatic.cumulant.ast.Term;
import net.hydromatic.cumulant.space.Index;
import net.hydromatic.cumulant.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Operations on averages: adjoint, renaming, and canonical forms up to a
 * permutation of indices.
 *
 * <p>These operations assume that the averages are canonical, so that the
 * indices on any one subspace are pairwise distinct; re-sorting by
 * {@link NormalOrder#GROUP_ORDERING} is then enough to restore canonical
 * form.
 */
public abstract class Averages {
  private Averages() {}

  /** Returns the adjoint of an average, ⟨P⟩* = ⟨P†⟩. */
  public static Factor.Average adjoint(Factor.Average average) {
    return Factor.Average.of(
        Operator.Product.of(sort(average.product.adjointOps())));
  }

  /** Returns whether an average is its own adjoint. */
  public static boolean isHermitian(Factor.Average average) {
    return adjoint(average).equals(average);
  }

  /** Replaces indices in an average. */
  public static Factor.Average rename(Factor.Average average,
      Map<Index, Index> map) {
    final List<Operator.Elementary> ops = new ArrayList<>();
    for (Operator.Elementary op : average.product.ops) {
      final Index index = op.index == null ? null : map.get(op.index);
      ops.add(index == null ? op : op.withIndex(index));
    }
    return Factor.Average.of(Operator.Product.of(sort(ops)));
  }

  /** Replaces indices in a parameter. */
  public static Factor.Parameter rename(Factor.Parameter parameter,
      Map<Index, Index> map) {
    return parameter.withIndices(
        Static.transformEager(parameter.indices,
            i -> map.getOrDefault(i, i)));
  }

  /** Returns the symbolic indices of an average, in order of appearance. */
  public static List<Index> symbolicIndices(Factor factor) {
    final List<Index> list = new ArrayList<>();
    for (Index index : factor.indices()) {
      if (!index.isConcrete()) {
        list.add(index);
      }
    }
    return list;
  }

  /**
   * Returns a string that is the same for two averages if and only if they
   * are equal up to renaming of symbolic indices.
   */
  public static String alphaKey(Factor.Average average) {
    return minimize(symbolicIndices(average), ignore -> true,
        (index, position) -> index.withName("#" + position),
        map -> rename(average, map)).toString();
  }

  /**
   * Returns the representative of the orbit of an average under
   * permutations of subsystems.
   *
   * <p>Indices on the given subspaces, symbolic or concrete, are replaced by
   * concrete values {@code 1, 2, ...}, choosing the assignment whose printed
   * form is smallest. For example, both {@code ⟨σ12(i)*σ21(j)⟩} and
   * {@code ⟨σ21(i)*σ12(j)⟩} become {@code ⟨σ12(1)*σ21(2)⟩}.
   */
  public static Factor.Average representative(Factor.Average average,
      Set<Integer> aons) {
    return minimize(ImmutableList.copyOf(average.indices()),
        i -> aons.contains(i.aon), Index::withValue,
        map -> rename(average, map));
  }

  /** Returns the representative of a parameter; see
   * {@link #representative(Factor.Average, Set)}. */
  public static Factor.Parameter representative(Factor.Parameter parameter,
      Set<Integer> aons) {
    return minimize(ImmutableList.copyOf(parameter.indices()),
        i -> aons.contains(i.aon), Index::withValue,
        map -> rename(parameter, map));
  }

  /**
   * Applies every assignment of new indices to a list of indices, and
   * returns the result whose printed form is smallest.
   *
   * <p>Indices are grouped by subspace; within each group, the indices are
   * permuted and the index at position {@code p} (starting from 1) is
   * replaced by {@code target.apply(index, p)}.
   */
  private static <T> T minimize(List<Index> indices,
      Predicate<Index> predicate, BiFunction<Index, Integer, Index> target,
      Function<Map<Index, Index>, T> apply) {
    final Map<Integer, List<Index>> groups =
        Static.groupBy(Static.filterEager(indices, predicate), i -> i.aon);
    final List<List<List<Index>>> permutations = new ArrayList<>();
    for (List<Index> group : groups.values()) {
      permutations.add(ImmutableList.copyOf(Collections2.permutations(group)));
    }
    @Nullable T best = null;
    @Nullable String bestString = null;
    for (List<List<Index>> assignment
        : Lists.cartesianProduct(permutations)) {
      final Map<Index, Index> map = new HashMap<>();
      for (List<Index> permutation : assignment) {
        for (int p = 0; p < permutation.size(); p++) {
          map.put(permutation.get(p), target.apply(permutation.get(p), p + 1));
        }
      }
      final T t = apply.apply(map);
      final String s = t.toString();
      if (bestString == null || s.compareTo(bestString) < 0) {
        best = t;
        bestString = s;
      }
    }
    if (best == null) {
      throw new AssertionError("no assignments");
    }
    return best;
  }

  /** Sorts a list of operators into canonical order; the sort is stable. */
  static List<Operator.Elementary> sort(List<Operator.Elementary> ops) {
    final List<Operator.Elementary> list = new ArrayList<>(ops);
    list.sort(NormalOrder.GROUP_ORDERING);
    return list;
  }

  /**
   * Returns the complex conjugate of a scalar expression: conjugate
   * coefficients and adjoint averages.
   */
  public static Expr conjugate(Expr expr) {
    final List<Term> terms = new ArrayList<>();
    for (Term term : expr.terms) {
      terms.add(conjugate(term));
    }
    return Expr.of(terms);
  }

  private static Term conjugate(Term term) {
    final List<Factor> factors = new ArrayList<>();
    for (Factor factor : term.factors) {
      factors.add(factor instanceof Factor.Average
          ? adjoint((Factor.Average) factor)
          : factor);
    }
    return Term.of(term.coeff.conj(), factors, term.product, term.bound,
        term.unequal);
  }

  /**
   * Replaces averages in a scalar expression. If the function returns null,
   * the term is removed.
   */
  public static Expr replace(Expr expr,
      Function<Factor.Average, Factor.@Nullable Average> function) {
    final List<Term> terms = new ArrayList<>();
    terms:
    for (Term term : expr.terms) {
      final List<Factor> factors = new ArrayList<>();
      for (Factor factor : term.factors) {
        if (factor instanceof Factor.Average) {
          final Factor.Average average =
              function.apply((Factor.Average) factor);
          if (average == null) {
            continue terms;
          }
          factors.add(average);
        } else {
          factors.add(factor);
        }
      }
      terms.add(
          Term.of(term.coeff, factors, term.product, term.bound,
              term.unequal));
    }
    return Expr.of(terms);
  }

  /** Returns the set of averages in a list of expressions. */
  public static Set<Factor.Average> averages(Iterable<Expr> exprs) {
    final Set<Factor.Average> set = new LinkedHashSet<>();
    for (Expr expr : exprs) {
      set.addAll(expr.averages());
    }
    return set;
  }
}

// End Averages.java
