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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.cumulant.algebra.Averages;
import net.hydromatic.cumulant.algebra.NormalOrder;
import net.hydromatic.cumulant.ast.Expr;
import net.hydromatic.cumulant.ast.Factor;
import net.hydromatic.cumulant.ast.Num;
import net.hydromatic.cumulant.ast.Term;
import net.hydromatic.cumulant.compile.Equation;
import net.hydromatic.cumulant.compile.EquationSet;
import net.hydromatic.cumulant.compile.NonClosureException;
import net.hydromatic.cumulant.space.Index;

/**
 * Expands a symbolic equation set for concrete sizes of its index ranges.
 *
 * <p>Each equation whose left-hand side has free indices becomes one
 * equation per assignment of distinct values to those indices; an equation
 * whose left-hand side is the adjoint of an earlier one is dropped. Sums in
 * right-hand sides are materialized, term by term, over the values that
 * their constraints allow, and each range symbol (such as "N") is replaced
 * by its size.
 */
public abstract class Instantiator {
  private Instantiator() {}

  /**
   * Instantiates a closed equation set.
   *
   * @param set Closed equation set
   * @param sizes Size of each symbolic range, keyed by the range's name
   */
  public static EquationSet instantiate(EquationSet set,
      Map<String, Integer> sizes) {
    return instantiate(set, sizes, true);
  }

  /**
   * Instantiates a closed equation set.
   *
   * @param set Closed equation set
   * @param sizes Size of each symbolic range, keyed by the range's name
   * @param identifyAdjoints Whether an equation also covers the adjoint of
   *                         its left-hand side
   */
  public static EquationSet instantiate(EquationSet set,
      Map<String, Integer> sizes, boolean identifyAdjoints) {
    if (!set.closed) {
      throw new NonClosureException(
          "cannot instantiate an equation set that is not closed", set);
    }
    final List<Equation> equations = new ArrayList<>();
    final Set<Factor.Average> seen = new LinkedHashSet<>();
    for (Equation equation : set.equations) {
      for (Map<Index, Index> assignment
          : assignments(Averages.symbolicIndices(equation.lhs), sizes)) {
        final Factor.Average lhs = Averages.rename(equation.lhs, assignment);
        if (seen.contains(lhs)
            || identifyAdjoints && seen.contains(Averages.adjoint(lhs))) {
          continue;
        }
        seen.add(lhs);
        equations.add(
            new Equation(lhs, instantiate(equation.rhs, assignment, sizes)));
      }
    }
    final Set<Factor.Average> rejected = new LinkedHashSet<>();
    for (Factor.Average average : set.rejected) {
      for (Map<Index, Index> assignment
          : assignments(Averages.symbolicIndices(average), sizes)) {
        rejected.add(Averages.rename(average, assignment));
      }
    }
    return EquationSet.of(equations, set.generator,
        ImmutableList.copyOf(rejected), true, set.identicalAons);
  }

  /**
   * Instantiates an expression: substitutes values for its free indices,
   * materializes its sums, and replaces range symbols by their sizes.
   */
  public static Expr instantiate(Expr expr, Map<Index, Index> assignment,
      Map<String, Integer> sizes) {
    final List<Term> terms = new ArrayList<>();
    for (Term term : expr.terms) {
      for (Term term2 : NormalOrder.substitute(term, assignment)) {
        materialize(term2, sizes, terms);
      }
    }
    final List<Term> terms2 = new ArrayList<>();
    for (Term term : terms) {
      terms2.add(replaceSizes(term, sizes));
    }
    return Expr.of(terms2);
  }

  /** Expands the sums of a term, outermost first. */
  private static void materialize(Term term, Map<String, Integer> sizes,
      List<Term> out) {
    if (term.bound.isEmpty()) {
      out.add(term);
      return;
    }
    final Index index = term.bound.get(0);
    final int size = size(index, sizes);
    for (int v = 1; v <= size; v++) {
      for (Term term2
          : NormalOrder.substitute(term,
              ImmutableMap.of(index, index.withValue(v)))) {
        materialize(term2, sizes, out);
      }
    }
  }

  /** Replaces each parameter that is the symbol of a range by its size. */
  private static Term replaceSizes(Term term, Map<String, Integer> sizes) {
    Num coeff = term.coeff;
    final List<Factor> factors = new ArrayList<>();
    for (Factor factor : term.factors) {
      if (factor instanceof Factor.Parameter
          && ((Factor.Parameter) factor).indices.isEmpty()
          && sizes.containsKey(((Factor.Parameter) factor).name)) {
        coeff = coeff.times(sizes.get(((Factor.Parameter) factor).name));
      } else {
        factors.add(factor);
      }
    }
    return Term.of(coeff, factors, term.product, term.bound, term.unequal);
  }

  /**
   * Returns every assignment of concrete values to a list of indices such
   * that indices on the same subspace have distinct values.
   */
  static List<Map<Index, Index>> assignments(List<Index> indices,
      Map<String, Integer> sizes) {
    final List<Map<Index, Index>> list = new ArrayList<>();
    assign(indices, 0, sizes, new HashMap<>(), list);
    return list;
  }

  private static void assign(List<Index> indices, int i,
      Map<String, Integer> sizes, Map<Index, Index> assignment,
      List<Map<Index, Index>> out) {
    if (i == indices.size()) {
      out.add(ImmutableMap.copyOf(assignment));
      return;
    }
    final Index index = indices.get(i);
    final int size = size(index, sizes);
    values:
    for (int v = 1; v <= size; v++) {
      for (Index assigned : assignment.values()) {
        if (assigned.aon == index.aon && assigned.value == v) {
          continue values;
        }
      }
      assignment.put(index, index.withValue(v));
      assign(indices, i + 1, sizes, assignment, out);
      assignment.remove(index);
    }
  }

  private static int size(Index index, Map<String, Integer> sizes) {
    if (!index.hasSymbolicRange()) {
      return index.rangeSize;
    }
    final Integer size = sizes.get(index.rangeName);
    if (size == null) {
      throw new IllegalArgumentException("no size for range "
          + index.rangeName + " of index " + index);
    }
    return size;
  }
}

// End Instantiator.java
