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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.cumulant.ast.Expr;
import net.hydromatic.cumulant.ast.Factor;
import net.hydromatic.cumulant.ast.Op;
import net.hydromatic.cumulant.ast.Operator;
import net.hydromatic.cumulant.ast.Term;
import net.hydromatic.cumulant.space.Index;

/**
 * Rewrites products of operators into canonical form.
 *
 * <p>The rules are:
 *
 * <ul>
 *   <li>operators on different subspaces commute, and are sorted by
 *       subspace;
 *   <li>operators on different subsystems of the same subspace (distinct
 *       indices) commute, and are sorted by index;
 *   <li>on a bosonic subsystem, {@code a a† = a† a + 1};
 *   <li>on a multi-level subsystem, {@code σ(a,b) σ(c,d) = δ(b,c) σ(a,d)};
 *   <li>if two operators on the same subspace have indices that might or
 *       might not be equal (because one is summed over), the term is split
 *       into a branch where they are equal and a branch where they are not;
 *   <li>the ground-state projector {@code σ(g,g)} becomes
 *       {@code 1 - Σ_{k≠g} σ(k,k)};
 *   <li>a sum over an index that no longer occurs becomes a multiplicity,
 *       {@code N} or {@code N - m}.
 * </ul>
 */
public abstract class NormalOrder {
  private NormalOrder() {}

  /** Orders operators by subspace, then by index, unindexed first. */
  public static final Comparator<Operator.Elementary> GROUP_ORDERING =
      Comparator.<Operator.Elementary>comparingInt(op -> op.aon)
          .thenComparing(op -> op.index,
              Comparator.nullsFirst(Index.ORDERING));

  /** Returns the canonical form of a term. */
  public static Expr canonicalize(Term term) {
    return Expr.of(normalize(Draft.of(term), ImmutableSet.of()));
  }

  /** Returns the canonical form of an expression. */
  public static Expr canonicalize(Expr expr) {
    final List<Term> terms = new ArrayList<>();
    for (Term term : expr.terms) {
      terms.addAll(normalize(Draft.of(term), ImmutableSet.of()));
    }
    return Expr.of(terms);
  }

  /** Returns the canonical form of a sequence of operators. */
  public static Expr product(List<? extends Operator.Elementary> ops) {
    final Draft d = Draft.one();
    d.ops.addAll(ops);
    return Expr.of(normalize(d, ImmutableSet.of()));
  }

  /**
   * Multiplies expressions, and sums the product over additional indices.
   *
   * <p>Bound indices of a factor are renamed if their name clashes with an
   * index of another factor.
   *
   * @param factors Expressions to multiply, in order
   * @param binders Indices to sum over, outermost first; each must be free in
   *                the factors
   * @param constraints Constraints between binders
   */
  public static Expr multiply(List<Expr> factors, List<Index> binders,
      Set<Term.Unequal> constraints) {
    final List<List<Term>> termLists = new ArrayList<>();
    for (Expr factor : factors) {
      if (factor.isZero()) {
        return Expr.ZERO;
      }
      termLists.add(factor.terms);
    }
    final List<Term> out = new ArrayList<>();
    for (List<Term> combination : Lists.cartesianProduct(termLists)) {
      final Set<String> used = new HashSet<>();
      for (Index binder : binders) {
        used.add(binder.name);
      }
      for (Term term : combination) {
        for (Index index : term.allIndices()) {
          if (!term.bound.contains(index)) {
            used.add(index.name);
          }
        }
      }
      final Draft d = Draft.one();
      d.bound.addAll(binders);
      d.unequal.addAll(constraints);
      for (Term term : combination) {
        final Draft d2 = Draft.of(term);
        for (Index index : term.bound) {
          String name = index.name;
          while (used.contains(name)) {
            name = name + "'";
          }
          used.add(name);
          if (!name.equals(index.name)) {
            d2.rename(index, index.withName(name));
          }
        }
        d.coeff = d.coeff.times(d2.coeff);
        d.params.addAll(d2.params);
        d.averages.addAll(d2.averages);
        d.ops.addAll(d2.ops);
        d.bound.addAll(d2.bound);
        d.unequal.addAll(d2.unequal);
      }
      out.addAll(normalize(d, ImmutableSet.of()));
    }
    return Expr.of(out);
  }

  /** Multiplies expressions. */
  public static Expr multiply(Expr... factors) {
    return multiply(ImmutableList.copyOf(factors), ImmutableList.of(),
        ImmutableSet.of());
  }

  /**
   * Returns the Hermitian adjoint of a term: conjugate coefficient, reversed
   * adjoint operators, and conjugate averages.
   */
  public static Expr adjoint(Term term) {
    final Draft d = Draft.of(term);
    d.coeff = d.coeff.conj();
    d.averages.replaceAll(NormalOrder::adjointOps);
    final List<Operator.Elementary> ops = adjointOps(d.ops);
    d.ops.clear();
    d.ops.addAll(ops);
    return Expr.of(normalize(d, ImmutableSet.of()));
  }

  /** Returns the Hermitian adjoint of an expression. */
  public static Expr adjoint(Expr expr) {
    Expr result = Expr.ZERO;
    for (Term term : expr.terms) {
      result = result.plus(adjoint(term));
    }
    return result;
  }

  /**
   * Splits sums until every pair of indices on the given subspaces is known
   * to be equal or distinct.
   */
  public static List<Term> splitFully(Term term, Set<Integer> aons) {
    return normalize(Draft.of(term), aons);
  }

  /**
   * Substitutes indices in a term, and returns its canonical form. A bound
   * index that is substituted is no longer summed over. Returns an empty list
   * if the substitution violates a constraint.
   */
  public static List<Term> substitute(Term term, Map<Index, Index> map) {
    final Draft d = Draft.of(term);
    for (Map.Entry<Index, Index> entry : map.entrySet()) {
      if (!d.substitute(entry.getKey(), entry.getValue())) {
        return ImmutableList.of();
      }
    }
    return normalize(d, ImmutableSet.of());
  }

  private static List<Operator.Elementary> adjointOps(
      List<Operator.Elementary> ops) {
    final List<Operator.Elementary> list = new ArrayList<>(ops.size());
    for (Operator.Elementary op : ops) {
      list.add(op.adjoint());
    }
    Collections.reverse(list);
    return list;
  }

  /** Rewrites a draft until every branch is canonical. */
  private static List<Term> normalize(Draft draft, Set<Integer> splitAons) {
    final List<Term> out = new ArrayList<>();
    final Deque<Draft> queue = new ArrayDeque<>();
    queue.push(draft);
    while (!queue.isEmpty()) {
      final Draft d = queue.pop();
      if (d.coeff.isZero()) {
        continue;
      }
      if (!step(d, splitAons, queue)) {
        out.add(d.toTerm());
      }
    }
    return out;
  }

  /**
   * Applies one rewrite to a draft, pushing the resulting drafts (zero, one
   * or more) onto the queue. Returns false if no rule applies.
   */
  private static boolean step(Draft d, Set<Integer> splitAons,
      Deque<Draft> queue) {
    return split(d, splitAons, queue)
        || reorder(d, queue)
        || eliminateGround(d, queue)
        || removeSum(d, queue);
  }

  /** Splits a sum if two indices on the same subspace might be equal. */
  private static boolean split(Draft d, Set<Integer> splitAons,
      Deque<Draft> queue) {
    for (List<Operator.Elementary> sequence : d.sequences()) {
      for (int i = 0; i < sequence.size(); i++) {
        final Operator.Elementary x = sequence.get(i);
        for (int j = i + 1; j < sequence.size(); j++) {
          final Operator.Elementary y = sequence.get(j);
          if (x.aon == y.aon
              && x.index != null
              && y.index != null
              && d.relation(x.index, y.index) == Draft.Relation.SPLIT) {
            split(d, x.index, y.index, queue);
            return true;
          }
        }
      }
    }
    if (!splitAons.isEmpty()) {
      final List<Index> indices = new ArrayList<>(d.allIndices());
      for (int i = 0; i < indices.size(); i++) {
        final Index x = indices.get(i);
        if (!splitAons.contains(x.aon)) {
          continue;
        }
        for (int j = i + 1; j < indices.size(); j++) {
          final Index y = indices.get(j);
          if (y.aon == x.aon
              && d.relation(x, y) == Draft.Relation.SPLIT) {
            split(d, x, y, queue);
            return true;
          }
        }
      }
    }
    return false;
  }

  /**
   * Splits a draft into a branch where two indices are equal and a branch
   * where they are not.
   */
  private static void split(Draft d, Index x, Index y, Deque<Draft> queue) {
    final Index from;
    final Index to;
    if (d.isBound(x)
        && (!d.isBound(y) || d.bound.indexOf(x) > d.bound.indexOf(y))) {
      from = x;
      to = y;
    } else {
      from = y;
      to = x;
    }
    final Draft unequal = d.copy();
    unequal.unequal.add(Term.Unequal.of(x, y));
    queue.push(unequal);
    if (d.substitute(from, to)) {
      queue.push(d);
    }
  }

  /** Swaps or merges the first adjacent pair that is out of order. */
  private static boolean reorder(Draft d, Deque<Draft> queue) {
    final List<List<Operator.Elementary>> sequences = d.sequences();
    for (int s = 0; s < sequences.size(); s++) {
      final List<Operator.Elementary> sequence = sequences.get(s);
      for (int i = 0; i + 1 < sequence.size(); i++) {
        final Operator.Elementary x = sequence.get(i);
        final Operator.Elementary y = sequence.get(i + 1);
        if (x.aon != y.aon
            || d.relation(x.index, y.index) == Draft.Relation.DISTINCT) {
          if (GROUP_ORDERING.compare(x, y) > 0) {
            Collections.swap(sequence, i, i + 1);
            queue.push(d);
            return true;
          }
          continue;
        }
        // Same subsystem.
        switch (x.op) {
        case DESTROY:
          if (y.op == Op.CREATE) {
            final Draft contracted = d.copy();
            final List<Operator.Elementary> sequence2 =
                contracted.sequences().get(s);
            sequence2.remove(i + 1);
            sequence2.remove(i);
            queue.push(contracted);
            Collections.swap(sequence, i, i + 1);
            queue.push(d);
            return true;
          }
          break;
        case TRANSITION:
          final Operator.Transition t = (Operator.Transition) x;
          final Operator.Transition u = (Operator.Transition) y;
          if (t.l == u.k) {
            sequence.set(i, t.withLevels(t.k, u.l));
            sequence.remove(i + 1);
            queue.push(d);
          }
          return true;
        default:
          break;
        }
      }
    }
    return false;
  }

  /** Replaces the first ground-state projector by its complement. */
  private static boolean eliminateGround(Draft d, Deque<Draft> queue) {
    final List<List<Operator.Elementary>> sequences = d.sequences();
    for (int s = 0; s < sequences.size(); s++) {
      final List<Operator.Elementary> sequence = sequences.get(s);
      for (int i = 0; i < sequence.size(); i++) {
        final Operator.Elementary op = sequence.get(i);
        if (op.op != Op.TRANSITION
            || !((Operator.Transition) op).isGroundProjector()) {
          continue;
        }
        final Operator.Transition t = (Operator.Transition) op;
        for (int level = t.levels; level >= 1; level--) {
          if (level == t.ground) {
            continue;
          }
          final Draft d2 = d.copy();
          d2.coeff = d2.coeff.negate();
          d2.sequences().get(s).set(i, t.withLevels(level, level));
          queue.push(d2);
        }
        sequence.remove(i);
        queue.push(d);
        return true;
      }
    }
    return false;
  }

  /**
   * Replaces a sum over an index that no longer occurs by its multiplicity.
   * The range size is reduced by the number of indices that the summation
   * index must differ from; those indices must be pairwise distinct, so the
   * sum may first be split.
   */
  private static boolean removeSum(Draft d, Deque<Draft> queue) {
    final Set<Index> used = d.usedIndices();
    for (int b = d.bound.size() - 1; b >= 0; b--) {
      final Index index = d.bound.get(b);
      if (used.contains(index)) {
        continue;
      }
      final List<Index> partners = d.partners(index);
      for (int i = 0; i < partners.size(); i++) {
        for (int j = i + 1; j < partners.size(); j++) {
          if (d.relation(partners.get(i), partners.get(j))
              == Draft.Relation.SPLIT) {
            split(d, partners.get(i), partners.get(j), queue);
            return true;
          }
        }
      }
      d.bound.remove(b);
      d.unequal.removeIf(u -> u.contains(index));
      final int m = partners.size();
      if (index.hasSymbolicRange()) {
        if (m > 0) {
          final Draft d2 = d.copy();
          d2.coeff = d2.coeff.times(-m);
          queue.push(d2);
        }
        d.params.add(size(index));
        queue.push(d);
      } else {
        d.coeff = d.coeff.times(index.rangeSize - m);
        queue.push(d);
      }
      return true;
    }
    return false;
  }

  /** Returns the parameter that is the size of an index's range. */
  public static Factor.Parameter size(Index index) {
    return Factor.Parameter.of(index.rangeName, ImmutableList.of());
  }
}

// End NormalOrder.java
