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
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.cumulant.ast.Factor;
import net.hydromatic.cumulant.ast.Num;
import net.hydromatic.cumulant.ast.Operator;
import net.hydromatic.cumulant.ast.Term;
import net.hydromatic.cumulant.space.Index;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Mutable term that is being rewritten into canonical form.
 *
 * <p>Operator sequences (the operator part, and the argument of each
 * average) are raw lists; {@link NormalOrder} rewrites them until each is a
 * canonical product, then converts the draft into a {@link Term}.
 */
class Draft {
  Num coeff;
  final List<Factor.Parameter> params;
  final List<List<Operator.Elementary>> averages;
  final List<Operator.Elementary> ops;
  final List<Index> bound;
  final Set<Term.Unequal> unequal;

  private Draft(Num coeff, List<Factor.Parameter> params,
      List<List<Operator.Elementary>> averages,
      List<Operator.Elementary> ops, List<Index> bound,
      Set<Term.Unequal> unequal) {
    this.coeff = coeff;
    this.params = params;
    this.averages = averages;
    this.ops = ops;
    this.bound = bound;
    this.unequal = unequal;
  }

  /** Creates an empty draft, representing the number 1. */
  static Draft one() {
    return new Draft(Num.ONE, new ArrayList<>(), new ArrayList<>(),
        new ArrayList<>(), new ArrayList<>(), new LinkedHashSet<>());
  }

  /** Creates a draft from a term. */
  static Draft of(Term term) {
    final Draft d = one();
    d.append(term);
    return d;
  }

  /** Multiplies this draft, on the right, by a term. */
  void append(Term term) {
    coeff = coeff.times(term.coeff);
    for (Factor factor : term.factors) {
      if (factor instanceof Factor.Parameter) {
        params.add((Factor.Parameter) factor);
      } else {
        averages.add(new ArrayList<>(((Factor.Average) factor).product.ops));
      }
    }
    ops.addAll(term.product.ops);
    bound.addAll(term.bound);
    unequal.addAll(term.unequal);
  }

  Draft copy() {
    final List<List<Operator.Elementary>> averages2 = new ArrayList<>();
    for (List<Operator.Elementary> average : averages) {
      averages2.add(new ArrayList<>(average));
    }
    return new Draft(coeff, new ArrayList<>(params), averages2,
        new ArrayList<>(ops), new ArrayList<>(bound),
        new LinkedHashSet<>(unequal));
  }

  /** Returns the operator sequences: the operator part, then averages. */
  List<List<Operator.Elementary>> sequences() {
    final List<List<Operator.Elementary>> list = new ArrayList<>();
    list.add(ops);
    list.addAll(averages);
    return list;
  }

  boolean isBound(@Nullable Index index) {
    return index != null && bound.contains(index);
  }

  /** Returns the indices that occur in operators and parameters. */
  Set<Index> usedIndices() {
    final Set<Index> set = new LinkedHashSet<>();
    for (Factor.Parameter param : params) {
      set.addAll(param.indices);
    }
    for (List<Operator.Elementary> sequence : sequences()) {
      for (Operator.Elementary op : sequence) {
        if (op.index != null) {
          set.add(op.index);
        }
      }
    }
    return set;
  }

  /** Returns every index, including bound indices and constrained indices. */
  Set<Index> allIndices() {
    final Set<Index> set = new LinkedHashSet<>(bound);
    set.addAll(usedIndices());
    for (Term.Unequal u : unequal) {
      set.addAll(u.indices());
    }
    return set;
  }

  /** Returns the indices that an index is constrained to differ from. */
  List<Index> partners(Index index) {
    final List<Index> list = new ArrayList<>();
    for (Term.Unequal u : unequal) {
      if (u.left.equals(index)) {
        list.add(u.right);
      } else if (u.right.equals(index)) {
        list.add(u.left);
      }
    }
    return list;
  }

  /** Returns what is known about whether two indices are equal. */
  Relation relation(@Nullable Index x, @Nullable Index y) {
    if (x == null || y == null) {
      return x == y ? Relation.SAME : Relation.DISTINCT;
    }
    if (x.equals(y)) {
      return Relation.SAME;
    }
    if (x.isConcrete() && y.isConcrete()) {
      return x.value == y.value ? Relation.SAME : Relation.DISTINCT;
    }
    if (unequal.contains(Term.Unequal.of(x, y))) {
      return Relation.DISTINCT;
    }
    if (!isBound(x) && !isBound(y)) {
      // Free indices are distinct from each other and from concrete indices
      return Relation.DISTINCT;
    }
    return Relation.SPLIT;
  }

  /**
   * Replaces index {@code from} by {@code to} everywhere, and removes
   * {@code from} from the bound indices. Returns false if the constraints
   * become contradictory.
   */
  boolean substitute(Index from, Index to) {
    replace(from, to);
    bound.remove(from);
    final List<Term.Unequal> list = new ArrayList<>(unequal);
    unequal.clear();
    for (Term.Unequal u : list) {
      final Term.Unequal u2 = u.substitute(from, to);
      if (u2.isContradiction()) {
        return false;
      }
      if (isBound(u2.left) || isBound(u2.right)) {
        unequal.add(u2);
      }
    }
    return true;
  }

  /** Renames a bound index. */
  void rename(Index from, Index to) {
    replace(from, to);
    bound.replaceAll(i -> i.equals(from) ? to : i);
    final List<Term.Unequal> list = new ArrayList<>(unequal);
    unequal.clear();
    for (Term.Unequal u : list) {
      unequal.add(u.substitute(from, to));
    }
  }

  private void replace(Index from, Index to) {
    for (List<Operator.Elementary> sequence : sequences()) {
      sequence.replaceAll(op ->
          from.equals(op.index) ? op.withIndex(to) : op);
    }
    params.replaceAll(p -> {
      if (!p.indices.contains(from)) {
        return p;
      }
      final List<Index> indices = new ArrayList<>(p.indices);
      indices.replaceAll(i -> i.equals(from) ? to : i);
      return p.withIndices(indices);
    });
  }

  /** Converts a draft whose sequences are in canonical form into a term. */
  Term toTerm() {
    final List<Factor> factors = new ArrayList<>(params);
    for (List<Operator.Elementary> average : averages) {
      if (!average.isEmpty()) {
        factors.add(Factor.Average.of(Operator.Product.of(average)));
      }
    }
    return Term.of(coeff, factors, Operator.Product.of(ops),
        ImmutableList.copyOf(bound), unequal);
  }

  /**
   * What is known about whether two indices have the same value.
   *
   * <p>A free symbolic index names a generic subsystem: it differs from every
   * other free index, and from every concrete index, on its subspace. So in
   * the equation for ⟨σ12(j)⟩, a Hamiltonian term on atom 1 acts on another
   * atom. A model that singles out an atom by a concrete index should use
   * concrete indices in its targets too.
   */
  enum Relation {
    /** The indices are the same. */
    SAME,
    /** The indices are known to be different. */
    DISTINCT,
    /**
     * The indices may or may not be equal; at least one is a summation
     * index, and the sum must be split.
     */
    SPLIT
  }
}

// End Draft.java
