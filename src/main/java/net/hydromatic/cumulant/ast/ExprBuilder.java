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
package net.hydromatic.cumulant.ast;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.cumulant.algebra.NormalOrder;
import net.hydromatic.cumulant.compile.IndexBindingException;
import net.hydromatic.cumulant.compile.InvalidOperatorException;
import net.hydromatic.cumulant.space.HilbertSpace;
import net.hydromatic.cumulant.space.Index;
import net.hydromatic.cumulant.space.Subspace;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds operator and scalar expressions. */
public enum ExprBuilder {
  /**
   * The singleton instance of the expression builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ex;

  /** Creates an annihilation operator on a bosonic subspace. */
  public Expr destroy(HilbertSpace h, String name, int aon) {
    return elementary(new Operator.Destroy(name, checkFock(h, aon), null));
  }

  /** Creates an annihilation operator on an indexed bosonic subspace. */
  public Expr destroy(HilbertSpace h, String name, Index index) {
    return elementary(
        new Operator.Destroy(name, checkFock(h, index.aon), index));
  }

  /** Creates a creation operator on a bosonic subspace. */
  public Expr create(HilbertSpace h, String name, int aon) {
    return elementary(new Operator.Create(name, checkFock(h, aon), null));
  }

  /** Creates a creation operator on an indexed bosonic subspace. */
  public Expr create(HilbertSpace h, String name, Index index) {
    return elementary(
        new Operator.Create(name, checkFock(h, index.aon), index));
  }

  /** Creates a transition operator σ(k,l) = |k⟩⟨l|. */
  public Expr transition(HilbertSpace h, String name, int aon, int k, int l) {
    return transition(h, name, aon, null, k, l);
  }

  /** Creates a transition operator on an indexed subsystem. */
  public Expr transition(HilbertSpace h, String name, Index index, int k,
      int l) {
    return transition(h, name, index.aon, index, k, l);
  }

  private Expr transition(HilbertSpace h, String name, int aon,
      @Nullable Index index, int k, int l) {
    final Subspace.NLevel space = checkNLevel(h, aon);
    if (!space.isLevel(k) || !space.isLevel(l)) {
      throw new InvalidOperatorException("transition " + name + k + l
          + " out of range for " + space, name + k + l);
    }
    return elementary(
        new Operator.Transition(name, aon, index, k, l, space.levels,
            space.ground));
  }

  private static Expr elementary(Operator.Elementary op) {
    return NormalOrder.product(ImmutableList.of(op));
  }

  private static int checkFock(HilbertSpace h, int aon) {
    if (!h.contains(aon)) {
      throw new InvalidOperatorException(
          "operator on undeclared subspace " + aon, aon);
    }
    if (!h.get(aon).isBosonic()) {
      throw new InvalidOperatorException(
          "ladder operator on non-bosonic subspace " + h.get(aon),
          h.get(aon));
    }
    return aon;
  }

  private static Subspace.NLevel checkNLevel(HilbertSpace h, int aon) {
    if (!h.contains(aon)) {
      throw new InvalidOperatorException(
          "operator on undeclared subspace " + aon, aon);
    }
    final Subspace space = h.get(aon);
    if (!(space instanceof Subspace.NLevel)) {
      throw new InvalidOperatorException(
          "transition on subspace " + space + " that has no levels", space);
    }
    return (Subspace.NLevel) space;
  }

  /** Creates a real parameter, optionally indexed. */
  public Expr param(String name, Index... indices) {
    return Expr.of(
        Term.of(Num.ONE,
            ImmutableList.of(
                Factor.Parameter.of(name, ImmutableList.copyOf(indices)))));
  }

  /** Creates a constant. */
  public Expr num(Num n) {
    return Expr.of(Term.of(n, ImmutableList.of()));
  }

  /** Creates a real constant. */
  public Expr num(double d) {
    return num(Num.of(d));
  }

  public Expr plus(Expr... exprs) {
    Expr result = Expr.ZERO;
    for (Expr expr : exprs) {
      result = result.plus(expr);
    }
    return result;
  }

  public Expr minus(Expr a, Expr b) {
    return a.minus(b);
  }

  /** Multiplies expressions, in order. */
  public Expr times(Expr... exprs) {
    return NormalOrder.multiply(exprs);
  }

  /** Multiplies an expression by a number. */
  public Expr times(Num n, Expr expr) {
    return expr.times(n);
  }

  /** Multiplies an expression by a real number. */
  public Expr times(double d, Expr expr) {
    return expr.times(Num.of(d));
  }

  /** Returns the Hermitian adjoint of an expression. */
  public Expr adjoint(Expr expr) {
    return NormalOrder.adjoint(expr);
  }

  /** Returns the commutator {@code [a, b] = ab − ba}. */
  public Expr commutator(Expr a, Expr b) {
    return times(a, b).minus(times(b, a));
  }

  /**
   * Sums an expression over an index, skipping the values of the excluded
   * indices.
   */
  public Expr sum(Expr expr, Index index, Index... excluded) {
    final Set<Term.Unequal> constraints = new LinkedHashSet<>();
    for (Index e : excluded) {
      if (e.aon != index.aon || e.equals(index)) {
        throw new IndexBindingException("cannot exclude index " + e
            + " from sum over " + index, e);
      }
      constraints.add(Term.Unequal.of(index, e));
    }
    for (Term term : expr.terms) {
      for (Index bound : term.bound) {
        if (bound.name.equals(index.name)) {
          throw new IndexBindingException("index " + index
              + " is already bound in " + term, index);
        }
      }
    }
    return NormalOrder.multiply(ImmutableList.of(expr),
        ImmutableList.of(index), constraints);
  }

  /**
   * Sums an expression over two indices; if {@code excludeEqual}, skips
   * terms where the indices are equal.
   */
  public Expr doubleSum(Expr expr, Index i, Index j, boolean excludeEqual) {
    final Expr inner = excludeEqual ? sum(expr, j, i) : sum(expr, j);
    return sum(inner, i);
  }

  /**
   * Converts an operator expression into a scalar expression by taking the
   * average of its operator part.
   */
  public Expr average(Expr expr) {
    final List<Term> terms = new ArrayList<>();
    for (Term term : expr.terms) {
      if (term.isScalar()) {
        terms.add(term);
      } else {
        final List<Factor> factors = new ArrayList<>(term.factors);
        factors.add(Factor.Average.of(term.product));
        terms.add(
            Term.of(term.coeff, factors, Operator.Product.IDENTITY,
                term.bound, term.unequal));
      }
    }
    return Expr.of(terms);
  }

  /** Returns the single average of an operator expression that is a single
   * product. */
  public Factor.Average averageOf(Expr expr) {
    if (expr.terms.size() != 1
        || !expr.terms.get(0).coeff.isOne()
        || !expr.terms.get(0).factors.isEmpty()
        || !expr.terms.get(0).bound.isEmpty()
        || expr.terms.get(0).isScalar()) {
      throw new IllegalArgumentException("not a single product: " + expr);
    }
    return Factor.Average.of(expr.terms.get(0).product);
  }

  /** Re-normalizes every term of an expression. */
  public Expr canonicalize(Expr expr) {
    return NormalOrder.canonicalize(expr);
  }
}

// End ExprBuilder.java
