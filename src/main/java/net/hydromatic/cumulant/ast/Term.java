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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import net.hydromatic.cumulant.space.Index;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Term of an expression: a coefficient times parameters, averages and an
 * operator product, summed over zero or more indices.
 *
 * <p>For example, {@code Σ(j≠i) 2*g*⟨σ12(j)⟩*a†} is a term with coefficient 2,
 * factors {@code [g, ⟨σ12(j)⟩]}, product {@code a†}, bound index {@code j} and
 * constraint {@code j≠i}.
 *
 * <p>Invariants: factors are sorted; every constraint involves at least one
 * bound index; distinct free symbolic indices on the same subspace are
 * implicitly unequal, and are not listed as constraints.
 */
public final class Term {
  public final Num coeff;
  public final ImmutableList<Factor> factors;
  public final Operator.Product product;
  /** Summation indices, outermost first. */
  public final ImmutableList<Index> bound;
  public final ImmutableSet<Unequal> unequal;

  private @Nullable String digest;

  private Term(Num coeff, ImmutableList<Factor> factors,
      Operator.Product product, ImmutableList<Index> bound,
      ImmutableSet<Unequal> unequal) {
    this.coeff = requireNonNull(coeff, "coeff");
    this.factors = requireNonNull(factors, "factors");
    this.product = requireNonNull(product, "product");
    this.bound = requireNonNull(bound, "bound");
    this.unequal = requireNonNull(unequal, "unequal");
  }

  /** Creates a term; sorts the factors. */
  public static Term of(Num coeff, Iterable<? extends Factor> factors,
      Operator.Product product, List<Index> bound, Set<Unequal> unequal) {
    return new Term(coeff, ImmutableList.<Factor>sortedCopyOf(factors),
        product, ImmutableList.copyOf(bound), ImmutableSet.copyOf(unequal));
  }

  /** Creates a scalar term with no sums. */
  public static Term of(Num coeff, Iterable<? extends Factor> factors) {
    return of(coeff, factors, Operator.Product.IDENTITY, ImmutableList.of(),
        ImmutableSet.of());
  }

  /** Creates a term that is an operator product with unit coefficient. */
  public static Term of(Operator.Product product) {
    return new Term(Num.ONE, ImmutableList.of(), product, ImmutableList.of(),
        ImmutableSet.of());
  }

  /** Returns this term with a different coefficient. */
  public Term withCoeff(Num coeff) {
    return coeff.equals(this.coeff)
        ? this
        : new Term(coeff, factors, product, bound, unequal);
  }

  /** Returns this term with unit coefficient; the key for combining terms. */
  public Term key() {
    return withCoeff(Num.ONE);
  }

  /** Returns whether this term has no operator part. */
  public boolean isScalar() {
    return product.isIdentity();
  }

  /** Returns the averages among the factors. */
  public List<Factor.Average> averages() {
    final List<Factor.Average> list = new ArrayList<>();
    for (Factor factor : factors) {
      if (factor instanceof Factor.Average) {
        list.add((Factor.Average) factor);
      }
    }
    return list;
  }

  /** Returns the parameters among the factors. */
  public List<Factor.Parameter> parameters() {
    final List<Factor.Parameter> list = new ArrayList<>();
    for (Factor factor : factors) {
      if (factor instanceof Factor.Parameter) {
        list.add((Factor.Parameter) factor);
      }
    }
    return list;
  }

  /**
   * Returns the indices that occur in the factors and product, in order of
   * appearance.
   */
  public Set<Index> indices() {
    final Set<Index> set = new LinkedHashSet<>();
    for (Factor factor : factors) {
      set.addAll(factor.indices());
    }
    set.addAll(product.indices());
    return set;
  }

  /** Returns the symbolic indices that occur and are not summed over. */
  public Set<Index> freeIndices() {
    final Set<Index> set = new LinkedHashSet<>();
    for (Index index : indices()) {
      if (!index.isConcrete() && !bound.contains(index)) {
        set.add(index);
      }
    }
    for (Unequal u : unequal) {
      for (Index index : u.indices()) {
        if (!index.isConcrete() && !bound.contains(index)) {
          set.add(index);
        }
      }
    }
    return set;
  }

  /**
   * Returns every index mentioned by this term: occurring, bound, or in a
   * constraint.
   */
  public Set<Index> allIndices() {
    final Set<Index> set = new LinkedHashSet<>(bound);
    set.addAll(indices());
    for (Unequal u : unequal) {
      set.addAll(u.indices());
    }
    return set;
  }

  /** Returns the indices that an index is constrained to differ from. */
  public List<Index> partners(Index index) {
    final List<Index> list = new ArrayList<>();
    for (Unequal u : unequal) {
      if (u.left.equals(index)) {
        list.add(u.right);
      } else if (u.right.equals(index)) {
        list.add(u.left);
      }
    }
    list.sort(Index.ORDERING);
    return list;
  }

  @Override
  public int hashCode() {
    return Objects.hash(coeff, factors, product, bound, unequal);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Term
            && ((Term) o).coeff.equals(coeff)
            && ((Term) o).factors.equals(factors)
            && ((Term) o).product.equals(product)
            && ((Term) o).bound.equals(bound)
            && ((Term) o).unequal.equals(unequal);
  }

  /** Returns the printed form of this term without its coefficient. */
  String digest() {
    String s = digest;
    if (s == null) {
      digest = s = key().toString();
    }
    return s;
  }

  public StringBuilder unparse(StringBuilder b) {
    for (int i = 0; i < bound.size(); i++) {
      final Index index = bound.get(i);
      b.append("Σ(").append(index.name);
      String sep = "≠";
      for (Index partner : partners(index)) {
        final int j = bound.indexOf(partner);
        if (j < i) {
          b.append(sep).append(partner.name);
          sep = ",";
        }
      }
      b.append(") ");
    }
    final List<Object> parts = new ArrayList<>(factors);
    if (!product.isIdentity()) {
      parts.add(product);
    }
    if (parts.isEmpty()) {
      return b.append(coeff);
    }
    if (coeff.equals(Num.MINUS_ONE)) {
      b.append('-');
    } else if (!coeff.isOne()) {
      b.append(coeff).append('*');
    }
    for (int i = 0; i < parts.size(); i++) {
      if (i > 0) {
        b.append('*');
      }
      b.append(parts.get(i));
    }
    return b;
  }

  @Override
  public String toString() {
    return unparse(new StringBuilder()).toString();
  }

  /** Constraint that two indices have different values. */
  public static final class Unequal {
    public final Index left;
    public final Index right;

    private Unequal(Index left, Index right) {
      this.left = left;
      this.right = right;
    }

    /** Creates a constraint; the order of the arguments does not matter. */
    public static Unequal of(Index a, Index b) {
      return Index.ORDERING.compare(a, b) <= 0
          ? new Unequal(a, b)
          : new Unequal(b, a);
    }

    /** Returns whether this constraint can never hold. */
    public boolean isContradiction() {
      return left.equals(right);
    }

    public boolean contains(Index index) {
      return left.equals(index) || right.equals(index);
    }

    public List<Index> indices() {
      return ImmutableList.of(left, right);
    }

    /** Replaces an index in this constraint. */
    public Unequal substitute(Index from, Index to) {
      if (!contains(from)) {
        return this;
      }
      return of(left.equals(from) ? to : left, right.equals(from) ? to : right);
    }

    @Override
    public int hashCode() {
      return left.hashCode() * 37 + right.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Unequal
              && ((Unequal) o).left.equals(left)
              && ((Unequal) o).right.equals(right);
    }

    @Override
    public String toString() {
      return left + "≠" + right;
    }
  }
}

// End Term.java
