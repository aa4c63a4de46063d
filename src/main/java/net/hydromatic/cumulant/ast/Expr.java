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
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sum of terms.
 *
 * <p>Like terms (equal but for their coefficient) are combined, terms whose
 * coefficient is zero are removed, and the remaining terms are sorted by
 * their printed form. Two expressions built from equal canonical terms are
 * therefore equal.
 *
 * <p>The same class holds operator expressions (such as a Hamiltonian) and
 * scalar expressions (such as the right-hand side of an equation).
 */
public final class Expr {
  public static final Expr ZERO = new Expr(ImmutableList.of());
  public static final Expr ONE =
      new Expr(ImmutableList.of(Term.of(Num.ONE, ImmutableList.of())));

  private static final Comparator<Term> TERM_ORDERING =
      Comparator.comparing(Term::digest);

  public final ImmutableList<Term> terms;

  private Expr(ImmutableList<Term> terms) {
    this.terms = requireNonNull(terms);
  }

  /** Creates an expression from terms that are in canonical form. */
  public static Expr of(Iterable<Term> terms) {
    final Map<Term, Num> map = new LinkedHashMap<>();
    for (Term term : terms) {
      map.merge(term.key(), term.coeff, Num::plus);
    }
    final List<Term> list = new ArrayList<>();
    map.forEach((key, coeff) -> {
      if (!coeff.isZero()) {
        list.add(key.withCoeff(coeff));
      }
    });
    if (list.isEmpty()) {
      return ZERO;
    }
    list.sort(TERM_ORDERING);
    return new Expr(ImmutableList.copyOf(list));
  }

  /** Creates an expression of a single term in canonical form. */
  public static Expr of(Term term) {
    return of(ImmutableList.of(term));
  }

  public boolean isZero() {
    return terms.isEmpty();
  }

  /** Returns whether every term has no operator part. */
  public boolean isScalar() {
    for (Term term : terms) {
      if (!term.isScalar()) {
        return false;
      }
    }
    return true;
  }

  public Expr plus(Expr e) {
    if (e.isZero()) {
      return this;
    }
    if (isZero()) {
      return e;
    }
    final List<Term> list = new ArrayList<>(terms);
    list.addAll(e.terms);
    return of(list);
  }

  public Expr minus(Expr e) {
    return plus(e.negate());
  }

  public Expr negate() {
    return times(Num.MINUS_ONE);
  }

  /** Multiplies every coefficient by a number. */
  public Expr times(Num n) {
    if (n.isZero()) {
      return ZERO;
    }
    final List<Term> list = new ArrayList<>();
    for (Term term : terms) {
      list.add(term.withCoeff(term.coeff.times(n)));
    }
    return of(list);
  }

  /** Returns the distinct averages that occur in this expression. */
  public Set<Factor.Average> averages() {
    final Set<Factor.Average> set = new LinkedHashSet<>();
    for (Term term : terms) {
      set.addAll(term.averages());
    }
    return set;
  }

  /** Returns the distinct parameters that occur in this expression. */
  public Set<Factor.Parameter> parameters() {
    final Set<Factor.Parameter> set = new LinkedHashSet<>();
    for (Term term : terms) {
      set.addAll(term.parameters());
    }
    return set;
  }

  @Override
  public int hashCode() {
    return terms.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Expr && ((Expr) o).terms.equals(terms);
  }

  public StringBuilder unparse(StringBuilder b) {
    if (terms.isEmpty()) {
      return b.append('0');
    }
    for (int i = 0; i < terms.size(); i++) {
      final Term term = terms.get(i);
      if (i == 0) {
        term.unparse(b);
      } else if (isNegative(term.coeff)) {
        b.append(" - ");
        term.withCoeff(term.coeff.negate()).unparse(b);
      } else {
        b.append(" + ");
        term.unparse(b);
      }
    }
    return b;
  }

  /** Returns whether a coefficient prints with a leading minus sign. */
  private static boolean isNegative(Num n) {
    return n.im == 0d ? n.re < 0 : n.re == 0d && n.im < 0;
  }

  @Override
  public String toString() {
    return unparse(new StringBuilder()).toString();
  }
}

// End Expr.java
