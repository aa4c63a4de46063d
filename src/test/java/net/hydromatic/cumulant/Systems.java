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
package net.hydromatic.cumulant;

import static net.hydromatic.cumulant.ast.ExprBuilder.ex;

import net.hydromatic.cumulant.algebra.Filters;
import net.hydromatic.cumulant.ast.Expr;
import net.hydromatic.cumulant.compile.Dissipation;
import net.hydromatic.cumulant.compile.MeanField;
import net.hydromatic.cumulant.eval.Parameters;
import net.hydromatic.cumulant.space.HilbertSpace;
import net.hydromatic.cumulant.space.Index;
import net.hydromatic.cumulant.space.Subspace;

/** Model systems used by tests. */
public abstract class Systems {
  private Systems() {}

  /** A cavity (subspace 0) and a two-level atom (subspace 1). */
  public static final HilbertSpace CAVITY_ATOM =
      HilbertSpace.of(new Subspace.Fock("cavity"),
          new Subspace.NLevel("atom", 2));

  /** Acts-on number of the cavity. */
  public static final int CAVITY = 0;

  /** Acts-on number of the atom, or of each of N identical atoms. */
  public static final int ATOM = 1;

  public static Expr a() {
    return ex.destroy(CAVITY_ATOM, "a", CAVITY);
  }

  public static Expr ad() {
    return ex.create(CAVITY_ATOM, "a", CAVITY);
  }

  public static Expr sigma(int k, int l) {
    return ex.transition(CAVITY_ATOM, "σ", ATOM, k, l);
  }

  public static Expr sigma(Index index, int k, int l) {
    return ex.transition(CAVITY_ATOM, "σ", index, k, l);
  }

  /** Index over N identical atoms. */
  public static Index atom(String name) {
    return Index.of(CAVITY_ATOM, name, "N", ATOM);
  }

  /**
   * Builder for a cavity coupled to one atom,
   * {@code H = Δ a†a + g(a†σ12 + aσ21)}, with cavity decay κ and atomic
   * decay Γ, at order 1.
   */
  public static MeanField.Builder jaynesCummings() {
    final Expr hamiltonian =
        ex.plus(ex.times(ex.param("Δ"), ad(), a()),
            ex.times(ex.param("g"),
                ex.plus(ex.times(ad(), sigma(1, 2)),
                    ex.times(a(), sigma(2, 1)))));
    final Dissipation dissipation =
        Dissipation.builder()
            .add(a(), ex.param("κ"))
            .add(sigma(1, 2), ex.param("Γ"))
            .build();
    return MeanField.builder(CAVITY_ATOM)
        .hamiltonian(hamiltonian)
        .dissipation(dissipation)
        .order(1);
  }

  /**
   * Builder for a cavity coupled to N identical atoms,
   * {@code H = Δ a†a + Σ_i g(a†σ12(i) + aσ21(i))}, with cavity decay κ and
   * atomic decay Γ, and a phase-invariant filter.
   */
  public static MeanField.Builder tavisCummings(int order) {
    final Index i = atom("i");
    final Expr hamiltonian =
        ex.plus(ex.times(ex.param("Δ"), ad(), a()),
            ex.sum(
                ex.times(ex.param("g"),
                    ex.plus(ex.times(ad(), sigma(i, 1, 2)),
                        ex.times(a(), sigma(i, 2, 1)))),
                i));
    final Dissipation dissipation =
        Dissipation.builder()
            .add(a(), ex.param("κ"))
            .add(sigma(i, 1, 2), ex.param("Γ"))
            .build();
    return MeanField.builder(CAVITY_ATOM)
        .hamiltonian(hamiltonian)
        .dissipation(dissipation)
        .order(order)
        .filter(Filters.phaseInvariant());
  }

  /** Parameter values for {@link #jaynesCummings()} and
   * {@link #tavisCummings(int)}. */
  public static Parameters parameters() {
    return Parameters.builder()
        .put("Δ", 0.3)
        .put("g", 0.7)
        .put("κ", 1.1)
        .put("Γ", 0.4)
        .build();
  }
}

// End Systems.java
