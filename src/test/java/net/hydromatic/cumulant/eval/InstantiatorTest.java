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

import static net.hydromatic.cumulant.Systems.ATOM;
import static net.hydromatic.cumulant.Systems.CAVITY_ATOM;
import static net.hydromatic.cumulant.Systems.a;
import static net.hydromatic.cumulant.Systems.ad;
import static net.hydromatic.cumulant.Systems.atom;
import static net.hydromatic.cumulant.Systems.parameters;
import static net.hydromatic.cumulant.Systems.sigma;
import static net.hydromatic.cumulant.Systems.tavisCummings;
import static net.hydromatic.cumulant.ast.ExprBuilder.ex;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.cumulant.algebra.Averages;
import net.hydromatic.cumulant.algebra.Filters;
import net.hydromatic.cumulant.ast.Expr;
import net.hydromatic.cumulant.ast.Factor;
import net.hydromatic.cumulant.ast.Num;
import net.hydromatic.cumulant.compile.Dissipation;
import net.hydromatic.cumulant.compile.Equation;
import net.hydromatic.cumulant.compile.EquationGenerator;
import net.hydromatic.cumulant.compile.EquationSet;
import net.hydromatic.cumulant.compile.MeanField;
import net.hydromatic.cumulant.compile.NonClosureException;
import net.hydromatic.cumulant.compile.Scaler;
import net.hydromatic.cumulant.space.Index;
import org.junit.jupiter.api.Test;

/** Tests for {@link Instantiator}. */
public class InstantiatorTest {
  private static final Set<Integer> ATOMS = ImmutableSet.of(ATOM);

  static EquationSet tavisCummingsSet() {
    final Index j = atom("j");
    return tavisCummings(2)
        .complete(ex.average(ex.times(ad(), a())),
            ex.average(sigma(j, 2, 2)));
  }

  @Test
  void testInstantiate() {
    final EquationSet set = tavisCummingsSet();
    final EquationSet set3 =
        Instantiator.instantiate(set, ImmutableMap.of("N", 3));
    assertThat(set3.closed, is(true));
    assertThat(set3.isScaled(), is(false));
    // ⟨a†a⟩; ⟨σ22(k)⟩ and ⟨a σ21(k)⟩ for 3 atoms; ⟨σ12(k) σ21(l)⟩ for 3
    // pairs, each covering its adjoint
    assertThat(set3.equations, hasSize(10));
    assertThat(set3.lhs().subList(0, 4),
        hasToString("[⟨a†*a⟩, ⟨σ22(1)⟩, ⟨σ22(2)⟩, ⟨σ22(3)⟩]"));
    assertThat(set3.equations.get(0).rhs,
        hasToString("i*g*⟨a*σ21(1)⟩ + i*g*⟨a*σ21(2)⟩ + i*g*⟨a*σ21(3)⟩ "
            + "- i*g*⟨a†*σ12(1)⟩ - i*g*⟨a†*σ12(2)⟩ - i*g*⟨a†*σ12(3)⟩ "
            + "- κ*⟨a†*a⟩"));
    NumericSystem.of(set3);

    // Without identifying adjoints, each ordered pair has an equation.
    final EquationSet set3b =
        Instantiator.instantiate(set, ImmutableMap.of("N", 3), false);
    assertThat(set3b.equations, hasSize(13));
  }

  @Test
  void testInstantiateFailures() {
    final Index j = atom("j");
    final EquationSet derived =
        tavisCummings(2).derive(ex.average(sigma(j, 2, 2)));
    assertThrows(NonClosureException.class,
        () -> Instantiator.instantiate(derived, ImmutableMap.of("N", 2)));
    final EquationSet set = tavisCummingsSet();
    assertThrows(IllegalArgumentException.class,
        () -> Instantiator.instantiate(set, ImmutableMap.of("M", 2)));
  }

  /** For a state that is symmetric under permutations of atoms, the
   * scaled system and the instantiated system have the same derivatives. */
  @Test
  void testScaledMatchesInstantiated() {
    final EquationSet set = tavisCummingsSet();
    final EquationSet scaled = Scaler.scale(set);
    final EquationSet set3 =
        Instantiator.instantiate(set, ImmutableMap.of("N", 3));
    final NumericSystem scaledSystem = NumericSystem.of(scaled);
    final NumericSystem system3 = NumericSystem.of(set3);

    final Num c = Num.of(0.1, 0.2);
    final Map<String, Num> values =
        ImmutableMap.<String, Num>builder()
            .put("⟨a†*a⟩", Num.of(0.8))
            .put("⟨σ22(1)⟩", Num.of(0.3))
            .put("⟨a*σ21(1)⟩", c)
            .put("⟨a†*σ12(1)⟩", c.conj())
            .put("⟨σ12(1)*σ21(2)⟩", Num.of(0.05))
            .build();
    final Num[] scaledState = state(scaled.lhs(), values);
    final Num[] state3 = state(set3.lhs(), values);
    final Parameters p =
        Parameters.builder()
            .put("Δ", 0.3).put("g", 0.7).put("κ", 1.1).put("Γ", 0.4)
            .put("N", 3)
            .build();
    final Num[] scaledDerivatives = scaledSystem.derivatives(scaledState, p);
    final Num[] derivatives3 = system3.derivatives(state3, p);
    for (int i = 0; i < set3.size(); i++) {
      final Factor.Average rep =
          Averages.representative(set3.lhs().get(i), ATOMS);
      final int k = scaled.lhs().indexOf(rep);
      final Num expected = scaledDerivatives[k];
      assertThat(derivatives3[i].re, closeTo(expected.re, 1e-9));
      assertThat(derivatives3[i].im, closeTo(expected.im, 1e-9));
    }
  }

  private static Num[] state(List<Factor.Average> lhs,
      Map<String, Num> values) {
    final Num[] state = new Num[lhs.size()];
    for (int i = 0; i < state.length; i++) {
      final String rep =
          Averages.representative(lhs.get(i), ATOMS).toString();
      state[i] = values.get(rep);
    }
    return state;
  }

  /** Collective decay with a rate matrix Γ(i,j), instantiated for two
   * atoms, agrees with the same system written with explicit indices. */
  @Test
  void testCollectiveDecay() {
    final Index i = atom("i");
    final Index j = atom("j");
    final Index k = atom("k");
    final EquationSet set =
        MeanField.builder(CAVITY_ATOM)
            .hamiltonian(ex.sum(ex.times(ex.param("Δ"), sigma(i, 2, 2)), i))
            .dissipation(
                Dissipation.builder()
                    .add(sigma(i, 1, 2), ex.param("Γ", i, j))
                    .build())
            .order(2)
            .filter(Filters.phaseInvariant())
            .complete(ex.average(sigma(k, 2, 2)));
    final EquationSet set2 =
        Instantiator.instantiate(set, ImmutableMap.of("N", 2));
    final NumericSystem system = NumericSystem.of(set2);

    final Index one = i.withValue(1);
    final Index two = i.withValue(2);
    final List<Expr> jumps =
        ImmutableList.of(sigma(one, 1, 2), sigma(two, 1, 2));
    final List<List<Expr>> rates = new ArrayList<>();
    for (Index x : ImmutableList.of(one, two)) {
      final List<Expr> row = new ArrayList<>();
      for (Index y : ImmutableList.of(one, two)) {
        row.add(ex.param("Γ", x, y));
      }
      rates.add(row);
    }
    final EquationGenerator explicit =
        MeanField.builder(CAVITY_ATOM)
            .hamiltonian(
                ex.times(ex.param("Δ"),
                    ex.plus(sigma(one, 2, 2), sigma(two, 2, 2))))
            .dissipation(Dissipation.builder().addMatrix(jumps, rates).build())
            .order(2)
            .generator();

    final Parameters p =
        Parameters.builder()
            .put("Δ", 0.3)
            .put("Γ(1,1)", 1.0).put("Γ(1,2)", 0.4)
            .put("Γ(2,1)", 0.4).put("Γ(2,2)", 0.7)
            .build();
    final Num[] state = new Num[system.size()];
    for (int n = 0; n < state.length; n++) {
      state[n] = Num.of(0.1 * (n + 1), 0.03 * n);
    }
    final Num[] derivatives = system.derivatives(state, p);
    for (int n = 0; n < set2.size(); n++) {
      final Equation equation = explicit.derive(set2.lhs().get(n));
      final Expr rhs =
          Averages.replace(equation.rhs,
              average -> Filters.phaseInvariant().test(average)
                  ? average : null);
      final Num expected = system.evaluate(rhs, state, p);
      assertThat(derivatives[n].re, closeTo(expected.re, 1e-9));
      assertThat(derivatives[n].im, closeTo(expected.im, 1e-9));
    }
  }

  /** Solutions of the instantiated system keep ⟨σ22⟩ real. */
  @Test
  void testPopulationIsReal() {
    final EquationSet set3 =
        Instantiator.instantiate(tavisCummingsSet(),
            ImmutableMap.of("N", 3));
    final NumericSystem system = NumericSystem.of(set3);
    final Num[] state = new Num[system.size()];
    for (int n = 0; n < state.length; n++) {
      final Factor.Average lhs = set3.lhs().get(n);
      state[n] = Averages.isHermitian(lhs)
          ? Num.of(0.1 * n)
          : Num.of(0.02 * n, -0.01 * n);
    }
    final Num[] derivatives = system.derivatives(state, parameters());
    for (int n = 0; n < state.length; n++) {
      if (Averages.isHermitian(set3.lhs().get(n))) {
        assertThat(derivatives[n].im, closeTo(0d, 1e-12));
      }
    }
  }
}

// End InstantiatorTest.java
