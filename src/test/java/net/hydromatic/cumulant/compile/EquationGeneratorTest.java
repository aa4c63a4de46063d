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
package net.hydromatic.cumulant.compile;

import static net.hydromatic.cumulant.Systems.CAVITY_ATOM;
import static net.hydromatic.cumulant.Systems.a;
import static net.hydromatic.cumulant.Systems.ad;
import static net.hydromatic.cumulant.Systems.atom;
import static net.hydromatic.cumulant.Systems.jaynesCummings;
import static net.hydromatic.cumulant.Systems.parameters;
import static net.hydromatic.cumulant.Systems.sigma;
import static net.hydromatic.cumulant.Systems.tavisCummings;
import static net.hydromatic.cumulant.ast.ExprBuilder.ex;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.cumulant.ast.Num;
import net.hydromatic.cumulant.eval.NumericSystem;
import net.hydromatic.cumulant.eval.Parameters;
import net.hydromatic.cumulant.eval.Prop;
import net.hydromatic.cumulant.space.Index;
import org.junit.jupiter.api.Test;

/** Tests for {@link EquationGenerator}, {@link Dissipation} and
 * {@link MeanField}. */
public class EquationGeneratorTest {
  /** A cavity coupled to one atom, at order 1, seeded with the field
   * amplitude. */
  @Test
  void testJaynesCummings() {
    final EquationSet set = jaynesCummings().complete(ex.average(a()));
    assertThat(set.closed, is(true));
    assertThat(set.lhs(), hasToString("[⟨a⟩, ⟨σ12⟩, ⟨σ22⟩]"));
    assertThat(set.equations.get(0).rhs,
        hasToString("-i*g*⟨σ12⟩ - i*Δ*⟨a⟩ - 0.5*κ*⟨a⟩"));
    assertThat(set.equations.get(1).rhs,
        hasToString("-i*g*⟨a⟩ + 2i*g*⟨a⟩*⟨σ22⟩ - 0.5*Γ*⟨σ12⟩"));
    assertThat(set.equations.get(2).rhs,
        hasToString("i*g*⟨a†⟩*⟨σ12⟩ - i*g*⟨a⟩*⟨σ21⟩ - Γ*⟨σ22⟩"));
    assertThat(set.equations.get(0),
        hasToString("d/dt ⟨a⟩ = -i*g*⟨σ12⟩ - i*Δ*⟨a⟩ - 0.5*κ*⟨a⟩"));
    assertThat(set.rejected.isEmpty(), is(true));
  }

  /** Evaluates the equations of {@link #testJaynesCummings()} and compares
   * with the equations written by hand. */
  @Test
  void testJaynesCummingsNumeric() {
    final EquationSet set = jaynesCummings().complete(ex.average(a()));
    final NumericSystem system = NumericSystem.of(set);
    final Parameters p = parameters();
    final Num alpha = Num.of(0.2, 0.1);
    final Num s = Num.of(-0.3, 0.4);
    final Num pe = Num.of(0.25);
    final Num[] d = system.derivatives(new Num[] {alpha, s, pe}, p);

    final Num delta = Num.of(0.3);
    final Num g = Num.of(0.7);
    final Num kappa = Num.of(1.1);
    final Num gamma = Num.of(0.4);
    final Num minusI = Num.MINUS_I;
    final Num i = Num.I;

    // d⟨a⟩ = −iΔα − ig s − κ/2 α
    final Num da =
        minusI.times(delta).times(alpha)
            .plus(minusI.times(g).times(s))
            .minus(kappa.times(Num.HALF).times(alpha));
    // d⟨σ12⟩ = 2ig α p − ig α − Γ/2 s
    final Num ds =
        i.times(g).times(alpha).times(pe).times(2d)
            .minus(i.times(g).times(alpha))
            .minus(gamma.times(Num.HALF).times(s));
    // d⟨σ22⟩ = ig α* s − ig α s* − Γ p
    final Num dp =
        i.times(g).times(alpha.conj()).times(s)
            .minus(i.times(g).times(alpha).times(s.conj()))
            .minus(gamma.times(pe));
    assertClose(d[0], da);
    assertClose(d[1], ds);
    assertClose(d[2], dp);
    // Population is real, so its derivative is real.
    assertThat(d[2].im, closeTo(0d, 1e-12));
  }

  static void assertClose(Num actual, Num expected) {
    assertThat(actual.re, closeTo(expected.re, 1e-12));
    assertThat(actual.im, closeTo(expected.im, 1e-12));
  }

  @Test
  void testDerive() {
    final EquationGenerator generator = tavisCummings(1).generator();
    assertThat(generator.reservedNames(), hasToString("[i]"));
    final Index j = atom("j");
    final Equation equation =
        generator.derive(ex.average(sigma(j, 2, 2)));
    assertThat(equation.lhs, hasToString("⟨σ22(j)⟩"));
    assertThat(equation.rhs.averages(),
        hasToString("[⟨a†⟩, ⟨σ12(j)⟩, ⟨a⟩, ⟨σ21(j)⟩, ⟨σ22(j)⟩]"));
  }

  /** The free index of a target must not be one that the Hamiltonian
   * binds. */
  @Test
  void testReservedIndex() {
    final Index i = atom("i");
    final IndexBindingException e =
        assertThrows(IndexBindingException.class,
            () -> tavisCummings(1).derive(ex.average(sigma(i, 2, 2))));
    assertThat(e.subject(), hasToString("⟨σ22(i)⟩"));
  }

  @Test
  void testBadTargets() {
    final Index j = atom("j");
    final MeanField.Builder builder = jaynesCummings();
    assertThrows(IndexBindingException.class,
        () -> builder.derive(ex.times(2, ex.average(a()))));
    assertThrows(IndexBindingException.class,
        () -> builder.derive(ex.plus(ex.average(a()), ex.average(ad()))));
    assertThrows(IndexBindingException.class,
        () -> builder.derive(ex.sum(ex.average(sigma(j, 2, 2)), j)));
    assertThrows(IndexBindingException.class,
        () -> builder.derive(ex.param("g")));
  }

  @Test
  void testFreeIndexInHamiltonian() {
    final MeanField.Builder builder =
        MeanField.builder(CAVITY_ATOM)
            .hamiltonian(ex.times(ex.param("Δ"), sigma(atom("i"), 2, 2)));
    assertThrows(IndexBindingException.class, builder::generator);
  }

  @Test
  void testDissipationRates() {
    final Index i = atom("i");
    final Index j = atom("j");
    final Index k = atom("k");
    assertThrows(IndexBindingException.class,
        () -> Dissipation.builder().add(sigma(i, 1, 2), ex.param("Γ", j, k)));
    assertThrows(IllegalArgumentException.class,
        () -> Dissipation.builder().add(a(), ad()));

    // A rate matrix over two indices makes a collective channel.
    final Dissipation collective =
        Dissipation.builder().add(sigma(i, 1, 2), ex.param("Γ", i, j))
            .build();
    assertThat(collective.channels.size(), is(1));
    assertThat(collective.channels.get(0),
        hasToString("Σ(i) Σ(j) (σ12(i), σ12(j), Γ(i,j))"));
    assertThat(collective.indexNames(), hasToString("[i, j]"));
  }

  @Test
  void testOrder() {
    assertThrows(IllegalArgumentException.class,
        () -> jaynesCummings().order(0).generator());
    final EquationGenerator generator = jaynesCummings().generator();
    assertThat(generator.order, is(1));
    assertThat(generator.withOrder(1), sameInstance(generator));
    assertThat(generator.withOrder(3).order, is(3));

    // Without an explicit order, the builder uses the "order" property.
    final EquationGenerator generator2 =
        MeanField.builder(CAVITY_ATOM)
            .hamiltonian(ex.times(ex.param("Δ"), ad(), a()))
            .prop(Prop.ORDER, "2")
            .generator();
    assertThat(generator2.order, is(2));
  }

  /** The Hamiltonian may be zero; only dissipation drives the system. */
  @Test
  void testPureDecay() {
    final EquationSet set =
        MeanField.builder(CAVITY_ATOM)
            .dissipation(Dissipation.builder().add(a(), ex.param("κ")).build())
            .order(2)
            .complete(ex.average(ex.times(ad(), a())));
    assertThat(set.lhs(), hasToString("[⟨a†*a⟩]"));
    assertThat(set.equations.get(0).rhs, hasToString("-κ*⟨a†*a⟩"));
  }
}

// End EquationGeneratorTest.java
