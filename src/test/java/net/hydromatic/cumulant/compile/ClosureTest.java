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

import static net.hydromatic.cumulant.Systems.CAVITY;
import static net.hydromatic.cumulant.Systems.a;
import static net.hydromatic.cumulant.Systems.ad;
import static net.hydromatic.cumulant.Systems.atom;
import static net.hydromatic.cumulant.Systems.jaynesCummings;
import static net.hydromatic.cumulant.Systems.sigma;
import static net.hydromatic.cumulant.Systems.tavisCummings;
import static net.hydromatic.cumulant.ast.ExprBuilder.ex;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.cumulant.ast.Factor;
import net.hydromatic.cumulant.eval.Prop;
import net.hydromatic.cumulant.space.Index;
import org.junit.jupiter.api.Test;

/** Tests for {@link Closure}. */
public class ClosureTest {
  /** Completing a closed set changes nothing. */
  @Test
  void testFixedPoint() {
    final EquationSet set = jaynesCummings().complete(ex.average(a()));
    final EquationSet set2 = Closure.complete(set);
    assertThat(set2.closed, is(true));
    assertThat(set2.equations, is(set.equations));

    final EquationSet set3 =
        tavisCummings(2).complete(ex.average(ex.times(ad(), a())));
    assertThat(Closure.complete(set3).equations, is(set3.equations));
  }

  /** Closure keeps the seed equations first, in order. */
  @Test
  void testSeedsFirst() {
    final EquationSet set =
        jaynesCummings().complete(ex.average(sigma(2, 2)), ex.average(a()));
    assertThat(set.lhs(), hasToString("[⟨σ22⟩, ⟨a⟩, ⟨σ12⟩]"));

    // A duplicate seed is ignored.
    final EquationSet set2 =
        jaynesCummings().complete(ex.average(a()), ex.average(a()));
    assertThat(set2.lhs(), hasToString("[⟨a⟩, ⟨σ12⟩, ⟨σ22⟩]"));
  }

  /** New targets are named after the seed's indices, avoiding the indices
   * that the Hamiltonian binds. */
  @Test
  void testNames() {
    final Index j = atom("j");
    final EquationSet set =
        tavisCummings(2).complete(ex.average(ex.times(ad(), a())),
            ex.average(sigma(j, 2, 2)));
    assertThat(set.lhs(),
        hasToString("[⟨a†*a⟩, ⟨σ22(j)⟩, ⟨a*σ21(j)⟩, ⟨σ12(j)*σ21(k)⟩]"));
    for (Equation equation : set.equations) {
      for (Factor.Average average : equation.rhs.averages()) {
        assertThat(average.order() <= 2, is(true));
      }
    }
  }

  /** At order 1, the phase filter removes every cross term. */
  @Test
  void testPhaseFilter() {
    final Index j = atom("j");
    final List<Factor.Average> rejected = new ArrayList<>();
    final EquationSet set =
        tavisCummings(1)
            .tracer(Tracers.withOnReject(Tracers.empty(), rejected::add))
            .complete(ex.average(sigma(j, 2, 2)));
    assertThat(set.lhs(), hasToString("[⟨σ22(j)⟩]"));
    assertThat(set.equations.get(0).rhs, hasToString("-Γ*⟨σ22(j)⟩"));
    assertThat(set.rejected, hasToString("[⟨a†⟩, ⟨σ12(j)⟩]"));
    assertThat(set.rejected, is(rejected));
  }

  /** A rejected average is zero. */
  @Test
  void testReject() {
    final EquationSet set =
        jaynesCummings()
            .filter(average -> average.product.ops.get(0).aon == CAVITY)
            .complete(ex.average(a()));
    assertThat(set.lhs(), hasToString("[⟨a⟩]"));
    assertThat(set.equations.get(0).rhs,
        hasToString("-i*Δ*⟨a⟩ - 0.5*κ*⟨a⟩"));
    assertThat(set.rejected, hasToString("[⟨σ12⟩]"));
  }

  @Test
  void testInconsistentFilter() {
    // The filter rejects a seed.
    final InconsistentFilterException e =
        assertThrows(InconsistentFilterException.class,
            () -> tavisCummings(1).complete(ex.average(a())));
    assertThat(e.subject(), hasToString("⟨a⟩"));

    // The filter rejects ⟨σ12⟩ but accepts its adjoint.
    final InconsistentFilterException e2 =
        assertThrows(InconsistentFilterException.class,
            () -> jaynesCummings()
                .filter(average -> !average.toString().equals("⟨σ12⟩"))
                .complete(ex.average(a())));
    assertThat(e2.subject(), hasToString("⟨σ12⟩"));
  }

  @Test
  void testMaxIterations() {
    final NonClosureException e =
        assertThrows(NonClosureException.class,
            () -> jaynesCummings().prop(Prop.MAX_ITERATIONS, 1)
                .complete(ex.average(a())));
    assertThat(e.subject(), hasToString("[⟨σ12⟩]"));

    // Two scans find ⟨σ12⟩ and ⟨σ22⟩; the third finds nothing.
    final EquationSet set =
        jaynesCummings().prop(Prop.MAX_ITERATIONS, "3")
            .complete(ex.average(a()));
    assertThat(set.size(), is(3));
  }

  @Test
  void testTracer() {
    final List<Equation> equations = new ArrayList<>();
    final List<Factor.Average> missing = new ArrayList<>();
    final List<Integer> passes = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnEquation(tracer, equations::add);
    tracer = Tracers.withOnMissing(tracer, missing::add);
    tracer = Tracers.withOnPass(tracer, passes::add);
    final EquationSet set =
        jaynesCummings().tracer(tracer).complete(ex.average(a()));
    assertThat(set.equations, is(equations));
    assertThat(missing, hasToString("[⟨σ12⟩, ⟨σ22⟩]"));
    assertThat(passes, hasToString("[1, 1]"));
  }

  /** Deriving in parallel gives the same equations, in the same order. */
  @Test
  void testParallel() {
    final Index j = atom("j");
    final EquationSet serial =
        tavisCummings(2).complete(ex.average(ex.times(ad(), a())),
            ex.average(sigma(j, 2, 2)));
    final EquationSet parallel =
        tavisCummings(2).prop(Prop.PARALLELISM, 4)
            .complete(ex.average(ex.times(ad(), a())),
                ex.average(sigma(j, 2, 2)));
    assertThat(parallel.equations, is(serial.equations));
    assertThat(parallel.equations, hasSize(4));
  }

  @Test
  void testIllegal() {
    final EquationSet set = jaynesCummings().complete(ex.average(a()));
    final EquationSet orphan = EquationSet.of(set.equations, null);
    assertThrows(IllegalArgumentException.class,
        () -> Closure.complete(orphan));
  }
}

// End ClosureTest.java
