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

import static net.hydromatic.cumulant.Systems.ATOM;
import static net.hydromatic.cumulant.Systems.a;
import static net.hydromatic.cumulant.Systems.ad;
import static net.hydromatic.cumulant.Systems.atom;
import static net.hydromatic.cumulant.Systems.sigma;
import static net.hydromatic.cumulant.ast.ExprBuilder.ex;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import net.hydromatic.cumulant.ast.Expr;
import net.hydromatic.cumulant.ast.Factor;
import net.hydromatic.cumulant.ast.Num;
import net.hydromatic.cumulant.space.Index;
import org.junit.jupiter.api.Test;

/** Tests for {@link Averages} and {@link Filters}. */
public class AveragesTest {
  @Test
  void testAdjoint() {
    final Index i = atom("i");
    final Factor.Average average = ex.averageOf(ex.times(a(), sigma(i, 2, 1)));
    assertThat(average, hasToString("⟨a*σ21(i)⟩"));
    assertThat(Averages.adjoint(average), hasToString("⟨a†*σ12(i)⟩"));
    assertThat(Averages.adjoint(Averages.adjoint(average)), is(average));
    assertThat(Averages.isHermitian(average), is(false));
    assertThat(Averages.isHermitian(ex.averageOf(ex.times(ad(), a()))),
        is(true));
  }

  @Test
  void testAlphaKey() {
    final Index i = atom("i");
    final Index j = atom("j");
    final Index k = atom("k");
    final Factor.Average a1 =
        ex.averageOf(ex.times(sigma(i, 1, 2), sigma(j, 2, 1)));
    final Factor.Average a2 =
        ex.averageOf(ex.times(sigma(i, 2, 1), sigma(j, 1, 2)));
    final Factor.Average a3 =
        ex.averageOf(ex.times(sigma(k, 1, 2), sigma(j, 2, 1)));
    assertThat(a1, hasToString("⟨σ12(i)*σ21(j)⟩"));
    assertThat(a2, hasToString("⟨σ21(i)*σ12(j)⟩"));
    assertThat(Averages.alphaKey(a1), is(Averages.alphaKey(a2)));
    assertThat(Averages.alphaKey(a1), is(Averages.alphaKey(a3)));
    assertThat(Averages.alphaKey(a1).equals(
            Averages.alphaKey(ex.averageOf(sigma(i, 2, 2)))),
        is(false));
  }

  @Test
  void testRepresentative() {
    final Index i = atom("i");
    final Index j = atom("j");
    final Factor.Average a1 =
        ex.averageOf(ex.times(sigma(i, 1, 2), sigma(j, 2, 1)));
    final Factor.Average a2 =
        ex.averageOf(ex.times(sigma(i, 2, 1), sigma(j, 1, 2)));
    assertThat(Averages.representative(a1, ImmutableSet.of(ATOM)),
        hasToString("⟨σ12(1)*σ21(2)⟩"));
    assertThat(Averages.representative(a2, ImmutableSet.of(ATOM)),
        hasToString("⟨σ12(1)*σ21(2)⟩"));

    // Concrete indices are also mapped onto 1, 2, ...
    final Factor.Average a3 =
        ex.averageOf(sigma(atom("i").withValue(3), 2, 2));
    assertThat(a3, hasToString("⟨σ22(3)⟩"));
    assertThat(Averages.representative(a3, ImmutableSet.of(ATOM)),
        hasToString("⟨σ22(1)⟩"));

    // Indices on other subspaces are left alone.
    assertThat(Averages.representative(a1, ImmutableSet.of()), is(a1));
  }

  @Test
  void testRename() {
    final Index i = atom("i");
    final Index j = atom("j");
    final Factor.Average average =
        ex.averageOf(ex.times(ad(), sigma(j, 1, 2)));
    assertThat(Averages.rename(average, ImmutableMap.of(j, i)),
        hasToString("⟨a†*σ12(i)⟩"));
    assertThat(Averages.rename(average, ImmutableMap.of(j, j.withValue(2))),
        hasToString("⟨a†*σ12(2)⟩"));
    assertThat(Averages.symbolicIndices(average), hasToString("[j]"));
  }

  @Test
  void testConjugateAndReplace() {
    final Expr e =
        ex.times(ex.num(Num.I), ex.param("g"), ex.average(a()));
    assertThat(e, hasToString("i*g*⟨a⟩"));
    assertThat(Averages.conjugate(e), hasToString("-i*g*⟨a†⟩"));

    final Expr f =
        ex.plus(e, ex.times(ex.param("κ"), ex.average(sigma(1, 2))));
    assertThat(Averages.replace(f, avg -> avg.order() == 1
            && avg.product.ops.get(0).aon == 0 ? null : avg),
        hasToString("κ*⟨σ12⟩"));
  }

  @Test
  void testPhase() {
    final Index i = atom("i");
    assertThat(Filters.phase(ex.averageOf(a())), is(-1));
    assertThat(Filters.phase(ex.averageOf(sigma(2, 1))), is(1));
    assertThat(Filters.phase(ex.averageOf(ex.times(ad(), sigma(1, 2)))),
        is(0));
    assertThat(
        Filters.phaseInvariant().test(
            ex.averageOf(ex.times(sigma(i, 1, 2), ad(), ad()))),
        is(false));
    assertThat(
        Filters.phaseInvariant().test(ex.averageOf(ex.times(ad(), a()))),
        is(true));
    assertThat(Filters.maxOrder(1).test(ex.averageOf(ex.times(ad(), a()))),
        is(false));
    assertThat(
        Filters.phaseInvariant().and(Filters.maxOrder(1))
            .test(ex.averageOf(sigma(2, 2))),
        is(true));
  }
}

// End AveragesTest.java
