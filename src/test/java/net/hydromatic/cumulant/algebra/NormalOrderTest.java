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

import static net.hydromatic.cumulant.Systems.CAVITY_ATOM;
import static net.hydromatic.cumulant.Systems.a;
import static net.hydromatic.cumulant.Systems.ad;
import static net.hydromatic.cumulant.Systems.atom;
import static net.hydromatic.cumulant.Systems.sigma;
import static net.hydromatic.cumulant.ast.ExprBuilder.ex;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import net.hydromatic.cumulant.ast.Expr;
import net.hydromatic.cumulant.ast.Num;
import net.hydromatic.cumulant.compile.IndexBindingException;
import net.hydromatic.cumulant.compile.InvalidOperatorException;
import net.hydromatic.cumulant.eval.Instantiator;
import net.hydromatic.cumulant.space.HilbertSpace;
import net.hydromatic.cumulant.space.Index;
import net.hydromatic.cumulant.space.Subspace;
import org.junit.jupiter.api.Test;

/** Tests for {@link NormalOrder}. */
public class NormalOrderTest {
  @Test
  void testBosonCommutation() {
    assertThat(ex.times(a(), ad()), hasToString("1 + a†*a"));
    assertThat(ex.times(ad(), a()), hasToString("a†*a"));
    assertThat(ex.commutator(a(), ad()), hasToString("1"));
    assertThat(ex.times(a(), ad(), a()), hasToString("a + a†*a*a"));
  }

  @Test
  void testTransitions() {
    assertThat(ex.times(sigma(2, 1), sigma(1, 2)), hasToString("σ22"));
    assertThat(ex.times(sigma(1, 2), sigma(1, 2)), hasToString("0"));
    assertThat(ex.times(sigma(1, 2), sigma(2, 1)), hasToString("1 - σ22"));
    // The ground-state projector is eliminated.
    assertThat(sigma(1, 1), hasToString("1 - σ22"));
    assertThat(ex.commutator(sigma(2, 1), sigma(1, 2)),
        hasToString("-1 + 2*σ22"));
  }

  /** Operators on different subspaces commute, and are sorted by
   * subspace. */
  @Test
  void testDifferentSubspaces() {
    assertThat(ex.times(sigma(1, 2), ad()), hasToString("a†*σ12"));
    assertThat(ex.commutator(a(), sigma(2, 1)), hasToString("0"));
  }

  @Test
  void testAdjoint() {
    assertThat(ex.adjoint(ex.times(ad(), sigma(1, 2))),
        hasToString("a*σ21"));
    assertThat(ex.adjoint(ex.times(ex.num(Num.I), a())),
        hasToString("-i*a†"));
  }

  /** Free indices are distinct, so operators on them commute. */
  @Test
  void testFreeIndices() {
    final Index i = atom("i");
    final Index j = atom("j");
    assertThat(ex.times(sigma(j, 1, 2), sigma(i, 2, 1)),
        hasToString("σ21(i)*σ12(j)"));
    assertThat(ex.commutator(sigma(i, 2, 1), sigma(j, 1, 2)),
        hasToString("0"));
    assertThat(ex.times(sigma(i, 2, 1), sigma(i, 1, 2)),
        hasToString("σ22(i)"));
  }

  /** A free index names a subsystem other than those that concrete indices
   * name, so operators on a free index and on atom 1 commute. */
  @Test
  void testFreeAndConcreteIndices() {
    final Index one = atom("i").withValue(1);
    final Index j = atom("j");
    assertThat(ex.times(sigma(j, 1, 2), sigma(one, 2, 1)),
        hasToString("σ21(1)*σ12(j)"));
    assertThat(ex.commutator(sigma(one, 2, 1), sigma(j, 1, 2)),
        hasToString("0"));
    assertThat(ex.times(sigma(one, 2, 1), sigma(atom("k").withValue(1), 1, 2)),
        hasToString("σ22(1)"));
  }

  /** A sum over an index that may equal a free index is split. */
  @Test
  void testSplit() {
    final Index i = atom("i");
    final Index j = atom("j");
    final Expr sum = ex.sum(sigma(i, 2, 1), i);
    assertThat(sum, hasToString("Σ(i) σ21(i)"));
    assertThat(ex.times(sum, sigma(j, 1, 2)),
        hasToString("Σ(i≠j) σ21(i)*σ12(j) + σ22(j)"));
    assertThat(ex.commutator(sum, sigma(j, 1, 2)),
        hasToString("-1 + 2*σ22(j)"));
  }

  /** A sum over an index that no longer occurs becomes a multiplicity. */
  @Test
  void testMultiplicity() {
    final Index i = atom("i");
    final Index j = atom("j");
    assertThat(ex.sum(ex.param("g"), i), hasToString("N*g"));
    assertThat(ex.doubleSum(ex.num(1), i, j, true), hasToString("-N + N*N"));
    assertThat(ex.doubleSum(ex.num(1), i, j, false), hasToString("N*N"));

    final HilbertSpace h =
        HilbertSpace.of(new Subspace.NLevel("atom", 2));
    final Index k = Index.of(h, "k", 4, 0);
    assertThat(ex.sum(ex.param("g"), k), hasToString("4*g"));
  }

  /** A double sum with exclusion, materialized for N = 3, has N(N−1)
   * terms. */
  @Test
  void testDoubleSumMaterialized() {
    final Index i = atom("i");
    final Index j = atom("j");
    final Expr product = ex.times(sigma(i, 2, 1), sigma(j, 1, 2));
    final Expr excluded = ex.doubleSum(product, i, j, true);
    final Expr e3 =
        Instantiator.instantiate(excluded, ImmutableMap.of(),
            ImmutableMap.of("N", 3));
    assertThat(e3.terms, hasSize(6));
    assertThat(e3.toString().contains("σ22"), is(false));

    final Expr all = ex.doubleSum(product, i, j, false);
    final Expr all3 =
        Instantiator.instantiate(all, ImmutableMap.of(),
            ImmutableMap.of("N", 3));
    assertThat(all3.terms, hasSize(9));

    final Expr count =
        Instantiator.instantiate(ex.doubleSum(ex.num(1), i, j, true),
            ImmutableMap.of(), ImmutableMap.of("N", 5));
    assertThat(count, hasToString("20"));
  }

  @Test
  void testSumFailures() {
    final Index i = atom("i");
    final Expr sum = ex.sum(sigma(i, 2, 1), i);
    assertThrows(IndexBindingException.class, () -> ex.sum(sum, i));
    assertThrows(IndexBindingException.class,
        () -> ex.sum(sigma(i, 2, 1), i, i));
    assertThrows(IndexBindingException.class,
        () -> Index.of(CAVITY_ATOM, "i", "N", 7));
  }

  @Test
  void testInvalidOperators() {
    assertThrows(InvalidOperatorException.class, () -> sigma(1, 3));
    assertThrows(InvalidOperatorException.class,
        () -> ex.destroy(CAVITY_ATOM, "a", 1));
    assertThrows(InvalidOperatorException.class,
        () -> ex.transition(CAVITY_ATOM, "σ", 0, 1, 2));
    assertThrows(InvalidOperatorException.class,
        () -> ex.create(CAVITY_ATOM, "a", 2));
  }

  /** Canonicalization leaves canonical expressions unchanged. */
  @Test
  void testCanonicalizeIdempotent() {
    final Index i = atom("i");
    final Index j = atom("j");
    final Expr e =
        ex.plus(ex.times(a(), ad(), sigma(j, 1, 2)),
            ex.times(ex.sum(sigma(i, 2, 1), i), sigma(j, 2, 2)));
    assertThat(ex.canonicalize(e), is(e));
    assertThat(ex.canonicalize(ex.canonicalize(e)), is(e));
  }
}

// End NormalOrderTest.java
