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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.cumulant.algebra.NormalOrder;
import net.hydromatic.cumulant.ast.Expr;
import net.hydromatic.cumulant.ast.Num;
import net.hydromatic.cumulant.ast.Term;
import net.hydromatic.cumulant.space.Index;

/**
 * Lindblad dissipation: a list of channels, each a pair of jump operators
 * with a rate.
 *
 * <p>A channel (J<sub>k</sub>, J<sub>l</sub>, R) contributes
 *
 * <blockquote>R (J<sub>k</sub>† O J<sub>l</sub>
 * − ½ J<sub>k</sub>† J<sub>l</sub> O − ½ O J<sub>k</sub>† J<sub>l</sub>)
 * </blockquote>
 *
 * <p>to the time derivative of an operator O, summed over the channel's
 * binders.
 */
public class Dissipation {
  public static final Dissipation NONE = new Dissipation(ImmutableList.of());

  public final ImmutableList<Channel> channels;

  private Dissipation(ImmutableList<Channel> channels) {
    this.channels = requireNonNull(channels);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns the symbolic index names that the channels use. */
  public Set<String> indexNames() {
    final Set<String> names = new LinkedHashSet<>();
    for (Channel channel : channels) {
      for (Index binder : channel.binders) {
        names.add(binder.name);
      }
      for (Expr expr : ImmutableList.of(channel.left, channel.right,
          channel.rate)) {
        for (Term term : expr.terms) {
          for (Index index : term.allIndices()) {
            if (!index.isConcrete()) {
              names.add(index.name);
            }
          }
        }
      }
    }
    return names;
  }

  /** Returns the indices that occur in channels, keyed by name. */
  ImmutableMap<String, Index> indices() {
    final ImmutableMap.Builder<String, Index> b = ImmutableMap.builder();
    final Set<String> names = new LinkedHashSet<>();
    for (Channel channel : channels) {
      for (Expr expr : ImmutableList.of(channel.left, channel.right,
          channel.rate)) {
        for (Term term : expr.terms) {
          for (Index index : term.allIndices()) {
            if (!index.isConcrete() && names.add(index.name)) {
              b.put(index.name, index);
            }
          }
        }
      }
    }
    return b.build();
  }

  /** Returns the free symbolic indices of an expression. */
  static List<Index> freeIndices(Expr expr) {
    final Set<Index> set = new LinkedHashSet<>();
    for (Term term : expr.terms) {
      set.addAll(term.freeIndices());
    }
    return ImmutableList.copyOf(set);
  }

  /**
   * Returns the contribution of this dissipation to the time derivative of
   * an operator.
   */
  Expr apply(Expr o) {
    Expr result = Expr.ZERO;
    for (Channel channel : channels) {
      result = result.plus(channel.apply(o));
    }
    return result;
  }

  /** Dissipation channel. */
  public static class Channel {
    /** Jump operator J<sub>k</sub>, which appears as its adjoint. */
    public final Expr left;
    /** Jump operator J<sub>l</sub>. */
    public final Expr right;
    /** Rate, a scalar expression. */
    public final Expr rate;
    /** Indices summed over. */
    public final ImmutableList<Index> binders;

    Channel(Expr left, Expr right, Expr rate, List<Index> binders) {
      this.left = requireNonNull(left, "left");
      this.right = requireNonNull(right, "right");
      this.rate = requireNonNull(rate, "rate");
      this.binders = ImmutableList.copyOf(binders);
    }

    Expr apply(Expr o) {
      final Expr leftAdjoint = NormalOrder.adjoint(left);
      final Expr sandwich =
          NormalOrder.multiply(ImmutableList.of(rate, leftAdjoint, o, right),
              binders, ImmutableSet.of());
      final Expr before =
          NormalOrder.multiply(ImmutableList.of(rate, leftAdjoint, right, o),
              binders, ImmutableSet.of());
      final Expr after =
          NormalOrder.multiply(ImmutableList.of(rate, o, leftAdjoint, right),
              binders, ImmutableSet.of());
      return sandwich.minus(before.plus(after).times(Num.HALF));
    }

    @Override
    public String toString() {
      final StringBuilder b = new StringBuilder();
      for (Index binder : binders) {
        b.append("Σ(").append(binder).append(") ");
      }
      return b.append('(').append(left).append(", ").append(right)
          .append(", ").append(rate).append(')').toString();
    }
  }

  /** Builder for {@link Dissipation}. */
  public static class Builder {
    private final List<Channel> channels = new ArrayList<>();

    /**
     * Adds a jump operator with a rate.
     *
     * <p>If the jump operator has a free index {@code i}, each subsystem
     * decays independently: the channel is summed over {@code i}, and the
     * rate may depend on {@code i}. If the rate has a second free index
     * {@code j}, such as {@code Γ(i,j)}, the rate is a matrix and the channel
     * is collective: J<sub>i</sub>† … J<sub>j</sub>, summed over both
     * indices.
     */
    public Builder add(Expr jump, Expr rate) {
      checkRate(rate);
      final List<Index> jumpIndices = freeIndices(jump);
      final List<Index> rateIndices = new ArrayList<>(freeIndices(rate));
      rateIndices.removeAll(jumpIndices);
      if (rateIndices.isEmpty()) {
        channels.add(new Channel(jump, jump, rate, jumpIndices));
        return this;
      }
      if (rateIndices.size() == 1 && jumpIndices.size() == 1) {
        final Index i = jumpIndices.get(0);
        final Index j = rateIndices.get(0);
        if (i.sameRange(j)) {
          final List<Term> terms = new ArrayList<>();
          for (Term term : jump.terms) {
            terms.addAll(NormalOrder.substitute(term, ImmutableMap.of(i, j)));
          }
          channels.add(
              new Channel(jump, Expr.of(terms), rate, ImmutableList.of(i, j)));
          return this;
        }
      }
      throw new IndexBindingException("rate " + rate
          + " has indices " + rateIndices + " that do not match jump "
          + jump, rate);
    }

    /**
     * Adds a list of jump operators with a rate matrix: for each pair
     * (k, l) whose rate is not zero, a channel
     * (J<sub>k</sub>, J<sub>l</sub>, R<sub>kl</sub>).
     */
    public Builder addMatrix(List<Expr> jumps, List<List<Expr>> rates) {
      if (rates.size() != jumps.size()) {
        throw new IllegalArgumentException("rate matrix has " + rates.size()
            + " rows; expected " + jumps.size());
      }
      for (int k = 0; k < jumps.size(); k++) {
        final List<Expr> row = rates.get(k);
        if (row.size() != jumps.size()) {
          throw new IllegalArgumentException("row " + k + " of rate matrix has "
              + row.size() + " columns; expected " + jumps.size());
        }
        for (int l = 0; l < jumps.size(); l++) {
          final Expr rate = row.get(l);
          if (rate.isZero()) {
            continue;
          }
          checkRate(rate);
          final Set<Index> binders = new LinkedHashSet<>();
          binders.addAll(freeIndices(jumps.get(k)));
          binders.addAll(freeIndices(jumps.get(l)));
          binders.addAll(freeIndices(rate));
          channels.add(
              new Channel(jumps.get(k), jumps.get(l), rate,
                  ImmutableList.copyOf(binders)));
        }
      }
      return this;
    }

    private static void checkRate(Expr rate) {
      if (!rate.isScalar()) {
        throw new IllegalArgumentException("rate must be scalar: " + rate);
      }
    }

    public Dissipation build() {
      return new Dissipation(ImmutableList.copyOf(channels));
    }
  }
}

// End Dissipation.java
