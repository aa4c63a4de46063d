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
import java.util.HashMap;
import java.util.Map;
import java.util.function.Predicate;
import net.hydromatic.cumulant.algebra.Filters;
import net.hydromatic.cumulant.ast.Expr;
import net.hydromatic.cumulant.ast.Factor;
import net.hydromatic.cumulant.eval.Prop;
import net.hydromatic.cumulant.space.HilbertSpace;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Entry point for deriving mean-field equations.
 *
 * <p>For example,
 *
 * <blockquote><pre>
 * EquationSet set =
 *     MeanField.builder(h)
 *         .hamiltonian(hamiltonian)
 *         .dissipation(dissipation)
 *         .order(2)
 *         .filter(Filters.phaseInvariant())
 *         .complete(ex.average(n));
 * </pre></blockquote>
 */
public abstract class MeanField {
  private MeanField() {}

  /** Creates a builder for systems on a given Hilbert space. */
  public static Builder builder(HilbertSpace space) {
    return new Builder(space);
  }

  /** Builder for equation systems. */
  public static class Builder {
    private final HilbertSpace space;
    private Expr hamiltonian = Expr.ZERO;
    private Dissipation dissipation = Dissipation.NONE;
    private @Nullable Integer order;
    private Predicate<Factor.Average> filter = Filters.all();
    private final Map<Prop, Object> props = new HashMap<>();
    private Tracer tracer = Tracers.empty();

    Builder(HilbertSpace space) {
      this.space = requireNonNull(space, "space");
    }

    public Builder hamiltonian(Expr hamiltonian) {
      this.hamiltonian = requireNonNull(hamiltonian, "hamiltonian");
      return this;
    }

    public Builder dissipation(Dissipation dissipation) {
      this.dissipation = requireNonNull(dissipation, "dissipation");
      return this;
    }

    /** Sets the order of the cumulant expansion. If not set, the order is
     * the value of {@link Prop#ORDER}. */
    public Builder order(int order) {
      this.order = order;
      return this;
    }

    public Builder filter(Predicate<Factor.Average> filter) {
      this.filter = requireNonNull(filter, "filter");
      return this;
    }

    /** Sets a property; strings are converted to the property's type. */
    public Builder prop(Prop prop, Object value) {
      prop.setLenient(props, value);
      return this;
    }

    public Builder tracer(Tracer tracer) {
      this.tracer = requireNonNull(tracer, "tracer");
      return this;
    }

    /** Creates the equation generator. */
    public EquationGenerator generator() {
      final int order =
          this.order != null ? this.order : Prop.ORDER.intValue(props);
      return EquationGenerator.create(space, hamiltonian, dissipation, order,
          props, tracer);
    }

    /** Derives equations for the given targets, without closure. */
    public EquationSet derive(Expr... targets) {
      return generator().deriveAll(ImmutableList.copyOf(targets));
    }

    /** Derives equations for the given targets, and completes the set. */
    public EquationSet complete(Expr... targets) {
      final EquationSet set = derive(targets);
      return new Closure(requireNonNull(set.generator), filter, a -> false,
          true).close(set);
    }
  }
}

// End MeanField.java
