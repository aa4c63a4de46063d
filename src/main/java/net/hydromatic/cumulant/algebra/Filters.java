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

import java.util.function.Predicate;
import net.hydromatic.cumulant.ast.Factor;
import net.hydromatic.cumulant.ast.Operator;

/**
 * Predicates that decide which averages an equation system keeps.
 *
 * <p>An average that fails the predicate is taken to be zero. Combine
 * predicates with {@link Predicate#and}, {@link Predicate#or} and
 * {@link Predicate#negate}.
 */
public abstract class Filters {
  private Filters() {}

  /** Returns a filter that accepts every average. */
  public static Predicate<Factor.Average> all() {
    return average -> true;
  }

  /**
   * Returns a filter that accepts averages that are invariant under a global
   * phase rotation, such as {@code ⟨a†*a⟩} and {@code ⟨a†*σ12⟩}, and rejects
   * {@code ⟨a⟩} and {@code ⟨σ21⟩}.
   *
   * <p>Each creation operator counts +1, each annihilation operator −1, and
   * each transition {@code σ(k,l)} counts {@code k − l}; the average is
   * accepted if the total is zero.
   */
  public static Predicate<Factor.Average> phaseInvariant() {
    return average -> phase(average) == 0;
  }

  /** Returns a filter that accepts averages of at most {@code order}
   * operators. */
  public static Predicate<Factor.Average> maxOrder(int order) {
    return average -> average.order() <= order;
  }

  /** Returns the phase of an average; see {@link #phaseInvariant()}. */
  public static int phase(Factor.Average average) {
    int phase = 0;
    for (Operator.Elementary op : average.product.ops) {
      switch (op.op) {
      case CREATE:
        ++phase;
        break;
      case DESTROY:
        --phase;
        break;
      case TRANSITION:
        final Operator.Transition t = (Operator.Transition) op;
        phase += t.k - t.l;
        break;
      default:
        throw new AssertionError(op.op);
      }
    }
    return phase;
  }
}

// End Filters.java
