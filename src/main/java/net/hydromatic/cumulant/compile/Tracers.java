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

import java.util.function.Consumer;
import java.util.function.IntConsumer;
import net.hydromatic.cumulant.ast.Factor;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action on each derived
   * equation, then calls the underlying tracer.
   */
  public static Tracer withOnEquation(Tracer tracer,
      Consumer<Equation> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onEquation(Equation equation) {
        consumer.accept(equation);
        super.onEquation(equation);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each missing
   * average, then calls the underlying tracer.
   */
  public static Tracer withOnMissing(Tracer tracer,
      Consumer<Factor.Average> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onMissing(Factor.Average average) {
        consumer.accept(average);
        super.onMissing(average);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on each rejected
   * average, then calls the underlying tracer.
   */
  public static Tracer withOnReject(Tracer tracer,
      Consumer<Factor.Average> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onReject(Factor.Average average) {
        consumer.accept(average);
        super.onReject(average);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action on the number of
   * equations added by each closure scan, then calls the underlying tracer.
   */
  public static Tracer withOnPass(Tracer tracer, IntConsumer consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onPass(int pass, int added) {
        consumer.accept(added);
        super.onPass(pass, added);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onEquation(Equation equation) {}

    @Override
    public void onMissing(Factor.Average average) {}

    @Override
    public void onReject(Factor.Average average) {}

    @Override
    public void onPass(int pass, int added) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onEquation(Equation equation) {
      tracer.onEquation(equation);
    }

    @Override
    public void onMissing(Factor.Average average) {
      tracer.onMissing(average);
    }

    @Override
    public void onReject(Factor.Average average) {
      tracer.onReject(average);
    }

    @Override
    public void onPass(int pass, int added) {
      tracer.onPass(pass, added);
    }
  }
}

// End Tracers.java
