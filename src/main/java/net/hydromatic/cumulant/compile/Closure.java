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

import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Predicate;
import net.hydromatic.cumulant.algebra.Averages;
import net.hydromatic.cumulant.algebra.Filters;
import net.hydromatic.cumulant.ast.Factor;
import net.hydromatic.cumulant.eval.Prop;
import net.hydromatic.cumulant.space.Index;
import net.hydromatic.cumulant.util.Static;

/**
 * Completes an equation set: derives equations for the averages that occur
 * in right-hand sides until every average has an equation.
 *
 * <p>Averages are compared up to renaming of symbolic indices. An average
 * whose adjoint has an equation is covered by that equation (unless
 * {@link #identifyAdjoints} is false). An average that fails the filter is
 * rejected: it is zero, and is removed from every right-hand side.
 */
public class Closure {
  private final EquationGenerator generator;
  private final Predicate<Factor.Average> filter;
  /** Averages that are resolved elsewhere and need no equation. */
  private final Predicate<Factor.Average> external;
  private final boolean identifyAdjoints;

  public Closure(EquationGenerator generator,
      Predicate<Factor.Average> filter, Predicate<Factor.Average> external,
      boolean identifyAdjoints) {
    this.generator = requireNonNull(generator, "generator");
    this.filter = requireNonNull(filter, "filter");
    this.external = requireNonNull(external, "external");
    this.identifyAdjoints = identifyAdjoints;
  }

  /** Completes an equation set, accepting every average. */
  public static EquationSet complete(EquationSet set) {
    return complete(set, Filters.all());
  }

  /** Completes an equation set, rejecting averages that fail a filter. */
  public static EquationSet complete(EquationSet set,
      Predicate<Factor.Average> filter) {
    if (set.generator == null) {
      throw new IllegalArgumentException("equation set has no generator");
    }
    return new Closure(set.generator, filter, a -> false, true).close(set);
  }

  /**
   * Completes an equation set. Returns a new set whose first equations are
   * those of {@code set} (with rejected averages removed from their
   * right-hand sides).
   *
   * @throws InconsistentFilterException if the filter rejects a left-hand
   *   side, or rejects an average but accepts its adjoint
   * @throws NonClosureException if there are still missing averages after
   *   {@link Prop#MAX_ITERATIONS} scans
   */
  public EquationSet close(EquationSet set) {
    if (set.isScaled()) {
      throw new IllegalArgumentException("cannot complete a scaled set");
    }
    final Tracer tracer = generator.tracer;
    final int maxIterations = Prop.MAX_ITERATIONS.intValue(generator.props);
    final List<Equation> equations = new ArrayList<>(set.equations);
    final List<Factor.Average> rejected = new ArrayList<>(set.rejected);
    final Set<String> rejectedKeys = new HashSet<>();
    for (Factor.Average average : rejected) {
      rejectedKeys.add(Averages.alphaKey(average));
    }
    final Set<String> covered = new HashSet<>();
    for (Equation equation : equations) {
      if (!filter.test(equation.lhs)) {
        throw new InconsistentFilterException("filter rejects "
            + equation.lhs + ", which has an equation", equation.lhs);
      }
      cover(covered, equation.lhs);
    }
    final Namer namer = new Namer(set.lhs(), generator.reservedNames());

    for (int pass = 1;; pass++) {
      equations.replaceAll(e ->
          e.withRhs(
              Averages.replace(e.rhs,
                  a -> isRejected(rejectedKeys, a) ? null : a)));

      final Map<String, Factor.Average> missing = new LinkedHashMap<>();
      for (Equation equation : equations) {
        for (Factor.Average average : equation.rhs.averages()) {
          final String key = Averages.alphaKey(average);
          if (covered.contains(key) || missing.containsKey(key)) {
            continue;
          }
          if (identifyAdjoints
              && missing.containsKey(
                  Averages.alphaKey(Averages.adjoint(average)))) {
            continue;
          }
          if (external.test(average)) {
            continue;
          }
          missing.put(key, average);
        }
      }
      if (missing.isEmpty()) {
        return EquationSet.of(equations, set.generator, rejected, true,
            set.identicalAons);
      }
      if (pass >= maxIterations) {
        throw new NonClosureException("no closure after " + pass
            + " scans; missing " + missing.values(),
            ImmutableList.copyOf(missing.values()));
      }

      final List<Factor.Average> toDerive = new ArrayList<>();
      missing.forEach((key, average) -> {
        tracer.onMissing(average);
        if (filter.test(average)) {
          toDerive.add(namer.rename(average));
          cover(covered, average);
        } else {
          if (identifyAdjoints && filter.test(Averages.adjoint(average))) {
            throw new InconsistentFilterException("filter rejects "
                + average + " but accepts its adjoint", average);
          }
          rejected.add(average);
          rejectedKeys.add(key);
          tracer.onReject(average);
        }
      });
      final List<Equation> derived = derive(toDerive);
      equations.addAll(derived);
      tracer.onPass(pass, derived.size());
    }
  }

  private void cover(Set<String> covered, Factor.Average average) {
    covered.add(Averages.alphaKey(average));
    if (identifyAdjoints) {
      covered.add(Averages.alphaKey(Averages.adjoint(average)));
    }
  }

  private boolean isRejected(Set<String> rejectedKeys,
      Factor.Average average) {
    if (rejectedKeys.isEmpty()) {
      return false;
    }
    return rejectedKeys.contains(Averages.alphaKey(average))
        || identifyAdjoints
        && rejectedKeys.contains(
            Averages.alphaKey(Averages.adjoint(average)));
  }

  /** Derives equations, in parallel if {@link Prop#PARALLELISM} is more
   * than 1; the result is in the same order as the averages. */
  private List<Equation> derive(List<Factor.Average> averages) {
    final int parallelism = Prop.PARALLELISM.intValue(generator.props);
    if (parallelism <= 1 || averages.size() <= 1) {
      return Static.transformEager(averages, generator::derive);
    }
    final ExecutorService executor =
        Executors.newFixedThreadPool(Math.min(parallelism, averages.size()));
    try {
      final List<Future<Equation>> futures = new ArrayList<>();
      for (Factor.Average average : averages) {
        futures.add(executor.submit(() -> generator.derive(average)));
      }
      final List<Equation> list = new ArrayList<>();
      for (Future<Equation> future : futures) {
        list.add(future.get());
      }
      return list;
    } catch (ExecutionException e) {
      Throwables.throwIfUnchecked(e.getCause());
      throw new IllegalStateException(e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted while deriving", e);
    } finally {
      executor.shutdownNow();
    }
  }

  /**
   * Chooses names for the symbolic indices of a new target, so that they do
   * not clash with the names that the Hamiltonian and dissipation bind.
   *
   * <p>Prefers the names used by the seed targets on the same subspace,
   * then the letters "i" to "z", then primed names.
   */
  private static class Namer {
    private final Map<Integer, List<String>> seedNames =
        new LinkedHashMap<>();
    private final Set<String> reserved;

    Namer(List<Factor.Average> seeds, Set<String> reserved) {
      this.reserved = reserved;
      for (Factor.Average seed : seeds) {
        for (Index index : Averages.symbolicIndices(seed)) {
          final List<String> names =
              seedNames.computeIfAbsent(index.aon, k -> new ArrayList<>());
          if (!names.contains(index.name)) {
            names.add(index.name);
          }
        }
      }
    }

    Factor.Average rename(Factor.Average average) {
      final List<Index> indices = Averages.symbolicIndices(average);
      if (indices.isEmpty()) {
        return average;
      }
      final Set<String> used = new LinkedHashSet<>();
      final Map<Index, Index> map = new LinkedHashMap<>();
      for (Index index : indices) {
        final String name = pick(index.aon, used);
        used.add(name);
        map.put(index, index.withName(name));
      }
      return Averages.rename(average, map);
    }

    private String pick(int aon, Set<String> used) {
      for (String name : seedNames.getOrDefault(aon, ImmutableList.of())) {
        if (isFree(name, used)) {
          return name;
        }
      }
      for (char c = 'i'; c <= 'z'; c++) {
        final String name = String.valueOf(c);
        if (isFree(name, used)) {
          return name;
        }
      }
      for (String name = "i'";; name += "'") {
        if (isFree(name, used)) {
          return name;
        }
      }
    }

    private boolean isFree(String name, Set<String> used) {
      return !used.contains(name) && !reserved.contains(name);
    }
  }
}

// End Closure.java
