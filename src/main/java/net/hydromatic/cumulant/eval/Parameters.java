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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.cumulant.ast.Factor;
import net.hydromatic.cumulant.ast.Num;

/**
 * Numeric values of parameters.
 *
 * <p>A value is looked up by the printed form of the parameter (such as
 * "Γ(1,2)"), then by its name (such as "Γ"); so an indexed parameter can be
 * given a value for all subsystems at once.
 */
public class Parameters {
  public static final Parameters EMPTY = new Parameters(ImmutableMap.of());

  private final ImmutableMap<String, Num> values;

  private Parameters(ImmutableMap<String, Num> values) {
    this.values = requireNonNull(values, "values");
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns whether there is a value for a parameter. */
  public boolean contains(Factor.Parameter parameter) {
    return values.containsKey(parameter.toString())
        || values.containsKey(parameter.name);
  }

  /**
   * Returns the value of a parameter.
   *
   * @throws IllegalArgumentException if there is no value
   */
  public Num value(Factor.Parameter parameter) {
    Num value = values.get(parameter.toString());
    if (value == null) {
      value = values.get(parameter.name);
    }
    if (value == null) {
      throw new IllegalArgumentException("no value for parameter "
          + parameter);
    }
    return value;
  }

  @Override
  public String toString() {
    return values.toString();
  }

  /** Builder for {@link Parameters}. */
  public static class Builder {
    private final Map<String, Num> values = new LinkedHashMap<>();

    /** Sets the value of a parameter, such as "g" or "Γ(1,2)". */
    public Builder put(String name, Num value) {
      values.put(requireNonNull(name, "name"), requireNonNull(value, "value"));
      return this;
    }

    /** Sets the real value of a parameter. */
    public Builder put(String name, double value) {
      return put(name, Num.of(value));
    }

    public Parameters build() {
      return new Parameters(ImmutableMap.copyOf(values));
    }
  }
}

// End Parameters.java
