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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property.
 *
 * <p>Properties are held in a {@code Map<Prop, Object>}; a property that is
 * not in the map has its default value.
 *
 * @see net.hydromatic.cumulant.compile.EquationGenerator#props
 */
public enum Prop {
  /**
   * Integer property "maxIterations" is the maximum number of scans that
   * closure makes before it gives up and throws
   * {@link net.hydromatic.cumulant.compile.NonClosureException}.
   * Default is 100.
   */
  MAX_ITERATIONS("maxIterations", Integer.class, true, 100),

  /**
   * Integer property "order" is the order of the cumulant expansion, used
   * when a builder is not given an order explicitly. Default is 1 (mean
   * field).
   */
  ORDER("order", Integer.class, true, 1),

  /**
   * Integer property "parallelism" is the number of threads that closure
   * uses to derive the equations found by one scan. Default is 1, which
   * derives in the calling thread.
   */
  PARALLELISM("parallelism", Integer.class, true, 1),

  /**
   * Double property "spectrumEpsilon" is the real part ε of the Laplace
   * variable s = ε + iω at which a spectrum is evaluated. A small positive
   * value broadens the lines and regularizes a singular system. Default is
   * 0.
   */
  SPECTRUM_EPSILON("spectrumEpsilon", Double.class, true, 0D);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final Object defaultValue;

  /**
   * Map of all properties, keyed by both {@link #name()} and {@link
   * #camelName}.
   */
  public static final ImmutableMap<String, Prop> BY_NAME;

  /** List of all properties sorted by {@link #camelName}. */
  public static final List<Prop> BY_CAMEL_NAME;

  static {
    final List<Prop> list = Arrays.asList(values());
    final Ordering<Prop> ordering =
        Ordering.from(Comparator.comparing((Prop o) -> o.camelName));
    BY_CAMEL_NAME = ordering.sortedCopy(list);

    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : BY_CAMEL_NAME) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(validValue(type, defaultValue));
  }

  private static boolean validValue(Class<?> type, Object value) {
    if (type == Integer.class || type == Double.class) {
      return type.isInstance(value);
    }
    return false;
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(type == requestedType,
        "invalid type %s for property %s", type, camelName);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  /** Returns the value of a double property. */
  public double doubleValue(Map<Prop, Object> map) {
    checkType(Double.class);
    return (Double) get(map);
  }

  /**
   * Sets the value of a property, converting strings (such as "12" or
   * "0.001") and other numbers to the property's type.
   */
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String) {
      final String s = ((String) value).trim();
      try {
        if (type == Integer.class) {
          set(map, Integer.valueOf(s));
        } else {
          set(map, Double.valueOf(s));
        }
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("invalid value '" + s
            + "' for property " + camelName, e);
      }
      return;
    }
    if (value instanceof Number && !type.isInstance(value)) {
      final Number n = (Number) value;
      if (type == Integer.class) {
        set(map, n.intValue());
      } else {
        set(map, n.doubleValue());
      }
      return;
    }
    set(map, value);
  }

  /**
   * Sets the value of a property. Checks that its type is valid. Setting a
   * required property to null restores its default value.
   */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      checkArgument(required || defaultValue != null,
          "property %s has no default", camelName);
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException("value for property " + camelName
            + " must have type " + type.getSimpleName());
      }
      map.put(this, value);
    }
  }
}

// End Prop.java
