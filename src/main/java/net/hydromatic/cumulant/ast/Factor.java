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
package net.hydromatic.cumulant.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import net.hydromatic.cumulant.space.Index;

/**
 * Scalar factor of a term: a {@link Parameter} or an {@link Average}.
 *
 * <p>Factors are sorted within a term: parameters before averages, and then
 * by their printed form.
 */
public abstract class Factor implements Comparable<Factor> {
  public final Op op;

  Factor(Op op) {
    this.op = requireNonNull(op, "op");
  }

  /** Returns the distinct indices of this factor, in order of appearance. */
  public abstract Set<Index> indices();

  @Override
  public int compareTo(Factor o) {
    if (op != o.op) {
      return op.compareTo(o.op);
    }
    return toString().compareTo(o.toString());
  }

  abstract StringBuilder unparse(StringBuilder b);

  @Override
  public String toString() {
    return unparse(new StringBuilder()).toString();
  }

  /**
   * Real symbolic parameter, such as "g", "κ", "g(i)" or "Γ(i,j)".
   *
   * <p>The symbol for the size of an index range ("N") is also a parameter.
   */
  public static class Parameter extends Factor {
    public final String name;
    public final ImmutableList<Index> indices;

    Parameter(String name, ImmutableList<Index> indices) {
      super(Op.PARAMETER);
      this.name = requireNonNull(name, "name");
      this.indices = requireNonNull(indices, "indices");
      checkArgument(!name.isEmpty(), "empty name");
    }

    /** Creates a parameter. */
    public static Parameter of(String name, List<Index> indices) {
      return new Parameter(name, ImmutableList.copyOf(indices));
    }

    /** Returns a parameter with the same name and different indices. */
    public Parameter withIndices(List<Index> indices) {
      return indices.equals(this.indices)
          ? this
          : new Parameter(name, ImmutableList.copyOf(indices));
    }

    @Override
    public Set<Index> indices() {
      return new LinkedHashSet<>(indices);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, indices);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Parameter
              && ((Parameter) o).name.equals(name)
              && ((Parameter) o).indices.equals(indices);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      b.append(name);
      if (!indices.isEmpty()) {
        b.append('(');
        for (int i = 0; i < indices.size(); i++) {
          if (i > 0) {
            b.append(',');
          }
          b.append(indices.get(i).name);
        }
        b.append(')');
      }
      return b;
    }
  }

  /**
   * Expectation value of a non-identity product of operators in canonical
   * form.
   *
   * <p>The unit of an equation system: each state variable is an average.
   */
  public static class Average extends Factor {
    public final Operator.Product product;

    Average(Operator.Product product) {
      super(Op.AVERAGE);
      this.product = requireNonNull(product, "product");
      checkArgument(!product.isIdentity(), "average of identity");
    }

    /** Creates an average of a product that is in canonical form. */
    public static Average of(Operator.Product product) {
      return new Average(product);
    }

    /** Returns the number of elementary operators in the product. */
    public int order() {
      return product.order();
    }

    @Override
    public Set<Index> indices() {
      return product.indices();
    }

    @Override
    public int hashCode() {
      return product.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Average && ((Average) o).product.equals(product);
    }

    @Override
    StringBuilder unparse(StringBuilder b) {
      return product.unparse(b.append('⟨')).append('⟩');
    }
  }
}

// End Factor.java
