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
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import net.hydromatic.cumulant.space.Index;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Quantum operators.
 *
 * <p>The set of variants is closed: {@link Destroy}, {@link Create} and
 * {@link Transition} are the elementary operators, and {@link Product} is an
 * ordered sequence of elementary operators in canonical form. Sums and
 * scalar multiples of operators are {@link Expr expressions}. Code that
 * needs to distinguish variants switches on {@link Elementary#op}.
 *
 * <p>This class functions as a namespace.
 */
public class Operator {
  private Operator() {}

  /** Elementary operator, acting on a single subsystem. */
  public abstract static class Elementary {
    public final Op op;
    public final String name;
    /** Position of the subspace that this operator acts on. */
    public final int aon;
    /** Index of the subsystem, or null if the subspace is not indexed. */
    public final @Nullable Index index;

    Elementary(Op op, String name, int aon, @Nullable Index index) {
      this.op = requireNonNull(op, "op");
      this.name = requireNonNull(name, "name");
      this.aon = aon;
      this.index = index;
      checkArgument(op.isElementary());
    }

    /** Returns the Hermitian adjoint of this operator. */
    public abstract Elementary adjoint();

    /** Returns a copy of this operator with a different index. */
    public abstract Elementary withIndex(@Nullable Index index);

    /**
     * Returns a copy of this operator acting on a different subspace, with a
     * different name.
     */
    public abstract Elementary withAon(int aon, String name);

    /** Writes this operator's symbol, without its index. */
    abstract StringBuilder symbol(StringBuilder b);

    @Override
    public int hashCode() {
      return Objects.hash(op, name, aon, index);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Elementary
              && ((Elementary) o).op == op
              && ((Elementary) o).name.equals(name)
              && ((Elementary) o).aon == aon
              && Objects.equals(((Elementary) o).index, index);
    }

    public StringBuilder unparse(StringBuilder b) {
      symbol(b);
      if (index != null) {
        b.append('(').append(index.name).append(')');
      }
      return b;
    }

    @Override
    public String toString() {
      return unparse(new StringBuilder()).toString();
    }
  }

  /** Bosonic annihilation operator, "a". */
  public static class Destroy extends Elementary {
    Destroy(String name, int aon, @Nullable Index index) {
      super(Op.DESTROY, name, aon, index);
    }

    @Override
    public Create adjoint() {
      return new Create(name, aon, index);
    }

    @Override
    public Destroy withIndex(@Nullable Index index) {
      return Objects.equals(index, this.index)
          ? this
          : new Destroy(name, aon, index);
    }

    @Override
    public Destroy withAon(int aon, String name) {
      return new Destroy(name, aon, index);
    }

    @Override
    StringBuilder symbol(StringBuilder b) {
      return b.append(name);
    }
  }

  /** Bosonic creation operator, "a†". */
  public static class Create extends Elementary {
    Create(String name, int aon, @Nullable Index index) {
      super(Op.CREATE, name, aon, index);
    }

    @Override
    public Destroy adjoint() {
      return new Destroy(name, aon, index);
    }

    @Override
    public Create withIndex(@Nullable Index index) {
      return Objects.equals(index, this.index)
          ? this
          : new Create(name, aon, index);
    }

    @Override
    public Create withAon(int aon, String name) {
      return new Create(name, aon, index);
    }

    @Override
    StringBuilder symbol(StringBuilder b) {
      return b.append(name).append('†');
    }
  }

  /** Transition operator σ(k,l) = |k⟩⟨l| of a multi-level system. */
  public static class Transition extends Elementary {
    /** Level of the ket. */
    public final int k;
    /** Level of the bra. */
    public final int l;
    /** Number of levels of the subspace. */
    public final int levels;
    /** Ground level of the subspace. */
    public final int ground;

    Transition(String name, int aon, @Nullable Index index, int k, int l,
        int levels, int ground) {
      super(Op.TRANSITION, name, aon, index);
      this.k = k;
      this.l = l;
      this.levels = levels;
      this.ground = ground;
    }

    /** Returns whether this operator is the projector onto a level. */
    public boolean isProjector() {
      return k == l;
    }

    /** Returns whether this operator is the projector onto the ground level. */
    public boolean isGroundProjector() {
      return k == ground && l == ground;
    }

    /** Returns a transition on the same subsystem between other levels. */
    public Transition withLevels(int k, int l) {
      return new Transition(name, aon, index, k, l, levels, ground);
    }

    @Override
    public Transition adjoint() {
      return k == l ? this : withLevels(l, k);
    }

    @Override
    public Transition withIndex(@Nullable Index index) {
      return Objects.equals(index, this.index)
          ? this
          : new Transition(name, aon, index, k, l, levels, ground);
    }

    @Override
    public Transition withAon(int aon, String name) {
      return new Transition(name, aon, index, k, l, levels, ground);
    }

    @Override
    public int hashCode() {
      return super.hashCode() * 31 + k * 7 + l;
    }

    @Override
    public boolean equals(Object o) {
      return super.equals(o)
          && ((Transition) o).k == k
          && ((Transition) o).l == l;
    }

    @Override
    StringBuilder symbol(StringBuilder b) {
      return b.append(name).append(k).append(l);
    }
  }

  /**
   * Product of elementary operators, in canonical form.
   *
   * <p>Only the normal-ordering code in {@code algebra} creates products from
   * lists; elsewhere, products come out of expressions.
   */
  public static class Product {
    public static final Product IDENTITY = new Product(ImmutableList.of());

    public final ImmutableList<Elementary> ops;

    private Product(ImmutableList<Elementary> ops) {
      this.ops = requireNonNull(ops);
    }

    /** Creates a product from a list that is already in canonical form. */
    public static Product of(List<? extends Elementary> ops) {
      return ops.isEmpty() ? IDENTITY : new Product(ImmutableList.copyOf(ops));
    }

    public boolean isIdentity() {
      return ops.isEmpty();
    }

    /** Returns the number of elementary operators. */
    public int order() {
      return ops.size();
    }

    /**
     * Returns the adjoint operators in reverse order. The result is not in
     * canonical form, so it is a list rather than a product.
     */
    public List<Elementary> adjointOps() {
      final List<Elementary> list = new ArrayList<>(ops.size());
      for (Elementary op : ops.reverse()) {
        list.add(op.adjoint());
      }
      return list;
    }

    /** Returns the distinct indices of this product, in order of appearance. */
    public Set<Index> indices() {
      final Set<Index> set = new LinkedHashSet<>();
      for (Elementary op : ops) {
        if (op.index != null) {
          set.add(op.index);
        }
      }
      return set;
    }

    @Override
    public int hashCode() {
      return ops.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Product && ((Product) o).ops.equals(ops);
    }

    public StringBuilder unparse(StringBuilder b) {
      if (ops.isEmpty()) {
        return b.append('1');
      }
      for (int i = 0; i < ops.size(); i++) {
        if (i > 0) {
          b.append('*');
        }
        ops.get(i).unparse(b);
      }
      return b;
    }

    @Override
    public String toString() {
      return unparse(new StringBuilder()).toString();
    }
  }
}

// End Operator.java
