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

import net.hydromatic.cumulant.algebra.Averages;
import net.hydromatic.cumulant.ast.Expr;
import net.hydromatic.cumulant.ast.Factor;

/** Equation of motion {@code d/dt lhs = rhs} for an average. */
public class Equation {
  public final Factor.Average lhs;
  /** Scalar expression in averages and parameters. */
  public final Expr rhs;

  public Equation(Factor.Average lhs, Expr rhs) {
    this.lhs = requireNonNull(lhs, "lhs");
    this.rhs = requireNonNull(rhs, "rhs");
  }

  /** Returns an equation with the same left-hand side. */
  public Equation withRhs(Expr rhs) {
    return rhs.equals(this.rhs) ? this : new Equation(lhs, rhs);
  }

  /** Returns the equation of the complex conjugate of the left-hand side. */
  public Equation conjugate() {
    return new Equation(Averages.adjoint(lhs), Averages.conjugate(rhs));
  }

  @Override
  public int hashCode() {
    return lhs.hashCode() * 31 + rhs.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Equation
            && ((Equation) o).lhs.equals(lhs)
            && ((Equation) o).rhs.equals(rhs);
  }

  @Override
  public String toString() {
    return "d/dt " + lhs + " = " + rhs;
  }
}

// End Equation.java
