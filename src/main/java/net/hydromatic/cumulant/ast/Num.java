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

/**
 * Complex number.
 *
 * <p>Used for the coefficients of terms, where the values that arise
 * (integers, halves, the imaginary unit) are exact in binary floating point,
 * and for numeric evaluation.
 */
public final class Num {
  public static final Num ZERO = new Num(0, 0);
  public static final Num ONE = new Num(1, 0);
  public static final Num MINUS_ONE = new Num(-1, 0);
  public static final Num HALF = new Num(0.5, 0);
  public static final Num I = new Num(0, 1);
  public static final Num MINUS_I = new Num(0, -1);

  public final double re;
  public final double im;

  private Num(double re, double im) {
    // Normalize -0.0, so that equals and hashCode agree with ==.
    this.re = re == 0d ? 0d : re;
    this.im = im == 0d ? 0d : im;
  }

  /** Creates a complex number. */
  public static Num of(double re, double im) {
    return new Num(re, im);
  }

  /** Creates a real number. */
  public static Num of(double re) {
    return new Num(re, 0);
  }

  public boolean isZero() {
    return re == 0d && im == 0d;
  }

  public boolean isOne() {
    return re == 1d && im == 0d;
  }

  public boolean isReal() {
    return im == 0d;
  }

  public Num plus(Num o) {
    return new Num(re + o.re, im + o.im);
  }

  public Num minus(Num o) {
    return new Num(re - o.re, im - o.im);
  }

  public Num times(Num o) {
    return new Num(re * o.re - im * o.im, re * o.im + im * o.re);
  }

  public Num times(double d) {
    return new Num(re * d, im * d);
  }

  public Num divide(Num o) {
    final double d = o.re * o.re + o.im * o.im;
    return new Num((re * o.re + im * o.im) / d, (im * o.re - re * o.im) / d);
  }

  public Num negate() {
    return new Num(-re, -im);
  }

  public Num conj() {
    return im == 0d ? this : new Num(re, -im);
  }

  /** Returns the modulus. */
  public double abs() {
    return Math.hypot(re, im);
  }

  @Override
  public int hashCode() {
    return Double.hashCode(re) * 31 + Double.hashCode(im);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Num
            && ((Num) o).re == re
            && ((Num) o).im == im;
  }

  /**
   * Prints this number as a coefficient: "2", "-0.5", "i", "-2i",
   * "(1+2i)".
   */
  @Override
  public String toString() {
    if (im == 0d) {
      return str(re);
    }
    final String imStr =
        im == 1d ? "i" : im == -1d ? "-i" : str(im) + "i";
    if (re == 0d) {
      return imStr;
    }
    return "(" + str(re) + (im > 0 ? "+" : "") + imStr + ")";
  }

  private static String str(double d) {
    if (d == Math.rint(d) && Math.abs(d) < 1e15) {
      return Long.toString((long) d);
    }
    return Double.toString(d);
  }
}

// End Num.java
