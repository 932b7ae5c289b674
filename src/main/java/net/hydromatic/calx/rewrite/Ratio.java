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
package net.hydromatic.calx.rewrite;

import static java.util.Objects.requireNonNull;

import java.math.BigInteger;
import net.hydromatic.calx.num.Num;

/**
 * Numeric coefficient that is exact when it is a ratio of integers.
 *
 * <p>If the numerator and divisor are both integers, the ratio is held in
 * lowest terms with a positive divisor, so {@code 2/4} and {@code -1/-2}
 * are both {@code 1/2}. Otherwise the divisor is one and the numerator
 * holds the value.
 */
final class Ratio {
  static final Ratio ZERO = of(Num.ZERO);
  static final Ratio ONE = of(Num.ONE);

  final Num numerator;
  final Num divisor;

  private Ratio(Num numerator, Num divisor) {
    this.numerator = requireNonNull(numerator);
    this.divisor = requireNonNull(divisor);
  }

  static Ratio of(Num n) {
    return new Ratio(n, Num.ONE);
  }

  /** Creates a ratio; the divisor must not be zero. */
  static Ratio of(Num n, Num d) {
    if (n.kind != Num.Kind.INTEGER || d.kind != Num.Kind.INTEGER) {
      return new Ratio(d.isOne() ? n : n.divide(d), Num.ONE);
    }
    BigInteger a = n.bigIntegerValue();
    BigInteger b = d.bigIntegerValue();
    if (b.signum() < 0) {
      a = a.negate();
      b = b.negate();
    }
    final BigInteger g = a.gcd(b);
    if (g.signum() != 0 && !g.equals(BigInteger.ONE)) {
      a = a.divide(g);
      b = b.divide(g);
    }
    return new Ratio(Num.of(a), Num.of(b));
  }

  /** Returns whether a literal can be the divisor of an exact ratio. */
  static boolean isExactDivisor(Num n) {
    return n.kind == Num.Kind.INTEGER && !n.isZero();
  }

  boolean isZero() {
    return numerator.isZero();
  }

  boolean isOne() {
    return numerator.isOne() && divisor.isOne();
  }

  boolean isNegative() {
    return numerator.isNegative();
  }

  Ratio negate() {
    return new Ratio(numerator.negate(), divisor);
  }

  Ratio plus(Ratio o) {
    if (divisor.equals(o.divisor)) {
      return of(numerator.plus(o.numerator), divisor);
    }
    return of(numerator.times(o.divisor).plus(o.numerator.times(divisor)),
        divisor.times(o.divisor));
  }

  Ratio times(Ratio o) {
    return of(numerator.times(o.numerator), divisor.times(o.divisor));
  }

  Ratio times(Num n) {
    return of(numerator.times(n), divisor);
  }

  /** Divides by a non-zero number. */
  Ratio divide(Num n) {
    return of(numerator, divisor.times(n));
  }

  boolean numericallyEquals(Ratio o) {
    return numerator.times(o.divisor)
        .numericallyEquals(o.numerator.times(divisor));
  }

  /** Returns the value as a number, which is inexact if the divisor is not
   * one. */
  Num toNum() {
    return divisor.isOne() ? numerator : numerator.divide(divisor);
  }

  @Override public String toString() {
    return divisor.isOne() ? numerator.toString()
        : numerator + "/" + divisor;
  }
}

// End Ratio.java
