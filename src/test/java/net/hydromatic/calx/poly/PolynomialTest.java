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
package net.hydromatic.calx.poly;

import static net.hydromatic.calx.Matchers.hasSortedValues;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import net.hydromatic.calx.Calx;
import net.hydromatic.calx.num.Num;
import org.junit.jupiter.api.Test;

/** Tests for {@link Polynomial} and {@link Polynomials}. */
public class PolynomialTest {
  private static final Polynomial X2_MINUS_9 = Polynomial.of("x", -9, 0, 1);

  @Test void testBasics() {
    assertThat(X2_MINUS_9.degree(), is(2));
    assertThat(X2_MINUS_9, hasToString("x^2 - 9"));
    assertThat(Polynomial.of("x", 1, -3, 0, 2),
        hasToString("2 * x^3 - 3 * x + 1"));
    assertThat(Polynomial.of("x", 0, 0, 0).isZero(), is(true));
    assertThat(Polynomial.of("x"), hasToString("0"));
    assertThat(X2_MINUS_9.evaluate(Num.of(3)), is(Num.ZERO));
    assertThat(X2_MINUS_9.leadingCoefficient(), is(Num.ONE));
  }

  @Test void testArithmetic() {
    final Polynomial a = Polynomial.of("x", 1, 1);
    final Polynomial b = Polynomial.of("x", -1, 1);
    assertThat(a.times(b), is(Polynomial.of("x", -1, 0, 1)));
    assertThat(a.plus(b), is(Polynomial.of("x", 0, 2)));
    assertThat(a.minus(a).isZero(), is(true));
    assertThat(a.pow(3), is(Polynomial.of("x", 1, 3, 3, 1)));
    assertThat(X2_MINUS_9.derivative(), is(Polynomial.of("x", 0, 2)));
    assertThat(Polynomial.of("x", 0, 0, 3).integral(),
        is(Polynomial.of("x", 0, 0, 0, 1)));
  }

  @Test void testDivide() {
    final Polynomial.Division d =
        Polynomial.of("x", -1, 0, 0, 1).divide(Polynomial.of("x", -1, 1));
    assertThat(d.quotient, is(Polynomial.of("x", 1, 1, 1)));
    assertThat(d.remainder.isZero(), is(true));
    final Polynomial.Division d2 =
        Polynomial.of("x", 1, 0, 1).divide(Polynomial.of("x", 1, 1));
    assertThat(d2.quotient, is(Polynomial.of("x", -1, 1)));
    assertThat(d2.remainder, is(Polynomial.of("x", 2)));
    assertThrows(ArithmeticException.class,
        () -> X2_MINUS_9.divide(Polynomial.of("x")));
  }

  @Test void testRoots() {
    assertThat(X2_MINUS_9.roots(), hasToString("[3, -3]"));
    assertThat(Polynomial.of("x", -6, 11, -6, 1).roots(),
        hasSortedValues("1", "2", "3"));
    assertThat(Polynomial.of("x", 0, 0, 1, 1).roots(),
        hasSortedValues("-1", "0", "0"));
    final List<Num> complex = Polynomial.of("x", 1, 0, 1).roots();
    assertThat(complex, hasSize(2));
    for (Num root : complex) {
      assertThat(root.isReal(), is(false));
      assertThat(Polynomial.of("x", 1, 0, 1).evaluate(root)
          .closeTo(Num.ZERO, 1e-9), is(true));
    }
    assertThat(Polynomial.of("x", 1, 0, 1)
            .realRoots(Polynomial.DEFAULT_MAX_ITERATIONS, 1e-10),
        hasSize(0));
    assertThrows(ArithmeticException.class,
        () -> Polynomial.of("x").roots());
  }

  /** The roots of a quintic, found numerically, satisfy it. */
  @Test void testDurandKerner() {
    final Polynomial p = Polynomial.of("x", 1, -2, 0, 3, 0, 1);
    final List<Num> roots = p.roots();
    assertThat(roots, hasSize(5));
    for (Num root : roots) {
      assertThat(p.evaluate(root).closeTo(Num.ZERO, 1e-6), is(true));
    }
  }

  @Test void testFactorizeGcd() {
    assertThat(X2_MINUS_9.factorize(),
        is(List.of(Polynomial.of("x", -3, 1), Polynomial.of("x", 3, 1))));
    final Polynomial a = Polynomial.of("x", -1, 0, 1);
    final Polynomial b = Polynomial.of("x", 1, 2, 1);
    assertThat(a.gcd(b), is(Polynomial.of("x", 1, 1)));
    assertThat(a.lcm(b), is(Polynomial.of("x", -1, -1, 1, 1)));
  }

  @Test void testToPolynomial() {
    final Calx calx = Calx.create();
    assertThat(Polynomials.toPolynomial(calx.parse("(x + 1)^2 - 1"), "x"),
        is(Polynomial.of("x", 0, 2, 1)));
    assertThat(Polynomials.toPolynomial(calx.parse("x / 2"), "x"),
        hasToString("0.5 * x"));
    assertThat(Polynomials.toPolynomial(calx.parse("x * y"), "x"),
        nullValue());
    assertThat(Polynomials.toPolynomial(calx.parse("sin(x)"), "x"),
        nullValue());
    assertThat(Polynomials.toPolynomial(calx.parse("x^-1"), "x"),
        nullValue());
    assertThat(Polynomials.toPolynomial(calx.parse("x / x"), "x"),
        nullValue());
  }
}

// End PolynomialTest.java
