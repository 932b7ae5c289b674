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
package net.hydromatic.calx.num;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import org.junit.jupiter.api.Test;

/** Tests for {@link Num}. */
public class NumTest {
  private static final MathContext MC = new MathContext(30);

  @Test void testParse() {
    assertThat(Num.parse("42", MC).kind, is(Num.Kind.INTEGER));
    assertThat(Num.parse("0x1f", MC), is(Num.of(31)));
    assertThat(Num.parse("0o17", MC), is(Num.of(15)));
    assertThat(Num.parse("2.5", MC).kind, is(Num.Kind.DOUBLE));
    assertThat(Num.parse("1.5e2", MC), hasToString("150.0"));
    assertThat(Num.parse("1.000000000000000000001", MC).kind,
        is(Num.Kind.PRECISE));
    // The text of a double parses back to the same double
    final Num sixth = Num.of(1d / 6d);
    assertThat(Num.parse(sixth.toString(), MC), is(sixth));
    assertThat(Num.parse("0.1111111111111111111", MC).kind,
        is(Num.Kind.PRECISE));
    assertThrows(NumberFormatException.class, () -> Num.parse("1x", MC));
  }

  /** Integer arithmetic is exact; a quotient that is not whole becomes a
   * double. */
  @Test void testIntegerArithmetic() {
    final Num big = Num.of(new BigInteger("123456789012345678901234567890"));
    assertThat(big.times(big).divide(big), is(big));
    assertThat(Num.of(6).divide(Num.of(3)), is(Num.of(2)));
    assertThat(Num.of(1).divide(Num.of(2)), is(Num.of(0.5d)));
    assertThat(Num.of(2).pow(Num.of(100)),
        hasToString("1267650600228229401496703205376"));
    assertThat(Num.of(-7).mod(Num.of(3)), is(Num.of(2)));
    final ArithmeticException e =
        assertThrows(ArithmeticException.class,
            () -> Num.of(1).divide(Num.ZERO));
    assertThat(e.getMessage(), is("Division by zero"));
  }

  @Test void testKinds() {
    assertThat(Num.of(1).plus(Num.of(0.5d)).kind, is(Num.Kind.DOUBLE));
    assertThat(Num.of(2).equals(Num.of(2d)), is(false));
    assertThat(Num.of(2).numericallyEquals(Num.of(2d)), is(true));
    assertThat(Num.of(2d).toIntegerIfWhole(), is(Num.of(2)));
    assertThat(Num.of(2.5d).toIntegerIfWhole(), is(Num.of(2.5d)));
  }

  @Test void testPrecise() {
    final Num third = Num.precise(BigDecimal.ONE, MC)
        .divide(Num.precise(new BigDecimal(3), MC));
    assertThat(third.kind, is(Num.Kind.PRECISE));
    assertThat(third, hasToString("0.333333333333333333333333333333"));
    assertThat(third.times(Num.of(3)).closeTo(Num.ONE, 1e-25), is(true));
  }

  @Test void testComplex() {
    final Num i = Num.I;
    assertThat(i.times(i).numericallyEquals(Num.MINUS_ONE), is(true));
    assertThat(Num.of(-4).sqrt(), is(Num.imaginary(2d)));
    assertThat(Num.of(16).sqrt(), is(Num.of(4)));
    assertThat(Num.complex(3d, 4d).abs(), is(Num.of(5d)));
    assertThat(Num.complex(1d, -2d), hasToString("1.0 - 2.0i"));
    assertThat(Num.of(-8).pow(Num.of(1d / 3d)).isReal(), is(false));
    assertThrows(ArithmeticException.class,
        () -> Num.complex(1d, 1d).compareTo(Num.ONE));
  }

  @Test void testCloseTo() {
    assertThat(Num.of(1e9).closeTo(Num.of(1e9 + 1), 1e-8), is(true));
    assertThat(Num.of(1d).closeTo(Num.of(1.001d), 1e-6), is(false));
    assertThat(Num.of(0.1d).plus(Num.of(0.2d)).doubleValue(),
        closeTo(0.3d, 1e-15));
  }

  @Test void testPredicates() {
    assertThat(Num.of(3d).isIntegral(), is(true));
    assertThat(Num.of(3.5d).isIntegral(), is(false));
    assertThat(Num.imaginary(1d).isIntegral(), is(false));
    assertThat(Num.of(-3).isNegative(), is(true));
    assertThat(Num.imaginary(-3d).isNegative(), is(false));
    assertThat(Num.of(0d).isZero(), is(true));
  }
}

// End NumTest.java
