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
package net.hydromatic.calx.calculus;

import static net.hydromatic.calx.Cx.cx;
import static net.hydromatic.calx.Matchers.isAst;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.calx.Calx;
import net.hydromatic.calx.ast.Ast;
import net.hydromatic.calx.eval.Prop;
import org.junit.jupiter.api.Test;

/** Tests for {@link Integrator}. */
public class IntegratorTest {
  @Test void testPolynomials() {
    cx("2 * x").assertIntegral("x^2");
    cx("x").assertIntegral("x^2 / 2");
    cx("3").assertIntegral("3 * x");
    cx("x^2 + x").assertIntegral("x^2 / 2 + x^3 / 3");
    cx("x^3 - 2 * x + 1").assertIntegralDifferentiates();
  }

  /** The coefficients of an integral are exact, so differentiating the
   * integral of a power gives back the same power, not a multiple such as
   * {@code 0.9999999999999999 * x^48}. */
  @Test void testExactCoefficients() {
    final Calx calx = Calx.create();
    for (int n = 1; n <= 60; n++) {
      final Ast.Exp e = calx.simplify(calx.parse("x^" + n));
      final Ast.Exp integral = calx.integrate(e, "x");
      assertThat(integral, isAst("x^" + (n + 1) + " / " + (n + 1)));
      assertThat("x^" + n, calx.differentiate(integral, "x"), is(e));
    }
    final Ast.Exp p = calx.parse("7 * x^6 + 5 * x^4 - 1");
    assertThat(calx.differentiate(calx.integrate(p, "x"), "x"),
        is(calx.simplify(p)));
  }

  @Test void testFunctions() {
    cx("cos(x)").assertIntegral("sin(x)");
    cx("1 / x").assertIntegral("ln(x)");
    final String[] expressions = {
        "sin(x)", "tan(x)", "exp(x)", "exp(3 * x + 1)", "sinh(x)",
        "cosh(x)", "sqrt(x)", "ln(x)", "sin(2 * x)", "2^x", "e^x",
        "(2 * x + 1)^3", "1 / (x + 1)"};
    for (String s : expressions) {
      cx(s).assertIntegralDifferentiates();
    }
  }

  @Test void testProducts() {
    final String[] expressions = {
        "3 * sin(x)", "x * exp(x)", "x * cos(x)", "x^2 * exp(x)",
        "2 * x / (x^2 + 1)"};
    for (String s : expressions) {
      cx(s).assertIntegralDifferentiates();
    }
  }

  /** In integration by parts, {@code u} is a logarithm if there is one,
   * otherwise a polynomial rather than an exponential or trigonometric
   * function. */
  @Test void testPartsOrder() {
    final Calx calx = Calx.create();
    final String[] ranked = {"ln(x)", "atan(x)", "x^2 + 1", "sin(x)",
        "exp(x)"};
    for (int i = 1; i < ranked.length; i++) {
      final Ast.Exp better = calx.parse(ranked[i - 1]);
      final Ast.Exp worse = calx.parse(ranked[i]);
      assertThat(ranked[i - 1] + " before " + ranked[i],
          Integrator.partsRank(better, "x")
              < Integrator.partsRank(worse, "x"),
          is(true));
    }
    // With the polynomial as u, two levels of nesting are enough
    final String[] expressions = {
        "exp(x) * x^2", "x^2 * exp(x)", "sin(x) * x", "x^2 * ln(x)"};
    for (String s : expressions) {
      cx(s).withProp(Prop.INTEGRATION_DEPTH, 2)
          .assertIntegralDifferentiates();
    }
  }

  /** Rational functions, by long division and partial fractions. */
  @Test void testRational() {
    final String[] expressions = {
        "(x^2 + 1) / (x + 1)", "1 / (x^2 - 9)", "x / ((x + 1) * (x + 4))",
        "3 / (2 * x + 5)"};
    for (String s : expressions) {
      cx(s).assertIntegralDifferentiates();
    }
  }

  @Test void testDegrees() {
    cx("cos(x)")
        .withProp(Prop.ANGLE_UNIT, Prop.AngleUnit.DEGREES)
        .assertIntegralDifferentiates();
  }

  /** An expression with no rule is returned unchanged. */
  @Test void testUnsupported() {
    final Calx calx = Calx.create();
    final String[] expressions = {"sec(x)", "exp(x^2)", "x^x"};
    for (String s : expressions) {
      final Ast.Exp e = calx.parse(s);
      assertThat(s, calx.integrate(e, "x"), sameInstance(e));
    }
  }
}

// End IntegratorTest.java
