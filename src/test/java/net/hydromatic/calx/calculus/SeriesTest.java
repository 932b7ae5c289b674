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

import static net.hydromatic.calx.Matchers.closeTo;
import static net.hydromatic.calx.Matchers.isAst;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import net.hydromatic.calx.Calx;
import net.hydromatic.calx.ast.Ast;
import net.hydromatic.calx.eval.EvaluationException;
import net.hydromatic.calx.num.Num;
import org.junit.jupiter.api.Test;

/** Tests for {@link Series}. */
public class SeriesTest {
  private final Calx calx = Calx.create();

  private Num at(Ast.Exp e, double x) {
    return calx.evaluateNum(e, ImmutableMap.of("x", Num.of(x)));
  }

  @Test void testMaclaurinPolynomial() {
    final Ast.Exp e = calx.parse("x^2 + 3*x + 1");
    assertThat(calx.maclaurin(e, "x", 2), isAst("1 + 3 * x + x^2"));
    assertThat(calx.maclaurin(e, "x", 1), isAst("1 + 3 * x"));
    assertThat(calx.maclaurin(e, "x", 0), isAst("1"));
  }

  @Test void testMaclaurin() {
    final Ast.Exp exp = calx.maclaurin(calx.parse("exp(x)"), "x", 4);
    assertThat(at(exp, 0.1d), closeTo(Math.exp(0.1d), 1e-6));
    final Ast.Exp sin = calx.maclaurin(calx.parse("sin(x)"), "x", 5);
    assertThat(at(sin, 0.2d), closeTo(Math.sin(0.2d), 1e-7));
  }

  @Test void testTaylor() {
    final Ast.Exp ln =
        calx.taylor(calx.parse("ln(x)"), "x", Num.ONE, 3);
    assertThat(at(ln, 1.1d), closeTo(Math.log(1.1d), 1e-4));
    assertThat(at(ln, 1d), closeTo(0d, 1e-12));
    final EvaluationException e =
        assertThrows(EvaluationException.class,
            () -> calx.maclaurin(calx.parse("ln(x)"), "x", 2));
    assertThat(e.getMessage(), containsString("domain of 'ln'"));
  }

  @Test void testLimit() {
    assertThat(calx.limit(calx.parse("x^2"), "x", Num.of(3)),
        is(Num.of(9)));
    assertThat(calx.limit(calx.parse("sin(x) / x"), "x", Num.ZERO),
        is(Num.ONE));
    assertThat(calx.limit(calx.parse("(x^2 - 1) / (x - 1)"), "x", Num.ONE),
        is(Num.of(2)));
    assertThat(calx.limit(calx.parse("(1 + x)^(1 / x)"), "x", Num.ZERO),
        closeTo(Math.E, 1e-6));
  }

  @Test void testNoLimit() {
    final EvaluationException e =
        assertThrows(EvaluationException.class,
            () -> calx.limit(calx.parse("1 / x"), "x", Num.ZERO));
    assertThat(e.getMessage(), containsString("does not exist"));
  }
}

// End SeriesTest.java
