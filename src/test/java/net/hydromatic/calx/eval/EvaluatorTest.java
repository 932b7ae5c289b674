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
package net.hydromatic.calx.eval;

import static net.hydromatic.calx.Cx.cx;
import static net.hydromatic.calx.Matchers.closeTo;
import static net.hydromatic.calx.Matchers.isAst;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.calx.Calx;
import net.hydromatic.calx.ast.Ast;
import net.hydromatic.calx.num.Num;
import net.hydromatic.calx.util.Tracers;
import org.junit.jupiter.api.Test;

/** Tests for {@link Evaluator} and {@link Functions}. */
public class EvaluatorTest {
  @Test void testArithmetic() {
    cx("2 + 3").assertEval(hasToString("5"));
    cx("1 + 2 * 3").assertEval(hasToString("7"));
    cx("(1 + 2) * 3").assertEval(hasToString("9"));
    cx("1 / 2").assertEval(hasToString("0.5"));
    cx("2^10").assertEval(hasToString("1024"));
    cx("2^-1").assertEval(hasToString("0.5"));
    cx("-2^2").assertEval(hasToString("-4"));
    cx("7 % 3").assertEval(hasToString("1"));
    cx("-7 ~/ 2").assertEval(hasToString("-4"));
    cx("5!").assertEval(hasToString("120"));
    cx("50%").assertEval(hasToString("0.5"));
    cx("5 P 2").assertEval(hasToString("20"));
    cx("5 C 2").assertEval(hasToString("10"));
    cx("6 & 3").assertEval(hasToString("2"));
    cx("1 << 10").assertEval(hasToString("1024"));
    cx("~0").assertEval(hasToString("-1"));
  }

  @Test void testFunctions() {
    cx("sqrt(16)").assertEval(hasToString("4"));
    cx("abs(-3)").assertEval(hasToString("3"));
    cx("floor(2.7)").assertEval(hasToString("2"));
    cx("ceil(2.1)").assertEval(hasToString("3"));
    cx("round(2.5)").assertEval(hasToString("3"));
    cx("max(3, 7, 5)").assertEval(hasToString("7"));
    cx("gcd(12, 18)").assertEval(hasToString("6"));
    cx("lcm(4, 6)").assertEval(hasToString("12"));
    cx("cbrt(27)").assertEval(hasToString("3"));
    cx("exp(0)").assertEval(hasToString("1"));
    cx("ln(1)").assertEval(hasToString("0"));
    final Calx calx = Calx.create();
    assertThat(calx.evaluateNum(calx.parse("sin(pi / 2)"), ImmutableMap.of()),
        closeTo(1d, 1e-12));
    assertThat(calx.evaluateNum(calx.parse("log(2, 8)"), ImmutableMap.of()),
        closeTo(3d, 1e-12));
    assertThat(calx.evaluateNum(calx.parse("log(1000)"), ImmutableMap.of()),
        closeTo(3d, 1e-12));
  }

  @Test void testDegrees() {
    final Calx calx = cx("")
        .withProp(Prop.ANGLE_UNIT, Prop.AngleUnit.DEGREES)
        .calx();
    assertThat(calx.evaluateNum(calx.parse("sin(90)"), ImmutableMap.of()),
        closeTo(1d, 1e-12));
    assertThat(calx.evaluateNum(calx.parse("atan(1)"), ImmutableMap.of()),
        closeTo(45d, 1e-9));
  }

  @Test void testComplex() {
    cx("sqrt(-4)").assertEval(hasToString("2.0i"));
    cx("i * i").assertEval(hasToString("-1.0 + 0.0i"));
    cx("sqrt(-4)")
        .withProp(Prop.COMPLEX, false)
        .assertEvalError(
            is("Argument -4 is outside the domain of 'sqrt'"));
    cx("(-8)^0.5")
        .withProp(Prop.COMPLEX, false)
        .assertEvalError(startsWith("Result of '(-8)^0.5' is complex"));
  }

  @Test void testValues() {
    cx("\"a\" + \"b\"").assertEval(hasToString("ab"));
    cx("[1, 2] + [3]").assertEval(hasToString("[1, 2, 3]"));
    cx("[10, 20, 30][1]").assertEval(hasToString("20"));
    cx("{a: 1, b: 2}.b").assertEval(hasToString("2"));
    cx("\"abc\"[2]").assertEval(hasToString("c"));
    cx("1 < 2 && 2 <= 2").assertEval(is(true));
    cx("1 == 1.0").assertEval(is(true));
    cx("null ?? 3").assertEval(hasToString("3"));
    cx("x > 0 ? 1 : 2").assertEval(instanceOf(Ast.Exp.class));
    cx("true ? 1 : 2").assertEval(hasToString("1"));
  }

  /** Short-circuit operators do not evaluate their second operand. */
  @Test void testShortCircuit() {
    cx("false && 1 / 0 > 1").assertEval(is(false));
    cx("true || 1 / 0 > 1").assertEval(is(true));
  }

  @Test void testErrors() {
    cx("1 / 0").assertEvalError(is("Division by zero"));
    cx("foo(1)").assertEvalError(is("Unknown function 'foo'"));
    cx("sin(1, 2)")
        .assertEvalError(is("Function 'sin' expects 1 argument, got 2"));
    cx("ln(0)").assertEvalError(is("Argument 0 is outside the domain of 'ln'"));
    cx("asin(2)")
        .assertEvalError(is("Argument 2 is outside the domain of 'asin'"));
    cx("(-1)!").assertEvalError(
        is("Factorial requires a non-negative integer, got -1"));
    cx("[1, 2][5]")
        .assertEvalError(is("Index 5 out of range for length 2"));
    cx("1 + true").assertEvalError(
        is("Operator '+' requires numeric operands, got boolean true"));
    cx("2 C 5").assertEvalError(startsWith("Operator 'C' requires"));
  }

  /** Unbound variables remain symbolic, and the rest is simplified. */
  @Test void testSymbolic() {
    final Calx calx = Calx.create();
    final Object o = calx.evaluate(calx.parse("2 * 3 * x"));
    assertThat(o, instanceOf(Ast.Exp.class));
    assertThat((Ast.Exp) o, isAst("6 * x"));
    assertThat(calx.evaluate(calx.parse("0 * x")), hasToString("0"));
    assertThat(calx.evaluate(calx.parse("x + 0")), hasToString("x"));
  }

  @Test void testBindings() {
    final Calx calx = Calx.create();
    final Ast.Exp e = calx.parse("x^2 + y");
    assertThat(calx.evaluateNum(e, ImmutableMap.of("x", 3, "y", Num.of(1))),
        is(Num.of(10)));
    // A binding may be an expression, which is evaluated in turn
    assertThat(
        calx.evaluate(e,
            ImmutableMap.of("x", calx.parse("y + 1"), "y", 2)),
        hasToString("11"));
    final EvaluationException ex =
        assertThrows(EvaluationException.class,
            () -> calx.evaluateNum(e, ImmutableMap.of("x", 3)));
    assertThat(ex.getMessage(), is("Unbound variable 'y'"));
  }

  @Test void testTracer() {
    final List<Object> results = new ArrayList<>();
    final Session session = Session.create()
        .withTracer(Tracers.withOnResult(Tracers.empty(), results::add));
    final Calx calx = new Calx(session);
    calx.evaluate("6 * 7");
    assertThat(results, hasToString("[42]"));
  }
}

// End EvaluatorTest.java
