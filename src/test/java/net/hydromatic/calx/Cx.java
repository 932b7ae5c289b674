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
package net.hydromatic.calx;

import static net.hydromatic.calx.Matchers.isAst;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.calx.ast.Ast;
import net.hydromatic.calx.ast.Op;
import net.hydromatic.calx.eval.EvaluationException;
import net.hydromatic.calx.eval.Prop;
import net.hydromatic.calx.eval.Session;
import net.hydromatic.calx.num.Num;
import net.hydromatic.calx.parse.CalxParseException;
import net.hydromatic.calx.util.Tracer;
import net.hydromatic.calx.util.Tracers;
import org.hamcrest.Matcher;

/** Fluent test helper for an expression. */
public class Cx {
  /** Points at which expressions are compared numerically. They are
   * positive so that {@code ln} and {@code sqrt} are defined, and avoid
   * {@code 1} and {@code -1}, which are often poles. */
  private static final double[] SAMPLES = {0.3, 0.7, 1.3, 2.1};

  private final String text;
  private final Map<Prop, Object> propMap;
  private final Tracer tracer;

  private Cx(String text, Map<Prop, Object> propMap, Tracer tracer) {
    this.text = text;
    this.propMap = ImmutableMap.copyOf(propMap);
    this.tracer = tracer;
  }

  /** Creates a fixture for an expression. */
  public static Cx cx(String text) {
    return new Cx(text, ImmutableMap.of(), Tracers.empty());
  }

  /** Returns a fixture with a given value of a property. */
  public Cx withProp(Prop prop, Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(propMap);
    prop.set(map, value);
    return new Cx(text, map, tracer);
  }

  /** Returns a fixture with a given tracer. */
  public Cx withTracer(Tracer tracer) {
    return new Cx(text, propMap, tracer);
  }

  public Calx calx() {
    return new Calx(new Session(propMap, tracer));
  }

  public Ast.Exp parse() {
    return calx().parse(text);
  }

  /** Checks that the expression parses and unparses to a given string. */
  public Cx assertParse(String expected) {
    assertThat(parse(), isAst(expected));
    return this;
  }

  /** Checks that the expression parses to a given tree. */
  public Cx assertParse(Ast.Exp expected) {
    assertThat(parse(), is(expected));
    return this;
  }

  /** Checks that parsing fails with a given description, which includes
   * the position. */
  public Cx assertParseError(String expected) {
    final CalxParseException e =
        assertThrows(CalxParseException.class, this::parse);
    assertThat(Matchers.describe(e), is(expected));
    return this;
  }

  /** Checks that the expression simplifies to a given string, and that
   * simplifying again has no effect. */
  public Cx assertSimplify(String expected) {
    final Calx calx = calx();
    final Ast.Exp e = calx.simplify(calx.parse(text));
    assertThat(e, isAst(expected));
    assertThat(calx.simplify(e), is(e));
    return this;
  }

  /** Checks that the simplified expansion of the expression is a given
   * string. */
  public Cx assertExpand(String expected) {
    final Calx calx = calx();
    assertThat(calx.simplify(calx.expand(calx.parse(text))),
        isAst(expected));
    return this;
  }

  /** Checks the value of the expression. */
  public Cx assertEval(Matcher<Object> matcher) {
    assertThat(calx().evaluate(text), matcher);
    return this;
  }

  /** Checks that evaluation fails with a given message. */
  public Cx assertEvalError(Matcher<String> matcher) {
    final EvaluationException e =
        assertThrows(EvaluationException.class, () -> calx().evaluate(text));
    assertThat(e.getMessage(), matcher);
    return this;
  }

  /** Checks the simplified derivative with respect to {@code x}. */
  public Cx assertDerivative(String expected) {
    final Calx calx = calx();
    assertThat(calx.differentiate(calx.parse(text), "x"), isAst(expected));
    return this;
  }

  /** Checks that the derivative with respect to {@code x} agrees with a
   * central difference at each sample point. */
  public Cx assertDerivativeNumerically() {
    final Calx calx = calx();
    final Ast.Exp f = calx.parse(text);
    final Ast.Exp df = calx.differentiate(f, "x");
    final double h = 1e-5;
    for (double x : SAMPLES) {
      final double expected =
          (value(calx, f, x + h) - value(calx, f, x - h)) / (2 * h);
      assertThat("derivative " + df + " at " + x,
          Num.of(value(calx, df, x)).closeTo(Num.of(expected), 1e-4),
          is(true));
    }
    return this;
  }

  /** Checks the simplified integral with respect to {@code x}. */
  public Cx assertIntegral(String expected) {
    final Calx calx = calx();
    assertThat(calx.integrate(calx.parse(text), "x"), isAst(expected));
    return this;
  }

  /** Checks that the expression can be integrated with respect to
   * {@code x}, and that the derivative of the integral is numerically equal
   * to the expression at each sample point. */
  public Cx assertIntegralDifferentiates() {
    final Calx calx = calx();
    final Ast.Exp f = calx.parse(text);
    final Ast.Exp integral = calx.integrate(f, "x");
    assertThat("no rule to integrate " + f, integral == f, is(false));
    final Ast.Exp df = calx.differentiate(integral, "x");
    for (double x : SAMPLES) {
      assertThat("derivative of " + integral + " at " + x,
          Num.of(value(calx, df, x))
              .closeTo(Num.of(value(calx, f, x)), 1e-6),
          is(true));
    }
    return this;
  }

  /** Checks the roots of the expression, or equation, for {@code x}, and
   * that each makes the expression zero. */
  public Cx assertSolve(Matcher<? super List<Num>> matcher) {
    final Calx calx = calx();
    final Ast.Exp e = calx.parse(text);
    final List<Num> roots = calx.solve(e, "x");
    assertThat(roots, matcher);
    final Ast.Exp zero = e.op == Op.EQ
        ? calx.parse("(" + text.replace("==", ") - (") + ")")
        : e;
    for (Num root : roots) {
      final Num value = calx.evaluateNum(zero, ImmutableMap.of("x", root));
      assertThat("residual at " + root, value.closeTo(Num.ZERO, 1e-6),
          is(true));
    }
    return this;
  }

  private static double value(Calx calx, Ast.Exp e, double x) {
    return calx.evaluateNum(e, ImmutableMap.of("x", Num.of(x)))
        .doubleValue();
  }
}

// End Cx.java
