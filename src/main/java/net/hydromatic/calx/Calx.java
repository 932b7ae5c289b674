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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.calx.ast.Ast;
import net.hydromatic.calx.calculus.Differentiator;
import net.hydromatic.calx.calculus.Integrator;
import net.hydromatic.calx.calculus.Series;
import net.hydromatic.calx.eval.Evaluator;
import net.hydromatic.calx.eval.Session;
import net.hydromatic.calx.num.Num;
import net.hydromatic.calx.parse.CalxParser;
import net.hydromatic.calx.rewrite.Expander;
import net.hydromatic.calx.rewrite.Replacer;
import net.hydromatic.calx.rewrite.Simplifier;
import net.hydromatic.calx.solve.Solver;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Entry point to the expression engine.
 *
 * <p>A {@code Calx} parses, evaluates and transforms expressions using the
 * settings of a {@link Session}. It is immutable; to change a setting,
 * create a new {@code Calx} from a new session.
 *
 * <pre>{@code
 * Calx calx = Calx.create();
 * Ast.Exp e = calx.parse("x^2 - 9");
 * calx.solve(e, "x");                // [3, -3]
 * calx.differentiate(e, "x");        // 2 * x
 * }</pre>
 */
public class Calx {
  private final Session session;
  private final CalxParser parser;
  private final Simplifier simplifier;
  private final Evaluator evaluator;
  private final Differentiator differentiator;
  private final Integrator integrator;
  private final Series series;
  private final Solver solver;

  /** Creates a Calx with a given session. */
  public Calx(Session session) {
    this.session = requireNonNull(session);
    this.parser = new CalxParser(session);
    this.simplifier = new Simplifier(session);
    this.evaluator = new Evaluator(session, simplifier);
    this.differentiator = new Differentiator(session, simplifier);
    this.integrator = new Integrator(session, simplifier);
    this.series = new Series(session, simplifier);
    this.solver = new Solver(session, simplifier);
  }

  /** Creates a Calx with default settings. */
  public static Calx create() {
    return new Calx(Session.create());
  }

  public Session session() {
    return session;
  }

  /** Parses an expression.
   *
   * @throws net.hydromatic.calx.parse.CalxParseException if the text is not
   *   a valid expression */
  public Ast.Exp parse(String text) {
    return parser.parse(text);
  }

  /** Evaluates an expression; unbound variables remain symbolic. */
  public @Nullable Object evaluate(Ast.Exp exp) {
    return evaluator.evaluate(exp);
  }

  /** Evaluates an expression with variable bindings. */
  public @Nullable Object evaluate(Ast.Exp exp, Map<String, ?> bindings) {
    return evaluator.evaluate(exp, bindings);
  }

  /** Evaluates an expression to a number. All variables must be bound. */
  public Num evaluateNum(Ast.Exp exp, Map<String, ?> bindings) {
    return evaluator.evaluateNum(exp, bindings);
  }

  /** Parses and evaluates an expression. */
  public @Nullable Object evaluate(String text) {
    return evaluate(parse(text), ImmutableMap.of());
  }

  public Ast.Exp simplify(Ast.Exp exp) {
    return simplifier.simplify(exp);
  }

  /** Expands products and powers of sums, without simplifying. */
  public Ast.Exp expand(Ast.Exp exp) {
    return Expander.expand(exp);
  }

  /** Replaces every occurrence of {@code target} in an expression with
   * {@code replacement}. */
  public Ast.Exp substitute(Ast.Exp exp, Ast.Exp target,
      Ast.Exp replacement) {
    return Replacer.replace(exp, target, replacement);
  }

  /** Returns the simplified derivative.
   *
   * @see Differentiator#differentiate */
  public Ast.Exp differentiate(Ast.Exp exp, @Nullable String variable) {
    return differentiator.differentiate(exp, variable);
  }

  /** Returns the simplified integral, or the expression unchanged if it
   * cannot be integrated.
   *
   * @see Integrator#integrate */
  public Ast.Exp integrate(Ast.Exp exp, @Nullable String variable) {
    return integrator.integrate(exp, variable);
  }

  /** Returns the roots of an equation.
   *
   * @see Solver#solve */
  public List<Num> solve(Ast.Exp equation, @Nullable String variable) {
    return solver.solve(equation, variable);
  }

  /** Isolates a variable in an equation.
   *
   * @see Solver#isolate */
  public Ast.Exp isolate(Ast.Exp equation, String variable) {
    return solver.isolate(equation, variable);
  }

  public Map<String, Num> solveSystem(List<Ast.Exp> equations,
      List<String> variables) {
    return solver.solveSystem(equations, variables);
  }

  public Ast.Exp taylor(Ast.Exp exp, String variable, Num point, int order) {
    return series.taylor(exp, variable, point, order);
  }

  public Ast.Exp maclaurin(Ast.Exp exp, String variable, int order) {
    return series.maclaurin(exp, variable, order);
  }

  public Num limit(Ast.Exp exp, String variable, Num point) {
    return series.limit(exp, variable, point);
  }
}

// End Calx.java
