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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.calx.ast.AstBuilder.ast;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.calx.ast.Ast;
import net.hydromatic.calx.eval.EvaluationException;
import net.hydromatic.calx.eval.Evaluator;
import net.hydromatic.calx.eval.Session;
import net.hydromatic.calx.num.Num;
import net.hydromatic.calx.rewrite.Simplifier;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Power series and limits. */
public class Series {
  private static final Logger LOGGER = LoggerFactory.getLogger(Series.class);

  /** Largest and smallest steps used to estimate a limit. */
  private static final double MAX_STEP = 1e-2;
  private static final double MIN_STEP = 1e-8;

  /** Two one-sided limits agree if they are this close. */
  private static final double AGREEMENT = 1e-4;

  private final Simplifier simplifier;
  private final Differentiator differentiator;
  private final Evaluator evaluator;

  public Series(Session session) {
    this(session, new Simplifier(session));
  }

  public Series(Session session, Simplifier simplifier) {
    this.simplifier = requireNonNull(simplifier);
    this.differentiator = new Differentiator(session, simplifier);
    this.evaluator = new Evaluator(session, simplifier);
  }

  /**
   * Returns the Taylor polynomial of an expression about a point.
   *
   * <p>The {@code k}th term is {@code f_k(a) / k! * (x - a)^k}, where
   * {@code f_k} is the {@code k}th derivative.
   *
   * @param exp Expression
   * @param variable Variable
   * @param point Point {@code a} about which to expand
   * @param order Highest power in the result
   * @throws EvaluationException if a derivative cannot be evaluated at the
   *   point, for example {@code ln(x)} at 0
   */
  public Ast.Exp taylor(Ast.Exp exp, String variable, Num point,
      int order) {
    checkArgument(order >= 0, "order must be non-negative: %s", order);
    final Ast.Exp offset = point.isZero()
        ? ast.id(variable)
        : ast.minus(ast.id(variable), ast.number(point));
    final List<Ast.Exp> terms = new ArrayList<>();
    Ast.Exp f = exp;
    Num factorial = Num.ONE;
    for (int k = 0; k <= order; k++) {
      if (k > 0) {
        f = differentiator.differentiate(f, variable);
        factorial = factorial.times(Num.of(k));
      }
      final Num c =
          evaluator.evaluateNum(f, variable, point).divide(factorial);
      if (c.isZero()) {
        continue;
      }
      terms.add(
          ast.times(ast.number(c.toIntegerIfWhole()),
              ast.power(offset, ast.number(k))));
    }
    return simplifier.simplify(ast.sum(terms));
  }

  /** Returns the Taylor polynomial of an expression about zero. */
  public Ast.Exp maclaurin(Ast.Exp exp, String variable, int order) {
    return taylor(exp, variable, Num.ZERO, order);
  }

  /**
   * Estimates the limit of an expression as a variable approaches a point.
   *
   * <p>If the expression can be evaluated at the point, returns its value.
   * Otherwise evaluates at {@code a - h} and {@code a + h} for steps
   * {@code h} from 1e-2 down to 1e-8, and takes the value at the smallest
   * step at which the expression can be evaluated. A value that is within
   * 1e-6 of an integer is returned as that integer.
   *
   * @throws EvaluationException if the two one-sided limits differ, or
   *   cannot be estimated
   */
  public Num limit(Ast.Exp exp, String variable, Num point) {
    final Num direct = evaluateOrNull(exp, variable, point);
    if (direct != null && direct.isReal()
        && Double.isFinite(direct.doubleValue())) {
      return direct;
    }
    final double a = point.doubleValue();
    Num left = null;
    Num right = null;
    for (double h = MAX_STEP; h >= MIN_STEP * 0.5d; h /= 10d) {
      final Num l = evaluateOrNull(exp, variable, Num.of(a - h));
      final Num r = evaluateOrNull(exp, variable, Num.of(a + h));
      if (l != null && r != null) {
        left = l;
        right = r;
      }
    }
    if (left == null || right == null) {
      throw new EvaluationException("Cannot estimate the limit of '" + exp
          + "' as " + variable + " approaches " + point, exp.pos);
    }
    LOGGER.debug("Limit of '{}' at {}: left {}, right {}", exp, point, left,
        right);
    if (!left.closeTo(right, AGREEMENT)) {
      throw new EvaluationException("Limit of '" + exp + "' as " + variable
          + " approaches " + point + " does not exist: left limit " + left
          + ", right limit " + right, exp.pos);
    }
    final double d = (left.doubleValue() + right.doubleValue()) / 2d;
    final double rounded = Math.rint(d);
    return Math.abs(d - rounded) < 1e-6
        ? Num.of(rounded).toIntegerIfWhole()
        : Num.of(d);
  }

  private @Nullable Num evaluateOrNull(Ast.Exp exp, String variable,
      Num value) {
    try {
      return evaluator.evaluateNum(exp, variable, value);
    } catch (EvaluationException e) {
      LOGGER.trace("Cannot evaluate '{}' at {} = {}: {}", exp, variable,
          value, e.getMessage());
      return null;
    }
  }
}

// End Series.java
