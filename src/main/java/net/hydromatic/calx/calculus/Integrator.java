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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.calx.ast.AstBuilder.ast;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.calx.ast.Ast;
import net.hydromatic.calx.ast.Op;
import net.hydromatic.calx.eval.Prop;
import net.hydromatic.calx.eval.Session;
import net.hydromatic.calx.num.Num;
import net.hydromatic.calx.poly.Polynomial;
import net.hydromatic.calx.poly.Polynomials;
import net.hydromatic.calx.rewrite.FreeFinder;
import net.hydromatic.calx.rewrite.Simplifier;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Symbolic integration.
 *
 * <p>Integration is partial. It handles constants, polynomials, sums,
 * constant factors, quotients whose numerator is a multiple of the
 * derivative of the denominator, quotients of polynomials (by long division
 * and by partial fractions over distinct real roots), functions of a linear
 * argument, exponentials with a constant base, and some products by
 * integration by parts. The constant of integration is zero.
 */
public class Integrator {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(Integrator.class);

  private final Session session;
  private final Simplifier simplifier;
  private final Differentiator differentiator;
  private final int maxDepth;

  /** Creates an Integrator. */
  public Integrator(Session session) {
    this(session, new Simplifier(session));
  }

  /** Creates an Integrator that uses a given simplifier. */
  public Integrator(Session session, Simplifier simplifier) {
    this.session = requireNonNull(session);
    this.simplifier = requireNonNull(simplifier);
    this.differentiator = new Differentiator(session, simplifier);
    this.maxDepth = Prop.INTEGRATION_DEPTH.intValue(session.map);
  }

  /**
   * Integrates an expression with respect to a variable.
   *
   * <p>If no rule applies, returns the expression unchanged. A caller can
   * therefore detect an expression that could not be integrated by
   * comparing the result with the argument.
   *
   * @param exp Expression
   * @param variable Variable, or null to use the expression's only free
   *   variable or {@link Prop#DEFAULT_VARIABLE}
   * @return Simplified integral, or {@code exp}
   */
  public Ast.Exp integrate(Ast.Exp exp, @Nullable String variable) {
    final String v = variable != null
        ? variable
        : Differentiator.defaultVariable(session, exp);
    final Ast.Exp e = simplifier.simplify(exp);
    final Ast.Exp integral;
    try {
      integral = integrate(e, v, 0);
    } catch (UnsupportedTransformException ex) {
      LOGGER.debug("Cannot integrate '{}': {}", exp, ex.getMessage());
      return exp;
    }
    if (integral == null) {
      LOGGER.debug("No rule to integrate '{}' with respect to {}", exp, v);
      return exp;
    }
    return simplifier.simplify(integral);
  }

  /** Integrates a simplified expression, or returns null. */
  private Ast.@Nullable Exp integrate(Ast.Exp e, String v, int depth) {
    final Ast.Id x = ast.id(v);
    if (!FreeFinder.contains(e, v)) {
      return ast.times(e, x);
    }
    final Polynomial p = Polynomials.toPolynomial(e, v);
    if (p != null) {
      LOGGER.debug("Integrating polynomial {}", p);
      return p.integralExp();
    }
    switch (e.op) {
      case GROUP:
        return integrate(((Ast.Group) e).exp, v, depth);
      case PLUS:
      case MINUS:
        final Ast.InfixCall sum = (Ast.InfixCall) e;
        final Ast.Exp i0 = integrate(sum.a0, v, depth);
        final Ast.Exp i1 = integrate(sum.a1, v, depth);
        return i0 == null || i1 == null
            ? null
            : ast.infixCall(e.op, i0, i1);
      case NEGATE:
        final Ast.Exp i = integrate(((Ast.Unary) e).a, v, depth);
        return i == null ? null : ast.negate(i);
      case TIMES:
        return product((Ast.InfixCall) e, v, depth);
      case DIVIDE:
        return quotient((Ast.InfixCall) e, v, depth);
      case POWER:
        return power((Ast.InfixCall) e, v);
      case APPLY:
        return apply((Ast.Apply) e, v);
      case POLYNOMIAL:
        final Polynomial polynomial = ((Ast.PolynomialExp) e).polynomial;
        return ast.polynomial(polynomial.integral());
      default:
        return null;
    }
  }

  /** Integrates a product: takes out constant factors, then tries
   * integration by parts. */
  private Ast.@Nullable Exp product(Ast.InfixCall e, String v, int depth) {
    final List<Ast.Exp> constants = new ArrayList<>();
    final List<Ast.Exp> factors = new ArrayList<>();
    flattenProduct(e, v, constants, factors);
    if (!constants.isEmpty()) {
      final Ast.Exp rest = simplifier.simplify(ast.product(factors));
      final Ast.Exp i = integrate(rest, v, depth);
      return i == null ? null : ast.times(ast.product(constants), i);
    }
    if (depth >= maxDepth) {
      return null;
    }
    // Integration by parts, taking the operand of lower rank as u first
    final boolean swap = partsRank(e.a1, v) < partsRank(e.a0, v);
    final Ast.Exp u = swap ? e.a1 : e.a0;
    final Ast.Exp dv = swap ? e.a0 : e.a1;
    final Ast.Exp first = byParts(u, dv, v, depth);
    if (first != null) {
      return first;
    }
    return byParts(dv, u, v, depth);
  }

  /** Ranks a factor as the choice of {@code u} in integration by parts;
   * lower is better. Logarithms come first, then inverse trigonometric
   * functions, polynomials, trigonometric functions, and last exponentials
   * and everything else. */
  static int partsRank(Ast.Exp e, String v) {
    if (e.op == Op.APPLY) {
      switch (((Ast.Apply) e).name) {
        case "ln":
        case "log":
          return 0;
        case "asin":
        case "acos":
        case "atan":
          return 1;
        case "sin":
        case "cos":
        case "tan":
        case "sinh":
        case "cosh":
          return 3;
        default:
          return 4;
      }
    }
    return Polynomials.toPolynomial(e, v) != null ? 2 : 4;
  }

  private static void flattenProduct(Ast.Exp e, String v,
      List<Ast.Exp> constants, List<Ast.Exp> factors) {
    if (e.op == Op.TIMES) {
      final Ast.InfixCall times = (Ast.InfixCall) e;
      flattenProduct(times.a0, v, constants, factors);
      flattenProduct(times.a1, v, constants, factors);
    } else if (FreeFinder.contains(e, v)) {
      factors.add(e);
    } else {
      constants.add(e);
    }
  }

  /** Integration by parts: the integral of {@code u dv} is
   * {@code u v} minus the integral of {@code v du}. */
  private Ast.@Nullable Exp byParts(Ast.Exp u, Ast.Exp dv, String v,
      int depth) {
    final Ast.Exp vi = integrate(dv, v, depth + 1);
    if (vi == null) {
      return null;
    }
    final Ast.Exp du = differentiator.differentiate(u, v);
    final Ast.Exp rest = simplifier.simplify(ast.times(vi, du));
    final Ast.Exp ri = integrate(rest, v, depth + 1);
    if (ri == null) {
      return null;
    }
    LOGGER.debug("Integrated by parts with u = {}, dv = {}", u, dv);
    return ast.minus(ast.times(u, vi), ri);
  }

  private Ast.@Nullable Exp quotient(Ast.InfixCall e, String v, int depth) {
    final Ast.Exp n = e.a0;
    final Ast.Exp d = e.a1;
    if (!FreeFinder.contains(d, v)) {
      final Ast.Exp i = integrate(n, v, depth);
      return i == null ? null : ast.divide(i, d);
    }
    // f' / f = ln(f), times a constant
    final Ast.Exp dd = differentiator.differentiate(d, v);
    if (!dd.isNumber(0)) {
      final Ast.Exp ratio = simplifier.simplify(ast.divide(n, dd));
      if (!FreeFinder.contains(ratio, v)) {
        LOGGER.debug("Integrating '{}' as a logarithm", e);
        return ast.times(ratio, ast.apply("ln", d));
      }
    }
    final Polynomial pn = Polynomials.toPolynomial(n, v);
    final Polynomial pd = Polynomials.toPolynomial(d, v);
    if (pn != null && pd != null && pd.degree() > 0) {
      if (pn.degree() >= pd.degree()) {
        return longDivision(pn, pd, v, depth);
      }
      return partialFractions(pn, pd, v);
    }
    // c / f^n = c * f^-n
    if (!FreeFinder.contains(n, v)
        && d.op == Op.POWER
        && !FreeFinder.contains(((Ast.InfixCall) d).a1, v)) {
      final Ast.InfixCall power = (Ast.InfixCall) d;
      final Ast.Exp i =
          power(ast.power(power.a0, ast.negate(power.a1)), v);
      return i == null ? null : ast.times(n, i);
    }
    return null;
  }

  private Ast.@Nullable Exp longDivision(Polynomial n, Polynomial d,
      String v, int depth) {
    final Polynomial.Division division = n.divide(d);
    LOGGER.debug("Dividing {} by {}", n, d);
    final Ast.Exp q = division.quotient.integralExp();
    if (division.remainder.isZero()) {
      return q;
    }
    final Ast.Exp r = integrate(
        simplifier.simplify(
            ast.divide(division.remainder.toExp(), d.toExp())),
        v, depth);
    return r == null ? null : ast.plus(q, r);
  }

  /** Integrates {@code n / d} where the degree of {@code n} is less than
   * that of {@code d} and {@code d} has distinct real roots
   * {@code r[i]}; the integral is the sum of
   * {@code n(r[i]) / d'(r[i]) * ln(x - r[i])}. */
  private Ast.@Nullable Exp partialFractions(Polynomial n, Polynomial d,
      String v) {
    final List<Num> roots;
    try {
      roots = d.roots(Prop.MAX_ITERATIONS.intValue(session.map),
          session.tolerance());
    } catch (ArithmeticException e) {
      LOGGER.debug("Cannot find roots of {}: {}", d, e.getMessage());
      return null;
    }
    final double tolerance = Math.sqrt(session.tolerance());
    for (int i = 0; i < roots.size(); i++) {
      if (!roots.get(i).isReal()) {
        return null;
      }
      for (int j = 0; j < i; j++) {
        if (roots.get(i).closeTo(roots.get(j), tolerance)) {
          return null;
        }
      }
    }
    final Polynomial dd = d.derivative();
    final List<Ast.Exp> terms = new ArrayList<>();
    for (Num root : roots) {
      final Num a = n.evaluate(root).divide(dd.evaluate(root));
      terms.add(
          ast.times(ast.number(a),
              ast.apply("ln", ast.minus(ast.id(v), ast.number(root)))));
    }
    LOGGER.debug("Partial fractions of {} / {} over roots {}", n, d, roots);
    return ast.sum(terms);
  }

  /** Integrates a power. */
  private Ast.@Nullable Exp power(Ast.InfixCall e, String v) {
    final Ast.Exp base = e.a0;
    final Ast.Exp exponent = e.a1;
    if (!FreeFinder.contains(exponent, v)) {
      // (a x + b)^n
      final Ast.Exp a = linearCoefficient(base, v);
      if (a == null) {
        return null;
      }
      final Ast.Exp n1 = simplifier.simplify(
          ast.plus(exponent, ast.number(1)));
      if (n1.isNumber(0)) {
        return ast.divide(ast.apply("ln", base), a);
      }
      return ast.divide(ast.power(base, n1), ast.times(n1, a));
    }
    if (!FreeFinder.contains(base, v)) {
      // b^(a x + c)
      final Ast.Exp a = linearCoefficient(exponent, v);
      if (a == null) {
        return null;
      }
      final Ast.Exp ln =
          base.op == Op.ID && ((Ast.Id) base).name.equals("e")
              ? a
              : ast.times(ast.apply("ln", base), a);
      return ast.divide(e, ln);
    }
    return null;
  }

  /** Integrates a function of a linear argument. */
  private Ast.@Nullable Exp apply(Ast.Apply e, String v) {
    if (e.args.size() != 1) {
      return null;
    }
    final Ast.Exp u = e.arg();
    final Ast.Exp a = linearCoefficient(u, v);
    if (a == null) {
      return null;
    }
    final Ast.Exp i;
    switch (e.name) {
      case "sin":
        return trig(ast.negate(ast.apply("cos", u)), a);
      case "cos":
        return trig(ast.apply("sin", u), a);
      case "tan":
        return trig(ast.negate(ast.apply("ln", ast.apply("cos", u))), a);
      case "exp":
        i = e;
        break;
      case "sinh":
        i = ast.apply("cosh", u);
        break;
      case "cosh":
        i = ast.apply("sinh", u);
        break;
      case "sqrt":
        // (2/3) u^(3/2)
        i = ast.divide(ast.times(ast.number(2), ast.power(u,
            ast.number(1.5d))), ast.number(3));
        break;
      case "ln":
        i = ast.minus(ast.times(u, e), u);
        break;
      default:
        return null;
    }
    return ast.divide(i, a);
  }

  /** Integral of a trigonometric function with a linear argument, scaled
   * if angles are in degrees. */
  private Ast.Exp trig(Ast.Exp i, Ast.Exp a) {
    if (session.angleUnit() == Prop.AngleUnit.DEGREES) {
      return ast.divide(i, ast.times(ast.number(Math.PI / 180d), a));
    }
    return ast.divide(i, a);
  }

  /** If an expression is linear in a variable, returns its (non-zero)
   * coefficient; otherwise null. */
  private Ast.@Nullable Exp linearCoefficient(Ast.Exp e, String v) {
    final Ast.Exp d = differentiator.differentiate(e, v);
    if (FreeFinder.contains(d, v) || d.isNumber(0)) {
      return null;
    }
    return d;
  }
}

// End Integrator.java
