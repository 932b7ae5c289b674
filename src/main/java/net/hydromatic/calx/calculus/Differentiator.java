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

import java.util.SortedSet;
import net.hydromatic.calx.ast.Ast;
import net.hydromatic.calx.ast.Op;
import net.hydromatic.calx.eval.Functions;
import net.hydromatic.calx.eval.Prop;
import net.hydromatic.calx.eval.Session;
import net.hydromatic.calx.rewrite.FreeFinder;
import net.hydromatic.calx.rewrite.Simplifier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Symbolic differentiation.
 *
 * <p>Applies the sum, product and quotient rules, the power rule (with a
 * constant exponent, a constant base, or by logarithmic differentiation if
 * both base and exponent vary), and the chain rule through the built-in
 * functions. The result is simplified.
 *
 * <p>If {@link Prop#ANGLE_UNIT} is {@code DEGREES}, the derivatives of
 * trigonometric functions carry a factor of pi / 180, and those of inverse
 * trigonometric functions a factor of 180 / pi.
 */
public class Differentiator {
  private final Session session;
  private final Simplifier simplifier;

  /** Creates a Differentiator. */
  public Differentiator(Session session) {
    this(session, new Simplifier(session));
  }

  /** Creates a Differentiator that uses a given simplifier. */
  public Differentiator(Session session, Simplifier simplifier) {
    this.session = requireNonNull(session);
    this.simplifier = requireNonNull(simplifier);
  }

  /** Returns the variable of an expression: its only free variable, if it
   * has exactly one, otherwise the value of
   * {@link Prop#DEFAULT_VARIABLE}. */
  public static String defaultVariable(Session session, Ast.Exp exp) {
    final SortedSet<String> variables = FreeFinder.freeVariables(exp);
    return variables.size() == 1
        ? variables.first()
        : Prop.DEFAULT_VARIABLE.stringValue(session.map);
  }

  /** Differentiates an expression with respect to a variable.
   *
   * @param exp Expression
   * @param variable Variable, or null to use
   *   {@link #defaultVariable(Session, Ast.Exp)}
   * @return Simplified derivative
   * @throws UnsupportedTransformException if the expression contains a
   *   construct that cannot be differentiated, such as a comparison or a
   *   call to {@code fact} */
  public Ast.Exp differentiate(Ast.Exp exp, @Nullable String variable) {
    final String v =
        variable != null ? variable : defaultVariable(session, exp);
    return simplifier.simplify(d(exp, v));
  }

  /** Returns the derivative, not simplified. */
  Ast.Exp d(Ast.Exp e, String v) {
    if (!FreeFinder.contains(e, v)) {
      return ast.number(0);
    }
    switch (e.op) {
      case ID:
        return ast.number(1);
      case GROUP:
        return d(((Ast.Group) e).exp, v);
      case PLUS:
      case MINUS:
        final Ast.InfixCall sum = (Ast.InfixCall) e;
        return ast.infixCall(e.op, d(sum.a0, v), d(sum.a1, v));
      case NEGATE:
        return ast.negate(d(((Ast.Unary) e).a, v));
      case POSITIVE:
        return d(((Ast.Unary) e).a, v);
      case PERCENT:
        return ast.times(ast.number(0.01d), d(((Ast.Unary) e).a, v));
      case TIMES:
        final Ast.InfixCall times = (Ast.InfixCall) e;
        if (!FreeFinder.contains(times.a0, v)) {
          return ast.times(times.a0, d(times.a1, v));
        }
        if (!FreeFinder.contains(times.a1, v)) {
          return ast.times(d(times.a0, v), times.a1);
        }
        return ast.plus(ast.times(d(times.a0, v), times.a1),
            ast.times(times.a0, d(times.a1, v)));
      case DIVIDE:
        final Ast.InfixCall divide = (Ast.InfixCall) e;
        if (!FreeFinder.contains(divide.a1, v)) {
          return ast.divide(d(divide.a0, v), divide.a1);
        }
        return ast.divide(
            ast.minus(ast.times(d(divide.a0, v), divide.a1),
                ast.times(divide.a0, d(divide.a1, v))),
            ast.power(divide.a1, ast.number(2)));
      case POWER:
        return power((Ast.InfixCall) e, v);
      case APPLY:
        return apply((Ast.Apply) e, v);
      case IF:
        // Piecewise; at a boundary, the branch chosen there
        final Ast.If anIf = (Ast.If) e;
        return ast.ifThenElse(e.pos, anIf.condition, d(anIf.ifTrue, v),
            d(anIf.ifFalse, v));
      case POLYNOMIAL:
        return ast.polynomial(
            ((Ast.PolynomialExp) e).polynomial.derivative());
      default:
        throw new UnsupportedTransformException("Cannot differentiate '"
            + e + "'", e.pos);
    }
  }

  /** Power rule. */
  private Ast.Exp power(Ast.InfixCall e, String v) {
    final Ast.Exp f = e.a0;
    final Ast.Exp g = e.a1;
    if (!FreeFinder.contains(g, v)) {
      // d(f^n) = n * f^(n - 1) * df
      return ast.times(
          ast.times(g, ast.power(f, ast.minus(g, ast.number(1)))),
          d(f, v));
    }
    if (!FreeFinder.contains(f, v)) {
      // d(a^g) = a^g * ln(a) * dg
      return ast.times(ast.times(e, ln(f)), d(g, v));
    }
    // d(f^g) = f^g * (dg * ln(f) + g * df / f)
    return ast.times(e,
        ast.plus(ast.times(d(g, v), ln(f)),
            ast.divide(ast.times(g, d(f, v)), f)));
  }

  /** Chain rule through a function call. */
  private Ast.Exp apply(Ast.Apply e, String v) {
    if (e.name.equals("log") && e.args.size() == 2) {
      // log(b, u) = ln(u) / ln(b)
      return d(ast.divide(ln(e.args.get(1)), ln(e.args.get(0))), v);
    }
    final Functions.BuiltIn f = Functions.lookup(e.name);
    if (f == null || e.args.size() != 1) {
      throw new UnsupportedTransformException("Cannot differentiate '"
          + e + "'", e.pos);
    }
    final Ast.Exp u = e.arg();
    final Ast.Exp outer = outer(f, e, u);
    return ast.times(outer, d(u, v));
  }

  /** Returns the derivative of a function with respect to its argument. */
  private Ast.Exp outer(Functions.BuiltIn f, Ast.Apply e, Ast.Exp u) {
    switch (f) {
      case SIN:
        return trig(ast.apply("cos", u));
      case COS:
        return trig(ast.negate(ast.apply("sin", u)));
      case TAN:
        return trig(square(ast.apply("sec", u)));
      case SEC:
        return trig(ast.times(e, ast.apply("tan", u)));
      case CSC:
        return trig(ast.negate(ast.times(e, ast.apply("cot", u))));
      case COT:
        return trig(ast.negate(square(ast.apply("csc", u))));
      case ASIN:
        return inverseTrig(
            ast.divide(ast.number(1), sqrt(ast.minus(ast.number(1),
                square(u)))));
      case ACOS:
        return inverseTrig(
            ast.divide(ast.number(-1), sqrt(ast.minus(ast.number(1),
                square(u)))));
      case ATAN:
        return inverseTrig(
            ast.divide(ast.number(1), ast.plus(ast.number(1), square(u))));
      case SINH:
        return ast.apply("cosh", u);
      case COSH:
        return ast.apply("sinh", u);
      case TANH:
        return ast.minus(ast.number(1), square(e));
      case ASINH:
        return ast.divide(ast.number(1),
            sqrt(ast.plus(square(u), ast.number(1))));
      case ACOSH:
        return ast.divide(ast.number(1),
            sqrt(ast.minus(square(u), ast.number(1))));
      case ATANH:
        return ast.divide(ast.number(1),
            ast.minus(ast.number(1), square(u)));
      case EXP:
        return e;
      case LN:
        return ast.divide(ast.number(1), u);
      case LOG:
      case LOG10:
        return ast.divide(ast.number(1),
            ast.times(u, ln(ast.number(10))));
      case LOG2:
        return ast.divide(ast.number(1),
            ast.times(u, ln(ast.number(2))));
      case SQRT:
        return ast.divide(ast.number(1), ast.times(ast.number(2), e));
      case CBRT:
        return ast.divide(ast.number(1), ast.times(ast.number(3), square(e)));
      case ABS:
        return ast.apply("sign", u);
      case FLOOR:
      case CEIL:
      case ROUND:
      case SIGN:
        // Zero wherever the derivative exists
        return ast.number(0);
      default:
        throw new UnsupportedTransformException("Cannot differentiate '"
            + e + "'", e.pos);
    }
  }

  private Ast.Exp trig(Ast.Exp e) {
    return session.angleUnit() == Prop.AngleUnit.DEGREES
        ? ast.times(ast.number(Math.PI / 180d), e)
        : e;
  }

  private Ast.Exp inverseTrig(Ast.Exp e) {
    return session.angleUnit() == Prop.AngleUnit.DEGREES
        ? ast.times(ast.number(180d / Math.PI), e)
        : e;
  }

  private static Ast.Exp ln(Ast.Exp e) {
    if (e.op == Op.ID && ((Ast.Id) e).name.equals("e")) {
      return ast.number(1);
    }
    return ast.apply("ln", e);
  }

  private static Ast.Exp sqrt(Ast.Exp e) {
    return ast.apply("sqrt", e);
  }

  private static Ast.Exp square(Ast.Exp e) {
    return ast.power(e, ast.number(2));
  }
}

// End Differentiator.java
