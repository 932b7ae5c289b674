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

import net.hydromatic.calx.ast.Ast;
import net.hydromatic.calx.ast.Op;
import net.hydromatic.calx.num.Num;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for {@link Polynomial}. */
public abstract class Polynomials {
  /** Largest exponent that {@link #toPolynomial} will expand. */
  private static final int MAX_POWER = 64;

  private Polynomials() {}

  /**
   * Converts an expression to a polynomial in a given variable, or returns
   * null if it is not one.
   *
   * <p>The expression may contain numeric literals, the variable, sums,
   * differences, products, quotients by a constant, non-negative integer
   * powers, negation, parentheses, and polynomials in the same variable. Any
   * other identifier makes the result null, because the coefficients of a
   * {@link Polynomial} are numbers.
   */
  public static @Nullable Polynomial toPolynomial(Ast.Exp exp,
      String variable) {
    switch (exp.op) {
      case NUMBER:
        return Polynomial.constant(variable, ((Ast.Literal) exp).num());

      case ID:
        return ((Ast.Id) exp).name.equals(variable)
            ? Polynomial.monomial(variable, Num.ONE, 1)
            : null;

      case POLYNOMIAL:
        final Polynomial p = ((Ast.PolynomialExp) exp).polynomial;
        return p.variable.equals(variable) ? p : null;

      case GROUP:
        return toPolynomial(((Ast.Group) exp).exp, variable);

      case NEGATE:
        final Polynomial a = toPolynomial(((Ast.Unary) exp).a, variable);
        return a == null ? null : a.negate();

      case POSITIVE:
        return toPolynomial(((Ast.Unary) exp).a, variable);

      case PLUS:
      case MINUS:
      case TIMES:
      case DIVIDE:
      case POWER:
        return binary((Ast.InfixCall) exp, variable);

      default:
        return null;
    }
  }

  private static @Nullable Polynomial binary(Ast.InfixCall call,
      String variable) {
    final Polynomial p0 = toPolynomial(call.a0, variable);
    if (p0 == null) {
      return null;
    }
    if (call.op == Op.POWER) {
      if (!call.a1.isNumber()) {
        return null;
      }
      final Num n = ((Ast.Literal) call.a1).num();
      if (!n.isIntegral() || n.isNegative()
          || n.compareTo(Num.of(MAX_POWER)) > 0) {
        return null;
      }
      return p0.pow(n.intValueExact());
    }
    final Polynomial p1 = toPolynomial(call.a1, variable);
    if (p1 == null) {
      return null;
    }
    switch (call.op) {
      case PLUS:
        return p0.plus(p1);
      case MINUS:
        return p0.minus(p1);
      case TIMES:
        return p0.times(p1);
      default:
        // DIVIDE; only by a non-zero constant
        if (p1.degree() != 0 || p1.isZero()) {
          return null;
        }
        return p0.times(Num.ONE.divide(p1.coefficient(0)));
    }
  }
}

// End Polynomials.java
