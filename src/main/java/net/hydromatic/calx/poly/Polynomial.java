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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.calx.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.calx.ast.Ast;
import net.hydromatic.calx.num.Num;

/**
 * Polynomial in one variable.
 *
 * <p>Coefficients are held densely in ascending order of power, so
 * {@code coefficient(0)} is the constant term. Trailing zero coefficients
 * are removed; the zero polynomial has no coefficients.
 *
 * <p>Instances are immutable.
 */
public class Polynomial {
  /** Default cap on root-finding iterations. */
  public static final int DEFAULT_MAX_ITERATIONS = 1000;

  /** Default convergence tolerance for root finding. */
  public static final double DEFAULT_TOLERANCE = 1e-10;

  public final String variable;
  private final ImmutableList<Num> coefficients;

  private Polynomial(String variable, ImmutableList<Num> coefficients) {
    this.variable = requireNonNull(variable);
    this.coefficients = requireNonNull(coefficients);
  }

  /** Creates a polynomial from coefficients in ascending order of power. */
  public static Polynomial of(String variable, List<Num> coefficients) {
    int n = coefficients.size();
    while (n > 0 && coefficients.get(n - 1).isZero()) {
      --n;
    }
    return new Polynomial(variable,
        ImmutableList.copyOf(coefficients.subList(0, n)));
  }

  /** Creates a polynomial from integer coefficients in ascending order of
   * power; {@code of("x", -9, 0, 1)} is {@code x^2 - 9}. */
  public static Polynomial of(String variable, long... coefficients) {
    final List<Num> list = new ArrayList<>();
    for (long c : coefficients) {
      list.add(Num.of(c));
    }
    return of(variable, list);
  }

  /** Creates a polynomial {@code c * variable^degree}. */
  public static Polynomial monomial(String variable, Num c, int degree) {
    checkArgument(degree >= 0, "negative degree");
    final List<Num> list = new ArrayList<>();
    for (int i = 0; i < degree; i++) {
      list.add(Num.ZERO);
    }
    list.add(c);
    return of(variable, list);
  }

  /** Creates a constant polynomial. */
  public static Polynomial constant(String variable, Num c) {
    return monomial(variable, c, 0);
  }

  /** Returns the degree. The zero polynomial and constants have degree 0. */
  public int degree() {
    return Math.max(0, coefficients.size() - 1);
  }

  /** Whether this is the zero polynomial. */
  public boolean isZero() {
    return coefficients.isEmpty();
  }

  /** Returns the coefficient of {@code variable^i}; zero if {@code i} is
   * greater than the degree. */
  public Num coefficient(int i) {
    checkArgument(i >= 0, "negative power");
    return i < coefficients.size() ? coefficients.get(i) : Num.ZERO;
  }

  /** Returns the coefficients in ascending order of power. */
  public List<Num> coefficients() {
    return coefficients;
  }

  /** Returns the coefficient of the highest power; zero for the zero
   * polynomial. */
  public Num leadingCoefficient() {
    return coefficient(degree());
  }

  /** Evaluates this polynomial at a point, using Horner's method. */
  public Num evaluate(Num x) {
    Num r = Num.ZERO;
    for (int i = coefficients.size() - 1; i >= 0; i--) {
      r = r.times(x).plus(coefficients.get(i));
    }
    return r;
  }

  private void checkVariable(Polynomial o) {
    checkArgument(variable.equals(o.variable) || o.degree() == 0
            || degree() == 0,
        "polynomials in different variables: %s, %s", variable, o.variable);
  }

  private String variable(Polynomial o) {
    return degree() == 0 && o.degree() > 0 ? o.variable : variable;
  }

  public Polynomial plus(Polynomial o) {
    checkVariable(o);
    final int n = Math.max(coefficients.size(), o.coefficients.size());
    final List<Num> list = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      list.add(coefficient(i).plus(o.coefficient(i)));
    }
    return of(variable(o), list);
  }

  public Polynomial negate() {
    return times(Num.MINUS_ONE);
  }

  public Polynomial minus(Polynomial o) {
    return plus(o.negate());
  }

  /** Multiplies by a constant. */
  public Polynomial times(Num c) {
    final List<Num> list = new ArrayList<>();
    for (Num coefficient : coefficients) {
      list.add(coefficient.times(c));
    }
    return of(variable, list);
  }

  public Polynomial times(Polynomial o) {
    checkVariable(o);
    if (isZero() || o.isZero()) {
      return of(variable(o), ImmutableList.of());
    }
    final List<Num> list = new ArrayList<>();
    for (int i = 0; i < coefficients.size() + o.coefficients.size() - 1; i++) {
      list.add(Num.ZERO);
    }
    for (int i = 0; i < coefficients.size(); i++) {
      for (int j = 0; j < o.coefficients.size(); j++) {
        list.set(i + j,
            list.get(i + j)
                .plus(coefficients.get(i).times(o.coefficients.get(j))));
      }
    }
    return of(variable(o), list);
  }

  /** Raises to a non-negative integer power. */
  public Polynomial pow(int n) {
    checkArgument(n >= 0, "negative exponent");
    Polynomial r = constant(variable, Num.ONE);
    for (int i = 0; i < n; i++) {
      r = r.times(this);
    }
    return r;
  }

  /** Divides by another polynomial, returning quotient and remainder.
   *
   * @throws ArithmeticException if the divisor is the zero polynomial */
  public Division divide(Polynomial divisor) {
    if (divisor.isZero()) {
      throw new ArithmeticException("Division by zero polynomial");
    }
    checkVariable(divisor);
    final int dd = divisor.degree();
    if (degree() < dd || isZero()) {
      return new Division(of(variable, ImmutableList.of()), this);
    }
    final List<Num> rem = new ArrayList<>(coefficients);
    final List<Num> quotient = new ArrayList<>();
    for (int i = 0; i <= degree() - dd; i++) {
      quotient.add(Num.ZERO);
    }
    final Num lead = divisor.leadingCoefficient();
    for (int i = degree() - dd; i >= 0; i--) {
      final Num c = rem.get(i + dd).divide(lead);
      quotient.set(i, c);
      for (int j = 0; j <= dd; j++) {
        rem.set(i + j, rem.get(i + j).minus(c.times(divisor.coefficient(j))));
      }
      rem.set(i + dd, Num.ZERO);
    }
    return new Division(of(variable(divisor), quotient),
        of(variable, rem.subList(0, dd)));
  }

  /** Returns the derivative. */
  public Polynomial derivative() {
    final List<Num> list = new ArrayList<>();
    for (int i = 1; i < coefficients.size(); i++) {
      list.add(coefficients.get(i).times(Num.of(i)));
    }
    return of(variable, list);
  }

  /** Returns the antiderivative whose constant term is zero. */
  public Polynomial integral() {
    final List<Num> list = new ArrayList<>();
    list.add(Num.ZERO);
    for (int i = 0; i < coefficients.size(); i++) {
      list.add(coefficients.get(i).divide(Num.of(i + 1)));
    }
    return of(variable, list);
  }

  /** Returns the integral, with constant term zero, as an expression.
   *
   * <p>Unlike {@link #integral()}, keeps each coefficient exact: where the
   * new exponent does not divide an integer coefficient, the term is
   * written as a quotient, {@code 2 * x^3 / 3}. */
  public Ast.Exp integralExp() {
    final List<Ast.Exp> terms = new ArrayList<>();
    for (int i = coefficients.size() - 1; i >= 0; i--) {
      final Num c = coefficients.get(i);
      if (c.isZero()) {
        continue;
      }
      final Num n = Num.of(i + 1);
      final Num q = c.divide(n);
      if (c.kind == Num.Kind.INTEGER && q.kind != Num.Kind.INTEGER) {
        terms.add(ast.divide(term(c, i + 1), ast.number(n)));
      } else {
        terms.add(term(q, i + 1));
      }
    }
    return terms.isEmpty() ? ast.number(0) : ast.sum(terms);
  }

  /** Divides every coefficient by the leading coefficient. */
  public Polynomial monic() {
    if (isZero()) {
      return this;
    }
    final Num lead = leadingCoefficient();
    final List<Num> list = new ArrayList<>();
    for (Num c : coefficients) {
      list.add(c.divide(lead).toIntegerIfWhole());
    }
    return of(variable, list);
  }

  /** Sets coefficients that are within a tolerance of zero to zero, and
   * converts whole floating-point coefficients to integers. */
  Polynomial clean(double tolerance) {
    double scale = 1d;
    for (Num c : coefficients) {
      scale = Math.max(scale, c.abs().doubleValue());
    }
    final List<Num> list = new ArrayList<>();
    for (Num c : coefficients) {
      if (c.abs().doubleValue() <= tolerance * scale) {
        list.add(Num.ZERO);
      } else if (c.kind == Num.Kind.DOUBLE
          && Math.abs(c.doubleValue() - Math.rint(c.doubleValue()))
              <= tolerance * scale) {
        list.add(Num.of(Math.rint(c.doubleValue())).toIntegerIfWhole());
      } else {
        list.add(c);
      }
    }
    return of(variable, list);
  }

  /** Returns all roots, with multiplicity, using default settings. */
  public List<Num> roots() {
    return roots(DEFAULT_MAX_ITERATIONS, DEFAULT_TOLERANCE);
  }

  /**
   * Returns all roots, with multiplicity.
   *
   * <p>Degree 1 and 2 use closed forms, which are exact when the
   * coefficients are integers and the roots are rational. Higher degrees use
   * the Durand-Kerner iteration. A root whose imaginary part is negligible
   * is returned as a real; a real root that is a whole number and satisfies
   * the polynomial is returned as an integer.
   *
   * @throws ArithmeticException if this is the zero polynomial, or the
   *   iteration does not converge within {@code maxIterations}
   */
  public List<Num> roots(int maxIterations, double tolerance) {
    if (isZero()) {
      throw new ArithmeticException("Zero polynomial has infinitely many "
          + "roots");
    }
    final ImmutableList.Builder<Num> roots = ImmutableList.builder();
    // Factor out zero roots exactly
    int k = 0;
    while (coefficients.get(k).isZero()) {
      roots.add(Num.ZERO);
      ++k;
    }
    final Polynomial p =
        of(variable, coefficients.subList(k, coefficients.size()));
    switch (p.degree()) {
      case 0:
        break;
      case 1:
        roots.add(p.coefficient(0).negate().divide(p.coefficient(1)));
        break;
      case 2:
        final Num a = p.coefficient(2);
        final Num b = p.coefficient(1);
        final Num c = p.coefficient(0);
        final Num s = b.times(b).minus(Num.of(4).times(a).times(c)).sqrt();
        final Num twoA = Num.of(2).times(a);
        roots.add(p.clean(b.negate().plus(s).divide(twoA), tolerance));
        roots.add(p.clean(b.negate().minus(s).divide(twoA), tolerance));
        break;
      default:
        for (double[] z
            : RootFinder.durandKerner(p, maxIterations, tolerance)) {
          roots.add(p.clean(z[0], z[1], tolerance));
        }
    }
    return roots.build();
  }

  /** Returns the distinct real roots. */
  public List<Num> realRoots(int maxIterations, double tolerance) {
    final List<Num> list = new ArrayList<>();
    final double eps = Math.sqrt(tolerance);
    for (Num root : roots(maxIterations, tolerance)) {
      if (root.isReal()
          && list.stream().noneMatch(r -> r.closeTo(root, eps))) {
        list.add(root);
      }
    }
    return list;
  }

  private Num clean(Num root, double tolerance) {
    if (root.kind == Num.Kind.INTEGER || root.kind == Num.Kind.PRECISE) {
      return root;
    }
    return clean(root.doubleValue(), root.imaginaryValue(), tolerance);
  }

  /** Converts an approximate complex root into a value. */
  private Num clean(double re, double im, double tolerance) {
    final double eps = Math.sqrt(tolerance);
    final double scale = Math.max(1d, Math.hypot(re, im));
    if (Math.abs(im) > eps * scale) {
      return Num.complex(re, im);
    }
    final double r = Math.rint(re);
    if (Math.abs(re - r) <= eps * scale) {
      final Num whole = Num.of(r).toIntegerIfWhole();
      final Num value = evaluate(whole);
      if (value.isZero() || value.abs().doubleValue() <= tolerance * scale) {
        return whole;
      }
    }
    return Num.of(re);
  }

  /**
   * Factors this polynomial into linear factors {@code (x - r)}, one per
   * root; the leading coefficient is multiplied into the first factor.
   * A polynomial of degree 0 is returned as its only factor.
   */
  public List<Polynomial> factorize() {
    if (degree() == 0) {
      return ImmutableList.of(this);
    }
    final ImmutableList.Builder<Polynomial> factors = ImmutableList.builder();
    boolean first = true;
    for (Num root : roots()) {
      Polynomial factor =
          of(variable, ImmutableList.of(root.negate(), Num.ONE));
      if (first) {
        factor = factor.times(leadingCoefficient());
        first = false;
      }
      factors.add(factor);
    }
    return factors.build();
  }

  /** Returns the monic greatest common divisor, computed by Euclid's
   * algorithm. */
  public Polynomial gcd(Polynomial o) {
    checkVariable(o);
    Polynomial a = clean(DEFAULT_TOLERANCE);
    Polynomial b = o.clean(DEFAULT_TOLERANCE);
    while (!b.isZero()) {
      final Polynomial r = a.divide(b).remainder.clean(DEFAULT_TOLERANCE);
      a = b;
      b = r;
    }
    return a.monic();
  }

  /** Returns the monic least common multiple. */
  public Polynomial lcm(Polynomial o) {
    if (isZero() || o.isZero()) {
      return of(variable(o), ImmutableList.of());
    }
    return times(o).divide(gcd(o)).quotient.clean(DEFAULT_TOLERANCE).monic();
  }

  /** Converts this polynomial to an expression, highest power first. */
  public Ast.Exp toExp() {
    Ast.Exp e = null;
    for (int i = coefficients.size() - 1; i >= 0; i--) {
      final Num c = coefficients.get(i);
      if (c.isZero()) {
        continue;
      }
      if (e == null) {
        e = term(c, i);
      } else if (c.isNegative()) {
        e = ast.minus(e, term(c.negate(), i));
      } else {
        e = ast.plus(e, term(c, i));
      }
    }
    return e == null ? ast.number(0) : e;
  }

  private Ast.Exp term(Num c, int i) {
    if (i == 0) {
      return ast.number(c);
    }
    final Ast.Exp power = i == 1
        ? ast.id(variable)
        : ast.power(ast.id(variable), ast.number(i));
    return c.isOne() ? power : ast.times(ast.number(c), power);
  }

  @Override public int hashCode() {
    return Objects.hash(variable, coefficients);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Polynomial
        && variable.equals(((Polynomial) o).variable)
        && coefficients.equals(((Polynomial) o).coefficients);
  }

  @Override public String toString() {
    return toExp().toString();
  }

  /** Result of dividing one polynomial by another. */
  public static class Division {
    public final Polynomial quotient;
    public final Polynomial remainder;

    Division(Polynomial quotient, Polynomial remainder) {
      this.quotient = requireNonNull(quotient);
      this.remainder = requireNonNull(remainder);
    }
  }
}

// End Polynomial.java
