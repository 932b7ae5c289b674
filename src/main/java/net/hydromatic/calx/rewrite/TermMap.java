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
package net.hydromatic.calx.rewrite;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.calx.ast.AstBuilder.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import net.hydromatic.calx.ast.Ast;
import net.hydromatic.calx.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Collection of like terms of a sum.
 *
 * <p>Each term is split into a numeric coefficient and a factor, and the
 * coefficients of factors that have the same canonical key (the unparsed
 * form of the factor) are added. Terms without a factor are added to the
 * constant.
 *
 * <p>Iteration is in key order, so two sums with the same terms in a
 * different order yield the same map.
 */
class TermMap {
  private final Simplifier simplifier;
  private Ratio constant = Ratio.ZERO;
  private final TreeMap<String, Term> terms = new TreeMap<>();

  TermMap(Simplifier simplifier) {
    this.simplifier = requireNonNull(simplifier);
  }

  /** Creates a term map from a sum or difference, or returns null if the
   * sum has a term that is not numeric, such as a string. */
  static @Nullable TermMap of(Simplifier simplifier, Ast.Exp exp) {
    final List<Ast.Exp> list = new ArrayList<>();
    final List<Boolean> negatives = new ArrayList<>();
    flatten(exp, false, list, negatives);
    final TermMap map = new TermMap(simplifier);
    for (int i = 0; i < list.size(); i++) {
      final Ast.Exp term = list.get(i);
      switch (term.op) {
        case STRING:
        case BOOL:
        case NULL:
        case LIST:
        case MAP:
          return null;
        default:
          final Term t = split(term);
          map.add(negatives.get(i) ? t.coefficient.negate() : t.coefficient,
              t.factor);
      }
    }
    return map;
  }

  /** Collects the terms of a tree of {@code +} and {@code -}. */
  static void flatten(Ast.Exp exp, boolean negative, List<Ast.Exp> list,
      List<Boolean> negatives) {
    switch (exp.op) {
      case PLUS:
      case MINUS:
        final Ast.InfixCall call = (Ast.InfixCall) exp;
        flatten(call.a0, negative, list, negatives);
        flatten(call.a1, negative ^ (exp.op == Op.MINUS), list, negatives);
        break;
      default:
        list.add(exp);
        negatives.add(negative);
    }
  }

  /** Splits a term into a numeric coefficient and a factor. The factor of a
   * numeric literal is null.
   *
   * <p>The coefficient of a product is its leftmost leaf, if that is a
   * number; the coefficient of a quotient is that of its numerator divided
   * by the integer coefficient, if any, of its denominator. So
   * {@code 2 * x * y} splits into {@code 2} and {@code x * y},
   * {@code 3 / x} into {@code 3} and {@code 1 / x}, and
   * {@code 3 * x / (2 * y)} into {@code 3/2} and {@code x / y}. */
  static Term split(Ast.Exp exp) {
    switch (exp.op) {
      case NUMBER:
        return new Term(Ratio.of(((Ast.Literal) exp).num()), null);
      case TIMES:
        final Ast.InfixCall times = (Ast.InfixCall) exp;
        final Term t0 = split(times.a0);
        if (t0.factor == null) {
          return new Term(t0.coefficient, times.a1);
        }
        if (t0.factor == times.a0) {
          return new Term(Ratio.ONE, exp);
        }
        return new Term(t0.coefficient, ast.times(t0.factor, times.a1));
      case DIVIDE:
        final Ast.InfixCall divide = (Ast.InfixCall) exp;
        final Term n = split(divide.a0);
        final Term d = split(divide.a1);
        if (d.coefficient.divisor.isOne()
            && Ratio.isExactDivisor(d.coefficient.numerator)) {
          final Ratio c = n.coefficient.divide(d.coefficient.numerator);
          if (d.factor == null) {
            return new Term(c, n.factor);
          }
          return new Term(c,
              ast.divide(n.factor == null ? ast.number(1) : n.factor,
                  d.factor));
        }
        if (n.factor == null) {
          return new Term(n.coefficient,
              ast.divide(ast.number(1), divide.a1));
        }
        if (n.factor == divide.a0) {
          return new Term(Ratio.ONE, exp);
        }
        return new Term(n.coefficient, ast.divide(n.factor, divide.a1));
      default:
        return new Term(Ratio.ONE, exp);
    }
  }

  /** Adds a multiple of a factor. */
  void add(Ratio coefficient, Ast.@Nullable Exp factor) {
    if (factor == null) {
      constant = constant.plus(coefficient);
      return;
    }
    final String key = factor.toString();
    final Term term = terms.get(key);
    terms.put(key,
        term == null
            ? new Term(coefficient, factor)
            : new Term(term.coefficient.plus(coefficient), term.factor));
  }

  /** Returns the coefficient of a factor, or zero. */
  Ratio coefficient(Ast.Exp factor) {
    final Term term = terms.get(factor.toString());
    return term == null ? Ratio.ZERO : term.coefficient;
  }

  /** Removes a factor. */
  void remove(Ast.Exp factor) {
    terms.remove(factor.toString());
  }

  /** Returns the terms, in key order, other than the constant. */
  List<Term> terms() {
    return new ArrayList<>(terms.values());
  }

  /** Applies the identity {@code c * sin(u)^2 + c * cos(u)^2 = c}.
   * Returns whether any pair was found. */
  boolean applyPythagorean() {
    boolean changed = false;
    for (Term term : terms()) {
      final Ast.Exp f = term.factor;
      if (f.op != Op.POWER
          || !((Ast.InfixCall) f).a1.isNumber(2)
          || ((Ast.InfixCall) f).a0.op != Op.APPLY) {
        continue;
      }
      final Ast.Apply apply = (Ast.Apply) ((Ast.InfixCall) f).a0;
      if (!apply.name.equals("sin") || apply.args.size() != 1) {
        continue;
      }
      final Ast.Exp cos =
          ast.power(ast.apply("cos", apply.arg()), ast.number(2));
      final Ratio c = coefficient(cos);
      if (!c.isZero() && c.numericallyEquals(coefficient(f))) {
        remove(f);
        remove(cos);
        constant = constant.plus(c);
        changed = true;
      }
    }
    return changed;
  }

  /** Converts this map back to an expression: the constant first, if it is
   * not zero, then the terms in key order. A term with a negative
   * coefficient, other than the first, is subtracted. */
  Ast.Exp toExp() {
    Ast.Exp e = constant.isZero() ? null : ast.number(constant.toNum());
    for (Map.Entry<String, Term> entry : terms.entrySet()) {
      final Term term = entry.getValue();
      final Ratio c = term.coefficient;
      if (c.isZero()) {
        continue;
      }
      if (e == null) {
        e = times(c, term.factor);
      } else if (c.isNegative()) {
        e = ast.minus(e, times(c.negate(), term.factor));
      } else {
        e = ast.plus(e, times(c, term.factor));
      }
    }
    return e == null ? ast.number(0) : e;
  }

  private Ast.Exp times(Ratio c, Ast.Exp factor) {
    if (c.isOne()) {
      return factor;
    }
    final Ast.Exp e = ast.times(ast.number(c.numerator), factor);
    return simplifier.simplify(c.divisor.isOne() ? e
        : ast.divide(e, ast.number(c.divisor)));
  }

  /** Term of a sum: coefficient times factor. */
  static class Term {
    final Ratio coefficient;
    /** Factor; null for a numeric term. */
    final Ast.@Nullable Exp factor;

    Term(Ratio coefficient, Ast.@Nullable Exp factor) {
      this.coefficient = requireNonNull(coefficient);
      this.factor = factor;
    }
  }
}

// End TermMap.java
