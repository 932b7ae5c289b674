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

import static net.hydromatic.calx.ast.AstBuilder.ast;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.calx.ast.Ast;
import net.hydromatic.calx.num.Num;
import net.hydromatic.calx.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Expands products of sums.
 *
 * <p>Multiplication distributes over addition and subtraction, a sum
 * divided by an expression becomes a sum of quotients, and a sum raised to
 * a small positive integer power is multiplied out. Negation of a sum
 * negates each term. No other identities are applied; the result is
 * usually simplified afterwards.
 */
public abstract class Expander {
  /** Largest power of a sum that is multiplied out. */
  static final int MAX_POWER = 16;

  /** Largest number of terms that an expansion may produce. */
  static final int MAX_TERMS = 4096;

  private Expander() {}

  /** Expands an expression, bottom-up. */
  public static Ast.Exp expand(Ast.Exp exp) {
    final List<Ast.Exp> args = exp.args();
    final Ast.Exp e = args.isEmpty()
        ? exp
        : exp.copy(Static.transformEager(args, Expander::expand));
    switch (e.op) {
      case GROUP:
        return ((Ast.Group) e).exp;
      case TIMES:
        final Ast.InfixCall times = (Ast.InfixCall) e;
        final Terms product =
            Terms.of(times.a0).times(Terms.of(times.a1));
        return product == null ? e : product.toExp();
      case DIVIDE:
        final Ast.InfixCall divide = (Ast.InfixCall) e;
        final Terms numerator = Terms.of(divide.a0);
        if (numerator.size() < 2) {
          return e;
        }
        final Terms quotient = new Terms();
        for (int i = 0; i < numerator.size(); i++) {
          quotient.add(ast.divide(numerator.terms.get(i), divide.a1),
              numerator.negatives.get(i));
        }
        return quotient.toExp();
      case POWER:
        final Ast.InfixCall power = (Ast.InfixCall) e;
        final Terms base = Terms.of(power.a0);
        if (base.size() < 2
            || !power.a1.isNumber()
            || !((Ast.Literal) power.a1).num().isIntegral()) {
          return e;
        }
        final Num k = ((Ast.Literal) power.a1).num();
        if (k.compareTo(Num.of(2)) < 0
            || k.compareTo(Num.of(MAX_POWER)) > 0) {
          return e;
        }
        final int n = k.intValueExact();
        @Nullable Terms result = base;
        for (int i = 1; i < n; i++) {
          result = result.times(base);
          if (result == null) {
            return e;
          }
        }
        return result.toExp();
      case NEGATE:
        final Terms terms = Terms.of(((Ast.Unary) e).a);
        if (terms.size() < 2) {
          return e;
        }
        final Terms negated = new Terms();
        for (int i = 0; i < terms.size(); i++) {
          negated.add(terms.terms.get(i), !terms.negatives.get(i));
        }
        return negated.toExp();
      default:
        return e;
    }
  }

  /** Terms of a sum, each with a flag saying whether it is subtracted. */
  private static class Terms {
    final List<Ast.Exp> terms = new ArrayList<>();
    final List<Boolean> negatives = new ArrayList<>();

    static Terms of(Ast.Exp e) {
      final Terms terms = new Terms();
      TermMap.flatten(e, false, terms.terms, terms.negatives);
      return terms;
    }

    int size() {
      return terms.size();
    }

    void add(Ast.Exp term, boolean negative) {
      terms.add(term);
      negatives.add(negative);
    }

    /** Multiplies two sums, or returns null if the result would have
     * too many terms or neither sum has more than one term. */
    @Nullable Terms times(Terms o) {
      if (size() < 2 && o.size() < 2
          || (long) size() * o.size() > MAX_TERMS) {
        return null;
      }
      final Terms product = new Terms();
      for (int i = 0; i < size(); i++) {
        for (int j = 0; j < o.size(); j++) {
          product.add(ast.times(terms.get(i), o.terms.get(j)),
              negatives.get(i) ^ o.negatives.get(j));
        }
      }
      return product;
    }

    Ast.Exp toExp() {
      Ast.@Nullable Exp e = null;
      for (int i = 0; i < terms.size(); i++) {
        final Ast.Exp term = terms.get(i);
        final boolean negative = negatives.get(i);
        if (e == null) {
          e = negative ? ast.negate(term) : term;
        } else {
          e = negative ? ast.minus(e, term) : ast.plus(e, term);
        }
      }
      return e == null ? ast.number(0) : e;
    }
  }
}

// End Expander.java
