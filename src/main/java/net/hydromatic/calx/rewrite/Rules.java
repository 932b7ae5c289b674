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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import net.hydromatic.calx.ast.Ast;
import net.hydromatic.calx.ast.Op;
import net.hydromatic.calx.eval.EvaluationException;
import net.hydromatic.calx.num.Num;
import net.hydromatic.calx.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Simplification rules.
 *
 * <p>{@link #DEFAULT} is the list of rules, in the order in which
 * {@link Simplifier} tries them. */
public abstract class Rules {
  private static final Logger LOGGER = LoggerFactory.getLogger(Rules.class);

  private Rules() {}

  /** Replaces a parenthesized expression with its contents. */
  public static final Rule GROUP_UNWRAP =
      new Rule("groupUnwrap", e -> e.op == Op.GROUP,
          (s, e) -> ((Ast.Group) e).exp);

  /** Folds prefix and postfix operators: {@code -literal},
   * {@code --a = a}, {@code -a = -1 * a}, {@code +a = a},
   * {@code !!a = a}, {@code a% = 0.01 * a}. */
  public static final Rule UNARY_FOLD =
      new Rule("unaryFold", e -> e.op.isPrefix() || e.op.isPostfix(),
          Rules::unaryFold);

  /** Evaluates an operator whose operands are all literals. */
  public static final Rule CONSTANT_FOLD =
      new Rule("constantFold", Rules::isFoldable, Rules::constantFold);

  /** {@code x^0 = 1}, {@code x^1 = x}, {@code 1^x = 1}. */
  public static final Rule POWER_IDENTITY =
      new Rule("powerIdentity", e -> e.op == Op.POWER, Rules::powerIdentity);

  /** {@code (x^a)^b = x^(a * b)}. */
  public static final Rule POWER_OF_POWER =
      new Rule("powerOfPower",
          e -> e.op == Op.POWER && ((Ast.InfixCall) e).a0.op == Op.POWER,
          (s, e) -> {
            final Ast.InfixCall outer = (Ast.InfixCall) e;
            final Ast.InfixCall inner = (Ast.InfixCall) outer.a0;
            return ast.power(inner.a0,
                s.simplify(ast.times(inner.a1, outer.a1)));
          });

  /** {@code a / c = (1 / c) * a} if {@code c} is a non-zero number other
   * than an integer. Division by an integer is kept, so that the
   * coefficient remains an exact ratio. */
  public static final Rule DIVIDE_BY_LITERAL =
      new Rule("divideByLiteral",
          e -> e.op == Op.DIVIDE
              && ((Ast.InfixCall) e).a1.isNumber()
              && !((Ast.Literal) ((Ast.InfixCall) e).a1).num().isZero()
              && ((Ast.Literal) ((Ast.InfixCall) e).a1).num().kind
                  != Num.Kind.INTEGER
              && !((Ast.InfixCall) e).a0.isLiteral(),
          (s, e) -> {
            final Ast.InfixCall call = (Ast.InfixCall) e;
            final Num c = ((Ast.Literal) call.a1).num();
            return ast.times(ast.number(Num.ONE.divide(c)), call.a0);
          });

  /** {@code (a + b) * (a - b) = a^2 - b^2}. */
  public static final Rule DIFFERENCE_OF_SQUARES =
      new Rule("differenceOfSquares",
          e -> e.op == Op.TIMES
              && isSum(((Ast.InfixCall) e).a0)
              && isSum(((Ast.InfixCall) e).a1),
          Rules::differenceOfSquares);

  /** {@code (a + b)^2 = (a + b) * (a + b) = a^2 + 2 * a * b + b^2}.
   *
   * <p>A squared binomial is always expanded, so that the two forms, and
   * a sum such as {@code (a - b)^2 + 4 * a * b}, reach the same normal
   * form. */
  public static final Rule PERFECT_SQUARE =
      new Rule("perfectSquare", Rules::isBinomialSquare,
          Rules::perfectSquare);

  /** Identities of built-in functions, such as {@code ln(exp(x)) = x}, and
   * evaluation of calls with literal arguments whose value is an
   * integer. */
  public static final Rule FUNCTION_IDENTITIES =
      new Rule("functionIdentities", e -> e.op == Op.APPLY,
          Rules::functionIdentities);

  /** Folds conditional expressions whose condition is known, and
   * comparisons and logical operators with a known result. */
  public static final Rule CONDITIONAL =
      new Rule("conditional",
          e -> e.op == Op.IF
              || e.op == Op.AND
              || e.op == Op.OR
              || e.op == Op.EQ
              || e.op == Op.NE
              || e.op == Op.LT
              || e.op == Op.LE
              || e.op == Op.GT
              || e.op == Op.GE,
          Rules::conditional);

  /** Collects like terms of a sum. */
  public static final Rule SUM_NORMAL_FORM =
      new Rule("sumNormalForm", Rules::isSum, Rules::sumNormalForm);

  /** Collects the numeric coefficient and like bases of a product. */
  public static final Rule PRODUCT_NORMAL_FORM =
      new Rule("productNormalForm",
          e -> e.op == Op.TIMES || e.op == Op.DIVIDE,
          Rules::productNormalForm);

  /** The rules, in the order that they are tried. */
  public static final ImmutableList<Rule> DEFAULT =
      ImmutableList.of(GROUP_UNWRAP, UNARY_FOLD, CONSTANT_FOLD,
          POWER_IDENTITY, POWER_OF_POWER, DIVIDE_BY_LITERAL,
          DIFFERENCE_OF_SQUARES, PERFECT_SQUARE, FUNCTION_IDENTITIES,
          CONDITIONAL, SUM_NORMAL_FORM, PRODUCT_NORMAL_FORM);

  static boolean isSum(Ast.Exp e) {
    return e.op == Op.PLUS || e.op == Op.MINUS;
  }

  private static Ast.@Nullable Exp unaryFold(Simplifier s, Ast.Exp e) {
    final Ast.Unary unary = (Ast.Unary) e;
    final Ast.Exp a = unary.a;
    switch (unary.op) {
      case NEGATE:
        if (a.isNumber()) {
          return ast.number(((Ast.Literal) a).num().negate());
        }
        if (a.op == Op.NEGATE) {
          return ((Ast.Unary) a).a;
        }
        return a.isLiteral() ? null : ast.times(ast.number(-1), a);
      case POSITIVE:
        return a.isLiteral() && !a.isNumber() ? null : a;
      case NOT:
        return a.op == Op.NOT ? ((Ast.Unary) a).a : null;
      case PERCENT:
        return a.isLiteral() ? null : ast.times(ast.number(0.01d), a);
      default:
        return null;
    }
  }

  private static boolean isFoldable(Ast.Exp e) {
    switch (e.op) {
      case APPLY:
      case GROUP:
      case LIST:
      case MAP:
        return false;
      default:
        final List<Ast.Exp> args = e.args();
        return !args.isEmpty() && Static.allMatch(args, Ast.Exp::isLiteral);
    }
  }

  private static Ast.@Nullable Exp constantFold(Simplifier s, Ast.Exp e) {
    final Object o;
    try {
      o = s.evaluator().evaluate(e);
    } catch (EvaluationException ex) {
      LOGGER.debug("Not folding '{}': {}", e, ex.getMessage());
      return null;
    }
    if (o instanceof List || o instanceof Map || o instanceof Ast.Exp) {
      return null;
    }
    return ast.lift(o);
  }

  private static Ast.@Nullable Exp powerIdentity(Simplifier s, Ast.Exp e) {
    final Ast.InfixCall call = (Ast.InfixCall) e;
    if (call.a1.isNumber(0) && !call.a0.isNumber(0)) {
      return ast.number(1);
    }
    if (call.a1.isNumber(1)) {
      return call.a0;
    }
    if (call.a0.isNumber(1)) {
      return ast.number(1);
    }
    return null;
  }

  /** Returns the two terms of a sum, each with its sign, or null if the sum
   * does not have exactly two terms. */
  private static @Nullable List<TermMap.Term> twoTerms(Ast.Exp e) {
    final List<Ast.Exp> parts = new ArrayList<>();
    final List<Boolean> negatives = new ArrayList<>();
    TermMap.flatten(e, false, parts, negatives);
    if (parts.size() != 2) {
      return null;
    }
    final List<TermMap.Term> terms = new ArrayList<>();
    for (int i = 0; i < 2; i++) {
      final TermMap.Term t = TermMap.split(parts.get(i));
      terms.add(negatives.get(i)
          ? new TermMap.Term(t.coefficient.negate(), t.factor)
          : t);
    }
    return terms;
  }

  /** Converts a term back to an expression. */
  private static Ast.Exp toExp(TermMap.Term t) {
    final Ratio c = t.coefficient;
    if (t.factor == null) {
      return ast.number(c.toNum());
    }
    final Ast.Exp e = c.numerator.isOne()
        ? t.factor
        : ast.times(ast.number(c.numerator), t.factor);
    return c.divisor.isOne() ? e : ast.divide(e, ast.number(c.divisor));
  }

  private static boolean sameFactor(TermMap.Term t0, TermMap.Term t1) {
    return t0.factor == null
        ? t1.factor == null
        : t1.factor != null && t0.factor.equals(t1.factor);
  }

  private static Ast.@Nullable Exp differenceOfSquares(Simplifier s,
      Ast.Exp e) {
    final Ast.InfixCall call = (Ast.InfixCall) e;
    final List<TermMap.Term> terms0 = twoTerms(call.a0);
    final List<TermMap.Term> terms1 = twoTerms(call.a1);
    if (terms0 == null || terms1 == null) {
      return null;
    }
    for (int i = 0; i < 2; i++) {
      for (int j = 0; j < 2; j++) {
        final TermMap.Term a0 = terms0.get(i);
        final TermMap.Term a1 = terms1.get(j);
        final TermMap.Term b0 = terms0.get(1 - i);
        final TermMap.Term b1 = terms1.get(1 - j);
        if (sameFactor(a0, a1)
            && a0.coefficient.numericallyEquals(a1.coefficient)
            && sameFactor(b0, b1)
            && b0.coefficient.numericallyEquals(b1.coefficient.negate())) {
          return ast.minus(ast.power(toExp(a0), ast.number(2)),
              ast.power(toExp(b0), ast.number(2)));
        }
      }
    }
    return null;
  }

  private static boolean isBinomialSquare(Ast.Exp e) {
    switch (e.op) {
      case TIMES:
        final Ast.InfixCall times = (Ast.InfixCall) e;
        return isSum(times.a0) && times.a0.equals(times.a1);
      case POWER:
        final Ast.InfixCall power = (Ast.InfixCall) e;
        return isSum(power.a0) && power.a1.isNumber(2);
      default:
        return false;
    }
  }

  private static Ast.@Nullable Exp perfectSquare(Simplifier s, Ast.Exp e) {
    final List<TermMap.Term> terms = twoTerms(((Ast.InfixCall) e).a0);
    if (terms == null) {
      return null;
    }
    final TermMap.Term t0 = terms.get(0);
    final TermMap.Term t1 = terms.get(1);
    final TermMap.Term cross =
        new TermMap.Term(
            t0.coefficient.times(t1.coefficient).times(Num.of(2)),
            t0.factor == null ? t1.factor
                : t1.factor == null ? t0.factor
                : ast.times(t0.factor, t1.factor));
    return ast.plus(ast.plus(toExp(square(t0)), toExp(cross)),
        toExp(square(t1)));
  }

  /** Squares a term; the coefficient is squared as a number, so that
   * {@code (-b)^2} becomes {@code b^2}. */
  private static TermMap.Term square(TermMap.Term t) {
    return new TermMap.Term(t.coefficient.times(t.coefficient),
        t.factor == null ? null : ast.power(t.factor, ast.number(2)));
  }

  private static Ast.@Nullable Exp functionIdentities(Simplifier s,
      Ast.Exp e) {
    final Ast.Apply apply = (Ast.Apply) e;
    if (apply.args.size() == 1) {
      final Ast.Exp arg = apply.arg();
      switch (apply.name) {
        case "ln":
          if (isCall(arg, "exp")) {
            return ((Ast.Apply) arg).arg();
          }
          if (arg.op == Op.ID && ((Ast.Id) arg).name.equals("e")) {
            return ast.number(1);
          }
          break;
        case "exp":
          if (isCall(arg, "ln")) {
            return ((Ast.Apply) arg).arg();
          }
          break;
        default:
          break;
      }
    }
    if (apply.name.equals("log") && apply.args.size() == 2) {
      if (apply.args.get(1).isNumber(1)) {
        return ast.number(0);
      }
      if (apply.args.get(0).equals(apply.args.get(1))) {
        return ast.number(1);
      }
    }
    if (!apply.args.isEmpty()
        && Static.allMatch(apply.args, Ast.Exp::isNumber)) {
      final Object o;
      try {
        o = s.evaluator().evaluate(apply);
      } catch (EvaluationException ex) {
        LOGGER.debug("Not folding '{}': {}", e, ex.getMessage());
        return null;
      }
      // Keep "sin(1)" rather than 0.8414709848078965
      if (o instanceof Num && ((Num) o).isIntegral()) {
        return ast.number(((Num) o).toIntegerIfWhole());
      }
    }
    return null;
  }

  private static boolean isCall(Ast.Exp e, String name) {
    return e.op == Op.APPLY
        && ((Ast.Apply) e).name.equals(name)
        && ((Ast.Apply) e).args.size() == 1;
  }

  private static Ast.@Nullable Exp conditional(Simplifier s, Ast.Exp e) {
    if (e.op == Op.IF) {
      final Ast.If anIf = (Ast.If) e;
      if (anIf.condition.op == Op.BOOL) {
        return Boolean.TRUE.equals(((Ast.Literal) anIf.condition).value)
            ? anIf.ifTrue
            : anIf.ifFalse;
      }
      return anIf.ifTrue.equals(anIf.ifFalse) ? anIf.ifTrue : null;
    }
    final Ast.InfixCall call = (Ast.InfixCall) e;
    switch (call.op) {
      case AND:
      case OR:
        final boolean and = call.op == Op.AND;
        for (int i = 0; i < 2; i++) {
          final Ast.Exp a = i == 0 ? call.a0 : call.a1;
          final Ast.Exp other = i == 0 ? call.a1 : call.a0;
          if (a.op == Op.BOOL) {
            final boolean b = Boolean.TRUE.equals(((Ast.Literal) a).value);
            // "true && x" is x, "false && x" is false, and vice versa for ||
            return b == and ? other : ast.bool(b);
          }
        }
        return call.a0.equals(call.a1) ? call.a0 : null;
      default:
        if (!call.a0.equals(call.a1)) {
          return null;
        }
        switch (call.op) {
          case EQ:
          case LE:
          case GE:
            return ast.bool(true);
          default:
            return ast.bool(false);
        }
    }
  }

  private static Ast.@Nullable Exp sumNormalForm(Simplifier s, Ast.Exp e) {
    final TermMap map = TermMap.of(s, e);
    if (map == null) {
      return null;
    }
    map.applyPythagorean();
    return map.toExp();
  }

  private static Ast.@Nullable Exp productNormalForm(Simplifier s,
      Ast.Exp e) {
    final Product product = new Product(s);
    if (!product.add(e, false)) {
      return null;
    }
    if (product.coefficient.isZero()) {
      return ast.number(0);
    }
    final List<Ast.Exp> numerator = new ArrayList<>();
    final List<Ast.Exp> denominator = new ArrayList<>();
    for (Product.Factor factor : product.factors.values()) {
      if (factor.exponent.isNumber()) {
        final Num n = ((Ast.Literal) factor.exponent).num();
        if (n.isZero()) {
          continue;
        }
        if (n.isNegative()) {
          denominator.add(power(factor.base, n.negate()));
        } else {
          numerator.add(power(factor.base, n));
        }
      } else {
        numerator.add(ast.power(factor.base, factor.exponent));
      }
    }
    final Ratio c = product.coefficient;
    if (!c.numerator.isOne() || numerator.isEmpty()) {
      numerator.add(0, ast.number(c.numerator));
    }
    if (!c.divisor.isOne()) {
      denominator.add(0, ast.number(c.divisor));
    }
    final Ast.Exp num = ast.product(numerator);
    return denominator.isEmpty()
        ? num
        : ast.divide(num, ast.product(denominator));
  }

  private static Ast.Exp power(Ast.Exp base, Num n) {
    return n.isOne() ? base : ast.power(base, ast.number(n));
  }

  /** Product being flattened by {@link #PRODUCT_NORMAL_FORM}: a numeric
   * coefficient and a map from the canonical key of each base to its
   * exponent. */
  private static class Product {
    final Simplifier simplifier;
    Ratio coefficient = Ratio.ONE;
    final TreeMap<String, Factor> factors = new TreeMap<>();

    Product(Simplifier simplifier) {
      this.simplifier = simplifier;
    }

    /** Adds a factor, or divides by it if {@code inverse}. Returns false if
     * the expression cannot be a factor: a non-numeric literal, or division
     * by literal zero. */
    boolean add(Ast.Exp e, boolean inverse) {
      switch (e.op) {
        case TIMES:
          final Ast.InfixCall times = (Ast.InfixCall) e;
          return add(times.a0, inverse) && add(times.a1, inverse);
        case DIVIDE:
          final Ast.InfixCall divide = (Ast.InfixCall) e;
          return add(divide.a0, inverse) && add(divide.a1, !inverse);
        case NUMBER:
          final Num n = ((Ast.Literal) e).num();
          if (!inverse) {
            coefficient = coefficient.times(n);
          } else if (n.isZero()) {
            return false;
          } else {
            coefficient = coefficient.divide(n);
          }
          return true;
        case STRING:
        case BOOL:
        case NULL:
        case LIST:
        case MAP:
          return false;
        case POWER:
          final Ast.InfixCall power = (Ast.InfixCall) e;
          addFactor(power.a0, inverse ? negate(power.a1) : power.a1);
          return true;
        default:
          addFactor(e, ast.number(inverse ? -1 : 1));
          return true;
      }
    }

    private Ast.Exp negate(Ast.Exp exponent) {
      if (exponent.isNumber()) {
        return ast.number(((Ast.Literal) exponent).num().negate());
      }
      return simplifier.simplify(ast.times(ast.number(-1), exponent));
    }

    private void addFactor(Ast.Exp base, Ast.Exp exponent) {
      final String key = base.toString();
      final Factor factor = factors.get(key);
      if (factor == null) {
        factors.put(key, new Factor(base, exponent));
        return;
      }
      final Ast.Exp sum;
      if (factor.exponent.isNumber() && exponent.isNumber()) {
        sum = ast.number(((Ast.Literal) factor.exponent).num()
            .plus(((Ast.Literal) exponent).num()));
      } else {
        sum = simplifier.simplify(ast.plus(factor.exponent, exponent));
      }
      factors.put(key, new Factor(base, sum));
    }

    /** Base and exponent. */
    static class Factor {
      final Ast.Exp base;
      final Ast.Exp exponent;

      Factor(Ast.Exp base, Ast.Exp exponent) {
        this.base = base;
        this.exponent = exponent;
      }
    }
  }
}

// End Rules.java
