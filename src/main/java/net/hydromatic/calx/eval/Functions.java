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
package net.hydromatic.calx.eval;

import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import net.hydromatic.calx.ast.Pos;
import net.hydromatic.calx.num.Num;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Built-in numeric functions.
 *
 * <p>Functions are applied to {@link Num} arguments. Trigonometric functions
 * read their argument, and inverse trigonometric functions write their
 * result, in the unit given by {@link Prop#ANGLE_UNIT}. Only {@code sqrt},
 * {@code exp}, {@code ln} and {@code abs} accept complex arguments.
 */
public abstract class Functions {
  /** Largest argument of {@link #factorial}. */
  private static final int MAX_FACTORIAL = 10_000;

  private Functions() {}

  /** Built-in function. */
  public enum BuiltIn {
    SIN("sin", 1, 1),
    COS("cos", 1, 1),
    TAN("tan", 1, 1),
    SEC("sec", 1, 1),
    CSC("csc", 1, 1),
    COT("cot", 1, 1),
    ASIN("asin", 1, 1),
    ACOS("acos", 1, 1),
    ATAN("atan", 1, 1),
    SINH("sinh", 1, 1),
    COSH("cosh", 1, 1),
    TANH("tanh", 1, 1),
    ASINH("asinh", 1, 1),
    ACOSH("acosh", 1, 1),
    ATANH("atanh", 1, 1),
    EXP("exp", 1, 1),
    LN("ln", 1, 1),
    /** Logarithm; {@code log(x)} is base 10, {@code log(b, x)} is base
     * {@code b}. */
    LOG("log", 1, 2),
    LOG2("log2", 1, 1),
    LOG10("log10", 1, 1),
    SQRT("sqrt", 1, 1),
    CBRT("cbrt", 1, 1),
    ABS("abs", 1, 1),
    FLOOR("floor", 1, 1),
    CEIL("ceil", 1, 1),
    ROUND("round", 1, 1),
    SIGN("sign", 1, 1),
    MIN("min", 1, Integer.MAX_VALUE),
    MAX("max", 1, Integer.MAX_VALUE),
    GCD("gcd", 1, Integer.MAX_VALUE),
    LCM("lcm", 1, Integer.MAX_VALUE),
    FACT("fact", 1, 1);

    public final String fnName;
    public final int minArgs;
    public final int maxArgs;

    BuiltIn(String fnName, int minArgs, int maxArgs) {
      this.fnName = fnName;
      this.minArgs = minArgs;
      this.maxArgs = maxArgs;
    }

    /** Whether this is sin, cos, tan, sec, csc or cot. */
    public boolean isTrig() {
      return ordinal() <= COT.ordinal();
    }

    /** Whether this is asin, acos or atan. */
    public boolean isInverseTrig() {
      return this == ASIN || this == ACOS || this == ATAN;
    }
  }

  /** Map of built-in functions by name. */
  public static final ImmutableMap<String, BuiltIn> BY_NAME;

  static {
    final ImmutableMap.Builder<String, BuiltIn> b = ImmutableMap.builder();
    for (BuiltIn builtIn : BuiltIn.values()) {
      b.put(builtIn.fnName, builtIn);
    }
    BY_NAME = b.build();
  }

  /** Returns the built-in function with a given name, or null. */
  public static @Nullable BuiltIn lookup(String name) {
    return BY_NAME.get(name);
  }

  /** Whether a name is a built-in function. */
  public static boolean isFunction(String name) {
    return BY_NAME.containsKey(name);
  }

  /** Applies a function to numeric arguments.
   *
   * @throws EvaluationException if the function is unknown, the number of
   *   arguments is wrong, or an argument is outside the domain */
  public static Num apply(Session session, Pos pos, String name,
      List<Num> args) {
    final BuiltIn f = lookup(name);
    if (f == null) {
      throw new EvaluationException("Unknown function '" + name + "'", pos);
    }
    if (args.size() < f.minArgs || args.size() > f.maxArgs) {
      throw new EvaluationException("Function '" + name + "' expects "
          + arity(f) + ", got " + args.size(), pos);
    }
    final Num x = args.get(0);
    switch (f) {
      case SQRT:
        if (x.isNegative() && !session.complex()) {
          throw domain(f, x, pos);
        }
        return x.sqrt();
      case EXP:
        return exp(x);
      case LN:
        return ln(session, f, x, pos);
      case ABS:
        return x.abs();
      case MIN:
      case MAX:
        Num best = real(f, x, pos);
        for (Num arg : args) {
          final int c = real(f, arg, pos).compareTo(best);
          if (f == BuiltIn.MIN ? c < 0 : c > 0) {
            best = arg;
          }
        }
        return best;
      case GCD:
      case LCM:
        BigInteger acc = integer(f, x, pos).abs();
        for (Num arg : args.subList(1, args.size())) {
          final BigInteger n = integer(f, arg, pos).abs();
          if (f == BuiltIn.GCD) {
            acc = acc.gcd(n);
          } else if (acc.signum() == 0 || n.signum() == 0) {
            acc = BigInteger.ZERO;
          } else {
            acc = acc.divide(acc.gcd(n)).multiply(n);
          }
        }
        return Num.of(acc);
      case FACT:
        return factorial(x, pos);
      case FLOOR:
      case CEIL:
      case ROUND:
        return round(f, real(f, x, pos), pos);
      case SIGN:
        return Num.of(real(f, x, pos).signum());
      case LOG:
        if (args.size() == 2) {
          final double base = real(f, x, pos).doubleValue();
          final double d = real(f, args.get(1), pos).doubleValue();
          if (base <= 0 || base == 1d || d <= 0) {
            throw new EvaluationException("Function 'log' is undefined for "
                + "base " + x + " and argument " + args.get(1), pos);
          }
          return Num.of(Math.log(d) / Math.log(base));
        }
        break;
      default:
        break;
    }
    final double d = real(f, x, pos).doubleValue();
    final double r;
    switch (f) {
      case SIN:
        r = Math.sin(toRadians(session, d));
        break;
      case COS:
        r = Math.cos(toRadians(session, d));
        break;
      case TAN:
        r = Math.tan(toRadians(session, d));
        break;
      case SEC:
        r = 1d / Math.cos(toRadians(session, d));
        break;
      case CSC:
        r = 1d / Math.sin(toRadians(session, d));
        break;
      case COT:
        r = 1d / Math.tan(toRadians(session, d));
        break;
      case ASIN:
        checkDomain(f, x, pos, d >= -1d && d <= 1d);
        r = fromRadians(session, Math.asin(d));
        break;
      case ACOS:
        checkDomain(f, x, pos, d >= -1d && d <= 1d);
        r = fromRadians(session, Math.acos(d));
        break;
      case ATAN:
        r = fromRadians(session, Math.atan(d));
        break;
      case SINH:
        r = Math.sinh(d);
        break;
      case COSH:
        r = Math.cosh(d);
        break;
      case TANH:
        r = Math.tanh(d);
        break;
      case ASINH:
        r = Math.log(d + Math.sqrt(d * d + 1d));
        break;
      case ACOSH:
        checkDomain(f, x, pos, d >= 1d);
        r = Math.log(d + Math.sqrt(d * d - 1d));
        break;
      case ATANH:
        checkDomain(f, x, pos, d > -1d && d < 1d);
        r = 0.5d * Math.log((1d + d) / (1d - d));
        break;
      case LOG:
      case LOG10:
        checkDomain(f, x, pos, d > 0d);
        r = Math.log10(d);
        break;
      case LOG2:
        checkDomain(f, x, pos, d > 0d);
        r = Math.log(d) / Math.log(2d);
        break;
      case CBRT:
        if (x.kind == Num.Kind.INTEGER) {
          final long c = Math.round(Math.cbrt(d));
          if (Num.of(c).pow(Num.of(3)).equals(x)) {
            return Num.of(c);
          }
        }
        r = Math.cbrt(d);
        break;
      default:
        throw new AssertionError(f);
    }
    if (Double.isNaN(r) || Double.isInfinite(r)) {
      throw domain(f, x, pos);
    }
    return Num.of(r);
  }

  private static String arity(BuiltIn f) {
    if (f.maxArgs == Integer.MAX_VALUE) {
      return "at least " + f.minArgs + " argument"
          + (f.minArgs == 1 ? "" : "s");
    }
    if (f.minArgs == f.maxArgs) {
      return f.minArgs + " argument" + (f.minArgs == 1 ? "" : "s");
    }
    return f.minArgs + " to " + f.maxArgs + " arguments";
  }

  private static double toRadians(Session session, double d) {
    return session.angleUnit() == Prop.AngleUnit.DEGREES
        ? Math.toRadians(d)
        : d;
  }

  private static double fromRadians(Session session, double d) {
    return session.angleUnit() == Prop.AngleUnit.DEGREES
        ? Math.toDegrees(d)
        : d;
  }

  private static Num real(BuiltIn f, Num x, Pos pos) {
    if (!x.isReal()) {
      throw new EvaluationException("Function '" + f.fnName
          + "' does not accept complex argument " + x, pos);
    }
    return x;
  }

  private static BigInteger integer(BuiltIn f, Num x, Pos pos) {
    if (!real(f, x, pos).isIntegral()) {
      throw new EvaluationException("Function '" + f.fnName
          + "' requires integer arguments, got " + x, pos);
    }
    return x.bigIntegerValue();
  }

  private static void checkDomain(BuiltIn f, Num x, Pos pos,
      boolean condition) {
    if (!condition) {
      throw domain(f, x, pos);
    }
  }

  private static EvaluationException domain(BuiltIn f, Num x, Pos pos) {
    return new EvaluationException("Argument " + x + " is outside the "
        + "domain of '" + f.fnName + "'", pos);
  }

  private static Num round(BuiltIn f, Num x, Pos pos) {
    if (x.kind == Num.Kind.INTEGER) {
      return x;
    }
    final BigDecimal d = x.toBigDecimal();
    final RoundingMode mode;
    switch (f) {
      case FLOOR:
        mode = RoundingMode.FLOOR;
        break;
      case CEIL:
        mode = RoundingMode.CEILING;
        break;
      default:
        mode = RoundingMode.HALF_UP;
    }
    return Num.of(d.setScale(0, mode).toBigIntegerExact());
  }

  /** Returns e raised to a (possibly complex) power. */
  public static Num exp(Num x) {
    if (x.isReal()) {
      if (x.isZero()) {
        return Num.ONE;
      }
      return Num.of(Math.exp(x.doubleValue()));
    }
    final double m = Math.exp(x.doubleValue());
    final double y = x.imaginaryValue();
    return Num.complex(m * Math.cos(y), m * Math.sin(y));
  }

  private static Num ln(Session session, BuiltIn f, Num x, Pos pos) {
    if (x.isZero()) {
      throw domain(f, x, pos);
    }
    if (x.isReal() && x.signum() > 0) {
      if (x.isOne()) {
        return Num.ZERO;
      }
      return Num.of(Math.log(x.doubleValue()));
    }
    if (!session.complex()) {
      throw domain(f, x, pos);
    }
    // Principal value: ln|z| + i arg(z)
    final double re = x.doubleValue();
    final double im = x.imaginaryValue();
    return Num.complex(Math.log(Math.hypot(re, im)), Math.atan2(im, re));
  }

  /** Returns the factorial of a non-negative integer.
   *
   * @throws EvaluationException if the argument is not a non-negative
   *   integer, or is too large */
  public static Num factorial(Num x, Pos pos) {
    if (!x.isReal() || !x.isIntegral() || x.signum() < 0) {
      throw new EvaluationException("Factorial requires a non-negative "
          + "integer, got " + x, pos);
    }
    final BigInteger n = x.bigIntegerValue();
    if (n.compareTo(BigInteger.valueOf(MAX_FACTORIAL)) > 0) {
      throw new EvaluationException("Factorial argument too large: " + x,
          pos);
    }
    BigInteger r = BigInteger.ONE;
    for (int i = 2; i <= n.intValue(); i++) {
      r = r.multiply(BigInteger.valueOf(i));
    }
    return Num.of(r);
  }

  /** Returns the number of ordered selections of {@code k} items from
   * {@code n}, "n P k". */
  public static Num permutations(Num n, Num k, Pos pos) {
    final BigInteger[] nk = nk("P", n, k, pos);
    BigInteger r = BigInteger.ONE;
    for (BigInteger i = nk[0].subtract(nk[1]).add(BigInteger.ONE);
         i.compareTo(nk[0]) <= 0; i = i.add(BigInteger.ONE)) {
      r = r.multiply(i);
    }
    return Num.of(r);
  }

  /** Returns the number of unordered selections of {@code k} items from
   * {@code n}, "n C k". */
  public static Num combinations(Num n, Num k, Pos pos) {
    final BigInteger[] nk = nk("C", n, k, pos);
    final BigInteger kk = nk[1].min(nk[0].subtract(nk[1]));
    BigInteger r = BigInteger.ONE;
    for (BigInteger i = BigInteger.ONE; i.compareTo(kk) <= 0;
         i = i.add(BigInteger.ONE)) {
      r = r.multiply(nk[0].subtract(kk).add(i)).divide(i);
    }
    return Num.of(r);
  }

  private static BigInteger[] nk(String op, Num n, Num k, Pos pos) {
    if (!n.isReal() || !k.isReal() || !n.isIntegral() || !k.isIntegral()
        || n.signum() < 0 || k.signum() < 0 || k.compareTo(n) > 0
        || n.compareTo(Num.of(MAX_FACTORIAL)) > 0) {
      throw new EvaluationException(
          String.format(Locale.ROOT,
              "Operator '%s' requires integers 0 <= k <= n, got n = %s, "
                  + "k = %s", op, n, k), pos);
    }
    return new BigInteger[] {n.bigIntegerValue(), k.bigIntegerValue()};
  }
}

// End Functions.java
