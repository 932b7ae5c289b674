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
package net.hydromatic.calx.num;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Numeric value.
 *
 * <p>A value has a {@link Kind}. The kinds are ordered by generality; the
 * result of an operation on two values has (at least) the more general kind
 * of its operands. There are two exceptions. A {@link Kind#PRECISE} value
 * combined with a value that has a non-zero imaginary part yields a
 * {@link Kind#COMPLEX} value, because {@link BigDecimal} has no imaginary
 * part. Dividing two integers yields an integer only if the division is
 * exact.
 *
 * <p>Values are immutable.
 */
public final class Num implements Comparable<Num> {
  /** Kind of numeric value, in increasing order of generality. */
  public enum Kind {
    INTEGER,
    DOUBLE,
    IMAGINARY,
    COMPLEX,
    PRECISE
  }

  /** Math context for {@link Kind#PRECISE} values created without one. */
  public static final MathContext DEFAULT_CONTEXT =
      new MathContext(50, RoundingMode.HALF_EVEN);

  /** Decimal literals with more significant digits than this become
   * {@link Kind#PRECISE}. */
  private static final int DOUBLE_DIGITS = 15;

  public static final Num ZERO = of(0);
  public static final Num ONE = of(1);
  public static final Num MINUS_ONE = of(-1);
  public static final Num I = imaginary(1d);

  public final Kind kind;
  private final @Nullable BigInteger integer;
  private final double re;
  private final double im;
  private final @Nullable BigDecimal decimal;
  private final MathContext mathContext;

  private Num(Kind kind, @Nullable BigInteger integer, double re, double im,
      @Nullable BigDecimal decimal, MathContext mathContext) {
    this.kind = requireNonNull(kind);
    this.integer = integer;
    this.re = re;
    this.im = im;
    this.decimal = decimal;
    this.mathContext = requireNonNull(mathContext);
  }

  /** Creates an integer value. */
  public static Num of(long value) {
    return of(BigInteger.valueOf(value));
  }

  /** Creates an integer value. */
  public static Num of(BigInteger value) {
    return new Num(Kind.INTEGER, requireNonNull(value), 0d, 0d, null,
        DEFAULT_CONTEXT);
  }

  /** Creates a floating-point value. */
  public static Num of(double value) {
    return new Num(Kind.DOUBLE, null, value, 0d, null, DEFAULT_CONTEXT);
  }

  /** Creates a value from a Java number. */
  public static Num of(Number number) {
    if (number instanceof BigInteger) {
      return of((BigInteger) number);
    }
    if (number instanceof BigDecimal) {
      return precise((BigDecimal) number, DEFAULT_CONTEXT);
    }
    if (number instanceof Double || number instanceof Float) {
      return of(number.doubleValue());
    }
    return of(number.longValue());
  }

  /** Creates a purely imaginary value, {@code im * i}. */
  public static Num imaginary(double im) {
    return new Num(Kind.IMAGINARY, null, 0d, im, null, DEFAULT_CONTEXT);
  }

  /** Creates a complex value, {@code re + im * i}. */
  public static Num complex(double re, double im) {
    return new Num(Kind.COMPLEX, null, re, im, null, DEFAULT_CONTEXT);
  }

  /** Creates an arbitrary-precision value, rounded to a math context. */
  public static Num precise(BigDecimal value, MathContext mathContext) {
    return new Num(Kind.PRECISE, null, 0d, 0d, value.round(mathContext),
        mathContext);
  }

  /**
   * Parses a numeric literal.
   *
   * <p>Accepts integers, radix-prefixed integers ({@code 0x1F},
   * {@code 0b101}, {@code 0o17}), decimals and scientific notation. A decimal
   * with more than 15 significant digits becomes {@link Kind#PRECISE},
   * unless it is the text that {@link #toString()} produces for a
   * {@link Kind#DOUBLE}, such as {@code 0.16666666666666666}.
   *
   * @throws NumberFormatException if the text is not a valid number
   */
  public static Num parse(String text, MathContext mathContext) {
    final String lower = text.toLowerCase(Locale.ROOT);
    if (lower.startsWith("0x")) {
      return of(new BigInteger(text.substring(2), 16));
    }
    if (lower.startsWith("0b")) {
      return of(new BigInteger(text.substring(2), 2));
    }
    if (lower.startsWith("0o")) {
      return of(new BigInteger(text.substring(2), 8));
    }
    if (lower.indexOf('.') >= 0 || lower.indexOf('e') >= 0) {
      final double d = Double.parseDouble(text);
      if (significantDigits(lower) > DOUBLE_DIGITS
          && !Double.toString(d).equalsIgnoreCase(text)) {
        return precise(new BigDecimal(text, mathContext), mathContext);
      }
      return of(d);
    }
    return of(new BigInteger(text));
  }

  private static int significantDigits(String text) {
    final int e = text.indexOf('e');
    final String mantissa = e >= 0 ? text.substring(0, e) : text;
    int n = 0;
    boolean leading = true;
    for (int i = 0; i < mantissa.length(); i++) {
      final char c = mantissa.charAt(i);
      if (c >= '0' && c <= '9') {
        if (c != '0' || !leading) {
          leading = false;
          ++n;
        }
      }
    }
    return n;
  }

  // Accessors

  /** Returns the real part as a {@code double}. */
  public double doubleValue() {
    switch (kind) {
      case INTEGER:
        return integer.doubleValue();
      case PRECISE:
        return decimal.doubleValue();
      case IMAGINARY:
        return 0d;
      default:
        return re;
    }
  }

  /** Returns the imaginary part as a {@code double}. */
  public double imaginaryValue() {
    return kind == Kind.IMAGINARY || kind == Kind.COMPLEX ? im : 0d;
  }

  /** Returns the value of an integer.
   *
   * @throws ArithmeticException if this value is not integral */
  public BigInteger bigIntegerValue() {
    if (kind == Kind.INTEGER) {
      return integer;
    }
    if (!isIntegral()) {
      throw new ArithmeticException("not an integer: " + this);
    }
    return toBigDecimal().toBigIntegerExact();
  }

  /** Returns the value of a small integer.
   *
   * @throws ArithmeticException if this value is not an integer that fits
   * in an {@code int} */
  public int intValueExact() {
    return bigIntegerValue().intValueExact();
  }

  /** Returns the real part as a {@link BigDecimal}. */
  public BigDecimal toBigDecimal() {
    switch (kind) {
      case INTEGER:
        return new BigDecimal(integer);
      case PRECISE:
        return decimal;
      default:
        return BigDecimal.valueOf(doubleValue());
    }
  }

  /** Whether the value has no imaginary part. */
  public boolean isReal() {
    return imaginaryValue() == 0d;
  }

  /** Whether the value is zero. */
  public boolean isZero() {
    switch (kind) {
      case INTEGER:
        return integer.signum() == 0;
      case PRECISE:
        return decimal.signum() == 0;
      default:
        return doubleValue() == 0d && imaginaryValue() == 0d;
    }
  }

  /** Whether the value is one. */
  public boolean isOne() {
    switch (kind) {
      case INTEGER:
        return integer.equals(BigInteger.ONE);
      case PRECISE:
        return decimal.compareTo(BigDecimal.ONE) == 0;
      default:
        return doubleValue() == 1d && imaginaryValue() == 0d;
    }
  }

  /** Whether the value is real and a whole number. */
  public boolean isIntegral() {
    switch (kind) {
      case INTEGER:
        return true;
      case PRECISE:
        return decimal.signum() == 0
            || decimal.stripTrailingZeros().scale() <= 0;
      default:
        final double d = doubleValue();
        return isReal() && !Double.isInfinite(d) && d == Math.rint(d);
    }
  }

  /** Whether the value is real and negative. */
  public boolean isNegative() {
    return isReal() && signum() < 0;
  }

  /** Returns -1, 0 or 1 according to the sign of a real value. */
  public int signum() {
    checkReal("signum");
    switch (kind) {
      case INTEGER:
        return integer.signum();
      case PRECISE:
        return decimal.signum();
      default:
        return (int) Math.signum(doubleValue());
    }
  }

  /** Converts a whole value of a floating kind to {@link Kind#INTEGER};
   * returns other values unchanged. */
  public Num toIntegerIfWhole() {
    if (kind != Kind.INTEGER && isIntegral()) {
      return of(toBigDecimal().toBigIntegerExact());
    }
    return this;
  }

  // Arithmetic

  private static Kind max(Kind k0, Kind k1) {
    return k0.ordinal() >= k1.ordinal() ? k0 : k1;
  }

  private static MathContext context(Num a, Num b) {
    return a.mathContext.getPrecision() >= b.mathContext.getPrecision()
        ? a.mathContext
        : b.mathContext;
  }

  /** Whether an operation between two values, one of which is
   * {@link Kind#PRECISE}, must be done in double complex arithmetic. */
  private static boolean preciseNeedsComplex(Num a, Num b) {
    return !a.isReal() || !b.isReal();
  }

  /** Creates the result of a double-complex operation, with a given kind. */
  private static Num fromComplex(Kind kind, double re, double im) {
    switch (kind) {
      case DOUBLE:
        return im == 0d ? of(re) : complex(re, im);
      case IMAGINARY:
        return re == 0d ? imaginary(im) : complex(re, im);
      default:
        return complex(re, im);
    }
  }

  public Num plus(Num o) {
    final Kind k = max(kind, o.kind);
    switch (k) {
      case INTEGER:
        return of(integer.add(o.integer));
      case PRECISE:
        if (!preciseNeedsComplex(this, o)) {
          final MathContext mc = context(this, o);
          return precise(toBigDecimal().add(o.toBigDecimal(), mc), mc);
        }
        return complex(doubleValue() + o.doubleValue(),
            imaginaryValue() + o.imaginaryValue());
      default:
        return fromComplex(k, doubleValue() + o.doubleValue(),
            imaginaryValue() + o.imaginaryValue());
    }
  }

  public Num minus(Num o) {
    return plus(o.negate());
  }

  public Num times(Num o) {
    final Kind k = max(kind, o.kind);
    switch (k) {
      case INTEGER:
        return of(integer.multiply(o.integer));
      case PRECISE:
        if (!preciseNeedsComplex(this, o)) {
          final MathContext mc = context(this, o);
          return precise(toBigDecimal().multiply(o.toBigDecimal(), mc), mc);
        }
        // fall through
      default:
        final double a = doubleValue();
        final double b = imaginaryValue();
        final double c = o.doubleValue();
        final double d = o.imaginaryValue();
        return fromComplex(k == Kind.PRECISE ? Kind.COMPLEX : k,
            a * c - b * d, a * d + b * c);
    }
  }

  /** Divides this value by another.
   *
   * @throws ArithmeticException if the divisor is zero */
  public Num divide(Num o) {
    if (o.isZero()) {
      throw new ArithmeticException("Division by zero");
    }
    final Kind k = max(kind, o.kind);
    switch (k) {
      case INTEGER:
        final BigInteger[] qr = integer.divideAndRemainder(o.integer);
        if (qr[1].signum() == 0) {
          return of(qr[0]);
        }
        return of(integer.doubleValue() / o.integer.doubleValue());
      case PRECISE:
        if (!preciseNeedsComplex(this, o)) {
          final MathContext mc = context(this, o);
          return precise(toBigDecimal().divide(o.toBigDecimal(), mc), mc);
        }
        // fall through
      default:
        final double a = doubleValue();
        final double b = imaginaryValue();
        final double c = o.doubleValue();
        final double d = o.imaginaryValue();
        final double m = c * c + d * d;
        return fromComplex(k == Kind.PRECISE ? Kind.COMPLEX : k,
            (a * c + b * d) / m, (b * c - a * d) / m);
    }
  }

  /** Returns the remainder of dividing this value by another. The result is
   * never negative.
   *
   * @throws ArithmeticException if the divisor is zero, or either value is
   * not real */
  public Num mod(Num o) {
    checkReal("mod");
    o.checkReal("mod");
    if (o.isZero()) {
      throw new ArithmeticException("Modulo by zero");
    }
    final Kind k = max(kind, o.kind);
    switch (k) {
      case INTEGER:
        return of(integer.mod(o.integer.abs()));
      case PRECISE:
        final MathContext mc = context(this, o);
        BigDecimal r = toBigDecimal().remainder(o.toBigDecimal(), mc);
        if (r.signum() < 0) {
          r = r.add(o.toBigDecimal().abs(), mc);
        }
        return precise(r, mc);
      default:
        double d = doubleValue() % o.doubleValue();
        if (d < 0) {
          d += Math.abs(o.doubleValue());
        }
        return of(d);
    }
  }

  /** Raises this value to a power.
   *
   * <p>A negative real raised to a non-integral power yields the principal
   * complex value.
   *
   * @throws ArithmeticException if this value is zero and the exponent is
   * not positive */
  public Num pow(Num o) {
    if (isZero()) {
      if (o.isReal() && o.signum() > 0) {
        return kind == Kind.INTEGER && o.kind == Kind.INTEGER ? ZERO : this;
      }
      throw new ArithmeticException("Zero raised to a non-positive power");
    }
    final Kind k = max(kind, o.kind);
    if (o.kind == Kind.INTEGER && o.integer.bitLength() < 31) {
      final int n = o.integer.intValue();
      switch (kind) {
        case INTEGER:
          if (n >= 0 && (n <= 10_000 || integer.abs().equals(BigInteger.ONE))) {
            return of(integer.pow(n));
          }
          break;
        case PRECISE:
          return precise(decimal.pow(n, mathContext), mathContext);
        case IMAGINARY:
        case COMPLEX:
          if (Math.abs(n) <= 64) {
            Num r = ONE;
            for (int i = 0; i < Math.abs(n); i++) {
              r = r.times(this);
            }
            return n >= 0 ? r : ONE.divide(r);
          }
          break;
        default:
          break;
      }
    }
    if (isReal() && o.isReal()) {
      final double base = doubleValue();
      final double exponent = o.doubleValue();
      if (base >= 0 || exponent == Math.rint(exponent)) {
        final double d = Math.pow(base, exponent);
        if (k == Kind.PRECISE) {
          return precise(BigDecimal.valueOf(d), context(this, o));
        }
        return fromComplex(k == Kind.INTEGER ? Kind.DOUBLE : k, d, 0d);
      }
    }
    // z ^ w = exp(w * ln(z))
    final double lnAbs = Math.log(Math.hypot(doubleValue(), imaginaryValue()));
    final double arg = Math.atan2(imaginaryValue(), doubleValue());
    final double c = o.doubleValue();
    final double d = o.imaginaryValue();
    final double x = c * lnAbs - d * arg;
    final double y = d * lnAbs + c * arg;
    final double m = Math.exp(x);
    return fromComplex(k == Kind.IMAGINARY ? Kind.IMAGINARY : Kind.COMPLEX,
        m * Math.cos(y), m * Math.sin(y));
  }

  /** Returns the principal square root. Exact for perfect squares. */
  public Num sqrt() {
    switch (kind) {
      case INTEGER:
        if (integer.signum() >= 0) {
          final BigInteger s = integer.sqrt();
          if (s.multiply(s).equals(integer)) {
            return of(s);
          }
          return of(Math.sqrt(integer.doubleValue()));
        }
        final BigInteger n = integer.negate();
        final BigInteger s = n.sqrt();
        return imaginary(s.multiply(s).equals(n)
            ? s.doubleValue()
            : Math.sqrt(n.doubleValue()));
      case PRECISE:
        if (decimal.signum() >= 0) {
          return precise(decimal.sqrt(mathContext), mathContext);
        }
        return imaginary(Math.sqrt(-decimal.doubleValue()));
      case DOUBLE:
        if (re >= 0) {
          return of(Math.sqrt(re));
        }
        return imaginary(Math.sqrt(-re));
      default:
        return pow(of(0.5d));
    }
  }

  public Num negate() {
    switch (kind) {
      case INTEGER:
        return of(integer.negate());
      case PRECISE:
        return precise(decimal.negate(), mathContext);
      case IMAGINARY:
        return imaginary(-im);
      case COMPLEX:
        return complex(-re, -im);
      default:
        return of(-re);
    }
  }

  /** Returns the absolute value (the modulus, for complex values). */
  public Num abs() {
    switch (kind) {
      case INTEGER:
        return of(integer.abs());
      case PRECISE:
        return precise(decimal.abs(), mathContext);
      case DOUBLE:
        return of(Math.abs(re));
      default:
        return of(Math.hypot(doubleValue(), imaginaryValue()));
    }
  }

  private void checkReal(String operation) {
    if (!isReal()) {
      throw new ArithmeticException("Cannot apply " + operation
          + " to complex value " + this);
    }
  }

  /** Compares two real values.
   *
   * @throws ArithmeticException if either value is not real */
  @Override public int compareTo(Num o) {
    checkReal("comparison");
    o.checkReal("comparison");
    if (kind == Kind.INTEGER && o.kind == Kind.INTEGER) {
      return integer.compareTo(o.integer);
    }
    if (kind == Kind.PRECISE || o.kind == Kind.PRECISE) {
      return toBigDecimal().compareTo(o.toBigDecimal());
    }
    return Double.compare(doubleValue(), o.doubleValue());
  }

  /** Whether two values are numerically equal, regardless of kind. For
   * example, integer 2 is numerically equal to double 2.0 but not
   * {@link #equals} to it. */
  public boolean numericallyEquals(Num o) {
    if (isReal() && o.isReal()) {
      return compareTo(o) == 0;
    }
    return doubleValue() == o.doubleValue()
        && imaginaryValue() == o.imaginaryValue();
  }

  /** Whether two values are within a tolerance of each other, relative to
   * their magnitude if it is greater than one. */
  public boolean closeTo(Num o, double tolerance) {
    checkArgument(tolerance >= 0, "tolerance must be non-negative");
    final double dr = doubleValue() - o.doubleValue();
    final double di = imaginaryValue() - o.imaginaryValue();
    final double scale =
        Math.max(1d, Math.max(abs().doubleValue(), o.abs().doubleValue()));
    return Math.hypot(dr, di) <= tolerance * scale;
  }

  @Override public int hashCode() {
    switch (kind) {
      case INTEGER:
        return integer.hashCode();
      case PRECISE:
        return decimal.stripTrailingZeros().hashCode();
      default:
        return Objects.hash(kind, re, im);
    }
  }

  @Override public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof Num) || ((Num) o).kind != kind) {
      return false;
    }
    final Num that = (Num) o;
    switch (kind) {
      case INTEGER:
        return integer.equals(that.integer);
      case PRECISE:
        return decimal.compareTo(that.decimal) == 0;
      default:
        return Double.compare(re, that.re) == 0
            && Double.compare(im, that.im) == 0;
    }
  }

  @Override public String toString() {
    switch (kind) {
      case INTEGER:
        return integer.toString();
      case PRECISE:
        return decimal.toPlainString();
      case DOUBLE:
        return Double.toString(re);
      case IMAGINARY:
        return Double.toString(im) + "i";
      default:
        if (im < 0 || im == 0d && 1d / im < 0) {
          return re + " - " + (-im) + "i";
        }
        return re + " + " + im + "i";
    }
  }
}

// End Num.java
