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

import static net.hydromatic.calx.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.calx.ast.Ast;
import net.hydromatic.calx.ast.Op;
import net.hydromatic.calx.ast.Pos;
import net.hydromatic.calx.num.Num;
import net.hydromatic.calx.rewrite.Simplifier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Evaluates expressions.
 *
 * <p>The value of an expression is a {@link Num}, {@link Boolean},
 * {@link String}, {@link List}, {@link Map}, null (the value of
 * {@code null}), or, if the expression has variables that are not bound,
 * an {@link Ast.Exp}. In the last case, the numeric parts of the expression
 * are evaluated, the expression is rebuilt around them and simplified;
 * {@code 2 * 3 * x} evaluates to the expression {@code 6 * x}.
 */
public class Evaluator {
  private final Session session;
  private @Nullable Simplifier simplifier;

  /** Creates an Evaluator. */
  public Evaluator(Session session) {
    this(session, null);
  }

  /** Creates an Evaluator that uses a given simplifier to simplify the
   * expressions that remain when variables are unbound. If the simplifier
   * is null, creates one when needed. */
  public Evaluator(Session session, @Nullable Simplifier simplifier) {
    this.session = session;
    this.simplifier = simplifier;
  }

  private Simplifier simplifier() {
    if (simplifier == null) {
      simplifier = new Simplifier(session);
    }
    return simplifier;
  }

  /** Evaluates an expression that has no variables, or whose variables are
   * to remain symbolic. */
  public @Nullable Object evaluate(Ast.Exp exp) {
    return evaluate(exp, ImmutableMap.of());
  }

  /** Evaluates an expression with a given set of variable bindings.
   *
   * <p>A binding may be a {@link Num}, a Java {@link Number}, an
   * {@link Ast.Exp}, or a boolean, string, list or map value.
   *
   * @throws EvaluationException on division by zero, an unknown function,
   *   an argument outside a function's domain, or a type error */
  public @Nullable Object evaluate(Ast.Exp exp, Map<String, ?> bindings) {
    final Object o = new Eval(bindings, false).eval(exp);
    session.tracer.onResult(o);
    return o;
  }

  /** Evaluates an expression to a number.
   *
   * @throws EvaluationException if a variable is not bound, or the value is
   *   not a number */
  public Num evaluateNum(Ast.Exp exp, Map<String, ?> bindings) {
    final Object o = new Eval(bindings, true).eval(exp);
    if (!(o instanceof Num)) {
      throw new EvaluationException("Expected a number, got "
          + describe(o), exp.pos);
    }
    session.tracer.onResult(o);
    return (Num) o;
  }

  /** Evaluates an expression with one variable bound to a number. */
  public Num evaluateNum(Ast.Exp exp, String variable, Num value) {
    return evaluateNum(exp, ImmutableMap.of(variable, value));
  }

  /** Returns the value of a named constant, or null. */
  public @Nullable Num constant(String name) {
    switch (name) {
      case "pi":
        return Num.of(Math.PI);
      case "e":
        return Num.of(Math.E);
      case "i":
        return session.complex() ? Num.I : null;
      default:
        return null;
    }
  }

  private static String describe(@Nullable Object o) {
    if (o == null) {
      return "null";
    }
    if (o instanceof Ast.Exp) {
      return "expression '" + o + "'";
    }
    return o.getClass().getSimpleName().toLowerCase(Locale.ROOT)
        + " " + o;
  }

  /** Converts a value back into an expression. */
  private static Ast.Exp toExp(@Nullable Object o) {
    if (o instanceof List) {
      final List<Ast.Exp> list = new ArrayList<>();
      for (Object e : (List<?>) o) {
        list.add(toExp(e));
      }
      return ast.list(Pos.ZERO, list);
    }
    if (o instanceof Map) {
      final List<Ast.Exp> keys = new ArrayList<>();
      final List<Ast.Exp> values = new ArrayList<>();
      ((Map<?, ?>) o).forEach((k, v) -> {
        keys.add(toExp(k));
        values.add(toExp(v));
      });
      return ast.map(Pos.ZERO, keys, values);
    }
    return ast.lift(o);
  }

  /** Evaluation of one expression with a set of bindings. */
  private class Eval {
    final Map<String, ?> bindings;
    /** Whether an unbound variable is an error, rather than remaining
     * symbolic. */
    final boolean strict;

    Eval(Map<String, ?> bindings, boolean strict) {
      this.bindings = bindings;
      this.strict = strict;
    }

    @Nullable Object eval(Ast.Exp exp) {
      switch (exp.op) {
        case NUMBER:
        case STRING:
        case BOOL:
        case NULL:
          return ((Ast.Literal) exp).value;
        case ID:
          return id((Ast.Id) exp);
        case GROUP:
          return eval(((Ast.Group) exp).exp);
        case APPLY:
          return apply((Ast.Apply) exp);
        case IF:
          return ifThenElse((Ast.If) exp);
        case MEMBER:
          return member((Ast.Member) exp);
        case INDEX:
          return index((Ast.Index) exp);
        case LIST:
          return list((Ast.ListExp) exp);
        case MAP:
          return map((Ast.MapExp) exp);
        case POLYNOMIAL:
          return polynomial((Ast.PolynomialExp) exp);
        case NEGATE:
        case POSITIVE:
        case NOT:
        case BIT_NOT:
        case FACTORIAL:
        case PERCENT:
          return unary((Ast.Unary) exp);
        default:
          return infix((Ast.InfixCall) exp);
      }
    }

    @Nullable Object id(Ast.Id id) {
      if (bindings.containsKey(id.name)) {
        final Object o = bindings.get(id.name);
        if (o instanceof Ast.Exp) {
          // Evaluate the bound expression without this binding, so that
          // "x" bound to "x + 1" does not recurse
          final Map<String, Object> map = new HashMap<>(bindings);
          map.remove(id.name);
          return new Eval(map, strict).eval((Ast.Exp) o);
        }
        if (o instanceof Number) {
          return Num.of((Number) o);
        }
        return o;
      }
      final Num constant = constant(id.name);
      if (constant != null) {
        return constant;
      }
      if (strict) {
        throw new EvaluationException("Unbound variable '" + id.name + "'",
            id.pos);
      }
      return id;
    }

    /** Rebuilds an expression from the values of its arguments, and
     * simplifies it. Called when at least one argument is symbolic. */
    Ast.Exp symbolic(Ast.Exp exp, List<?> values) {
      final List<Ast.Exp> args = new ArrayList<>();
      for (Object value : values) {
        args.add(toExp(value));
      }
      return simplifier().simplify(exp.copy(args));
    }

    boolean isSymbolic(@Nullable Object o) {
      return o instanceof Ast.Exp;
    }

    Num num(@Nullable Object o, Ast.Exp exp) {
      if (o instanceof Num) {
        return (Num) o;
      }
      throw new EvaluationException("Operator '" + exp.op.opName
          + "' requires numeric operands, got " + describe(o), exp.pos);
    }

    boolean bool(@Nullable Object o, Ast.Exp exp) {
      if (o instanceof Boolean) {
        return (Boolean) o;
      }
      throw new EvaluationException("Expected a boolean, got "
          + describe(o), exp.pos);
    }

    BigInteger integer(@Nullable Object o, Ast.Exp exp) {
      final Num n = num(o, exp);
      if (!n.isIntegral()) {
        throw new EvaluationException("Operator '" + exp.op.opName
            + "' requires integer operands, got " + n, exp.pos);
      }
      return n.bigIntegerValue();
    }

    /** Checks that a numeric result is real if complex values are
     * disabled. */
    Num checkComplex(Num result, Ast.Exp exp, Num... operands) {
      if (!result.isReal() && !session.complex()) {
        for (Num operand : operands) {
          if (!operand.isReal()) {
            return result;
          }
        }
        throw new EvaluationException("Result of '" + exp
            + "' is complex, and complex numbers are disabled", exp.pos);
      }
      return result;
    }

    @Nullable Object unary(Ast.Unary unary) {
      final Object a = eval(unary.a);
      if (isSymbolic(a)) {
        return symbolic(unary, Collections.singletonList(a));
      }
      try {
        switch (unary.op) {
          case NEGATE:
            return num(a, unary).negate();
          case POSITIVE:
            return num(a, unary);
          case NOT:
            return !bool(a, unary);
          case BIT_NOT:
            return Num.of(integer(a, unary).not());
          case FACTORIAL:
            return Functions.factorial(num(a, unary), unary.pos);
          case PERCENT:
            return num(a, unary).divide(Num.of(100));
          default:
            throw new AssertionError(unary.op);
        }
      } catch (ArithmeticException e) {
        throw new EvaluationException(e.getMessage(), unary.pos, e);
      }
    }

    @Nullable Object infix(Ast.InfixCall call) {
      final Object a0 = eval(call.a0);
      switch (call.op) {
        case AND:
          if (Boolean.FALSE.equals(a0)) {
            return false;
          }
          break;
        case OR:
          if (Boolean.TRUE.equals(a0)) {
            return true;
          }
          break;
        case COALESCE:
          if (a0 != null && !isSymbolic(a0)) {
            return a0;
          }
          break;
        default:
          break;
      }
      final Object a1 = eval(call.a1);
      switch (call.op) {
        case TIMES:
          if (isZero(a0) && isSymbolic(a1) || isOne(a1) && isSymbolic(a0)) {
            return a0;
          }
          if (isZero(a1) && isSymbolic(a0) || isOne(a0) && isSymbolic(a1)) {
            return a1;
          }
          break;
        case PLUS:
          if (isZero(a0) && isSymbolic(a1)) {
            return a1;
          }
          if (isZero(a1) && isSymbolic(a0)) {
            return a0;
          }
          break;
        case COALESCE:
          if (a0 == null) {
            return a1;
          }
          break;
        default:
          break;
      }
      if (isSymbolic(a0) || isSymbolic(a1)) {
        return symbolic(call, Arrays.asList(a0, a1));
      }
      try {
        return binary(call, a0, a1);
      } catch (ArithmeticException e) {
        throw new EvaluationException(e.getMessage(), call.pos, e);
      }
    }

    boolean isZero(@Nullable Object o) {
      return o instanceof Num && ((Num) o).isZero();
    }

    boolean isOne(@Nullable Object o) {
      return o instanceof Num && ((Num) o).isOne();
    }

    @Nullable Object binary(Ast.InfixCall call, @Nullable Object a0,
        @Nullable Object a1) {
      switch (call.op) {
        case EQ:
          return valueEquals(a0, a1);
        case NE:
          return !valueEquals(a0, a1);
        case LT:
          return compare(call, a0, a1) < 0;
        case LE:
          return compare(call, a0, a1) <= 0;
        case GT:
          return compare(call, a0, a1) > 0;
        case GE:
          return compare(call, a0, a1) >= 0;
        case AND:
          return bool(a0, call) && bool(a1, call);
        case OR:
          return bool(a0, call) || bool(a1, call);
        case PLUS:
          if (a0 instanceof String || a1 instanceof String) {
            return String.valueOf(a0) + a1;
          }
          if (a0 instanceof List && a1 instanceof List) {
            final List<Object> list = new ArrayList<>((List<?>) a0);
            list.addAll((List<?>) a1);
            return Collections.unmodifiableList(list);
          }
          return num(a0, call).plus(num(a1, call));
        case MINUS:
          return num(a0, call).minus(num(a1, call));
        case TIMES:
          return num(a0, call).times(num(a1, call));
        case DIVIDE:
          return num(a0, call).divide(num(a1, call));
        case MOD:
          return num(a0, call).mod(num(a1, call));
        case POWER:
          final Num base = num(a0, call);
          final Num exponent = num(a1, call);
          return checkComplex(base.pow(exponent), call, base, exponent);
        case INT_DIVIDE:
          return intDivide(call, a0, a1);
        case BIT_AND:
          if (a0 instanceof Boolean && a1 instanceof Boolean) {
            return (Boolean) a0 & (Boolean) a1;
          }
          return Num.of(integer(a0, call).and(integer(a1, call)));
        case BIT_OR:
          if (a0 instanceof Boolean && a1 instanceof Boolean) {
            return (Boolean) a0 | (Boolean) a1;
          }
          return Num.of(integer(a0, call).or(integer(a1, call)));
        case SHL:
          return Num.of(integer(a0, call).shiftLeft(shift(call, a1)));
        case SHR:
          return Num.of(integer(a0, call).shiftRight(shift(call, a1)));
        case PERMUTE:
          return Functions.permutations(num(a0, call), num(a1, call),
              call.pos);
        case CHOOSE:
          return Functions.combinations(num(a0, call), num(a1, call),
              call.pos);
        default:
          throw new AssertionError(call.op);
      }
    }

    boolean valueEquals(@Nullable Object a0, @Nullable Object a1) {
      if (a0 instanceof Num && a1 instanceof Num) {
        return ((Num) a0).numericallyEquals((Num) a1);
      }
      return Objects.equals(a0, a1);
    }

    int compare(Ast.InfixCall call, @Nullable Object a0,
        @Nullable Object a1) {
      if (a0 instanceof Num && a1 instanceof Num) {
        return ((Num) a0).compareTo((Num) a1);
      }
      if (a0 instanceof String && a1 instanceof String) {
        return ((String) a0).compareTo((String) a1);
      }
      throw new EvaluationException("Cannot compare " + describe(a0)
          + " and " + describe(a1), call.pos);
    }

    int shift(Ast.InfixCall call, @Nullable Object o) {
      final BigInteger n = integer(o, call);
      if (n.bitLength() > 16) {
        throw new EvaluationException("Shift distance too large: " + n,
            call.pos);
      }
      return n.intValue();
    }

    Num intDivide(Ast.InfixCall call, @Nullable Object a0,
        @Nullable Object a1) {
      final Num n0 = num(a0, call);
      final Num n1 = num(a1, call);
      if (n1.isZero()) {
        throw new ArithmeticException("Division by zero");
      }
      if (n0.kind == Num.Kind.INTEGER && n1.kind == Num.Kind.INTEGER) {
        final BigInteger b = n1.bigIntegerValue();
        final BigInteger[] qr = n0.bigIntegerValue().divideAndRemainder(b);
        if (qr[1].signum() != 0 && qr[1].signum() != b.signum()) {
          return Num.of(qr[0].subtract(BigInteger.ONE));
        }
        return Num.of(qr[0]);
      }
      return Num.of(Math.floor(n0.doubleValue() / n1.doubleValue()))
          .toIntegerIfWhole();
    }

    @Nullable Object apply(Ast.Apply apply) {
      final List<Object> values = new ArrayList<>();
      boolean symbolic = false;
      for (Ast.Exp arg : apply.args) {
        final Object value = eval(arg);
        symbolic |= isSymbolic(value);
        values.add(value);
      }
      if (symbolic) {
        if (!Functions.isFunction(apply.name)) {
          throw new EvaluationException("Unknown function '" + apply.name
              + "'", apply.pos);
        }
        return symbolic(apply, values);
      }
      final List<Num> nums = new ArrayList<>();
      for (Object value : values) {
        if (!(value instanceof Num)) {
          throw new EvaluationException("Function '" + apply.name
              + "' requires numeric arguments, got " + describe(value),
              apply.pos);
        }
        nums.add((Num) value);
      }
      try {
        return Functions.apply(session, apply.pos, apply.name, nums);
      } catch (ArithmeticException e) {
        throw new EvaluationException(e.getMessage(), apply.pos, e);
      }
    }

    @Nullable Object ifThenElse(Ast.If anIf) {
      final Object condition = eval(anIf.condition);
      if (isSymbolic(condition)) {
        return symbolic(anIf,
            Arrays.asList(condition, eval(anIf.ifTrue),
                eval(anIf.ifFalse)));
      }
      return bool(condition, anIf) ? eval(anIf.ifTrue) : eval(anIf.ifFalse);
    }

    @Nullable Object member(Ast.Member member) {
      final Object o = eval(member.exp);
      if (isSymbolic(o)) {
        return symbolic(member, Collections.singletonList(o));
      }
      if (o instanceof Map && ((Map<?, ?>) o).containsKey(member.field)) {
        return ((Map<?, ?>) o).get(member.field);
      }
      throw new EvaluationException("No member '" + member.field + "' in "
          + describe(o), member.pos);
    }

    @Nullable Object index(Ast.Index index) {
      final Object o = eval(index.exp);
      final Object key = eval(index.key);
      if (isSymbolic(o) || isSymbolic(key)) {
        return symbolic(index, Arrays.asList(o, key));
      }
      if (o instanceof Map) {
        final Map<?, ?> map = (Map<?, ?>) o;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
          if (valueEquals(entry.getKey(), key)) {
            return entry.getValue();
          }
        }
        throw new EvaluationException("Key " + describe(key)
            + " not found", index.pos);
      }
      if (o instanceof List || o instanceof String) {
        final int size = o instanceof List
            ? ((List<?>) o).size()
            : ((String) o).length();
        final BigInteger n = integer(key, index);
        if (n.signum() < 0 || n.compareTo(BigInteger.valueOf(size)) >= 0) {
          throw new EvaluationException("Index " + n + " out of range for "
              + "length " + size, index.pos);
        }
        return o instanceof List
            ? ((List<?>) o).get(n.intValue())
            : String.valueOf(((String) o).charAt(n.intValue()));
      }
      throw new EvaluationException("Cannot index " + describe(o),
          index.pos);
    }

    Object list(Ast.ListExp list) {
      final List<Object> values = new ArrayList<>();
      boolean symbolic = false;
      for (Ast.Exp arg : list.args) {
        final Object value = eval(arg);
        symbolic |= isSymbolic(value);
        values.add(value);
      }
      if (symbolic) {
        return symbolic(list, values);
      }
      return Collections.unmodifiableList(values);
    }

    Object map(Ast.MapExp mapExp) {
      final Map<Object, Object> map = new LinkedHashMap<>();
      final List<Object> values = new ArrayList<>();
      boolean symbolic = false;
      for (int i = 0; i < mapExp.keys.size(); i++) {
        final Ast.Exp keyExp = mapExp.keys.get(i);
        // A bare identifier as a key is a name, as in "{a: 1}"
        final Object key = keyExp.op == Op.ID
            ? ((Ast.Id) keyExp).name
            : eval(keyExp);
        final Object value = eval(mapExp.values.get(i));
        symbolic |= isSymbolic(key) || isSymbolic(value);
        values.add(keyExp.op == Op.ID ? keyExp : key);
        values.add(value);
        map.put(key, value);
      }
      if (symbolic) {
        return symbolic(mapExp, values);
      }
      return Collections.unmodifiableMap(map);
    }

    Object polynomial(Ast.PolynomialExp exp) {
      final Object o = id(ast.id(exp.polynomial.variable));
      if (isSymbolic(o)) {
        return exp;
      }
      return exp.polynomial.evaluate(num(o, exp));
    }
  }
}

// End Evaluator.java
