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
package net.hydromatic.calx.solve;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.calx.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import net.hydromatic.calx.ast.Ast;
import net.hydromatic.calx.ast.Op;
import net.hydromatic.calx.calculus.Differentiator;
import net.hydromatic.calx.eval.EvaluationException;
import net.hydromatic.calx.eval.Evaluator;
import net.hydromatic.calx.eval.Prop;
import net.hydromatic.calx.eval.Session;
import net.hydromatic.calx.num.Num;
import net.hydromatic.calx.poly.Polynomial;
import net.hydromatic.calx.poly.Polynomials;
import net.hydromatic.calx.rewrite.Expander;
import net.hydromatic.calx.rewrite.FreeFinder;
import net.hydromatic.calx.rewrite.Replacer;
import net.hydromatic.calx.rewrite.Simplifier;
import net.hydromatic.calx.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Solves equations.
 *
 * <p>An equation is either an {@code ==} expression, or an expression that
 * is to equal zero. The solver keeps the equation in the form
 * {@code lhs = target} and peels operators off {@code lhs}, applying the
 * inverse of each to {@code target}, until {@code lhs} is the variable.
 * A product that equals zero is split into its factors. If no operator can
 * be inverted, and the equation is a polynomial in the variable, its roots
 * are found numerically.
 *
 * <p>Each state is reported to the session's
 * {@link net.hydromatic.calx.util.Tracer#onSolverStep tracer}.
 */
public class Solver {
  private static final Logger LOGGER = LoggerFactory.getLogger(Solver.class);

  /** A root is kept only if the equation, evaluated at the root, is this
   * close to zero. */
  private static final double RESIDUAL = 1e-6;

  /** Values given to the other variables of an equation when checking a
   * root. */
  private static final double[] SAMPLES = {0.5d, 1.5d, 2.5d};

  /** Inverse of each function that can be inverted. */
  private static final ImmutableMap<String, String> INVERSES =
      ImmutableMap.<String, String>builder()
          .put("sin", "asin")
          .put("cos", "acos")
          .put("tan", "atan")
          .put("asin", "sin")
          .put("acos", "cos")
          .put("atan", "tan")
          .put("sinh", "asinh")
          .put("asinh", "sinh")
          .put("cosh", "acosh")
          .put("acosh", "cosh")
          .put("tanh", "atanh")
          .put("atanh", "tanh")
          .put("exp", "ln")
          .put("ln", "exp")
          .build();

  private final Session session;
  private final Simplifier simplifier;
  private final Evaluator evaluator;

  /** Creates a Solver. */
  public Solver(Session session) {
    this(session, new Simplifier(session));
  }

  /** Creates a Solver that uses a given simplifier. */
  public Solver(Session session, Simplifier simplifier) {
    this.session = requireNonNull(session);
    this.simplifier = requireNonNull(simplifier);
    this.evaluator = new Evaluator(session, simplifier);
  }

  /**
   * Solves an equation for a variable.
   *
   * <p>Roots are evaluated to numbers. A root whose imaginary part is
   * negligible becomes real, and a real root within
   * {@link Prop#TOLERANCE} of an integer becomes that integer. Complex
   * roots are kept only if {@link Prop#COMPLEX} is true. Extraneous roots,
   * at which the equation cannot be evaluated or is not zero, are removed,
   * as are duplicates.
   *
   * @param equation Equation
   * @param variable Variable, or null to use the equation's only free
   *   variable or {@link Prop#DEFAULT_VARIABLE}
   * @return Roots, in the order found; empty if the equation is a
   *   contradiction
   * @throws SolverException if the equation cannot be solved, is true for
   *   every value of the variable, or has a root that depends on another
   *   variable
   */
  public List<Num> solve(Ast.Exp equation, @Nullable String variable) {
    final String v = variable != null
        ? variable
        : Differentiator.defaultVariable(session, equation);
    final Ast.Exp zero = toZero(equation);
    final List<Ast.Exp> solutions = new ArrayList<>();
    step(zero, ast.number(0), v, solutions);
    final double tolerance = session.tolerance();
    final List<Num> roots = new ArrayList<>();
    for (Ast.Exp solution : solutions) {
      final Num root;
      try {
        root = clean(evaluator.evaluateNum(solution, ImmutableMap.of()),
            tolerance);
      } catch (EvaluationException e) {
        throw new SolverException("Solution '" + solution + "' for " + v
            + " is not a number: " + e.getMessage(), equation.pos, e);
      }
      if (!root.isReal() && !session.complex()) {
        LOGGER.debug("Discarding complex root {}", root);
        continue;
      }
      if (!satisfies(zero, v, root)) {
        LOGGER.debug("Discarding extraneous root {}", root);
        continue;
      }
      if (!Static.anyMatch(roots,
          r -> r.closeTo(root, Math.sqrt(tolerance)))) {
        roots.add(root);
      }
    }
    return roots;
  }

  /**
   * Isolates a variable in an equation.
   *
   * <p>Returns the expression that the variable must equal. If there is
   * more than one, such as for {@code x^2 == y}, returns the first.
   *
   * @throws SolverException if the variable cannot be isolated
   */
  public Ast.Exp isolate(Ast.Exp equation, String variable) {
    final List<Ast.Exp> solutions = new ArrayList<>();
    step(toZero(equation), ast.number(0), variable, solutions);
    if (solutions.isEmpty()) {
      throw new SolverException("Equation '" + equation + "' has no "
          + "solution for " + variable, equation.pos);
    }
    return solutions.get(0);
  }

  /**
   * Solves a system of simultaneous equations.
   *
   * <p>Searches for an equation in which one of the remaining variables can
   * be isolated, substitutes the isolated expression into the other
   * equations, solves the reduced system, and substitutes back. If a choice
   * leads to an inconsistent system, tries the next.
   *
   * @return Value of each variable, sorted by name, or an empty map if no
   *   consistent assignment is found
   */
  public Map<String, Num> solveSystem(List<Ast.Exp> equations,
      List<String> variables) {
    final List<Ast.Exp> zeros = new ArrayList<>();
    for (Ast.Exp equation : equations) {
      zeros.add(toZero(equation));
    }
    final Map<String, Num> values = system(zeros, variables);
    return values == null
        ? ImmutableSortedMap.of()
        : ImmutableSortedMap.copyOf(values);
  }

  private @Nullable Map<String, Num> system(List<Ast.Exp> equations,
      List<String> variables) {
    if (variables.isEmpty()) {
      for (Ast.Exp equation : equations) {
        if (!satisfies(equation, ImmutableMap.of())) {
          return null;
        }
      }
      return new HashMap<>();
    }
    for (int i = 0; i < equations.size(); i++) {
      final Ast.Exp equation = equations.get(i);
      for (String variable : variables) {
        if (!FreeFinder.contains(equation, variable)) {
          continue;
        }
        final List<Ast.Exp> solutions = new ArrayList<>();
        try {
          step(equation, ast.number(0), variable, solutions);
        } catch (SolverException e) {
          LOGGER.debug("Cannot isolate {} in '{}': {}", variable, equation,
              e.getMessage());
          continue;
        }
        final List<Ast.Exp> others = new ArrayList<>(equations);
        others.remove(i);
        final List<String> remaining = Static.minus(variables, variable);
        for (Ast.Exp solution : solutions) {
          final Map<String, Ast.Exp> substitution =
              ImmutableMap.of(variable, solution);
          final List<Ast.Exp> reduced = new ArrayList<>();
          for (Ast.Exp other : others) {
            reduced.add(
                simplifier.simplify(Replacer.substitute(other, substitution)));
          }
          final Map<String, Num> values = system(reduced, remaining);
          if (values == null) {
            continue;
          }
          final Num value;
          try {
            value = clean(evaluator.evaluateNum(solution, values),
                session.tolerance());
          } catch (EvaluationException e) {
            LOGGER.debug("Cannot evaluate {} = {}: {}", variable, solution,
                e.getMessage());
            continue;
          }
          values.put(variable, value);
          return values;
        }
      }
    }
    return null;
  }

  /** Converts an equation {@code a == b} to {@code a - b}, simplified. */
  private Ast.Exp toZero(Ast.Exp equation) {
    if (equation.op == Op.EQ) {
      final Ast.InfixCall eq = (Ast.InfixCall) equation;
      return simplifier.simplify(ast.minus(eq.a0, eq.a1));
    }
    return simplifier.simplify(equation);
  }

  /** Solves {@code lhs = target} for {@code v}, adding each solution to a
   * list. {@code target} does not contain {@code v}. */
  private void step(Ast.Exp lhs, Ast.Exp target, String v,
      List<Ast.Exp> solutions) {
    final Ast.Exp t = simplifier.simplify(target);
    if (!FreeFinder.contains(lhs, v)) {
      final Ast.Exp difference = simplifier.simplify(ast.minus(lhs, t));
      if (difference.isNumber(0)) {
        throw new SolverException("Equation is true for every value of "
            + v, lhs.pos);
      }
      // A contradiction, such as 1 = 2, has no solutions
      session.tracer.onSolverStep("contradiction", lhs, t);
      return;
    }
    switch (lhs.op) {
      case ID:
        session.tracer.onSolverStep("solved", lhs, t);
        solutions.add(t);
        return;
      case GROUP:
        step(((Ast.Group) lhs).exp, t, v, solutions);
        return;
      case NEGATE:
        session.tracer.onSolverStep("negate", lhs, t);
        step(((Ast.Unary) lhs).a, ast.negate(t), v, solutions);
        return;
      case PLUS:
      case MINUS:
        if (sum((Ast.InfixCall) lhs, t, v, solutions)) {
          return;
        }
        break;
      case TIMES:
        if (product((Ast.InfixCall) lhs, t, v, solutions)) {
          return;
        }
        break;
      case DIVIDE:
        if (quotient((Ast.InfixCall) lhs, t, v, solutions)) {
          return;
        }
        break;
      case POWER:
        if (power((Ast.InfixCall) lhs, t, v, solutions)) {
          return;
        }
        break;
      case APPLY:
        if (apply((Ast.Apply) lhs, t, v, solutions)) {
          return;
        }
        break;
      default:
        break;
    }
    polynomial(lhs, t, v, solutions);
  }

  private boolean sum(Ast.InfixCall lhs, Ast.Exp t, String v,
      List<Ast.Exp> solutions) {
    final boolean in0 = FreeFinder.contains(lhs.a0, v);
    final boolean in1 = FreeFinder.contains(lhs.a1, v);
    if (in0 && in1) {
      return false;
    }
    session.tracer.onSolverStep("sum", lhs, t);
    if (in0) {
      // a0 + a1 = t  =>  a0 = t - a1;  a0 - a1 = t  =>  a0 = t + a1
      step(lhs.a0, lhs.op == Op.PLUS
          ? ast.minus(t, lhs.a1)
          : ast.plus(t, lhs.a1), v, solutions);
    } else {
      // a0 + a1 = t  =>  a1 = t - a0;  a0 - a1 = t  =>  a1 = a0 - t
      step(lhs.a1, lhs.op == Op.PLUS
          ? ast.minus(t, lhs.a0)
          : ast.minus(lhs.a0, t), v, solutions);
    }
    return true;
  }

  private boolean product(Ast.InfixCall lhs, Ast.Exp t, String v,
      List<Ast.Exp> solutions) {
    final boolean in0 = FreeFinder.contains(lhs.a0, v);
    final boolean in1 = FreeFinder.contains(lhs.a1, v);
    if (in0 && in1) {
      if (!t.isNumber(0)) {
        return false;
      }
      // A * B = 0  =>  A = 0 or B = 0
      session.tracer.onSolverStep("factors", lhs, t);
      step(lhs.a0, t, v, solutions);
      step(lhs.a1, t, v, solutions);
      return true;
    }
    session.tracer.onSolverStep("product", lhs, t);
    if (in0) {
      step(lhs.a0, ast.divide(t, lhs.a1), v, solutions);
    } else {
      step(lhs.a1, ast.divide(t, lhs.a0), v, solutions);
    }
    return true;
  }

  private boolean quotient(Ast.InfixCall lhs, Ast.Exp t, String v,
      List<Ast.Exp> solutions) {
    final boolean in0 = FreeFinder.contains(lhs.a0, v);
    final boolean in1 = FreeFinder.contains(lhs.a1, v);
    session.tracer.onSolverStep("quotient", lhs, t);
    if (in0 && !in1) {
      step(lhs.a0, ast.times(t, lhs.a1), v, solutions);
      return true;
    }
    if (t.isNumber(0)) {
      // A / B = 0  =>  A = 0, excluding roots of B, which the caller
      // discards because the equation cannot be evaluated there
      step(lhs.a0, t, v, solutions);
      return true;
    }
    if (!in0) {
      step(lhs.a1, ast.divide(lhs.a0, t), v, solutions);
      return true;
    }
    return false;
  }

  private boolean power(Ast.InfixCall lhs, Ast.Exp t, String v,
      List<Ast.Exp> solutions) {
    final Ast.Exp base = lhs.a0;
    final Ast.Exp exponent = lhs.a1;
    if (!FreeFinder.contains(exponent, v)) {
      if (t.isNumber(0) && isPositive(exponent)) {
        // A^n = 0  =>  A = 0
        session.tracer.onSolverStep("powerBase", lhs, t);
        step(base, t, v, solutions);
        return true;
      }
      if (isPolynomial(lhs, t, v)) {
        return false;
      }
      session.tracer.onSolverStep("root", lhs, t);
      final Ast.Exp root =
          ast.power(t, ast.divide(ast.number(1), exponent));
      step(base, root, v, solutions);
      if (isEven(exponent)) {
        step(base, ast.negate(root), v, solutions);
      }
      return true;
    }
    if (!FreeFinder.contains(base, v)) {
      // b^g = t  =>  g = ln(t) / ln(b)
      session.tracer.onSolverStep("logarithm", lhs, t);
      final Ast.Exp ln =
          base.op == Op.ID && ((Ast.Id) base).name.equals("e")
              ? ast.apply("ln", t)
              : ast.divide(ast.apply("ln", t), ast.apply("ln", base));
      step(exponent, ln, v, solutions);
      return true;
    }
    return false;
  }

  private boolean apply(Ast.Apply lhs, Ast.Exp t, String v,
      List<Ast.Exp> solutions) {
    if (lhs.args.size() != 1) {
      return false;
    }
    final Ast.Exp u = lhs.arg();
    final String inverse = INVERSES.get(lhs.name);
    final Ast.Exp target;
    if (inverse != null) {
      target = ast.apply(inverse, t);
    } else {
      switch (lhs.name) {
        case "sqrt":
          target = ast.power(t, ast.number(2));
          break;
        case "cbrt":
          target = ast.power(t, ast.number(3));
          break;
        case "log":
        case "log10":
          target = ast.power(ast.number(10), t);
          break;
        case "log2":
          target = ast.power(ast.number(2), t);
          break;
        case "abs":
          session.tracer.onSolverStep("abs", lhs, t);
          step(u, t, v, solutions);
          step(u, ast.negate(t), v, solutions);
          return true;
        default:
          return false;
      }
    }
    session.tracer.onSolverStep("inverse", lhs, t);
    step(u, target, v, solutions);
    return true;
  }

  /** Whether {@code lhs - t} is a polynomial of degree 2 or more. Such an
   * equation is better solved by finding the roots of the polynomial than
   * by taking a root of both sides. */
  private boolean isPolynomial(Ast.Exp lhs, Ast.Exp t, String v) {
    final Polynomial p = toPolynomial(lhs, t, v);
    return p != null && p.degree() >= 2;
  }

  private @Nullable Polynomial toPolynomial(Ast.Exp lhs, Ast.Exp t,
      String v) {
    final Ast.Exp e =
        simplifier.simplify(Expander.expand(ast.minus(lhs, t)));
    return Polynomials.toPolynomial(e, v);
  }

  /** Last resort: if {@code lhs - t} is a polynomial in {@code v}, adds its
   * roots. */
  private void polynomial(Ast.Exp lhs, Ast.Exp t, String v,
      List<Ast.Exp> solutions) {
    final Polynomial p = toPolynomial(lhs, t, v);
    if (p == null || p.degree() < 1) {
      throw new SolverException("Cannot solve '" + lhs + " = " + t
          + "' for " + v, lhs.pos);
    }
    session.tracer.onSolverStep("polynomial", lhs, t);
    final List<Num> roots;
    try {
      roots = p.roots(Prop.MAX_ITERATIONS.intValue(session.map),
          session.tolerance());
    } catch (ArithmeticException e) {
      throw new SolverException("Cannot find roots of " + p + ": "
          + e.getMessage(), lhs.pos, e);
    }
    LOGGER.debug("Roots of {}: {}", p, roots);
    for (Num root : roots) {
      solutions.add(ast.number(root));
    }
  }

  /** Whether the equation {@code exp = 0} holds when {@code v} has a given
   * value. */
  /** Returns whether a root makes an expression zero.
   *
   * <p>If the expression has variables other than {@code v}, such as
   * {@code y} in {@code x * y}, the root must make it zero whatever their
   * values, so the residual is simplified and then checked at a few sample
   * values. A sample at which the residual cannot be evaluated is
   * skipped, but at least one must succeed. */
  private boolean satisfies(Ast.Exp exp, String v, Num value) {
    final Set<String> others = new TreeSet<>(FreeFinder.freeVariables(exp));
    others.remove(v);
    if (others.isEmpty()) {
      return satisfies(exp, ImmutableMap.of(v, value));
    }
    final Ast.Exp residual =
        simplifier.simplify(
            Replacer.substitute(exp,
                ImmutableMap.of(v, ast.number(value))));
    boolean evaluated = false;
    for (double sample : SAMPLES) {
      final Map<String, Num> bindings = new HashMap<>();
      for (String other : FreeFinder.freeVariables(residual)) {
        bindings.put(other, Num.of(sample));
      }
      final Num n;
      try {
        n = evaluator.evaluateNum(residual, bindings);
      } catch (EvaluationException e) {
        LOGGER.debug("Cannot evaluate '{}' with {}: {}", residual, bindings,
            e.getMessage());
        continue;
      }
      if (!n.closeTo(Num.ZERO, RESIDUAL)) {
        return false;
      }
      evaluated = true;
    }
    return evaluated;
  }

  private boolean satisfies(Ast.Exp exp, Map<String, ?> bindings) {
    final Num residual;
    try {
      residual = evaluator.evaluateNum(exp, bindings);
    } catch (EvaluationException e) {
      LOGGER.debug("Cannot evaluate '{}' with {}: {}", exp, bindings,
          e.getMessage());
      return false;
    }
    return residual.closeTo(Num.ZERO, RESIDUAL);
  }

  private static boolean isPositive(Ast.Exp e) {
    return e.isNumber()
        && ((Ast.Literal) e).num().isReal()
        && ((Ast.Literal) e).num().signum() > 0;
  }

  private static boolean isEven(Ast.Exp e) {
    if (!e.isNumber() || !((Ast.Literal) e).num().isIntegral()) {
      return false;
    }
    return !((Ast.Literal) e).num().bigIntegerValue().testBit(0);
  }

  /** Cleans a numeric root: drops a negligible imaginary part, and rounds
   * a value that is very close to an integer. */
  static Num clean(Num root, double tolerance) {
    Num r = root;
    final double scale = Math.max(1d, r.abs().doubleValue());
    if (!r.isReal()
        && Math.abs(r.imaginaryValue()) <= Math.sqrt(tolerance) * scale) {
      r = Num.of(r.doubleValue());
    }
    if (r.isReal() && !r.isIntegral()) {
      final double d = r.doubleValue();
      final double rounded = Math.rint(d);
      if (Math.abs(d - rounded) <= tolerance * scale) {
        r = Num.of(rounded);
      }
    }
    return r.isReal() ? r.toIntegerIfWhole() : r;
  }
}

// End Solver.java
