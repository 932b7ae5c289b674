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

import static net.hydromatic.calx.Cx.cx;
import static net.hydromatic.calx.Matchers.closeTo;
import static net.hydromatic.calx.Matchers.hasSortedValues;
import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.startsWith;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.calx.Calx;
import net.hydromatic.calx.ast.Ast;
import net.hydromatic.calx.eval.Prop;
import net.hydromatic.calx.num.Num;
import net.hydromatic.calx.util.Tracers;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.Test;

/** Tests for {@link Solver}. */
public class SolverTest {
  @Test void testLinear() {
    cx("2*x + 3 == 7").assertSolve(hasToString("[2]"));
    cx("x - 4").assertSolve(hasToString("[4]"));
    cx("3 == 6 - x").assertSolve(hasToString("[3]"));
    cx("1/x == 4").assertSolve(hasToString("[0.25]"));
  }

  @Test void testPolynomial() {
    cx("x^2 - 9").assertSolve(hasToString("[3, -3]"));
    cx("x^3 - 6*x^2 + 11*x - 6").assertSolve(hasSortedValues("1", "2", "3"));
    cx("(x - 1) * (x + 2)").assertSolve(hasSortedValues("-2", "1"));
    cx("x^2 + 1")
        .withProp(Prop.COMPLEX, false)
        .assertSolve(Matchers.<Num>empty());
    final List<Num> roots =
        Calx.create().solve(Calx.create().parse("x^2 + 1"), "x");
    assertThat(roots, hasSize(2));
    for (Num root : roots) {
      assertThat(root.isReal(), is(false));
    }
  }

  @Test void testInverses() {
    cx("sqrt(x) == 3").assertSolve(hasToString("[9]"));
    cx("exp(x) == 1").assertSolve(hasToString("[0]"));
    cx("abs(x - 1) == 2").assertSolve(hasSortedValues("-1", "3"));
    final Calx calx = Calx.create();
    final List<Num> roots = calx.solve(calx.parse("ln(x) == 2"), "x");
    assertThat(roots, hasSize(1));
    assertThat(roots.get(0), closeTo(Math.exp(2d), 1e-9));
  }

  /** A root that does not satisfy the original equation is dropped. */
  @Test void testExtraneous() {
    cx("sqrt(x) == -3").assertSolve(Matchers.<Num>empty());
  }

  /** A root is kept if it makes the equation zero whatever the values of
   * the other variables. */
  @Test void testOtherVariables() {
    final Calx calx = Calx.create();
    assertThat(calx.solve(calx.parse("x * y == 0"), "x"),
        hasToString("[0]"));
    assertThat(calx.solve(calx.parse("(x - 2) * y == 0"), "x"),
        hasToString("[2]"));
    assertThat(calx.solve(calx.parse("x^2 * y == 4 * y"), "x"),
        hasSortedValues("-2", "2"));
    // x = 9 makes the first factor 6, not 0
    assertThat(calx.solve(calx.parse("(sqrt(x) + 3) * y == 0"), "x"),
        Matchers.<Num>empty());
  }

  @Test void testContradiction() {
    cx("1 == 2").assertSolve(Matchers.<Num>empty());
    cx("x == x + 1").assertSolve(Matchers.<Num>empty());
  }

  @Test void testErrors() {
    final Calx calx = Calx.create();
    final SolverException e =
        assertThrows(SolverException.class,
            () -> calx.solve(calx.parse("x == x"), "x"));
    assertThat(e.getMessage(), is("Equation is true for every value of x"));
    final SolverException e2 =
        assertThrows(SolverException.class,
            () -> calx.solve(calx.parse("sin(x) + x"), "x"));
    assertThat(e2.getMessage(), startsWith("Cannot solve"));
  }

  @Test void testIsolate() {
    final Calx calx = Calx.create();
    final Ast.Exp x = calx.isolate(calx.parse("2 * x + 1 == y"), "x");
    assertThat(calx.evaluateNum(x, ImmutableMap.of("y", 5)),
        is(Num.of(2)));
  }

  @Test void testSystem() {
    final Calx calx = Calx.create();
    final Map<String, Num> values =
        calx.solveSystem(
            ImmutableList.of(calx.parse("x + y == 10"),
                calx.parse("x - y == 2")),
            ImmutableList.of("x", "y"));
    assertThat(values, hasToString("{x=6, y=4}"));
    final Map<String, Num> values3 =
        calx.solveSystem(
            ImmutableList.of(calx.parse("x + y + z == 6"),
                calx.parse("y - z == 1"), calx.parse("2 * z == 2")),
            ImmutableList.of("x", "y", "z"));
    assertThat(values3, hasToString("{x=3, y=2, z=1}"));
    final Map<String, Num> inconsistent =
        calx.solveSystem(
            ImmutableList.of(calx.parse("x + y == 1"),
                calx.parse("x + y == 2")),
            ImmutableList.of("x", "y"));
    assertThat(inconsistent.isEmpty(), is(true));
  }

  @Test void testTracer() {
    final List<String> steps = new ArrayList<>();
    cx("2*x + 3 == 7")
        .withTracer(Tracers.withOnSolverStep(Tracers.empty(), steps::add))
        .assertSolve(hasToString("[2]"));
    assertThat(steps, hasItem("solved"));
  }
}

// End SolverTest.java
