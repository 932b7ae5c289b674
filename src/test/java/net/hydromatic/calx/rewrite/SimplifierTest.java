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

import static net.hydromatic.calx.Cx.cx;
import static net.hydromatic.calx.Matchers.isAst;
import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.calx.Calx;
import net.hydromatic.calx.ast.Ast;
import net.hydromatic.calx.eval.Prop;
import net.hydromatic.calx.eval.Session;
import net.hydromatic.calx.util.Tracers;
import org.junit.jupiter.api.Test;

/** Tests for {@link Simplifier} and {@link Rules}. */
public class SimplifierTest {
  @Test void testConstants() {
    cx("2 + 3").assertSimplify("5");
    cx("2 * 3 * x").assertSimplify("6 * x");
    cx("-(3)").assertSimplify("-3");
    cx("--x").assertSimplify("x");
    cx("x / 2").assertSimplify("x / 2");
    cx("6 * x / 4").assertSimplify("3 * x / 2");
    cx("x / 3 + x / 6").assertSimplify("x / 2");
    cx("\"a\" + \"b\"").assertSimplify("\"ab\"");
  }

  /** A constant that cannot be evaluated, such as a division by zero, is
   * left alone. */
  @Test void testUnfoldable() {
    cx("1 / 0").assertSimplify("1 / 0");
  }

  @Test void testIdentities() {
    cx("0 * x").assertSimplify("0");
    cx("x * 0").assertSimplify("0");
    cx("x * 1").assertSimplify("x");
    cx("x + 0").assertSimplify("x");
    cx("x^1").assertSimplify("x");
    cx("x^0").assertSimplify("1");
    cx("1^x").assertSimplify("1");
    cx("(x^2)^3").assertSimplify("x^6");
  }

  @Test void testLikeTerms() {
    cx("x + -1*x").assertSimplify("0");
    cx("x - x").assertSimplify("0");
    cx("x + 2*x + 3").assertSimplify("3 + 3 * x");
    cx("2*x + 3*y - x").assertSimplify("x + 3 * y");
    cx("x^2 - 1").assertSimplify("-1 + x^2");
    cx("x*3").assertSimplify("3 * x");
  }

  @Test void testLikeFactors() {
    cx("x * x").assertSimplify("x^2");
    cx("x^2 * x^3").assertSimplify("x^5");
    cx("x * y / x").assertSimplify("y");
    cx("c * b * a").assertSimplify("a * b * c");
  }

  /** The normal form does not depend on the order of the operands. */
  @Test void testPermutations() {
    final String[] sums = {"a + b + c", "c + b + a", "b + a + c",
        "b + (c + a)"};
    for (String sum : sums) {
      cx(sum).assertSimplify("a + b + c");
    }
    final String[] mixed = {"2*x + 3*y - x", "3*y + x", "y + x + 2*y"};
    for (String s : mixed) {
      cx(s).assertSimplify("x + 3 * y");
    }
    final String[] products = {"2 * x * y", "y * 2 * x", "x * (y * 2)"};
    for (String s : products) {
      cx(s).assertSimplify("2 * x * y");
    }
  }

  @Test void testSquares() {
    cx("(x + 1) * (x - 1)").assertSimplify("-1 + x^2");
    cx("(x + 1) * (x + 1)").assertSimplify("1 + 2 * x + x^2");
    cx("(x + 1)^2").assertSimplify("1 + 2 * x + x^2");
    cx("(x - 1)^2 + 4*x").assertSimplify("1 + 2 * x + x^2");
    cx("(x + 1)^2 - (x^2 + 2*x + 1)").assertSimplify("0");
    cx("(x + 1)^2 - (x + 1) * (x + 1)").assertSimplify("0");
    cx("sin(x)^2 + cos(x)^2").assertSimplify("1");
  }

  /** A squared binomial, written as a power or as a product, and its
   * expansion all simplify to the same expression. */
  @Test void testSquareForms() {
    final String[][] groups = {
        {"(a + b)^2", "(a + b) * (a + b)", "a^2 + 2*a*b + b^2",
            "(a - b)^2 + 4*a*b", "(b + a)^2"},
        {"(x - 3)^2", "(x - 3) * (x - 3)", "x^2 - 6*x + 9",
            "(3 - x)^2"},
    };
    final Calx calx = Calx.create();
    for (String[] group : groups) {
      final Ast.Exp first = calx.simplify(calx.parse(group[0]));
      for (String s : group) {
        assertThat(s, calx.simplify(calx.parse(s)), is(first));
      }
    }
  }

  @Test void testFunctions() {
    cx("ln(exp(x))").assertSimplify("x");
    cx("exp(ln(x))").assertSimplify("x");
    cx("ln(e)").assertSimplify("1");
    cx("log(2, 2)").assertSimplify("1");
    cx("log(x, 1)").assertSimplify("0");
    cx("sqrt(16)").assertSimplify("4");
    // Not folded, because the result would not be exact
    cx("sqrt(2)").assertSimplify("sqrt(2)");
  }

  @Test void testConditional() {
    cx("true ? x : y").assertSimplify("x");
    cx("false ? x : y").assertSimplify("y");
    cx("x > 1 ? y : y").assertSimplify("y");
    cx("x == x").assertSimplify("true");
    cx("x < x").assertSimplify("false");
    cx("true && x > 1").assertSimplify("x > 1");
    cx("false || x > 1").assertSimplify("x > 1");
  }

  /** Simplifying a simplified expression has no effect. */
  @Test void testIdempotent() {
    final String[] expressions = {
        "x + 2*x + 3", "(x + 1) * (x - 1)", "x / y", "sin(x) * x^2",
        "exp(x) * x", "2^x + 3^x", "(a + b)^2", "1 / (x - 1)",
        "x % 3", "x > 0 ? x : -x"};
    final Calx calx = Calx.create();
    for (String s : expressions) {
      final Ast.Exp e = calx.simplify(calx.parse(s));
      assertThat(s, calx.simplify(e), is(e));
    }
  }

  @Test void testTracer() {
    final List<String> rules = new ArrayList<>();
    cx("0 * x")
        .withTracer(Tracers.withOnRule(Tracers.empty(),
            (rule, e) -> rules.add(rule)))
        .assertSimplify("0");
    assertThat(rules, hasItem("productNormalForm"));
  }

  /** A simplifier with no rules leaves an expression unchanged. */
  @Test void testNoRules() {
    final Session session = Session.create();
    final Simplifier simplifier =
        new Simplifier(session, ImmutableList.of());
    final Ast.Exp e = Calx.create().parse("0 * x");
    assertThat(simplifier.simplify(e), isAst("0 * x"));
  }

  /** With a pass limit of 1, a node is rewritten at most once. */
  @Test void testPassLimit() {
    final Session session =
        Session.create().with(Prop.SIMPLIFY_PASS_LIMIT, 1);
    final Simplifier simplifier = new Simplifier(session,
        ImmutableList.of(Rules.UNARY_FOLD));
    final Ast.Exp e = Calx.create().parse("-(-(x))");
    assertThat(simplifier.simplify(e).toString().contains("x"), is(true));
  }
}

// End SimplifierTest.java
