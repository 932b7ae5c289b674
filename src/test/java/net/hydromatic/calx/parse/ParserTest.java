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
package net.hydromatic.calx.parse;

import static net.hydromatic.calx.Cx.cx;
import static net.hydromatic.calx.ast.AstBuilder.ast;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.calx.Calx;
import net.hydromatic.calx.ast.Ast;
import net.hydromatic.calx.ast.Op;
import net.hydromatic.calx.ast.Pos;
import net.hydromatic.calx.eval.Prop;
import net.hydromatic.calx.eval.Session;
import net.hydromatic.calx.num.Num;
import org.junit.jupiter.api.Test;

/** Tests for {@link CalxParser}. */
public class ParserTest {
  private static final Ast.Id X = ast.id("x");
  private static final Ast.Id Y = ast.id("y");

  @Test void testLiterals() {
    cx("1").assertParse("1");
    cx("2.5").assertParse("2.5");
    cx("1e3").assertParse("1000.0");
    cx("0x1F").assertParse("31");
    cx("0b101").assertParse("5");
    cx("\"a\\tb\"").assertParse("\"a\\tb\"");
    cx("true").assertParse("true");
    cx("null").assertParse("null");
    cx("[1, 2, x]").assertParse("[1, 2, x]");
    cx("{a: 1, b: x}").assertParse("{a: 1, b: x}");
  }

  /** A decimal with more digits than a double holds is kept exactly. */
  @Test void testPrecise() {
    final Ast.Exp e = cx("3.14159265358979323846").parse();
    assertThat(((Ast.Literal) e).num().kind, is(Num.Kind.PRECISE));
    assertThat(e.toString(), is("3.14159265358979323846"));
  }

  @Test void testPrecedence() {
    cx("1 + 2 * 3").assertParse(
        ast.plus(ast.number(1), ast.times(ast.number(2), ast.number(3))));
    cx("a - b - c").assertParse(
        ast.minus(ast.minus(ast.id("a"), ast.id("b")), ast.id("c")));
    cx("a ^ b ^ c").assertParse(
        ast.power(ast.id("a"), ast.power(ast.id("b"), ast.id("c"))));
    cx("x == 1 || y < 2 && true").assertParse("x == 1 || y < 2 && true");
    cx("1 + 2 * 3 ^ 4").assertParse("1 + 2 * 3^4");
    cx("(1 + 2) * 3").assertParse("(1 + 2) * 3");
    cx("7 % 3").assertParse(ast.mod(ast.number(7), ast.number(3)));
  }

  /** Unary minus binds less tightly than {@code ^}. */
  @Test void testNegatePower() {
    cx("-x^2").assertParse(ast.negate(ast.power(X, ast.number(2))));
    cx("-x^2").assertParse("-x^2");
    cx("(-x)^2").assertParse("(-x)^2");
    cx("2^-1").assertParse(
        ast.power(ast.number(2), ast.negate(ast.number(1))));
  }

  @Test void testPostfix() {
    cx("5!").assertParse(
        ast.unary(Pos.ZERO, Op.FACTORIAL, ast.number(5)));
    cx("50%").assertParse("50%");
    cx("(50% + 1)").assertParse("(50% + 1)");
    cx("50% - 3").assertParse("50% - 3");
    cx("50%-3").assertParse("50% - 3");
    assertThat(cx("50% - 3").parse().op, is(Op.MINUS));
    cx("[1, 2][0]").assertParse("[1, 2][0]");
    cx("{a: 1}.a").assertParse("{a: 1}.a");
  }

  /** "%" before a sign that is attached to its operand is modulo. */
  @Test void testModuloBySigned() {
    cx("5 % -3").assertParse("5 % -3");
    assertThat(cx("5 % -3").parse().op, is(Op.MOD));
    assertThat(cx("x % +y").parse().op, is(Op.MOD));
    assertThat(cx("x % !y").parse().op, is(Op.MOD));
    cx("5 % -3").assertEval(hasToString("2"));
    cx("50% - 3").assertEval(hasToString("-2.5"));
  }

  @Test void testImplicitMultiplication() {
    cx("2x").assertParse(ast.times(ast.number(2), X));
    cx("2x y").assertParse(ast.times(ast.times(ast.number(2), X), Y));
    cx("2(x + 1)").assertParse("2 * (x + 1)");
    cx("sin x").assertParse(ast.apply("sin", X));
    cx("sin x^2").assertParse(ast.apply("sin", ast.power(X, ast.number(2))));
    cx("2 sin x").assertParse(
        ast.times(ast.number(2), ast.apply("sin", X)));
    cx("-sin x").assertParse(ast.negate(ast.apply("sin", X)));
    // "f" is not a function, so "f(x)" is a product
    cx("f(x)").assertParse("f * (x)");
    cx("sin(x)").assertParse("sin(x)");
    cx("log(2, x)").assertParse(ast.apply("log", ast.number(2), X));
  }

  @Test void testNoImplicitMultiplication() {
    cx("2x")
        .withProp(Prop.IMPLICIT_MULTIPLICATION, false)
        .assertParseError("1.2 Error: Unexpected 'x'");
    cx("f(x)")
        .withProp(Prop.IMPLICIT_MULTIPLICATION, false)
        .assertParse(ast.apply("f", X));
  }

  @Test void testConditional() {
    cx("x > 0 ? x : -x").assertParse("x > 0 ? x : -x");
    cx("1 + (x > 0 ? 1 : 2)").assertParse("1 + (x > 0 ? 1 : 2)");
  }

  @Test void testErrors() {
    cx("1 + )").assertParseError("1.5 Error: Unexpected ')'");
    cx("1 $ 2").assertParseError("1.3 Error: Unexpected character '$'");
    cx("(1 + 2")
        .assertParseError("1.7 Error: Expected ')' but found end of input");
    cx("1 2 )").assertParseError("1.5 Error: Unexpected ')'");
    cx("\"abc").assertParseError("1.1-1.5 Error: Unterminated string");
  }

  @Test void testPosition() {
    final Ast.Exp e = cx("x +\n  y * 2").parse();
    final Ast.InfixCall plus = (Ast.InfixCall) e;
    assertThat(plus.a1.pos.toString(), is("2.3-2.8"));
  }

  @Test void testDepth() {
    final StringBuilder b = new StringBuilder();
    for (int i = 0; i < 20; i++) {
      b.append('(');
    }
    b.append('1');
    for (int i = 0; i < 20; i++) {
      b.append(')');
    }
    final String s = b.toString();
    cx(s).parse();
    final CalxParser parser =
        new CalxParser(Session.create().with(Prop.MAX_DEPTH, 10));
    final CalxParseException e =
        assertThrows(CalxParseException.class, () -> parser.parse(s));
    assertThat(e.getMessage(),
        is("Expression nested too deeply (maximum depth 10)"));
  }

  /** Unparsing then parsing gives an equal tree. */
  @Test void testRoundTrip() {
    final String[] expressions = {
        "-x^2 + 3 * (y - 1) / 2", "2^3^x", "(a - b) - (c - d)",
        "sin(x)^2 * cos(x)", "x! + 10%", "x > 1 && y <= 2 || !z",
        "{a: [1, 2], b: \"s\"}.a[1]", "(-1)^x", "x * -1", "5 % -3"};
    for (String s : expressions) {
      final Ast.Exp e = cx(s).parse();
      assertThat(s, cx(e.toString()).parse(), is(e));
    }
  }

  /** A simplified expression containing floating-point literals parses
   * back to an equal expression. */
  @Test void testRoundTripDecimals() {
    final Calx calx = Calx.create();
    final String[] expressions = {
        "x / (x * 6)", "x * 2.5", "1 / 3 + y", "0.1 + 0.2", "x^0.75",
        "1e-7 * x"};
    for (String s : expressions) {
      final Ast.Exp e = calx.simplify(calx.parse(s));
      assertThat(s, calx.parse(e.toString()), is(e));
    }
    assertThat(calx.simplify(calx.parse("x / (x * 6)")).toString(),
        is("0.16666666666666666"));
  }
}

// End ParserTest.java
