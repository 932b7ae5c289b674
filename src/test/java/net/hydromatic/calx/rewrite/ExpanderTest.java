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
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableMap;
import net.hydromatic.calx.Calx;
import net.hydromatic.calx.ast.Ast;
import org.junit.jupiter.api.Test;

/** Tests for {@link Expander}, {@link Replacer} and {@link FreeFinder}. */
public class ExpanderTest {
  private final Calx calx = Calx.create();

  private Ast.Exp expand(String s) {
    return calx.expand(calx.parse(s));
  }

  @Test void testExpand() {
    assertThat(expand("(a + b) * (c - d)"),
        isAst("a * c - a * d + b * c - b * d"));
    assertThat(expand("-(x - y)"), isAst("-x + y"));
    assertThat(expand("(x + y) / 2"), isAst("x / 2 + y / 2"));
    assertThat(expand("x * y"), isAst("x * y"));
    // Too large to multiply out
    assertThat(expand("(x + 1)^20"), isAst("(x + 1)^20"));
    assertThat(expand("(x + 1)^y"), isAst("(x + 1)^y"));
  }

  @Test void testExpandSimplify() {
    cx("(x + 1)^2").assertExpand("1 + 2 * x + x^2");
    cx("2 * (x + 3)").assertExpand("6 + 2 * x");
    cx("(x - 1) * (x + 1)").assertExpand("-1 + x^2");
    cx("(x + 1)^3 - x^3").assertExpand("1 + 3 * x + 3 * x^2");
  }

  @Test void testSubstitute() {
    final Ast.Exp e = calx.parse("x^2 + x");
    assertThat(calx.substitute(e, calx.parse("x"), calx.parse("y + 1")),
        isAst("(y + 1)^2 + (y + 1)"));
    assertThat(
        calx.substitute(calx.parse("sin(x) + sin(x)^2"),
            calx.parse("sin(x)"), calx.parse("u")),
        isAst("u + u^2"));
    // A replacement is not itself searched
    assertThat(
        Replacer.substitute(calx.parse("x + y"),
            ImmutableMap.of("x", calx.parse("y"), "y", calx.parse("x"))),
        isAst("y + x"));
    assertThat(calx.substitute(e, calx.parse("z"), calx.parse("1")),
        is(e));
  }

  @Test void testFreeVariables() {
    assertThat(
        FreeFinder.freeVariables(calx.parse("x * pi + y + e + sin(z) * i")),
        hasToString("[x, y, z]"));
    assertThat(FreeFinder.freeVariables(calx.parse("{a: b}.a")),
        hasToString("[b]"));
    assertThat(FreeFinder.freeVariables(calx.parse("2 + 3")),
        hasToString("[]"));
    assertThat(FreeFinder.contains(calx.parse("x^2"), "x"), is(true));
    assertThat(FreeFinder.contains(calx.parse("x^2"), "y"), is(false));
  }
}

// End ExpanderTest.java
