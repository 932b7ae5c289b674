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

import static java.util.Objects.requireNonNull;

import java.util.function.BiFunction;
import java.util.function.Predicate;
import net.hydromatic.calx.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Simplification rule.
 *
 * <p>A rule has a matcher, a cheap test of the shape of a node, and a
 * rewriter, which returns the rewritten node, or null (or the node itself)
 * if the rule does not apply after all.
 *
 * @see Rules
 * @see Simplifier */
public class Rule {
  public final String name;
  private final Predicate<Ast.Exp> matcher;
  private final BiFunction<Simplifier, Ast.Exp, Ast.@Nullable Exp> rewriter;

  /** Creates a Rule. */
  public Rule(String name, Predicate<Ast.Exp> matcher,
      BiFunction<Simplifier, Ast.Exp, Ast.@Nullable Exp> rewriter) {
    this.name = requireNonNull(name);
    this.matcher = requireNonNull(matcher);
    this.rewriter = requireNonNull(rewriter);
  }

  /** Applies this rule to an expression whose children have been
   * simplified. Returns the rewritten expression, or null if the rule does
   * not apply or does not change the expression. */
  public Ast.@Nullable Exp apply(Simplifier simplifier, Ast.Exp exp) {
    if (!matcher.test(exp)) {
      return null;
    }
    final Ast.Exp result = rewriter.apply(simplifier, exp);
    return result == null || result.equals(exp) ? null : result;
  }

  @Override public String toString() {
    return name;
  }
}

// End Rule.java
