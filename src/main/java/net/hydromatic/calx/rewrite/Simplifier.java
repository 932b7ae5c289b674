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

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.calx.ast.Ast;
import net.hydromatic.calx.eval.Evaluator;
import net.hydromatic.calx.eval.Prop;
import net.hydromatic.calx.eval.Session;
import net.hydromatic.calx.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites expressions to a simpler, canonical form.
 *
 * <p>Simplification is bottom-up. The arguments of a node are simplified
 * first; then the rules are tried in order, and the first rule that
 * changes the node wins. The result is simplified again, until no rule
 * applies.
 *
 * <p>The number of rewrites of any one node is limited by
 * {@link Prop#SIMPLIFY_PASS_LIMIT}; if the limit is reached, a warning is
 * logged and the latest expression is returned.
 *
 * <p>Each rewrite is reported to the session's
 * {@link net.hydromatic.calx.util.Tracer#onRule tracer}.
 */
public class Simplifier {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(Simplifier.class);

  private final Session session;
  private final ImmutableList<Rule> rules;
  private final Evaluator evaluator;
  private final int passLimit;

  /** Creates a Simplifier with the default rules. */
  public Simplifier(Session session) {
    this(session, Rules.DEFAULT);
  }

  /** Creates a Simplifier with a given list of rules. */
  public Simplifier(Session session, List<Rule> rules) {
    this.session = requireNonNull(session);
    this.rules = ImmutableList.copyOf(rules);
    this.evaluator = new Evaluator(session, this);
    this.passLimit = Prop.SIMPLIFY_PASS_LIMIT.intValue(session.map);
  }

  public Session session() {
    return session;
  }

  public List<Rule> rules() {
    return rules;
  }

  /** Returns the evaluator used to fold constants. */
  Evaluator evaluator() {
    return evaluator;
  }

  /** Simplifies an expression. */
  public Ast.Exp simplify(Ast.Exp exp) {
    Ast.Exp e = simplifyArgs(exp);
    for (int pass = 1;; pass++) {
      final Ast.Exp e2 = rewrite(e);
      if (e2 == null) {
        return e;
      }
      if (pass >= passLimit) {
        LOGGER.warn("Simplification of '{}' stopped after {} rewrites",
            exp, passLimit);
        return e2;
      }
      e = simplifyArgs(e2);
    }
  }

  private Ast.Exp simplifyArgs(Ast.Exp e) {
    final List<Ast.Exp> args = e.args();
    if (args.isEmpty()) {
      return e;
    }
    final List<Ast.Exp> args2 = Static.transformEager(args, this::simplify);
    return args2.equals(args) ? e : e.copy(args2);
  }

  /** Applies the first rule that matches, or returns null. */
  private Ast.@Nullable Exp rewrite(Ast.Exp e) {
    for (Rule rule : rules) {
      final Ast.Exp e2 = rule.apply(this, e);
      if (e2 != null) {
        LOGGER.trace("{}: {} => {}", rule, e, e2);
        session.tracer.onRule(rule.name, e, e2);
        return e2;
      }
    }
    return null;
  }
}

// End Simplifier.java
