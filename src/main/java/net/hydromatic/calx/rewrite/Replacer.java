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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.calx.ast.Ast;
import net.hydromatic.calx.ast.Op;
import net.hydromatic.calx.ast.Shuttle;
import net.hydromatic.calx.util.Static;

/** Replaces identifiers with expressions. */
public class Replacer extends Shuttle {
  protected final Map<String, ? extends Ast.Exp> substitution;

  private Replacer(Map<String, ? extends Ast.Exp> substitution) {
    this.substitution = requireNonNull(substitution);
  }

  /** Replaces every occurrence of the variables in a map with the
   * corresponding expressions. The replacements are not themselves
   * searched. */
  public static Ast.Exp substitute(Ast.Exp exp,
      Map<String, ? extends Ast.Exp> substitution) {
    if (substitution.isEmpty()) {
      return exp;
    }
    return exp.accept(new Replacer(substitution));
  }

  /** Replaces every subtree that is structurally equal to {@code target}
   * with {@code replacement}. */
  public static Ast.Exp replace(Ast.Exp exp, Ast.Exp target,
      Ast.Exp replacement) {
    if (target.op == Op.ID) {
      return substitute(exp, ImmutableMap.of(((Ast.Id) target).name,
          replacement));
    }
    if (exp.equals(target)) {
      return replacement;
    }
    if (exp.args().isEmpty()) {
      return exp;
    }
    return exp.copy(
        Static.transformEager(exp.args(),
            arg -> replace(arg, target, replacement)));
  }

  @Override public Ast.Exp visit(Ast.Id id) {
    final Ast.Exp exp = substitution.get(id.name);
    return exp != null ? exp : id;
  }

  @Override public Ast.Exp visit(Ast.PolynomialExp polynomialExp) {
    if (substitution.containsKey(polynomialExp.polynomial.variable)) {
      return polynomialExp.polynomial.toExp().accept(this);
    }
    return polynomialExp;
  }
}

// End Replacer.java
