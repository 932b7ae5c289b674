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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import java.util.SortedSet;
import java.util.function.Consumer;
import net.hydromatic.calx.ast.Ast;
import net.hydromatic.calx.ast.Op;
import net.hydromatic.calx.ast.Visitor;

/** Finds free variables in an expression. */
public class FreeFinder extends Visitor {
  /** Names that denote constants rather than variables. */
  public static final ImmutableSet<String> CONSTANTS =
      ImmutableSet.of("pi", "e", "i");

  final Consumer<String> consumer;

  protected FreeFinder(Consumer<String> consumer) {
    this.consumer = consumer;
  }

  /** Finds the free variables in an expression, sorted by name. */
  public static SortedSet<String> freeVariables(Ast.Exp exp) {
    final ImmutableSortedSet.Builder<String> set =
        ImmutableSortedSet.naturalOrder();
    exp.accept(new FreeFinder(set::add));
    return set.build();
  }

  /** Whether an expression contains a given variable. */
  public static boolean contains(Ast.Exp exp, String variable) {
    return freeVariables(exp).contains(variable);
  }

  @Override protected void visit(Ast.Id id) {
    if (!CONSTANTS.contains(id.name)) {
      consumer.accept(id.name);
    }
  }

  @Override protected void visit(Ast.MapExp map) {
    // A bare identifier as a key is a name, not a variable
    map.keys.forEach(key -> {
      if (key.op != Op.ID) {
        key.accept(this);
      }
    });
    map.values.forEach(this::accept);
  }

  @Override protected void visit(Ast.PolynomialExp polynomialExp) {
    consumer.accept(polynomialExp.polynomial.variable);
  }
}

// End FreeFinder.java
