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
package net.hydromatic.calx.util;

import net.hydromatic.calx.ast.Ast;

/** Called on various events while expressions are transformed. */
public interface Tracer {
  /** Called when a simplification rule rewrites an expression. */
  void onRule(String rule, Ast.Exp before, Ast.Exp after);

  /** Called when the solver moves to a new state, with the current
   * left-hand side and the target value it must equal. */
  void onSolverStep(String step, Ast.Exp lhs, Ast.Exp target);

  /** Called on the result of an evaluation. */
  void onResult(Object o);
}

// End Tracer.java
