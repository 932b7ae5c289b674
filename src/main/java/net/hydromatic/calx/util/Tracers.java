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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.calx.ast.Ast;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action each time a rule fires,
   * then calls the underlying tracer. */
  public static Tracer withOnRule(Tracer tracer,
      BiConsumer<String, Ast.Exp> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onRule(String rule, Ast.Exp before,
          Ast.Exp after) {
        consumer.accept(rule, after);
        super.onRule(rule, before, after);
      }
    };
  }

  /** Returns a tracer that performs the given action on each solver step,
   * then calls the underlying tracer. */
  public static Tracer withOnSolverStep(Tracer tracer,
      Consumer<String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onSolverStep(String step, Ast.Exp lhs,
          Ast.Exp target) {
        consumer.accept(step);
        super.onSolverStep(step, lhs, target);
      }
    };
  }

  /** Returns a tracer that performs the given action on the result of an
   * evaluation, then calls the underlying tracer. */
  public static Tracer withOnResult(Tracer tracer, Consumer<Object> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onResult(Object o) {
        consumer.accept(o);
        super.onResult(o);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onRule(String rule, Ast.Exp before, Ast.Exp after) {
    }

    @Override public void onSolverStep(String step, Ast.Exp lhs,
        Ast.Exp target) {
    }

    @Override public void onResult(Object o) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onRule(String rule, Ast.Exp before, Ast.Exp after) {
      tracer.onRule(rule, before, after);
    }

    @Override public void onSolverStep(String step, Ast.Exp lhs,
        Ast.Exp target) {
      tracer.onSolverStep(step, lhs, target);
    }

    @Override public void onResult(Object o) {
      tracer.onResult(o);
    }
  }
}

// End Tracers.java
