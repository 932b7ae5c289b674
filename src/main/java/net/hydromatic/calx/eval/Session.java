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
package net.hydromatic.calx.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.calx.util.Tracer;
import net.hydromatic.calx.util.Tracers;

/** Session environment.
 *
 * <p>Holds property values and a tracer. Every component that parses,
 * evaluates or transforms expressions is created with a session, and reads
 * its settings from there.
 *
 * <p>A session is immutable; methods such as {@link #with(Prop, Object)}
 * return a new session. */
public class Session {
  /** Property values. Properties that are not present have their default
   * value. */
  public final ImmutableMap<Prop, Object> map;

  /** Receives notifications of rule firings and solver steps. */
  public final Tracer tracer;

  /** Creates a Session.
   *
   * @param map Map that contains property values
   * @param tracer Tracer */
  public Session(Map<Prop, Object> map, Tracer tracer) {
    this.map = ImmutableMap.copyOf(map);
    this.tracer = requireNonNull(tracer, "tracer");
  }

  /** Creates a session with default property values and no tracing. */
  public static Session create() {
    return new Session(ImmutableMap.of(), Tracers.empty());
  }

  /** Returns a session with a given value of a property. */
  public Session with(Prop prop, Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(this.map);
    prop.set(map, value);
    return new Session(map, tracer);
  }

  /** Returns a session with a given value of a property, converting the
   * value from a string if necessary. */
  public Session withLenient(Prop prop, Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(this.map);
    prop.setLenient(map, value);
    return new Session(map, tracer);
  }

  /** Returns a session with a given tracer. */
  public Session withTracer(Tracer tracer) {
    return new Session(map, tracer);
  }

  /** Returns the math context for arbitrary-precision values, per
   * {@link Prop#PRECISION}. */
  public MathContext mathContext() {
    return new MathContext(Prop.PRECISION.intValue(map),
        RoundingMode.HALF_EVEN);
  }

  /** Returns the value of {@link Prop#TOLERANCE}. */
  public double tolerance() {
    return Prop.TOLERANCE.doubleValue(map);
  }

  /** Returns the value of {@link Prop#COMPLEX}. */
  public boolean complex() {
    return Prop.COMPLEX.booleanValue(map);
  }

  /** Returns the value of {@link Prop#ANGLE_UNIT}. */
  public Prop.AngleUnit angleUnit() {
    return Prop.ANGLE_UNIT.enumValue(map, Prop.AngleUnit.class);
  }
}

// End Session.java
