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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests for {@link Session} and {@link Prop}. */
public class SessionTest {
  @Test void testDefaults() {
    final Session session = Session.create();
    assertThat(session.complex(), is(true));
    assertThat(session.angleUnit(), is(Prop.AngleUnit.RADIANS));
    assertThat(session.tolerance(), is(1e-10));
    assertThat(session.mathContext().getPrecision(), is(50));
    assertThat(Prop.DEFAULT_VARIABLE.stringValue(session.map), is("x"));
  }

  /** Setting a property creates a new session; the original is unchanged. */
  @Test void testWith() {
    final Session session = Session.create();
    final Session session2 = session.with(Prop.COMPLEX, false);
    assertThat(session2.complex(), is(false));
    assertThat(session.complex(), is(true));
  }

  @Test void testLenient() {
    final Session session = Session.create()
        .withLenient(Prop.ANGLE_UNIT, "degrees")
        .withLenient(Prop.PRECISION, "20")
        .withLenient(Prop.IMPLICIT_MULTIPLICATION, "false");
    assertThat(session.angleUnit(), is(Prop.AngleUnit.DEGREES));
    assertThat(session.mathContext().getPrecision(), is(20));
    assertThat(Prop.IMPLICIT_MULTIPLICATION.booleanValue(session.map),
        is(false));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Session.create().withLenient(Prop.PRECISION, "many"));
    assertThat(e.getMessage(),
        is("invalid value for property precision: many"));
    final IllegalArgumentException e2 =
        assertThrows(IllegalArgumentException.class,
            () -> Session.create().withLenient(Prop.ANGLE_UNIT, "turns"));
    assertThat(e2.getMessage(),
        is("value must be one of: 'RADIANS', 'DEGREES'"));
  }

  @Test void testLookup() {
    assertThat(Prop.lookup("maxDepth"), is(Prop.MAX_DEPTH));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.lookup("colour"));
    assertThat(e.getMessage(), is("property colour not found"));
  }
}

// End SessionTest.java
