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
package net.hydromatic.cas.eval;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests for {@link Session} and {@link Prop}. */
public class SessionTest {
  @Test void testDefaults() {
    final Session session = Session.DEFAULT;
    assertThat(session.precision(), is(10));
    assertThat(session.numberFormat(), is(NumberFormat.AUTOMATIC));
    assertThat(session.maxDepth(), is(200));
    assertThat(session.loopLimit(), is(10_000));
    assertThat(session.map.isEmpty(), is(true));
  }

  @Test void testWith() {
    final Session session = Session.DEFAULT.with(Prop.PRECISION, 4);
    assertThat(session.precision(), is(4));
    assertThat(session.formatter().precision, is(4));
    // the original is unchanged
    assertThat(Session.DEFAULT.precision(), is(10));
    // null resets to the default
    assertThat(session.with(Prop.PRECISION, null).precision(), is(10));
  }

  @Test void testLenient() {
    assertThat(
        Session.DEFAULT.withLenient(Prop.NUMBER_FORMAT, "scientific")
            .numberFormat(),
        is(NumberFormat.SCIENTIFIC));
    assertThat(Session.DEFAULT.withLenient(Prop.LOOP_LIMIT, "50")
        .loopLimit(), is(50));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Session.DEFAULT.withLenient(Prop.NUMBER_FORMAT, "fancy"));
    assertThat(e.getMessage(),
        is("value must be one of: 'PLAIN', 'AUTOMATIC', 'SCIENTIFIC'"));
    final IllegalArgumentException e2 =
        assertThrows(IllegalArgumentException.class,
            () -> Session.DEFAULT.withLenient(Prop.PRECISION, "ten"));
    assertThat(e2.getMessage(), is("value must be an integer"));
  }

  @Test void testInvalid() {
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Session.DEFAULT.with(Prop.PRECISION, "4"));
    assertThat(e.getMessage(),
        is("value for property precision must have type Integer"));
    final IllegalArgumentException e2 =
        assertThrows(IllegalArgumentException.class,
            () -> Session.DEFAULT.with(Prop.LOOP_LIMIT, -1));
    assertThat(e2.getMessage(),
        is("value for property loopLimit must not be negative"));
    final IllegalArgumentException e3 =
        assertThrows(IllegalArgumentException.class,
            () -> Session.DEFAULT.with(Prop.MAX_DEPTH, 0));
    assertThat(e3.getMessage(),
        is("value for property maxDepth must be positive"));
  }

  @Test void testLookup() {
    assertThat(Prop.lookup("precision"), is(Prop.PRECISION));
    assertThat(Prop.lookup("NUMBER_FORMAT"), is(Prop.NUMBER_FORMAT));
    assertThat(Prop.lookup("maxDepth"), is(Prop.MAX_DEPTH));
    assertThrows(IllegalArgumentException.class, () -> Prop.lookup("foo"));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.LOOP_LIMIT));
  }
}

// End SessionTest.java
