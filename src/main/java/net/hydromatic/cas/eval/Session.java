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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Settings that affect evaluation, such as the number format and
 * precision.
 *
 * <p>A session is immutable; {@link #with} returns a modified copy.
 */
public class Session {
  /** Session with every property at its default value. */
  public static final Session DEFAULT = new Session(ImmutableMap.of());

  /** Property values. Properties not in the map have their default
   * value. */
  public final ImmutableMap<Prop, Object> map;

  private Session(Map<Prop, Object> map) {
    this.map = ImmutableMap.copyOf(map);
  }

  /** Returns a session with a property set to a value; a null value resets
   * the property to its default. */
  public Session with(Prop prop, @Nullable Object value) {
    final Map<Prop, Object> map2 = new LinkedHashMap<>(map);
    prop.set(map2, value);
    return new Session(map2);
  }

  /** As {@link #with}, but converts from a string if necessary. */
  public Session withLenient(Prop prop, @Nullable Object value) {
    final Map<Prop, Object> map2 = new LinkedHashMap<>(map);
    prop.setLenient(map2, value);
    return new Session(map2);
  }

  public NumberFormat numberFormat() {
    return Prop.NUMBER_FORMAT.enumValue(map, NumberFormat.class);
  }

  public int precision() {
    return Prop.PRECISION.intValue(map);
  }

  public int maxDepth() {
    return Prop.MAX_DEPTH.intValue(map);
  }

  public int loopLimit() {
    return Prop.LOOP_LIMIT.intValue(map);
  }

  /** Returns a formatter for this session's number format and
   * precision. */
  public Formatter formatter() {
    return new Formatter(numberFormat(), precision());
  }

  @Override public String toString() {
    return map.toString();
  }
}

// End Session.java
