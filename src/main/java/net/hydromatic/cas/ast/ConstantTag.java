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
package net.hydromatic.cas.ast;

import com.google.common.collect.ImmutableMap;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Symbolic constant.
 *
 * <p>A constant stays symbolic until a numeric value is required; see
 * {@link Expr.Constant#toDouble()}.
 */
public enum ConstantTag {
  PI("π", Math.PI),
  E("e", Math.E),
  /** Golden ratio. */
  PHI("φ", 1.618033988749895),
  /** Vacuum permittivity, F/m. */
  EPSILON_0("ε₀", 8.8541878128e-12),
  /** Vacuum permeability, N/A². */
  MU_0("μ₀", 1.25663706212e-6),
  /** Speed of light in vacuum, m/s. */
  C_0("c₀", 299792458d),
  /** Elementary charge, C. */
  ELEMENTARY_CHARGE("e⁻", 1.602176634e-19),
  /** Imaginary unit. Has no real value. */
  I("i", Double.NaN);

  /** Symbol, e.g. "π". */
  public final String symbol;
  /** Value as a double. */
  public final double value;

  private static final ImmutableMap<String, ConstantTag> BY_SYMBOL;

  static {
    final ImmutableMap.Builder<String, ConstantTag> b = ImmutableMap.builder();
    for (ConstantTag tag : values()) {
      b.put(tag.symbol, tag);
    }
    // Alternative spellings
    b.put("pi", PI);
    b.put("µ₀", MU_0);
    BY_SYMBOL = b.build();
  }

  ConstantTag(String symbol, double value) {
    this.symbol = symbol;
    this.value = value;
  }

  /** Looks up a constant by its symbol; returns null if not found. */
  public static @Nullable ConstantTag lookup(String symbol) {
    return BY_SYMBOL.get(symbol);
  }
}

// End ConstantTag.java
