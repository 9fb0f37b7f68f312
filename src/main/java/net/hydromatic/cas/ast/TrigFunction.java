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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Locale;
import java.util.function.DoubleUnaryOperator;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Trigonometric and hyperbolic function. Arguments are in radians. */
public enum TrigFunction {
  SIN(Math::sin),
  COS(Math::cos),
  TAN(Math::tan),
  ASIN(Math::asin),
  ACOS(Math::acos),
  ATAN(Math::atan),
  SINH(Math::sinh),
  COSH(Math::cosh),
  TANH(Math::tanh),
  ASINH(x -> Math.log(x + Math.sqrt(x * x + 1d))),
  ACOSH(x -> Math.log(x + Math.sqrt(x * x - 1d))),
  ATANH(x -> 0.5d * Math.log((1d + x) / (1d - x)));

  /** Lower-case name, as written in an expression, e.g. "sin". */
  public final String functionName;
  private final DoubleUnaryOperator function;

  private static final ImmutableMap<String, TrigFunction> BY_NAME;

  static {
    final ImmutableMap.Builder<String, TrigFunction> b =
        ImmutableMap.builder();
    for (TrigFunction f : values()) {
      b.put(f.functionName, f);
    }
    BY_NAME = b.build();
  }

  TrigFunction(DoubleUnaryOperator function) {
    this.functionName = name().toLowerCase(Locale.ROOT);
    this.function = requireNonNull(function);
  }

  /** Looks up a function by name, e.g. "sinh"; returns null if not found. */
  public static @Nullable TrigFunction lookup(String name) {
    return BY_NAME.get(name.toLowerCase(Locale.ROOT));
  }

  /** Applies this function to a value. */
  public double apply(double x) {
    return function.applyAsDouble(x);
  }
}

// End TrigFunction.java
