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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Writes numbers according to a {@link NumberFormat} and a precision.
 *
 * <p>Rounding is half-up and propagates carries; for example, 129999 with
 * precision 2 in scientific notation is "1.3E5", and 9999999 is "1E7".
 * Trailing zeros after the decimal point are removed.
 */
public class Formatter {
  /** Values of smaller magnitude are written as "0". */
  private static final BigDecimal ZERO_THRESHOLD = new BigDecimal("1E-30");

  /** Approximate values of at least this magnitude, or less than
   * {@link #AUTOMATIC_MIN}, are written in scientific notation in automatic
   * format. */
  private static final BigDecimal AUTOMATIC_MAX = BigDecimal.valueOf(1e6);

  private static final BigDecimal AUTOMATIC_MIN = new BigDecimal("1E-6");

  /** Integers of at least this magnitude are written in scientific notation
   * in automatic format. */
  private static final BigInteger AUTOMATIC_LIMIT = BigInteger.TEN.pow(6);

  /** Numerators and denominators of at least this magnitude are written in
   * scientific notation, except in plain format. */
  private static final BigInteger FRACTION_LIMIT = BigInteger.TEN.pow(15);

  public final NumberFormat format;
  public final int precision;

  public Formatter(NumberFormat format, int precision) {
    checkArgument(precision >= 0, "precision must not be negative");
    this.format = requireNonNull(format);
    this.precision = precision;
  }

  /** Formats an approximate value. */
  public String format(double v) {
    if (Double.isNaN(v)) {
      return "NaN";
    }
    if (Double.isInfinite(v)) {
      return v > 0 ? "∞" : "-∞";
    }
    return format(BigDecimal.valueOf(v));
  }

  /** Formats a decimal value, which may be too large for a {@code double};
   * for example the value of 10^400. */
  public String format(BigDecimal d) {
    final BigDecimal abs = d.abs();
    if (abs.compareTo(ZERO_THRESHOLD) < 0) {
      return "0";
    }
    switch (format) {
    case PLAIN:
      return plain(d, true);
    case SCIENTIFIC:
      return scientific(d);
    default:
      return abs.compareTo(AUTOMATIC_MAX) >= 0
          || abs.compareTo(AUTOMATIC_MIN) < 0
          ? scientific(d)
          : plain(d, false);
    }
  }

  /** Formats an exact integer. */
  public String formatInteger(BigInteger v) {
    switch (format) {
    case PLAIN:
      return group(v.toString());
    case SCIENTIFIC:
      return scientific(new BigDecimal(v));
    default:
      return v.abs().compareTo(AUTOMATIC_LIMIT) >= 0
          ? scientific(new BigDecimal(v))
          : v.toString();
    }
  }

  /** Formats the numerator or denominator of an exact fraction. */
  public String formatFractionPart(BigInteger v) {
    if (format == NumberFormat.PLAIN) {
      return group(v.toString());
    }
    return v.abs().compareTo(FRACTION_LIMIT) >= 0
        ? scientific(new BigDecimal(v))
        : v.toString();
  }

  /** Formats an integer that is part of a larger expression, such as the
   * exponent in "x^2". Only very large values use scientific notation, and
   * digits are never grouped. */
  public String formatEmbedded(BigInteger v) {
    return format != NumberFormat.PLAIN
        && v.abs().compareTo(FRACTION_LIMIT) >= 0
        ? scientific(new BigDecimal(v))
        : v.toString();
  }

  private String plain(BigDecimal d, boolean grouped) {
    final BigDecimal r = d.setScale(precision, RoundingMode.HALF_UP);
    if (r.signum() == 0) {
      return "0";
    }
    final String s = r.stripTrailingZeros().toPlainString();
    return grouped ? group(s) : s;
  }

  /** Returns a number in scientific notation, such as "1.25E-7". The
   * exponent is omitted if it is zero. */
  private String scientific(BigDecimal d) {
    if (d.signum() == 0) {
      return "0";
    }
    final BigDecimal r =
        d.round(new MathContext(precision + 1, RoundingMode.HALF_UP))
            .stripTrailingZeros();
    final int exponent = r.precision() - r.scale() - 1;
    final BigDecimal mantissa = r.movePointLeft(exponent);
    return exponent == 0
        ? mantissa.toPlainString()
        : mantissa.toPlainString() + "E" + exponent;
  }

  /** Inserts commas into the integer part of a plain number; for example,
   * "-1234567.5" becomes "-1,234,567.5". */
  static String group(String s) {
    final int start = s.startsWith("-") ? 1 : 0;
    int end = s.indexOf('.');
    if (end < 0) {
      end = s.length();
    }
    final StringBuilder b = new StringBuilder(s);
    for (int i = end - 3; i > start; i -= 3) {
      b.insert(i, ',');
    }
    return b.toString();
  }
}

// End Formatter.java
