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

import java.math.BigDecimal;
import java.math.BigInteger;
import org.junit.jupiter.api.Test;

/** Tests for {@link Formatter}. */
public class FormatterTest {
  private static final Formatter AUTOMATIC =
      new Formatter(NumberFormat.AUTOMATIC, 10);
  private static final Formatter PLAIN =
      new Formatter(NumberFormat.PLAIN, 10);

  @Test void testAutomatic() {
    assertThat(AUTOMATIC.format(1.5), is("1.5"));
    assertThat(AUTOMATIC.format(0.1 + 0.2), is("0.3"));
    assertThat(AUTOMATIC.format(1d / 3d), is("0.3333333333"));
    assertThat(AUTOMATIC.format(-1234.5), is("-1234.5"));
    assertThat(AUTOMATIC.format(1e6), is("1E6"));
    assertThat(AUTOMATIC.format(999_999d), is("999999"));
    assertThat(AUTOMATIC.format(1.5e-7), is("1.5E-7"));
    assertThat(AUTOMATIC.format(1e-40), is("0"));
  }

  @Test void testPlain() {
    assertThat(PLAIN.format(1e6), is("1,000,000"));
    assertThat(PLAIN.format(-1234.5), is("-1,234.5"));
    assertThat(PLAIN.format(0.25), is("0.25"));
    assertThat(PLAIN.formatInteger(BigInteger.valueOf(1234567)),
        is("1,234,567"));
    assertThat(PLAIN.formatFractionPart(BigInteger.valueOf(12345)),
        is("12,345"));
  }

  @Test void testScientific() {
    final Formatter f = new Formatter(NumberFormat.SCIENTIFIC, 2);
    assertThat(f.format(129_999d), is("1.3E5"));
    assertThat(f.format(9_999_999d), is("1E7"));
    assertThat(f.format(1.5e-7), is("1.5E-7"));
    assertThat(f.format(0.5), is("5E-1"));
    assertThat(f.formatInteger(BigInteger.valueOf(120)), is("1.2E2"));
  }

  /** The exponent is omitted when it is zero. */
  @Test void testZeroExponent() {
    final Formatter f = new Formatter(NumberFormat.SCIENTIFIC, 10);
    assertThat(f.format(5d), is("5"));
    assertThat(f.format(1.5), is("1.5"));
    assertThat(f.formatInteger(BigInteger.valueOf(-7)), is("-7"));
    assertThat(f.format(15d), is("1.5E1"));
  }

  /** Values too large for a double are formatted exactly. */
  @Test void testBigDecimal() {
    final BigDecimal big = new BigDecimal(BigInteger.TEN.pow(400));
    assertThat(AUTOMATIC.format(big), is("1E400"));
    assertThat(new Formatter(NumberFormat.SCIENTIFIC, 3).format(big),
        is("1E400"));
    assertThat(AUTOMATIC.format(new BigDecimal("2.5")), is("2.5"));
    assertThat(AUTOMATIC.format(new BigDecimal("1E-400")), is("0"));
    assertThat(PLAIN.format(new BigDecimal("1234567.125")),
        is("1,234,567.125"));
  }

  @Test void testEmbedded() {
    assertThat(AUTOMATIC.formatEmbedded(BigInteger.valueOf(1_234_567)),
        is("1234567"));
    assertThat(PLAIN.formatEmbedded(BigInteger.valueOf(1_234_567)),
        is("1234567"));
    assertThat(AUTOMATIC.formatEmbedded(BigInteger.TEN.pow(15)),
        is("1E15"));
    assertThat(PLAIN.formatEmbedded(BigInteger.TEN.pow(15)),
        is("1000000000000000"));
  }

  @Test void testSpecialValues() {
    assertThat(AUTOMATIC.format(Double.NaN), is("NaN"));
    assertThat(AUTOMATIC.format(Double.POSITIVE_INFINITY), is("∞"));
    assertThat(AUTOMATIC.format(Double.NEGATIVE_INFINITY), is("-∞"));
    assertThat(PLAIN.format(0d), is("0"));
  }

  @Test void testIntegers() {
    assertThat(AUTOMATIC.formatInteger(BigInteger.valueOf(999_999)),
        is("999999"));
    assertThat(AUTOMATIC.formatInteger(BigInteger.valueOf(-1_234_567)),
        is("-1.234567E6"));
    assertThat(
        AUTOMATIC.formatFractionPart(BigInteger.valueOf(1_234_567)),
        is("1234567"));
    assertThat(
        AUTOMATIC.formatFractionPart(BigInteger.TEN.pow(15)),
        is("1E15"));
  }

  @Test void testGroup() {
    assertThat(Formatter.group("-1234567.5"), is("-1,234,567.5"));
    assertThat(Formatter.group("123"), is("123"));
    assertThat(Formatter.group("1234"), is("1,234"));
  }

  @Test void testNegativePrecision() {
    assertThrows(IllegalArgumentException.class,
        () -> new Formatter(NumberFormat.PLAIN, -1));
  }
}

// End FormatterTest.java
