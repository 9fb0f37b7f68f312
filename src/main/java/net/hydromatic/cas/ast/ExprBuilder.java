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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;

/** Builds expressions.
 *
 * <p>The expressions are not simplified. */
public enum ExprBuilder {
  /** The singleton instance of the expression builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  expr;

  private final Expr.Int zero = new Expr.Int(BigInteger.ZERO);
  private final Expr.Int one = new Expr.Int(BigInteger.ONE);
  private final Expr.Int minusOne = new Expr.Int(BigInteger.ONE.negate());

  /** Creates an integer literal. */
  public Expr.Int intLiteral(BigInteger value) {
    switch (value.signum()) {
    case 0:
      return zero;
    case 1:
      return value.equals(BigInteger.ONE) ? one : new Expr.Int(value);
    default:
      return value.equals(minusOne.value) ? minusOne : new Expr.Int(value);
    }
  }

  /** Creates an integer literal. */
  public Expr.Int intLiteral(long value) {
    return intLiteral(BigInteger.valueOf(value));
  }

  /** Creates the integer literal 0. */
  public Expr.Int zero() {
    return zero;
  }

  /** Creates the integer literal 1. */
  public Expr.Int one() {
    return one;
  }

  /** Creates the integer literal -1. */
  public Expr.Int minusOne() {
    return minusOne;
  }

  /** Creates a rational number in lowest terms; an integer if the
   * denominator divides the numerator, otherwise a fraction with a positive
   * denominator. */
  public Expr.Rational rational(BigInteger numerator, BigInteger denominator) {
    checkArgument(denominator.signum() != 0, "zero denominator");
    if (denominator.signum() < 0) {
      numerator = numerator.negate();
      denominator = denominator.negate();
    }
    final BigInteger gcd = numerator.gcd(denominator);
    if (!gcd.equals(BigInteger.ONE)) {
      numerator = numerator.divide(gcd);
      denominator = denominator.divide(gcd);
    }
    if (denominator.equals(BigInteger.ONE)) {
      return intLiteral(numerator);
    }
    return new Expr.Frac(numerator, denominator);
  }

  /** Creates a rational number in lowest terms. */
  public Expr.Rational rational(long numerator, long denominator) {
    return rational(BigInteger.valueOf(numerator),
        BigInteger.valueOf(denominator));
  }

  public Expr.Constant constant(ConstantTag tag) {
    return new Expr.Constant(tag);
  }

  public Expr.Variable variable(String name) {
    return new Expr.Variable(name);
  }

  public Expr.Sum sum(List<? extends Expr.Exp> terms) {
    return new Expr.Sum(ImmutableList.copyOf(terms));
  }

  public Expr.Sum sum(Expr.Exp... terms) {
    return new Expr.Sum(ImmutableList.copyOf(terms));
  }

  public Expr.Product product(List<? extends Expr.Exp> factors) {
    return new Expr.Product(ImmutableList.copyOf(factors));
  }

  public Expr.Product product(Expr.Exp... factors) {
    return new Expr.Product(ImmutableList.copyOf(factors));
  }

  /** Creates "-e", as the product of -1 and e. */
  public Expr.Product negate(Expr.Exp e) {
    return product(minusOne, e);
  }

  /** Creates "a - b", as the sum of a and -b. */
  public Expr.Sum minus(Expr.Exp a, Expr.Exp b) {
    return sum(a, negate(b));
  }

  public Expr.Power power(Expr.Exp base, Expr.Exp exponent) {
    return new Expr.Power(base, exponent);
  }

  public Expr.Root root(Expr.Exp radicand, int degree) {
    return new Expr.Root(radicand, degree);
  }

  /** Creates a square root. */
  public Expr.Root sqrt(Expr.Exp radicand) {
    return new Expr.Root(radicand, 2);
  }

  public Expr.Log log(Expr.Exp base, Expr.Exp argument) {
    return new Expr.Log(base, argument);
  }

  /** Creates a natural logarithm. */
  public Expr.Log ln(Expr.Exp argument) {
    return new Expr.Log(constant(ConstantTag.E), argument);
  }

  public Expr.Trig trig(TrigFunction function, Expr.Exp argument) {
    return new Expr.Trig(function, argument);
  }

  public Expr.Abs abs(Expr.Exp argument) {
    return new Expr.Abs(argument);
  }

  public Expr.Div div(Expr.Exp numerator, Expr.Exp denominator) {
    return new Expr.Div(numerator, denominator);
  }

  public Expr.Perm perm(Expr.Exp n, Expr.Exp r) {
    return new Expr.Perm(n, r);
  }

  public Expr.Comb comb(Expr.Exp n, Expr.Exp r) {
    return new Expr.Comb(n, r);
  }
}

// End ExprBuilder.java
