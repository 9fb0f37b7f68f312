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

import static net.hydromatic.cas.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Context for writing an expression out as a string. */
public class ExprWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public ExprWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an expression. */
  public ExprWriter append(Expr.Exp exp, int left, int right) {
    return exp.unparse(this, left, right);
  }

  /** Appends a call to an infix operator. */
  public ExprWriter infix(int left, Expr.Exp a0, Op op, Expr.Exp a1,
      int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    a0.unparse(this, left, op.left);
    append(op.padded);
    a1.unparse(this, op.right, right);
    return this;
  }

  /** Appends a call to a prefix operator, such as unary minus. */
  public ExprWriter prefix(int left, Op op, Expr.Exp a, int right) {
    if (left > op.left || op.right < right) {
      return append("(").prefix(0, op, a, 0).append(")");
    }
    append(op.padded);
    a.unparse(this, op.right, right);
    return this;
  }

  /** Appends a positive fraction literal. */
  public ExprWriter fraction(int left, BigInteger numerator,
      BigInteger denominator, int right) {
    final Op op = Op.FRACTION;
    if (left > op.left || op.right < right) {
      return append("(").fraction(0, numerator, denominator, 0).append(")");
    }
    return append(numerator.toString()).append(op.padded)
        .append(denominator.toString());
  }

  /** Appends a function call with two arguments, e.g. "P(5, 2)". */
  public ExprWriter call(String name, Expr.Exp a0, Expr.Exp a1) {
    return append(name).append("(").append(a0, 0, 0).append(", ")
        .append(a1, 0, 0).append(")");
  }

  /** Appends a sum. Terms with a negative coefficient are written with a
   * minus sign, e.g. "x - 2y" rather than "x + -2y". */
  public ExprWriter sum(int left, List<Expr.Exp> terms, int right) {
    final Op op = Op.SUM;
    if (left > op.left || op.right < right) {
      return append("(").sum(0, terms, 0).append(")");
    }
    for (int i = 0; i < terms.size(); i++) {
      final Expr.Exp term = terms.get(i);
      final int r = i == terms.size() - 1 ? right : op.left;
      if (i == 0) {
        term.unparse(this, left, r);
        continue;
      }
      final Expr.@Nullable Exp positive = positive(term);
      if (positive != null) {
        append(" - ");
        positive.unparse(this, op.right, r);
      } else {
        append(op.padded);
        term.unparse(this, op.right, r);
      }
    }
    return this;
  }

  /** Appends a product. An integer coefficient is written next to the
   * following factor, e.g. "2x", unless the factor starts with a digit. */
  public ExprWriter product(int left, List<Expr.Exp> factors, int right) {
    final Op op = Op.PRODUCT;
    final Expr.Exp first = factors.get(0);
    if (first instanceof Expr.Rational
        && ((Expr.Rational) first).signum() < 0) {
      final Expr.@Nullable Exp positive = positive(expr.product(factors));
      if (positive != null) {
        return prefix(left, Op.NEGATE, positive, right);
      }
    }
    if (left > op.left || op.right < right) {
      return append("(").product(0, factors, 0).append(")");
    }
    for (int i = 0; i < factors.size(); i++) {
      final Expr.Exp factor = factors.get(i);
      if (i > 0
          && !(i == 1 && first instanceof Expr.Int && juxtaposable(factor))) {
        append(op.padded);
      }
      factor.unparse(this, op.right, op.left);
    }
    return this;
  }

  /** Returns whether a factor may follow an integer coefficient without a
   * multiplication sign. */
  private static boolean juxtaposable(Expr.Exp factor) {
    final String s = factor.toString();
    final char c = s.charAt(0);
    return !Character.isDigit(c) && c != '-' && c != '.';
  }

  /** If an expression is negative (a negative rational, or a product or
   * quotient with a negative coefficient) returns its negation; otherwise
   * returns null. */
  public static Expr.@Nullable Exp positive(Expr.Exp exp) {
    switch (exp.op) {
    case INTEGER:
    case FRACTION:
      final Expr.Rational rational = (Expr.Rational) exp;
      return rational.signum() < 0 ? rational.negate() : null;

    case PRODUCT:
      final List<Expr.Exp> factors = ((Expr.Product) exp).factors;
      if (factors.isEmpty()
          || !(factors.get(0) instanceof Expr.Rational)
          || ((Expr.Rational) factors.get(0)).signum() >= 0) {
        return null;
      }
      final Expr.Rational coefficient =
          ((Expr.Rational) factors.get(0)).negate();
      final List<Expr.Exp> rest = factors.subList(1, factors.size());
      if (!coefficient.isOne()) {
        return expr.product(
            ImmutableList.<Expr.Exp>builder().add(coefficient).addAll(rest)
                .build());
      }
      switch (rest.size()) {
      case 0:
        return coefficient;
      case 1:
        return rest.get(0);
      default:
        return expr.product(rest);
      }

    case DIV:
      final Expr.Div div = (Expr.Div) exp;
      final Expr.@Nullable Exp numerator = positive(div.numerator);
      return numerator == null ? null : expr.div(numerator, div.denominator);

    default:
      return null;
    }
  }

  @Override public String toString() {
    return b.toString();
  }
}

// End ExprWriter.java
