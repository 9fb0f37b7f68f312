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
package net.hydromatic.cas.solve;

import static net.hydromatic.cas.ast.ExprBuilder.expr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.hydromatic.cas.ast.Expr;
import net.hydromatic.cas.compile.Simplifier;
import net.hydromatic.cas.compile.Substitutor;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Utilities for treating expressions as polynomials. */
public abstract class Polynomials {
  /** Largest degree that {@link #coefficients} will return. */
  static final int MAX_DEGREE = 100;

  private Polynomials() {}

  /** Returns the coefficients of a polynomial in a variable, indexed by
   * degree; or null if the expression is not a polynomial in that variable.
   *
   * <p>Coefficients may contain other variables. For example,
   * "3x^2 + y·x + 1" in x gives [1, y, 3]. Trailing zero coefficients are
   * removed, so the coefficients of 0 are the empty list. */
  public static @Nullable List<Expr.Exp> coefficients(Expr.Exp exp,
      String variable) {
    final Expr.Exp expanded = Simplifier.expand(Simplifier.simplify(exp));
    final List<Expr.Exp> coefficients = new ArrayList<>();
    for (Expr.Exp term : Simplifier.termsOf(expanded)) {
      final @Nullable Monomial monomial = monomial(term, variable);
      if (monomial == null) {
        return null;
      }
      while (coefficients.size() <= monomial.degree) {
        coefficients.add(expr.zero());
      }
      coefficients.set(monomial.degree,
          Simplifier.add(coefficients.get(monomial.degree),
              monomial.coefficient));
    }
    while (!coefficients.isEmpty()
        && coefficients.get(coefficients.size() - 1).isZero()) {
      coefficients.remove(coefficients.size() - 1);
    }
    return coefficients;
  }

  /** Returns the degree of a polynomial in a variable, -1 for the zero
   * polynomial, or -2 if it is not a polynomial. */
  public static int degree(Expr.Exp exp, String variable) {
    final @Nullable List<Expr.Exp> coefficients =
        coefficients(exp, variable);
    return coefficients == null ? -2 : coefficients.size() - 1;
  }

  /** Returns the rational coefficients of a linear expression in several
   * variables, followed by its constant term; or null if the expression is
   * not linear or a coefficient is not rational.
   *
   * <p>For example, "2x - 3y + 1" in [x, y] gives [2, -3, 1]. */
  static Expr.Rational @Nullable [] linearRow(Expr.Exp exp,
      List<String> variables) {
    final Expr.Rational[] row = new Expr.Rational[variables.size() + 1];
    Arrays.fill(row, expr.zero());
    final Expr.Exp expanded = Simplifier.expand(Simplifier.simplify(exp));
    for (Expr.Exp term : Simplifier.termsOf(expanded)) {
      int column = variables.size();
      @Nullable Monomial monomial = null;
      for (int i = 0; i < variables.size(); i++) {
        if (Substitutor.dependsOn(term, variables.get(i))) {
          if (monomial != null) {
            return null; // term such as "x·y"
          }
          monomial = monomial(term, variables.get(i));
          if (monomial == null || monomial.degree != 1) {
            return null;
          }
          column = i;
        }
      }
      final Expr.Exp coefficient =
          monomial == null ? term : monomial.coefficient;
      if (!coefficient.isRational()) {
        return null;
      }
      row[column] = row[column].plus((Expr.Rational) coefficient);
    }
    return row;
  }

  /** Splits a canonical term into a coefficient and a power of a variable,
   * or returns null if the term is not of that form. */
  private static @Nullable Monomial monomial(Expr.Exp term,
      String variable) {
    if (!Substitutor.dependsOn(term, variable)) {
      return new Monomial(0, term);
    }
    switch (term.op) {
    case VARIABLE:
      return new Monomial(1, expr.one());

    case POWER:
      final Expr.Power power = (Expr.Power) term;
      if (power.base instanceof Expr.Variable
          && power.exponent instanceof Expr.Int
          && ((Expr.Int) power.exponent).isSmall()) {
        final int degree = ((Expr.Int) power.exponent).value.intValue();
        if (degree >= 1 && degree <= MAX_DEGREE) {
          return new Monomial(degree, expr.one());
        }
      }
      return null;

    case PRODUCT:
      // Exactly one factor may depend on the variable.
      @Nullable Monomial dependent = null;
      final List<Expr.Exp> others = new ArrayList<>();
      for (Expr.Exp factor : ((Expr.Product) term).factors) {
        if (Substitutor.dependsOn(factor, variable)) {
          if (dependent != null) {
            return null;
          }
          dependent = monomial(factor, variable);
          if (dependent == null) {
            return null;
          }
        } else {
          others.add(factor);
        }
      }
      if (dependent == null) {
        return null;
      }
      others.add(dependent.coefficient);
      return new Monomial(dependent.degree,
          Simplifier.simplify(expr.product(others)));

    case DIV:
      final Expr.Div div = (Expr.Div) term;
      if (Substitutor.dependsOn(div.denominator, variable)) {
        return null;
      }
      final @Nullable Monomial numerator = monomial(div.numerator, variable);
      if (numerator == null) {
        return null;
      }
      return new Monomial(numerator.degree,
          Simplifier.divide(numerator.coefficient, div.denominator));

    default:
      return null;
    }
  }

  /** Term of a polynomial; the coefficient times the variable raised to the
   * degree. */
  private static class Monomial {
    final int degree;
    final Expr.Exp coefficient;

    Monomial(int degree, Expr.Exp coefficient) {
      this.degree = degree;
      this.coefficient = coefficient;
    }
  }
}

// End Polynomials.java
