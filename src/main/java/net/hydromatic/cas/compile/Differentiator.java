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
package net.hydromatic.cas.compile;

import static net.hydromatic.cas.ast.ExprBuilder.expr;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.cas.ast.Expr;
import net.hydromatic.cas.ast.TrigFunction;
import net.hydromatic.cas.util.EvalException;

/**
 * Differentiates expressions symbolically.
 *
 * <p>Variables other than the one being differentiated are independent
 * constants.
 */
public class Differentiator {
  private final String variable;

  private Differentiator(String variable) {
    this.variable = variable;
  }

  /** Returns the derivative of an expression with respect to a variable,
   * in canonical form. */
  public static Expr.Exp differentiate(Expr.Exp exp, String variable) {
    final Differentiator differentiator = new Differentiator(variable);
    return Simplifier.simplify(
        differentiator.derive(Simplifier.simplify(exp)));
  }

  /** Returns the value of the derivative of an expression at a point. */
  public static Expr.Exp differentiate(Expr.Exp exp, String variable,
      Expr.Exp at) {
    return Substitutor.substitute(differentiate(exp, variable), variable, at);
  }

  private boolean isConstant(Expr.Exp exp) {
    return !Substitutor.dependsOn(exp, variable);
  }

  /** Returns the derivative of an expression; the result is not
   * simplified. */
  private Expr.Exp derive(Expr.Exp e) {
    if (isConstant(e)) {
      return expr.zero();
    }
    switch (e.op) {
    case VARIABLE:
      // Only the variable we are differentiating is not constant
      return expr.one();

    case SUM:
      final List<Expr.Exp> terms = new ArrayList<>();
      for (Expr.Exp term : ((Expr.Sum) e).terms) {
        terms.add(derive(term));
      }
      return expr.sum(terms);

    case PRODUCT:
      // (f g h)' = f' g h + f g' h + f g h'
      final List<Expr.Exp> factors = ((Expr.Product) e).factors;
      final List<Expr.Exp> products = new ArrayList<>();
      for (int i = 0; i < factors.size(); i++) {
        if (isConstant(factors.get(i))) {
          continue;
        }
        final List<Expr.Exp> list = new ArrayList<>(factors);
        list.set(i, derive(factors.get(i)));
        products.add(expr.product(list));
      }
      return expr.sum(products);

    case DIV:
      // (n / d)' = (n' d - n d') / d^2
      final Expr.Div div = (Expr.Div) e;
      return expr.div(
          expr.minus(expr.product(derive(div.numerator), div.denominator),
              expr.product(div.numerator, derive(div.denominator))),
          expr.power(div.denominator, expr.intLiteral(2)));

    case POWER:
      return derivePower((Expr.Power) e);

    case ROOT:
      // root(u, n)' = u' / (n root(u^(n-1), n))
      final Expr.Root root = (Expr.Root) e;
      return expr.div(derive(root.radicand),
          expr.product(expr.intLiteral(root.degree),
              expr.root(
                  expr.power(root.radicand,
                      expr.intLiteral(root.degree - 1)),
                  root.degree)));

    case LOG:
      final Expr.Log log = (Expr.Log) e;
      if (!isConstant(log.base)) {
        // Change of base: log_b(u) = ln(u) / ln(b)
        return derive(expr.div(expr.ln(log.argument), expr.ln(log.base)));
      }
      if (log.isNatural()) {
        return expr.div(derive(log.argument), log.argument);
      }
      return expr.div(derive(log.argument),
          expr.product(log.argument, expr.ln(log.base)));

    case TRIG:
      final Expr.Trig trig = (Expr.Trig) e;
      return expr.product(deriveTrig(trig.function, trig.argument),
          derive(trig.argument));

    case ABS:
      // |u|' = u u' / |u|
      final Expr.Abs abs = (Expr.Abs) e;
      return expr.div(expr.product(abs.argument, derive(abs.argument)), abs);

    case PERM:
    case COMB:
      throw new EvalException("not differentiable with respect to "
          + variable + ": " + e);

    default:
      throw new AssertionError("unexpected op " + e.op);
    }
  }

  private Expr.Exp derivePower(Expr.Power power) {
    final Expr.Exp b = power.base;
    final Expr.Exp k = power.exponent;
    if (isConstant(k)) {
      // (b^k)' = k b^(k-1) b'
      return expr.product(k, expr.power(b, expr.minus(k, expr.one())),
          derive(b));
    }
    if (isConstant(b)) {
      // (b^k)' = b^k ln(b) k'
      return expr.product(power, expr.ln(b), derive(k));
    }
    // (b^k)' = b^k (k' ln(b) + k b' / b)
    return expr.product(power,
        expr.sum(expr.product(derive(k), expr.ln(b)),
            expr.div(expr.product(k, derive(b)), b)));
  }

  /** Returns the derivative of a trigonometric function with respect to its
   * argument. */
  private static Expr.Exp deriveTrig(TrigFunction function, Expr.Exp u) {
    final Expr.Exp two = expr.intLiteral(2);
    final Expr.Exp uSquared = expr.power(u, two);
    switch (function) {
    case SIN:
      return expr.trig(TrigFunction.COS, u);
    case COS:
      return expr.negate(expr.trig(TrigFunction.SIN, u));
    case TAN:
      return expr.div(expr.one(),
          expr.power(expr.trig(TrigFunction.COS, u), two));
    case ASIN:
      return expr.div(expr.one(),
          expr.sqrt(expr.minus(expr.one(), uSquared)));
    case ACOS:
      return expr.div(expr.minusOne(),
          expr.sqrt(expr.minus(expr.one(), uSquared)));
    case ATAN:
      return expr.div(expr.one(), expr.sum(expr.one(), uSquared));
    case SINH:
      return expr.trig(TrigFunction.COSH, u);
    case COSH:
      return expr.trig(TrigFunction.SINH, u);
    case TANH:
      return expr.div(expr.one(),
          expr.power(expr.trig(TrigFunction.COSH, u), two));
    case ASINH:
      return expr.div(expr.one(), expr.sqrt(expr.sum(uSquared, expr.one())));
    case ACOSH:
      return expr.div(expr.one(),
          expr.sqrt(expr.minus(uSquared, expr.one())));
    case ATANH:
      return expr.div(expr.one(), expr.minus(expr.one(), uSquared));
    default:
      throw new AssertionError("unexpected function " + function);
    }
  }
}

// End Differentiator.java
