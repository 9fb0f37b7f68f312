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
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Integrates expressions symbolically.
 *
 * <p>Integration is term-wise, using the power rule and the constant
 * multiple rule. Products and powers of sums are expanded first. A few other
 * forms are recognized if their argument is linear in the variable: powers,
 * reciprocals, exponentials, roots, natural logarithms and the functions
 * sin, cos, tan, sinh and cosh.
 *
 * <p>Anything else causes {@link EvalException}.
 */
public class Integrator {
  private final String variable;
  private final Expr.Variable x;

  private Integrator(String variable) {
    this.variable = variable;
    this.x = expr.variable(variable);
  }

  /** Returns the indefinite integral of an expression, adding a fresh
   * integration constant. */
  public static Expr.Exp integrate(Expr.Exp exp, String variable,
      ConstantGenerator constants) {
    return Simplifier.add(antiderivative(exp, variable), constants.next());
  }

  /** Returns the definite integral of an expression. If the upper bound is
   * less than the lower bound, the result is negated. */
  public static Expr.Exp integrate(Expr.Exp exp, String variable,
      Expr.Exp lower, Expr.Exp upper) {
    final Expr.Exp f = antiderivative(exp, variable);
    return Simplifier.subtract(Substitutor.substitute(f, variable, upper),
        Substitutor.substitute(f, variable, lower));
  }

  /** Returns an antiderivative of an expression, without a constant. */
  public static Expr.Exp antiderivative(Expr.Exp exp, String variable) {
    final Integrator integrator = new Integrator(variable);
    return Simplifier.simplify(
        integrator.integrate(Simplifier.simplify(exp)));
  }

  private boolean isConstant(Expr.Exp exp) {
    return !Substitutor.dependsOn(exp, variable);
  }

  /** If an expression is linear in the variable, returns its slope;
   * otherwise returns null. */
  private Expr.@Nullable Exp slope(Expr.Exp exp) {
    final Expr.Exp d = Differentiator.differentiate(exp, variable);
    return isConstant(d) && !d.isZero() ? d : null;
  }

  private EvalException notIntegrable(Expr.Exp e) {
    return new EvalException("cannot integrate " + e + " with respect to "
        + variable);
  }

  /** Integrates a canonical expression; the result is not simplified. */
  private Expr.Exp integrate(Expr.Exp e) {
    if (isConstant(e)) {
      return expr.product(e, x);
    }
    switch (e.op) {
    case VARIABLE:
      return expr.div(expr.power(x, expr.intLiteral(2)), expr.intLiteral(2));

    case SUM:
      final List<Expr.Exp> terms = new ArrayList<>();
      for (Expr.Exp term : ((Expr.Sum) e).terms) {
        terms.add(integrate(term));
      }
      return expr.sum(terms);

    case PRODUCT:
      return integrateProduct((Expr.Product) e);

    case DIV:
      return integrateDiv((Expr.Div) e);

    case POWER:
      final Expr.Power power = (Expr.Power) e;
      if (isConstant(power.exponent)) {
        final Expr.@Nullable Exp slope = slope(power.base);
        if (slope != null) {
          return powerRule(power.base, power.exponent, slope);
        }
        if (power.base instanceof Expr.Sum) {
          return integrateExpanded(power);
        }
      } else if (isConstant(power.base)) {
        // ∫ b^(a x + c) = b^(a x + c) / (a ln(b))
        final Expr.@Nullable Exp slope = slope(power.exponent);
        if (slope != null) {
          return expr.div(power, expr.product(slope, expr.ln(power.base)));
        }
      }
      break;

    case ROOT:
      final Expr.Root root = (Expr.Root) e;
      final Expr.@Nullable Exp rootSlope = slope(root.radicand);
      if (rootSlope != null) {
        return powerRule(root.radicand, expr.rational(1, root.degree),
            rootSlope);
      }
      break;

    case TRIG:
      final Expr.Trig trig = (Expr.Trig) e;
      final Expr.@Nullable Exp trigSlope = slope(trig.argument);
      if (trigSlope != null) {
        final Expr.@Nullable Exp f =
            integrateTrig(trig.function, trig.argument);
        if (f != null) {
          return expr.div(f, trigSlope);
        }
      }
      break;

    case LOG:
      // ∫ ln(u) = (u ln(u) - u) / a
      final Expr.Log log = (Expr.Log) e;
      if (isConstant(log.base)) {
        final Expr.@Nullable Exp logSlope = slope(log.argument);
        if (logSlope != null) {
          final Expr.Exp u = log.argument;
          final Expr.Exp f =
              expr.div(expr.minus(expr.product(u, expr.ln(u)), u), logSlope);
          return log.isNatural() ? f : expr.div(f, expr.ln(log.base));
        }
      }
      break;

    default:
      break;
    }
    throw notIntegrable(e);
  }

  private Expr.Exp integrateProduct(Expr.Product product) {
    final List<Expr.Exp> constants = new ArrayList<>();
    final List<Expr.Exp> rest = new ArrayList<>();
    for (Expr.Exp factor : product.factors) {
      (isConstant(factor) ? constants : rest).add(factor);
    }
    if (rest.size() == 1) {
      constants.add(integrate(rest.get(0)));
      return expr.product(constants);
    }
    if (rest.stream().anyMatch(factor -> factor instanceof Expr.Sum
        || factor instanceof Expr.Power
            && ((Expr.Power) factor).base instanceof Expr.Sum)) {
      return integrateExpanded(product);
    }
    throw notIntegrable(product);
  }

  private Expr.Exp integrateDiv(Expr.Div div) {
    final Expr.Exp n = div.numerator;
    final Expr.Exp d = div.denominator;
    if (isConstant(d)) {
      return expr.div(integrate(n), d);
    }
    if (n instanceof Expr.Sum) {
      final List<Expr.Exp> terms = new ArrayList<>();
      for (Expr.Exp term : ((Expr.Sum) n).terms) {
        terms.add(integrate(Simplifier.divide(term, d)));
      }
      return expr.sum(terms);
    }
    if (isConstant(n)) {
      final Expr.@Nullable Exp slope = slope(d);
      if (slope != null) {
        // ∫ n / (a x + b) = n ln|a x + b| / a
        return expr.div(expr.product(n, expr.ln(expr.abs(d))), slope);
      }
      if (d instanceof Expr.Power) {
        // ∫ n / u^k = n ∫ u^-k
        final Expr.Power power = (Expr.Power) d;
        final Expr.@Nullable Exp powerSlope = slope(power.base);
        if (powerSlope != null && isConstant(power.exponent)) {
          return expr.product(n,
              powerRule(power.base, expr.negate(power.exponent), powerSlope));
        }
      }
      if (d instanceof Expr.Root) {
        final Expr.Root root = (Expr.Root) d;
        final Expr.@Nullable Exp rootSlope = slope(root.radicand);
        if (rootSlope != null) {
          return expr.product(n,
              powerRule(root.radicand, expr.rational(-1, root.degree),
                  rootSlope));
        }
      }
    }
    // ∫ k u' / u = k ln|u|
    final Expr.Exp ratio =
        Simplifier.divide(n, Differentiator.differentiate(d, variable));
    if (isConstant(ratio)) {
      return expr.product(ratio, expr.ln(expr.abs(d)));
    }
    throw notIntegrable(div);
  }

  /** Multiplies out a product or power of sums, then integrates term by
   * term. */
  private Expr.Exp integrateExpanded(Expr.Exp e) {
    final Expr.Exp expanded = Simplifier.expand(e);
    if (expanded.equals(e)) {
      throw notIntegrable(e);
    }
    return integrate(expanded);
  }

  /** Applies the power rule to {@code u^k} where u is linear with slope
   * {@code a}: the integral is {@code u^(k+1) / ((k+1) a)}, or
   * {@code ln|u| / a} if k is -1. */
  private static Expr.Exp powerRule(Expr.Exp u, Expr.Exp k, Expr.Exp a) {
    final Expr.Exp k1 = Simplifier.add(k, expr.one());
    if (k1.isZero()) {
      return expr.div(expr.ln(expr.abs(u)), a);
    }
    return expr.div(expr.power(u, k1), expr.product(k1, a));
  }

  /** Returns the integral of a trigonometric function with respect to its
   * argument, or null. */
  private static Expr.@Nullable Exp integrateTrig(TrigFunction function,
      Expr.Exp u) {
    switch (function) {
    case SIN:
      return expr.negate(expr.trig(TrigFunction.COS, u));
    case COS:
      return expr.trig(TrigFunction.SIN, u);
    case TAN:
      return expr.negate(
          expr.ln(expr.abs(expr.trig(TrigFunction.COS, u))));
    case SINH:
      return expr.trig(TrigFunction.COSH, u);
    case COSH:
      return expr.trig(TrigFunction.SINH, u);
    default:
      return null;
    }
  }
}

// End Integrator.java
