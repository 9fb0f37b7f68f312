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

import com.google.common.collect.ImmutableList;
import com.google.common.math.BigIntegerMath;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import net.hydromatic.cas.ast.ConstantTag;
import net.hydromatic.cas.ast.Expr;
import net.hydromatic.cas.ast.Op;
import net.hydromatic.cas.ast.TrigFunction;
import net.hydromatic.cas.ast.Visitor;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts expressions to canonical form.
 *
 * <p>{@link #simplify} is pure (it never modifies its argument), total (it
 * never throws for a well-formed expression) and idempotent.
 *
 * <p>Canonical forms:
 *
 * <ul>
 *   <li>A sum is flat, has no zero terms, and no two terms that differ only
 *       in their numeric coefficient;
 *   <li>A product has at most one numeric coefficient, which is an integer
 *       and comes first; roots come next, then other factors ordered by
 *       their string representation; equal bases are merged into a power;
 *   <li>A product whose coefficient is a fraction, or that has factors with
 *       negative exponents, is a {@link Expr.Div};
 *   <li>A root has no perfect-power factor in its radicand, and a rational
 *       radicand is an integer.
 * </ul>
 *
 * <p>Division by zero is not simplified away; {@code x / 0} remains a
 * {@link Expr.Div} whose value is infinite or NaN.
 */
public class Simplifier {
  /** Largest magnitude of an integer exponent applied exactly to a rational
   * base. */
  static final int MAX_EXACT_EXPONENT = 1000;

  /** Largest number of multiplications used to compute P(n, r) or
   * C(n, r) exactly. */
  static final int MAX_ARRANGEMENT = 10_000;

  /** Largest power of a sum that {@link #expand} multiplies out. */
  static final int MAX_EXPANSION = 10;

  /** Largest trial divisor used when extracting perfect powers. */
  private static final long MAX_TRIAL_DIVISOR = 100_000L;

  /** Order of factors in a product: roots first, then by text. */
  private static final Comparator<Expr.Exp> FACTOR_ORDER =
      Comparator.comparing((Expr.Exp e) -> e.op == Op.ROOT ? 0 : 1)
          .thenComparing(Expr.Exp::toString);

  private Simplifier() {}

  /** Converts an expression to canonical form. */
  public static Expr.Exp simplify(Expr.Exp exp) {
    switch (exp.op) {
    case INTEGER:
    case FRACTION:
    case CONSTANT:
    case VARIABLE:
      return exp;

    case SUM:
      final List<Expr.Exp> terms = new ArrayList<>();
      for (Expr.Exp term : ((Expr.Sum) exp).terms) {
        addTerm(terms, simplify(term));
      }
      return collect(terms);

    case PRODUCT:
      final List<Expr.Exp> factors = new ArrayList<>();
      for (Expr.Exp factor : ((Expr.Product) exp).factors) {
        factors.add(simplify(factor));
      }
      return multiplyAll(factors, ImmutableList.of());

    case POWER:
      final Expr.Power power = (Expr.Power) exp;
      return simplifyPower(simplify(power.base), simplify(power.exponent));

    case ROOT:
      final Expr.Root root = (Expr.Root) exp;
      return simplifyRoot(simplify(root.radicand), root.degree);

    case LOG:
      final Expr.Log log = (Expr.Log) exp;
      return simplifyLog(simplify(log.base), simplify(log.argument));

    case TRIG:
      final Expr.Trig trig = (Expr.Trig) exp;
      return simplifyTrig(trig.function, simplify(trig.argument));

    case ABS:
      return simplifyAbs(simplify(((Expr.Abs) exp).argument));

    case DIV:
      final Expr.Div div = (Expr.Div) exp;
      final Expr.Exp numerator = simplify(div.numerator);
      final Expr.Exp denominator = simplify(div.denominator);
      if (denominator.isZero()) {
        // Leave it to toDouble to produce infinity or NaN
        return expr.div(numerator, denominator);
      }
      if (numerator.isZero()) {
        return numerator;
      }
      return multiplyAll(ImmutableList.of(numerator),
          ImmutableList.of(denominator));

    case PERM:
      final Expr.Perm perm = (Expr.Perm) exp;
      return arrangements(false, simplify(perm.n), simplify(perm.r));

    case COMB:
      final Expr.Comb comb = (Expr.Comb) exp;
      return arrangements(true, simplify(comb.n), simplify(comb.r));

    default:
      throw new AssertionError("unexpected op " + exp.op);
    }
  }

  // Arithmetic combinators. Arguments need not be canonical; results are.

  /** Returns the canonical form of "a + b". */
  public static Expr.Exp add(Expr.Exp a, Expr.Exp b) {
    if (a.isRational() && b.isRational()) {
      return ((Expr.Rational) a).plus((Expr.Rational) b);
    }
    return simplify(expr.sum(a, b));
  }

  /** Returns the canonical form of "a - b". */
  public static Expr.Exp subtract(Expr.Exp a, Expr.Exp b) {
    if (a.isRational() && b.isRational()) {
      return ((Expr.Rational) a).minus((Expr.Rational) b);
    }
    return simplify(expr.minus(a, b));
  }

  /** Returns the canonical form of "a * b". */
  public static Expr.Exp multiply(Expr.Exp a, Expr.Exp b) {
    if (a.isRational() && b.isRational()) {
      return ((Expr.Rational) a).times((Expr.Rational) b);
    }
    return simplify(expr.product(a, b));
  }

  /** Returns the canonical form of "a / b". If b is zero, the result is a
   * division whose value is infinite or NaN. */
  public static Expr.Exp divide(Expr.Exp a, Expr.Exp b) {
    if (a.isRational() && b.isRational() && !b.isZero()) {
      return ((Expr.Rational) a).divide((Expr.Rational) b);
    }
    return simplify(expr.div(a, b));
  }

  /** Returns the canonical form of "a ^ b". */
  public static Expr.Exp power(Expr.Exp a, Expr.Exp b) {
    return simplify(expr.power(a, b));
  }

  /** Returns the canonical form of "-a". */
  public static Expr.Exp negate(Expr.Exp a) {
    if (a.isRational()) {
      return ((Expr.Rational) a).negate();
    }
    return multiply(expr.minusOne(), a);
  }

  /** Returns whether an expression has no irrational parts: no roots, logs,
   * trigonometric functions or symbolic constants. */
  public static boolean isExact(Expr.Exp exp) {
    final boolean[] exact = {true};
    exp.accept(
        new Visitor() {
          @Override protected void visit(Expr.Constant constant) {
            exact[0] = false;
          }

          @Override protected void visit(Expr.Root root) {
            exact[0] = false;
          }

          @Override protected void visit(Expr.Log log) {
            exact[0] = false;
          }

          @Override protected void visit(Expr.Trig trig) {
            exact[0] = false;
          }
        });
    return exact[0];
  }

  /** Returns whether an expression contains a division by zero, such as
   * "1/0" or "0^-1". */
  public static boolean dividesByZero(Expr.Exp exp) {
    final boolean[] found = {false};
    exp.accept(
        new Visitor() {
          @Override protected void visit(Expr.Div div) {
            if (div.denominator.isZero()) {
              found[0] = true;
            }
            super.visit(div);
          }

          @Override protected void visit(Expr.Power power) {
            if (power.base.isZero()
                && power.exponent.isRational()
                && ((Expr.Rational) power.exponent).signum() < 0) {
              found[0] = true;
            }
            super.visit(power);
          }
        });
    return found[0];
  }

  /** Multiplies out products of sums and small powers of sums; for
   * example, "(x + 1)^2" becomes "x^2 + 2x + 1". The argument must be
   * canonical. */
  public static Expr.Exp expand(Expr.Exp exp) {
    switch (exp.op) {
    case SUM:
      final List<Expr.Exp> terms = new ArrayList<>();
      for (Expr.Exp term : ((Expr.Sum) exp).terms) {
        addTerm(terms, expand(term));
      }
      return collect(terms);

    case PRODUCT:
      List<Expr.Exp> products = ImmutableList.of(expr.one());
      for (Expr.Exp factor : ((Expr.Product) exp).factors) {
        products = crossMultiply(products, termsOf(expand(factor)));
      }
      return simplify(expr.sum(products));

    case POWER:
      final Expr.Power power = (Expr.Power) exp;
      if (power.base instanceof Expr.Sum
          && power.exponent instanceof Expr.Int
          && ((Expr.Int) power.exponent).isSmall()) {
        final int k = ((Expr.Int) power.exponent).value.intValue();
        if (k > 1 && k <= MAX_EXPANSION) {
          List<Expr.Exp> powers = ImmutableList.of(expr.one());
          for (int i = 0; i < k; i++) {
            powers = crossMultiply(powers, ((Expr.Sum) power.base).terms);
          }
          return simplify(expr.sum(powers));
        }
      }
      return exp;

    case DIV:
      final Expr.Div div = (Expr.Div) exp;
      if (div.denominator.isZero()) {
        return exp;
      }
      return simplify(expr.div(expand(div.numerator), div.denominator));

    default:
      return exp;
    }
  }

  /** Returns the terms of an expression; a non-sum has one term. */
  public static List<Expr.Exp> termsOf(Expr.Exp exp) {
    return exp instanceof Expr.Sum
        ? ((Expr.Sum) exp).terms
        : ImmutableList.of(exp);
  }

  private static List<Expr.Exp> crossMultiply(List<Expr.Exp> terms0,
      List<Expr.Exp> terms1) {
    final List<Expr.Exp> list = new ArrayList<>();
    for (Expr.Exp term0 : terms0) {
      for (Expr.Exp term1 : terms1) {
        list.add(multiply(term0, term1));
      }
    }
    return list;
  }

  // Sums

  /** Adds a canonical term to a list of terms, flattening sums and
   * skipping zeros. */
  private static void addTerm(List<Expr.Exp> terms, Expr.Exp term) {
    if (term instanceof Expr.Sum) {
      terms.addAll(((Expr.Sum) term).terms);
    } else if (!term.isZero()) {
      terms.add(term);
    }
  }

  /** Combines like terms. Each group of terms keeps the position of its
   * first occurrence. */
  private static Expr.Exp collect(List<Expr.Exp> terms) {
    final Map<Expr.Exp, Expr.Rational> coefficients = new LinkedHashMap<>();
    for (Expr.Exp term : terms) {
      coefficients.merge(base(term), coefficient(term), Expr.Rational::plus);
    }
    final List<Expr.Exp> list = new ArrayList<>();
    coefficients.forEach((base, coefficient) -> {
      if (coefficient.signum() != 0) {
        addTerm(list, scale(coefficient, base));
      }
    });
    switch (list.size()) {
    case 0:
      return expr.zero();
    case 1:
      return list.get(0);
    default:
      return expr.sum(list);
    }
  }

  /** Returns the numeric coefficient of a term; for example 3 for "3x",
   * -1/2 for "-x/2", and the value of a number. */
  static Expr.Rational coefficient(Expr.Exp term) {
    switch (term.op) {
    case INTEGER:
    case FRACTION:
      return (Expr.Rational) term;

    case PRODUCT:
      final List<Expr.Exp> factors = ((Expr.Product) term).factors;
      return !factors.isEmpty() && factors.get(0).isRational()
          ? (Expr.Rational) factors.get(0)
          : expr.one();

    case DIV:
      final Expr.Div div = (Expr.Div) term;
      final Expr.Rational d = coefficient(div.denominator);
      if (d.signum() == 0) {
        return expr.one();
      }
      return coefficient(div.numerator).divide(d);

    default:
      return expr.one();
    }
  }

  /** Returns a term without its numeric coefficient; for example "x" for
   * "3x", and 1 for a number. Terms with the same base are like terms. */
  static Expr.Exp base(Expr.Exp term) {
    switch (term.op) {
    case INTEGER:
    case FRACTION:
      return expr.one();

    case PRODUCT:
      final List<Expr.Exp> factors = ((Expr.Product) term).factors;
      if (factors.isEmpty() || !factors.get(0).isRational()) {
        return term;
      }
      switch (factors.size()) {
      case 1:
        return expr.one();
      case 2:
        return factors.get(1);
      default:
        return expr.product(factors.subList(1, factors.size()));
      }

    case DIV:
      final Expr.Div div = (Expr.Div) term;
      if (coefficient(div.denominator).signum() == 0) {
        return term;
      }
      final Expr.Exp numerator = base(div.numerator);
      final Expr.Exp denominator = base(div.denominator);
      return denominator.isOne() ? numerator : expr.div(numerator, denominator);

    default:
      return term;
    }
  }

  /** Multiplies a base by a non-zero coefficient. */
  private static Expr.Exp scale(Expr.Rational coefficient, Expr.Exp base) {
    if (base.isOne()) {
      return coefficient;
    }
    return simplify(expr.product(coefficient, base));
  }

  // Products

  /** Multiplies canonical numerators and divides by canonical
   * denominators, returning a canonical expression. */
  private static Expr.Exp multiplyAll(List<Expr.Exp> numerators,
      List<Expr.Exp> denominators) {
    final Factors factors = new Factors();
    numerators.forEach(factors::multiply);
    denominators.forEach(factors::divide);
    return factors.build();
  }

  /** Accumulates the factors of a product, merging equal bases. */
  private static class Factors {
    Expr.Rational coefficient = expr.one();

    /** Exponents of each base, in order of first occurrence. */
    final Map<Expr.Exp, List<Expr.Exp>> exponents = new LinkedHashMap<>();

    /** Radicands of roots, keyed by degree. */
    final Map<Integer, List<Expr.Exp>> radicands = new TreeMap<>();

    /** Factors that cannot be merged, such as a division by zero. */
    final List<Expr.Exp> opaque = new ArrayList<>();

    void multiply(Expr.Exp e) {
      switch (e.op) {
      case INTEGER:
      case FRACTION:
        coefficient = coefficient.times((Expr.Rational) e);
        return;

      case PRODUCT:
        ((Expr.Product) e).factors.forEach(this::multiply);
        return;

      case DIV:
        final Expr.Div div = (Expr.Div) e;
        if (div.denominator.isZero()) {
          opaque.add(e);
          return;
        }
        multiply(div.numerator);
        divide(div.denominator);
        return;

      case ROOT:
        final Expr.Root root = (Expr.Root) e;
        radicands.computeIfAbsent(root.degree, d -> new ArrayList<>())
            .add(root.radicand);
        return;

      case POWER:
        final Expr.Power power = (Expr.Power) e;
        exponent(power.base, power.exponent);
        return;

      default:
        exponent(e, expr.one());
      }
    }

    void divide(Expr.Exp e) {
      switch (e.op) {
      case INTEGER:
      case FRACTION:
        final Expr.Rational r = (Expr.Rational) e;
        if (r.signum() == 0) {
          opaque.add(expr.div(expr.one(), r));
        } else {
          coefficient = coefficient.divide(r);
        }
        return;

      case PRODUCT:
        ((Expr.Product) e).factors.forEach(this::divide);
        return;

      case DIV:
        final Expr.Div div = (Expr.Div) e;
        if (div.denominator.isZero()) {
          exponent(e, expr.minusOne());
          return;
        }
        multiply(div.denominator);
        divide(div.numerator);
        return;

      case ROOT:
        final Expr.Root root = (Expr.Root) e;
        if (root.radicand.isRational()
            && ((Expr.Rational) root.radicand).signum() > 0) {
          // Rationalize: 1 / root(r, n) = root(r ^ (n - 1), n) / r
          final Expr.Rational radicand = (Expr.Rational) root.radicand;
          radicands.computeIfAbsent(root.degree, d -> new ArrayList<>())
              .add(
                  simplifyPower(radicand, expr.intLiteral(root.degree - 1)));
          coefficient = coefficient.divide(radicand);
          return;
        }
        exponent(e, expr.minusOne());
        return;

      case POWER:
        final Expr.Power power = (Expr.Power) e;
        exponent(power.base, negate(power.exponent));
        return;

      default:
        exponent(e, expr.minusOne());
      }
    }

    private void exponent(Expr.Exp base, Expr.Exp exponent) {
      exponents.computeIfAbsent(base, b -> new ArrayList<>()).add(exponent);
    }

    /** Adds a canonical expression to the numerator. */
    private void addNumerator(List<Expr.Exp> numerators, Expr.Exp e) {
      if (e.isRational()) {
        coefficient = coefficient.times((Expr.Rational) e);
      } else if (e instanceof Expr.Product) {
        for (Expr.Exp factor : ((Expr.Product) e).factors) {
          addNumerator(numerators, factor);
        }
      } else {
        numerators.add(e);
      }
    }

    Expr.Exp build() {
      if (coefficient.signum() == 0) {
        return expr.zero();
      }
      final List<Expr.Exp> numerators = new ArrayList<>();
      final List<Expr.Exp> denominators = new ArrayList<>();
      exponents.forEach((base, list) -> {
        final Expr.Exp total =
            list.size() == 1 ? list.get(0) : simplify(expr.sum(list));
        if (total.isZero()) {
          return;
        }
        if (total.isOne()) {
          numerators.add(base);
          return;
        }
        if (total.isRational() && ((Expr.Rational) total).signum() < 0) {
          denominators.add(
              simplifyPower(base, ((Expr.Rational) total).negate()));
          return;
        }
        if (list.size() == 1) {
          numerators.add(expr.power(base, total));
          return;
        }
        addNumerator(numerators, simplifyPower(base, total));
      });
      radicands.forEach((degree, list) -> {
        if (list.size() == 1) {
          addNumerator(numerators, simplifyRoot(list.get(0), degree));
          return;
        }
        if (degree % 2 == 0
            && list.stream().anyMatch(r ->
                r.isRational() && ((Expr.Rational) r).signum() < 0)) {
          // sqrt(-1) * sqrt(-1) is not 1
          list.forEach(r -> numerators.add(expr.root(r, degree)));
          return;
        }
        addNumerator(numerators,
            simplifyRoot(simplify(expr.product(list)), degree));
      });
      numerators.addAll(opaque);
      if (coefficient.signum() == 0) {
        return expr.zero();
      }
      numerators.sort(FACTOR_ORDER);
      denominators.sort(FACTOR_ORDER);

      final BigInteger n = coefficient.numerator();
      final BigInteger d = coefficient.denominator();
      if (!denominators.isEmpty()) {
        return expr.div(withCoefficient(n, numerators),
            withCoefficient(d, denominators));
      }
      if (numerators.isEmpty()) {
        return coefficient;
      }
      if (numerators.size() == 1
          && numerators.get(0) instanceof Expr.Sum
          && !coefficient.isOne()) {
        // Distribute a numeric coefficient over a sum: 2(x + 1) = 2x + 2
        final List<Expr.Exp> terms = new ArrayList<>();
        for (Expr.Exp term : ((Expr.Sum) numerators.get(0)).terms) {
          addTerm(terms,
              multiplyAll(ImmutableList.of(coefficient, term),
                  ImmutableList.of()));
        }
        return collect(terms);
      }
      if (d.equals(BigInteger.ONE)) {
        return withCoefficient(n, numerators);
      }
      return expr.div(withCoefficient(n, numerators), expr.intLiteral(d));
    }

    private static Expr.Exp withCoefficient(BigInteger c,
        List<Expr.Exp> factors) {
      if (factors.isEmpty()) {
        return expr.intLiteral(c);
      }
      if (c.equals(BigInteger.ONE)) {
        return factors.size() == 1 ? factors.get(0) : expr.product(factors);
      }
      return expr.product(
          ImmutableList.<Expr.Exp>builder().add(expr.intLiteral(c))
              .addAll(factors).build());
    }
  }

  // Powers and roots

  /** Simplifies "base ^ exponent", given canonical arguments. */
  static Expr.Exp simplifyPower(Expr.Exp base, Expr.Exp exponent) {
    if (exponent.isZero()) {
      return expr.one();
    }
    if (exponent.isOne()) {
      return base;
    }
    if (base.isZero()) {
      // 0 ^ -1 is left alone; its value is infinite
      return exponent.isRational()
          && ((Expr.Rational) exponent).signum() > 0
          ? base
          : expr.power(base, exponent);
    }
    if (base.isOne()) {
      return base;
    }
    if (exponent instanceof Expr.Int) {
      return simplifyIntPower(base, (Expr.Int) exponent);
    }
    if (exponent instanceof Expr.Frac) {
      // a ^ (m/n) = root(a ^ m, n)
      final Expr.Frac f = (Expr.Frac) exponent;
      if (f.denominator.bitLength() < 31
          && f.numerator.abs()
              .compareTo(BigInteger.valueOf(MAX_EXACT_EXPONENT)) <= 0) {
        final Expr.Exp p =
            simplifyPower(base, expr.intLiteral(f.numerator.abs()));
        final Expr.Exp root = simplifyRoot(p, f.denominator.intValue());
        return f.numerator.signum() > 0
            ? root
            : multiplyAll(ImmutableList.of(), ImmutableList.of(root));
      }
    }
    return expr.power(base, exponent);
  }

  private static Expr.Exp simplifyIntPower(Expr.Exp base, Expr.Int exponent) {
    final BigInteger k = exponent.value;
    if (base.isRational()) {
      if (k.abs().compareTo(BigInteger.valueOf(MAX_EXACT_EXPONENT)) > 0) {
        return expr.power(base, exponent);
      }
      final Expr.Rational r = (Expr.Rational) base;
      final int e = k.abs().intValueExact();
      final Expr.Rational p =
          expr.rational(r.numerator().pow(e), r.denominator().pow(e));
      return k.signum() > 0 ? p : expr.one().divide(p);
    }
    switch (base.op) {
    case CONSTANT:
      if (((Expr.Constant) base).tag == ConstantTag.I) {
        // i^2 = -1
        switch (k.mod(BigInteger.valueOf(4)).intValue()) {
        case 0:
          return expr.one();
        case 1:
          return base;
        case 2:
          return expr.minusOne();
        default:
          return expr.negate(base);
        }
      }
      break;

    case POWER:
      // (a ^ m) ^ k = a ^ (m * k)
      final Expr.Power power = (Expr.Power) base;
      return simplifyPower(power.base, multiply(power.exponent, exponent));

    case ROOT:
      final Expr.Root root = (Expr.Root) base;
      final BigInteger degree = BigInteger.valueOf(root.degree);
      if (k.mod(degree).signum() == 0) {
        return simplifyPower(root.radicand, expr.intLiteral(k.divide(degree)));
      }
      if (k.signum() > 0) {
        return simplifyRoot(simplifyPower(root.radicand, exponent),
            root.degree);
      }
      break;

    case PRODUCT:
      // (a * b) ^ k = a ^ k * b ^ k
      final List<Expr.Exp> factors = new ArrayList<>();
      for (Expr.Exp factor : ((Expr.Product) base).factors) {
        factors.add(simplifyPower(factor, exponent));
      }
      return multiplyAll(factors, ImmutableList.of());

    case DIV:
      final Expr.Div div = (Expr.Div) base;
      if (!div.denominator.isZero()) {
        return multiplyAll(
            ImmutableList.of(simplifyPower(div.numerator, exponent)),
            ImmutableList.of(simplifyPower(div.denominator, exponent)));
      }
      break;

    default:
      break;
    }
    if (k.signum() < 0) {
      // x ^ -2 = 1 / x ^ 2
      return multiplyAll(ImmutableList.of(),
          ImmutableList.of(simplifyPower(base, expr.intLiteral(k.negate()))));
    }
    return expr.power(base, exponent);
  }

  /** Simplifies a root, given a canonical radicand. */
  static Expr.Exp simplifyRoot(Expr.Exp radicand, int degree) {
    if (radicand.isZero() || radicand.isOne()) {
      return radicand;
    }
    switch (radicand.op) {
    case INTEGER:
      final BigInteger v = ((Expr.Int) radicand).value;
      if (v.signum() < 0) {
        if (degree % 2 == 1) {
          // cbrt(-8) = -2
          return negate(simplifyRoot(expr.intLiteral(v.negate()), degree));
        }
        return expr.root(radicand, degree);
      }
      final BigInteger[] parts = extractPower(v, degree);
      if (parts[1].equals(BigInteger.ONE)) {
        return expr.intLiteral(parts[0]);
      }
      final Expr.Root root = expr.root(expr.intLiteral(parts[1]), degree);
      return parts[0].equals(BigInteger.ONE)
          ? root
          : expr.product(expr.intLiteral(parts[0]), root);

    case FRACTION:
      final Expr.Frac frac = (Expr.Frac) radicand;
      if (frac.numerator.signum() < 0 && degree % 2 == 0) {
        return expr.root(radicand, degree);
      }
      // root(a/b, n) = root(a * b^(n-1), n) / b
      final BigInteger r =
          frac.numerator.multiply(frac.denominator.pow(degree - 1));
      return multiplyAll(
          ImmutableList.of(simplifyRoot(expr.intLiteral(r), degree)),
          ImmutableList.of(expr.intLiteral(frac.denominator)));

    case PRODUCT:
      final List<Expr.Exp> factors = ((Expr.Product) radicand).factors;
      if (factors.get(0) instanceof Expr.Int
          && ((Expr.Int) factors.get(0)).value.signum() > 0) {
        final BigInteger[] parts2 =
            extractPower(((Expr.Int) factors.get(0)).value, degree);
        if (!parts2[0].equals(BigInteger.ONE)) {
          // sqrt(8x) = 2 sqrt(2x)
          final List<Expr.Exp> inner = new ArrayList<>();
          inner.add(expr.intLiteral(parts2[1]));
          inner.addAll(factors.subList(1, factors.size()));
          return multiplyAll(
              ImmutableList.of(expr.intLiteral(parts2[0]),
                  expr.root(multiplyAll(inner, ImmutableList.of()), degree)),
              ImmutableList.of());
        }
      }
      return expr.root(radicand, degree);

    default:
      return expr.root(radicand, degree);
    }
  }

  /** Splits a non-negative integer v into {@code [a, b]} such that
   * {@code v = a^degree * b} and b has no factor that is a perfect power of
   * the given degree, except a product of two or more distinct primes
   * above the trial division limit. */
  private static BigInteger[] extractPower(BigInteger v, int degree) {
    BigInteger outside = BigInteger.ONE;
    BigInteger inside = BigInteger.ONE;
    BigInteger rest = v;
    for (long p = 2; p <= MAX_TRIAL_DIVISOR; p = p == 2 ? 3 : p + 2) {
      final BigInteger bp = BigInteger.valueOf(p);
      if (bp.pow(degree).compareTo(rest) > 0) {
        break;
      }
      int count = 0;
      while (rest.mod(bp).signum() == 0) {
        rest = rest.divide(bp);
        ++count;
      }
      outside = outside.multiply(bp.pow(count / degree));
      inside = inside.multiply(bp.pow(count % degree));
    }
    // What remains has no small prime factors, but may be a power of a
    // large prime, as in 100003^2
    final BigInteger root = nthRoot(rest, degree);
    if (root.compareTo(BigInteger.ONE) > 0 && root.pow(degree).equals(rest)) {
      outside = outside.multiply(root);
      rest = BigInteger.ONE;
    }
    return new BigInteger[] {outside, inside.multiply(rest)};
  }

  /** Returns the largest integer r such that {@code r^degree <= v}, for
   * non-negative v. */
  static BigInteger nthRoot(BigInteger v, int degree) {
    if (degree == 2) {
      return BigIntegerMath.sqrt(v, RoundingMode.FLOOR);
    }
    BigInteger lo = BigInteger.ZERO;
    BigInteger hi = BigInteger.ONE.shiftLeft(v.bitLength() / degree + 1);
    while (lo.compareTo(hi) < 0) {
      // Invariant: lo^degree <= v < (hi + 1)^degree
      final BigInteger mid = lo.add(hi).add(BigInteger.ONE).shiftRight(1);
      if (mid.pow(degree).compareTo(v) <= 0) {
        lo = mid;
      } else {
        hi = mid.subtract(BigInteger.ONE);
      }
    }
    return lo;
  }

  // Functions

  private static Expr.Exp simplifyLog(Expr.Exp base, Expr.Exp argument) {
    if (argument.isOne()) {
      return expr.zero();
    }
    if (argument.equals(base)) {
      return expr.one();
    }
    if (argument instanceof Expr.Power
        && ((Expr.Power) argument).base.equals(base)) {
      // log_a(a ^ n) = n
      return ((Expr.Power) argument).exponent;
    }
    if (base instanceof Expr.Int
        && ((Expr.Int) base).value.compareTo(BigInteger.ONE) > 0
        && argument.isRational()
        && ((Expr.Rational) argument).signum() > 0) {
      final BigInteger b = ((Expr.Int) base).value;
      final Expr.Rational a = (Expr.Rational) argument;
      if (a.denominator().equals(BigInteger.ONE)) {
        final int k = exactLog(b, a.numerator());
        if (k >= 0) {
          return expr.intLiteral(k);
        }
      } else if (a.numerator().equals(BigInteger.ONE)) {
        final int k = exactLog(b, a.denominator());
        if (k >= 0) {
          return expr.intLiteral(-k);
        }
      }
    }
    return expr.log(base, argument);
  }

  /** Returns k such that b^k = a, or -1. */
  private static int exactLog(BigInteger b, BigInteger a) {
    BigInteger p = BigInteger.ONE;
    int k = 0;
    while (p.compareTo(a) < 0) {
      p = p.multiply(b);
      ++k;
    }
    return p.equals(a) ? k : -1;
  }

  private static Expr.Exp simplifyTrig(TrigFunction function,
      Expr.Exp argument) {
    if (argument.isZero()) {
      switch (function) {
      case COS:
      case COSH:
        return expr.one();
      case ACOS:
        return piOver(2);
      case ACOSH:
        return expr.trig(function, argument);
      default:
        return expr.zero();
      }
    }
    if (argument.isRational() && ((Expr.Rational) argument).abs().isOne()) {
      final boolean positive = ((Expr.Rational) argument).signum() > 0;
      switch (function) {
      case ASIN:
        return positive ? piOver(2) : negate(piOver(2));
      case ACOS:
        return positive ? expr.zero() : expr.constant(ConstantTag.PI);
      case ATAN:
        return positive ? piOver(4) : negate(piOver(4));
      default:
        break;
      }
    }
    final Expr.@Nullable Rational k = piMultiple(argument);
    if (k != null) {
      final int t = twelfths(k);
      final Expr.@Nullable Exp sin = sinTwelfths(t);
      final Expr.@Nullable Exp cos = sinTwelfths(t < 0 ? t : (t + 6) % 24);
      switch (function) {
      case SIN:
        if (sin != null) {
          return sin;
        }
        break;
      case COS:
        if (cos != null) {
          return cos;
        }
        break;
      case TAN:
        if (sin != null && cos != null && !cos.isZero()) {
          return divide(sin, cos);
        }
        break;
      default:
        break;
      }
    }
    return expr.trig(function, argument);
  }

  private static Expr.Exp piOver(int n) {
    return multiplyAll(ImmutableList.of(expr.constant(ConstantTag.PI)),
        ImmutableList.of(expr.intLiteral(n)));
  }

  /** If an expression is a rational multiple of π, returns the multiple;
   * otherwise null. */
  private static Expr.@Nullable Rational piMultiple(Expr.Exp e) {
    switch (e.op) {
    case CONSTANT:
      return ((Expr.Constant) e).tag == ConstantTag.PI ? expr.one() : null;
    case PRODUCT:
      final List<Expr.Exp> factors = ((Expr.Product) e).factors;
      if (factors.size() == 2 && factors.get(0).isRational()) {
        final Expr.@Nullable Rational k = piMultiple(factors.get(1));
        return k == null ? null : k.times((Expr.Rational) factors.get(0));
      }
      return null;
    case DIV:
      final Expr.Div div = (Expr.Div) e;
      if (div.denominator.isRational() && !div.denominator.isZero()) {
        final Expr.@Nullable Rational k = piMultiple(div.numerator);
        return k == null ? null : k.divide((Expr.Rational) div.denominator);
      }
      return null;
    default:
      return null;
    }
  }

  /** Converts a multiple of π to a number of twelfths of π in the range
   * [0, 24), or returns -1 if it is not a whole number of twelfths. */
  private static int twelfths(Expr.Rational k) {
    final Expr.Rational t = k.times(expr.intLiteral(12));
    if (!(t instanceof Expr.Int)) {
      return -1;
    }
    return ((Expr.Int) t).value.mod(BigInteger.valueOf(24)).intValue();
  }

  /** Returns the exact sine of {@code t * π / 12}, or null. */
  private static Expr.@Nullable Exp sinTwelfths(int t) {
    switch (t) {
    case 0:
    case 12:
      return expr.zero();
    case 6:
      return expr.one();
    case 18:
      return expr.minusOne();
    case 2:
    case 10:
      return expr.rational(1, 2);
    case 14:
    case 22:
      return expr.rational(-1, 2);
    case 3:
    case 9:
      return halfRoot(1, 2);
    case 15:
    case 21:
      return halfRoot(-1, 2);
    case 4:
    case 8:
      return halfRoot(1, 3);
    case 16:
    case 20:
      return halfRoot(-1, 3);
    default:
      return null;
    }
  }

  /** Returns "sign * sqrt(r) / 2". */
  private static Expr.Exp halfRoot(int sign, int r) {
    return multiplyAll(
        ImmutableList.of(expr.intLiteral(sign),
            expr.sqrt(expr.intLiteral(r))),
        ImmutableList.of(expr.intLiteral(2)));
  }

  private static Expr.Exp simplifyAbs(Expr.Exp argument) {
    if (argument.isRational()) {
      return ((Expr.Rational) argument).abs();
    }
    switch (argument.op) {
    case ABS:
    case ROOT:
      return argument;
    case CONSTANT:
      return ((Expr.Constant) argument).tag == ConstantTag.I
          ? expr.abs(argument)
          : argument;
    case PRODUCT:
    case DIV:
      if (coefficient(argument).signum() < 0) {
        // |-x| = |x|
        return simplifyAbs(negate(argument));
      }
      return expr.abs(argument);
    default:
      return expr.abs(argument);
    }
  }

  private static Expr.Exp arrangements(boolean choose, Expr.Exp n,
      Expr.Exp r) {
    if (n instanceof Expr.Int && r instanceof Expr.Int
        && ((Expr.Int) n).isSmall() && ((Expr.Int) r).isSmall()) {
      final int nn = ((Expr.Int) n).value.intValue();
      final int rr = ((Expr.Int) r).value.intValue();
      if (nn >= 0 && rr > nn) {
        return expr.zero();
      }
      // C(n, r) = C(n, n - r), so choosing needs only min(r, n - r) steps
      final int steps = choose ? Math.min(rr, nn - rr) : rr;
      if (nn >= 0 && rr >= 0 && steps <= MAX_ARRANGEMENT) {
        BigInteger v = BigInteger.ONE;
        BigInteger f = BigInteger.ONE;
        for (int i = 0; i < steps; i++) {
          v = v.multiply(BigInteger.valueOf(nn - i));
          f = f.multiply(BigInteger.valueOf(i + 1));
        }
        return expr.intLiteral(choose ? v.divide(f) : v);
      }
    }
    return choose ? expr.comb(n, r) : expr.perm(n, r);
  }
}

// End Simplifier.java
