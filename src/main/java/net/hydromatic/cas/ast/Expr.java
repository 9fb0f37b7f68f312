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
import static java.util.Objects.requireNonNull;
import static net.hydromatic.cas.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.List;
import java.util.Objects;

/**
 * Exact expressions.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short. The set of sub-classes of {@link Exp} is closed; every traversal
 * ({@link Shuttle}, {@link Visitor}) has one method per sub-class.
 *
 * <p>Expressions are immutable. Constructors do not simplify; use {@link
 * ExprBuilder} to create expressions and {@code Simplifier.simplify} to
 * convert them to canonical form.
 */
public class Expr {
  private Expr() {}

  /** Base class for all expressions. */
  public abstract static class Exp {
    public final Op op;

    Exp(Op op) {
      this.op = requireNonNull(op);
      checkArgument(!op.isNode());
    }

    /** Accepts a shuttle, and returns the expression it creates. */
    public abstract Exp accept(Shuttle shuttle);

    /** Accepts a visitor. */
    public abstract void accept(Visitor visitor);

    /**
     * Converts this expression to a string.
     *
     * @param w Writer
     * @param left Precedence of the operator to the left of this expression
     * @param right Precedence of the operator to the right
     */
    abstract ExprWriter unparse(ExprWriter w, int left, int right);

    /**
     * Returns an approximate value of this expression.
     *
     * <p>Division by zero gives an infinite value, {@code 0/0} gives NaN, and
     * so does an expression that contains a free variable.
     */
    public abstract double toDouble();

    @Override public String toString() {
      return unparse(new ExprWriter(), 0, 0).toString();
    }

    /** Returns whether this is an {@link Int} or {@link Frac}. */
    public boolean isRational() {
      return false;
    }

    /** Returns whether this is the integer 0. */
    public boolean isZero() {
      return false;
    }

    /** Returns whether this is the integer 1. */
    public boolean isOne() {
      return false;
    }
  }

  /** Exact rational number; either {@link Int} or {@link Frac}. */
  public abstract static class Rational extends Exp
      implements Comparable<Rational> {
    Rational(Op op) {
      super(op);
    }

    public abstract BigInteger numerator();

    /** Returns the denominator; always positive. */
    public abstract BigInteger denominator();

    @Override public boolean isRational() {
      return true;
    }

    public int signum() {
      return numerator().signum();
    }

    public Rational plus(Rational o) {
      return expr.rational(
          numerator().multiply(o.denominator())
              .add(o.numerator().multiply(denominator())),
          denominator().multiply(o.denominator()));
    }

    public Rational minus(Rational o) {
      return plus(o.negate());
    }

    public Rational times(Rational o) {
      return expr.rational(numerator().multiply(o.numerator()),
          denominator().multiply(o.denominator()));
    }

    /** Divides this by another rational. Throws if it is zero. */
    public Rational divide(Rational o) {
      checkArgument(o.signum() != 0, "division by zero");
      return expr.rational(numerator().multiply(o.denominator()),
          denominator().multiply(o.numerator()));
    }

    public Rational negate() {
      return expr.rational(numerator().negate(), denominator());
    }

    public Rational abs() {
      return signum() < 0 ? negate() : this;
    }

    @Override public int compareTo(Rational o) {
      return numerator().multiply(o.denominator())
          .compareTo(o.numerator().multiply(denominator()));
    }

    @Override public double toDouble() {
      if (denominator().equals(BigInteger.ONE)) {
        return numerator().doubleValue();
      }
      return new BigDecimal(numerator())
          .divide(new BigDecimal(denominator()), MathContext.DECIMAL64)
          .doubleValue();
    }
  }

  /** Integer literal. */
  public static class Int extends Rational {
    public final BigInteger value;

    Int(BigInteger value) {
      super(Op.INTEGER);
      this.value = requireNonNull(value);
    }

    @Override public BigInteger numerator() {
      return value;
    }

    @Override public BigInteger denominator() {
      return BigInteger.ONE;
    }

    @Override public boolean isZero() {
      return value.signum() == 0;
    }

    @Override public boolean isOne() {
      return value.equals(BigInteger.ONE);
    }

    /** Returns whether the value fits in a Java {@code int}. */
    public boolean isSmall() {
      return value.bitLength() < 32;
    }

    @Override public int hashCode() {
      return value.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Int
          && value.equals(((Int) o).value);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      if (value.signum() < 0) {
        return w.prefix(left, Op.NEGATE, expr.intLiteral(value.negate()),
            right);
      }
      return w.append(value.toString());
    }

    @Override public double toDouble() {
      return value.doubleValue();
    }
  }

  /** Fraction literal.
   *
   * <p>Always reduced: the numerator and denominator have no common factor,
   * and the denominator is greater than 1. Use {@link ExprBuilder#rational}
   * to create one. */
  public static class Frac extends Rational {
    public final BigInteger numerator;
    public final BigInteger denominator;

    Frac(BigInteger numerator, BigInteger denominator) {
      super(Op.FRACTION);
      this.numerator = requireNonNull(numerator);
      this.denominator = requireNonNull(denominator);
      checkArgument(denominator.compareTo(BigInteger.ONE) > 0,
          "denominator must be greater than 1");
      checkArgument(numerator.gcd(denominator).equals(BigInteger.ONE),
          "fraction must be reduced");
    }

    @Override public BigInteger numerator() {
      return numerator;
    }

    @Override public BigInteger denominator() {
      return denominator;
    }

    @Override public int hashCode() {
      return Objects.hash(numerator, denominator);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Frac
          && numerator.equals(((Frac) o).numerator)
          && denominator.equals(((Frac) o).denominator);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      if (numerator.signum() < 0) {
        return w.prefix(left, Op.NEGATE, negate(), right);
      }
      return w.fraction(left, numerator, denominator, right);
    }
  }

  /** Symbolic constant, such as π. */
  public static class Constant extends Exp {
    public final ConstantTag tag;

    Constant(ConstantTag tag) {
      super(Op.CONSTANT);
      this.tag = requireNonNull(tag);
    }

    @Override public int hashCode() {
      return tag.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Constant
          && tag == ((Constant) o).tag;
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.append(tag.symbol);
    }

    @Override public double toDouble() {
      return tag.value;
    }
  }

  /** Named variable, such as "x", "ans3" or "c0". */
  public static class Variable extends Exp {
    public final String name;

    Variable(String name) {
      super(Op.VARIABLE);
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty());
    }

    @Override public int hashCode() {
      return name.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Variable
          && name.equals(((Variable) o).name);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.append(name);
    }

    @Override public double toDouble() {
      return Double.NaN;
    }
  }

  /** Sum of terms. */
  public static class Sum extends Exp {
    public final ImmutableList<Exp> terms;

    Sum(ImmutableList<Exp> terms) {
      super(Op.SUM);
      this.terms = requireNonNull(terms);
    }

    @Override public int hashCode() {
      return terms.hashCode() * 31 + 1;
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Sum
          && terms.equals(((Sum) o).terms);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      if (terms.isEmpty()) {
        return w.append("0");
      }
      return w.sum(left, terms, right);
    }

    @Override public double toDouble() {
      double d = 0d;
      for (Exp term : terms) {
        d += term.toDouble();
      }
      return d;
    }

    /** Creates a copy of this Sum with given terms, or this Sum if the terms
     * are the same. */
    public Sum copy(List<Exp> terms) {
      return terms.equals(this.terms) ? this : expr.sum(terms);
    }
  }

  /** Product of factors. */
  public static class Product extends Exp {
    public final ImmutableList<Exp> factors;

    Product(ImmutableList<Exp> factors) {
      super(Op.PRODUCT);
      this.factors = requireNonNull(factors);
    }

    @Override public int hashCode() {
      return factors.hashCode() * 31 + 2;
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Product
          && factors.equals(((Product) o).factors);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      if (factors.isEmpty()) {
        return w.append("1");
      }
      return w.product(left, factors, right);
    }

    @Override public double toDouble() {
      double d = 1d;
      for (Exp factor : factors) {
        d *= factor.toDouble();
      }
      return d;
    }

    public Product copy(List<Exp> factors) {
      return factors.equals(this.factors) ? this : expr.product(factors);
    }
  }

  /** Power, "base ^ exponent". */
  public static class Power extends Exp {
    public final Exp base;
    public final Exp exponent;

    Power(Exp base, Exp exponent) {
      super(Op.POWER);
      this.base = requireNonNull(base);
      this.exponent = requireNonNull(exponent);
    }

    @Override public int hashCode() {
      return Objects.hash(op, base, exponent);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Power
          && base.equals(((Power) o).base)
          && exponent.equals(((Power) o).exponent);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.infix(left, base, op, exponent, right);
    }

    @Override public double toDouble() {
      return Math.pow(base.toDouble(), exponent.toDouble());
    }

    public Power copy(Exp base, Exp exponent) {
      return base == this.base && exponent == this.exponent
          ? this
          : expr.power(base, exponent);
    }
  }

  /** Root of given degree; degree 2 is the square root. */
  public static class Root extends Exp {
    public final Exp radicand;
    public final int degree;

    Root(Exp radicand, int degree) {
      super(Op.ROOT);
      this.radicand = requireNonNull(radicand);
      this.degree = degree;
      checkArgument(degree >= 2, "degree must be at least 2: %s", degree);
    }

    @Override public int hashCode() {
      return Objects.hash(op, radicand, degree);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Root
          && radicand.equals(((Root) o).radicand)
          && degree == ((Root) o).degree;
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      if (degree == 2) {
        return w.prefix(left, op, radicand, right);
      }
      return w.append("root(").append(radicand, 0, 0)
          .append(", " + degree + ")");
    }

    @Override public double toDouble() {
      final double r = radicand.toDouble();
      if (degree == 2) {
        return Math.sqrt(r);
      }
      if (r < 0d && degree % 2 == 1) {
        return -Math.pow(-r, 1d / degree);
      }
      return Math.pow(r, 1d / degree);
    }

    public Root copy(Exp radicand) {
      return radicand == this.radicand ? this : expr.root(radicand, degree);
    }
  }

  /** Logarithm of an argument to a given base. */
  public static class Log extends Exp {
    public final Exp base;
    public final Exp argument;

    Log(Exp base, Exp argument) {
      super(Op.LOG);
      this.base = requireNonNull(base);
      this.argument = requireNonNull(argument);
    }

    /** Returns whether this is a natural logarithm (base e). */
    public boolean isNatural() {
      return base instanceof Constant && ((Constant) base).tag == ConstantTag.E;
    }

    @Override public int hashCode() {
      return Objects.hash(op, base, argument);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Log
          && base.equals(((Log) o).base)
          && argument.equals(((Log) o).argument);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      if (isNatural()) {
        w.append("ln");
      } else {
        w.append("log_").append(base, op.left, op.right);
      }
      return w.append("(").append(argument, 0, 0).append(")");
    }

    @Override public double toDouble() {
      final double a = Math.log(argument.toDouble());
      return isNatural() ? a : a / Math.log(base.toDouble());
    }

    public Log copy(Exp base, Exp argument) {
      return base == this.base && argument == this.argument
          ? this
          : expr.log(base, argument);
    }
  }

  /** Call to a trigonometric or hyperbolic function. */
  public static class Trig extends Exp {
    public final TrigFunction function;
    public final Exp argument;

    Trig(TrigFunction function, Exp argument) {
      super(Op.TRIG);
      this.function = requireNonNull(function);
      this.argument = requireNonNull(argument);
    }

    @Override public int hashCode() {
      return Objects.hash(op, function, argument);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Trig
          && function == ((Trig) o).function
          && argument.equals(((Trig) o).argument);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.append(function.functionName)
          .append("(").append(argument, 0, 0).append(")");
    }

    @Override public double toDouble() {
      return function.apply(argument.toDouble());
    }

    public Trig copy(Exp argument) {
      return argument == this.argument ? this : expr.trig(function, argument);
    }
  }

  /** Absolute value. */
  public static class Abs extends Exp {
    public final Exp argument;

    Abs(Exp argument) {
      super(Op.ABS);
      this.argument = requireNonNull(argument);
    }

    @Override public int hashCode() {
      return Objects.hash(op, argument);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Abs
          && argument.equals(((Abs) o).argument);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.append("|").append(argument, 0, 0).append("|");
    }

    @Override public double toDouble() {
      return Math.abs(argument.toDouble());
    }

    public Abs copy(Exp argument) {
      return argument == this.argument ? this : expr.abs(argument);
    }
  }

  /** Quotient, "numerator / denominator". */
  public static class Div extends Exp {
    public final Exp numerator;
    public final Exp denominator;

    Div(Exp numerator, Exp denominator) {
      super(Op.DIV);
      this.numerator = requireNonNull(numerator);
      this.denominator = requireNonNull(denominator);
    }

    @Override public int hashCode() {
      return Objects.hash(op, numerator, denominator);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Div
          && numerator.equals(((Div) o).numerator)
          && denominator.equals(((Div) o).denominator);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.infix(left, numerator, op, denominator, right);
    }

    @Override public double toDouble() {
      return numerator.toDouble() / denominator.toDouble();
    }

    public Div copy(Exp numerator, Exp denominator) {
      return numerator == this.numerator && denominator == this.denominator
          ? this
          : expr.div(numerator, denominator);
    }
  }

  /** Number of permutations, "P(n, r)". */
  public static class Perm extends Exp {
    public final Exp n;
    public final Exp r;

    Perm(Exp n, Exp r) {
      super(Op.PERM);
      this.n = requireNonNull(n);
      this.r = requireNonNull(r);
    }

    @Override public int hashCode() {
      return Objects.hash(op, n, r);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Perm
          && n.equals(((Perm) o).n)
          && r.equals(((Perm) o).r);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.call("P", n, r);
    }

    @Override public double toDouble() {
      return arrangements(n.toDouble(), r.toDouble(), false);
    }

    public Perm copy(Exp n, Exp r) {
      return n == this.n && r == this.r ? this : expr.perm(n, r);
    }
  }

  /** Number of combinations, "C(n, r)". */
  public static class Comb extends Exp {
    public final Exp n;
    public final Exp r;

    Comb(Exp n, Exp r) {
      super(Op.COMB);
      this.n = requireNonNull(n);
      this.r = requireNonNull(r);
    }

    @Override public int hashCode() {
      return Objects.hash(op, n, r);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Comb
          && n.equals(((Comb) o).n)
          && r.equals(((Comb) o).r);
    }

    @Override public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.call("C", n, r);
    }

    @Override public double toDouble() {
      return arrangements(n.toDouble(), r.toDouble(), true);
    }

    public Comb copy(Exp n, Exp r) {
      return n == this.n && r == this.r ? this : expr.comb(n, r);
    }
  }

  /** Approximates nPr or nCr. Returns NaN unless n and r are whole numbers
   * with 0 &le; r &le; n. */
  private static double arrangements(double n, double r, boolean choose) {
    if (n != Math.rint(n) || r != Math.rint(r) || r < 0d || r > n) {
      return Double.NaN;
    }
    double d = 1d;
    for (int i = 0; i < r; i++) {
      d *= n - i;
      if (choose) {
        d /= i + 1;
      }
    }
    return d;
  }
}

// End Expr.java
