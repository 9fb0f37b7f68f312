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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * Editor node types.
 *
 * <p>This class functions as a namespace, in the same way as {@link Expr}.
 * Create nodes via {@link NodeBuilder}.
 */
public class Nodes {
  private Nodes() {}

  /** Text: digits, letters, operators, parentheses, "=", "°", "rad". */
  public static class Literal extends MathNode {
    public final String text;

    Literal(String text) {
      super(Op.LITERAL_NODE);
      this.text = requireNonNull(text);
    }

    @Override public List<List<MathNode>> children() {
      return ImmutableList.of();
    }

    @Override StringBuilder describe(StringBuilder b) {
      return b.append(text);
    }

    @Override public int hashCode() {
      return text.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
          && text.equals(((Literal) o).text);
    }
  }

  /** Fraction with a numerator and denominator, stacked. */
  public static class Fraction extends MathNode {
    public final ImmutableList<MathNode> numerator;
    public final ImmutableList<MathNode> denominator;

    Fraction(List<? extends MathNode> numerator,
        List<? extends MathNode> denominator) {
      super(Op.FRACTION_NODE);
      this.numerator = ImmutableList.copyOf(numerator);
      this.denominator = ImmutableList.copyOf(denominator);
    }

    @Override public List<List<MathNode>> children() {
      return ImmutableList.of(numerator, denominator);
    }

    @Override StringBuilder describe(StringBuilder b) {
      b.append("frac(");
      describe(b, numerator).append(", ");
      return describe(b, denominator).append(")");
    }

    @Override public int hashCode() {
      return Objects.hash(op, numerator, denominator);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Fraction
          && numerator.equals(((Fraction) o).numerator)
          && denominator.equals(((Fraction) o).denominator);
    }
  }

  /** Base raised to a power; the power is written as a superscript. */
  public static class Exponent extends MathNode {
    public final ImmutableList<MathNode> base;
    public final ImmutableList<MathNode> power;

    Exponent(List<? extends MathNode> base, List<? extends MathNode> power) {
      super(Op.EXPONENT_NODE);
      this.base = ImmutableList.copyOf(base);
      this.power = ImmutableList.copyOf(power);
    }

    @Override public List<List<MathNode>> children() {
      return ImmutableList.of(base, power);
    }

    @Override StringBuilder describe(StringBuilder b) {
      b.append("pow(");
      describe(b, base).append(", ");
      return describe(b, power).append(")");
    }

    @Override public int hashCode() {
      return Objects.hash(op, base, power);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Exponent
          && base.equals(((Exponent) o).base)
          && power.equals(((Exponent) o).power);
    }
  }

  /** Parenthesized group. */
  public static class Parenthesis extends MathNode {
    public final ImmutableList<MathNode> content;

    Parenthesis(List<? extends MathNode> content) {
      super(Op.PARENTHESIS_NODE);
      this.content = ImmutableList.copyOf(content);
    }

    @Override public List<List<MathNode>> children() {
      return ImmutableList.of(content);
    }

    @Override StringBuilder describe(StringBuilder b) {
      b.append("(");
      return describe(b, content).append(")");
    }

    @Override public int hashCode() {
      return Objects.hash(op, content);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Parenthesis
          && content.equals(((Parenthesis) o).content);
    }
  }

  /** Call to a named function of one argument: a trigonometric or
   * hyperbolic function, or "abs". */
  public static class Trig extends MathNode {
    public final String function;
    public final ImmutableList<MathNode> argument;

    Trig(String function, List<? extends MathNode> argument) {
      super(Op.TRIG_NODE);
      this.function = requireNonNull(function);
      this.argument = ImmutableList.copyOf(argument);
    }

    @Override public List<List<MathNode>> children() {
      return ImmutableList.of(argument);
    }

    @Override StringBuilder describe(StringBuilder b) {
      b.append(function).append("(");
      return describe(b, argument).append(")");
    }

    @Override public int hashCode() {
      return Objects.hash(op, function, argument);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Trig
          && function.equals(((Trig) o).function)
          && argument.equals(((Trig) o).argument);
    }
  }

  /** Root. A square root has no visible index. */
  public static class Root extends MathNode {
    public final ImmutableList<MathNode> index;
    public final ImmutableList<MathNode> radicand;
    public final boolean squareRoot;

    Root(List<? extends MathNode> index, List<? extends MathNode> radicand,
        boolean squareRoot) {
      super(Op.ROOT_NODE);
      this.index = ImmutableList.copyOf(index);
      this.radicand = ImmutableList.copyOf(radicand);
      this.squareRoot = squareRoot;
    }

    @Override public List<List<MathNode>> children() {
      return ImmutableList.of(index, radicand);
    }

    @Override StringBuilder describe(StringBuilder b) {
      if (squareRoot) {
        b.append("sqrt(");
      } else {
        b.append("root(");
        describe(b, index).append(", ");
      }
      return describe(b, radicand).append(")");
    }

    @Override public int hashCode() {
      return Objects.hash(op, index, radicand, squareRoot);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Root
          && index.equals(((Root) o).index)
          && radicand.equals(((Root) o).radicand)
          && squareRoot == ((Root) o).squareRoot;
    }
  }

  /** Logarithm. A natural logarithm has no visible base; an empty base
   * means base 10. */
  public static class Log extends MathNode {
    public final ImmutableList<MathNode> base;
    public final ImmutableList<MathNode> argument;
    public final boolean natural;

    Log(List<? extends MathNode> base, List<? extends MathNode> argument,
        boolean natural) {
      super(Op.LOG_NODE);
      this.base = ImmutableList.copyOf(base);
      this.argument = ImmutableList.copyOf(argument);
      this.natural = natural;
    }

    @Override public List<List<MathNode>> children() {
      return ImmutableList.of(base, argument);
    }

    @Override StringBuilder describe(StringBuilder b) {
      if (natural) {
        b.append("ln(");
      } else {
        b.append("log(");
        describe(b, base).append(", ");
      }
      return describe(b, argument).append(")");
    }

    @Override public int hashCode() {
      return Objects.hash(op, base, argument, natural);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Log
          && base.equals(((Log) o).base)
          && argument.equals(((Log) o).argument)
          && natural == ((Log) o).natural;
    }
  }

  /** Permutation "nPr" or combination "nCr". */
  public static class Arrangement extends MathNode {
    public final ImmutableList<MathNode> n;
    public final ImmutableList<MathNode> r;

    Arrangement(Op op, List<? extends MathNode> n,
        List<? extends MathNode> r) {
      super(op);
      this.n = ImmutableList.copyOf(n);
      this.r = ImmutableList.copyOf(r);
    }

    @Override public List<List<MathNode>> children() {
      return ImmutableList.of(n, r);
    }

    @Override StringBuilder describe(StringBuilder b) {
      b.append(op == Op.PERMUTATION_NODE ? "P(" : "C(");
      describe(b, n).append(", ");
      return describe(b, r).append(")");
    }

    @Override public int hashCode() {
      return Objects.hash(op, n, r);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Arrangement
          && op == ((Arrangement) o).op
          && n.equals(((Arrangement) o).n)
          && r.equals(((Arrangement) o).r);
    }
  }

  /** Derivative "d/dx body", optionally evaluated at a point. An empty
   * {@code at} list means the derivative is symbolic. */
  public static class Derivative extends MathNode {
    public final ImmutableList<MathNode> variable;
    public final ImmutableList<MathNode> at;
    public final ImmutableList<MathNode> body;

    Derivative(List<? extends MathNode> variable,
        List<? extends MathNode> at, List<? extends MathNode> body) {
      super(Op.DERIVATIVE_NODE);
      this.variable = ImmutableList.copyOf(variable);
      this.at = ImmutableList.copyOf(at);
      this.body = ImmutableList.copyOf(body);
    }

    @Override public List<List<MathNode>> children() {
      return ImmutableList.of(variable, at, body);
    }

    @Override StringBuilder describe(StringBuilder b) {
      b.append("deriv(");
      describe(b, variable).append(", ");
      describe(b, at).append(", ");
      return describe(b, body).append(")");
    }

    @Override public int hashCode() {
      return Objects.hash(op, variable, at, body);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Derivative
          && variable.equals(((Derivative) o).variable)
          && at.equals(((Derivative) o).at)
          && body.equals(((Derivative) o).body);
    }
  }

  /** Node with a bound variable, a lower and upper bound, and a body:
   * an integral, a summation or a product.
   *
   * <p>An integral whose bounds are both empty is indefinite. */
  public static class Bounded extends MathNode {
    public final ImmutableList<MathNode> variable;
    public final ImmutableList<MathNode> lower;
    public final ImmutableList<MathNode> upper;
    public final ImmutableList<MathNode> body;

    Bounded(Op op, List<? extends MathNode> variable,
        List<? extends MathNode> lower, List<? extends MathNode> upper,
        List<? extends MathNode> body) {
      super(op);
      this.variable = ImmutableList.copyOf(variable);
      this.lower = ImmutableList.copyOf(lower);
      this.upper = ImmutableList.copyOf(upper);
      this.body = ImmutableList.copyOf(body);
    }

    @Override public List<List<MathNode>> children() {
      return ImmutableList.of(variable, lower, upper, body);
    }

    @Override StringBuilder describe(StringBuilder b) {
      switch (op) {
      case INTEGRAL_NODE:
        b.append("int(");
        break;
      case SUMMATION_NODE:
        b.append("sum(");
        break;
      default:
        b.append("prod(");
        break;
      }
      describe(b, variable).append(", ");
      describe(b, lower).append(", ");
      describe(b, upper).append(", ");
      return describe(b, body).append(")");
    }

    @Override public int hashCode() {
      return Objects.hash(op, variable, lower, upper, body);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Bounded
          && op == ((Bounded) o).op
          && variable.equals(((Bounded) o).variable)
          && lower.equals(((Bounded) o).lower)
          && upper.equals(((Bounded) o).upper)
          && body.equals(((Bounded) o).body);
    }
  }

  /** Reference to a previous answer, by cell index. */
  public static class Ans extends MathNode {
    public final ImmutableList<MathNode> index;

    Ans(List<? extends MathNode> index) {
      super(Op.ANS_NODE);
      this.index = ImmutableList.copyOf(index);
    }

    @Override public List<List<MathNode>> children() {
      return ImmutableList.of(index);
    }

    @Override StringBuilder describe(StringBuilder b) {
      b.append("ans(");
      return describe(b, index).append(")");
    }

    @Override public int hashCode() {
      return Objects.hash(op, index);
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Ans
          && index.equals(((Ans) o).index);
    }
  }

  /** Named constant, such as "π" or "ε₀", treated as one unit. */
  public static class Constant extends MathNode {
    public final String symbol;

    Constant(String symbol) {
      super(Op.CONSTANT_NODE);
      this.symbol = requireNonNull(symbol);
    }

    @Override public List<List<MathNode>> children() {
      return ImmutableList.of();
    }

    @Override StringBuilder describe(StringBuilder b) {
      return b.append(symbol);
    }

    @Override public int hashCode() {
      return symbol.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Constant
          && symbol.equals(((Constant) o).symbol);
    }
  }

  /** Separates lines, such as the equations of a system. */
  public static class Newline extends MathNode {
    Newline() {
      super(Op.NEWLINE_NODE);
    }

    @Override public List<List<MathNode>> children() {
      return ImmutableList.of();
    }

    @Override StringBuilder describe(StringBuilder b) {
      return b.append("\n");
    }

    @Override public int hashCode() {
      return op.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this || o instanceof Newline;
    }
  }
}

// End Nodes.java
