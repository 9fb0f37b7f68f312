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

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Builds editor nodes. */
public enum NodeBuilder {
  /** The singleton instance of the node builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  node;

  private final Nodes.Newline newline = new Nodes.Newline();

  /** Creates a list of nodes. */
  public ImmutableList<MathNode> list(MathNode... nodes) {
    return ImmutableList.copyOf(nodes);
  }

  public Nodes.Literal literal(String text) {
    return new Nodes.Literal(text);
  }

  /** Creates a list containing one literal; for example,
   * {@code literals("x+5=10")}. */
  public ImmutableList<MathNode> literals(String text) {
    return ImmutableList.of(literal(text));
  }

  public Nodes.Fraction fraction(List<? extends MathNode> numerator,
      List<? extends MathNode> denominator) {
    return new Nodes.Fraction(numerator, denominator);
  }

  public Nodes.Exponent exponent(List<? extends MathNode> base,
      List<? extends MathNode> power) {
    return new Nodes.Exponent(base, power);
  }

  public Nodes.Parenthesis parenthesis(List<? extends MathNode> content) {
    return new Nodes.Parenthesis(content);
  }

  /** Creates a call to a function such as "sin" or "abs". */
  public Nodes.Trig trig(String function, List<? extends MathNode> argument) {
    return new Nodes.Trig(function, argument);
  }

  public Nodes.Root sqrt(List<? extends MathNode> radicand) {
    return new Nodes.Root(literals("2"), radicand, true);
  }

  public Nodes.Root root(List<? extends MathNode> index,
      List<? extends MathNode> radicand) {
    return new Nodes.Root(index, radicand, false);
  }

  public Nodes.Log log(List<? extends MathNode> base,
      List<? extends MathNode> argument) {
    return new Nodes.Log(base, argument, false);
  }

  public Nodes.Log ln(List<? extends MathNode> argument) {
    return new Nodes.Log(ImmutableList.of(), argument, true);
  }

  public Nodes.Arrangement permutation(List<? extends MathNode> n,
      List<? extends MathNode> r) {
    return new Nodes.Arrangement(Op.PERMUTATION_NODE, n, r);
  }

  public Nodes.Arrangement combination(List<? extends MathNode> n,
      List<? extends MathNode> r) {
    return new Nodes.Arrangement(Op.COMBINATION_NODE, n, r);
  }

  /** Creates a symbolic derivative. */
  public Nodes.Derivative derivative(String variable,
      List<? extends MathNode> body) {
    return derivative(literals(variable), ImmutableList.of(), body);
  }

  /** Creates a derivative evaluated at a point, or a symbolic derivative if
   * {@code at} is empty. */
  public Nodes.Derivative derivative(List<? extends MathNode> variable,
      List<? extends MathNode> at, List<? extends MathNode> body) {
    return new Nodes.Derivative(variable, at, body);
  }

  /** Creates an indefinite integral. */
  public Nodes.Bounded integral(String variable,
      List<? extends MathNode> body) {
    return integral(literals(variable), ImmutableList.of(),
        ImmutableList.of(), body);
  }

  /** Creates a definite integral, or an indefinite integral if both bounds
   * are empty. */
  public Nodes.Bounded integral(List<? extends MathNode> variable,
      List<? extends MathNode> lower, List<? extends MathNode> upper,
      List<? extends MathNode> body) {
    return new Nodes.Bounded(Op.INTEGRAL_NODE, variable, lower, upper, body);
  }

  public Nodes.Bounded summation(List<? extends MathNode> variable,
      List<? extends MathNode> lower, List<? extends MathNode> upper,
      List<? extends MathNode> body) {
    return new Nodes.Bounded(Op.SUMMATION_NODE, variable, lower, upper, body);
  }

  public Nodes.Bounded product(List<? extends MathNode> variable,
      List<? extends MathNode> lower, List<? extends MathNode> upper,
      List<? extends MathNode> body) {
    return new Nodes.Bounded(Op.PRODUCT_NODE, variable, lower, upper, body);
  }

  public Nodes.Ans ans(List<? extends MathNode> index) {
    return new Nodes.Ans(index);
  }

  /** Creates a reference to the answer of a given cell. */
  public Nodes.Ans ans(int index) {
    return new Nodes.Ans(literals(Integer.toString(index)));
  }

  public Nodes.Constant constant(String symbol) {
    return new Nodes.Constant(symbol);
  }

  public Nodes.Newline newline() {
    return newline;
  }
}

// End NodeBuilder.java
