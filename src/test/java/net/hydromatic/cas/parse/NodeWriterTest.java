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
package net.hydromatic.cas.parse;

import static net.hydromatic.cas.ast.ExprBuilder.expr;
import static net.hydromatic.cas.ast.NodeBuilder.node;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.List;
import net.hydromatic.cas.ast.ConstantTag;
import net.hydromatic.cas.ast.Expr;
import net.hydromatic.cas.ast.MathNode;
import net.hydromatic.cas.ast.TrigFunction;
import net.hydromatic.cas.eval.Formatter;
import net.hydromatic.cas.eval.NumberFormat;
import org.junit.jupiter.api.Test;

/** Tests for {@link NodeWriter}. */
public class NodeWriterTest {
  private final Expr.Variable x = expr.variable("x");

  private static String write(Expr.Exp exp) {
    return write(exp, NumberFormat.AUTOMATIC);
  }

  private static String write(Expr.Exp exp, NumberFormat format) {
    return MathNode.describe(
        new NodeWriter(new Formatter(format, 10)).write(exp));
  }

  private static Expr.Int i(long v) {
    return expr.intLiteral(v);
  }

  @Test void testNumbers() {
    assertThat(write(i(42)), is("42"));
    assertThat(write(i(-42)), is("-42"));
    assertThat(write(i(1234567)), is("1.234567E6"));
    assertThat(write(i(1234567), NumberFormat.PLAIN), is("1,234,567"));
    assertThat(write(expr.rational(3, 4)), is("frac(3, 4)"));
    assertThat(write(expr.rational(-3, 4)), is("-frac(3, 4)"));
    assertThat(write(expr.constant(ConstantTag.PI)), is("π"));
  }

  /** The number format applies to a number on its own, not to the numbers
   * inside an expression. */
  @Test void testNumberFormats() {
    final Expr.Exp e =
        expr.sum(expr.power(x, i(2)), expr.product(i(3), x));
    assertThat(write(e, NumberFormat.SCIENTIFIC), is("pow(x, 2)+3x"));
    assertThat(write(e, NumberFormat.AUTOMATIC), is("pow(x, 2)+3x"));
    assertThat(write(e, NumberFormat.PLAIN), is("pow(x, 2)+3x"));
    final Expr.Exp big = expr.sum(expr.power(x, i(1234)), i(1));
    assertThat(write(big, NumberFormat.PLAIN), is("pow(x, 1234)+1"));
    assertThat(write(big, NumberFormat.SCIENTIFIC), is("pow(x, 1234)+1"));
    assertThat(write(expr.product(expr.rational(1, 1_000_000), x),
        NumberFormat.PLAIN), is("frac(1, 1000000)x"));

    assertThat(write(i(5), NumberFormat.SCIENTIFIC), is("5"));
    assertThat(write(i(1234), NumberFormat.SCIENTIFIC), is("1.234E3"));
    assertThat(write(i(1234), NumberFormat.PLAIN), is("1,234"));
    assertThat(write(i(1234), NumberFormat.AUTOMATIC), is("1234"));
    assertThat(write(expr.rational(1, 1234), NumberFormat.PLAIN),
        is("frac(1, 1,234)"));
    assertThat(write(expr.rational(1, 1234), NumberFormat.SCIENTIFIC),
        is("frac(1, 1234)"));
  }

  @Test void testSums() {
    assertThat(write(expr.sum(x, i(1))), is("x+1"));
    assertThat(write(expr.sum(x, expr.negate(expr.variable("y")))),
        is("x-y"));
    assertThat(write(expr.sum(x, i(-3))), is("x-3"));
  }

  @Test void testProducts() {
    assertThat(write(expr.product(i(2), x)), is("2x"));
    assertThat(write(expr.product(i(-1), x)), is("-x"));
    assertThat(write(expr.product(i(-2), x)), is("-2x"));
    assertThat(write(expr.product(i(2), expr.sqrt(i(2)))), is("2sqrt(2)"));
    assertThat(write(expr.product(i(2), expr.power(i(3), x))),
        is("2·pow(3, x)"));
    assertThat(
        write(
            expr.product(expr.trig(TrigFunction.SIN, x),
                expr.trig(TrigFunction.COS, x))),
        is("sin(x)·cos(x)"));
    assertThat(write(expr.product(i(2), expr.sum(x, i(1)))),
        is("2(x+1)"));
    assertThat(write(expr.product(expr.variable("c0"), x)), is("c0·x"));
  }

  @Test void testPowersAndFunctions() {
    assertThat(write(expr.power(x, i(2))), is("pow(x, 2)"));
    assertThat(write(expr.power(expr.sum(x, i(1)), i(2))),
        is("pow((x+1), 2)"));
    assertThat(write(expr.power(i(-2), x)), is("pow((-2), x)"));
    assertThat(write(expr.root(x, 3)), is("root(3, x)"));
    assertThat(write(expr.ln(x)), is("ln(x)"));
    assertThat(write(expr.log(i(2), x)), is("log(2, x)"));
    assertThat(write(expr.abs(x)), is("abs(x)"));
    assertThat(write(expr.div(x, i(2))), is("frac(x, 2)"));
    assertThat(write(expr.comb(i(5), x)), is("C(5, x)"));
  }

  @Test void testMerge() {
    final List<MathNode> merged =
        NodeWriter.merge(
            node.list(node.literal("2"), node.literal("x"),
                node.sqrt(node.literals("2")), node.literal("+"),
                node.literal("1")));
    assertThat(merged.size(), is(3));
    assertThat(MathNode.describe(merged), is("2xsqrt(2)+1"));
  }
}

// End NodeWriterTest.java
