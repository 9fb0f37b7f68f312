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

import static net.hydromatic.cas.Matchers.isExp;
import static net.hydromatic.cas.ast.ExprBuilder.expr;
import static net.hydromatic.cas.ast.NodeBuilder.node;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.cas.ast.Expr;
import net.hydromatic.cas.ast.MathNode;
import net.hydromatic.cas.util.EvalException;
import org.junit.jupiter.api.Test;

/** Tests for {@link NodeConverter}. */
public class NodeConverterTest {
  private static Expr.Exp convert(List<? extends MathNode> nodes) {
    return NodeConverter.create(ImmutableMap.of(), 100, 1_000)
        .convert(nodes);
  }

  private static Expr.Exp convert(String text) {
    return convert(node.literals(text));
  }

  @Test void testNumbers() {
    assertThat(convert("12"), isExp("12"));
    assertThat(convert("0.5"), is(expr.rational(1, 2)));
    assertThat(convert(".25"), is(expr.rational(1, 4)));
    assertThat(convert("1.5E3"), isExp("1500"));
    assertThat(convert("2e3"), isExp("2000"));
    // "e" not followed by digits is Euler's number
    assertThat(convert("2e"), isExp("2e"));
  }

  @Test void testOperators() {
    assertThat(convert("1+2*3"), isExp("7"));
    assertThat(convert("(1+2)*3"), isExp("9"));
    assertThat(convert("2^3^2"), isExp("512"));
    assertThat(convert("-2^2"), isExp("-4"));
    assertThat(convert("7/2"), is(expr.rational(7, 2)));
    assertThat(convert("6÷4"), is(expr.rational(3, 2)));
    assertThat(convert("2·3"), isExp("6"));
  }

  @Test void testImplicitMultiplication() {
    assertThat(convert("2x"), isExp("2x"));
    assertThat(convert("xy"), isExp("x*y"));
    assertThat(convert("2(x+1)"), isExp("2x + 2"));
    assertThat(convert("2pi"), isExp("2π"));
    assertThat(
        convert(
            ImmutableList.of(node.literal("3"),
                node.fraction(node.literals("1"), node.literals("2")))),
        is(expr.rational(3, 2)));
  }

  @Test void testAdjacentLiterals() {
    assertThat(
        convert(ImmutableList.of(node.literal("1"), node.literal("2"))),
        isExp("12"));
  }

  @Test void testStructuredNodes() {
    assertThat(convert(node.list(node.trig("sin", node.literals("30°")))),
        is(expr.rational(1, 2)));
    assertThat(
        convert(
            node.list(node.log(ImmutableList.of(), node.literals("100")))),
        isExp("2"));
    assertThat(
        convert(node.list(node.root(node.literals("3"), node.literals("27")))),
        isExp("3"));
    assertThat(convert(node.list(node.sqrt(node.literals("8")))),
        isExp("2√2"));
    assertThat(
        convert(
            node.list(
                node.exponent(node.literals("x"), node.literals("2")),
                node.literal("+x"))),
        isExp("x^2 + x"));
    assertThat(
        convert(
            node.list(
                node.combination(node.literals("5"), node.literals("2")))),
        isExp("10"));
    assertThat(
        convert(
            node.list(
                node.permutation(node.literals("5"), node.literals("2")))),
        isExp("20"));
  }

  @Test void testCalculus() {
    assertThat(convert(node.list(node.derivative("x", node.literals("x^2")))),
        isExp("2x"));
    assertThat(
        convert(
            node.list(
                node.derivative(node.literals("x"), node.literals("2"),
                    node.literals("x^3")))),
        isExp("12"));
    assertThat(convert(node.list(node.integral("x", node.literals("x")))),
        isExp("x^2/2 + c0"));
    assertThat(
        convert(
            node.list(
                node.integral(node.literals("x"), node.literals("0"),
                    node.literals("1"), node.literals("x")))),
        is(expr.rational(1, 2)));
  }

  /** Two integrals in one expression get different constants. */
  @Test void testIntegrationConstants() {
    final Expr.Exp e =
        convert(
            node.list(node.integral("x", node.literals("1")),
                node.literal("+"),
                node.integral("y", node.literals("1"))));
    assertThat(e.toString(), containsString("c0"));
    assertThat(e.toString(), containsString("c1"));
  }

  @Test void testSummation() {
    assertThat(
        convert(
            node.list(
                node.summation(node.literals("i"), node.literals("1"),
                    node.literals("4"), node.literals("i")))),
        isExp("10"));
    assertThat(
        convert(
            node.list(
                node.product(node.literals("k"), node.literals("1"),
                    node.literals("5"), node.literals("k")))),
        isExp("120"));
    // inner loop variable shadows the outer one
    final MathNode inner =
        node.summation(node.literals("i"), node.literals("1"),
            node.literals("3"), node.literals("i"));
    assertThat(
        convert(
            node.list(
                node.summation(node.literals("i"), node.literals("1"),
                    node.literals("2"), node.list(inner)))),
        isExp("12"));
  }

  @Test void testAnswers() {
    final NodeConverter converter =
        NodeConverter.create(ImmutableMap.of(0, expr.intLiteral(3)), 100,
            1_000);
    assertThat(converter.convert(node.literals("ans0*4")), isExp("12"));
    assertThat(converter.convert(node.list(node.ans(0))), isExp("3"));
    assertThat(converter.convert(node.literals("ans5")), isExp("ans5"));
  }

  @Test void testInvalid() {
    assertThrows(ParseException.class, () -> convert("2+*3"));
    assertThrows(ParseException.class, () -> convert("x=1"));
    assertThrows(ParseException.class, () -> convert("(1+2"));
    assertThrows(ParseException.class, () -> convert("2$"));
    assertThrows(ParseException.class,
        () -> convert(node.list(node.trig("foo", node.literals("1")))));
  }

  @Test void testTooDeep() {
    List<MathNode> nodes = node.literals("1");
    for (int i = 0; i < 5; i++) {
      nodes = node.list(node.parenthesis(nodes));
    }
    final List<MathNode> deep = nodes;
    final NodeConverter converter =
        NodeConverter.create(ImmutableMap.of(), 3, 1_000);
    final EvalException e =
        assertThrows(EvalException.class, () -> converter.convert(deep));
    assertThat(e.getMessage(), is("expression is nested too deeply"));
    assertThat(NodeConverter.create(ImmutableMap.of(), 10, 1_000)
        .convert(deep), isExp("1"));
  }
}

// End NodeConverterTest.java
