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
package net.hydromatic.cas.eval;

import static net.hydromatic.cas.Calc.calc;
import static net.hydromatic.cas.ast.ExprBuilder.expr;
import static net.hydromatic.cas.ast.NodeBuilder.node;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.math.BigInteger;
import java.util.List;
import net.hydromatic.cas.ast.Expr;
import net.hydromatic.cas.ast.MathNode;
import net.hydromatic.cas.solve.Solution;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests for {@link Engine}. */
public class EngineTest {
  @Test void testArithmetic() {
    calc("1+2").assertText("3").assertExp("3").assertDecimal("3");
    calc("1/3").assertExp("1/3").assertDecimal("0.3333333333");
    calc("2^10").assertText("1024");
    calc("0.1+0.2").assertExp("3/10").assertDecimal("0.3");
    calc("2x+3x").assertText("5x");
  }

  @Test void testEmpty() {
    calc("").assertEmpty();
    calc("  ").assertEmpty();
    calc("2+").assertEmpty();
    calc("(1+2").assertEmpty();
    calc("2$").assertEmpty();
    calc(ImmutableList.<MathNode>of()).assertEmpty();
  }

  @Test void testDivisionByZero() {
    calc("1/0").assertText("∞").assertDecimal("∞");
  }

  /** Exact values too large for a double are still shown exactly. */
  @Test void testLargeValues() {
    calc("10^400").assertText("1E400").assertDecimal("1E400");
    final ExactResult result = calc("10^400").evaluate();
    assertThat(result.exp instanceof Expr.Int, is(true));
    calc("2^1024").assertDecimal("1.7976931349E308");
    calc("2^1024").with(Prop.NUMBER_FORMAT, NumberFormat.PLAIN)
        .assertText(
            Formatter.group(BigInteger.ONE.shiftLeft(1024).toString()));
    final MathNode factorial =
        node.product(node.literals("k"), node.literals("1"),
            node.literals("200"), node.literals("k"));
    calc(factorial).assertText("7.8865786736E374")
        .assertDecimal("7.8865786736E374");
  }

  /** Numbers inside an expression or a solution ignore the scientific
   * format. */
  @Test void testScientificFormat() {
    calc("x^2+3x").with(Prop.NUMBER_FORMAT, NumberFormat.SCIENTIFIC)
        .assertText("pow(x, 2)+3x");
    calc("x+5=10").with(Prop.NUMBER_FORMAT, NumberFormat.SCIENTIFIC)
        .assertText("x = 5");
    calc("5").with(Prop.NUMBER_FORMAT, NumberFormat.SCIENTIFIC)
        .assertText("5");
  }

  /** Input of several lines without "=" has no value. */
  @Test void testSeveralLines() {
    calc("1+2\n3+4").assertEmpty();
  }

  @Test void testProperties() {
    calc("1/3").with(Prop.PRECISION, 4).assertDecimal("0.3333");
    calc("2^20").assertText("1.048576E6");
    calc("2^20").with(Prop.NUMBER_FORMAT, NumberFormat.PLAIN)
        .assertText("1,048,576");
  }

  @Test void testEquations() {
    calc("x+5=10").assertText("x = 5");
    calc("2x+3=x+7").assertText("x = 4");
    calc("x^2-5x+6=0").assertLines("x = 3", "x = 2");
    calc("x^2+1=0").assertLines("x = i", "x = -i");
    calc("x+y=5\nx-y=1").assertText("x = 3\ny = 2");
    // no solution
    calc("x^3=1").assertEmpty();
    calc("1=2").assertEmpty();
    calc("x=1=2").assertEmpty();
  }

  @Test void testSolutionResult() {
    final ExactResult result = calc("x+5=10").evaluate();
    assertThat(result.isSolution(), is(true));
    assertThat(result.exp, nullValue());
    assertThat(result.isExact(), is(true));
    final @Nullable Solution solution =
        new Engine(Session.DEFAULT).solve(node.literals("3x=1"),
            ImmutableMap.of());
    assertThat(solution, notNullValue());
    assertThat(solution.toString(), is("x = 1/3"));
  }

  /** Solving malformed input returns null rather than throwing. */
  @Test void testSolveMalformed() {
    final Engine engine = new Engine(Session.DEFAULT);
    for (String s : new String[] {"x+=5", "x=", "=5", "x+1", "x=2$"}) {
      assertThat(s, engine.solve(node.literals(s), ImmutableMap.of()),
          nullValue());
    }
    assertThat(engine.solve(node.literals("3x=1"), ImmutableMap.of()),
        notNullValue());
  }

  /** Integration constants start from c0 in every evaluation. */
  @Test void testConstantsPerEvaluation() {
    final Engine engine = new Engine(Session.DEFAULT);
    final List<MathNode> nodes =
        node.list(node.integral("x", node.literals("x")));
    final ExactResult first = engine.evaluate(nodes);
    final ExactResult second = engine.evaluate(nodes);
    assertThat(String.valueOf(first.exp), is("x^2/2 + c0"));
    assertThat(String.valueOf(second.exp), is("x^2/2 + c0"));
    assertThat(first.text(), is(second.text()));
  }

  @Test void testAnswers() {
    calc("ans0*4").withAns(0, expr.intLiteral(3)).assertExp("12");
    calc(node.ans(0)).withAns(0, expr.rational(1, 2)).assertExp("1/2");
    calc("ans0*ans0").withAns(0, expr.sqrt(expr.intLiteral(2)))
        .assertExp("2");
    calc("ans5").assertExp("ans5");
  }

  @Test void testStructured() {
    calc(node.trig("sin", node.literals("30°"))).assertExp("1/2");
    calc(node.log(ImmutableList.of(), node.literals("100"))).assertExp("2");
    calc(node.root(node.literals("3"), node.literals("27"))).assertExp("3");
    calc(node.derivative("x", node.literals("3x^2"))).assertText("6x");
    calc(node.integral("x", node.literals("x")))
        .assertExp("x^2/2 + c0");
  }

  /** Each integral in a cell gets its own constant. */
  @Test void testDoubleIntegral() {
    final ExactResult result =
        calc(
            node.integral("x",
                node.list(node.integral("x", node.literals("1")))))
            .evaluate();
    assertThat(result.exp, notNullValue());
    assertThat(result.exp.toString(), containsString("c0"));
    assertThat(result.exp.toString(), containsString("c1"));
  }

  @Test void testErrors() {
    final MathNode xSinX =
        node.integral("x",
            node.list(node.literal("x"),
                node.trig("sin", node.literals("x"))));
    calc(xSinX).assertError("cannot integrate");
    final MathNode sum =
        node.summation(node.literals("i"), node.literals("1"),
            node.literals("100"), node.literals("i"));
    calc(sum).assertExp("5050");
    calc(sum).with(Prop.LOOP_LIMIT, 10).assertError("too many iterations");
  }

  @Test void testTooDeep() {
    List<MathNode> nodes = node.literals("1");
    for (int i = 0; i < 10; i++) {
      nodes = node.list(node.fraction(nodes, node.literals("2")));
    }
    calc(nodes).with(Prop.MAX_DEPTH, 5)
        .assertError("expression is nested too deeply");
    calc(nodes).assertExp("1/1024");
  }
}

// End EngineTest.java
