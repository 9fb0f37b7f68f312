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

import static net.hydromatic.cas.Matchers.isExp;
import static net.hydromatic.cas.ast.ExprBuilder.expr;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.cas.ast.ConstantTag;
import net.hydromatic.cas.ast.Expr;
import net.hydromatic.cas.ast.TrigFunction;
import net.hydromatic.cas.util.EvalException;
import org.junit.jupiter.api.Test;

/** Tests for {@link Integrator} and {@link Enumerator}. */
public class IntegratorTest {
  private final Expr.Variable x = expr.variable("x");

  private static Expr.Int i(long v) {
    return expr.intLiteral(v);
  }

  private static Expr.Exp f(Expr.Exp e) {
    return Integrator.antiderivative(e, "x");
  }

  @Test void testPowerRule() {
    assertThat(f(x), isExp("x^2/2"));
    assertThat(f(i(5)), isExp("5x"));
    assertThat(f(expr.product(i(3), expr.power(x, i(2)))), isExp("x^3"));
    assertThat(f(expr.div(i(1), x)), isExp("ln(|x|)"));
    assertThat(f(expr.power(x, i(-1))), isExp("ln(|x|)"));
  }

  /** Each indefinite integral gets a fresh constant. */
  @Test void testConstants() {
    final ConstantGenerator constants = new ConstantGenerator();
    assertThat(Integrator.integrate(x, "x", constants),
        isExp("x^2/2 + c0"));
    assertThat(Integrator.integrate(x, "x", constants),
        isExp("x^2/2 + c1"));
    final Expr.Exp e =
        expr.sum(expr.product(i(3), expr.power(x, i(2))), i(3));
    assertThat(Integrator.integrate(e, "x", new ConstantGenerator()),
        isExp("x^3 + 3x + c0"));
  }

  @Test void testDefinite() {
    assertThat(Integrator.integrate(x, "x", i(0), i(1)),
        is(expr.rational(1, 2)));
    assertThat(Integrator.integrate(x, "x", i(1), i(0)),
        is(expr.rational(-1, 2)));
    final Expr.Exp square = expr.power(expr.sum(x, i(1)), i(2));
    assertThat(Integrator.integrate(square, "x", i(0), i(3)), isExp("21"));
  }

  @Test void testFunctions() {
    assertThat(f(expr.trig(TrigFunction.COS, x)), isExp("sin(x)"));
    assertThat(f(expr.trig(TrigFunction.SIN, x)), isExp("-cos(x)"));
    assertThat(f(expr.power(expr.constant(ConstantTag.E), x)),
        isExp("e^x"));
  }

  /** Products of sums are multiplied out before integrating. */
  @Test void testExpanded() {
    assertThat(f(expr.product(x, expr.sum(x, i(1)))),
        isExp("x^3/3 + x^2/2"));
  }

  @Test void testNotIntegrable() {
    final EvalException e =
        assertThrows(EvalException.class,
            () -> f(expr.product(x, expr.trig(TrigFunction.SIN, x))));
    assertThat(e.getMessage(), containsString("cannot integrate"));
  }

  @Test void testSummation() {
    assertThat(Enumerator.sum(i(1), i(4), expr::intLiteral, 100),
        isExp("10"));
    assertThat(Enumerator.product(i(1), i(5), expr::intLiteral, 100),
        isExp("120"));
    // empty range and non-integer bounds give the identity
    assertThat(Enumerator.sum(i(5), i(1), expr::intLiteral, 100),
        isExp("0"));
    assertThat(
        Enumerator.product(expr.rational(1, 2), i(3), expr::intLiteral, 100),
        isExp("1"));
    final EvalException e =
        assertThrows(EvalException.class,
            () -> Enumerator.sum(i(1), i(1000), expr::intLiteral, 10));
    assertThat(e.getMessage(), containsString("too many iterations"));
  }
}

// End IntegratorTest.java
