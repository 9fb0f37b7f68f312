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
package net.hydromatic.cas.solve;

import static net.hydromatic.cas.ast.ExprBuilder.expr;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.cas.ast.Expr;
import net.hydromatic.cas.ast.TrigFunction;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests for {@link EquationSolver}, {@link Polynomials} and
 * {@link LinearSystem}. */
public class EquationSolverTest {
  private final Expr.Variable x = expr.variable("x");
  private final Expr.Variable y = expr.variable("y");

  private static Expr.Int i(long v) {
    return expr.intLiteral(v);
  }

  private static @Nullable Solution solve(Expr.Exp... equations) {
    return EquationSolver.solve(ImmutableList.copyOf(equations));
  }

  private static void assertSolution(@Nullable Solution solution,
      String expected) {
    assertThat(solution, notNullValue());
    assertThat(solution.toString(), is(expected));
  }

  @Test void testLinear() {
    assertSolution(solve(expr.sum(expr.product(i(2), x), i(-10))), "x = 5");
    assertThat(solve(expr.sum(expr.product(i(2), x), i(-10))),
        is(Solution.of("x", i(5))));
    assertSolution(solve(expr.sum(expr.product(i(3), x), i(1))),
        "x = -1/3");
  }

  @Test void testQuadratic() {
    assertSolution(
        solve(
            expr.sum(expr.power(x, i(2)), expr.product(i(-5), x), i(6))),
        "x = 3\nx = 2");
    // repeated root appears once
    assertSolution(
        solve(
            expr.sum(expr.power(x, i(2)), expr.product(i(-4), x), i(4))),
        "x = 2");
    assertSolution(solve(expr.sum(expr.power(x, i(2)), i(1))),
        "x = i\nx = -i");
  }

  @Test void testSystem() {
    assertSolution(
        solve(expr.sum(x, y, i(-5)), expr.sum(x, expr.negate(y), i(-1))),
        "x = 3\ny = 2");
  }

  @Test void testNoSolution() {
    // cubic
    assertThat(solve(expr.sum(expr.power(x, i(3)), i(-1))), nullValue());
    // no variables
    assertThat(solve(i(3)), nullValue());
    // singular system
    assertThat(
        solve(expr.sum(x, y, i(-1)),
            expr.sum(expr.product(i(2), x), expr.product(i(2), y), i(-2))),
        nullValue());
    // non-linear system
    assertThat(solve(expr.sum(expr.product(x, y), i(-1)), expr.minus(x, y)),
        nullValue());
    // more variables than equations
    assertThat(solve(expr.sum(x, y)), nullValue());
    // not a polynomial
    assertThat(solve(expr.trig(TrigFunction.SIN, x)), nullValue());
  }

  @Test void testPolynomials() {
    final Expr.Exp e =
        expr.sum(expr.power(x, i(2)), expr.product(i(2), x), i(1));
    final @Nullable List<Expr.Exp> coefficients =
        Polynomials.coefficients(e, "x");
    assertThat(coefficients, notNullValue());
    assertThat(coefficients.toString(), is("[1, 2, 1]"));
    assertThat(Polynomials.degree(e, "x"), is(2));
    assertThat(Polynomials.degree(expr.power(expr.sum(x, i(1)), i(3)), "x"),
        is(3));
    assertThat(Polynomials.degree(expr.product(i(5), y), "x"), is(0));
    assertThat(Polynomials.degree(i(0), "x"), is(-1));
    assertThat(Polynomials.degree(expr.trig(TrigFunction.SIN, x), "x"),
        is(-2));
  }

  @Test void testLinearSystem() {
    final @Nullable LinearSystem system =
        LinearSystem.of(
            ImmutableList.of(expr.sum(x, expr.product(i(2), y), i(-4)),
                expr.sum(expr.product(i(3), x), expr.negate(y), i(-5))),
            ImmutableList.of("x", "y"));
    assertThat(system, notNullValue());
    assertSolution(system.solve(), "x = 2\ny = 1");
    assertThat(
        LinearSystem.of(ImmutableList.of(expr.power(x, i(2))),
            ImmutableList.of("x")),
        nullValue());
  }
}

// End EquationSolverTest.java
