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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import net.hydromatic.cas.ast.ConstantTag;
import net.hydromatic.cas.ast.Expr;
import net.hydromatic.cas.compile.Simplifier;
import net.hydromatic.cas.compile.Substitutor;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Solves equations exactly.
 *
 * <p>Each equation is an expression that is equal to zero. The solver
 * handles one linear or quadratic equation in one variable, and systems of
 * N linear equations in N variables. Anything else has no solution.
 */
public abstract class EquationSolver {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(EquationSolver.class);

  private EquationSolver() {}

  /** Solves a list of equations, each of which is an expression equal to
   * zero. Returns null if the equations cannot be solved. */
  public static @Nullable Solution solve(List<Expr.Exp> equations) {
    final List<Expr.Exp> simplified = new ArrayList<>();
    final SortedSet<String> variables = new TreeSet<>();
    for (Expr.Exp equation : equations) {
      final Expr.Exp e = Simplifier.simplify(equation);
      simplified.add(e);
      variables.addAll(Substitutor.variables(e));
    }
    if (variables.isEmpty() || simplified.isEmpty()) {
      return null;
    }
    if (simplified.size() == 1 && variables.size() == 1) {
      return solveSingle(simplified.get(0), variables.first());
    }
    if (simplified.size() == variables.size()) {
      LOGGER.debug("solving {} linear equations in {}", simplified.size(),
          variables);
      final @Nullable LinearSystem system =
          LinearSystem.of(simplified, ImmutableList.copyOf(variables));
      return system == null ? null : system.solve();
    }
    LOGGER.debug("cannot solve {} equations in {}", simplified.size(),
        variables);
    return null;
  }

  /** Solves an equation in one variable. */
  private static @Nullable Solution solveSingle(Expr.Exp equation,
      String variable) {
    final @Nullable List<Expr.Exp> coefficients =
        Polynomials.coefficients(equation, variable);
    if (coefficients == null) {
      LOGGER.debug("not a polynomial in {}: {}", variable, equation);
      return null;
    }
    switch (coefficients.size()) {
    case 2:
      // a·x + b = 0, so x = -b/a
      return Solution.of(variable,
          Simplifier.divide(Simplifier.negate(coefficients.get(0)),
              coefficients.get(1)));
    case 3:
      return solveQuadratic(variable, coefficients.get(2),
          coefficients.get(1), coefficients.get(0));
    default:
      LOGGER.debug("degree {} in {}: {}", coefficients.size() - 1, variable,
          equation);
      return null;
    }
  }

  /** Solves "a·x^2 + b·x + c = 0" by the quadratic formula. */
  private static Solution solveQuadratic(String variable, Expr.Exp a,
      Expr.Exp b, Expr.Exp c) {
    final Expr.Exp discriminant =
        Simplifier.subtract(Simplifier.multiply(b, b),
            Simplifier.multiply(expr.intLiteral(4),
                Simplifier.multiply(a, c)));
    final Expr.Exp root = squareRoot(discriminant);
    final Expr.Exp minusB = Simplifier.negate(b);
    final Expr.Exp twoA = Simplifier.multiply(expr.intLiteral(2), a);
    final Expr.Exp x1 =
        Simplifier.divide(Simplifier.add(minusB, root), twoA);
    final Expr.Exp x2 =
        Simplifier.divide(Simplifier.subtract(minusB, root), twoA);
    final List<Solution.Assignment> assignments = new ArrayList<>();
    assignments.add(new Solution.Assignment(variable, x1));
    if (!x2.equals(x1)) {
      assignments.add(new Solution.Assignment(variable, x2));
    }
    return new Solution(assignments);
  }

  /** Returns the square root of a discriminant. The square root of a
   * negative number is a multiple of the imaginary unit. */
  private static Expr.Exp squareRoot(Expr.Exp d) {
    if (d.isRational() && ((Expr.Rational) d).signum() < 0) {
      return Simplifier.multiply(
          Simplifier.simplify(expr.sqrt(((Expr.Rational) d).negate())),
          expr.constant(ConstantTag.I));
    }
    return Simplifier.simplify(expr.sqrt(d));
  }
}

// End EquationSolver.java
