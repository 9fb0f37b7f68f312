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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.cas.ast.Expr;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * System of linear equations with exact rational coefficients.
 *
 * <p>Each row holds the coefficients of the variables followed by the
 * constant term; a row [a, b, c] represents the equation "a·x + b·y + c =
 * 0".
 */
public class LinearSystem {
  private final ImmutableList<String> variables;
  private final Expr.Rational[][] rows;

  private LinearSystem(List<String> variables, Expr.Rational[][] rows) {
    this.variables = ImmutableList.copyOf(variables);
    this.rows = rows;
  }

  /** Creates a linear system from expressions that are each equal to zero,
   * or returns null if an expression is not linear in the variables with
   * rational coefficients. */
  public static @Nullable LinearSystem of(List<Expr.Exp> equations,
      List<String> variables) {
    checkArgument(equations.size() == variables.size(),
        "need %s equations, got %s", variables.size(), equations.size());
    final Expr.Rational[][] rows = new Expr.Rational[equations.size()][];
    for (int i = 0; i < equations.size(); i++) {
      final Expr.Rational @Nullable [] row =
          Polynomials.linearRow(equations.get(i), variables);
      if (row == null) {
        return null;
      }
      rows[i] = row;
    }
    return new LinearSystem(variables, rows);
  }

  /** Solves the system by Gaussian elimination with partial pivoting.
   * Returns null if the system is singular. */
  public @Nullable Solution solve() {
    final int n = variables.size();
    final Expr.Rational[][] m = new Expr.Rational[n][];
    for (int i = 0; i < n; i++) {
      m[i] = rows[i].clone();
    }
    for (int col = 0; col < n; col++) {
      // Choose the row with the largest value in this column.
      int pivot = col;
      for (int r = col + 1; r < n; r++) {
        if (m[r][col].abs().compareTo(m[pivot][col].abs()) > 0) {
          pivot = r;
        }
      }
      if (m[pivot][col].signum() == 0) {
        return null;
      }
      final Expr.Rational[] t = m[col];
      m[col] = m[pivot];
      m[pivot] = t;
      for (int r = 0; r < n; r++) {
        if (r == col || m[r][col].signum() == 0) {
          continue;
        }
        final Expr.Rational factor = m[r][col].divide(m[col][col]);
        for (int c = col; c <= n; c++) {
          m[r][c] = m[r][c].minus(factor.times(m[col][c]));
        }
      }
    }
    final List<Solution.Assignment> assignments = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      // a·x + c = 0, so x = -c/a
      final Expr.Rational value = m[i][n].negate().divide(m[i][i]);
      assignments.add(new Solution.Assignment(variables.get(i), value));
    }
    return new Solution(assignments);
  }
}

// End LinearSystem.java
