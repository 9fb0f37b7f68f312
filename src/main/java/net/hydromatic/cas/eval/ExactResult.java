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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.cas.ast.Expr;
import net.hydromatic.cas.ast.MathNode;
import net.hydromatic.cas.compile.Simplifier;
import net.hydromatic.cas.solve.Solution;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Result of evaluating an expression or solving equations.
 *
 * <p>A result is either empty (the input was empty, incomplete or
 * malformed), an error (evaluation failed), a value, or a solution.
 */
public class ExactResult {
  private static final ExactResult EMPTY =
      new ExactResult(null, null, null, null, null, null);

  /** Canonical value; null unless this result is a value. */
  public final Expr.@Nullable Exp exp;
  /** Solution of equations; null unless this result is a solution. */
  public final @Nullable Solution solution;
  /** Nodes for display; null if empty or error. */
  public final @Nullable ImmutableList<MathNode> nodes;
  /** Approximate value; null unless this result is a value. */
  public final @Nullable Double value;
  /** Approximate value, formatted. */
  public final @Nullable String decimal;
  /** Error message; null unless this result is an error. */
  public final @Nullable String error;

  private ExactResult(Expr.@Nullable Exp exp, @Nullable Solution solution,
      @Nullable List<MathNode> nodes, @Nullable Double value,
      @Nullable String decimal, @Nullable String error) {
    this.exp = exp;
    this.solution = solution;
    this.nodes = nodes == null ? null : ImmutableList.copyOf(nodes);
    this.value = value;
    this.decimal = decimal;
    this.error = error;
  }

  /** Returns the empty result. */
  public static ExactResult empty() {
    return EMPTY;
  }

  /** Creates a result for a failed evaluation. */
  public static ExactResult error(String message) {
    return new ExactResult(null, null, null, null, null,
        requireNonNull(message));
  }

  /** Creates a result that is a value. */
  public static ExactResult of(Expr.Exp exp, List<MathNode> nodes,
      double value, String decimal) {
    return new ExactResult(requireNonNull(exp), null, requireNonNull(nodes),
        value, requireNonNull(decimal), null);
  }

  /** Creates a result that is the solution of equations. */
  public static ExactResult of(Solution solution, List<MathNode> nodes) {
    return new ExactResult(null, requireNonNull(solution),
        requireNonNull(nodes), null, null, null);
  }

  public boolean isEmpty() {
    return this == EMPTY;
  }

  public boolean isError() {
    return error != null;
  }

  public boolean isSolution() {
    return solution != null;
  }

  /** Returns whether the result has no irrational parts, so that its
   * approximate value adds no information. */
  public boolean isExact() {
    if (exp != null) {
      return Simplifier.isExact(exp);
    }
    if (solution != null) {
      return solution.assignments.stream()
          .allMatch(a -> Simplifier.isExact(a.value));
    }
    return false;
  }

  /** Returns the nodes as text; for example "x = 5". */
  public String text() {
    return nodes == null ? "" : MathNode.describe(nodes);
  }

  @Override public String toString() {
    if (isEmpty()) {
      return "empty";
    }
    if (error != null) {
      return "error: " + error;
    }
    return decimal == null ? text() : text() + " ≈ " + decimal;
  }
}

// End ExactResult.java
