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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;
import net.hydromatic.cas.ast.Expr;

/** Solution of an equation or a system of equations.
 *
 * <p>A quadratic equation may have two assignments to the same variable. */
public class Solution {
  public final ImmutableList<Assignment> assignments;

  public Solution(List<Assignment> assignments) {
    this.assignments = ImmutableList.copyOf(assignments);
  }

  /** Creates a solution with one assignment. */
  public static Solution of(String variable, Expr.Exp value) {
    return new Solution(ImmutableList.of(new Assignment(variable, value)));
  }

  @Override public int hashCode() {
    return assignments.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Solution
        && assignments.equals(((Solution) o).assignments);
  }

  /** Returns the assignments, one per line; for example
   * "x = 3\ny = 2". */
  @Override public String toString() {
    return assignments.stream().map(Assignment::toString)
        .collect(Collectors.joining("\n"));
  }

  /** Value of a variable in a solution. */
  public static class Assignment {
    public final String variable;
    public final Expr.Exp value;

    public Assignment(String variable, Expr.Exp value) {
      this.variable = requireNonNull(variable);
      this.value = requireNonNull(value);
    }

    @Override public int hashCode() {
      return variable.hashCode() * 31 + value.hashCode();
    }

    @Override public boolean equals(Object o) {
      return o == this
          || o instanceof Assignment
          && variable.equals(((Assignment) o).variable)
          && value.equals(((Assignment) o).value);
    }

    @Override public String toString() {
      return variable + " = " + value;
    }
  }
}

// End Solution.java
