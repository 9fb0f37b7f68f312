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

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import net.hydromatic.cas.ast.Expr;
import net.hydromatic.cas.ast.Shuttle;
import net.hydromatic.cas.ast.Visitor;

/** Replaces variables in an expression with other expressions. */
public class Substitutor extends Shuttle {
  private final ImmutableMap<String, Expr.Exp> map;

  private Substitutor(Map<String, ? extends Expr.Exp> map) {
    this.map = ImmutableMap.copyOf(map);
  }

  /** Replaces each occurrence of a variable and simplifies the result. */
  public static Expr.Exp substitute(Expr.Exp exp, String name,
      Expr.Exp value) {
    return substitute(exp, ImmutableMap.of(name, value));
  }

  /** Replaces variables and simplifies the result. */
  public static Expr.Exp substitute(Expr.Exp exp,
      Map<String, ? extends Expr.Exp> map) {
    if (map.isEmpty()) {
      return exp;
    }
    return Simplifier.simplify(exp.accept(new Substitutor(map)));
  }

  /** Returns the names of the variables in an expression, sorted. */
  public static SortedSet<String> variables(Expr.Exp exp) {
    final SortedSet<String> names = new TreeSet<>();
    exp.accept(
        new Visitor() {
          @Override protected void visit(Expr.Variable variable) {
            names.add(variable.name);
          }
        });
    return names;
  }

  /** Returns whether an expression contains a given variable. */
  public static boolean dependsOn(Expr.Exp exp, String name) {
    return variables(exp).contains(name);
  }

  @Override protected Expr.Exp visit(Expr.Variable variable) {
    final Expr.Exp value = map.get(variable.name);
    return value != null ? value : variable;
  }
}

// End Substitutor.java
