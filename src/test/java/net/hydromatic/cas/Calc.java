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
package net.hydromatic.cas;

import static net.hydromatic.cas.Matchers.hasLines;
import static net.hydromatic.cas.Matchers.hasText;
import static net.hydromatic.cas.Matchers.isEmptyResult;
import static net.hydromatic.cas.Matchers.isErrorResult;
import static net.hydromatic.cas.ast.NodeBuilder.node;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.cas.ast.Expr;
import net.hydromatic.cas.ast.MathNode;
import net.hydromatic.cas.eval.Engine;
import net.hydromatic.cas.eval.ExactResult;
import net.hydromatic.cas.eval.Prop;
import net.hydromatic.cas.eval.Session;

/** Fluent test helper. Evaluates a list of nodes and checks the result. */
public class Calc {
  private final ImmutableList<MathNode> nodes;
  private final ImmutableMap<Integer, Expr.Exp> ans;
  private final Session session;

  Calc(List<? extends MathNode> nodes, Map<Integer, Expr.Exp> ans,
      Session session) {
    this.nodes = ImmutableList.copyOf(nodes);
    this.ans = ImmutableMap.copyOf(ans);
    this.session = session;
  }

  /** Creates a {@code Calc} with a single literal, such as "x+5=10". */
  public static Calc calc(String text) {
    return calc(node.literals(text));
  }

  /** Creates a {@code Calc} with a list of nodes. */
  public static Calc calc(List<? extends MathNode> nodes) {
    return new Calc(nodes, ImmutableMap.of(), Session.DEFAULT);
  }

  /** Creates a {@code Calc} with a list of nodes. */
  public static Calc calc(MathNode... nodes) {
    return calc(ImmutableList.copyOf(nodes));
  }

  /** Returns a {@code Calc} with a previous answer. */
  public Calc withAns(int index, Expr.Exp value) {
    final Map<Integer, Expr.Exp> map = new LinkedHashMap<>(ans);
    map.put(index, value);
    return new Calc(nodes, map, session);
  }

  /** Returns a {@code Calc} with a property set. */
  public Calc with(Prop prop, Object value) {
    return new Calc(nodes, ans, session.with(prop, value));
  }

  public ExactResult evaluate() {
    return new Engine(session).evaluate(nodes, ans);
  }

  /** Evaluates and returns the canonical value. */
  public Expr.Exp value() {
    final ExactResult result = evaluate();
    assertThat("no value: " + result, result.exp, notNullValue());
    return result.exp;
  }

  public Calc assertText(String expected) {
    assertThat(evaluate(), hasText(expected));
    return this;
  }

  public Calc assertLines(String... expected) {
    assertThat(evaluate(), hasLines(expected));
    return this;
  }

  public Calc assertExp(String expected) {
    assertThat(value().toString(), is(expected));
    return this;
  }

  public Calc assertDecimal(String expected) {
    assertThat(evaluate().decimal, is(expected));
    return this;
  }

  public Calc assertEmpty() {
    assertThat(evaluate(), isEmptyResult());
    return this;
  }

  public Calc assertError(String message) {
    assertThat(evaluate(), isErrorResult(message));
    return this;
  }
}

// End Calc.java
