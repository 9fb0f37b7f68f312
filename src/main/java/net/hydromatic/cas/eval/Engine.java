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
import static net.hydromatic.cas.ast.NodeBuilder.node;

import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.cas.ast.Expr;
import net.hydromatic.cas.ast.MathNode;
import net.hydromatic.cas.compile.Simplifier;
import net.hydromatic.cas.parse.NodeConverter;
import net.hydromatic.cas.parse.NodeValidator;
import net.hydromatic.cas.parse.NodeWriter;
import net.hydromatic.cas.parse.ParseException;
import net.hydromatic.cas.solve.EquationSolver;
import net.hydromatic.cas.solve.Solution;
import net.hydromatic.cas.util.EvalException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates trees of editor nodes exactly.
 *
 * <p>An engine is immutable, and may be shared. Each call to
 * {@link #evaluate} creates its own converter, and therefore numbers its
 * integration constants from {@code c0}.
 */
public class Engine {
  private static final Logger LOGGER = LoggerFactory.getLogger(Engine.class);

  public final Session session;

  public Engine(Session session) {
    this.session = requireNonNull(session);
  }

  /** Evaluates nodes that contain no references to previous answers. */
  public ExactResult evaluate(List<? extends MathNode> nodes) {
    return evaluate(nodes, ImmutableMap.of());
  }

  /** Evaluates an expression, or solves one or more equations.
   *
   * <p>Never throws: empty, incomplete and malformed input gives an empty
   * result, and failures such as an expression that cannot be integrated
   * give an error result.
   *
   * @param nodes Nodes; lines are separated by newline nodes
   * @param ans Values of previous answers, by index
   */
  public ExactResult evaluate(List<? extends MathNode> nodes,
      Map<Integer, ? extends Expr.Exp> ans) {
    if (NodeValidator.isEmpty(nodes)) {
      return ExactResult.empty();
    }
    if (NodeValidator.depth(nodes) > session.maxDepth()) {
      LOGGER.debug("nesting exceeds {}", session.maxDepth());
      return ExactResult.error("expression is nested too deeply");
    }
    final List<MathNode> normalized = NodeValidator.normalize(nodes);
    if (NodeValidator.isIncomplete(normalized)) {
      return ExactResult.empty();
    }
    final List<List<MathNode>> lines = NodeValidator.splitLines(normalized);
    if (lines.isEmpty()) {
      return ExactResult.empty();
    }
    final NodeConverter converter =
        NodeConverter.create(ans, session.maxDepth(), session.loopLimit());
    try {
      if (NodeValidator.containsEquals(normalized)) {
        final @Nullable Solution solution = solve(lines, converter);
        if (solution == null) {
          LOGGER.debug("no solution for {}", MathNode.describe(normalized));
          return ExactResult.empty();
        }
        return ExactResult.of(solution, write(solution));
      }
      if (lines.size() > 1) {
        // Several lines are a system of equations, or nothing
        LOGGER.debug("{} lines but no equation", lines.size());
        return ExactResult.empty();
      }
      final Expr.Exp exp = converter.convert(lines.get(0));
      return value(exp);
    } catch (ParseException e) {
      LOGGER.debug("cannot parse {}: {}", MathNode.describe(normalized),
          e.getMessage());
      return ExactResult.empty();
    } catch (EvalException | ArithmeticException e) {
      LOGGER.debug("cannot evaluate {}", MathNode.describe(normalized), e);
      return ExactResult.error(String.valueOf(e.getMessage()));
    }
  }

  /** Solves one or more equations. Returns null if the input is empty,
   * incomplete or malformed, if it is not a list of equations, or if the
   * equations have no solution. Never throws. */
  public @Nullable Solution solve(List<? extends MathNode> nodes,
      Map<Integer, ? extends Expr.Exp> ans) {
    if (NodeValidator.isEmpty(nodes)
        || NodeValidator.depth(nodes) > session.maxDepth()) {
      return null;
    }
    final List<MathNode> normalized = NodeValidator.normalize(nodes);
    if (NodeValidator.isIncomplete(normalized)
        || !NodeValidator.containsEquals(normalized)) {
      return null;
    }
    try {
      return solve(NodeValidator.splitLines(normalized),
          NodeConverter.create(ans, session.maxDepth(), session.loopLimit()));
    } catch (ParseException | EvalException | ArithmeticException e) {
      LOGGER.debug("cannot solve {}: {}", MathNode.describe(normalized),
          e.getMessage());
      return null;
    }
  }

  private static @Nullable Solution solve(List<List<MathNode>> lines,
      NodeConverter converter) {
    final List<Expr.Exp> equations = new ArrayList<>();
    for (List<MathNode> line : lines) {
      final List<List<MathNode>> sides = NodeValidator.splitSides(line);
      if (sides.size() != 2) {
        return null;
      }
      final Expr.Exp left = converter.convert(sides.get(0));
      final Expr.Exp right = converter.convert(sides.get(1));
      equations.add(Simplifier.subtract(left, right));
    }
    LOGGER.debug("solving {}", equations);
    return EquationSolver.solve(equations);
  }

  private ExactResult value(Expr.Exp exp) {
    final Formatter formatter = session.formatter();
    final double value = exp.toDouble();
    final List<MathNode> nodes;
    if (Double.isInfinite(value) && Simplifier.dividesByZero(exp)) {
      nodes = node.literals(value > 0 ? "∞" : "-∞");
    } else {
      nodes = new NodeWriter(formatter).write(exp);
    }
    // A rational may be too large for a double, so format it exactly
    final String decimal = exp.isRational()
        ? formatter.format(toDecimal((Expr.Rational) exp, formatter))
        : formatter.format(value);
    return ExactResult.of(exp, nodes, value, decimal);
  }

  /** Converts a rational to a decimal with enough digits for a formatter's
   * precision. */
  private static BigDecimal toDecimal(Expr.Rational r, Formatter formatter) {
    final BigDecimal numerator = new BigDecimal(r.numerator());
    if (r.denominator().equals(BigInteger.ONE)) {
      return numerator;
    }
    final int digits = numerator.precision() + formatter.precision + 2;
    return numerator.divide(new BigDecimal(r.denominator()),
        new MathContext(digits, RoundingMode.HALF_EVEN));
  }

  /** Converts a solution to nodes, one line per assignment. */
  private List<MathNode> write(Solution solution) {
    final NodeWriter writer = new NodeWriter(session.formatter());
    final List<MathNode> list = new ArrayList<>();
    for (Solution.Assignment assignment : solution.assignments) {
      if (!list.isEmpty()) {
        list.add(node.newline());
      }
      list.add(node.literal(assignment.variable + " = "));
      list.addAll(writer.write(assignment.value));
    }
    return NodeWriter.merge(list);
  }
}

// End Engine.java
