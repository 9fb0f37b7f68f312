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
package net.hydromatic.cas.parse;

import static net.hydromatic.cas.ast.NodeBuilder.node;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;
import net.hydromatic.cas.ast.MathNode;
import net.hydromatic.cas.ast.Nodes;
import net.hydromatic.cas.ast.Op;

/**
 * Checks and splits editor input before it is converted.
 *
 * <p>While the user is typing, the input is often incomplete: it ends in an
 * operator, has an unclosed parenthesis, or a fraction whose denominator has
 * not been filled in. The engine returns an empty result for such input
 * rather than an error.
 */
public class NodeValidator {
  /** Two operators in a row, other than a sign after "+" or "-". */
  private static final Pattern CONSECUTIVE_OPERATORS =
      Pattern.compile("[+\\-*/^][*/^]|[*/^][+\\-*/^]");

  /** Operators, which do not count as content. */
  private static final Pattern OPERATORS = Pattern.compile("[+\\-*/^·×÷−]");

  private NodeValidator() {}

  /** Returns whether a list of nodes has no content: no structured nodes,
   * and no literal text other than operators and spaces. */
  public static boolean isEmpty(List<? extends MathNode> nodes) {
    for (MathNode n : nodes) {
      switch (n.op) {
      case LITERAL_NODE:
        final String text = ((Nodes.Literal) n).text;
        if (!OPERATORS.matcher(text).replaceAll("").trim().isEmpty()) {
          return false;
        }
        break;
      case NEWLINE_NODE:
        break;
      default:
        return false;
      }
    }
    return true;
  }

  /** Returns whether a list of nodes is incomplete: it has a trailing
   * operator, a misplaced leading operator, two consecutive operators,
   * unbalanced parentheses, or an empty required slot in a structured
   * node. */
  public static boolean isIncomplete(List<? extends MathNode> nodes) {
    for (List<MathNode> line : splitLines(normalize(nodes))) {
      for (List<MathNode> side : splitSides(line)) {
        if (isIncompleteExpression(side)) {
          return true;
        }
      }
    }
    return false;
  }

  private static boolean isIncompleteExpression(List<MathNode> nodes) {
    final StringBuilder b = new StringBuilder();
    for (MathNode n : nodes) {
      if (n instanceof Nodes.Literal) {
        b.append(((Nodes.Literal) n).text);
      } else if (hasEmptySlot(n)) {
        return true;
      } else {
        // A structured node is an operand
        b.append('1');
      }
    }
    final String s = b.toString()
        .replace('·', '*')
        .replace('×', '*')
        .replace('−', '-')
        .replace('÷', '/')
        .replaceAll("\\s+", "");
    if (s.isEmpty()) {
      return true;
    }
    final char last = s.charAt(s.length() - 1);
    if ("+-*/^(".indexOf(last) >= 0) {
      return true;
    }
    if ("*/^".indexOf(s.charAt(0)) >= 0) {
      return true;
    }
    if (CONSECUTIVE_OPERATORS.matcher(s).find()) {
      return true;
    }
    int parens = 0;
    for (int i = 0; i < s.length(); i++) {
      switch (s.charAt(i)) {
      case '(':
        ++parens;
        break;
      case ')':
        if (--parens < 0) {
          return true;
        }
        break;
      default:
        break;
      }
    }
    return parens != 0;
  }

  /** Returns whether a structured node has a required slot that is empty or
   * incomplete. */
  private static boolean hasEmptySlot(MathNode n) {
    switch (n.op) {
    case FRACTION_NODE:
      final Nodes.Fraction fraction = (Nodes.Fraction) n;
      return isIncompleteSlot(fraction.numerator)
          || isIncompleteSlot(fraction.denominator);
    case EXPONENT_NODE:
      final Nodes.Exponent exponent = (Nodes.Exponent) n;
      return isIncompleteSlot(exponent.base)
          || isIncompleteSlot(exponent.power);
    case PARENTHESIS_NODE:
      return isIncompleteSlot(((Nodes.Parenthesis) n).content);
    case TRIG_NODE:
      return isIncompleteSlot(((Nodes.Trig) n).argument);
    case ROOT_NODE:
      final Nodes.Root root = (Nodes.Root) n;
      return isIncompleteSlot(root.radicand)
          || !root.squareRoot && isIncompleteSlot(root.index);
    case LOG_NODE:
      final Nodes.Log log = (Nodes.Log) n;
      return isIncompleteSlot(log.argument)
          || !log.natural && !log.base.isEmpty() && isIncompleteSlot(log.base);
    case PERMUTATION_NODE:
    case COMBINATION_NODE:
      final Nodes.Arrangement arrangement = (Nodes.Arrangement) n;
      return isIncompleteSlot(arrangement.n)
          || isIncompleteSlot(arrangement.r);
    case DERIVATIVE_NODE:
      final Nodes.Derivative derivative = (Nodes.Derivative) n;
      return isIncompleteSlot(derivative.variable)
          || isIncompleteSlot(derivative.body)
          || !derivative.at.isEmpty() && isIncompleteSlot(derivative.at);
    case INTEGRAL_NODE:
      final Nodes.Bounded integral = (Nodes.Bounded) n;
      if (isIncompleteSlot(integral.variable)
          || isIncompleteSlot(integral.body)) {
        return true;
      }
      // Bounds are optional, but come in pairs
      if (isEmpty(integral.lower) && isEmpty(integral.upper)) {
        return false;
      }
      return isIncompleteSlot(integral.lower)
          || isIncompleteSlot(integral.upper);
    case SUMMATION_NODE:
    case PRODUCT_NODE:
      final Nodes.Bounded loop = (Nodes.Bounded) n;
      return isIncompleteSlot(loop.variable)
          || isIncompleteSlot(loop.lower)
          || isIncompleteSlot(loop.upper)
          || isIncompleteSlot(loop.body);
    case ANS_NODE:
      return isEmpty(((Nodes.Ans) n).index);
    default:
      return false;
    }
  }

  private static boolean isIncompleteSlot(List<MathNode> nodes) {
    return isEmpty(nodes) || isIncompleteExpression(nodes);
  }

  /** Splits literal text at "=" and newline characters, so that each "=" is
   * a literal of its own and each line break is a {@link Nodes.Newline}. */
  public static List<MathNode> normalize(List<? extends MathNode> nodes) {
    final List<MathNode> list = new ArrayList<>();
    for (MathNode n : nodes) {
      if (!(n instanceof Nodes.Literal)) {
        list.add(n);
        continue;
      }
      final String text = ((Nodes.Literal) n).text;
      if (text.indexOf('=') < 0 && text.indexOf('\n') < 0) {
        list.add(n);
        continue;
      }
      final String[] lines = text.split("\n", -1);
      for (int i = 0; i < lines.length; i++) {
        if (i > 0) {
          list.add(node.newline());
        }
        final String[] parts = lines[i].split("=", -1);
        for (int j = 0; j < parts.length; j++) {
          if (j > 0) {
            list.add(node.literal("="));
          }
          if (!parts[j].isEmpty()) {
            list.add(node.literal(parts[j]));
          }
        }
      }
    }
    return list;
  }

  /** Splits normalized nodes into lines, skipping empty lines. */
  public static List<List<MathNode>> splitLines(List<MathNode> nodes) {
    final List<List<MathNode>> lines = new ArrayList<>();
    List<MathNode> line = new ArrayList<>();
    for (MathNode n : nodes) {
      if (n.op == Op.NEWLINE_NODE) {
        if (!line.isEmpty()) {
          lines.add(ImmutableList.copyOf(line));
        }
        line = new ArrayList<>();
      } else {
        line.add(n);
      }
    }
    if (!line.isEmpty()) {
      lines.add(ImmutableList.copyOf(line));
    }
    return lines;
  }

  /** Splits a normalized line at its "=" markers. A line with no "=" has one
   * side; an equation has two. */
  public static List<List<MathNode>> splitSides(List<MathNode> line) {
    final List<List<MathNode>> sides = new ArrayList<>();
    List<MathNode> side = new ArrayList<>();
    for (MathNode n : line) {
      if (isEquals(n)) {
        sides.add(ImmutableList.copyOf(side));
        side = new ArrayList<>();
      } else {
        side.add(n);
      }
    }
    sides.add(ImmutableList.copyOf(side));
    return sides;
  }

  /** Returns whether a list of nodes contains an "=" marker. */
  public static boolean containsEquals(List<MathNode> nodes) {
    return nodes.stream().anyMatch(NodeValidator::isEquals);
  }

  private static boolean isEquals(MathNode n) {
    return n instanceof Nodes.Literal
        && ((Nodes.Literal) n).text.equals("=");
  }

  /** Returns the depth of a tree of nodes; a list of literals has depth
   * 1. Does not recurse. */
  public static int depth(List<? extends MathNode> nodes) {
    final Deque<List<? extends MathNode>> lists = new ArrayDeque<>();
    final Deque<Integer> levels = new ArrayDeque<>();
    lists.add(nodes);
    levels.add(1);
    int depth = 0;
    while (!lists.isEmpty()) {
      final List<? extends MathNode> list = lists.remove();
      final int level = levels.remove();
      for (MathNode n : list) {
        depth = Math.max(depth, level);
        for (List<MathNode> child : n.children()) {
          lists.add(child);
          levels.add(level + 1);
        }
      }
    }
    return depth;
  }
}

// End NodeValidator.java
