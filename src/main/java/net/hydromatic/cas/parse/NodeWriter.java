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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.cas.ast.NodeBuilder.node;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import net.hydromatic.cas.ast.Expr;
import net.hydromatic.cas.ast.ExprWriter;
import net.hydromatic.cas.ast.MathNode;
import net.hydromatic.cas.ast.Nodes;
import net.hydromatic.cas.eval.Formatter;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts an expression to a list of editor nodes, for display.
 *
 * <p>Integers and fractions are written using a {@link Formatter}. The
 * multiplication sign is omitted except between two function calls, and
 * before a factor that starts with a digit; for example "2x^2", "3√2",
 * "sin(x)·cos(x)", "2·3^x".
 */
public class NodeWriter {
  private final Formatter formatter;

  public NodeWriter(Formatter formatter) {
    this.formatter = requireNonNull(formatter);
  }

  /** Converts an expression to nodes.
   *
   * <p>The number format applies only if the whole expression is a number;
   * numbers inside a larger expression, such as the "2" in "x^2", are
   * written in plain digits unless they are very large. */
  public ImmutableList<MathNode> write(Expr.Exp exp) {
    final List<MathNode> list = new ArrayList<>();
    switch (exp.op) {
    case INTEGER:
      list.add(node.literal(formatter.formatInteger(((Expr.Int) exp).value)));
      break;
    case FRACTION:
      writeFraction(list, (Expr.Frac) exp, formatter::formatFractionPart);
      break;
    default:
      write(list, exp);
    }
    return merge(list);
  }

  /** Converts a sub-expression to nodes. */
  private ImmutableList<MathNode> writeAll(Expr.Exp exp) {
    final List<MathNode> list = new ArrayList<>();
    write(list, exp);
    return merge(list);
  }

  private void write(List<MathNode> list, Expr.Exp exp) {
    switch (exp.op) {
    case INTEGER:
      list.add(number(((Expr.Int) exp).value));
      return;

    case FRACTION:
      writeFraction(list, (Expr.Frac) exp, formatter::formatEmbedded);
      return;

    case CONSTANT:
      list.add(node.constant(((Expr.Constant) exp).tag.symbol));
      return;

    case VARIABLE:
      list.add(node.literal(((Expr.Variable) exp).name));
      return;

    case SUM:
      final List<Expr.Exp> terms = ((Expr.Sum) exp).terms;
      for (int i = 0; i < terms.size(); i++) {
        final Expr.Exp term = terms.get(i);
        final Expr.@Nullable Exp positive =
            i == 0 ? null : ExprWriter.positive(term);
        if (positive != null) {
          list.add(node.literal("-"));
          write(list, positive);
        } else {
          if (i > 0) {
            list.add(node.literal("+"));
          }
          write(list, term);
        }
      }
      return;

    case PRODUCT:
      writeProduct(list, (Expr.Product) exp);
      return;

    case POWER:
      final Expr.Power power = (Expr.Power) exp;
      list.add(
          node.exponent(operand(power.base), writeAll(power.exponent)));
      return;

    case ROOT:
      final Expr.Root root = (Expr.Root) exp;
      if (root.degree == 2) {
        list.add(node.sqrt(writeAll(root.radicand)));
      } else {
        list.add(
            node.root(node.literals(Integer.toString(root.degree)),
                writeAll(root.radicand)));
      }
      return;

    case LOG:
      final Expr.Log log = (Expr.Log) exp;
      if (log.isNatural()) {
        list.add(node.ln(writeAll(log.argument)));
      } else {
        list.add(node.log(writeAll(log.base), writeAll(log.argument)));
      }
      return;

    case TRIG:
      final Expr.Trig trig = (Expr.Trig) exp;
      list.add(
          node.trig(trig.function.functionName, writeAll(trig.argument)));
      return;

    case ABS:
      list.add(node.trig("abs", writeAll(((Expr.Abs) exp).argument)));
      return;

    case DIV:
      final Expr.Div div = (Expr.Div) exp;
      final Expr.@Nullable Exp positiveDiv = ExprWriter.positive(div);
      if (positiveDiv != null) {
        list.add(node.literal("-"));
        write(list, positiveDiv);
        return;
      }
      list.add(
          node.fraction(writeAll(div.numerator), writeAll(div.denominator)));
      return;

    case PERM:
      final Expr.Perm perm = (Expr.Perm) exp;
      list.add(node.permutation(writeAll(perm.n), writeAll(perm.r)));
      return;

    case COMB:
      final Expr.Comb comb = (Expr.Comb) exp;
      list.add(node.combination(writeAll(comb.n), writeAll(comb.r)));
      return;

    default:
      throw new AssertionError("unknown op " + exp.op);
    }
  }

  private void writeProduct(List<MathNode> list, Expr.Product product) {
    final Expr.@Nullable Exp positive = ExprWriter.positive(product);
    if (positive != null) {
      list.add(node.literal("-"));
      if (positive instanceof Expr.Product) {
        writeFactors(list, ((Expr.Product) positive).factors);
      } else if (positive instanceof Expr.Sum) {
        list.add(node.parenthesis(writeAll(positive)));
      } else {
        write(list, positive);
      }
      return;
    }
    writeFactors(list, product.factors);
  }

  private void writeFactors(List<MathNode> list, List<Expr.Exp> factors) {
    for (int i = 0; i < factors.size(); i++) {
      final Expr.Exp factor = factors.get(i);
      if (i > 0 && needsSign(factors.get(i - 1), factor)) {
        list.add(node.literal("·"));
      }
      if (factor instanceof Expr.Sum) {
        list.add(node.parenthesis(writeAll(factor)));
      } else {
        write(list, factor);
      }
    }
  }

  /** Returns the nodes for the base of a power, in parentheses if the base
   * is not a single operand. */
  private List<MathNode> operand(Expr.Exp exp) {
    switch (exp.op) {
    case SUM:
    case PRODUCT:
    case POWER:
    case DIV:
    case FRACTION:
      return node.list(node.parenthesis(writeAll(exp)));
    case INTEGER:
      if (((Expr.Int) exp).value.signum() < 0) {
        return node.list(node.parenthesis(writeAll(exp)));
      }
      // fall through
    default:
      return writeAll(exp);
    }
  }

  /** Returns whether a multiplication sign is needed between two adjacent
   * factors of a product. */
  private static boolean needsSign(Expr.Exp previous, Expr.Exp factor) {
    if (isCall(previous) && isCall(factor)) {
      return true;
    }
    final String s = factor.toString();
    if (!s.isEmpty() && Character.isDigit(s.charAt(0))) {
      return true;
    }
    // "c0·x" rather than "c0x"
    return previous instanceof Expr.Variable
        && Character.isDigit(lastChar(((Expr.Variable) previous).name));
  }

  /** Returns whether an expression is written like a function call. */
  private static boolean isCall(Expr.Exp exp) {
    switch (exp.op) {
    case TRIG:
    case LOG:
    case ABS:
    case PERM:
    case COMB:
      return true;
    default:
      return false;
    }
  }

  private static char lastChar(String s) {
    return s.charAt(s.length() - 1);
  }

  private MathNode number(BigInteger value) {
    return node.literal(formatter.formatEmbedded(value));
  }

  private static void writeFraction(List<MathNode> list, Expr.Frac frac,
      Function<BigInteger, String> format) {
    if (frac.numerator.signum() < 0) {
      list.add(node.literal("-"));
    }
    list.add(
        node.fraction(
            node.list(node.literal(format.apply(frac.numerator.abs()))),
            node.list(node.literal(format.apply(frac.denominator)))));
  }

  /** Merges adjacent literals; "2", "x" becomes "2x". */
  public static ImmutableList<MathNode> merge(List<MathNode> list) {
    final ImmutableList.Builder<MathNode> b = ImmutableList.builder();
    @Nullable StringBuilder text = null;
    for (MathNode n : list) {
      if (n instanceof Nodes.Literal) {
        if (text == null) {
          text = new StringBuilder();
        }
        text.append(((Nodes.Literal) n).text);
      } else {
        if (text != null) {
          b.add(node.literal(text.toString()));
          text = null;
        }
        b.add(n);
      }
    }
    if (text != null) {
      b.add(node.literal(text.toString()));
    }
    return b.build();
  }
}

// End NodeWriter.java
