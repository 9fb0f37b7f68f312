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

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.cas.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.cas.ast.ConstantTag;
import net.hydromatic.cas.ast.Expr;
import net.hydromatic.cas.ast.MathNode;
import net.hydromatic.cas.ast.Nodes;
import net.hydromatic.cas.ast.Op;
import net.hydromatic.cas.ast.TrigFunction;
import net.hydromatic.cas.compile.ConstantGenerator;
import net.hydromatic.cas.compile.Differentiator;
import net.hydromatic.cas.compile.Enumerator;
import net.hydromatic.cas.compile.Integrator;
import net.hydromatic.cas.compile.Simplifier;
import net.hydromatic.cas.util.EvalException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts a tree of editor nodes to an expression.
 *
 * <p>Literal text is tokenized and parsed. Letters that are next to each
 * other are separate variables, multiplied; so are a number followed by a
 * letter, or a closing parenthesis followed by an opening one. A degree
 * marker "°" multiplies the preceding operand by π/180; the suffix "rad" is
 * ignored. A reference to a previous answer is replaced by its value, or,
 * if the answer is unknown, by a variable such as "ans5".
 *
 * <p>Structured nodes (fractions, roots, derivatives, integrals and so
 * forth) are converted recursively and become operands.
 *
 * <p>A converter lives for one top-level evaluation. It owns the generator
 * of integration constants, so that each evaluation starts at "c0".
 */
public class NodeConverter {
  /** Largest magnitude of a decimal exponent, as in "1E400". */
  private static final int MAX_SCALE = 10_000;

  private final ImmutableMap<Integer, Expr.Exp> ans;
  private final ImmutableMap<String, Expr.Exp> bindings;
  private final ConstantGenerator constants;
  private final int maxDepth;
  private final int loopLimit;
  private int depth;

  private NodeConverter(Map<Integer, ? extends Expr.Exp> ans,
      Map<String, ? extends Expr.Exp> bindings, ConstantGenerator constants,
      int maxDepth, int loopLimit, int depth) {
    this.ans = ImmutableMap.copyOf(ans);
    this.bindings = ImmutableMap.copyOf(bindings);
    this.constants = constants;
    this.maxDepth = maxDepth;
    this.loopLimit = loopLimit;
    this.depth = depth;
  }

  /** Creates a converter.
   *
   * @param ans Values of previous answers, by cell index
   * @param maxDepth Maximum nesting of nodes and parentheses
   * @param loopLimit Maximum number of iterations of a summation or product
   */
  public static NodeConverter create(Map<Integer, ? extends Expr.Exp> ans,
      int maxDepth, int loopLimit) {
    checkArgument(maxDepth > 0, "maxDepth must be positive");
    checkArgument(loopLimit >= 0, "loopLimit must not be negative");
    return new NodeConverter(ans, ImmutableMap.of(), new ConstantGenerator(),
        maxDepth, loopLimit, 0);
  }

  /** Returns a converter that replaces variables with values. The new
   * converter shares this converter's integration constants. */
  public NodeConverter bind(Map<String, ? extends Expr.Exp> values) {
    final Map<String, Expr.Exp> map = new HashMap<>(bindings);
    map.putAll(values);
    return new NodeConverter(ans, map, constants, maxDepth, loopLimit, depth);
  }

  /** Returns a converter that replaces a variable with a value. */
  public NodeConverter bind(String name, Expr.Exp value) {
    return bind(ImmutableMap.of(name, value));
  }

  /** Returns a converter in which a variable is free; for example, the
   * variable of a derivative. */
  private NodeConverter unbind(String name) {
    if (!bindings.containsKey(name)) {
      return this;
    }
    final Map<String, Expr.Exp> map = new HashMap<>(bindings);
    map.remove(name);
    return new NodeConverter(ans, map, constants, maxDepth, loopLimit, depth);
  }

  /** Converts a list of nodes to an expression in canonical form.
   *
   * @throws ParseException if the input is malformed
   * @throws EvalException if the input is too deeply nested, or an operator
   *   such as an integral cannot be evaluated
   */
  public Expr.Exp convert(List<? extends MathNode> nodes) {
    enter();
    try {
      final List<Token> tokens = tokenize(nodes);
      if (tokens.isEmpty()) {
        throw new ParseException("empty expression");
      }
      final Parser parser = new Parser(tokens);
      final Expr.Exp exp = parser.sum();
      if (parser.i < tokens.size()) {
        throw new ParseException("unexpected " + tokens.get(parser.i));
      }
      return Simplifier.simplify(exp);
    } finally {
      exit();
    }
  }

  private void enter() {
    if (++depth > maxDepth) {
      throw new EvalException("expression is nested too deeply");
    }
  }

  private void exit() {
    --depth;
  }

  // Tokenizer

  /** Converts nodes to tokens, inserting implicit multiplication. */
  private List<Token> tokenize(List<? extends MathNode> nodes) {
    final List<Token> raw = new ArrayList<>();
    final StringBuilder text = new StringBuilder();
    for (MathNode node : nodes) {
      if (node instanceof Nodes.Literal) {
        // Adjacent literals form one piece of text, so "1" "2" is 12
        text.append(((Nodes.Literal) node).text);
        continue;
      }
      tokenizeLiteral(raw, text.toString());
      text.setLength(0);
      if (node.op != Op.NEWLINE_NODE) {
        raw.add(Token.operand(convertNode(node)));
      }
    }
    tokenizeLiteral(raw, text.toString());

    final List<Token> tokens = new ArrayList<>();
    for (Token token : raw) {
      if (!tokens.isEmpty()
          && tokens.get(tokens.size() - 1).endsOperand()
          && token.startsOperand()) {
        tokens.add(Token.op('*'));
      }
      tokens.add(token);
    }
    return tokens;
  }

  private void tokenizeLiteral(List<Token> tokens, String s) {
    final String text = s.replace('·', '*')
        .replace('×', '*')
        .replace('−', '-')
        .replace('÷', '/');
    int i = 0;
    while (i < text.length()) {
      final char c = text.charAt(i);
      if (Character.isWhitespace(c)) {
        ++i;
        continue;
      }
      switch (c) {
      case '+':
      case '-':
      case '*':
      case '/':
      case '^':
        tokens.add(Token.op(c));
        ++i;
        continue;
      case '(':
        tokens.add(Token.LEFT);
        ++i;
        continue;
      case ')':
        tokens.add(Token.RIGHT);
        ++i;
        continue;
      case '°':
        tokens.add(Token.DEGREE);
        ++i;
        continue;
      case '=':
        throw new ParseException("unexpected '='");
      default:
        break;
      }
      if (isDigit(c) || c == '.') {
        i = number(tokens, text, i);
        continue;
      }
      if (text.startsWith("ans", i)
          && i + 3 < text.length()
          && isDigit(text.charAt(i + 3))) {
        // "ans2" is the same as an answer node with index 2
        int j = i + 3;
        while (j < text.length() && isDigit(text.charAt(j))) {
          ++j;
        }
        tokens.add(Token.operand(answer(text.substring(i + 3, j))));
        i = j;
        continue;
      }
      if (text.startsWith("rad", i)) {
        // Angles are in radians already
        i += 3;
        continue;
      }
      if (text.startsWith("pi", i)) {
        tokens.add(Token.operand(expr.constant(ConstantTag.PI)));
        i += 2;
        continue;
      }
      if (i + 1 < text.length()) {
        final @Nullable ConstantTag tag =
            ConstantTag.lookup(text.substring(i, i + 2));
        if (tag != null) {
          // Two-character constants: "ε₀", "μ₀", "c₀", "e⁻"
          tokens.add(Token.operand(expr.constant(tag)));
          i += 2;
          continue;
        }
      }
      if (c == 'e'
          && (i + 1 == text.length()
              || !Character.isLetter(text.charAt(i + 1)))) {
        tokens.add(Token.operand(expr.constant(ConstantTag.E)));
        ++i;
        continue;
      }
      if (c == 'π' || c == 'φ') {
        tokens.add(
            Token.operand(
                expr.constant(c == 'π' ? ConstantTag.PI : ConstantTag.PHI)));
        ++i;
        continue;
      }
      if (Character.isLetter(c)) {
        tokens.add(Token.operand(variable(String.valueOf(c))));
        ++i;
        continue;
      }
      throw new ParseException("unexpected character '" + c + "'");
    }
  }

  /** Reads a number such as "12", "0.5", ".5" or "1.5E-3", adds a token,
   * and returns the position after it. */
  private static int number(List<Token> tokens, String text, int start) {
    int i = start;
    while (i < text.length() && (isDigit(text.charAt(i))
        || text.charAt(i) == '.')) {
      ++i;
    }
    final StringBuilder b = new StringBuilder(text.substring(start, i));
    if (i < text.length() && "Eeᴇ".indexOf(text.charAt(i)) >= 0) {
      // Exponent, if followed by digits: "2e3" is 2000, but "2e" is 2 * e
      int j = i + 1;
      if (j < text.length() && "+-".indexOf(text.charAt(j)) >= 0) {
        ++j;
      }
      if (j < text.length() && isDigit(text.charAt(j))) {
        while (j < text.length() && isDigit(text.charAt(j))) {
          ++j;
        }
        b.append('E').append(text, i + 1, j);
        i = j;
      }
    }
    tokens.add(Token.operand(decimal(b.toString())));
    return i;
  }

  /** Converts a decimal string to an exact rational. */
  static Expr.Rational decimal(String s) {
    final BigDecimal d;
    try {
      d = new BigDecimal(s);
    } catch (NumberFormatException e) {
      throw new ParseException("invalid number '" + s + "'", e);
    }
    if (Math.abs(d.scale()) > MAX_SCALE) {
      throw new ParseException("number out of range '" + s + "'");
    }
    if (d.scale() <= 0) {
      return expr.intLiteral(
          d.unscaledValue().multiply(BigInteger.TEN.pow(-d.scale())));
    }
    return expr.rational(d.unscaledValue(), BigInteger.TEN.pow(d.scale()));
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private Expr.Exp variable(String name) {
    final Expr.Exp value = bindings.get(name);
    return value != null ? value : expr.variable(name);
  }

  // Structured nodes

  /** Converts a node other than a literal to an expression. */
  private Expr.Exp convertNode(MathNode node) {
    switch (node.op) {
    case FRACTION_NODE:
      final Nodes.Fraction fraction = (Nodes.Fraction) node;
      return expr.div(convert(fraction.numerator),
          convert(fraction.denominator));

    case EXPONENT_NODE:
      final Nodes.Exponent exponent = (Nodes.Exponent) node;
      return expr.power(convert(exponent.base), convert(exponent.power));

    case PARENTHESIS_NODE:
      return convert(((Nodes.Parenthesis) node).content);

    case TRIG_NODE:
      final Nodes.Trig trig = (Nodes.Trig) node;
      final Expr.Exp argument = convert(trig.argument);
      if (trig.function.equals("abs")) {
        return expr.abs(argument);
      }
      final @Nullable TrigFunction function =
          TrigFunction.lookup(trig.function);
      if (function == null) {
        throw new ParseException("unknown function '" + trig.function + "'");
      }
      return expr.trig(function, argument);

    case ROOT_NODE:
      final Nodes.Root root = (Nodes.Root) node;
      final Expr.Exp radicand = convert(root.radicand);
      if (root.squareRoot) {
        return expr.sqrt(radicand);
      }
      final Expr.Exp index = convert(root.index);
      if (index instanceof Expr.Int
          && ((Expr.Int) index).isSmall()
          && ((Expr.Int) index).value.intValue() >= 2) {
        return expr.root(radicand, ((Expr.Int) index).value.intValue());
      }
      // A root with any other index is a power
      return expr.power(radicand, Simplifier.divide(expr.one(), index));

    case LOG_NODE:
      final Nodes.Log log = (Nodes.Log) node;
      if (log.natural) {
        return expr.ln(convert(log.argument));
      }
      final Expr.Exp base = log.base.isEmpty()
          ? expr.intLiteral(10)
          : convert(log.base);
      return expr.log(base, convert(log.argument));

    case PERMUTATION_NODE:
    case COMBINATION_NODE:
      final Nodes.Arrangement arrangement = (Nodes.Arrangement) node;
      final Expr.Exp n = convert(arrangement.n);
      final Expr.Exp r = convert(arrangement.r);
      return node.op == Op.PERMUTATION_NODE
          ? expr.perm(n, r)
          : expr.comb(n, r);

    case DERIVATIVE_NODE:
      final Nodes.Derivative derivative = (Nodes.Derivative) node;
      final String x = variableName(derivative.variable);
      final Expr.Exp body = unbind(x).convert(derivative.body);
      if (derivative.at.isEmpty()) {
        return Differentiator.differentiate(body, x);
      }
      return Differentiator.differentiate(body, x, convert(derivative.at));

    case INTEGRAL_NODE:
      return convertIntegral((Nodes.Bounded) node);

    case SUMMATION_NODE:
    case PRODUCT_NODE:
      return convertLoop((Nodes.Bounded) node);

    case ANS_NODE:
      return answer(MathNode.describe(((Nodes.Ans) node).index).trim());

    case CONSTANT_NODE:
      final String symbol = ((Nodes.Constant) node).symbol;
      final @Nullable ConstantTag tag = ConstantTag.lookup(symbol);
      return tag != null ? expr.constant(tag) : variable(symbol);

    default:
      throw new AssertionError("unexpected node " + node.op);
    }
  }

  /** Returns the value of a previous answer, or a variable such as "ans5"
   * if there is no such answer. */
  private Expr.Exp answer(String index) {
    final int i;
    try {
      i = Integer.parseInt(index);
    } catch (NumberFormatException e) {
      throw new ParseException("invalid answer index '" + index + "'", e);
    }
    final Expr.Exp value = ans.get(i);
    return value != null ? value : expr.variable("ans" + index);
  }

  private Expr.Exp convertIntegral(Nodes.Bounded integral) {
    final String x = variableName(integral.variable);
    final Expr.Exp body = unbind(x).convert(integral.body);
    if (integral.lower.isEmpty() && integral.upper.isEmpty()) {
      return Integrator.integrate(body, x, constants);
    }
    if (integral.lower.isEmpty() || integral.upper.isEmpty()) {
      throw new ParseException("integral has only one bound");
    }
    return Integrator.integrate(body, x, convert(integral.lower),
        convert(integral.upper));
  }

  private Expr.Exp convertLoop(Nodes.Bounded loop) {
    final String i = variableName(loop.variable);
    final Expr.Exp lower = convert(loop.lower);
    final Expr.Exp upper = convert(loop.upper);
    if (loop.op == Op.SUMMATION_NODE) {
      return Enumerator.sum(lower, upper,
          k -> bind(i, expr.intLiteral(k)).convert(loop.body), loopLimit);
    }
    return Enumerator.product(lower, upper,
        k -> bind(i, expr.intLiteral(k)).convert(loop.body), loopLimit);
  }

  /** Returns the name of the variable of a derivative, integral, summation
   * or product. */
  private static String variableName(List<MathNode> nodes) {
    final String name = MathNode.describe(nodes).trim();
    if (name.isEmpty() || !name.codePoints().allMatch(Character::isLetter)) {
      throw new ParseException("invalid variable '" + name + "'");
    }
    return name;
  }

  // Parser

  /** Kind of token. */
  private enum TokenType {
    OPERAND, OP, LEFT, RIGHT, DEGREE
  }

  /** Token. An operand carries an expression; an operator carries its
   * character. */
  private static class Token {
    static final Token LEFT = new Token(TokenType.LEFT, null, '(');
    static final Token RIGHT = new Token(TokenType.RIGHT, null, ')');
    static final Token DEGREE = new Token(TokenType.DEGREE, null, '°');

    final TokenType type;
    final Expr.@Nullable Exp exp;
    final char c;

    private Token(TokenType type, Expr.@Nullable Exp exp, char c) {
      this.type = type;
      this.exp = exp;
      this.c = c;
    }

    static Token operand(Expr.Exp exp) {
      return new Token(TokenType.OPERAND, exp, ' ');
    }

    static Token op(char c) {
      return new Token(TokenType.OP, null, c);
    }

    boolean endsOperand() {
      return type == TokenType.OPERAND
          || type == TokenType.RIGHT
          || type == TokenType.DEGREE;
    }

    boolean startsOperand() {
      return type == TokenType.OPERAND || type == TokenType.LEFT;
    }

    boolean isOp(char c) {
      return type == TokenType.OP && this.c == c;
    }

    @Override public String toString() {
      return exp != null ? exp.toString() : String.valueOf(c);
    }
  }

  /** Recursive-descent parser.
   *
   * <pre>
   * sum     := product (('+' | '-') product)*
   * product := unary (('*' | '/') unary)*
   * unary   := '-' unary | '+' unary | power
   * power   := postfix ('^' unary)?
   * postfix := primary '°'*
   * primary := operand | '(' sum ')'
   * </pre>
   */
  private class Parser {
    final List<Token> tokens;
    int i = 0;

    Parser(List<Token> tokens) {
      this.tokens = tokens;
    }

    private @Nullable Token peek() {
      return i < tokens.size() ? tokens.get(i) : null;
    }

    private boolean accept(char c) {
      final @Nullable Token token = peek();
      if (token != null && token.isOp(c)) {
        ++i;
        return true;
      }
      return false;
    }

    Expr.Exp sum() {
      final List<Expr.Exp> terms = new ArrayList<>();
      terms.add(product());
      for (; ; ) {
        if (accept('+')) {
          terms.add(product());
        } else if (accept('-')) {
          terms.add(expr.negate(product()));
        } else {
          break;
        }
      }
      return terms.size() == 1 ? terms.get(0) : expr.sum(terms);
    }

    Expr.Exp product() {
      List<Expr.Exp> factors = new ArrayList<>();
      factors.add(unary());
      for (; ; ) {
        if (accept('*')) {
          factors.add(unary());
        } else if (accept('/')) {
          // "a b / c" is "(a b) / c"
          final Expr.Exp numerator = collapse(factors);
          factors = new ArrayList<>();
          factors.add(expr.div(numerator, unary()));
        } else {
          break;
        }
      }
      return collapse(factors);
    }

    private Expr.Exp collapse(List<Expr.Exp> factors) {
      return factors.size() == 1 ? factors.get(0) : expr.product(factors);
    }

    Expr.Exp unary() {
      if (accept('-')) {
        return expr.negate(unary());
      }
      if (accept('+')) {
        return unary();
      }
      return power();
    }

    Expr.Exp power() {
      final Expr.Exp base = postfix();
      if (accept('^')) {
        // Right-associative: "2^3^2" is "2^(3^2)"
        return expr.power(base, unary());
      }
      return base;
    }

    Expr.Exp postfix() {
      Expr.Exp e = primary();
      while (i < tokens.size() && tokens.get(i).type == TokenType.DEGREE) {
        ++i;
        e = expr.div(expr.product(e, expr.constant(ConstantTag.PI)),
            expr.intLiteral(180));
      }
      return e;
    }

    Expr.Exp primary() {
      final @Nullable Token token = peek();
      if (token == null) {
        throw new ParseException("unexpected end of expression");
      }
      switch (token.type) {
      case OPERAND:
        ++i;
        return requireExp(token);
      case LEFT:
        ++i;
        enter();
        try {
          final Expr.Exp e = sum();
          final @Nullable Token right = peek();
          if (right == null || right.type != TokenType.RIGHT) {
            throw new ParseException("missing ')'");
          }
          ++i;
          return e;
        } finally {
          exit();
        }
      default:
        throw new ParseException("unexpected '" + token + "'");
      }
    }

    private Expr.Exp requireExp(Token token) {
      final Expr.@Nullable Exp exp = token.exp;
      if (exp == null) {
        throw new AssertionError("operand without expression");
      }
      return exp;
    }
  }
}

// End NodeConverter.java
