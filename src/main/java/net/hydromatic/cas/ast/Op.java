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
package net.hydromatic.cas.ast;

/** Sub-types of {@link Expr.Exp} and {@link MathNode}. */
public enum Op {
  // expressions
  INTEGER(true),
  FRACTION("/", 7),
  CONSTANT(true),
  VARIABLE(true),
  SUM(" + ", 6),
  PRODUCT("*", 7),
  POWER("^", 9, false),
  ROOT("√", 8, false),
  LOG(true),
  TRIG(true),
  ABS(true),
  DIV("/", 7),
  PERM(true),
  COMB(true),

  /** Unary minus. Never the op of an expression; used when unparsing
   * negative numbers and products with a negative coefficient. */
  NEGATE("-", 7, false),

  // editor nodes
  LITERAL_NODE,
  FRACTION_NODE,
  EXPONENT_NODE,
  PARENTHESIS_NODE,
  TRIG_NODE,
  ROOT_NODE,
  LOG_NODE,
  PERMUTATION_NODE,
  COMBINATION_NODE,
  DERIVATIVE_NODE,
  INTEGRAL_NODE,
  SUMMATION_NODE,
  PRODUCT_NODE,
  ANS_NODE,
  CONSTANT_NODE,
  NEWLINE_NODE;

  /** Padded name, e.g. " + ". */
  public final String padded;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  Op() {
    this(null, 0, 0);
  }

  Op(boolean atom) {
    this("", 99);
    assert atom;
  }

  Op(String padded, int leftPrecedence) {
    this(padded, leftPrecedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }

  /** Returns whether this op is the op of an editor node. */
  public boolean isNode() {
    return name().endsWith("_NODE");
  }
}

// End Op.java
