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

import static net.hydromatic.cas.ast.ExprBuilder.expr;

import java.math.BigInteger;
import java.util.function.Function;
import net.hydromatic.cas.ast.Expr;
import net.hydromatic.cas.util.EvalException;

/** Evaluates bounded summations "Σ" and products "Π".
 *
 * <p>Bounds are inclusive. If either bound is not an integer, or the upper
 * bound is less than the lower bound, the result is the identity: 0 for a
 * summation, 1 for a product. */
public class Enumerator {
  private Enumerator() {}

  /** Returns the sum of {@code body(i)} for i from lower to upper. */
  public static Expr.Exp sum(Expr.Exp lower, Expr.Exp upper,
      Function<BigInteger, Expr.Exp> body, int limit) {
    return enumerate(false, lower, upper, body, limit);
  }

  /** Returns the product of {@code body(i)} for i from lower to upper. */
  public static Expr.Exp product(Expr.Exp lower, Expr.Exp upper,
      Function<BigInteger, Expr.Exp> body, int limit) {
    return enumerate(true, lower, upper, body, limit);
  }

  private static Expr.Exp enumerate(boolean product, Expr.Exp lower,
      Expr.Exp upper, Function<BigInteger, Expr.Exp> body, int limit) {
    final Expr.Exp identity = product ? expr.one() : expr.zero();
    if (!(lower instanceof Expr.Int) || !(upper instanceof Expr.Int)) {
      return identity;
    }
    final BigInteger from = ((Expr.Int) lower).value;
    final BigInteger to = ((Expr.Int) upper).value;
    if (to.compareTo(from) < 0) {
      return identity;
    }
    final BigInteger count = to.subtract(from).add(BigInteger.ONE);
    if (count.compareTo(BigInteger.valueOf(limit)) > 0) {
      throw new EvalException("too many iterations: " + count
          + " exceeds limit " + limit);
    }
    Expr.Exp result = identity;
    for (BigInteger i = from; i.compareTo(to) <= 0; i = i.add(BigInteger.ONE)) {
      final Expr.Exp value = body.apply(i);
      result = product
          ? Simplifier.multiply(result, value)
          : Simplifier.add(result, value);
    }
    return result;
  }
}

// End Enumerator.java
