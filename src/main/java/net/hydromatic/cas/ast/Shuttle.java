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

import java.util.ArrayList;
import java.util.List;

/** Visits and transforms expression trees.
 *
 * <p>The default implementation of each method transforms the children,
 * and returns the same expression if no child changed. The result is not
 * simplified. */
public class Shuttle {
  protected List<Expr.Exp> visitList(List<Expr.Exp> exps) {
    final List<Expr.Exp> list = new ArrayList<>();
    for (Expr.Exp exp : exps) {
      list.add(exp.accept(this));
    }
    return list;
  }

  // leaves

  protected Expr.Exp visit(Expr.Int i) {
    return i;
  }

  protected Expr.Exp visit(Expr.Frac frac) {
    return frac;
  }

  protected Expr.Exp visit(Expr.Constant constant) {
    return constant;
  }

  protected Expr.Exp visit(Expr.Variable variable) {
    return variable;
  }

  // composites

  protected Expr.Exp visit(Expr.Sum sum) {
    return sum.copy(visitList(sum.terms));
  }

  protected Expr.Exp visit(Expr.Product product) {
    return product.copy(visitList(product.factors));
  }

  protected Expr.Exp visit(Expr.Power power) {
    return power.copy(power.base.accept(this), power.exponent.accept(this));
  }

  protected Expr.Exp visit(Expr.Root root) {
    return root.copy(root.radicand.accept(this));
  }

  protected Expr.Exp visit(Expr.Log log) {
    return log.copy(log.base.accept(this), log.argument.accept(this));
  }

  protected Expr.Exp visit(Expr.Trig trig) {
    return trig.copy(trig.argument.accept(this));
  }

  protected Expr.Exp visit(Expr.Abs abs) {
    return abs.copy(abs.argument.accept(this));
  }

  protected Expr.Exp visit(Expr.Div div) {
    return div.copy(div.numerator.accept(this),
        div.denominator.accept(this));
  }

  protected Expr.Exp visit(Expr.Perm perm) {
    return perm.copy(perm.n.accept(this), perm.r.accept(this));
  }

  protected Expr.Exp visit(Expr.Comb comb) {
    return comb.copy(comb.n.accept(this), comb.r.accept(this));
  }
}

// End Shuttle.java
