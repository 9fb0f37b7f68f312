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

/** Visits expression trees.
 *
 * <p>The default implementation of each method visits the children. */
public class Visitor {

  /** For use as a method reference. */
  protected void accept(Expr.Exp e) {
    e.accept(this);
  }

  // leaves

  protected void visit(Expr.Int i) {}

  protected void visit(Expr.Frac frac) {}

  protected void visit(Expr.Constant constant) {}

  protected void visit(Expr.Variable variable) {}

  // composites

  protected void visit(Expr.Sum sum) {
    sum.terms.forEach(this::accept);
  }

  protected void visit(Expr.Product product) {
    product.factors.forEach(this::accept);
  }

  protected void visit(Expr.Power power) {
    power.base.accept(this);
    power.exponent.accept(this);
  }

  protected void visit(Expr.Root root) {
    root.radicand.accept(this);
  }

  protected void visit(Expr.Log log) {
    log.base.accept(this);
    log.argument.accept(this);
  }

  protected void visit(Expr.Trig trig) {
    trig.argument.accept(this);
  }

  protected void visit(Expr.Abs abs) {
    abs.argument.accept(this);
  }

  protected void visit(Expr.Div div) {
    div.numerator.accept(this);
    div.denominator.accept(this);
  }

  protected void visit(Expr.Perm perm) {
    perm.n.accept(this);
    perm.r.accept(this);
  }

  protected void visit(Expr.Comb comb) {
    comb.n.accept(this);
    comb.r.accept(this);
  }
}

// End Visitor.java
