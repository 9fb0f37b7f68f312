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

import net.hydromatic.cas.ast.Expr;

/**
 * Generates integration constants.
 *
 * <p>Constants are named "c0", "c1", and so forth. Create one generator per
 * top-level evaluation, so that numbering restarts at "c0" each time.
 */
public class ConstantGenerator {
  private int id = 0;

  /** Generates a constant that is unique in this evaluation. */
  public Expr.Variable next() {
    return expr.variable("c" + id++);
  }
}

// End ConstantGenerator.java
