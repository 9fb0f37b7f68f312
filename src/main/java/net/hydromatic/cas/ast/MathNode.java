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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;

/**
 * Node of the structural tree produced by an expression editor.
 *
 * <p>Each node owns lists of child nodes rather than raw text; for example,
 * a fraction has a list of nodes for its numerator and another for its
 * denominator. Sub-classes are in {@link Nodes}.
 */
public abstract class MathNode {
  public final Op op;

  MathNode(Op op) {
    checkArgument(op.isNode(), "not a node op: %s", op);
    this.op = op;
  }

  /** Returns the lists of child nodes. */
  public abstract List<List<MathNode>> children();

  /** Appends a description of this node. */
  abstract StringBuilder describe(StringBuilder b);

  /** Appends a description of a list of nodes. */
  static StringBuilder describe(StringBuilder b, List<MathNode> nodes) {
    nodes.forEach(node -> node.describe(b));
    return b;
  }

  /** Returns a description of a list of nodes; for example,
   * "2frac(1, x)". */
  public static String describe(List<? extends MathNode> nodes) {
    final StringBuilder b = new StringBuilder();
    nodes.forEach(node -> node.describe(b));
    return b.toString();
  }

  @Override public String toString() {
    return describe(new StringBuilder()).toString();
  }
}

// End MathNode.java
