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
package net.hydromatic.kernel.ast;

import java.util.List;

/** Context for writing an expression out as a string. */
public class ExprWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public ExprWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an expression in a given precedence context. */
  public ExprWriter append(Expr.Exp exp, int left, int right) {
    return exp.unparse(this, left, right);
  }

  /** Appends a call to a binary infix operator. */
  public ExprWriter infix(
      int left, Expr.Exp a0, Op op, Expr.Exp a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    a0.unparse(this, left, op.left);
    append(op.padded);
    a1.unparse(this, op.right, right);
    return this;
  }

  /** Appends a call to an n-ary infix operator, such as "a + b + c". */
  public ExprWriter nary(
      int left, Op op, List<? extends Expr.Exp> args, int right) {
    if (args.size() > 1 && (left > op.left || op.right < right)) {
      return append("(").nary(0, op, args, 0).append(")");
    }
    for (int i = 0; i < args.size(); i++) {
      if (i > 0) {
        append(op.padded);
      }
      args.get(i)
          .unparse(
              this,
              i == 0 ? left : op.right,
              i == args.size() - 1 ? right : op.left);
    }
    return this;
  }

  /** Appends the operand of a postfix operator such as "." or "[]". */
  public ExprWriter postfix(Expr.Exp aggregate) {
    if (aggregate.op.left < Op.CALL.left) {
      return append("(").append(aggregate, 0, 0).append(")");
    }
    return append(aggregate, 0, Op.CALL.left);
  }

  @Override
  public String toString() {
    return b.toString();
  }
}

// End ExprWriter.java
