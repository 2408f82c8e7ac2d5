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
package net.hydromatic.kernel.compile;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.kernel.ast.Expr;
import net.hydromatic.kernel.ast.Op;
import net.hydromatic.kernel.ast.Shuttle;

/**
 * Moves negated terms to the end of each sum.
 *
 * <p>A term is negated if it is a product (possibly wrapped in one common
 * sub-expression) with an odd number of negative integer literal factors.
 * The relative order of terms within each group is preserved, so the pass is
 * idempotent, and equal inputs produce equal outputs.
 */
class SumSignGrouper extends Shuttle {
  @Override
  protected Expr.Exp visit(Expr.Sum sum) {
    final List<Expr.Exp> args = visitList(sum.args);
    final List<Expr.Exp> positives = new ArrayList<>();
    final List<Expr.Exp> negatives = new ArrayList<>();
    for (Expr.Exp arg : args) {
      (isNegated(arg) ? negatives : positives).add(arg);
    }
    positives.addAll(negatives);
    return sum.copy(positives);
  }

  /** Returns whether a term is a product with an odd number of negative
   * integer factors. */
  static boolean isNegated(Expr.Exp e) {
    if (e.op == Op.CSE) {
      e = ((Expr.Cse) e).exp;
    }
    return e.op == Op.PRODUCT
        && ((Expr.Product) e).negativeIntCount() % 2 == 1;
  }
}

// End SumSignGrouper.java
