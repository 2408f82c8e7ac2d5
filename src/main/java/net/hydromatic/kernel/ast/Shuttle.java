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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Visits and transforms expression trees.
 *
 * <p>The default implementation of each {@code visit} method rewrites the
 * node's children and returns the node itself if none of them changed.
 *
 * <p>Results are memoized by structural equality. A shuttle must therefore be
 * a pure function of the tree it is given; create a new shuttle for each
 * batch.
 */
public class Shuttle implements UnaryOperator<Expr.Exp> {
  private final Map<Expr.Exp, Expr.Exp> memo = new HashMap<>();

  /** Rewrites an expression, consulting and then updating the memo table. */
  @Override
  public Expr.Exp apply(Expr.Exp exp) {
    Expr.Exp result = memo.get(exp);
    if (result == null) {
      result = exp.accept(this);
      memo.put(exp, result);
    }
    return result;
  }

  protected List<Expr.Exp> visitList(List<Expr.Exp> nodes) {
    final List<Expr.Exp> list = new ArrayList<>(nodes.size());
    for (Expr.Exp node : nodes) {
      list.add(apply(node));
    }
    return list;
  }

  // leaves

  protected Expr.Exp visit(Expr.Var var) {
    return var;
  }

  protected Expr.Exp visit(Expr.Literal literal) {
    return literal;
  }

  // arithmetic

  protected Expr.Exp visit(Expr.Sum sum) {
    return sum.copy(visitList(sum.args));
  }

  protected Expr.Exp visit(Expr.Product product) {
    return product.copy(visitList(product.args));
  }

  protected Expr.Exp visit(Expr.Quotient quotient) {
    return quotient.copy(
        apply(quotient.numerator), apply(quotient.denominator));
  }

  protected Expr.Exp visit(Expr.Power power) {
    return power.copy(apply(power.base), apply(power.exponent));
  }

  // postfix

  protected Expr.Exp visit(Expr.Call call) {
    return call.withArgs(visitList(call.args));
  }

  protected Expr.Exp visit(Expr.Lookup lookup) {
    return lookup.copy(apply(lookup.aggregate));
  }

  protected Expr.Exp visit(Expr.Subscript subscript) {
    return subscript.copy(apply(subscript.aggregate), apply(subscript.index));
  }

  // wrappers

  protected Expr.Exp visit(Expr.Cse cse) {
    return cse.copy(apply(cse.exp));
  }

  protected Expr.Exp visit(Expr.Derivative derivative) {
    final Expr.Exp call = apply(derivative.call);
    if (!(call instanceof Expr.Call)) {
      throw new AssertionError("derivative of non-call: " + call);
    }
    return derivative.copy((Expr.Call) call, apply(derivative.point));
  }
}

// End Shuttle.java
