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

import static net.hydromatic.kernel.ast.ExprBuilder.expr;

import com.google.common.math.LongMath;
import net.hydromatic.kernel.ast.Expr;
import net.hydromatic.kernel.ast.Shuttle;

/**
 * Replaces derivatives of Hankel and Bessel J functions by sums of functions
 * of shifted order.
 *
 * <p>Both families obey the same recurrence (Abramowitz and Stegun 9.1.31):
 *
 * <blockquote>
 * C<sub>&nu;</sub><sup>(k)</sup>(z) = 2<sup>-k</sup> &Sigma;<sub>j=0..k</sub>
 * (-1)<sup>j</sup> C(k, j) C<sub>&nu;-k+2j</sub>(z)
 * </blockquote>
 *
 * <p>Derivatives of other functions are left unchanged.
 */
class BesselDerivativeReplacer extends Shuttle {
  @Override
  protected Expr.Exp visit(Expr.Derivative derivative) {
    final Expr.Call call = derivative.call;
    if (!call.isCallTo(BuiltIn.HANKEL_1) && !call.isCallTo(BuiltIn.BESSEL_J)) {
      return super.visit(derivative);
    }
    final int order = BesselSubstitutor.intOrder(call);
    final String variable = derivative.variables.get(0);
    for (String v : derivative.variables) {
      if (!v.equals(variable)) {
        throw new AssertionError("mixed derivative: " + derivative);
      }
    }
    if (!call.arg(1).equals(expr.var(variable))) {
      throw new AssertionError("derivative with respect to " + variable
          + " of call whose argument is " + call.arg(1));
    }
    final Expr.Exp point = apply(derivative.point);
    final int k = derivative.count();
    Expr.Exp sum = expr.intLiteral(0);
    for (int j = 0; j <= k; j++) {
      final long coefficient =
          (j % 2 == 0 ? 1 : -1) * LongMath.binomial(k, j);
      final Expr.Call shifted =
          expr.call(call.name, expr.intLiteral(order - k + 2 * j), point);
      sum = expr.plus(sum, expr.times(coefficient, shifted));
    }
    final String orderString =
        order >= 0 ? Integer.toString(order) : "m" + -order;
    return expr.cse(
        expr.times(expr.realLiteral(Math.pow(2, -k)), sum),
        "d" + k + "_" + call.name + "_" + orderString);
  }
}

// End BesselDerivativeReplacer.java
