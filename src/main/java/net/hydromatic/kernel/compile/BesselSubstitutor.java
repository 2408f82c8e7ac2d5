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

import static java.util.Objects.requireNonNull;

import java.math.BigInteger;
import net.hydromatic.kernel.ast.Expr;
import net.hydromatic.kernel.ast.Shuttle;

/**
 * Replaces calls to {@link BuiltIn#HANKEL_1} and {@link BuiltIn#BESSEL_J} with
 * the expressions built by a {@link BesselGetter}.
 */
class BesselSubstitutor extends Shuttle {
  private final BesselGetter besselGetter;

  BesselSubstitutor(BesselGetter besselGetter) {
    this.besselGetter = requireNonNull(besselGetter);
  }

  /**
   * Returns the order of a call to a Hankel or Bessel function.
   *
   * @throws AssertionError if the call does not have two arguments or its
   *     order is not an integer literal whose magnitude is in the range of
   *     {@code int}
   */
  static int intOrder(Expr.Call call) {
    if (call.args.size() != 2) {
      throw new AssertionError("expected (order, argument): " + call);
    }
    final Expr.Exp order = call.arg(0);
    if (!order.isInt()) {
      throw new AssertionError("order is not an integer literal: " + call);
    }
    final BigInteger i = ((Expr.Literal) order).intValue();
    // Integer.MIN_VALUE has no negation
    if (i.bitLength() >= Integer.SIZE || i.intValue() == Integer.MIN_VALUE) {
      throw new AssertionError("order out of range: " + call);
    }
    return i.intValue();
  }

  @Override
  protected Expr.Exp visit(Expr.Call call) {
    if (call.isCallTo(BuiltIn.HANKEL_1)) {
      final int order = intOrder(call);
      return besselGetter.hankel1(order, apply(call.arg(1)));
    }
    if (call.isCallTo(BuiltIn.BESSEL_J)) {
      final int order = intOrder(call);
      final Expr.Exp key = call.arg(1);
      return besselGetter.besselJ(order, key, apply(key));
    }
    return super.visit(call);
  }
}

// End BesselSubstitutor.java
