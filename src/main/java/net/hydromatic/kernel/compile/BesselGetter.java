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
import static net.hydromatic.kernel.ast.ExprBuilder.expr;

import java.util.HashMap;
import java.util.Map;
import net.hydromatic.kernel.ast.Expr;

/**
 * Builds numerically stable expressions for Hankel and Bessel functions of
 * integer order.
 *
 * <p>Hankel functions are computed by the forward recurrence from orders 0
 * and 1, which are evaluated together by one call to {@link
 * BuiltIn#HANK1_01}.
 *
 * <p>Bessel J functions are computed by the backward (decreasing-order)
 * recurrence, which is the stable direction for this function. For each
 * argument, the two highest orders requested anywhere in the batch are
 * evaluated directly by {@link BuiltIn#BESSEL_JV}; every lower order descends
 * from them. The highest orders come from a {@link BesselOrderGatherer}.
 *
 * <p>Results are memoized per (order, argument), so each order is built once
 * per batch and shared between assignments.
 */
class BesselGetter {
  private final Map<Expr.Exp, Integer> topOrders;

  private final Map<Expr.Exp, Expr.Exp> hank1_01Cache = new HashMap<>();
  private final Map<Expr.Exp, Map<Integer, Expr.Exp>> hankelCache =
      new HashMap<>();
  private final Map<Expr.Exp, Map<Integer, Expr.Exp>> besselJCache =
      new HashMap<>();

  /**
   * Creates a BesselGetter.
   *
   * @param topOrders Maximum absolute order of Bessel J requested for each
   *     argument, gathered over the whole batch
   */
  BesselGetter(Map<Expr.Exp, Integer> topOrders) {
    this.topOrders = requireNonNull(topOrders);
  }

  /** Returns the shared evaluation of Hankel orders 0 and 1. */
  private Expr.Exp hank1_01(Expr.Exp arg) {
    Expr.Exp e = hank1_01Cache.get(arg);
    if (e == null) {
      e = expr.cse(expr.call(BuiltIn.HANK1_01, arg), BuiltIn.HANK1_01_RESULT);
      hank1_01Cache.put(arg, e);
    }
    return e;
  }

  /** Returns an expression for the direct evaluation of Bessel J. */
  private Expr.Exp besselJImpl(int order, Expr.Exp arg) {
    return expr.call(BuiltIn.BESSEL_JV, expr.intLiteral(order), arg);
  }

  /** Returns an expression for {@code hankel_1(order, arg)}. */
  Expr.Exp hankel1(int order, Expr.Exp arg) {
    final Map<Integer, Expr.Exp> map =
        hankelCache.computeIfAbsent(arg, a -> new HashMap<>());
    Expr.Exp e = map.get(order);
    if (e == null) {
      e = hankel1_(order, arg);
      map.put(order, e);
    }
    return e;
  }

  private Expr.Exp hankel1_(int order, Expr.Exp arg) {
    if (order == 0) {
      return expr.lookup(hank1_01(arg), BuiltIn.ORDER0);
    } else if (order == 1) {
      return expr.lookup(hank1_01(arg), BuiltIn.ORDER1);
    } else if (order < 0) {
      // Reflection: H(-n, z) = (-1)^n H(n, z)
      final int nu = -order;
      return expr.wrap(
          expr.times(sign(nu), hankel1(nu, arg)), "hank1_neg" + nu);
    } else {
      // Forward recurrence: H(n, z) = 2(n-1)/z H(n-1, z) - H(n-2, z)
      final int nu = order - 1;
      return expr.cse(
          expr.minus(
              expr.times(
                  expr.quotient(expr.intLiteral(2L * nu), arg),
                  hankel1(nu, arg)),
              hankel1(nu - 1, arg)),
          "hank1_" + order);
    }
  }

  /**
   * Returns an expression for {@code bessel_j(order, arg)}.
   *
   * @throws AssertionError if {@code |order|} exceeds the top order gathered
   *     for {@code key}, or if no order was gathered for {@code key}
   */
  Expr.Exp besselJ(int order, Expr.Exp key, Expr.Exp arg) {
    final Map<Integer, Expr.Exp> map =
        besselJCache.computeIfAbsent(key, a -> new HashMap<>());
    Expr.Exp e = map.get(order);
    if (e == null) {
      e = besselJ_(order, key, arg);
      map.put(order, e);
    }
    return e;
  }

  private Expr.Exp besselJ_(int order, Expr.Exp key, Expr.Exp arg) {
    final Integer topOrder = topOrders.get(key);
    if (topOrder == null) {
      throw new AssertionError("no top order gathered for argument " + key);
    }
    if (order == topOrder || order == topOrder - 1) {
      return expr.cse(besselJImpl(order, arg), "bessel_j_" + order);
    } else if (order < 0) {
      // Reflection: J(-n, z) = (-1)^n J(n, z)
      return expr.times(sign(-order), besselJ(-order, key, arg));
    } else {
      if (order > topOrder) {
        throw new AssertionError("order " + order + " exceeds top order "
            + topOrder + " gathered for argument " + key);
      }
      // Backward recurrence: J(n, z) = 2(n+1)/z J(n+1, z) - J(n+2, z)
      final int nu = order + 1;
      return expr.cse(
          expr.minus(
              expr.times(
                  expr.quotient(expr.intLiteral(2L * nu), arg),
                  besselJ(nu, key, arg)),
              besselJ(nu + 1, key, arg)),
          "bessel_j_" + order);
    }
  }

  /** Returns (-1)^n. */
  private static long sign(int n) {
    return n % 2 == 0 ? 1 : -1;
  }
}

// End BesselGetter.java
