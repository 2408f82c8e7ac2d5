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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.kernel.ast.Expr;
import net.hydromatic.kernel.ast.Visitor;

/**
 * Walks expression trees to find, for each argument, the highest order of
 * Bessel J that is requested, so that all lower orders can be computed by the
 * (stable) downward recurrence.
 *
 * <p>Must see every assignment of a batch before any substitution starts,
 * because assignments that share an argument share its top order.
 *
 * <p>Arguments are keyed by structural identity, without algebraic
 * canonicalization; "2 * x" and "x * 2" are different arguments.
 */
class BesselOrderGatherer extends Visitor {
  private final Map<Expr.Exp, Integer> topOrders = new LinkedHashMap<>();

  /** Returns the top order for each argument seen so far. */
  ImmutableMap<Expr.Exp, Integer> topOrders() {
    return ImmutableMap.copyOf(topOrders);
  }

  @Override
  protected void visit(Expr.Call call) {
    if (call.isCallTo(BuiltIn.BESSEL_J)) {
      final int order = BesselSubstitutor.intOrder(call);
      final Expr.Exp arg = call.arg(1);
      arg.accept(this);
      topOrders.merge(arg, Math.abs(order), Math::max);
    } else {
      super.visit(call);
    }
  }
}

// End BesselOrderGatherer.java
