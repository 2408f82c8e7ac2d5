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

import java.util.List;
import java.util.Map;
import net.hydromatic.kernel.ast.Expr;

/** Called on various events during compilation. */
public interface Tracer {
  /** Called when an assignment's expression has been converted from its
   * foreign representation. */
  void onConvert(String name, Expr.Exp exp);

  /** Called when the top orders of Bessel J have been gathered over the
   * whole batch, before substitution. */
  void onBesselOrders(Map<Expr.Exp, Integer> topOrders);

  /** Called after a phase has rewritten an assignment's expression. */
  void onPass(Phase phase, String name, Expr.Exp exp);

  /** Called with the instructions of the batch. */
  void onInstructions(List<Instruction> instructions);
}

// End Tracer.java
