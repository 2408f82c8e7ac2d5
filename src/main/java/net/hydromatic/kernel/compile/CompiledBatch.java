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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.kernel.ast.Expr;
import net.hydromatic.kernel.type.TypeSystem;

/** Result of compiling a batch of assignments. */
public class CompiledBatch {
  /** Instructions, one per assignment, in the order of the assignments. */
  public final ImmutableList<Instruction> instructions;

  /** Types and function signatures used by the instructions. */
  public final TypeSystem typeSystem;

  /** Top order of Bessel J gathered for each argument. */
  public final ImmutableMap<Expr.Exp, Integer> besselOrders;

  /** Source fragments that must precede the generated code. */
  public final ImmutableList<String> preambles;

  CompiledBatch(ImmutableList<Instruction> instructions,
      TypeSystem typeSystem, ImmutableMap<Expr.Exp, Integer> besselOrders,
      ImmutableList<String> preambles) {
    this.instructions = requireNonNull(instructions);
    this.typeSystem = requireNonNull(typeSystem);
    this.besselOrders = requireNonNull(besselOrders);
    this.preambles = requireNonNull(preambles);
  }

  /** Returns the instruction for a given assignee, or throws. */
  public Instruction instruction(String assignee) {
    for (Instruction instruction : instructions) {
      if (instruction.assignee.equals(assignee)) {
        return instruction;
      }
    }
    throw new IllegalArgumentException("no instruction for " + assignee);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    for (Instruction instruction : instructions) {
      b.append(instruction).append('\n');
    }
    return b.toString();
  }
}

// End CompiledBatch.java
