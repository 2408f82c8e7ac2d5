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

import java.util.Objects;
import net.hydromatic.kernel.ast.Expr;

/**
 * Instruction for the loop-nest code generator: assign an expression to a
 * temporary.
 */
public class Instruction {
  public final String assignee;
  public final Expr.Exp expression;
  public final StorageType storageType;

  Instruction(String assignee, Expr.Exp expression, StorageType storageType) {
    this.assignee = requireNonNull(assignee);
    this.expression = requireNonNull(expression);
    this.storageType = requireNonNull(storageType);
  }

  @Override
  public int hashCode() {
    return Objects.hash(assignee, expression, storageType);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Instruction
            && ((Instruction) o).assignee.equals(assignee)
            && ((Instruction) o).expression.equals(expression)
            && ((Instruction) o).storageType == storageType;
  }

  @Override
  public String toString() {
    return assignee + " <- " + expression;
  }

  /** How the code generator chooses the type of the assignee. */
  public enum StorageType {
    /** The code generator infers the type from the expression. */
    INFER
  }
}

// End Instruction.java
