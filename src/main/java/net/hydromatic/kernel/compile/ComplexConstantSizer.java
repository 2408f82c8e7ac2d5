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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import net.hydromatic.kernel.ast.Expr;
import net.hydromatic.kernel.ast.Op;
import net.hydromatic.kernel.ast.Shuttle;
import net.hydromatic.kernel.type.NumericType;

/**
 * Gives every complex literal the same fixed width, so that literals of mixed
 * width never reach the code generator.
 *
 * <p>Integer and real literals are left unchanged.
 */
class ComplexConstantSizer extends Shuttle {
  private final NumericType width;

  ComplexConstantSizer(NumericType width) {
    this.width = requireNonNull(width);
    checkArgument(width.isComplex(), "not a complex type: %s", width);
  }

  @Override
  protected Expr.Exp visit(Expr.Literal literal) {
    if (literal.op == Op.COMPLEX_LITERAL) {
      return literal.withWidth(width);
    }
    return literal;
  }
}

// End ComplexConstantSizer.java
