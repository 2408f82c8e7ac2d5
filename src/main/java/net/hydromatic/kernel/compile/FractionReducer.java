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

import java.math.BigInteger;
import net.hydromatic.kernel.ast.Expr;
import net.hydromatic.kernel.ast.Op;
import net.hydromatic.kernel.ast.Shuttle;

/**
 * Evaluates quotients of integer literals.
 *
 * <ul>
 *   <li>{@code 6 / 3} &rarr; {@code 2}
 *   <li>{@code 5 / 2} &rarr; {@code 2.5}
 * </ul>
 *
 * <p>Quotients with a zero denominator or a non-integer operand are left
 * unchanged.
 */
class FractionReducer extends Shuttle {
  @Override
  protected Expr.Exp visit(Expr.Quotient quotient) {
    final Expr.Exp e = super.visit(quotient);
    if (e.op != Op.QUOTIENT || !((Expr.Quotient) e).isRational()) {
      return e;
    }
    final Expr.Quotient q = (Expr.Quotient) e;
    final BigInteger numerator = ((Expr.Literal) q.numerator).intValue();
    final BigInteger denominator = ((Expr.Literal) q.denominator).intValue();
    if (denominator.signum() == 0) {
      return q;
    }
    final BigInteger[] qr = numerator.divideAndRemainder(denominator);
    if (qr[1].signum() == 0) {
      return expr.intLiteral(qr[0]);
    }
    return expr.realLiteral(
        numerator.doubleValue() / denominator.doubleValue());
  }
}

// End FractionReducer.java
