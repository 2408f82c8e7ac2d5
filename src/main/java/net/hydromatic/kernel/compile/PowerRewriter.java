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
 * Rewrites powers with integer and half-integer exponents into
 * multiplications, reciprocals and square roots.
 *
 * <ul>
 *   <li>{@code x ** 1} &rarr; {@code x}
 *   <li>{@code x ** 4} &rarr; {@code s * s} where {@code s = x * x}
 *   <li>{@code x ** 5} &rarr; {@code (s * s) * x} where {@code s = x * x}
 *   <li>{@code x ** -2} &rarr; {@code r * r} where {@code r = 1 / x}
 *   <li>{@code x ** (3/2)} &rarr; {@code (q * q) * q} where {@code q =
 *       sqrt(x)}
 *   <li>{@code x ** (-1/2)} &rarr; {@code rsqrt(x)}
 * </ul>
 *
 * <p>Intermediate results are wrapped as common sub-expressions. Other
 * exponents, including 0, are left unchanged.
 */
class PowerRewriter extends Shuttle {
  /** Exponents beyond this magnitude are left alone. */
  private static final int MAX_BITS = 62;

  @Override
  protected Expr.Exp visit(Expr.Power power) {
    final Expr.Exp exponent = power.exponent;
    if (exponent.isInt()) {
      final BigInteger e = ((Expr.Literal) exponent).intValue();
      if (e.signum() != 0 && e.bitLength() <= MAX_BITS) {
        final Expr.Exp base = expr.wrap(apply(power.base));
        return intPower(base, e.longValue());
      }
    } else if (exponent.op == Op.QUOTIENT
        && ((Expr.Quotient) exponent).isRational()) {
      final Expr.Quotient quotient = (Expr.Quotient) exponent;
      BigInteger p = ((Expr.Literal) quotient.numerator).intValue();
      BigInteger q = ((Expr.Literal) quotient.denominator).intValue();
      if (q.signum() < 0) {
        p = p.negate();
        q = q.negate();
      }
      if (p.signum() != 0 && p.bitLength() <= MAX_BITS) {
        if (q.equals(BigInteger.ONE)) {
          final Expr.Exp base = expr.wrap(apply(power.base));
          return intPower(base, p.longValue());
        }
        if (q.equals(BigInteger.valueOf(2))) {
          final Expr.Exp base = apply(power.base);
          if (p.signum() > 0) {
            final Expr.Exp sqrt =
                expr.wrap(expr.call(BuiltIn.SQRT, expr.wrap(base)));
            return positivePower(sqrt, p.longValue());
          } else {
            final Expr.Exp rsqrt = expr.wrap(expr.call(BuiltIn.RSQRT, base));
            return positivePower(rsqrt, -p.longValue());
          }
        }
      }
    }
    return super.visit(power);
  }

  /** Raises a wrapped base to a non-zero integer power. */
  private static Expr.Exp intPower(Expr.Exp base, long e) {
    if (e < 0) {
      final Expr.Exp reciprocal =
          expr.wrap(expr.quotient(expr.intLiteral(1), base));
      return positivePower(reciprocal, -e);
    }
    return positivePower(base, e);
  }

  /** Raises a wrapped base to a positive power by repeated squaring. */
  private static Expr.Exp positivePower(Expr.Exp base, long e) {
    if (e == 1) {
      return base;
    }
    final Expr.Exp square = expr.wrap(expr.product(base, base));
    if (e % 2 == 0) {
      return expr.wrap(positivePower(square, e / 2));
    }
    return expr.times(expr.wrap(positivePower(square, (e - 1) / 2)), base);
  }
}

// End PowerRewriter.java
