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
package net.hydromatic.kernel.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import net.hydromatic.kernel.compile.BuiltIn;
import net.hydromatic.kernel.type.NumericType;
import org.apache.commons.math3.complex.Complex;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds expression nodes.
 *
 * <p>The factory methods {@link #sum}, {@link #product}, {@link #quotient} and
 * {@link #power} create exactly the node you ask for. The arithmetic methods
 * {@link #plus}, {@link #minus}, {@link #times} and {@link #pow} behave like
 * operators of a computer algebra system: they drop additive zeros and
 * multiplicative ones, and flatten into an existing sum or product on the
 * left.
 */
public enum ExprBuilder {
  /**
   * The singleton instance of the expression builder. The short name is
   * convenient for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  expr;

  private final Expr.Literal zero = intLiteral_(BigInteger.ZERO);
  private final Expr.Literal one = intLiteral_(BigInteger.ONE);
  private final Expr.Literal minusOne = intLiteral_(BigInteger.ONE.negate());

  /** Used only during initialization. */
  private static Expr.Literal intLiteral_(BigInteger i) {
    return new Expr.Literal(Op.INT_LITERAL, i, null);
  }

  /** Creates a reference to a variable. */
  public Expr.Var var(String name) {
    return new Expr.Var(name);
  }

  /** Creates an integer literal. */
  public Expr.Literal intLiteral(BigInteger i) {
    if (i.equals(BigInteger.ZERO)) {
      return zero;
    }
    if (i.equals(BigInteger.ONE)) {
      return one;
    }
    return new Expr.Literal(Op.INT_LITERAL, i, null);
  }

  /** Creates an integer literal. */
  public Expr.Literal intLiteral(long i) {
    return intLiteral(BigInteger.valueOf(i));
  }

  /** Creates a floating-point literal. */
  public Expr.Literal realLiteral(double d) {
    return new Expr.Literal(Op.REAL_LITERAL, d, null);
  }

  /** Creates a complex literal whose width is not yet fixed. */
  public Expr.Literal complexLiteral(Complex c) {
    return new Expr.Literal(Op.COMPLEX_LITERAL, c, null);
  }

  /** Creates a complex literal with a given width. */
  public Expr.Literal complexLiteral(Complex c, NumericType width) {
    return new Expr.Literal(Op.COMPLEX_LITERAL, c, width);
  }

  /** Creates a complex literal from its real and imaginary parts. */
  public Expr.Literal complexLiteral(double re, double im) {
    return complexLiteral(new Complex(re, im));
  }

  /** Creates a rational number, the quotient of two integer literals. */
  public Expr.Exp rational(BigInteger p, BigInteger q) {
    checkArgument(q.signum() != 0, "zero denominator");
    return quotient(intLiteral(p), intLiteral(q));
  }

  /** Creates a call to a named function. */
  public Expr.Call call(String name, List<? extends Expr.Exp> args) {
    return new Expr.Call(name, ImmutableList.copyOf(args));
  }

  /** Creates a call to a named function. */
  public Expr.Call call(String name, Expr.Exp... args) {
    return new Expr.Call(name, ImmutableList.copyOf(args));
  }

  /** Creates a call to a built-in function. */
  public Expr.Call call(BuiltIn builtIn, Expr.Exp... args) {
    return call(builtIn.functionName, args);
  }

  /** Creates a sum with exactly the given terms. */
  public Expr.Sum sum(List<? extends Expr.Exp> args) {
    return new Expr.Sum(ImmutableList.copyOf(args));
  }

  /** Creates a sum with exactly the given terms. */
  public Expr.Sum sum(Expr.Exp... args) {
    return new Expr.Sum(ImmutableList.copyOf(args));
  }

  /** Creates a product with exactly the given factors. */
  public Expr.Product product(List<? extends Expr.Exp> args) {
    return new Expr.Product(ImmutableList.copyOf(args));
  }

  /** Creates a product with exactly the given factors. */
  public Expr.Product product(Expr.Exp... args) {
    return new Expr.Product(ImmutableList.copyOf(args));
  }

  /** Creates a quotient. */
  public Expr.Quotient quotient(Expr.Exp numerator, Expr.Exp denominator) {
    return new Expr.Quotient(numerator, denominator);
  }

  /** Creates a power. */
  public Expr.Power power(Expr.Exp base, Expr.Exp exponent) {
    return new Expr.Power(base, exponent);
  }

  /** Creates a field lookup. */
  public Expr.Lookup lookup(Expr.Exp aggregate, String field) {
    return new Expr.Lookup(aggregate, field);
  }

  /** Creates a subscript. */
  public Expr.Subscript subscript(Expr.Exp aggregate, Expr.Exp index) {
    return new Expr.Subscript(aggregate, index);
  }

  /** Creates a subscript with an integer index. */
  public Expr.Subscript subscript(Expr.Exp aggregate, BigInteger index) {
    return new Expr.Subscript(aggregate, intLiteral(index));
  }

  /** Creates a common sub-expression, even if {@code exp} is already one. */
  public Expr.Cse cse(Expr.Exp exp, @Nullable String tag) {
    return new Expr.Cse(exp, tag);
  }

  /**
   * Marks an expression as a common sub-expression, unless it is too cheap
   * to be worth it or is already marked.
   *
   * <p>Variables, subscripts and literals are returned unchanged. An existing
   * common sub-expression without a tag acquires {@code tag}; one with a tag
   * keeps it.
   */
  public Expr.Exp wrap(Expr.Exp exp, @Nullable String tag) {
    switch (exp.op) {
      case VAR:
      case SUBSCRIPT:
      case INT_LITERAL:
      case REAL_LITERAL:
      case COMPLEX_LITERAL:
        return exp;
      case CSE:
        final Expr.Cse cse = (Expr.Cse) exp;
        if (cse.tag == null && tag != null) {
          return new Expr.Cse(cse.exp, tag);
        }
        return cse;
      default:
        return new Expr.Cse(exp, tag);
    }
  }

  /** Marks an expression as an untagged common sub-expression. */
  public Expr.Exp wrap(Expr.Exp exp) {
    return wrap(exp, null);
  }

  /** Creates a derivative. */
  public Expr.Derivative derivative(
      Expr.Call call, List<String> variables, Expr.Exp point) {
    return new Expr.Derivative(call, ImmutableList.copyOf(variables), point);
  }

  /** Adds two expressions. */
  public Expr.Exp plus(Expr.Exp a0, Expr.Exp a1) {
    if (a0.equals(zero)) {
      return a1;
    }
    if (a1.equals(zero)) {
      return a0;
    }
    if (a0.op == Op.SUM) {
      final Expr.Sum sum = (Expr.Sum) a0;
      return sum(
          ImmutableList.<Expr.Exp>builder().addAll(sum.args).add(a1).build());
    }
    return sum(a0, a1);
  }

  /** Subtracts one expression from another. */
  public Expr.Exp minus(Expr.Exp a0, Expr.Exp a1) {
    return plus(a0, negate(a1));
  }

  /** Negates an expression, as "-1 * e". */
  public Expr.Exp negate(Expr.Exp e) {
    return times(minusOne, e);
  }

  /** Multiplies two expressions. */
  public Expr.Exp times(Expr.Exp a0, Expr.Exp a1) {
    if (a0.equals(one)) {
      return a1;
    }
    if (a1.equals(one)) {
      return a0;
    }
    if (a0.op == Op.PRODUCT) {
      final Expr.Product product = (Expr.Product) a0;
      return product(
          ImmutableList.<Expr.Exp>builder()
              .addAll(product.args)
              .add(a1)
              .build());
    }
    return product(a0, a1);
  }

  /** Multiplies an expression by an integer. */
  public Expr.Exp times(long i, Expr.Exp e) {
    return times(intLiteral(i), e);
  }

  /** Raises an expression to a power. */
  public Expr.Exp pow(Expr.Exp base, Expr.Exp exponent) {
    if (exponent.equals(one)) {
      return base;
    }
    return power(base, exponent);
  }

  /** Raises an expression to an integer power. */
  public Expr.Exp pow(Expr.Exp base, long exponent) {
    return pow(base, intLiteral(exponent));
  }
}

// End ExprBuilder.java
