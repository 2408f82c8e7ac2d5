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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import net.hydromatic.kernel.compile.BuiltIn;
import net.hydromatic.kernel.type.NumericType;
import org.apache.commons.math3.complex.Complex;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Kernel expressions.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short. Nodes are immutable; create them via {@link ExprBuilder}.
 *
 * <p>Every node implements structural {@link Object#equals} and {@link
 * Object#hashCode}, so that passes can use nodes as keys of memo tables.
 */
public class Expr {
  private Expr() {}

  /** Abstract base class of expression nodes. */
  public abstract static class Exp {
    public final Op op;

    /** Cached hash code; 0 means not computed yet. */
    private int hash;

    Exp(Op op) {
      this.op = requireNonNull(op);
    }

    /**
     * Converts this node into a string.
     *
     * <p>The string is deterministic and inserts parentheses only where
     * operator precedence requires them.
     */
    @Override
    public final String toString() {
      return unparse(new ExprWriter(), 0, 0).toString();
    }

    @Override
    public final int hashCode() {
      int h = hash;
      if (h == 0) {
        h = computeHash();
        hash = h == 0 ? 1 : h;
      }
      return hash;
    }

    abstract int computeHash();

    abstract ExprWriter unparse(ExprWriter w, int left, int right);

    /**
     * Accepts a shuttle, calling the {@link Shuttle#visit} method appropriate
     * to the type of this node, and returning the result.
     */
    public abstract Exp accept(Shuttle shuttle);

    /**
     * Accepts a visitor, calling the {@link Visitor#visit} method appropriate
     * to the type of this node.
     */
    public abstract void accept(Visitor visitor);

    /** Returns whether this is an integer literal. */
    public boolean isInt() {
      return op == Op.INT_LITERAL;
    }

    /** Returns whether this is an integer literal less than zero. */
    public boolean isNegativeInt() {
      return isInt() && ((Literal) this).intValue().signum() < 0;
    }
  }

  /** Reference to a variable. */
  public static class Var extends Exp {
    public final String name;

    Var(String name) {
      super(Op.VAR);
      this.name = requireNonNull(name);
      checkArgument(!name.isEmpty(), "empty name");
    }

    @Override
    int computeHash() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Var && ((Var) o).name.equals(name);
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.append(name);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Numeric literal.
   *
   * <p>The value is a {@link BigInteger} if the op is {@link Op#INT_LITERAL},
   * a {@link Double} if {@link Op#REAL_LITERAL}, a {@link Complex} if {@link
   * Op#COMPLEX_LITERAL}. A rational number is not a literal; it is a {@link
   * Quotient} of two integer literals.
   */
  public static class Literal extends Exp {
    public final Object value;

    /** Width of a complex literal, or null if not yet fixed. */
    public final @Nullable NumericType width;

    Literal(Op op, Object value, @Nullable NumericType width) {
      super(op);
      this.value = requireNonNull(value);
      this.width = width;
      switch (op) {
        case INT_LITERAL:
          checkArgument(value instanceof BigInteger);
          checkArgument(width == null);
          break;
        case REAL_LITERAL:
          checkArgument(value instanceof Double);
          checkArgument(width == null);
          break;
        case COMPLEX_LITERAL:
          checkArgument(value instanceof Complex);
          checkArgument(width == null || width.isComplex(),
              "not a complex type: %s", width);
          break;
        default:
          throw new AssertionError("not a literal: " + op);
      }
    }

    /** Returns the value of an integer literal. */
    public BigInteger intValue() {
      checkArgument(op == Op.INT_LITERAL);
      return (BigInteger) value;
    }

    /** Returns the value of this literal as a complex number. */
    public Complex complexValue() {
      switch (op) {
        case INT_LITERAL:
          return new Complex(((BigInteger) value).doubleValue());
        case REAL_LITERAL:
          return new Complex((Double) value);
        default:
          return (Complex) value;
      }
    }

    /** Returns a copy of this complex literal with a given width. */
    public Literal withWidth(NumericType width) {
      checkArgument(op == Op.COMPLEX_LITERAL);
      return width == this.width ? this : new Literal(op, value, width);
    }

    @Override
    int computeHash() {
      return Objects.hash(op, value, width);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
              && ((Literal) o).op == op
              && ((Literal) o).value.equals(value)
              && ((Literal) o).width == width;
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      switch (op) {
        case COMPLEX_LITERAL:
          final Complex c = (Complex) value;
          if (width != null) {
            w.append(width.moniker);
          }
          return w.append("(")
              .append(Double.toString(c.getReal()))
              .append(c.getImaginary() < 0 ? "-" : "+")
              .append(Double.toString(Math.abs(c.getImaginary())))
              .append("j)");
        case INT_LITERAL:
          final BigInteger i = (BigInteger) value;
          if (i.signum() < 0 && right >= Op.POWER.right) {
            // base of a power: "(-1) ** 2", not "-1 ** 2"
            return w.append("(").append(i.toString()).append(")");
          }
          return w.append(i.toString());
        default:
          final double d = (Double) value;
          if (d < 0 && right >= Op.POWER.right) {
            return w.append("(").append(Double.toString(d)).append(")");
          }
          return w.append(Double.toString(d));
      }
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Call to a named function, for example "{@code bessel_j(3, r)}". */
  public static class Call extends Exp {
    public final String name;
    public final ImmutableList<Exp> args;

    Call(String name, ImmutableList<Exp> args) {
      super(Op.CALL);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    /** Returns the {@code i}th argument. */
    public Exp arg(int i) {
      return args.get(i);
    }

    /** Returns whether this is a call to a given built-in function. */
    public boolean isCallTo(BuiltIn builtIn) {
      return name.equals(builtIn.functionName);
    }

    /** Returns a copy of this call with different arguments. */
    public Call withArgs(List<Exp> args) {
      return args.equals(this.args)
          ? this
          : new Call(name, ImmutableList.copyOf(args));
    }

    @Override
    int computeHash() {
      return Objects.hash(name, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Call
              && ((Call) o).name.equals(name)
              && ((Call) o).args.equals(args);
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      w.append(name).append("(");
      for (int i = 0; i < args.size(); i++) {
        if (i > 0) {
          w.append(", ");
        }
        w.append(args.get(i), 0, 0);
      }
      return w.append(")");
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Base class for {@link Sum} and {@link Product}. */
  public abstract static class Nary extends Exp {
    public final ImmutableList<Exp> args;

    Nary(Op op, ImmutableList<Exp> args) {
      super(op);
      this.args = requireNonNull(args);
      checkArgument(!args.isEmpty(), "empty %s", op);
    }

    /** Returns a copy of this node with different arguments. */
    public abstract Nary copy(List<Exp> args);

    @Override
    int computeHash() {
      return Objects.hash(op, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Nary
              && ((Nary) o).op == op
              && ((Nary) o).args.equals(args);
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.nary(left, op, args, right);
    }
  }

  /** Sum of one or more terms. */
  public static class Sum extends Nary {
    Sum(ImmutableList<Exp> args) {
      super(Op.SUM, args);
    }

    @Override
    public Sum copy(List<Exp> args) {
      return args.equals(this.args)
          ? this
          : new Sum(ImmutableList.copyOf(args));
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Product of one or more factors. */
  public static class Product extends Nary {
    Product(ImmutableList<Exp> args) {
      super(Op.PRODUCT, args);
    }

    @Override
    public Product copy(List<Exp> args) {
      return args.equals(this.args)
          ? this
          : new Product(ImmutableList.copyOf(args));
    }

    /** Returns the number of factors that are negative integer literals. */
    public int negativeIntCount() {
      int n = 0;
      for (Exp arg : args) {
        if (arg.isNegativeInt()) {
          ++n;
        }
      }
      return n;
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Quotient, "numerator / denominator". */
  public static class Quotient extends Exp {
    public final Exp numerator;
    public final Exp denominator;

    Quotient(Exp numerator, Exp denominator) {
      super(Op.QUOTIENT);
      this.numerator = requireNonNull(numerator);
      this.denominator = requireNonNull(denominator);
    }

    /** Returns whether both operands are integer literals. */
    public boolean isRational() {
      return numerator.isInt() && denominator.isInt();
    }

    public Quotient copy(Exp numerator, Exp denominator) {
      return numerator.equals(this.numerator)
              && denominator.equals(this.denominator)
          ? this
          : new Quotient(numerator, denominator);
    }

    @Override
    int computeHash() {
      return Objects.hash(op, numerator, denominator);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Quotient
              && ((Quotient) o).numerator.equals(numerator)
              && ((Quotient) o).denominator.equals(denominator);
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.infix(left, numerator, op, denominator, right);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Power, "base ** exponent". */
  public static class Power extends Exp {
    public final Exp base;
    public final Exp exponent;

    Power(Exp base, Exp exponent) {
      super(Op.POWER);
      this.base = requireNonNull(base);
      this.exponent = requireNonNull(exponent);
    }

    public Power copy(Exp base, Exp exponent) {
      return base.equals(this.base) && exponent.equals(this.exponent)
          ? this
          : new Power(base, exponent);
    }

    @Override
    int computeHash() {
      return Objects.hash(op, base, exponent);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Power
              && ((Power) o).base.equals(base)
              && ((Power) o).exponent.equals(exponent);
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.infix(left, base, op, exponent, right);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Access to a named field of a struct value, "aggregate.field". */
  public static class Lookup extends Exp {
    public final Exp aggregate;
    public final String field;

    Lookup(Exp aggregate, String field) {
      super(Op.LOOKUP);
      this.aggregate = requireNonNull(aggregate);
      this.field = requireNonNull(field);
    }

    public Lookup copy(Exp aggregate) {
      return aggregate.equals(this.aggregate)
          ? this
          : new Lookup(aggregate, field);
    }

    @Override
    int computeHash() {
      return Objects.hash(op, aggregate, field);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Lookup
              && ((Lookup) o).aggregate.equals(aggregate)
              && ((Lookup) o).field.equals(field);
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.postfix(aggregate).append(".").append(field);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Indexed access to a component of a vector, "aggregate[index]". */
  public static class Subscript extends Exp {
    public final Exp aggregate;
    public final Exp index;

    Subscript(Exp aggregate, Exp index) {
      super(Op.SUBSCRIPT);
      this.aggregate = requireNonNull(aggregate);
      this.index = requireNonNull(index);
    }

    public Subscript copy(Exp aggregate, Exp index) {
      return aggregate.equals(this.aggregate) && index.equals(this.index)
          ? this
          : new Subscript(aggregate, index);
    }

    @Override
    int computeHash() {
      return Objects.hash(op, aggregate, index);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Subscript
              && ((Subscript) o).aggregate.equals(aggregate)
              && ((Subscript) o).index.equals(index);
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.postfix(aggregate).append("[").append(index, 0, 0).append("]");
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Common sub-expression.
   *
   * <p>Marks a sub-tree that the code generator should evaluate once and
   * assign to a temporary. The optional tag is a human-readable prefix for the
   * temporary's name. Passes must preserve this node, never flatten it.
   */
  public static class Cse extends Exp {
    public final Exp exp;
    public final @Nullable String tag;

    Cse(Exp exp, @Nullable String tag) {
      super(Op.CSE);
      this.exp = requireNonNull(exp);
      this.tag = tag;
    }

    public Cse copy(Exp exp) {
      return exp.equals(this.exp) ? this : new Cse(exp, tag);
    }

    @Override
    int computeHash() {
      return Objects.hash(op, exp, tag);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Cse
              && ((Cse) o).exp.equals(exp)
              && Objects.equals(((Cse) o).tag, tag);
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      w.append("cse");
      if (tag != null) {
        w.append("[").append(tag).append("]");
      }
      return w.append("(").append(exp, 0, 0).append(")");
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Derivative of a call, evaluated at a point.
   *
   * <p>For example, the second derivative of {@code hankel_1(0, x)} with
   * respect to {@code x}, evaluated at {@code x = k * r}, has {@code call}
   * "hankel_1(0, x)", {@code variables} "[x, x]" and {@code point} "k * r".
   */
  public static class Derivative extends Exp {
    public final Call call;
    public final ImmutableList<String> variables;
    public final Exp point;

    Derivative(Call call, ImmutableList<String> variables, Exp point) {
      super(Op.DERIVATIVE);
      this.call = requireNonNull(call);
      this.variables = requireNonNull(variables);
      this.point = requireNonNull(point);
      checkArgument(!variables.isEmpty(), "no variables");
    }

    /** Returns the number of times the call is differentiated. */
    public int count() {
      return variables.size();
    }

    public Derivative copy(Call call, Exp point) {
      return call.equals(this.call) && point.equals(this.point)
          ? this
          : new Derivative(call, variables, point);
    }

    @Override
    int computeHash() {
      return Objects.hash(op, call, variables, point);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Derivative
              && ((Derivative) o).call.equals(call)
              && ((Derivative) o).variables.equals(variables)
              && ((Derivative) o).point.equals(point);
    }

    @Override
    ExprWriter unparse(ExprWriter w, int left, int right) {
      w.append("subs(diff(").append(call, 0, 0);
      for (String variable : variables) {
        w.append(", ").append(variable);
      }
      return w.append("), ")
          .append(variables.get(0))
          .append(", ")
          .append(point, 0, 0)
          .append(")");
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }
}

// End Expr.java
