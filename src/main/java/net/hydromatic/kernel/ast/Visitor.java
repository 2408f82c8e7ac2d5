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

/** Visits expression trees. */
public class Visitor {

  /** For use as a method reference. */
  protected void accept(Expr.Exp e) {
    e.accept(this);
  }

  // leaves

  protected void visit(Expr.Var var) {}

  protected void visit(Expr.Literal literal) {}

  // arithmetic

  protected void visit(Expr.Sum sum) {
    sum.args.forEach(this::accept);
  }

  protected void visit(Expr.Product product) {
    product.args.forEach(this::accept);
  }

  protected void visit(Expr.Quotient quotient) {
    quotient.numerator.accept(this);
    quotient.denominator.accept(this);
  }

  protected void visit(Expr.Power power) {
    power.base.accept(this);
    power.exponent.accept(this);
  }

  // postfix

  protected void visit(Expr.Call call) {
    call.args.forEach(this::accept);
  }

  protected void visit(Expr.Lookup lookup) {
    lookup.aggregate.accept(this);
  }

  protected void visit(Expr.Subscript subscript) {
    subscript.aggregate.accept(this);
    subscript.index.accept(this);
  }

  // wrappers

  protected void visit(Expr.Cse cse) {
    cse.exp.accept(this);
  }

  protected void visit(Expr.Derivative derivative) {
    derivative.call.accept(this);
    derivative.point.accept(this);
  }
}

// End Visitor.java
