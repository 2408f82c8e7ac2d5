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

/** Sub-types of {@link Expr.Exp}. */
public enum Op {
  // identifiers
  VAR,

  // literals
  INT_LITERAL,
  REAL_LITERAL,
  COMPLEX_LITERAL,

  // arithmetic
  SUM(" + ", 10, 11),
  PRODUCT(" * ", 20, 21),
  QUOTIENT(" / ", 20, 21),
  // right-associative: "a ** b ** c" is "a ** (b ** c)"
  POWER(" ** ", 31, 30),

  // postfix
  CALL,
  LOOKUP,
  SUBSCRIPT,

  // wrappers
  CSE,
  DERIVATIVE;

  /** Operator with spaces on either side, e.g. " + "; or null. */
  public final String padded;

  /** Binding strength to the left; atoms bind tightest. */
  public final int left;

  /** Binding strength to the right. */
  public final int right;

  Op() {
    this(null, 100, 100);
  }

  Op(String padded, int left, int right) {
    this.padded = padded;
    this.left = left;
    this.right = right;
  }
}

// End Op.java
