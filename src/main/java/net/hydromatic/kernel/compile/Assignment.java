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

/** Assignment of an expression to a named temporary. */
public class Assignment {
  public final String name;
  public final Expr.Exp exp;

  public Assignment(String name, Expr.Exp exp) {
    this.name = requireNonNull(name);
    this.exp = requireNonNull(exp);
  }

  /** Returns a copy of this assignment with a different expression. */
  public Assignment withExp(Expr.Exp exp) {
    return exp.equals(this.exp) ? this : new Assignment(name, exp);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, exp);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Assignment
            && ((Assignment) o).name.equals(name)
            && ((Assignment) o).exp.equals(exp);
  }

  @Override
  public String toString() {
    return name + " = " + exp;
  }
}

// End Assignment.java
