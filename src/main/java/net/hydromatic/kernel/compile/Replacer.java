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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import net.hydromatic.kernel.ast.Expr;
import net.hydromatic.kernel.ast.Shuttle;

/** Replaces variables with expressions. */
public class Replacer extends Shuttle {
  private final ImmutableMap<String, Expr.Exp> substitution;

  private Replacer(Map<String, ? extends Expr.Exp> substitution) {
    this.substitution = ImmutableMap.copyOf(substitution);
  }

  /** Replaces each variable that is a key of {@code substitution} in an
   * expression by the corresponding value. */
  public static Expr.Exp substitute(
      Map<String, ? extends Expr.Exp> substitution, Expr.Exp exp) {
    requireNonNull(exp);
    if (substitution.isEmpty()) {
      return exp;
    }
    return new Replacer(substitution).apply(exp);
  }

  @Override
  protected Expr.Exp visit(Expr.Var var) {
    final Expr.Exp exp = substitution.get(var.name);
    return exp != null ? exp : var;
  }

  /** {@inheritDoc}
   *
   * <p>The variable of a derivative is bound inside its call; a substitution
   * for it applies only to the point of evaluation. Other variables are
   * substituted into the call as usual.
   *
   * @throws IllegalArgumentException if a bound variable is substituted in a
   *     derivative with respect to more than one distinct variable, which has
   *     no single point of evaluation
   */
  @Override
  protected Expr.Exp visit(Expr.Derivative derivative) {
    final Set<String> variables = ImmutableSet.copyOf(derivative.variables);
    if (Collections.disjoint(variables, substitution.keySet())) {
      return super.visit(derivative);
    }
    if (variables.size() > 1) {
      throw new IllegalArgumentException("cannot substitute "
          + Sets.intersection(variables, substitution.keySet())
          + " in derivative with respect to several variables: "
          + derivative);
    }
    final Map<String, Expr.Exp> free =
        Maps.filterKeys(substitution, name -> !variables.contains(name));
    final Expr.Exp call = substitute(free, derivative.call);
    if (!(call instanceof Expr.Call)) {
      throw new AssertionError("derivative of non-call: " + call);
    }
    return derivative.copy((Expr.Call) call, apply(derivative.point));
  }
}

// End Replacer.java
