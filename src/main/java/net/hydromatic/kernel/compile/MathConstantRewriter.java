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

import com.google.common.collect.ImmutableMap;
import net.hydromatic.kernel.ast.Expr;
import net.hydromatic.kernel.ast.Shuttle;

/**
 * Renames variables that denote mathematical constants to the names that the
 * C and OpenCL math headers give them; for example, {@code pi} becomes {@code
 * M_PI}.
 */
class MathConstantRewriter extends Shuttle {
  private static final ImmutableMap<String, String> NAMES =
      ImmutableMap.of("pi", "M_PI");

  @Override
  protected Expr.Exp visit(Expr.Var var) {
    final String name = NAMES.get(var.name);
    return name == null ? var : expr.var(name);
  }
}

// End MathConstantRewriter.java
