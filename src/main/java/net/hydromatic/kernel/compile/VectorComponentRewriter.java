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

import com.google.common.collect.ImmutableSet;
import java.math.BigInteger;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.hydromatic.kernel.ast.Expr;
import net.hydromatic.kernel.ast.Shuttle;

/**
 * Rewrites variables whose names are a vector name followed by digits into
 * subscripts; for example, if "r" is a vector name, {@code r0} becomes {@code
 * r[0]}.
 *
 * <p>Names whose prefix is not in the whitelist are left unchanged.
 */
class VectorComponentRewriter extends Shuttle {
  private static final Pattern INDEXED_VAR =
      Pattern.compile("^([a-zA-Z_]+)([0-9]+)$");

  private final ImmutableSet<String> vectorNames;

  VectorComponentRewriter(Set<String> vectorNames) {
    this.vectorNames = ImmutableSet.copyOf(vectorNames);
  }

  @Override
  protected Expr.Exp visit(Expr.Var var) {
    final Matcher matcher = INDEXED_VAR.matcher(var.name);
    if (matcher.matches() && vectorNames.contains(matcher.group(1))) {
      return expr.subscript(expr.var(matcher.group(1)),
          new BigInteger(matcher.group(2)));
    }
    return var;
  }
}

// End VectorComponentRewriter.java
