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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import net.hydromatic.kernel.ast.Expr;
import net.hydromatic.kernel.type.NumericType;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Configuration of a {@link KernelCompiler}.
 *
 * <p>Immutable; each {@code with} method returns a new configuration.
 */
public class CompilerConfig {
  /** Configuration with no vector names, no extra passes, and every
   * property at its default value. */
  public static final CompilerConfig DEFAULT =
      new CompilerConfig(ImmutableSet.of(), ImmutableList.of(),
          ImmutableMap.of());

  /** Base names of variables that denote vectors. */
  public final ImmutableSet<String> vectorNames;

  /** Passes applied, in order, after the built-in passes. */
  public final ImmutableList<UnaryOperator<Expr.Exp>> extraPasses;

  private final ImmutableMap<Prop, Object> propMap;

  private CompilerConfig(ImmutableSet<String> vectorNames,
      ImmutableList<UnaryOperator<Expr.Exp>> extraPasses,
      ImmutableMap<Prop, Object> propMap) {
    this.vectorNames = vectorNames;
    this.extraPasses = extraPasses;
    this.propMap = propMap;
  }

  /** Returns a configuration with the given vector names. */
  public CompilerConfig withVectorNames(Iterable<String> vectorNames) {
    return new CompilerConfig(ImmutableSet.copyOf(vectorNames), extraPasses,
        propMap);
  }

  /** Returns a configuration with an extra pass appended. */
  public CompilerConfig withExtraPass(UnaryOperator<Expr.Exp> pass) {
    return new CompilerConfig(vectorNames,
        ImmutableList.<UnaryOperator<Expr.Exp>>builder()
            .addAll(extraPasses)
            .add(pass)
            .build(),
        propMap);
  }

  /** Returns a configuration with the given extra passes. */
  public CompilerConfig withExtraPasses(
      List<? extends UnaryOperator<Expr.Exp>> extraPasses) {
    return new CompilerConfig(vectorNames, ImmutableList.copyOf(extraPasses),
        propMap);
  }

  /** Returns a configuration with a property set to a value, or reset to
   * its default value if {@code value} is null. */
  public CompilerConfig with(Prop prop, @Nullable Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(propMap);
    prop.set(map, value);
    return withPropMap(map);
  }

  /** Returns a configuration with a property, identified by name, set to a
   * value; strings are converted to enum and boolean values. */
  public CompilerConfig withLenient(String propName, @Nullable Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(propMap);
    Prop.lookup(propName).setLenient(map, value);
    return withPropMap(map);
  }

  private CompilerConfig withPropMap(Map<Prop, Object> map) {
    final NumericType width =
        Prop.COMPLEX_WIDTH.enumValue(map, NumericType.class);
    checkArgument(width == null || width.isComplex(),
        "complexWidth must be a complex type: %s", width);
    return new CompilerConfig(vectorNames, extraPasses,
        ImmutableMap.copyOf(map));
  }

  /** Returns the value of a property. */
  public @Nullable Object get(Prop prop) {
    return prop.get(propMap);
  }

  /** Returns the width to which complex literals are cast, or null. */
  public @Nullable NumericType complexWidth() {
    return Prop.COMPLEX_WIDTH.enumValue(propMap, NumericType.class);
  }

  /** Returns whether to rename mathematical constants. */
  public boolean rewriteMathConstants() {
    return Prop.REWRITE_MATH_CONSTANTS.booleanValue(propMap);
  }
}

// End CompilerConfig.java
