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

import static net.hydromatic.kernel.type.NumericType.COMPLEX128;
import static net.hydromatic.kernel.type.NumericType.FLOAT64;
import static net.hydromatic.kernel.type.NumericType.INT32;

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import net.hydromatic.kernel.type.FnType;
import net.hydromatic.kernel.type.StructType;
import net.hydromatic.kernel.type.TypeSystem;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Functions that have special meaning to the compiler. */
public enum BuiltIn {
  /**
   * Function "hankel_1(order, z)", the Hankel function of the first kind.
   * Abstract: replaced during substitution by {@link #HANK1_01} and
   * recurrences.
   */
  HANKEL_1("hankel_1", "hankel1", null),

  /**
   * Function "bessel_j(order, z)", the Bessel function of the first kind.
   * Abstract: replaced during substitution by {@link #BESSEL_JV} and
   * recurrences.
   */
  BESSEL_J("bessel_j", "besselj", null),

  /**
   * Function "hank1_01(z)" evaluates the Hankel function of orders 0 and 1 in
   * one call, returning a struct with fields {@code order0} and {@code
   * order1}. Defined in the Bessel preamble.
   */
  HANK1_01(
      "hank1_01",
      null,
      ts -> ts.fnType("hank1_01", hank1_01ResultType(ts), COMPLEX128)),

  /**
   * Function "bessel_jv(order, x)", a generic evaluation of the Bessel
   * function of the first kind. Less precise than the recurrence; used only at
   * the two highest orders.
   */
  BESSEL_JV("bessel_jv", null, ts -> ts.fnType("bessel_jv", FLOAT64, INT32,
      FLOAT64)),

  /** Function "sqrt(x)". */
  SQRT("sqrt", "sqrt", null),

  /** Function "rsqrt(x)", the reciprocal of the square root. */
  RSQRT("rsqrt", null, null);

  /** Name of the struct type returned by {@link #HANK1_01}. */
  public static final String HANK1_01_RESULT = "hank1_01_result";

  /** Names of the fields of {@link #HANK1_01_RESULT}. */
  public static final String ORDER0 = "order0";

  public static final String ORDER1 = "order1";

  /** Name of the function in expressions and generated code. */
  public final String functionName;

  /** Name of the function in SymPy, or null if SymPy has no such function. */
  public final @Nullable String sympyName;

  /**
   * Registers this function's signature in a type system, or null if the
   * function is an abstract one or a math-library function.
   */
  private final @Nullable Function<TypeSystem, FnType> typeFunction;

  /** Map of built-ins, keyed by both function name and SymPy name. */
  private static final ImmutableMap<String, BuiltIn> BY_NAME;

  static {
    final Map<String, BuiltIn> map = new LinkedHashMap<>();
    for (BuiltIn builtIn : values()) {
      map.put(builtIn.functionName, builtIn);
      if (builtIn.sympyName != null) {
        map.putIfAbsent(builtIn.sympyName, builtIn);
      }
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  BuiltIn(
      String functionName,
      @Nullable String sympyName,
      @Nullable Function<TypeSystem, FnType> typeFunction) {
    this.functionName = functionName;
    this.sympyName = sympyName;
    this.typeFunction = typeFunction;
  }

  /** Looks up a built-in by function name or SymPy name; or returns null. */
  public static @Nullable BuiltIn lookup(String name) {
    return BY_NAME.get(name);
  }

  /**
   * Returns whether generated code that calls this function needs the Bessel
   * preamble.
   */
  public boolean needsPreamble() {
    return typeFunction != null;
  }

  /**
   * Registers this function's signature, and any types it uses, in a type
   * system; returns null if the function has no registered signature.
   */
  public @Nullable FnType register(TypeSystem typeSystem) {
    return typeFunction == null ? null : typeFunction.apply(typeSystem);
  }

  /** Registers and returns the struct type returned by {@link #HANK1_01}. */
  static StructType hank1_01ResultType(TypeSystem typeSystem) {
    return typeSystem.structType(HANK1_01_RESULT,
        ImmutableMap.of(ORDER0, COMPLEX128, ORDER1, COMPLEX128));
  }
}

// End BuiltIn.java
