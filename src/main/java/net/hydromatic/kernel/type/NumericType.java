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
package net.hydromatic.kernel.type;

import com.google.common.base.Enums;
import com.google.common.base.Optional;
import java.util.Locale;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Scalar numeric type with a fixed width.
 *
 * <p>The {@link #kind} follows the convention of array libraries: 'i' for
 * signed integers, 'f' for floating point, 'c' for complex floating point.
 */
public enum NumericType implements Type {
  INT32("int", 'i', 4),
  FLOAT32("float", 'f', 4),
  FLOAT64("double", 'f', 8),
  COMPLEX64("cfloat_t", 'c', 8),
  COMPLEX128("cdouble_t", 'c', 16);

  /** The name in the registry, e.g. {@code complex128}. */
  public final String moniker = name().toLowerCase(Locale.ROOT);

  private final String cName;

  /** One of 'i', 'f', 'c'. */
  public final char kind;

  /** Width in bytes. */
  public final int size;

  NumericType(String cName, char kind, int size) {
    this.cName = cName;
    this.kind = kind;
    this.size = size;
  }

  /** Looks up a type by moniker ("complex128") or name ("COMPLEX128"). */
  public static @Nullable NumericType lookup(String name) {
    final Optional<NumericType> optional =
        Enums.getIfPresent(NumericType.class, name.toUpperCase(Locale.ROOT));
    return optional.orNull();
  }

  /** Returns whether values of this type are complex numbers. */
  public boolean isComplex() {
    return kind == 'c';
  }

  @Override
  public String cName() {
    return cName;
  }

  @Override
  public String moniker() {
    return moniker;
  }

  @Override
  public String toString() {
    return moniker;
  }
}

// End NumericType.java
