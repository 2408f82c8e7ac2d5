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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A table that contains the composite types and function signatures used by
 * the code of one compilation batch.
 *
 * <p>The code generator that consumes the batch asks the table for the
 * result type of each function it sees (see {@link #mangle}). Each batch owns
 * its own table; there is no process-wide registry.
 */
public class TypeSystem {
  private final Map<String, Type> typeByName = new LinkedHashMap<>();
  private final Map<String, FnType> fnTypeByName = new LinkedHashMap<>();

  public TypeSystem() {
    for (NumericType numericType : NumericType.values()) {
      typeByName.put(numericType.moniker, numericType);
    }
  }

  /**
   * Registers a struct type, or returns the existing one of the same name.
   *
   * @throws IllegalArgumentException if a different type with the same name
   *     is already registered
   */
  public StructType structType(String name, Map<String, NumericType> fields) {
    final StructType structType = new StructType(name, fields);
    final Type existing = typeByName.putIfAbsent(name, structType);
    if (existing != null) {
      checkArgument(existing.equals(structType),
          "type %s is already registered as %s", name, existing);
      return (StructType) existing;
    }
    return structType;
  }

  /**
   * Registers the signature of a function, or returns the existing one.
   *
   * @throws IllegalArgumentException if a different signature with the same
   *     name is already registered
   */
  public FnType fnType(String name, Type resultType, Type... paramTypes) {
    final FnType fnType =
        new FnType(name, resultType, ImmutableList.copyOf(paramTypes));
    final FnType existing = fnTypeByName.putIfAbsent(name, fnType);
    if (existing != null) {
      checkArgument(existing.equals(fnType),
          "function %s is already registered as %s", name, existing);
      return existing;
    }
    return fnType;
  }

  /** Looks up a type by name; returns null if not found. */
  public @Nullable Type lookupOpt(String name) {
    return typeByName.get(name);
  }

  /** Looks up a type by name; throws if not found. */
  public Type lookup(String name) {
    final Type type = typeByName.get(name);
    if (type == null) {
      throw new IllegalArgumentException("unknown type: " + name);
    }
    return type;
  }

  /**
   * Returns the signature of a function that generated code calls, or null
   * if the function is not known to this table (in which case the code
   * generator should resolve it by other means).
   */
  public @Nullable FnType mangle(String functionName) {
    return fnTypeByName.get(functionName);
  }

  /** Returns the struct types, in the order they were registered. */
  public List<StructType> structTypes() {
    final ImmutableList.Builder<StructType> list = ImmutableList.builder();
    for (Type type : typeByName.values()) {
      if (type instanceof StructType) {
        list.add((StructType) type);
      }
    }
    return list.build();
  }

  /** Returns the registered function signatures, in registration order. */
  public List<FnType> fnTypes() {
    return ImmutableList.copyOf(fnTypeByName.values());
  }
}

// End TypeSystem.java
