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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;

/**
 * Composite type with named fields, such as the pair of values returned by a
 * function that evaluates two orders of a special function at once.
 */
public class StructType implements Type {
  public final String name;

  /** Fields, in declaration order. */
  public final ImmutableMap<String, NumericType> fields;

  StructType(String name, Map<String, NumericType> fields) {
    this.name = requireNonNull(name);
    this.fields = ImmutableMap.copyOf(fields);
    checkArgument(!this.fields.isEmpty(), "struct %s has no fields", name);
  }

  /** Returns the type of a field, or throws if there is no such field. */
  public NumericType fieldType(String field) {
    final NumericType type = fields.get(field);
    if (type == null) {
      throw new IllegalArgumentException(
          "struct " + name + " has no field " + field);
    }
    return type;
  }

  /** Returns a C declaration of this struct, as a typedef. */
  public String declaration() {
    final StringBuilder b = new StringBuilder("typedef struct ")
        .append(name)
        .append("_str\n{\n");
    fields.forEach((field, type) ->
        b.append("    ").append(type.cName()).append(' ').append(field)
            .append(";\n"));
    return b.append("} ").append(name).append(";\n").toString();
  }

  @Override
  public String cName() {
    return name;
  }

  @Override
  public String moniker() {
    return name;
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + fields.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof StructType
            && ((StructType) o).name.equals(name)
            && ((StructType) o).fields.equals(fields);
  }

  @Override
  public String toString() {
    return name + fields;
  }
}

// End StructType.java
