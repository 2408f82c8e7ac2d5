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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.stream.Collectors;

/** Signature of a function that generated code may call. */
public class FnType {
  public final String name;
  public final Type resultType;
  public final ImmutableList<Type> paramTypes;

  FnType(String name, Type resultType, List<? extends Type> paramTypes) {
    this.name = requireNonNull(name);
    this.resultType = requireNonNull(resultType);
    this.paramTypes = ImmutableList.copyOf(paramTypes);
  }

  @Override
  public int hashCode() {
    return name.hashCode() * 31 + paramTypes.hashCode();
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof FnType
            && ((FnType) o).name.equals(name)
            && ((FnType) o).resultType.equals(resultType)
            && ((FnType) o).paramTypes.equals(paramTypes);
  }

  @Override
  public String toString() {
    return paramTypes.stream()
        .map(Type::moniker)
        .collect(Collectors.joining(", ", name + "(", ") -> "))
        + resultType.moniker();
  }
}

// End FnType.java
