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

/** Steps of compilation that rewrite expressions, in the order they run. */
public enum Phase {
  /** Expands derivatives of Hankel and Bessel functions. */
  DERIVATIVES,
  /** Replaces Hankel and Bessel functions by stable recurrences. */
  SUBSTITUTION,
  /** Rewrites indexed variable names into subscripts. */
  VECTOR_COMPONENTS,
  /** Rewrites integer and half-integer powers. */
  POWERS,
  /** Evaluates quotients of integers. */
  FRACTIONS,
  /** Moves negated terms to the end of sums. */
  SIGNS,
  /** Casts complex literals to a fixed width. */
  COMPLEX_WIDTH,
  /** Renames mathematical constants. */
  MATH_CONSTANTS,
  /** Runs the caller's passes. */
  EXTRA
}

// End Phase.java
