/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * Copyright 2019-2025 The TurnKey Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package tools.aqua.contracts.verification.types;

/** Why a type name cannot be modeled by the solver theories. */
public enum UnsupportedReason {
  /** {@code f32}, {@code f64}, {@code decimal} and their aliases. */
  FLOATING_POINT("floating-point types cannot be verified with bit-vector theory"),
  /** {@code object} and {@code dynamic}. */
  DYNAMIC("reference/dynamic types cannot be statically verified"),
  /** Anything shaped like a function, action or delegate type. */
  FUNCTION("function/delegate types cannot be verified"),
  /** Arrays whose elements are not integers. */
  ARRAY_ELEMENT("array elements must be integer types"),
  /** Any other name. */
  UNKNOWN(null);

  /** The explanation appended to diagnostics, or {@code null} for a generic message. */
  private final String explanation;

  UnsupportedReason(final String explanation) {
    this.explanation = explanation;
  }

  /**
   * Render the diagnostic for a type name rejected for this reason.
   *
   * @param typeName the type name as written.
   * @return a human-readable reason.
   */
  public String describe(final String typeName) {
    if (explanation == null) {
      return "Type '" + typeName + "' is not supported for verification";
    }
    return "Type '" + typeName + "' is not supported (" + explanation + ")";
  }
}
