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

import static java.util.Objects.requireNonNull;

/**
 * The outcome of looking up a type name in the {@link TypeRegistry}: either a verifiable type or
 * the reason it is unsupported.
 */
public final class ResolvedType {

  /** The theories a declared symbol can live in. */
  public enum Kind {
    BIT_VECTOR,
    BOOL,
    STRING,
    ARRAY,
    UNSUPPORTED
  }

  private final Kind kind;
  private final String typeName;
  /** The integer type for {@link Kind#BIT_VECTOR}, the element type for {@link Kind#ARRAY}. */
  private final IntegerType integerType;
  private final UnsupportedReason reason;

  private ResolvedType(
      final Kind kind,
      final String typeName,
      final IntegerType integerType,
      final UnsupportedReason reason) {
    this.kind = kind;
    this.typeName = typeName;
    this.integerType = integerType;
    this.reason = reason;
  }

  static ResolvedType bitVector(final String typeName, final IntegerType type) {
    return new ResolvedType(Kind.BIT_VECTOR, typeName, requireNonNull(type), null);
  }

  static ResolvedType bool(final String typeName) {
    return new ResolvedType(Kind.BOOL, typeName, null, null);
  }

  static ResolvedType string(final String typeName) {
    return new ResolvedType(Kind.STRING, typeName, null, null);
  }

  static ResolvedType array(final String typeName, final IntegerType elementType) {
    return new ResolvedType(Kind.ARRAY, typeName, requireNonNull(elementType), null);
  }

  static ResolvedType unsupported(final String typeName, final UnsupportedReason reason) {
    return new ResolvedType(Kind.UNSUPPORTED, typeName, null, requireNonNull(reason));
  }

  public Kind getKind() {
    return kind;
  }

  /** @return the type name as it was looked up. */
  public String getTypeName() {
    return typeName;
  }

  public boolean isSupported() {
    return kind != Kind.UNSUPPORTED;
  }

  /**
   * Get the integer type of a bit-vector symbol or the element type of an array.
   *
   * @return the integer type.
   * @throws IllegalStateException if this type is neither a bit-vector nor an array.
   */
  public IntegerType getIntegerType() {
    if (integerType == null) {
      throw new IllegalStateException(typeName + " has no integer representation");
    }
    return integerType;
  }

  /**
   * Get the reason this type is unsupported.
   *
   * @return the reason.
   * @throws IllegalStateException if the type is supported.
   */
  public UnsupportedReason getUnsupportedReason() {
    if (reason == null) {
      throw new IllegalStateException(typeName + " is supported");
    }
    return reason;
  }

  /** @return the diagnostic for an unsupported type. */
  public String describeUnsupported() {
    return getUnsupportedReason().describe(typeName);
  }

  @Override
  public String toString() {
    switch (kind) {
      case BIT_VECTOR:
        return integerType.getName();
      case ARRAY:
        return integerType.getName() + "[]";
      case BOOL:
        return "bool";
      case STRING:
        return "string";
      default:
        return typeName + " (unsupported)";
    }
  }
}
