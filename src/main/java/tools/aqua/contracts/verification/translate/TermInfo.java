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

package tools.aqua.contracts.verification.translate;

import static java.util.Objects.requireNonNull;

import tools.aqua.contracts.verification.types.IntegerType;

/**
 * Semantic metadata for a solver term. Z3 terms only know their sort; the signedness of a
 * bit-vector and the element type of an array live here instead.
 */
public final class TermInfo {

  /** The semantic kinds of a term. */
  public enum Kind {
    BIT_VECTOR,
    BOOL,
    STRING,
    ARRAY
  }

  private static final TermInfo BOOL = new TermInfo(Kind.BOOL, 0, false, null);
  private static final TermInfo STRING = new TermInfo(Kind.STRING, 0, false, null);

  private final Kind kind;
  private final int width;
  private final boolean signed;
  private final IntegerType elementType;

  private TermInfo(
      final Kind kind, final int width, final boolean signed, final IntegerType elementType) {
    this.kind = kind;
    this.width = width;
    this.signed = signed;
    this.elementType = elementType;
  }

  public static TermInfo bitVector(final int width, final boolean signed) {
    if (width <= 0) {
      throw new IllegalArgumentException("invalid bit-vector width " + width);
    }
    return new TermInfo(Kind.BIT_VECTOR, width, signed, null);
  }

  public static TermInfo bitVector(final IntegerType type) {
    return bitVector(type.getWidth(), type.isSigned());
  }

  public static TermInfo bool() {
    return BOOL;
  }

  public static TermInfo string() {
    return STRING;
  }

  public static TermInfo array(final IntegerType elementType) {
    return new TermInfo(Kind.ARRAY, 0, false, requireNonNull(elementType, "elementType"));
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isBitVector() {
    return kind == Kind.BIT_VECTOR;
  }

  /** @return the bit-width; {@code 0} for non-bit-vector terms. */
  public int getWidth() {
    return width;
  }

  public boolean isSigned() {
    return signed;
  }

  /** @return the array element type, or {@code null} if this is not an array. */
  public IntegerType getElementType() {
    return elementType;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) return true;
    if (!(o instanceof TermInfo)) return false;
    final TermInfo other = (TermInfo) o;
    return kind == other.kind
        && width == other.width
        && signed == other.signed
        && elementType == other.elementType;
  }

  @Override
  public int hashCode() {
    return ((kind.hashCode() * 31 + width) * 31 + (signed ? 1 : 0)) * 31
        + (elementType == null ? 0 : elementType.hashCode());
  }

  /** Renders the kind the way diagnostics name operand types, e.g. {@code u16} or {@code bool}. */
  @Override
  public String toString() {
    switch (kind) {
      case BIT_VECTOR:
        return (signed ? "i" : "u") + width;
      case ARRAY:
        return elementType.getName() + "[]";
      case BOOL:
        return "bool";
      default:
        return "string";
    }
  }
}
