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

/** The fixed-width machine integer types, modeled as bit-vectors. */
public enum IntegerType {
  /** Signed 8 bit. */
  I8("i8", 8, true),
  /** Signed 16 bit. */
  I16("i16", 16, true),
  /** Signed 32 bit. */
  I32("i32", 32, true),
  /** Signed 64 bit. */
  I64("i64", 64, true),
  /** Unsigned 8 bit. */
  U8("u8", 8, false),
  /** Unsigned 16 bit. */
  U16("u16", 16, false),
  /** Unsigned 32 bit. */
  U32("u32", 32, false),
  /** Unsigned 64 bit. */
  U64("u64", 64, false);

  /** The canonical type name. */
  final String name;
  /** The bit-width. */
  final int width;
  /** Whether values are interpreted in two's complement. */
  final boolean signed;

  /**
   * Construct a new enum entry.
   *
   * @param name the {@link #name}.
   * @param width the {@link #width}.
   * @param signed the {@link #signed} flag.
   */
  IntegerType(final String name, final int width, final boolean signed) {
    this.name = name;
    this.width = width;
    this.signed = signed;
  }

  public String getName() {
    return name;
  }

  public int getWidth() {
    return width;
  }

  public boolean isSigned() {
    return signed;
  }

  /**
   * Identify an integer type from a lower-case type name, accepting the short names and their
   * aliases.
   *
   * @param typeName the lower-case type name.
   * @return the integer type, or {@code null} if the name does not denote one.
   */
  static IntegerType identify(final String typeName) {
    switch (typeName) {
      case "i8":
      case "sbyte":
      case "int8":
      case "system.sbyte":
        return I8;
      case "i16":
      case "short":
      case "int16":
      case "system.int16":
        return I16;
      case "i32":
      case "int":
      case "int32":
      case "system.int32":
        return I32;
      case "i64":
      case "long":
      case "int64":
      case "system.int64":
        return I64;
      case "u8":
      case "byte":
      case "uint8":
      case "system.byte":
        return U8;
      case "u16":
      case "ushort":
      case "uint16":
      case "system.uint16":
        return U16;
      case "u32":
      case "uint":
      case "uint32":
      case "system.uint32":
        return U32;
      case "u64":
      case "ulong":
      case "uint64":
      case "system.uint64":
        return U64;
      default:
        return null;
    }
  }
}
