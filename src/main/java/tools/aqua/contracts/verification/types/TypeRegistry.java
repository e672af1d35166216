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

import java.util.Locale;

/**
 * Maps type names of the contract language to the solver theory used to model them. Lookup is
 * case-insensitive and accepts the usual aliases ({@code int} for {@code i32}, {@code byte} for
 * {@code u8}, and so on). Arrays are written {@code <element>[]} and must have an integer element
 * type.
 */
public final class TypeRegistry {

  /** The suffix marking an array type name. */
  private static final String ARRAY_SUFFIX = "[]";

  /** This class should not be constructed. */
  private TypeRegistry() {
    throw new AssertionError();
  }

  /**
   * Resolve a type name.
   *
   * @param typeName the type name as written in the source.
   * @return the resolved type; never {@code null}, unsupported names resolve to an {@link
   *     ResolvedType.Kind#UNSUPPORTED} type carrying the reason.
   */
  public static ResolvedType resolve(final String typeName) {
    requireNonNull(typeName, "typeName");
    final String normalized = typeName.trim().toLowerCase(Locale.ROOT);

    if (normalized.endsWith(ARRAY_SUFFIX)) {
      final String elementName =
          normalized.substring(0, normalized.length() - ARRAY_SUFFIX.length()).trim();
      final IntegerType element = IntegerType.identify(elementName);
      if (element != null) {
        return ResolvedType.array(typeName, element);
      }
      final UnsupportedReason elementReason = classifyUnsupported(elementName);
      return ResolvedType.unsupported(
          typeName,
          elementReason == UnsupportedReason.UNKNOWN
              ? UnsupportedReason.ARRAY_ELEMENT
              : elementReason);
    }

    final IntegerType integer = IntegerType.identify(normalized);
    if (integer != null) {
      return ResolvedType.bitVector(typeName, integer);
    }
    switch (normalized) {
      case "bool":
      case "boolean":
      case "system.boolean":
        return ResolvedType.bool(typeName);
      case "string":
      case "str":
      case "system.string":
        return ResolvedType.string(typeName);
      default:
        return ResolvedType.unsupported(typeName, classifyUnsupported(normalized));
    }
  }

  /**
   * Shortcut for {@code resolve(typeName).isSupported()}.
   *
   * @param typeName the type name.
   * @return {@code true} iff the type can be declared.
   */
  public static boolean isSupported(final String typeName) {
    return resolve(typeName).isSupported();
  }

  /**
   * Describe why a type name cannot be verified.
   *
   * @param typeName the type name.
   * @return a human-readable reason naming the type.
   */
  public static String describeUnsupported(final String typeName) {
    final ResolvedType type = resolve(typeName);
    if (type.isSupported()) {
      return "Type '" + typeName + "' is supported";
    }
    return type.describeUnsupported();
  }

  /**
   * Recognize delegate types: {@code Func<...>}, {@code Action} and {@code Action<...>}, with or
   * without the {@code System.} namespace, and anything declared as a delegate.
   *
   * @param normalized the lower-case type name.
   * @return {@code true} iff the name denotes a function type.
   */
  private static boolean isFunctionShaped(final String normalized) {
    final String simple =
        normalized.startsWith("system.") ? normalized.substring("system.".length()) : normalized;
    return simple.startsWith("func<")
        || simple.equals("action")
        || simple.startsWith("action<")
        || simple.contains("delegate");
  }

  /**
   * Pick the reason for a lower-case type name that denotes no supported type.
   *
   * @param normalized the lower-case type name.
   * @return the reason.
   */
  private static UnsupportedReason classifyUnsupported(final String normalized) {
    switch (normalized) {
      case "f32":
      case "f64":
      case "float":
      case "double":
      case "single":
      case "decimal":
      case "system.single":
      case "system.double":
      case "system.decimal":
        return UnsupportedReason.FLOATING_POINT;
      case "object":
      case "dynamic":
      case "system.object":
        return UnsupportedReason.DYNAMIC;
      default:
        if (isFunctionShaped(normalized)) {
          return UnsupportedReason.FUNCTION;
        }
        return UnsupportedReason.UNKNOWN;
    }
  }
}
