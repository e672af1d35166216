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

import tools.aqua.contracts.ast.Expression;
import tools.aqua.contracts.verification.types.TypeRegistry;

/**
 * Explains why an expression cannot be translated. The explanation comes from the same lowering the
 * translator uses, run against a snapshot of the translator's bindings: arrays declared on the fly
 * and warnings emitted while diagnosing are discarded afterwards.
 */
public final class DiagnosticAnalyzer {

  private final ContractTranslator translator;

  /**
   * Create an analyzer over the bindings of a translator.
   *
   * @param translator the translator whose declarations are visible.
   */
  public DiagnosticAnalyzer(final ContractTranslator translator) {
    this.translator = requireNonNull(translator, "translator");
  }

  /**
   * Find the first construct of an expression that cannot be modeled.
   *
   * @param node the expression.
   * @return the reason, or {@code null} if the expression translates.
   */
  public String diagnose(final Expression node) {
    requireNonNull(node, "node");
    return isolated(node, false);
  }

  /**
   * Like {@link #diagnose(Expression)}, additionally reporting a non-boolean result.
   *
   * @param node the expression.
   * @return the reason, or {@code null} if the expression translates to a boolean.
   */
  public String diagnoseBool(final Expression node) {
    requireNonNull(node, "node");
    return isolated(node, true);
  }

  /**
   * Describe why a declared type is not supported.
   *
   * @param typeName the type name.
   * @return the reason, or {@code null} if the type is supported.
   */
  public String describeUnsupportedType(final String typeName) {
    return TypeRegistry.isSupported(typeName) ? null : TypeRegistry.describeUnsupported(typeName);
  }

  private String isolated(final Expression node, final boolean requireBool) {
    final SymbolTable symbols = translator.symbols();
    final int warnings = translator.warningCount();
    symbols.pushIsolatedScope();
    try {
      final Translation translation =
          requireBool
              ? translator.translateBoolOrExplain(node)
              : translator.translateOrExplain(node);
      return translation.getFailure();
    } finally {
      symbols.popScope();
      translator.discardWarningsAfter(warnings);
    }
  }
}
