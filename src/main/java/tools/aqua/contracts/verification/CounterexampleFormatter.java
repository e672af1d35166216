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

package tools.aqua.contracts.verification;

import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Model;
import com.microsoft.z3.Z3Exception;
import java.math.BigInteger;
import java.util.Collection;
import java.util.StringJoiner;
import java.util.function.Function;
import tools.aqua.contracts.verification.translate.ContractTranslator;
import tools.aqua.contracts.verification.translate.Symbol;

/**
 * Renders a model as {@code Counterexample: a=0, b=-1}. Bit-vectors print in decimal according to
 * the signedness of their symbol; other values use the solver's rendering.
 */
final class CounterexampleFormatter {

  static final String UNAVAILABLE = "Counterexample found (values unavailable)";

  private CounterexampleFormatter() {
    throw new AssertionError();
  }

  /**
   * Evaluate every declared symbol under a model. A symbol that fails to evaluate is listed as
   * failed.
   *
   * @param model the model of a satisfiable query.
   * @param translator the translator holding the declarations.
   * @return the rendered counterexample.
   */
  static String format(final Model model, final ContractTranslator translator) {
    return format(term -> model.evaluate(term, true), translator);
  }

  /**
   * Evaluate every declared symbol with an evaluator. A symbol whose evaluation throws is listed as
   * failed.
   *
   * @param evaluator maps a symbol's term to its value.
   * @param translator the translator holding the declarations.
   * @return the rendered counterexample.
   */
  static String format(
      final Function<Expr<?>, Expr<?>> evaluator, final ContractTranslator translator) {
    final Collection<Symbol> symbols = translator.getVariables().values();
    if (symbols.isEmpty()) {
      return UNAVAILABLE;
    }
    final StringJoiner values = new StringJoiner(", ", "Counterexample: ", "");
    for (final Symbol symbol : symbols) {
      values.add(symbol.getName() + "=" + evaluate(evaluator, translator, symbol));
    }
    return values.toString();
  }

  private static String evaluate(
      final Function<Expr<?>, Expr<?>> evaluator,
      final ContractTranslator translator,
      final Symbol symbol) {
    try {
      final Expr<?> value = evaluator.apply(symbol.getTerm());
      if (value instanceof BitVecNum) {
        return render(
            ((BitVecNum) value).getBigInteger(),
            ((BitVecNum) value).getSortSize(),
            translator.getInfo(symbol.getTerm()).isSigned());
      }
      return value.toString();
    } catch (final Z3Exception e) {
      return "<eval failed: " + e.getClass().getSimpleName() + ">";
    }
  }

  /**
   * Interpret the unsigned bit pattern of a bit-vector value.
   *
   * @param bits the value as an unsigned integer.
   * @param width the bit-width.
   * @param signed whether to read it as two's complement.
   * @return the decimal rendering.
   */
  static String render(final BigInteger bits, final int width, final boolean signed) {
    if (signed && bits.testBit(width - 1)) {
      return bits.subtract(BigInteger.ONE.shiftLeft(width)).toString();
    }
    return bits.toString();
  }
}
