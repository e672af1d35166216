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

import static org.assertj.core.api.Assertions.assertThat;
import static tools.aqua.contracts.ast.Expressions.add;
import static tools.aqua.contracts.ast.Expressions.and;
import static tools.aqua.contracts.ast.Expressions.at;
import static tools.aqua.contracts.ast.Expressions.forall;
import static tools.aqua.contracts.ast.Expressions.gt;
import static tools.aqua.contracts.ast.Expressions.ite;
import static tools.aqua.contracts.ast.Expressions.lit;
import static tools.aqua.contracts.ast.Expressions.not;
import static tools.aqua.contracts.ast.Expressions.ref;
import static tools.aqua.contracts.ast.Expressions.str;
import static tools.aqua.contracts.ast.Expressions.string;
import static tools.aqua.contracts.ast.Expressions.var;

import com.microsoft.z3.Context;
import org.junit.jupiter.api.Test;
import tools.aqua.contracts.ast.StringComparisonMode;
import tools.aqua.contracts.ast.StringOp;

/** Test the explanations of untranslatable expressions. */
class DiagnosticAnalyzerTest {

  /** An expression that translates has no diagnosis. */
  @Test
  void testTranslatableExpression() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      translator.declareVariable("x", "i32");
      assertThat(new DiagnosticAnalyzer(translator).diagnoseBool(gt(ref("x"), lit(0)))).isNull();
    }
  }

  /** The first failing sub-expression is reported, depth first. */
  @Test
  void testFirstFailureWins() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      translator.declareVariable("x", "i32");
      final DiagnosticAnalyzer analyzer = new DiagnosticAnalyzer(translator);

      assertThat(analyzer.diagnose(and(gt(ref("y"), lit(0)), gt(ref("z"), lit(0)))))
          .isEqualTo("Unknown variable 'y'");
      assertThat(analyzer.diagnose(add(lit(true), ref("x"))))
          .isEqualTo("Arithmetic operator '+' requires integer operands, but got bool and i32");
      assertThat(analyzer.diagnose(not(ref("x"))))
          .isEqualTo("Logical NOT requires a boolean operand, but got i32");
    }
  }

  /** Mismatched conditional branches are reported with both kinds. */
  @Test
  void testConditionalMismatch() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      translator.declareVariable("c", "bool");
      assertThat(new DiagnosticAnalyzer(translator).diagnose(ite(ref("c"), lit(1), str("one"))))
          .isEqualTo("Conditional branches have incompatible types: 'i32' and 'string'");
    }
  }

  /** Non-boolean conditions are reported by the boolean variant only. */
  @Test
  void testBooleanRequirement() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      final DiagnosticAnalyzer analyzer = new DiagnosticAnalyzer(translator);
      assertThat(analyzer.diagnose(lit(3))).isNull();
      assertThat(analyzer.diagnoseBool(lit(3))).contains("must be boolean");
    }
  }

  /** Diagnosing leaves no bindings or warnings behind. */
  @Test
  void testNoSideEffects() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      translator.declareVariable("s", "string");
      final DiagnosticAnalyzer analyzer = new DiagnosticAnalyzer(translator);

      assertThat(
              analyzer.diagnose(
                  forall(var("k", "i32"), gt(at(ref("ys"), ref("k")), ref("missing")))))
          .isEqualTo("Unknown variable 'missing'");
      assertThat(
              analyzer.diagnose(
                  string(StringOp.ENDS_WITH, StringComparisonMode.INVARIANT, ref("s"), lit(1))))
          .isEqualTo("String operation 'ENDS_WITH' requires a string argument, but got i32");

      assertThat(translator.lookup("k")).isNull();
      assertThat(translator.lookup("ys")).isNull();
      assertThat(translator.lookup("ys$length")).isNull();
      assertThat(translator.getWarnings()).isEmpty();
      assertThat(translator.getVariables()).containsOnlyKeys("s");
    }
  }

  /** Unsupported declared types are described with their reason. */
  @Test
  void testDescribeUnsupportedType() {
    try (Context ctx = new Context()) {
      final DiagnosticAnalyzer analyzer = new DiagnosticAnalyzer(new ContractTranslator(ctx));
      assertThat(analyzer.describeUnsupportedType("i32")).isNull();
      assertThat(analyzer.describeUnsupportedType("dynamic")).contains("dynamic");
    }
  }

  /** Arrays first seen inside a diagnosed quantifier do not outlive the diagnosis. */
  @Test
  void testNoArrayLeakFromQuantifier() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      final DiagnosticAnalyzer analyzer = new DiagnosticAnalyzer(translator);

      assertThat(
              analyzer.diagnoseBool(
                  forall(var("i", "i32"), gt(at(ref("zs"), ref("i")), lit(0)))))
          .isNull();
      assertThat(translator.getVariables()).isEmpty();
      assertThat(translator.symbols().depth()).isZero();
    }
  }
}
