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

import static java.util.Arrays.asList;
import static java.util.Collections.emptyList;
import static java.util.Collections.singletonList;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static tools.aqua.contracts.ast.Expressions.add;
import static tools.aqua.contracts.ast.Expressions.and;
import static tools.aqua.contracts.ast.Expressions.at;
import static tools.aqua.contracts.ast.Expressions.binary;
import static tools.aqua.contracts.ast.Expressions.call;
import static tools.aqua.contracts.ast.Expressions.eq;
import static tools.aqua.contracts.ast.Expressions.forall;
import static tools.aqua.contracts.ast.Expressions.ge;
import static tools.aqua.contracts.ast.Expressions.gt;
import static tools.aqua.contracts.ast.Expressions.implies;
import static tools.aqua.contracts.ast.Expressions.length;
import static tools.aqua.contracts.ast.Expressions.lit;
import static tools.aqua.contracts.ast.Expressions.lt;
import static tools.aqua.contracts.ast.Expressions.ne;
import static tools.aqua.contracts.ast.Expressions.ref;
import static tools.aqua.contracts.ast.Expressions.str;
import static tools.aqua.contracts.ast.Expressions.string;
import static tools.aqua.contracts.ast.Expressions.var;
import static tools.aqua.contracts.verification.VerificationOptions.DEFAULT_TIMEOUT_MS;

import com.microsoft.z3.Context;
import java.util.List;
import org.junit.jupiter.api.Test;
import tools.aqua.contracts.ast.BinaryOperator;
import tools.aqua.contracts.ast.Contract;
import tools.aqua.contracts.ast.Expression;
import tools.aqua.contracts.ast.Parameter;
import tools.aqua.contracts.ast.StringComparisonMode;
import tools.aqua.contracts.ast.StringOp;

/** Test the verification of single preconditions and postconditions. */
class ContractVerifierTest {

  private static final List<Parameter> AB =
      asList(Parameter.of("a", "i32"), Parameter.of("b", "i32"));

  /** A satisfiable precondition is proven. */
  @Test
  void testSatisfiablePrecondition() {
    try (Context ctx = new Context()) {
      final VerificationResult result =
          new ContractVerifier(ctx)
              .verifyPrecondition(
                  singletonList(Parameter.of("x", "i32")), new Contract(ge(ref("x"), lit(0))));

      assertThat(result.getStatus()).isEqualTo(VerificationStatus.PROVEN);
      assertThat(result.getCounterexample()).isEmpty();
    }
  }

  /** A contradictory precondition is disproven without a counterexample. */
  @Test
  void testUnsatisfiablePrecondition() {
    try (Context ctx = new Context()) {
      final VerificationResult result =
          new ContractVerifier(ctx)
              .verifyPrecondition(
                  singletonList(Parameter.of("x", "i32")), new Contract(ne(ref("x"), ref("x"))));

      assertThat(result.getStatus()).isEqualTo(VerificationStatus.DISPROVEN);
      assertThat(result.getMessage())
          .hasValueSatisfying(m -> assertThat(m).contains("never satisfiable"));
      assertThat(result.getCounterexample()).isEmpty();
    }
  }

  /** A postcondition broken by {@code b == 0} is disproven with a counterexample. */
  @Test
  void testDisprovenPostcondition() {
    try (Context ctx = new Context()) {
      final VerificationResult result =
          new ContractVerifier(ctx)
              .verifyPostcondition(
                  AB,
                  "i32",
                  singletonList(new Contract(ge(ref("b"), lit(0)))),
                  new Contract(gt(ref("result"), ref("a")), "result must grow"),
                  add(ref("a"), ref("b")));

      assertThat(result.getStatus()).isEqualTo(VerificationStatus.DISPROVEN);
      assertThat(result.getMessage()).contains("result must grow");
      assertThat(result.getCounterexample())
          .hasValueSatisfying(
              c -> assertThat(c).startsWith("Counterexample: a=").contains(", b=", ", result="));
    }
  }

  /** A postcondition restating the result binding is proven. */
  @Test
  void testProvenPostcondition() {
    try (Context ctx = new Context()) {
      final VerificationResult result =
          new ContractVerifier(ctx)
              .verifyPostcondition(
                  AB,
                  "i32",
                  emptyList(),
                  new Contract(eq(ref("result"), add(ref("a"), ref("b")))),
                  add(ref("a"), ref("b")));

      assertThat(result.getStatus()).isEqualTo(VerificationStatus.PROVEN);
      assertThat(result.getWarnings()).isEmpty();
    }
  }

  /** Fixed-width arithmetic wraps around, and the counterexample shows the signed value. */
  @Test
  void testOverflow() {
    try (Context ctx = new Context()) {
      final VerificationResult result =
          new ContractVerifier(ctx)
              .verifyPostcondition(
                  singletonList(Parameter.of("x", "i32")),
                  "void",
                  emptyList(),
                  new Contract(gt(add(ref("x"), lit(1)), ref("x"))));

      assertThat(result.getStatus()).isEqualTo(VerificationStatus.DISPROVEN);
      assertThat(result.getCounterexample()).contains("Counterexample: x=2147483647");
    }
  }

  /** Unsigned values compare unsigned against non-negative literals. */
  @Test
  void testUnsignedNonNegative() {
    try (Context ctx = new Context()) {
      final VerificationResult result =
          new ContractVerifier(ctx)
              .verifyPostcondition(
                  singletonList(Parameter.of("n", "u8")),
                  null,
                  emptyList(),
                  new Contract(ge(ref("n"), lit(0))));

      assertThat(result.getStatus()).isEqualTo(VerificationStatus.PROVEN);
    }
  }

  /** A floating-point parameter makes the contract unsupported. */
  @Test
  void testUnsupportedParameter() {
    try (Context ctx = new Context()) {
      final VerificationResult result =
          new ContractVerifier(ctx)
              .verifyPrecondition(
                  singletonList(Parameter.of("x", "f64")), new Contract(ge(ref("x"), lit(0))));

      assertThat(result.getStatus()).isEqualTo(VerificationStatus.UNSUPPORTED);
      assertThat(result.getMessage())
          .hasValueSatisfying(
              m ->
                  assertThat(m)
                      .startsWith("Parameter 'x' has unsupported type 'f64'")
                      .contains("floating-point"));
    }
  }

  /** An untranslatable postcondition is unsupported with a diagnostic. */
  @Test
  void testUnsupportedPostcondition() {
    try (Context ctx = new Context()) {
      final VerificationResult result =
          new ContractVerifier(ctx)
              .verifyPostcondition(
                  AB, "i32", emptyList(), new Contract(eq(ref("result"), call("max", ref("a")))));

      assertThat(result.getStatus()).isEqualTo(VerificationStatus.UNSUPPORTED);
      assertThat(result.getMessage())
          .hasValueSatisfying(
              m -> assertThat(m).startsWith("Postcondition cannot be verified: Function call"));
    }
  }

  /** Translation warnings are carried into the result. */
  @Test
  void testWarningsCarried() {
    try (Context ctx = new Context()) {
      final VerificationResult result =
          new ContractVerifier(ctx)
              .verifyPrecondition(
                  singletonList(Parameter.of("s", "string")),
                  new Contract(
                      string(
                          StringOp.STARTS_WITH,
                          StringComparisonMode.IGNORE_CASE,
                          ref("s"),
                          str("x"))));

      assertThat(result.getStatus()).isEqualTo(VerificationStatus.PROVEN);
      assertThat(result.getWarnings()).hasSize(1);
      assertThat(result.describe()).startsWith("PROVEN").contains("[warning: ");
    }
  }

  /** Quantified array properties are proven over the length companion. */
  @Test
  void testArrayQuantifier() {
    try (Context ctx = new Context()) {
      final VerificationResult result =
          new ContractVerifier(ctx)
              .verifyPostcondition(
                  singletonList(Parameter.of("arr", "i32[]")),
                  null,
                  singletonList(new Contract(gt(length(ref("arr")), lit(0)))),
                  new Contract(
                      forall(
                          var("i", "i32"),
                          implies(
                              and(ge(ref("i"), lit(0)), lt(ref("i"), length(ref("arr")))),
                              eq(at(ref("arr"), ref("i")), at(ref("arr"), ref("i")))))));

      assertThat(result.getStatus()).isEqualTo(VerificationStatus.PROVEN);
    }
  }

  /** The timeout must be positive. */
  @Test
  void testInvalidTimeout() {
    try (Context ctx = new Context()) {
      assertThatThrownBy(() -> new ContractVerifier(ctx, 0))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  /** Arrays first mentioned inside a quantifier appear in the counterexample. */
  @Test
  void testCounterexampleNamesQuantifiedArray() {
    try (Context ctx = new Context()) {
      final VerificationResult result =
          new ContractVerifier(ctx)
              .verifyPostcondition(
                  singletonList(Parameter.of("n", "i32")),
                  null,
                  emptyList(),
                  new Contract(forall(var("i", "i32"), gt(at(ref("ys"), ref("i")), ref("n")))));

      assertThat(result.getStatus()).isEqualTo(VerificationStatus.DISPROVEN);
      assertThat(result.getCounterexample())
          .hasValueSatisfying(
              counterexample ->
                  assertThat(counterexample)
                      .startsWith("Counterexample: n=")
                      .contains(", ys=")
                      .contains(", ys$length="));
    }
  }

  /**
   * Zero-extend a 32-bit unsigned operand to 64 bits by adding the 64-bit zero {@code z}.
   *
   * @param operand the operand.
   * @return the widened operand.
   */
  private static Expression widen(final Expression operand) {
    return add(ref("z"), operand);
  }

  /** A check cut short by the timeout is unproven, not disproven. */
  @Test
  void testTimeoutIsUnproven() {
    // x * y == 0xffffffea00000055, the product of the primes 4294967291 and 4294967279
    final Expression limit = binary(BinaryOperator.LEFT_SHIFT, widen(lit(1)), widen(lit(32)));
    final Expression semiprime =
        binary(
            BinaryOperator.BITWISE_OR,
            binary(BinaryOperator.LEFT_SHIFT, widen(ref("h")), widen(lit(32))),
            widen(lit(0x55)));
    final List<Contract> preconditions =
        asList(
            new Contract(eq(ref("z"), lit(0))),
            new Contract(eq(ref("h"), lit(0xffffffea))),
            new Contract(gt(ref("x"), lit(1))),
            new Contract(gt(ref("y"), lit(1))),
            new Contract(lt(ref("x"), limit)),
            new Contract(lt(ref("y"), limit)));

    try (Context ctx = new Context()) {
      final VerificationResult result =
          new ContractVerifier(ctx, 1)
              .verifyPostcondition(
                  asList(
                      Parameter.of("x", "u64"),
                      Parameter.of("y", "u64"),
                      Parameter.of("z", "u64"),
                      Parameter.of("h", "u32")),
                  null,
                  preconditions,
                  new Contract(ne(binary(BinaryOperator.MULTIPLY, ref("x"), ref("y")), semiprime)));

      assertThat(result.getStatus()).isEqualTo(VerificationStatus.UNPROVEN);
      assertThat(result.getCounterexample()).isEmpty();
      assertThat(result.getMessage())
          .hasValueSatisfying(
              message -> assertThat(message).startsWith("Solver returned unknown"));
    }
  }

  /** Solver errors are reported as unproven with the error message. */
  @Test
  void testSolverFailureIsUnproven() {
    try (Context ctx = new Context();
        Context other = new Context()) {
      final VerificationResult result =
          new ContractVerifier(ctx, DEFAULT_TIMEOUT_MS, unused -> other.mkSolver())
              .verifyPrecondition(
                  singletonList(Parameter.of("x", "i32")), new Contract(ge(ref("x"), lit(0))));

      assertThat(result.getStatus()).isEqualTo(VerificationStatus.UNPROVEN);
      assertThat(result.getMessage()).contains("Context mismatch");
    }
  }
}
