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

import static java.util.Objects.requireNonNull;
import static tools.aqua.contracts.verification.VerificationOptions.DEFAULT_TIMEOUT_MS;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.aqua.contracts.ast.Expression;
import tools.aqua.contracts.ast.Parameter;
import tools.aqua.contracts.verification.types.IntegerType;

/**
 * Proves implications between contract conditions, as needed when an implementation refines an
 * interface: an implementation may only weaken preconditions and strengthen postconditions.
 */
public final class ImplicationProver {

  private static final Logger logger = LoggerFactory.getLogger(ImplicationProver.class);

  private final Context context;
  private final int timeoutMs;

  public ImplicationProver(final Context context) {
    this(context, DEFAULT_TIMEOUT_MS);
  }

  /**
   * @param context the Z3 context.
   * @param timeoutMs the timeout of each solver check in milliseconds.
   */
  public ImplicationProver(final Context context, final int timeoutMs) {
    if (timeoutMs <= 0) {
      throw new IllegalArgumentException("timeout must be positive, got " + timeoutMs);
    }
    this.context = requireNonNull(context, "context");
    this.timeoutMs = timeoutMs;
  }

  /**
   * Prove that {@code antecedent} implies {@code consequent} for all parameter values.
   *
   * @param parameters the free variables.
   * @param antecedent the assumption.
   * @param consequent the claim.
   * @return {@link VerificationStatus#PROVEN} if the implication is valid, {@link
   *     VerificationStatus#DISPROVEN} with a counterexample if not.
   */
  public VerificationResult proveImplication(
      final List<Parameter> parameters, final Expression antecedent, final Expression consequent) {
    final SolverSession session = new SolverSession(context, timeoutMs);
    if (!session.declare(requireNonNull(parameters, "parameters"))) {
      return session.unsupported();
    }
    return prove(session, antecedent, consequent);
  }

  /**
   * Check that an implementation's precondition accepts every input the interface's precondition
   * accepts.
   *
   * @param parameters the parameters.
   * @param interfacePrecondition the precondition declared by the interface.
   * @param implementerPrecondition the precondition declared by the implementation.
   * @return the result of proving {@code interfacePrecondition -> implementerPrecondition}.
   */
  public VerificationResult checkPreconditionWeakening(
      final List<Parameter> parameters,
      final Expression interfacePrecondition,
      final Expression implementerPrecondition) {
    return proveImplication(parameters, interfacePrecondition, implementerPrecondition);
  }

  /**
   * Check that an implementation's postcondition guarantees the interface's postcondition.
   *
   * @param parameters the parameters.
   * @param outputType the return type; {@code i32} is assumed if absent.
   * @param interfacePostcondition the postcondition declared by the interface.
   * @param implementerPostcondition the postcondition declared by the implementation.
   * @return the result of proving {@code implementerPostcondition -> interfacePostcondition}.
   */
  public VerificationResult checkPostconditionStrengthening(
      final List<Parameter> parameters,
      final String outputType,
      final Expression interfacePostcondition,
      final Expression implementerPostcondition) {
    final SolverSession session = new SolverSession(context, timeoutMs);
    if (!session.declare(requireNonNull(parameters, "parameters"))) {
      return session.unsupported();
    }
    final String resultType =
        ContractVerifier.hasResult(outputType) ? outputType : IntegerType.I32.getName();
    if (!session.declare(SolverSession.RESULT, resultType, "Return value")) {
      return session.unsupported();
    }
    return prove(session, implementerPostcondition, interfacePostcondition);
  }

  private VerificationResult prove(
      final SolverSession session, final Expression antecedent, final Expression consequent) {
    requireNonNull(antecedent, "antecedent");
    requireNonNull(consequent, "consequent");
    try {
      final BoolExpr assumption = session.translate(antecedent, "Antecedent");
      if (assumption == null) {
        return session.unsupported();
      }
      final BoolExpr claim = session.translate(consequent, "Consequent");
      if (claim == null) {
        return session.unsupported();
      }

      final Solver solver = session.newSolver();
      final Status status = session.check(solver, assumption, context.mkNot(claim));
      switch (status) {
        case UNSATISFIABLE:
          return VerificationResult.proven(session.warnings(), session.elapsed());
        case SATISFIABLE:
          return VerificationResult.disproven(
              session.counterexample(solver),
              "Implication does not hold",
              session.warnings(),
              session.elapsed());
        default:
          return ContractVerifier.unknown(solver, session);
      }
    } catch (final Z3Exception e) {
      logger.warn("Z3 failed while proving an implication: {}", e.getMessage());
      return VerificationResult.unproven(e.getMessage(), session.warnings(), session.elapsed());
    }
  }
}
