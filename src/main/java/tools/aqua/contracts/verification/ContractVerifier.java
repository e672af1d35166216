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
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.aqua.contracts.ast.Contract;
import tools.aqua.contracts.ast.Expression;
import tools.aqua.contracts.ast.Parameter;

/**
 * Checks single preconditions and postconditions with Z3.
 *
 * <p>Each call runs in isolation with a fresh translator and a fresh solver bounded by the timeout.
 * A precondition is checked for satisfiability: a satisfiable precondition is {@link
 * VerificationStatus#PROVEN}, since the function can be called at all. A postcondition is proven by
 * showing that the preconditions together with its negation are unsatisfiable; a model of that
 * query is a counterexample.
 *
 * <p>Verification is advisory. Whatever the outcome, the runtime contract checks stay in place.
 *
 * <p>The context is owned by the caller and must not be used concurrently.
 */
public final class ContractVerifier {

  private static final Logger logger = LoggerFactory.getLogger(ContractVerifier.class);

  static final String NEVER_SATISFIABLE =
      "Precondition is never satisfiable: the function can never be called correctly.";

  private final Context context;
  private final int timeoutMs;
  private final Function<Context, Solver> solverFactory;

  /**
   * Create a verifier with the default timeout.
   *
   * @param context the Z3 context.
   */
  public ContractVerifier(final Context context) {
    this(context, DEFAULT_TIMEOUT_MS);
  }

  /**
   * Create a verifier.
   *
   * @param context the Z3 context.
   * @param timeoutMs the timeout of each solver check in milliseconds.
   * @throws IllegalArgumentException if the timeout is not positive.
   */
  public ContractVerifier(final Context context, final int timeoutMs) {
    this(context, timeoutMs, Context::mkSolver);
  }

  /**
   * Create a verifier checking with solvers from the given factory.
   *
   * @param context the Z3 context the terms are built in.
   * @param timeoutMs the timeout of each solver check in milliseconds.
   * @param solverFactory creates the solver of each check.
   */
  ContractVerifier(
      final Context context, final int timeoutMs, final Function<Context, Solver> solverFactory) {
    if (timeoutMs <= 0) {
      throw new IllegalArgumentException("timeout must be positive, got " + timeoutMs);
    }
    this.context = requireNonNull(context, "context");
    this.timeoutMs = timeoutMs;
    this.solverFactory = requireNonNull(solverFactory, "solverFactory");
  }

  public int getTimeoutMs() {
    return timeoutMs;
  }

  /**
   * Check that a precondition can be satisfied by some input.
   *
   * @param parameters the function parameters.
   * @param precondition the precondition.
   * @return {@link VerificationStatus#PROVEN} if some input satisfies it, {@link
   *     VerificationStatus#DISPROVEN} if none does, {@link VerificationStatus#UNPROVEN} on timeout
   *     or solver failure, {@link VerificationStatus#UNSUPPORTED} if it cannot be modeled.
   */
  public VerificationResult verifyPrecondition(
      final List<Parameter> parameters, final Contract precondition) {
    requireNonNull(parameters, "parameters");
    requireNonNull(precondition, "precondition");

    final SolverSession session = new SolverSession(context, timeoutMs, solverFactory);
    try {
      if (!session.declare(parameters)) {
        return report("precondition", session.unsupported());
      }
      final BoolExpr condition = session.translate(precondition.getCondition(), "Precondition");
      if (condition == null) {
        return report("precondition", session.unsupported());
      }

      final Solver solver = session.newSolver();
      final Status status = session.check(solver, condition);
      switch (status) {
        case SATISFIABLE:
          return report(
              "precondition", VerificationResult.proven(session.warnings(), session.elapsed()));
        case UNSATISFIABLE:
          return report(
              "precondition",
              VerificationResult.disproven(
                  null, NEVER_SATISFIABLE, session.warnings(), session.elapsed()));
        default:
          return report("precondition", unknown(solver, session));
      }
    } catch (final Z3Exception e) {
      return fault("precondition", e, session);
    }
  }

  /**
   * Check that a postcondition holds for every input satisfying the preconditions.
   *
   * @param parameters the function parameters.
   * @param outputType the return type, or {@code null} or {@code "void"} if there is none.
   * @param preconditions the preconditions that may be assumed.
   * @param postcondition the postcondition.
   * @return the result.
   */
  public VerificationResult verifyPostcondition(
      final List<Parameter> parameters,
      final String outputType,
      final List<Contract> preconditions,
      final Contract postcondition) {
    return verifyPostcondition(parameters, outputType, preconditions, postcondition, null);
  }

  /**
   * Check that a postcondition holds for every input satisfying the preconditions, where the return
   * value equals a given expression over the parameters.
   *
   * @param parameters the function parameters.
   * @param outputType the return type, or {@code null} or {@code "void"} if there is none.
   * @param preconditions the preconditions that may be assumed.
   * @param postcondition the postcondition.
   * @param resultBinding the returned expression, or {@code null} to leave {@code result}
   *     unconstrained.
   * @return {@link VerificationStatus#PROVEN} if no counterexample exists, {@link
   *     VerificationStatus#DISPROVEN} with a counterexample otherwise, {@link
   *     VerificationStatus#UNPROVEN} on timeout or solver failure, {@link
   *     VerificationStatus#UNSUPPORTED} if any part cannot be modeled.
   */
  public VerificationResult verifyPostcondition(
      final List<Parameter> parameters,
      final String outputType,
      final List<Contract> preconditions,
      final Contract postcondition,
      final Expression resultBinding) {
    requireNonNull(parameters, "parameters");
    requireNonNull(preconditions, "preconditions");
    requireNonNull(postcondition, "postcondition");

    final SolverSession session = new SolverSession(context, timeoutMs, solverFactory);
    try {
      if (!session.declare(parameters)) {
        return report("postcondition", session.unsupported());
      }
      if (hasResult(outputType)
          && !session.declare(SolverSession.RESULT, outputType, "Return value")) {
        return report("postcondition", session.unsupported());
      }

      final List<BoolExpr> assertions = new ArrayList<>();
      for (final Contract precondition : preconditions) {
        final BoolExpr condition = session.translate(precondition.getCondition(), "Precondition");
        if (condition == null) {
          return report("postcondition", session.unsupported());
        }
        assertions.add(condition);
      }
      if (resultBinding != null) {
        final BoolExpr binding = session.bindResult(resultBinding);
        if (binding == null) {
          return report("postcondition", session.unsupported());
        }
        assertions.add(binding);
      }
      final BoolExpr goal = session.translate(postcondition.getCondition(), "Postcondition");
      if (goal == null) {
        return report("postcondition", session.unsupported());
      }
      assertions.add(context.mkNot(goal));

      final Solver solver = session.newSolver();
      final Status status = session.check(solver, assertions.toArray(new BoolExpr[0]));
      switch (status) {
        case UNSATISFIABLE:
          return report(
              "postcondition", VerificationResult.proven(session.warnings(), session.elapsed()));
        case SATISFIABLE:
          return report(
              "postcondition",
              VerificationResult.disproven(
                  session.counterexample(solver),
                  postcondition.getMessage().orElse(null),
                  session.warnings(),
                  session.elapsed()));
        default:
          return report("postcondition", unknown(solver, session));
      }
    } catch (final Z3Exception e) {
      return fault("postcondition", e, session);
    }
  }

  static boolean hasResult(final String outputType) {
    return outputType != null && !outputType.isEmpty() && !"void".equalsIgnoreCase(outputType);
  }

  static VerificationResult unknown(final Solver solver, final SolverSession session) {
    return VerificationResult.unproven(
        "Solver returned unknown: " + solver.getReasonUnknown(),
        session.warnings(),
        session.elapsed());
  }

  private static VerificationResult fault(
      final String kind, final Z3Exception e, final SolverSession session) {
    logger.warn("Z3 failed while verifying a {}: {}", kind, e.getMessage());
    return VerificationResult.unproven(e.getMessage(), session.warnings(), session.elapsed());
  }

  private static VerificationResult report(final String kind, final VerificationResult result) {
    logger.debug("Verified {}: {}", kind, result.describe());
    return result;
  }
}
