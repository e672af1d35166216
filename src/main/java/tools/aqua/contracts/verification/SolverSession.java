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
import static tools.aqua.contracts.ast.Expressions.eq;
import static tools.aqua.contracts.ast.Expressions.ref;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import java.time.Duration;
import java.util.List;
import java.util.function.Function;
import tools.aqua.contracts.ast.Expression;
import tools.aqua.contracts.ast.Parameter;
import tools.aqua.contracts.verification.translate.ContractTranslator;
import tools.aqua.contracts.verification.translate.DiagnosticAnalyzer;
import tools.aqua.contracts.verification.types.TypeRegistry;

/**
 * One verification: a fresh translator, a fresh solver bounded by a timeout, and the clock. Not
 * reusable.
 */
final class SolverSession {

  /** The name of the synthetic return value symbol. */
  static final String RESULT = "result";

  private final Context context;
  private final int timeoutMs;
  private final Function<Context, Solver> solverFactory;
  private final ContractTranslator translator;
  private final long start = System.nanoTime();
  private String failure;

  SolverSession(final Context context, final int timeoutMs) {
    this(context, timeoutMs, Context::mkSolver);
  }

  SolverSession(
      final Context context,
      final int timeoutMs,
      final Function<Context, Solver> solverFactory) {
    this.context = requireNonNull(context, "context");
    this.timeoutMs = timeoutMs;
    this.solverFactory = requireNonNull(solverFactory, "solverFactory");
    this.translator = new ContractTranslator(context);
  }

  /**
   * Declare all parameters.
   *
   * @param parameters the parameters.
   * @return {@code true} on success; otherwise {@link #failure()} names the offending parameter.
   */
  boolean declare(final List<Parameter> parameters) {
    for (final Parameter parameter : parameters) {
      if (!declare(parameter.getName(), parameter.getTypeName(), "Parameter")) {
        return false;
      }
    }
    return true;
  }

  boolean declare(final String name, final String typeName, final String role) {
    if (translator.declareVariable(name, typeName)) {
      return true;
    }
    failure =
        role
            + " '"
            + name
            + "' has unsupported type '"
            + typeName
            + "': "
            + TypeRegistry.describeUnsupported(typeName);
    return false;
  }

  /**
   * Translate a boolean contract condition.
   *
   * @param condition the condition.
   * @param role the role of the condition, for the diagnostic.
   * @return the term, or {@code null}; then {@link #failure()} holds the diagnostic.
   */
  BoolExpr translate(final Expression condition, final String role) {
    final BoolExpr term = translator.translateBool(condition);
    if (term == null) {
      failure =
          role + " cannot be verified: " + new DiagnosticAnalyzer(translator).diagnoseBool(condition);
    }
    return term;
  }

  /**
   * Translate the binding of the result symbol to {@code result == binding}.
   *
   * @param binding the expression the function returns.
   * @return the equation, or {@code null}; then {@link #failure()} holds the diagnostic.
   */
  BoolExpr bindResult(final Expression binding) {
    return translate(eq(ref(RESULT), binding), "Result binding");
  }

  String failure() {
    return failure;
  }

  Solver newSolver() {
    final Solver solver = solverFactory.apply(context);
    final Params params = context.mkParams();
    params.add("timeout", timeoutMs);
    solver.setParameters(params);
    return solver;
  }

  Status check(final Solver solver, final BoolExpr... assertions) {
    solver.add(assertions);
    return solver.check();
  }

  String counterexample(final Solver solver) {
    return CounterexampleFormatter.format(solver.getModel(), translator);
  }

  List<String> warnings() {
    return translator.getWarnings();
  }

  Duration elapsed() {
    return Duration.ofNanos(System.nanoTime() - start);
  }

  VerificationResult unsupported() {
    return VerificationResult.unsupported(failure, warnings(), elapsed());
  }
}
