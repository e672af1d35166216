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

import com.microsoft.z3.Context;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.aqua.contracts.ast.Contract;
import tools.aqua.contracts.ast.FunctionContract;

/**
 * Verifies the contracts of every function in a module and reports disproven ones.
 *
 * <p>Functions without contracts are left out of the result. If Z3 cannot be loaded, every contract
 * is reported as {@link VerificationStatus#SKIPPED}; the runtime checks are emitted either way.
 */
public final class ContractVerificationPass {

  private static final Logger logger = LoggerFactory.getLogger(ContractVerificationPass.class);

  private final VerificationOptions options;
  private final BooleanSupplier solverAvailable;

  public ContractVerificationPass() {
    this(VerificationOptions.DEFAULT);
  }

  public ContractVerificationPass(final VerificationOptions options) {
    this(options, Z3ContextFactory::isAvailable);
  }

  ContractVerificationPass(
      final VerificationOptions options, final BooleanSupplier solverAvailable) {
    this.options = requireNonNull(options, "options");
    this.solverAvailable = requireNonNull(solverAvailable, "solverAvailable");
  }

  /**
   * Verify the contracts of a module.
   *
   * @param functions the functions of the module.
   * @return the per-function results and their summary.
   */
  public ModuleVerificationResult verify(final List<FunctionContract> functions) {
    requireNonNull(functions, "functions");
    final List<FunctionContract> contracted = new ArrayList<>();
    for (final FunctionContract function : functions) {
      if (function.hasContracts()) {
        contracted.add(function);
      }
    }

    final ModuleVerificationResult result;
    if (!solverAvailable.getAsBoolean()) {
      logger.warn("Z3 is unavailable, skipping verification of {} function(s)", contracted.size());
      result = skipAll(contracted);
    } else {
      try (final Context context = Z3ContextFactory.create()) {
        final ContractVerifier verifier = new ContractVerifier(context, options.getTimeoutMs());
        final List<FunctionVerificationResult> results = new ArrayList<>();
        for (final FunctionContract function : contracted) {
          results.add(verify(verifier, function));
        }
        result = new ModuleVerificationResult(results);
      }
    }

    if (options.isVerbose()) {
      logger.info("Contract verification: {}", result.getSummary());
    } else {
      logger.debug("Contract verification: {}", result.getSummary());
    }
    return result;
  }

  private FunctionVerificationResult verify(
      final ContractVerifier verifier, final FunctionContract function) {
    final String outputType = function.getOutputType().orElse(null);

    final List<VerificationResult> preconditions = new ArrayList<>();
    for (final Contract precondition : function.getPreconditions()) {
      final VerificationResult result =
          verifier.verifyPrecondition(function.getParameters(), precondition);
      report(function, "precondition", precondition, result);
      preconditions.add(result);
    }

    final List<VerificationResult> postconditions = new ArrayList<>();
    for (final Contract postcondition : function.getPostconditions()) {
      final VerificationResult result =
          verifier.verifyPostcondition(
              function.getParameters(),
              outputType,
              function.getPreconditions(),
              postcondition,
              function.getResultBinding().orElse(null));
      report(function, "postcondition", postcondition, result);
      postconditions.add(result);
    }
    return new FunctionVerificationResult(function.getName(), preconditions, postconditions);
  }

  private void report(
      final FunctionContract function,
      final String kind,
      final Contract contract,
      final VerificationResult result) {
    switch (result.getStatus()) {
      case DISPROVEN:
        logger.warn(
            "{} of '{}' is disproven{}: {}",
            kind,
            function.getName(),
            contract.getMessage().map(message -> " (" + message + ")").orElse(""),
            result.getCounterexample().orElse(result.getMessage().orElse("")));
        break;
      case PROVEN:
        if (options.isVerbose()) {
          logger.info("{} of '{}' is proven", kind, function.getName());
        }
        break;
      default:
        logger.debug("{} of '{}': {}", kind, function.getName(), result.describe());
    }
  }

  private static ModuleVerificationResult skipAll(final List<FunctionContract> functions) {
    final List<FunctionVerificationResult> results = new ArrayList<>();
    for (final FunctionContract function : functions) {
      final List<VerificationResult> preconditions = new ArrayList<>();
      for (int i = 0; i < function.getPreconditions().size(); i++) {
        preconditions.add(VerificationResult.skipped("Z3 is not available"));
      }
      final List<VerificationResult> postconditions = new ArrayList<>();
      for (int i = 0; i < function.getPostconditions().size(); i++) {
        postconditions.add(VerificationResult.skipped("Z3 is not available"));
      }
      results.add(new FunctionVerificationResult(function.getName(), preconditions, postconditions));
    }
    return new ModuleVerificationResult(results);
  }
}
