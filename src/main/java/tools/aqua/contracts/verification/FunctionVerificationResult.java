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

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;

/** The results for the contracts of one function, each list in source order. */
public final class FunctionVerificationResult {

  private final String functionName;
  private final List<VerificationResult> preconditions;
  private final List<VerificationResult> postconditions;

  FunctionVerificationResult(
      final String functionName,
      final List<VerificationResult> preconditions,
      final List<VerificationResult> postconditions) {
    this.functionName = requireNonNull(functionName, "functionName");
    this.preconditions = unmodifiableList(new ArrayList<>(preconditions));
    this.postconditions = unmodifiableList(new ArrayList<>(postconditions));
  }

  public String getFunctionName() {
    return functionName;
  }

  public List<VerificationResult> getPreconditionResults() {
    return preconditions;
  }

  public List<VerificationResult> getPostconditionResults() {
    return postconditions;
  }

  /** @return all results, preconditions first. */
  public List<VerificationResult> getAllResults() {
    final List<VerificationResult> all = new ArrayList<>(preconditions);
    all.addAll(postconditions);
    return unmodifiableList(all);
  }

  @Override
  public String toString() {
    return functionName + ": " + getAllResults().size() + " contract(s)";
  }
}
