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

import java.util.ArrayList;
import java.util.List;

/** The results of verifying every function of a module. */
public final class ModuleVerificationResult {

  private final List<FunctionVerificationResult> functions;
  private final VerificationSummary summary;

  ModuleVerificationResult(final List<FunctionVerificationResult> functions) {
    this.functions = unmodifiableList(new ArrayList<>(functions));
    this.summary = new VerificationSummary(this.functions);
  }

  /** @return the functions that carry contracts, in input order. */
  public List<FunctionVerificationResult> getFunctions() {
    return functions;
  }

  public VerificationSummary getSummary() {
    return summary;
  }

  /** @return {@code true} iff no contract was disproven. */
  public boolean isSound() {
    return summary.getDisproven() == 0;
  }
}
