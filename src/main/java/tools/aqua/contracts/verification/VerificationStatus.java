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

/** The outcome of checking one contract. */
public enum VerificationStatus {
  /** The contract holds for every input within the modeled theories. */
  PROVEN,
  /** The contract is false; a counterexample or explanation is attached. */
  DISPROVEN,
  /** The solver timed out, answered unknown or failed. */
  UNPROVEN,
  /** The contract uses a construct or type the solver theories cannot express. */
  UNSUPPORTED,
  /** Verification did not run because the solver is unavailable. */
  SKIPPED;

  /** @return {@code true} iff the outcome is conclusive. */
  public boolean isConclusive() {
    return this == PROVEN || this == DISPROVEN;
  }
}
