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

import static java.util.Objects.requireNonNull;

import com.microsoft.z3.Expr;

/**
 * The outcome of lowering one expression: either a solver term or the first concrete reason the
 * expression cannot be modeled. Producing terms and explaining their absence are the same pass.
 */
public final class Translation {

  private final Expr<?> term;
  private final String failure;

  private Translation(final Expr<?> term, final String failure) {
    this.term = term;
    this.failure = failure;
  }

  static Translation of(final Expr<?> term) {
    return new Translation(requireNonNull(term, "term"), null);
  }

  static Translation failure(final String reason) {
    return new Translation(null, requireNonNull(reason, "reason"));
  }

  public boolean isSuccess() {
    return term != null;
  }

  /** @return the term, or {@code null} if translation failed. */
  public Expr<?> getTerm() {
    return term;
  }

  /** @return the failure reason, or {@code null} if translation succeeded. */
  public String getFailure() {
    return failure;
  }

  @Override
  public String toString() {
    return isSuccess() ? "Translation[" + term + "]" : "Translation.failure[" + failure + "]";
  }
}
