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

import static java.util.Collections.emptyList;
import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** The immutable result of one contract check. */
public final class VerificationResult {

  private final VerificationStatus status;
  private final String counterexample;
  private final String message;
  private final List<String> warnings;
  private final Duration duration;

  VerificationResult(
      final VerificationStatus status,
      final String counterexample,
      final String message,
      final List<String> warnings,
      final Duration duration) {
    this.status = requireNonNull(status, "status");
    this.counterexample = counterexample;
    this.message = message;
    this.warnings = unmodifiableList(new ArrayList<>(requireNonNull(warnings, "warnings")));
    this.duration = requireNonNull(duration, "duration");
  }

  static VerificationResult proven(final List<String> warnings, final Duration duration) {
    return new VerificationResult(VerificationStatus.PROVEN, null, null, warnings, duration);
  }

  static VerificationResult disproven(
      final String counterexample,
      final String message,
      final List<String> warnings,
      final Duration duration) {
    return new VerificationResult(
        VerificationStatus.DISPROVEN, counterexample, message, warnings, duration);
  }

  static VerificationResult unproven(
      final String message, final List<String> warnings, final Duration duration) {
    return new VerificationResult(VerificationStatus.UNPROVEN, null, message, warnings, duration);
  }

  static VerificationResult unsupported(
      final String message, final List<String> warnings, final Duration duration) {
    return new VerificationResult(
        VerificationStatus.UNSUPPORTED, null, message, warnings, duration);
  }

  static VerificationResult skipped(final String message) {
    return new VerificationResult(
        VerificationStatus.SKIPPED, null, message, emptyList(), Duration.ZERO);
  }

  public VerificationStatus getStatus() {
    return status;
  }

  /** @return the rendered counterexample, present only for disproven postconditions. */
  public Optional<String> getCounterexample() {
    return Optional.ofNullable(counterexample);
  }

  /** @return the diagnostic or explanation, if any. */
  public Optional<String> getMessage() {
    return Optional.ofNullable(message);
  }

  /** @return the non-fatal translation warnings, in emission order. */
  public List<String> getWarnings() {
    return warnings;
  }

  public Duration getDuration() {
    return duration;
  }

  /**
   * Render the result as a single human-readable line.
   *
   * @return the line, starting with the status.
   */
  public String describe() {
    final StringBuilder line = new StringBuilder(status.name());
    if (message != null) {
      line.append(": ").append(message);
    }
    if (counterexample != null) {
      line.append(message == null ? ": " : " ").append(counterexample);
    }
    line.append(" (").append(duration.toMillis()).append(" ms)");
    for (final String warning : warnings) {
      line.append(" [warning: ").append(warning).append(']');
    }
    return line.toString();
  }

  @Override
  public String toString() {
    return describe();
  }
}
