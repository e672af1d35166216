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

import static java.lang.System.getProperty;

/**
 * Settings of a verification run.
 *
 * <p>The system properties {@value #TIMEOUT_PROPERTY} (milliseconds) and {@value
 * #VERBOSE_PROPERTY} override the defaults when read through {@link #fromSystemProperties()}.
 */
public final class VerificationOptions {

  /** Property holding the per-check solver timeout in milliseconds. */
  public static final String TIMEOUT_PROPERTY = "contracts.verification.timeout";

  /** Property enabling verbose reporting. */
  public static final String VERBOSE_PROPERTY = "contracts.verification.verbose";

  /** The default per-check solver timeout in milliseconds. */
  public static final int DEFAULT_TIMEOUT_MS = 5000;

  /** A five second timeout, not verbose. */
  public static final VerificationOptions DEFAULT =
      new VerificationOptions(DEFAULT_TIMEOUT_MS, false);

  private final int timeoutMs;
  private final boolean verbose;

  private VerificationOptions(final int timeoutMs, final boolean verbose) {
    if (timeoutMs <= 0) {
      throw new IllegalArgumentException("timeout must be positive, got " + timeoutMs);
    }
    this.timeoutMs = timeoutMs;
    this.verbose = verbose;
  }

  /**
   * Read the options from the system properties, using the defaults for absent properties.
   *
   * @return the options.
   * @throws IllegalArgumentException if {@value #TIMEOUT_PROPERTY} is not a positive integer.
   */
  public static VerificationOptions fromSystemProperties() {
    final String timeout = getProperty(TIMEOUT_PROPERTY);
    final String verbose = getProperty(VERBOSE_PROPERTY);

    int timeoutMs = DEFAULT_TIMEOUT_MS;
    if (timeout != null) {
      try {
        timeoutMs = Integer.parseInt(timeout.trim());
      } catch (final NumberFormatException e) {
        throw new IllegalArgumentException(
            TIMEOUT_PROPERTY + " must be an integer, got '" + timeout + "'", e);
      }
      if (timeoutMs <= 0) {
        throw new IllegalArgumentException(
            TIMEOUT_PROPERTY + " must be positive, got " + timeoutMs);
      }
    }
    return new VerificationOptions(timeoutMs, Boolean.parseBoolean(verbose));
  }

  public int getTimeoutMs() {
    return timeoutMs;
  }

  public boolean isVerbose() {
    return verbose;
  }

  /**
   * @param timeoutMs the new timeout in milliseconds.
   * @return a copy with the given timeout.
   * @throws IllegalArgumentException if the timeout is not positive.
   */
  public VerificationOptions withTimeout(final int timeoutMs) {
    return new VerificationOptions(timeoutMs, verbose);
  }

  /**
   * @param verbose whether to report verbosely.
   * @return a copy with the given verbosity.
   */
  public VerificationOptions withVerbose(final boolean verbose) {
    return new VerificationOptions(timeoutMs, verbose);
  }

  @Override
  public String toString() {
    return "VerificationOptions[timeoutMs=" + timeoutMs + ", verbose=" + verbose + "]";
  }
}
