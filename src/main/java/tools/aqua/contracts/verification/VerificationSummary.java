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

import java.util.EnumMap;
import java.util.Map;

/** Counts of contract outcomes over a module. */
public final class VerificationSummary {

  private final Map<VerificationStatus, Integer> counts = new EnumMap<>(VerificationStatus.class);

  VerificationSummary(final Iterable<FunctionVerificationResult> functions) {
    for (final VerificationStatus status : VerificationStatus.values()) {
      counts.put(status, 0);
    }
    for (final FunctionVerificationResult function : functions) {
      for (final VerificationResult result : function.getAllResults()) {
        counts.merge(result.getStatus(), 1, Integer::sum);
      }
    }
  }

  /**
   * @param status a status.
   * @return the number of contracts with that status.
   */
  public int count(final VerificationStatus status) {
    return counts.get(status);
  }

  public int getProven() {
    return count(VerificationStatus.PROVEN);
  }

  public int getDisproven() {
    return count(VerificationStatus.DISPROVEN);
  }

  public int getUnproven() {
    return count(VerificationStatus.UNPROVEN);
  }

  public int getUnsupported() {
    return count(VerificationStatus.UNSUPPORTED);
  }

  public int getSkipped() {
    return count(VerificationStatus.SKIPPED);
  }

  public int getTotal() {
    int total = 0;
    for (final int count : counts.values()) {
      total += count;
    }
    return total;
  }

  @Override
  public String toString() {
    return getTotal()
        + " contract(s): "
        + getProven()
        + " proven, "
        + getDisproven()
        + " disproven, "
        + getUnproven()
        + " unproven, "
        + getUnsupported()
        + " unsupported, "
        + getSkipped()
        + " skipped";
  }
}
