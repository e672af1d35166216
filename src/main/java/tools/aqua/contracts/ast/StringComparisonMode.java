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

package tools.aqua.contracts.ast;

/** Comparison modes that string queries may request. */
public enum StringComparisonMode {
  /** Ordinal, case-sensitive comparison. */
  ORDINAL,
  /** Case-insensitive ordinal comparison. */
  IGNORE_CASE,
  /** Invariant-culture comparison. */
  INVARIANT,
  /** Case-insensitive invariant-culture comparison. */
  INVARIANT_IGNORE_CASE
}
