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

/** Native string operations. Not every operation is verifiable. */
public enum StringOp {
  // queries
  LENGTH,
  CONTAINS,
  STARTS_WITH,
  ENDS_WITH,
  INDEX_OF,
  IS_NULL_OR_EMPTY,
  IS_NULL_OR_WHITESPACE,
  EQUALS,

  // transformations
  SUBSTRING,
  SUBSTRING_FROM,
  REPLACE,
  TO_UPPER,
  TO_LOWER,
  TRIM,
  TRIM_START,
  TRIM_END,
  PAD_LEFT,
  PAD_RIGHT,

  // static helpers
  JOIN,
  FORMAT,
  CONCAT,
  SPLIT,
  TO_STRING,

  // regular expressions
  REGEX_TEST,
  REGEX_MATCH,
  REGEX_REPLACE,
  REGEX_SPLIT
}
