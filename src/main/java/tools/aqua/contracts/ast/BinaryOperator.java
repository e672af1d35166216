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

/** Binary operators of the contract language. */
public enum BinaryOperator {
  ADD("+"),
  SUBTRACT("-"),
  MULTIPLY("*"),
  DIVIDE("/"),
  MODULO("%"),

  EQUAL("=="),
  NOT_EQUAL("!="),
  LESS_THAN("<"),
  LESS_OR_EQUAL("<="),
  GREATER_THAN(">"),
  GREATER_OR_EQUAL(">="),

  AND("&&"),
  OR("||"),

  BITWISE_AND("&"),
  BITWISE_OR("|"),
  BITWISE_XOR("^"),
  LEFT_SHIFT("<<"),
  RIGHT_SHIFT(">>");

  /** The operator's source notation. */
  private final String symbol;

  BinaryOperator(final String symbol) {
    this.symbol = symbol;
  }

  public String getSymbol() {
    return symbol;
  }
}
