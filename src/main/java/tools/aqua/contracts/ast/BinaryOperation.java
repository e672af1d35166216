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

import static java.util.Objects.requireNonNull;

/** {@code left op right}. */
public final class BinaryOperation implements Expression {

  private final BinaryOperator operator;
  private final Expression left;
  private final Expression right;

  public BinaryOperation(
      final BinaryOperator operator, final Expression left, final Expression right) {
    this.operator = requireNonNull(operator, "operator");
    this.left = requireNonNull(left, "left");
    this.right = requireNonNull(right, "right");
  }

  public BinaryOperator getOperator() {
    return operator;
  }

  public Expression getLeft() {
    return left;
  }

  public Expression getRight() {
    return right;
  }

  @Override
  public <R> R accept(final ExpressionVisitor<R> visitor) {
    return visitor.visitBinaryOperation(this);
  }

  @Override
  public String toString() {
    return "(" + left + " " + operator.getSymbol() + " " + right + ")";
  }
}
