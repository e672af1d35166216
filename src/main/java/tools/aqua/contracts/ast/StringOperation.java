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

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;

/** A string operation applied to its arguments, optionally with a comparison mode. */
public final class StringOperation implements Expression {

  private final StringOp operation;
  private final List<Expression> arguments;
  /** The requested comparison mode, or {@code null} if none was given. */
  private final StringComparisonMode comparisonMode;

  public StringOperation(final StringOp operation, final List<Expression> arguments) {
    this(operation, arguments, null);
  }

  public StringOperation(
      final StringOp operation,
      final List<Expression> arguments,
      final StringComparisonMode comparisonMode) {
    this.operation = requireNonNull(operation, "operation");
    this.arguments = unmodifiableList(new ArrayList<>(arguments));
    this.comparisonMode = comparisonMode;
  }

  public StringOp getOperation() {
    return operation;
  }

  public List<Expression> getArguments() {
    return arguments;
  }

  /**
   * Get the requested comparison mode.
   *
   * @return the mode, or {@code null} if the operation did not request one.
   */
  public StringComparisonMode getComparisonMode() {
    return comparisonMode;
  }

  @Override
  public <R> R accept(final ExpressionVisitor<R> visitor) {
    return visitor.visitStringOperation(this);
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder("(").append(operation);
    for (final Expression argument : arguments) {
      builder.append(' ').append(argument);
    }
    if (comparisonMode != null) {
      builder.append(" :").append(comparisonMode);
    }
    return builder.append(')').toString();
  }
}
