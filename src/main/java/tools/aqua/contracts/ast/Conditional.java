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

/** {@code if condition then whenTrue else whenFalse}. */
public final class Conditional implements Expression {

  private final Expression condition;
  private final Expression whenTrue;
  private final Expression whenFalse;

  public Conditional(
      final Expression condition, final Expression whenTrue, final Expression whenFalse) {
    this.condition = requireNonNull(condition, "condition");
    this.whenTrue = requireNonNull(whenTrue, "whenTrue");
    this.whenFalse = requireNonNull(whenFalse, "whenFalse");
  }

  public Expression getCondition() {
    return condition;
  }

  public Expression getWhenTrue() {
    return whenTrue;
  }

  public Expression getWhenFalse() {
    return whenFalse;
  }

  @Override
  public <R> R accept(final ExpressionVisitor<R> visitor) {
    return visitor.visitConditional(this);
  }

  @Override
  public String toString() {
    return "(if " + condition + " then " + whenTrue + " else " + whenFalse + ")";
  }
}
