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

/** {@code array{index}}. */
public final class ArrayAccess implements Expression {

  private final Expression array;
  private final Expression index;

  public ArrayAccess(final Expression array, final Expression index) {
    this.array = requireNonNull(array, "array");
    this.index = requireNonNull(index, "index");
  }

  public Expression getArray() {
    return array;
  }

  public Expression getIndex() {
    return index;
  }

  @Override
  public <R> R accept(final ExpressionVisitor<R> visitor) {
    return visitor.visitArrayAccess(this);
  }

  @Override
  public String toString() {
    return array + "{" + index + "}";
  }
}
