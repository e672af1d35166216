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

/** The literals {@code true} and {@code false}. */
public final class BoolLiteral implements Expression {

  public static final BoolLiteral TRUE = new BoolLiteral(true);

  public static final BoolLiteral FALSE = new BoolLiteral(false);

  private final boolean value;

  private BoolLiteral(final boolean value) {
    this.value = value;
  }

  public static BoolLiteral of(final boolean value) {
    return value ? TRUE : FALSE;
  }

  public boolean getValue() {
    return value;
  }

  @Override
  public <R> R accept(final ExpressionVisitor<R> visitor) {
    return visitor.visitBoolLiteral(this);
  }

  @Override
  public String toString() {
    return Boolean.toString(value);
  }
}
