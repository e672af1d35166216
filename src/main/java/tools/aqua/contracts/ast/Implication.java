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

/** {@code antecedent -> consequent}. */
public final class Implication implements Expression {

  private final Expression antecedent;
  private final Expression consequent;

  public Implication(final Expression antecedent, final Expression consequent) {
    this.antecedent = requireNonNull(antecedent, "antecedent");
    this.consequent = requireNonNull(consequent, "consequent");
  }

  public Expression getAntecedent() {
    return antecedent;
  }

  public Expression getConsequent() {
    return consequent;
  }

  @Override
  public <R> R accept(final ExpressionVisitor<R> visitor) {
    return visitor.visitImplication(this);
  }

  @Override
  public String toString() {
    return "(" + antecedent + " -> " + consequent + ")";
  }
}
