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

/** {@code forall (vars) body} or {@code exists (vars) body}. */
public final class QuantifierExpression implements Expression {

  /** The two quantifier kinds. */
  public enum Kind {
    FORALL("forall"),
    EXISTS("exists");

    private final String keyword;

    Kind(final String keyword) {
      this.keyword = keyword;
    }

    public String getKeyword() {
      return keyword;
    }
  }

  private final Kind kind;
  private final List<BoundVariable> boundVariables;
  private final Expression body;

  public QuantifierExpression(
      final Kind kind, final List<BoundVariable> boundVariables, final Expression body) {
    this.kind = requireNonNull(kind, "kind");
    this.boundVariables = unmodifiableList(new ArrayList<>(boundVariables));
    this.body = requireNonNull(body, "body");
  }

  public Kind getKind() {
    return kind;
  }

  public List<BoundVariable> getBoundVariables() {
    return boundVariables;
  }

  public Expression getBody() {
    return body;
  }

  @Override
  public <R> R accept(final ExpressionVisitor<R> visitor) {
    return visitor.visitQuantifier(this);
  }

  @Override
  public String toString() {
    return "(" + kind.getKeyword() + " " + boundVariables + " " + body + ")";
  }
}
