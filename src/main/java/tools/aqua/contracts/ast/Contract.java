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

import java.util.Optional;

/**
 * A single precondition or postcondition clause. The optional message is the user-supplied text
 * the runtime check reports on failure; verification passes it through unchanged.
 */
public final class Contract {

  private final Expression condition;
  private final String message;

  public Contract(final Expression condition) {
    this(condition, null);
  }

  public Contract(final Expression condition, final String message) {
    this.condition = requireNonNull(condition, "condition");
    this.message = message;
  }

  public Expression getCondition() {
    return condition;
  }

  public Optional<String> getMessage() {
    return Optional.ofNullable(message);
  }

  @Override
  public String toString() {
    return message == null ? condition.toString() : condition + " \"" + message + "\"";
  }
}
