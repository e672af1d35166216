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

/** A call to a user or library function. */
public final class Call implements Expression {

  private final String target;
  private final List<Expression> arguments;

  public Call(final String target, final List<Expression> arguments) {
    this.target = requireNonNull(target, "target");
    this.arguments = unmodifiableList(new ArrayList<>(arguments));
  }

  public String getTarget() {
    return target;
  }

  public List<Expression> getArguments() {
    return arguments;
  }

  @Override
  public <R> R accept(final ExpressionVisitor<R> visitor) {
    return visitor.visitCall(this);
  }

  @Override
  public String toString() {
    return target + arguments;
  }
}
