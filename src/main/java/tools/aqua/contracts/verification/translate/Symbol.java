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

package tools.aqua.contracts.verification.translate;

import static java.util.Objects.requireNonNull;

import com.microsoft.z3.Expr;

/** A declared name: the solver constant standing for it and its declared type name. */
public final class Symbol {

  private final String name;
  private final Expr<?> term;
  private final String typeName;

  Symbol(final String name, final Expr<?> term, final String typeName) {
    this.name = requireNonNull(name, "name");
    this.term = requireNonNull(term, "term");
    this.typeName = requireNonNull(typeName, "typeName");
  }

  public String getName() {
    return name;
  }

  public Expr<?> getTerm() {
    return term;
  }

  public String getTypeName() {
    return typeName;
  }

  @Override
  public String toString() {
    return name + ":" + typeName;
  }
}
