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
import java.util.Optional;

/**
 * The verification-relevant view of one function: its signature and its contracts in source
 * order.
 */
public final class FunctionContract {

  private final String name;
  private final List<Parameter> parameters;
  private final String outputType;
  private final List<Contract> preconditions;
  private final List<Contract> postconditions;
  private final Expression resultBinding;

  /**
   * Create a new function contract.
   *
   * @param name the function name.
   * @param parameters the parameters in declaration order.
   * @param outputType the return type name, or {@code null} for functions without a result.
   * @param preconditions the preconditions in source order.
   * @param postconditions the postconditions in source order.
   * @param resultBinding a pure expression the function returns, or {@code null} if unknown.
   */
  public FunctionContract(
      final String name,
      final List<Parameter> parameters,
      final String outputType,
      final List<Contract> preconditions,
      final List<Contract> postconditions,
      final Expression resultBinding) {
    this.name = requireNonNull(name, "name");
    this.parameters = unmodifiableList(new ArrayList<>(parameters));
    this.outputType = outputType;
    this.preconditions = unmodifiableList(new ArrayList<>(preconditions));
    this.postconditions = unmodifiableList(new ArrayList<>(postconditions));
    this.resultBinding = resultBinding;
  }

  public String getName() {
    return name;
  }

  public List<Parameter> getParameters() {
    return parameters;
  }

  public Optional<String> getOutputType() {
    return Optional.ofNullable(outputType);
  }

  public List<Contract> getPreconditions() {
    return preconditions;
  }

  public List<Contract> getPostconditions() {
    return postconditions;
  }

  public Optional<Expression> getResultBinding() {
    return Optional.ofNullable(resultBinding);
  }

  public boolean hasContracts() {
    return !preconditions.isEmpty() || !postconditions.isEmpty();
  }

  @Override
  public String toString() {
    return name + parameters + (outputType == null ? "" : " -> " + outputType);
  }
}
