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

/**
 * Visitor over the closed set of contract expression node types.
 *
 * @param <R> the result type.
 */
public interface ExpressionVisitor<R> {

  R visitIntLiteral(IntLiteral node);

  R visitFloatLiteral(FloatLiteral node);

  R visitBoolLiteral(BoolLiteral node);

  R visitStringLiteral(StringLiteral node);

  R visitReference(Reference node);

  R visitBinaryOperation(BinaryOperation node);

  R visitUnaryOperation(UnaryOperation node);

  R visitConditional(Conditional node);

  R visitQuantifier(QuantifierExpression node);

  R visitImplication(Implication node);

  R visitArrayAccess(ArrayAccess node);

  R visitArrayLength(ArrayLength node);

  R visitStringOperation(StringOperation node);

  R visitCall(Call node);
}
