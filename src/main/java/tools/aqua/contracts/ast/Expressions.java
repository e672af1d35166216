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

import static java.util.Arrays.asList;

/** Static factory methods for building contract expression trees. */
public final class Expressions {

  /** This class should not be constructed. */
  private Expressions() {
    throw new AssertionError();
  }

  public static IntLiteral lit(final long value) {
    return new IntLiteral(value);
  }

  public static BoolLiteral lit(final boolean value) {
    return BoolLiteral.of(value);
  }

  public static StringLiteral str(final String value) {
    return new StringLiteral(value);
  }

  public static Reference ref(final String name) {
    return new Reference(name);
  }

  public static BinaryOperation binary(
      final BinaryOperator operator, final Expression left, final Expression right) {
    return new BinaryOperation(operator, left, right);
  }

  public static BinaryOperation add(final Expression left, final Expression right) {
    return binary(BinaryOperator.ADD, left, right);
  }

  public static BinaryOperation sub(final Expression left, final Expression right) {
    return binary(BinaryOperator.SUBTRACT, left, right);
  }

  public static BinaryOperation eq(final Expression left, final Expression right) {
    return binary(BinaryOperator.EQUAL, left, right);
  }

  public static BinaryOperation ne(final Expression left, final Expression right) {
    return binary(BinaryOperator.NOT_EQUAL, left, right);
  }

  public static BinaryOperation lt(final Expression left, final Expression right) {
    return binary(BinaryOperator.LESS_THAN, left, right);
  }

  public static BinaryOperation le(final Expression left, final Expression right) {
    return binary(BinaryOperator.LESS_OR_EQUAL, left, right);
  }

  public static BinaryOperation gt(final Expression left, final Expression right) {
    return binary(BinaryOperator.GREATER_THAN, left, right);
  }

  public static BinaryOperation ge(final Expression left, final Expression right) {
    return binary(BinaryOperator.GREATER_OR_EQUAL, left, right);
  }

  public static BinaryOperation and(final Expression left, final Expression right) {
    return binary(BinaryOperator.AND, left, right);
  }

  public static BinaryOperation or(final Expression left, final Expression right) {
    return binary(BinaryOperator.OR, left, right);
  }

  public static UnaryOperation not(final Expression operand) {
    return new UnaryOperation(UnaryOperator.NOT, operand);
  }

  public static UnaryOperation neg(final Expression operand) {
    return new UnaryOperation(UnaryOperator.NEGATE, operand);
  }

  public static Conditional ite(
      final Expression condition, final Expression whenTrue, final Expression whenFalse) {
    return new Conditional(condition, whenTrue, whenFalse);
  }

  public static QuantifierExpression forall(final BoundVariable variable, final Expression body) {
    return new QuantifierExpression(QuantifierExpression.Kind.FORALL, asList(variable), body);
  }

  public static QuantifierExpression exists(final BoundVariable variable, final Expression body) {
    return new QuantifierExpression(QuantifierExpression.Kind.EXISTS, asList(variable), body);
  }

  public static BoundVariable var(final String name, final String typeName) {
    return new BoundVariable(name, typeName);
  }

  public static Implication implies(final Expression antecedent, final Expression consequent) {
    return new Implication(antecedent, consequent);
  }

  public static ArrayAccess at(final Expression array, final Expression index) {
    return new ArrayAccess(array, index);
  }

  public static ArrayLength length(final Expression array) {
    return new ArrayLength(array);
  }

  public static StringOperation string(final StringOp operation, final Expression... arguments) {
    return new StringOperation(operation, asList(arguments));
  }

  public static StringOperation string(
      final StringOp operation, final StringComparisonMode mode, final Expression... arguments) {
    return new StringOperation(operation, asList(arguments), mode);
  }

  public static Call call(final String target, final Expression... arguments) {
    return new Call(target, asList(arguments));
  }
}
