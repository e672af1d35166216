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

import static com.microsoft.z3.Status.UNSATISFIABLE;
import static org.assertj.core.api.Assertions.assertThat;
import static tools.aqua.contracts.ast.Expressions.add;
import static tools.aqua.contracts.ast.Expressions.at;
import static tools.aqua.contracts.ast.Expressions.binary;
import static tools.aqua.contracts.ast.Expressions.call;
import static tools.aqua.contracts.ast.Expressions.eq;
import static tools.aqua.contracts.ast.Expressions.forall;
import static tools.aqua.contracts.ast.Expressions.gt;
import static tools.aqua.contracts.ast.Expressions.ite;
import static tools.aqua.contracts.ast.Expressions.length;
import static tools.aqua.contracts.ast.Expressions.lit;
import static tools.aqua.contracts.ast.Expressions.ref;
import static tools.aqua.contracts.ast.Expressions.str;
import static tools.aqua.contracts.ast.Expressions.string;
import static tools.aqua.contracts.ast.Expressions.var;

import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Solver;
import org.junit.jupiter.api.Test;
import tools.aqua.contracts.ast.BinaryOperator;
import tools.aqua.contracts.ast.FloatLiteral;
import tools.aqua.contracts.ast.StringComparisonMode;
import tools.aqua.contracts.ast.StringOp;
import tools.aqua.contracts.verification.types.IntegerType;

/** Test the lowering of contract expressions to solver terms. */
class ContractTranslatorTest {

  /** Assert that a formula holds under every assignment. */
  private static void assertValid(final Context ctx, final BoolExpr formula) {
    final Solver solver = ctx.mkSolver();
    assertThat(solver.check(ctx.mkNot(formula))).isEqualTo(UNSATISFIABLE);
  }

  /** Declaring an unsupported type fails and binds nothing. */
  @Test
  void testUnsupportedDeclaration() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      assertThat(translator.declareVariable("x", "f64")).isFalse();
      assertThat(translator.getVariables()).isEmpty();
    }
  }

  /** Addition over operands of different widths is commutative. */
  @Test
  void testMixedWidthAdditionCommutes() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      translator.declareVariable("a", "i8");
      translator.declareVariable("b", "u32");

      final BitVecExpr ab = (BitVecExpr) translator.translate(add(ref("a"), ref("b")));
      final BitVecExpr ba = (BitVecExpr) translator.translate(add(ref("b"), ref("a")));

      assertThat(ab.getSortSize()).isEqualTo(32);
      assertThat(translator.getInfo(ab).isSigned()).isTrue();
      assertValid(ctx, ctx.mkEq(ab, ba));
    }
  }

  /** Narrow signed operands are sign-extended before widening arithmetic. */
  @Test
  void testSignExtension() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      translator.declareVariable("a", "i8");
      final Expr<?> a = translator.lookup("a").getTerm();
      final BitVecExpr sum = (BitVecExpr) translator.translate(add(ref("a"), lit(0)));

      // a = -1 as 8 bits stays -1 at 32 bits
      assertValid(
          ctx,
          ctx.mkImplies(
              ctx.mkEq((BitVecExpr) a, ctx.mkBV(-1, 8)), ctx.mkEq(sum, ctx.mkBV(-1, 32))));
    }
  }

  /** Division of signed operands truncates toward zero. */
  @Test
  void testSignedDivision() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      translator.declareVariable("a", "i32");
      final BitVecExpr a = (BitVecExpr) translator.lookup("a").getTerm();
      final BitVecExpr quotient =
          (BitVecExpr) translator.translate(binary(BinaryOperator.DIVIDE, ref("a"), lit(2)));
      final BitVecExpr remainder =
          (BitVecExpr) translator.translate(binary(BinaryOperator.MODULO, ref("a"), lit(2)));

      assertValid(
          ctx, ctx.mkImplies(ctx.mkEq(a, ctx.mkBV(-7, 32)), ctx.mkEq(quotient, ctx.mkBV(-3, 32))));
      assertValid(
          ctx,
          ctx.mkImplies(ctx.mkEq(a, ctx.mkBV(-7, 32)), ctx.mkEq(remainder, ctx.mkBV(-1, 32))));
    }
  }

  /** Mixed signedness prefers unsigned only against non-negative literals. */
  @Test
  void testSignednessRule() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      translator.declareVariable("u", "u32");
      translator.declareVariable("v", "u32");
      translator.declareVariable("i", "i32");
      final BitVecExpr u = (BitVecExpr) translator.lookup("u").getTerm();
      final BitVecExpr v = (BitVecExpr) translator.lookup("v").getTerm();
      final BitVecExpr i = (BitVecExpr) translator.lookup("i").getTerm();
      final BitVecExpr five = (BitVecExpr) translator.translate(lit(5));
      final BitVecExpr minusOne = (BitVecExpr) translator.translate(lit(-1));

      assertThat(translator.prefersUnsigned(u, v)).isTrue();
      assertThat(translator.prefersUnsigned(i, i)).isFalse();
      assertThat(translator.prefersUnsigned(u, five)).isTrue();
      assertThat(translator.prefersUnsigned(five, u)).isTrue();
      assertThat(translator.prefersUnsigned(u, minusOne)).isFalse();
      assertThat(translator.prefersUnsigned(u, i)).isFalse();
    }
  }

  /** Right shift of an unsigned operand is logical. */
  @Test
  void testLogicalRightShift() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      translator.declareVariable("u", "u8");
      final BitVecExpr u = (BitVecExpr) translator.lookup("u").getTerm();
      final BitVecExpr shifted =
          (BitVecExpr) translator.translate(binary(BinaryOperator.RIGHT_SHIFT, ref("u"), lit(1)));

      assertValid(
          ctx,
          ctx.mkImplies(ctx.mkEq(u, ctx.mkBV(255, 8)), ctx.mkEq(shifted, ctx.mkBV(127, 32))));
    }
  }

  /** Conditional branches of different widths are normalized. */
  @Test
  void testConditionalWidths() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      translator.declareVariable("c", "bool");
      translator.declareVariable("a", "u8");
      translator.declareVariable("b", "u32");

      final Expr<?> term = translator.translate(ite(ref("c"), ref("a"), ref("b")));
      assertThat(term).isInstanceOf(BitVecExpr.class);
      assertThat(translator.getInfo(term)).isEqualTo(TermInfo.bitVector(IntegerType.U32));
    }
  }

  /** The length companion of an array is reachable by name and by length access. */
  @Test
  void testArrayLength() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      assertThat(translator.declareVariable("arr", "i32[]")).isTrue();

      final Symbol byName = translator.lookup("arr$length");
      assertThat(byName).isNotNull();
      assertThat(translator.translate(length(ref("arr")))).isEqualTo(byName.getTerm());
      assertThat(translator.getInfo(byName.getTerm()))
          .isEqualTo(TermInfo.bitVector(IntegerType.U32));
    }
  }

  /** Accessing an undeclared array declares it with 32-bit signed elements. */
  @Test
  void testUndeclaredArray() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      final Expr<?> element = translator.translate(at(ref("xs"), lit(0)));

      assertThat(element).isInstanceOf(BitVecExpr.class);
      assertThat(translator.getInfo(element)).isEqualTo(TermInfo.bitVector(IntegerType.I32));
      assertThat(translator.lookup("xs").getTypeName()).isEqualTo("i32[]");
      assertThat(translator.lookup("xs$length")).isNotNull();
    }
  }

  /** Indexing a scalar fails. */
  @Test
  void testIndexingScalar() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      translator.declareVariable("x", "i32");
      assertThat(translator.translateOrExplain(at(ref("x"), lit(0))).getFailure())
          .isEqualTo("Variable 'x' of type 'i32' is not an array");
    }
  }

  /** A non-ordinal comparison mode yields exactly one warning. */
  @Test
  void testComparisonModeWarning() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      translator.declareVariable("s", "string");

      final BoolExpr contains =
          translator.translateBool(
              string(StringOp.CONTAINS, StringComparisonMode.IGNORE_CASE, ref("s"), str("a")));
      assertThat(contains).isNotNull();
      assertThat(translator.getWarnings()).hasSize(1);
      assertThat(translator.getWarnings().get(0)).contains("IGNORE_CASE").contains("ordinal");
    }
  }

  /** Ordinal comparison emits no warning. */
  @Test
  void testOrdinalNoWarning() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      translator.declareVariable("s", "string");
      translator.translate(
          string(StringOp.STARTS_WITH, StringComparisonMode.ORDINAL, ref("s"), str("a")));
      assertThat(translator.getWarnings()).isEmpty();
    }
  }

  /** String length and prefix tests agree with concrete strings. */
  @Test
  void testStringSemantics() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      final BoolExpr lengthIsFive =
          translator.translateBool(eq(string(StringOp.LENGTH, str("hello")), lit(5)));
      final BoolExpr prefix =
          translator.translateBool(string(StringOp.STARTS_WITH, str("hello"), str("he")));
      final BoolExpr concat =
          translator.translateBool(
              string(StringOp.EQUALS, string(StringOp.CONCAT, str("he"), str("llo")), str("hello")));

      assertValid(ctx, lengthIsFive);
      assertValid(ctx, prefix);
      assertValid(ctx, concat);
    }
  }

  /** Operations outside the string theory are not approximated. */
  @Test
  void testUnsupportedStringOperation() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      translator.declareVariable("s", "string");
      assertThat(translator.translate(string(StringOp.TO_UPPER, ref("s")))).isNull();
      assertThat(translator.translateOrExplain(string(StringOp.TO_UPPER, ref("s"))).getFailure())
          .contains("TO_UPPER");
    }
  }

  /** Floats and calls never translate. */
  @Test
  void testFloatAndCall() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      assertThat(translator.translate(new FloatLiteral(1.5))).isNull();
      assertThat(translator.translateOrExplain(call("f", lit(1))).getFailure())
          .contains("Function call 'f'");
    }
  }

  /** A non-boolean expression is rejected where a condition is expected. */
  @Test
  void testConditionMustBeBoolean() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      translator.declareVariable("x", "i32");
      assertThat(translator.translate(ref("x"))).isNotNull();
      assertThat(translator.translateBool(ref("x"))).isNull();
      assertThat(translator.translateBoolOrExplain(ref("x")).getFailure())
          .startsWith("Expression must be boolean for verification, but got i32");
    }
  }

  /** A bound variable shadows an outer one only inside the quantifier. */
  @Test
  void testQuantifierShadowing() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      translator.declareVariable("x", "u32");
      final Expr<?> outer = translator.lookup("x").getTerm();

      final BoolExpr quantified =
          translator.translateBool(forall(var("x", "i32"), eq(ref("x"), ref("x"))));
      assertThat(quantified).isNotNull();
      assertThat(translator.lookup("x").getTerm()).isEqualTo(outer);
      assertThat(translator.getInfo(outer)).isEqualTo(TermInfo.bitVector(IntegerType.U32));
      assertValid(ctx, quantified);
    }
  }

  /** A failing quantifier body still restores the enclosing bindings. */
  @Test
  void testQuantifierFailureRestoresScope() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      translator.declareVariable("x", "u32");
      final Expr<?> outer = translator.lookup("x").getTerm();

      final Translation failed =
          translator.translateOrExplain(
              forall(var("x", "i32"), gt(ref("x"), ref("missing"))));
      assertThat(failed.isSuccess()).isFalse();
      assertThat(failed.getFailure()).isEqualTo("Unknown variable 'missing'");
      assertThat(translator.lookup("x").getTerm()).isEqualTo(outer);
      assertThat(translator.symbols().depth()).isZero();
    }
  }

  /** Bound variables of unsupported type are named in the failure. */
  @Test
  void testQuantifierUnsupportedBoundType() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      assertThat(
              translator
                  .translateOrExplain(forall(var("d", "f64"), eq(ref("d"), ref("d"))))
                  .getFailure())
          .startsWith("Unsupported type 'f64' for bound variable 'd' in forall expression");
      assertThat(translator.lookup("d")).isNull();
    }
  }

  /** An array first accessed inside a quantifier stays declared after it. */
  @Test
  void testArrayDeclaredInsideQuantifier() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      translator.declareVariable("n", "i32");

      final BoolExpr quantified =
          translator.translateBool(forall(var("i", "i32"), gt(at(ref("ys"), ref("i")), ref("n"))));
      assertThat(quantified).isNotNull();
      assertThat(translator.symbols().depth()).isZero();
      assertThat(translator.getVariables()).containsOnlyKeys("n", "ys", "ys$length");
      assertThat(translator.lookup("i")).isNull();
    }
  }

  /** A scalar bound over an array name hides the array's length too. */
  @Test
  void testScalarShadowsArrayLength() {
    try (Context ctx = new Context()) {
      final ContractTranslator translator = new ContractTranslator(ctx);
      translator.declareVariable("arr", "i32[]");
      final Expr<?> outerLength = translator.lookup("arr$length").getTerm();

      final Translation shadowed =
          translator.translateOrExplain(
              forall(var("arr", "i32"), gt(length(ref("arr")), lit(0))));
      assertThat(shadowed.getFailure()).isEqualTo("Variable 'arr' of type 'i32' is not an array");
      assertThat(translator.translate(length(ref("arr")))).isEqualTo(outerLength);
    }
  }
}
