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

import static java.util.Collections.singletonList;
import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

import com.microsoft.z3.ArrayExpr;
import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.CharSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntExpr;
import com.microsoft.z3.Quantifier;
import com.microsoft.z3.SeqExpr;
import com.microsoft.z3.Sort;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.aqua.contracts.ast.ArrayAccess;
import tools.aqua.contracts.ast.ArrayLength;
import tools.aqua.contracts.ast.BinaryOperation;
import tools.aqua.contracts.ast.BinaryOperator;
import tools.aqua.contracts.ast.BoolLiteral;
import tools.aqua.contracts.ast.BoundVariable;
import tools.aqua.contracts.ast.Call;
import tools.aqua.contracts.ast.Conditional;
import tools.aqua.contracts.ast.Expression;
import tools.aqua.contracts.ast.ExpressionVisitor;
import tools.aqua.contracts.ast.FloatLiteral;
import tools.aqua.contracts.ast.Implication;
import tools.aqua.contracts.ast.IntLiteral;
import tools.aqua.contracts.ast.QuantifierExpression;
import tools.aqua.contracts.ast.Reference;
import tools.aqua.contracts.ast.StringComparisonMode;
import tools.aqua.contracts.ast.StringLiteral;
import tools.aqua.contracts.ast.StringOperation;
import tools.aqua.contracts.ast.UnaryOperation;
import tools.aqua.contracts.verification.types.IntegerType;
import tools.aqua.contracts.verification.types.ResolvedType;
import tools.aqua.contracts.verification.types.TypeRegistry;

/**
 * Lowers contract expressions to Z3 terms over bit-vectors, booleans, strings and arrays.
 *
 * <p>Integers are fixed-width bit-vectors with two's-complement wrap-around. Operands of different
 * widths are widened to the wider width first, by sign extension if the narrower operand is signed
 * and by zero extension otherwise. Addition, subtraction and multiplication do not depend on
 * signedness; their result is unsigned only if both operands are. Division, remainder and the
 * relational operators pick the signed or unsigned solver primitive: signed if both operands are
 * signed, unsigned if both are unsigned, and for mixed operands unsigned only if the signed operand
 * is a literal that is non-negative at its width. Everything else falls back to signed.
 *
 * <p>Known gaps:
 *
 * <ul>
 *   <li>Integer literals are always signed 32-bit; values outside that range are truncated. Narrow
 *       operands are not promoted to 32 bits before arithmetic, so {@code u8} sums wrap at 8 bits.
 *   <li>Strings use the solver's sequence theory, which is ordinal only. A requested non-ordinal
 *       comparison mode is ignored and recorded as a warning.
 *   <li>Strings cannot be null, so {@code IsNullOrEmpty} is {@code length == 0}.
 * </ul>
 *
 * <p>Each array {@code a} is an uninterpreted map from 64-bit indices to elements, paired with an
 * unsigned 32-bit constant {@code a$length}. Accessing an undeclared array declares it with {@code
 * i32} elements.
 *
 * <p>Instances hold the symbol table, term metadata and warnings of a single verification and are
 * not thread-safe. Create a fresh translator per verification.
 */
public final class ContractTranslator {

  private static final Logger logger = LoggerFactory.getLogger(ContractTranslator.class);

  /** Width of integer literals. */
  static final int LITERAL_WIDTH = 32;

  /** Width of array indices after extension. */
  static final int INDEX_WIDTH = 64;

  /** Width of array and string lengths. */
  static final int LENGTH_WIDTH = 32;

  /** Element type of arrays that are accessed without a declaration. */
  static final IntegerType DEFAULT_ELEMENT_TYPE = IntegerType.I32;

  private final Context context;
  private final TermTracker tracker = new TermTracker();
  private final SymbolTable symbols = new SymbolTable();
  private final List<String> warnings = new ArrayList<>();
  private final Lowering lowering = new Lowering();

  /**
   * Create a translator building terms in the given context. The context stays owned by the
   * caller.
   *
   * @param context the Z3 context.
   */
  public ContractTranslator(final Context context) {
    this.context = requireNonNull(context, "context");
  }

  /**
   * Declare a variable. Array types also declare the companion length constant. An unsupported
   * type leaves the translator unchanged.
   *
   * @param name the variable name.
   * @param typeName the declared type name.
   * @return {@code true} iff the type is supported and the variable was declared.
   */
  public boolean declareVariable(final String name, final String typeName) {
    requireNonNull(name, "name");
    final ResolvedType type = TypeRegistry.resolve(typeName);
    if (!type.isSupported()) {
      logger.debug("Cannot declare {}: {}", name, type.describeUnsupported());
      return false;
    }
    bind(name, type, false);
    return true;
  }

  /**
   * Translate an expression.
   *
   * @param node the expression.
   * @return the term, or {@code null} if the expression cannot be modeled.
   */
  public Expr<?> translate(final Expression node) {
    return translateOrExplain(node).getTerm();
  }

  /**
   * Translate an expression that must be boolean.
   *
   * @param node the expression.
   * @return the term, or {@code null} if the expression cannot be modeled or is not boolean.
   */
  public BoolExpr translateBool(final Expression node) {
    return (BoolExpr) translateBoolOrExplain(node).getTerm();
  }

  /**
   * Translate an expression, keeping the reason on failure.
   *
   * @param node the expression.
   * @return the translation.
   */
  public Translation translateOrExplain(final Expression node) {
    return requireNonNull(node, "node").accept(lowering);
  }

  /**
   * Translate an expression that must be boolean, keeping the reason on failure.
   *
   * @param node the expression.
   * @return the translation; a successful one always holds a {@link BoolExpr}.
   */
  public Translation translateBoolOrExplain(final Expression node) {
    final Translation translation = translateOrExplain(node);
    if (translation.isSuccess() && !(translation.getTerm() instanceof BoolExpr)) {
      return Translation.failure(
          "Expression must be boolean for verification, but got "
              + describe(translation.getTerm())
              + ". Boolean expressions include comparisons (==, !=, <, >, <=, >=), "
              + "logical operations (&&, ||, !), and boolean variables.");
    }
    return translation;
  }

  /** @return the visible bindings in declaration order. */
  public Map<String, Symbol> getVariables() {
    return symbols.view();
  }

  /**
   * Look up a visible binding.
   *
   * @param name the name.
   * @return the symbol, or {@code null} if the name is not bound.
   */
  public Symbol lookup(final String name) {
    return symbols.lookup(name);
  }

  /**
   * Get the metadata of a term built by this translator.
   *
   * @param term the term.
   * @return its metadata.
   */
  public TermInfo getInfo(final Expr<?> term) {
    return tracker.lookup(term);
  }

  /** @return the warnings accumulated so far, in emission order. */
  public List<String> getWarnings() {
    return unmodifiableList(new ArrayList<>(warnings));
  }

  SymbolTable symbols() {
    return symbols;
  }

  int warningCount() {
    return warnings.size();
  }

  void discardWarningsAfter(final int count) {
    warnings.subList(count, warnings.size()).clear();
  }

  /**
   * Decide whether a division, remainder or comparison uses the unsigned solver primitive.
   *
   * @param left the left operand before width normalization.
   * @param right the right operand before width normalization.
   * @return {@code true} for the unsigned primitive.
   */
  boolean prefersUnsigned(final BitVecExpr left, final BitVecExpr right) {
    final boolean leftSigned = tracker.isSigned(left);
    final boolean rightSigned = tracker.isSigned(right);
    if (!leftSigned && !rightSigned) return true;
    if (leftSigned && rightSigned) return false;
    if (!leftSigned && isNonNegativeLiteral(right)) return true;
    if (!rightSigned && isNonNegativeLiteral(left)) return true;
    return false;
  }

  private static boolean isNonNegativeLiteral(final Expr<?> term) {
    if (!(term instanceof BitVecNum)) {
      return false;
    }
    final BitVecNum number = (BitVecNum) term;
    final BigInteger maxPositive =
        BigInteger.ONE.shiftLeft(number.getSortSize() - 1).subtract(BigInteger.ONE);
    final BigInteger value = number.getBigInteger();
    return value.signum() >= 0 && value.compareTo(maxPositive) <= 0;
  }

  // ---------------------------------------------------------------------------------------------
  // declarations

  /**
   * Create the constants for a supported type and bind them.
   *
   * @param name the source name.
   * @param type the resolved type.
   * @param fresh whether to use fresh solver names, for quantifier-bound variables.
   * @return the created constants; an array yields the array and its length.
   */
  private List<Expr<?>> bind(final String name, final ResolvedType type, final boolean fresh) {
    switch (type.getKind()) {
      case BIT_VECTOR:
        {
          final IntegerType integer = type.getIntegerType();
          final BitVecExpr constant =
              tracker.trackBitVector(
                  (BitVecExpr) constant(name, context.mkBitVecSort(integer.getWidth()), fresh),
                  integer);
          symbols.bind(new Symbol(name, constant, type.getTypeName()));
          return singletonList(constant);
        }
      case BOOL:
        {
          final Expr<?> constant =
              tracker.track(constant(name, context.getBoolSort(), fresh), TermInfo.bool());
          symbols.bind(new Symbol(name, constant, type.getTypeName()));
          return singletonList(constant);
        }
      case STRING:
        {
          final Expr<?> constant =
              tracker.track(constant(name, context.getStringSort(), fresh), TermInfo.string());
          symbols.bind(new Symbol(name, constant, type.getTypeName()));
          return singletonList(constant);
        }
      case ARRAY:
        return bindArray(name, type.getIntegerType(), type.getTypeName(), fresh);
      default:
        throw new IllegalArgumentException(type.describeUnsupported());
    }
  }

  private List<Expr<?>> bindArray(
      final String name, final IntegerType element, final String typeName, final boolean fresh) {
    final Expr<?> array =
        tracker.track(
            constant(
                name,
                context.mkArraySort(
                    context.mkBitVecSort(INDEX_WIDTH), context.mkBitVecSort(element.getWidth())),
                fresh),
            TermInfo.array(element));
    final String lengthName = SymbolTable.lengthName(name);
    final BitVecExpr length =
        tracker.trackBitVector(
            (BitVecExpr) constant(lengthName, context.mkBitVecSort(LENGTH_WIDTH), fresh),
            IntegerType.U32);
    final Symbol arraySymbol = new Symbol(name, array, typeName);
    final Symbol lengthSymbol = new Symbol(lengthName, length, IntegerType.U32.getName());
    if (fresh) {
      symbols.bind(arraySymbol);
      symbols.bind(lengthSymbol);
    } else {
      // free constants stay visible after the quantifiers they were first used in
      symbols.bindOutermost(arraySymbol);
      symbols.bindOutermost(lengthSymbol);
    }
    return Arrays.asList(array, length);
  }

  private Expr<?> constant(final String name, final Sort sort, final boolean fresh) {
    return fresh ? context.mkFreshConst(name, sort) : context.mkConst(name, sort);
  }

  // ---------------------------------------------------------------------------------------------
  // bit-vector helpers

  /** A pair of operands extended to a common width. */
  private static final class Operands {
    final BitVecExpr left;
    final BitVecExpr right;

    Operands(final BitVecExpr left, final BitVecExpr right) {
      this.left = left;
      this.right = right;
    }

    int width() {
      return left.getSortSize();
    }
  }

  private BitVecExpr extend(final BitVecExpr term, final int width) {
    final int current = term.getSortSize();
    if (current >= width) {
      return term;
    }
    return tracker.isSigned(term)
        ? context.mkSignExt(width - current, term)
        : context.mkZeroExt(width - current, term);
  }

  private Operands normalize(final BitVecExpr left, final BitVecExpr right) {
    final int width = Math.max(left.getSortSize(), right.getSortSize());
    return new Operands(extend(left, width), extend(right, width));
  }

  private BitVecExpr arithmetic(
      final BitVecExpr left,
      final BitVecExpr right,
      final BiFunction<BitVecExpr, BitVecExpr, BitVecExpr> operation) {
    final Operands operands = normalize(left, right);
    final boolean signed = tracker.isSigned(left) || tracker.isSigned(right);
    return tracker.trackBitVector(
        operation.apply(operands.left, operands.right), operands.width(), signed);
  }

  private BitVecExpr division(
      final BitVecExpr left,
      final BitVecExpr right,
      final BiFunction<BitVecExpr, BitVecExpr, BitVecExpr> signedOperation,
      final BiFunction<BitVecExpr, BitVecExpr, BitVecExpr> unsignedOperation) {
    final Operands operands = normalize(left, right);
    final boolean unsigned = prefersUnsigned(left, right);
    final BitVecExpr result =
        (unsigned ? unsignedOperation : signedOperation).apply(operands.left, operands.right);
    return tracker.trackBitVector(result, operands.width(), !unsigned);
  }

  private BoolExpr comparison(
      final BitVecExpr left,
      final BitVecExpr right,
      final BiFunction<BitVecExpr, BitVecExpr, BoolExpr> signedOperation,
      final BiFunction<BitVecExpr, BitVecExpr, BoolExpr> unsignedOperation) {
    final Operands operands = normalize(left, right);
    return (prefersUnsigned(left, right) ? unsignedOperation : signedOperation)
        .apply(operands.left, operands.right);
  }

  private BitVecExpr shift(
      final BitVecExpr left,
      final BitVecExpr right,
      final BiFunction<BitVecExpr, BitVecExpr, BitVecExpr> operation) {
    final Operands operands = normalize(left, right);
    return tracker.trackBitVector(
        operation.apply(operands.left, operands.right),
        operands.width(),
        tracker.isSigned(left));
  }

  private BoolExpr equal(final Expr<?> left, final Expr<?> right) {
    if (left instanceof BitVecExpr && right instanceof BitVecExpr) {
      final Operands operands = normalize((BitVecExpr) left, (BitVecExpr) right);
      return context.mkEq(operands.left, operands.right);
    }
    if (!left.getSort().equals(right.getSort())) {
      return null;
    }
    return sameSortEqual(left, right);
  }

  /**
   * Equate two terms whose sorts were checked to be equal.
   *
   * @param left the left term, fixing the sort.
   * @param right a term of the same sort.
   * @param <S> the common sort.
   * @return the equation.
   */
  @SuppressWarnings("unchecked")
  private <S extends Sort> BoolExpr sameSortEqual(final Expr<S> left, final Expr<?> right) {
    return context.mkEq(left, (Expr<S>) right);
  }

  private Expr<?> ite(final BoolExpr condition, final Expr<?> whenTrue, final Expr<?> whenFalse) {
    return context.<Sort>mkITE(condition, whenTrue, whenFalse);
  }

  @SuppressWarnings("unchecked")
  private static SeqExpr<CharSort> asString(final Expr<?> term) {
    return (SeqExpr<CharSort>) term;
  }

  private String describe(final Expr<?> term) {
    return tracker.lookup(term).toString();
  }

  private static String describe(final Expression node) {
    return node.getClass().getSimpleName();
  }

  private static boolean bothBitVectors(final Expr<?> left, final Expr<?> right) {
    return left instanceof BitVecExpr && right instanceof BitVecExpr;
  }

  private static boolean bothBooleans(final Expr<?> left, final Expr<?> right) {
    return left instanceof BoolExpr && right instanceof BoolExpr;
  }

  // ---------------------------------------------------------------------------------------------
  // lowering

  /** The single dispatch over expression nodes. Failures carry the first offending construct. */
  private final class Lowering implements ExpressionVisitor<Translation> {

    @Override
    public Translation visitIntLiteral(final IntLiteral node) {
      return Translation.of(
          tracker.trackBitVector(
              context.mkBV((int) node.getValue(), LITERAL_WIDTH), IntegerType.I32));
    }

    @Override
    public Translation visitFloatLiteral(final FloatLiteral node) {
      return Translation.failure(
          "Floating-point literal '"
              + node.getValue()
              + "' is not supported (bit-vector theory does not model floats)");
    }

    @Override
    public Translation visitBoolLiteral(final BoolLiteral node) {
      return Translation.of(context.mkBool(node.getValue()));
    }

    @Override
    public Translation visitStringLiteral(final StringLiteral node) {
      return Translation.of(tracker.track(context.mkString(node.getValue()), TermInfo.string()));
    }

    @Override
    public Translation visitReference(final Reference node) {
      final Symbol symbol = symbols.lookup(node.getName());
      if (symbol == null) {
        return Translation.failure("Unknown variable '" + node.getName() + "'");
      }
      return Translation.of(symbol.getTerm());
    }

    @Override
    public Translation visitBinaryOperation(final BinaryOperation node) {
      final Translation left = node.getLeft().accept(this);
      if (!left.isSuccess()) return left;
      final Translation right = node.getRight().accept(this);
      if (!right.isSuccess()) return right;

      final Expr<?> l = left.getTerm();
      final Expr<?> r = right.getTerm();
      final BinaryOperator operator = node.getOperator();
      switch (operator) {
        case ADD:
        case SUBTRACT:
        case MULTIPLY:
        case DIVIDE:
        case MODULO:
          if (!bothBitVectors(l, r)) {
            return operandMismatch("Arithmetic operator", operator, "integer", l, r);
          }
          return Translation.of(arithmetic(operator, (BitVecExpr) l, (BitVecExpr) r));

        case LESS_THAN:
        case LESS_OR_EQUAL:
        case GREATER_THAN:
        case GREATER_OR_EQUAL:
          if (!bothBitVectors(l, r)) {
            return operandMismatch("Comparison operator", operator, "integer", l, r);
          }
          return Translation.of(relational(operator, (BitVecExpr) l, (BitVecExpr) r));

        case EQUAL:
        case NOT_EQUAL:
          {
            final BoolExpr equality = equal(l, r);
            if (equality == null) {
              return Translation.failure(
                  "Equality operator '"
                      + operator.getSymbol()
                      + "' requires operands of the same type, but got "
                      + describe(l)
                      + " and "
                      + describe(r));
            }
            return Translation.of(
                operator == BinaryOperator.EQUAL ? equality : context.mkNot(equality));
          }

        case AND:
        case OR:
          if (!bothBooleans(l, r)) {
            return operandMismatch("Logical operator", operator, "boolean", l, r);
          }
          return Translation.of(
              operator == BinaryOperator.AND
                  ? context.mkAnd((BoolExpr) l, (BoolExpr) r)
                  : context.mkOr((BoolExpr) l, (BoolExpr) r));

        case BITWISE_AND:
        case BITWISE_OR:
        case BITWISE_XOR:
        case LEFT_SHIFT:
        case RIGHT_SHIFT:
          if (!bothBitVectors(l, r)) {
            return operandMismatch("Bitwise operator", operator, "integer", l, r);
          }
          return Translation.of(bitwise(operator, (BitVecExpr) l, (BitVecExpr) r));

        default:
          return Translation.failure("Unsupported binary operator '" + operator.getSymbol() + "'");
      }
    }

    private BitVecExpr arithmetic(
        final BinaryOperator operator, final BitVecExpr left, final BitVecExpr right) {
      switch (operator) {
        case ADD:
          return ContractTranslator.this.arithmetic(left, right, context::mkBVAdd);
        case SUBTRACT:
          return ContractTranslator.this.arithmetic(left, right, context::mkBVSub);
        case MULTIPLY:
          return ContractTranslator.this.arithmetic(left, right, context::mkBVMul);
        case DIVIDE:
          return division(left, right, context::mkBVSDiv, context::mkBVUDiv);
        default:
          // truncated remainder: the result takes the sign of the dividend
          return division(left, right, context::mkBVSRem, context::mkBVURem);
      }
    }

    private BoolExpr relational(
        final BinaryOperator operator, final BitVecExpr left, final BitVecExpr right) {
      switch (operator) {
        case LESS_THAN:
          return comparison(left, right, context::mkBVSLT, context::mkBVULT);
        case LESS_OR_EQUAL:
          return comparison(left, right, context::mkBVSLE, context::mkBVULE);
        case GREATER_THAN:
          return comparison(left, right, context::mkBVSGT, context::mkBVUGT);
        default:
          return comparison(left, right, context::mkBVSGE, context::mkBVUGE);
      }
    }

    private BitVecExpr bitwise(
        final BinaryOperator operator, final BitVecExpr left, final BitVecExpr right) {
      switch (operator) {
        case BITWISE_AND:
          return ContractTranslator.this.arithmetic(left, right, context::mkBVAND);
        case BITWISE_OR:
          return ContractTranslator.this.arithmetic(left, right, context::mkBVOR);
        case BITWISE_XOR:
          return ContractTranslator.this.arithmetic(left, right, context::mkBVXOR);
        case LEFT_SHIFT:
          return shift(left, right, context::mkBVSHL);
        default:
          return tracker.isSigned(left)
              ? shift(left, right, context::mkBVASHR)
              : shift(left, right, context::mkBVLSHR);
      }
    }

    private Translation operandMismatch(
        final String category,
        final BinaryOperator operator,
        final String expected,
        final Expr<?> left,
        final Expr<?> right) {
      return Translation.failure(
          category
              + " '"
              + operator.getSymbol()
              + "' requires "
              + expected
              + " operands, but got "
              + describe(left)
              + " and "
              + describe(right));
    }

    @Override
    public Translation visitUnaryOperation(final UnaryOperation node) {
      final Translation operand = node.getOperand().accept(this);
      if (!operand.isSuccess()) return operand;
      final Expr<?> term = operand.getTerm();

      switch (node.getOperator()) {
        case NOT:
          if (!(term instanceof BoolExpr)) {
            return Translation.failure(
                "Logical NOT requires a boolean operand, but got " + describe(term));
          }
          return Translation.of(context.mkNot((BoolExpr) term));
        case NEGATE:
          if (!(term instanceof BitVecExpr)) {
            return Translation.failure(
                "Negation requires an integer operand, but got " + describe(term));
          }
          return Translation.of(
              tracker.track(context.mkBVNeg((BitVecExpr) term), tracker.lookup(term)));
        default:
          return Translation.failure(
              "Unsupported unary operator '" + node.getOperator().getSymbol() + "'");
      }
    }

    @Override
    public Translation visitConditional(final Conditional node) {
      final Translation condition = node.getCondition().accept(this);
      if (!condition.isSuccess()) return condition;
      if (!(condition.getTerm() instanceof BoolExpr)) {
        return Translation.failure(
            "Conditional expression requires boolean condition, but got "
                + describe(condition.getTerm()));
      }
      final Translation whenTrue = node.getWhenTrue().accept(this);
      if (!whenTrue.isSuccess()) return whenTrue;
      final Translation whenFalse = node.getWhenFalse().accept(this);
      if (!whenFalse.isSuccess()) return whenFalse;

      final BoolExpr test = (BoolExpr) condition.getTerm();
      final Expr<?> t = whenTrue.getTerm();
      final Expr<?> f = whenFalse.getTerm();
      if (bothBitVectors(t, f)) {
        final BitVecExpr left = (BitVecExpr) t;
        final BitVecExpr right = (BitVecExpr) f;
        final Operands operands = normalize(left, right);
        final boolean signed = tracker.isSigned(left) || tracker.isSigned(right);
        return Translation.of(
            tracker.trackBitVector(
                (BitVecExpr) ite(test, operands.left, operands.right), operands.width(), signed));
      }
      if (!t.getSort().equals(f.getSort())) {
        return Translation.failure(
            "Conditional branches have incompatible types: '"
                + describe(t)
                + "' and '"
                + describe(f)
                + "'");
      }
      return Translation.of(tracker.track(ite(test, t, f), tracker.lookup(t)));
    }

    @Override
    public Translation visitQuantifier(final QuantifierExpression node) {
      final String keyword = node.getKind().getKeyword();
      symbols.pushScope();
      try {
        final List<Expr<?>> bound = new ArrayList<>();
        for (final BoundVariable variable : node.getBoundVariables()) {
          final ResolvedType type = TypeRegistry.resolve(variable.getTypeName());
          if (!type.isSupported()) {
            return Translation.failure(
                "Unsupported type '"
                    + variable.getTypeName()
                    + "' for bound variable '"
                    + variable.getName()
                    + "' in "
                    + keyword
                    + " expression: "
                    + type.describeUnsupported());
          }
          bound.addAll(bind(variable.getName(), type, true));
        }

        final Translation body = node.getBody().accept(this);
        if (!body.isSuccess()) return body;
        if (!(body.getTerm() instanceof BoolExpr)) {
          return Translation.failure(
              "Body of " + keyword + " expression must be boolean, but got "
                  + describe(body.getTerm()));
        }

        final Expr<?>[] constants = bound.toArray(new Expr<?>[0]);
        final BoolExpr matrix = (BoolExpr) body.getTerm();
        final Quantifier quantifier =
            node.getKind() == QuantifierExpression.Kind.FORALL
                ? context.mkForall(constants, matrix, 1, null, null, null, null)
                : context.mkExists(constants, matrix, 1, null, null, null, null);
        return Translation.of(quantifier);
      } finally {
        symbols.popScope();
      }
    }

    @Override
    public Translation visitImplication(final Implication node) {
      final Translation antecedent = node.getAntecedent().accept(this);
      if (!antecedent.isSuccess()) return antecedent;
      if (!(antecedent.getTerm() instanceof BoolExpr)) {
        return Translation.failure(
            "Implication antecedent must be boolean, but got " + describe(antecedent.getTerm()));
      }
      final Translation consequent = node.getConsequent().accept(this);
      if (!consequent.isSuccess()) return consequent;
      if (!(consequent.getTerm() instanceof BoolExpr)) {
        return Translation.failure(
            "Implication consequent must be boolean, but got " + describe(consequent.getTerm()));
      }
      // p -> q as !p || q
      return Translation.of(
          context.mkOr(
              context.mkNot((BoolExpr) antecedent.getTerm()), (BoolExpr) consequent.getTerm()));
    }

    @Override
    @SuppressWarnings("unchecked")
    public Translation visitArrayAccess(final ArrayAccess node) {
      if (!(node.getArray() instanceof Reference)) {
        return Translation.failure(
            "Array access requires a simple variable reference, but got '"
                + describe(node.getArray())
                + "' (computed array expressions like method returns or nested accesses are not"
                + " supported)");
      }
      final Translation index = node.getIndex().accept(this);
      if (!index.isSuccess()) return index;
      if (!(index.getTerm() instanceof BitVecExpr)) {
        return Translation.failure(
            "Array index must be an integer, but got " + describe(index.getTerm()));
      }

      final String name = ((Reference) node.getArray()).getName();
      final Symbol symbol = resolveArray(name);
      if (!(symbol.getTerm() instanceof ArrayExpr)) {
        return notAnArray(symbol);
      }

      final ArrayExpr<BitVecSort, BitVecSort> array =
          (ArrayExpr<BitVecSort, BitVecSort>) symbol.getTerm();
      final BitVecExpr position = extend((BitVecExpr) index.getTerm(), INDEX_WIDTH);
      final BitVecExpr element = (BitVecExpr) context.mkSelect(array, position);
      return Translation.of(
          tracker.track(element, TermInfo.bitVector(tracker.lookup(array).getElementType())));
    }

    @Override
    public Translation visitArrayLength(final ArrayLength node) {
      if (!(node.getArray() instanceof Reference)) {
        return Translation.failure(
            "Array length requires a simple variable reference, but got '"
                + describe(node.getArray())
                + "'");
      }
      final String name = ((Reference) node.getArray()).getName();
      final Symbol symbol = resolveArray(name);
      if (!(symbol.getTerm() instanceof ArrayExpr)) {
        return notAnArray(symbol);
      }
      return Translation.of(symbols.lookup(SymbolTable.lengthName(name)).getTerm());
    }

    /** Find an array binding, declaring it with the default element type if it is unknown. */
    private Symbol resolveArray(final String name) {
      final Symbol existing = symbols.lookup(name);
      if (existing != null) {
        return existing;
      }
      logger.debug("Declaring undeclared array {} with {} elements", name, DEFAULT_ELEMENT_TYPE);
      bindArray(name, DEFAULT_ELEMENT_TYPE, DEFAULT_ELEMENT_TYPE.getName() + "[]", false);
      return symbols.lookup(name);
    }

    private Translation notAnArray(final Symbol symbol) {
      return Translation.failure(
          "Variable '" + symbol.getName() + "' of type '" + symbol.getTypeName()
              + "' is not an array");
    }

    @Override
    public Translation visitStringOperation(final StringOperation node) {
      final StringComparisonMode mode = node.getComparisonMode();
      if (mode != null && mode != StringComparisonMode.ORDINAL) {
        final String warning =
            "String operation '"
                + node.getOperation()
                + "' specifies comparison mode '"
                + mode
                + "' which is ignored during verification. The string theory only supports ordinal"
                + " comparison; case-insensitive or culture-aware comparisons cannot be modeled."
                + " Verification will use ordinal comparison semantics.";
        logger.debug(warning);
        warnings.add(warning);
      }

      switch (node.getOperation()) {
        case LENGTH:
          return stringQuery(node, 1);
        case CONTAINS:
        case STARTS_WITH:
        case ENDS_WITH:
        case EQUALS:
          return stringQuery(node, 2);
        case IS_NULL_OR_EMPTY:
          return stringQuery(node, 1);
        case INDEX_OF:
          return indexOf(node);
        case SUBSTRING:
          return substring(node);
        case SUBSTRING_FROM:
          return substringFrom(node);
        case CONCAT:
          return concat(node);
        case REPLACE:
          return replace(node);
        default:
          return Translation.failure(
              "String operation '"
                  + node.getOperation()
                  + "' is not supported (the string theory lacks this operation)");
      }
    }

    /** Queries taking only string arguments. */
    private Translation stringQuery(final StringOperation node, final int arity) {
      final Translation arityFailure = checkArity(node, arity);
      if (arityFailure != null) return arityFailure;
      final List<SeqExpr<CharSort>> strings = new ArrayList<>();
      for (int i = 0; i < arity; i++) {
        final Translation argument = stringArgument(node, i);
        if (!argument.isSuccess()) return argument;
        strings.add(asString(argument.getTerm()));
      }
      final SeqExpr<CharSort> s = strings.get(0);
      switch (node.getOperation()) {
        case LENGTH:
          return Translation.of(
              tracker.trackBitVector(
                  context.mkInt2BV(LENGTH_WIDTH, context.mkLength(s)), IntegerType.U32));
        case IS_NULL_OR_EMPTY:
          // no null in the sequence theory: only emptiness is checked
          return Translation.of(context.mkEq(context.mkLength(s), context.mkInt(0)));
        case CONTAINS:
          return Translation.of(context.mkContains(s, strings.get(1)));
        case STARTS_WITH:
          return Translation.of(context.mkPrefixOf(strings.get(1), s));
        case ENDS_WITH:
          return Translation.of(context.mkSuffixOf(strings.get(1), s));
        default:
          return Translation.of(context.mkEq(s, strings.get(1)));
      }
    }

    private Translation indexOf(final StringOperation node) {
      final Translation arityFailure = checkArity(node, 2);
      if (arityFailure != null) return arityFailure;
      final Translation s = stringArgument(node, 0);
      if (!s.isSuccess()) return s;
      final Translation search = stringArgument(node, 1);
      if (!search.isSuccess()) return search;

      IntExpr start = context.mkInt(0);
      if (node.getArguments().size() >= 3) {
        final Translation offset = integerArgument(node, 2, "IndexOf start index");
        if (!offset.isSuccess()) return offset;
        start = (IntExpr) offset.getTerm();
      }
      final IntExpr index =
          context.mkIndexOf(asString(s.getTerm()), asString(search.getTerm()), start);
      return Translation.of(
          tracker.trackBitVector(context.mkInt2BV(LENGTH_WIDTH, index), IntegerType.I32));
    }

    private Translation substring(final StringOperation node) {
      final Translation arityFailure = checkArity(node, 3);
      if (arityFailure != null) return arityFailure;
      final Translation s = stringArgument(node, 0);
      if (!s.isSuccess()) return s;
      final Translation start = integerArgument(node, 1, "Substring start index");
      if (!start.isSuccess()) return start;
      final Translation count = integerArgument(node, 2, "Substring length");
      if (!count.isSuccess()) return count;
      return Translation.of(
          tracker.track(
              context.mkExtract(
                  asString(s.getTerm()), (IntExpr) start.getTerm(), (IntExpr) count.getTerm()),
              TermInfo.string()));
    }

    private Translation substringFrom(final StringOperation node) {
      final Translation arityFailure = checkArity(node, 2);
      if (arityFailure != null) return arityFailure;
      final Translation s = stringArgument(node, 0);
      if (!s.isSuccess()) return s;
      final Translation start = integerArgument(node, 1, "SubstringFrom start index");
      if (!start.isSuccess()) return start;

      final SeqExpr<CharSort> string = asString(s.getTerm());
      final IntExpr offset = (IntExpr) start.getTerm();
      final IntExpr remaining = (IntExpr) context.mkSub(context.mkLength(string), offset);
      return Translation.of(
          tracker.track(context.mkExtract(string, offset, remaining), TermInfo.string()));
    }

    private Translation concat(final StringOperation node) {
      final Translation arityFailure = checkArity(node, 2);
      if (arityFailure != null) return arityFailure;
      SeqExpr<CharSort> result = null;
      for (int i = 0; i < node.getArguments().size(); i++) {
        final Translation argument = stringArgument(node, i);
        if (!argument.isSuccess()) return argument;
        final SeqExpr<CharSort> next = asString(argument.getTerm());
        result = result == null ? next : context.mkConcat(result, next);
      }
      return Translation.of(tracker.track(result, TermInfo.string()));
    }

    private Translation replace(final StringOperation node) {
      final Translation arityFailure = checkArity(node, 3);
      if (arityFailure != null) return arityFailure;
      final Translation s = stringArgument(node, 0);
      if (!s.isSuccess()) return s;
      final Translation source = stringArgument(node, 1);
      if (!source.isSuccess()) return source;
      final Translation target = stringArgument(node, 2);
      if (!target.isSuccess()) return target;
      // first occurrence only
      return Translation.of(
          tracker.track(
              context.mkReplace(
                  asString(s.getTerm()), asString(source.getTerm()), asString(target.getTerm())),
              TermInfo.string()));
    }

    private Translation checkArity(final StringOperation node, final int minimum) {
      final int actual = node.getArguments().size();
      if (actual >= minimum) {
        return null;
      }
      return Translation.failure(
          "String operation '"
              + node.getOperation()
              + "' requires at least "
              + minimum
              + (minimum == 1 ? " argument" : " arguments")
              + ", but got "
              + actual);
    }

    private Translation stringArgument(final StringOperation node, final int position) {
      final Translation argument = node.getArguments().get(position).accept(this);
      if (!argument.isSuccess()) return argument;
      if (!(argument.getTerm() instanceof SeqExpr)) {
        return Translation.failure(
            "String operation '"
                + node.getOperation()
                + "' requires a string argument, but got "
                + describe(argument.getTerm()));
      }
      return argument;
    }

    /** Translates an integer argument and converts it to the unbounded integers strings use. */
    private Translation integerArgument(
        final StringOperation node, final int position, final String role) {
      final Translation argument = node.getArguments().get(position).accept(this);
      if (!argument.isSuccess()) return argument;
      if (!(argument.getTerm() instanceof BitVecExpr)) {
        return Translation.failure(
            role + " must be an integer, but got " + describe(argument.getTerm()));
      }
      final BitVecExpr term = (BitVecExpr) argument.getTerm();
      return Translation.of(context.mkBV2Int(term, tracker.isSigned(term)));
    }

    @Override
    public Translation visitCall(final Call node) {
      return Translation.failure(
          "Function call '"
              + node.getTarget()
              + "' is not supported (only built-in operations are verifiable)");
    }
  }
}
