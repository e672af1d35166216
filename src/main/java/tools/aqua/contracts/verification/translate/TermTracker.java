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

import com.microsoft.z3.ArrayExpr;
import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Expr;
import com.microsoft.z3.SeqExpr;
import java.util.HashMap;
import java.util.Map;
import tools.aqua.contracts.verification.types.IntegerType;

/**
 * Side table from solver terms to their {@link TermInfo}. Keys compare by Z3 AST equality, so a
 * term rebuilt from the same operands finds the same entry.
 */
final class TermTracker {

  private final Map<Expr<?>, TermInfo> infos = new HashMap<>();

  /**
   * Record the metadata of a term.
   *
   * @param term the term.
   * @param info its metadata.
   * @param <E> the term type.
   * @return {@code term}, for chaining.
   */
  <E extends Expr<?>> E track(final E term, final TermInfo info) {
    infos.put(term, info);
    return term;
  }

  <E extends BitVecExpr> E trackBitVector(final E term, final int width, final boolean signed) {
    return track(term, TermInfo.bitVector(width, signed));
  }

  <E extends BitVecExpr> E trackBitVector(final E term, final IntegerType type) {
    return track(term, TermInfo.bitVector(type));
  }

  /**
   * Look up the metadata of a term. Untracked bit-vectors are treated as signed at their sort
   * width, which is how untracked literals behave.
   *
   * @param term the term.
   * @return the metadata.
   * @throws IllegalArgumentException if the term is untracked and not of a known sort.
   */
  TermInfo lookup(final Expr<?> term) {
    final TermInfo info = infos.get(term);
    if (info != null) {
      return info;
    }
    if (term instanceof BitVecExpr) {
      return TermInfo.bitVector(((BitVecExpr) term).getSortSize(), true);
    }
    if (term instanceof BoolExpr) {
      return TermInfo.bool();
    }
    if (term instanceof SeqExpr) {
      return TermInfo.string();
    }
    if (term instanceof ArrayExpr) {
      return TermInfo.array(IntegerType.I32);
    }
    throw new IllegalArgumentException("untracked term of sort " + term.getSort());
  }

  boolean isSigned(final Expr<?> term) {
    return lookup(term).isSigned();
  }
}
