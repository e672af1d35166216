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

import static java.util.Collections.unmodifiableMap;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Name bindings of one translation, with a stack of full snapshots for quantifier scopes. Bindings
 * keep declaration order so counterexamples list symbols deterministically.
 */
final class SymbolTable {

  /** The convention naming the length companion of an array. */
  static final String LENGTH_SUFFIX = "$length";

  /** The bindings saved by one {@link #pushScope()} or {@link #pushIsolatedScope()}. */
  private static final class Frame {
    final Map<String, Symbol> saved;
    final boolean isolated;

    Frame(final Map<String, Symbol> saved, final boolean isolated) {
      this.saved = saved;
      this.isolated = isolated;
    }
  }

  private Map<String, Symbol> symbols = new LinkedHashMap<>();

  private final Deque<Frame> scopes = new ArrayDeque<>();

  static String lengthName(final String arrayName) {
    return arrayName + LENGTH_SUFFIX;
  }

  Symbol lookup(final String name) {
    return symbols.get(name);
  }

  void bind(final Symbol symbol) {
    symbols.put(symbol.getName(), symbol);
  }

  /**
   * Bind a free symbol in the current scope and in every enclosing quantifier scope, so it outlives
   * the quantifiers it was first seen in. Bindings saved by an isolated scope are left untouched.
   *
   * @param symbol the symbol.
   */
  void bindOutermost(final Symbol symbol) {
    bind(symbol);
    for (final Frame frame : scopes) {
      if (frame.isolated) {
        break;
      }
      frame.saved.put(symbol.getName(), symbol);
    }
  }

  /** Snapshot the current bindings. Must be paired with {@link #popScope()}. */
  void pushScope() {
    push(false);
  }

  /**
   * Snapshot the current bindings such that nothing bound until the matching {@link #popScope()}
   * survives it, including symbols bound by {@link #bindOutermost(Symbol)}.
   */
  void pushIsolatedScope() {
    push(true);
  }

  private void push(final boolean isolated) {
    scopes.push(new Frame(symbols, isolated));
    symbols = new LinkedHashMap<>(symbols);
  }

  /**
   * Restore the bindings saved by the matching push.
   *
   * @throws IllegalStateException if no scope is open.
   */
  void popScope() {
    if (scopes.isEmpty()) {
      throw new IllegalStateException("no open scope");
    }
    symbols = scopes.pop().saved;
  }

  int depth() {
    return scopes.size();
  }

  Map<String, Symbol> view() {
    return unmodifiableMap(symbols);
  }
}
