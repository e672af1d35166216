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

package tools.aqua.contracts.verification;

import com.microsoft.z3.Context;
import com.microsoft.z3.Version;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates Z3 contexts. The native library is loaded on first use; if it cannot be loaded on this
 * platform the factory reports the solver as unavailable instead of failing.
 */
public final class Z3ContextFactory {

  private static final Logger logger = LoggerFactory.getLogger(Z3ContextFactory.class);

  /** This class should not be constructed. */
  private Z3ContextFactory() {
    throw new AssertionError();
  }

  /** Probes the native library once, on first access. */
  private static final class Holder {
    static final String VERSION = probe();

    private static String probe() {
      try {
        final String version = Version.getFullVersion();
        logger.debug("Loaded {}", version);
        return version;
      } catch (final LinkageError | IllegalStateException e) {
        logger.warn("Z3 is not available on this platform: {}", e.toString());
        return null;
      }
    }
  }

  /** @return {@code true} iff the native solver library could be loaded. */
  public static boolean isAvailable() {
    return Holder.VERSION != null;
  }

  /**
   * @return the full Z3 version string.
   * @throws IllegalStateException if Z3 is not available.
   */
  public static String version() {
    if (!isAvailable()) {
      throw new IllegalStateException("Z3 is not available");
    }
    return Holder.VERSION;
  }

  /**
   * Create a new context. The caller closes it.
   *
   * @return the context.
   * @throws IllegalStateException if Z3 is not available.
   */
  public static Context create() {
    if (!isAvailable()) {
      throw new IllegalStateException("Z3 is not available");
    }
    return new Context();
  }
}
