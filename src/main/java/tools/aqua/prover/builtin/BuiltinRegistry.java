/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * Copyright 2025-2026 The TurnKey Authors
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

package tools.aqua.prover.builtin;

import static java.util.Collections.unmodifiableMap;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The table of library function models, keyed by fully-qualified name. It is filled once when the
 * class is loaded and read-only afterwards.
 */
public final class BuiltinRegistry {

  private static final Logger logger = LoggerFactory.getLogger(BuiltinRegistry.class);

  private static final Map<String, Builtin> BUILTINS;

  static {
    final Map<String, Builtin> builtins = new TreeMap<>();
    RandomFunctions.register(builtins);
    MathFunctions.register(builtins);
    RegexFunctions.register(builtins);
    BUILTINS = unmodifiableMap(builtins);
  }

  private BuiltinRegistry() {}

  /**
   * Find the model of a library function.
   *
   * @param qualifiedName the fully-qualified name, e.g. {@code random.Random.randint}.
   * @return the handler, if one is registered.
   */
  public static Optional<Builtin> lookup(final String qualifiedName) {
    final Builtin builtin = BUILTINS.get(qualifiedName);
    logger.debug("Lookup of {}: {}", qualifiedName, builtin == null ? "not found" : "found");
    return Optional.ofNullable(builtin);
  }

  /**
   * Get the names of all registered functions.
   *
   * @return the names, sorted.
   */
  public static Set<String> names() {
    return BUILTINS.keySet();
  }
}
