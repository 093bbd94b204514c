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

package tools.aqua.prover.context;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import tools.aqua.prover.value.Value;

/**
 * Variable bindings as a stack of layers. Lookups search from the top layer down; writes only ever
 * touch the top layer, so a child scope shadows its parent without modifying it.
 */
public final class Scope {

  /** The next layer down, or {@code null} for the root. */
  private final Scope parent;

  /** The bindings of this layer, in first-assignment order. */
  private final Map<String, Value> layer = new LinkedHashMap<>();

  private Scope(final Scope parent) {
    this.parent = parent;
  }

  /**
   * Create an empty scope without parent layers.
   *
   * @return the scope.
   */
  public static Scope root() {
    return new Scope(null);
  }

  /**
   * Create a scope whose single fresh layer sits on top of this one.
   *
   * @return the child scope.
   */
  public Scope child() {
    return new Scope(this);
  }

  /**
   * Look up a name, most recent layer first.
   *
   * @param name the variable name.
   * @return the bound value, if any layer binds the name.
   */
  public Optional<Value> get(final String name) {
    for (Scope scope = this; scope != null; scope = scope.parent) {
      final Value value = scope.layer.get(name);
      if (value != null) {
        return Optional.of(value);
      }
    }
    return Optional.empty();
  }

  /**
   * Bind a name in the top layer, shadowing bindings further down.
   *
   * @param name the variable name.
   * @param value the value.
   */
  public void set(final String name, final Value value) {
    layer.put(requireNonNull(name), requireNonNull(value));
  }

  /**
   * Get the bindings made in the top layer only.
   *
   * @return an unmodifiable view of the top layer.
   */
  public Map<String, Value> layer() {
    return unmodifiableMap(layer);
  }
}
