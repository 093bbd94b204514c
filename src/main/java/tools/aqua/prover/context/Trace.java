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

import static java.util.Objects.requireNonNull;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The names of the functions currently being evaluated. Entering a function that is already on
 * the trace is a (direct or mutual) recursive call.
 */
public final class Trace {

  private final Set<String> names = new LinkedHashSet<>();

  /**
   * Put a function on the trace for the lifetime of the returned guard. Use in a
   * try-with-resources statement so that the name is removed on every exit path.
   *
   * @param name the function name.
   * @return the guard that removes the name again when closed.
   */
  public Guard guard(final String name) {
    requireNonNull(name);
    if (!names.add(name)) {
      throw new IllegalStateException(name + " is already on the trace");
    }
    return new Guard(name);
  }

  /**
   * Check whether a function is currently being evaluated.
   *
   * @param name the function name.
   * @return {@code true} if the name is on the trace.
   */
  public boolean contains(final String name) {
    return names.contains(name);
  }

  public boolean isEmpty() {
    return names.isEmpty();
  }

  @Override
  public String toString() {
    return "Trace(" + String.join(", ", names) + ")";
  }

  /** Scoped membership of one name in the trace. */
  public final class Guard implements AutoCloseable {
    private final String name;

    private Guard(final String name) {
      this.name = name;
    }

    @Override
    public void close() {
      names.remove(name);
    }
  }
}
