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

package tools.aqua.prover;

import static java.util.Objects.requireNonNull;

import java.util.Optional;

/**
 * Signals a subject-language construct that the evaluator does not model. The enclosing function
 * cannot be analyzed; the proof attempt for it ends with {@link Conclusion#SKIP}.
 */
public class UnsupportedConstructException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** The kind of construct, e.g. {@code "multiple assignment"}. */
  private final String construct;

  /** The offending name, if one is known. */
  private final String name;

  /**
   * Create a new exception without a name.
   *
   * @param construct the {@link #construct}.
   */
  public UnsupportedConstructException(final String construct) {
    this(construct, null);
  }

  /**
   * Create a new exception.
   *
   * @param construct the {@link #construct}.
   * @param name the {@link #name}, may be {@code null}.
   */
  public UnsupportedConstructException(final String construct, final String name) {
    super(name == null ? construct : construct + ": " + name);
    this.construct = requireNonNull(construct);
    this.name = name;
  }

  /**
   * Get the kind of construct that is not supported.
   *
   * @return the construct description.
   */
  public String getConstruct() {
    return construct;
  }

  /**
   * Get the name attached to the construct, if any.
   *
   * @return the name.
   */
  public Optional<String> getName() {
    return Optional.ofNullable(name);
  }
}
