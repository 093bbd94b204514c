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

package tools.aqua.prover.ast;

import static java.util.Objects.requireNonNull;

import java.util.Optional;

/** A function parameter with its optional annotation and default value. */
public final class Parameter {

  /** The parameter name. */
  private final String name;

  /** The type annotation, or {@code null}. */
  private final Expression annotation;

  /** The default value expression, or {@code null}. */
  private final Expression defaultValue;

  /**
   * Create a new parameter.
   *
   * @param name the {@link #name}.
   * @param annotation the {@link #annotation}, may be {@code null}.
   * @param defaultValue the {@link #defaultValue}, may be {@code null}.
   */
  public Parameter(final String name, final Expression annotation, final Expression defaultValue) {
    this.name = requireNonNull(name);
    this.annotation = annotation;
    this.defaultValue = defaultValue;
  }

  public String getName() {
    return name;
  }

  public Optional<Expression> getAnnotation() {
    return Optional.ofNullable(annotation);
  }

  public Optional<Expression> getDefaultValue() {
    return Optional.ofNullable(defaultValue);
  }
}
