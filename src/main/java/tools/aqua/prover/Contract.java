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

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import tools.aqua.prover.ast.Expression;

/**
 * The contract of a function: preconditions over its parameters, postconditions over its
 * parameters and {@code result}, and the exception types it may raise.
 */
public final class Contract {

  private static final Contract NONE = builder().build();

  private final List<Expression> preconditions;
  private final List<Expression> postconditions;
  private final Set<String> raises;

  private Contract(final Builder builder) {
    this.preconditions = unmodifiableList(new ArrayList<>(builder.preconditions));
    this.postconditions = unmodifiableList(new ArrayList<>(builder.postconditions));
    this.raises = unmodifiableSet(new LinkedHashSet<>(builder.raises));
  }

  /**
   * Get the empty contract: no assumptions, no postconditions, no exceptions allowed.
   *
   * @return the empty contract.
   */
  public static Contract none() {
    return NONE;
  }

  public static Builder builder() {
    return new Builder();
  }

  public List<Expression> getPreconditions() {
    return preconditions;
  }

  public List<Expression> getPostconditions() {
    return postconditions;
  }

  public Set<String> getRaises() {
    return raises;
  }

  @Override
  public String toString() {
    return "Contract(pre="
        + preconditions.size()
        + ", post="
        + postconditions.size()
        + ", raises="
        + raises
        + ")";
  }

  /** Builder for {@link Contract}s. */
  public static final class Builder {
    private final List<Expression> preconditions = new ArrayList<>();
    private final List<Expression> postconditions = new ArrayList<>();
    private final Set<String> raises = new LinkedHashSet<>();

    private Builder() {}

    public Builder pre(final Expression precondition) {
      preconditions.add(requireNonNull(precondition));
      return this;
    }

    public Builder post(final Expression postcondition) {
      postconditions.add(requireNonNull(postcondition));
      return this;
    }

    /**
     * Allow exceptions of the given types. An exception is allowed if any of its class names,
     * including its bases, is listed.
     *
     * @param exceptionNames the exception class names.
     * @return this builder.
     */
    public Builder raises(final String... exceptionNames) {
      for (final String name : exceptionNames) {
        raises.add(requireNonNull(name));
      }
      return this;
    }

    public Contract build() {
      return new Contract(this);
    }
  }
}
