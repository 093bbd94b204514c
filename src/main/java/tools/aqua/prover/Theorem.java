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

import static java.util.Collections.emptyMap;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** The outcome of proving one function against its contract. */
public final class Theorem {

  private final String functionName;
  private final Conclusion conclusion;
  private final Map<String, String> counterexample;
  private final String reason;

  private Theorem(
      final String functionName,
      final Conclusion conclusion,
      final Map<String, String> counterexample,
      final String reason) {
    this.functionName = requireNonNull(functionName);
    this.conclusion = requireNonNull(conclusion);
    this.counterexample = unmodifiableMap(new LinkedHashMap<>(counterexample));
    this.reason = reason;
  }

  static Theorem proved(final String functionName) {
    return new Theorem(functionName, Conclusion.OK, emptyMap(), null);
  }

  static Theorem refuted(final String functionName, final Map<String, String> counterexample) {
    return new Theorem(functionName, Conclusion.FAIL, counterexample, null);
  }

  static Theorem skipped(final String functionName, final String reason) {
    return new Theorem(functionName, Conclusion.SKIP, emptyMap(), reason);
  }

  static Theorem unknown(final String functionName, final String reason) {
    return new Theorem(functionName, Conclusion.UNKNOWN, emptyMap(), reason);
  }

  public String getFunctionName() {
    return functionName;
  }

  public Conclusion getConclusion() {
    return conclusion;
  }

  /**
   * Get the parameter values of a counterexample, rendered as solver terms.
   *
   * @return the values by parameter name; empty unless the conclusion is {@link Conclusion#FAIL}.
   */
  public Map<String, String> getCounterexample() {
    return counterexample;
  }

  /**
   * Get the reason a function was skipped or the solver gave up.
   *
   * @return the reason, if any.
   */
  public Optional<String> getReason() {
    return Optional.ofNullable(reason);
  }

  @Override
  public String toString() {
    final StringBuilder builder = new StringBuilder(functionName).append(": ").append(conclusion);
    if (!counterexample.isEmpty()) {
      builder.append(' ').append(counterexample);
    }
    if (reason != null) {
      builder.append(" (").append(reason).append(')');
    }
    return builder.toString();
  }
}
