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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

/** Test that the recursion trace is released on every exit path. */
class TraceTest {

  /** A guard removes its name when closed normally. */
  @Test
  void testGuardReleasesName() {
    final Trace trace = new Trace();
    try (Trace.Guard guard = trace.guard("f")) {
      assertThat(trace.contains("f")).isTrue();
      assertThat(trace).hasToString("Trace(f)");
    }
    assertThat(trace.contains("f")).isFalse();
    assertThat(trace.isEmpty()).isTrue();
  }

  /** A guard removes its name when the guarded code fails. */
  @Test
  void testGuardReleasesNameOnFailure() {
    final Trace trace = new Trace();
    assertThatThrownBy(
            () -> {
              try (Trace.Guard guard = trace.guard("f")) {
                throw new IllegalArgumentException("boom");
              }
            })
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(trace.isEmpty()).isTrue();
  }

  /** Nested guards keep the outer name until the outer guard closes. */
  @Test
  void testNestedGuards() {
    final Trace trace = new Trace();
    try (Trace.Guard outer = trace.guard("f")) {
      try (Trace.Guard inner = trace.guard("g")) {
        assertThat(trace).hasToString("Trace(f, g)");
      }
      assertThat(trace.contains("g")).isFalse();
      assertThat(trace.contains("f")).isTrue();
    }
  }

  /** A name cannot be entered twice. */
  @Test
  void testDuplicateGuardIsRejected() {
    final Trace trace = new Trace();
    try (Trace.Guard guard = trace.guard("f")) {
      assertThatThrownBy(() -> trace.guard("f")).isInstanceOf(IllegalStateException.class);
    }
  }
}
