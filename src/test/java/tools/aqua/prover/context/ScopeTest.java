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

import com.microsoft.z3.Context;
import org.junit.jupiter.api.Test;
import tools.aqua.prover.value.IntValue;
import tools.aqua.prover.value.Value;

/** Test lookup and shadowing in layered scopes. */
class ScopeTest {

  /** A child sees its parent's bindings and shadows them without modifying the parent. */
  @Test
  void testShadowing() {
    try (Context ctx = new Context()) {
      final Value one = IntValue.of(ctx, 1);
      final Value two = IntValue.of(ctx, 2);

      final Scope parent = Scope.root();
      parent.set("x", one);
      final Scope child = parent.child();
      assertThat(child.get("x")).contains(one);
      assertThat(child.layer()).isEmpty();

      child.set("x", two);
      assertThat(child.get("x")).contains(two);
      assertThat(parent.get("x")).contains(one);
      assertThat(child.layer()).containsOnlyKeys("x");
    }
  }

  /** Unbound names resolve to nothing. */
  @Test
  void testUnboundName() {
    assertThat(Scope.root().child().get("y")).isEmpty();
  }

  /** The top layer keeps first-assignment order. */
  @Test
  void testLayerOrder() {
    try (Context ctx = new Context()) {
      final Scope scope = Scope.root();
      scope.set("b", IntValue.of(ctx, 1));
      scope.set("a", IntValue.of(ctx, 2));
      scope.set("b", IntValue.of(ctx, 3));
      assertThat(scope.layer().keySet()).containsExactly("b", "a");
    }
  }
}
