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

import org.junit.jupiter.api.Test;

/** Test the visibility rules of layered registers. */
class LayeredRegisterTest {

  /** Iteration runs over all layers from the root up; a layer holds only its own items. */
  @Test
  void testLayers() {
    final LayeredRegister<String> root = LayeredRegister.root();
    root.add("a");
    final LayeredRegister<String> child = root.child();
    child.add("b");
    child.add("c");

    assertThat(child).containsExactly("a", "b", "c");
    assertThat(child.layer()).containsExactly("b", "c");
    assertThat(root).containsExactly("a");
  }

  /** Siblings do not see each other's items. */
  @Test
  void testSiblingsAreIsolated() {
    final LayeredRegister<String> root = LayeredRegister.root();
    final LayeredRegister<String> left = root.child();
    final LayeredRegister<String> right = root.child();
    left.add("l");
    right.add("r");

    assertThat(left).containsExactly("l");
    assertThat(right).containsExactly("r");
    assertThat(root).isEmpty();
  }
}
