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

import tools.aqua.prover.context.ExecutionContext;
import tools.aqua.prover.value.Arguments;
import tools.aqua.prover.value.Value;

/**
 * A function of the {@code builtins} namespace. Unlike a {@link Builtin}, it dispatches to the
 * operations of its argument's variant and may record the exceptions those operations raise.
 */
@FunctionalInterface
public interface ProtocolFunction {

  /**
   * Apply the function.
   *
   * @param ctx the calling context.
   * @param arguments the evaluated arguments.
   * @return the result.
   */
  Value call(ExecutionContext ctx, Arguments arguments);
}
