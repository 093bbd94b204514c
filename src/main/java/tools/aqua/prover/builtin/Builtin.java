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

import tools.aqua.prover.value.Arguments;
import tools.aqua.prover.value.Value;

/**
 * The semantic model of a library function. A handler builds its result from the arguments and
 * may constrain fresh symbols through {@link CallSite#assume}; it has no access to the variable
 * scope, the proof obligations or the exception and return events of the caller.
 */
@FunctionalInterface
public interface Builtin {

  /**
   * Apply the function.
   *
   * @param site the call site.
   * @param arguments the evaluated arguments.
   * @return the result.
   */
  Value call(CallSite site, Arguments arguments);
}
