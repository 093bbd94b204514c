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

/**
 * Signals a name without a binding, e.g. a variable assigned in only one branch of a conditional
 * and never before it.
 */
public class UnboundVariableException extends UnsupportedConstructException {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new exception.
   *
   * @param name the unbound name.
   */
  public UnboundVariableException(final String name) {
    super("unbound variable", name);
  }
}
