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

/** Signals an operator or merge applied to symbolic values of incompatible sorts. */
public class SortMismatchException extends UnsupportedConstructException {

  private static final long serialVersionUID = 1L;

  /**
   * Create a new exception.
   *
   * @param operation the operation that was attempted.
   * @param left the description of the left operand's type.
   * @param right the description of the right operand's type.
   */
  public SortMismatchException(final String operation, final String left, final String right) {
    super("sort mismatch in " + operation, left + " and " + right);
  }
}
