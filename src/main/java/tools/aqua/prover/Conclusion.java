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

/** The verdict of one proof attempt. */
public enum Conclusion {
  /** The contract holds for all inputs satisfying the preconditions. */
  OK,
  /** The solver found a counterexample. */
  FAIL,
  /** The function uses a construct that cannot be analyzed. */
  SKIP,
  /** The solver gave up, e.g. on a timeout. */
  UNKNOWN
}
