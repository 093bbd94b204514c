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

import static java.util.Objects.requireNonNull;

import com.microsoft.z3.BoolExpr;
import java.util.Optional;
import tools.aqua.prover.value.Value;

/**
 * A return event: if the condition holds, the function returns the value on this path. A bare
 * {@code return} has no value.
 */
public final class ReturnInfo {

  private final Value value;
  private final BoolExpr condition;

  /**
   * Create a new return event.
   *
   * @param value the returned value, {@code null} for a bare return.
   * @param condition the path condition under which the return happens.
   */
  public ReturnInfo(final Value value, final BoolExpr condition) {
    this.value = value;
    this.condition = requireNonNull(condition);
  }

  public Optional<Value> getValue() {
    return Optional.ofNullable(value);
  }

  public BoolExpr getCondition() {
    return condition;
  }

  @Override
  public String toString() {
    return "ReturnInfo(" + value + " if " + condition + ")";
  }
}
