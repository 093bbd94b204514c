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

import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.requireNonNull;

import com.microsoft.z3.BoolExpr;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An exception event: if the condition holds, an exception escapes on this path whose type is
 * (a subclass of) every name in the set.
 */
public final class ExceptionInfo {

  private final Set<String> names;
  private final BoolExpr condition;

  /**
   * Create a new exception event.
   *
   * @param names the exception type and its base classes.
   * @param condition the path condition under which the exception is raised.
   */
  public ExceptionInfo(final Set<String> names, final BoolExpr condition) {
    this.names = unmodifiableSet(new LinkedHashSet<>(names));
    this.condition = requireNonNull(condition);
  }

  public Set<String> getNames() {
    return names;
  }

  public BoolExpr getCondition() {
    return condition;
  }

  @Override
  public String toString() {
    return "ExceptionInfo(" + names + " if " + condition + ")";
  }
}
