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

package tools.aqua.prover.eval;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import java.util.LinkedHashSet;
import java.util.Set;
import tools.aqua.prover.UnboundVariableException;
import tools.aqua.prover.context.ExceptionInfo;
import tools.aqua.prover.context.ExecutionContext;
import tools.aqua.prover.context.ReturnInfo;
import tools.aqua.prover.value.Value;
import tools.aqua.prover.value.Values;

/** Merging of child contexts back into their parent. */
final class Branches {

  private Branches() {}

  /**
   * Merge both arms of a conditional. Every variable assigned in either arm is rebound in the
   * parent to a conditional value; it must be visible in both arms.
   *
   * @param parent the context the conditional was evaluated in.
   * @param test the branch condition.
   * @param then the context of the taken arm.
   * @param orElse the context of the other arm.
   * @throws UnboundVariableException if a variable is bound on one path only.
   */
  static void merge(
      final ExecutionContext parent,
      final BoolExpr test,
      final ExecutionContext then,
      final ExecutionContext orElse) {
    final Context z3 = parent.getZ3();
    final Set<String> assigned = new LinkedHashSet<>(then.getScope().layer().keySet());
    assigned.addAll(orElse.getScope().layer().keySet());
    for (final String name : assigned) {
      final Value thenValue =
          then.getScope().get(name).orElseThrow(() -> new UnboundVariableException(name));
      final Value elseValue =
          orElse.getScope().get(name).orElseThrow(() -> new UnboundVariableException(name));
      parent.getScope().set(name, Values.ifExpr(test, thenValue, elseValue));
    }
    fold(parent, test, then);
    fold(parent, z3.mkNot(test), orElse);
  }

  /**
   * Move the constraints and events of a child context into its parent, guarded by the condition
   * under which the child was evaluated. The child's variable bindings are not moved.
   *
   * @param parent the parent context.
   * @param guard the path condition of the child.
   * @param child the child context.
   */
  static void fold(
      final ExecutionContext parent, final BoolExpr guard, final ExecutionContext child) {
    final Context z3 = parent.getZ3();
    for (final BoolExpr given : child.getGiven().layer()) {
      parent.getGiven().add(z3.mkImplies(guard, given));
    }
    for (final BoolExpr expected : child.getExpected().layer()) {
      parent.getExpected().add(z3.mkImplies(guard, expected));
    }
    for (final ExceptionInfo exception : child.getExceptions().layer()) {
      parent
          .getExceptions()
          .add(new ExceptionInfo(exception.getNames(), z3.mkAnd(guard, exception.getCondition())));
    }
    for (final ReturnInfo ret : child.getReturns().layer()) {
      parent
          .getReturns()
          .add(new ReturnInfo(ret.getValue().orElse(null), z3.mkAnd(guard, ret.getCondition())));
    }
  }
}
