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

import static com.microsoft.z3.Status.SATISFIABLE;
import static com.microsoft.z3.Status.UNSATISFIABLE;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Solver;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import tools.aqua.prover.ast.Module;
import tools.aqua.prover.context.ExecutionContext;

/** Solver shortcuts for tests. */
public final class Solving {

  private Solving() {}

  /**
   * Check that a formula holds in every model.
   *
   * @param ctx the solver context.
   * @param assumptions formulas assumed to hold.
   * @param formula the formula.
   * @return {@code true} if the formula is valid under the assumptions.
   */
  public static boolean isValid(
      final Context ctx, final BoolExpr formula, final BoolExpr... assumptions) {
    final Solver solver = ctx.mkSolver();
    solver.add(assumptions);
    solver.add(ctx.mkNot(formula));
    return solver.check() == UNSATISFIABLE;
  }

  /**
   * Check that a formula holds in some model.
   *
   * @param ctx the solver context.
   * @param formula the formula.
   * @param assumptions formulas assumed to hold.
   * @return {@code true} if the formula is satisfiable under the assumptions.
   */
  public static boolean isSatisfiable(
      final Context ctx, final BoolExpr formula, final BoolExpr... assumptions) {
    final Solver solver = ctx.mkSolver();
    solver.add(assumptions);
    solver.add(formula);
    return solver.check() == SATISFIABLE;
  }

  /**
   * Collect the given constraints visible from a context.
   *
   * @param context the execution context.
   * @return the constraints.
   */
  public static BoolExpr[] given(final ExecutionContext context) {
    final List<BoolExpr> given = new ArrayList<>();
    context.getGiven().forEach(given::add);
    return given.toArray(new BoolExpr[0]);
  }

  /**
   * Create a root execution context over an empty module.
   *
   * @param ctx the solver context.
   * @return the execution context.
   */
  public static ExecutionContext emptyContext(final Context ctx) {
    return ExecutionContext.root(
        ctx, new Module(Collections.emptyList()), ProverConfig.DEFAULT);
  }
}
