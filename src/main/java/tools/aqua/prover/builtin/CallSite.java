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

import static java.util.Objects.requireNonNull;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Sort;
import tools.aqua.prover.ProverConfig;
import tools.aqua.prover.context.ExecutionContext;
import tools.aqua.prover.value.Value;
import tools.aqua.prover.value.Values;

/** The view of the calling context a {@link Builtin} handler gets. */
public final class CallSite {

  private final String name;
  private final ExecutionContext ctx;

  /**
   * Create a new call site.
   *
   * @param name the qualified name of the called function.
   * @param ctx the calling context.
   */
  public CallSite(final String name, final ExecutionContext ctx) {
    this.name = requireNonNull(name);
    this.ctx = requireNonNull(ctx);
  }

  public String getName() {
    return name;
  }

  public Context getZ3() {
    return ctx.getZ3();
  }

  public ProverConfig getConfig() {
    return ctx.getConfig();
  }

  /**
   * Assume a constraint from here on, by adding it to the given constraints. The constraint only
   * binds paths that have not raised or returned before the call.
   *
   * @param constraint the constraint.
   */
  public void assume(final BoolExpr constraint) {
    final Context z3 = ctx.getZ3();
    ctx.getGiven().add(z3.mkImplies(z3.mkNot(ctx.interrupted()), constraint));
  }

  /**
   * Create an unconstrained symbol.
   *
   * @param prefix the name prefix.
   * @param sort the sort.
   * @return the symbol's value.
   */
  public Value fresh(final String prefix, final Sort sort) {
    return Values.wrap(ctx.getZ3(), ctx.getZ3().mkFreshConst(prefix, sort));
  }
}
