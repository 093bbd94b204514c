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
import com.microsoft.z3.Context;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import tools.aqua.prover.ProverConfig;
import tools.aqua.prover.annotation.Annotations;
import tools.aqua.prover.ast.Module;

/**
 * The state of one symbolic evaluation: the variable {@link Scope}, the {@code given} assumptions,
 * the {@code expected} obligations, and the exception and return events recorded so far, together
 * with the recursion {@link Trace}.
 *
 * <p>Contexts form a tree. {@link #makeChild()} creates a context for one branch of a conditional:
 * every register gets a single fresh layer on top of the parent's, so the branch can be read back
 * from {@link LayeredRegister#layer()} and folded into the parent. The solver context, the module,
 * the configuration and the trace are shared by the whole tree.
 *
 * <p>Whether the current path is interrupted is not stored but derived from the exception and
 * return events visible from this context, see {@link #interrupted()}.
 */
public final class ExecutionContext {

  private final Context z3;
  private final Module module;
  private final ProverConfig config;
  private final Annotations annotations;
  private final Trace trace;

  private final Scope scope;
  private final LayeredRegister<BoolExpr> given;
  private final LayeredRegister<BoolExpr> expected;
  private final LayeredRegister<ExceptionInfo> exceptions;
  private final LayeredRegister<ReturnInfo> returns;

  private ExecutionContext(
      final Context z3,
      final Module module,
      final ProverConfig config,
      final Annotations annotations,
      final Trace trace,
      final Scope scope,
      final LayeredRegister<BoolExpr> given,
      final LayeredRegister<BoolExpr> expected,
      final LayeredRegister<ExceptionInfo> exceptions,
      final LayeredRegister<ReturnInfo> returns) {
    this.z3 = z3;
    this.module = module;
    this.config = config;
    this.annotations = annotations;
    this.trace = trace;
    this.scope = scope;
    this.given = given;
    this.expected = expected;
    this.exceptions = exceptions;
    this.returns = returns;
  }

  /**
   * Create the root context for one proof attempt.
   *
   * @param z3 the solver context all expressions are built in.
   * @param module the module the evaluated code belongs to.
   * @param config the prover configuration.
   * @return the root context.
   */
  public static ExecutionContext root(
      final Context z3, final Module module, final ProverConfig config) {
    requireNonNull(z3);
    return new ExecutionContext(
        z3,
        requireNonNull(module),
        requireNonNull(config),
        new Annotations(z3),
        new Trace(),
        Scope.root(),
        LayeredRegister.root(),
        LayeredRegister.root(),
        LayeredRegister.root(),
        LayeredRegister.root());
  }

  /**
   * Create a context for one branch. All registers get a fresh layer on top of this context's.
   *
   * @return the child context.
   */
  public ExecutionContext makeChild() {
    return new ExecutionContext(
        z3,
        module,
        config,
        annotations,
        trace,
        scope.child(),
        given.child(),
        expected.child(),
        exceptions.child(),
        returns.child());
  }

  /**
   * Create a context for the body of a called function. The scope starts empty, while the other
   * registers chain to this context so that the callee sees the caller's interruption state.
   *
   * @return the callee context.
   */
  public ExecutionContext makeCall() {
    return new ExecutionContext(
        z3,
        module,
        config,
        annotations,
        trace,
        Scope.root(),
        given.child(),
        expected.child(),
        exceptions.child(),
        returns.child());
  }

  /**
   * Compute the condition under which the current path has already raised or returned. This is
   * the disjunction of all exception and return conditions visible from this context.
   *
   * @return the interruption condition, {@code false} if nothing was recorded yet.
   */
  public BoolExpr interrupted() {
    final List<BoolExpr> conditions = new ArrayList<>();
    for (final ExceptionInfo exception : exceptions) {
      conditions.add(exception.getCondition());
    }
    for (final ReturnInfo ret : returns) {
      conditions.add(ret.getCondition());
    }
    if (conditions.isEmpty()) {
      return z3.mkFalse();
    }
    if (conditions.size() == 1) {
      return conditions.get(0);
    }
    return z3.mkOr(conditions.toArray(new BoolExpr[0]));
  }

  /**
   * Guard a condition by the current path not being interrupted.
   *
   * @param condition the condition.
   * @return {@code condition AND NOT interrupted}.
   */
  public BoolExpr uninterrupted(final BoolExpr condition) {
    return z3.mkAnd(condition, z3.mkNot(interrupted()));
  }

  /**
   * Record that the built-in exception {@code exceptionName} is raised if {@code condition} holds
   * on a path that is not yet interrupted.
   *
   * @param condition the trigger condition.
   * @param exceptionName the exception class name.
   */
  public void raise(final BoolExpr condition, final String exceptionName) {
    raise(condition, module.exceptionNames(exceptionName));
  }

  /**
   * Record that an exception with the given class names is raised if {@code condition} holds on a
   * path that is not yet interrupted.
   *
   * @param condition the trigger condition.
   * @param names the exception class and its bases.
   */
  public void raise(final BoolExpr condition, final Set<String> names) {
    exceptions.add(new ExceptionInfo(names, uninterrupted(condition)));
  }

  public Context getZ3() {
    return z3;
  }

  public Module getModule() {
    return module;
  }

  public ProverConfig getConfig() {
    return config;
  }

  public Annotations getAnnotations() {
    return annotations;
  }

  public Trace getTrace() {
    return trace;
  }

  public Scope getScope() {
    return scope;
  }

  public LayeredRegister<BoolExpr> getGiven() {
    return given;
  }

  public LayeredRegister<BoolExpr> getExpected() {
    return expected;
  }

  public LayeredRegister<ExceptionInfo> getExceptions() {
    return exceptions;
  }

  public LayeredRegister<ReturnInfo> getReturns() {
    return returns;
  }
}
