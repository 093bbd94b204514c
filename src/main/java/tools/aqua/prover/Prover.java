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

import static java.util.Objects.requireNonNull;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.FuncInterp;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.aqua.prover.ast.Expression;
import tools.aqua.prover.ast.Module;
import tools.aqua.prover.ast.Parameter;
import tools.aqua.prover.ast.Statement;
import tools.aqua.prover.context.ExceptionInfo;
import tools.aqua.prover.context.ExecutionContext;
import tools.aqua.prover.context.ReturnInfo;
import tools.aqua.prover.eval.ExpressionEvaluator;
import tools.aqua.prover.eval.FunctionCalls;
import tools.aqua.prover.eval.StatementEvaluator;
import tools.aqua.prover.value.FixedTupleValue;
import tools.aqua.prover.value.FunctionValue;
import tools.aqua.prover.value.Value;

/**
 * Proves functions against their contracts. Each proof attempt runs in its own solver context, so
 * a function that cannot be analyzed does not affect the others.
 */
public final class Prover {

  private static final Logger logger = LoggerFactory.getLogger(Prover.class);

  /** The name postconditions use for the function's return value. */
  public static final String RESULT = "result";

  private final ProverConfig config;

  /** Create a prover configured from the system properties. */
  public Prover() {
    this(ProverConfig.fromSystemProperties());
  }

  public Prover(final ProverConfig config) {
    this.config = requireNonNull(config);
  }

  /**
   * Prove a function of a module.
   *
   * @param module the module.
   * @param functionName the name of a top-level function of the module.
   * @param contract the function's contract.
   * @return the outcome.
   * @throws IllegalArgumentException if the module has no such function.
   */
  public Theorem prove(final Module module, final String functionName, final Contract contract) {
    final Statement.FunctionDef function =
        module
            .findFunction(functionName)
            .orElseThrow(() -> new IllegalArgumentException("no function " + functionName));
    return prove(module, function, contract);
  }

  /**
   * Prove every top-level function of a module.
   *
   * @param module the module.
   * @param contracts the contracts by function name; functions without one get {@link
   *     Contract#none()}.
   * @return the outcomes in definition order.
   */
  public List<Theorem> proveAll(final Module module, final Map<String, Contract> contracts) {
    final List<Theorem> theorems = new ArrayList<>();
    for (final Statement.FunctionDef function : module.getFunctions().values()) {
      theorems.add(
          prove(module, function, contracts.getOrDefault(function.getName(), Contract.none())));
    }
    return theorems;
  }

  /**
   * Prove a function.
   *
   * @param module the module the function belongs to.
   * @param function the function.
   * @param contract the function's contract.
   * @return the outcome.
   */
  public Theorem prove(
      final Module module, final Statement.FunctionDef function, final Contract contract) {
    final String name = function.getName();
    Theorem theorem;
    try (Context z3 = new Context()) {
      theorem = check(z3, module, function, contract);
    } catch (UnsupportedConstructException e) {
      logger.warn("Skipping {}: {}", name, e.getMessage());
      theorem = Theorem.skipped(name, e.getMessage());
    } catch (Z3Exception e) {
      logger.warn("Skipping {}, solver rejected a term: {}", name, e.getMessage());
      theorem = Theorem.skipped(name, "solver error: " + e.getMessage());
    }
    logger.info("{}", theorem);
    return theorem;
  }

  private Theorem check(
      final Context z3,
      final Module module,
      final Statement.FunctionDef function,
      final Contract contract) {
    final ExecutionContext ctx = ExecutionContext.root(z3, module, config);
    final Map<String, Value> parameters = declareParameters(ctx, function);

    for (final Expression precondition : contract.getPreconditions()) {
      final ExecutionContext assumption = ctx.makeChild();
      final BoolExpr holds =
          new ExpressionEvaluator(assumption).evaluate(precondition).asBool().unwrap();
      assumption.getGiven().layer().forEach(ctx.getGiven()::add);
      ctx.getGiven().add(holds);
    }

    new StatementEvaluator(ctx).evaluate(function);

    for (final ExceptionInfo exception : ctx.getExceptions()) {
      if (Collections.disjoint(exception.getNames(), contract.getRaises())) {
        ctx.getExpected().add(z3.mkNot(exception.getCondition()));
      }
    }

    if (!contract.getPostconditions().isEmpty()) {
      checkPostconditions(ctx, contract.getPostconditions());
    }

    return solve(z3, ctx, function.getName(), parameters);
  }

  private static Map<String, Value> declareParameters(
      final ExecutionContext ctx, final Statement.FunctionDef function) {
    final Map<String, Value> parameters = new LinkedHashMap<>();
    for (final Parameter parameter : function.getParameters()) {
      final Expression annotation =
          parameter
              .getAnnotation()
              .orElseThrow(
                  () ->
                      new UnsupportedConstructException(
                          "parameter without annotation", parameter.getName()));
      final Value value = ctx.getAnnotations().declare(parameter.getName(), annotation);
      ctx.getScope().set(parameter.getName(), value);
      parameters.put(parameter.getName(), value);
    }
    return parameters;
  }

  /** Require each postcondition on every path that returns. */
  private static void checkPostconditions(
      final ExecutionContext ctx, final List<Expression> postconditions) {
    final Context z3 = ctx.getZ3();
    final List<ReturnInfo> returns = new ArrayList<>();
    ctx.getReturns().forEach(returns::add);
    final BoolExpr returned =
        z3.mkOr(returns.stream().map(ReturnInfo::getCondition).toArray(BoolExpr[]::new));
    final ExecutionContext post = ctx.makeChild();
    final Value result = FunctionCalls.returnValue(returns);
    if (result != null) {
      post.getScope().set(RESULT, result);
    }
    final ExpressionEvaluator evaluator = new ExpressionEvaluator(post);
    for (final Expression postcondition : postconditions) {
      final BoolExpr holds = evaluator.evaluate(postcondition).asBool().unwrap();
      ctx.getExpected().add(z3.mkImplies(returned, holds));
    }
    post.getGiven().layer().forEach(ctx.getGiven()::add);
  }

  private Theorem solve(
      final Context z3,
      final ExecutionContext ctx,
      final String name,
      final Map<String, Value> parameters) {
    final Solver solver = z3.mkSolver();
    final Params params = z3.mkParams();
    params.add("timeout", config.getTimeout());
    solver.setParameters(params);

    final List<BoolExpr> expected = new ArrayList<>();
    ctx.getExpected().forEach(expected::add);
    ctx.getGiven().forEach(solver::add);
    solver.add(z3.mkNot(z3.mkAnd(expected.toArray(new BoolExpr[0]))));
    logger.debug("Checking {} against {} obligations", name, expected.size());

    final Status status = solver.check();
    switch (status) {
      case UNSATISFIABLE:
        return Theorem.proved(name);
      case SATISFIABLE:
        return Theorem.refuted(name, counterexample(solver.getModel(), parameters));
      default:
        return Theorem.unknown(name, solver.getReasonUnknown());
    }
  }

  private static Map<String, String> counterexample(
      final Model model, final Map<String, Value> parameters) {
    final Map<String, String> values = new LinkedHashMap<>();
    parameters.forEach((name, value) -> values.put(name, render(model, value)));
    return values;
  }

  private static String render(final Model model, final Value value) {
    if (value instanceof FixedTupleValue) {
      return ((FixedTupleValue) value)
          .getElements().stream()
              .map(element -> render(model, element))
              .collect(Collectors.joining(", ", "(", ")"));
    }
    if (value instanceof FunctionValue) {
      final FuncInterp<?> interpretation = model.getFuncInterp(((FunctionValue) value).getDecl());
      return interpretation == null ? "<unconstrained>" : interpretation.toString();
    }
    return model.evaluate(value.unwrap(), true).toString();
  }
}
