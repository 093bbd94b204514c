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
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Sort;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.aqua.prover.UnsupportedConstructException;
import tools.aqua.prover.annotation.Annotations;
import tools.aqua.prover.ast.Expression;
import tools.aqua.prover.ast.Statement;
import tools.aqua.prover.context.ExecutionContext;
import tools.aqua.prover.context.ReturnInfo;
import tools.aqua.prover.context.Trace;
import tools.aqua.prover.value.Value;

/**
 * Evaluates statements into the registers of an {@link ExecutionContext}. Statement effects are
 * recorded as constraints guarded by the current path, so statements after a {@code return} or
 * {@code raise} on some path only constrain the remaining paths.
 */
public final class StatementEvaluator implements Statement.Visitor<Void> {

  private static final Logger logger = LoggerFactory.getLogger(StatementEvaluator.class);

  private final ExecutionContext ctx;
  private final Context z3;
  private final ExpressionEvaluator expressions;

  /**
   * Create a new evaluator.
   *
   * @param ctx the context to record into.
   */
  public StatementEvaluator(final ExecutionContext ctx) {
    this.ctx = ctx;
    this.z3 = ctx.getZ3();
    this.expressions = new ExpressionEvaluator(ctx);
  }

  /**
   * Evaluate a statement.
   *
   * @param statement the statement.
   */
  public void evaluate(final Statement statement) {
    logger.debug("Evaluating {} in {}", statement.kind(), ctx.getTrace());
    statement.accept(this);
  }

  /**
   * Evaluate a function body or branch. Definitions may not be nested.
   *
   * @param body the statements.
   */
  void evaluateBody(final List<Statement> body) {
    for (final Statement statement : body) {
      if (statement instanceof Statement.FunctionDef) {
        throw new UnsupportedConstructException(
            "nested function definition", ((Statement.FunctionDef) statement).getName());
      }
      if (statement instanceof Statement.ClassDef) {
        throw new UnsupportedConstructException(
            "nested class definition", ((Statement.ClassDef) statement).getName());
      }
      evaluate(statement);
    }
  }

  @Override
  public Void visitFunctionDef(final Statement.FunctionDef node) {
    if (ctx.getTrace().contains(node.getName())) {
      summarizeRecursion(node);
      return null;
    }
    try (Trace.Guard guard = ctx.getTrace().guard(node.getName())) {
      evaluateBody(node.getBody());
    }
    return null;
  }

  /**
   * Replace a recursive invocation by an uninterpreted function of the bound parameters, since
   * unrolling would not terminate on symbolic input.
   */
  private void summarizeRecursion(final Statement.FunctionDef node) {
    final Annotations annotations = ctx.getAnnotations();
    final Expression annotation =
        node.getReturns()
            .orElseThrow(
                () ->
                    new UnsupportedConstructException(
                        "recursion without return annotation", node.getName()));
    final Sort range =
        annotations
            .resolveSort(annotation)
            .orElseThrow(
                () -> new UnsupportedConstructException("return annotation", node.getName()));
    final List<Expr<?>> arguments = new ArrayList<>();
    for (final Value argument : ctx.getScope().layer().values()) {
      arguments.add(argument.unwrap());
    }
    final Sort[] domain = new Sort[arguments.size()];
    for (int i = 0; i < domain.length; i++) {
      domain[i] = arguments.get(i).getSort();
    }
    final FuncDecl<Sort> summary = z3.mkFuncDecl(node.getName(), domain, range);
    logger.debug("Summarizing recursive call of {} as {}", node.getName(), summary);
    final Value result =
        annotations.wrapAs(annotation, summary.apply(arguments.toArray(new Expr<?>[0])));
    ctx.getReturns().add(new ReturnInfo(result, z3.mkTrue()));
  }

  @Override
  public Void visitClassDef(final Statement.ClassDef node) {
    throw new UnsupportedConstructException("class definition", node.getName());
  }

  @Override
  public Void visitAssert(final Statement.Assert node) {
    final BoolExpr test = expressions.evaluate(node.getTest()).asBool().unwrap();
    ctx.getExpected().add(z3.mkOr(ctx.interrupted(), test));
    return null;
  }

  @Override
  public Void visitExpressionStatement(final Statement.ExpressionStatement node) {
    expressions.evaluate(node.getValue());
    return null;
  }

  @Override
  public Void visitAssign(final Statement.Assign node) {
    if (node.getTargets().size() != 1 || !(node.getTargets().get(0) instanceof Expression.Name)) {
      throw new UnsupportedConstructException("assignment target");
    }
    final String name = ((Expression.Name) node.getTargets().get(0)).getId();
    final Value value = expressions.evaluate(node.getValue());
    if (value == null) {
      throw new UnsupportedConstructException("assignment of None", name);
    }
    ctx.getScope().set(name, value);
    return null;
  }

  @Override
  public Void visitReturn(final Statement.Return node) {
    final Value value = node.getValue().map(expressions::evaluate).orElse(null);
    ctx.getReturns().add(new ReturnInfo(value, ctx.uninterrupted(z3.mkTrue())));
    return null;
  }

  @Override
  public Void visitIf(final Statement.If node) {
    final BoolExpr test = expressions.evaluate(node.getTest()).asBool().unwrap();
    final ExecutionContext then = ctx.makeChild();
    new StatementEvaluator(then).evaluateBody(node.getBody());
    final ExecutionContext orElse = ctx.makeChild();
    new StatementEvaluator(orElse).evaluateBody(node.getOrElse());
    Branches.merge(ctx, test, then, orElse);
    return null;
  }

  @Override
  public Void visitRaise(final Statement.Raise node) {
    final Expression exception =
        node.getException().orElseThrow(() -> new UnsupportedConstructException("bare raise"));
    final Set<String> names = new LinkedHashSet<>(ctx.getModule().exceptionNames(exception));
    node.getCause().ifPresent(cause -> names.addAll(ctx.getModule().exceptionNames(cause)));
    if (names.isEmpty()) {
      throw new UnsupportedConstructException("raised expression");
    }
    ctx.raise(z3.mkTrue(), names);
    return null;
  }

  @Override
  public Void visitImport(final Statement.Import node) {
    return null;
  }

  @Override
  public Void visitPass(final Statement.Pass node) {
    return null;
  }

  @Override
  public Void visitGlobal(final Statement.Global node) {
    return null;
  }

  @Override
  public Void visitUnknown(final Statement.Unknown node) {
    throw new UnsupportedConstructException("statement", node.kind());
  }
}
