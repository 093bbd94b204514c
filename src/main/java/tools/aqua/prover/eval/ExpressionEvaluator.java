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
import com.microsoft.z3.Sort;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.aqua.prover.UnboundVariableException;
import tools.aqua.prover.UnsupportedConstructException;
import tools.aqua.prover.ast.Expression;
import tools.aqua.prover.ast.Statement;
import tools.aqua.prover.builtin.Builtin;
import tools.aqua.prover.builtin.BuiltinRegistry;
import tools.aqua.prover.builtin.CallSite;
import tools.aqua.prover.builtin.ProtocolFunction;
import tools.aqua.prover.builtin.ProtocolFunctions;
import tools.aqua.prover.context.ExecutionContext;
import tools.aqua.prover.value.Arguments;
import tools.aqua.prover.value.BoolValue;
import tools.aqua.prover.value.DictValue;
import tools.aqua.prover.value.FixedTupleValue;
import tools.aqua.prover.value.FloatValue;
import tools.aqua.prover.value.IntValue;
import tools.aqua.prover.value.Kind;
import tools.aqua.prover.value.ListValue;
import tools.aqua.prover.value.SetValue;
import tools.aqua.prover.value.StrValue;
import tools.aqua.prover.value.Value;
import tools.aqua.prover.value.Values;

/**
 * Evaluates expressions to {@link Value}s. Evaluation may record exceptions, assumptions and
 * nested proof obligations in the context; sub-expressions that are only evaluated on some paths
 * record into child contexts that are folded back under their path condition.
 */
public final class ExpressionEvaluator implements Expression.Visitor<Value> {

  private static final Logger logger = LoggerFactory.getLogger(ExpressionEvaluator.class);

  private final ExecutionContext ctx;
  private final Context z3;

  /**
   * Create a new evaluator.
   *
   * @param ctx the context to evaluate in.
   */
  public ExpressionEvaluator(final ExecutionContext ctx) {
    this.ctx = ctx;
    this.z3 = ctx.getZ3();
  }

  /**
   * Evaluate an expression.
   *
   * @param expression the expression.
   * @return its value, {@code null} for a call that returns nothing.
   */
  public Value evaluate(final Expression expression) {
    return expression.accept(this);
  }

  private Value evaluateValue(final Expression expression) {
    final Value value = evaluate(expression);
    if (value == null) {
      throw new UnsupportedConstructException("use of None");
    }
    return value;
  }

  private List<Value> evaluateAll(final List<Expression> expressions) {
    final List<Value> values = new ArrayList<>(expressions.size());
    for (final Expression expression : expressions) {
      values.add(evaluateValue(expression));
    }
    return values;
  }

  @Override
  public Value visitConstant(final Expression.Constant node) {
    final Object value = node.getValue();
    if (value instanceof Boolean) {
      return BoolValue.of(z3, (Boolean) value);
    }
    if (value instanceof BigInteger) {
      return IntValue.of(z3, (BigInteger) value);
    }
    if (value instanceof Double) {
      return FloatValue.of(z3, (Double) value);
    }
    if (value instanceof String) {
      return StrValue.of(z3, (String) value);
    }
    throw new UnsupportedConstructException("constant", String.valueOf(value));
  }

  @Override
  public Value visitName(final Expression.Name node) {
    final String name = node.getId();
    return ctx.getScope().get(name).orElseThrow(() -> new UnboundVariableException(name));
  }

  @Override
  public Value visitAttribute(final Expression.Attribute node) {
    throw new UnsupportedConstructException(
        "attribute access", node.getDottedName().orElse(node.getAttribute()));
  }

  @Override
  public Value visitBinaryOperation(final Expression.BinaryOperation node) {
    final Value left = evaluateValue(node.getLeft());
    final Value right = evaluateValue(node.getRight());
    switch (node.getOperator()) {
      case ADD:
        return left.add(right);
      case SUBTRACT:
        return left.subtract(right);
      case MULTIPLY:
        return left.multiply(right);
      case TRUE_DIVIDE:
        return left.trueDivide(ctx, right);
      case FLOOR_DIVIDE:
        return left.floorDivide(ctx, right);
      case MODULO:
        return left.modulo(ctx, right);
      case POWER:
        return left.power(right);
      case BIT_OR:
        return left.bitOr(right);
      case BIT_AND:
        return left.bitAnd(right);
      default:
        throw new UnsupportedConstructException("operator", node.getOperator().symbol);
    }
  }

  @Override
  public Value visitUnaryOperation(final Expression.UnaryOperation node) {
    final Value operand = evaluateValue(node.getOperand());
    switch (node.getOperator()) {
      case NOT:
        return operand.asBool().not();
      case NEGATE:
        return operand.negate();
      case POSITIVE:
        return operand.positive();
      case INVERT:
        return operand.invert();
      default:
        throw new UnsupportedConstructException("operator", node.getOperator().symbol);
    }
  }

  /**
   * Evaluate {@code a and b} as {@code b if a else a} and {@code a or b} as {@code a if a else b}.
   * The right operand is only evaluated on the paths where it decides the result.
   */
  @Override
  public Value visitBooleanOperation(final Expression.BooleanOperation node) {
    final boolean conjunction = node.getOperator() == Expression.BooleanOperator.AND;
    final List<Expression> operands = node.getValues();
    Value result = evaluateValue(operands.get(0));
    for (final Expression operand : operands.subList(1, operands.size())) {
      final BoolExpr truthy = result.asBool().unwrap();
      final BoolExpr guard = conjunction ? truthy : z3.mkNot(truthy);
      final ExecutionContext child = ctx.makeChild();
      final Value right = new ExpressionEvaluator(child).evaluateValue(operand);
      Branches.fold(ctx, guard, child);
      final List<Value> merged = Values.promote(List.of(result, right));
      result =
          conjunction
              ? Values.ifExpr(truthy, merged.get(1), merged.get(0))
              : Values.ifExpr(truthy, merged.get(0), merged.get(1));
    }
    return result;
  }

  @Override
  public Value visitCompare(final Expression.Compare node) {
    Value left = evaluateValue(node.getLeft());
    BoolValue result = BoolValue.of(z3, true);
    for (int i = 0; i < node.getOperators().size(); i++) {
      final Value right = evaluateValue(node.getComparators().get(i));
      result = result.and(compare(node.getOperators().get(i), left, right));
      left = right;
    }
    return result;
  }

  private BoolValue compare(
      final Expression.CompareOperator operator, final Value left, final Value right) {
    switch (operator) {
      case EQUAL:
        return left.eq(right);
      case NOT_EQUAL:
        return left.ne(right);
      case LESS:
        return left.lt(right);
      case LESS_OR_EQUAL:
        return left.le(right);
      case GREATER:
        return left.gt(right);
      case GREATER_OR_EQUAL:
        return left.ge(right);
      case IN:
        return right.contains(left);
      case NOT_IN:
        return right.contains(left).not();
      default:
        throw new UnsupportedConstructException("comparison", operator.symbol);
    }
  }

  @Override
  public Value visitCall(final Expression.Call node) {
    final Expression function = node.getFunction();
    final Arguments arguments = evaluateArguments(node);
    final Optional<String> target = node.getTarget();

    if (function instanceof Expression.Name) {
      final String name = ((Expression.Name) function).getId();
      final Optional<Value> bound = ctx.getScope().get(name);
      if (bound.isPresent()) {
        return bound.get().call(ctx, arguments);
      }
      final Optional<Statement.FunctionDef> definition = ctx.getModule().findFunction(name);
      if (definition.isPresent()) {
        return FunctionCalls.call(ctx, definition.get(), arguments);
      }
      final Optional<ProtocolFunction> protocol = ProtocolFunctions.lookup(target.orElse(name));
      if (protocol.isPresent()) {
        logger.debug("Calling builtins.{} with {}", name, arguments);
        return protocol.get().call(ctx, arguments);
      }
      return callRegistered(target.orElse(name), arguments);
    }

    if (function instanceof Expression.Attribute) {
      final Expression.Attribute attribute = (Expression.Attribute) function;
      final boolean receiverBound =
          attribute.getRootName().map(root -> ctx.getScope().get(root).isPresent()).orElse(true);
      if (receiverBound) {
        return callMethod(attribute, arguments);
      }
      final String qualified =
          target.orElseGet(
              () ->
                  attribute
                      .getDottedName()
                      .orElseThrow(() -> new UnsupportedConstructException("call target")));
      return callRegistered(qualified, arguments);
    }

    return evaluateValue(function).call(ctx, arguments);
  }

  private Arguments evaluateArguments(final Expression.Call node) {
    final Map<String, Value> keywords = new LinkedHashMap<>();
    for (final Expression.Keyword keyword : node.getKeywords()) {
      keywords.put(keyword.getName(), evaluateValue(keyword.getValue()));
    }
    return new Arguments(evaluateAll(node.getArguments()), keywords);
  }

  private Value callRegistered(final String qualifiedName, final Arguments arguments) {
    final Builtin builtin =
        BuiltinRegistry.lookup(qualifiedName)
            .orElseThrow(() -> new UnsupportedConstructException("call target", qualifiedName));
    logger.debug("Calling {} with {}", qualifiedName, arguments);
    return builtin.call(new CallSite(qualifiedName, ctx), arguments);
  }

  /**
   * Call a method. Methods that update their receiver in place produce the updated value, which
   * is rebound to the receiver variable; the call itself evaluates to nothing.
   */
  private Value callMethod(final Expression.Attribute attribute, final Arguments arguments) {
    final Value receiver = evaluateValue(attribute.getValue());
    final String method = attribute.getAttribute();
    if (!receiver.isMutator(method)) {
      return receiver.callMethod(ctx, method, arguments);
    }
    if (!(attribute.getValue() instanceof Expression.Name)) {
      throw new UnsupportedConstructException("in-place update of a non-variable", method);
    }
    final String variable = ((Expression.Name) attribute.getValue()).getId();
    ctx.getScope().set(variable, receiver.callMethod(ctx, method, arguments));
    return null;
  }

  @Override
  public Value visitSubscript(final Expression.Subscript node) {
    final Value value = evaluateValue(node.getValue());
    if (node.getIndex() instanceof Expression.Slice) {
      final Expression.Slice slice = (Expression.Slice) node.getIndex();
      if (slice.getStep().isPresent()) {
        final Optional<BigInteger> step = Values.constantInt(evaluateValue(slice.getStep().get()));
        if (!step.isPresent() || !step.get().equals(BigInteger.ONE)) {
          throw new UnsupportedConstructException("slice step");
        }
      }
      return value.getSlice(
          ctx,
          slice.getLower().map(this::evaluateValue),
          slice.getUpper().map(this::evaluateValue));
    }
    return value.getItem(ctx, evaluateValue(node.getIndex()));
  }

  @Override
  public Value visitSlice(final Expression.Slice node) {
    throw new UnsupportedConstructException("slice outside subscript");
  }

  @Override
  public Value visitTupleLiteral(final Expression.TupleLiteral node) {
    return new FixedTupleValue(z3, evaluateAll(node.getElements()));
  }

  @Override
  public Value visitListLiteral(final Expression.ListLiteral node) {
    final List<Value> elements = evaluateAll(node.getElements());
    return ListValue.of(z3, commonSort("list", elements), elements);
  }

  @Override
  public Value visitSetLiteral(final Expression.SetLiteral node) {
    final List<Value> elements = evaluateAll(node.getElements());
    return SetValue.of(z3, commonSort("set", elements), elements);
  }

  @Override
  public Value visitDictLiteral(final Expression.DictLiteral node) {
    final List<Value> keys = evaluateAll(node.getKeys());
    final List<Value> values = evaluateAll(node.getValues());
    return DictValue.of(z3, commonSort("dict", keys), commonSort("dict", values), keys, values);
  }

  /** Get the sort all elements of a display can be stored as; empty displays have none. */
  private Sort commonSort(final String display, final List<Value> elements) {
    if (elements.isEmpty()) {
      throw new UnsupportedConstructException("empty " + display + " literal");
    }
    final List<Value> promoted = Values.promote(elements);
    final Value first = promoted.get(0);
    if (first.getKind() == Kind.FIXED_TUPLE || first.getKind() == Kind.FUNCTION) {
      throw new UnsupportedConstructException(
          display + " of " + first.getKind().getTypeName() + " elements");
    }
    return first.getSort();
  }

  @Override
  public Value visitIfExpression(final Expression.IfExpression node) {
    final BoolExpr test = evaluateValue(node.getTest()).asBool().unwrap();
    final ExecutionContext then = ctx.makeChild();
    final Value thenValue = new ExpressionEvaluator(then).evaluateValue(node.getBody());
    final ExecutionContext orElse = ctx.makeChild();
    final Value elseValue = new ExpressionEvaluator(orElse).evaluateValue(node.getOrElse());
    Branches.fold(ctx, test, then);
    Branches.fold(ctx, z3.mkNot(test), orElse);
    final List<Value> merged = Values.promote(List.of(thenValue, elseValue));
    return Values.ifExpr(test, merged.get(0), merged.get(1));
  }

  /**
   * Unroll a comprehension over an iterable of constant length. Each candidate element is kept
   * under the conjunction of the filter conditions; a condition is only evaluated where the
   * preceding ones hold.
   */
  @Override
  public Value visitListComprehension(final Expression.ListComprehension node) {
    final List<Value> items =
        evaluateValue(node.getIterable()).elements(ctx.getConfig().getUnrollLimit());
    if (items.isEmpty()) {
      throw new UnsupportedConstructException("comprehension over empty iterable");
    }
    final List<BoolExpr> guards = new ArrayList<>(items.size());
    final List<Value> candidates = new ArrayList<>(items.size());
    for (final Value item : items) {
      final ExecutionContext iteration = ctx.makeChild();
      iteration.getScope().set(node.getTarget(), item);
      BoolExpr guard = z3.mkTrue();
      for (final Expression condition : node.getConditions()) {
        final ExecutionContext filter = iteration.makeChild();
        final BoolExpr holds =
            new ExpressionEvaluator(filter).evaluateValue(condition).asBool().unwrap();
        Branches.fold(iteration, guard, filter);
        guard = z3.mkAnd(guard, holds);
      }
      final ExecutionContext element = iteration.makeChild();
      candidates.add(new ExpressionEvaluator(element).evaluateValue(node.getElement()));
      Branches.fold(iteration, guard, element);
      Branches.fold(ctx, z3.mkTrue(), iteration);
      guards.add(guard);
    }
    return ListValue.filtered(z3, commonSort("list", candidates), guards, candidates);
  }

  @Override
  public Value visitUnknown(final Expression.Unknown node) {
    throw new UnsupportedConstructException("expression", node.kind());
  }
}
