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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.aqua.prover.UnsupportedConstructException;
import tools.aqua.prover.ast.Parameter;
import tools.aqua.prover.ast.Statement;
import tools.aqua.prover.context.ExecutionContext;
import tools.aqua.prover.context.ReturnInfo;
import tools.aqua.prover.value.Arguments;
import tools.aqua.prover.value.Value;
import tools.aqua.prover.value.Values;

/** Inlining of calls to functions defined in the analyzed module. */
public final class FunctionCalls {

  private static final Logger logger = LoggerFactory.getLogger(FunctionCalls.class);

  private FunctionCalls() {}

  /**
   * Evaluate a call by executing the callee's body in a fresh scope. Constraints, proof
   * obligations and exceptions of the callee become those of the caller; its returns determine
   * the call's value.
   *
   * @param caller the calling context.
   * @param function the called definition.
   * @param arguments the evaluated arguments.
   * @return the call's value, {@code null} if the callee returns nothing.
   */
  static Value call(
      final ExecutionContext caller,
      final Statement.FunctionDef function,
      final Arguments arguments) {
    logger.debug("Inlining call of {} with {}", function.getName(), arguments);
    final ExecutionContext callee = caller.makeCall();
    bind(caller, callee, function, arguments);
    new StatementEvaluator(callee).evaluate(function);
    callee.getGiven().layer().forEach(caller.getGiven()::add);
    callee.getExpected().layer().forEach(caller.getExpected()::add);
    callee.getExceptions().layer().forEach(caller.getExceptions()::add);
    return returnValue(callee.getReturns().layer());
  }

  private static void bind(
      final ExecutionContext caller,
      final ExecutionContext callee,
      final Statement.FunctionDef function,
      final Arguments arguments) {
    final List<Parameter> parameters = function.getParameters();
    final List<Value> positional = arguments.getPositional();
    if (positional.size() > parameters.size()) {
      throw new UnsupportedConstructException("too many arguments", function.getName());
    }
    for (int i = 0; i < parameters.size(); i++) {
      final Parameter parameter = parameters.get(i);
      final Value value;
      if (i < positional.size()) {
        value = positional.get(i);
      } else if (arguments.getKeywords().containsKey(parameter.getName())) {
        value = arguments.getKeywords().get(parameter.getName());
      } else {
        value =
            new ExpressionEvaluator(caller)
                .evaluate(
                    parameter
                        .getDefaultValue()
                        .orElseThrow(
                            () ->
                                new UnsupportedConstructException(
                                    "missing argument " + parameter.getName(),
                                    function.getName())));
      }
      callee.getScope().set(parameter.getName(), value);
    }
    for (final Map.Entry<String, Value> keyword : arguments.getKeywords().entrySet()) {
      final int index = parameterIndex(parameters, keyword.getKey());
      if (index < 0) {
        throw new UnsupportedConstructException(
            "unexpected keyword argument " + keyword.getKey(), function.getName());
      }
      if (index < positional.size()) {
        throw new UnsupportedConstructException(
            "duplicate argument " + keyword.getKey(), function.getName());
      }
    }
  }

  private static int parameterIndex(final List<Parameter> parameters, final String name) {
    for (int i = 0; i < parameters.size(); i++) {
      if (parameters.get(i).getName().equals(name)) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Combine the returns of a function body into the value it returns. The last return serves as
   * the fallback for paths that reach none of the others, including paths that fall off the end
   * of the body.
   *
   * @param returns the returns in evaluation order.
   * @return the combined value, {@code null} if no return carries a value.
   * @throws UnsupportedConstructException if some returns carry a value and others do not.
   */
  public static Value returnValue(final List<ReturnInfo> returns) {
    final List<Value> values = new ArrayList<>();
    for (final ReturnInfo ret : returns) {
      ret.getValue().ifPresent(values::add);
    }
    if (values.isEmpty()) {
      return null;
    }
    if (values.size() != returns.size()) {
      throw new UnsupportedConstructException("mixed return of value and None");
    }
    final List<Value> promoted = Values.promote(values);
    Value result = promoted.get(promoted.size() - 1);
    for (int i = promoted.size() - 2; i >= 0; i--) {
      result = Values.ifExpr(returns.get(i).getCondition(), promoted.get(i), result);
    }
    return result;
  }
}
