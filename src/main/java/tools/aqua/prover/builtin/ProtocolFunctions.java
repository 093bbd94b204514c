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

import static java.util.Collections.unmodifiableMap;

import com.microsoft.z3.Context;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import tools.aqua.prover.UnsupportedConstructException;
import tools.aqua.prover.context.ExecutionContext;
import tools.aqua.prover.value.Arguments;
import tools.aqua.prover.value.BoolValue;
import tools.aqua.prover.value.FloatValue;
import tools.aqua.prover.value.IntValue;
import tools.aqua.prover.value.StrValue;
import tools.aqua.prover.value.Value;
import tools.aqua.prover.value.Values;

/** The supported functions of the {@code builtins} namespace. */
public final class ProtocolFunctions {

  private static final String NAMESPACE = "builtins.";

  private static final Map<String, ProtocolFunction> FUNCTIONS;

  static {
    final Map<String, ProtocolFunction> functions = new TreeMap<>();
    functions.put("len", ProtocolFunctions::len);
    functions.put("abs", ProtocolFunctions::abs);
    functions.put("bool", ProtocolFunctions::bool);
    functions.put("int", ProtocolFunctions::toInt);
    functions.put("float", ProtocolFunctions::toFloat);
    functions.put("str", ProtocolFunctions::str);
    functions.put("ord", ProtocolFunctions::ord);
    functions.put("min", (ctx, arguments) -> extremum(ctx, arguments, "min", true));
    functions.put("max", (ctx, arguments) -> extremum(ctx, arguments, "max", false));
    functions.put("sum", ProtocolFunctions::sum);
    FUNCTIONS = unmodifiableMap(functions);
  }

  private ProtocolFunctions() {}

  /**
   * Find a function by its qualified ({@code builtins.len}) or bare ({@code len}) name.
   *
   * @param name the name.
   * @return the function, if supported.
   */
  public static Optional<ProtocolFunction> lookup(final String name) {
    final String bare = name.startsWith(NAMESPACE) ? name.substring(NAMESPACE.length()) : name;
    return Optional.ofNullable(FUNCTIONS.get(bare));
  }

  private static UnsupportedConstructException unsupported(final String function, final Value x) {
    return new UnsupportedConstructException(
        function + " of " + x.getKind().getTypeName(), NAMESPACE + function);
  }

  private static Value len(final ExecutionContext ctx, final Arguments arguments) {
    arguments.check("len", 1, "obj");
    return arguments.require(0, "obj", "len").length();
  }

  private static Value abs(final ExecutionContext ctx, final Arguments arguments) {
    arguments.check("abs", 1, "x");
    final Value x = arguments.require(0, "x", "abs");
    switch (x.getKind()) {
      case BOOL:
        return ((BoolValue) x).toInt().abs();
      case INT:
        return ((IntValue) x).abs();
      case FLOAT:
        return ((FloatValue) x).abs();
      default:
        throw unsupported("abs", x);
    }
  }

  private static Value bool(final ExecutionContext ctx, final Arguments arguments) {
    arguments.check("bool", 0, "x");
    return arguments
        .get(0, "x")
        .map(Value::asBool)
        .orElseGet(() -> BoolValue.of(ctx.getZ3(), false));
  }

  private static Value toInt(final ExecutionContext ctx, final Arguments arguments) {
    arguments.check("int", 0, "x");
    final Context z3 = ctx.getZ3();
    final Optional<Value> argument = arguments.get(0, "x");
    if (argument.isEmpty()) {
      return IntValue.of(z3, 0);
    }
    final Value x = argument.get();
    switch (x.getKind()) {
      case BOOL:
        return ((BoolValue) x).toInt();
      case INT:
        return x;
      case FLOAT:
        final FloatValue number = (FloatValue) x;
        ctx.raise(number.isNaN().unwrap(), "ValueError");
        ctx.raise(number.isInfinite().unwrap(), "OverflowError");
        return number.toInt();
      case STR:
        return ((StrValue) x).toInt(ctx);
      default:
        throw unsupported("int", x);
    }
  }

  private static Value toFloat(final ExecutionContext ctx, final Arguments arguments) {
    arguments.check("float", 0, "x");
    final Optional<Value> argument = arguments.get(0, "x");
    if (argument.isEmpty()) {
      return FloatValue.of(ctx.getZ3(), 0.0);
    }
    final Value x = argument.get();
    if (!x.getKind().isNumeric()) {
      throw unsupported("float", x);
    }
    return Values.toFloat(x);
  }

  private static Value str(final ExecutionContext ctx, final Arguments arguments) {
    arguments.check("str", 0, "object");
    final Context z3 = ctx.getZ3();
    final Optional<Value> argument = arguments.get(0, "object");
    if (argument.isEmpty()) {
      return StrValue.of(z3, "");
    }
    final Value x = argument.get();
    switch (x.getKind()) {
      case BOOL:
        return Values.ifExpr(
            ((BoolValue) x).unwrap(), StrValue.of(z3, "True"), StrValue.of(z3, "False"));
      case INT:
        return ((IntValue) x).toStr();
      case STR:
        return x;
      default:
        throw unsupported("str", x);
    }
  }

  private static Value ord(final ExecutionContext ctx, final Arguments arguments) {
    arguments.check("ord", 1, "c");
    final Value c = arguments.require(0, "c", "ord");
    if (!(c instanceof StrValue)) {
      throw unsupported("ord", c);
    }
    return ((StrValue) c).ord(ctx);
  }

  /** {@code min} and {@code max} over their arguments or over a single iterable argument. */
  private static Value extremum(
      final ExecutionContext ctx,
      final Arguments arguments,
      final String function,
      final boolean minimum) {
    if (!arguments.getKeywords().isEmpty()) {
      throw new UnsupportedConstructException("keyword arguments", NAMESPACE + function);
    }
    final List<Value> positional = arguments.getPositional();
    if (positional.isEmpty()) {
      throw new UnsupportedConstructException("missing argument iterable", NAMESPACE + function);
    }
    final List<Value> candidates =
        Values.promote(
            positional.size() == 1
                ? positional.get(0).elements(ctx.getConfig().getUnrollLimit())
                : positional);
    if (candidates.isEmpty()) {
      throw new UnsupportedConstructException("empty iterable", NAMESPACE + function);
    }
    Value result = candidates.get(0);
    for (final Value candidate : candidates.subList(1, candidates.size())) {
      // ties keep the earlier candidate
      final BoolValue replaces = minimum ? candidate.lt(result) : candidate.gt(result);
      result = Values.ifExpr(replaces.unwrap(), candidate, result);
    }
    return result;
  }

  private static Value sum(final ExecutionContext ctx, final Arguments arguments) {
    arguments.check("sum", 1, "iterable", "start");
    final Value start = arguments.get(1, "start").orElseGet(() -> IntValue.of(ctx.getZ3(), 0));
    Value total = start;
    for (final Value element :
        arguments.require(0, "iterable", "sum").elements(ctx.getConfig().getUnrollLimit())) {
      total = total.add(element);
    }
    return total;
  }
}
