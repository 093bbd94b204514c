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

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntSort;
import java.math.BigInteger;
import java.util.Map;
import tools.aqua.prover.UnsupportedConstructException;
import tools.aqua.prover.value.Arguments;
import tools.aqua.prover.value.FloatValue;
import tools.aqua.prover.value.IntValue;
import tools.aqua.prover.value.Value;
import tools.aqua.prover.value.Values;

/**
 * Models of the {@code random} module. Each call yields a fresh symbol whose documented range is
 * assumed at the call site. The module-level functions are aliases of the methods of the shared
 * {@code random.Random} instance.
 */
final class RandomFunctions {

  private RandomFunctions() {}

  static void register(final Map<String, Builtin> registry) {
    alias(registry, "randint", RandomFunctions::randint);
    alias(registry, "randrange", RandomFunctions::randrange);
    alias(registry, "choice", RandomFunctions::choice);
    alias(registry, "random", RandomFunctions::random);
  }

  private static void alias(
      final Map<String, Builtin> registry, final String name, final Builtin builtin) {
    registry.put("random." + name, builtin);
    registry.put("random.Random." + name, builtin);
  }

  private static Expr<IntSort> integer(final CallSite site, final Value value) {
    return Values.integer(value)
        .orElseThrow(
            () -> new UnsupportedConstructException("non-integer argument", site.getName()));
  }

  /** {@code randint(a, b)}: an int in {@code [a, b]}. */
  static Value randint(final CallSite site, final Arguments arguments) {
    arguments.check(site.getName(), 2, "a", "b");
    final Context z3 = site.getZ3();
    final Expr<IntSort> low = integer(site, arguments.require(0, "a", site.getName()));
    final Expr<IntSort> high = integer(site, arguments.require(1, "b", site.getName()));
    final IntValue result = (IntValue) site.fresh("randint", z3.getIntSort());
    site.assume(z3.mkAnd(z3.mkLe(low, result.unwrap()), z3.mkLe(result.unwrap(), high)));
    return result;
  }

  /**
   * {@code randrange(stop)} or {@code randrange(start, stop[, step])}: an int of the form {@code
   * start + k * step} below {@code stop}. The step must be a positive constant.
   */
  static Value randrange(final CallSite site, final Arguments arguments) {
    arguments.check(site.getName(), 1, "start", "stop", "step");
    final Context z3 = site.getZ3();
    final Expr<IntSort> first = integer(site, arguments.require(0, "start", site.getName()));
    final Expr<IntSort> start;
    final Expr<IntSort> stop;
    if (arguments.get(1, "stop").isPresent()) {
      start = first;
      stop = integer(site, arguments.get(1, "stop").get());
    } else {
      start = z3.mkInt(0);
      stop = first;
    }
    final BigInteger step =
        arguments
            .get(2, "step")
            .map(
                value ->
                    Values.constantInt(value)
                        .orElseThrow(
                            () ->
                                new UnsupportedConstructException(
                                    "symbolic step", site.getName())))
            .orElse(BigInteger.ONE);
    if (step.signum() <= 0) {
      throw new UnsupportedConstructException("non-positive step", site.getName());
    }
    final IntValue result = (IntValue) site.fresh("randrange", z3.getIntSort());
    final Expr<IntSort> offset = z3.mkSub(result.unwrap(), start);
    final BoolExpr onStep = z3.mkEq(z3.mkMod(offset, z3.mkInt(step.toString())), z3.mkInt(0));
    site.assume(
        z3.mkAnd(z3.mkLe(start, result.unwrap()), z3.mkLt(result.unwrap(), stop), onStep));
    return result;
  }

  /** {@code choice(seq)}: some element of a non-empty sequence. */
  static Value choice(final CallSite site, final Arguments arguments) {
    arguments.check(site.getName(), 1, "seq");
    final Context z3 = site.getZ3();
    final Value sequence = arguments.require(0, "seq", site.getName());
    final IntValue index = (IntValue) site.fresh("choice", z3.getIntSort());
    final Expr<IntSort> length = sequence.length().unwrap();
    site.assume(z3.mkAnd(z3.mkLe(z3.mkInt(0), index.unwrap()), z3.mkLt(index.unwrap(), length)));
    return sequence.element(index);
  }

  /** {@code random()}: a float in {@code [0.0, 1.0)}. */
  static Value random(final CallSite site, final Arguments arguments) {
    arguments.check(site.getName(), 0);
    final Context z3 = site.getZ3();
    final FloatValue result = (FloatValue) site.fresh("random", FloatValue.sort(z3));
    site.assume(
        z3.mkAnd(
            z3.mkFPLEq(FloatValue.of(z3, 0.0).unwrap(), result.unwrap()),
            z3.mkFPLt(result.unwrap(), FloatValue.of(z3, 1.0).unwrap())));
    return result;
  }
}
