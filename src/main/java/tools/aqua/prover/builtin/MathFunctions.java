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

import java.util.Map;
import java.util.function.Function;
import tools.aqua.prover.UnsupportedConstructException;
import tools.aqua.prover.value.Arguments;
import tools.aqua.prover.value.BoolValue;
import tools.aqua.prover.value.FloatValue;
import tools.aqua.prover.value.Value;
import tools.aqua.prover.value.Values;

/** Models of the float classification functions of the {@code math} module. */
final class MathFunctions {

  private MathFunctions() {}

  static void register(final Map<String, Builtin> registry) {
    registry.put("math.isnan", classifier(FloatValue::isNaN));
    registry.put("math.isinf", classifier(FloatValue::isInfinite));
    registry.put("math.isfinite", classifier(FloatValue::isFinite));
  }

  private static Builtin classifier(final Function<FloatValue, BoolValue> test) {
    return (site, arguments) -> classify(site, arguments, test);
  }

  private static Value classify(
      final CallSite site, final Arguments arguments, final Function<FloatValue, BoolValue> test) {
    arguments.check(site.getName(), 1, "x");
    final Value x = arguments.require(0, "x", site.getName());
    if (!x.getKind().isNumeric()) {
      throw new UnsupportedConstructException("non-numeric argument", site.getName());
    }
    return test.apply(Values.toFloat(x));
  }
}
