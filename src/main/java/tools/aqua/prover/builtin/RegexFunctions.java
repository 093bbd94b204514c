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
import java.util.function.BiFunction;
import tools.aqua.prover.UnsupportedConstructException;
import tools.aqua.prover.regex.PatternCompiler;
import tools.aqua.prover.value.Arguments;
import tools.aqua.prover.value.BoolValue;
import tools.aqua.prover.value.Kind;
import tools.aqua.prover.value.PatternValue;
import tools.aqua.prover.value.Value;
import tools.aqua.prover.value.Values;

/**
 * Models of the {@code re} module. Patterns must be constant strings; the match functions return
 * whether a match exists, since match objects are not modeled.
 */
final class RegexFunctions {

  private RegexFunctions() {}

  static void register(final Map<String, Builtin> registry) {
    registry.put("re.compile", RegexFunctions::compile);
    registry.put("re.fullmatch", matcher(PatternValue::fullMatch));
    registry.put("re.match", matcher(PatternValue::match));
    registry.put("re.search", matcher(PatternValue::search));
  }

  private static PatternValue pattern(final CallSite site, final Value pattern) {
    if (pattern.getKind() == Kind.PATTERN) {
      return (PatternValue) pattern;
    }
    final String source =
        Values.constantString(pattern)
            .orElseThrow(
                () -> new UnsupportedConstructException("non-constant pattern", site.getName()));
    return new PatternValue(site.getZ3(), PatternCompiler.compile(site.getZ3(), source));
  }

  /** {@code compile(pattern)}. */
  static Value compile(final CallSite site, final Arguments arguments) {
    arguments.check(site.getName(), 1, "pattern");
    return pattern(site, arguments.require(0, "pattern", site.getName()));
  }

  private static Builtin matcher(final BiFunction<PatternValue, Value, BoolValue> mode) {
    return (site, arguments) -> {
      arguments.check(site.getName(), 2, "pattern", "string");
      final PatternValue pattern = pattern(site, arguments.require(0, "pattern", site.getName()));
      return mode.apply(pattern, arguments.require(1, "string", site.getName()));
    };
  }
}
