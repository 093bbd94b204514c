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

package tools.aqua.prover.regex;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static tools.aqua.prover.Solving.isValid;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import tools.aqua.prover.UnsupportedConstructException;
import tools.aqua.prover.value.StrValue;

/** Test the translation of pattern literals into solver regular expressions. */
class PatternCompilerTest {

  private static boolean fullMatches(final String pattern, final String text) {
    try (Context ctx = new Context()) {
      final CompiledPattern compiled = PatternCompiler.compile(ctx, pattern);
      final BoolExpr matches = compiled.fullMatch(ctx, StrValue.literal(ctx, text));
      if (isValid(ctx, matches)) {
        return true;
      }
      assertThat(isValid(ctx, ctx.mkNot(matches))).isTrue();
      return false;
    }
  }

  /** Whole-string matching over the supported syntax. */
  @ParameterizedTest
  @CsvSource({
    "'[a-z]+\\d{2}', abc12, true",
    "'[a-z]+\\d{2}', abc1, false",
    "'(?:ab|cd)*', abcdab, true",
    "'(?:ab|cd)*', abc, false",
    "'a.c', abc, true",
    "'[^0-9]?x', x, true",
    "'[^0-9]?x', 5x, false",
    "'\\w+\\s\\w+', 'hello world', true",
    "'colou?r', color, true",
    "'a{2,}', aaaa, true",
    "'a{2,3}', aaaa, false",
    "'a+?b', aab, true",
    "'\\.', ., true",
    "'\\.', x, false",
  })
  void testFullMatch(final String pattern, final String text, final boolean expected) {
    assertThat(fullMatches(pattern, text)).isEqualTo(expected);
  }

  /** Match anchors at the start only, search anywhere, unless the pattern is anchored. */
  @Test
  void testMatchModes() {
    try (Context ctx = new Context()) {
      final CompiledPattern digits = PatternCompiler.compile(ctx, "\\d+");
      final CompiledPattern anchored = PatternCompiler.compile(ctx, "^\\d+$");

      assertThat(isValid(ctx, digits.match(ctx, StrValue.literal(ctx, "12ab")))).isTrue();
      assertThat(isValid(ctx, ctx.mkNot(digits.match(ctx, StrValue.literal(ctx, "ab12")))))
          .isTrue();
      assertThat(isValid(ctx, digits.search(ctx, StrValue.literal(ctx, "ab12")))).isTrue();
      assertThat(isValid(ctx, ctx.mkNot(anchored.search(ctx, StrValue.literal(ctx, "ab12")))))
          .isTrue();
      assertThat(anchored.isAnchoredStart()).isTrue();
      assertThat(anchored.isAnchoredEnd()).isTrue();
    }
  }

  /** Syntax outside the supported subset is rejected. */
  @ParameterizedTest
  @ValueSource(strings = {"(?=a)", "a^b", "(a", "a)", "*a", "\\", "(a)\\1", "\\bword"})
  void testUnsupported(final String pattern) {
    try (Context ctx = new Context()) {
      assertThatThrownBy(() -> PatternCompiler.compile(ctx, pattern))
          .isInstanceOf(UnsupportedConstructException.class)
          .hasMessageStartingWith("regex");
    }
  }
}
