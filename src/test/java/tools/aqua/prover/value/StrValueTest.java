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

package tools.aqua.prover.value;

import static java.util.Arrays.asList;
import static org.assertj.core.api.Assertions.assertThat;
import static tools.aqua.prover.Solving.emptyContext;
import static tools.aqua.prover.Solving.isSatisfiable;
import static tools.aqua.prover.Solving.isValid;

import com.microsoft.z3.Context;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import tools.aqua.prover.context.ExceptionInfo;
import tools.aqua.prover.context.ExecutionContext;

/** Test the string operations against the subject language's results. */
class StrValueTest {

  private static StrValue symbol(final Context ctx, final String name) {
    return new StrValue(ctx, ctx.mkConst(name, ctx.mkStringSort()));
  }

  /** Literals survive escaping of non-printable characters and backslashes. */
  @Test
  void testLiteralEscaping() {
    try (Context ctx = new Context()) {
      for (final String text : new String[] {"plain", "tab\there", "back\\slash", "été"}) {
        final StrValue value = StrValue.of(ctx, text);
        assertThat(Values.constantString(value)).contains(text);
        assertThat(isValid(ctx, value.length().eq(IntValue.of(ctx, text.length())).unwrap()))
            .isTrue();
      }
    }
  }

  /** Negative indices count from the end; out-of-range indices raise IndexError. */
  @Test
  void testIndexing() {
    try (Context ctx = new Context()) {
      final ExecutionContext context = emptyContext(ctx);
      final StrValue abc = StrValue.of(ctx, "abc");

      final Value last = abc.getItem(context, IntValue.of(ctx, -1));
      assertThat(isValid(ctx, last.eq(StrValue.of(ctx, "c")).unwrap())).isTrue();

      abc.getItem(context, IntValue.of(ctx, 3));
      final ExceptionInfo error = context.getExceptions().layer().get(1);
      assertThat(error.getNames()).contains("IndexError", "LookupError");
      assertThat(isValid(ctx, error.getCondition())).isTrue();
    }
  }

  /** Slices clamp their bounds. */
  @Test
  void testSlicing() {
    try (Context ctx = new Context()) {
      final ExecutionContext context = emptyContext(ctx);
      final StrValue hello = StrValue.of(ctx, "hello");
      final Value middle =
          hello.getSlice(
              context, Optional.of(IntValue.of(ctx, 1)), Optional.of(IntValue.of(ctx, -1)));
      assertThat(isValid(ctx, middle.eq(StrValue.of(ctx, "ell")).unwrap())).isTrue();
      final Value clamped =
          hello.getSlice(
              context, Optional.of(IntValue.of(ctx, 3)), Optional.of(IntValue.of(ctx, 99)));
      assertThat(isValid(ctx, clamped.eq(StrValue.of(ctx, "lo")).unwrap())).isTrue();
    }
  }

  /** Ordering is lexicographic by code point. */
  @Test
  void testOrdering() {
    try (Context ctx = new Context()) {
      assertThat(isValid(ctx, StrValue.of(ctx, "ab").lt(StrValue.of(ctx, "b")).unwrap())).isTrue();
      assertThat(isValid(ctx, StrValue.of(ctx, "ab").lt(StrValue.of(ctx, "abc")).unwrap()))
          .isTrue();
      assertThat(isValid(ctx, StrValue.of(ctx, "b").ge(StrValue.of(ctx, "b")).unwrap())).isTrue();
    }
  }

  /** The prefix and search methods. */
  @Test
  void testMethods() {
    try (Context ctx = new Context()) {
      final ExecutionContext context = emptyContext(ctx);
      final StrValue text = StrValue.of(ctx, "banana");

      final Value starts =
          text.callMethod(context, "startswith", Arguments.of(StrValue.of(ctx, "ban")));
      assertThat(isValid(ctx, starts.asBool().unwrap())).isTrue();

      final Value alternatives =
          text.callMethod(
              context,
              "endswith",
              Arguments.of(
                  new FixedTupleValue(
                      ctx, asList(StrValue.of(ctx, "x"), StrValue.of(ctx, "na")))));
      assertThat(isValid(ctx, alternatives.asBool().unwrap())).isTrue();

      final Value found = text.callMethod(context, "find", Arguments.of(StrValue.of(ctx, "an")));
      assertThat(isValid(ctx, found.eq(IntValue.of(ctx, 1)).unwrap())).isTrue();

      final Value later =
          text.callMethod(
              context, "find", Arguments.of(StrValue.of(ctx, "an"), IntValue.of(ctx, 2)));
      assertThat(isValid(ctx, later.eq(IntValue.of(ctx, 3)).unwrap())).isTrue();

      text.callMethod(context, "index", Arguments.of(StrValue.of(ctx, "x")));
      assertThat(context.getExceptions().layer()).hasSize(1);
      assertThat(context.getExceptions().layer().get(0).getNames()).contains("ValueError");
    }
  }

  /** A start past the end finds nothing, even for the empty string. */
  @Test
  void testFindPastEnd() {
    try (Context ctx = new Context()) {
      final ExecutionContext context = emptyContext(ctx);
      final StrValue text = StrValue.of(ctx, "abc");
      final StrValue empty = StrValue.of(ctx, "");

      final Value atEnd =
          text.callMethod(context, "find", Arguments.of(empty, IntValue.of(ctx, 3)));
      assertThat(isValid(ctx, atEnd.eq(IntValue.of(ctx, 3)).unwrap())).isTrue();

      final Value pastEnd =
          text.callMethod(context, "find", Arguments.of(empty, IntValue.of(ctx, 5)));
      assertThat(isValid(ctx, pastEnd.eq(IntValue.of(ctx, -1)).unwrap())).isTrue();

      final Value fromEnd =
          text.callMethod(context, "find", Arguments.of(empty, IntValue.of(ctx, -5)));
      assertThat(isValid(ctx, fromEnd.eq(IntValue.of(ctx, 0)).unwrap())).isTrue();

      text.callMethod(context, "index", Arguments.of(empty, IntValue.of(ctx, 5)));
      assertThat(context.getExceptions().layer()).hasSize(1);
      final ExceptionInfo missing = context.getExceptions().layer().get(0);
      assertThat(missing.getNames()).contains("ValueError");
      assertThat(isValid(ctx, missing.getCondition())).isTrue();
    }
  }

  /** Parsing an int records a ValueError exactly for malformed input. */
  @Test
  void testToInt() {
    try (Context ctx = new Context()) {
      final ExecutionContext context = emptyContext(ctx);
      final IntValue parsed = StrValue.of(ctx, "-42").toInt(context);
      assertThat(isValid(ctx, parsed.eq(IntValue.of(ctx, -42)).unwrap())).isTrue();
      assertThat(isSatisfiable(ctx, context.getExceptions().layer().get(0).getCondition()))
          .isFalse();

      final ExecutionContext other = emptyContext(ctx);
      final StrValue s = symbol(ctx, "s");
      s.toInt(other);
      final ExceptionInfo error = other.getExceptions().layer().get(0);
      assertThat(error.getNames()).contains("ValueError");
      assertThat(
              isValid(
                  ctx,
                  error.getCondition(),
                  ctx.mkEq(s.unwrap(), StrValue.of(ctx, "4x").unwrap())))
          .isTrue();
    }
  }

  /** Ord records a TypeError unless the string has length 1. */
  @Test
  void testOrd() {
    try (Context ctx = new Context()) {
      final ExecutionContext context = emptyContext(ctx);
      final IntValue code = StrValue.of(ctx, "A").ord(context);
      assertThat(isValid(ctx, code.eq(IntValue.of(ctx, 65)).unwrap())).isTrue();
      assertThat(isSatisfiable(ctx, context.getExceptions().layer().get(0).getCondition()))
          .isFalse();
    }
  }
}
