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
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static tools.aqua.prover.Solving.emptyContext;
import static tools.aqua.prover.Solving.isSatisfiable;
import static tools.aqua.prover.Solving.isValid;

import com.microsoft.z3.Context;
import org.junit.jupiter.api.Test;
import tools.aqua.prover.SortMismatchException;
import tools.aqua.prover.context.ExecutionContext;

/** Test lists over solver sequences. */
class ListValueTest {

  private static ListValue ints(final Context ctx, final long... values) {
    final Value[] elements = new Value[values.length];
    for (int i = 0; i < values.length; i++) {
      elements[i] = IntValue.of(ctx, values[i]);
    }
    return ListValue.of(ctx, ctx.getIntSort(), asList(elements));
  }

  /** Append produces the extended list and coerces bools. */
  @Test
  void testAppend() {
    try (Context ctx = new Context()) {
      final ExecutionContext context = emptyContext(ctx);
      final ListValue list = ints(ctx, 1, 2);
      assertThat(list.isMutator("append")).isTrue();
      assertThat(list.isMutator("count")).isFalse();

      final Value appended =
          list.callMethod(context, "append", Arguments.of(BoolValue.of(ctx, true)));
      assertThat(isValid(ctx, appended.eq(ints(ctx, 1, 2, 1)).unwrap())).isTrue();
      assertThat(isValid(ctx, list.length().eq(IntValue.of(ctx, 2)).unwrap())).isTrue();

      assertThatThrownBy(
              () -> list.callMethod(context, "append", Arguments.of(StrValue.of(ctx, "x"))))
          .isInstanceOf(SortMismatchException.class);
    }
  }

  /** Lists compare lexicographically; on constant lists a witness decides the order. */
  @Test
  void testOrdering() {
    try (Context ctx = new Context()) {
      assertThat(isSatisfiable(ctx, ints(ctx, 1, 2).lt(ints(ctx, 1, 3)).unwrap())).isTrue();
      assertThat(isSatisfiable(ctx, ints(ctx, 1).lt(ints(ctx, 1, 0)).unwrap())).isTrue();
      assertThat(isSatisfiable(ctx, ints(ctx, 2).gt(ints(ctx, 1, 9)).unwrap())).isTrue();
      assertThat(isValid(ctx, ints(ctx, 1, 2).le(ints(ctx, 1, 2)).unwrap())).isTrue();
    }
  }

  /** Membership promotes numeric items and rejects other variants. */
  @Test
  void testContains() {
    try (Context ctx = new Context()) {
      final ListValue list = ints(ctx, 1, 2);
      assertThat(isValid(ctx, list.contains(IntValue.of(ctx, 2)).unwrap())).isTrue();
      assertThat(isValid(ctx, list.contains(BoolValue.of(ctx, true)).unwrap())).isTrue();
      assertThat(isValid(ctx, list.contains(StrValue.of(ctx, "1")).not().unwrap())).isTrue();
    }
  }

  /** A filtered list keeps exactly the guarded candidates. */
  @Test
  void testFiltered() {
    try (Context ctx = new Context()) {
      final ListValue filtered =
          ListValue.filtered(
              ctx,
              ctx.getIntSort(),
              asList(ctx.mkTrue(), ctx.mkFalse(), ctx.mkTrue()),
              asList(IntValue.of(ctx, 1), IntValue.of(ctx, 2), IntValue.of(ctx, 3)));
      assertThat(isValid(ctx, filtered.eq(ints(ctx, 1, 3)).unwrap())).isTrue();
    }
  }
}
