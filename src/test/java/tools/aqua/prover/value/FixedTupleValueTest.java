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
import static tools.aqua.prover.Solving.isValid;

import com.microsoft.z3.Context;
import org.junit.jupiter.api.Test;
import tools.aqua.prover.UnsupportedConstructException;
import tools.aqua.prover.context.ExecutionContext;

/** Test heterogeneous fixed-length tuples. */
class FixedTupleValueTest {

  private static FixedTupleValue tuple(final Context ctx, final Value... elements) {
    return new FixedTupleValue(ctx, asList(elements));
  }

  /** Equality is element-wise; differing variants are simply unequal. */
  @Test
  void testEquality() {
    try (Context ctx = new Context()) {
      final FixedTupleValue left = tuple(ctx, IntValue.of(ctx, 1), StrValue.of(ctx, "a"));
      final FixedTupleValue same = tuple(ctx, BoolValue.of(ctx, true), StrValue.of(ctx, "a"));
      final FixedTupleValue other = tuple(ctx, StrValue.of(ctx, "a"), IntValue.of(ctx, 1));

      assertThat(isValid(ctx, left.eq(same).unwrap())).isTrue();
      assertThat(isValid(ctx, left.ne(other).unwrap())).isTrue();
      assertThat(isValid(ctx, left.ne(tuple(ctx, IntValue.of(ctx, 1))).unwrap())).isTrue();
    }
  }

  /** Ordering is lexicographic, shorter prefixes first. */
  @Test
  void testOrdering() {
    try (Context ctx = new Context()) {
      final FixedTupleValue oneTwo = tuple(ctx, IntValue.of(ctx, 1), IntValue.of(ctx, 2));
      final FixedTupleValue oneThree = tuple(ctx, IntValue.of(ctx, 1), IntValue.of(ctx, 3));
      final FixedTupleValue one = tuple(ctx, IntValue.of(ctx, 1));

      assertThat(isValid(ctx, oneTwo.lt(oneThree).unwrap())).isTrue();
      assertThat(isValid(ctx, one.lt(oneTwo).unwrap())).isTrue();
      assertThat(isValid(ctx, oneThree.gt(oneTwo).unwrap())).isTrue();
      assertThat(isValid(ctx, oneTwo.le(oneTwo).unwrap())).isTrue();
      assertThat(isValid(ctx, oneTwo.lt(oneTwo).not().unwrap())).isTrue();
    }
  }

  /** Constant indices resolve directly; symbolic ones select by position. */
  @Test
  void testIndexing() {
    try (Context ctx = new Context()) {
      final ExecutionContext context = emptyContext(ctx);
      final FixedTupleValue pair = tuple(ctx, StrValue.of(ctx, "a"), StrValue.of(ctx, "b"));

      assertThat(pair.getItem(context, IntValue.of(ctx, -1)).getKind()).isEqualTo(Kind.STR);
      assertThat(context.getExceptions().layer()).isEmpty();

      final IntValue i = new IntValue(ctx, ctx.mkIntConst("i"));
      final Value selected = pair.getItem(context, i);
      assertThat(
              isValid(
                  ctx,
                  selected.eq(StrValue.of(ctx, "b")).unwrap(),
                  ctx.mkEq(i.unwrap(), ctx.mkInt(1))))
          .isTrue();
      assertThat(context.getExceptions().layer()).hasSize(1);

      pair.getItem(context, IntValue.of(ctx, 2));
      assertThat(context.getExceptions().layer()).hasSize(2);
      assertThat(context.getExceptions().layer().get(1).getNames()).contains("IndexError");
    }
  }

  /** Any subscript of the empty tuple raises an IndexError. */
  @Test
  void testEmptyIndexing() {
    try (Context ctx = new Context()) {
      final ExecutionContext context = emptyContext(ctx);
      final FixedTupleValue empty = tuple(ctx);

      empty.getItem(context, new IntValue(ctx, ctx.mkIntConst("i")));

      assertThat(context.getExceptions().layer()).hasSize(1);
      assertThat(context.getExceptions().layer().get(0).getNames()).contains("IndexError");
      assertThat(isValid(ctx, context.interrupted())).isTrue();
    }
  }

  /** Count and index compare with subject-language equality. */
  @Test
  void testMethods() {
    try (Context ctx = new Context()) {
      final ExecutionContext context = emptyContext(ctx);
      final FixedTupleValue values =
          tuple(ctx, IntValue.of(ctx, 1), StrValue.of(ctx, "1"), FloatValue.of(ctx, 1.0));

      final Value count = values.callMethod(context, "count", Arguments.of(IntValue.of(ctx, 1)));
      assertThat(isValid(ctx, count.eq(IntValue.of(ctx, 2)).unwrap())).isTrue();

      final Value index = values.callMethod(context, "index", Arguments.of(StrValue.of(ctx, "1")));
      assertThat(isValid(ctx, index.eq(IntValue.of(ctx, 1)).unwrap())).isTrue();
    }
  }

  /** Tuples have no solver sort of their own. */
  @Test
  void testNoSort() {
    try (Context ctx = new Context()) {
      assertThatThrownBy(() -> tuple(ctx, IntValue.of(ctx, 1)).getSort())
          .isInstanceOf(UnsupportedConstructException.class);
    }
  }
}
