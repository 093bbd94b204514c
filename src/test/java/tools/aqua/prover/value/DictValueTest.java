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
import tools.aqua.prover.context.ExceptionInfo;
import tools.aqua.prover.context.ExecutionContext;

/** Test dictionaries over partial maps. */
class DictValueTest {

  private static DictValue ages(final Context ctx) {
    return DictValue.of(
        ctx,
        ctx.mkStringSort(),
        ctx.getIntSort(),
        asList(StrValue.of(ctx, "ann"), StrValue.of(ctx, "bob")),
        asList(IntValue.of(ctx, 31), IntValue.of(ctx, 42)));
  }

  /** Membership tests keys only. */
  @Test
  void testContains() {
    try (Context ctx = new Context()) {
      final DictValue dict = ages(ctx);
      assertThat(isValid(ctx, dict.contains(StrValue.of(ctx, "ann")).unwrap())).isTrue();
      assertThat(isValid(ctx, dict.contains(StrValue.of(ctx, "cid")).not().unwrap())).isTrue();
      assertThat(isValid(ctx, dict.contains(IntValue.of(ctx, 31)).not().unwrap())).isTrue();
    }
  }

  /** Lookups of absent keys raise KeyError. */
  @Test
  void testGetItem() {
    try (Context ctx = new Context()) {
      final ExecutionContext context = emptyContext(ctx);
      final DictValue dict = ages(ctx);

      final Value bob = dict.getItem(context, StrValue.of(ctx, "bob"));
      assertThat(isValid(ctx, bob.eq(IntValue.of(ctx, 42)).unwrap())).isTrue();

      dict.getItem(context, StrValue.of(ctx, "cid"));
      final ExceptionInfo missing = context.getExceptions().layer().get(1);
      assertThat(missing.getNames()).contains("KeyError", "LookupError");
      assertThat(isValid(ctx, missing.getCondition())).isTrue();
    }
  }

  /** Get falls back to the default for absent keys and needs one. */
  @Test
  void testGet() {
    try (Context ctx = new Context()) {
      final ExecutionContext context = emptyContext(ctx);
      final DictValue dict = ages(ctx);

      final Value fallback =
          dict.callMethod(
              context, "get", Arguments.of(StrValue.of(ctx, "cid"), IntValue.of(ctx, 0)));
      assertThat(isValid(ctx, fallback.eq(IntValue.of(ctx, 0)).unwrap())).isTrue();
      assertThat(context.getExceptions().layer()).isEmpty();

      assertThatThrownBy(() -> dict.callMethod(context, "get", Arguments.of(StrValue.of(ctx, "a"))))
          .isInstanceOf(UnsupportedConstructException.class);
    }
  }

  /** Dictionaries built in different orders are equal. */
  @Test
  void testEquality() {
    try (Context ctx = new Context()) {
      final DictValue reversed =
          DictValue.of(
              ctx,
              ctx.mkStringSort(),
              ctx.getIntSort(),
              asList(StrValue.of(ctx, "bob"), StrValue.of(ctx, "ann")),
              asList(IntValue.of(ctx, 42), IntValue.of(ctx, 31)));
      assertThat(isValid(ctx, ages(ctx).eq(reversed).unwrap())).isTrue();
    }
  }
}
