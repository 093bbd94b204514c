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

import static java.util.Arrays.asList;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static tools.aqua.prover.Solving.emptyContext;
import static tools.aqua.prover.Solving.isValid;

import com.microsoft.z3.Context;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;
import tools.aqua.prover.UnsupportedConstructException;
import tools.aqua.prover.context.ExceptionInfo;
import tools.aqua.prover.context.ExecutionContext;
import tools.aqua.prover.value.Arguments;
import tools.aqua.prover.value.BoolValue;
import tools.aqua.prover.value.FloatValue;
import tools.aqua.prover.value.IntValue;
import tools.aqua.prover.value.Kind;
import tools.aqua.prover.value.ListValue;
import tools.aqua.prover.value.StrValue;
import tools.aqua.prover.value.Value;

/** Test the modeled functions of the builtins namespace. */
class ProtocolFunctionsTest {

  private static Value call(
      final ExecutionContext context, final String name, final Value... arguments) {
    return ProtocolFunctions.lookup(name).orElseThrow().call(context, Arguments.of(arguments));
  }

  private static boolean holds(final Context ctx, final Value value) {
    return isValid(ctx, value.asBool().unwrap());
  }

  private static ListValue ints(final Context ctx, final long... values) {
    final List<Value> elements = new ArrayList<>();
    for (final long value : values) {
      elements.add(IntValue.of(ctx, value));
    }
    return ListValue.of(ctx, ctx.getIntSort(), elements);
  }

  /** Names resolve with and without the namespace. */
  @Test
  void testLookup() {
    assertThat(ProtocolFunctions.lookup("len")).isPresent();
    assertThat(ProtocolFunctions.lookup("builtins.len")).isPresent();
    assertThat(ProtocolFunctions.lookup("print")).isEmpty();
  }

  /** len, abs and bool. */
  @Test
  void testBasics() {
    try (Context ctx = new Context()) {
      final ExecutionContext context = emptyContext(ctx);

      assertThat(holds(ctx, call(context, "len", StrValue.of(ctx, "abc")).eq(IntValue.of(ctx, 3))))
          .isTrue();
      assertThat(holds(ctx, call(context, "abs", IntValue.of(ctx, -4)).eq(IntValue.of(ctx, 4))))
          .isTrue();
      assertThat(holds(ctx, call(context, "abs", BoolValue.of(ctx, true)).eq(IntValue.of(ctx, 1))))
          .isTrue();
      assertThat(holds(ctx, call(context, "bool").asBool().not())).isTrue();
      assertThat(holds(ctx, call(context, "bool", StrValue.of(ctx, "")).asBool().not()))
          .isTrue();

      assertThatThrownBy(() -> call(context, "abs", ints(ctx, 1)))
          .isInstanceOf(UnsupportedConstructException.class)
          .hasMessage("abs of list: builtins.abs");
    }
  }

  /** int truncates floats and records the conversion errors. */
  @Test
  void testInt() {
    try (Context ctx = new Context()) {
      final ExecutionContext context = emptyContext(ctx);

      final Value truncated = call(context, "int", FloatValue.of(ctx, -2.7));
      assertThat(holds(ctx, truncated.eq(IntValue.of(ctx, -2)))).isTrue();
      assertThat(holds(ctx, call(context, "int", BoolValue.of(ctx, true)).eq(IntValue.of(ctx, 1))))
          .isTrue();
      assertThat(context.getExceptions().layer()).hasSize(2);

      call(context, "int", FloatValue.of(ctx, Double.NaN));
      final List<ExceptionInfo> raised = context.getExceptions().layer();
      final ExceptionInfo valueError = raised.get(raised.size() - 2);
      assertThat(valueError.getNames()).contains("ValueError");
      assertThat(isValid(ctx, valueError.getCondition())).isTrue();
      assertThat(isValid(ctx, ctx.mkNot(raised.get(raised.size() - 1).getCondition()))).isTrue();
    }
  }

  /** str renders bools the way the language does. */
  @Test
  void testStr() {
    try (Context ctx = new Context()) {
      final ExecutionContext context = emptyContext(ctx);

      final Value rendered = call(context, "str", BoolValue.of(ctx, true));
      assertThat(holds(ctx, rendered.eq(StrValue.of(ctx, "True")))).isTrue();
      final Value negative = call(context, "str", IntValue.of(ctx, -12));
      assertThat(holds(ctx, negative.eq(StrValue.of(ctx, "-12")))).isTrue();
      assertThat(holds(ctx, call(context, "str").eq(StrValue.of(ctx, "")))).isTrue();
      assertThatThrownBy(() -> call(context, "str", FloatValue.of(ctx, 1.5)))
          .isInstanceOf(UnsupportedConstructException.class);
    }
  }

  /** min and max over arguments or one iterable, promoting numbers. */
  @Test
  void testExtremum() {
    try (Context ctx = new Context()) {
      final ExecutionContext context = emptyContext(ctx);

      final Value smallest =
          call(context, "min", IntValue.of(ctx, 3), IntValue.of(ctx, 1), IntValue.of(ctx, 2));
      assertThat(holds(ctx, smallest.eq(IntValue.of(ctx, 1)))).isTrue();
      final Value mixed = call(context, "max", IntValue.of(ctx, 1), FloatValue.of(ctx, 2.5));
      assertThat(mixed.getKind()).isEqualTo(Kind.FLOAT);
      assertThat(holds(ctx, mixed.eq(FloatValue.of(ctx, 2.5)))).isTrue();
      assertThat(holds(ctx, call(context, "max", ints(ctx, 5, 9, 3)).eq(IntValue.of(ctx, 9))))
          .isTrue();

      assertThatThrownBy(() -> call(context, "min", ints(ctx)))
          .isInstanceOf(UnsupportedConstructException.class);
      assertThatThrownBy(
              () ->
                  ProtocolFunctions.lookup("max")
                      .orElseThrow()
                      .call(
                          context,
                          new Arguments(
                              asList(IntValue.of(ctx, 1), IntValue.of(ctx, 2)),
                              Collections.singletonMap("key", IntValue.of(ctx, 0)))))
          .isInstanceOf(UnsupportedConstructException.class);
    }
  }

  /** sum adds the elements to the start value. */
  @Test
  void testSum() {
    try (Context ctx = new Context()) {
      final ExecutionContext context = emptyContext(ctx);

      assertThat(holds(ctx, call(context, "sum", ints(ctx, 1, 2, 3)).eq(IntValue.of(ctx, 6))))
          .isTrue();
      assertThat(
              holds(
                  ctx,
                  call(context, "sum", ints(ctx, 1, 2), IntValue.of(ctx, 10))
                      .eq(IntValue.of(ctx, 13))))
          .isTrue();
    }
  }
}
