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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static tools.aqua.prover.Solving.emptyContext;
import static tools.aqua.prover.Solving.isSatisfiable;
import static tools.aqua.prover.Solving.isValid;

import com.microsoft.z3.Context;
import java.util.List;
import org.junit.jupiter.api.Test;
import tools.aqua.prover.SortMismatchException;
import tools.aqua.prover.UnsupportedConstructException;
import tools.aqua.prover.context.ExceptionInfo;
import tools.aqua.prover.context.ExecutionContext;

/** Test integer arithmetic with the subject language's rounding rules. */
class IntValueTest {

  private static BoolValue equal(final Value left, final long right) {
    return left.eq(IntValue.of(left.getContext(), right));
  }

  /** Floor division and modulo round towards negative infinity. */
  @Test
  void testFloorDivisionAndModulo() {
    try (Context ctx = new Context()) {
      final ExecutionContext context = emptyContext(ctx);
      final IntValue minusSeven = IntValue.of(ctx, -7);
      final IntValue seven = IntValue.of(ctx, 7);
      final IntValue two = IntValue.of(ctx, 2);
      final IntValue minusTwo = IntValue.of(ctx, -2);

      assertThat(isValid(ctx, equal(minusSeven.floorDivide(context, two), -4).unwrap())).isTrue();
      assertThat(isValid(ctx, equal(minusSeven.modulo(context, two), 1).unwrap())).isTrue();
      assertThat(isValid(ctx, equal(seven.floorDivide(context, minusTwo), -4).unwrap())).isTrue();
      assertThat(isValid(ctx, equal(seven.modulo(context, minusTwo), -1).unwrap())).isTrue();
      final Value quotient = IntValue.of(ctx, -8).floorDivide(context, minusTwo);
      assertThat(isValid(ctx, equal(quotient, 4).unwrap())).isTrue();
    }
  }

  /** A symbolic divisor records a ZeroDivisionError guarded by the divisor being zero. */
  @Test
  void testDivisionByZeroIsRecorded() {
    try (Context ctx = new Context()) {
      final ExecutionContext context = emptyContext(ctx);
      final IntValue x = new IntValue(ctx, ctx.mkIntConst("x"));
      final IntValue y = new IntValue(ctx, ctx.mkIntConst("y"));

      x.floorDivide(context, y);

      final List<ExceptionInfo> exceptions = context.getExceptions().layer();
      assertThat(exceptions).hasSize(1);
      final ExceptionInfo exception = exceptions.get(0);
      assertThat(exception.getNames()).contains("ZeroDivisionError", "ArithmeticError");
      assertThat(
              isValid(
                  ctx, ctx.mkEq(exception.getCondition(), ctx.mkEq(y.unwrap(), ctx.mkInt(0)))))
          .isTrue();
    }
  }

  /** True division always produces a float. */
  @Test
  void testTrueDivisionIsFloat() {
    try (Context ctx = new Context()) {
      final Value half = IntValue.of(ctx, 1).trueDivide(emptyContext(ctx), IntValue.of(ctx, 2));
      assertThat(half.getKind()).isEqualTo(Kind.FLOAT);
      assertThat(isValid(ctx, half.eq(FloatValue.of(ctx, 0.5)).unwrap())).isTrue();
    }
  }

  /** Powers need a small constant exponent. */
  @Test
  void testPower() {
    try (Context ctx = new Context()) {
      final IntValue x = new IntValue(ctx, ctx.mkIntConst("x"));
      assertThat(isValid(ctx, equal(IntValue.of(ctx, 3).power(IntValue.of(ctx, 4)), 81).unwrap()))
          .isTrue();
      assertThatThrownBy(() -> IntValue.of(ctx, 3).power(x))
          .isInstanceOf(UnsupportedConstructException.class)
          .hasMessageContaining("symbolic exponent");
    }
  }

  /** Bools take part in arithmetic as 0 and 1; strings do not. */
  @Test
  void testMixedOperands() {
    try (Context ctx = new Context()) {
      final Value sum = IntValue.of(ctx, 41).add(BoolValue.of(ctx, true));
      assertThat(isValid(ctx, equal(sum, 42).unwrap())).isTrue();
      assertThatThrownBy(() -> IntValue.of(ctx, 1).add(StrValue.of(ctx, "a")))
          .isInstanceOf(SortMismatchException.class);
    }
  }

  /** Conversion to a string handles the sign. */
  @Test
  void testToStr() {
    try (Context ctx = new Context()) {
      assertThat(isValid(ctx, IntValue.of(ctx, -12).toStr().eq(StrValue.of(ctx, "-12")).unwrap()))
          .isTrue();
      final IntValue x = new IntValue(ctx, ctx.mkIntConst("x"));
      assertThat(isSatisfiable(ctx, x.toStr().eq(StrValue.of(ctx, "7")).unwrap())).isTrue();
    }
  }
}
