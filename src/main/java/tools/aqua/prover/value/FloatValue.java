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

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FPRMExpr;
import com.microsoft.z3.FPSort;
import com.microsoft.z3.IntSort;
import tools.aqua.prover.context.ExecutionContext;

/** A {@code float}: an IEEE-754 double with round-to-nearest-even arithmetic. */
public final class FloatValue extends Value {

  private final Expr<FPSort> expr;

  /**
   * Create a new float value.
   *
   * @param z3 the solver context.
   * @param expr the payload.
   */
  public FloatValue(final Context z3, final Expr<FPSort> expr) {
    super(z3);
    this.expr = expr;
  }

  /**
   * Create a constant float value.
   *
   * @param z3 the solver context.
   * @param value the constant.
   * @return the value.
   */
  public static FloatValue of(final Context z3, final double value) {
    return new FloatValue(z3, z3.mkFP(value, sort(z3)));
  }

  /**
   * Get the sort of floats.
   *
   * @param z3 the solver context.
   * @return the double precision sort.
   */
  public static FPSort sort(final Context z3) {
    return z3.mkFPSort64();
  }

  private FPRMExpr rounding() {
    return z3.mkFPRoundNearestTiesToEven();
  }

  @Override
  public Kind getKind() {
    return Kind.FLOAT;
  }

  @Override
  public Expr<FPSort> unwrap() {
    return expr;
  }

  @Override
  Value rebuild(final Expr<?> expr) {
    return Values.wrap(z3, expr);
  }

  @Override
  public BoolValue asBool() {
    return new BoolValue(z3, z3.mkNot(z3.mkFPIsZero(expr)));
  }

  public BoolValue isNaN() {
    return new BoolValue(z3, z3.mkFPIsNaN(expr));
  }

  public BoolValue isInfinite() {
    return new BoolValue(z3, z3.mkFPIsInfinite(expr));
  }

  public BoolValue isFinite() {
    return new BoolValue(z3, z3.mkNot(z3.mkOr(z3.mkFPIsNaN(expr), z3.mkFPIsInfinite(expr))));
  }

  public FloatValue abs() {
    return new FloatValue(z3, z3.mkFPAbs(expr));
  }

  /**
   * Truncate towards zero. The result is meaningless for NaN and infinities.
   *
   * @return the int value.
   */
  public IntValue toInt() {
    final Expr<FPSort> truncated = z3.mkFPRoundToIntegral(z3.mkFPRoundTowardZero(), expr);
    final Expr<IntSort> integer = z3.mkReal2Int(z3.mkFPToReal(truncated));
    return new IntValue(z3, integer);
  }

  private Expr<FPSort> floating(final String operation, final Value other) {
    if (!other.getKind().isNumeric()) {
      throw mismatch(operation, other);
    }
    return Values.toFloat(other).expr;
  }

  @Override
  public Value add(final Value other) {
    return new FloatValue(z3, z3.mkFPAdd(rounding(), expr, floating("+", other)));
  }

  @Override
  public Value subtract(final Value other) {
    return new FloatValue(z3, z3.mkFPSub(rounding(), expr, floating("-", other)));
  }

  @Override
  public Value multiply(final Value other) {
    return new FloatValue(z3, z3.mkFPMul(rounding(), expr, floating("*", other)));
  }

  FloatValue divide(final FloatValue other) {
    return new FloatValue(z3, z3.mkFPDiv(rounding(), expr, other.expr));
  }

  private FloatValue floor(final FloatValue other) {
    return new FloatValue(
        z3, z3.mkFPRoundToIntegral(z3.mkFPRoundTowardNegative(), divide(other).expr));
  }

  @Override
  public Value trueDivide(final ExecutionContext ctx, final Value other) {
    final FloatValue divisor = new FloatValue(z3, floating("/", other));
    ctx.raise(z3.mkFPIsZero(divisor.expr), "ZeroDivisionError");
    return divide(divisor);
  }

  @Override
  public Value floorDivide(final ExecutionContext ctx, final Value other) {
    final FloatValue divisor = new FloatValue(z3, floating("//", other));
    ctx.raise(z3.mkFPIsZero(divisor.expr), "ZeroDivisionError");
    return floor(divisor);
  }

  @Override
  public Value modulo(final ExecutionContext ctx, final Value other) {
    final FloatValue divisor = new FloatValue(z3, floating("%", other));
    ctx.raise(z3.mkFPIsZero(divisor.expr), "ZeroDivisionError");
    return subtract(divisor.multiply(floor(divisor)));
  }

  @Override
  public Value power(final Value other) {
    final int exponent = IntValue.constantExponent(other);
    Value result = of(z3, 1.0);
    for (int i = 0; i < exponent; i++) {
      result = result.multiply(this);
    }
    return result;
  }

  @Override
  public Value negate() {
    return new FloatValue(z3, z3.mkFPNeg(expr));
  }

  @Override
  public Value positive() {
    return this;
  }

  @Override
  public BoolValue eq(final Value other) {
    return new BoolValue(z3, z3.mkFPEq(expr, floating("==", other)));
  }

  @Override
  public BoolValue lt(final Value other) {
    return new BoolValue(z3, z3.mkFPLt(expr, floating("<", other)));
  }

  @Override
  public BoolValue le(final Value other) {
    return new BoolValue(z3, z3.mkFPLEq(expr, floating("<=", other)));
  }

  @Override
  public BoolValue gt(final Value other) {
    return new BoolValue(z3, z3.mkFPGt(expr, floating(">", other)));
  }

  @Override
  public BoolValue ge(final Value other) {
    return new BoolValue(z3, z3.mkFPGEq(expr, floating(">=", other)));
  }
}
