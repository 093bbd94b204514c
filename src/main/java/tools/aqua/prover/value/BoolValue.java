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

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import tools.aqua.prover.context.ExecutionContext;

/** A {@code bool}. In arithmetic and ordering it behaves as the int 0 or 1. */
public final class BoolValue extends Value {

  private final BoolExpr expr;

  /**
   * Create a new bool value.
   *
   * @param z3 the solver context.
   * @param expr the payload.
   */
  public BoolValue(final Context z3, final Expr<BoolSort> expr) {
    super(z3);
    this.expr = (BoolExpr) expr;
  }

  /**
   * Create a constant bool value.
   *
   * @param z3 the solver context.
   * @param value the constant.
   * @return the value.
   */
  public static BoolValue of(final Context z3, final boolean value) {
    return new BoolValue(z3, z3.mkBool(value));
  }

  @Override
  public Kind getKind() {
    return Kind.BOOL;
  }

  @Override
  public BoolExpr unwrap() {
    return expr;
  }

  @Override
  Value rebuild(final Expr<?> expr) {
    return Values.wrap(z3, expr);
  }

  @Override
  public BoolValue asBool() {
    return this;
  }

  public BoolValue not() {
    return new BoolValue(z3, z3.mkNot(expr));
  }

  public BoolValue and(final BoolValue other) {
    return new BoolValue(z3, z3.mkAnd(expr, other.expr));
  }

  public BoolValue or(final BoolValue other) {
    return new BoolValue(z3, z3.mkOr(expr, other.expr));
  }

  /**
   * Convert to the int 0 or 1.
   *
   * @return the int value.
   */
  public IntValue toInt() {
    return new IntValue(z3, z3.mkITE(expr, z3.mkInt(1), z3.mkInt(0)));
  }

  @Override
  public Value add(final Value other) {
    return toInt().add(other);
  }

  @Override
  public Value subtract(final Value other) {
    return toInt().subtract(other);
  }

  @Override
  public Value multiply(final Value other) {
    return toInt().multiply(other);
  }

  @Override
  public Value trueDivide(final ExecutionContext ctx, final Value other) {
    return toInt().trueDivide(ctx, other);
  }

  @Override
  public Value floorDivide(final ExecutionContext ctx, final Value other) {
    return toInt().floorDivide(ctx, other);
  }

  @Override
  public Value modulo(final ExecutionContext ctx, final Value other) {
    return toInt().modulo(ctx, other);
  }

  @Override
  public Value power(final Value other) {
    return toInt().power(other);
  }

  @Override
  public Value bitOr(final Value other) {
    if (other.getKind() == Kind.BOOL) {
      return or((BoolValue) other);
    }
    return super.bitOr(other);
  }

  @Override
  public Value bitAnd(final Value other) {
    if (other.getKind() == Kind.BOOL) {
      return and((BoolValue) other);
    }
    return super.bitAnd(other);
  }

  @Override
  public Value negate() {
    return toInt().negate();
  }

  @Override
  public Value positive() {
    return toInt();
  }

  @Override
  public Value invert() {
    return toInt().invert();
  }

  @Override
  public BoolValue eq(final Value other) {
    if (other.getKind() == Kind.BOOL) {
      return new BoolValue(z3, z3.mkEq(expr, ((BoolValue) other).expr));
    }
    if (other.getKind().isNumeric()) {
      return toInt().eq(other);
    }
    throw mismatch("==", other);
  }

  @Override
  public BoolValue lt(final Value other) {
    checkNumeric("<", other);
    return toInt().lt(other);
  }

  @Override
  public BoolValue le(final Value other) {
    checkNumeric("<=", other);
    return toInt().le(other);
  }

  @Override
  public BoolValue gt(final Value other) {
    checkNumeric(">", other);
    return toInt().gt(other);
  }

  @Override
  public BoolValue ge(final Value other) {
    checkNumeric(">=", other);
    return toInt().ge(other);
  }

  private void checkNumeric(final String operation, final Value other) {
    if (!other.getKind().isNumeric()) {
      throw mismatch(operation, other);
    }
  }
}
