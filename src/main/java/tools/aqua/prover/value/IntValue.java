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
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntSort;
import java.math.BigInteger;
import tools.aqua.prover.UnsupportedConstructException;
import tools.aqua.prover.context.ExecutionContext;

/**
 * An {@code int} of unbounded precision. Division and modulo follow the subject language's
 * flooring semantics; mixed int/float operations promote to float.
 */
public final class IntValue extends Value {

  /** Largest exponent {@code **} unrolls into multiplications. */
  private static final int MAX_EXPONENT = 64;

  private final Expr<IntSort> expr;

  /**
   * Create a new int value.
   *
   * @param z3 the solver context.
   * @param expr the payload.
   */
  public IntValue(final Context z3, final Expr<IntSort> expr) {
    super(z3);
    this.expr = expr;
  }

  /**
   * Create a constant int value.
   *
   * @param z3 the solver context.
   * @param value the constant.
   * @return the value.
   */
  public static IntValue of(final Context z3, final long value) {
    return new IntValue(z3, z3.mkInt(value));
  }

  /**
   * Create a constant int value.
   *
   * @param z3 the solver context.
   * @param value the constant.
   * @return the value.
   */
  public static IntValue of(final Context z3, final BigInteger value) {
    return new IntValue(z3, z3.mkInt(value.toString()));
  }

  @SuppressWarnings("unchecked")
  static Expr<IntSort> cast(final Expr<?> expr) {
    return (Expr<IntSort>) expr;
  }

  @Override
  public Kind getKind() {
    return Kind.INT;
  }

  @Override
  public Expr<IntSort> unwrap() {
    return expr;
  }

  @Override
  Value rebuild(final Expr<?> expr) {
    return Values.wrap(z3, expr);
  }

  @Override
  public BoolValue asBool() {
    return new BoolValue(z3, z3.mkNot(z3.mkEq(expr, z3.mkInt(0))));
  }

  /**
   * Convert to the nearest float.
   *
   * @return the float value.
   */
  public FloatValue toFloat() {
    return new FloatValue(
        z3,
        z3.mkFPToFP(z3.mkFPRoundNearestTiesToEven(), z3.mkInt2Real(expr), FloatValue.sort(z3)));
  }

  /**
   * Convert to the decimal string representation.
   *
   * @return the string value.
   */
  public StrValue toStr() {
    return new StrValue(
        z3,
        z3.mkITE(
            z3.mkLt(expr, z3.mkInt(0)),
            z3.mkConcat(StrValue.literal(z3, "-"), z3.intToString(z3.mkUnaryMinus(expr))),
            z3.intToString(expr)));
  }

  public IntValue abs() {
    return new IntValue(z3, z3.mkITE(z3.mkLt(expr, z3.mkInt(0)), z3.mkUnaryMinus(expr), expr));
  }

  private Expr<IntSort> integer(final String operation, final Value other) {
    return Values.integer(other).orElseThrow(() -> mismatch(operation, other));
  }

  @Override
  public Value add(final Value other) {
    if (other.getKind() == Kind.FLOAT) {
      return toFloat().add(other);
    }
    return new IntValue(z3, z3.mkAdd(expr, integer("+", other)));
  }

  @Override
  public Value subtract(final Value other) {
    if (other.getKind() == Kind.FLOAT) {
      return toFloat().subtract(other);
    }
    return new IntValue(z3, z3.mkSub(expr, integer("-", other)));
  }

  @Override
  public Value multiply(final Value other) {
    switch (other.getKind()) {
      case FLOAT:
        return toFloat().multiply(other);
      case STR:
      case LIST:
      case VAR_TUPLE:
      case FIXED_TUPLE:
        return other.multiply(this);
      default:
        return new IntValue(z3, z3.mkMul(expr, integer("*", other)));
    }
  }

  @Override
  public Value trueDivide(final ExecutionContext ctx, final Value other) {
    if (other.getKind() == Kind.FLOAT) {
      return toFloat().trueDivide(ctx, other);
    }
    final Expr<IntSort> divisor = integer("/", other);
    ctx.raise(z3.mkEq(divisor, z3.mkInt(0)), "ZeroDivisionError");
    return toFloat().divide(new IntValue(z3, divisor).toFloat());
  }

  @Override
  public Value floorDivide(final ExecutionContext ctx, final Value other) {
    if (other.getKind() == Kind.FLOAT) {
      return toFloat().floorDivide(ctx, other);
    }
    final Expr<IntSort> divisor = integer("//", other);
    ctx.raise(z3.mkEq(divisor, z3.mkInt(0)), "ZeroDivisionError");
    return new IntValue(z3, floorDiv(divisor));
  }

  @Override
  public Value modulo(final ExecutionContext ctx, final Value other) {
    if (other.getKind() == Kind.FLOAT) {
      return toFloat().modulo(ctx, other);
    }
    final Expr<IntSort> divisor = integer("%", other);
    ctx.raise(z3.mkEq(divisor, z3.mkInt(0)), "ZeroDivisionError");
    return new IntValue(z3, z3.mkSub(expr, z3.mkMul(divisor, floorDiv(divisor))));
  }

  /**
   * Build the flooring quotient. The solver's integer division is euclidean, which differs for
   * negative divisors with a non-zero remainder.
   */
  private Expr<IntSort> floorDiv(final Expr<IntSort> divisor) {
    final Expr<IntSort> quotient = z3.mkDiv(expr, divisor);
    final BoolExpr exact = z3.mkEq(z3.mkMod(expr, divisor), z3.mkInt(0));
    return z3.mkITE(
        z3.mkOr(z3.mkGe(divisor, z3.mkInt(0)), exact),
        quotient,
        z3.mkSub(quotient, z3.mkInt(1)));
  }

  @Override
  public Value power(final Value other) {
    if (other.getKind() == Kind.FLOAT) {
      return toFloat().power(other);
    }
    final int exponent = constantExponent(other);
    Expr<IntSort> result = z3.mkInt(1);
    for (int i = 0; i < exponent; i++) {
      result = z3.mkMul(result, expr);
    }
    return new IntValue(z3, result);
  }

  /**
   * Get a small non-negative constant exponent.
   *
   * @param exponent the exponent value.
   * @return the exponent.
   * @throws UnsupportedConstructException if the exponent is symbolic, negative or too large.
   */
  static int constantExponent(final Value exponent) {
    final BigInteger constant =
        Values.constantInt(exponent)
            .orElseThrow(() -> new UnsupportedConstructException("symbolic exponent"));
    if (constant.signum() < 0 || constant.compareTo(BigInteger.valueOf(MAX_EXPONENT)) > 0) {
      throw new UnsupportedConstructException("exponent out of range", constant.toString());
    }
    return constant.intValue();
  }

  @Override
  public Value negate() {
    return new IntValue(z3, z3.mkUnaryMinus(expr));
  }

  @Override
  public Value positive() {
    return this;
  }

  @Override
  public Value invert() {
    return new IntValue(z3, z3.mkSub(z3.mkUnaryMinus(expr), z3.mkInt(1)));
  }

  @Override
  public BoolValue eq(final Value other) {
    if (other.getKind() == Kind.FLOAT) {
      return toFloat().eq(other);
    }
    return new BoolValue(z3, z3.mkEq(expr, integer("==", other)));
  }

  @Override
  public BoolValue lt(final Value other) {
    if (other.getKind() == Kind.FLOAT) {
      return toFloat().lt(other);
    }
    return new BoolValue(z3, z3.mkLt(expr, integer("<", other)));
  }

  @Override
  public BoolValue le(final Value other) {
    if (other.getKind() == Kind.FLOAT) {
      return toFloat().le(other);
    }
    return new BoolValue(z3, z3.mkLe(expr, integer("<=", other)));
  }

  @Override
  public BoolValue gt(final Value other) {
    if (other.getKind() == Kind.FLOAT) {
      return toFloat().gt(other);
    }
    return new BoolValue(z3, z3.mkGt(expr, integer(">", other)));
  }

  @Override
  public BoolValue ge(final Value other) {
    if (other.getKind() == Kind.FLOAT) {
      return toFloat().ge(other);
    }
    return new BoolValue(z3, z3.mkGe(expr, integer(">=", other)));
  }
}
