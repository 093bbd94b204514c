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
import java.util.Optional;
import tools.aqua.prover.UnsupportedConstructException;
import tools.aqua.prover.context.ExecutionContext;

/** Index arithmetic shared by the sequence variants. */
final class Sequences {

  /** Largest repetition count {@code seq * n} unrolls. */
  private static final int MAX_REPETITIONS = 1024;

  private Sequences() {}

  /**
   * Get the integer payload of an index operand.
   *
   * @param owner the indexed value.
   * @param operation the operation, for diagnostics.
   * @param index the index.
   * @return the index expression.
   */
  static Expr<IntSort> index(final Value owner, final String operation, final Value index) {
    return Values.integer(index).orElseThrow(() -> owner.mismatch(operation, index));
  }

  /**
   * Resolve an element index against a length: negative indices count from the end. Records an
   * {@code IndexError} if the resolved index is out of range.
   *
   * @param ctx the context.
   * @param index the index.
   * @param length the sequence length.
   * @return the resolved index.
   */
  static Expr<IntSort> elementIndex(
      final ExecutionContext ctx, final Expr<IntSort> index, final Expr<IntSort> length) {
    final Context z3 = ctx.getZ3();
    final Expr<IntSort> resolved =
        z3.mkITE(z3.mkLt(index, z3.mkInt(0)), z3.mkAdd(index, length), index);
    final BoolExpr outOfRange = z3.mkOr(z3.mkLt(resolved, z3.mkInt(0)), z3.mkGe(resolved, length));
    ctx.raise(outOfRange, "IndexError");
    return resolved;
  }

  /**
   * Resolve a slice bound against a length: negative bounds count from the end, and the result is
   * clamped to {@code [0, length]}.
   *
   * @param owner the sliced value.
   * @param bound the bound, if given.
   * @param fallback the bound to use if none is given.
   * @param length the sequence length.
   * @return the resolved bound.
   */
  static Expr<IntSort> sliceBound(
      final Value owner,
      final Optional<Value> bound,
      final Expr<IntSort> fallback,
      final Expr<IntSort> length) {
    if (bound.isEmpty()) {
      return fallback;
    }
    final Context z3 = owner.z3;
    final Expr<IntSort> raw = index(owner, "slice", bound.get());
    final Expr<IntSort> shifted = z3.mkAdd(raw, length);
    final Expr<IntSort> low =
        z3.mkITE(z3.mkLt(shifted, z3.mkInt(0)), z3.mkInt(0), shifted);
    return z3.mkITE(
        z3.mkLt(raw, z3.mkInt(0)), low, z3.mkITE(z3.mkGt(raw, length), length, raw));
  }

  /**
   * Get the length of a slice between two resolved bounds.
   *
   * @param z3 the solver context.
   * @param start the resolved start.
   * @param stop the resolved stop.
   * @return {@code max(stop - start, 0)}.
   */
  static Expr<IntSort> sliceLength(
      final Context z3, final Expr<IntSort> start, final Expr<IntSort> stop) {
    return z3.mkITE(z3.mkGt(stop, start), z3.mkSub(stop, start), z3.mkInt(0));
  }

  /**
   * Get the constant repetition count of {@code seq * n}. Negative counts repeat zero times.
   *
   * @param owner the repeated value.
   * @param count the count operand.
   * @return the count.
   */
  static int repetitions(final Value owner, final Value count) {
    if (!count.getKind().isNumeric() || count.getKind() == Kind.FLOAT) {
      throw owner.mismatch("*", count);
    }
    final BigInteger constant =
        Values.constantInt(count)
            .orElseThrow(() -> new UnsupportedConstructException("symbolic repetition count"));
    if (constant.compareTo(BigInteger.valueOf(MAX_REPETITIONS)) > 0) {
      throw new UnsupportedConstructException("repetition count too large", constant.toString());
    }
    return Math.max(constant.intValue(), 0);
  }

  /**
   * Get the constant length of a sequence.
   *
   * @param owner the sequence.
   * @param length its length expression.
   * @param limit the maximum accepted length.
   * @return the length.
   */
  static int constantLength(final Value owner, final Expr<IntSort> length, final int limit) {
    final BigInteger constant =
        Values.constantInt(length)
            .orElseThrow(
                () ->
                    new UnsupportedConstructException(
                        "iteration over symbolic length", owner.describe()));
    if (constant.compareTo(BigInteger.valueOf(limit)) > 0) {
      throw new UnsupportedConstructException(
          "iteration over more than " + limit + " elements", owner.describe());
    }
    return constant.intValue();
  }
}
