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

import com.microsoft.z3.ArraySort;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.CharSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FPSort;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.IntSort;
import com.microsoft.z3.ReSort;
import com.microsoft.z3.SeqSort;
import com.microsoft.z3.Sort;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import tools.aqua.prover.UnsupportedConstructException;
import tools.aqua.prover.regex.CompiledPattern;

/** Construction and combination of {@link Value}s. */
public final class Values {

  private Values() {}

  /**
   * Wrap a solver expression into the variant matching its sort. Sequences other than strings
   * become lists; use the variant constructors for variable-length tuples.
   *
   * @param z3 the solver context.
   * @param expr the expression.
   * @return the tagged value.
   * @throws UnsupportedConstructException if no variant has the expression's sort.
   */
  @SuppressWarnings("unchecked")
  public static Value wrap(final Context z3, final Expr<?> expr) {
    final Sort sort = expr.getSort();
    if (sort instanceof BoolSort) {
      return new BoolValue(z3, (Expr<BoolSort>) expr);
    }
    if (sort instanceof IntSort) {
      return new IntValue(z3, (Expr<IntSort>) expr);
    }
    if (sort instanceof FPSort) {
      return new FloatValue(z3, (Expr<FPSort>) expr);
    }
    if (sort instanceof SeqSort) {
      if (sort.equals(z3.mkStringSort())) {
        return new StrValue(z3, (Expr<SeqSort<CharSort>>) expr);
      }
      return new ListValue(z3, (Expr<SeqSort<Sort>>) expr);
    }
    if (sort instanceof ArraySort) {
      final Sort range = ((ArraySort<?, ?>) sort).getRange();
      if (range instanceof BoolSort) {
        return new SetValue(z3, expr);
      }
      if (DictEntries.isEntrySort(range)) {
        return new DictValue(z3, expr);
      }
    }
    if (sort instanceof ReSort) {
      return new PatternValue(z3, new CompiledPattern(expr, false, false));
    }
    throw new UnsupportedConstructException("unsupported sort", sort.toString());
  }

  /**
   * Wrap a solver expression, keeping the variant of a template value. This distinguishes lists
   * from variable-length tuples.
   *
   * @param template the value whose variant to use.
   * @param expr the expression, must have the template's sort.
   * @return the tagged value.
   */
  public static Value wrapLike(final Value template, final Expr<?> expr) {
    return template.rebuild(expr);
  }

  /**
   * Merge two values of the same variant: the result is {@code then} if {@code condition} holds
   * and {@code orElse} otherwise.
   *
   * @param condition the condition.
   * @param then the value if the condition holds.
   * @param orElse the value otherwise.
   * @return the merged value.
   */
  public static Value ifExpr(final BoolExpr condition, final Value then, final Value orElse) {
    return then.ifThenElse(condition, orElse);
  }

  /**
   * Build the equality of two values, or {@code false} for values that can never be equal in the
   * subject language because their types differ. Used for membership tests and counting.
   *
   * @param left the left value.
   * @param right the right value.
   * @return the equality.
   */
  public static BoolValue equalOrFalse(final Value left, final Value right) {
    final Kind leftKind = left.getKind();
    final Kind rightKind = right.getKind();
    if (leftKind.isNumeric() && rightKind.isNumeric()) {
      return left.eq(right);
    }
    if (leftKind == Kind.FIXED_TUPLE && rightKind == Kind.FIXED_TUPLE) {
      return left.eq(right);
    }
    if (leftKind != rightKind
        || leftKind == Kind.FUNCTION
        || leftKind == Kind.FIXED_TUPLE
        || !left.getSort().equals(right.getSort())) {
      return BoolValue.of(left.z3, false);
    }
    return left.eq(right);
  }

  /**
   * Convert a value to a given sort if the subject language would consider it equal to values of
   * that sort: bools and ints are promoted along the numeric tower.
   *
   * @param value the value.
   * @param sort the target sort.
   * @return the converted value, or empty if the value can never be of that sort.
   */
  public static Optional<Value> coerce(final Value value, final Sort sort) {
    if (value.getKind() != Kind.FIXED_TUPLE
        && value.getKind() != Kind.FUNCTION
        && value.getSort().equals(sort)) {
      return Optional.of(value);
    }
    if (sort instanceof IntSort && value.getKind() == Kind.BOOL) {
      return Optional.of(((BoolValue) value).toInt());
    }
    if (sort instanceof FPSort && value.getKind().isNumeric()) {
      return Optional.of(toFloat(value));
    }
    return Optional.empty();
  }

  /**
   * Bring numeric values of mixed variants to the widest variant among them, so they can be merged
   * or stored in one collection. Other lists are returned unchanged.
   *
   * @param values the values.
   * @return the promoted values.
   */
  public static List<Value> promote(final List<Value> values) {
    Kind widest = Kind.BOOL;
    for (final Value value : values) {
      if (!value.getKind().isNumeric()) {
        return values;
      }
      if (value.getKind().ordinal() > widest.ordinal()) {
        widest = value.getKind();
      }
    }
    final List<Value> promoted = new ArrayList<>(values.size());
    for (final Value value : values) {
      if (widest == Kind.FLOAT) {
        promoted.add(toFloat(value));
      } else if (widest == Kind.INT && value.getKind() == Kind.BOOL) {
        promoted.add(((BoolValue) value).toInt());
      } else {
        promoted.add(value);
      }
    }
    return promoted;
  }

  /**
   * Get the integer payload of a bool or int value.
   *
   * @param value the value.
   * @return the integer expression, or empty for other variants.
   */
  public static Optional<Expr<IntSort>> integer(final Value value) {
    if (value.getKind() == Kind.INT) {
      return Optional.of(((IntValue) value).unwrap());
    }
    if (value.getKind() == Kind.BOOL) {
      return Optional.of(((BoolValue) value).toInt().unwrap());
    }
    return Optional.empty();
  }

  /**
   * Promote a numeric value to float.
   *
   * @param value a bool, int or float value.
   * @return the float value.
   */
  public static FloatValue toFloat(final Value value) {
    switch (value.getKind()) {
      case FLOAT:
        return (FloatValue) value;
      case INT:
        return ((IntValue) value).toFloat();
      case BOOL:
        return ((BoolValue) value).toInt().toFloat();
      default:
        throw new IllegalArgumentException("not numeric: " + value.describe());
    }
  }

  /**
   * Get the value of an integer expression that simplifies to a constant.
   *
   * @param value the value.
   * @return the constant, or empty if the value is symbolic or not an integer.
   */
  public static Optional<BigInteger> constantInt(final Value value) {
    return integer(value).flatMap(Values::constantInt);
  }

  static Optional<BigInteger> constantInt(final Expr<IntSort> expr) {
    final Expr<IntSort> simplified = expr.simplify();
    if (simplified.isIntNum()) {
      return Optional.of(((IntNum) simplified).getBigInteger());
    }
    return Optional.empty();
  }

  /**
   * Get the value of a string expression that simplifies to a constant.
   *
   * @param value the value.
   * @return the constant, or empty if the value is symbolic or not a string.
   */
  public static Optional<String> constantString(final Value value) {
    if (value.getKind() != Kind.STR) {
      return Optional.empty();
    }
    final Expr<?> simplified = value.unwrap().simplify();
    if (simplified.isString()) {
      return Optional.of(StrValue.decode(simplified.getString()));
    }
    return Optional.empty();
  }

  @SuppressWarnings("unchecked")
  static Expr<Sort> cast(final Expr<?> expr) {
    return (Expr<Sort>) expr;
  }
}
