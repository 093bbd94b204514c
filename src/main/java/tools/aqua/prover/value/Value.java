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

import static java.util.Objects.requireNonNull;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Sort;
import java.util.List;
import java.util.Optional;
import tools.aqua.prover.SortMismatchException;
import tools.aqua.prover.UnsupportedConstructException;
import tools.aqua.prover.context.ExecutionContext;

/**
 * A symbolic value of the subject language: a solver expression tagged with the subject-language
 * type it represents. Values are immutable; every operation builds a new value.
 *
 * <p>The operations mirror the subject language's operator protocol. The defaults reject the
 * operation with a {@link SortMismatchException} or {@link UnsupportedConstructException}; each
 * variant overrides what its type supports. Operations that may fail at run time of the subject
 * language take the {@link ExecutionContext} to record the failure as an exception event.
 *
 * <p>Values are created by the variant constructors or by {@link Values#wrap(Context, Expr)},
 * which picks the variant from the expression's sort.
 */
public abstract class Value {

  /** The solver context the payload belongs to. */
  final Context z3;

  Value(final Context z3) {
    this.z3 = requireNonNull(z3);
  }

  /**
   * Get the variant tag.
   *
   * @return the kind.
   */
  public abstract Kind getKind();

  /**
   * Strip the tag and return the bare solver expression.
   *
   * @return the payload.
   */
  public abstract Expr<?> unwrap();

  /**
   * Get the solver sort of the payload.
   *
   * @return the sort.
   */
  public Sort getSort() {
    return unwrap().getSort();
  }

  public Context getContext() {
    return z3;
  }

  /**
   * Re-tag an expression of this value's sort with this value's variant.
   *
   * @param expr the expression, must have this value's sort.
   * @return the new value.
   */
  abstract Value rebuild(Expr<?> expr);

  /**
   * Build the value that is {@code this} if {@code condition} holds and {@code orElse} otherwise.
   * Both values must be of the same variant and sort.
   *
   * @param condition the condition.
   * @param orElse the value if the condition does not hold.
   * @return the merged value.
   */
  public Value ifThenElse(final BoolExpr condition, final Value orElse) {
    if (getKind() != orElse.getKind() || !getSort().equals(orElse.getSort())) {
      throw new SortMismatchException("conditional merge", describe(), orElse.describe());
    }
    return rebuild(z3.mkITE(condition, Values.cast(unwrap()), Values.cast(orElse.unwrap())));
  }

  /**
   * Get the truthiness of this value.
   *
   * @return the boolean value of {@code bool(this)}.
   */
  public abstract BoolValue asBool();

  public Value add(final Value other) {
    throw mismatch("+", other);
  }

  public Value subtract(final Value other) {
    throw mismatch("-", other);
  }

  public Value multiply(final Value other) {
    throw mismatch("*", other);
  }

  public Value trueDivide(final ExecutionContext ctx, final Value other) {
    throw mismatch("/", other);
  }

  public Value floorDivide(final ExecutionContext ctx, final Value other) {
    throw mismatch("//", other);
  }

  public Value modulo(final ExecutionContext ctx, final Value other) {
    throw mismatch("%", other);
  }

  public Value power(final Value other) {
    throw mismatch("**", other);
  }

  public Value bitOr(final Value other) {
    throw mismatch("|", other);
  }

  public Value bitAnd(final Value other) {
    throw mismatch("&", other);
  }

  public Value negate() {
    throw unsupported("unary -");
  }

  public Value positive() {
    throw unsupported("unary +");
  }

  public Value invert() {
    throw unsupported("unary ~");
  }

  /**
   * Build {@code this == other}. Operands of different variants are a sort mismatch, except for the
   * numeric promotions of the subject language.
   *
   * @param other the right operand.
   * @return the equality.
   */
  public BoolValue eq(final Value other) {
    if (getKind() != other.getKind() || !getSort().equals(other.getSort())) {
      throw mismatch("==", other);
    }
    return new BoolValue(z3, z3.mkEq(Values.cast(unwrap()), Values.cast(other.unwrap())));
  }

  public BoolValue ne(final Value other) {
    return eq(other).not();
  }

  public BoolValue lt(final Value other) {
    throw mismatch("<", other);
  }

  public BoolValue le(final Value other) {
    throw mismatch("<=", other);
  }

  public BoolValue gt(final Value other) {
    return other.lt(this);
  }

  public BoolValue ge(final Value other) {
    return other.le(this);
  }

  /**
   * Build {@code item in this}.
   *
   * @param item the searched item.
   * @return the membership test.
   */
  public BoolValue contains(final Value item) {
    throw mismatch("in", item);
  }

  /**
   * Build {@code len(this)}.
   *
   * @return the length.
   */
  public IntValue length() {
    throw unsupported("len");
  }

  /**
   * Build {@code this[index]}.
   *
   * @param ctx the context recording lookup failures.
   * @param index the index or key.
   * @return the element.
   */
  public Value getItem(final ExecutionContext ctx, final Value index) {
    throw unsupported("subscript");
  }

  /**
   * Select an element by an index the caller has already constrained to lie in range.
   *
   * @param index the non-negative index.
   * @return the element.
   */
  public Value element(final IntValue index) {
    throw unsupported("element access");
  }

  /**
   * Build {@code this[lower:upper]}.
   *
   * @param ctx the context.
   * @param lower the lower bound, if given.
   * @param upper the upper bound, if given.
   * @return the slice.
   */
  public Value getSlice(
      final ExecutionContext ctx, final Optional<Value> lower, final Optional<Value> upper) {
    throw unsupported("slice");
  }

  /**
   * Call a method on this value.
   *
   * @param ctx the context recording failures.
   * @param name the method name.
   * @param arguments the evaluated arguments.
   * @return the result, {@code null} if the method returns nothing.
   */
  public Value callMethod(
      final ExecutionContext ctx, final String name, final Arguments arguments) {
    throw new UnsupportedConstructException("method", getKind().getTypeName() + "." + name);
  }

  /**
   * Check whether a method updates the receiver in place. The evaluator rebinds the receiver to
   * the result of such a method.
   *
   * @param name the method name.
   * @return {@code true} if the method mutates the receiver.
   */
  public boolean isMutator(final String name) {
    return false;
  }

  /**
   * Call this value.
   *
   * @param ctx the context.
   * @param arguments the evaluated arguments.
   * @return the result.
   */
  public Value call(final ExecutionContext ctx, final Arguments arguments) {
    throw unsupported("call");
  }

  /**
   * Get the elements of an iterable whose length is a known constant.
   *
   * @param limit the maximum number of elements to produce.
   * @return the elements.
   * @throws UnsupportedConstructException if the length is symbolic or above the limit.
   */
  public List<Value> elements(final int limit) {
    throw unsupported("iteration");
  }

  /**
   * Describe this value's type for diagnostics.
   *
   * @return the type name and sort.
   */
  public String describe() {
    return getKind().getTypeName();
  }

  SortMismatchException mismatch(final String operation, final Value other) {
    return new SortMismatchException(operation, describe(), other.describe());
  }

  UnsupportedConstructException unsupported(final String operation) {
    return new UnsupportedConstructException(operation + " on " + getKind().getTypeName());
  }

  @Override
  public String toString() {
    return getKind().getTypeName() + "(" + unwrap() + ")";
  }
}
