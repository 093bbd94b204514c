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
import com.microsoft.z3.SeqSort;
import com.microsoft.z3.Sort;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import tools.aqua.prover.SortMismatchException;
import tools.aqua.prover.UnsupportedConstructException;
import tools.aqua.prover.context.ExecutionContext;

/**
 * A homogeneous sequence of symbolic length, backed by the solver's sequence theory. The concrete
 * variants differ only in mutability.
 */
public abstract class SequenceValue extends Value {

  final Expr<SeqSort<Sort>> expr;

  SequenceValue(final Context z3, final Expr<SeqSort<Sort>> expr) {
    super(z3);
    final Sort sort = expr.getSort();
    if (!(sort instanceof SeqSort) || sort.equals(z3.mkStringSort())) {
      throw new IllegalArgumentException("not a sequence of values: " + sort);
    }
    this.expr = expr;
  }

  @SuppressWarnings("unchecked")
  static Expr<SeqSort<Sort>> cast(final Expr<?> expr) {
    return (Expr<SeqSort<Sort>>) expr;
  }

  /**
   * Build a sequence from its elements.
   *
   * @param z3 the solver context.
   * @param elementSort the element sort, used if there are no elements.
   * @param elements the elements, all of the element sort.
   * @return the sequence expression.
   */
  static Expr<SeqSort<Sort>> sequence(
      final Context z3, final Sort elementSort, final List<? extends Value> elements) {
    Expr<SeqSort<Sort>> result = cast(z3.mkEmptySeq(z3.mkSeqSort(elementSort)));
    for (final Value element : elements) {
      final Value coerced =
          Values.coerce(element, elementSort)
              .orElseThrow(
                  () ->
                      new SortMismatchException(
                          "sequence element", elementSort.toString(), element.describe()));
      result = z3.mkConcat(result, z3.mkUnit(Values.cast(coerced.unwrap())));
    }
    return result;
  }

  /**
   * Re-tag a sequence expression with this value's variant.
   *
   * @param payload the sequence.
   * @return the new value.
   */
  abstract SequenceValue withPayload(Expr<SeqSort<Sort>> payload);

  @Override
  Value rebuild(final Expr<?> expr) {
    return withPayload(cast(expr));
  }

  @Override
  public Expr<SeqSort<Sort>> unwrap() {
    return expr;
  }

  /**
   * Get the sort of the elements.
   *
   * @return the element sort.
   */
  public Sort getElementSort() {
    return z3.mkNth(expr, z3.mkInt(0)).getSort();
  }

  private Value element(final Expr<SeqSort<Sort>> sequence, final Expr<IntSort> index) {
    return Values.wrap(z3, z3.mkNth(sequence, index));
  }

  @Override
  public String describe() {
    return getKind().getTypeName() + "[" + getElementSort() + "]";
  }

  @Override
  public BoolValue asBool() {
    return new BoolValue(z3, z3.mkNot(z3.mkEq(z3.mkLength(expr), z3.mkInt(0))));
  }

  @Override
  public IntValue length() {
    return new IntValue(z3, z3.mkLength(expr));
  }

  Expr<SeqSort<Sort>> sameSequence(final String operation, final Value other) {
    if (other.getKind() != getKind() || !other.getSort().equals(getSort())) {
      throw mismatch(operation, other);
    }
    return ((SequenceValue) other).expr;
  }

  @Override
  public Value add(final Value other) {
    return withPayload(z3.mkConcat(expr, sameSequence("+", other)));
  }

  @Override
  public Value multiply(final Value other) {
    final int count = Sequences.repetitions(this, other);
    Expr<SeqSort<Sort>> result = cast(z3.mkEmptySeq(getSort()));
    for (int i = 0; i < count; i++) {
      result = z3.mkConcat(result, expr);
    }
    return withPayload(result);
  }

  /**
   * Build the lexicographic order: some common prefix is followed either by the end of this
   * sequence while the other continues, or by a smaller element.
   */
  private BoolExpr lessThan(final Expr<SeqSort<Sort>> left, final Expr<SeqSort<Sort>> right) {
    final Expr<IntSort> position = z3.mkFreshConst("i", z3.mkIntSort());
    final Expr<IntSort> leftLength = z3.mkLength(left);
    final Expr<IntSort> rightLength = z3.mkLength(right);
    final BoolExpr inBounds =
        z3.mkAnd(
            z3.mkLe(z3.mkInt(0), position),
            z3.mkLe(position, leftLength),
            z3.mkLe(position, rightLength));
    final BoolExpr commonPrefix =
        z3.mkEq(
            z3.mkExtract(left, z3.mkInt(0), position),
            z3.mkExtract(right, z3.mkInt(0), position));
    final BoolExpr leftEnds =
        z3.mkAnd(z3.mkEq(position, leftLength), z3.mkLt(position, rightLength));
    final BoolExpr smallerElement =
        z3.mkAnd(
            z3.mkLt(position, leftLength),
            z3.mkLt(position, rightLength),
            element(left, position).lt(element(right, position)).unwrap());
    return z3.mkExists(
        new Expr<?>[] {position},
        z3.mkAnd(inBounds, commonPrefix, z3.mkOr(leftEnds, smallerElement)),
        1,
        null,
        null,
        null,
        null);
  }

  @Override
  public BoolValue lt(final Value other) {
    return new BoolValue(z3, lessThan(expr, sameSequence("<", other)));
  }

  @Override
  public BoolValue le(final Value other) {
    final Expr<SeqSort<Sort>> right = sameSequence("<=", other);
    return new BoolValue(z3, z3.mkOr(lessThan(expr, right), z3.mkEq(expr, right)));
  }

  @Override
  public BoolValue gt(final Value other) {
    return new BoolValue(z3, lessThan(sameSequence(">", other), expr));
  }

  @Override
  public BoolValue ge(final Value other) {
    final Expr<SeqSort<Sort>> left = sameSequence(">=", other);
    return new BoolValue(z3, z3.mkOr(lessThan(left, expr), z3.mkEq(left, expr)));
  }

  @Override
  public BoolValue contains(final Value item) {
    final Optional<Value> coerced = Values.coerce(item, getElementSort());
    if (coerced.isEmpty()) {
      return BoolValue.of(z3, false);
    }
    return new BoolValue(
        z3, z3.mkContains(expr, z3.mkUnit(Values.cast(coerced.get().unwrap()))));
  }

  @Override
  public Value getItem(final ExecutionContext ctx, final Value index) {
    final Expr<IntSort> resolved =
        Sequences.elementIndex(ctx, Sequences.index(this, "subscript", index), z3.mkLength(expr));
    return element(expr, resolved);
  }

  @Override
  public Value element(final IntValue index) {
    return element(expr, index.unwrap());
  }

  @Override
  public Value getSlice(
      final ExecutionContext ctx, final Optional<Value> lower, final Optional<Value> upper) {
    final Expr<IntSort> length = z3.mkLength(expr);
    final Expr<IntSort> start = Sequences.sliceBound(this, lower, z3.mkInt(0), length);
    final Expr<IntSort> stop = Sequences.sliceBound(this, upper, length, length);
    return withPayload(z3.mkExtract(expr, start, Sequences.sliceLength(z3, start, stop)));
  }

  @Override
  public List<Value> elements(final int limit) {
    final int length = Sequences.constantLength(this, z3.mkLength(expr), limit);
    final List<Value> elements = new ArrayList<>(length);
    for (int i = 0; i < length; i++) {
      elements.add(element(expr, z3.mkInt(i)));
    }
    return elements;
  }

  /**
   * Append one element.
   *
   * @param element the element, coerced to the element sort.
   * @return the extended sequence.
   */
  SequenceValue append(final Value element) {
    final Value coerced =
        Values.coerce(element, getElementSort()).orElseThrow(() -> mismatch("append", element));
    return withPayload(z3.mkConcat(expr, z3.mkUnit(Values.cast(coerced.unwrap()))));
  }

  /**
   * Append all elements of a sequence of the same sort.
   *
   * @param other the sequence.
   * @return the extended sequence.
   */
  SequenceValue extend(final Value other) {
    if (!(other instanceof SequenceValue) || !other.getSort().equals(getSort())) {
      throw mismatch("extend", other);
    }
    return withPayload(z3.mkConcat(expr, ((SequenceValue) other).expr));
  }

  /**
   * Reject a method this variant does not support.
   *
   * @param name the method name.
   * @return the exception to throw.
   */
  UnsupportedConstructException noMethod(final String name) {
    return new UnsupportedConstructException("method", getKind().getTypeName() + "." + name);
  }
}
