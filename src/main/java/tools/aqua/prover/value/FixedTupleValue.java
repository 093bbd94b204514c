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

import static java.util.Collections.unmodifiableList;
import static java.util.stream.Collectors.joining;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntSort;
import com.microsoft.z3.Sort;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import tools.aqua.prover.SortMismatchException;
import tools.aqua.prover.UnsupportedConstructException;
import tools.aqua.prover.context.ExecutionContext;

/**
 * A tuple of known length whose elements may have different types. It has no solver sort of its
 * own; all operations work element-wise.
 */
public final class FixedTupleValue extends Value {

  private final List<Value> elements;

  /**
   * Create a new tuple.
   *
   * @param z3 the solver context.
   * @param elements the elements.
   */
  public FixedTupleValue(final Context z3, final List<? extends Value> elements) {
    super(z3);
    this.elements = unmodifiableList(new ArrayList<>(elements));
  }

  public List<Value> getElements() {
    return elements;
  }

  @Override
  public Kind getKind() {
    return Kind.FIXED_TUPLE;
  }

  @Override
  public Expr<?> unwrap() {
    throw new UnsupportedConstructException("tuple as solver term", describe());
  }

  @Override
  public Sort getSort() {
    throw new UnsupportedConstructException("tuple as solver term", describe());
  }

  @Override
  Value rebuild(final Expr<?> expr) {
    throw new UnsupportedConstructException("tuple as solver term", describe());
  }

  @Override
  public Value ifThenElse(final BoolExpr condition, final Value orElse) {
    final List<Value> others = tuple("conditional merge", orElse);
    if (others.size() != elements.size()) {
      throw mismatch("conditional merge", orElse);
    }
    final List<Value> merged = new ArrayList<>(elements.size());
    for (int i = 0; i < elements.size(); i++) {
      merged.add(Values.ifExpr(condition, elements.get(i), others.get(i)));
    }
    return new FixedTupleValue(z3, merged);
  }

  @Override
  public String describe() {
    return elements.stream().map(Value::describe).collect(joining(", ", "tuple[", "]"));
  }

  private List<Value> tuple(final String operation, final Value other) {
    if (other.getKind() != Kind.FIXED_TUPLE) {
      throw mismatch(operation, other);
    }
    return ((FixedTupleValue) other).elements;
  }

  @Override
  public BoolValue asBool() {
    return BoolValue.of(z3, !elements.isEmpty());
  }

  @Override
  public IntValue length() {
    return IntValue.of(z3, elements.size());
  }

  @Override
  public Value add(final Value other) {
    final List<Value> concatenated = new ArrayList<>(elements);
    concatenated.addAll(tuple("+", other));
    return new FixedTupleValue(z3, concatenated);
  }

  @Override
  public Value multiply(final Value other) {
    final int count = Sequences.repetitions(this, other);
    final List<Value> repeated = new ArrayList<>(elements.size() * count);
    for (int i = 0; i < count; i++) {
      repeated.addAll(elements);
    }
    return new FixedTupleValue(z3, repeated);
  }

  @Override
  public BoolValue eq(final Value other) {
    final List<Value> others = tuple("==", other);
    if (others.size() != elements.size()) {
      return BoolValue.of(z3, false);
    }
    BoolValue equal = BoolValue.of(z3, true);
    for (int i = 0; i < elements.size(); i++) {
      equal = equal.and(Values.equalOrFalse(elements.get(i), others.get(i)));
    }
    return equal;
  }

  /**
   * Build the lexicographic order from the last shared position backwards: position {@code i}
   * decides if the elements differ, otherwise the rest decides, and finally the lengths.
   */
  private BoolValue lexicographic(
      final String operation,
      final List<Value> left,
      final List<Value> right,
      final boolean orEqual) {
    final int shared = Math.min(left.size(), right.size());
    BoolValue result =
        BoolValue.of(z3, orEqual ? left.size() <= right.size() : left.size() < right.size());
    for (int i = shared - 1; i >= 0; i--) {
      final Value l = left.get(i);
      final Value r = right.get(i);
      if (!l.getKind().isNumeric() && l.getKind() != r.getKind()) {
        throw new SortMismatchException(operation, l.describe(), r.describe());
      }
      result = l.lt(r).or(Values.equalOrFalse(l, r).and(result));
    }
    return result;
  }

  @Override
  public BoolValue lt(final Value other) {
    return lexicographic("<", elements, tuple("<", other), false);
  }

  @Override
  public BoolValue le(final Value other) {
    return lexicographic("<=", elements, tuple("<=", other), true);
  }

  @Override
  public BoolValue gt(final Value other) {
    return lexicographic(">", tuple(">", other), elements, false);
  }

  @Override
  public BoolValue ge(final Value other) {
    return lexicographic(">=", tuple(">=", other), elements, true);
  }

  @Override
  public BoolValue contains(final Value item) {
    BoolValue any = BoolValue.of(z3, false);
    for (final Value element : elements) {
      any = any.or(Values.equalOrFalse(element, item));
    }
    return any;
  }

  @Override
  public Value getItem(final ExecutionContext ctx, final Value index) {
    final Expr<IntSort> raw = Sequences.index(this, "subscript", index);
    if (elements.isEmpty()) {
      // Always out of range.
      ctx.raise(z3.mkTrue(), "IndexError");
      return this;
    }
    final Optional<BigInteger> constant = Values.constantInt(raw);
    if (constant.isPresent()) {
      final int size = elements.size();
      final BigInteger value = constant.get();
      final BigInteger resolved = value.signum() < 0 ? value.add(BigInteger.valueOf(size)) : value;
      if (resolved.signum() < 0 || resolved.compareTo(BigInteger.valueOf(size)) >= 0) {
        ctx.raise(z3.mkTrue(), "IndexError");
        return elements.get(0);
      }
      return elements.get(resolved.intValue());
    }
    final Expr<IntSort> resolved = Sequences.elementIndex(ctx, raw, z3.mkInt(elements.size()));
    return select(resolved);
  }

  @Override
  public Value element(final IntValue index) {
    if (elements.isEmpty()) {
      throw new UnsupportedConstructException("element of empty tuple");
    }
    return select(index.unwrap());
  }

  private Value select(final Expr<IntSort> index) {
    Value selected = elements.get(elements.size() - 1);
    for (int i = elements.size() - 2; i >= 0; i--) {
      selected = Values.ifExpr(z3.mkEq(index, z3.mkInt(i)), elements.get(i), selected);
    }
    return selected;
  }

  @Override
  public Value getSlice(
      final ExecutionContext ctx, final Optional<Value> lower, final Optional<Value> upper) {
    final int size = elements.size();
    final int start = constantBound(lower, 0);
    final int stop = constantBound(upper, size);
    return new FixedTupleValue(z3, elements.subList(start, Math.max(start, stop)));
  }

  private int constantBound(final Optional<Value> bound, final int fallback) {
    if (bound.isEmpty()) {
      return fallback;
    }
    final int size = elements.size();
    final BigInteger raw =
        Values.constantInt(bound.get())
            .orElseThrow(() -> new UnsupportedConstructException("symbolic tuple slice"));
    final BigInteger shifted = raw.signum() < 0 ? raw.add(BigInteger.valueOf(size)) : raw;
    return shifted.max(BigInteger.ZERO).min(BigInteger.valueOf(size)).intValue();
  }

  @Override
  public List<Value> elements(final int limit) {
    if (elements.size() > limit) {
      throw new UnsupportedConstructException(
          "iteration over more than " + limit + " elements", describe());
    }
    return elements;
  }

  @Override
  public Value callMethod(
      final ExecutionContext ctx, final String name, final Arguments arguments) {
    switch (name) {
      case "count":
        {
          arguments.check("tuple.count", 1, "value");
          final Value item = arguments.require(0, "value", "tuple.count");
          Expr<IntSort> count = z3.mkInt(0);
          for (final Value element : elements) {
            final BoolExpr equal = Values.equalOrFalse(element, item).unwrap();
            count = z3.mkAdd(count, z3.mkITE(equal, z3.mkInt(1), z3.mkInt(0)));
          }
          return new IntValue(z3, count);
        }
      case "index":
        {
          arguments.check("tuple.index", 1, "value");
          final Value item = arguments.require(0, "value", "tuple.index");
          Expr<IntSort> position = z3.mkInt(-1);
          for (int i = elements.size() - 1; i >= 0; i--) {
            final BoolExpr equal = Values.equalOrFalse(elements.get(i), item).unwrap();
            position = z3.mkITE(equal, z3.mkInt(i), position);
          }
          ctx.raise(z3.mkNot(contains(item).unwrap()), "ValueError");
          return new IntValue(z3, position);
        }
      default:
        return super.callMethod(ctx, name, arguments);
    }
  }

  @Override
  public String toString() {
    return elements.stream().map(Value::toString).collect(joining(", ", "tuple(", ")"));
  }
}
