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
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Sort;
import java.util.List;
import java.util.Optional;
import tools.aqua.prover.SortMismatchException;
import tools.aqua.prover.UnsupportedConstructException;
import tools.aqua.prover.context.ExecutionContext;

/**
 * A {@code set}, represented by its characteristic function. Sets have no symbolic cardinality,
 * so {@code len} is not supported.
 */
public final class SetValue extends Value {

  private final Expr<ArraySort<Sort, BoolSort>> expr;

  @SuppressWarnings("unchecked")
  SetValue(final Context z3, final Expr<?> expr) {
    super(z3);
    final Sort sort = expr.getSort();
    if (!(sort instanceof ArraySort)
        || !(((ArraySort<?, ?>) sort).getRange() instanceof BoolSort)) {
      throw new IllegalArgumentException("not a set: " + sort);
    }
    this.expr = (Expr<ArraySort<Sort, BoolSort>>) expr;
  }

  /**
   * Create a set from its elements.
   *
   * @param z3 the solver context.
   * @param elementSort the element sort.
   * @param elements the elements.
   * @return the set.
   */
  public static SetValue of(
      final Context z3, final Sort elementSort, final List<? extends Value> elements) {
    Expr<ArraySort<Sort, BoolSort>> result = z3.mkEmptySet(elementSort);
    for (final Value element : elements) {
      final Value coerced =
          Values.coerce(element, elementSort)
              .orElseThrow(
                  () ->
                      new SortMismatchException(
                          "set element", elementSort.toString(), element.describe()));
      result = z3.mkSetAdd(result, Values.cast(coerced.unwrap()));
    }
    return new SetValue(z3, result);
  }

  @Override
  public Kind getKind() {
    return Kind.SET;
  }

  @Override
  public Expr<ArraySort<Sort, BoolSort>> unwrap() {
    return expr;
  }

  @Override
  Value rebuild(final Expr<?> expr) {
    return new SetValue(z3, expr);
  }

  /**
   * Get the sort of the elements.
   *
   * @return the element sort.
   */
  public Sort getElementSort() {
    return ((ArraySort<?, ?>) expr.getSort()).getDomain();
  }

  @Override
  public String describe() {
    return "set[" + getElementSort() + "]";
  }

  @Override
  public BoolValue asBool() {
    return new BoolValue(z3, z3.mkNot(z3.mkEq(expr, z3.mkEmptySet(getElementSort()))));
  }

  @Override
  public IntValue length() {
    throw new UnsupportedConstructException("len of set", describe());
  }

  private Expr<ArraySort<Sort, BoolSort>> set(final String operation, final Value other) {
    if (other.getKind() != Kind.SET || !other.getSort().equals(getSort())) {
      throw mismatch(operation, other);
    }
    return ((SetValue) other).expr;
  }

  @Override
  public Value bitOr(final Value other) {
    return new SetValue(z3, z3.mkSetUnion(expr, set("|", other)));
  }

  @Override
  public Value bitAnd(final Value other) {
    return new SetValue(z3, z3.mkSetIntersection(expr, set("&", other)));
  }

  @Override
  public Value subtract(final Value other) {
    return new SetValue(z3, z3.mkSetDifference(expr, set("-", other)));
  }

  @Override
  public BoolValue le(final Value other) {
    return new BoolValue(z3, z3.mkSetSubset(expr, set("<=", other)));
  }

  @Override
  public BoolValue lt(final Value other) {
    final Expr<ArraySort<Sort, BoolSort>> right = set("<", other);
    return new BoolValue(
        z3, z3.mkAnd(z3.mkSetSubset(expr, right), z3.mkNot(z3.mkEq(expr, right))));
  }

  @Override
  public BoolValue ge(final Value other) {
    return new BoolValue(z3, z3.mkSetSubset(set(">=", other), expr));
  }

  @Override
  public BoolValue gt(final Value other) {
    final Expr<ArraySort<Sort, BoolSort>> left = set(">", other);
    return new BoolValue(z3, z3.mkAnd(z3.mkSetSubset(left, expr), z3.mkNot(z3.mkEq(left, expr))));
  }

  @Override
  public BoolValue contains(final Value item) {
    final Optional<Value> coerced = Values.coerce(item, getElementSort());
    if (coerced.isEmpty()) {
      return BoolValue.of(z3, false);
    }
    return new BoolValue(z3, z3.mkSetMembership(Values.cast(coerced.get().unwrap()), expr));
  }

  @Override
  public boolean isMutator(final String name) {
    return "add".equals(name) || "discard".equals(name);
  }

  @Override
  public Value callMethod(
      final ExecutionContext ctx, final String name, final Arguments arguments) {
    switch (name) {
      case "add":
        {
          arguments.check("set.add", 1, "element");
          final Value element = element("add", arguments.require(0, "element", "set.add"));
          return new SetValue(z3, z3.mkSetAdd(expr, Values.cast(element.unwrap())));
        }
      case "discard":
        {
          arguments.check("set.discard", 1, "element");
          final Value element = element("discard", arguments.require(0, "element", "set.discard"));
          return new SetValue(z3, z3.mkSetDel(expr, Values.cast(element.unwrap())));
        }
      default:
        return super.callMethod(ctx, name, arguments);
    }
  }

  private Value element(final String operation, final Value element) {
    return Values.coerce(element, getElementSort()).orElseThrow(() -> mismatch(operation, element));
  }
}
