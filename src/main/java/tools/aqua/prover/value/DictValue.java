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
import com.microsoft.z3.Context;
import com.microsoft.z3.DatatypeSort;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Sort;
import java.util.List;
import java.util.Optional;
import tools.aqua.prover.SortMismatchException;
import tools.aqua.prover.UnsupportedConstructException;
import tools.aqua.prover.context.ExecutionContext;

/**
 * A {@code dict}, represented as an array from keys to entries that carry a presence flag and the
 * value. Absent keys map to an entry with a cleared flag.
 */
public final class DictValue extends Value {

  private final Expr<ArraySort<Sort, Sort>> expr;

  /** The constructor and accessors of the entry sort. */
  private final FuncDecl<?> entry;
  private final FuncDecl<?> present;
  private final FuncDecl<?> value;

  @SuppressWarnings("unchecked")
  DictValue(final Context z3, final Expr<?> expr) {
    super(z3);
    final Sort sort = expr.getSort();
    if (!(sort instanceof ArraySort)
        || !DictEntries.isEntrySort(((ArraySort<?, ?>) sort).getRange())) {
      throw new IllegalArgumentException("not a dict: " + sort);
    }
    this.expr = (Expr<ArraySort<Sort, Sort>>) expr;
    final DatatypeSort<?> entrySort = (DatatypeSort<?>) ((ArraySort<?, ?>) sort).getRange();
    this.entry = entrySort.getConstructors()[0];
    this.present = entrySort.getAccessors()[0][0];
    this.value = entrySort.getAccessors()[0][1];
  }

  /**
   * Get the sort of dictionaries.
   *
   * @param z3 the solver context.
   * @param keySort the key sort.
   * @param valueSort the value sort.
   * @return the dictionary sort.
   */
  public static Sort sort(final Context z3, final Sort keySort, final Sort valueSort) {
    return z3.mkArraySort(keySort, DictEntries.entrySort(z3, valueSort));
  }

  /**
   * Create a dictionary from its items. Later items overwrite earlier ones with the same key.
   *
   * @param z3 the solver context.
   * @param keySort the key sort.
   * @param valueSort the value sort.
   * @param keys the keys.
   * @param values the values, in key order.
   * @return the dictionary.
   */
  public static DictValue of(
      final Context z3,
      final Sort keySort,
      final Sort valueSort,
      final List<? extends Value> keys,
      final List<? extends Value> values) {
    final Sort entrySort = DictEntries.entrySort(z3, valueSort);
    final DictValue empty =
        new DictValue(z3, z3.mkConstArray(keySort, Values.cast(absent(z3, entrySort, valueSort))));
    Expr<ArraySort<Sort, Sort>> result = empty.expr;
    for (int i = 0; i < keys.size(); i++) {
      final Value key = coerce("dict key", keys.get(i), keySort);
      final Value item = coerce("dict value", values.get(i), valueSort);
      result = z3.mkStore(result, Values.cast(key.unwrap()), empty.present(item));
    }
    return new DictValue(z3, result);
  }

  private static Value coerce(final String operation, final Value value, final Sort sort) {
    return Values.coerce(value, sort)
        .orElseThrow(
            () -> new SortMismatchException(operation, sort.toString(), value.describe()));
  }

  private static Expr<?> absent(final Context z3, final Sort entrySort, final Sort valueSort) {
    final FuncDecl<?> constructor = ((DatatypeSort<?>) entrySort).getConstructors()[0];
    return constructor.apply(z3.mkFalse(), z3.mkConst("dict_absent", valueSort));
  }

  private Expr<Sort> present(final Value item) {
    return Values.cast(entry.apply(z3.mkTrue(), item.unwrap()));
  }

  @Override
  public Kind getKind() {
    return Kind.DICT;
  }

  @Override
  public Expr<ArraySort<Sort, Sort>> unwrap() {
    return expr;
  }

  @Override
  Value rebuild(final Expr<?> expr) {
    return new DictValue(z3, expr);
  }

  public Sort getKeySort() {
    return ((ArraySort<?, ?>) expr.getSort()).getDomain();
  }

  public Sort getValueSort() {
    return value.getRange();
  }

  @Override
  public String describe() {
    return "dict[" + getKeySort() + ", " + getValueSort() + "]";
  }

  private Expr<Sort> select(final Expr<?> key) {
    return z3.mkSelect(expr, Values.cast(key));
  }

  private BoolExpr isPresent(final Expr<?> key) {
    return ((BoolValue) Values.wrap(z3, present.apply(select(key)))).unwrap();
  }

  private Value valueAt(final Expr<?> key) {
    return Values.wrap(z3, value.apply(select(key)));
  }

  @Override
  public BoolValue eq(final Value other) {
    if (other.getKind() != Kind.DICT || !other.getSort().equals(getSort())) {
      throw mismatch("==", other);
    }
    final DictValue dict = (DictValue) other;
    final Expr<?> key = z3.mkFreshConst("k", getKeySort());
    final BoolExpr samePresence = z3.mkEq(isPresent(key), dict.isPresent(key));
    final BoolExpr sameValue =
        z3.mkImplies(isPresent(key), valueAt(key).eq(dict.valueAt(key)).unwrap());
    return new BoolValue(
        z3,
        z3.mkForall(
            new Expr<?>[] {key}, z3.mkAnd(samePresence, sameValue), 1, null, null, null, null));
  }

  @Override
  public BoolValue asBool() {
    final Expr<?> key = z3.mkFreshConst("k", getKeySort());
    return new BoolValue(
        z3, z3.mkExists(new Expr<?>[] {key}, isPresent(key), 1, null, null, null, null));
  }

  @Override
  public IntValue length() {
    throw new UnsupportedConstructException("len of dict", describe());
  }

  @Override
  public BoolValue contains(final Value item) {
    final Optional<Value> key = Values.coerce(item, getKeySort());
    if (key.isEmpty()) {
      return BoolValue.of(z3, false);
    }
    return new BoolValue(z3, isPresent(key.get().unwrap()));
  }

  @Override
  public Value getItem(final ExecutionContext ctx, final Value index) {
    final Value key = Values.coerce(index, getKeySort()).orElseThrow(() -> mismatch("[]", index));
    ctx.raise(z3.mkNot(isPresent(key.unwrap())), "KeyError");
    return valueAt(key.unwrap());
  }

  @Override
  public Value callMethod(
      final ExecutionContext ctx, final String name, final Arguments arguments) {
    if (!"get".equals(name)) {
      return super.callMethod(ctx, name, arguments);
    }
    arguments.check("dict.get", 1, "key", "default");
    final Value index = arguments.require(0, "key", "dict.get");
    final Value fallback =
        arguments
            .get(1, "default")
            .orElseThrow(() -> new UnsupportedConstructException("dict.get without default"));
    final Optional<Value> key = Values.coerce(index, getKeySort());
    final Value defaultValue =
        Values.coerce(fallback, getValueSort()).orElseThrow(() -> mismatch("get", fallback));
    if (key.isEmpty()) {
      return defaultValue;
    }
    return Values.ifExpr(
        isPresent(key.get().unwrap()), valueAt(key.get().unwrap()), defaultValue);
  }
}
