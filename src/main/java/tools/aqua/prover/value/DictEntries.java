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
import com.microsoft.z3.DatatypeSort;
import com.microsoft.z3.Sort;
import com.microsoft.z3.Symbol;
import com.microsoft.z3.TupleSort;
import java.util.HashMap;
import java.util.Map;
import java.util.WeakHashMap;

/**
 * The entry sorts of dictionaries: a pair of a presence flag and a value. Each solver context gets
 * exactly one entry sort per value sort, so dictionaries with equal value sorts have equal sorts.
 */
final class DictEntries {

  /** Name prefix that marks entry sorts. */
  private static final String PREFIX = "DictEntry";

  private static final Map<Context, Map<Sort, TupleSort>> CACHE = new WeakHashMap<>();

  private DictEntries() {}

  /**
   * Get the entry sort for a value sort.
   *
   * @param z3 the solver context.
   * @param valueSort the value sort.
   * @return the entry sort.
   */
  static synchronized Sort entrySort(final Context z3, final Sort valueSort) {
    return CACHE
        .computeIfAbsent(z3, key -> new HashMap<>())
        .computeIfAbsent(
            valueSort,
            key ->
                z3.mkTupleSort(
                    z3.mkSymbol(PREFIX + "[" + key + "]"),
                    new Symbol[] {z3.mkSymbol("present"), z3.mkSymbol("value")},
                    new Sort[] {z3.getBoolSort(), key}));
  }

  /**
   * Check whether a sort is an entry sort.
   *
   * @param sort the sort.
   * @return {@code true} if the sort was created by {@link #entrySort(Context, Sort)}.
   */
  static boolean isEntrySort(final Sort sort) {
    return sort instanceof DatatypeSort && sort.getName().toString().contains(PREFIX);
  }
}
