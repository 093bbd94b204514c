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
import com.microsoft.z3.SeqSort;
import com.microsoft.z3.Sort;
import java.util.Collections;
import java.util.List;
import tools.aqua.prover.context.ExecutionContext;

/** A {@code list}. The in-place methods return the updated list for the caller to rebind. */
public final class ListValue extends SequenceValue {

  /**
   * Create a new list value.
   *
   * @param z3 the solver context.
   * @param expr the payload, a sequence of any sort but characters.
   */
  public ListValue(final Context z3, final Expr<SeqSort<Sort>> expr) {
    super(z3, expr);
  }

  /**
   * Create a list from its elements.
   *
   * @param z3 the solver context.
   * @param elementSort the element sort.
   * @param elements the elements.
   * @return the list.
   */
  public static ListValue of(
      final Context z3, final Sort elementSort, final List<? extends Value> elements) {
    return new ListValue(z3, sequence(z3, elementSort, elements));
  }

  /**
   * Create a list holding each candidate element only if its guard holds, as a filtering
   * comprehension does.
   *
   * @param z3 the solver context.
   * @param elementSort the element sort.
   * @param guards the guards, one per candidate.
   * @param candidates the candidate elements.
   * @return the list.
   */
  public static ListValue filtered(
      final Context z3,
      final Sort elementSort,
      final List<BoolExpr> guards,
      final List<? extends Value> candidates) {
    final Expr<SeqSort<Sort>> empty = cast(z3.mkEmptySeq(z3.mkSeqSort(elementSort)));
    Expr<SeqSort<Sort>> result = empty;
    for (int i = 0; i < candidates.size(); i++) {
      final Expr<SeqSort<Sort>> single =
          sequence(z3, elementSort, Collections.singletonList(candidates.get(i)));
      result = z3.mkConcat(result, z3.mkITE(guards.get(i), single, empty));
    }
    return new ListValue(z3, result);
  }

  @Override
  public Kind getKind() {
    return Kind.LIST;
  }

  @Override
  SequenceValue withPayload(final Expr<SeqSort<Sort>> payload) {
    return new ListValue(z3, payload);
  }

  @Override
  public boolean isMutator(final String name) {
    return "append".equals(name) || "extend".equals(name);
  }

  @Override
  public Value callMethod(
      final ExecutionContext ctx, final String name, final Arguments arguments) {
    switch (name) {
      case "append":
        arguments.check("list.append", 1, "object");
        return append(arguments.require(0, "object", "list.append"));
      case "extend":
        arguments.check("list.extend", 1, "iterable");
        return extend(arguments.require(0, "iterable", "list.extend"));
      default:
        throw noMethod(name);
    }
  }
}
