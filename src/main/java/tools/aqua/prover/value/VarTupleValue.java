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
import com.microsoft.z3.Expr;
import com.microsoft.z3.SeqSort;
import com.microsoft.z3.Sort;

/** A homogeneous tuple of symbolic length, as declared by {@code tuple[T, ...]}. */
public final class VarTupleValue extends SequenceValue {

  /**
   * Create a new tuple value.
   *
   * @param z3 the solver context.
   * @param expr the payload, a sequence of any sort but characters.
   */
  public VarTupleValue(final Context z3, final Expr<SeqSort<Sort>> expr) {
    super(z3, expr);
  }

  @Override
  public Kind getKind() {
    return Kind.VAR_TUPLE;
  }

  @Override
  SequenceValue withPayload(final Expr<SeqSort<Sort>> payload) {
    return new VarTupleValue(z3, payload);
  }
}
