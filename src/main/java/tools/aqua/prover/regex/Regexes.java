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

package tools.aqua.prover.regex;

import com.microsoft.z3.CharSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.ReExpr;
import com.microsoft.z3.ReSort;
import com.microsoft.z3.SeqSort;
import tools.aqua.prover.value.StrValue;

/** Building blocks for regular expressions over strings. */
final class Regexes {

  private Regexes() {}

  static ReSort<SeqSort<CharSort>> sort(final Context z3) {
    return z3.mkReSort(z3.mkStringSort());
  }

  @SuppressWarnings("unchecked")
  private static ReExpr<SeqSort<CharSort>> cast(final Expr<?> regex) {
    return (ReExpr<SeqSort<CharSort>>) regex;
  }

  /** All strings. */
  static ReExpr<SeqSort<CharSort>> anything(final Context z3) {
    return cast(z3.mkFullRe(sort(z3)));
  }

  /** No string at all. */
  static ReExpr<SeqSort<CharSort>> nothing(final Context z3) {
    return cast(z3.mkEmptyRe(sort(z3)));
  }

  /** All single-character strings. */
  static ReExpr<SeqSort<CharSort>> anyCharacter(final Context z3) {
    return cast(z3.mkAllcharRe(sort(z3)));
  }

  /** Exactly the given string. */
  static ReExpr<SeqSort<CharSort>> literal(final Context z3, final String text) {
    return z3.mkToRe(StrValue.literal(z3, text));
  }

  /** The characters from {@code low} to {@code high}, inclusive. */
  static ReExpr<SeqSort<CharSort>> range(final Context z3, final int low, final int high) {
    return z3.mkRange(
        StrValue.literal(z3, new String(Character.toChars(low))),
        StrValue.literal(z3, new String(Character.toChars(high))));
  }

  /** The single characters not matched by a character class. */
  static ReExpr<SeqSort<CharSort>> complementCharacters(
      final Context z3, final ReExpr<SeqSort<CharSort>> characters) {
    return z3.mkIntersect(anyCharacter(z3), z3.mkComplement(characters));
  }

  static ReExpr<SeqSort<CharSort>> union(
      final Context z3,
      final ReExpr<SeqSort<CharSort>> left,
      final ReExpr<SeqSort<CharSort>> right) {
    return z3.mkUnion(left, right);
  }

  static ReExpr<SeqSort<CharSort>> concat(
      final Context z3,
      final ReExpr<SeqSort<CharSort>> left,
      final ReExpr<SeqSort<CharSort>> right) {
    return z3.mkConcat(left, right);
  }
}
