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

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.CharSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.ReExpr;
import com.microsoft.z3.ReSort;
import com.microsoft.z3.SeqSort;

/**
 * A regular expression over strings together with the anchors of its source pattern. The regex
 * itself describes the language between the anchors.
 */
public final class CompiledPattern {

  private final ReExpr<SeqSort<CharSort>> regex;
  private final boolean anchoredStart;
  private final boolean anchoredEnd;

  /**
   * Create a new compiled pattern.
   *
   * @param regex the regular expression, must be of the string regex sort.
   * @param anchoredStart whether the pattern started with {@code ^}.
   * @param anchoredEnd whether the pattern ended with {@code $}.
   */
  @SuppressWarnings("unchecked")
  public CompiledPattern(
      final Expr<?> regex, final boolean anchoredStart, final boolean anchoredEnd) {
    if (!(regex.getSort() instanceof ReSort)) {
      throw new IllegalArgumentException("not a regular expression: " + regex.getSort());
    }
    this.regex = (ReExpr<SeqSort<CharSort>>) regex;
    this.anchoredStart = anchoredStart;
    this.anchoredEnd = anchoredEnd;
  }

  public ReExpr<SeqSort<CharSort>> getRegex() {
    return regex;
  }

  public boolean isAnchoredStart() {
    return anchoredStart;
  }

  public boolean isAnchoredEnd() {
    return anchoredEnd;
  }

  /**
   * Test whether the whole string matches.
   *
   * @param z3 the solver context.
   * @param string the string.
   * @return the membership test.
   */
  public BoolExpr fullMatch(final Context z3, final Expr<SeqSort<CharSort>> string) {
    return z3.mkInRe(string, regex);
  }

  /**
   * Test whether a prefix of the string matches.
   *
   * @param z3 the solver context.
   * @param string the string.
   * @return the membership test.
   */
  public BoolExpr match(final Context z3, final Expr<SeqSort<CharSort>> string) {
    final ReExpr<SeqSort<CharSort>> prefix =
        anchoredEnd ? regex : z3.mkConcat(regex, Regexes.anything(z3));
    return z3.mkInRe(string, prefix);
  }

  /**
   * Test whether a substring of the string matches.
   *
   * @param z3 the solver context.
   * @param string the string.
   * @return the membership test.
   */
  public BoolExpr search(final Context z3, final Expr<SeqSort<CharSort>> string) {
    ReExpr<SeqSort<CharSort>> infix = regex;
    if (!anchoredStart) {
      infix = z3.mkConcat(Regexes.anything(z3), infix);
    }
    if (!anchoredEnd) {
      infix = z3.mkConcat(infix, Regexes.anything(z3));
    }
    return z3.mkInRe(string, infix);
  }

  @Override
  public String toString() {
    return (anchoredStart ? "^" : "") + regex + (anchoredEnd ? "$" : "");
  }
}
