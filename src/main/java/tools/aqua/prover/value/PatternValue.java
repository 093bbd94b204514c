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
import tools.aqua.prover.UnsupportedConstructException;
import tools.aqua.prover.context.ExecutionContext;
import tools.aqua.prover.regex.CompiledPattern;

/**
 * A compiled regular expression, as returned by {@code re.compile}. Matching yields a bool
 * instead of a match object.
 */
public final class PatternValue extends Value {

  private final CompiledPattern pattern;

  /**
   * Create a new pattern value.
   *
   * @param z3 the solver context.
   * @param pattern the compiled pattern.
   */
  public PatternValue(final Context z3, final CompiledPattern pattern) {
    super(z3);
    this.pattern = requireNonNull(pattern);
  }

  public CompiledPattern getPattern() {
    return pattern;
  }

  @Override
  public Kind getKind() {
    return Kind.PATTERN;
  }

  @Override
  public Expr<?> unwrap() {
    return pattern.getRegex();
  }

  @Override
  Value rebuild(final Expr<?> expr) {
    return new PatternValue(
        z3, new CompiledPattern(expr, pattern.isAnchoredStart(), pattern.isAnchoredEnd()));
  }

  @Override
  public Value ifThenElse(final BoolExpr condition, final Value orElse) {
    if (orElse.getKind() == Kind.PATTERN) {
      final CompiledPattern other = ((PatternValue) orElse).pattern;
      if (other.isAnchoredStart() != pattern.isAnchoredStart()
          || other.isAnchoredEnd() != pattern.isAnchoredEnd()) {
        throw new UnsupportedConstructException(
            "conditional merge of differently anchored patterns");
      }
    }
    return super.ifThenElse(condition, orElse);
  }

  @Override
  public BoolValue asBool() {
    return BoolValue.of(z3, true);
  }

  /**
   * Match a whole string, as {@code re.fullmatch} does.
   *
   * @param string the string.
   * @return whether the string matches.
   */
  public BoolValue fullMatch(final Value string) {
    return new BoolValue(z3, pattern.fullMatch(z3, subject("fullmatch", string).unwrap()));
  }

  /**
   * Match a prefix of a string, as {@code re.match} does.
   *
   * @param string the string.
   * @return whether some prefix matches.
   */
  public BoolValue match(final Value string) {
    return new BoolValue(z3, pattern.match(z3, subject("match", string).unwrap()));
  }

  /**
   * Match anywhere in a string, as {@code re.search} does.
   *
   * @param string the string.
   * @return whether some substring matches.
   */
  public BoolValue search(final Value string) {
    return new BoolValue(z3, pattern.search(z3, subject("search", string).unwrap()));
  }

  private StrValue subject(final String operation, final Value string) {
    if (string.getKind() != Kind.STR) {
      throw mismatch(operation, string);
    }
    return (StrValue) string;
  }

  @Override
  public Value callMethod(
      final ExecutionContext ctx, final String name, final Arguments arguments) {
    switch (name) {
      case "fullmatch":
        arguments.check("Pattern.fullmatch", 1, "string");
        return fullMatch(arguments.require(0, "string", "Pattern.fullmatch"));
      case "match":
        arguments.check("Pattern.match", 1, "string");
        return match(arguments.require(0, "string", "Pattern.match"));
      case "search":
        arguments.check("Pattern.search", 1, "string");
        return search(arguments.require(0, "string", "Pattern.search"));
      default:
        return super.callMethod(ctx, name, arguments);
    }
  }
}
