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
import com.microsoft.z3.CharSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntSort;
import com.microsoft.z3.SeqSort;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import tools.aqua.prover.context.ExecutionContext;

/** A {@code str}, backed by the solver's string theory. */
public final class StrValue extends Value {

  private final Expr<SeqSort<CharSort>> expr;

  /**
   * Create a new string value.
   *
   * @param z3 the solver context.
   * @param expr the payload.
   */
  public StrValue(final Context z3, final Expr<SeqSort<CharSort>> expr) {
    super(z3);
    this.expr = expr;
  }

  /**
   * Create a constant string value.
   *
   * @param z3 the solver context.
   * @param value the constant.
   * @return the value.
   */
  public static StrValue of(final Context z3, final String value) {
    return new StrValue(z3, literal(z3, value));
  }

  /**
   * Build a string constant. Backslashes and characters outside printable ASCII are passed in the
   * solver's unicode escape notation so that they are taken literally.
   *
   * @param z3 the solver context.
   * @param value the constant.
   * @return the string expression.
   */
  public static Expr<SeqSort<CharSort>> literal(final Context z3, final String value) {
    final StringBuilder encoded = new StringBuilder(value.length());
    value
        .codePoints()
        .forEach(
            codePoint -> {
              if (codePoint < 0x20 || codePoint > 0x7e || codePoint == '\\') {
                encoded.append("\\u{").append(Integer.toHexString(codePoint)).append('}');
              } else {
                encoded.appendCodePoint(codePoint);
              }
            });
    return z3.mkString(encoded.toString());
  }

  /**
   * Reverse the escape notation of {@link #literal(Context, String)}.
   *
   * @param encoded the solver's rendering of a string constant.
   * @return the string.
   */
  static String decode(final String encoded) {
    final StringBuilder decoded = new StringBuilder(encoded.length());
    int i = 0;
    while (i < encoded.length()) {
      final int close = encoded.indexOf('}', i);
      if (encoded.startsWith("\\u{", i) && close > i + 3) {
        decoded.appendCodePoint(Integer.parseInt(encoded.substring(i + 3, close), 16));
        i = close + 1;
      } else {
        decoded.append(encoded.charAt(i));
        i++;
      }
    }
    return decoded.toString();
  }

  @SuppressWarnings("unchecked")
  static Expr<SeqSort<CharSort>> cast(final Expr<?> expr) {
    return (Expr<SeqSort<CharSort>>) expr;
  }

  @Override
  public Kind getKind() {
    return Kind.STR;
  }

  @Override
  public Expr<SeqSort<CharSort>> unwrap() {
    return expr;
  }

  @Override
  Value rebuild(final Expr<?> expr) {
    return new StrValue(z3, cast(expr));
  }

  @Override
  public BoolValue asBool() {
    return new BoolValue(z3, z3.mkNot(z3.mkEq(z3.mkLength(expr), z3.mkInt(0))));
  }

  @Override
  public IntValue length() {
    return new IntValue(z3, z3.mkLength(expr));
  }

  private Expr<SeqSort<CharSort>> string(final String operation, final Value other) {
    if (other.getKind() != Kind.STR) {
      throw mismatch(operation, other);
    }
    return ((StrValue) other).expr;
  }

  @Override
  public Value add(final Value other) {
    return new StrValue(z3, z3.mkConcat(expr, string("+", other)));
  }

  @Override
  public Value multiply(final Value other) {
    final int count = Sequences.repetitions(this, other);
    Expr<SeqSort<CharSort>> result = literal(z3, "");
    for (int i = 0; i < count; i++) {
      result = z3.mkConcat(result, expr);
    }
    return new StrValue(z3, result);
  }

  @Override
  public BoolValue lt(final Value other) {
    return new BoolValue(z3, z3.MkStringLt(expr, string("<", other)));
  }

  @Override
  public BoolValue le(final Value other) {
    return new BoolValue(z3, z3.MkStringLe(expr, string("<=", other)));
  }

  @Override
  public BoolValue gt(final Value other) {
    return new BoolValue(z3, z3.MkStringLt(string(">", other), expr));
  }

  @Override
  public BoolValue ge(final Value other) {
    return new BoolValue(z3, z3.MkStringLe(string(">=", other), expr));
  }

  @Override
  public BoolValue contains(final Value item) {
    return new BoolValue(z3, z3.mkContains(expr, string("in", item)));
  }

  @Override
  public Value getItem(final ExecutionContext ctx, final Value index) {
    final Expr<IntSort> resolved =
        Sequences.elementIndex(ctx, Sequences.index(this, "subscript", index), z3.mkLength(expr));
    return new StrValue(z3, z3.mkAt(expr, resolved));
  }

  @Override
  public Value element(final IntValue index) {
    return new StrValue(z3, z3.mkAt(expr, index.unwrap()));
  }

  @Override
  public Value getSlice(
      final ExecutionContext ctx, final Optional<Value> lower, final Optional<Value> upper) {
    final Expr<IntSort> length = z3.mkLength(expr);
    final Expr<IntSort> start = Sequences.sliceBound(this, lower, z3.mkInt(0), length);
    final Expr<IntSort> stop = Sequences.sliceBound(this, upper, length, length);
    return new StrValue(z3, z3.mkExtract(expr, start, Sequences.sliceLength(z3, start, stop)));
  }

  @Override
  public List<Value> elements(final int limit) {
    final int length = Sequences.constantLength(this, z3.mkLength(expr), limit);
    final List<Value> characters = new ArrayList<>(length);
    for (int i = 0; i < length; i++) {
      characters.add(new StrValue(z3, z3.mkAt(expr, z3.mkInt(i))));
    }
    return characters;
  }

  @Override
  public Value callMethod(
      final ExecutionContext ctx, final String name, final Arguments arguments) {
    switch (name) {
      case "startswith":
        arguments.check("str.startswith", 1, "prefix");
        return affix(arguments.require(0, "prefix", "str.startswith"), true);
      case "endswith":
        arguments.check("str.endswith", 1, "suffix");
        return affix(arguments.require(0, "suffix", "str.endswith"), false);
      case "find":
        arguments.check("str.find", 1, "sub", "start");
        return find(arguments);
      case "index":
        {
          arguments.check("str.index", 1, "sub", "start");
          final IntValue position = find(arguments);
          ctx.raise(z3.mkEq(position.unwrap(), z3.mkInt(-1)), "ValueError");
          return position;
        }
      default:
        return super.callMethod(ctx, name, arguments);
    }
  }

  /** Build {@code startswith}/{@code endswith}, which also accept a tuple of alternatives. */
  private BoolValue affix(final Value candidate, final boolean prefix) {
    if (candidate.getKind() == Kind.FIXED_TUPLE) {
      BoolValue any = BoolValue.of(z3, false);
      for (final Value alternative : ((FixedTupleValue) candidate).getElements()) {
        any = any.or(affix(alternative, prefix));
      }
      return any;
    }
    final Expr<SeqSort<CharSort>> affix =
        string(prefix ? "startswith" : "endswith", candidate);
    final BoolExpr test = prefix ? z3.mkPrefixOf(affix, expr) : z3.mkSuffixOf(affix, expr);
    return new BoolValue(z3, test);
  }

  private IntValue find(final Arguments arguments) {
    final Expr<SeqSort<CharSort>> sub = string("find", arguments.require(0, "sub", "str.find"));
    final Optional<Value> raw = arguments.get(1, "start");
    final Expr<IntSort> length = z3.mkLength(expr);
    final Expr<IntSort> start = Sequences.sliceBound(this, raw, z3.mkInt(0), length);
    final Expr<IntSort> found = z3.mkIndexOf(expr, sub, start);
    if (raw.isEmpty()) {
      return new IntValue(z3, found);
    }
    // A start past the end finds nothing, not even the empty string.
    final BoolExpr past = z3.mkGt(Sequences.index(this, "find", raw.get()), length);
    return new IntValue(z3, z3.mkITE(past, z3.mkInt(-1), found));
  }

  /**
   * Convert a decimal integer literal with optional sign to an int, recording a {@code
   * ValueError} if the string is not one.
   *
   * @param ctx the context.
   * @return the int value.
   */
  public IntValue toInt(final ExecutionContext ctx) {
    final Expr<IntSort> length = z3.mkLength(expr);
    final Expr<SeqSort<CharSort>> tail =
        z3.mkExtract(expr, z3.mkInt(1), z3.mkSub(length, z3.mkInt(1)));
    final BoolExpr negative = z3.mkPrefixOf(literal(z3, "-"), expr);
    final BoolExpr signed = z3.mkOr(negative, z3.mkPrefixOf(literal(z3, "+"), expr));
    final Expr<IntSort> digits = z3.stringToInt(z3.mkITE(signed, tail, expr));
    ctx.raise(z3.mkEq(digits, z3.mkInt(-1)), "ValueError");
    return new IntValue(z3, z3.mkITE(negative, z3.mkUnaryMinus(digits), digits));
  }

  /**
   * Get the code point of a single-character string, recording a {@code TypeError} for other
   * lengths.
   *
   * @param ctx the context.
   * @return the code point.
   */
  public IntValue ord(final ExecutionContext ctx) {
    ctx.raise(z3.mkNot(z3.mkEq(z3.mkLength(expr), z3.mkInt(1))), "TypeError");
    return new IntValue(z3, z3.charToInt(z3.mkNth(expr, z3.mkInt(0))));
  }
}
