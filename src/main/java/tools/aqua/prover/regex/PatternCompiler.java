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
import com.microsoft.z3.ReExpr;
import com.microsoft.z3.SeqSort;
import tools.aqua.prover.UnsupportedConstructException;

/**
 * Translates the source text of a regular expression into a solver regex. The supported subset
 * covers literals, escapes, {@code .}, character classes, groups, alternation, the greedy and lazy
 * quantifiers, and {@code ^}/{@code $} at the very ends of the pattern. Everything else, such as
 * backreferences, lookaround or inline flags, is rejected since it has no regular equivalent or
 * would change the matched language.
 */
public final class PatternCompiler {

  private final Context z3;
  private final String source;
  private int position;

  private PatternCompiler(final Context z3, final String source) {
    this.z3 = z3;
    this.source = source;
  }

  /**
   * Compile a pattern.
   *
   * @param z3 the solver context.
   * @param pattern the pattern source text.
   * @return the compiled pattern.
   * @throws UnsupportedConstructException if the pattern uses unsupported syntax.
   */
  public static CompiledPattern compile(final Context z3, final String pattern) {
    final boolean anchoredStart = pattern.startsWith("^");
    final boolean anchoredEnd = pattern.endsWith("$") && !isEscaped(pattern, pattern.length() - 1);
    final int begin = anchoredStart ? 1 : 0;
    final int end = Math.max(begin, anchoredEnd ? pattern.length() - 1 : pattern.length());
    final PatternCompiler compiler = new PatternCompiler(z3, pattern.substring(begin, end));
    final ReExpr<SeqSort<CharSort>> regex = compiler.alternation();
    if (compiler.position < compiler.source.length()) {
      throw compiler.unsupported("unbalanced parenthesis");
    }
    return new CompiledPattern(regex, anchoredStart, anchoredEnd);
  }

  private static boolean isEscaped(final String text, final int index) {
    int backslashes = 0;
    for (int i = index - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
      backslashes++;
    }
    return backslashes % 2 == 1;
  }

  private UnsupportedConstructException unsupported(final String what) {
    return new UnsupportedConstructException("regex " + what, source);
  }

  private boolean atEnd() {
    return position >= source.length();
  }

  private char peek() {
    return source.charAt(position);
  }

  private boolean accept(final char expected) {
    if (!atEnd() && peek() == expected) {
      position++;
      return true;
    }
    return false;
  }

  private ReExpr<SeqSort<CharSort>> alternation() {
    ReExpr<SeqSort<CharSort>> result = concatenation();
    while (accept('|')) {
      result = Regexes.union(z3, result, concatenation());
    }
    return result;
  }

  private ReExpr<SeqSort<CharSort>> concatenation() {
    ReExpr<SeqSort<CharSort>> result = Regexes.literal(z3, "");
    while (!atEnd() && peek() != '|' && peek() != ')') {
      result = Regexes.concat(z3, result, quantified());
    }
    return result;
  }

  private ReExpr<SeqSort<CharSort>> quantified() {
    ReExpr<SeqSort<CharSort>> atom = atom();
    while (!atEnd()) {
      final char next = peek();
      if (next == '*') {
        position++;
        atom = z3.mkStar(atom);
      } else if (next == '+') {
        position++;
        atom = z3.mkPlus(atom);
      } else if (next == '?') {
        position++;
        atom = z3.mkOption(atom);
      } else if (next == '{' && isRepetition()) {
        atom = repetition(atom);
      } else {
        break;
      }
      // a lazy quantifier matches the same language
      accept('?');
    }
    return atom;
  }

  /** Check whether a brace starts a {@code {m}}, {@code {m,}} or {@code {m,n}} quantifier. */
  private boolean isRepetition() {
    final int close = source.indexOf('}', position);
    return close > position + 1 && source.substring(position + 1, close).matches("\\d+(,\\d*)?");
  }

  private ReExpr<SeqSort<CharSort>> repetition(final ReExpr<SeqSort<CharSort>> atom) {
    final int close = source.indexOf('}', position);
    final String[] bounds = source.substring(position + 1, close).split(",", -1);
    position = close + 1;
    final int low = Integer.parseInt(bounds[0]);
    if (bounds.length == 1) {
      return z3.mkLoop(atom, low, low);
    }
    if (bounds[1].isEmpty()) {
      return z3.mkLoop(atom, low);
    }
    final int high = Integer.parseInt(bounds[1]);
    if (high < low) {
      throw unsupported("repetition bounds out of order");
    }
    return z3.mkLoop(atom, low, high);
  }

  private ReExpr<SeqSort<CharSort>> atom() {
    final char next = source.charAt(position++);
    switch (next) {
      case '(':
        {
          if (accept('?')) {
            if (!accept(':')) {
              throw unsupported("group extension");
            }
          }
          final ReExpr<SeqSort<CharSort>> group = alternation();
          if (!accept(')')) {
            throw unsupported("unbalanced parenthesis");
          }
          return group;
        }
      case '[':
        return characterClass();
      case '.':
        return Regexes.complementCharacters(z3, Regexes.literal(z3, "\n"));
      case '\\':
        return escape(false);
      case '^':
      case '$':
        throw unsupported("anchor inside pattern");
      case '*':
      case '+':
      case '?':
        throw unsupported("quantifier without operand");
      default:
        return Regexes.literal(z3, String.valueOf(next));
    }
  }

  /** Parse an escape after its backslash, inside or outside a character class. */
  private ReExpr<SeqSort<CharSort>> escape(final boolean inClass) {
    if (atEnd()) {
      throw unsupported("trailing backslash");
    }
    final char escaped = source.charAt(position++);
    switch (escaped) {
      case 'd':
        return digits();
      case 'D':
        return Regexes.complementCharacters(z3, digits());
      case 'w':
        return word();
      case 'W':
        return Regexes.complementCharacters(z3, word());
      case 's':
        return whitespace();
      case 'S':
        return Regexes.complementCharacters(z3, whitespace());
      case 'n':
        return Regexes.literal(z3, "\n");
      case 't':
        return Regexes.literal(z3, "\t");
      case 'r':
        return Regexes.literal(z3, "\r");
      case 'f':
        return Regexes.literal(z3, "\f");
      case 'v':
        return Regexes.literal(z3, "\u000b");
      default:
        if (Character.isLetterOrDigit(escaped)) {
          throw unsupported((inClass ? "class escape \\" : "escape \\") + escaped);
        }
        return Regexes.literal(z3, String.valueOf(escaped));
    }
  }

  private ReExpr<SeqSort<CharSort>> digits() {
    return Regexes.range(z3, '0', '9');
  }

  private ReExpr<SeqSort<CharSort>> word() {
    ReExpr<SeqSort<CharSort>> word = Regexes.range(z3, 'a', 'z');
    word = Regexes.union(z3, word, Regexes.range(z3, 'A', 'Z'));
    word = Regexes.union(z3, word, digits());
    return Regexes.union(z3, word, Regexes.literal(z3, "_"));
  }

  private ReExpr<SeqSort<CharSort>> whitespace() {
    ReExpr<SeqSort<CharSort>> whitespace = Regexes.literal(z3, " ");
    for (final String character : new String[] {"\t", "\n", "\r", "\f", "\u000b"}) {
      whitespace = Regexes.union(z3, whitespace, Regexes.literal(z3, character));
    }
    return whitespace;
  }

  /** Parse a character class after its opening bracket. */
  private ReExpr<SeqSort<CharSort>> characterClass() {
    final boolean negated = accept('^');
    ReExpr<SeqSort<CharSort>> members = Regexes.nothing(z3);
    boolean first = true;
    while (true) {
      if (atEnd()) {
        throw unsupported("unterminated character class");
      }
      final char next = source.charAt(position++);
      if (next == ']' && !first) {
        break;
      }
      first = false;
      if (next == '\\') {
        final char escaped = atEnd() ? '\\' : peek();
        if ("dDwWsS".indexOf(escaped) >= 0) {
          members = Regexes.union(z3, members, escape(true));
          continue;
        }
        members = Regexes.union(z3, members, single(escapedCharacter()));
        continue;
      }
      if (!atEnd() && peek() == '-' && position + 1 < source.length()
          && source.charAt(position + 1) != ']') {
        position++;
        char high = source.charAt(position++);
        if (high == '\\') {
          high = escapedCharacter();
        }
        if (high < next) {
          throw unsupported("character range out of order");
        }
        members = Regexes.union(z3, members, Regexes.range(z3, next, high));
        continue;
      }
      members = Regexes.union(z3, members, single(next));
    }
    return negated ? Regexes.complementCharacters(z3, members) : members;
  }

  /** Parse a single escaped character inside a class after its backslash. */
  private char escapedCharacter() {
    if (atEnd()) {
      throw unsupported("trailing backslash");
    }
    final char escaped = source.charAt(position++);
    switch (escaped) {
      case 'n':
        return '\n';
      case 't':
        return '\t';
      case 'r':
        return '\r';
      case 'f':
        return '\f';
      case 'v':
        return '\u000b';
      default:
        if (Character.isLetterOrDigit(escaped)) {
          throw unsupported("class escape \\" + escaped);
        }
        return escaped;
    }
  }

  private ReExpr<SeqSort<CharSort>> single(final char character) {
    return Regexes.literal(z3, String.valueOf(character));
  }
}
