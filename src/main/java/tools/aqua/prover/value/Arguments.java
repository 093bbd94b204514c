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

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import tools.aqua.prover.UnsupportedConstructException;

/** The evaluated arguments of a call: positional values followed by keyword values. */
public final class Arguments {

  private final List<Value> positional;
  private final Map<String, Value> keywords;

  /**
   * Create a new argument list.
   *
   * @param positional the positional arguments.
   * @param keywords the keyword arguments.
   */
  public Arguments(
      final List<? extends Value> positional, final Map<String, ? extends Value> keywords) {
    this.positional = unmodifiableList(new ArrayList<>(positional));
    this.keywords = unmodifiableMap(new LinkedHashMap<>(keywords));
  }

  /**
   * Create an argument list without keywords.
   *
   * @param positional the positional arguments.
   * @return the arguments.
   */
  public static Arguments of(final Value... positional) {
    return new Arguments(List.of(positional), Map.of());
  }

  public List<Value> getPositional() {
    return positional;
  }

  public Map<String, Value> getKeywords() {
    return keywords;
  }

  /**
   * Get the total number of arguments.
   *
   * @return the number of positional and keyword arguments.
   */
  public int size() {
    return positional.size() + keywords.size();
  }

  /**
   * Look up an argument by position or, failing that, by keyword.
   *
   * @param index the position.
   * @param keyword the parameter name.
   * @return the argument, if passed.
   */
  public Optional<Value> get(final int index, final String keyword) {
    if (index < positional.size()) {
      return Optional.of(positional.get(index));
    }
    return Optional.ofNullable(keywords.get(keyword));
  }

  /**
   * Look up a mandatory argument.
   *
   * @param index the position.
   * @param keyword the parameter name.
   * @param function the called function, for diagnostics.
   * @return the argument.
   * @throws UnsupportedConstructException if the argument is missing.
   */
  public Value require(final int index, final String keyword, final String function) {
    return get(index, keyword)
        .orElseThrow(
            () -> new UnsupportedConstructException("missing argument " + keyword, function));
  }

  /**
   * Check the number of arguments and the keyword names.
   *
   * @param function the called function, for diagnostics.
   * @param parameters the parameter names in positional order; the first {@code required} of
   *     them must be passed.
   * @param required the number of mandatory parameters.
   * @return this argument list.
   * @throws UnsupportedConstructException if the arguments do not fit the parameters.
   */
  public Arguments check(final String function, final int required, final String... parameters) {
    if (positional.size() > parameters.length) {
      throw new UnsupportedConstructException("too many arguments", function);
    }
    for (final String keyword : keywords.keySet()) {
      final int index = List.of(parameters).indexOf(keyword);
      if (index < 0) {
        throw new UnsupportedConstructException("unexpected keyword argument " + keyword, function);
      }
      if (index < positional.size()) {
        throw new UnsupportedConstructException("duplicate argument " + keyword, function);
      }
    }
    for (int i = 0; i < required; i++) {
      require(i, parameters[i], function);
    }
    return this;
  }

  @Override
  public String toString() {
    return "Arguments(" + positional + ", " + keywords + ")";
  }
}
