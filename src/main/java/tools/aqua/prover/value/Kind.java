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

/** The variants of {@link Value}, one per subject-language type. */
public enum Kind {
  BOOL("bool"),
  INT("int"),
  FLOAT("float"),
  STR("str"),
  LIST("list"),
  FIXED_TUPLE("tuple"),
  VAR_TUPLE("tuple[...]"),
  SET("set"),
  DICT("dict"),
  FUNCTION("function"),
  PATTERN("re.Pattern");

  /** The subject-language type name. */
  private final String typeName;

  Kind(final String typeName) {
    this.typeName = typeName;
  }

  public String getTypeName() {
    return typeName;
  }

  /**
   * Check whether values of this kind take part in int/float promotion.
   *
   * @return {@code true} for bool, int and float.
   */
  public boolean isNumeric() {
    return this == BOOL || this == INT || this == FLOAT;
  }
}
