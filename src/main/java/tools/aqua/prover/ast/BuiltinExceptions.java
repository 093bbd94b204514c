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

package tools.aqua.prover.ast;

import static java.util.Collections.emptyList;
import static java.util.Collections.singletonList;
import static java.util.Collections.unmodifiableMap;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The built-in exception hierarchy of the subject language, exposed as synthetic class definitions
 * so that base-class walking treats built-in and user-defined exceptions alike.
 */
final class BuiltinExceptions {

  /** Class name to the name of its single base class. */
  private static final Map<String, String> BASES;

  static {
    final Map<String, String> bases = new HashMap<>();
    bases.put("Exception", "BaseException");
    bases.put("GeneratorExit", "BaseException");
    bases.put("KeyboardInterrupt", "BaseException");
    bases.put("SystemExit", "BaseException");

    bases.put("ArithmeticError", "Exception");
    bases.put("AssertionError", "Exception");
    bases.put("AttributeError", "Exception");
    bases.put("BufferError", "Exception");
    bases.put("EOFError", "Exception");
    bases.put("ImportError", "Exception");
    bases.put("LookupError", "Exception");
    bases.put("MemoryError", "Exception");
    bases.put("NameError", "Exception");
    bases.put("OSError", "Exception");
    bases.put("RuntimeError", "Exception");
    bases.put("StopIteration", "Exception");
    bases.put("TypeError", "Exception");
    bases.put("ValueError", "Exception");

    bases.put("FloatingPointError", "ArithmeticError");
    bases.put("OverflowError", "ArithmeticError");
    bases.put("ZeroDivisionError", "ArithmeticError");

    bases.put("IndexError", "LookupError");
    bases.put("KeyError", "LookupError");

    bases.put("ModuleNotFoundError", "ImportError");
    bases.put("UnboundLocalError", "NameError");
    bases.put("NotImplementedError", "RuntimeError");
    bases.put("RecursionError", "RuntimeError");
    bases.put("UnicodeError", "ValueError");

    bases.put("FileExistsError", "OSError");
    bases.put("FileNotFoundError", "OSError");
    bases.put("PermissionError", "OSError");
    bases.put("TimeoutError", "OSError");
    BASES = unmodifiableMap(bases);
  }

  /** This class should not be constructed. */
  private BuiltinExceptions() {
    throw new AssertionError();
  }

  /**
   * Look up a built-in exception class.
   *
   * @param name the class name.
   * @return a synthetic definition with the class's base, or nothing for unknown names.
   */
  static Optional<Statement.ClassDef> lookup(final String name) {
    if ("BaseException".equals(name)) {
      return Optional.of(new Statement.ClassDef(name, emptyList()));
    }
    final String base = BASES.get(name);
    if (base == null) {
      return Optional.empty();
    }
    return Optional.of(
        new Statement.ClassDef(name, singletonList(new Expression.Name(base))));
  }
}
