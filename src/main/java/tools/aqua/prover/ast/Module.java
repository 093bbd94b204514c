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

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A parsed source module. Besides holding the top-level statements, it answers the static
 * resolution questions the evaluator asks: which function a call refers to and which classes an
 * exception expression instantiates.
 */
public final class Module {

  /** The top-level statements in source order. */
  private final List<Statement> body;

  /** Top-level functions by name; later definitions replace earlier ones. */
  private final Map<String, Statement.FunctionDef> functions = new LinkedHashMap<>();

  /** Top-level classes by name. */
  private final Map<String, Statement.ClassDef> classes = new LinkedHashMap<>();

  /**
   * Create a module from its top-level statements.
   *
   * @param body the statements.
   */
  public Module(final List<? extends Statement> body) {
    this.body = unmodifiableList(new ArrayList<>(body));
    for (final Statement statement : this.body) {
      if (statement instanceof Statement.FunctionDef) {
        final Statement.FunctionDef function = (Statement.FunctionDef) statement;
        functions.put(function.getName(), function);
      } else if (statement instanceof Statement.ClassDef) {
        final Statement.ClassDef clazz = (Statement.ClassDef) statement;
        classes.put(clazz.getName(), clazz);
      }
    }
  }

  public List<Statement> getBody() {
    return body;
  }

  /**
   * Get all top-level functions in definition order.
   *
   * @return the functions by name.
   */
  public Map<String, Statement.FunctionDef> getFunctions() {
    return unmodifiableMap(functions);
  }

  /**
   * Resolve a top-level function.
   *
   * @param name the function name.
   * @return the definition, if any.
   */
  public Optional<Statement.FunctionDef> findFunction(final String name) {
    return Optional.ofNullable(functions.get(name));
  }

  /**
   * Resolve a class, looking at the module first and the built-in exceptions second.
   *
   * @param name the class name.
   * @return the definition, if any.
   */
  public Optional<Statement.ClassDef> findClass(final String name) {
    final Statement.ClassDef clazz = classes.get(name);
    if (clazz != null) {
      return Optional.of(clazz);
    }
    return BuiltinExceptions.lookup(name);
  }

  /**
   * Compute the names of all exception types an expression may denote: the referenced name itself
   * and every base class reachable from a resolvable class definition. Calls such as {@code
   * ValueError("message")} are resolved through their callee.
   *
   * @param exception the raised expression.
   * @return the exception names, in discovery order.
   */
  public Set<String> exceptionNames(final Expression exception) {
    final Set<String> names = new LinkedHashSet<>();
    collectBases(exception, names, new HashSet<>());
    return names;
  }

  /**
   * Compute the names of a class and all its bases.
   *
   * @param className the class name.
   * @return the class name followed by its bases.
   */
  public Set<String> exceptionNames(final String className) {
    return exceptionNames(new Expression.Name(className));
  }

  private void collectBases(
      final Expression node, final Set<String> names, final Set<String> visited) {
    Expression reference = node;
    if (reference instanceof Expression.Call) {
      reference = ((Expression.Call) reference).getFunction();
    }
    if (!(reference instanceof Expression.Name)) {
      return;
    }
    final String name = ((Expression.Name) reference).getId();
    names.add(name);
    if (!visited.add(name)) {
      return;
    }
    final Optional<Statement.ClassDef> definition = findClass(name);
    if (definition.isPresent()) {
      for (final Expression base : definition.get().getBases()) {
        collectBases(base, names, visited);
      }
    }
  }
}
