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
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Sort;
import java.util.function.Function;
import tools.aqua.prover.UnsupportedConstructException;
import tools.aqua.prover.context.ExecutionContext;

/**
 * A function whose behavior is unknown: an uninterpreted solver function. Applying it to equal
 * arguments yields equal results, and nothing else is known.
 */
public final class FunctionValue extends Value {

  private final FuncDecl<?> decl;

  /** Tags the results of applications. */
  private final Function<Expr<?>, Value> result;

  /**
   * Create a new function value whose results are wrapped by their sort.
   *
   * @param z3 the solver context.
   * @param decl the function symbol.
   */
  public FunctionValue(final Context z3, final FuncDecl<?> decl) {
    this(z3, decl, expr -> Values.wrap(z3, expr));
  }

  /**
   * Create a new function value.
   *
   * @param z3 the solver context.
   * @param decl the function symbol.
   * @param result the tagging of application results.
   */
  public FunctionValue(
      final Context z3, final FuncDecl<?> decl, final Function<Expr<?>, Value> result) {
    super(z3);
    this.decl = requireNonNull(decl);
    this.result = requireNonNull(result);
  }

  public FuncDecl<?> getDecl() {
    return decl;
  }

  @Override
  public Kind getKind() {
    return Kind.FUNCTION;
  }

  @Override
  public Expr<?> unwrap() {
    throw new UnsupportedConstructException("function as solver term", describe());
  }

  @Override
  public Sort getSort() {
    throw new UnsupportedConstructException("function as solver term", describe());
  }

  @Override
  Value rebuild(final Expr<?> expr) {
    throw new UnsupportedConstructException("function as solver term", describe());
  }

  @Override
  public Value ifThenElse(final BoolExpr condition, final Value orElse) {
    if (orElse.getKind() == Kind.FUNCTION && ((FunctionValue) orElse).decl.equals(decl)) {
      return this;
    }
    throw new UnsupportedConstructException("conditional merge of functions", describe());
  }

  @Override
  public String describe() {
    return "function " + decl.getName();
  }

  @Override
  public BoolValue asBool() {
    return BoolValue.of(z3, true);
  }

  @Override
  public BoolValue eq(final Value other) {
    if (other.getKind() != Kind.FUNCTION) {
      throw mismatch("==", other);
    }
    return BoolValue.of(z3, decl.equals(((FunctionValue) other).decl));
  }

  @Override
  public Value call(final ExecutionContext ctx, final Arguments arguments) {
    if (!arguments.getKeywords().isEmpty()) {
      throw new UnsupportedConstructException("keyword arguments", describe());
    }
    final Sort[] domain = decl.getDomain();
    if (arguments.getPositional().size() != domain.length) {
      throw new UnsupportedConstructException("wrong number of arguments", describe());
    }
    final Expr<?>[] operands = new Expr<?>[domain.length];
    for (int i = 0; i < domain.length; i++) {
      final Value argument = arguments.getPositional().get(i);
      operands[i] =
          Values.coerce(argument, domain[i]).orElseThrow(() -> mismatch("call", argument)).unwrap();
    }
    return result.apply(decl.apply(operands));
  }

  @Override
  public String toString() {
    return describe();
  }
}
