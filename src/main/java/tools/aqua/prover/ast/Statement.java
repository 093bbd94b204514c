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
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A statement node as delivered by the front end. Like {@link Expression}, the set of kinds is
 * closed and matched over with a {@link Visitor}.
 */
public abstract class Statement {

  /** Only the nested node kinds extend this class. */
  private Statement() {}

  /**
   * Dispatch to the visitor method for this node kind.
   *
   * @param visitor the visitor.
   * @param <R> the visitor's result type.
   * @return the visitor's result.
   */
  public abstract <R> R accept(Visitor<R> visitor);

  /**
   * Get a short description of this node kind for diagnostics.
   *
   * @return the kind name.
   */
  public String kind() {
    return getClass().getSimpleName();
  }

  /**
   * A visitor over all statement kinds.
   *
   * @param <R> the result type.
   */
  public interface Visitor<R> {
    R visitFunctionDef(FunctionDef node);

    R visitClassDef(ClassDef node);

    R visitAssert(Assert node);

    R visitExpressionStatement(ExpressionStatement node);

    R visitAssign(Assign node);

    R visitReturn(Return node);

    R visitIf(If node);

    R visitRaise(Raise node);

    R visitImport(Import node);

    R visitPass(Pass node);

    R visitGlobal(Global node);

    R visitUnknown(Unknown node);
  }

  private static <T> List<T> copy(final List<? extends T> list) {
    return unmodifiableList(new ArrayList<>(list));
  }

  /** A function definition. */
  public static final class FunctionDef extends Statement {
    private final String name;
    private final List<Parameter> parameters;
    private final Expression returns;
    private final List<Statement> body;

    /**
     * Create a new function definition.
     *
     * @param name the function name.
     * @param parameters the parameters in declaration order.
     * @param returns the return annotation, may be {@code null}.
     * @param body the body statements.
     */
    public FunctionDef(
        final String name,
        final List<Parameter> parameters,
        final Expression returns,
        final List<? extends Statement> body) {
      this.name = requireNonNull(name);
      this.parameters = copy(parameters);
      this.returns = returns;
      this.body = copy(body);
    }

    public String getName() {
      return name;
    }

    public List<Parameter> getParameters() {
      return parameters;
    }

    public Optional<Expression> getReturns() {
      return Optional.ofNullable(returns);
    }

    public List<Statement> getBody() {
      return body;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitFunctionDef(this);
    }
  }

  /** A class definition; only its name and bases matter to the prover. */
  public static final class ClassDef extends Statement {
    private final String name;
    private final List<Expression> bases;

    public ClassDef(final String name, final List<? extends Expression> bases) {
      this.name = requireNonNull(name);
      this.bases = copy(bases);
    }

    public String getName() {
      return name;
    }

    public List<Expression> getBases() {
      return bases;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitClassDef(this);
    }
  }

  /** An {@code assert test} statement. */
  public static final class Assert extends Statement {
    private final Expression test;

    public Assert(final Expression test) {
      this.test = requireNonNull(test);
    }

    public Expression getTest() {
      return test;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitAssert(this);
    }
  }

  /** An expression evaluated for its effects. */
  public static final class ExpressionStatement extends Statement {
    private final Expression value;

    public ExpressionStatement(final Expression value) {
      this.value = requireNonNull(value);
    }

    public Expression getValue() {
      return value;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitExpressionStatement(this);
    }
  }

  /** An assignment {@code t1 = t2 = ... = value}. */
  public static final class Assign extends Statement {
    private final List<Expression> targets;
    private final Expression value;

    public Assign(final List<? extends Expression> targets, final Expression value) {
      this.targets = copy(targets);
      this.value = requireNonNull(value);
    }

    public List<Expression> getTargets() {
      return targets;
    }

    public Expression getValue() {
      return value;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitAssign(this);
    }
  }

  /** A {@code return} statement; the value is absent for a bare {@code return}. */
  public static final class Return extends Statement {
    private final Expression value;

    public Return(final Expression value) {
      this.value = value;
    }

    public Optional<Expression> getValue() {
      return Optional.ofNullable(value);
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitReturn(this);
    }
  }

  /** An {@code if} statement; {@code elif} chains arrive as nested ifs in the else branch. */
  public static final class If extends Statement {
    private final Expression test;
    private final List<Statement> body;
    private final List<Statement> orElse;

    public If(
        final Expression test,
        final List<? extends Statement> body,
        final List<? extends Statement> orElse) {
      this.test = requireNonNull(test);
      this.body = copy(body);
      this.orElse = copy(orElse);
    }

    public Expression getTest() {
      return test;
    }

    public List<Statement> getBody() {
      return body;
    }

    public List<Statement> getOrElse() {
      return orElse;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitIf(this);
    }
  }

  /** A {@code raise exception from cause} statement; both parts are optional. */
  public static final class Raise extends Statement {
    private final Expression exception;
    private final Expression cause;

    public Raise(final Expression exception, final Expression cause) {
      this.exception = exception;
      this.cause = cause;
    }

    public Optional<Expression> getException() {
      return Optional.ofNullable(exception);
    }

    public Optional<Expression> getCause() {
      return Optional.ofNullable(cause);
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitRaise(this);
    }
  }

  /** An {@code import} or {@code from ... import} statement. */
  public static final class Import extends Statement {
    private final List<String> names;

    public Import(final List<String> names) {
      this.names = copy(names);
    }

    public List<String> getNames() {
      return names;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitImport(this);
    }
  }

  /** A {@code pass} statement. */
  public static final class Pass extends Statement {
    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitPass(this);
    }
  }

  /** A {@code global} declaration. */
  public static final class Global extends Statement {
    private final List<String> names;

    public Global(final List<String> names) {
      this.names = copy(names);
    }

    public List<String> getNames() {
      return names;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitGlobal(this);
    }
  }

  /** A statement kind known to the front end but not modeled here. */
  public static final class Unknown extends Statement {
    private final String kind;

    public Unknown(final String kind) {
      this.kind = requireNonNull(kind);
    }

    @Override
    public String kind() {
      return kind;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitUnknown(this);
    }
  }
}
