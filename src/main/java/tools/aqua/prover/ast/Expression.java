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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An expression node as delivered by the front end. The set of node kinds is closed; evaluators
 * match over it with a {@link Visitor}. Kinds the front end knows but this model does not are
 * delivered as {@link Unknown}.
 */
public abstract class Expression {

  /** Only the nested node kinds extend this class. */
  private Expression() {}

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
   * A visitor over all expression kinds.
   *
   * @param <R> the result type.
   */
  public interface Visitor<R> {
    R visitConstant(Constant node);

    R visitName(Name node);

    R visitAttribute(Attribute node);

    R visitBinaryOperation(BinaryOperation node);

    R visitUnaryOperation(UnaryOperation node);

    R visitBooleanOperation(BooleanOperation node);

    R visitCompare(Compare node);

    R visitCall(Call node);

    R visitSubscript(Subscript node);

    R visitSlice(Slice node);

    R visitTupleLiteral(TupleLiteral node);

    R visitListLiteral(ListLiteral node);

    R visitSetLiteral(SetLiteral node);

    R visitDictLiteral(DictLiteral node);

    R visitIfExpression(IfExpression node);

    R visitListComprehension(ListComprehension node);

    R visitUnknown(Unknown node);
  }

  /** Binary operators. */
  public enum BinaryOperator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    TRUE_DIVIDE("/"),
    FLOOR_DIVIDE("//"),
    MODULO("%"),
    POWER("**"),
    BIT_OR("|"),
    BIT_AND("&"),
    BIT_XOR("^"),
    LEFT_SHIFT("<<"),
    RIGHT_SHIFT(">>"),
    MATRIX_MULTIPLY("@");

    /** The operator's source spelling. */
    public final String symbol;

    BinaryOperator(final String symbol) {
      this.symbol = symbol;
    }
  }

  /** Unary operators. */
  public enum UnaryOperator {
    NOT("not"),
    NEGATE("-"),
    POSITIVE("+"),
    INVERT("~");

    /** The operator's source spelling. */
    public final String symbol;

    UnaryOperator(final String symbol) {
      this.symbol = symbol;
    }
  }

  /** Short-circuiting boolean operators. */
  public enum BooleanOperator {
    AND,
    OR
  }

  /** Comparison operators. */
  public enum CompareOperator {
    EQUAL("=="),
    NOT_EQUAL("!="),
    LESS("<"),
    LESS_OR_EQUAL("<="),
    GREATER(">"),
    GREATER_OR_EQUAL(">="),
    IN("in"),
    NOT_IN("not in"),
    IS("is"),
    IS_NOT("is not");

    /** The operator's source spelling. */
    public final String symbol;

    CompareOperator(final String symbol) {
      this.symbol = symbol;
    }
  }

  private static <T> List<T> copy(final List<? extends T> list) {
    return unmodifiableList(new ArrayList<>(list));
  }

  /**
   * A literal. The value is a {@link Boolean}, a {@link BigInteger}, a {@link Double}, a {@link
   * String}, or the {@link #ELLIPSIS} marker.
   */
  public static final class Constant extends Expression {

    /** The value of the {@code ...} literal. */
    public static final Object ELLIPSIS =
        new Object() {
          @Override
          public String toString() {
            return "Ellipsis";
          }
        };

    private final Object value;

    /**
     * Create a new literal.
     *
     * @param value the literal value, normalized so that integral numbers are {@link BigInteger}.
     */
    public Constant(final Object value) {
      requireNonNull(value);
      if (value instanceof Integer || value instanceof Long || value instanceof Short) {
        this.value = BigInteger.valueOf(((Number) value).longValue());
      } else if (value instanceof Float) {
        this.value = ((Float) value).doubleValue();
      } else {
        this.value = value;
      }
    }

    public Object getValue() {
      return value;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitConstant(this);
    }
  }

  /** A reference to a variable, function, class or module by its simple name. */
  public static final class Name extends Expression {
    private final String id;

    public Name(final String id) {
      this.id = requireNonNull(id);
    }

    public String getId() {
      return id;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitName(this);
    }
  }

  /** An attribute access {@code value.attribute}. */
  public static final class Attribute extends Expression {
    private final Expression value;
    private final String attribute;

    public Attribute(final Expression value, final String attribute) {
      this.value = requireNonNull(value);
      this.attribute = requireNonNull(attribute);
    }

    public Expression getValue() {
      return value;
    }

    public String getAttribute() {
      return attribute;
    }

    /**
     * Get the dotted path of this attribute if it is a chain of names, e.g. {@code math.isnan}.
     *
     * @return the dotted path, or nothing if the chain contains other node kinds.
     */
    public Optional<String> getDottedName() {
      if (value instanceof Name) {
        return Optional.of(((Name) value).getId() + "." + attribute);
      }
      if (value instanceof Attribute) {
        return ((Attribute) value).getDottedName().map(prefix -> prefix + "." + attribute);
      }
      return Optional.empty();
    }

    /**
     * Get the leftmost name of an attribute chain.
     *
     * @return the root name, or nothing if the chain does not start with a name.
     */
    public Optional<String> getRootName() {
      if (value instanceof Name) {
        return Optional.of(((Name) value).getId());
      }
      if (value instanceof Attribute) {
        return ((Attribute) value).getRootName();
      }
      return Optional.empty();
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitAttribute(this);
    }
  }

  /** A binary arithmetic or bitwise operation. */
  public static final class BinaryOperation extends Expression {
    private final BinaryOperator operator;
    private final Expression left;
    private final Expression right;

    public BinaryOperation(
        final Expression left, final BinaryOperator operator, final Expression right) {
      this.operator = requireNonNull(operator);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    public BinaryOperator getOperator() {
      return operator;
    }

    public Expression getLeft() {
      return left;
    }

    public Expression getRight() {
      return right;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitBinaryOperation(this);
    }
  }

  /** A unary operation. */
  public static final class UnaryOperation extends Expression {
    private final UnaryOperator operator;
    private final Expression operand;

    public UnaryOperation(final UnaryOperator operator, final Expression operand) {
      this.operator = requireNonNull(operator);
      this.operand = requireNonNull(operand);
    }

    public UnaryOperator getOperator() {
      return operator;
    }

    public Expression getOperand() {
      return operand;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitUnaryOperation(this);
    }
  }

  /** A chain of {@code and} or {@code or} over two or more operands. */
  public static final class BooleanOperation extends Expression {
    private final BooleanOperator operator;
    private final List<Expression> values;

    public BooleanOperation(
        final BooleanOperator operator, final List<? extends Expression> values) {
      if (values.size() < 2) {
        throw new IllegalArgumentException("boolean operation needs at least two operands");
      }
      this.operator = requireNonNull(operator);
      this.values = copy(values);
    }

    public BooleanOperator getOperator() {
      return operator;
    }

    public List<Expression> getValues() {
      return values;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitBooleanOperation(this);
    }
  }

  /** A possibly chained comparison {@code left op1 c1 op2 c2 ...}. */
  public static final class Compare extends Expression {
    private final Expression left;
    private final List<CompareOperator> operators;
    private final List<Expression> comparators;

    public Compare(
        final Expression left,
        final List<CompareOperator> operators,
        final List<? extends Expression> comparators) {
      if (operators.isEmpty() || operators.size() != comparators.size()) {
        throw new IllegalArgumentException("each comparison operator needs one comparator");
      }
      this.left = requireNonNull(left);
      this.operators = copy(operators);
      this.comparators = copy(comparators);
    }

    public Expression getLeft() {
      return left;
    }

    public List<CompareOperator> getOperators() {
      return operators;
    }

    public List<Expression> getComparators() {
      return comparators;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitCompare(this);
    }
  }

  /** A keyword argument {@code name=value} of a call. */
  public static final class Keyword {
    private final String name;
    private final Expression value;

    public Keyword(final String name, final Expression value) {
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
    }

    public String getName() {
      return name;
    }

    public Expression getValue() {
      return value;
    }
  }

  /**
   * A call. The front end may attach the fully-qualified name of the called definition, e.g.
   * {@code random.Random.randint} for {@code random.randint(...)}.
   */
  public static final class Call extends Expression {
    private final Expression function;
    private final List<Expression> arguments;
    private final List<Keyword> keywords;
    private final String target;

    public Call(
        final Expression function,
        final List<? extends Expression> arguments,
        final List<Keyword> keywords,
        final String target) {
      this.function = requireNonNull(function);
      this.arguments = copy(arguments);
      this.keywords = copy(keywords);
      this.target = target;
    }

    public Expression getFunction() {
      return function;
    }

    public List<Expression> getArguments() {
      return arguments;
    }

    public List<Keyword> getKeywords() {
      return keywords;
    }

    /**
     * Get the resolved fully-qualified name of the call target, if the front end supplied one.
     *
     * @return the qualified target name.
     */
    public Optional<String> getTarget() {
      return Optional.ofNullable(target);
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitCall(this);
    }
  }

  /** An index or slice access {@code value[index]}. */
  public static final class Subscript extends Expression {
    private final Expression value;
    private final Expression index;

    public Subscript(final Expression value, final Expression index) {
      this.value = requireNonNull(value);
      this.index = requireNonNull(index);
    }

    public Expression getValue() {
      return value;
    }

    /**
     * Get the index expression; a {@link Slice} for slicing, a {@link TupleLiteral} for
     * multi-argument subscripts in annotations.
     *
     * @return the index.
     */
    public Expression getIndex() {
      return index;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitSubscript(this);
    }
  }

  /** A slice {@code lower:upper:step}; every part is optional. */
  public static final class Slice extends Expression {
    private final Expression lower;
    private final Expression upper;
    private final Expression step;

    public Slice(final Expression lower, final Expression upper, final Expression step) {
      this.lower = lower;
      this.upper = upper;
      this.step = step;
    }

    public Optional<Expression> getLower() {
      return Optional.ofNullable(lower);
    }

    public Optional<Expression> getUpper() {
      return Optional.ofNullable(upper);
    }

    public Optional<Expression> getStep() {
      return Optional.ofNullable(step);
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitSlice(this);
    }
  }

  /** A tuple display {@code (a, b)}. */
  public static final class TupleLiteral extends Expression {
    private final List<Expression> elements;

    public TupleLiteral(final List<? extends Expression> elements) {
      this.elements = copy(elements);
    }

    public List<Expression> getElements() {
      return elements;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitTupleLiteral(this);
    }
  }

  /** A list display {@code [a, b]}. */
  public static final class ListLiteral extends Expression {
    private final List<Expression> elements;

    public ListLiteral(final List<? extends Expression> elements) {
      this.elements = copy(elements);
    }

    public List<Expression> getElements() {
      return elements;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitListLiteral(this);
    }
  }

  /** A set display {@code {a, b}}. */
  public static final class SetLiteral extends Expression {
    private final List<Expression> elements;

    public SetLiteral(final List<? extends Expression> elements) {
      this.elements = copy(elements);
    }

    public List<Expression> getElements() {
      return elements;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitSetLiteral(this);
    }
  }

  /** A dict display {@code {k1: v1, k2: v2}}. */
  public static final class DictLiteral extends Expression {
    private final List<Expression> keys;
    private final List<Expression> values;

    public DictLiteral(
        final List<? extends Expression> keys, final List<? extends Expression> values) {
      if (keys.size() != values.size()) {
        throw new IllegalArgumentException("each dict key needs one value");
      }
      this.keys = copy(keys);
      this.values = copy(values);
    }

    public List<Expression> getKeys() {
      return keys;
    }

    public List<Expression> getValues() {
      return values;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitDictLiteral(this);
    }
  }

  /** A conditional expression {@code body if test else orElse}. */
  public static final class IfExpression extends Expression {
    private final Expression test;
    private final Expression body;
    private final Expression orElse;

    public IfExpression(final Expression test, final Expression body, final Expression orElse) {
      this.test = requireNonNull(test);
      this.body = requireNonNull(body);
      this.orElse = requireNonNull(orElse);
    }

    public Expression getTest() {
      return test;
    }

    public Expression getBody() {
      return body;
    }

    public Expression getOrElse() {
      return orElse;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitIfExpression(this);
    }
  }

  /** A single-generator list comprehension {@code [element for target in iterable if ...]}. */
  public static final class ListComprehension extends Expression {
    private final Expression element;
    private final String target;
    private final Expression iterable;
    private final List<Expression> conditions;

    public ListComprehension(
        final Expression element,
        final String target,
        final Expression iterable,
        final List<? extends Expression> conditions) {
      this.element = requireNonNull(element);
      this.target = requireNonNull(target);
      this.iterable = requireNonNull(iterable);
      this.conditions = copy(conditions);
    }

    public Expression getElement() {
      return element;
    }

    public String getTarget() {
      return target;
    }

    public Expression getIterable() {
      return iterable;
    }

    public List<Expression> getConditions() {
      return conditions;
    }

    @Override
    public <R> R accept(final Visitor<R> visitor) {
      return visitor.visitListComprehension(this);
    }
  }

  /** An expression kind known to the front end but not modeled here. */
  public static final class Unknown extends Expression {
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
