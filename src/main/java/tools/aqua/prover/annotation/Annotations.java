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

package tools.aqua.prover.annotation;

import static java.util.Objects.requireNonNull;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.SeqSort;
import com.microsoft.z3.Sort;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import tools.aqua.prover.UnsupportedConstructException;
import tools.aqua.prover.ast.Expression;
import tools.aqua.prover.value.DictValue;
import tools.aqua.prover.value.FixedTupleValue;
import tools.aqua.prover.value.FloatValue;
import tools.aqua.prover.value.FunctionValue;
import tools.aqua.prover.value.Value;
import tools.aqua.prover.value.Values;
import tools.aqua.prover.value.VarTupleValue;

/**
 * Resolves type annotations to solver sorts and declares typed symbols.
 *
 * <p>Understood annotations are {@code bool}, {@code int}, {@code float}, {@code str}, {@code
 * list[T]}, {@code set[T]}, {@code dict[K, V]}, {@code tuple[T, ...]}, {@code tuple[A, B, ...]}
 * with a fixed number of elements, and {@code Callable[[A, ...], R]}. The capitalized {@code
 * typing} spellings, qualified names and string forward references are accepted as well.
 */
public final class Annotations {

  private final Context z3;

  /**
   * Create a new resolver.
   *
   * @param z3 the solver context sorts are created in.
   */
  public Annotations(final Context z3) {
    this.z3 = requireNonNull(z3);
  }

  /**
   * Get the type name an annotation refers to, without its module qualification.
   *
   * @param annotation the annotation or the subscripted part of it.
   * @return the name, if the annotation is a plain or qualified name.
   */
  private static Optional<String> typeName(final Expression annotation) {
    if (annotation instanceof Expression.Name) {
      return Optional.of(((Expression.Name) annotation).getId());
    }
    if (annotation instanceof Expression.Attribute) {
      return ((Expression.Attribute) annotation)
          .getDottedName()
          .map(name -> name.substring(name.lastIndexOf('.') + 1));
    }
    if (annotation instanceof Expression.Constant
        && ((Expression.Constant) annotation).getValue() instanceof String) {
      final String reference = ((String) ((Expression.Constant) annotation).getValue()).trim();
      if (reference.matches("[A-Za-z_][A-Za-z_0-9.]*")) {
        return Optional.of(reference.substring(reference.lastIndexOf('.') + 1));
      }
    }
    return Optional.empty();
  }

  /** Get the type arguments of a subscripted annotation. */
  private static List<Expression> typeArguments(final Expression.Subscript annotation) {
    final Expression index = annotation.getIndex();
    if (index instanceof Expression.TupleLiteral) {
      return ((Expression.TupleLiteral) index).getElements();
    }
    return List.of(index);
  }

  private static boolean isEllipsis(final Expression expression) {
    return expression instanceof Expression.Constant
        && ((Expression.Constant) expression).getValue() == Expression.Constant.ELLIPSIS;
  }

  /**
   * Check whether an annotation denotes a tuple of variable length, {@code tuple[T, ...]}.
   *
   * @param annotation the annotation.
   * @return {@code true} for variable-length tuples.
   */
  public static boolean isVariableTuple(final Expression annotation) {
    if (!(annotation instanceof Expression.Subscript)) {
      return false;
    }
    final Expression.Subscript subscript = (Expression.Subscript) annotation;
    final List<Expression> arguments = typeArguments(subscript);
    return typeName(subscript.getValue()).map(Annotations::isTupleName).orElse(false)
        && arguments.size() == 2
        && isEllipsis(arguments.get(1));
  }

  private static boolean isTupleName(final String name) {
    return "tuple".equals(name) || "Tuple".equals(name);
  }

  /**
   * Resolve the solver sort an annotation denotes.
   *
   * @param annotation the annotation.
   * @return the sort, or empty if the annotation has no single solver sort.
   */
  public Optional<Sort> resolveSort(final Expression annotation) {
    if (annotation instanceof Expression.Subscript) {
      return resolveGeneric((Expression.Subscript) annotation);
    }
    return typeName(annotation).flatMap(this::resolveSimple);
  }

  private Optional<Sort> resolveSimple(final String name) {
    switch (name) {
      case "bool":
        return Optional.of(z3.getBoolSort());
      case "int":
        return Optional.of(z3.getIntSort());
      case "float":
        return Optional.of(FloatValue.sort(z3));
      case "str":
        return Optional.of(z3.mkStringSort());
      default:
        return Optional.empty();
    }
  }

  private Optional<Sort> resolveGeneric(final Expression.Subscript annotation) {
    final Optional<String> name = typeName(annotation.getValue());
    if (name.isEmpty()) {
      return Optional.empty();
    }
    final List<Expression> arguments = typeArguments(annotation);
    switch (name.get()) {
      case "list":
      case "List":
      case "Sequence":
        if (arguments.size() != 1) {
          return Optional.empty();
        }
        return resolveSort(arguments.get(0)).map(z3::mkSeqSort);
      case "set":
      case "Set":
      case "frozenset":
      case "FrozenSet":
        if (arguments.size() != 1) {
          return Optional.empty();
        }
        return resolveSort(arguments.get(0)).map(z3::mkSetSort);
      case "dict":
      case "Dict":
      case "Mapping":
        {
          if (arguments.size() != 2) {
            return Optional.empty();
          }
          final Optional<Sort> key = resolveSort(arguments.get(0));
          final Optional<Sort> value = resolveSort(arguments.get(1));
          if (key.isEmpty() || value.isEmpty()) {
            return Optional.empty();
          }
          return Optional.of(DictValue.sort(z3, key.get(), value.get()));
        }
      case "tuple":
      case "Tuple":
        if (!isVariableTuple(annotation)) {
          return Optional.empty();
        }
        return resolveSort(arguments.get(0)).map(z3::mkSeqSort);
      default:
        return Optional.empty();
    }
  }

  /**
   * Declare a symbol of the annotated type.
   *
   * @param name the symbol name.
   * @param annotation the annotation.
   * @return the value of the new symbol.
   * @throws UnsupportedConstructException if the annotation is not understood.
   */
  public Value declare(final String name, final Expression annotation) {
    if (annotation instanceof Expression.Subscript) {
      final Expression.Subscript subscript = (Expression.Subscript) annotation;
      final Optional<String> generic = typeName(subscript.getValue());
      if (generic.filter(Annotations::isTupleName).isPresent() && !isVariableTuple(annotation)) {
        final List<Value> elements = new ArrayList<>();
        final List<Expression> arguments = typeArguments(subscript);
        for (int i = 0; i < arguments.size(); i++) {
          elements.add(declare(name + "_" + i, arguments.get(i)));
        }
        return new FixedTupleValue(z3, elements);
      }
      if (generic.filter("Callable"::equals).isPresent()) {
        return declareFunction(name, typeArguments(subscript));
      }
    }
    final Sort sort =
        resolveSort(annotation)
            .orElseThrow(() -> new UnsupportedConstructException("type annotation", name));
    return wrapAs(annotation, z3.mkConst(name, sort));
  }

  private Value declareFunction(final String name, final List<Expression> arguments) {
    if (arguments.size() != 2 || !(arguments.get(0) instanceof Expression.ListLiteral)) {
      throw new UnsupportedConstructException("Callable annotation", name);
    }
    final List<Expression> parameters = ((Expression.ListLiteral) arguments.get(0)).getElements();
    final Sort[] domain = new Sort[parameters.size()];
    for (int i = 0; i < domain.length; i++) {
      domain[i] =
          resolveSort(parameters.get(i))
              .orElseThrow(() -> new UnsupportedConstructException("Callable parameter", name));
    }
    final Expression returns = arguments.get(1);
    final Sort range =
        resolveSort(returns)
            .orElseThrow(() -> new UnsupportedConstructException("Callable result", name));
    final FuncDecl<?> decl = z3.mkFuncDecl(name, domain, range);
    return new FunctionValue(z3, decl, expr -> wrapAs(returns, expr));
  }

  /**
   * Tag an expression with the variant its annotation calls for. This only differs from {@link
   * Values#wrap(Context, Expr)} for variable-length tuples.
   *
   * @param annotation the annotation.
   * @param expr the expression.
   * @return the tagged value.
   */
  @SuppressWarnings("unchecked")
  public Value wrapAs(final Expression annotation, final Expr<?> expr) {
    if (isVariableTuple(annotation)) {
      return new VarTupleValue(z3, (Expr<SeqSort<Sort>>) expr);
    }
    return Values.wrap(z3, expr);
  }
}
