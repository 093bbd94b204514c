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

package tools.aqua.prover;

import static java.util.Arrays.asList;
import static java.util.Collections.emptyList;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static tools.aqua.prover.Snippets.assertion;
import static tools.aqua.prover.Snippets.assign;
import static tools.aqua.prover.Snippets.attribute;
import static tools.aqua.prover.Snippets.binary;
import static tools.aqua.prover.Snippets.block;
import static tools.aqua.prover.Snippets.call;
import static tools.aqua.prover.Snippets.compare;
import static tools.aqua.prover.Snippets.constant;
import static tools.aqua.prover.Snippets.function;
import static tools.aqua.prover.Snippets.generic;
import static tools.aqua.prover.Snippets.ifThen;
import static tools.aqua.prover.Snippets.module;
import static tools.aqua.prover.Snippets.name;
import static tools.aqua.prover.Snippets.parameter;
import static tools.aqua.prover.Snippets.raise;
import static tools.aqua.prover.Snippets.resolvedCall;
import static tools.aqua.prover.Snippets.returns;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import tools.aqua.prover.ast.Expression;
import tools.aqua.prover.ast.Expression.BinaryOperator;
import tools.aqua.prover.ast.Expression.CompareOperator;
import tools.aqua.prover.ast.Module;
import tools.aqua.prover.ast.Parameter;
import tools.aqua.prover.ast.Statement;

/** Test proving functions against their contracts end to end. */
class ProverTest {

  private final Prover prover = new Prover(ProverConfig.builder().timeout(20_000).build());

  private static Expression result() {
    return name(Prover.RESULT);
  }

  /** A postcondition that holds on every return is proved. */
  @Test
  void testProved() {
    final Module module =
        module(
            function(
                "twice",
                asList(parameter("x", "int")),
                name("int"),
                returns(binary(name("x"), BinaryOperator.ADD, name("x")))));
    final Contract contract =
        Contract.builder()
            .post(
                compare(
                    result(),
                    CompareOperator.EQUAL,
                    binary(constant(2), BinaryOperator.MULTIPLY, name("x"))))
            .build();

    final Theorem theorem = prover.prove(module, "twice", contract);

    assertThat(theorem.getConclusion()).isEqualTo(Conclusion.OK);
    assertThat(theorem.getFunctionName()).isEqualTo("twice");
    assertThat(theorem.getCounterexample()).isEmpty();
  }

  /** A failing assertion yields a counterexample over the parameters. */
  @Test
  void testRefuted() {
    final Module module =
        module(
            function(
                "check",
                asList(parameter("x", "int")),
                null,
                assertion(
                    compare(
                        binary(name("x"), BinaryOperator.MULTIPLY, constant(2)),
                        CompareOperator.NOT_EQUAL,
                        constant(14)))));

    final Theorem theorem = prover.prove(module, "check", Contract.none());

    assertThat(theorem.getConclusion()).isEqualTo(Conclusion.FAIL);
    assertThat(theorem.getCounterexample()).containsEntry("x", "7");
  }

  /** Preconditions restrict the inputs considered. */
  @Test
  void testPrecondition() {
    final Module module =
        module(
            function(
                "positive",
                asList(parameter("x", "int")),
                name("int"),
                assertion(compare(name("x"), CompareOperator.GREATER, constant(0))),
                returns(name("x"))));

    assertThat(prover.prove(module, "positive", Contract.none()).getConclusion())
        .isEqualTo(Conclusion.FAIL);
    assertThat(
            prover
                .prove(
                    module,
                    "positive",
                    Contract.builder()
                        .pre(compare(name("x"), CompareOperator.GREATER_OR_EQUAL, constant(1)))
                        .build())
                .getConclusion())
        .isEqualTo(Conclusion.OK);
  }

  /** Implicit exceptions fail the proof unless the contract allows them or one of their bases. */
  @Test
  void testImplicitException() {
    final Module module =
        module(
            function(
                "divide",
                asList(parameter("x", "int"), parameter("y", "int")),
                name("int"),
                returns(binary(name("x"), BinaryOperator.FLOOR_DIVIDE, name("y")))));

    final Theorem unguarded = prover.prove(module, "divide", Contract.none());
    assertThat(unguarded.getConclusion()).isEqualTo(Conclusion.FAIL);
    assertThat(unguarded.getCounterexample()).containsEntry("y", "0");

    assertThat(
            prover
                .prove(module, "divide", Contract.builder().raises("ArithmeticError").build())
                .getConclusion())
        .isEqualTo(Conclusion.OK);
    assertThat(
            prover
                .prove(
                    module,
                    "divide",
                    Contract.builder()
                        .pre(compare(name("y"), CompareOperator.NOT_EQUAL, constant(0)))
                        .build())
                .getConclusion())
        .isEqualTo(Conclusion.OK);
  }

  /** Explicitly raised exceptions end their path before the postcondition applies. */
  @Test
  void testRaise() {
    final Module module =
        module(
            function(
                "validated",
                asList(parameter("x", "int")),
                name("int"),
                ifThen(
                    compare(name("x"), CompareOperator.LESS, constant(0)),
                    block(raise("ValueError")),
                    block()),
                returns(name("x"))));
    final Contract.Builder contract =
        Contract.builder()
            .post(compare(result(), CompareOperator.GREATER_OR_EQUAL, constant(0)));

    assertThat(prover.prove(module, "validated", contract.build()).getConclusion())
        .isEqualTo(Conclusion.FAIL);
    final Contract allowing = contract.raises("ValueError").build();
    assertThat(prover.prove(module, "validated", allowing).getConclusion())
        .isEqualTo(Conclusion.OK);
  }

  /** Helper functions are inlined and library calls constrain their results. */
  @Test
  void testCalls() {
    final Module module =
        module(
            function(
                "increment",
                asList(parameter("n", "int")),
                name("int"),
                returns(binary(name("n"), BinaryOperator.ADD, constant(1)))),
            function(
                "roll",
                emptyList(),
                name("int"),
                returns(
                    call(
                        "increment",
                        call(attribute(name("random"), "randint"), constant(1), constant(6))))));
    final Contract contract =
        Contract.builder()
            .post(
                new Expression.Compare(
                    constant(2),
                    asList(CompareOperator.LESS_OR_EQUAL, CompareOperator.LESS_OR_EQUAL),
                    asList(result(), constant(7))))
            .build();

    assertThat(prover.prove(module, "roll", contract).getConclusion()).isEqualTo(Conclusion.OK);
  }

  /** Strings are analyzed through the sequence theory. */
  @Test
  void testStrings() {
    final Module module =
        module(
            function(
                "greet",
                asList(parameter("who", "str")),
                name("str"),
                returns(binary(constant("hi "), BinaryOperator.ADD, name("who")))));
    final Expression length = call("len", result());

    assertThat(
            prover
                .prove(
                    module,
                    "greet",
                    Contract.builder()
                        .post(compare(length, CompareOperator.GREATER_OR_EQUAL, constant(3)))
                        .build())
                .getConclusion())
        .isEqualTo(Conclusion.OK);
    assertThat(
            prover
                .prove(
                    module,
                    "greet",
                    Contract.builder()
                        .post(compare(length, CompareOperator.GREATER, constant(3)))
                        .build())
                .getConclusion())
        .isEqualTo(Conclusion.FAIL);
  }

  /** Recursive functions are analyzed with a summary of the recursive call. */
  @Test
  void testRecursion() {
    final Module module =
        module(
            function(
                "depth",
                asList(parameter("n", "int")),
                name("int"),
                ifThen(
                    compare(name("n"), CompareOperator.LESS_OR_EQUAL, constant(0)),
                    block(returns(constant(0))),
                    block()),
                returns(
                    binary(
                        constant(1),
                        BinaryOperator.ADD,
                        call("depth", binary(name("n"), BinaryOperator.SUBTRACT, constant(1)))))));

    final Theorem theorem =
        prover.prove(
            module,
            "depth",
            Contract.builder()
                .post(
                    new Expression.BooleanOperation(
                        Expression.BooleanOperator.OR,
                        asList(
                            compare(name("n"), CompareOperator.GREATER, constant(0)),
                            compare(result(), CompareOperator.EQUAL, constant(0)))))
                .build());

    assertThat(theorem.getConclusion()).isEqualTo(Conclusion.OK);
  }

  /** The allowed exceptions are matched against the raised class and its bases. */
  @Test
  void testRaisesContract() {
    final Module module =
        module(function("reject", asList(parameter("x", "int")), null, raise("ValueError")));

    assertThat(
            prover
                .prove(module, "reject", Contract.builder().raises("ValueError").build())
                .getConclusion())
        .isEqualTo(Conclusion.OK);
    assertThat(
            prover
                .prove(module, "reject", Contract.builder().raises("ZeroDivisionError").build())
                .getConclusion())
        .isEqualTo(Conclusion.FAIL);
  }

  /** Assertions over constants are decided by the solver. */
  @Test
  void testConstantAssertion() {
    final Module module =
        module(
            function(
                "four",
                emptyList(),
                null,
                assertion(
                    compare(call("len", constant("abcd")), CompareOperator.EQUAL, constant(4)))),
            function(
                "five",
                emptyList(),
                null,
                assertion(
                    compare(call("len", constant("abcd")), CompareOperator.EQUAL, constant(5)))));

    assertThat(prover.proveAll(module, Map.of()))
        .extracting(Theorem::getConclusion)
        .containsExactly(Conclusion.OK, Conclusion.FAIL);
  }

  /** Both arms of a conditional assignment are considered. */
  @Test
  void testMergedAssignment() {
    final Module module =
        module(
            function(
                "pick",
                asList(parameter("x", "bool")),
                null,
                ifThen(name("x"), block(assign("y", constant(1))), block(assign("y", constant(2)))),
                assertion(
                    new Expression.BooleanOperation(
                        Expression.BooleanOperator.OR,
                        asList(
                            compare(name("y"), CompareOperator.EQUAL, constant(1)),
                            compare(name("y"), CompareOperator.EQUAL, constant(2)))))));

    assertThat(prover.prove(module, "pick", Contract.none()).getConclusion())
        .isEqualTo(Conclusion.OK);
  }

  /** The bounds of a random integer are known after the call. */
  @Test
  void testRandomBounds() {
    final Module module =
        module(
            function(
                "draw",
                asList(parameter("a", "int"), parameter("b", "int")),
                null,
                assign(
                    "r",
                    resolvedCall(
                        "random.Random.randint",
                        attribute(name("rng"), "randint"),
                        name("a"),
                        name("b"))),
                assertion(
                    new Expression.BooleanOperation(
                        Expression.BooleanOperator.AND,
                        asList(
                            compare(name("r"), CompareOperator.GREATER_OR_EQUAL, name("a")),
                            compare(name("r"), CompareOperator.LESS_OR_EQUAL, name("b")))))));

    assertThat(prover.prove(module, "draw", Contract.none()).getConclusion())
        .isEqualTo(Conclusion.OK);
  }

  /** Empty random bounds after a raise do not hide the raise. */
  @Test
  void testRandomBoundsAfterRaise() {
    final Module module =
        module(
            function(
                "draw",
                asList(parameter("x", "bool")),
                name("int"),
                ifThen(name("x"), block(raise("ValueError")), block()),
                returns(
                    resolvedCall(
                        "random.Random.randint",
                        attribute(name("rng"), "randint"),
                        constant(1),
                        constant(0)))));

    final Theorem theorem = prover.prove(module, "draw", Contract.none());

    assertThat(theorem.getConclusion()).isEqualTo(Conclusion.FAIL);
    assertThat(theorem.getCounterexample()).containsEntry("x", "true");
  }

  /** Choosing from a list that was checked to be non-empty still raises for the empty one. */
  @Test
  void testChoiceAfterRaise() {
    final Module module =
        module(
            function(
                "pick",
                asList(parameter("xs", generic("list", name("int")))),
                name("int"),
                ifThen(
                    compare(call("len", name("xs")), CompareOperator.EQUAL, constant(0)),
                    block(raise("ValueError")),
                    block()),
                returns(
                    resolvedCall(
                        "random.Random.choice", attribute(name("rng"), "choice"), name("xs")))));

    assertThat(prover.prove(module, "pick", Contract.none()).getConclusion())
        .isEqualTo(Conclusion.FAIL);
    assertThat(
            prover
                .prove(module, "pick", Contract.builder().raises("ValueError").build())
                .getConclusion())
        .isEqualTo(Conclusion.OK);
  }

  /** Functions outside the supported subset are skipped with a reason. */
  @Test
  void testSkipped() {
    final Module module =
        module(
            function(
                "untyped",
                asList(new Parameter("x", null, null)),
                null,
                returns(name("x"))));

    final Theorem theorem = prover.prove(module, "untyped", Contract.none());

    assertThat(theorem.getConclusion()).isEqualTo(Conclusion.SKIP);
    assertThat(theorem.getReason()).contains("parameter without annotation: x");
    assertThatThrownBy(() -> prover.prove(module, "missing", Contract.none()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  /** Every function of a module is proved on its own. */
  @Test
  void testProveAll() {
    final Module module =
        module(
            function(
                "unsupported",
                asList(parameter("x", "int")),
                null,
                new Statement.Unknown("While")),
            function(
                "fine",
                asList(parameter("x", "int")),
                null,
                assertion(compare(name("x"), CompareOperator.EQUAL, name("x")))),
            function(
                "broken",
                asList(parameter("x", "bool")),
                null,
                assertion(name("x"))));

    final List<Theorem> theorems = prover.proveAll(module, Map.of());

    assertThat(theorems)
        .extracting(Theorem::getFunctionName)
        .containsExactly("unsupported", "fine", "broken");
    assertThat(theorems)
        .extracting(Theorem::getConclusion)
        .containsExactly(Conclusion.SKIP, Conclusion.OK, Conclusion.FAIL);
    assertThat(theorems.get(2).getCounterexample()).containsEntry("x", "false");
  }
}
