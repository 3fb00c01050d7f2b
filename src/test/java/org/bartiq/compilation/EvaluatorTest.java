/*
 * Copyright 2025 The Bartiq Authors
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


package org.bartiq.compilation;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.bartiq.compilation.CompilationError.ConstraintViolation;
import org.bartiq.routine.CompiledRoutine;
import org.bartiq.routine.PortDirection;
import org.bartiq.routine.ResourceType;
import org.bartiq.routine.Routine;
import org.bartiq.routine.Sequence;
import org.bartiq.symbolics.ComparisonResult;
import org.bartiq.symbolics.builtin.BuiltinEngine;
import org.bartiq.symbolics.builtin.Expr;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class EvaluatorTest {

  private static final BuiltinEngine ENGINE = BuiltinEngine.INSTANCE;

  private static double valueOf(Expr expr) {
    Number value = ENGINE.numericValue(expr);
    assertThat(value).isNotNull();
    return value.doubleValue();
  }

  @Test
  public void numericAssignment() {
    CompiledRoutine<Expr> compiled = Compiler.compile(CompilerTest.chain(), ENGINE);
    CompiledRoutine<Expr> evaluated =
        Evaluator.evaluate(compiled, ImmutableMap.of("N", ENGINE.number(3)), ENGINE);

    assertThat(evaluated.inputParams).isEmpty();
    assertThat(valueOf(evaluated.resourceValue("x"))).isEqualTo(45.0);
    assertThat(valueOf(evaluated.descendant("a").resourceValue("x"))).isEqualTo(9.0);
    assertThat(valueOf(evaluated.descendant("b").resourceValue("x"))).isEqualTo(36.0);
    assertThat(valueOf(evaluated.ports.get("out_0").size)).isEqualTo(6.0);
    assertThat(evaluated.descendant("b").inputParams).isEmpty();
  }

  @Test
  public void symbolicAssignment() {
    CompiledRoutine<Expr> compiled = Compiler.compile(CompilerTest.chain(), ENGINE);
    CompiledRoutine<Expr> evaluated =
        Evaluator.evaluate(
            compiled, Evaluator.parseAssignments(ImmutableList.of("N = 2*M"), ENGINE), ENGINE);

    assertThat(evaluated.inputParams).containsExactly("M");
    assertThat(
            ENGINE.compare(
                evaluated.descendant("a").ports.get("out_0").size, ENGINE.parse("4*M")))
        .isEqualTo(ComparisonResult.EQUAL);
  }

  @Test
  public void unknownVariable() {
    CompiledRoutine<Expr> compiled = Compiler.compile(CompilerTest.chain(), ENGINE);
    CompilationError e =
        assertThrows(
            CompilationError.class,
            () -> Evaluator.evaluate(compiled, ImmutableMap.of("Q", ENGINE.number(1)), ENGINE));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo("root: Cannot set unknown variable Q; known variables are [N].");
  }

  @Test
  public void constraintsAreRechecked() {
    Routine<Expr> routine =
        Routine.builder("root", ENGINE)
            .port("in_0", PortDirection.INPUT, "N")
            .connect("in_0", "a.in_0")
            .child(Routine.builder("a", ENGINE).port("in_0", PortDirection.INPUT, "4"))
            .build();
    CompiledRoutine<Expr> compiled = Compiler.compile(routine, ENGINE);
    assertThat(compiled.descendant("a").constraints).hasSize(1);

    CompiledRoutine<Expr> satisfied =
        Evaluator.evaluate(compiled, ImmutableMap.of("N", ENGINE.number(4)), ENGINE);
    assertThat(satisfied.descendant("a").constraints).isEmpty();

    ConstraintViolation e =
        assertThrows(
            ConstraintViolation.class,
            () -> Evaluator.evaluate(compiled, ImmutableMap.of("N", ENGINE.number(5)), ENGINE));
    assertThat(e.path).isEqualTo("root.a");
  }

  @Test
  public void repetitionIsEvaluated() {
    Routine<Expr> routine =
        Routine.builder("loop", ENGINE)
            .inputParams("n")
            .repetition("n", Sequence.custom(ENGINE.parse("i + 1")))
            .child(Routine.builder("body", ENGINE).resource("T", ResourceType.ADDITIVE, "1"))
            .build();
    CompiledRoutine<Expr> compiled = Compiler.compile(routine, ENGINE);
    CompiledRoutine<Expr> evaluated =
        Evaluator.evaluate(compiled, ImmutableMap.of("n", ENGINE.number(4)), ENGINE);
    assertThat(evaluated.repetition.count).isEqualTo(ENGINE.number(4));
    // 1 + 2 + 3 + 4
    assertThat(valueOf(evaluated.resourceValue("T"))).isEqualTo(10.0);
  }

  @Test
  public void malformedAssignment() {
    assertThrows(
        IllegalArgumentException.class,
        () -> Evaluator.parseAssignments(ImmutableList.of("N = 3", "10"), ENGINE));
  }
}
