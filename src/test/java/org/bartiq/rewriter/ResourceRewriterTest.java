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


package org.bartiq.rewriter;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import org.bartiq.rewriter.Instruction.Assumption;
import org.bartiq.routine.CompiledRoutine;
import org.bartiq.routine.Resource;
import org.bartiq.routine.ResourceType;
import org.bartiq.symbolics.builtin.BuiltinEngine;
import org.bartiq.symbolics.builtin.Expr;
import org.bartiq.symbolics.builtin.Expr.Sym;
import org.bartiq.symbolics.builtin.Sign;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ResourceRewriterTest {

  private static final BuiltinEngine ENGINE = BuiltinEngine.INSTANCE;

  private static Resource<Expr> resource(String name, String value) {
    return new Resource<>(name, ResourceType.ADDITIVE, ENGINE.parse(value));
  }

  /** A routine whose resource T depends on max(0, X) at two levels, and is a number in b. */
  private static CompiledRoutine<Expr> routine() {
    return CompiledRoutine.<Expr>builder("root")
        .inputParams(ImmutableList.of("X"))
        .resource(resource("T", "max(0, X) + 3"))
        .resource(resource("Q", "max(0, X)"))
        .child(
            CompiledRoutine.<Expr>builder("a")
                .inputParams(ImmutableList.of("X"))
                .resource(resource("T", "max(0, X)"))
                .build())
        .child(CompiledRoutine.<Expr>builder("b").resource(resource("T", "3")).build())
        .build();
  }

  @Test
  public void rewritesResource() {
    ResourceRewriter<Expr> rewriter =
        new ResourceRewriter<>(routine(), "T", BuiltinRewriter::of).assume("X > 0");
    assertThat(rewriter.expression()).isEqualTo(ENGINE.parse("X + 3"));
    assertThat(rewriter.history())
        .containsExactly(Instruction.INITIAL, Assumption.parse("X > 0"))
        .inOrder();
    assertThat(rewriter.undoPrevious(1).expression()).isEqualTo(ENGINE.parse("max(0, X) + 3"));
  }

  @Test
  public void applyToWholeRoutine() {
    CompiledRoutine<Expr> original = routine();
    CompiledRoutine<Expr> rewritten =
        new ResourceRewriter<>(original, "T", BuiltinRewriter::of)
            .assume("X > 0")
            .applyToWholeRoutine();

    assertThat(rewritten.resourceValue("T")).isEqualTo(ENGINE.parse("X + 3"));
    assertThat(rewritten.descendant("a").resourceValue("T")).isEqualTo(ENGINE.parse("X"));
    assertThat(((Sym) rewritten.descendant("a").resourceValue("T")).sign)
        .isEqualTo(Sign.POSITIVE);
    assertThat(rewritten.descendant("b").resourceValue("T")).isEqualTo(ENGINE.parse("3"));
    // Other resources are unchanged
    assertThat(rewritten.resourceValue("Q")).isEqualTo(ENGINE.parse("max(0, X)"));
    // The original routine is unchanged
    assertThat(original.descendant("a").resourceValue("T")).isEqualTo(ENGINE.parse("max(0, X)"));
    assertThat(rewritten.children.keySet()).containsExactly("a", "b").inOrder();
  }

  @Test
  public void fromHistory() {
    ResourceRewriter<Expr> rewriter =
        ResourceRewriter.fromHistory(
            routine(),
            "T",
            ImmutableList.of(Instruction.INITIAL, Assumption.parse("X > 0")),
            BuiltinRewriter::of);
    assertThat(rewriter.expression()).isEqualTo(ENGINE.parse("X + 3"));
    assertThat(rewriter.history()).hasSize(2);
  }

  @Test
  public void severalResources() {
    CompiledRoutine<Expr> rewritten =
        RoutineRewriting.rewriteRoutineResources(
            routine(),
            ImmutableList.of("T", "Q"),
            ImmutableList.of(Assumption.parse("X >= 0")),
            BuiltinRewriter::of);
    assertThat(rewritten.resourceValue("T")).isEqualTo(ENGINE.parse("X + 3"));
    assertThat(rewritten.resourceValue("Q")).isEqualTo(ENGINE.parse("X"));
    assertThat(rewritten.descendant("a").resourceValue("T")).isEqualTo(ENGINE.parse("X"));
  }

  @Test
  public void missingResource() {
    RewriterError e =
        assertThrows(
            RewriterError.class,
            () -> new ResourceRewriter<>(routine(), "W", BuiltinRewriter::of));
    assertThat(e).hasMessageThat().isEqualTo("Routine root has no resource W.");
  }
}
