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
import org.bartiq.routine.Constraint;
import org.bartiq.routine.Endpoint;
import org.bartiq.routine.ParameterLink;
import org.bartiq.routine.PortDirection;
import org.bartiq.routine.ResourceType;
import org.bartiq.routine.Routine;
import org.bartiq.symbolics.builtin.BuiltinEngine;
import org.bartiq.symbolics.builtin.Expr;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PreprocessingTest {

  private static final BuiltinEngine ENGINE = BuiltinEngine.INSTANCE;

  private static Routine.Builder<Expr> builder(String name) {
    return Routine.builder(name, ENGINE);
  }

  private static Expr parse(String text) {
    return ENGINE.parse(text);
  }

  @Test
  public void mergeOutputSize() {
    Routine<Expr> merge =
        builder("m")
            .type(Preprocessing.MERGE_TYPE)
            .port("in_0", PortDirection.INPUT, "A")
            .port("in_1", PortDirection.INPUT, "B")
            .port("out_0", PortDirection.OUTPUT, null)
            .port("out_1", PortDirection.OUTPUT, "7")
            .build();
    Preprocessing.defaultMergeOutputSize(merge, ENGINE);
    assertThat(merge.ports().get("out_0").size).isEqualTo(parse("#in_0 + #in_1"));
    assertThat(merge.ports().get("out_1").size).isEqualTo(parse("7"));
  }

  @Test
  public void additiveResources() {
    Routine<Expr> root =
        builder("root")
            .child(
                builder("a")
                    .resource("T", ResourceType.ADDITIVE, "c")
                    .resource("Q", ResourceType.QUBITS, "5")
                    .child(builder("x").resource("U", ResourceType.ADDITIVE, "1")))
            .child(builder("b").resource("T", ResourceType.ADDITIVE, "d"))
            .build();
    Preprocessing.addDefaultAdditiveResources(root, ENGINE);
    assertThat(root.resources().get("T").value).isEqualTo(parse("a.T + b.T"));
    assertThat(root.resources()).doesNotContainKey("Q");
    // Propagated bottom-up through a
    assertThat(root.children().get("a").resources().get("U").value).isEqualTo(parse("x.U"));
    assertThat(root.resources().get("U").value).isEqualTo(parse("a.U"));
  }

  @Test
  public void explicitAdditiveResourceWins() {
    Routine<Expr> root =
        builder("root")
            .resource("T", ResourceType.ADDITIVE, "42")
            .child(builder("a").resource("T", ResourceType.ADDITIVE, "c"))
            .build();
    Preprocessing.addDefaultAdditiveResources(root, ENGINE);
    assertThat(root.resources().get("T").value).isEqualTo(parse("42"));
  }

  @Test
  public void passthrough() {
    Routine<Expr> root =
        builder("root")
            .port("in_0", PortDirection.INPUT, "N")
            .port("in_1", PortDirection.INPUT, "M")
            .port("out_0", PortDirection.OUTPUT, null)
            .port("out_1", PortDirection.OUTPUT, null)
            .connect("in_0", "a.in_0")
            .connect("a.out_0", "out_0")
            .connect("in_1", "out_1")
            .child(
                builder("a")
                    .port("in_0", PortDirection.INPUT, null)
                    .port("out_0", PortDirection.OUTPUT, "#in_0"))
            .build();
    Preprocessing.insertPassthroughs(root, ENGINE);

    Routine<Expr> passthrough = root.children().get("passthrough_0");
    assertThat(passthrough.type()).isEqualTo(Preprocessing.PASSTHROUGH_TYPE);
    assertThat(passthrough.ports().get("out_0").size).isEqualTo(parse("#in_0"));
    assertThat(root.connections())
        .containsExactly(
            Endpoint.own("in_0"), Endpoint.parse("a.in_0"),
            Endpoint.parse("a.out_0"), Endpoint.own("out_0"),
            Endpoint.own("in_1"), Endpoint.parse("passthrough_0.in_0"),
            Endpoint.parse("passthrough_0.out_0"), Endpoint.own("out_1"));
  }

  @Test
  public void passthroughInLeaf() {
    Routine<Expr> leaf =
        builder("leaf")
            .port("in_0", PortDirection.INPUT, "N")
            .port("out_0", PortDirection.OUTPUT, null)
            .connect("in_0", "out_0")
            .build();
    PreparationError e =
        assertThrows(PreparationError.class, () -> Preprocessing.insertPassthroughs(leaf, ENGINE));
    assertThat(e.path).isEqualTo("leaf");
    assertThat(e.msg)
        .isEqualTo("Cannot add a passthrough from in_0 to out_0, as the routine has no children.");
  }

  @Test
  public void passthroughNameCollision() {
    Routine<Expr> root =
        builder("root")
            .port("in_0", PortDirection.THROUGH, "N")
            .port("out_0", PortDirection.OUTPUT, null)
            .connect("in_0", "out_0")
            .child(builder("passthrough_0"))
            .build();
    PreparationError e =
        assertThrows(PreparationError.class, () -> Preprocessing.insertPassthroughs(root, ENGINE));
    assertThat(e.msg)
        .isEqualTo(
            "Cannot add passthrough named passthrough_0, as child with such name already exists.");
  }

  @Test
  public void flattenLinkedParams() {
    Routine<Expr> root =
        builder("root")
            .link("N", "a.b.K")
            .child(builder("a").child(builder("b").inputParams("K")))
            .build();
    Preprocessing.flattenLinkedParams(root, ENGINE);

    assertThat(root.linkedParams().get("N")).containsExactly(new ParameterLink("a", "b.K"));
    Routine<Expr> a = root.children().get("a");
    assertThat(a.inputParams()).contains("b.K");
    assertThat(a.linkedParams().get("b.K")).containsExactly(new ParameterLink("b", "K"));
  }

  @Test
  public void linkToMissingChild() {
    Routine<Expr> root = builder("root").link("N", "z.K").build();
    PreparationError e =
        assertThrows(PreparationError.class, () -> Preprocessing.flattenLinkedParams(root, ENGINE));
    assertThat(e.stage).isEqualTo("flattenLinkedParams");
  }

  @Test
  public void promoteUnlinkedInputs() {
    Routine<Expr> root =
        builder("root")
            .link("N", "a.K")
            .child(builder("a").inputParams("K", "L", "#in_0"))
            .build();
    Preprocessing.promoteUnlinkedInputs(root, ENGINE);

    assertThat(root.inputParams()).containsExactly("N", "a.L").inOrder();
    assertThat(root.linkedParams().get("a.L")).containsExactly(new ParameterLink("a", "L"));
  }

  @Test
  public void normalizePortVariables() {
    Routine<Expr> root =
        builder("root")
            .port("in_0", PortDirection.INPUT, "N")
            .child(
                builder("a")
                    .port("in_0", PortDirection.INPUT, "K")
                    .port("in_1", PortDirection.INPUT, "3")
                    .port("in_2", PortDirection.THROUGH, "K")
                    .port("out_0", PortDirection.OUTPUT, "2*K"))
            .build();
    Preprocessing.normalizePortVariables(root, ENGINE);

    assertThat(root.ports().get("in_0").size).isEqualTo(parse("N"));
    Routine<Expr> a = root.children().get("a");
    assertThat(a.ports().get("in_0").size).isEqualTo(parse("#in_0"));
    assertThat(a.ports().get("in_1").size).isEqualTo(parse("#in_1"));
    assertThat(a.ports().get("in_2").size).isEqualTo(parse("#in_2"));
    assertThat(a.ports().get("out_0").size).isEqualTo(parse("2*K"));
    assertThat(a.localVariables()).containsExactly("K", parse("#in_0"));
    assertThat(a.constraints())
        .containsExactly(
            new Constraint<>(parse("#in_1"), parse("3")),
            new Constraint<>(parse("#in_2"), parse("#in_0")))
        .inOrder();
    assertThat(a.inputParams()).containsExactly("#in_0", "#in_1", "#in_2");
  }

  @Test
  public void stripNonLeafInputSizes() {
    Routine<Expr> root =
        builder("root")
            .port("in_0", PortDirection.INPUT, "N")
            .child(
                builder("a")
                    .port("in_0", PortDirection.INPUT, "#in_0")
                    .port("in_1", PortDirection.THROUGH, "#in_1")
                    .child(builder("b").port("in_0", PortDirection.INPUT, "#in_0")))
            .build();
    Preprocessing.stripNonLeafInputSizes(root, ENGINE);

    assertThat(root.ports().get("in_0").size).isEqualTo(parse("N"));
    Routine<Expr> a = root.children().get("a");
    assertThat(a.ports().get("in_0").size).isNull();
    assertThat(a.ports().get("in_1").size).isEqualTo(parse("#in_1"));
    assertThat(a.children().get("b").ports().get("in_0").size).isEqualTo(parse("#in_0"));
  }

  @Test
  public void unrollWildcards() {
    Routine<Expr> root =
        builder("root")
            .resource("T", ResourceType.ADDITIVE, "sum(~.T)")
            .resource("depth", ResourceType.OTHER, "max(step~.depth)")
            .child(builder("step_0").resource("T", ResourceType.ADDITIVE, "1"))
            .child(builder("step_1").resource("T", ResourceType.ADDITIVE, "x"))
            .child(builder("other").resource("depth", ResourceType.OTHER, "2"))
            .child(builder("step_2").resource("depth", ResourceType.OTHER, "3"))
            .build();
    Preprocessing.unrollWildcardResources(root, ENGINE);

    assertThat(root.resources().get("T").value).isEqualTo(parse("step_0.T + step_1.T"));
    assertThat(root.resources().get("depth").value).isEqualTo(parse("step_2.depth"));
  }

  @Test
  public void wildcardErrors() {
    assertThat(wildcardError("sum(~.a.T)"))
        .isEqualTo("Wildcard parsing supported only for expressions without nesting: ~.a.T");
    assertThat(wildcardError("sum(a.T~)"))
        .isEqualTo("Resource name cannot contain wildcard symbol: a.T~");
    assertThat(wildcardError("sum(x~)")).isEqualTo("Wildcard x~ must name a resource, as in ~.T");
  }

  private static String wildcardError(String value) {
    Routine<Expr> root =
        builder("root")
            .resource("T", ResourceType.OTHER, value)
            .child(builder("a").resource("T", ResourceType.OTHER, "1"))
            .build();
    PreparationError e =
        assertThrows(
            PreparationError.class, () -> Preprocessing.unrollWildcardResources(root, ENGINE));
    assertThat(e.stage).isEqualTo("unrollWildcardResources");
    return e.msg;
  }

  @Test
  public void idempotent() {
    Routine<Expr> once = CompilerTest.chain();
    Preprocessing.preprocess(once, ENGINE);
    Routine<Expr> twice = once.copy();
    Preprocessing.preprocess(twice, ENGINE);
    assertThat(twice).isEqualTo(once);
  }

  @Test
  public void customStages() {
    Routine<Expr> root = builder("root").child(builder("a").inputParams("K")).build();
    Preprocessing.preprocess(
        root, ENGINE, ImmutableList.of(Preprocessing::promoteUnlinkedInputs));
    assertThat(root.inputParams()).containsExactly("a.K");
    // Only the given stage ran
    assertThat(root.children().get("a").inputParams()).containsExactly("K");
  }
}
