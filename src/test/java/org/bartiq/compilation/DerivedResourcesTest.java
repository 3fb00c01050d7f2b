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

import com.google.common.collect.ImmutableMap;
import org.bartiq.routine.CompiledRoutine;
import org.bartiq.routine.PortDirection;
import org.bartiq.routine.Resource;
import org.bartiq.routine.ResourceType;
import org.bartiq.routine.Routine;
import org.bartiq.symbolics.builtin.BuiltinEngine;
import org.bartiq.symbolics.builtin.Expr;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class DerivedResourcesTest {

  private static final BuiltinEngine ENGINE = BuiltinEngine.INSTANCE;

  private static Routine.Builder<Expr> builder(String name) {
    return Routine.builder(name, ENGINE);
  }

  private static double highwater(CompiledRoutine<Expr> routine, int n) {
    Expr value = routine.resourceValue(DerivedResources.QUBIT_HIGHWATER);
    assertThat(value).isNotNull();
    Number number =
        ENGINE.numericValue(ENGINE.substitute(value, ImmutableMap.of("N", ENGINE.number(n))));
    assertThat(number).isNotNull();
    return number.doubleValue();
  }

  private static CompiledRoutine<Expr> compile(Routine<Expr> routine) {
    CompilationOptions<Expr> options =
        CompilationOptions.<Expr>builder()
            .addDerivedResource(DerivedResources.qubitHighwater())
            .build();
    return Compiler.compile(routine, ENGINE, options);
  }

  @Test
  public void childrenInSeries() {
    Routine<Expr> routine =
        builder("root")
            .port("in_0", PortDirection.INPUT, "N")
            .port("out_0", PortDirection.OUTPUT, null)
            .connect("in_0", "a.in_0")
            .connect("a.out_0", "b.in_0")
            .connect("b.out_0", "out_0")
            .child(
                builder("a")
                    .port("in_0", PortDirection.INPUT, null)
                    .port("out_0", PortDirection.OUTPUT, "#in_0")
                    .resource(DerivedResources.LOCAL_ANCILLAE, ResourceType.QUBITS, "3"))
            .child(
                builder("b")
                    .port("in_0", PortDirection.INPUT, null)
                    .port("out_0", PortDirection.OUTPUT, "2*#in_0"))
            .build();
    CompiledRoutine<Expr> root = compile(routine);

    assertThat(root.resources.get(DerivedResources.QUBIT_HIGHWATER).type)
        .isEqualTo(ResourceType.QUBITS);
    // a holds N qubits plus 3 ancillae
    assertThat(highwater(root.descendant("a"), 10)).isEqualTo(13.0);
    // b ends with 2*N qubits
    assertThat(highwater(root.descendant("b"), 10)).isEqualTo(20.0);
    assertThat(highwater(root, 10)).isEqualTo(20.0);
    assertThat(highwater(root, 1)).isEqualTo(4.0);
  }

  @Test
  public void ancillaeOnly() {
    Routine<Expr> routine =
        builder("root").resource(DerivedResources.LOCAL_ANCILLAE, ResourceType.QUBITS, "5").build();
    assertThat(compile(routine).resourceValue(DerivedResources.QUBIT_HIGHWATER))
        .isEqualTo(ENGINE.number(5));
  }

  @Test
  public void customNames() {
    DerivedResource<Expr> derived = DerivedResources.qubitHighwater("peak", "scratch");
    assertThat(derived.name).isEqualTo("peak");
    CompiledRoutine<Expr> leaf =
        CompiledRoutine.<Expr>builder("leaf")
            .resource(
                new Resource<>("scratch", ResourceType.QUBITS, ENGINE.number(2)))
            .build();
    assertThat(derived.compute(leaf, ENGINE)).isEqualTo(ENGINE.number(2));
  }
}
