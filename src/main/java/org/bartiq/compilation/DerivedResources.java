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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.bartiq.routine.CompiledRoutine;
import org.bartiq.routine.Port;
import org.bartiq.routine.PortDirection;
import org.bartiq.routine.ResourceType;
import org.bartiq.symbolics.AlgebraEngine;

/** Factories for commonly used {@link DerivedResource}s. */
public final class DerivedResources {

  private static final Logger logger = Logger.getLogger(DerivedResources.class.getName());

  public static final String QUBIT_HIGHWATER = "qubit_highwater";
  public static final String LOCAL_ANCILLAE = "local_ancillae";

  /** Returns {@link #qubitHighwater(String, String)} with the default resource names. */
  public static <E> DerivedResource<E> qubitHighwater() {
    return qubitHighwater(QUBIT_HIGHWATER, LOCAL_ANCILLAE);
  }

  /**
   * Returns a derived resource estimating the largest number of qubits live at any point during
   * the routine.
   *
   * <p>The children are assumed to run one at a time, in topological order. Starting from the
   * routine's inflow (the total size of its input and through ports), each child replaces its
   * inflow by its own high-water mark while it runs, and by its outflow afterwards. The result is
   * the largest nonzero watermark seen (including the routine's final outflow), plus the value of
   * the {@code ancillaeName} resource if the routine has one.
   *
   * <p>The result is an upper bound when the declared order of the children is not the order in
   * which they actually run; a warning is logged if declared and topological orders differ.
   */
  public static <E> DerivedResource<E> qubitHighwater(String name, String ancillaeName) {
    return new DerivedResource<E>(name, ResourceType.QUBITS) {
      @Override
      public E compute(CompiledRoutine<E> routine, AlgebraEngine<E> engine) {
        E active = flow(routine, engine, PortDirection.INPUT);
        List<E> watermarks = new ArrayList<>();
        watermarks.add(active);
        ImmutableList<String> order =
            TopologicalSort.sort(routine.name, routine.children.keySet(), routine.connections);
        if (!order.equals(routine.children.keySet().asList())) {
          logger.warning(
              String.format(
                  "Order of children in %s does not match the topology; %s is estimated using %s",
                  routine.name,
                  name,
                  order));
        }
        for (String childName : order) {
          CompiledRoutine<E> child = routine.children.get(childName);
          E childHighwater = child.resourceValue(name);
          if (childHighwater == null) {
            childHighwater = compute(child, engine);
          }
          E remaining = engine.sub(active, flow(child, engine, PortDirection.INPUT));
          watermarks.add(engine.add(remaining, childHighwater));
          active = engine.add(remaining, flow(child, engine, PortDirection.OUTPUT));
        }
        watermarks.add(flow(routine, engine, PortDirection.OUTPUT));
        E ancillae = routine.resourceValue(ancillaeName);
        if (ancillae == null) {
          ancillae = engine.number(0);
        }
        List<E> nonzero = new ArrayList<>();
        for (E watermark : watermarks) {
          Number value = engine.numericValue(watermark);
          if (value == null || value.doubleValue() != 0) {
            nonzero.add(watermark);
          }
        }
        return nonzero.isEmpty() ? ancillae : engine.add(engine.max(nonzero), ancillae);
      }
    };
  }

  /**
   * Returns the total size of the ports with the given direction, together with the through
   * ports.
   */
  private static <E> E flow(
      CompiledRoutine<E> routine, AlgebraEngine<E> engine, PortDirection direction) {
    List<E> sizes = new ArrayList<>();
    for (Port<E> port : routine.portsWith(direction, PortDirection.THROUGH)) {
      if (port.size != null) {
        sizes.add(port.size);
      }
    }
    return engine.sum(sizes);
  }

  // Statics only
  private DerivedResources() {}
}
