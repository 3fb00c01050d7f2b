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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.bartiq.routine.CompiledRoutine;
import org.bartiq.routine.Resource;
import org.bartiq.symbolics.AlgebraEngine;

/** Factories for commonly used {@link PostprocessingStage}s. */
public final class Postprocessing {

  /** Returns {@link #aggregateResources(Map, boolean)}, removing the decomposed resources. */
  public static <E> PostprocessingStage<E> aggregateResources(
      Map<String, ? extends Map<String, String>> decompositions) {
    return aggregateResources(decompositions, true);
  }

  /**
   * Returns a stage that decomposes resources into more fundamental components. {@code
   * decompositions} maps a resource name to its components, each with a multiplier given as
   * expression text; for example {@code {"swap": {"CNOT": "3"}}} replaces a {@code swap} resource
   * with value {@code x} by a {@code CNOT} resource with value {@code 3*x} (added to any existing
   * {@code CNOT} resource). Components may themselves be decomposed.
   *
   * <p>The stage throws {@link CompilationError.CyclicDependency} if the decompositions are
   * circular.
   *
   * @param removeDecomposed if false, decomposed resources are kept alongside their components
   */
  public static <E> PostprocessingStage<E> aggregateResources(
      Map<String, ? extends Map<String, String>> decompositions, boolean removeDecomposed) {
    ImmutableMap.Builder<String, ImmutableMap<String, String>> builder = ImmutableMap.builder();
    decompositions.forEach(
        (name, components) -> builder.put(name, ImmutableMap.copyOf(components)));
    ImmutableMap<String, ImmutableMap<String, String>> copy = builder.buildOrThrow();
    return (routine, engine) -> {
      Map<String, Map<String, E>> expanded = expand(routine.name, copy, engine);
      return aggregate(routine, expanded, removeDecomposed, engine);
    };
  }

  /**
   * Returns each decomposition rewritten in terms of components that are not themselves
   * decomposed.
   */
  private static <E> Map<String, Map<String, E>> expand(
      String path,
      ImmutableMap<String, ImmutableMap<String, String>> decompositions,
      AlgebraEngine<E> engine) {
    SetMultimap<String, String> components = LinkedHashMultimap.create();
    decompositions.forEach((name, parts) -> components.putAll(name, parts.keySet()));
    ImmutableList<String> order = TopologicalSort.sort(path, decompositions.keySet(), components);
    Map<String, Map<String, E>> expanded = new HashMap<>();
    // Expand the components of each resource before the resource itself.
    for (String name : order.reverse()) {
      Map<String, E> result = new LinkedHashMap<>();
      decompositions
          .get(name)
          .forEach(
              (component, multiplierText) -> {
                E multiplier = engine.parse(multiplierText);
                Map<String, E> nested = expanded.get(component);
                if (nested == null) {
                  result.merge(component, multiplier, engine::add);
                } else {
                  nested.forEach(
                      (leaf, factor) ->
                          result.merge(leaf, engine.mul(multiplier, factor), engine::add));
                }
              });
      expanded.put(name, result);
    }
    return expanded;
  }

  private static <E> CompiledRoutine<E> aggregate(
      CompiledRoutine<E> routine,
      Map<String, Map<String, E>> expanded,
      boolean removeDecomposed,
      AlgebraEngine<E> engine) {
    CompiledRoutine.Builder<E> builder = routine.toBuilder();
    for (CompiledRoutine<E> child : routine.children.values()) {
      builder.child(aggregate(child, expanded, removeDecomposed, engine));
    }
    Map<String, Resource<E>> resources = new LinkedHashMap<>(routine.resources);
    for (Resource<E> resource : routine.resources.values()) {
      Map<String, E> parts = expanded.get(resource.name);
      if (parts == null) {
        continue;
      }
      parts.forEach(
          (component, multiplier) -> {
            E value = engine.mul(multiplier, resource.value);
            Resource<E> existing = resources.get(component);
            resources.put(
                component,
                (existing == null)
                    ? new Resource<>(component, resource.type, value)
                    : existing.withValue(engine.add(existing.value, value)));
          });
      if (removeDecomposed) {
        resources.remove(resource.name);
      }
    }
    return builder.resources(resources.values()).build();
  }

  // Statics only
  private Postprocessing() {}
}
