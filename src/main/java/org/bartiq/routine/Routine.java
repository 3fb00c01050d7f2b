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


package org.bartiq.routine;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.bartiq.symbolics.AlgebraEngine;
import org.bartiq.symbolics.ExpressionSyntax;
import org.jspecify.annotations.Nullable;

/**
 * An uncompiled routine: a node in a tree of nested subroutines, each with ports, resources, and
 * cost expressions written in terms of its own local names.
 *
 * <p>Routines are mutable; preprocessing rewrites them in place before compilation. All of the
 * collection accessors return live views that preserve insertion order. Children are owned
 * exclusively by their parent, so the routines form a tree.
 */
public final class Routine<E> {
  private final String name;
  private @Nullable String type;
  private final Map<String, Port<E>> ports = new LinkedHashMap<>();
  private final Map<String, Resource<E>> resources = new LinkedHashMap<>();
  private final Map<String, E> localVariables = new LinkedHashMap<>();
  private final Set<String> inputParams = new LinkedHashSet<>();

  /**
   * Maps each linked parameter of this routine to the descendants' parameters that receive its
   * value.
   */
  private final Map<String, List<ParameterLink>> linkedParams = new LinkedHashMap<>();

  private final List<Constraint<E>> constraints = new ArrayList<>();
  private @Nullable Repetition<E> repetition;
  private final Map<Endpoint, Endpoint> connections = new LinkedHashMap<>();
  private final Map<String, Routine<E>> children = new LinkedHashMap<>();

  public Routine(String name) {
    this.name = checkNotNull(name);
  }

  public String name() {
    return name;
  }

  public @Nullable String type() {
    return type;
  }

  public void setType(@Nullable String type) {
    this.type = type;
  }

  public Map<String, Port<E>> ports() {
    return ports;
  }

  public Map<String, Resource<E>> resources() {
    return resources;
  }

  public Map<String, E> localVariables() {
    return localVariables;
  }

  public Set<String> inputParams() {
    return inputParams;
  }

  public Map<String, List<ParameterLink>> linkedParams() {
    return linkedParams;
  }

  public List<Constraint<E>> constraints() {
    return constraints;
  }

  public @Nullable Repetition<E> repetition() {
    return repetition;
  }

  public void setRepetition(@Nullable Repetition<E> repetition) {
    this.repetition = repetition;
  }

  /** Maps each source endpoint to the endpoint it feeds. */
  public Map<Endpoint, Endpoint> connections() {
    return connections;
  }

  public Map<String, Routine<E>> children() {
    return children;
  }

  public boolean isLeaf() {
    return children.isEmpty();
  }

  /** Adds a child, whose name must differ from those of the existing children. */
  public void addChild(Routine<E> child) {
    checkArgument(
        !children.containsKey(child.name),
        "Routine %s already has a child named %s",
        name,
        child.name);
    children.put(child.name, child);
  }

  /** Returns this routine's ports with any of the given directions, in declaration order. */
  public ImmutableList<Port<E>> portsWith(PortDirection... directions) {
    List<PortDirection> wanted = Arrays.asList(directions);
    return ports.values().stream()
        .filter(p -> wanted.contains(p.direction))
        .collect(ImmutableList.toImmutableList());
  }

  /** Returns the connections between two of this routine's children. */
  public ImmutableMap<Endpoint, Endpoint> innerConnections() {
    return innerConnections(connections);
  }

  static ImmutableMap<Endpoint, Endpoint> innerConnections(Map<Endpoint, Endpoint> connections) {
    ImmutableMap.Builder<Endpoint, Endpoint> builder = ImmutableMap.builder();
    connections.forEach(
        (source, target) -> {
          if (!source.isOwn() && !target.isOwn()) {
            builder.put(source, target);
          }
        });
    return builder.buildOrThrow();
  }

  /** Returns an independent copy of this routine and all of its descendants. */
  public Routine<E> copy() {
    Routine<E> result = new Routine<>(name);
    result.type = type;
    result.ports.putAll(ports);
    result.resources.putAll(resources);
    result.localVariables.putAll(localVariables);
    result.inputParams.addAll(inputParams);
    linkedParams.forEach((param, links) -> result.linkedParams.put(param, new ArrayList<>(links)));
    result.constraints.addAll(constraints);
    result.repetition = repetition;
    result.connections.putAll(connections);
    children.values().forEach(child -> result.addChild(child.copy()));
    return result;
  }

  @Override
  public boolean equals(Object other) {
    // Map.equals() ignores insertion order, which is irrelevant for ports, resources and children.
    return other instanceof Routine<?> routine
        && name.equals(routine.name)
        && Objects.equals(type, routine.type)
        && ports.equals(routine.ports)
        && resources.equals(routine.resources)
        && localVariables.equals(routine.localVariables)
        && inputParams.equals(routine.inputParams)
        && linkedParams.equals(routine.linkedParams)
        && constraints.equals(routine.constraints)
        && Objects.equals(repetition, routine.repetition)
        && connections.equals(routine.connections)
        && children.equals(routine.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, ports, resources, children);
  }

  @Override
  public String toString() {
    return (type == null) ? name : String.format("%s(%s)", name, type);
  }

  /**
   * Returns a Builder for a routine with the given name; expressions passed to the builder as text
   * are parsed with {@code engine}.
   */
  public static <E> Builder<E> builder(String name, AlgebraEngine<E> engine) {
    return new Builder<>(name, engine);
  }

  /** A fluent way to construct a Routine, with expressions given as text. */
  public static final class Builder<E> {
    private final Routine<E> routine;
    private final AlgebraEngine<E> engine;

    private Builder(String name, AlgebraEngine<E> engine) {
      this.routine = new Routine<>(name);
      this.engine = engine;
    }

    @CanIgnoreReturnValue
    public Builder<E> type(String type) {
      routine.type = type;
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<E> inputParams(String... names) {
      routine.inputParams.addAll(Arrays.asList(names));
      return this;
    }

    /** Adds a port; {@code size} may be null to leave it unset. */
    @CanIgnoreReturnValue
    public Builder<E> port(String name, PortDirection direction, @Nullable String size) {
      routine.ports.put(name, new Port<>(name, direction, (size == null) ? null : parse(size)));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<E> resource(String name, ResourceType type, String value) {
      routine.resources.put(name, new Resource<>(name, type, parse(value)));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<E> localVariable(String name, String value) {
      routine.localVariables.put(name, parse(value));
      return this;
    }

    /**
     * Links the parameter {@code param} of this routine to the parameter of a descendant, given as
     * a dotted path such as {@code "a.b.N"}. The routine gains {@code param} as an input parameter.
     */
    @CanIgnoreReturnValue
    public Builder<E> link(String param, String target) {
      int dot = target.lastIndexOf(ExpressionSyntax.PATH_SEPARATOR);
      checkArgument(dot > 0, "Expected a string with at least one dot, got %s.", target);
      routine.inputParams.add(param);
      routine
          .linkedParams
          .computeIfAbsent(param, k -> new ArrayList<>())
          .add(new ParameterLink(target.substring(0, dot), target.substring(dot + 1)));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<E> constraint(String lhs, String rhs) {
      routine.constraints.add(new Constraint<>(parse(lhs), parse(rhs)));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<E> repetition(String count, Sequence<E> sequence) {
      routine.repetition = new Repetition<>(parse(count), sequence);
      return this;
    }

    /** Adds a connection; endpoints are given as {@code "port"} or {@code "child.port"}. */
    @CanIgnoreReturnValue
    public Builder<E> connect(String source, String target) {
      routine.connections.put(Endpoint.parse(source), Endpoint.parse(target));
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<E> child(Routine<E> child) {
      routine.addChild(child);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<E> child(Builder<E> child) {
      return child(child.build());
    }

    public Routine<E> build() {
      return routine;
    }

    private E parse(String text) {
      return engine.parse(text);
    }
  }
}
