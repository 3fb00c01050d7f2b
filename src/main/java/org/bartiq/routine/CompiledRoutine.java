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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * The result of compiling a {@link Routine}: the same tree, with every port size, resource value,
 * and repetition expressed in terms of the root routine's input parameters only.
 *
 * <p>CompiledRoutines are immutable; use {@link #toBuilder} to derive a modified copy.
 */
public final class CompiledRoutine<E> {
  public final String name;
  public final @Nullable String type;

  /** The global parameters that this routine's expressions depend on, sorted. */
  public final ImmutableList<String> inputParams;

  public final ImmutableMap<String, Port<E>> ports;
  public final ImmutableMap<String, Resource<E>> resources;
  public final ImmutableMap<Endpoint, Endpoint> connections;

  /** Constraints whose truth depends on the values of global parameters. */
  public final ImmutableList<Constraint<E>> constraints;

  public final @Nullable Repetition<E> repetition;
  public final ImmutableMap<String, CompiledRoutine<E>> children;

  private CompiledRoutine(Builder<E> builder) {
    this.name = builder.name;
    this.type = builder.type;
    this.inputParams = ImmutableList.sortedCopyOf(builder.inputParams);
    this.ports = ImmutableMap.copyOf(builder.ports);
    this.resources = ImmutableMap.copyOf(builder.resources);
    this.connections = ImmutableMap.copyOf(builder.connections);
    this.constraints = ImmutableList.copyOf(builder.constraints);
    this.repetition = builder.repetition;
    this.children = ImmutableMap.copyOf(builder.children);
  }

  public boolean isLeaf() {
    return children.isEmpty();
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
    return Routine.innerConnections(connections);
  }

  /** Returns the value of the named resource, or null if this routine does not have it. */
  public @Nullable E resourceValue(String resourceName) {
    Resource<E> resource = resources.get(resourceName);
    return (resource == null) ? null : resource.value;
  }

  /**
   * Returns the descendant at the given dotted path relative to this routine (e.g. {@code "a.b"}),
   * or this routine if the path is empty.
   *
   * @throws IllegalArgumentException if there is no such descendant
   */
  public CompiledRoutine<E> descendant(String path) {
    CompiledRoutine<E> result = this;
    if (path.isEmpty()) {
      return result;
    }
    for (String segment : Splitter.on('.').split(path)) {
      CompiledRoutine<E> next = result.children.get(segment);
      checkArgument(next != null, "%s has no child named %s", result.name, segment);
      result = next;
    }
    return result;
  }

  public Builder<E> toBuilder() {
    Builder<E> builder = new Builder<>(name);
    builder.type = type;
    builder.inputParams.addAll(inputParams);
    builder.ports.putAll(ports);
    builder.resources.putAll(resources);
    builder.connections.putAll(connections);
    builder.constraints.addAll(constraints);
    builder.repetition = repetition;
    builder.children.putAll(children);
    return builder;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof CompiledRoutine<?> routine
        && name.equals(routine.name)
        && Objects.equals(type, routine.type)
        && inputParams.equals(routine.inputParams)
        && ports.equals(routine.ports)
        && resources.equals(routine.resources)
        && connections.equals(routine.connections)
        && constraints.equals(routine.constraints)
        && Objects.equals(repetition, routine.repetition)
        && children.equals(routine.children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, ports, resources, children);
  }

  @Override
  public String toString() {
    return String.format("%s%s %s", name, inputParams, resources.values());
  }

  public static <E> Builder<E> builder(String name) {
    return new Builder<>(name);
  }

  public static final class Builder<E> {
    private final String name;
    private @Nullable String type;
    private final List<String> inputParams = new ArrayList<>();
    private final Map<String, Port<E>> ports = new LinkedHashMap<>();
    private final Map<String, Resource<E>> resources = new LinkedHashMap<>();
    private final Map<Endpoint, Endpoint> connections = new LinkedHashMap<>();
    private final List<Constraint<E>> constraints = new ArrayList<>();
    private @Nullable Repetition<E> repetition;
    private final Map<String, CompiledRoutine<E>> children = new LinkedHashMap<>();

    private Builder(String name) {
      this.name = checkNotNull(name);
    }

    @CanIgnoreReturnValue
    public Builder<E> type(@Nullable String type) {
      this.type = type;
      return this;
    }

    /** Replaces the input parameters; they need not be sorted. */
    @CanIgnoreReturnValue
    public Builder<E> inputParams(Collection<String> params) {
      inputParams.clear();
      params.stream().distinct().forEach(inputParams::add);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<E> port(Port<E> port) {
      ports.put(port.name, port);
      return this;
    }

    /** Adds or replaces a resource. */
    @CanIgnoreReturnValue
    public Builder<E> resource(Resource<E> resource) {
      resources.put(resource.name, resource);
      return this;
    }

    /** Replaces all resources, keeping the iteration order of {@code newResources}. */
    @CanIgnoreReturnValue
    public Builder<E> resources(Collection<Resource<E>> newResources) {
      resources.clear();
      newResources.forEach(this::resource);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<E> connections(Map<Endpoint, Endpoint> newConnections) {
      connections.clear();
      connections.putAll(newConnections);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<E> constraints(Collection<Constraint<E>> newConstraints) {
      constraints.clear();
      constraints.addAll(newConstraints);
      return this;
    }

    @CanIgnoreReturnValue
    public Builder<E> repetition(@Nullable Repetition<E> repetition) {
      this.repetition = repetition;
      return this;
    }

    /** Adds or replaces a child. */
    @CanIgnoreReturnValue
    public Builder<E> child(CompiledRoutine<E> child) {
      children.put(child.name, child);
      return this;
    }

    public CompiledRoutine<E> build() {
      return new CompiledRoutine<>(this);
    }
  }
}
