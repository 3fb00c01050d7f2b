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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

/** A named cost of a routine, such as a gate count or a number of qubits. */
public final class Resource<E> {
  public final String name;
  public final ResourceType type;
  public final E value;

  public Resource(String name, ResourceType type, E value) {
    this.name = checkNotNull(name);
    this.type = checkNotNull(type);
    this.value = checkNotNull(value);
  }

  public Resource<E> withValue(E newValue) {
    return new Resource<>(name, type, newValue);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Resource<?> resource
        && name.equals(resource.name)
        && type == resource.type
        && value.equals(resource.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, type, value);
  }

  @Override
  public String toString() {
    return String.format("%s(%s) = %s", name, type, value);
  }
}
