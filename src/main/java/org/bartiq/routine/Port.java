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
import org.jspecify.annotations.Nullable;

/** A named, directed register of a routine, whose size is an expression. Ports are immutable. */
public final class Port<E> {
  public final String name;
  public final PortDirection direction;

  /** The size of the port, or null if it is unset (and should be inferred from connections). */
  public final @Nullable E size;

  public Port(String name, PortDirection direction, @Nullable E size) {
    this.name = checkNotNull(name);
    this.direction = checkNotNull(direction);
    this.size = size;
  }

  /** Returns a port with the same name and direction and the given size. */
  public Port<E> withSize(@Nullable E newSize) {
    return new Port<>(name, direction, newSize);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Port<?> port
        && name.equals(port.name)
        && direction == port.direction
        && Objects.equals(size, port.size);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, direction, size);
  }

  @Override
  public String toString() {
    return String.format("%s(%s): %s", name, direction, (size == null) ? "?" : size);
  }
}
