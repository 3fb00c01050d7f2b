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

import java.util.Objects;
import org.bartiq.symbolics.ExpressionSyntax;
import org.jspecify.annotations.Nullable;

/**
 * One end of a connection: a port of the routine that owns the connection (if {@link
 * #routineName} is null) or a port of one of its direct children.
 */
public final class Endpoint {
  public final @Nullable String routineName;
  public final String portName;

  public Endpoint(@Nullable String routineName, String portName) {
    this.routineName = routineName;
    this.portName = checkNotNull(portName);
  }

  /** Returns an endpoint referring to the owning routine's own port. */
  public static Endpoint own(String portName) {
    return new Endpoint(null, portName);
  }

  /**
   * Parses {@code "port"} (an own port) or {@code "child.port"} (a port of a direct child).
   *
   * @throws IllegalArgumentException if {@code text} has more than one separator
   */
  public static Endpoint parse(String text) {
    int dot = text.indexOf(ExpressionSyntax.PATH_SEPARATOR);
    if (dot < 0) {
      return own(text);
    }
    checkArgument(
        text.indexOf(ExpressionSyntax.PATH_SEPARATOR, dot + 1) < 0,
        "Endpoints may only refer to direct children: %s",
        text);
    return new Endpoint(text.substring(0, dot), text.substring(dot + 1));
  }

  public boolean isOwn() {
    return routineName == null;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Endpoint endpoint
        && Objects.equals(routineName, endpoint.routineName)
        && portName.equals(endpoint.portName);
  }

  @Override
  public int hashCode() {
    return Objects.hash(routineName, portName);
  }

  @Override
  public String toString() {
    return isOwn() ? portName : ExpressionSyntax.joinPath(routineName, portName);
  }
}
