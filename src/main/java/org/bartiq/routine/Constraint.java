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

/**
 * A requirement that two expressions be equal, e.g. that a declared port size matches the size
 * propagated to it.
 */
public final class Constraint<E> {
  public final E lhs;
  public final E rhs;
  public final ConstraintStatus status;

  public Constraint(E lhs, E rhs, ConstraintStatus status) {
    this.lhs = checkNotNull(lhs);
    this.rhs = checkNotNull(rhs);
    this.status = checkNotNull(status);
  }

  public Constraint(E lhs, E rhs) {
    this(lhs, rhs, ConstraintStatus.INCONCLUSIVE);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Constraint<?> constraint
        && lhs.equals(constraint.lhs)
        && rhs.equals(constraint.rhs)
        && status == constraint.status;
  }

  @Override
  public int hashCode() {
    return Objects.hash(lhs, rhs, status);
  }

  @Override
  public String toString() {
    return String.format("%s == %s (%s)", lhs, rhs, status);
  }
}
