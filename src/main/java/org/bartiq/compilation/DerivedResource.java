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

import static com.google.common.base.Preconditions.checkNotNull;

import org.bartiq.routine.CompiledRoutine;
import org.bartiq.routine.ResourceType;
import org.bartiq.symbolics.AlgebraEngine;
import org.jspecify.annotations.Nullable;

/**
 * A resource whose value is computed from a routine after the rest of the routine has been
 * compiled. The compiler computes derived resources bottom-up, so {@link #compute} may rely on
 * each child already having the derived resource.
 *
 * @see DerivedResources
 */
public abstract class DerivedResource<E> {
  public final String name;
  public final ResourceType type;

  protected DerivedResource(String name, ResourceType type) {
    this.name = checkNotNull(name);
    this.type = checkNotNull(type);
  }

  /**
   * Returns the value of this resource for {@code routine}, or null if it does not apply to that
   * routine.
   */
  public abstract @Nullable E compute(CompiledRoutine<E> routine, AlgebraEngine<E> engine);

  @Override
  public String toString() {
    return name;
  }
}
