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

import org.bartiq.routine.Routine;
import org.bartiq.symbolics.AlgebraEngine;

/**
 * A transformation applied in place to a whole routine tree before compilation. Each stage is
 * given the root and is responsible for visiting the descendants it needs to.
 *
 * @see Preprocessing
 */
@FunctionalInterface
public interface PreprocessingStage<E> {
  /**
   * Transforms the tree rooted at {@code root}.
   *
   * @throws PreparationError if the tree cannot be transformed
   */
  void apply(Routine<E> root, AlgebraEngine<E> engine);
}
