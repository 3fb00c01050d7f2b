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

import org.bartiq.routine.CompiledRoutine;
import org.bartiq.symbolics.AlgebraEngine;

/**
 * A transformation of a compiled routine tree, applied after compilation.
 *
 * @see Postprocessing
 */
@FunctionalInterface
public interface PostprocessingStage<E> {
  CompiledRoutine<E> apply(CompiledRoutine<E> routine, AlgebraEngine<E> engine);
}
