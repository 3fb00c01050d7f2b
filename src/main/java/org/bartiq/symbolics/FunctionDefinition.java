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

package org.bartiq.symbolics;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A user-supplied function, substituted for calls of an otherwise undefined function name.
 *
 * <p>An implementation may return null to leave a particular call unevaluated (e.g. because its
 * arguments are still symbolic).
 */
@FunctionalInterface
public interface FunctionDefinition<E> {
  @Nullable E apply(List<E> args);
}
