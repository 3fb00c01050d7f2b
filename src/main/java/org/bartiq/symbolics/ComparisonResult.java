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

/** The outcome of {@link AlgebraEngine#compare}. */
public enum ComparisonResult {
  /** The two expressions are provably equal. */
  EQUAL,
  /** The two expressions provably differ. */
  NOT_EQUAL,
  /** Equality depends on the values of free symbols. */
  UNKNOWN
}
