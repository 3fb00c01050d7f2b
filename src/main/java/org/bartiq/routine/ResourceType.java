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

/**
 * How a resource combines across the children of a routine. Only ADDITIVE and MULTIPLICATIVE
 * resources are combined automatically; the others are carried through unchanged.
 */
public enum ResourceType {
  /** Summed over children, and over the iterations of a repetition. */
  ADDITIVE,
  /** Multiplied over the iterations of a repetition. */
  MULTIPLICATIVE,
  QUBITS,
  OTHER
}
