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

/** Which way data flows through a {@link Port}. */
public enum PortDirection {
  INPUT,
  OUTPUT,
  /** A port that is both consumed and produced, e.g. a register operated on in place. */
  THROUGH;

  /** Returns true for INPUT and THROUGH ports, whose sizes are known before the routine runs. */
  public boolean isIncoming() {
    return this != OUTPUT;
  }

  /** Returns true for OUTPUT and THROUGH ports. */
  public boolean isOutgoing() {
    return this != INPUT;
  }
}
