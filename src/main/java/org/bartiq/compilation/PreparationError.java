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

import com.google.errorprone.annotations.FormatMethod;

/**
 * Thrown when a preprocessing stage finds a routine whose structure it cannot safely repair.
 */
public class PreparationError extends RuntimeException {
  public final String msg;

  /** The dotted path of the routine at which the problem was found. */
  public final String path;

  /** The name of the preprocessing stage that failed. */
  public final String stage;

  public PreparationError(String msg, String path, String stage) {
    super(msg);
    this.msg = msg;
    this.path = path;
    this.stage = stage;
  }

  @FormatMethod
  static PreparationError of(String path, String stage, String fmt, Object... fmtArgs) {
    return new PreparationError(String.format(fmt, fmtArgs), path, stage);
  }

  @Override
  public String getMessage() {
    return String.format("%s (in %s, during %s)", msg, path, stage);
  }
}
