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


package org.bartiq.rewriter;

import com.google.errorprone.annotations.FormatMethod;

/**
 * Thrown when a rewriter is asked to do something it cannot: parse a malformed assumption, undo
 * more steps than it has taken, or rewrite a resource that a routine does not have.
 */
public class RewriterError extends RuntimeException {
  public final String msg;

  public RewriterError(String msg) {
    super(msg);
    this.msg = msg;
  }

  @FormatMethod
  static RewriterError of(String fmt, Object... fmtArgs) {
    return new RewriterError(String.format(fmt, fmtArgs));
  }
}
