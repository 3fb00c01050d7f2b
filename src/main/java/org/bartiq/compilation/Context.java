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

import org.bartiq.symbolics.ExpressionSyntax;

/** Identifies the routine being compiled by its dotted path from the root. */
final class Context {
  final String path;
  private final boolean isRoot;

  private Context(String path, boolean isRoot) {
    this.path = path;
    this.isRoot = isRoot;
  }

  static Context root(String name) {
    return new Context(name, true);
  }

  Context child(String name) {
    return new Context(ExpressionSyntax.joinPath(path, name), false);
  }

  boolean isRoot() {
    return isRoot;
  }

  @Override
  public String toString() {
    return path;
  }
}
