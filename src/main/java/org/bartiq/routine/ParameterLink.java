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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Objects;

/**
 * The target of a linked parameter: the value of a parent's parameter is passed to parameter
 * {@link #param} of the descendant at {@link #childPath}. Until linked parameters are flattened
 * the path may have several segments ({@code "a.b"}); afterwards it names a direct child.
 */
public final class ParameterLink {
  public final String childPath;
  public final String param;

  public ParameterLink(String childPath, String param) {
    this.childPath = checkNotNull(childPath);
    this.param = checkNotNull(param);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ParameterLink link
        && childPath.equals(link.childPath)
        && param.equals(link.param);
  }

  @Override
  public int hashCode() {
    return Objects.hash(childPath, param);
  }

  @Override
  public String toString() {
    return childPath + "." + param;
  }
}
