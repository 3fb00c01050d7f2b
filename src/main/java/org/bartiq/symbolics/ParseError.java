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

/** All errors detected while reading expression text throw a ParseError. */
public class ParseError extends RuntimeException {
  public final String msg;

  /** The complete text that was being parsed. */
  public final String text;

  /** The offset of the offending character within {@link #text}, or -1 if unknown. */
  public final int position;

  public ParseError(String msg, String text, int position) {
    super(msg);
    this.msg = msg;
    this.text = text;
    this.position = position;
  }

  @Override
  public String getMessage() {
    if (position < 0) {
      return String.format("%s (in \"%s\")", msg, text);
    }
    return String.format("%s (%s in \"%s\")", msg, position, text);
  }
}
