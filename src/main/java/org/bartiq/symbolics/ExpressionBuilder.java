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

/**
 * The callbacks through which {@link ExpressionSyntax} assembles engine expressions. Each algebra
 * engine supplies one; the syntax layer never constructs expressions itself.
 *
 * <p>Methods may throw IllegalArgumentException to reject a construct (e.g. a built-in function
 * called with the wrong number of arguments); the parser reports it as a {@link ParseError} at
 * the offending position.
 */
public interface ExpressionBuilder<E> {

  /** Returns a number, given its source text (an integer, decimal, or scientific literal). */
  E number(String text);

  /**
   * Returns a symbol. {@code name} may be a plain name, a port reference ({@code #in_0}), a
   * dotted path ({@code a.b.T}), or a wildcarded path ({@code ~.T}).
   */
  E symbol(String name);

  /** Returns a pattern wildcard; {@code name} does not include the leading {@code $}. */
  E wild(String name);

  /** Returns an application of the named function. */
  E call(String name, List<E> args);

  E negate(E x);

  E add(E x, E y);

  E subtract(E x, E y);

  E multiply(E x, E y);

  E divide(E x, E y);

  /** Returns {@code floor(x / y)}. */
  E floorDivide(E x, E y);

  E modulo(E x, E y);

  E power(E x, E y);
}
