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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * The operations on symbolic expressions that the compiler and the rewriters rely on. Expressions
 * are opaque values of type {@code E}; all expressions handed to an engine must have been created
 * by the same engine.
 *
 * <p>Implementations must be thread-safe, and expressions must be immutable.
 */
public interface AlgebraEngine<E> {

  /**
   * Parses the given text.
   *
   * @throws ParseError if the text is malformed or calls a built-in function with the wrong
   *     number of arguments
   */
  E parse(String text);

  /** Returns the given number (a Long, Integer, BigInteger, or Double) as an expression. */
  E number(Number value);

  /** Returns a free symbol with the given name. */
  E symbol(String name);

  E add(E x, E y);

  E sub(E x, E y);

  E mul(E x, E y);

  E div(E x, E y);

  E pow(E base, E exponent);

  /** Returns the sum of the given terms; the sum of no terms is zero. */
  E sum(List<E> terms);

  /** Returns the largest of the given arguments; at least one argument is required. */
  E max(List<E> args);

  /** Returns the smallest of the given arguments; at least one argument is required. */
  E min(List<E> args);

  /**
   * Returns an application of the named function. Built-in functions are evaluated as far as
   * their arguments allow; any other name produces an uninterpreted function call.
   */
  E call(String name, List<E> args);

  /**
   * Replaces each free symbol whose name is a key of {@code values} by the corresponding
   * expression, and each call of a function whose name is a key of {@code functions} by the result
   * of that function. If the result has no free symbols it is reduced to a number.
   *
   * @throws IllegalArgumentException if {@code functions} names a built-in function
   */
  E substitute(E expr, Map<String, E> values, Map<String, FunctionDefinition<E>> functions);

  default E substitute(E expr, Map<String, E> values) {
    return substitute(expr, values, ImmutableMap.of());
  }

  /** Returns an equivalent expression that is no larger than {@code expr}, often smaller. */
  E simplify(E expr);

  /** Distributes products and integer powers over sums. */
  E expand(E expr);

  /**
   * Returns the names of the free symbols of {@code expr}. Iterators bound by {@code sum_over} and
   * {@code prod_over} are not free.
   */
  ImmutableSet<String> freeSymbols(E expr);

  /**
   * Returns the numeric value of {@code expr} (a Long, BigInteger or Double), or null if it
   * depends on free symbols or is not finite.
   */
  @Nullable Number numericValue(E expr);

  /** Determines whether {@code lhs} and {@code rhs} are equal. */
  ComparisonResult compare(E lhs, E rhs);

  /** Returns text that {@link #parse} maps back to an equal expression. */
  String serialize(E expr);

  /**
   * Replaces free symbols that spell a well-known constant ({@code pi}, {@code e}, {@code oo},
   * {@code infinity}; lower case, upper case or capitalized) by that constant.
   */
  E parseConstant(E expr);

  /** Returns the sum of {@code term} as {@code iterator} runs from {@code start} to {@code end}. */
  E sequenceSum(E term, String iterator, E start, E end);

  /**
   * Returns the product of {@code term} for {@code iterator} running from {@code start} to {@code
   * end}.
   */
  E sequenceProd(E term, String iterator, E start, E end);

  /**
   * Returns the names of functions called in {@code expr} that are neither built in nor in {@code
   * userDefined}, each mapped to the most similar built-in name or to the empty string if no
   * built-in is similar enough.
   */
  ImmutableMap<String, String> findUndefinedFunctions(E expr, Set<String> userDefined);

  /** If {@code expr} is a single free symbol, returns its name; otherwise returns null. */
  @Nullable String singleParameterName(E expr);

  /** Returns true if {@code expr} is an integer constant. */
  boolean isConstantInt(E expr);

  /** Returns the names of all built-in functions. */
  ImmutableSet<String> reservedFunctions();

  /**
   * Replaces each wildcard symbol that is a key of {@code expansions} by the symbols it expands to.
   * A wildcard used as a function argument contributes one argument per expansion; elsewhere it
   * must expand to exactly one symbol.
   *
   * @throws IllegalArgumentException if a wildcard outside a function call does not expand to
   *     exactly one symbol
   */
  E unrollWildcards(E expr, Map<String, ImmutableList<String>> expansions);
}
