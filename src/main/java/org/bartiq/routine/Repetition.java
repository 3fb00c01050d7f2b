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

import com.google.common.collect.ImmutableSet;
import java.util.Map;
import java.util.Objects;
import org.bartiq.symbolics.AlgebraEngine;
import org.bartiq.symbolics.FunctionDefinition;

/**
 * Specifies that a routine consists of {@link #count} iterations of its only child, with the
 * number of copies in each iteration described by {@link #sequence}.
 */
public final class Repetition<E> {
  public final E count;
  public final Sequence<E> sequence;

  public Repetition(E count, Sequence<E> sequence) {
    this.count = checkNotNull(count);
    this.sequence = checkNotNull(sequence);
  }

  /** Returns the total over all iterations of an additive resource with per-copy value expr. */
  public E sum(E expr, AlgebraEngine<E> engine) {
    return sequence.sum(expr, count, engine);
  }

  /** Returns the product over all iterations of a multiplicative resource. */
  public E prod(E expr, AlgebraEngine<E> engine) {
    return sequence.prod(expr, count, engine);
  }

  public Repetition<E> substitute(
      Map<String, E> values,
      Map<String, FunctionDefinition<E>> functions,
      AlgebraEngine<E> engine) {
    return new Repetition<>(
        engine.substitute(count, values, functions),
        sequence.substitute(values, functions, engine));
  }

  public ImmutableSet<String> freeSymbols(AlgebraEngine<E> engine) {
    return ImmutableSet.<String>builder()
        .addAll(engine.freeSymbols(count))
        .addAll(sequence.freeSymbols(engine))
        .build();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Repetition<?> repetition
        && count.equals(repetition.count)
        && sequence.equals(repetition.sequence);
  }

  @Override
  public int hashCode() {
    return Objects.hash(count, sequence);
  }

  @Override
  public String toString() {
    return String.format("repeat %s times: %s", count, sequence);
  }
}
