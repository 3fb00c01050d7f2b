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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import org.bartiq.symbolics.AlgebraEngine;
import org.bartiq.symbolics.FunctionDefinition;
import org.jspecify.annotations.Nullable;

/**
 * Describes how the number of copies of a repeated child varies from one iteration of a {@link
 * Repetition} to the next.
 *
 * <p>There are five concrete subclasses:
 *
 * <ul>
 *   <li>{@link Constant}: every iteration contains {@code multiplier} copies;
 *   <li>{@link Arithmetic}: iteration k contains {@code initialTerm + k * difference} copies;
 *   <li>{@link Geometric}: iteration k contains {@code ratio^k} copies;
 *   <li>{@link ClosedForm}: the caller supplies the sum and/or product directly, in terms of a
 *       symbol standing for the number of iterations; and
 *   <li>{@link Custom}: iteration k contains {@code termExpression} copies, with the iterator
 *       symbol bound to k.
 * </ul>
 *
 * Sequences are immutable.
 */
public abstract class Sequence<E> {

  private Sequence() {}

  /**
   * Returns the total of an additive resource with per-copy value {@code expr} over {@code count}
   * iterations.
   *
   * @throws IllegalStateException if this sequence cannot compute a sum
   */
  public abstract E sum(E expr, E count, AlgebraEngine<E> engine);

  /**
   * Returns the combined value of a multiplicative resource with per-copy value {@code expr} over
   * {@code count} iterations.
   *
   * @throws IllegalStateException if this sequence cannot compute a product
   */
  public abstract E prod(E expr, E count, AlgebraEngine<E> engine);

  /**
   * Returns a sequence with the given values and functions substituted into each of its
   * expressions. Symbols bound by the sequence itself are never substituted.
   *
   * @throws IllegalStateException if {@code values} would rebind the iterator of a {@link Custom}
   *     sequence
   */
  public abstract Sequence<E> substitute(
      Map<String, E> values, Map<String, FunctionDefinition<E>> functions, AlgebraEngine<E> engine);

  /** Returns this sequence's expressions. */
  abstract ImmutableList<E> expressions();

  /** Returns the symbols bound by this sequence, which are not free in its expressions. */
  ImmutableSet<String> boundSymbols() {
    return ImmutableSet.of();
  }

  /** Returns the free symbols of this sequence's expressions, excluding those it binds. */
  public ImmutableSet<String> freeSymbols(AlgebraEngine<E> engine) {
    ImmutableSet.Builder<String> builder = ImmutableSet.builder();
    ImmutableSet<String> bound = boundSymbols();
    for (E expr : expressions()) {
      engine.freeSymbols(expr).stream().filter(s -> !bound.contains(s)).forEach(builder::add);
    }
    return builder.build();
  }

  @Override
  public boolean equals(Object other) {
    return other != null
        && other.getClass() == getClass()
        && expressions().equals(((Sequence<?>) other).expressions())
        && boundSymbols().equals(((Sequence<?>) other).boundSymbols());
  }

  @Override
  public int hashCode() {
    return Objects.hash(getClass(), expressions(), boundSymbols());
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + expressions();
  }

  public static <E> Sequence<E> constant(E multiplier) {
    return new Constant<>(multiplier);
  }

  public static <E> Sequence<E> arithmetic(E initialTerm, E difference) {
    return new Arithmetic<>(initialTerm, difference);
  }

  public static <E> Sequence<E> geometric(E ratio) {
    return new Geometric<>(ratio);
  }

  /**
   * Returns a sequence whose sum and product are given directly; either may be null if it is not
   * known. Both are expressed in terms of {@code numTermsSymbol}.
   */
  public static <E> Sequence<E> closedForm(
      @Nullable E sum, @Nullable E prod, String numTermsSymbol) {
    return new ClosedForm<>(sum, prod, numTermsSymbol);
  }

  public static <E> Sequence<E> custom(E termExpression, String iteratorSymbol) {
    return new Custom<>(termExpression, iteratorSymbol);
  }

  /** Returns a custom sequence whose iterator symbol is {@code i}. */
  public static <E> Sequence<E> custom(E termExpression) {
    return new Custom<>(termExpression, Custom.DEFAULT_ITERATOR);
  }

  private static <E> E substitute(
      E expr,
      Map<String, E> values,
      Map<String, FunctionDefinition<E>> functions,
      AlgebraEngine<E> engine) {
    return engine.substitute(expr, values, functions);
  }

  /** Every iteration has the same number of copies. */
  public static final class Constant<E> extends Sequence<E> {
    public final E multiplier;

    private Constant(E multiplier) {
      this.multiplier = checkNotNull(multiplier);
    }

    @Override
    public E sum(E expr, E count, AlgebraEngine<E> engine) {
      return engine.mul(engine.mul(count, multiplier), expr);
    }

    @Override
    public E prod(E expr, E count, AlgebraEngine<E> engine) {
      return engine.pow(expr, engine.mul(count, multiplier));
    }

    @Override
    public Sequence<E> substitute(
        Map<String, E> values,
        Map<String, FunctionDefinition<E>> functions,
        AlgebraEngine<E> engine) {
      return new Constant<>(Sequence.substitute(multiplier, values, functions, engine));
    }

    @Override
    ImmutableList<E> expressions() {
      return ImmutableList.of(multiplier);
    }
  }

  /** The number of copies grows by a fixed difference from one iteration to the next. */
  public static final class Arithmetic<E> extends Sequence<E> {
    public final E initialTerm;
    public final E difference;

    private Arithmetic(E initialTerm, E difference) {
      this.initialTerm = checkNotNull(initialTerm);
      this.difference = checkNotNull(difference);
    }

    @Override
    public E sum(E expr, E count, AlgebraEngine<E> engine) {
      // count * (2 * a + (count - 1) * d) / 2
      E one = engine.number(1);
      E two = engine.number(2);
      E total =
          engine.add(
              engine.mul(two, initialTerm), engine.mul(engine.sub(count, one), difference));
      return engine.mul(engine.div(engine.mul(count, total), two), expr);
    }

    @Override
    public E prod(E expr, E count, AlgebraEngine<E> engine) {
      // d^count * gamma(a/d + count) / gamma(a/d) * expr^count
      E ratio = engine.div(initialTerm, difference);
      E gammas =
          engine.div(
              engine.call("gamma", ImmutableList.of(engine.add(ratio, count))),
              engine.call("gamma", ImmutableList.of(ratio)));
      return engine.mul(
          engine.mul(engine.pow(difference, count), gammas), engine.pow(expr, count));
    }

    @Override
    public Sequence<E> substitute(
        Map<String, E> values,
        Map<String, FunctionDefinition<E>> functions,
        AlgebraEngine<E> engine) {
      return new Arithmetic<>(
          Sequence.substitute(initialTerm, values, functions, engine),
          Sequence.substitute(difference, values, functions, engine));
    }

    @Override
    ImmutableList<E> expressions() {
      return ImmutableList.of(initialTerm, difference);
    }
  }

  /** The number of copies is multiplied by a fixed ratio from one iteration to the next. */
  public static final class Geometric<E> extends Sequence<E> {
    public final E ratio;

    private Geometric(E ratio) {
      this.ratio = checkNotNull(ratio);
    }

    @Override
    public E sum(E expr, E count, AlgebraEngine<E> engine) {
      E one = engine.number(1);
      return engine.div(
          engine.mul(expr, engine.sub(one, engine.pow(ratio, count))), engine.sub(one, ratio));
    }

    @Override
    public E prod(E expr, E count, AlgebraEngine<E> engine) {
      // The product of ratio^k * expr for k in [0, count)
      E one = engine.number(1);
      E exponent = engine.div(engine.mul(count, engine.sub(count, one)), engine.number(2));
      return engine.mul(engine.pow(expr, count), engine.pow(ratio, exponent));
    }

    @Override
    public Sequence<E> substitute(
        Map<String, E> values,
        Map<String, FunctionDefinition<E>> functions,
        AlgebraEngine<E> engine) {
      return new Geometric<>(Sequence.substitute(ratio, values, functions, engine));
    }

    @Override
    ImmutableList<E> expressions() {
      return ImmutableList.of(ratio);
    }
  }

  /** A sequence whose sum and product are known in closed form. */
  public static final class ClosedForm<E> extends Sequence<E> {
    public final @Nullable E sum;
    public final @Nullable E prod;

    /** The symbol that {@link #sum} and {@link #prod} use for the number of iterations. */
    public final String numTermsSymbol;

    private ClosedForm(@Nullable E sum, @Nullable E prod, String numTermsSymbol) {
      this.sum = sum;
      this.prod = prod;
      this.numTermsSymbol = checkNotNull(numTermsSymbol);
    }

    @Override
    public E sum(E expr, E count, AlgebraEngine<E> engine) {
      checkState(
          sum != null, "Cannot evaluate sum for closed-form sequence, as sum is not defined.");
      return engine.mul(expr, engine.substitute(sum, ImmutableMap.of(numTermsSymbol, count)));
    }

    @Override
    public E prod(E expr, E count, AlgebraEngine<E> engine) {
      checkState(
          prod != null,
          "Cannot evaluate product for closed-form sequence, as product is not defined.");
      return engine.mul(expr, engine.substitute(prod, ImmutableMap.of(numTermsSymbol, count)));
    }

    @Override
    public Sequence<E> substitute(
        Map<String, E> values,
        Map<String, FunctionDefinition<E>> functions,
        AlgebraEngine<E> engine) {
      Map<String, E> unbound = values;
      if (values.containsKey(numTermsSymbol)) {
        unbound = new HashMap<>(values);
        unbound.remove(numTermsSymbol);
      }
      return new ClosedForm<>(
          (sum == null) ? null : Sequence.substitute(sum, unbound, functions, engine),
          (prod == null) ? null : Sequence.substitute(prod, unbound, functions, engine),
          numTermsSymbol);
    }

    @Override
    ImmutableList<E> expressions() {
      ImmutableList.Builder<E> builder = ImmutableList.builder();
      if (sum != null) {
        builder.add(sum);
      }
      if (prod != null) {
        builder.add(prod);
      }
      return builder.build();
    }

    @Override
    ImmutableSet<String> boundSymbols() {
      return ImmutableSet.of(numTermsSymbol);
    }
  }

  /** A sequence given by an explicit expression for the number of copies in each iteration. */
  public static final class Custom<E> extends Sequence<E> {
    static final String DEFAULT_ITERATOR = "i";

    public final E termExpression;
    public final String iteratorSymbol;

    private Custom(E termExpression, String iteratorSymbol) {
      this.termExpression = checkNotNull(termExpression);
      this.iteratorSymbol = checkNotNull(iteratorSymbol);
    }

    @Override
    public E sum(E expr, E count, AlgebraEngine<E> engine) {
      return engine.sequenceSum(
          engine.mul(termExpression, expr),
          iteratorSymbol,
          engine.number(0),
          engine.sub(count, engine.number(1)));
    }

    @Override
    public E prod(E expr, E count, AlgebraEngine<E> engine) {
      return engine.sequenceProd(
          engine.mul(termExpression, expr),
          iteratorSymbol,
          engine.number(0),
          engine.sub(count, engine.number(1)));
    }

    @Override
    public Sequence<E> substitute(
        Map<String, E> values,
        Map<String, FunctionDefinition<E>> functions,
        AlgebraEngine<E> engine) {
      checkState(
          !values.containsKey(iteratorSymbol),
          "Tried to replace symbol that's used as iterator symbol in a sequence: %s.",
          iteratorSymbol);
      return new Custom<>(
          Sequence.substitute(termExpression, values, functions, engine), iteratorSymbol);
    }

    @Override
    ImmutableList<E> expressions() {
      return ImmutableList.of(termExpression);
    }

    @Override
    ImmutableSet<String> boundSymbols() {
      return ImmutableSet.of(iteratorSymbol);
    }
  }
}
