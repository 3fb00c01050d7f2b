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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.bartiq.rewriter.Instruction.Assumption;
import org.bartiq.rewriter.Instruction.Substitution;
import org.bartiq.symbolics.AlgebraEngine;
import org.bartiq.symbolics.FunctionDefinition;
import org.jspecify.annotations.Nullable;

/**
 * An expression together with the sequence of {@link Instruction}s that produced it from some
 * original expression.
 *
 * <p>ExpressionRewriters are immutable; each transforming method returns a new rewriter whose
 * history is one instruction longer, and which links back to this one so that the step can be
 * undone.
 *
 * <p>Subclasses supply the parts that depend on the representation of expressions: applying an
 * assumption or a substitution, and taking an expression apart.
 */
public abstract class ExpressionRewriter<E> {
  protected final AlgebraEngine<E> engine;

  /** The current expression. */
  public final E expression;

  /**
   * For each symbol introduced by a (non-wildcard) substitution, the symbols of the pattern it
   * replaced.
   */
  private final ImmutableMap<String, ImmutableSet<String>> linkedSymbols;

  /** The instruction that produced this rewriter from {@link #previous}. */
  private final Instruction instruction;

  private final @Nullable ExpressionRewriter<E> previous;

  /** Creates a rewriter with an empty history. */
  protected ExpressionRewriter(AlgebraEngine<E> engine, E expression) {
    this.engine = checkNotNull(engine);
    this.expression = checkNotNull(expression);
    this.linkedSymbols = ImmutableMap.of();
    this.instruction = Instruction.INITIAL;
    this.previous = null;
  }

  /** Creates a rewriter that follows {@code previous} in a history. */
  protected ExpressionRewriter(
      ExpressionRewriter<E> previous,
      Instruction instruction,
      E expression,
      ImmutableMap<String, ImmutableSet<String>> linkedSymbols) {
    this.engine = previous.engine;
    this.expression = checkNotNull(expression);
    this.linkedSymbols = linkedSymbols;
    this.instruction = instruction;
    this.previous = previous;
  }

  /** Returns a new rewriter that follows this one, created with the appropriate constructor. */
  protected abstract ExpressionRewriter<E> next(
      Instruction instruction, E expression, ImmutableMap<String, ImmutableSet<String>> linked);

  /** Returns {@code expr} rewritten to take account of {@code assumption}. */
  protected abstract E applyAssumption(E expr, Assumption assumption);

  /**
   * Returns {@code expr} with each occurrence of {@code pattern} replaced. If the pattern contains
   * wildcards, each symbol of the replacement with a wildcard's name stands for what it matched.
   */
  protected abstract E applySubstitution(E expr, E pattern, E replacement);

  /** Returns the terms of the current expression, or just the expression if it is not a sum. */
  public abstract ImmutableList<E> individualTerms();

  /** Returns every function call in the current expression, at any depth. */
  public abstract ImmutableSet<E> allFunctionsAndArguments();

  /**
   * Returns the arguments of each call of the named function (ignoring case) in the current
   * expression.
   */
  public abstract ImmutableList<ImmutableList<E>> listArgumentsOfFunction(String name);

  public ImmutableSet<String> freeSymbols() {
    return engine.freeSymbols(expression);
  }

  /** True if the current expression is a number. */
  public boolean isNumeric() {
    return engine.numericValue(expression) != null;
  }

  public ImmutableMap<String, ImmutableSet<String>> linkedSymbols() {
    return linkedSymbols;
  }

  public ExpressionRewriter<E> simplify() {
    return next(Instruction.SIMPLIFY, engine.simplify(expression), linkedSymbols);
  }

  public ExpressionRewriter<E> expand() {
    return next(Instruction.EXPAND, engine.expand(expression), linkedSymbols);
  }

  /** Parses {@code assumption} (e.g. {@code "X > 5"}) and applies it. */
  public ExpressionRewriter<E> assume(String assumption) {
    return assume(Assumption.parse(assumption));
  }

  public ExpressionRewriter<E> assume(Assumption assumption) {
    return next(assumption, applyAssumption(expression, assumption), linkedSymbols);
  }

  /**
   * Applies all of this rewriter's assumptions again, e.g. after a substitution has introduced
   * symbols that were not present when they were first applied.
   */
  public ExpressionRewriter<E> reapplyAllAssumptions() {
    E result = expression;
    for (Assumption assumption : assumptions()) {
      result = applyAssumption(result, assumption);
    }
    return next(Instruction.REAPPLY_ALL_ASSUMPTIONS, result, linkedSymbols);
  }

  public ExpressionRewriter<E> substitute(String pattern, String replacement) {
    return substitute(new Substitution(pattern, replacement));
  }

  public ExpressionRewriter<E> substitute(Substitution substitution) {
    E pattern = engine.parse(substitution.pattern);
    E replacement = engine.parse(substitution.replacement);
    E result = applySubstitution(expression, pattern, replacement);
    if (substitution.isWild()) {
      return next(substitution, result, linkedSymbols);
    }
    ImmutableSet<String> replaced = engine.freeSymbols(pattern);
    Map<String, ImmutableSet<String>> linked = new LinkedHashMap<>(linkedSymbols);
    for (String symbol : engine.freeSymbols(replacement)) {
      if (!replaced.contains(symbol)) {
        ImmutableSet<String> already = linked.get(symbol);
        linked.put(
            symbol,
            (already == null)
                ? replaced
                : ImmutableSet.<String>builder().addAll(already).addAll(replaced).build());
      }
    }
    return next(substitution, result, ImmutableMap.copyOf(linked));
  }

  /** Applies each of the given instructions in turn; {@link Instruction#INITIAL} is skipped. */
  public ExpressionRewriter<E> withInstructions(List<Instruction> instructions) {
    ExpressionRewriter<E> result = this;
    for (Instruction step : instructions) {
      result = result.apply(step);
    }
    return result;
  }

  private ExpressionRewriter<E> apply(Instruction step) {
    if (step == Instruction.INITIAL) {
      return this;
    } else if (step == Instruction.SIMPLIFY) {
      return simplify();
    } else if (step == Instruction.EXPAND) {
      return expand();
    } else if (step == Instruction.REAPPLY_ALL_ASSUMPTIONS) {
      return reapplyAllAssumptions();
    } else if (step instanceof Assumption assumption) {
      return assume(assumption);
    } else if (step instanceof Substitution substitution) {
      return substitute(substitution);
    }
    throw new IllegalArgumentException("Unknown instruction: " + step);
  }

  public ExpressionRewriter<E> undoPrevious() {
    return undoPrevious(1);
  }

  /** Returns the rewriter that this one was derived from by its last {@code steps} instructions. */
  public ExpressionRewriter<E> undoPrevious(int steps) {
    int available = history().size() - 1;
    if (steps > available) {
      throw RewriterError.of(
          "Attempting to undo too many operations! Only %s transforming commands in history.",
          available);
    } else if (steps < 1) {
      throw RewriterError.of("Can't undo fewer than one previous command.");
    }
    ExpressionRewriter<E> result = this;
    for (int i = 0; i < steps; i++) {
      result = result.previous;
    }
    return result;
  }

  /** Returns the rewriter at the start of this one's history. */
  public ExpressionRewriter<E> original() {
    ExpressionRewriter<E> result = this;
    while (result.previous != null) {
      result = result.previous;
    }
    return result;
  }

  /** Returns the instructions that produced this rewriter, starting with INITIAL. */
  public ImmutableList<Instruction> history() {
    List<Instruction> reversed = new ArrayList<>();
    for (ExpressionRewriter<E> r = this; r != null; r = r.previous) {
      reversed.add(r.instruction);
    }
    return ImmutableList.copyOf(reversed).reverse();
  }

  public ImmutableList<Assumption> assumptions() {
    ImmutableList.Builder<Assumption> builder = ImmutableList.builder();
    for (Instruction step : history()) {
      if (step instanceof Assumption assumption) {
        builder.add(assumption);
      }
    }
    return builder.build();
  }

  public ImmutableList<Substitution> substitutions() {
    ImmutableList.Builder<Substitution> builder = ImmutableList.builder();
    for (Instruction step : history()) {
      if (step instanceof Substitution substitution) {
        builder.add(substitution);
      }
    }
    return builder.build();
  }

  public @Nullable E focus(String... symbols) {
    return focus(Arrays.asList(symbols));
  }

  /**
   * Returns the sum of the terms of the current expression that contain any of the given symbols,
   * or any symbol that earlier substitutions linked to them, with each symbol factored out of the
   * terms that contain it. Returns null if no term contains any of them.
   */
  public @Nullable E focus(Collection<String> symbols) {
    Set<String> targets = new LinkedHashSet<>(symbols);
    boolean grew = true;
    while (grew) {
      grew = false;
      for (Map.Entry<String, ImmutableSet<String>> entry : linkedSymbols.entrySet()) {
        if (!targets.contains(entry.getKey())
            && entry.getValue().stream().anyMatch(targets::contains)) {
          targets.add(entry.getKey());
          grew = true;
        }
      }
    }
    List<E> remaining = new ArrayList<>(individualTerms());
    List<E> groups = new ArrayList<>();
    for (String target : targets) {
      List<E> factored = new ArrayList<>();
      List<E> others = new ArrayList<>();
      E symbol = engine.symbol(target);
      for (int i = 0; i < remaining.size(); ) {
        E term = remaining.get(i);
        if (!engine.freeSymbols(term).contains(target)) {
          i++;
          continue;
        }
        remaining.remove(i);
        E quotient = engine.div(term, symbol);
        if (engine.freeSymbols(quotient).contains(target)) {
          others.add(term);
        } else {
          factored.add(quotient);
        }
      }
      if (!factored.isEmpty()) {
        groups.add(engine.mul(symbol, engine.sum(factored)));
      }
      groups.addAll(others);
    }
    return groups.isEmpty() ? null : engine.sum(groups);
  }

  /** Returns the current expression with the given values substituted; the history is unchanged. */
  public E evaluateExpression(Map<String, E> assignments) {
    return engine.substitute(expression, assignments);
  }

  public E evaluateExpression(
      Map<String, E> assignments, Map<String, FunctionDefinition<E>> functions) {
    return engine.substitute(expression, assignments, functions);
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof ExpressionRewriter<?> rewriter
        && getClass() == rewriter.getClass()
        && expression.equals(rewriter.expression)
        && linkedSymbols.equals(rewriter.linkedSymbols)
        && instruction.equals(rewriter.instruction)
        && Objects.equals(previous, rewriter.previous);
  }

  @Override
  public int hashCode() {
    return Objects.hash(expression, instruction, previous);
  }

  @Override
  public String toString() {
    return engine.serialize(expression);
  }
}
