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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.List;
import java.util.Map;
import org.bartiq.rewriter.Instruction.Assumption;
import org.bartiq.routine.CompiledRoutine;
import org.bartiq.symbolics.FunctionDefinition;
import org.jspecify.annotations.Nullable;

/**
 * Rewrites one resource of a compiled routine, recording each step so that the same steps can
 * then be applied to that resource throughout the routine's tree.
 *
 * <p>Unlike an {@link ExpressionRewriter}, a ResourceRewriter is mutable: each method replaces its
 * current rewriter and returns {@code this}.
 */
public final class ResourceRewriter<E> {
  public final CompiledRoutine<E> routine;
  public final String resource;
  private final RewriterFactory<E> factory;
  private ExpressionRewriter<E> rewriter;

  /**
   * @throws RewriterError if {@code routine} does not have the named resource
   */
  public ResourceRewriter(CompiledRoutine<E> routine, String resource, RewriterFactory<E> factory) {
    E value = routine.resourceValue(resource);
    if (value == null) {
      throw RewriterError.of("Routine %s has no resource %s.", routine.name, resource);
    }
    this.routine = routine;
    this.resource = resource;
    this.factory = factory;
    this.rewriter = factory.create(value);
  }

  /** Returns a ResourceRewriter that has already applied the given instructions. */
  public static <E> ResourceRewriter<E> fromHistory(
      CompiledRoutine<E> routine,
      String resource,
      List<Instruction> instructions,
      RewriterFactory<E> factory) {
    ResourceRewriter<E> result = new ResourceRewriter<>(routine, resource, factory);
    result.rewriter = result.rewriter.withInstructions(instructions);
    return result;
  }

  public ExpressionRewriter<E> rewriter() {
    return rewriter;
  }

  public E expression() {
    return rewriter.expression;
  }

  public ImmutableList<Instruction> history() {
    return rewriter.history();
  }

  @CanIgnoreReturnValue
  public ResourceRewriter<E> simplify() {
    rewriter = rewriter.simplify();
    return this;
  }

  @CanIgnoreReturnValue
  public ResourceRewriter<E> expand() {
    rewriter = rewriter.expand();
    return this;
  }

  @CanIgnoreReturnValue
  public ResourceRewriter<E> assume(String assumption) {
    rewriter = rewriter.assume(assumption);
    return this;
  }

  @CanIgnoreReturnValue
  public ResourceRewriter<E> assume(Assumption assumption) {
    rewriter = rewriter.assume(assumption);
    return this;
  }

  @CanIgnoreReturnValue
  public ResourceRewriter<E> reapplyAllAssumptions() {
    rewriter = rewriter.reapplyAllAssumptions();
    return this;
  }

  @CanIgnoreReturnValue
  public ResourceRewriter<E> substitute(String pattern, String replacement) {
    rewriter = rewriter.substitute(pattern, replacement);
    return this;
  }

  @CanIgnoreReturnValue
  public ResourceRewriter<E> undoPrevious(int steps) {
    rewriter = rewriter.undoPrevious(steps);
    return this;
  }

  public @Nullable E focus(String... symbols) {
    return rewriter.focus(symbols);
  }

  public E evaluateExpression(
      Map<String, E> assignments, Map<String, FunctionDefinition<E>> functions) {
    return rewriter.evaluateExpression(assignments, functions);
  }

  /**
   * Returns a copy of the routine in which this resource has been rewritten, at every level of the
   * tree, by the steps taken so far.
   */
  public CompiledRoutine<E> applyToWholeRoutine() {
    return RoutineRewriting.rewriteRoutineResources(routine, resource, history(), factory);
  }
}
