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
import java.util.Collection;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.bartiq.routine.CompiledRoutine;
import org.bartiq.routine.Resource;

/** Applies a rewriting history to resources throughout a compiled routine. */
public final class RoutineRewriting {
  private static final Logger logger = Logger.getLogger(RoutineRewriting.class.getName());

  public static <E> CompiledRoutine<E> rewriteRoutineResources(
      CompiledRoutine<E> routine,
      String resource,
      List<Instruction> instructions,
      RewriterFactory<E> factory) {
    return rewriteRoutineResources(routine, ImmutableList.of(resource), instructions, factory);
  }

  /**
   * Returns a copy of {@code routine} in which each of the named resources, in the routine and in
   * all of its descendants, has been rewritten by replaying {@code instructions}. Numeric values,
   * and routines that do not have the resource, are left unchanged.
   */
  public static <E> CompiledRoutine<E> rewriteRoutineResources(
      CompiledRoutine<E> routine,
      Collection<String> resources,
      List<Instruction> instructions,
      RewriterFactory<E> factory) {
    CompiledRoutine.Builder<E> builder = routine.toBuilder();
    for (CompiledRoutine<E> child : routine.children.values()) {
      builder.child(rewriteRoutineResources(child, resources, instructions, factory));
    }
    for (String name : resources) {
      Resource<E> resource = routine.resources.get(name);
      if (resource == null) {
        continue;
      }
      ExpressionRewriter<E> rewriter = factory.create(resource.value);
      if (!rewriter.isNumeric()) {
        E rewritten = rewriter.withInstructions(instructions).expression;
        if (logger.isLoggable(Level.FINE)) {
          logger.fine(String.format("Rewrote %s of %s as %s", name, routine.name, rewritten));
        }
        builder.resource(resource.withValue(rewritten));
      }
    }
    return builder.build();
  }

  // Statics only
  private RoutineRewriting() {}
}
