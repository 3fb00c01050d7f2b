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

import static com.google.common.base.Preconditions.checkArgument;
import static org.bartiq.symbolics.ExpressionSyntax.joinPath;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bartiq.compilation.CompilationError.ConstraintViolation;
import org.bartiq.compilation.CompilationError.RepetitionError;
import org.bartiq.routine.CompiledRoutine;
import org.bartiq.routine.Constraint;
import org.bartiq.routine.ConstraintStatus;
import org.bartiq.routine.Port;
import org.bartiq.routine.Resource;
import org.bartiq.symbolics.AlgebraEngine;
import org.bartiq.symbolics.FunctionDefinition;

/**
 * Assigns values to some or all of a compiled routine's parameters, producing a new compiled
 * routine. Assignments are usually numbers but may be arbitrary expressions.
 */
public final class Evaluator {

  public static <E> CompiledRoutine<E> evaluate(
      CompiledRoutine<E> compiled, Map<String, E> assignments, AlgebraEngine<E> engine) {
    return evaluate(compiled, assignments, engine, ImmutableMap.of());
  }

  /**
   * Substitutes {@code assignments} into every port size, resource value, constraint and
   * repetition of {@code compiled} and its descendants.
   *
   * <p>The result's parameters are the unassigned parameters of {@code compiled} together with the
   * free symbols of the assigned values.
   *
   * @throws CompilationError if an assignment names something other than a parameter of {@code
   *     compiled}
   * @throws ConstraintViolation if the assignments make a remaining constraint false
   */
  public static <E> CompiledRoutine<E> evaluate(
      CompiledRoutine<E> compiled,
      Map<String, E> assignments,
      AlgebraEngine<E> engine,
      Map<String, FunctionDefinition<E>> functions) {
    for (String name : assignments.keySet()) {
      if (!compiled.inputParams.contains(name)) {
        throw CompilationError.of(
            compiled.name,
            "Cannot set unknown variable %s; known variables are %s.",
            name,
            compiled.inputParams);
      }
    }
    return new Substituter<>(engine, assignments, functions).apply(compiled, compiled.name);
  }

  /**
   * Parses assignments of the form {@code "N = 10"}.
   *
   * @throws IllegalArgumentException if an assignment has no {@code =}
   */
  public static <E> ImmutableMap<String, E> parseAssignments(
      List<String> assignments, AlgebraEngine<E> engine) {
    Map<String, E> result = new LinkedHashMap<>();
    for (String assignment : assignments) {
      int eq = assignment.indexOf('=');
      checkArgument(eq > 0, "Expected an assignment of the form \"name = value\": %s", assignment);
      result.put(
          assignment.substring(0, eq).trim(), engine.parse(assignment.substring(eq + 1).trim()));
    }
    return ImmutableMap.copyOf(result);
  }

  private static class Substituter<E> {
    final AlgebraEngine<E> engine;
    final Map<String, E> assignments;
    final Map<String, FunctionDefinition<E>> functions;

    Substituter(
        AlgebraEngine<E> engine,
        Map<String, E> assignments,
        Map<String, FunctionDefinition<E>> functions) {
      this.engine = engine;
      this.assignments = assignments;
      this.functions = functions;
    }

    E substitute(E expr) {
      return engine.substitute(expr, assignments, functions);
    }

    CompiledRoutine<E> apply(CompiledRoutine<E> routine, String path) {
      CompiledRoutine.Builder<E> builder = routine.toBuilder();
      List<Constraint<E>> constraints = new ArrayList<>();
      for (Constraint<E> constraint : routine.constraints) {
        E lhs = substitute(constraint.lhs);
        E rhs = substitute(constraint.rhs);
        switch (engine.compare(lhs, rhs)) {
          case EQUAL -> {}
          case NOT_EQUAL -> throw new ConstraintViolation(
              path, constraint, new Constraint<>(lhs, rhs, ConstraintStatus.VIOLATED));
          case UNKNOWN -> constraints.add(new Constraint<>(lhs, rhs, constraint.status));
        }
      }
      builder.constraints(constraints);
      for (Port<E> port : routine.ports.values()) {
        if (port.size != null) {
          builder.port(port.withSize(substitute(port.size)));
        }
      }
      List<Resource<E>> resources = new ArrayList<>();
      for (Resource<E> resource : routine.resources.values()) {
        resources.add(resource.withValue(substitute(resource.value)));
      }
      builder.resources(resources);
      if (routine.repetition != null) {
        try {
          builder.repetition(routine.repetition.substitute(assignments, functions, engine));
        } catch (IllegalStateException e) {
          RepetitionError error = new RepetitionError(e.getMessage(), path);
          error.initCause(e);
          throw error;
        }
      }
      for (CompiledRoutine<E> child : routine.children.values()) {
        builder.child(apply(child, joinPath(path, child.name)));
      }
      List<String> params = new ArrayList<>();
      for (String param : routine.inputParams) {
        E value = assignments.get(param);
        if (value == null) {
          params.add(param);
        } else {
          params.addAll(engine.freeSymbols(value));
        }
      }
      return builder.inputParams(params).build();
    }
  }

  // Statics only
  private Evaluator() {}
}
