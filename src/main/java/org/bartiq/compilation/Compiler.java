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

import static org.bartiq.symbolics.ExpressionSyntax.joinPath;
import static org.bartiq.symbolics.ExpressionSyntax.portVariable;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.bartiq.compilation.CompilationError.ConstraintViolation;
import org.bartiq.compilation.CompilationError.RepetitionError;
import org.bartiq.compilation.CompilationError.UnresolvedParameter;
import org.bartiq.routine.CompiledRoutine;
import org.bartiq.routine.Constraint;
import org.bartiq.routine.ConstraintStatus;
import org.bartiq.routine.Endpoint;
import org.bartiq.routine.ParameterLink;
import org.bartiq.routine.Port;
import org.bartiq.routine.PortDirection;
import org.bartiq.routine.Repetition;
import org.bartiq.routine.Resource;
import org.bartiq.routine.Routine;
import org.bartiq.symbolics.AlgebraEngine;

/**
 * Compiles a routine tree, whose cost expressions are written in each routine's local terms, into
 * a {@link CompiledRoutine} whose expressions depend only on the root's parameters.
 *
 * <p>The root's parameters ("global parameters") are its input parameters (including those that
 * preprocessing promotes from its descendants) plus the free symbols of its input and through
 * port sizes. Each routine is compiled with a map from its local names to expressions over the
 * global parameters, which its parent builds while compiling itself:
 *
 * <ol>
 *   <li>constraints are checked, and dropped if they are provably true;
 *   <li>local variables are resolved;
 *   <li>input and through port sizes are resolved, and passed to the children they connect to,
 *       along with the values of linked parameters;
 *   <li>children are compiled in topological order, each one's output sizes being passed on to
 *       the siblings it connects to and its ports and resources becoming visible as {@code
 *       child.#port} and {@code child.resource};
 *   <li>if the routine is a repetition, its child's resources are summed or multiplied over the
 *       iterations;
 *   <li>resources are resolved;
 *   <li>output port sizes are resolved, from the port that connects to them if there is one; and
 *   <li>derived resources are computed.
 * </ol>
 */
public final class Compiler {

  private static final Logger logger = Logger.getLogger(Compiler.class.getName());

  /** Preprocesses and compiles {@code routine} with the default options. */
  public static <E> CompiledRoutine<E> compile(Routine<E> routine, AlgebraEngine<E> engine) {
    return compile(routine, engine, CompilationOptions.defaults());
  }

  /**
   * Preprocesses {@code routine} (in place) with the configured stages, then compiles it.
   *
   * @throws PreparationError if a preprocessing stage fails
   * @throws CompilationError if the routine cannot be compiled
   */
  public static <E> CompiledRoutine<E> compile(
      Routine<E> routine, AlgebraEngine<E> engine, CompilationOptions<E> options) {
    for (String name : options.functions.keySet()) {
      if (engine.reservedFunctions().contains(name)) {
        throw CompilationError.of(routine.name(), "Cannot redefine built-in function: %s", name);
      }
    }
    Preprocessing.preprocess(routine, engine, options.preprocessingStages);
    Set<String> globals = new LinkedHashSet<>(routine.inputParams());
    for (Port<E> port : routine.ports().values()) {
      if (!port.direction.isIncoming()) {
        continue;
      } else if (port.size == null) {
        globals.add(portVariable(port.name));
      } else {
        globals.addAll(engine.freeSymbols(port.size));
      }
    }
    Map<String, E> inbound = new LinkedHashMap<>();
    globals.forEach(name -> inbound.put(name, engine.symbol(name)));
    NodeCompiler<E> compiler = new NodeCompiler<>(engine, options, ImmutableSet.copyOf(globals));
    CompiledRoutine<E> result = compiler.compile(routine, Context.root(routine.name()), inbound);
    for (PostprocessingStage<E> stage : options.postprocessingStages) {
      result = stage.apply(result, engine);
    }
    return result;
  }

  /** Holds the state shared by the recursive compilation of every routine in a tree. */
  private static class NodeCompiler<E> {
    final AlgebraEngine<E> engine;
    final CompilationOptions<E> options;
    final ImmutableSet<String> globals;

    NodeCompiler(
        AlgebraEngine<E> engine, CompilationOptions<E> options, ImmutableSet<String> globals) {
      this.engine = engine;
      this.options = options;
      this.globals = globals;
    }

    E substitute(E expr, Map<String, E> scope) {
      return engine.substitute(expr, scope, options.functions);
    }

    /**
     * Compiles {@code routine}, given the values (over global parameters) of the local names that
     * its parent provides.
     */
    CompiledRoutine<E> compile(Routine<E> routine, Context context, Map<String, E> inbound) {
      String path = context.path;
      if (logger.isLoggable(Level.FINE)) {
        logger.fine(String.format("Compiling %s with %s", path, inbound.keySet()));
      }
      Map<String, E> scope = new HashMap<>(inbound);

      List<Constraint<E>> remaining = new ArrayList<>();
      for (Constraint<E> constraint : routine.constraints()) {
        E lhs = substitute(constraint.lhs, scope);
        E rhs = substitute(constraint.rhs, scope);
        switch (engine.compare(lhs, rhs)) {
          case EQUAL -> {}
          case NOT_EQUAL -> throw new ConstraintViolation(
              path, constraint, new Constraint<>(lhs, rhs, ConstraintStatus.VIOLATED));
          case UNKNOWN -> remaining.add(new Constraint<>(lhs, rhs));
        }
      }

      routine.localVariables().forEach((name, value) -> scope.put(name, substitute(value, scope)));

      Map<String, Port<E>> compiledPorts = new HashMap<>();
      for (Port<E> port : routine.ports().values()) {
        if (port.direction.isIncoming()) {
          String variable = portVariable(port.name);
          E size = substitute((port.size == null) ? engine.symbol(variable) : port.size, scope);
          compiledPorts.put(port.name, port.withSize(size));
          scope.put(variable, size);
        }
      }

      // The values that each child's local names will have.
      Map<String, Map<String, E>> childScopes = new HashMap<>();
      routine.children().keySet().forEach(name -> childScopes.put(name, new HashMap<>()));
      for (Map.Entry<Endpoint, Endpoint> connection : routine.connections().entrySet()) {
        Endpoint source = connection.getKey();
        Endpoint target = connection.getValue();
        if (source.isOwn() && !target.isOwn()) {
          Port<E> port = compiledPorts.get(source.portName);
          if (port == null) {
            throw CompilationError.of(
                path, "Connection %s -> %s must start at an input or through port", source, target);
          }
          childScope(childScopes, target.routineName, path)
              .put(portVariable(target.portName), port.size);
        }
      }
      routine
          .linkedParams()
          .forEach(
              (param, links) -> {
                E value = substitute(engine.symbol(param), scope);
                for (ParameterLink link : links) {
                  childScope(childScopes, link.childPath, path).put(link.param, value);
                }
              });

      Map<String, CompiledRoutine<E>> compiledChildren = new HashMap<>();
      List<String> order =
          TopologicalSort.sort(path, routine.children().keySet(), routine.connections());
      for (String name : order) {
        CompiledRoutine<E> child =
            compile(routine.children().get(name), context.child(name), childScopes.get(name));
        compiledChildren.put(name, child);
        for (Map.Entry<Endpoint, Endpoint> connection : routine.connections().entrySet()) {
          Endpoint source = connection.getKey();
          Endpoint target = connection.getValue();
          if (name.equals(source.routineName) && !target.isOwn()) {
            childScope(childScopes, target.routineName, path)
                .put(portVariable(target.portName), childPortSize(child, source, path));
          }
        }
        for (Port<E> port : child.ports.values()) {
          scope.put(joinPath(name, portVariable(port.name)), port.size);
        }
        for (Resource<E> resource : child.resources.values()) {
          scope.put(joinPath(name, resource.name), resource.value);
        }
      }

      CompiledRoutine.Builder<E> builder =
          CompiledRoutine.<E>builder(routine.name())
              .type(routine.type())
              .connections(routine.connections())
              .constraints(remaining);

      Map<String, Resource<E>> repeated = new LinkedHashMap<>();
      Repetition<E> repetition = routine.repetition();
      if (repetition != null) {
        if (compiledChildren.size() != 1) {
          throw new RepetitionError(
              String.format(
                  "A repeated routine must have exactly one child, found %s",
                  compiledChildren.size()),
              path);
        }
        CompiledRoutine<E> child = Iterables.getOnlyElement(compiledChildren.values());
        try {
          Repetition<E> compiled = repetition.substitute(scope, options.functions, engine);
          for (Resource<E> resource : child.resources.values()) {
            E value =
                switch (resource.type) {
                  case ADDITIVE -> compiled.sum(resource.value, engine);
                  case MULTIPLICATIVE -> compiled.prod(resource.value, engine);
                  default -> resource.value;
                };
            repeated.put(resource.name, resource.withValue(value));
          }
          builder.repetition(compiled);
        } catch (IllegalStateException e) {
          RepetitionError error = new RepetitionError(e.getMessage(), path);
          error.initCause(e);
          throw error;
        }
      }

      for (Resource<E> resource : routine.resources().values()) {
        Resource<E> replacement = repeated.remove(resource.name);
        builder.resource(
            (replacement != null)
                ? replacement
                : resource.withValue(substitute(resource.value, scope)));
      }
      repeated.values().forEach(builder::resource);

      Map<String, Endpoint> outputSources = new HashMap<>();
      routine
          .connections()
          .forEach(
              (source, target) -> {
                if (target.isOwn()) {
                  outputSources.put(target.portName, source);
                }
              });
      for (Port<E> port : routine.ports().values()) {
        if (port.direction != PortDirection.OUTPUT) {
          builder.port(compiledPorts.get(port.name));
          continue;
        }
        Endpoint source = outputSources.get(port.name);
        E size;
        if (source == null) {
          if (port.size == null) {
            throw UnresolvedParameter.of(
                path,
                portVariable(port.name),
                "Output port %s has no size and is not connected to any port",
                port.name);
          }
          size = substitute(port.size, scope);
        } else if (source.isOwn()) {
          Port<E> ownPort = compiledPorts.get(source.portName);
          if (ownPort == null) {
            throw CompilationError.of(
                path, "Output port %s is connected from unknown port %s", port.name, source);
          }
          size = ownPort.size;
        } else {
          size = childPortSize(compiledChildren.get(source.routineName), source, path);
        }
        builder.port(port.withSize(size));
      }

      for (String name : routine.children().keySet()) {
        builder.child(compiledChildren.get(name));
      }
      for (DerivedResource<E> derived : options.derivedResources) {
        E value = derived.compute(builder.build(), engine);
        if (value != null) {
          builder.resource(new Resource<>(derived.name, derived.type, value));
        }
      }

      CompiledRoutine<E> compiled = builder.build();
      Set<String> used = new TreeSet<>();
      compiled.ports.values().forEach(p -> used.addAll(engine.freeSymbols(p.size)));
      compiled.resources.values().forEach(r -> used.addAll(engine.freeSymbols(r.value)));
      for (Constraint<E> constraint : compiled.constraints) {
        used.addAll(engine.freeSymbols(constraint.lhs));
        used.addAll(engine.freeSymbols(constraint.rhs));
      }
      if (compiled.repetition != null) {
        used.addAll(compiled.repetition.freeSymbols(engine));
      }
      if (options.verify) {
        for (String symbol : used) {
          if (!globals.contains(symbol)) {
            throw UnresolvedParameter.of(
                path, symbol, "%s is not resolved to a parameter of the root routine", symbol);
          }
        }
      }
      return builder.inputParams(context.isRoot() ? globals : used).build();
    }

    /** Returns the scope being built for the named child. */
    private Map<String, E> childScope(
        Map<String, Map<String, E>> childScopes, String childName, String path) {
      Map<String, E> result = childScopes.get(childName);
      if (result == null) {
        throw CompilationError.of(path, "There is no child named %s", childName);
      }
      return result;
    }

    /** Returns the compiled size of the given child port. */
    private E childPortSize(CompiledRoutine<E> child, Endpoint endpoint, String path) {
      Port<E> port = (child == null) ? null : child.ports.get(endpoint.portName);
      if (port == null || port.size == null) {
        throw CompilationError.of(path, "There is no port %s", endpoint);
      }
      return port.size;
    }
  }

  // Statics only
  private Compiler() {}
}
