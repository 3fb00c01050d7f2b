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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import org.bartiq.routine.Constraint;
import org.bartiq.routine.Endpoint;
import org.bartiq.routine.ParameterLink;
import org.bartiq.routine.Port;
import org.bartiq.routine.PortDirection;
import org.bartiq.routine.Resource;
import org.bartiq.routine.ResourceType;
import org.bartiq.routine.Routine;
import org.bartiq.symbolics.AlgebraEngine;
import org.bartiq.symbolics.ExpressionSyntax;

/**
 * The standard preprocessing stages, which bring a routine tree into the form that {@link
 * Compiler} requires:
 *
 * <ol>
 *   <li>{@link #defaultMergeOutputSize}
 *   <li>{@link #addDefaultAdditiveResources}
 *   <li>{@link #insertPassthroughs}
 *   <li>{@link #flattenLinkedParams}
 *   <li>{@link #promoteUnlinkedInputs}
 *   <li>{@link #normalizePortVariables}
 *   <li>{@link #stripNonLeafInputSizes}
 *   <li>{@link #unrollWildcardResources}
 * </ol>
 *
 * Applying the default stages a second time leaves the tree unchanged.
 */
public final class Preprocessing {

  private static final Logger logger = Logger.getLogger(Preprocessing.class.getName());

  /** The type of routines whose output size defaults to the sum of their input sizes. */
  public static final String MERGE_TYPE = "merge";

  /** The type of the identity routines inserted by {@link #insertPassthroughs}. */
  public static final String PASSTHROUGH_TYPE = "passthrough";

  static final String PASSTHROUGH_PREFIX = "passthrough_";
  static final String PASSTHROUGH_INPUT = "in_0";
  static final String PASSTHROUGH_OUTPUT = "out_0";

  /** Returns the default stages, in the order in which they should be applied. */
  public static <E> ImmutableList<PreprocessingStage<E>> defaultStages() {
    return ImmutableList.of(
        Preprocessing::defaultMergeOutputSize,
        Preprocessing::addDefaultAdditiveResources,
        Preprocessing::insertPassthroughs,
        Preprocessing::flattenLinkedParams,
        Preprocessing::promoteUnlinkedInputs,
        Preprocessing::normalizePortVariables,
        Preprocessing::stripNonLeafInputSizes,
        Preprocessing::unrollWildcardResources);
  }

  /** Applies the default stages to the tree rooted at {@code root}. */
  public static <E> void preprocess(Routine<E> root, AlgebraEngine<E> engine) {
    preprocess(root, engine, defaultStages());
  }

  /** Applies each of {@code stages}, in order, to the tree rooted at {@code root}. */
  public static <E> void preprocess(
      Routine<E> root, AlgebraEngine<E> engine, List<PreprocessingStage<E>> stages) {
    if (logger.isLoggable(Level.FINE)) {
      logger.fine(String.format("Preprocessing %s with %s stages", root.name(), stages.size()));
    }
    for (PreprocessingStage<E> stage : stages) {
      stage.apply(root, engine);
    }
  }

  /**
   * Sets each unset output port size of a {@code merge} routine to the sum of its input port
   * variables.
   */
  public static <E> void defaultMergeOutputSize(Routine<E> root, AlgebraEngine<E> engine) {
    preorder(
        root,
        (routine, path) -> {
          if (!MERGE_TYPE.equals(routine.type())) {
            return;
          }
          List<E> inputs = new ArrayList<>();
          for (Port<E> port : routine.portsWith(PortDirection.INPUT)) {
            inputs.add(engine.symbol(portVariable(port.name)));
          }
          for (Port<E> port : routine.portsWith(PortDirection.OUTPUT)) {
            if (port.size == null) {
              routine.ports().put(port.name, port.withSize(engine.sum(inputs)));
            }
          }
        });
  }

  /**
   * For each additive resource defined by any child, gives the parent a resource of the same name
   * whose value is the sum of the children's values, unless the parent already defines it.
   * Applied bottom-up, so that additive resources propagate all the way to the root.
   */
  public static <E> void addDefaultAdditiveResources(Routine<E> root, AlgebraEngine<E> engine) {
    postorder(
        root,
        (routine, path) -> {
          Map<String, List<E>> sums = new LinkedHashMap<>();
          for (Routine<E> child : routine.children().values()) {
            for (Resource<E> resource : child.resources().values()) {
              if (resource.type == ResourceType.ADDITIVE) {
                sums.computeIfAbsent(resource.name, k -> new ArrayList<>())
                    .add(engine.symbol(joinPath(child.name(), resource.name)));
              }
            }
          }
          sums.forEach(
              (name, terms) -> {
                if (!routine.resources().containsKey(name)) {
                  routine
                      .resources()
                      .put(name, new Resource<>(name, ResourceType.ADDITIVE, engine.sum(terms)));
                }
              });
        });
  }

  /**
   * Replaces each connection from a routine's own input (or through) port directly to its own
   * output port with a zero-cost child of type {@code passthrough} interposed on the edge.
   *
   * @throws PreparationError if the routine has no children, or already has a child with the
   *     generated name
   */
  public static <E> void insertPassthroughs(Routine<E> root, AlgebraEngine<E> engine) {
    String stage = "insertPassthroughs";
    preorder(
        root,
        (routine, path) -> {
          boolean isLeaf = routine.isLeaf();
          Map<Endpoint, Endpoint> rewired = new LinkedHashMap<>();
          int index = 0;
          for (Map.Entry<Endpoint, Endpoint> entry : routine.connections().entrySet()) {
            Endpoint source = entry.getKey();
            Endpoint target = entry.getValue();
            if (!isPassthrough(routine, source, target)) {
              rewired.put(source, target);
              continue;
            }
            if (isLeaf) {
              throw PreparationError.of(
                  path,
                  stage,
                  "Cannot add a passthrough from %s to %s, as the routine has no children.",
                  source,
                  target);
            }
            String name = PASSTHROUGH_PREFIX + index++;
            if (routine.children().containsKey(name)) {
              throw PreparationError.of(
                  path,
                  stage,
                  "Cannot add passthrough named %s, as child with such name already exists.",
                  name);
            }
            routine.addChild(passthrough(name, engine));
            rewired.put(source, new Endpoint(name, PASSTHROUGH_INPUT));
            rewired.put(new Endpoint(name, PASSTHROUGH_OUTPUT), target);
          }
          if (index > 0) {
            routine.connections().clear();
            routine.connections().putAll(rewired);
          }
        });
  }

  private static <E> boolean isPassthrough(Routine<E> routine, Endpoint source, Endpoint target) {
    if (!source.isOwn() || !target.isOwn()) {
      return false;
    }
    Port<E> from = routine.ports().get(source.portName);
    Port<E> to = routine.ports().get(target.portName);
    return from != null
        && to != null
        && from.direction.isIncoming()
        && to.direction == PortDirection.OUTPUT;
  }

  private static <E> Routine<E> passthrough(String name, AlgebraEngine<E> engine) {
    return Routine.builder(name, engine)
        .type(PASSTHROUGH_TYPE)
        .port(PASSTHROUGH_INPUT, PortDirection.INPUT, null)
        .port(PASSTHROUGH_OUTPUT, PortDirection.OUTPUT, portVariable(PASSTHROUGH_INPUT))
        .build();
  }

  /**
   * Rewrites linked parameters so that each links to a parameter of a direct child. A link from
   * parameter {@code q} to {@code (a.b, p)} becomes a link to {@code (a, b.p)}, and {@code a}
   * gains an input parameter {@code b.p} linked to {@code (b, p)}; this is repeated top-down
   * until every link is one level deep.
   *
   * @throws PreparationError if a link names a child that does not exist
   */
  public static <E> void flattenLinkedParams(Routine<E> root, AlgebraEngine<E> engine) {
    String stage = "flattenLinkedParams";
    preorder(
        root,
        (routine, path) -> {
          for (Map.Entry<String, List<ParameterLink>> entry : routine.linkedParams().entrySet()) {
            List<ParameterLink> flattened = new ArrayList<>();
            for (ParameterLink link : entry.getValue()) {
              int dot = link.childPath.indexOf(ExpressionSyntax.PATH_SEPARATOR);
              String childName = (dot < 0) ? link.childPath : link.childPath.substring(0, dot);
              Routine<E> child = routine.children().get(childName);
              if (child == null) {
                throw PreparationError.of(
                    path,
                    stage,
                    "Parameter %s is linked to %s, but there is no child named %s",
                    entry.getKey(),
                    link,
                    childName);
              }
              ParameterLink direct = link;
              if (dot >= 0) {
                String rest = link.childPath.substring(dot + 1);
                String param = joinPath(rest, link.param);
                child.inputParams().add(param);
                addIfAbsent(
                    child.linkedParams().computeIfAbsent(param, k -> new ArrayList<>()),
                    new ParameterLink(rest, link.param));
                direct = new ParameterLink(childName, param);
              }
              addIfAbsent(flattened, direct);
            }
            entry.setValue(flattened);
          }
        });
  }

  private static <T> void addIfAbsent(List<T> list, T element) {
    if (!list.contains(element)) {
      list.add(element);
    }
  }

  /**
   * Gives each routine an input parameter {@code child.param} linked to every input parameter of
   * a child that is not the target of a link and is not a port variable. Applied bottom-up, so
   * that unlinked parameters become parameters of the root.
   */
  public static <E> void promoteUnlinkedInputs(Routine<E> root, AlgebraEngine<E> engine) {
    postorder(
        root,
        (routine, path) -> {
          Set<ParameterLink> targets = new HashSet<>();
          routine.linkedParams().values().forEach(targets::addAll);
          for (Routine<E> child : routine.children().values()) {
            for (String param : child.inputParams()) {
              ParameterLink link = new ParameterLink(child.name(), param);
              if (isPortVariable(param) || targets.contains(link)) {
                continue;
              }
              String promoted = joinPath(child.name(), param);
              routine.inputParams().add(promoted);
              routine.linkedParams().computeIfAbsent(promoted, k -> new ArrayList<>()).add(link);
            }
          }
        });
  }

  /**
   * Replaces the size of each input and through port of a non-root routine by its port variable
   * ({@code #port}), which becomes an input parameter of the routine. The original size is kept:
   *
   * <ul>
   *   <li>a single symbol {@code S} becomes a local variable {@code S = #port}, or, if {@code S}
   *       is already a local variable, a constraint equating {@code #port} with its value;
   *   <li>any other expression becomes a constraint {@code #port == size}.
   * </ul>
   */
  public static <E> void normalizePortVariables(Routine<E> root, AlgebraEngine<E> engine) {
    preorder(
        root,
        (routine, path) -> {
          if (routine == root) {
            return;
          }
          for (Port<E> port : ImmutableList.copyOf(routine.ports().values())) {
            if (!port.direction.isIncoming()) {
              continue;
            }
            String variable = portVariable(port.name);
            E symbol = engine.symbol(variable);
            if (port.size != null) {
              String single = engine.singleParameterName(port.size);
              if (single == null) {
                routine.constraints().add(new Constraint<>(symbol, port.size));
              } else if (!single.equals(variable)) {
                E existing = routine.localVariables().get(single);
                if (existing == null) {
                  routine.localVariables().put(single, symbol);
                } else {
                  routine.constraints().add(new Constraint<>(symbol, existing));
                }
              }
            }
            routine.ports().put(port.name, port.withSize(symbol));
            routine.inputParams().add(variable);
          }
        });
  }

  /**
   * Clears the input port sizes of routines that are neither the root nor a leaf; the compiler
   * derives them from the connected ports.
   */
  public static <E> void stripNonLeafInputSizes(Routine<E> root, AlgebraEngine<E> engine) {
    preorder(
        root,
        (routine, path) -> {
          if (routine == root || routine.isLeaf()) {
            return;
          }
          for (Port<E> port : routine.portsWith(PortDirection.INPUT)) {
            routine.ports().put(port.name, port.withSize(null));
          }
        });
  }

  /**
   * Expands each wildcard symbol {@code prefix~.res} used as a function argument in a resource
   * (e.g. {@code sum(~.T)} or {@code max(step~.T)}) into one argument {@code child.res} for each
   * child whose name matches the prefix (with {@code ~} matching any characters) and that defines
   * {@code res}.
   *
   * @throws PreparationError if a wildcard path is nested, has a wildcard in its resource name, or
   *     is used outside a function call without matching exactly one child
   */
  public static <E> void unrollWildcardResources(Routine<E> root, AlgebraEngine<E> engine) {
    String stage = "unrollWildcardResources";
    postorder(
        root,
        (routine, path) -> {
          for (Resource<E> resource : ImmutableList.copyOf(routine.resources().values())) {
            Map<String, ImmutableList<String>> expansions = new LinkedHashMap<>();
            for (String symbol : engine.freeSymbols(resource.value)) {
              if (!ExpressionSyntax.isWildcarded(symbol)) {
                continue;
              }
              List<String> parts =
                  Splitter.on(ExpressionSyntax.PATH_SEPARATOR).splitToList(symbol);
              if (parts.size() < 2) {
                throw PreparationError.of(
                    path, stage, "Wildcard %s must name a resource, as in ~.T", symbol);
              } else if (parts.size() > 2) {
                throw PreparationError.of(
                    path,
                    stage,
                    "Wildcard parsing supported only for expressions without nesting: %s",
                    symbol);
              }
              String resourceName = parts.get(1);
              if (ExpressionSyntax.isWildcarded(resourceName)) {
                throw PreparationError.of(
                    path, stage, "Resource name cannot contain wildcard symbol: %s", symbol);
              }
              Pattern pattern = Pattern.compile(parts.get(0).replace("~", ".*"));
              expansions.put(
                  symbol,
                  routine.children().values().stream()
                      .filter(
                          c ->
                              pattern.matcher(c.name()).find()
                                  && c.resources().containsKey(resourceName))
                      .map(c -> joinPath(c.name(), resourceName))
                      .collect(ImmutableList.toImmutableList()));
            }
            if (expansions.isEmpty()) {
              continue;
            }
            E unrolled;
            try {
              unrolled = engine.unrollWildcards(resource.value, expansions);
            } catch (IllegalArgumentException e) {
              PreparationError error = new PreparationError(e.getMessage(), path, stage);
              error.initCause(e);
              throw error;
            }
            routine.resources().put(resource.name, resource.withValue(unrolled));
          }
        });
  }

  static boolean isPortVariable(String name) {
    return name.charAt(0) == ExpressionSyntax.PORT_PREFIX;
  }

  /** Called with each routine of a tree and its dotted path. */
  private interface Visitor<E> {
    void visit(Routine<E> routine, String path);
  }

  /** Visits {@code routine} before its descendants. */
  private static <E> void preorder(Routine<E> root, Visitor<E> visitor) {
    preorder(root, root.name(), visitor);
  }

  private static <E> void preorder(Routine<E> routine, String path, Visitor<E> visitor) {
    visitor.visit(routine, path);
    for (Routine<E> child : ImmutableList.copyOf(routine.children().values())) {
      preorder(child, joinPath(path, child.name()), visitor);
    }
  }

  /** Visits {@code routine} after its descendants. */
  private static <E> void postorder(Routine<E> root, Visitor<E> visitor) {
    postorder(root, root.name(), visitor);
  }

  private static <E> void postorder(Routine<E> routine, String path, Visitor<E> visitor) {
    for (Routine<E> child : ImmutableList.copyOf(routine.children().values())) {
      postorder(child, joinPath(path, child.name()), visitor);
    }
    visitor.visit(routine, path);
  }

  // Statics only
  private Preprocessing() {}
}
