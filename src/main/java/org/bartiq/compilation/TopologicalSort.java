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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedHashMultimap;
import com.google.common.collect.SetMultimap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.bartiq.compilation.CompilationError.CyclicDependency;
import org.bartiq.routine.Endpoint;

/**
 * Orders the children of a routine so that each child comes after every sibling that feeds one of
 * its input ports (Kahn's algorithm). Whenever several children are ready, the one declared first
 * is chosen, so the result is deterministic.
 */
final class TopologicalSort {

  // Statics only
  private TopologicalSort() {}

  /**
   * Returns {@code names} ordered so that the source of each connection precedes its target.
   * Connections whose endpoints are not both in {@code names} are ignored.
   *
   * @param path the path of the routine whose children are being ordered, for error messages
   * @throws CyclicDependency if the connections form a cycle
   */
  static ImmutableList<String> sort(
      String path, Collection<String> names, Map<Endpoint, Endpoint> connections) {
    SetMultimap<String, String> successors = LinkedHashMultimap.create();
    for (Map.Entry<Endpoint, Endpoint> entry : connections.entrySet()) {
      String from = entry.getKey().routineName;
      String to = entry.getValue().routineName;
      if (from != null && to != null && names.contains(from) && names.contains(to)) {
        successors.put(from, to);
      }
    }
    return sort(path, names, successors);
  }

  /**
   * Returns {@code names} ordered so that each node precedes all of its successors.
   *
   * @throws CyclicDependency if the successor relation has a cycle
   */
  static ImmutableList<String> sort(
      String path, Collection<String> names, SetMultimap<String, String> successors) {
    Map<String, Integer> inDegree = new HashMap<>();
    names.forEach(name -> inDegree.put(name, 0));
    successors.values().forEach(to -> inDegree.merge(to, 1, Integer::sum));
    // Kept in declaration order, so that the first ready node wins ties.
    List<String> pending = new ArrayList<>(names);
    ImmutableList.Builder<String> result = ImmutableList.builder();
    while (!pending.isEmpty()) {
      String next = null;
      for (String name : pending) {
        if (inDegree.get(name) == 0) {
          next = name;
          break;
        }
      }
      if (next == null) {
        ImmutableList<String> remaining = ImmutableList.copyOf(pending);
        throw new CyclicDependency(
            path, remaining, String.format("Cyclic dependency among %s", remaining));
      }
      pending.remove(next);
      result.add(next);
      for (String to : successors.get(next)) {
        inDegree.merge(to, -1, Integer::sum);
      }
    }
    return result.build();
  }
}
