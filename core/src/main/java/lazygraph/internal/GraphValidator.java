/*
 * Copyright (C) 2026 The Lazygraph Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package lazygraph.internal;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.Multimaps;
import com.google.common.collect.Ordering;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lazygraph.CycleCheck;

/**
 * Detects problems in a dependency graph: cycles and dependencies on names that are not members.
 *
 * <p>The graph maps each member to the members it depends on, so an edge {@code a -> b} means
 * {@code a} requires {@code b}. Dependencies that are not keys of the graph take no part in cycle
 * detection; they are reported separately as undefined.
 */
public final class GraphValidator {

  /**
   * Checks {@code graph} as {@code cycleCheck} asks. {@link CycleCheck#SKIP} never looks at the
   * graph.
   */
  public static ValidationResult validate(
      Map<String, ? extends List<String>> graph, CycleCheck cycleCheck) {
    switch (cycleCheck) {
      case SKIP:
        return ValidationResult.skipped();
      case SIMPLE:
        return ValidationResult.simple(hasCycle(graph), undefinedDependencies(graph));
      case DETAILED:
        return ValidationResult.detailed(findCycles(graph), undefinedDependencies(graph));
    }
    throw new AssertionError(cycleCheck);
  }

  /** Returns true if {@code graph} has at least one cycle. Stops at the first one found. */
  public static boolean hasCycle(Map<String, ? extends List<String>> graph) {
    Map<String, VisitState> states = new HashMap<>();
    for (String member : graph.keySet()) {
      if (!states.containsKey(member) && visitForCycle(member, graph, states)) {
        return true;
      }
    }
    return false;
  }

  /** Members absent from {@code states} are unvisited. */
  private static boolean visitForCycle(
      String member, Map<String, ? extends List<String>> graph, Map<String, VisitState> states) {
    states.put(member, VisitState.VISITING);
    for (String dependency : graph.get(member)) {
      if (!graph.containsKey(dependency)) {
        continue;
      }
      VisitState state = states.get(dependency);
      if (state == VisitState.VISITING) {
        return true; // Back edge, or a member that depends on itself.
      }
      if (state == null && visitForCycle(dependency, graph, states)) {
        return true;
      }
    }
    states.put(member, VisitState.VISITED);
    return false;
  }

  /**
   * Returns every cycle in {@code graph}: each strongly connected component with more than one
   * member, and each member that depends on itself but shares no component with another member.
   * The result is {@linkplain Cycles#normalize normalized}.
   */
  public static ImmutableList<ImmutableList<String>> findCycles(
      Map<String, ? extends List<String>> graph) {
    return new ComponentFinder(graph).findCycles();
  }

  /** Returns each member mapped to the dependencies it names that are not members. */
  public static ImmutableSetMultimap<String, String> undefinedDependencies(
      Map<String, ? extends List<String>> graph) {
    ImmutableSetMultimap.Builder<String, String> undefined =
        ImmutableSetMultimap.<String, String>builder()
            .orderKeysBy(Ordering.natural())
            .orderValuesBy(Ordering.natural());
    for (Map.Entry<String, ? extends List<String>> entry : graph.entrySet()) {
      for (String dependency : entry.getValue()) {
        if (!graph.containsKey(dependency)) {
          undefined.put(entry.getKey(), dependency);
        }
      }
    }
    return undefined.build();
  }

  private enum VisitState {
    VISITING,
    VISITED,
  }

  /**
   * Tarjan's strongly connected components. A single depth-first pass gives every member a visit
   * index and a low-link, the smallest visit index reachable from it through members whose
   * component is still open. A member whose low-link equals its own visit index is the root of a
   * component and closes it.
   */
  private static final class ComponentFinder {
    private final Map<String, ? extends List<String>> graph;
    private final Map<String, NodeInfo> nodes = new LinkedHashMap<>();
    private final Deque<String> open = new ArrayDeque<>();
    private final Set<String> selfLoops = new HashSet<>();

    ComponentFinder(Map<String, ? extends List<String>> graph) {
      this.graph = graph;
    }

    ImmutableList<ImmutableList<String>> findCycles() {
      for (String member : graph.keySet()) {
        if (!nodes.containsKey(member)) {
          visit(member);
        }
      }

      ImmutableListMultimap<String, String> components =
          Multimaps.index(nodes.keySet(), member -> nodes.get(member).root);
      List<Collection<String>> cycles = new ArrayList<>();
      for (Collection<String> component : components.asMap().values()) {
        if (component.size() > 1 || selfLoops.contains(component.iterator().next())) {
          cycles.add(component);
        }
      }
      return Cycles.normalize(cycles);
    }

    private NodeInfo visit(String member) {
      NodeInfo info = new NodeInfo(nodes.size());
      nodes.put(member, info);
      open.push(member);

      for (String dependency : graph.get(member)) {
        if (dependency.equals(member)) {
          selfLoops.add(member);
          continue;
        }
        if (!graph.containsKey(dependency)) {
          continue;
        }
        NodeInfo dependencyInfo = nodes.get(dependency);
        if (dependencyInfo == null) {
          dependencyInfo = visit(dependency);
          info.lowLink = Math.min(info.lowLink, dependencyInfo.lowLink);
        } else if (dependencyInfo.root == null) {
          // Still in an open component: either an ancestor or part of one.
          info.lowLink = Math.min(info.lowLink, dependencyInfo.visitIndex);
        }
      }

      if (info.lowLink == info.visitIndex) {
        String closed;
        do {
          closed = open.pop();
          nodes.get(closed).root = member;
        } while (!closed.equals(member));
      }
      return info;
    }
  }

  /** Traversal state of one member. */
  private static final class NodeInfo {
    final int visitIndex;
    int lowLink;
    /** The root of this member's component, or null while the component is open. */
    String root;

    NodeInfo(int visitIndex) {
      this.visitIndex = visitIndex;
      this.lowLink = visitIndex;
    }
  }

  private GraphValidator() {}
}
