/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.executor.distributed;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.federation.sql.exception.CyclicDependencyException;
import org.federation.sql.planner.distributed.QueryStep;

/** Orders plan steps so that every step follows the steps it depends on. */
public final class StepScheduler {

  private StepScheduler() {}

  /** Step id to the ids it depends on, in plan order. */
  public static Map<String, List<String>> buildDependencyGraph(List<QueryStep> steps) {
    Map<String, List<String>> graph = new LinkedHashMap<>();
    for (QueryStep step : steps) {
      graph.put(step.getId(), new ArrayList<>(step.getDependsOn()));
    }
    return graph;
  }

  /**
   * Depth-first topological sort. Steps without ordering constraints keep their plan order.
   *
   * @throws CyclicDependencyException when the dependencies form a cycle
   */
  public static List<String> topologicalSort(List<QueryStep> steps) {
    Map<String, List<String>> graph = buildDependencyGraph(steps);
    List<String> order = new ArrayList<>();
    Set<String> visited = new HashSet<>();
    Set<String> inProgress = new HashSet<>();
    for (String stepId : graph.keySet()) {
      visit(stepId, graph, visited, inProgress, order);
    }
    return order;
  }

  private static void visit(
      String stepId,
      Map<String, List<String>> graph,
      Set<String> visited,
      Set<String> inProgress,
      List<String> order) {
    if (visited.contains(stepId)) {
      return;
    }
    if (!inProgress.add(stepId)) {
      throw new CyclicDependencyException(stepId);
    }
    for (String dependency : graph.getOrDefault(stepId, List.of())) {
      if (graph.containsKey(dependency)) {
        visit(dependency, graph, visited, inProgress, order);
      }
    }
    inProgress.remove(stepId);
    visited.add(stepId);
    order.add(stepId);
  }
}
