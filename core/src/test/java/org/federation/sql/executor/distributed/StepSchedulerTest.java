/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.executor.distributed;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.federation.sql.catalog.model.ServiceIdentifier;
import org.federation.sql.exception.CyclicDependencyException;
import org.federation.sql.planner.distributed.InMemoryOperation;
import org.federation.sql.planner.distributed.QueryStep;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class StepSchedulerTest {

  @Test
  void dependencies_come_first() {
    QueryStep limit = inMemory("limit", "sort");
    QueryStep sort = inMemory("sort", "join");
    QueryStep join = inMemory("join", "step_1", "step_2");

    List<String> order =
        StepScheduler.topologicalSort(List.of(limit, sort, join, sql("step_2"), sql("step_1")));

    assertEquals(List.of("step_1", "step_2", "join", "sort", "limit"), order);
  }

  @Test
  void independent_steps_keep_plan_order() {
    assertEquals(
        List.of("step_1", "step_2", "step_3"),
        StepScheduler.topologicalSort(List.of(sql("step_1"), sql("step_2"), sql("step_3"))));
  }

  @Test
  void every_step_is_scheduled_once() {
    QueryStep join = inMemory("join", "step_1", "step_2");
    QueryStep count = inMemory("count", "step_1", "join");

    List<String> order =
        StepScheduler.topologicalSort(List.of(sql("step_1"), sql("step_2"), join, count));

    assertEquals(4, order.size());
    assertTrue(order.indexOf("join") < order.indexOf("count"));
  }

  @Test
  void cycle_is_rejected() {
    QueryStep a = inMemory("a", "b");
    QueryStep b = inMemory("b", "c");
    QueryStep c = inMemory("c", "a");

    CyclicDependencyException exception =
        assertThrows(
            CyclicDependencyException.class, () -> StepScheduler.topologicalSort(List.of(a, b, c)));
    assertTrue(exception.getMessage().startsWith("Circular dependency detected for step"));
  }

  @Test
  void dependency_graph_mirrors_depends_on() {
    assertEquals(
        List.of("step_1", "step_2"),
        StepScheduler.buildDependencyGraph(List.of(inMemory("join", "step_1", "step_2")))
            .get("join"));
  }

  private static QueryStep sql(String id) {
    return QueryStep.sql(id, ServiceIdentifier.WALLET, id, "SELECT 1");
  }

  private static QueryStep inMemory(String id, String... dependsOn) {
    return QueryStep.inMemory(
        id, id, InMemoryOperation.JOIN, List.of(dependsOn), List.of("id"));
  }
}
