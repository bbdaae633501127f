/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.executor.distributed;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.federation.sql.data.model.Row;
import org.federation.sql.data.model.RowValue;
import org.federation.sql.exception.StepExecutionException;
import org.federation.sql.planner.distributed.InMemoryOperation;
import org.federation.sql.planner.distributed.QueryStep;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class InMemoryStepExecutorTest {

  private final InMemoryStepExecutor executor = new InMemoryStepExecutor();

  @Test
  void join_combines_both_dependencies() {
    QueryStep join =
        QueryStep.inMemory(
            "join_1", "join", InMemoryOperation.JOIN, List.of("a", "b"), List.of("id"));

    List<Row> result =
        executor.execute(
            join,
            inputs(
                "a", List.of(Row.of("id", 1, "x", 1), Row.of("id", 2, "x", 2)),
                "b", List.of(Row.of("id", 2, "y", 3))));

    assertEquals(List.of(Row.of("id", 2, "x", 2, "y", 3)), result);
  }

  @Test
  void join_needs_two_dependencies() {
    QueryStep join =
        QueryStep.inMemory("join_1", "join", InMemoryOperation.JOIN, List.of("a"), List.of("id"));

    StepExecutionException exception =
        assertThrows(
            StepExecutionException.class,
            () -> executor.execute(join, inputs("a", List.of(Row.of("id", 1)))));
    assertEquals("join_1", exception.getStepId());
  }

  @Test
  void filter_reads_the_first_dependency() {
    QueryStep filter =
        QueryStep.inMemory(
            "filter",
            "filter",
            InMemoryOperation.FILTER,
            List.of("a", "b"),
            List.of("v", ">", "1"));

    List<Row> result =
        executor.execute(
            filter,
            inputs("a", List.of(Row.of("v", 1), Row.of("v", 2)), "b", List.of(Row.of("v", 5))));

    assertEquals(List.of(Row.of("v", 2)), result);
  }

  @Test
  void filter_value_reference_is_resolved_from_dependency_rows() {
    QueryStep filter =
        QueryStep.inMemory(
            "filter_by_max",
            "filter",
            InMemoryOperation.FILTER,
            List.of("step_1", "global_max"),
            List.of("amount", "=", "${max}"));

    List<Row> result =
        executor.execute(
            filter,
            inputs(
                "step_1", List.of(Row.of("amount", 3), Row.of("amount", 8)),
                "global_max", List.of(Row.of("max", 8, "field", "max"))));

    assertEquals(List.of(Row.of("amount", 8)), result);
  }

  @Test
  void filter_reference_prefers_the_last_dependency() {
    QueryStep filter =
        QueryStep.inMemory(
            "filter_by_max",
            "filter",
            InMemoryOperation.FILTER,
            List.of("step_1", "global_max"),
            List.of("max", "=", "${max}"));

    List<Row> result =
        executor.execute(
            filter,
            inputs(
                "step_1", List.of(Row.of("max", 40), Row.of("max", 90)),
                "global_max", List.of(Row.of("max", 90, "field", "max"))));

    assertEquals(List.of(Row.of("max", 90)), result);
  }

  @Test
  void unresolved_filter_reference_stays_literal() {
    RowValue value =
        InMemoryStepExecutor.resolveFilterValue("${max}", List.of(List.of(Row.of("id", 1))));

    assertEquals(RowValue.string("${max}"), value);
  }

  @Test
  void sort_defaults_to_descending() {
    QueryStep sort =
        QueryStep.inMemory("sort", "sort", InMemoryOperation.SORT, List.of("a"), List.of("v"));

    List<Row> result =
        executor.execute(sort, inputs("a", List.of(Row.of("v", 1), Row.of("v", 3))));

    assertEquals(List.of(Row.of("v", 3), Row.of("v", 1)), result);
  }

  @Test
  void invalid_limit_is_a_step_error() {
    QueryStep limit =
        QueryStep.inMemory("limit", "limit", InMemoryOperation.LIMIT, List.of("a"), List.of("x"));

    StepExecutionException exception =
        assertThrows(
            StepExecutionException.class,
            () -> executor.execute(limit, inputs("a", List.of(Row.of("v", 1)))));
    assertTrue(exception.getMessage().startsWith("Invalid limit or offset parameters"));
  }

  @Test
  void aggregate_reads_every_dependency() {
    QueryStep count =
        QueryStep.inMemory(
            "aggregate_count",
            "count",
            InMemoryOperation.AGGREGATE,
            List.of("a", "b"),
            List.of("count", "*"));

    List<Row> result =
        executor.execute(
            count, inputs("a", List.of(Row.of("id", 1)), "b", List.of(Row.of("id", 2))));

    assertEquals(List.of(Row.of("count", 2, "field", "*")), result);
  }

  @Test
  void group_is_not_supported() {
    QueryStep group =
        QueryStep.inMemory("group", "group", InMemoryOperation.GROUP, List.of("a"), List.of("v"));

    assertThrows(
        StepExecutionException.class,
        () -> executor.execute(group, inputs("a", List.of(Row.of("v", 1)))));
  }

  private static Map<String, List<Row>> inputs(Object... idsAndRows) {
    Map<String, List<Row>> inputs = new LinkedHashMap<>();
    for (int i = 0; i < idsAndRows.length; i += 2) {
      @SuppressWarnings("unchecked")
      List<Row> rows = (List<Row>) idsAndRows[i + 1];
      inputs.put((String) idsAndRows[i], rows);
    }
    return inputs;
  }
}
