/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.executor.distributed.operator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;
import org.federation.sql.data.model.Row;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SortOperatorTest {

  @Test
  void numbers_sort_numerically() {
    List<Row> rows = List.of(Row.of("v", 9), Row.of("v", 10), Row.of("v", 1));

    List<Row> sorted = SortOperator.sort(rows, SortKey.of("v", "asc"));

    assertEquals(List.of(Row.of("v", 1), Row.of("v", 9), Row.of("v", 10)), sorted);
  }

  @Test
  void strings_sort_lexicographically() {
    List<Row> rows = List.of(Row.of("v", "9"), Row.of("v", "10"), Row.of("v", "1"));

    List<Row> sorted = SortOperator.sort(rows, SortKey.of("v", "asc"));

    assertEquals(List.of("1", "10", "9"), values(sorted));
  }

  @Test
  void default_direction_is_descending() {
    assertTrue(SortKey.of("v", null).descending());
    assertTrue(SortKey.of("v", "down").descending());
    assertFalse(SortKey.of("v", "ASC").descending());

    List<Row> rows = List.of(Row.of("v", 1), Row.of("v", 3), Row.of("v", 2));
    assertEquals(List.of("3", "2", "1"), values(SortOperator.sort(rows, SortKey.of("v", null))));
  }

  @Test
  void sort_is_stable_and_leaves_input_untouched() {
    List<Row> rows =
        List.of(Row.of("v", 1, "n", "a"), Row.of("v", 1, "n", "b"), Row.of("v", 0, "n", "c"));

    List<Row> sorted = SortOperator.sort(rows, SortKey.of("v", "desc"));

    assertEquals(List.of("a", "b", "c"), names(sorted));
    assertEquals(List.of("a", "b", "c"), names(rows));
  }

  private static List<String> values(List<Row> rows) {
    return rows.stream().map(row -> row.get("v").asString()).collect(Collectors.toList());
  }

  private static List<String> names(List<Row> rows) {
    return rows.stream().map(row -> row.get("n").asString()).collect(Collectors.toList());
  }
}
