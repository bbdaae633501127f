/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.executor.distributed.operator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.federation.sql.data.model.Row;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class LimitOperatorTest {

  private final List<Row> rows =
      List.of(Row.of("id", 1), Row.of("id", 2), Row.of("id", 3), Row.of("id", 4));

  @Test
  void limit_slices_from_offset() {
    assertEquals(List.of(Row.of("id", 2), Row.of("id", 3)), LimitOperator.limit(rows, "2", "1"));
  }

  @Test
  void limit_is_clipped_to_input() {
    assertEquals(rows, LimitOperator.limit(rows, "10", "0"));
    assertTrue(LimitOperator.limit(rows, "3", "10").isEmpty());
  }

  @Test
  void non_integer_limit_is_rejected() {
    IllegalArgumentException exception =
        assertThrows(IllegalArgumentException.class, () -> LimitOperator.limit(rows, "ten", "0"));

    assertEquals("Invalid limit or offset parameters: ten, 0", exception.getMessage());
  }

  @Test
  void negative_offset_is_rejected() {
    assertThrows(IllegalArgumentException.class, () -> LimitOperator.limit(rows, "1", "-1"));
  }
}
