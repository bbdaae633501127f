/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.executor.distributed.operator;

import java.util.List;
import org.federation.sql.data.model.Row;

public final class LimitOperator {

  private LimitOperator() {}

  /**
   * Rows {@code [offset, offset + limit)}, clipped to the input.
   *
   * @throws IllegalArgumentException when limit or offset is not a non-negative integer
   */
  public static List<Row> limit(List<Row> rows, String limit, String offset) {
    int count = parse(limit, offset);
    int skip = parse(offset, limit);
    int from = Math.min(skip, rows.size());
    int to = (int) Math.min((long) skip + count, rows.size());
    return List.copyOf(rows.subList(from, to));
  }

  private static int parse(String value, String other) {
    try {
      int parsed = Integer.parseInt(value.trim());
      if (parsed < 0) {
        throw new NumberFormatException("negative");
      }
      return parsed;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("Invalid limit or offset parameters: %s, %s", value, other), e);
    }
  }
}
