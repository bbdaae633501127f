/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.executor.distributed.operator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.log4j.Log4j2;
import org.federation.sql.data.model.Row;
import org.federation.sql.data.model.RowValue;

/**
 * Inner equi-join of step results on one shared key column. All methods are static and
 * stateless.
 */
@Log4j2
public final class HashJoinExecutor {

  private HashJoinExecutor() {}

  /**
   * Performs a hash join between left and right rows. Builds a hash table on the right side (build
   * side) and probes with the left side (probe side). Every matching pair yields one row, so keys
   * repeated on both sides fan out.
   *
   * <p>Keys compare by their string form; null, missing and empty keys never match.
   */
  public static List<Row> performHashJoin(List<Row> leftRows, List<Row> rightRows, String key) {
    if (leftRows.isEmpty() || rightRows.isEmpty()) {
      log.debug(
          "Cannot join: one side is empty (left {}, right {})", leftRows.size(), rightRows.size());
      return List.of();
    }

    Map<String, List<Row>> hashTable = buildHashTable(rightRows, key);

    List<Row> result = new ArrayList<>();
    for (Row leftRow : leftRows) {
      String leftKey = extractJoinKey(leftRow, key);
      if (leftKey == null) {
        continue;
      }
      List<Row> matchingRightRows = hashTable.get(leftKey);
      if (matchingRightRows == null) {
        continue;
      }
      for (Row rightRow : matchingRightRows) {
        result.add(combineRows(leftRow, rightRow, key));
      }
    }
    log.debug(
        "Joined {} and {} rows on \"{}\": {} rows",
        leftRows.size(),
        rightRows.size(),
        key,
        result.size());
    return result;
  }

  /** Left-to-right fold of {@link #performHashJoin} over every input. */
  public static List<Row> joinAll(List<List<Row>> inputs, String key) {
    List<Row> result = inputs.get(0);
    for (int i = 1; i < inputs.size(); i++) {
      result = performHashJoin(result, inputs.get(i), key);
    }
    return result;
  }

  /** Builds a hash table from the given rows. Rows without a key are excluded. */
  static Map<String, List<Row>> buildHashTable(List<Row> rows, String key) {
    Map<String, List<Row>> hashTable = new HashMap<>();
    for (Row row : rows) {
      String joinKey = extractJoinKey(row, key);
      if (joinKey != null) {
        hashTable.computeIfAbsent(joinKey, k -> new ArrayList<>()).add(row);
      }
    }
    return hashTable;
  }

  /** String form of the key column, or null when it is missing, null or empty. */
  static String extractJoinKey(Row row, String key) {
    RowValue value = row.get(key);
    if (value.isNull()) {
      return null;
    }
    String text = value.asString();
    return text.isEmpty() ? null : text;
  }

  /** Left columns followed by the right ones; right values win except for the key. */
  static Row combineRows(Row leftRow, Row rightRow, String key) {
    Row.Builder combined = leftRow.toBuilder();
    rightRow
        .asMap()
        .forEach(
            (column, value) -> {
              if (!column.equals(key)) {
                combined.put(column, value);
              }
            });
    return combined.build();
  }
}
