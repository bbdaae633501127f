/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.executor.distributed.operator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.federation.sql.data.model.Row;
import org.federation.sql.data.model.RowValue;

public final class SortOperator {

  private SortOperator() {}

  /**
   * Stable sort of a copy of the rows. Two numbers compare numerically, any other pair by string
   * form; missing values get no special placement.
   */
  public static List<Row> sort(List<Row> rows, SortKey sortKey) {
    List<Row> sorted = new ArrayList<>(rows);
    if (sorted.size() <= 1) {
      return sorted;
    }
    Comparator<Row> comparator =
        (row1, row2) -> {
          int cmp = compare(row1.get(sortKey.fieldName()), row2.get(sortKey.fieldName()));
          return sortKey.descending() ? -cmp : cmp;
        };
    sorted.sort(comparator);
    return sorted;
  }

  static int compare(RowValue v1, RowValue v2) {
    if (v1.isNumber() && v2.isNumber()) {
      return Double.compare(v1.toDouble(), v2.toDouble());
    }
    return v1.asString().compareTo(v2.asString());
  }
}
