/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.executor.distributed.operator;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.federation.sql.data.model.Row;
import org.federation.sql.data.model.RowValue;

@Log4j2
public final class FilterOperator {

  private FilterOperator() {}

  /**
   * Keeps the rows whose {@code field} satisfies {@code operator value}. An operator that is not
   * recognized keeps every row.
   */
  public static List<Row> filter(List<Row> rows, String field, String operator, RowValue value) {
    Optional<ComparisonOperator> comparison = ComparisonOperator.fromSymbol(operator);
    if (comparison.isEmpty()) {
      log.warn("Unknown filter operator \"{}\", keeping all {} rows", operator, rows.size());
      return rows;
    }
    List<Row> filtered =
        rows.stream()
            .filter(row -> comparison.get().test(row.get(field), value))
            .collect(Collectors.toList());
    log.debug(
        "Filter {} {} {} kept {} of {} rows",
        field,
        operator,
        value,
        filtered.size(),
        rows.size());
    return filtered;
  }
}
