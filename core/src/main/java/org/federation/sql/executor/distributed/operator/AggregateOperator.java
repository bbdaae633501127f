/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.executor.distributed.operator;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.BinaryOperator;
import lombok.extern.log4j.Log4j2;
import org.federation.sql.data.model.Row;
import org.federation.sql.data.model.RowValue;

@Log4j2
public final class AggregateOperator {

  private AggregateOperator() {}

  /**
   * Reduce the rows to one row {@code {<fn>: value, field: <field>}}. MAX, MIN, SUM and AVG read
   * {@code field} as an exact decimal with missing or null values counting as zero; a value with
   * no numeric meaning makes the result null. COUNT ignores the field. An empty input yields no
   * row for every function.
   *
   * @throws IllegalArgumentException for an unsupported function name
   */
  public static List<Row> aggregate(List<Row> rows, String function, String field) {
    AggregateFunction fn =
        AggregateFunction.of(function)
            .orElseThrow(
                () -> new IllegalArgumentException("Unsupported aggregate function: " + function));
    if (rows.isEmpty()) {
      log.debug("Source data is empty, returning empty result");
      return List.of();
    }

    Object result;
    switch (fn) {
      case COUNT:
        result = rows.size();
        break;
      case MAX:
        result = reduce(rows, field, BigDecimal::max).orElse(null);
        break;
      case MIN:
        result = reduce(rows, field, BigDecimal::min).orElse(null);
        break;
      case SUM:
        result = reduce(rows, field, BigDecimal::add).orElse(null);
        break;
      case AVG:
        result =
            reduce(rows, field, BigDecimal::add)
                .map(sum -> sum.divide(BigDecimal.valueOf(rows.size()), MathContext.DECIMAL128))
                .orElse(null);
        break;
      default:
        throw new IllegalArgumentException("Unsupported aggregate function: " + function);
    }
    log.debug("Aggregate {}({}) over {} rows = {}", fn.columnName(), field, rows.size(), result);
    return List.of(Row.of(fn.columnName(), result, "field", field));
  }

  /** Empty when any value of the field is not numeric. */
  private static Optional<BigDecimal> reduce(
      List<Row> rows, String field, BinaryOperator<BigDecimal> accumulator) {
    List<BigDecimal> values = new ArrayList<>(rows.size());
    for (Row row : rows) {
      RowValue value = row.get(field);
      Optional<BigDecimal> decimal =
          value.isNull() ? Optional.of(BigDecimal.ZERO) : value.toDecimal();
      if (decimal.isEmpty()) {
        log.warn("Value {} of field {} is not numeric, aggregate is null", value, field);
        return Optional.empty();
      }
      values.add(decimal.get());
    }
    return values.stream().reduce(accumulator);
  }
}
