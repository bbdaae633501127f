/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.executor.distributed;

import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.log4j.Log4j2;
import org.federation.sql.data.model.Row;
import org.federation.sql.data.model.RowValue;
import org.federation.sql.exception.StepExecutionException;
import org.federation.sql.executor.distributed.operator.AggregateOperator;
import org.federation.sql.executor.distributed.operator.FilterOperator;
import org.federation.sql.executor.distributed.operator.HashJoinExecutor;
import org.federation.sql.executor.distributed.operator.LimitOperator;
import org.federation.sql.executor.distributed.operator.SortKey;
import org.federation.sql.executor.distributed.operator.SortOperator;
import org.federation.sql.planner.distributed.QueryStep;

/**
 * Evaluates a synthetic step over the rows of its dependencies. FILTER, SORT and LIMIT read the
 * first dependency, JOIN folds every dependency left to right and AGGREGATE reduces all of them
 * together.
 */
@Log4j2
public class InMemoryStepExecutor {

  private static final Pattern REFERENCE = Pattern.compile("^\\$\\{\\s*(\\w+)\\s*}$");

  /**
   * Run the step.
   *
   * @param step in-memory step
   * @param inputs dependency id to rows, in the step's dependency order
   * @return result rows
   * @throws StepExecutionException when the step is malformed or the operator rejects it
   */
  public List<Row> execute(QueryStep step, Map<String, List<Row>> inputs) {
    if (step.getOperation() == null) {
      throw new StepExecutionException(
          step.getId(), "In-memory step " + step.getId() + " has no operation defined");
    }
    List<List<Row>> sources = new ArrayList<>(inputs.values());
    log.info(
        "Executing in-memory step {} with operation {} and arguments {}",
        step.getId(),
        step.getOperation(),
        step.getOperationArguments());
    try {
      switch (step.getOperation()) {
        case JOIN:
          require(
              step,
              sources.size() >= 2 && !step.getOperationArguments().isEmpty(),
              "JOIN operation requires at least 2 dependencies and join field parameter");
          return HashJoinExecutor.joinAll(sources, step.argument(0, null));
        case FILTER:
          require(
              step,
              !sources.isEmpty() && step.getOperationArguments().size() >= 2,
              "FILTER operation requires at least 1 dependency and filter parameters");
          return FilterOperator.filter(
              sources.get(0),
              step.argument(0, null),
              step.argument(1, null),
              resolveFilterValue(step.argument(2, ""), sources));
        case SORT:
          require(
              step,
              !sources.isEmpty() && !step.getOperationArguments().isEmpty(),
              "SORT operation requires at least 1 dependency and sort parameters");
          return SortOperator.sort(
              sources.get(0), SortKey.of(step.argument(0, null), step.argument(1, "desc")));
        case LIMIT:
          require(
              step,
              !sources.isEmpty() && !step.getOperationArguments().isEmpty(),
              "LIMIT operation requires at least 1 dependency and limit parameter");
          return LimitOperator.limit(
              sources.get(0), step.argument(0, null), step.argument(1, "0"));
        case AGGREGATE:
          require(
              step,
              !sources.isEmpty() && step.getOperationArguments().size() >= 2,
              "AGGREGATE operation requires at least 1 dependency and aggregate parameters");
          List<Row> all = new ArrayList<>();
          sources.forEach(all::addAll);
          return AggregateOperator.aggregate(all, step.argument(0, null), step.argument(1, null));
        default:
          throw new StepExecutionException(
              step.getId(), "Unsupported in-memory operation: " + step.getOperation());
      }
    } catch (IllegalArgumentException e) {
      throw new StepExecutionException(step.getId(), e.getMessage(), e);
    }
  }

  /**
   * A {@code ${name}} filter value names a column of a dependency's first row, e.g. the {@code
   * max} column produced by a global maximum step. Dependencies are searched last to first. Any
   * other value is a literal.
   */
  static RowValue resolveFilterValue(String value, List<List<Row>> sources) {
    Matcher matcher = REFERENCE.matcher(value.trim());
    if (!matcher.matches()) {
      return RowValue.string(value);
    }
    String name = matcher.group(1);
    for (List<Row> rows : Lists.reverse(sources)) {
      if (!rows.isEmpty()) {
        Optional<Map.Entry<String, RowValue>> entry = rows.get(0).findIgnoreCase(name);
        if (entry.isPresent()) {
          log.debug("Resolved filter value {} = {}", value, entry.get().getValue());
          return entry.get().getValue();
        }
      }
    }
    log.warn("Filter value {} could not be resolved from dependency results", value);
    return RowValue.string(value);
  }

  private static void require(QueryStep step, boolean condition, String message) {
    if (!condition) {
      throw new StepExecutionException(step.getId(), message);
    }
  }
}
