/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.planner.distributed;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.federation.sql.catalog.model.ServiceIdentifier;

/**
 * A node of the distributed execution graph. A step either runs SQL against one service or, when
 * {@link #inMemory} is set, combines the cached rows of its dependencies with an {@link
 * InMemoryOperation}.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class QueryStep {

  /** Unique within the plan */
  private String id;

  /** Service the SQL runs against; synthetic steps carry a placeholder service */
  private ServiceIdentifier service;

  private String description;

  /** SQL text, always null for in-memory steps */
  private String sqlQuery;

  /** Ids of the steps whose results this step reads, in order */
  private List<String> dependsOn = new ArrayList<>();

  /** Names of the placeholders in the SQL resolved from dependency rows */
  private List<String> parameters = new ArrayList<>();

  private boolean inMemory;

  private InMemoryOperation operation;

  /** Positional operator arguments of an in-memory step, e.g. {@code [amount, >, 7]} */
  private List<String> operationArguments = new ArrayList<>();

  private List<CrossServiceReference> crossServiceReferences = new ArrayList<>();

  private List<CrossServiceColumn> crossServiceColumns = new ArrayList<>();

  /**
   * Creates a step that runs SQL against a service.
   *
   * @param id step id
   * @param service target service
   * @param description purpose of the step
   * @param sqlQuery SQL text
   * @return SQL step without dependencies
   */
  public static QueryStep sql(
      String id, ServiceIdentifier service, String description, String sqlQuery) {
    QueryStep step = new QueryStep();
    step.setId(id);
    step.setService(service);
    step.setDescription(description);
    step.setSqlQuery(sqlQuery);
    return step;
  }

  /**
   * Creates a synthetic step evaluated over its dependencies' rows.
   *
   * @param id step id
   * @param description purpose of the step
   * @param operation operator to apply
   * @param dependsOn input step ids
   * @param arguments operator arguments
   * @return in-memory step running on the placeholder service
   */
  public static QueryStep inMemory(
      String id,
      String description,
      InMemoryOperation operation,
      List<String> dependsOn,
      List<String> arguments) {
    QueryStep step = new QueryStep();
    step.setId(id);
    step.setService(ServiceIdentifier.PAM);
    step.setDescription(description);
    step.setInMemory(true);
    step.setOperation(operation);
    step.setDependsOn(new ArrayList<>(dependsOn));
    step.setOperationArguments(new ArrayList<>(arguments));
    return step;
  }

  public boolean hasSql() {
    return sqlQuery != null && !sqlQuery.isBlank();
  }

  /** Operator argument at {@code index}, or {@code defaultValue} when not supplied. */
  public String argument(int index, String defaultValue) {
    return operationArguments != null && operationArguments.size() > index
        ? operationArguments.get(index)
        : defaultValue;
  }
}
