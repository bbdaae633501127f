/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.conflict;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.federation.sql.catalog.SchemaCatalog;
import org.federation.sql.catalog.model.DatabaseDescription;
import org.federation.sql.catalog.model.ServiceIdentifier;
import org.federation.sql.catalog.model.TableSchema;
import org.federation.sql.lexer.SqlTableExtractor;
import org.federation.sql.planner.distributed.PlanStep;
import org.federation.sql.planner.distributed.QueryPlan;

/**
 * Finds table names that exist in more than one service's schema and rates how likely a plan is to
 * query the wrong one. The lookup maps are built once from the catalog; a table the catalog does
 * not know is never a conflict.
 */
@Log4j2
public class ConflictDetector {

  private final Map<String, List<ServiceIdentifier>> tableServices = new HashMap<>();

  private final Map<String, Map<ServiceIdentifier, TableSchema>> tableSchemas = new HashMap<>();

  public ConflictDetector(SchemaCatalog catalog) {
    List<DatabaseDescription> databases = catalog.getAllDatabases();
    for (DatabaseDescription database : databases) {
      for (TableSchema table : database.getTables()) {
        tableServices
            .computeIfAbsent(table.getName(), name -> new ArrayList<>())
            .add(database.getService());
        tableSchemas
            .computeIfAbsent(table.getName(), name -> new EnumMap<>(ServiceIdentifier.class))
            .put(database.getService(), table);
      }
    }
    log.info(
        "ConflictDetector initialized with {} services and {} distinct table names",
        databases.size(),
        tableServices.size());
  }

  /**
   * Conflict for a table name.
   *
   * @param tableName exact table name
   * @return conflict when two or more services own the table, empty otherwise
   */
  public Optional<TableConflict> detectTableConflicts(String tableName) {
    List<ServiceIdentifier> services = tableServices.get(tableName);
    if (services == null || services.size() <= 1) {
      return Optional.empty();
    }
    log.info("Detected conflict for table \"{}\" across services: {}", tableName, services);
    Map<ServiceIdentifier, TableSchema> schemas = new EnumMap<>(tableSchemas.get(tableName));
    return Optional.of(
        new TableConflict(
            tableName, List.copyOf(services), Collections.unmodifiableMap(schemas)));
  }

  /** Check every table referenced after FROM or JOIN in the plan's SQL. */
  public ConflictDetectionResult detectPlanConflicts(QueryPlan plan) {
    Set<String> tables = new LinkedHashSet<>();
    for (PlanStep step : plan.getSteps()) {
      if (step.hasSql()) {
        tables.addAll(SqlTableExtractor.extractTableNames(step.sqlQuery()));
      }
    }

    List<TableConflict> conflicts =
        tables.stream()
            .map(this::detectTableConflicts)
            .flatMap(Optional::stream)
            .collect(Collectors.toList());
    if (conflicts.isEmpty()) {
      return ConflictDetectionResult.none();
    }

    Set<ServiceIdentifier> required = plan.getRequiredServices();
    boolean ambiguous =
        conflicts.stream().anyMatch(conflict -> ownersInPlan(conflict, required).size() > 1);
    ErrorProbability probability = ambiguous ? ErrorProbability.HIGH : ErrorProbability.MEDIUM;
    return new ConflictDetectionResult(
        conflicts, probability, resolutionSuggestion(conflicts, required));
  }

  private String resolutionSuggestion(
      List<TableConflict> conflicts, Set<ServiceIdentifier> required) {
    StringBuilder suggestion = new StringBuilder("Suggestions for resolving table conflicts:\n\n");
    for (TableConflict conflict : conflicts) {
      suggestion
          .append("* Table \"")
          .append(conflict.tableName())
          .append("\" exists in several services: ")
          .append(
              conflict.services().stream()
                  .map(ServiceIdentifier::getServiceName)
                  .collect(Collectors.joining(", ")))
          .append(".\n");
      if (!sameColumns(conflict.schemas().values())) {
        suggestion.append(
            "  - The table schemas differ, which raises the risk of a wrong query.\n");
      }
      suggestion.append(
          "  - Name the service explicitly or use fully qualified table names in the query.\n");
      suggestion
          .append("  - Judging by the plan, the table \"")
          .append(conflict.tableName())
          .append("\" most likely belongs to service \"")
          .append(mostPlausibleService(conflict, required).getServiceName())
          .append("\".\n\n");
    }
    return suggestion.toString();
  }

  /** The single owner required by the plan, else the first required owner, else the first one. */
  private static ServiceIdentifier mostPlausibleService(
      TableConflict conflict, Set<ServiceIdentifier> required) {
    List<ServiceIdentifier> inPlan = ownersInPlan(conflict, required);
    return inPlan.isEmpty() ? conflict.services().get(0) : inPlan.get(0);
  }

  private static List<ServiceIdentifier> ownersInPlan(
      TableConflict conflict, Set<ServiceIdentifier> required) {
    return conflict.services().stream().filter(required::contains).collect(Collectors.toList());
  }

  private static boolean sameColumns(Collection<TableSchema> schemas) {
    Set<String> reference = null;
    for (TableSchema schema : schemas) {
      Set<String> columns = schema.columnNames();
      if (reference == null) {
        reference = columns;
      } else if (!reference.equals(columns)) {
        return false;
      }
    }
    return true;
  }
}
