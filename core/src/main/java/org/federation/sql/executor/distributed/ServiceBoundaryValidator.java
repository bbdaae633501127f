/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.executor.distributed;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.federation.sql.catalog.SchemaCatalog;
import org.federation.sql.catalog.model.DatabaseDescription;
import org.federation.sql.catalog.model.ServiceIdentifier;
import org.federation.sql.lexer.SqlTableExtractor;
import org.federation.sql.lexer.SqlToken;
import org.federation.sql.lexer.SqlTokenizer;
import org.federation.sql.lexer.TableReference;
import org.federation.sql.planner.distributed.CrossServiceColumn;
import org.federation.sql.planner.distributed.CrossServiceReference;
import org.federation.sql.planner.distributed.QueryStep;

/**
 * Rejects SQL steps that reach into another service. A foreign column may only be used as a
 * declared parameter of a step that depends on a step of the owning service reading its table; a
 * foreign table may never be selected from directly.
 */
@Log4j2
@RequiredArgsConstructor
public class ServiceBoundaryValidator {

  private final SchemaCatalog catalog;

  /**
   * Check every SQL step of a plan.
   *
   * @param steps plan steps
   * @return violations, empty when the plan respects service boundaries
   */
  public List<String> validate(List<QueryStep> steps) {
    List<String> violations = new ArrayList<>();
    for (QueryStep step : steps) {
      if (step.isInMemory() || !step.hasSql()) {
        continue;
      }
      List<SqlToken> tokens = SqlTokenizer.tokenize(step.getSqlQuery());
      List<TableReference> tables = SqlTableExtractor.extract(tokens);
      validateColumns(step, steps, tokens, violations);
      validateAnnotatedTables(step, tables, violations);
      validateCatalogTables(step, tables, violations);
    }
    violations.forEach(violation -> log.error("Service boundary violation: {}", violation));
    return violations;
  }

  private static void validateColumns(
      QueryStep step, List<QueryStep> steps, List<SqlToken> tokens, List<String> violations) {
    for (CrossServiceColumn column : step.getCrossServiceColumns()) {
      if (!references(tokens, column.column())) {
        continue;
      }
      boolean retrievedByDependency =
          steps.stream()
              .anyMatch(
                  other ->
                      other.getService() == column.sourceService()
                          && other.hasSql()
                          && other.getSqlQuery().contains(column.sourceTable())
                          && step.getDependsOn().contains(other.getId()));
      if (!retrievedByDependency) {
        violations.add(
            String.format(
                "Step %s directly references column %s from service %s without a proper"
                    + " dependent step for data retrieval.",
                step.getId(), column.column(), column.sourceService()));
      } else if (step.getParameters().stream()
          .noneMatch(parameter -> parameter.equalsIgnoreCase(column.column()))) {
        violations.add(
            String.format(
                "Step %s uses cross-service column %s without listing it as a parameter.",
                step.getId(), column.column()));
      }
    }
  }

  private static void validateAnnotatedTables(
      QueryStep step, List<TableReference> tables, List<String> violations) {
    for (CrossServiceReference reference : step.getCrossServiceReferences()) {
      boolean selected =
          tables.stream().anyMatch(table -> table.name().equalsIgnoreCase(reference.table()));
      if (selected && reference.service() != step.getService()) {
        violations.add(
            String.format(
                "Step %s directly references table %s from service %s without transformation.",
                step.getId(), reference.table(), reference.service()));
      }
    }
  }

  /** A table the step's own service lacks but another service owns. */
  private void validateCatalogTables(
      QueryStep step, List<TableReference> tables, List<String> violations) {
    if (!catalog.isLoaded()) {
      return;
    }
    Optional<DatabaseDescription> own = catalog.getDatabase(step.getService());
    if (own.isEmpty()) {
      return;
    }
    for (TableReference table : tables) {
      if (own.get().findTable(table.name()).isPresent()) {
        continue;
      }
      List<ServiceIdentifier> owners =
          catalog.getAllDatabases().stream()
              .filter(database -> database.findTable(table.name()).isPresent())
              .map(DatabaseDescription::getService)
              .collect(Collectors.toList());
      if (!owners.isEmpty()) {
        violations.add(
            String.format(
                "Step %s references table %s owned by service %s, not by %s.",
                step.getId(), table.name(), owners, step.getService()));
      }
    }
  }

  /** Identifier or named placeholder equal to the column name, ignoring case. */
  private static boolean references(List<SqlToken> tokens, String column) {
    return tokens.stream()
        .anyMatch(
            token ->
                (token.isIdentifier() && token.identifierName().equalsIgnoreCase(column))
                    || (token.isNamedParameter()
                        && token.parameterName().equalsIgnoreCase(column)));
  }
}
