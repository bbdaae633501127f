/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.executor.distributed;

import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.federation.sql.catalog.SchemaCatalog;
import org.federation.sql.catalog.model.DatabaseDescription;
import org.federation.sql.catalog.model.ServiceIdentifier;
import org.federation.sql.catalog.model.TableSchema;
import org.federation.sql.exception.StepExecutionException;
import org.federation.sql.lexer.SqlTableExtractor;
import org.federation.sql.lexer.SqlToken;
import org.federation.sql.lexer.SqlTokenizer;
import org.federation.sql.lexer.TableReference;
import org.federation.sql.lexer.TokenType;

/**
 * Checks that a step's SQL only names tables of its own service and, for {@code table.column}
 * references, columns of those tables. Without schema knowledge for the service the check passes.
 */
@Log4j2
@RequiredArgsConstructor
public class SqlSchemaValidator {

  private final SchemaCatalog catalog;

  /**
   * Validate the SQL of a step.
   *
   * @return the first problem found, empty when the SQL is consistent with the schema
   */
  public Optional<String> validate(ServiceIdentifier service, String sql) {
    if (!catalog.isLoaded()) {
      log.warn("Schema catalog not loaded, skipping schema validation");
      return Optional.empty();
    }
    Optional<DatabaseDescription> database = catalog.getDatabase(service);
    if (database.isEmpty()) {
      log.warn("No schema information available for service {}, skipping validation", service);
      return Optional.empty();
    }

    List<SqlToken> tokens = SqlTokenizer.tokenize(sql);
    for (TableReference reference : SqlTableExtractor.extract(tokens)) {
      if (database.get().findTable(reference.name()).isEmpty()) {
        return Optional.of(
            String.format(
                "Table \"%s\" not found in service \"%s\" schema", reference.name(), service));
      }
    }

    List<SqlToken> significant = SqlTokenizer.significant(tokens);
    for (int i = 0; i + 2 < significant.size(); i++) {
      SqlToken qualifier = significant.get(i);
      SqlToken column = significant.get(i + 2);
      if (!qualifier.isIdentifier()
          || significant.get(i + 1).type() != TokenType.DOT
          || !column.isIdentifier()
          || (i > 0 && significant.get(i - 1).type() == TokenType.DOT)
          || (i + 3 < significant.size() && significant.get(i + 3).type() == TokenType.DOT)) {
        continue;
      }
      Optional<TableSchema> table = database.get().findTable(qualifier.identifierName());
      if (table.isPresent() && table.get().findColumn(column.identifierName()).isEmpty()) {
        return Optional.of(
            String.format(
                "Column \"%s\" not found in table \"%s\" of service \"%s\"",
                column.identifierName(),
                table.get().getName(),
                service));
      }
    }
    return Optional.empty();
  }

  /**
   * Validate, repair with {@link IdentifierNormalizer#repair} when invalid, and validate again.
   *
   * @return SQL to execute
   * @throws StepExecutionException when the repaired SQL is still invalid
   */
  public String validateAndRepair(String stepId, ServiceIdentifier service, String sql) {
    Optional<String> error = validate(service, sql);
    if (error.isEmpty()) {
      return sql;
    }
    log.warn("Schema validation error in step {}: {}", stepId, error.get());
    log.info("Attempting to fix SQL query of step {}", stepId);

    DatabaseDescription database = catalog.getDatabase(service).orElseThrow();
    String repaired = IdentifierNormalizer.repair(sql, database);
    Optional<String> remaining = validate(service, repaired);
    if (remaining.isPresent()) {
      throw new StepExecutionException(stepId, "Schema validation failed: " + remaining.get());
    }
    log.info("SQL query of step {} fixed: {}", stepId, repaired);
    return repaired;
  }
}
