/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.executor.distributed;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.log4j.Log4j2;
import org.federation.sql.catalog.model.ColumnSchema;
import org.federation.sql.catalog.model.DatabaseDescription;
import org.federation.sql.catalog.model.TableSchema;
import org.federation.sql.common.utils.StringUtils;
import org.federation.sql.lexer.SqlTableExtractor;
import org.federation.sql.lexer.SqlToken;
import org.federation.sql.lexer.SqlTokenizer;
import org.federation.sql.lexer.TableReference;
import org.federation.sql.lexer.TokenType;

/**
 * Best-effort repair of identifier spelling before SQL reaches a service. Only identifier tokens
 * are rewritten; string literals, casts and placeholders pass through untouched.
 */
@Log4j2
public final class IdentifierNormalizer {

  static final String USER_ID = "userId";

  static final double TABLE_SIMILARITY_THRESHOLD = 0.7;

  private IdentifierNormalizer() {}

  /**
   * Quote every unquoted {@code userId} so that PostgreSQL does not fold it to lower case. The
   * identifier recurs across almost every service schema. Only the exact spelling is quoted; a
   * lower-case {@code userid} may be a real column.
   */
  public static String quoteUserId(String sql) {
    List<SqlToken> tokens = new ArrayList<>(SqlTokenizer.tokenize(sql));
    boolean changed = false;
    SqlToken previous = null;
    for (int i = 0; i < tokens.size(); i++) {
      SqlToken token = tokens.get(i);
      if (!token.isSignificant()) {
        continue;
      }
      boolean castTarget = previous != null && previous.type() == TokenType.CAST;
      if (token.type() == TokenType.WORD && USER_ID.equals(token.text()) && !castTarget) {
        tokens.set(i, SqlToken.quotedIdentifier(USER_ID));
        changed = true;
      }
      previous = token;
    }
    if (!changed) {
      return sql;
    }
    String normalized = SqlTokenizer.render(tokens);
    log.info("Quoted userId identifiers: {}", normalized);
    return normalized;
  }

  /**
   * Repair table and column names against the service's schema: an unknown table becomes the most
   * similar known table, a table or quoted column written in the wrong case gets the catalog's
   * casing.
   */
  public static String repair(String sql, DatabaseDescription database) {
    List<SqlToken> tokens = new ArrayList<>(SqlTokenizer.tokenize(sql));
    List<TableSchema> referenced = new ArrayList<>();

    for (TableReference reference : SqlTableExtractor.extract(tokens)) {
      Optional<TableSchema> table = database.findTable(reference.name());
      if (table.isEmpty()) {
        table = mostSimilarTable(reference.name(), database);
        table.ifPresent(
            t ->
                log.info(
                    "Replacing invalid table name \"{}\" with similar table \"{}\"",
                    reference.name(),
                    t.getName()));
      }
      if (table.isPresent()) {
        referenced.add(table.get());
        if (!table.get().getName().equals(reference.name()) || !reference.quoted()) {
          tokens.set(reference.tokenIndex(), SqlToken.quotedIdentifier(table.get().getName()));
        }
      }
    }

    for (int i = 0; i < tokens.size(); i++) {
      SqlToken token = tokens.get(i);
      if (token.type() != TokenType.QUOTED_IDENTIFIER) {
        continue;
      }
      String name = token.identifierName();
      for (TableSchema table : referenced) {
        Optional<ColumnSchema> column = table.findColumn(name);
        if (column.isPresent() && !column.get().getName().equals(name)) {
          tokens.set(i, SqlToken.quotedIdentifier(column.get().getName()));
          break;
        }
      }
    }
    return SqlTokenizer.render(tokens);
  }

  private static Optional<TableSchema> mostSimilarTable(String name, DatabaseDescription database) {
    String lower = name.toLowerCase(Locale.ROOT);
    return database.getTables().stream()
        .filter(t -> similarity(t, lower) > TABLE_SIMILARITY_THRESHOLD)
        .max(Comparator.comparingDouble(t -> similarity(t, lower)));
  }

  private static double similarity(TableSchema table, String lowerName) {
    return StringUtils.similarity(table.getName().toLowerCase(Locale.ROOT), lowerName);
  }
}
