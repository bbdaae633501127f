/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.lexer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.experimental.UtilityClass;

/**
 * Finds table names that follow {@code FROM} and {@code JOIN}. This is targeted extraction, not
 * parsing: derived tables are skipped and {@code FROM} used inside {@code EXTRACT}, {@code
 * SUBSTRING}, {@code TRIM}, {@code POSITION}, {@code OVERLAY} or {@code IS DISTINCT FROM} is not a
 * table position.
 */
@UtilityClass
public class SqlTableExtractor {

  private static final Set<String> FROM_ARGUMENT_FUNCTIONS =
      Set.of("EXTRACT", "SUBSTRING", "TRIM", "POSITION", "OVERLAY");

  private static final Set<String> TABLE_PREFIX_KEYWORDS = Set.of("ONLY", "LATERAL");

  public static List<TableReference> extract(String sql) {
    return extract(SqlTokenizer.tokenize(sql));
  }

  /**
   * Table references in order of appearance, duplicates included. Names of common table
   * expressions defined by the statement are not tables and are left out.
   */
  public static List<TableReference> extract(List<SqlToken> tokens) {
    Set<String> cteNames = commonTableExpressionNames(tokens);
    List<TableReference> references = new ArrayList<>();
    Deque<String> parenOwners = new ArrayDeque<>();
    SqlToken previous = null;
    for (int i = 0; i < tokens.size(); i++) {
      SqlToken token = tokens.get(i);
      if (!token.isSignificant()) {
        continue;
      }
      switch (token.type()) {
        case LEFT_PAREN:
          parenOwners.push(
              previous != null && previous.type() == TokenType.WORD
                  ? previous.text().toUpperCase()
                  : "");
          break;
        case RIGHT_PAREN:
          if (!parenOwners.isEmpty()) {
            parenOwners.pop();
          }
          break;
        case WORD:
          boolean fromKeyword =
              token.isKeyword("FROM")
                  && !FROM_ARGUMENT_FUNCTIONS.contains(
                      parenOwners.isEmpty() ? "" : parenOwners.peek())
                  && (previous == null || !previous.isKeyword("DISTINCT"));
          if (fromKeyword || token.isKeyword("JOIN")) {
            int nameIndex = tableNameIndex(tokens, i + 1);
            if (nameIndex >= 0
                && !cteNames.contains(tokens.get(nameIndex).identifierName().toLowerCase())) {
              SqlToken name = tokens.get(nameIndex);
              references.add(
                  new TableReference(
                      name.identifierName(),
                      name.type() == TokenType.QUOTED_IDENTIFIER,
                      nameIndex));
            }
          }
          break;
        default:
          break;
      }
      previous = token;
    }
    return references;
  }

  /** Distinct table names in order of first appearance. */
  public static Set<String> extractTableNames(String sql) {
    Set<String> names = new LinkedHashSet<>();
    extract(sql).forEach(reference -> names.add(reference.name()));
    return names;
  }

  /**
   * Index of the identifier naming the table that starts at {@code from}, resolving a
   * {@code schema.table} qualifier to its last part; -1 for derived tables.
   */
  private static int tableNameIndex(List<SqlToken> tokens, int from) {
    int index = nextSignificant(tokens, from);
    while (index >= 0
        && tokens.get(index).type() == TokenType.WORD
        && TABLE_PREFIX_KEYWORDS.contains(tokens.get(index).text().toUpperCase())) {
      index = nextSignificant(tokens, index + 1);
    }
    if (index < 0 || !tokens.get(index).isIdentifier()) {
      return -1;
    }
    int dot = nextSignificant(tokens, index + 1);
    while (dot >= 0 && tokens.get(dot).type() == TokenType.DOT) {
      int part = nextSignificant(tokens, dot + 1);
      if (part < 0 || !tokens.get(part).isIdentifier()) {
        break;
      }
      index = part;
      dot = nextSignificant(tokens, part + 1);
    }
    return index;
  }

  /** Lower-cased names declared as {@code WITH name AS (...)} or {@code , name AS (...)}. */
  private static Set<String> commonTableExpressionNames(List<SqlToken> tokens) {
    List<SqlToken> significant = SqlTokenizer.significant(tokens);
    Set<String> names = new HashSet<>();
    for (int i = 1; i + 2 < significant.size(); i++) {
      SqlToken previous = significant.get(i - 1);
      boolean listPosition =
          previous.isKeyword("WITH")
              || previous.isKeyword("RECURSIVE")
              || previous.type() == TokenType.COMMA;
      if (listPosition
          && significant.get(i).isIdentifier()
          && significant.get(i + 1).isKeyword("AS")
          && significant.get(i + 2).type() == TokenType.LEFT_PAREN) {
        names.add(significant.get(i).identifierName().toLowerCase());
      }
    }
    return names;
  }

  static int nextSignificant(List<SqlToken> tokens, int from) {
    for (int i = from; i < tokens.size(); i++) {
      if (tokens.get(i).isSignificant()) {
        return i;
      }
    }
    return -1;
  }
}
