/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.lexer;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.experimental.UtilityClass;

/**
 * Lossless SQL lexer. It understands just enough of the PostgreSQL dialect to keep literals,
 * quoted identifiers, comments, {@code ::} casts and bind placeholders apart; it does not build a
 * syntax tree.
 */
@UtilityClass
public class SqlTokenizer {

  private static final Set<String> TWO_CHAR_OPERATORS =
      Set.of("<=", ">=", "<>", "!=", "==", "||");

  public static List<SqlToken> tokenize(String sql) {
    List<SqlToken> tokens = new ArrayList<>();
    int length = sql.length();
    int i = 0;
    while (i < length) {
      char c = sql.charAt(i);
      int start = i;
      if (Character.isWhitespace(c)) {
        while (i < length && Character.isWhitespace(sql.charAt(i))) {
          i++;
        }
        tokens.add(SqlToken.of(TokenType.WHITESPACE, sql.substring(start, i)));
      } else if (c == '-' && peek(sql, i + 1) == '-') {
        while (i < length && sql.charAt(i) != '\n') {
          i++;
        }
        tokens.add(SqlToken.of(TokenType.COMMENT, sql.substring(start, i)));
      } else if (c == '/' && peek(sql, i + 1) == '*') {
        int end = sql.indexOf("*/", i + 2);
        i = end < 0 ? length : end + 2;
        tokens.add(SqlToken.of(TokenType.COMMENT, sql.substring(start, i)));
      } else if (c == '\'') {
        i = skipQuoted(sql, i, '\'');
        tokens.add(SqlToken.of(TokenType.STRING_LITERAL, sql.substring(start, i)));
      } else if (c == '"' || c == '`') {
        i = skipQuoted(sql, i, c);
        tokens.add(SqlToken.of(TokenType.QUOTED_IDENTIFIER, sql.substring(start, i)));
      } else if (c == ':') {
        i = colon(sql, i, tokens);
      } else if (c == '$') {
        i = dollar(sql, i, tokens);
      } else if (c == '@' && isIdentifierStart(peek(sql, i + 1))) {
        i = skipWord(sql, i + 1);
        tokens.add(SqlToken.parameter(sql.substring(start, i), sql.substring(start + 1, i)));
      } else if (c == '?') {
        i++;
        tokens.add(SqlToken.of(TokenType.PARAMETER, "?"));
      } else if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(sql, i + 1)))) {
        i = skipNumber(sql, i);
        tokens.add(SqlToken.of(TokenType.NUMBER, sql.substring(start, i)));
      } else if (isIdentifierStart(c)) {
        i = skipWord(sql, i);
        tokens.add(SqlToken.of(TokenType.WORD, sql.substring(start, i)));
      } else if (c == '(') {
        i++;
        tokens.add(SqlToken.of(TokenType.LEFT_PAREN, "("));
      } else if (c == ')') {
        i++;
        tokens.add(SqlToken.of(TokenType.RIGHT_PAREN, ")"));
      } else if (c == '.') {
        i++;
        tokens.add(SqlToken.of(TokenType.DOT, "."));
      } else if (c == ',') {
        i++;
        tokens.add(SqlToken.of(TokenType.COMMA, ","));
      } else {
        i += i + 2 <= length && TWO_CHAR_OPERATORS.contains(sql.substring(i, i + 2)) ? 2 : 1;
        tokens.add(SqlToken.of(TokenType.SYMBOL, sql.substring(start, i)));
      }
    }
    return tokens;
  }

  /** Reassemble tokens into SQL text. */
  public static String render(List<SqlToken> tokens) {
    return tokens.stream().map(SqlToken::text).collect(Collectors.joining());
  }

  /** Tokens with whitespace and comments removed. */
  public static List<SqlToken> significant(List<SqlToken> tokens) {
    return tokens.stream().filter(SqlToken::isSignificant).collect(Collectors.toList());
  }

  private static int colon(String sql, int i, List<SqlToken> tokens) {
    char next = peek(sql, i + 1);
    if (next == ':') {
      tokens.add(SqlToken.of(TokenType.CAST, "::"));
      return i + 2;
    }
    if (next == '"') {
      int end = skipQuoted(sql, i + 1, '"');
      String text = sql.substring(i, end);
      String name = text.substring(2, Math.max(2, text.length() - 1));
      tokens.add(SqlToken.parameter(text, name));
      return end;
    }
    if (isIdentifierStart(next)) {
      int end = skipWord(sql, i + 1);
      tokens.add(SqlToken.parameter(sql.substring(i, end), sql.substring(i + 1, end)));
      return end;
    }
    tokens.add(SqlToken.of(TokenType.SYMBOL, ":"));
    return i + 1;
  }

  private static int dollar(String sql, int i, List<SqlToken> tokens) {
    char next = peek(sql, i + 1);
    if (next == '{') {
      int close = sql.indexOf('}', i + 2);
      if (close > 0) {
        String text = sql.substring(i, close + 1);
        tokens.add(SqlToken.parameter(text, sql.substring(i + 2, close).trim()));
        return close + 1;
      }
    } else if (Character.isDigit(next)) {
      int end = i + 1;
      while (end < sql.length() && Character.isDigit(sql.charAt(end))) {
        end++;
      }
      String text = sql.substring(i, end);
      int position = Integer.parseInt(text.substring(1));
      tokens.add(new SqlToken(TokenType.PARAMETER, text, null, position));
      return end;
    } else if (isIdentifierStart(next)) {
      int end = skipWord(sql, i + 1);
      tokens.add(SqlToken.parameter(sql.substring(i, end), sql.substring(i + 1, end)));
      return end;
    }
    tokens.add(SqlToken.of(TokenType.SYMBOL, "$"));
    return i + 1;
  }

  private static int skipQuoted(String sql, int i, char quote) {
    int j = i + 1;
    while (j < sql.length()) {
      if (sql.charAt(j) == quote) {
        if (peek(sql, j + 1) == quote) {
          j += 2;
          continue;
        }
        return j + 1;
      }
      j++;
    }
    return sql.length();
  }

  private static int skipWord(String sql, int i) {
    int j = i;
    while (j < sql.length() && isIdentifierPart(sql.charAt(j))) {
      j++;
    }
    return j;
  }

  private static int skipNumber(String sql, int i) {
    int j = i;
    while (j < sql.length() && Character.isDigit(sql.charAt(j))) {
      j++;
    }
    if (peek(sql, j) == '.' && Character.isDigit(peek(sql, j + 1))) {
      j++;
      while (j < sql.length() && Character.isDigit(sql.charAt(j))) {
        j++;
      }
    }
    char e = peek(sql, j);
    if ((e == 'e' || e == 'E')
        && (Character.isDigit(peek(sql, j + 1))
            || ((peek(sql, j + 1) == '-' || peek(sql, j + 1) == '+')
                && Character.isDigit(peek(sql, j + 2))))) {
      j += 2;
      while (j < sql.length() && Character.isDigit(sql.charAt(j))) {
        j++;
      }
    }
    return j;
  }

  private static boolean isIdentifierStart(char c) {
    return Character.isLetter(c) || c == '_';
  }

  private static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_' || c == '$';
  }

  private static char peek(String sql, int i) {
    return i < sql.length() ? sql.charAt(i) : '\0';
  }
}
