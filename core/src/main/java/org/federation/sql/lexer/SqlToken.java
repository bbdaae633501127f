/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.lexer;

/**
 * A lexical token of a SQL text. Concatenating the {@link #text()} of every token reproduces the
 * input exactly.
 *
 * @param type token kind
 * @param text raw source text
 * @param parameterName name of a named placeholder, null for positional ones and non-parameters
 * @param position 1-based number of a {@code $N} placeholder, 0 otherwise
 */
public record SqlToken(TokenType type, String text, String parameterName, int position) {

  public static SqlToken of(TokenType type, String text) {
    return new SqlToken(type, text, null, 0);
  }

  public static SqlToken parameter(String text, String name) {
    return new SqlToken(TokenType.PARAMETER, text, name, 0);
  }

  public boolean isSignificant() {
    return type != TokenType.WHITESPACE && type != TokenType.COMMENT;
  }

  public boolean isKeyword(String keyword) {
    return type == TokenType.WORD && text.equalsIgnoreCase(keyword);
  }

  public boolean isIdentifier() {
    return type == TokenType.WORD || type == TokenType.QUOTED_IDENTIFIER;
  }

  public boolean isNamedParameter() {
    return type == TokenType.PARAMETER && parameterName != null;
  }

  public boolean isPositionalParameter() {
    return type == TokenType.PARAMETER && parameterName == null;
  }

  /** Identifier name without quotes, or the raw text for other tokens. */
  public String identifierName() {
    if (type == TokenType.QUOTED_IDENTIFIER) {
      char quote = text.charAt(0);
      String body = text.substring(1, text.length() - (text.length() > 1 ? 1 : 0));
      return body.replace(String.valueOf(quote) + quote, String.valueOf(quote));
    }
    return text;
  }

  public SqlToken withText(String newText) {
    return new SqlToken(type, newText, parameterName, position);
  }

  /** Double-quoted identifier token for the given name. */
  public static SqlToken quotedIdentifier(String name) {
    return of(TokenType.QUOTED_IDENTIFIER, "\"" + name.replace("\"", "\"\"") + "\"");
  }
}
