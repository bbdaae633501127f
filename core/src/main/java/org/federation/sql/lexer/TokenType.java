/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.lexer;

public enum TokenType {
  WHITESPACE,
  COMMENT,
  STRING_LITERAL,
  QUOTED_IDENTIFIER,
  /** Unquoted identifier or keyword. */
  WORD,
  NUMBER,
  /** Bind placeholder: ?, :name, :"name", ${name}, @name, $name or $N. */
  PARAMETER,
  /** PostgreSQL {@code ::} type cast operator. */
  CAST,
  LEFT_PAREN,
  RIGHT_PAREN,
  DOT,
  COMMA,
  SYMBOL
}
