/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.lexer;

/**
 * A table named after {@code FROM} or {@code JOIN}.
 *
 * @param name unquoted table name, without schema qualifier
 * @param quoted whether the name was written as a quoted identifier
 * @param tokenIndex index of the name token in the full token list
 */
public record TableReference(String name, boolean quoted, int tokenIndex) {}
