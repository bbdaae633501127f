/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.data.model;

/** The closed set of value kinds a {@link RowValue} may hold. */
public enum ValueType {
  NULL,
  NUMBER,
  STRING,
  BOOLEAN,
  TIMESTAMP,
  JSON
}
