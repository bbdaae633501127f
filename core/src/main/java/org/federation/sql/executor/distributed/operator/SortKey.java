/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.executor.distributed.operator;

/** Represents a sort key with field name and direction. */
public record SortKey(String fieldName, boolean descending) {

  /** Key for a textual direction; anything but {@code asc} sorts descending. */
  public static SortKey of(String fieldName, String direction) {
    return new SortKey(fieldName, !"asc".equalsIgnoreCase(direction));
  }
}
