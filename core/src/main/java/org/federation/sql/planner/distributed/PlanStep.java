/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.planner.distributed;

import org.federation.sql.catalog.model.ServiceIdentifier;

/**
 * One step of a flat plan as drafted upstream.
 *
 * @param service service the SQL runs against
 * @param description human readable purpose
 * @param sqlQuery SQL text, null when the drafter produced none
 */
public record PlanStep(ServiceIdentifier service, String description, String sqlQuery) {

  public boolean hasSql() {
    return sqlQuery != null && !sqlQuery.isBlank();
  }
}
