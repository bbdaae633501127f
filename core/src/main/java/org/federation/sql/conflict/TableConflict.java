/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.conflict;

import java.util.List;
import java.util.Map;
import org.federation.sql.catalog.model.ServiceIdentifier;
import org.federation.sql.catalog.model.TableSchema;

/**
 * A table name owned independently by more than one service.
 *
 * @param tableName shared name
 * @param services owners in catalog order
 * @param schemas each owner's definition of the table
 */
public record TableConflict(
    String tableName,
    List<ServiceIdentifier> services,
    Map<ServiceIdentifier, TableSchema> schemas) {}
