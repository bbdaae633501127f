/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.catalog;

import java.util.List;
import java.util.Optional;
import org.federation.sql.catalog.model.DatabaseDescription;
import org.federation.sql.catalog.model.ServiceIdentifier;
import org.federation.sql.catalog.model.TableSchema;

/** Read-only knowledge about the tables and columns each service owns. */
public interface SchemaCatalog {

  /** All known service databases, empty until the catalog is loaded. */
  List<DatabaseDescription> getAllDatabases();

  Optional<DatabaseDescription> getDatabase(ServiceIdentifier service);

  /** Table of the given service, matched ignoring case. */
  default Optional<TableSchema> getTable(ServiceIdentifier service, String tableName) {
    return getDatabase(service).flatMap(database -> database.findTable(tableName));
  }

  boolean isLoaded();
}
