/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.catalog;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.federation.sql.catalog.model.ColumnSchema;
import org.federation.sql.catalog.model.ServiceIdentifier;
import org.federation.sql.catalog.model.TableSchema;
import org.federation.sql.common.setting.PropertiesSettings;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class JsonSchemaCatalogTest {

  @TempDir Path tempDir;

  @Test
  void load_reads_services_tables_and_column_flags() throws IOException {
    JsonSchemaCatalog catalog = new JsonSchemaCatalog();
    try (InputStream in = getClass().getResourceAsStream("/catalog/test-catalog.json")) {
      catalog.load(in);
    }

    assertTrue(catalog.isLoaded());
    assertEquals(4, catalog.getAllDatabases().size());
    TableSchema transaction =
        catalog.getTable(ServiceIdentifier.WALLET, "transaction").orElseThrow();
    assertEquals("Transaction", transaction.getName());
    ColumnSchema userId = transaction.findColumn("USERID").orElseThrow();
    assertTrue(userId.isForeignKey());
    assertFalse(userId.isNullable());
    assertEquals("User", userId.getReferences().getTable());
    assertTrue(transaction.findColumn("id").orElseThrow().isPrimaryKey());
    assertEquals(1, catalog.getDatabase(ServiceIdentifier.PAM).orElseThrow().getTables().size());
  }

  @Test
  void unknown_service_name_is_rejected() {
    JsonSchemaCatalog catalog = new JsonSchemaCatalog();
    InputStream in =
        new ByteArrayInputStream(
            "[{\"service\": \"casino\", \"tables\": []}]".getBytes(StandardCharsets.UTF_8));

    assertThrows(IllegalArgumentException.class, () -> catalog.load(in));
    assertFalse(catalog.isLoaded());
  }

  @Test
  void missing_file_leaves_catalog_unloaded() {
    JsonSchemaCatalog catalog = new JsonSchemaCatalog();

    catalog.loadFromFile(tempDir.resolve("absent.json"));

    assertFalse(catalog.isLoaded());
    assertTrue(catalog.getAllDatabases().isEmpty());
    assertTrue(catalog.getDatabase(ServiceIdentifier.WALLET).isEmpty());
  }

  @Test
  void reload_picks_up_file_changes() throws IOException {
    Path file = tempDir.resolve("catalog.json");
    Files.writeString(file, "[{\"service\": \"kyc\", \"tables\": [{\"name\": \"User\"}]}]");
    Properties properties = new Properties();
    properties.setProperty("federation.catalog.path", file.toString());
    JsonSchemaCatalog catalog = JsonSchemaCatalog.fromSettings(new PropertiesSettings(properties));
    assertEquals(1, catalog.getAllDatabases().size());

    Files.writeString(
        file,
        "[{\"service\": \"kyc\"},"
            + " {\"service\": \"PAM\", \"tables\": [{\"name\": \"User\"}]}]");
    catalog.reload();

    assertEquals(2, catalog.getAllDatabases().size());
    assertTrue(catalog.getTable(ServiceIdentifier.PAM, "user").isPresent());
  }

  @Test
  void prompt_description_lists_tables_columns_and_examples() throws IOException {
    JsonSchemaCatalog catalog = new JsonSchemaCatalog();
    try (InputStream in = getClass().getResourceAsStream("/catalog/test-catalog.json")) {
      catalog.load(in);
    }

    String description = catalog.describeForPrompt();

    assertThat(description, containsString("## \"wallet\": Balances and money movements"));
    assertThat(description, containsString("### Table: Transaction"));
    assertThat(description, containsString("- id (uuid PK, NOT NULL): "));
    assertThat(description, containsString("- userId (uuid NOT NULL, FK): "));
    assertThat(description, containsString("- Latest deposits: `SELECT * FROM \"Transaction\""));
  }
}
