/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.catalog;

import com.google.common.base.Strings;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.extern.log4j.Log4j2;
import org.federation.sql.catalog.model.ColumnSchema;
import org.federation.sql.catalog.model.DatabaseDescription;
import org.federation.sql.catalog.model.ServiceIdentifier;
import org.federation.sql.catalog.model.TableSchema;
import org.federation.sql.common.setting.Settings;

/**
 * {@link SchemaCatalog} loaded from a JSON array of {@link DatabaseDescription}. Loading replaces
 * the previous content atomically; readers never observe a half-loaded catalog.
 */
@Log4j2
public class JsonSchemaCatalog implements SchemaCatalog {

  private volatile Map<ServiceIdentifier, DatabaseDescription> databases =
      new EnumMap<>(ServiceIdentifier.class);

  private volatile boolean loaded;

  private volatile Path catalogPath;

  /** Catalog from the file named by {@link Settings.Key#CATALOG_PATH}, if any. */
  public static JsonSchemaCatalog fromSettings(Settings settings) {
    JsonSchemaCatalog catalog = new JsonSchemaCatalog();
    String path = settings.getSettingValue(Settings.Key.CATALOG_PATH);
    if (Strings.isNullOrEmpty(path)) {
      log.warn("No schema catalog configured, cross-service checks run without schema knowledge");
    } else {
      catalog.loadFromFile(Paths.get(path));
    }
    return catalog;
  }

  /** Catalog built from already materialized descriptions. */
  public static JsonSchemaCatalog of(List<DatabaseDescription> descriptions) {
    JsonSchemaCatalog catalog = new JsonSchemaCatalog();
    catalog.replace(descriptions);
    return catalog;
  }

  /**
   * Load descriptions from a file. A missing file only logs a warning and leaves the catalog as
   * it was.
   */
  public void loadFromFile(Path path) {
    this.catalogPath = path;
    if (!Files.exists(path)) {
      log.warn("Schema catalog file not found at {}", path);
      return;
    }
    try (InputStream in = Files.newInputStream(path)) {
      load(in);
      log.info("Loaded schema catalog from {}", path);
    } catch (IOException e) {
      log.error("Failed to read schema catalog from {}", path, e);
      throw new IllegalStateException("Failed to read schema catalog " + path, e);
    }
  }

  public void load(InputStream inputStream) {
    replace(DatabaseDescription.fromInputStream(inputStream));
  }

  /** Re-read the file of the last {@link #loadFromFile(Path)} call. */
  public void reload() {
    if (catalogPath == null) {
      log.warn("Cannot reload schema catalog: file path is not set");
      return;
    }
    loadFromFile(catalogPath);
  }

  private void replace(List<DatabaseDescription> descriptions) {
    Map<ServiceIdentifier, DatabaseDescription> next = new EnumMap<>(ServiceIdentifier.class);
    for (DatabaseDescription description : descriptions) {
      next.put(description.getService(), description);
    }
    databases = next;
    loaded = true;
    log.info(
        "Schema catalog holds {} databases, {} tables",
        next.size(),
        next.values().stream().mapToInt(d -> d.getTables().size()).sum());
  }

  @Override
  public List<DatabaseDescription> getAllDatabases() {
    if (!loaded) {
      log.warn("Database descriptions are not loaded yet");
      return List.of();
    }
    return new ArrayList<>(databases.values());
  }

  @Override
  public Optional<DatabaseDescription> getDatabase(ServiceIdentifier service) {
    return Optional.ofNullable(databases.get(service));
  }

  @Override
  public boolean isLoaded() {
    return loaded;
  }

  /**
   * Text rendering of every service, table and column, used as context by the component that
   * drafts per-service SQL.
   */
  public String describeForPrompt() {
    if (!loaded) {
      return "Database descriptions are not loaded yet.";
    }
    StringBuilder sb = new StringBuilder("AVAILABLE DATABASE SERVICES AND TABLES:\n\n");
    for (DatabaseDescription db : databases.values()) {
      sb.append("## \"").append(db.getService()).append("\": ");
      sb.append(Strings.nullToEmpty(db.getDescription())).append("\n\n");
      for (TableSchema table : db.getTables()) {
        sb.append("### Table: ").append(table.getName()).append('\n');
        sb.append(Strings.nullToEmpty(table.getDescription())).append("\n\n");
        sb.append("Columns:\n");
        for (ColumnSchema column : table.getColumns()) {
          sb.append("- ").append(column.getName()).append(" (").append(column.getType());
          String flags = columnFlags(column);
          if (!flags.isEmpty()) {
            sb.append(' ').append(flags);
          }
          sb.append("): ").append(Strings.nullToEmpty(column.getDescription())).append('\n');
        }
        if (!table.getExamples().isEmpty()) {
          sb.append("\nExample queries:\n");
          table.getExamples()
              .forEach(
                  ex ->
                      sb.append("- ")
                          .append(ex.getDescription())
                          .append(": `")
                          .append(ex.getQuery())
                          .append("`\n"));
        }
        sb.append('\n');
      }
      sb.append('\n');
    }
    return sb.toString();
  }

  private static String columnFlags(ColumnSchema column) {
    List<String> flags = new ArrayList<>();
    if (column.isPrimaryKey()) {
      flags.add("PK");
    }
    if (column.isUnique()) {
      flags.add("UNIQUE");
    }
    flags.add(column.isNullable() ? "NULL" : "NOT NULL");
    if (column.isForeignKey()) {
      flags.add("FK");
    }
    return flags.stream().collect(Collectors.joining(", "));
  }
}
