/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.common.setting;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import java.util.Properties;
import lombok.extern.log4j.Log4j2;

/**
 * {@link Settings} backed by a properties file on the classpath. A JVM system property with the
 * same key overrides the file, and a missing key falls back to the default declared on {@link
 * Settings.Key}.
 */
@Log4j2
public class PropertiesSettings extends Settings {

  public static final String DEFAULT_RESOURCE = "federation.properties";

  private final Properties properties;

  public PropertiesSettings() {
    this(DEFAULT_RESOURCE);
  }

  public PropertiesSettings(String resource) {
    this(load(resource));
  }

  @VisibleForTesting
  public PropertiesSettings(Properties properties) {
    this.properties = properties;
  }

  @Override
  @SuppressWarnings("unchecked")
  public <T> T getSettingValue(Key key) {
    String raw = getRawValue(key.getKeyValue()).orElse(key.getDefaultValue());
    try {
      return (T) convert(raw, key.getValueType());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(
          String.format("Invalid value [%s] for setting %s", raw, key.getKeyValue()), e);
    }
  }

  @Override
  public Optional<String> getRawValue(String keyValue) {
    String value = System.getProperty(keyValue);
    if (Strings.isNullOrEmpty(value)) {
      value = properties.getProperty(keyValue);
    }
    return Optional.ofNullable(Strings.emptyToNull(value == null ? null : value.trim()));
  }

  private static Object convert(String raw, Class<?> type) {
    if (type == Integer.class) {
      return Integer.parseInt(raw);
    } else if (type == Long.class) {
      return Long.parseLong(raw);
    } else if (type == Boolean.class) {
      return Boolean.parseBoolean(raw);
    }
    return raw;
  }

  private static Properties load(String resource) {
    Properties properties = new Properties();
    try (InputStream in =
        PropertiesSettings.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        log.warn("Settings resource {} not found, using defaults", resource);
        return properties;
      }
      properties.load(in);
      log.info("Loaded {} settings from {}", properties.size(), resource);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read settings resource " + resource, e);
    }
    return properties;
  }
}
