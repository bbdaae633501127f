/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.federation.sql.data.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Date;
import java.util.Objects;
import java.util.Optional;
import org.federation.sql.common.utils.StringUtils;

/**
 * A single column value. Numbers are held as normalized {@link BigDecimal} so that {@code 1},
 * {@code 1L} and {@code 1.0} are the same value, timestamps as {@link Instant} and structured
 * values as Jackson {@link JsonNode}.
 */
public final class RowValue {

  public static final RowValue NULL = new RowValue(ValueType.NULL, null);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static final DateTimeFormatter ISO_MILLIS =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

  private final ValueType type;

  private final Object value;

  private RowValue(ValueType type, Object value) {
    this.type = type;
    this.value = value;
  }

  /** Convert a JDBC or plain Java value into a row value. */
  public static RowValue of(Object value) {
    if (value == null) {
      return NULL;
    }
    if (value instanceof RowValue) {
      return (RowValue) value;
    }
    if (value instanceof Number) {
      return number((Number) value);
    }
    if (value instanceof CharSequence || value instanceof Character) {
      return new RowValue(ValueType.STRING, value.toString());
    }
    if (value instanceof Boolean) {
      return new RowValue(ValueType.BOOLEAN, value);
    }
    if (value instanceof Date) {
      return new RowValue(ValueType.TIMESTAMP, ((Date) value).toInstant());
    }
    if (value instanceof Instant) {
      return new RowValue(ValueType.TIMESTAMP, value);
    }
    if (value instanceof OffsetDateTime) {
      return new RowValue(ValueType.TIMESTAMP, ((OffsetDateTime) value).toInstant());
    }
    if (value instanceof ZonedDateTime) {
      return new RowValue(ValueType.TIMESTAMP, ((ZonedDateTime) value).toInstant());
    }
    if (value instanceof LocalDateTime) {
      return new RowValue(ValueType.TIMESTAMP, ((LocalDateTime) value).toInstant(ZoneOffset.UTC));
    }
    if (value instanceof LocalDate) {
      return new RowValue(
          ValueType.TIMESTAMP, ((LocalDate) value).atStartOfDay().toInstant(ZoneOffset.UTC));
    }
    if (value instanceof JsonNode) {
      return json((JsonNode) value);
    }
    return json(MAPPER.valueToTree(value));
  }

  public static RowValue string(String value) {
    return value == null ? NULL : new RowValue(ValueType.STRING, value);
  }

  private static RowValue number(Number number) {
    BigDecimal decimal;
    if (number instanceof BigDecimal) {
      decimal = (BigDecimal) number;
    } else if (number instanceof Double || number instanceof Float) {
      double d = number.doubleValue();
      if (Double.isNaN(d) || Double.isInfinite(d)) {
        return NULL;
      }
      decimal = BigDecimal.valueOf(d);
    } else {
      decimal = new BigDecimal(number.toString());
    }
    return new RowValue(ValueType.NUMBER, decimal.stripTrailingZeros());
  }

  private static RowValue json(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return NULL;
    }
    if (node.isNumber()) {
      return number(node.decimalValue());
    }
    if (node.isTextual()) {
      return new RowValue(ValueType.STRING, node.asText());
    }
    if (node.isBoolean()) {
      return new RowValue(ValueType.BOOLEAN, node.booleanValue());
    }
    return new RowValue(ValueType.JSON, node);
  }

  public ValueType type() {
    return type;
  }

  public boolean isNull() {
    return type == ValueType.NULL;
  }

  public boolean isNumber() {
    return type == ValueType.NUMBER;
  }

  public boolean isJson() {
    return type == ValueType.JSON;
  }

  /** The backing JSON node, only meaningful for {@link ValueType#JSON} values. */
  public JsonNode jsonValue() {
    return isJson() ? (JsonNode) value : MAPPER.valueToTree(toJavaObject());
  }

  /**
   * Numeric view of the value. Strings are parsed after trimming (blank counts as zero), booleans
   * map to 1 and 0, and anything that has no numeric meaning is {@code NaN} so that every
   * comparison against it is false.
   */
  public double toDouble() {
    switch (type) {
      case NUMBER:
        return ((BigDecimal) value).doubleValue();
      case BOOLEAN:
        return (Boolean) value ? 1 : 0;
      case STRING:
        String text = ((String) value).trim();
        if (text.isEmpty()) {
          return 0;
        }
        try {
          return Double.parseDouble(text);
        } catch (NumberFormatException e) {
          return Double.NaN;
        }
      case TIMESTAMP:
        return ((Instant) value).toEpochMilli();
      default:
        return Double.NaN;
    }
  }

  /**
   * Exact numeric view of the value. Strings are parsed after trimming (blank counts as zero) and
   * booleans map to 1 and 0; null and values without a numeric meaning are empty.
   */
  public Optional<BigDecimal> toDecimal() {
    switch (type) {
      case NUMBER:
        return Optional.of((BigDecimal) value);
      case BOOLEAN:
        return Optional.of((Boolean) value ? BigDecimal.ONE : BigDecimal.ZERO);
      case STRING:
        String text = ((String) value).trim();
        if (text.isEmpty()) {
          return Optional.of(BigDecimal.ZERO);
        }
        try {
          return Optional.of(new BigDecimal(text));
        } catch (NumberFormatException e) {
          return Optional.empty();
        }
      default:
        return Optional.empty();
    }
  }

  /** String form used for join keys, string comparison and logging. Null renders as empty. */
  public String asString() {
    switch (type) {
      case NULL:
        return "";
      case NUMBER:
        return ((BigDecimal) value).toPlainString();
      case TIMESTAMP:
        return ISO_MILLIS.format((Instant) value);
      default:
        return value.toString();
    }
  }

  /** Render as a SQL literal: NULL, a quoted and escaped string, or a raw number or boolean. */
  public String toSqlLiteral() {
    switch (type) {
      case NULL:
        return "NULL";
      case NUMBER:
      case BOOLEAN:
        return asString();
      case JSON:
        try {
          return quote(MAPPER.writeValueAsString(value));
        } catch (JsonProcessingException e) {
          throw new IllegalStateException("Unable to serialize JSON value", e);
        }
      default:
        return quote(asString());
    }
  }

  /** Plain Java view: BigDecimal, String, Boolean, Instant, JsonNode or null. */
  public Object toJavaObject() {
    return value;
  }

  private static String quote(String text) {
    return "'" + StringUtils.escapeSingleQuotes(text) + "'";
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RowValue)) {
      return false;
    }
    RowValue other = (RowValue) o;
    return type == other.type && Objects.equals(value, other.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, value);
  }

  @Override
  public String toString() {
    if (type == ValueType.NULL) {
      return "null";
    }
    return type == ValueType.STRING ? "\"" + value + "\"" : asString();
  }
}
