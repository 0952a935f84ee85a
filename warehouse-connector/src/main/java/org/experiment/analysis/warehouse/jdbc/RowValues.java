package org.experiment.analysis.warehouse.jdbc;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

/** Lenient conversions of JDBC values; drivers disagree on the Java types they return. */
class RowValues {

  static String getString(Map<String, Object> row, String column) {
    Object value = row.get(column);
    return value == null ? null : value.toString();
  }

  static long getLong(Map<String, Object> row, String column) {
    Object value = row.get(column);
    if (value == null) {
      return 0;
    }
    if (value instanceof Number) {
      return ((Number) value).longValue();
    }
    return (long) Double.parseDouble(value.toString());
  }

  static double getDouble(Map<String, Object> row, String column) {
    Double value = getNullableDouble(row, column);
    return value == null ? 0 : value;
  }

  static Double getNullableDouble(Map<String, Object> row, String column) {
    Object value = row.get(column);
    if (value == null) {
      return null;
    }
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    return Double.parseDouble(value.toString());
  }

  static boolean getBoolean(Map<String, Object> row, String column) {
    Object value = row.get(column);
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    if (value instanceof Number) {
      return ((Number) value).intValue() != 0;
    }
    return value != null && Boolean.parseBoolean(value.toString());
  }

  static Instant getInstant(Map<String, Object> row, String column) {
    Object value = row.get(column);
    if (value == null) {
      return null;
    }
    if (value instanceof Timestamp) {
      return ((Timestamp) value).toLocalDateTime().toInstant(ZoneOffset.UTC);
    }
    if (value instanceof LocalDateTime) {
      return ((LocalDateTime) value).toInstant(ZoneOffset.UTC);
    }
    if (value instanceof OffsetDateTime) {
      return ((OffsetDateTime) value).toInstant();
    }
    if (value instanceof LocalDate) {
      return ((LocalDate) value).atStartOfDay().toInstant(ZoneOffset.UTC);
    }
    if (value instanceof java.util.Date) {
      return ((java.util.Date) value).toInstant();
    }
    return LocalDateTime.parse(value.toString().replace(' ', 'T')).toInstant(ZoneOffset.UTC);
  }
}
