package org.experiment.analysis.warehouse.compiler;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Warehouse specific SQL fragments. The compiler never writes a function call, a type name or a
 * quoted value itself; it always goes through the dialect.
 */
public abstract class SqlDialect {
  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

  /** Name reported to SQL formatters. */
  public abstract String formatDialect();

  public abstract String floatType();

  public String stringType() {
    return "VARCHAR";
  }

  public String timestampType() {
    return "TIMESTAMP";
  }

  public String formatTimestamp(Instant instant) {
    return TIMESTAMP_FORMAT.format(instant);
  }

  public String toTimestamp(Instant instant) {
    return "CAST('" + formatTimestamp(instant) + "' AS " + timestampType() + ")";
  }

  public String addHours(String column, double hours) {
    if (hours == 0) {
      return column;
    }
    long seconds = Math.round(Math.abs(hours) * 3600);
    return "(" + column + (hours > 0 ? " + " : " - ") + "INTERVAL '" + seconds + " seconds')";
  }

  public String dateTrunc(String column) {
    return "date_trunc('day', " + column + ")";
  }

  public abstract String formatDate(String column);

  public String castToString(String column) {
    return "CAST(" + column + " AS " + stringType() + ")";
  }

  public String ensureFloat(String column) {
    return "CAST(" + column + " AS " + floatType() + ")";
  }

  public String percentileCapValue(String column, double quantile) {
    return "PERCENTILE_CONT(" + quantile + ") WITHIN GROUP (ORDER BY " + column + ")";
  }

  public String quoteIdentifier(String identifier) {
    return "\"" + identifier.replace("\"", "\"\"") + "\"";
  }

  public String escapeLiteral(String value) {
    return "'" + value.replace("'", "''") + "'";
  }

  public String generateTablePath(String tableName, String schema, String database) {
    StringBuilder path = new StringBuilder();
    if (database != null && !database.isEmpty()) {
      path.append(database).append('.');
    }
    if (schema != null && !schema.isEmpty()) {
      path.append(schema).append('.');
    }
    return path.append(tableName).toString();
  }

  public String limit(String sql, int limit) {
    return sql + "\nLIMIT " + limit;
  }
}
