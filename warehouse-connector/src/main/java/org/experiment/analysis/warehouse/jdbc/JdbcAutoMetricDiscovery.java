package org.experiment.analysis.warehouse.jdbc;

import static org.experiment.analysis.warehouse.jdbc.RowValues.getInstant;
import static org.experiment.analysis.warehouse.jdbc.RowValues.getLong;
import static org.experiment.analysis.warehouse.jdbc.RowValues.getString;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.experiment.analysis.datamodel.metric.MetricType;
import org.experiment.analysis.datamodel.rows.AutoMetricToCreate;
import org.experiment.analysis.datamodel.rows.TrackedEventData;
import org.experiment.analysis.warehouse.capability.AutoMetricDiscoverable;
import org.experiment.analysis.warehouse.compiler.SqlDialect;

/**
 * Auto metrics for event tracking schemas that keep one row per tracked event in a {@code tracks}
 * table with {@code event}, {@code user_id}, {@code anonymous_id} and {@code timestamp} columns.
 */
class JdbcAutoMetricDiscovery implements AutoMetricDiscoverable {
  static final String TRACKS_TABLE = "tracks";

  private final JdbcQueryExecutor executor;
  private final SqlDialect dialect;

  JdbcAutoMetricDiscovery(JdbcQueryExecutor executor, SqlDialect dialect) {
    this.executor = executor;
    this.dialect = dialect;
  }

  @Override
  public List<TrackedEventData> getEventsTrackedByDatasource(String schema) {
    String sql =
        "SELECT event AS event_name, COUNT(*) AS count,\n"
            + "  SUM(CASE WHEN user_id IS NULL THEN 0 ELSE 1 END) AS user_rows,\n"
            + "  MAX(timestamp) AS last_tracked_at\nFROM "
            + dialect.generateTablePath(TRACKS_TABLE, schema, null)
            + "\nGROUP BY event\nORDER BY count DESC, event";
    return executor.query(
        sql,
        row ->
            TrackedEventData.builder()
                .eventName(getString(row, "event_name"))
                .displayName(getString(row, "event_name"))
                .hasUserId(getLong(row, "user_rows") > 0)
                .count(getLong(row, "count"))
                .lastTrackedAt(getInstant(row, "last_tracked_at"))
                .build());
  }

  @Override
  public List<AutoMetricToCreate> getAutoMetricsToCreate(
      Set<String> existingMetricNames, String schema) {
    List<AutoMetricToCreate> metrics = new ArrayList<>();
    for (TrackedEventData event : getEventsTrackedByDatasource(schema)) {
      for (MetricType type : List.of(MetricType.PROPORTION, MetricType.MEAN)) {
        String name =
            type == MetricType.PROPORTION
                ? event.getEventName()
                : "Count of " + event.getEventName();
        boolean exists = existingMetricNames.contains(name);
        AutoMetricToCreate.AutoMetricToCreateBuilder metric =
            AutoMetricToCreate.builder()
                .name(name)
                .type(type)
                .sql(
                    getAutoGeneratedMetricSqlQuery(
                        event.getEventName(), event.isHasUserId(), schema, type))
                .alreadyExists(exists)
                .shouldCreate(!exists)
                .userIdType("anonymous_id");
        if (event.isHasUserId()) {
          metric.userIdType("user_id");
        }
        metrics.add(metric.build());
      }
    }
    return metrics;
  }

  @Override
  public String getAutoGeneratedMetricSqlQuery(
      String event, boolean hasUserId, String schema, MetricType type) {
    return "SELECT\n  "
        + (hasUserId ? "user_id,\n  " : "")
        + "anonymous_id,\n  timestamp"
        + (type == MetricType.PROPORTION ? "" : ",\n  1 AS value")
        + "\nFROM "
        + dialect.generateTablePath(TRACKS_TABLE, schema, null)
        + "\nWHERE event = "
        + dialect.escapeLiteral(event)
        + "\n  AND timestamp BETWEEN '{{startDate}}' AND '{{endDate}}'";
  }
}
