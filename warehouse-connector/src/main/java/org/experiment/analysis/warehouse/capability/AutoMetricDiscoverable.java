package org.experiment.analysis.warehouse.capability;

import java.util.List;
import java.util.Set;
import org.experiment.analysis.datamodel.metric.MetricType;
import org.experiment.analysis.datamodel.rows.AutoMetricToCreate;
import org.experiment.analysis.datamodel.rows.TrackedEventData;

/** Discovers tracked events in an event-tracking schema and proposes metrics for them. */
public interface AutoMetricDiscoverable {

  List<TrackedEventData> getEventsTrackedByDatasource(String schema);

  List<AutoMetricToCreate> getAutoMetricsToCreate(Set<String> existingMetricNames, String schema);

  String getAutoGeneratedMetricSqlQuery(
      String event, boolean hasUserId, String schema, MetricType type);
}
