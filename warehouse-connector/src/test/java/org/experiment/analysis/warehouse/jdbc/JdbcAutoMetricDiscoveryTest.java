package org.experiment.analysis.warehouse.jdbc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.experiment.analysis.datamodel.metric.MetricType;
import org.experiment.analysis.datamodel.rows.AutoMetricToCreate;
import org.experiment.analysis.datamodel.rows.TrackedEventData;
import org.experiment.analysis.warehouse.compiler.PostgresDialect;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class JdbcAutoMetricDiscoveryTest {
  private final JdbcQueryExecutor executor = mock(JdbcQueryExecutor.class);
  private final JdbcAutoMetricDiscovery discovery =
      new JdbcAutoMetricDiscovery(executor, new PostgresDialect());

  @Test
  void testGeneratedMetricSql() {
    Assertions.assertEquals(
        "SELECT\n  user_id,\n  anonymous_id,\n  timestamp,\n  1 AS value\nFROM segment.tracks\n"
            + "WHERE event = 'Checkout ''Started'''\n"
            + "  AND timestamp BETWEEN '{{startDate}}' AND '{{endDate}}'",
        discovery.getAutoGeneratedMetricSqlQuery(
            "Checkout 'Started'", true, "segment", MetricType.MEAN));
    Assertions.assertFalse(
        discovery
            .getAutoGeneratedMetricSqlQuery("signup", false, "segment", MetricType.PROPORTION)
            .contains("user_id"));
  }

  @Test
  void testExistingMetricsAreNotRecreated() {
    doReturn(
            List.of(
                TrackedEventData.builder()
                    .eventName("signup")
                    .displayName("signup")
                    .hasUserId(false)
                    .count(40)
                    .lastTrackedAt(Instant.parse("2024-01-01T00:00:00Z"))
                    .build()))
        .when(executor)
        .query(anyString(), any());

    List<AutoMetricToCreate> metrics =
        discovery.getAutoMetricsToCreate(Set.of("signup"), "segment");

    Assertions.assertEquals(2, metrics.size());
    Assertions.assertEquals("signup", metrics.get(0).getName());
    Assertions.assertTrue(metrics.get(0).isAlreadyExists());
    Assertions.assertFalse(metrics.get(0).isShouldCreate());
    Assertions.assertEquals("Count of signup", metrics.get(1).getName());
    Assertions.assertTrue(metrics.get(1).isShouldCreate());
    Assertions.assertEquals(List.of("anonymous_id"), metrics.get(1).getUserIdTypes());
  }
}
