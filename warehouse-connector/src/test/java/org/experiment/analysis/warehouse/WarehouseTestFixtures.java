package org.experiment.analysis.warehouse;

import java.time.Instant;
import org.experiment.analysis.datamodel.experiment.ExperimentSnapshotSettings;
import org.experiment.analysis.datamodel.experiment.ExposureQuery;
import org.experiment.analysis.datamodel.experiment.Variation;
import org.experiment.analysis.datamodel.metric.ColumnRef;
import org.experiment.analysis.datamodel.metric.FactMetric;
import org.experiment.analysis.datamodel.metric.FactTable;
import org.experiment.analysis.datamodel.metric.MetricType;

public class WarehouseTestFixtures {
  public static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
  public static final Instant END = Instant.parse("2024-01-08T00:00:00Z");

  public static final FactTable PURCHASES =
      FactTable.builder()
          .id("purchases")
          .name("Purchases")
          .sql("SELECT user_id, timestamp, amount FROM purchases")
          .userIdType("user_id")
          .build();

  public static final FactMetric PURCHASE_COUNT =
      FactMetric.builder()
          .id("fact_purchase_count")
          .name("Purchase count")
          .metricType(MetricType.MEAN)
          .numerator(ColumnRef.builder().factTableId("purchases").column(ColumnRef.COUNT).build())
          .build();

  public static final FactMetric REVENUE =
      FactMetric.builder()
          .id("fact_revenue")
          .name("Revenue")
          .metricType(MetricType.MEAN)
          .numerator(ColumnRef.builder().factTableId("purchases").column("amount").build())
          .build();

  public static final FactMetric PURCHASED =
      FactMetric.builder()
          .id("fact_purchased")
          .name("Purchased")
          .metricType(MetricType.PROPORTION)
          .numerator(
              ColumnRef.builder().factTableId("purchases").column(ColumnRef.DISTINCT_USERS).build())
          .build();

  private WarehouseTestFixtures() {}

  public static ExperimentSnapshotSettings settings() {
    return ExperimentSnapshotSettings.builder()
        .experimentId("exp_checkout")
        .snapshotId("snp_1")
        .datasourceId("warehouse")
        .exposureQuery(
            ExposureQuery.builder()
                .id("user_exposures")
                .userIdType("user_id")
                .sql("SELECT user_id, timestamp, experiment_id, variation_id FROM exposures")
                .build())
        .startDate(START)
        .endDate(END)
        .variation(Variation.builder().id("0").name("Control").weight(0.5).build())
        .variation(Variation.builder().id("1").name("Treatment").weight(0.5).build())
        .build();
  }
}
