package org.experiment.analysis.warehouse.compiler;

import static org.experiment.analysis.warehouse.WarehouseTestFixtures.PURCHASED;
import static org.experiment.analysis.warehouse.WarehouseTestFixtures.REVENUE;
import static org.experiment.analysis.warehouse.WarehouseTestFixtures.settings;

import java.time.Instant;
import java.util.List;
import org.experiment.analysis.datamodel.metric.CappingSettings;
import org.experiment.analysis.datamodel.metric.CappingType;
import org.experiment.analysis.datamodel.metric.FactMetric;
import org.experiment.analysis.datamodel.metric.FactMetricData;
import org.experiment.analysis.datamodel.metric.MetricWindow;
import org.experiment.analysis.datamodel.metric.WindowType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class FactMetricDataFactoryTest {

  @Test
  void testAliasesFollowMetricOrder() {
    List<FactMetricData> metrics =
        FactMetricDataFactory.create(List.of(REVENUE, PURCHASED), settings());

    Assertions.assertEquals("m0", metrics.get(0).getAlias());
    Assertions.assertEquals("fact_revenue", metrics.get(0).getId());
    Assertions.assertEquals("m1", metrics.get(1).getAlias());
  }

  @Test
  void testRegressionAdjustmentNeedsBothSwitches() {
    FactMetric adjusted =
        REVENUE.toBuilder().regressionAdjustmentEnabled(true).regressionAdjustmentDays(14).build();

    FactMetricData disabled = FactMetricDataFactory.create(List.of(adjusted), settings()).get(0);
    Assertions.assertFalse(disabled.isRegressionAdjusted());
    Assertions.assertEquals(settings().getStartDate(), disabled.getMetricStart());

    FactMetricData enabled =
        FactMetricDataFactory.create(
                List.of(adjusted), settings().toBuilder().regressionAdjustmentEnabled(true).build())
            .get(0);
    Assertions.assertTrue(enabled.isRegressionAdjusted());
    Assertions.assertEquals(336, enabled.getRegressionAdjustmentHours());
    Assertions.assertEquals(Instant.parse("2023-12-18T00:00:00Z"), enabled.getMetricStart());
  }

  @Test
  void testConversionWindowExtendsMetricEnd() {
    FactMetric windowed =
        REVENUE.toBuilder()
            .window(
                MetricWindow.builder()
                    .type(WindowType.CONVERSION)
                    .delayHours(-2)
                    .windowHours(26)
                    .build())
            .build();

    FactMetricData data = FactMetricDataFactory.create(List.of(windowed), settings()).get(0);

    Assertions.assertEquals(24, data.getMaxHoursToConvert());
    Assertions.assertEquals(-2, data.getMinMetricDelay());
    Assertions.assertEquals(Instant.parse("2023-12-31T22:00:00Z"), data.getMetricStart());
    Assertions.assertEquals(Instant.parse("2024-01-09T00:00:00Z"), data.getMetricEnd());
  }

  @Test
  void testCapCoalesceExpressions() {
    FactMetric absolute =
        REVENUE.toBuilder()
            .capping(CappingSettings.builder().type(CappingType.ABSOLUTE).value(100).build())
            .build();
    FactMetric percentile =
        REVENUE.toBuilder()
            .capping(CappingSettings.builder().type(CappingType.PERCENTILE).value(0.99).build())
            .build();

    List<FactMetricData> metrics =
        FactMetricDataFactory.create(List.of(absolute, percentile, PURCHASED), settings());

    Assertions.assertEquals(
        "COALESCE(LEAST(m0_value, 100.0), 0)", metrics.get(0).getCapCoalesceMetric());
    Assertions.assertTrue(metrics.get(1).isPercentileCapped());
    Assertions.assertEquals(
        "COALESCE(LEAST(m1_value, m1_value_cap), 0)", metrics.get(1).getCapCoalesceMetric());
    Assertions.assertEquals(
        "CASE WHEN COALESCE(m2_value, 0) > 0 THEN 1 ELSE 0 END",
        metrics.get(2).getCapCoalesceMetric());
  }
}
