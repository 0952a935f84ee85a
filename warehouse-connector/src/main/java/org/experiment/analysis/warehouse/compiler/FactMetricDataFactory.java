package org.experiment.analysis.warehouse.compiler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.experiment.analysis.datamodel.experiment.ExperimentSnapshotSettings;
import org.experiment.analysis.datamodel.metric.CappingSettings;
import org.experiment.analysis.datamodel.metric.FactMetric;
import org.experiment.analysis.datamodel.metric.FactMetricData;
import org.experiment.analysis.datamodel.metric.MetricWindow;
import org.experiment.analysis.datamodel.metric.WindowType;

/** Resolves stored fact metrics into the per-request {@link FactMetricData} of the compiler. */
public class FactMetricDataFactory {

  public static String alias(int index) {
    return "m" + index;
  }

  public static List<FactMetricData> create(
      List<FactMetric> metrics, ExperimentSnapshotSettings settings) {
    double minMetricDelay = 0;
    for (FactMetric metric : metrics) {
      minMetricDelay = Math.min(minMetricDelay, metric.getWindow().getDelayHours());
    }

    List<FactMetricData> result = new ArrayList<>(metrics.size());
    for (int i = 0; i < metrics.size(); i++) {
      result.add(create(alias(i), metrics.get(i), settings, minMetricDelay));
    }
    return result;
  }

  static FactMetricData create(
      String alias, FactMetric metric, ExperimentSnapshotSettings settings, double minMetricDelay) {
    boolean regressionAdjusted =
        settings.isRegressionAdjustmentEnabled()
            && metric.isRegressionAdjustmentEnabled()
            && metric.getRegressionAdjustmentDays() > 0
            && !metric.isQuantile();
    double regressionAdjustmentHours =
        regressionAdjusted ? metric.getRegressionAdjustmentDays() * 24 : 0;

    MetricWindow window = metric.getWindow();
    double maxHoursToConvert =
        window.getType() == WindowType.CONVERSION
            ? window.getDelayHours() + window.getWindowHours()
            : 0;

    Instant metricStart =
        plusHours(settings.getStartDate(), minMetricDelay - regressionAdjustmentHours);
    Instant metricEnd =
        window.getType() == WindowType.CONVERSION
            ? plusHours(settings.getEndDate(), maxHoursToConvert)
            : settings.getEndDate();

    CappingSettings capping = metric.getCapping();
    String capCoalesceMetric = capCoalesce(alias + "_value", alias + "_value_cap", capping);
    String capCoalesceDenominator =
        metric.isRatio()
            ? capCoalesce(alias + "_denominator", alias + "_denominator_cap", capping)
            : null;
    String capCoalesceCovariate =
        regressionAdjusted
            ? capCoalesce(alias + "_covariate", alias + "_value_cap", capping)
            : null;
    if (metric.isBinomial()) {
      capCoalesceMetric = "CASE WHEN " + capCoalesceMetric + " > 0 THEN 1 ELSE 0 END";
      if (capCoalesceCovariate != null) {
        capCoalesceCovariate = "CASE WHEN " + capCoalesceCovariate + " > 0 THEN 1 ELSE 0 END";
      }
    }

    return FactMetricData.builder()
        .alias(alias)
        .id(metric.getId())
        .metric(metric)
        .ratioMetric(metric.isRatio())
        .quantileMetric(metric.isQuantile() ? metric.getQuantileSettings().getType() : null)
        .regressionAdjusted(regressionAdjusted)
        .regressionAdjustmentHours(regressionAdjustmentHours)
        .percentileCapped(capping.isPercentileCapped())
        .capCoalesceMetric(capCoalesceMetric)
        .capCoalesceDenominator(capCoalesceDenominator)
        .capCoalesceCovariate(capCoalesceCovariate)
        .minMetricDelay(minMetricDelay)
        .metricStart(metricStart)
        .metricEnd(metricEnd)
        .maxHoursToConvert(maxHoursToConvert)
        .build();
  }

  private static String capCoalesce(String column, String capColumn, CappingSettings capping) {
    if (capping.isPercentileCapped()) {
      return "COALESCE(LEAST(" + column + ", " + capColumn + "), 0)";
    }
    if (capping.isAbsoluteCapped()) {
      return "COALESCE(LEAST(" + column + ", " + capping.getValue() + "), 0)";
    }
    return "COALESCE(" + column + ", 0)";
  }

  private static Instant plusHours(Instant instant, double hours) {
    return instant.plus(Duration.ofSeconds(Math.round(hours * 3600)));
  }
}
