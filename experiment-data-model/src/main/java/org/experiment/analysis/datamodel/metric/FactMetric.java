package org.experiment.analysis.datamodel.metric;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Stored definition of a metric computed from fact rows. Ratio metrics carry a denominator,
 * quantile metrics carry {@link QuantileSettings}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FactMetric {
  String id;
  String name;
  MetricType metricType;
  ColumnRef numerator;
  ColumnRef denominator;
  @Builder.Default MetricWindow window = MetricWindow.NONE;
  @Builder.Default CappingSettings capping = CappingSettings.NONE;
  QuantileSettings quantileSettings;
  boolean regressionAdjustmentEnabled;
  double regressionAdjustmentDays;
  boolean inverse;

  public boolean isRatio() {
    return metricType == MetricType.RATIO && denominator != null;
  }

  public boolean isQuantile() {
    return metricType == MetricType.QUANTILE && quantileSettings != null;
  }

  public boolean isBinomial() {
    return metricType == MetricType.PROPORTION;
  }
}
