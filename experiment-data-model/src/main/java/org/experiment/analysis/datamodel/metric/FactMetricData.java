package org.experiment.analysis.datamodel.metric;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Per-request view of a {@link FactMetric}: its SQL alias plus every setting already resolved
 * against the experiment snapshot settings. Instances are immutable for the duration of one
 * analysis request.
 */
@Value
@Builder
public class FactMetricData {
  String alias;
  String id;
  FactMetric metric;
  boolean ratioMetric;
  QuantileType quantileMetric;
  boolean regressionAdjusted;
  double regressionAdjustmentHours;
  boolean percentileCapped;
  String capCoalesceMetric;
  String capCoalesceDenominator;
  String capCoalesceCovariate;
  double minMetricDelay;
  Instant metricStart;
  Instant metricEnd;
  double maxHoursToConvert;

  public boolean isQuantile() {
    return quantileMetric != null;
  }
}
