package org.experiment.analysis.datamodel.rows;

import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * One (dimension, variation) aggregate of several metrics. Metric statistics are keyed by the
 * metric alias, e.g. {@code m0_main_sum} or {@code m1_quantile}.
 */
@Value
@Builder
public class FactMetricsRow {
  String dimension;
  String variation;
  long users;
  long count;
  @Singular Map<String, Object> values;

  public Optional<Double> getDouble(String alias, String statistic) {
    Object value = values.get(alias + "_" + statistic);
    if (value instanceof Number) {
      return Optional.of(((Number) value).doubleValue());
    }
    if (value instanceof String) {
      return Optional.of(Double.parseDouble((String) value));
    }
    return Optional.empty();
  }
}
