package org.experiment.analysis.datamodel.metric;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class MetricWindow {
  public static final MetricWindow NONE = MetricWindow.builder().build();

  @Builder.Default WindowType type = WindowType.NONE;
  // conversion window length, or the lookback length for LOOKBACK windows
  double windowHours;
  double delayHours;
}
