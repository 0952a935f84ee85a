package org.experiment.analysis.datamodel.metric;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class QuantileSettings {
  @Builder.Default QuantileType type = QuantileType.UNIT;
  double quantile;
  boolean ignoreZeros;
}
