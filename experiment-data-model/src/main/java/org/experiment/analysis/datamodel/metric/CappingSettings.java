package org.experiment.analysis.datamodel.metric;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CappingSettings {
  public static final CappingSettings NONE = CappingSettings.builder().build();

  @Builder.Default CappingType type = CappingType.NONE;
  double value;
  boolean ignoreZeros;

  public boolean isPercentileCapped() {
    return type == CappingType.PERCENTILE && value > 0 && value < 1;
  }

  public boolean isAbsoluteCapped() {
    return type == CappingType.ABSOLUTE && value > 0;
  }
}
