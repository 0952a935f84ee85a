package org.experiment.analysis.datamodel.query;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MetricAnalysisSettings {
  public static final int MAX_BINS = 25;

  Instant startDate;
  Instant endDate;
  String userIdType;
  @Builder.Default int numBins = MetricAnalysisSettings.MAX_BINS;
}
