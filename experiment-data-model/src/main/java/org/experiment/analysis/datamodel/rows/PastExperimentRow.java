package org.experiment.analysis.datamodel.rows;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PastExperimentRow {
  String exposureQuery;
  String experimentId;
  String experimentName;
  String variationId;
  String variationName;
  Instant startDate;
  Instant endDate;
  long users;
  Instant latestData;
}
