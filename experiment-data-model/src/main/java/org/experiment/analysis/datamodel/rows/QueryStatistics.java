package org.experiment.analysis.datamodel.rows;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class QueryStatistics {
  long executionDurationMs;
  // null when the warehouse does not report it
  Long bytesScanned;
  Long rowsProcessed;
  String jobId;
}
