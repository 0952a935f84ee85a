package org.experiment.analysis.datamodel.query;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ExperimentPipelineTrimMetricsParams {
  String tableName;
  Instant lookbackDate;
}
