package org.experiment.analysis.datamodel.query;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.experiment.analysis.datamodel.experiment.ExposureQuery;

@Value
@Builder
public class PastExperimentParams {
  Instant from;
  @Singular List<ExposureQuery> exposureQueries;
  boolean forceRefresh;
}
