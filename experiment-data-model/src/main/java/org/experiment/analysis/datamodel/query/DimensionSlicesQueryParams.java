package org.experiment.analysis.datamodel.query;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.experiment.analysis.datamodel.dimension.ExperimentDimension;
import org.experiment.analysis.datamodel.experiment.ExposureQuery;

@Value
@Builder
public class DimensionSlicesQueryParams {
  ExposureQuery exposureQuery;
  @Singular List<ExperimentDimension> dimensions;
  int lookbackDays;
  // upper bound of the lookback range, passed in so compilation never reads the clock
  Instant endDate;
}
