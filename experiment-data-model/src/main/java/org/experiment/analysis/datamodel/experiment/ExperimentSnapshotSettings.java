package org.experiment.analysis.datamodel.experiment;

import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class ExperimentSnapshotSettings {
  String experimentId;
  String snapshotId;
  String datasourceId;
  ExposureQuery exposureQuery;
  Instant startDate;
  Instant endDate;
  @Singular List<Variation> variations;
  boolean regressionAdjustmentEnabled;
  boolean skipPartialData;
  String queryFilter;
  @Builder.Default AttributionModel attributionModel = AttributionModel.FIRST_EXPOSURE;
}
