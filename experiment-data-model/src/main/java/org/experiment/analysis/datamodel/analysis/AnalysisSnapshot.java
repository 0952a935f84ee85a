package org.experiment.analysis.datamodel.analysis;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Result of one refresh of an experiment. The first entry of {@code results} is the default
 * (unsliced) analysis.
 */
@Value
@Builder
@Jacksonized
public class AnalysisSnapshot {
  String experimentId;
  String snapshotId;
  Instant dateCreated;
  long multipleExposures;
  @Singular List<AnalysisResultDimension> results;

  @JsonIgnore
  public Optional<AnalysisResultDimension> getDefaultAnalysisResults() {
    return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
  }
}
