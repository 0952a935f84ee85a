package org.experiment.analysis.datamodel.analysis;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Aggregated result for one dimension slice; {@code srm} is the sample ratio mismatch p-value. */
@Value
@Builder
@Jacksonized
public class AnalysisResultDimension {
  String name;
  double srm;
  @Singular List<VariationResult> variations;

  public long getTotalUsers() {
    return variations.stream().mapToLong(VariationResult::getUsers).sum();
  }
}
