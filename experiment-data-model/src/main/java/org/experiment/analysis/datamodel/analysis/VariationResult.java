package org.experiment.analysis.datamodel.analysis;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class VariationResult {
  String variationId;
  long users;
}
