package org.experiment.analysis.datamodel.rows;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AggregateUnitsRow {
  // variation of units exposed to more than one variation
  public static final String MULTIPLE_EXPOSURES = "__multiple__";

  String variation;
  String dimensionValue;
  String dimensionName;
  long units;
}
