package org.experiment.analysis.datamodel.rows;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DimensionSliceRow {
  String dimensionValue;
  String dimensionName;
  long units;
  long totalUnits;
}
