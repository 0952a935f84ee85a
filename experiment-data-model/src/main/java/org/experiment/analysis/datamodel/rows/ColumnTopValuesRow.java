package org.experiment.analysis.datamodel.rows;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ColumnTopValuesRow {
  String value;
  long count;
}
