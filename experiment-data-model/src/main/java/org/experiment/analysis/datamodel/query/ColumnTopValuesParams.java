package org.experiment.analysis.datamodel.query;

import lombok.Builder;
import lombok.Value;
import org.experiment.analysis.datamodel.metric.FactTable;

@Value
@Builder
public class ColumnTopValuesParams {
  FactTable factTable;
  String column;
  @Builder.Default int limit = 50;
}
