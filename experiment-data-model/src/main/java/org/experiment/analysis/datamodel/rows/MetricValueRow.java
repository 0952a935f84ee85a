package org.experiment.analysis.datamodel.rows;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MetricValueRow {
  String date;
  long count;
  double mainSum;
  double mainSumSquares;
}
