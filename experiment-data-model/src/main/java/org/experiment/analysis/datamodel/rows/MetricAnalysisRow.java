package org.experiment.analysis.datamodel.rows;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Metric distribution row. {@code dataType} is {@code overall} for the summary row (which carries
 * the histogram) or {@code date} for daily rows.
 */
@Value
@Builder
public class MetricAnalysisRow {
  String date;
  String dataType;
  boolean capped;
  long units;
  double mainSum;
  double mainSumSquares;
  Double denominatorSum;
  Double denominatorSumSquares;
  Double mainDenominatorSumProduct;
  Double valueMin;
  Double valueMax;
  Double binWidth;
  @Singular List<Long> unitsBins;
}
