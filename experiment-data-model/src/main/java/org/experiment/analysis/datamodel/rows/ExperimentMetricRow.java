package org.experiment.analysis.datamodel.rows;

import lombok.Builder;
import lombok.Value;

/**
 * One (dimension, variation) aggregate of a single metric. Optional statistics are null when the
 * metric type does not produce them: denominator columns for ratio metrics, covariate columns for
 * regression adjusted metrics, quantile columns for quantile metrics.
 */
@Value
@Builder
public class ExperimentMetricRow {
  String dimension;
  String variation;
  long users;
  long count;
  Double mainCapValue;
  double mainSum;
  double mainSumSquares;
  Double denominatorCapValue;
  Double denominatorSum;
  Double denominatorSumSquares;
  Double mainDenominatorSumProduct;
  Double covariateSum;
  Double covariateSumSquares;
  Double mainCovariateSumProduct;
  Double quantile;
  Double quantileN;
  Double quantileLower;
  Double quantileUpper;
  Double quantileNstar;
}
