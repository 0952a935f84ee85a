package org.experiment.analysis.datamodel.metric;

public enum MetricType {
  PROPORTION,
  MEAN,
  RATIO,
  QUANTILE
}
