package org.experiment.analysis.datamodel.metric;

public enum ColumnAggregation {
  SUM,
  MAX,
  COUNT_DISTINCT
}
