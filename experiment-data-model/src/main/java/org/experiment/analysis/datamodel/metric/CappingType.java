package org.experiment.analysis.datamodel.metric;

public enum CappingType {
  NONE,
  ABSOLUTE,
  PERCENTILE
}
