package org.experiment.analysis.datamodel.metric;

public enum WindowType {
  NONE,
  CONVERSION,
  LOOKBACK
}
