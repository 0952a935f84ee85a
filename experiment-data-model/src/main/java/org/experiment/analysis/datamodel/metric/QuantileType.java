package org.experiment.analysis.datamodel.metric;

public enum QuantileType {
  /** Quantile over individual fact rows. */
  EVENT,
  /** Quantile over per-unit aggregated values. */
  UNIT
}
