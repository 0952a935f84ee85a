package org.experiment.analysis.datamodel.experiment;

public enum AttributionModel {
  /** Metric windows start at each unit's first exposure. */
  FIRST_EXPOSURE,
  /** Metric windows are ignored, every conversion until the experiment end counts. */
  EXPERIMENT_DURATION
}
