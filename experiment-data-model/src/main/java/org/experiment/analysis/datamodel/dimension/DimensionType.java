package org.experiment.analysis.datamodel.dimension;

public enum DimensionType {
  USER,
  EXPERIMENT,
  DATE,
  ACTIVATION
}
