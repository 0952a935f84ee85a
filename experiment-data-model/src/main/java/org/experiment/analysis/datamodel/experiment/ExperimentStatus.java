package org.experiment.analysis.datamodel.experiment;

public enum ExperimentStatus {
  DRAFT,
  RUNNING,
  STOPPED
}
