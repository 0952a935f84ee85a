package org.experiment.analysis.pipeline;

/** Stages of an incremental refresh, in execution order. */
public enum PipelineStage {
  CREATE_UNITS_TABLE,
  POPULATE_UNITS,
  TRIM_METRICS,
  COMPUTE_FACT_METRICS,
  COMPUTE_STATISTICS,
  DONE;

  public PipelineStage next() {
    if (this == DONE) {
      throw new IllegalStateException("No stage after " + DONE);
    }
    return values()[ordinal() + 1];
  }
}
