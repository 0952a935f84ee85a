package org.experiment.analysis.pipeline;

public class PipelineStageException extends RuntimeException {
  private final PipelineStage stage;

  public PipelineStageException(PipelineStage stage, String experimentId, Throwable cause) {
    super(
        "Pipeline stage " + stage + " failed for experiment " + experimentId + ": "
            + cause.getMessage(),
        cause);
    this.stage = stage;
  }

  public PipelineStage getStage() {
    return stage;
  }
}
