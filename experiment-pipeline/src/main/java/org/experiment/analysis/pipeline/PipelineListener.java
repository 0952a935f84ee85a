package org.experiment.analysis.pipeline;

public interface PipelineListener {
  PipelineListener NOOP = new PipelineListener() {};

  default void onStageStarted(PipelineState state, PipelineStage stage) {}

  /** Called after {@code state} has been advanced past the completed stage. */
  default void onStageCompleted(PipelineState state) {}

  default void onStageFailed(PipelineState state, PipelineStageException exception) {}
}
