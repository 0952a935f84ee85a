package org.experiment.analysis.pipeline;

/** Receives the warehouse job id of every statement a pipeline submits, as soon as it is known. */
@FunctionalInterface
public interface ExternalIdListener {
  ExternalIdListener NOOP = (state, stage, externalId) -> {};

  void onExternalIdAssigned(PipelineState state, PipelineStage stage, String externalId);
}
