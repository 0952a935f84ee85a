package org.experiment.analysis.pipeline;

import com.google.common.base.Preconditions;
import java.time.Instant;
import lombok.Getter;
import lombok.ToString;

/**
 * Progress of one experiment's refresh. {@link #getCompletedStage()} is {@code null} until the
 * first stage succeeds and only ever moves one stage forward.
 */
@Getter
@ToString
public class PipelineState {
  private final String experimentId;
  private final String tableName;
  private final Instant lookbackDate;
  private volatile PipelineStage completedStage;

  public PipelineState(String experimentId, String tableName, Instant lookbackDate) {
    this.experimentId = experimentId;
    this.tableName = tableName;
    this.lookbackDate = lookbackDate;
  }

  public String getMetricsTableName() {
    return PipelineTableNames.metricsTable(tableName);
  }

  /** The stage that runs next, {@link PipelineStage#DONE} once every stage succeeded. */
  public PipelineStage getNextStage() {
    return completedStage == null ? PipelineStage.CREATE_UNITS_TABLE : completedStage.next();
  }

  public boolean isDone() {
    return completedStage == PipelineStage.COMPUTE_STATISTICS;
  }

  void complete(PipelineStage stage) {
    Preconditions.checkState(
        stage == getNextStage(), "Stage %s completed while %s was expected", stage, getNextStage());
    completedStage = stage;
  }
}
