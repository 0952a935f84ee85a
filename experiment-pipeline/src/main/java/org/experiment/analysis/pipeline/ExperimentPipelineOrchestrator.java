package org.experiment.analysis.pipeline;

import com.google.common.base.Preconditions;
import com.typesafe.config.Config;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.experiment.analysis.datamodel.metric.FactMetric;
import org.experiment.analysis.datamodel.query.DropTableQueryParams;
import org.experiment.analysis.datamodel.query.ExperimentPipelineFactMetricsParams;
import org.experiment.analysis.datamodel.query.ExperimentPipelineTrimMetricsParams;
import org.experiment.analysis.datamodel.query.ExperimentPipelineUnitsParams;
import org.experiment.analysis.datamodel.rows.FactMetricsRow;
import org.experiment.analysis.datamodel.rows.QueryResponse;
import org.experiment.analysis.warehouse.QueryJob;
import org.experiment.analysis.warehouse.WarehouseConnector;
import org.experiment.analysis.warehouse.exception.DataSourceNotSupportedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the incremental refresh of one experiment against a dedicated units table and its metrics
 * table:
 *
 * <ol>
 *   <li>create both tables if missing
 *   <li>insert units first exposed since the lookback date
 *   <li>delete metric rows older than the lookback date
 *   <li>recompute metric rows from the lookback date on, one statement per metric group
 *   <li>aggregate the metrics table into per variation statistics
 * </ol>
 *
 * <p>A failed stage stops the run; tables written by earlier stages are left as they are. Callers
 * wanting a clean retry drop the tables with {@link #dropPipelineTables(PipelineState)} first.
 */
public class ExperimentPipelineOrchestrator {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(ExperimentPipelineOrchestrator.class);

  static final String MAX_METRICS_PER_GROUP_CONFIG = "maxMetricsPerGroup";
  static final String STAGE_TIMER = "experiment.pipeline.stage";

  private final WarehouseConnector connector;
  private final MetricGroupPartitioner partitioner;
  private final MeterRegistry meterRegistry;

  public ExperimentPipelineOrchestrator(
      WarehouseConnector connector, Config pipelineConfig, MeterRegistry meterRegistry) {
    this.connector = connector;
    this.partitioner =
        new MetricGroupPartitioner(
            pipelineConfig.hasPath(MAX_METRICS_PER_GROUP_CONFIG)
                ? pipelineConfig.getInt(MAX_METRICS_PER_GROUP_CONFIG)
                : MetricGroupPartitioner.DEFAULT_MAX_GROUP_SIZE);
    this.meterRegistry = meterRegistry;
  }

  public PipelineResult run(ExperimentPipelineRequest request) {
    return run(request, PipelineListener.NOOP, ExternalIdListener.NOOP);
  }

  public PipelineResult run(
      ExperimentPipelineRequest request,
      PipelineListener listener,
      ExternalIdListener externalIdListener) {
    if (!connector.getSourceProperties().isSupportsPipeline()) {
      throw new DataSourceNotSupportedException(
          "Datasource " + connector.getDatasourceId() + " does not support incremental refresh");
    }

    Preconditions.checkArgument(!request.getMetrics().isEmpty(), "no metrics to compute");

    String experimentId = request.getSettings().getExperimentId();
    String tableName =
        connector.generateTablePath(
            PipelineTableNames.unitsTable(experimentId, request.getSettings().getSnapshotId()));
    PipelineState state = new PipelineState(experimentId, tableName, request.getLookbackDate());
    List<List<FactMetric>> metricGroups = partitioner.partition(request.getMetrics());
    LOGGER.info(
        "Starting pipeline for experiment {} on table {} with lookback {} and {} metric groups",
        experimentId,
        tableName,
        request.getLookbackDate(),
        metricGroups.size());

    ExperimentPipelineUnitsParams unitsParams =
        ExperimentPipelineUnitsParams.builder()
            .settings(request.getSettings())
            .factTables(request.getFactTables())
            .dimensions(request.getDimensions())
            .activationMetric(request.getActivationMetric())
            .segment(request.getSegment())
            .tableName(tableName)
            .lookbackDate(request.getLookbackDate())
            .build();
    ExperimentPipelineFactMetricsParams factMetricsParams =
        ExperimentPipelineFactMetricsParams.builder()
            .settings(request.getSettings())
            .factTables(request.getFactTables())
            .dimensions(request.getDimensions())
            .activationMetric(request.getActivationMetric())
            .segment(request.getSegment())
            .tableName(tableName)
            .lookbackDate(request.getLookbackDate())
            .metricGroups(metricGroups)
            .build();

    runStage(
        state,
        PipelineStage.CREATE_UNITS_TABLE,
        listener,
        () ->
            await(
                state,
                PipelineStage.CREATE_UNITS_TABLE,
                connector.runExperimentPipelineCreateUnitsQuery(
                    connector.getExperimentPipelineCreateUnitsQuery(unitsParams)),
                externalIdListener));
    runStage(
        state,
        PipelineStage.POPULATE_UNITS,
        listener,
        () ->
            await(
                state,
                PipelineStage.POPULATE_UNITS,
                connector.runExperimentPipelineUnitsQuery(
                    connector.getExperimentPipelineUnitsQuery(unitsParams)),
                externalIdListener));
    runStage(
        state,
        PipelineStage.TRIM_METRICS,
        listener,
        () ->
            await(
                state,
                PipelineStage.TRIM_METRICS,
                connector.runExperimentPipelineTrimMetricsQuery(
                    connector.getExperimentPipelineTrimMetricsQuery(
                        ExperimentPipelineTrimMetricsParams.builder()
                            .tableName(tableName)
                            .lookbackDate(request.getLookbackDate())
                            .build())),
                externalIdListener));
    runStage(
        state,
        PipelineStage.COMPUTE_FACT_METRICS,
        listener,
        () -> computeFactMetrics(state, factMetricsParams, metricGroups, externalIdListener));
    List<FactMetricsRow> rows =
        runStage(
            state,
            PipelineStage.COMPUTE_STATISTICS,
            listener,
            () ->
                await(
                        state,
                        PipelineStage.COMPUTE_STATISTICS,
                        connector.runExperimentPipelineStatisticsQuery(
                            connector.getExperimentPipelineStatisticsQuery(factMetricsParams)),
                        externalIdListener)
                    .getRows());

    LOGGER.info(
        "Pipeline for experiment {} finished with {} statistics rows", experimentId, rows.size());
    List<FactMetric> aliasOrder =
        metricGroups.stream().flatMap(List::stream).collect(Collectors.toList());
    return new PipelineResult(state, aliasOrder, rows);
  }

  /** Drops the units and metrics tables of a run. */
  public void dropPipelineTables(PipelineState state) {
    for (String table : List.of(state.getTableName(), state.getMetricsTableName())) {
      connector
          .runDropTableQuery(
              connector.getDropUnitsTableQuery(
                  DropTableQueryParams.builder().fullTablePath(table).build()))
          .await();
      LOGGER.info("Dropped pipeline table {} of experiment {}", table, state.getExperimentId());
    }
  }

  /** Groups run one after the other; the first failing group fails the stage. */
  private Void computeFactMetrics(
      PipelineState state,
      ExperimentPipelineFactMetricsParams params,
      List<List<FactMetric>> metricGroups,
      ExternalIdListener externalIdListener) {
    for (int i = 0; i < metricGroups.size(); i++) {
      LOGGER.debug(
          "Computing metric group {}/{} of experiment {}",
          i + 1,
          metricGroups.size(),
          state.getExperimentId());
      await(
          state,
          PipelineStage.COMPUTE_FACT_METRICS,
          connector.runExperimentPipelineFactMetricsQuery(
              connector.getExperimentPipelineFactMetricsQuery(
                  params.toBuilder().clearMetricGroups().metricGroup(metricGroups.get(i)).build())),
          externalIdListener);
    }
    return null;
  }

  private <T> T runStage(
      PipelineState state, PipelineStage stage, PipelineListener listener, Supplier<T> work) {
    listener.onStageStarted(state, stage);
    LOGGER.debug("Running stage {} of experiment {}", stage, state.getExperimentId());
    Timer.Sample sample = Timer.start(meterRegistry);
    String outcome = "success";
    try {
      T result = work.get();
      state.complete(stage);
      listener.onStageCompleted(state);
      return result;
    } catch (RuntimeException e) {
      outcome = "failure";
      PipelineStageException failure =
          new PipelineStageException(stage, state.getExperimentId(), e);
      LOGGER.error("Stage {} failed for experiment {}", stage, state.getExperimentId(), e);
      listener.onStageFailed(state, failure);
      throw failure;
    } finally {
      sample.stop(
          Timer.builder(STAGE_TIMER)
              .tag("stage", stage.name().toLowerCase(Locale.ROOT))
              .tag("outcome", outcome)
              .register(meterRegistry));
    }
  }

  private static <T> QueryResponse<T> await(
      PipelineState state,
      PipelineStage stage,
      QueryJob<T> job,
      ExternalIdListener externalIdListener) {
    job.externalId()
        .thenAccept(
            externalId -> externalIdListener.onExternalIdAssigned(state, stage, externalId));
    return job.await();
  }
}
