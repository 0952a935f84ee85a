package org.experiment.analysis.engine.job;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.experiment.analysis.datamodel.analysis.AnalysisSnapshot;
import org.experiment.analysis.datamodel.experiment.ExperimentDocument;
import org.experiment.analysis.datamodel.experiment.ExperimentSnapshotSettings;
import org.experiment.analysis.datamodel.query.ExperimentAggregateUnitsQueryParams;
import org.experiment.analysis.datamodel.rows.AggregateUnitsRow;
import org.experiment.analysis.engine.analysis.UnitsSnapshotAnalyzer;
import org.experiment.analysis.engine.definition.ExperimentRefreshDefinition;
import org.experiment.analysis.notification.service.ExperimentNotificationService;
import org.experiment.analysis.notification.service.NotificationContext;
import org.experiment.analysis.notification.service.store.ExperimentStore;
import org.experiment.analysis.pipeline.ExperimentPipelineOrchestrator;
import org.experiment.analysis.pipeline.ExperimentPipelineRequest;
import org.experiment.analysis.pipeline.PipelineResult;
import org.experiment.analysis.warehouse.WarehouseConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Refreshes one experiment: runs the incremental pipeline, counts units per variation from the
 * pipeline's units table and reports the outcome to the notification service. Failures are
 * logged and counted, never thrown.
 *
 * <p>The first successful refresh of an experiment in this process recomputes from the experiment
 * start; later ones only go back {@code lookbackDays}.
 */
public class ExperimentRefresher {
  private static final Logger LOGGER = LoggerFactory.getLogger(ExperimentRefresher.class);

  static final String DEFAULT_SNAPSHOT_ID = "incremental";
  static final int DEFAULT_LOOKBACK_DAYS = 3;
  static final String REFRESH_TIMER = "experiment.refresh.time";
  static final String REFRESH_FAILURE_COUNTER = "experiment.refresh.failures";
  static final String NOTIFICATION_FAILURE_COUNTER = "experiment.refresh.notification.failures";

  private final WarehouseConnector connector;
  private final ExperimentPipelineOrchestrator orchestrator;
  private final UnitsSnapshotAnalyzer analyzer;
  private final ExperimentNotificationService notificationService;
  private final ExperimentStore experimentStore;
  private final NotificationContext notificationContext;
  private final int defaultLookbackDays;
  private final Clock clock;
  private final MeterRegistry meterRegistry;
  private final Set<String> refreshedExperiments = ConcurrentHashMap.newKeySet();

  public ExperimentRefresher(
      WarehouseConnector connector,
      ExperimentPipelineOrchestrator orchestrator,
      UnitsSnapshotAnalyzer analyzer,
      ExperimentNotificationService notificationService,
      ExperimentStore experimentStore,
      NotificationContext notificationContext,
      int defaultLookbackDays,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.connector = connector;
    this.orchestrator = orchestrator;
    this.analyzer = analyzer;
    this.notificationService = notificationService;
    this.experimentStore = experimentStore;
    this.notificationContext = notificationContext;
    this.defaultLookbackDays = defaultLookbackDays;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
  }

  /** @return the new snapshot, empty if the refresh failed */
  public Optional<AnalysisSnapshot> refresh(ExperimentRefreshDefinition definition) {
    String experimentId = definition.getExperimentId();
    Instant now = clock.instant();
    Timer.Sample sample = Timer.start(meterRegistry);
    AnalysisSnapshot snapshot = null;
    try {
      snapshot = analyze(definition, now);
      refreshedExperiments.add(experimentId);
      LOGGER.info(
          "Refreshed experiment {}: {} results, {} multiple exposures",
          experimentId,
          snapshot.getResults().size(),
          snapshot.getMultipleExposures());
    } catch (RuntimeException e) {
      LOGGER.error("Refresh of experiment {} failed", experimentId, e);
      Counter.builder(REFRESH_FAILURE_COUNTER)
          .tag("experimentId", experimentId)
          .register(meterRegistry)
          .increment();
    } finally {
      sample.stop(
          Timer.builder(REFRESH_TIMER).tag("experimentId", experimentId).register(meterRegistry));
    }

    notifyOutcome(experimentId, snapshot);
    return Optional.ofNullable(snapshot);
  }

  private AnalysisSnapshot analyze(ExperimentRefreshDefinition definition, Instant now) {
    ExperimentSnapshotSettings settings = settings(definition.getSettings(), now);
    int lookbackDays =
        definition.getLookbackDays() != null ? definition.getLookbackDays() : defaultLookbackDays;
    Instant lookbackDate = now.minus(Duration.ofDays(lookbackDays));
    if (settings.getStartDate() != null
        && (lookbackDate.isBefore(settings.getStartDate())
            || !refreshedExperiments.contains(settings.getExperimentId()))) {
      lookbackDate = settings.getStartDate();
    }

    PipelineResult result =
        orchestrator.run(
            ExperimentPipelineRequest.builder()
                .settings(settings)
                .factTables(definition.getFactTables())
                .metrics(definition.getMetrics())
                .activationMetric(definition.getActivationMetric())
                .segment(definition.getSegment())
                .lookbackDate(lookbackDate)
                .build());
    LOGGER.debug(
        "Pipeline of experiment {} produced {} statistics rows",
        settings.getExperimentId(),
        result.getStatistics().size());

    List<AggregateUnitsRow> units =
        connector
            .runExperimentAggregateUnitsQuery(
                connector.getExperimentAggregateUnitsQuery(
                    ExperimentAggregateUnitsQueryParams.builder()
                        .settings(settings)
                        .factTables(definition.getFactTables())
                        .useUnitsTable(true)
                        .unitsTableFullName(result.getState().getTableName())
                        .build()))
            .await()
            .getRows();

    return analyzer.analyze(settings, snapshotId(settings.getExperimentId(), now), now, units);
  }

  private void notifyOutcome(String experimentId, AnalysisSnapshot snapshot) {
    try {
      Optional<ExperimentDocument> experiment = experimentStore.findById(experimentId);
      if (experiment.isEmpty()) {
        LOGGER.warn("Experiment {} not found, skipping notifications", experimentId);
        return;
      }
      notificationService.notifyAutoUpdate(
          notificationContext, experiment.get(), snapshot != null);
      if (snapshot != null) {
        notificationService.notifyExperimentChange(notificationContext, snapshot);
      }
    } catch (IOException | RuntimeException e) {
      LOGGER.error("Notifications for experiment {} failed", experimentId, e);
      Counter.builder(NOTIFICATION_FAILURE_COUNTER)
          .tag("experimentId", experimentId)
          .register(meterRegistry)
          .increment();
    }
  }

  private static ExperimentSnapshotSettings settings(
      ExperimentSnapshotSettings settings, Instant now) {
    ExperimentSnapshotSettings.ExperimentSnapshotSettingsBuilder builder = settings.toBuilder();
    if (settings.getSnapshotId() == null) {
      builder.snapshotId(DEFAULT_SNAPSHOT_ID);
    }
    if (settings.getEndDate() == null || settings.getEndDate().isAfter(now)) {
      builder.endDate(now);
    }
    return builder.build();
  }

  private static String snapshotId(String experimentId, Instant now) {
    return "snp_" + experimentId + "_" + now.getEpochSecond();
  }
}
