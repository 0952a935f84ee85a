package org.experiment.analysis.notification.service;

import com.google.common.base.Strings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.experiment.analysis.datamodel.analysis.AnalysisResultDimension;
import org.experiment.analysis.datamodel.analysis.AnalysisSnapshot;
import org.experiment.analysis.datamodel.event.AutoUpdatePayload;
import org.experiment.analysis.datamodel.event.ExperimentNotification;
import org.experiment.analysis.datamodel.event.ExperimentWarningEvent;
import org.experiment.analysis.datamodel.event.ExperimentWarningPayload;
import org.experiment.analysis.datamodel.event.MultipleExposuresPayload;
import org.experiment.analysis.datamodel.event.SrmPayload;
import org.experiment.analysis.datamodel.experiment.ExperimentDocument;
import org.experiment.analysis.notification.service.event.EventCreator;
import org.experiment.analysis.notification.service.store.ExperimentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns analysis results into experiment warnings. Every warning type is remembered in the
 * experiment's {@code pastNotifications} ledger so that an open episode alerts once; once the
 * condition clears the entry is removed without an event and the next occurrence alerts again.
 *
 * <p>Ledger writes are conditional on the version the evaluation read and happen before any event
 * is sent. A lost race is logged and the evaluation stops without dispatching.
 */
public class ExperimentNotificationService {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(ExperimentNotificationService.class);

  static final String DISPATCHED_COUNTER = "experiment.notifications.dispatched";
  static final String CONFLICT_COUNTER = "experiment.notifications.conflicts";

  private final ExperimentStore experimentStore;
  private final EventCreator eventCreator;
  private final MeterRegistry meterRegistry;

  public ExperimentNotificationService(
      ExperimentStore experimentStore, EventCreator eventCreator, MeterRegistry meterRegistry) {
    this.experimentStore = experimentStore;
    this.eventCreator = eventCreator;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Alerts on the rising edge of {@code triggered} and clears the ledger entry on the falling
   * edge. The ledger entry is claimed with a versioned write before the event is dispatched, so
   * of two evaluations racing on the same version only one dispatches. A failed dispatch releases
   * the claim again.
   *
   * @return the experiment as written, or as read if nothing changed; empty if the ledger write
   *     lost against a concurrent update
   */
  public Optional<ExperimentDocument> memoizeNotification(
      ExperimentDocument experiment,
      ExperimentNotification type,
      boolean triggered,
      NotificationDispatch dispatch)
      throws IOException {
    boolean alerted = experiment.getPastNotifications().contains(type.getTag());
    if (triggered == alerted) {
      return Optional.of(experiment);
    }

    List<String> pastNotifications = new ArrayList<>(experiment.getPastNotifications());
    if (triggered) {
      pastNotifications.add(type.getTag());
    } else {
      pastNotifications.removeIf(type.getTag()::equals);
    }

    if (!experimentStore.updatePastNotifications(
        experiment.getId(), experiment.getVersion(), pastNotifications)) {
      LOGGER.warn(
          "Experiment {} changed concurrently, discarding {} ledger update",
          experiment.getId(),
          type);
      Counter.builder(CONFLICT_COUNTER)
          .tag("type", type.getTag())
          .register(meterRegistry)
          .increment();
      return Optional.empty();
    }

    if (triggered) {
      try {
        dispatch.dispatch();
      } catch (IOException | RuntimeException e) {
        releaseClaim(experiment, type, e);
        throw e;
      }
    } else {
      LOGGER.info("Condition {} cleared for experiment {}", type, experiment.getId());
    }
    return Optional.of(
        experiment.toBuilder()
            .clearPastNotifications()
            .pastNotifications(pastNotifications)
            .version(experiment.getVersion() + 1)
            .build());
  }

  // restores the ledger read by the evaluation so the next one retries the alert
  private void releaseClaim(
      ExperimentDocument experiment, ExperimentNotification type, Exception cause) {
    try {
      if (!experimentStore.updatePastNotifications(
          experiment.getId(), experiment.getVersion() + 1, experiment.getPastNotifications())) {
        LOGGER.error(
            "Experiment {} changed before the {} ledger entry could be released",
            experiment.getId(),
            type);
      }
    } catch (IOException e) {
      cause.addSuppressed(e);
    }
  }

  public Optional<ExperimentDocument> notifyAutoUpdate(
      NotificationContext context, ExperimentDocument experiment, boolean success)
      throws IOException {
    return memoizeNotification(
        experiment,
        ExperimentNotification.AUTO_UPDATE,
        !success,
        () ->
            dispatchEvent(
                context,
                experiment,
                new AutoUpdatePayload(experiment.getId(), experiment.getName(), success)));
  }

  public Optional<ExperimentDocument> notifyMultipleExposures(
      NotificationContext context,
      ExperimentDocument experiment,
      AnalysisResultDimension results,
      AnalysisSnapshot snapshot)
      throws IOException {
    long totalUsers = results.getTotalUsers();
    // multiple exposures without counted users give an infinite percent; 0 / 0 never triggers
    double percent = (double) snapshot.getMultipleExposures() / totalUsers;
    double minPercent = context.getOrganization().getMultipleExposureMinPercent();
    boolean triggered = minPercent < percent;
    LOGGER.debug(
        "Experiment {} has {} multiple exposures out of {} users, threshold {}",
        experiment.getId(),
        snapshot.getMultipleExposures(),
        totalUsers,
        minPercent);

    return memoizeNotification(
        experiment,
        ExperimentNotification.MULTIPLE_EXPOSURES,
        triggered,
        () ->
            dispatchEvent(
                context,
                experiment,
                new MultipleExposuresPayload(
                    experiment.getId(),
                    experiment.getName(),
                    snapshot.getMultipleExposures(),
                    percent)));
  }

  public Optional<ExperimentDocument> notifySrm(
      NotificationContext context, ExperimentDocument experiment, AnalysisResultDimension results)
      throws IOException {
    double srmThreshold = context.getOrganization().getSrmThreshold();
    return memoizeNotification(
        experiment,
        ExperimentNotification.SRM,
        results.getSrm() < srmThreshold,
        () ->
            dispatchEvent(
                context,
                experiment,
                new SrmPayload(experiment.getId(), experiment.getName(), srmThreshold)));
  }

  /** Evaluates the result based warnings for a new snapshot of an experiment. */
  public void notifyExperimentChange(NotificationContext context, AnalysisSnapshot snapshot)
      throws IOException {
    ExperimentDocument experiment =
        experimentStore
            .findById(snapshot.getExperimentId())
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "Error while fetching experiment " + snapshot.getExperimentId()));

    Optional<AnalysisResultDimension> results = snapshot.getDefaultAnalysisResults();
    if (results.isEmpty()) {
      LOGGER.debug("Snapshot {} has no results", snapshot.getSnapshotId());
      return;
    }

    Optional<ExperimentDocument> updated =
        notifyMultipleExposures(context, experiment, results.get(), snapshot);
    if (updated.isEmpty()) {
      return;
    }
    notifySrm(context, updated.get(), results.get());
  }

  /**
   * Creates the warning event.
   *
   * @throws EventDispatchException if the event bus did not create the event
   */
  public String dispatchEvent(
      NotificationContext context, ExperimentDocument experiment, ExperimentWarningPayload data)
      throws IOException {
    List<String> environments =
        experiment.isIncludedInPayload()
            ? context.getOrganization().getEnvironments()
            : List.of();
    ExperimentWarningEvent event =
        ExperimentWarningEvent.builder()
            .data(data)
            .user(context.toEventUser())
            .project(Strings.nullToEmpty(experiment.getProject()))
            .environments(environments)
            .tags(experiment.getTags())
            .containsSecrets(false)
            .build();

    String eventId =
        eventCreator
            .createEvent(context.getOrganization().getOrganizationId(), event)
            .orElseThrow(
                () ->
                    new EventDispatchException(
                        String.format(
                            "Error while creating %s event for experiment %s",
                            data.getType(), experiment.getId())));
    LOGGER.info("Created event {}: {}", eventId, data.accept(WarningPayloadDescriber.INSTANCE));
    Counter.builder(DISPATCHED_COUNTER)
        .tag("type", data.getType().getTag())
        .register(meterRegistry)
        .increment();
    return eventId;
  }
}
