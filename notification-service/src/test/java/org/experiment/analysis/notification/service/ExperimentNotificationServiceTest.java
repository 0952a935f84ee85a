package org.experiment.analysis.notification.service;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.experiment.analysis.datamodel.analysis.AnalysisResultDimension;
import org.experiment.analysis.datamodel.analysis.AnalysisSnapshot;
import org.experiment.analysis.datamodel.analysis.VariationResult;
import org.experiment.analysis.datamodel.event.AutoUpdatePayload;
import org.experiment.analysis.datamodel.event.ExperimentNotification;
import org.experiment.analysis.datamodel.event.ExperimentWarningEvent;
import org.experiment.analysis.datamodel.event.MultipleExposuresPayload;
import org.experiment.analysis.datamodel.event.SrmPayload;
import org.experiment.analysis.datamodel.experiment.ExperimentDocument;
import org.experiment.analysis.datamodel.experiment.ExperimentStatus;
import org.experiment.analysis.notification.service.event.EventCreator;
import org.experiment.analysis.notification.service.store.ExperimentStore;
import org.experiment.analysis.notification.service.store.FileSystemExperimentStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.ArgumentCaptor;

class ExperimentNotificationServiceTest {
  private static final String EXPERIMENT_ID = "exp_checkout";

  @TempDir Path directory;

  private FileSystemExperimentStore store;
  private final EventCreator eventCreator = mock(EventCreator.class);
  private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
  private ExperimentNotificationService service;

  private final NotificationContext context =
      NotificationContext.builder()
          .organization(
              OrganizationSettings.builder()
                  .organizationId("org_1")
                  .environment("production")
                  .environment("staging")
                  .build())
          .userId("u_1")
          .email("analyst@example.com")
          .userName("Analyst")
          .build();

  @BeforeEach
  void setUp() throws IOException {
    store = new FileSystemExperimentStore(directory);
    service = new ExperimentNotificationService(store, eventCreator, meterRegistry);
    when(eventCreator.createEvent(anyString(), any())).thenReturn(Optional.of("events-0-0"));
  }

  private ExperimentDocument saved(String... pastNotifications) throws IOException {
    ExperimentDocument experiment =
        ExperimentDocument.builder()
            .id(EXPERIMENT_ID)
            .organization("org_1")
            .name("Checkout button")
            .project("prj_web")
            .tag("checkout")
            .status(ExperimentStatus.RUNNING)
            .linkedFeature("checkout-button")
            .pastNotifications(List.of(pastNotifications))
            .version(3)
            .build();
    store.save(experiment);
    return experiment;
  }

  private ExperimentDocument stored() throws IOException {
    return store.findById(EXPERIMENT_ID).orElseThrow();
  }

  private static AnalysisResultDimension results(double srm, long... users) {
    AnalysisResultDimension.AnalysisResultDimensionBuilder builder =
        AnalysisResultDimension.builder().name("All").srm(srm);
    for (int i = 0; i < users.length; i++) {
      builder.variation(
          VariationResult.builder().variationId(String.valueOf(i)).users(users[i]).build());
    }
    return builder.build();
  }

  private static AnalysisSnapshot snapshot(
      long multipleExposures, AnalysisResultDimension results) {
    return AnalysisSnapshot.builder()
        .experimentId(EXPERIMENT_ID)
        .snapshotId("snp_1")
        .dateCreated(Instant.parse("2024-01-08T00:00:00Z"))
        .multipleExposures(multipleExposures)
        .result(results)
        .build();
  }

  @ParameterizedTest
  @CsvSource({
    "false, true, 1, true",
    "false, false, 0, false",
    "true, true, 0, true",
    "true, false, 0, false"
  })
  void testLedgerTransitions(
      boolean present, boolean triggered, int expectedDispatches, boolean expectedPresent)
      throws IOException {
    ExperimentDocument experiment = present ? saved("srm") : saved();
    AtomicInteger dispatches = new AtomicInteger();

    Optional<ExperimentDocument> result =
        service.memoizeNotification(
            experiment, ExperimentNotification.SRM, triggered, dispatches::incrementAndGet);

    Assertions.assertEquals(expectedDispatches, dispatches.get());
    Assertions.assertTrue(result.isPresent());
    Assertions.assertEquals(expectedPresent, result.get().getPastNotifications().contains("srm"));
    Assertions.assertEquals(expectedPresent, stored().getPastNotifications().contains("srm"));
    long expectedVersion = present == triggered ? 3 : 4;
    Assertions.assertEquals(expectedVersion, stored().getVersion());
  }

  @Test
  void testLedgerKeepsOtherEntries() throws IOException {
    ExperimentDocument experiment = saved("auto-update", "srm");

    service.memoizeNotification(experiment, ExperimentNotification.SRM, false, () -> {});
    service.memoizeNotification(
        stored(), ExperimentNotification.MULTIPLE_EXPOSURES, true, () -> {});

    Assertions.assertEquals(
        List.of("auto-update", "multiple-exposures"), stored().getPastNotifications());
  }

  @Test
  void testMultipleExposuresAlertsOncePerEpisode() throws IOException {
    saved();
    AnalysisSnapshot snapshot = snapshot(15, results(0.5, 500, 500));

    service.notifyExperimentChange(context, snapshot);
    service.notifyExperimentChange(context, snapshot);

    ArgumentCaptor<ExperimentWarningEvent> captor =
        ArgumentCaptor.forClass(ExperimentWarningEvent.class);
    verify(eventCreator, times(1)).createEvent(eq("org_1"), captor.capture());
    MultipleExposuresPayload payload = (MultipleExposuresPayload) captor.getValue().getData();
    Assertions.assertEquals(15, payload.getUsersCount());
    Assertions.assertEquals(0.015, payload.getPercent(), 1e-12);
    Assertions.assertEquals(List.of("multiple-exposures"), stored().getPastNotifications());
    Assertions.assertEquals(
        1.0,
        meterRegistry
            .get(ExperimentNotificationService.DISPATCHED_COUNTER)
            .tag("type", "multiple-exposures")
            .counter()
            .count());
  }

  @Test
  void testSrmClearsSilently() throws IOException {
    saved();

    service.notifyExperimentChange(context, snapshot(0, results(0.0005, 480, 520)));
    Assertions.assertEquals(List.of("srm"), stored().getPastNotifications());

    service.notifyExperimentChange(context, snapshot(0, results(0.002, 480, 520)));
    Assertions.assertEquals(List.of(), stored().getPastNotifications());

    ArgumentCaptor<ExperimentWarningEvent> captor =
        ArgumentCaptor.forClass(ExperimentWarningEvent.class);
    verify(eventCreator, times(1)).createEvent(eq("org_1"), captor.capture());
    Assertions.assertEquals(
        new SrmPayload(EXPERIMENT_ID, "Checkout button", 0.001), captor.getValue().getData());
  }

  @Test
  void testAutoUpdateRecoveryIsSilent() throws IOException {
    ExperimentDocument experiment = saved();

    Optional<ExperimentDocument> failed = service.notifyAutoUpdate(context, experiment, false);
    Assertions.assertEquals(List.of("auto-update"), stored().getPastNotifications());

    service.notifyAutoUpdate(context, failed.orElseThrow(), true);
    Assertions.assertEquals(List.of(), stored().getPastNotifications());

    ArgumentCaptor<ExperimentWarningEvent> captor =
        ArgumentCaptor.forClass(ExperimentWarningEvent.class);
    verify(eventCreator, times(1)).createEvent(eq("org_1"), captor.capture());
    Assertions.assertEquals(
        new AutoUpdatePayload(EXPERIMENT_ID, "Checkout button", false),
        captor.getValue().getData());
  }

  @Test
  void testThresholdEqualityDoesNotAlert() throws IOException {
    saved();

    // 10 of 1000 users is exactly the default 1%, srm exactly the default threshold
    service.notifyExperimentChange(context, snapshot(10, results(0.001, 500, 500)));

    verify(eventCreator, never()).createEvent(anyString(), any());
    Assertions.assertEquals(List.of(), stored().getPastNotifications());
  }

  @Test
  void testOrganizationThresholdsOverrideDefaults() throws IOException {
    saved();
    NotificationContext strict =
        context.toBuilder()
            .organization(
                OrganizationSettings.builder()
                    .organizationId("org_1")
                    .srmThreshold(0.01)
                    .multipleExposureMinPercent(0.005)
                    .build())
            .build();

    service.notifyExperimentChange(strict, snapshot(6, results(0.005, 500, 500)));

    Assertions.assertEquals(List.of("multiple-exposures", "srm"), stored().getPastNotifications());
  }

  @Test
  void testNoUsersDoesNotAlert() throws IOException {
    saved();

    service.notifyExperimentChange(context, snapshot(0, results(1.0, 0, 0)));

    verify(eventCreator, never()).createEvent(anyString(), any());
    Assertions.assertEquals(List.of(), stored().getPastNotifications());
  }

  @Test
  void testMultipleExposuresWithoutUsersAlerts() throws IOException {
    saved();

    service.notifyExperimentChange(context, snapshot(15, results(1.0, 0, 0)));

    ArgumentCaptor<ExperimentWarningEvent> captor =
        ArgumentCaptor.forClass(ExperimentWarningEvent.class);
    verify(eventCreator, times(1)).createEvent(eq("org_1"), captor.capture());
    MultipleExposuresPayload payload = (MultipleExposuresPayload) captor.getValue().getData();
    Assertions.assertEquals(15, payload.getUsersCount());
    Assertions.assertEquals(Double.POSITIVE_INFINITY, payload.getPercent());
    Assertions.assertEquals(List.of("multiple-exposures"), stored().getPastNotifications());
  }

  @Test
  void testSnapshotWithoutResults() throws IOException {
    saved();

    service.notifyExperimentChange(
        context, AnalysisSnapshot.builder().experimentId(EXPERIMENT_ID).snapshotId("s").build());

    verify(eventCreator, never()).createEvent(anyString(), any());
    Assertions.assertEquals(3, stored().getVersion());
  }

  @Test
  void testMissingExperiment() {
    Assertions.assertThrows(
        IllegalStateException.class,
        () -> service.notifyExperimentChange(context, snapshot(0, results(0.5, 1, 1))));
  }

  @Test
  void testFailedDispatchKeepsEpisodeOpen() throws IOException {
    ExperimentDocument experiment = saved();
    when(eventCreator.createEvent(anyString(), any())).thenReturn(Optional.empty());

    Assertions.assertThrows(
        EventDispatchException.class, () -> service.notifyAutoUpdate(context, experiment, false));
    // the claimed entry is released again
    Assertions.assertEquals(List.of(), stored().getPastNotifications());
    Assertions.assertEquals(5, stored().getVersion());

    when(eventCreator.createEvent(anyString(), any())).thenReturn(Optional.of("events-0-1"));
    service.notifyAutoUpdate(context, stored(), false);
    Assertions.assertEquals(List.of("auto-update"), stored().getPastNotifications());
  }

  @Test
  void testWriteConflictIsDiscarded() throws IOException {
    ExperimentStore conflicting = mock(ExperimentStore.class);
    ExperimentDocument experiment = saved();
    when(conflicting.findById(EXPERIMENT_ID)).thenReturn(Optional.of(experiment));
    when(conflicting.updatePastNotifications(anyString(), anyLong(), anyList())).thenReturn(false);
    ExperimentNotificationService conflicted =
        new ExperimentNotificationService(conflicting, eventCreator, meterRegistry);

    conflicted.notifyExperimentChange(context, snapshot(15, results(0.0001, 500, 500)));

    // nothing is sent for a lost claim and the srm detector does not run on a stale experiment
    verify(eventCreator, never()).createEvent(anyString(), any());
    verify(conflicting, times(1)).updatePastNotifications(anyString(), anyLong(), anyList());
    Assertions.assertEquals(
        1.0,
        meterRegistry
            .get(ExperimentNotificationService.CONFLICT_COUNTER)
            .tag("type", "multiple-exposures")
            .counter()
            .count());
  }

  @Test
  void testStaleVersionIsRejectedByStore() throws IOException {
    ExperimentDocument experiment = saved();
    store.updatePastNotifications(EXPERIMENT_ID, 3, List.of("auto-update"));

    AtomicInteger dispatched = new AtomicInteger();
    Optional<ExperimentDocument> result =
        service.memoizeNotification(
            experiment, ExperimentNotification.SRM, true, dispatched::incrementAndGet);

    Assertions.assertTrue(result.isEmpty());
    Assertions.assertEquals(0, dispatched.get());
    Assertions.assertEquals(List.of("auto-update"), stored().getPastNotifications());
  }

  @Test
  void testConcurrentEvaluationsDispatchOnce() throws Exception {
    ExperimentDocument experiment = saved();
    AtomicInteger dispatched = new AtomicInteger();
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Callable<Optional<ExperimentDocument>>> evaluations = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        ExperimentNotificationService evaluator =
            new ExperimentNotificationService(store, eventCreator, meterRegistry);
        evaluations.add(
            () ->
                evaluator.memoizeNotification(
                    experiment,
                    ExperimentNotification.MULTIPLE_EXPOSURES,
                    true,
                    dispatched::incrementAndGet));
      }
      int written = 0;
      for (Future<Optional<ExperimentDocument>> result : executor.invokeAll(evaluations)) {
        written += result.get().isPresent() ? 1 : 0;
      }
      Assertions.assertEquals(1, written);
      Assertions.assertEquals(1, dispatched.get());
      Assertions.assertEquals(List.of("multiple-exposures"), stored().getPastNotifications());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void testEventEnvelope() throws IOException {
    ExperimentDocument experiment = saved();

    service.dispatchEvent(
        context, experiment, new SrmPayload(EXPERIMENT_ID, experiment.getName(), 0.001));

    ArgumentCaptor<ExperimentWarningEvent> captor =
        ArgumentCaptor.forClass(ExperimentWarningEvent.class);
    verify(eventCreator).createEvent(eq("org_1"), captor.capture());
    ExperimentWarningEvent event = captor.getValue();
    Assertions.assertEquals("experiment.warning", event.getEvent());
    Assertions.assertEquals("experiment", event.getObject());
    Assertions.assertEquals(List.of("prj_web"), event.getProjects());
    Assertions.assertEquals(List.of("production", "staging"), event.getEnvironments());
    Assertions.assertEquals(List.of("checkout"), event.getTags());
    Assertions.assertFalse(event.isContainsSecrets());
    Assertions.assertEquals("dashboard", event.getUser().getType());
    Assertions.assertEquals("u_1", event.getUser().getId());
    Assertions.assertEquals("analyst@example.com", event.getUser().getEmail());
    Assertions.assertEquals("Analyst", event.getUser().getName());
  }

  @Test
  void testEnvelopeOfExperimentOutsidePayload() throws IOException {
    ExperimentDocument draft =
        ExperimentDocument.builder().id("exp_draft").name("Draft").build();

    service.dispatchEvent(context, draft, new AutoUpdatePayload("exp_draft", "Draft", false));

    ArgumentCaptor<ExperimentWarningEvent> captor =
        ArgumentCaptor.forClass(ExperimentWarningEvent.class);
    verify(eventCreator).createEvent(eq("org_1"), captor.capture());
    Assertions.assertEquals(List.of(""), captor.getValue().getProjects());
    Assertions.assertEquals(List.of(), captor.getValue().getEnvironments());
    Assertions.assertEquals(List.of(), captor.getValue().getTags());
  }

  @ParameterizedTest
  @EnumSource(ExperimentNotification.class)
  void testEveryWarningTypeIsDispatched(ExperimentNotification type) throws IOException {
    ExperimentDocument experiment = saved();
    AnalysisResultDimension results = results(0.0001, 500, 500);

    switch (type) {
      case AUTO_UPDATE:
        service.notifyAutoUpdate(context, experiment, false);
        break;
      case MULTIPLE_EXPOSURES:
        service.notifyMultipleExposures(context, experiment, results, snapshot(50, results));
        break;
      case SRM:
        service.notifySrm(context, experiment, results);
        break;
      default:
        Assertions.fail("Unhandled warning type " + type);
    }

    ArgumentCaptor<ExperimentWarningEvent> captor =
        ArgumentCaptor.forClass(ExperimentWarningEvent.class);
    verify(eventCreator).createEvent(eq("org_1"), captor.capture());
    Assertions.assertEquals(type, captor.getValue().getData().getType());
    Assertions.assertEquals(List.of(type.getTag()), stored().getPastNotifications());
  }
}
