package org.experiment.analysis.engine.job;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.file.Path;
import java.util.Map;
import org.experiment.analysis.engine.definition.ExperimentDefinitionSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.quartz.CronTrigger;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;

class ExperimentRefreshJobManagerTest {

  @TempDir Path tempDir;

  private ExperimentRefreshJobManager jobManager;
  private Scheduler scheduler;

  @BeforeEach
  void setUp() {
    jobManager = new ExperimentRefreshJobManager(new SimpleMeterRegistry());
    scheduler = mock(Scheduler.class);
  }

  @AfterEach
  void tearDown() throws SchedulerException {
    jobManager.unscheduleJob(scheduler);
  }

  @Test
  void testInitJob() {
    jobManager.initJob(appConfig(Map.of("job.config.cronExpression", "0 */15 * * * ?")));

    JobDetail jobDetail = jobManager.getJobDetail();
    Assertions.assertEquals(ExperimentRefreshJob.class, jobDetail.getJobClass());
    Assertions.assertEquals(
        JobKey.jobKey(
            ExperimentRefreshJobConstants.JOB_NAME, ExperimentRefreshJobConstants.JOB_GROUP),
        jobDetail.getKey());
    Assertions.assertTrue(
        jobDetail.getJobDataMap().get(ExperimentRefreshJobConstants.JOB_DATA_MAP_DEFINITION_SOURCE)
            instanceof ExperimentDefinitionSource);
    Assertions.assertTrue(
        jobDetail.getJobDataMap().get(ExperimentRefreshJobConstants.JOB_DATA_MAP_REFRESHER)
            instanceof ExperimentRefresher);

    CronTrigger trigger = (CronTrigger) jobManager.getJobTrigger();
    Assertions.assertEquals("0 */15 * * * ?", trigger.getCronExpression());
  }

  @Test
  void testDefaultCronExpression() {
    jobManager.initJob(appConfig(Map.of()));

    CronTrigger trigger = (CronTrigger) jobManager.getJobTrigger();
    Assertions.assertEquals(
        ExperimentRefreshJobConstants.CRON_EXPRESSION, trigger.getCronExpression());
  }

  @Test
  void testScheduleAndUnscheduleJob() throws SchedulerException {
    jobManager.initJob(appConfig(Map.of()));
    jobManager.scheduleJob(scheduler);
    verify(scheduler).scheduleJob(jobManager.getJobDetail(), jobManager.getJobTrigger());

    JobKey jobKey = jobManager.getJobDetail().getKey();
    when(scheduler.checkExists(jobKey)).thenReturn(true);
    jobManager.unscheduleJob(scheduler);
    verify(scheduler).deleteJob(jobKey);
  }

  @Test
  void testUnscheduleMissingJob() throws SchedulerException {
    jobManager.unscheduleJob(scheduler);

    verify(scheduler, never()).deleteJob(any());
  }

  private Config appConfig(Map<String, Object> overrides) {
    Config base =
        ConfigFactory.parseMap(
            Map.of(
                "datasource.id", "warehouse",
                "datasource.type", "duckdb",
                "datasource.params.path", tempDir.resolve("warehouse.duckdb").toString(),
                "datasource.pool.maxSize", 1,
                "experimentsSource.type", "fs",
                "experimentsSource.fs.path", tempDir.resolve("experiments.json").toString(),
                "notification.experimentStore.type", "fs",
                "notification.experimentStore.fs.path", tempDir.resolve("store").toString(),
                "notification.eventCreator.type", "kafka",
                "notification.eventCreator.kafka.bootstrap.servers", "localhost:9092"));
    Config kafka =
        ConfigFactory.parseMap(
            Map.of("notification.eventCreator.kafka.producer.topic", "experiment-events"));
    return ConfigFactory.parseMap(overrides).withFallback(base).withFallback(kafka);
  }
}
