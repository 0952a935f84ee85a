package org.experiment.analysis.engine.job;

import static org.experiment.analysis.engine.job.ExperimentRefreshJobConstants.CRON_EXPRESSION;
import static org.experiment.analysis.engine.job.ExperimentRefreshJobConstants.DATASOURCE_CONFIG;
import static org.experiment.analysis.engine.job.ExperimentRefreshJobConstants.EVENT_CREATOR_CONFIG;
import static org.experiment.analysis.engine.job.ExperimentRefreshJobConstants.EXPERIMENTS_SOURCE_CONFIG;
import static org.experiment.analysis.engine.job.ExperimentRefreshJobConstants.EXPERIMENT_STORE_CONFIG;
import static org.experiment.analysis.engine.job.ExperimentRefreshJobConstants.JOB_CONFIG;
import static org.experiment.analysis.engine.job.ExperimentRefreshJobConstants.JOB_CONFIG_CRON_EXPRESSION;
import static org.experiment.analysis.engine.job.ExperimentRefreshJobConstants.JOB_CONFIG_LOOKBACK_DAYS;
import static org.experiment.analysis.engine.job.ExperimentRefreshJobConstants.JOB_DATA_MAP_DEFINITION_SOURCE;
import static org.experiment.analysis.engine.job.ExperimentRefreshJobConstants.JOB_DATA_MAP_REFRESHER;
import static org.experiment.analysis.engine.job.ExperimentRefreshJobConstants.JOB_GROUP;
import static org.experiment.analysis.engine.job.ExperimentRefreshJobConstants.JOB_NAME;
import static org.experiment.analysis.engine.job.ExperimentRefreshJobConstants.JOB_TRIGGER_NAME;
import static org.experiment.analysis.engine.job.ExperimentRefreshJobConstants.NOTIFICATION_ORGANIZATION_CONFIG;
import static org.experiment.analysis.engine.job.ExperimentRefreshJobConstants.NOTIFICATION_USER_CONFIG;
import static org.experiment.analysis.engine.job.ExperimentRefreshJobConstants.PIPELINE_CONFIG;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.Map;
import org.experiment.analysis.engine.analysis.UnitsSnapshotAnalyzer;
import org.experiment.analysis.engine.definition.ExperimentDefinitionSource;
import org.experiment.analysis.engine.definition.ExperimentDefinitionSourceProvider;
import org.experiment.analysis.notification.service.ExperimentNotificationService;
import org.experiment.analysis.notification.service.NotificationContext;
import org.experiment.analysis.notification.service.OrganizationSettings;
import org.experiment.analysis.notification.service.event.EventCreator;
import org.experiment.analysis.notification.service.event.EventCreatorProvider;
import org.experiment.analysis.notification.service.store.ExperimentStore;
import org.experiment.analysis.notification.service.store.ExperimentStoreProvider;
import org.experiment.analysis.pipeline.ExperimentPipelineOrchestrator;
import org.experiment.analysis.warehouse.WarehouseConnector;
import org.experiment.analysis.warehouse.WarehouseConnectorFactory;
import org.quartz.CronScheduleBuilder;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Schedules the refresh of every configured experiment on a cron trigger. */
public class ExperimentRefreshJobManager implements ScheduledJobManager {
  private static final Logger LOGGER = LoggerFactory.getLogger(ExperimentRefreshJobManager.class);

  private final MeterRegistry meterRegistry;
  private final Clock clock;

  private JobKey jobKey;
  private JobDetail jobDetail;
  private Trigger jobTrigger;
  private WarehouseConnector connector;
  private EventCreator eventCreator;

  public ExperimentRefreshJobManager(MeterRegistry meterRegistry) {
    this(meterRegistry, Clock.systemUTC());
  }

  ExperimentRefreshJobManager(MeterRegistry meterRegistry, Clock clock) {
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  public void initJob(Config appConfig) {
    Config jobConfig = getConfig(appConfig, JOB_CONFIG);

    ExperimentDefinitionSource definitionSource =
        ExperimentDefinitionSourceProvider.getProvider(
            appConfig.getConfig(EXPERIMENTS_SOURCE_CONFIG));
    connector = WarehouseConnectorFactory.create(appConfig.getConfig(DATASOURCE_CONFIG));
    ExperimentStore experimentStore =
        ExperimentStoreProvider.getExperimentStore(appConfig.getConfig(EXPERIMENT_STORE_CONFIG));
    eventCreator = EventCreatorProvider.getEventCreator(appConfig.getConfig(EVENT_CREATOR_CONFIG));

    ExperimentRefresher refresher =
        new ExperimentRefresher(
            connector,
            new ExperimentPipelineOrchestrator(
                connector, getConfig(appConfig, PIPELINE_CONFIG), meterRegistry),
            new UnitsSnapshotAnalyzer(),
            new ExperimentNotificationService(experimentStore, eventCreator, meterRegistry),
            experimentStore,
            notificationContext(appConfig),
            jobConfig.hasPath(JOB_CONFIG_LOOKBACK_DAYS)
                ? jobConfig.getInt(JOB_CONFIG_LOOKBACK_DAYS)
                : ExperimentRefresher.DEFAULT_LOOKBACK_DAYS,
            clock,
            meterRegistry);

    jobKey = JobKey.jobKey(JOB_NAME, JOB_GROUP);

    JobDataMap jobDataMap = new JobDataMap();
    jobDataMap.put(JOB_DATA_MAP_DEFINITION_SOURCE, definitionSource);
    jobDataMap.put(JOB_DATA_MAP_REFRESHER, refresher);

    jobDetail =
        JobBuilder.newJob(ExperimentRefreshJob.class)
            .withIdentity(jobKey)
            .usingJobData(jobDataMap)
            .build();

    String cronExpression =
        jobConfig.hasPath(JOB_CONFIG_CRON_EXPRESSION)
            ? jobConfig.getString(JOB_CONFIG_CRON_EXPRESSION)
            : CRON_EXPRESSION;
    jobTrigger =
        TriggerBuilder.newTrigger()
            .withIdentity(JOB_TRIGGER_NAME, JOB_GROUP)
            .withSchedule(CronScheduleBuilder.cronSchedule(cronExpression))
            .build();
  }

  public void scheduleJob(Scheduler scheduler) throws SchedulerException {
    LOGGER.info("Schedule a job:{} with Trigger:{}", jobKey, jobTrigger);
    scheduler.scheduleJob(jobDetail, jobTrigger);
  }

  public void unscheduleJob(Scheduler scheduler) throws SchedulerException {
    if (scheduler.checkExists(jobKey)) {
      scheduler.deleteJob(jobKey);
    }
    if (eventCreator != null) {
      eventCreator.close();
    }
    if (connector != null) {
      connector.close();
    }
  }

  JobDetail getJobDetail() {
    return jobDetail;
  }

  Trigger getJobTrigger() {
    return jobTrigger;
  }

  private static NotificationContext notificationContext(Config appConfig) {
    Config user = getConfig(appConfig, NOTIFICATION_USER_CONFIG);
    return NotificationContext.builder()
        .organization(
            OrganizationSettings.fromConfig(getConfig(appConfig, NOTIFICATION_ORGANIZATION_CONFIG)))
        .userId(user.hasPath("id") ? user.getString("id") : null)
        .email(user.hasPath("email") ? user.getString("email") : null)
        .userName(user.hasPath("name") ? user.getString("name") : null)
        .build();
  }

  private static Config getConfig(Config appConfig, String path) {
    return appConfig.hasPath(path) ? appConfig.getConfig(path) : ConfigFactory.parseMap(Map.of());
  }
}
