package org.experiment.analysis.engine.job;

public class ExperimentRefreshJobConstants {
  public static final String JOB_DATA_MAP_DEFINITION_SOURCE = "definitionSource";
  public static final String JOB_DATA_MAP_REFRESHER = "refresher";

  public static final String JOB_NAME = "experiment-refresh";
  public static final String JOB_GROUP = "experiment-analysis";
  public static final String JOB_TRIGGER_NAME = "experiment-refresh-trigger";
  public static final String CRON_EXPRESSION = "0 0 * * * ?";

  public static final String JOB_CONFIG = "job.config";
  public static final String JOB_CONFIG_CRON_EXPRESSION = "cronExpression";
  public static final String JOB_CONFIG_LOOKBACK_DAYS = "lookbackDays";

  public static final String DATASOURCE_CONFIG = "datasource";
  public static final String PIPELINE_CONFIG = "pipeline";
  public static final String EXPERIMENTS_SOURCE_CONFIG = "experimentsSource";
  public static final String NOTIFICATION_ORGANIZATION_CONFIG = "notification.organization";
  public static final String NOTIFICATION_USER_CONFIG = "notification.user";
  public static final String EXPERIMENT_STORE_CONFIG = "notification.experimentStore";
  public static final String EVENT_CREATOR_CONFIG = "notification.eventCreator";
}
