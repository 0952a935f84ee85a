package org.experiment.analysis.engine;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.logging.LoggingMeterRegistry;
import org.experiment.analysis.engine.job.ExperimentRefreshJobManager;
import org.experiment.analysis.engine.job.ScheduledJobManager;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.SchedulerFactory;
import org.quartz.impl.StdSchedulerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Service entry point: schedules experiment refreshes until the JVM shuts down. */
public class ExperimentAnalysisEngine {
  private static final Logger LOGGER = LoggerFactory.getLogger(ExperimentAnalysisEngine.class);
  static final String SERVICE_NAME = "experiment-analysis-engine";
  static final String CONFIG_RESOURCE = "configs/" + SERVICE_NAME + "/application";

  private final Config appConfig;
  private final MeterRegistry meterRegistry;
  private Scheduler scheduler;
  private ScheduledJobManager jobManager;

  public ExperimentAnalysisEngine(Config appConfig, MeterRegistry meterRegistry) {
    this.appConfig = appConfig;
    this.meterRegistry = meterRegistry;
  }

  protected void doInit() {
    try {
      SchedulerFactory schedulerFactory = new StdSchedulerFactory();
      scheduler = schedulerFactory.getScheduler();
      jobManager = new ExperimentRefreshJobManager(meterRegistry);
      jobManager.initJob(appConfig);
    } catch (SchedulerException e) {
      throw new RuntimeException(e);
    }
  }

  protected void doStart() {
    try {
      jobManager.scheduleJob(scheduler);
      scheduler.start();
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }

  protected void doStop() {
    try {
      jobManager.unscheduleJob(scheduler);
      scheduler.shutdown();
    } catch (Exception e) {
      throw new RuntimeException(e);
    }
  }

  public static void main(String[] args) {
    Config appConfig = ConfigFactory.load(CONFIG_RESOURCE);
    MeterRegistry meterRegistry = new LoggingMeterRegistry();
    ExperimentAnalysisEngine engine = new ExperimentAnalysisEngine(appConfig, meterRegistry);
    engine.doInit();
    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  LOGGER.info("Stopping {}", SERVICE_NAME);
                  engine.doStop();
                  meterRegistry.close();
                }));
    engine.doStart();
    LOGGER.info("Started {}", SERVICE_NAME);
  }
}
