package org.experiment.analysis.engine.job;

import com.typesafe.config.Config;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;

/**
 * A recurring engine job. {@link #initJob(Config)} builds the job's collaborators from the
 * application config before the shared Quartz scheduler starts.
 */
public interface ScheduledJobManager {
  void initJob(Config appConfig);

  /** Registers the job and its cron trigger. */
  void scheduleJob(Scheduler scheduler) throws SchedulerException;

  /** Removes the job if it is scheduled. */
  void unscheduleJob(Scheduler scheduler) throws SchedulerException;
}
