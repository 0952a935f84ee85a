package org.experiment.analysis.engine.job;

import static org.experiment.analysis.engine.job.ExperimentRefreshJobConstants.JOB_DATA_MAP_DEFINITION_SOURCE;
import static org.experiment.analysis.engine.job.ExperimentRefreshJobConstants.JOB_DATA_MAP_REFRESHER;

import java.io.IOException;
import java.util.List;
import org.experiment.analysis.engine.definition.ExperimentDefinitionSource;
import org.experiment.analysis.engine.definition.ExperimentRefreshDefinition;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.Job;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@DisallowConcurrentExecution
public class ExperimentRefreshJob implements Job {
  private static final Logger LOGGER = LoggerFactory.getLogger(ExperimentRefreshJob.class);

  public void execute(JobExecutionContext jobExecutionContext) {
    JobDetail jobDetail = jobExecutionContext.getJobDetail();
    LOGGER.debug("Starting experiment refresh job: {}", jobDetail.getKey());

    JobDataMap jobDataMap = jobDetail.getJobDataMap();
    ExperimentDefinitionSource definitionSource =
        (ExperimentDefinitionSource) jobDataMap.get(JOB_DATA_MAP_DEFINITION_SOURCE);
    ExperimentRefresher refresher = (ExperimentRefresher) jobDataMap.get(JOB_DATA_MAP_REFRESHER);

    List<ExperimentRefreshDefinition> definitions;
    try {
      definitions = definitionSource.getAllDefinitions();
    } catch (IOException e) {
      LOGGER.error("Job failed reading experiment definitions", e);
      return;
    }

    LOGGER.debug("Number of experiments to refresh as part of this run: {}", definitions.size());
    definitions.forEach(refresher::refresh);
    LOGGER.debug("job finished");
  }
}
