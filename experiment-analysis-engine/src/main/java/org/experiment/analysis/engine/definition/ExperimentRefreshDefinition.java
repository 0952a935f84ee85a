package org.experiment.analysis.engine.definition;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.experiment.analysis.datamodel.experiment.ExperimentSnapshotSettings;
import org.experiment.analysis.datamodel.experiment.Segment;
import org.experiment.analysis.datamodel.metric.FactMetric;
import org.experiment.analysis.datamodel.metric.FactTable;

/**
 * An experiment refreshed on schedule. The settings' {@code snapshotId} names the experiment's
 * pipeline tables and stays the same across refreshes; {@code lookbackDays} overrides the job
 * default when set.
 */
@Value
@Builder
@Jacksonized
public class ExperimentRefreshDefinition {
  ExperimentSnapshotSettings settings;
  @Singular Map<String, FactTable> factTables;
  @Singular List<FactMetric> metrics;
  FactMetric activationMetric;
  Segment segment;
  Integer lookbackDays;

  public String getExperimentId() {
    return settings.getExperimentId();
  }
}
