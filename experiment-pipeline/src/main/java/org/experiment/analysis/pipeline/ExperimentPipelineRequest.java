package org.experiment.analysis.pipeline;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.experiment.analysis.datamodel.dimension.Dimension;
import org.experiment.analysis.datamodel.experiment.ExperimentSnapshotSettings;
import org.experiment.analysis.datamodel.experiment.Segment;
import org.experiment.analysis.datamodel.metric.FactMetric;
import org.experiment.analysis.datamodel.metric.FactTable;

/** Everything needed to refresh one experiment's metrics from {@code lookbackDate} on. */
@Value
@Builder
public class ExperimentPipelineRequest {
  ExperimentSnapshotSettings settings;
  @Singular Map<String, FactTable> factTables;
  @Singular List<Dimension> dimensions;
  FactMetric activationMetric;
  Segment segment;
  @Singular List<FactMetric> metrics;
  Instant lookbackDate;
}
