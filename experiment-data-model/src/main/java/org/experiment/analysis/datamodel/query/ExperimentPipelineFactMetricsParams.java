package org.experiment.analysis.datamodel.query;

import java.time.Instant;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import org.experiment.analysis.datamodel.metric.FactMetric;

@SuperBuilder(toBuilder = true)
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class ExperimentPipelineFactMetricsParams extends ExperimentBaseQueryParams {
  private final String tableName;
  private final Instant lookbackDate;
  // each group is compiled into its own statement
  @Singular private final List<List<FactMetric>> metricGroups;
}
