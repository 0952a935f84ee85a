package org.experiment.analysis.datamodel.query;

import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import org.experiment.analysis.datamodel.metric.FactMetric;

/** Several fact metrics, all reading the same fact table, computed in one statement. */
@SuperBuilder(toBuilder = true)
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class ExperimentFactMetricsQueryParams extends ExperimentBaseQueryParams {
  @Singular private final List<FactMetric> metrics;
  private final boolean useUnitsTable;
}
