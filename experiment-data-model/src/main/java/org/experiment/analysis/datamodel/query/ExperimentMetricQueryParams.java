package org.experiment.analysis.datamodel.query;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import org.experiment.analysis.datamodel.metric.FactMetric;

@SuperBuilder(toBuilder = true)
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class ExperimentMetricQueryParams extends ExperimentBaseQueryParams {
  private final FactMetric metric;
  private final boolean useUnitsTable;
}
