package org.experiment.analysis.datamodel.query;

import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.experiment.analysis.datamodel.experiment.Segment;
import org.experiment.analysis.datamodel.metric.FactMetric;
import org.experiment.analysis.datamodel.metric.FactTable;

@Value
@Builder
public class MetricAnalysisParams {
  MetricAnalysisSettings settings;
  FactMetric metric;
  @Singular Map<String, FactTable> factTables;
  Segment segment;
}
