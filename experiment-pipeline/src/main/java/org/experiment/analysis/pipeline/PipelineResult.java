package org.experiment.analysis.pipeline;

import java.util.List;
import java.util.Optional;
import lombok.Value;
import org.experiment.analysis.datamodel.metric.FactMetric;
import org.experiment.analysis.datamodel.rows.FactMetricsRow;
import org.experiment.analysis.warehouse.compiler.FactMetricDataFactory;

@Value
public class PipelineResult {
  PipelineState state;
  // alias order of the statistics columns: metrics.get(i) is read with alias "m<i>"
  List<FactMetric> metrics;
  List<FactMetricsRow> statistics;

  public Optional<String> aliasOf(String metricId) {
    for (int i = 0; i < metrics.size(); i++) {
      if (metrics.get(i).getId().equals(metricId)) {
        return Optional.of(FactMetricDataFactory.alias(i));
      }
    }
    return Optional.empty();
  }
}
