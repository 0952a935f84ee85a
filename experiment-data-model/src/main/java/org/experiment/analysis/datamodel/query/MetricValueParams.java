package org.experiment.analysis.datamodel.query;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.experiment.analysis.datamodel.experiment.Segment;
import org.experiment.analysis.datamodel.metric.FactMetric;
import org.experiment.analysis.datamodel.metric.FactTable;

@Value
@Builder
public class MetricValueParams {
  Instant from;
  Instant to;
  FactMetric metric;
  String name;
  String userIdType;
  @Singular Map<String, FactTable> factTables;
  Segment segment;
  boolean includeByDate;
}
