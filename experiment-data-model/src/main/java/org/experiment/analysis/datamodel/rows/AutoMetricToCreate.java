package org.experiment.analysis.datamodel.rows;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.experiment.analysis.datamodel.metric.MetricType;

@Value
@Builder
public class AutoMetricToCreate {
  String name;
  String sql;
  MetricType type;
  boolean shouldCreate;
  boolean alreadyExists;
  @Singular List<String> userIdTypes;
}
