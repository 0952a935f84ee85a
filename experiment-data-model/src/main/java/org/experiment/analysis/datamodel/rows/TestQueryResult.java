package org.experiment.analysis.datamodel.rows;

import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class TestQueryResult {
  @Singular List<Map<String, Object>> results;
  long durationMs;
}
