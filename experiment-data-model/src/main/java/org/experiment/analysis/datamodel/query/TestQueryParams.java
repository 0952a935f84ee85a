package org.experiment.analysis.datamodel.query;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class TestQueryParams {
  String query;
  // anchors the {{startDate}} / {{endDate}} template range
  Instant endDate;
  @Singular Map<String, String> templateVariables;
  @Builder.Default int testDays = 30;
  @Builder.Default int limit = 5;
}
