package org.experiment.analysis.warehouse;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SourceProperties {
  @Builder.Default String queryLanguage = "sql";
  boolean hasSettings;
  boolean separateExperimentResultQueries;
  boolean supportsInformationSchema;
  boolean supportsAutoGeneratedMetrics;
  boolean supportsPipeline;
  @Builder.Default int maxColumns = 1000;
}
