package org.experiment.analysis.datamodel.query;

import java.time.Instant;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@SuperBuilder(toBuilder = true)
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class ExperimentPipelineUnitsParams extends ExperimentBaseQueryParams {
  private final String tableName;
  private final Instant lookbackDate;
}
