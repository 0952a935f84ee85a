package org.experiment.analysis.datamodel.query;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.SuperBuilder;

@SuperBuilder(toBuilder = true)
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class ExperimentUnitsQueryParams extends ExperimentBaseQueryParams {
  private final boolean includeIdJoins;
}
