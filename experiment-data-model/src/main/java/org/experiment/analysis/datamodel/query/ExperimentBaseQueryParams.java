package org.experiment.analysis.datamodel.query;

import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;
import lombok.experimental.SuperBuilder;
import org.experiment.analysis.datamodel.dimension.Dimension;
import org.experiment.analysis.datamodel.experiment.ExperimentSnapshotSettings;
import org.experiment.analysis.datamodel.experiment.Segment;
import org.experiment.analysis.datamodel.metric.FactMetric;
import org.experiment.analysis.datamodel.metric.FactTable;

/** Inputs shared by every experiment-scoped query kind. */
@SuperBuilder(toBuilder = true)
@Getter
@ToString
@EqualsAndHashCode
public abstract class ExperimentBaseQueryParams {
  private final ExperimentSnapshotSettings settings;
  private final FactMetric activationMetric;
  @Singular private final Map<String, FactTable> factTables;
  @Singular private final List<Dimension> dimensions;
  private final Segment segment;
  private final String unitsTableFullName;
}
