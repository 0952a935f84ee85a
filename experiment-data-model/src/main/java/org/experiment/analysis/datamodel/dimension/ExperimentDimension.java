package org.experiment.analysis.datamodel.dimension;

import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** A dimension column provided by the exposure query itself. */
@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class ExperimentDimension extends Dimension {
  private final String id;
  // when non-empty, values outside this list are bucketed into "__Other__"
  private final List<String> specifiedSlices;

  public ExperimentDimension(String id) {
    this(id, List.of());
  }

  public ExperimentDimension(String id, List<String> specifiedSlices) {
    this.id = id;
    this.specifiedSlices = List.copyOf(specifiedSlices);
  }

  @Override
  public DimensionType getType() {
    return DimensionType.EXPERIMENT;
  }

  @Override
  public <T> T accept(DimensionVisitor<T> visitor) {
    return visitor.visitExperiment(this);
  }
}
