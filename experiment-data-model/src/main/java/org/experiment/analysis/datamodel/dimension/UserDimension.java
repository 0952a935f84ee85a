package org.experiment.analysis.datamodel.dimension;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.experiment.analysis.datamodel.experiment.DimensionDefinition;

@Getter
@ToString
@EqualsAndHashCode(callSuper = false)
public class UserDimension extends Dimension {
  private final DimensionDefinition dimension;

  public UserDimension(DimensionDefinition dimension) {
    this.dimension = dimension;
  }

  @Override
  public DimensionType getType() {
    return DimensionType.USER;
  }

  @Override
  public <T> T accept(DimensionVisitor<T> visitor) {
    return visitor.visitUser(this);
  }
}
