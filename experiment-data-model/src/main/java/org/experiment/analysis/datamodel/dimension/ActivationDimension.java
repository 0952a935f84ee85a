package org.experiment.analysis.datamodel.dimension;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/** Splits units into activated and not-activated by the activation metric. */
@ToString
@EqualsAndHashCode(callSuper = false)
public class ActivationDimension extends Dimension {

  @Override
  public DimensionType getType() {
    return DimensionType.ACTIVATION;
  }

  @Override
  public <T> T accept(DimensionVisitor<T> visitor) {
    return visitor.visitActivation(this);
  }
}
