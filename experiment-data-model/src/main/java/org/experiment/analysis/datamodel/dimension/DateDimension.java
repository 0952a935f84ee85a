package org.experiment.analysis.datamodel.dimension;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/** Slices units by the day of their first exposure. */
@ToString
@EqualsAndHashCode(callSuper = false)
public class DateDimension extends Dimension {

  @Override
  public DimensionType getType() {
    return DimensionType.DATE;
  }

  @Override
  public <T> T accept(DimensionVisitor<T> visitor) {
    return visitor.visitDate(this);
  }
}
