package org.experiment.analysis.datamodel.dimension;

/** A slicing axis for experiment results. */
public abstract class Dimension {

  public abstract DimensionType getType();

  public abstract <T> T accept(DimensionVisitor<T> visitor);
}
