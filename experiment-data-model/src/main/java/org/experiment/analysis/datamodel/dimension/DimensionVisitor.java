package org.experiment.analysis.datamodel.dimension;

public interface DimensionVisitor<T> {
  T visitUser(UserDimension dimension);

  T visitExperiment(ExperimentDimension dimension);

  T visitDate(DateDimension dimension);

  T visitActivation(ActivationDimension dimension);
}
