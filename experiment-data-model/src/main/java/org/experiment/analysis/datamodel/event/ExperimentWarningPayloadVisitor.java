package org.experiment.analysis.datamodel.event;

public interface ExperimentWarningPayloadVisitor<T> {
  T visitAutoUpdate(AutoUpdatePayload payload);

  T visitMultipleExposures(MultipleExposuresPayload payload);

  T visitSrm(SrmPayload payload);
}
