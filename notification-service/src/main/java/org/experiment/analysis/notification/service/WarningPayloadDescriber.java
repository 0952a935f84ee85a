package org.experiment.analysis.notification.service;

import org.experiment.analysis.datamodel.event.AutoUpdatePayload;
import org.experiment.analysis.datamodel.event.ExperimentWarningPayloadVisitor;
import org.experiment.analysis.datamodel.event.MultipleExposuresPayload;
import org.experiment.analysis.datamodel.event.SrmPayload;

/** One line description of a warning, used in logs. */
class WarningPayloadDescriber implements ExperimentWarningPayloadVisitor<String> {
  static final WarningPayloadDescriber INSTANCE = new WarningPayloadDescriber();

  @Override
  public String visitAutoUpdate(AutoUpdatePayload payload) {
    return String.format(
        "auto-update of experiment %s %s",
        payload.getExperimentId(), payload.isSuccess() ? "succeeded" : "failed");
  }

  @Override
  public String visitMultipleExposures(MultipleExposuresPayload payload) {
    return String.format(
        "%d users (%.2f%%) of experiment %s saw multiple variations",
        payload.getUsersCount(), payload.getPercent() * 100, payload.getExperimentId());
  }

  @Override
  public String visitSrm(SrmPayload payload) {
    return String.format(
        "sample ratio mismatch in experiment %s below threshold %s",
        payload.getExperimentId(), payload.getThreshold());
  }
}
