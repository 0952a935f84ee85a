package org.experiment.analysis.datamodel.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class SrmPayload extends ExperimentWarningPayload {
  private final double threshold;

  @JsonCreator
  public SrmPayload(
      @JsonProperty("experimentId") String experimentId,
      @JsonProperty("experimentName") String experimentName,
      @JsonProperty("threshold") double threshold) {
    super(experimentId, experimentName);
    this.threshold = threshold;
  }

  @Override
  public ExperimentNotification getType() {
    return ExperimentNotification.SRM;
  }

  @Override
  public <T> T accept(ExperimentWarningPayloadVisitor<T> visitor) {
    return visitor.visitSrm(this);
  }
}
