package org.experiment.analysis.datamodel.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class AutoUpdatePayload extends ExperimentWarningPayload {
  private final boolean success;

  @JsonCreator
  public AutoUpdatePayload(
      @JsonProperty("experimentId") String experimentId,
      @JsonProperty("experimentName") String experimentName,
      @JsonProperty("success") boolean success) {
    super(experimentId, experimentName);
    this.success = success;
  }

  @Override
  public ExperimentNotification getType() {
    return ExperimentNotification.AUTO_UPDATE;
  }

  @Override
  public <T> T accept(ExperimentWarningPayloadVisitor<T> visitor) {
    return visitor.visitAutoUpdate(this);
  }
}
