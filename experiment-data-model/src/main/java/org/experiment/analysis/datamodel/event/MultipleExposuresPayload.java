package org.experiment.analysis.datamodel.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class MultipleExposuresPayload extends ExperimentWarningPayload {
  private final long usersCount;
  private final double percent;

  @JsonCreator
  public MultipleExposuresPayload(
      @JsonProperty("experimentId") String experimentId,
      @JsonProperty("experimentName") String experimentName,
      @JsonProperty("usersCount") long usersCount,
      @JsonProperty("percent") double percent) {
    super(experimentId, experimentName);
    this.usersCount = usersCount;
    this.percent = percent;
  }

  @Override
  public ExperimentNotification getType() {
    return ExperimentNotification.MULTIPLE_EXPOSURES;
  }

  @Override
  public <T> T accept(ExperimentWarningPayloadVisitor<T> visitor) {
    return visitor.visitMultipleExposures(this);
  }
}
