package org.experiment.analysis.datamodel.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/** The {@code data} section of an experiment warning event, discriminated by {@code type}. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
  @JsonSubTypes.Type(value = AutoUpdatePayload.class, name = "auto-update"),
  @JsonSubTypes.Type(value = MultipleExposuresPayload.class, name = "multiple-exposures"),
  @JsonSubTypes.Type(value = SrmPayload.class, name = "srm")
})
@Getter
@ToString
@EqualsAndHashCode
public abstract class ExperimentWarningPayload {
  private final String experimentId;
  private final String experimentName;

  protected ExperimentWarningPayload(String experimentId, String experimentName) {
    this.experimentId = experimentId;
    this.experimentName = experimentName;
  }

  @JsonIgnore
  public abstract ExperimentNotification getType();

  public abstract <T> T accept(ExperimentWarningPayloadVisitor<T> visitor);
}
