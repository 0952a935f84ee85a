package org.experiment.analysis.datamodel.event;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ExperimentWarningEvent {
  public static final String EVENT_NAME = "experiment.warning";
  public static final String OBJECT_NAME = "experiment";

  @Builder.Default String event = EVENT_NAME;
  @Builder.Default String object = OBJECT_NAME;
  ExperimentWarningPayload data;
  EventUser user;
  @Singular List<String> projects;
  @Singular List<String> environments;
  @Singular List<String> tags;
  boolean containsSecrets;
}
