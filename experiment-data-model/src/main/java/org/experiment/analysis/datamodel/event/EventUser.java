package org.experiment.analysis.datamodel.event;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** The acting user recorded on an emitted event. */
@Value
@Builder
@Jacksonized
public class EventUser {
  @Builder.Default String type = "dashboard";
  String id;
  String email;
  String name;
}
