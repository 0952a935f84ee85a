package org.experiment.analysis.datamodel.rows;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TrackedEventData {
  String eventName;
  String displayName;
  boolean hasUserId;
  long count;
  Instant lastTrackedAt;
}
