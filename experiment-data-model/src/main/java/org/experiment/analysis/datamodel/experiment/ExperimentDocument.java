package org.experiment.analysis.datamodel.experiment;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Persisted experiment state as far as this service reads it. {@code pastNotifications} is the
 * notification ledger and {@code version} is bumped on every write for optimistic concurrency.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ExperimentDocument {
  String id;
  String organization;
  String name;
  String project;
  @Singular List<String> tags;
  @Builder.Default ExperimentStatus status = ExperimentStatus.DRAFT;
  boolean archived;
  @Singular List<String> linkedFeatures;
  String releasedVariationId;
  boolean excludeFromPayload;
  @Singular List<Variation> variations;
  @Singular List<String> pastNotifications;
  long version;

  /**
   * Whether the experiment is part of the SDK payload. Only those experiments affect environments
   * and get them attached to warning events.
   */
  @JsonIgnore
  public boolean isIncludedInPayload() {
    if (archived || linkedFeatures.isEmpty()) {
      return false;
    }
    if (status == ExperimentStatus.RUNNING) {
      return true;
    }
    return status == ExperimentStatus.STOPPED
        && releasedVariationId != null
        && !releasedVariationId.isEmpty()
        && !excludeFromPayload;
  }
}
