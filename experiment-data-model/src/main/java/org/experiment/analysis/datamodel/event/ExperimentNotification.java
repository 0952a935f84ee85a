package org.experiment.analysis.datamodel.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/** Ledger tags persisted in an experiment's {@code pastNotifications}. */
public enum ExperimentNotification {
  AUTO_UPDATE("auto-update"),
  MULTIPLE_EXPOSURES("multiple-exposures"),
  SRM("srm");

  private final String tag;

  ExperimentNotification(String tag) {
    this.tag = tag;
  }

  @JsonValue
  public String getTag() {
    return tag;
  }

  @JsonCreator
  public static ExperimentNotification fromTag(String tag) {
    return Arrays.stream(values())
        .filter(notification -> notification.tag.equals(tag))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown notification type: " + tag));
  }

  @Override
  public String toString() {
    return tag;
  }
}
