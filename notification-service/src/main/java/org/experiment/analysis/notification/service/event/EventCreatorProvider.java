package org.experiment.analysis.notification.service.event;

import com.typesafe.config.Config;

public class EventCreatorProvider {
  private static final String EVENT_CREATOR_TYPE = "type";
  private static final String EVENT_CREATOR_TYPE_KAFKA = "kafka";

  public static EventCreator getEventCreator(Config eventCreatorConfig) {
    String type = eventCreatorConfig.getString(EVENT_CREATOR_TYPE);
    switch (type) {
      case EVENT_CREATOR_TYPE_KAFKA:
        return new KafkaEventCreator(eventCreatorConfig.getConfig(EVENT_CREATOR_TYPE_KAFKA));
      default:
        throw new RuntimeException(String.format("Invalid event creator type:%s", type));
    }
  }
}
