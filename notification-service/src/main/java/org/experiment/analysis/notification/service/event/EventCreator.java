package org.experiment.analysis.notification.service.event;

import java.io.IOException;
import java.util.Optional;
import org.experiment.analysis.datamodel.event.ExperimentWarningEvent;

/** Hands warning events to the event bus. */
public interface EventCreator extends AutoCloseable {

  /**
   * Creates the event for an organization.
   *
   * @return the id of the created event, empty if the bus did not accept it
   */
  Optional<String> createEvent(String organizationId, ExperimentWarningEvent event)
      throws IOException;

  @Override
  default void close() {}
}
