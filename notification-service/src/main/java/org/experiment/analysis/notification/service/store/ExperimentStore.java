package org.experiment.analysis.notification.service.store;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.experiment.analysis.datamodel.experiment.ExperimentDocument;

/** Persisted experiments. Writes are versioned for optimistic concurrency. */
public interface ExperimentStore {

  Optional<ExperimentDocument> findById(String experimentId) throws IOException;

  /**
   * Replaces the notification ledger of an experiment if its stored version still is {@code
   * expectedVersion}. A successful write increments the version.
   *
   * @return {@code false} if the experiment is missing or was written concurrently
   */
  boolean updatePastNotifications(
      String experimentId, long expectedVersion, List<String> pastNotifications)
      throws IOException;
}
