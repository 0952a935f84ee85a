package org.experiment.analysis.warehouse.capability;

public interface QueryCancellable {

  /** Cancels the running statement with this external id. Unknown ids are ignored. */
  void cancelQuery(String externalId);
}
