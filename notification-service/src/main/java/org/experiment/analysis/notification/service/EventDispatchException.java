package org.experiment.analysis.notification.service;

/** The event bus did not create an event for a warning. The ledger is left untouched. */
public class EventDispatchException extends RuntimeException {
  public EventDispatchException(String message) {
    super(message);
  }
}
