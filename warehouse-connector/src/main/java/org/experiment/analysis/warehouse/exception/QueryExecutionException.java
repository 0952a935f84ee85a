package org.experiment.analysis.warehouse.exception;

/** A warehouse rejected or failed a query. The message is the warehouse's own error text. */
public class QueryExecutionException extends RuntimeException {
  private final String externalId;

  public QueryExecutionException(String message, String externalId, Throwable cause) {
    super(message, cause);
    this.externalId = externalId;
  }

  public String getExternalId() {
    return externalId;
  }
}
