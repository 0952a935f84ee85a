package org.experiment.analysis.warehouse;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.experiment.analysis.datamodel.rows.QueryResponse;
import org.experiment.analysis.warehouse.exception.QueryExecutionException;

/**
 * Handle on a query submitted to a warehouse. {@link #externalId()} completes once, when the
 * warehouse accepts the statement and before any rows are produced, so that callers can record it
 * for a later cancellation.
 */
public interface QueryJob<T> {

  CompletableFuture<String> externalId();

  CompletableFuture<QueryResponse<T>> response();

  /** Best effort; a job that already finished is left as is. */
  void cancel();

  /** Waits for the response and rethrows a warehouse failure as {@link QueryExecutionException}. */
  default QueryResponse<T> await() {
    try {
      return response().join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof QueryExecutionException) {
        throw (QueryExecutionException) e.getCause();
      }
      throw new QueryExecutionException(
          String.valueOf(e.getCause() != null ? e.getCause().getMessage() : e.getMessage()),
          externalId().getNow(null),
          e.getCause() != null ? e.getCause() : e);
    }
  }
}
