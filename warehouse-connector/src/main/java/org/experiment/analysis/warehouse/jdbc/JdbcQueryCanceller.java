package org.experiment.analysis.warehouse.jdbc;

import org.experiment.analysis.warehouse.capability.QueryCancellable;

/** Cancels running statements through {@link java.sql.Statement#cancel()}. */
class JdbcQueryCanceller implements QueryCancellable {
  private final JdbcQueryExecutor executor;

  JdbcQueryCanceller(JdbcQueryExecutor executor) {
    this.executor = executor;
  }

  @Override
  public void cancelQuery(String externalId) {
    executor.cancel(externalId);
  }
}
