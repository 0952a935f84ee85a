package org.experiment.analysis.warehouse.jdbc;

import java.sql.SQLException;
import java.sql.Statement;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.experiment.analysis.datamodel.rows.QueryResponse;
import org.experiment.analysis.warehouse.QueryJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class JdbcQueryJob<T> implements QueryJob<T> {
  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcQueryJob.class);

  private final CompletableFuture<String> externalId = new CompletableFuture<>();
  private final CompletableFuture<QueryResponse<T>> response = new CompletableFuture<>();
  private final AtomicReference<Statement> statement = new AtomicReference<>();
  private volatile boolean cancelled;

  @Override
  public CompletableFuture<String> externalId() {
    return externalId;
  }

  @Override
  public CompletableFuture<QueryResponse<T>> response() {
    return response;
  }

  @Override
  public void cancel() {
    cancelled = true;
    Statement running = statement.get();
    if (running == null) {
      return;
    }
    try {
      running.cancel();
    } catch (SQLException e) {
      LOGGER.warn("Unable to cancel query {}", externalId.getNow(null), e);
    }
  }

  boolean isCancelled() {
    return cancelled;
  }

  void started(String jobId, Statement runningStatement) {
    statement.set(runningStatement);
    externalId.complete(jobId);
  }

  void finished() {
    statement.set(null);
  }
}
