package org.experiment.analysis.pipeline;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import org.experiment.analysis.datamodel.rows.QueryResponse;
import org.experiment.analysis.datamodel.rows.QueryStatistics;
import org.experiment.analysis.warehouse.QueryJob;
import org.experiment.analysis.warehouse.exception.QueryExecutionException;

class StubQueryJob<T> implements QueryJob<T> {
  private final CompletableFuture<String> externalId = new CompletableFuture<>();
  private final CompletableFuture<QueryResponse<T>> response = new CompletableFuture<>();

  static <T> StubQueryJob<T> completed(String jobId, List<T> rows) {
    StubQueryJob<T> job = new StubQueryJob<>();
    job.externalId.complete(jobId);
    job.response.complete(
        new QueryResponse<>(rows, QueryStatistics.builder().jobId(jobId).build()));
    return job;
  }

  static <T> StubQueryJob<T> failed(String jobId, String message) {
    StubQueryJob<T> job = new StubQueryJob<>();
    job.externalId.complete(jobId);
    job.response.completeExceptionally(new QueryExecutionException(message, jobId, null));
    return job;
  }

  @Override
  public CompletableFuture<String> externalId() {
    return externalId;
  }

  @Override
  public CompletableFuture<QueryResponse<T>> response() {
    return response;
  }

  @Override
  public void cancel() {}
}
