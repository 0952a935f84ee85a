package org.experiment.analysis.warehouse.jdbc;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import javax.sql.DataSource;
import org.experiment.analysis.datamodel.rows.QueryResponse;
import org.experiment.analysis.datamodel.rows.QueryStatistics;
import org.experiment.analysis.warehouse.QueryJob;
import org.experiment.analysis.warehouse.compiler.SqlQueryCompiler;
import org.experiment.analysis.warehouse.exception.QueryExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs SQL on pooled connections in the background. Multi statement scripts (separated by {@link
 * SqlQueryCompiler#STATEMENT_SEPARATOR}) run in one transaction on one connection.
 */
public class JdbcQueryExecutor implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcQueryExecutor.class);

  private final String datasourceId;
  private final DataSource dataSource;
  private final ExecutorService executorService;
  private final Map<String, JdbcQueryJob<?>> runningJobs = new ConcurrentHashMap<>();

  public JdbcQueryExecutor(String datasourceId, DataSource dataSource, int threads) {
    this.datasourceId = datasourceId;
    this.dataSource = dataSource;
    this.executorService =
        Executors.newFixedThreadPool(
            threads,
            new ThreadFactoryBuilder()
                .setNameFormat("warehouse-" + datasourceId + "-%d")
                .setDaemon(true)
                .build());
  }

  public DataSource getDataSource() {
    return dataSource;
  }

  public <T> QueryJob<T> submit(String sql, RowMapper<T> rowMapper) {
    JdbcQueryJob<T> job = new JdbcQueryJob<>();
    executorService.execute(() -> run(job, sql, rowMapper));
    return job;
  }

  /** Blocking variant used by the capability implementations. */
  public <T> List<T> query(String sql, RowMapper<T> rowMapper) {
    return submit(sql, rowMapper).await().getRows();
  }

  public boolean cancel(String externalId) {
    JdbcQueryJob<?> job = runningJobs.get(externalId);
    if (job == null) {
      LOGGER.debug("No running query {} on datasource {}", externalId, datasourceId);
      return false;
    }
    job.cancel();
    return true;
  }

  @VisibleForTesting
  int getRunningJobCount() {
    return runningJobs.size();
  }

  private <T> void run(JdbcQueryJob<T> job, String sql, RowMapper<T> rowMapper) {
    String jobId = UUID.randomUUID().toString();
    long startTime = System.currentTimeMillis();
    List<String> statements = splitStatements(sql);

    try (Connection connection = dataSource.getConnection();
        Statement statement = connection.createStatement()) {
      runningJobs.put(jobId, job);
      job.started(jobId, statement);
      if (job.isCancelled()) {
        throw new SQLException("Query " + jobId + " was cancelled");
      }

      boolean transactional = statements.size() > 1;
      if (transactional) {
        connection.setAutoCommit(false);
      }
      List<T> rows = new ArrayList<>();
      try {
        for (String part : statements) {
          LOGGER.debug("Running query {} on datasource {}: {}", jobId, datasourceId, part);
          if (statement.execute(part)) {
            try (ResultSet resultSet = statement.getResultSet()) {
              rows = readRows(resultSet, rowMapper);
            }
          }
        }
        if (transactional) {
          connection.commit();
        }
      } catch (Throwable e) {
        if (transactional) {
          rollback(connection, e);
        }
        throw e;
      } finally {
        if (transactional) {
          connection.setAutoCommit(true);
        }
      }

      QueryStatistics statistics =
          QueryStatistics.builder()
              .executionDurationMs(System.currentTimeMillis() - startTime)
              .rowsProcessed((long) rows.size())
              .jobId(jobId)
              .build();
      job.response().complete(new QueryResponse<>(rows, statistics));
    } catch (Throwable e) {
      LOGGER.error("Query {} failed on datasource {}", jobId, datasourceId, e);
      QueryExecutionException failure = new QueryExecutionException(e.getMessage(), jobId, e);
      job.externalId().completeExceptionally(failure);
      job.response().completeExceptionally(failure);
      if (e instanceof Error) {
        throw (Error) e;
      }
    } finally {
      job.finished();
      runningJobs.remove(jobId);
    }
  }

  private static void rollback(Connection connection, Throwable cause) {
    try {
      connection.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  private static <T> List<T> readRows(ResultSet resultSet, RowMapper<T> rowMapper)
      throws SQLException {
    ResultSetMetaData metaData = resultSet.getMetaData();
    int columnCount = metaData.getColumnCount();
    List<T> rows = new ArrayList<>();
    while (resultSet.next()) {
      Map<String, Object> row = new LinkedHashMap<>(columnCount);
      for (int i = 1; i <= columnCount; i++) {
        row.put(metaData.getColumnLabel(i).toLowerCase(Locale.ROOT), resultSet.getObject(i));
      }
      Optional.ofNullable(rowMapper.map(row)).ifPresent(rows::add);
    }
    return rows;
  }

  static List<String> splitStatements(String sql) {
    List<String> statements = new ArrayList<>();
    for (String part : sql.split(SqlQueryCompiler.STATEMENT_SEPARATOR)) {
      if (!part.isBlank()) {
        statements.add(part.trim());
      }
    }
    return statements;
  }

  @Override
  public void close() {
    executorService.shutdown();
    try {
      if (!executorService.awaitTermination(30, TimeUnit.SECONDS)) {
        executorService.shutdownNow();
      }
    } catch (InterruptedException e) {
      executorService.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
