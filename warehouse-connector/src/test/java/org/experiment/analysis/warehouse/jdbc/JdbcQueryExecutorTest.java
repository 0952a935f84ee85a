package org.experiment.analysis.warehouse.jdbc;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Map;
import javax.sql.DataSource;
import org.experiment.analysis.warehouse.QueryJob;
import org.experiment.analysis.warehouse.exception.QueryExecutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JdbcQueryExecutorTest {
  private final DataSource dataSource = mock(DataSource.class);
  private final Connection connection = mock(Connection.class);
  private final Statement statement = mock(Statement.class);
  private JdbcQueryExecutor executor;

  @BeforeEach
  void setUp() throws SQLException {
    when(dataSource.getConnection()).thenReturn(connection);
    when(connection.createStatement()).thenReturn(statement);
    executor = new JdbcQueryExecutor("warehouse", dataSource, 1);
  }

  @AfterEach
  void tearDown() {
    executor.close();
  }

  @Test
  void testErrorsFailTheJob() throws SQLException {
    when(statement.execute("SELECT 1")).thenThrow(new LinkageError("driver class missing"));

    QueryJob<Map<String, Object>> job = executor.submit("SELECT 1", RowMappers.RAW);

    QueryExecutionException failure =
        Assertions.assertTimeoutPreemptively(
            Duration.ofSeconds(10),
            () -> Assertions.assertThrows(QueryExecutionException.class, job::await));
    Assertions.assertTrue(failure.getCause() instanceof LinkageError);
    Assertions.assertNotNull(failure.getExternalId());
  }

  @Test
  void testRollbackFailureIsSuppressed() throws SQLException {
    when(statement.execute("UPDATE b SET y = 2")).thenThrow(new SQLException("deadlock"));
    doThrow(new SQLException("connection reset")).when(connection).rollback();

    QueryJob<Map<String, Object>> job =
        executor.submit("UPDATE a SET x = 1;\nUPDATE b SET y = 2", RowMappers.RAW);

    QueryExecutionException failure =
        Assertions.assertTimeoutPreemptively(
            Duration.ofSeconds(10),
            () -> Assertions.assertThrows(QueryExecutionException.class, job::await));
    Assertions.assertEquals("deadlock", failure.getCause().getMessage());
    Assertions.assertEquals(1, failure.getCause().getSuppressed().length);
    Assertions.assertEquals(
        "connection reset", failure.getCause().getSuppressed()[0].getMessage());
    verify(connection).setAutoCommit(false);
    verify(connection).setAutoCommit(true);
  }
}
