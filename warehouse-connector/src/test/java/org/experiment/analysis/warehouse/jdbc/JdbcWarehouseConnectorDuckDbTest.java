package org.experiment.analysis.warehouse.jdbc;

import static org.experiment.analysis.warehouse.WarehouseTestFixtures.PURCHASES;
import static org.experiment.analysis.warehouse.WarehouseTestFixtures.PURCHASE_COUNT;
import static org.experiment.analysis.warehouse.WarehouseTestFixtures.REVENUE;
import static org.experiment.analysis.warehouse.WarehouseTestFixtures.START;
import static org.experiment.analysis.warehouse.WarehouseTestFixtures.settings;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import org.experiment.analysis.datamodel.query.ExperimentAggregateUnitsQueryParams;
import org.experiment.analysis.datamodel.query.ExperimentPipelineFactMetricsParams;
import org.experiment.analysis.datamodel.query.ExperimentPipelineTrimMetricsParams;
import org.experiment.analysis.datamodel.query.ExperimentPipelineUnitsParams;
import org.experiment.analysis.datamodel.rows.AggregateUnitsRow;
import org.experiment.analysis.datamodel.rows.FactMetricsRow;
import org.experiment.analysis.datamodel.rows.QueryResponse;
import org.experiment.analysis.datamodel.rows.TestQueryResult;
import org.experiment.analysis.warehouse.ConnectorCapability;
import org.experiment.analysis.warehouse.QueryJob;
import org.experiment.analysis.warehouse.capability.TestQueryCapable;
import org.experiment.analysis.warehouse.compiler.DuckDbDialect;
import org.experiment.analysis.warehouse.compiler.SqlQueryCompiler;
import org.experiment.analysis.warehouse.exception.QueryExecutionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JdbcWarehouseConnectorDuckDbTest {
  private static final String TABLE = "exp_checkout_pipeline";
  private static final String SEED =
      String.join(
          SqlQueryCompiler.STATEMENT_SEPARATOR,
          "CREATE TABLE exposures (user_id VARCHAR, timestamp TIMESTAMP, experiment_id VARCHAR,"
              + " variation_id VARCHAR)",
          "INSERT INTO exposures VALUES"
              + " ('u1', '2024-01-02 10:00:00', 'exp_checkout', '0'),"
              + " ('u2', '2024-01-02 11:00:00', 'exp_checkout', '1'),"
              + " ('u3', '2024-01-03 09:00:00', 'exp_checkout', '1'),"
              + " ('u4', '2024-01-03 09:00:00', 'exp_checkout', '0'),"
              + " ('u4', '2024-01-04 09:00:00', 'exp_checkout', '1'),"
              + " ('u5', '2024-01-03 09:00:00', 'exp_other', '0')",
          "CREATE TABLE purchases (user_id VARCHAR, timestamp TIMESTAMP, amount DOUBLE)",
          "INSERT INTO purchases VALUES"
              + " ('u1', '2024-01-02 12:00:00', 10),"
              + " ('u1', '2024-01-05 12:00:00', 5),"
              + " ('u2', '2024-01-01 12:00:00', 99),"
              + " ('u2', '2024-01-02 12:00:00', 20)");

  @TempDir Path tempDir;

  private JdbcQueryExecutor executor;
  private JdbcWarehouseConnector connector;

  @BeforeEach
  void setUp() {
    JdbcConnectionSettings connectionSettings =
        JdbcConnectionSettings.builder()
            .jdbcUrl("jdbc:duckdb:" + tempDir.resolve("warehouse.duckdb"))
            .driverClassName("org.duckdb.DuckDBDriver")
            .maxPoolSize(1)
            .build();
    executor =
        new JdbcQueryExecutor(
            "duckdb_test", HikariDataSourceFactory.create("duckdb_test", connectionSettings), 1);
    connector =
        new JdbcWarehouseConnector(
            "duckdb_test",
            null,
            new SqlQueryCompiler(new DuckDbDialect()),
            executor,
            EnumSet.of(ConnectorCapability.TEST_QUERY, ConnectorCapability.FORMAT_DIALECT));
    executor.query(SEED, RowMappers.NONE);
  }

  @AfterEach
  void tearDown() {
    connector.close();
  }

  @Test
  void testConnection() {
    Assertions.assertTrue(connector.testConnection());
  }

  @Test
  void testPipelineLifecycle() {
    ExperimentPipelineUnitsParams unitsParams =
        ExperimentPipelineUnitsParams.builder()
            .settings(settings())
            .tableName(TABLE)
            .lookbackDate(START)
            .build();
    connector
        .runExperimentPipelineCreateUnitsQuery(
            connector.getExperimentPipelineCreateUnitsQuery(unitsParams))
        .await();
    String populate = connector.getExperimentPipelineUnitsQuery(unitsParams);
    connector.runExperimentPipelineUnitsQuery(populate).await();
    // a second run finds every unit already present
    connector.runExperimentPipelineUnitsQuery(populate).await();

    List<AggregateUnitsRow> units =
        connector
            .runExperimentAggregateUnitsQuery(
                connector.getExperimentAggregateUnitsQuery(
                    ExperimentAggregateUnitsQueryParams.builder()
                        .settings(settings())
                        .useUnitsTable(true)
                        .unitsTableFullName(TABLE)
                        .build()))
            .await()
            .getRows();
    Assertions.assertEquals(3, units.size());
    Assertions.assertEquals("0", units.get(0).getVariation());
    Assertions.assertEquals(1, units.get(0).getUnits());
    Assertions.assertEquals("1", units.get(1).getVariation());
    Assertions.assertEquals(2, units.get(1).getUnits());
    Assertions.assertEquals("__multiple__", units.get(2).getVariation());
    Assertions.assertEquals(1, units.get(2).getUnits());

    connector
        .runExperimentPipelineTrimMetricsQuery(
            connector.getExperimentPipelineTrimMetricsQuery(
                ExperimentPipelineTrimMetricsParams.builder()
                    .tableName(TABLE)
                    .lookbackDate(START)
                    .build()))
        .await();

    ExperimentPipelineFactMetricsParams factParams =
        ExperimentPipelineFactMetricsParams.builder()
            .settings(settings())
            .factTable(PURCHASES.getId(), PURCHASES)
            .tableName(TABLE)
            .lookbackDate(START)
            .metricGroup(List.of(PURCHASE_COUNT, REVENUE))
            .build();
    String factMetrics = connector.getExperimentPipelineFactMetricsQuery(factParams);
    connector.runExperimentPipelineFactMetricsQuery(factMetrics).await();
    // re-running replaces the rows instead of duplicating them
    connector.runExperimentPipelineFactMetricsQuery(factMetrics).await();

    List<FactMetricsRow> statistics =
        connector
            .runExperimentPipelineStatisticsQuery(
                connector.getExperimentPipelineStatisticsQuery(factParams))
            .await()
            .getRows();
    Assertions.assertEquals(2, statistics.size());

    FactMetricsRow control = statistics.get(0);
    Assertions.assertEquals("0", control.getVariation());
    Assertions.assertEquals("All", control.getDimension());
    Assertions.assertEquals(1, control.getUsers());
    Assertions.assertEquals(2.0, control.getDouble("m0", "main_sum").orElseThrow());
    Assertions.assertEquals(15.0, control.getDouble("m1", "main_sum").orElseThrow());

    FactMetricsRow treatment = statistics.get(1);
    Assertions.assertEquals("1", treatment.getVariation());
    Assertions.assertEquals(2, treatment.getUsers());
    // purchases before the first exposure do not count
    Assertions.assertEquals(1.0, treatment.getDouble("m0", "main_sum").orElseThrow());
    Assertions.assertEquals(20.0, treatment.getDouble("m1", "main_sum").orElseThrow());
    Assertions.assertEquals(400.0, treatment.getDouble("m1", "main_sum_squares").orElseThrow());
  }

  @Test
  void testExternalIdIsAssignedBeforeCompletion() {
    QueryJob<Map<String, Object>> job = executor.submit("SELECT 1 AS one", RowMappers.RAW);
    QueryResponse<Map<String, Object>> response = job.await();

    String externalId = job.externalId().join();
    Assertions.assertNotNull(externalId);
    Assertions.assertEquals(externalId, response.getStatistics().getJobId());
    Assertions.assertEquals(1, ((Number) response.getRows().get(0).get("one")).intValue());
    Assertions.assertEquals(0, executor.getRunningJobCount());
  }

  @Test
  void testFailedQueryCarriesWarehouseMessage() {
    QueryJob<Void> job = connector.runDropTableQuery("DROP TABLE missing_table");

    QueryExecutionException exception =
        Assertions.assertThrows(QueryExecutionException.class, job::await);
    Assertions.assertNotNull(exception.getExternalId());
    Assertions.assertTrue(exception.getMessage().contains("missing_table"));
  }

  @Test
  void testFailedScriptIsRolledBack() {
    String script =
        String.join(
            SqlQueryCompiler.STATEMENT_SEPARATOR,
            "DELETE FROM purchases",
            "SELECT * FROM missing_table");

    Assertions.assertThrows(
        QueryExecutionException.class, () -> executor.query(script, RowMappers.RAW));
    Assertions.assertEquals(
        4, executor.query("SELECT * FROM purchases", RowMappers.RAW).size());
  }

  @Test
  void testRunTestQuery() {
    TestQueryCapable testQuery = connector.capability(TestQueryCapable.class).orElseThrow();
    TestQueryResult result =
        testQuery.runTestQuery("SELECT user_id FROM purchases ORDER BY user_id, timestamp");

    Assertions.assertEquals(4, result.getResults().size());
    Assertions.assertEquals("u1", result.getResults().get(0).get("user_id"));
  }
}
