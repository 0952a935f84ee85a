package org.experiment.analysis.warehouse.jdbc;

import java.time.Instant;
import java.util.Map;
import org.experiment.analysis.datamodel.query.TestQueryParams;
import org.experiment.analysis.datamodel.rows.QueryResponse;
import org.experiment.analysis.datamodel.rows.TestQueryResult;
import org.experiment.analysis.warehouse.capability.TestQueryCapable;
import org.experiment.analysis.warehouse.compiler.SqlQueryCompiler;

class JdbcTestQueryRunner implements TestQueryCapable {
  private final JdbcQueryExecutor executor;
  private final SqlQueryCompiler compiler;

  JdbcTestQueryRunner(JdbcQueryExecutor executor, SqlQueryCompiler compiler) {
    this.executor = executor;
    this.compiler = compiler;
  }

  @Override
  public String getTestQuery(TestQueryParams params) {
    return compiler.getTestQuery(params);
  }

  @Override
  public String getTestValidityQuery(String query, Instant endDate, Map<String, String> variables) {
    return compiler.getTestValidityQuery(query, endDate, variables);
  }

  @Override
  public TestQueryResult runTestQuery(String sql) {
    QueryResponse<Map<String, Object>> response = executor.submit(sql, RowMappers.RAW).await();
    return TestQueryResult.builder()
        .results(response.getRows())
        .durationMs(response.getStatistics().getExecutionDurationMs())
        .build();
  }
}
