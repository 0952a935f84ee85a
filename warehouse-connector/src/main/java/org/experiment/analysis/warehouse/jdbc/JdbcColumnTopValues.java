package org.experiment.analysis.warehouse.jdbc;

import org.experiment.analysis.datamodel.query.ColumnTopValuesParams;
import org.experiment.analysis.datamodel.rows.ColumnTopValuesRow;
import org.experiment.analysis.warehouse.QueryJob;
import org.experiment.analysis.warehouse.capability.ColumnTopValuesCapable;
import org.experiment.analysis.warehouse.compiler.SqlQueryCompiler;

class JdbcColumnTopValues implements ColumnTopValuesCapable {
  private final JdbcQueryExecutor executor;
  private final SqlQueryCompiler compiler;

  JdbcColumnTopValues(JdbcQueryExecutor executor, SqlQueryCompiler compiler) {
    this.executor = executor;
    this.compiler = compiler;
  }

  @Override
  public String getColumnTopValuesQuery(ColumnTopValuesParams params) {
    return compiler.getColumnTopValuesQuery(params);
  }

  @Override
  public QueryJob<ColumnTopValuesRow> runColumnTopValuesQuery(String sql) {
    return executor.submit(sql, RowMappers.COLUMN_TOP_VALUES);
  }
}
