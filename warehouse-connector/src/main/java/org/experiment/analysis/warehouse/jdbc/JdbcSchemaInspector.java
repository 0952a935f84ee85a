package org.experiment.analysis.warehouse.jdbc;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.experiment.analysis.datamodel.rows.InformationSchemaColumn;
import org.experiment.analysis.datamodel.rows.InformationSchemaTable;
import org.experiment.analysis.warehouse.capability.SchemaInspectable;
import org.experiment.analysis.warehouse.compiler.SqlDialect;
import org.experiment.analysis.warehouse.exception.QueryExecutionException;

/** Schema introspection through {@link DatabaseMetaData}. */
class JdbcSchemaInspector implements SchemaInspectable {
  static final int TABLE_DATA_LIMIT = 100;
  private static final String[] TABLE_TYPES = {"TABLE", "VIEW", "BASE TABLE"};

  private final JdbcQueryExecutor executor;
  private final SqlDialect dialect;

  JdbcSchemaInspector(JdbcQueryExecutor executor, SqlDialect dialect) {
    this.executor = executor;
    this.dialect = dialect;
  }

  @Override
  public List<InformationSchemaTable> getInformationSchema() {
    try (Connection connection = executor.getDataSource().getConnection()) {
      DatabaseMetaData metaData = connection.getMetaData();
      Map<String, Integer> columnCounts = new LinkedHashMap<>();
      try (ResultSet columns = metaData.getColumns(null, null, "%", "%")) {
        while (columns.next()) {
          columnCounts.merge(
              key(
                  columns.getString("TABLE_CAT"),
                  columns.getString("TABLE_SCHEM"),
                  columns.getString("TABLE_NAME")),
              1,
              Integer::sum);
        }
      }

      List<InformationSchemaTable> tables = new ArrayList<>();
      try (ResultSet resultSet = metaData.getTables(null, null, "%", TABLE_TYPES)) {
        while (resultSet.next()) {
          String database = resultSet.getString("TABLE_CAT");
          String schema = resultSet.getString("TABLE_SCHEM");
          String table = resultSet.getString("TABLE_NAME");
          if (isSystemSchema(schema)) {
            continue;
          }
          tables.add(
              InformationSchemaTable.builder()
                  .databaseName(database)
                  .schemaName(schema)
                  .tableName(table)
                  .path(dialect.generateTablePath(table, schema, database))
                  .numOfColumns(columnCounts.getOrDefault(key(database, schema, table), 0))
                  .build());
        }
      }
      return tables;
    } catch (SQLException e) {
      throw new QueryExecutionException(e.getMessage(), null, e);
    }
  }

  @Override
  public List<InformationSchemaColumn> getTableColumns(
      String databaseName, String schema, String table) {
    try (Connection connection = executor.getDataSource().getConnection();
        ResultSet resultSet =
            connection.getMetaData().getColumns(databaseName, schema, table, "%")) {
      List<InformationSchemaColumn> columns = new ArrayList<>();
      while (resultSet.next()) {
        columns.add(
            InformationSchemaColumn.builder()
                .columnName(resultSet.getString("COLUMN_NAME"))
                .dataType(resultSet.getString("TYPE_NAME"))
                .build());
      }
      return columns;
    } catch (SQLException e) {
      throw new QueryExecutionException(e.getMessage(), null, e);
    }
  }

  @Override
  public List<Map<String, Object>> getTableData(String databaseName, String schema, String table) {
    String sql =
        dialect.limit(
            "SELECT * FROM " + dialect.generateTablePath(table, schema, databaseName),
            TABLE_DATA_LIMIT);
    return executor.query(sql, RowMappers.RAW);
  }

  private static boolean isSystemSchema(String schema) {
    return "information_schema".equalsIgnoreCase(schema)
        || "pg_catalog".equalsIgnoreCase(schema);
  }

  private static String key(String database, String schema, String table) {
    return Objects.toString(database, "") + "." + Objects.toString(schema, "") + "." + table;
  }
}
