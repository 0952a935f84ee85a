package org.experiment.analysis.warehouse;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.experiment.analysis.warehouse.compiler.DuckDbDialect;
import org.experiment.analysis.warehouse.compiler.PostgresDialect;
import org.experiment.analysis.warehouse.compiler.SqlDialect;
import org.experiment.analysis.warehouse.compiler.SqlQueryCompiler;
import org.experiment.analysis.warehouse.exception.DataSourceNotSupportedException;
import org.experiment.analysis.warehouse.exception.MissingDatasourceParamsException;
import org.experiment.analysis.warehouse.jdbc.HikariDataSourceFactory;
import org.experiment.analysis.warehouse.jdbc.JdbcConnectionSettings;
import org.experiment.analysis.warehouse.jdbc.JdbcQueryExecutor;
import org.experiment.analysis.warehouse.jdbc.JdbcWarehouseConnector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link WarehouseConnector} from a datasource config block:
 *
 * <pre>
 * id = "warehouse"
 * type = postgres | redshift | duckdb
 * params { host, port, database, user, password, schema } or params { path, schema }
 * pool.maxSize = 4
 * capabilities.disabled = [COLUMN_TOP_VALUES]
 * autoMetrics.schema = "segment"
 * </pre>
 */
public class WarehouseConnectorFactory {
  private static final Logger LOGGER = LoggerFactory.getLogger(WarehouseConnectorFactory.class);

  static final String ID_CONFIG = "id";
  static final String TYPE_CONFIG = "type";
  static final String PARAMS_CONFIG = "params";
  static final String POOL_MAX_SIZE_CONFIG = "pool.maxSize";
  static final String DISABLED_CAPABILITIES_CONFIG = "capabilities.disabled";
  static final String AUTO_METRICS_SCHEMA_CONFIG = "autoMetrics.schema";
  static final int DEFAULT_POOL_MAX_SIZE = 4;

  private static final List<String> POSTGRES_PARAMS = List.of("host", "database", "user");
  private static final List<String> DUCKDB_PARAMS = List.of("path");
  private static final int DEFAULT_POSTGRES_PORT = 5432;
  private static final int DEFAULT_REDSHIFT_PORT = 5439;

  private WarehouseConnectorFactory() {}

  public static WarehouseConnector create(Config datasourceConfig) {
    String datasourceId =
        datasourceConfig.hasPath(ID_CONFIG) ? datasourceConfig.getString(ID_CONFIG) : "default";
    if (!datasourceConfig.hasPath(TYPE_CONFIG)) {
      throw new MissingDatasourceParamsException(datasourceId, List.of(TYPE_CONFIG));
    }
    String type = datasourceConfig.getString(TYPE_CONFIG).toLowerCase(Locale.ROOT);
    Config params =
        datasourceConfig.hasPath(PARAMS_CONFIG)
            ? datasourceConfig.getConfig(PARAMS_CONFIG)
            : ConfigFactory.parseMap(Map.of());
    int maxPoolSize =
        datasourceConfig.hasPath(POOL_MAX_SIZE_CONFIG)
            ? datasourceConfig.getInt(POOL_MAX_SIZE_CONFIG)
            : DEFAULT_POOL_MAX_SIZE;

    SqlDialect dialect;
    JdbcConnectionSettings settings;
    Set<ConnectorCapability> capabilities;
    switch (type) {
      case "postgres":
      case "redshift":
        boolean redshift = type.equals("redshift");
        requireParams(datasourceId, params, POSTGRES_PARAMS);
        dialect = new PostgresDialect(redshift);
        settings =
            JdbcConnectionSettings.builder()
                .jdbcUrl(
                    String.format(
                        "jdbc:postgresql://%s:%d/%s",
                        params.getString("host"),
                        params.hasPath("port")
                            ? params.getInt("port")
                            : (redshift ? DEFAULT_REDSHIFT_PORT : DEFAULT_POSTGRES_PORT),
                        params.getString("database")))
                .driverClassName("org.postgresql.Driver")
                .user(params.getString("user"))
                .password(params.hasPath("password") ? params.getString("password") : null)
                .defaultSchema(params.hasPath("schema") ? params.getString("schema") : null)
                .maxPoolSize(maxPoolSize)
                .build();
        capabilities =
            EnumSet.of(
                ConnectorCapability.SCHEMA_INSPECTION,
                ConnectorCapability.COLUMN_TOP_VALUES,
                ConnectorCapability.TEST_QUERY,
                ConnectorCapability.QUERY_CANCELLATION,
                ConnectorCapability.FORMAT_DIALECT);
        break;
      case "duckdb":
        requireParams(datasourceId, params, DUCKDB_PARAMS);
        dialect = new DuckDbDialect();
        settings =
            JdbcConnectionSettings.builder()
                .jdbcUrl("jdbc:duckdb:" + params.getString("path"))
                .driverClassName("org.duckdb.DuckDBDriver")
                .defaultSchema(params.hasPath("schema") ? params.getString("schema") : null)
                .maxPoolSize(maxPoolSize)
                .build();
        capabilities =
            EnumSet.of(
                ConnectorCapability.SCHEMA_INSPECTION,
                ConnectorCapability.COLUMN_TOP_VALUES,
                ConnectorCapability.TEST_QUERY,
                ConnectorCapability.FORMAT_DIALECT);
        break;
      case "mixpanel":
      case "google_analytics":
        throw new DataSourceNotSupportedException(
            "Datasource " + datasourceId + " of type " + type + " cannot run SQL queries");
      default:
        throw new DataSourceNotSupportedException(
            "Unknown datasource type " + type + " for datasource " + datasourceId);
    }

    if (datasourceConfig.hasPath(AUTO_METRICS_SCHEMA_CONFIG)) {
      capabilities.add(ConnectorCapability.AUTO_METRICS);
    }
    if (datasourceConfig.hasPath(DISABLED_CAPABILITIES_CONFIG)) {
      for (String disabled : datasourceConfig.getStringList(DISABLED_CAPABILITIES_CONFIG)) {
        capabilities.remove(ConnectorCapability.valueOf(disabled.toUpperCase(Locale.ROOT)));
      }
    }

    JdbcQueryExecutor executor =
        new JdbcQueryExecutor(
            datasourceId, HikariDataSourceFactory.create(datasourceId, settings), maxPoolSize);
    LOGGER.info(
        "Created {} warehouse connector {} with capabilities {}", type, datasourceId, capabilities);
    return new JdbcWarehouseConnector(
        datasourceId,
        settings.getDefaultSchema(),
        new SqlQueryCompiler(dialect),
        executor,
        capabilities);
  }

  private static void requireParams(String datasourceId, Config params, List<String> required) {
    List<String> missing = new ArrayList<>();
    for (String param : required) {
      if (!params.hasPath(param) || params.getString(param).isBlank()) {
        missing.add(param);
      }
    }
    if (!missing.isEmpty()) {
      throw new MissingDatasourceParamsException(datasourceId, missing);
    }
  }
}
