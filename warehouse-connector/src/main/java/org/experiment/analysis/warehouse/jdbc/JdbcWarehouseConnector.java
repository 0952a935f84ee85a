package org.experiment.analysis.warehouse.jdbc;

import com.google.common.collect.ImmutableClassToInstanceMap;
import java.io.Closeable;
import java.io.IOException;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import javax.sql.DataSource;
import org.experiment.analysis.datamodel.query.DimensionSlicesQueryParams;
import org.experiment.analysis.datamodel.query.DropTableQueryParams;
import org.experiment.analysis.datamodel.query.ExperimentAggregateUnitsQueryParams;
import org.experiment.analysis.datamodel.query.ExperimentFactMetricsQueryParams;
import org.experiment.analysis.datamodel.query.ExperimentMetricQueryParams;
import org.experiment.analysis.datamodel.query.ExperimentPipelineFactMetricsParams;
import org.experiment.analysis.datamodel.query.ExperimentPipelineTrimMetricsParams;
import org.experiment.analysis.datamodel.query.ExperimentPipelineUnitsParams;
import org.experiment.analysis.datamodel.query.ExperimentUnitsQueryParams;
import org.experiment.analysis.datamodel.query.MetricAnalysisParams;
import org.experiment.analysis.datamodel.query.MetricValueParams;
import org.experiment.analysis.datamodel.query.PastExperimentParams;
import org.experiment.analysis.datamodel.rows.AggregateUnitsRow;
import org.experiment.analysis.datamodel.rows.DimensionSliceRow;
import org.experiment.analysis.datamodel.rows.ExperimentMetricRow;
import org.experiment.analysis.datamodel.rows.FactMetricsRow;
import org.experiment.analysis.datamodel.rows.MetricAnalysisRow;
import org.experiment.analysis.datamodel.rows.MetricValueRow;
import org.experiment.analysis.datamodel.rows.PastExperimentRow;
import org.experiment.analysis.warehouse.ConnectorCapability;
import org.experiment.analysis.warehouse.QueryJob;
import org.experiment.analysis.warehouse.SourceProperties;
import org.experiment.analysis.warehouse.WarehouseConnector;
import org.experiment.analysis.warehouse.capability.AutoMetricDiscoverable;
import org.experiment.analysis.warehouse.capability.ColumnTopValuesCapable;
import org.experiment.analysis.warehouse.capability.DialectReporting;
import org.experiment.analysis.warehouse.capability.QueryCancellable;
import org.experiment.analysis.warehouse.capability.SchemaInspectable;
import org.experiment.analysis.warehouse.capability.TestQueryCapable;
import org.experiment.analysis.warehouse.compiler.SqlQueryCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link WarehouseConnector} for SQL warehouses reachable over JDBC. */
public class JdbcWarehouseConnector implements WarehouseConnector {
  private static final Logger LOGGER = LoggerFactory.getLogger(JdbcWarehouseConnector.class);
  private static final List<String> SENSITIVE_PARAM_KEYS = List.of("password");

  private final String datasourceId;
  private final String defaultSchema;
  private final SqlQueryCompiler compiler;
  private final JdbcQueryExecutor executor;
  private final ImmutableClassToInstanceMap<Object> capabilities;
  private final Set<ConnectorCapability> capabilitySet;

  public JdbcWarehouseConnector(
      String datasourceId,
      String defaultSchema,
      SqlQueryCompiler compiler,
      JdbcQueryExecutor executor,
      Set<ConnectorCapability> enabledCapabilities) {
    this.datasourceId = datasourceId;
    this.defaultSchema = defaultSchema;
    this.compiler = compiler;
    this.executor = executor;

    ImmutableClassToInstanceMap.Builder<Object> builder = ImmutableClassToInstanceMap.builder();
    for (ConnectorCapability capability : enabledCapabilities) {
      switch (capability) {
        case SCHEMA_INSPECTION:
          builder.put(
              SchemaInspectable.class, new JdbcSchemaInspector(executor, compiler.getDialect()));
          break;
        case COLUMN_TOP_VALUES:
          builder.put(ColumnTopValuesCapable.class, new JdbcColumnTopValues(executor, compiler));
          break;
        case AUTO_METRICS:
          builder.put(
              AutoMetricDiscoverable.class,
              new JdbcAutoMetricDiscovery(executor, compiler.getDialect()));
          break;
        case TEST_QUERY:
          builder.put(TestQueryCapable.class, new JdbcTestQueryRunner(executor, compiler));
          break;
        case QUERY_CANCELLATION:
          builder.put(QueryCancellable.class, new JdbcQueryCanceller(executor));
          break;
        case FORMAT_DIALECT:
          DialectReporting dialectReporting = compiler.getDialect()::formatDialect;
          builder.put(DialectReporting.class, dialectReporting);
          break;
        default:
          throw new IllegalArgumentException("Unknown capability " + capability);
      }
    }
    this.capabilities = builder.build();
    this.capabilitySet =
        enabledCapabilities.isEmpty()
            ? EnumSet.noneOf(ConnectorCapability.class)
            : EnumSet.copyOf(enabledCapabilities);
  }

  @Override
  public String getDatasourceId() {
    return datasourceId;
  }

  @Override
  public SourceProperties getSourceProperties() {
    return SourceProperties.builder()
        .hasSettings(true)
        .separateExperimentResultQueries(false)
        .supportsInformationSchema(capabilitySet.contains(ConnectorCapability.SCHEMA_INSPECTION))
        .supportsAutoGeneratedMetrics(capabilitySet.contains(ConnectorCapability.AUTO_METRICS))
        .supportsPipeline(true)
        .build();
  }

  @Override
  public List<String> getSensitiveParamKeys() {
    return SENSITIVE_PARAM_KEYS;
  }

  @Override
  public boolean testConnection() {
    try {
      executor.query("SELECT 1", RowMappers.RAW);
      return true;
    } catch (RuntimeException e) {
      LOGGER.warn("Connection test failed for datasource {}", datasourceId, e);
      return false;
    }
  }

  @Override
  public Set<ConnectorCapability> getCapabilities() {
    return capabilitySet.isEmpty()
        ? EnumSet.noneOf(ConnectorCapability.class)
        : EnumSet.copyOf(capabilitySet);
  }

  @Override
  public <T> Optional<T> capability(Class<T> capabilityType) {
    return Optional.ofNullable(capabilities.getInstance(capabilityType));
  }

  @Override
  public String getExperimentUnitsTableQuery(ExperimentUnitsQueryParams params) {
    return compiler.getExperimentUnitsTableQuery(params);
  }

  @Override
  public QueryJob<Void> runExperimentUnitsQuery(String sql) {
    return executor.submit(sql, RowMappers.NONE);
  }

  @Override
  public String getExperimentMetricQuery(ExperimentMetricQueryParams params) {
    return compiler.getExperimentMetricQuery(params);
  }

  @Override
  public QueryJob<ExperimentMetricRow> runExperimentMetricQuery(String sql) {
    return executor.submit(sql, RowMappers.EXPERIMENT_METRIC);
  }

  @Override
  public String getExperimentFactMetricsQuery(ExperimentFactMetricsQueryParams params) {
    return compiler.getExperimentFactMetricsQuery(params);
  }

  @Override
  public QueryJob<FactMetricsRow> runExperimentFactMetricsQuery(String sql) {
    return executor.submit(sql, RowMappers.FACT_METRICS);
  }

  @Override
  public String getExperimentAggregateUnitsQuery(ExperimentAggregateUnitsQueryParams params) {
    return compiler.getExperimentAggregateUnitsQuery(params);
  }

  @Override
  public QueryJob<AggregateUnitsRow> runExperimentAggregateUnitsQuery(String sql) {
    return executor.submit(sql, RowMappers.AGGREGATE_UNITS);
  }

  @Override
  public String getMetricValueQuery(MetricValueParams params) {
    return compiler.getMetricValueQuery(params);
  }

  @Override
  public QueryJob<MetricValueRow> runMetricValueQuery(String sql) {
    return executor.submit(sql, RowMappers.METRIC_VALUE);
  }

  @Override
  public String getMetricAnalysisQuery(MetricAnalysisParams params) {
    return compiler.getMetricAnalysisQuery(params);
  }

  @Override
  public QueryJob<MetricAnalysisRow> runMetricAnalysisQuery(String sql) {
    return executor.submit(sql, RowMappers.METRIC_ANALYSIS);
  }

  @Override
  public String getPastExperimentQuery(PastExperimentParams params) {
    return compiler.getPastExperimentQuery(params);
  }

  @Override
  public QueryJob<PastExperimentRow> runPastExperimentQuery(String sql) {
    return executor.submit(sql, RowMappers.PAST_EXPERIMENT);
  }

  @Override
  public String getDimensionSlicesQuery(DimensionSlicesQueryParams params) {
    return compiler.getDimensionSlicesQuery(params);
  }

  @Override
  public QueryJob<DimensionSliceRow> runDimensionSlicesQuery(String sql) {
    return executor.submit(sql, RowMappers.DIMENSION_SLICE);
  }

  @Override
  public String getDropUnitsTableQuery(DropTableQueryParams params) {
    return compiler.getDropUnitsTableQuery(params);
  }

  @Override
  public QueryJob<Void> runDropTableQuery(String sql) {
    return executor.submit(sql, RowMappers.NONE);
  }

  @Override
  public String generateTablePath(String tableName) {
    return compiler.getDialect().generateTablePath(tableName, defaultSchema, null);
  }

  @Override
  public String getExperimentPipelineCreateUnitsQuery(ExperimentPipelineUnitsParams params) {
    return compiler.getExperimentPipelineCreateUnitsQuery(params);
  }

  @Override
  public QueryJob<Void> runExperimentPipelineCreateUnitsQuery(String sql) {
    return executor.submit(sql, RowMappers.NONE);
  }

  @Override
  public String getExperimentPipelineUnitsQuery(ExperimentPipelineUnitsParams params) {
    return compiler.getExperimentPipelineUnitsQuery(params);
  }

  @Override
  public QueryJob<Void> runExperimentPipelineUnitsQuery(String sql) {
    return executor.submit(sql, RowMappers.NONE);
  }

  @Override
  public String getExperimentPipelineTrimMetricsQuery(ExperimentPipelineTrimMetricsParams params) {
    return compiler.getExperimentPipelineTrimMetricsQuery(params);
  }

  @Override
  public QueryJob<Void> runExperimentPipelineTrimMetricsQuery(String sql) {
    return executor.submit(sql, RowMappers.NONE);
  }

  @Override
  public String getExperimentPipelineFactMetricsQuery(ExperimentPipelineFactMetricsParams params) {
    return compiler.getExperimentPipelineFactMetricsQuery(params);
  }

  @Override
  public QueryJob<Void> runExperimentPipelineFactMetricsQuery(String sql) {
    return executor.submit(sql, RowMappers.NONE);
  }

  @Override
  public String getExperimentPipelineStatisticsQuery(ExperimentPipelineFactMetricsParams params) {
    return compiler.getExperimentPipelineStatisticsQuery(params);
  }

  @Override
  public QueryJob<FactMetricsRow> runExperimentPipelineStatisticsQuery(String sql) {
    return executor.submit(sql, RowMappers.FACT_METRICS);
  }

  @Override
  public void close() {
    executor.close();
    DataSource dataSource = executor.getDataSource();
    if (dataSource instanceof Closeable) {
      try {
        ((Closeable) dataSource).close();
      } catch (IOException e) {
        LOGGER.warn("Failed to close connection pool of datasource {}", datasourceId, e);
      }
    }
    LOGGER.info("Closed warehouse connector {}", datasourceId);
  }
}
