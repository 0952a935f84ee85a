package org.experiment.analysis.warehouse;

import java.util.List;
import java.util.Optional;
import java.util.Set;
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

/**
 * A warehouse that experiment queries can run against. Every query kind comes as a pair: a pure
 * {@code get*Query} compiling parameters to SQL and a {@code run*Query} executing that SQL.
 *
 * <p>Optional features are not part of this interface. They are looked up with {@link
 * #capability(Class)} and must not be invoked when absent.
 */
public interface WarehouseConnector extends AutoCloseable {

  String getDatasourceId();

  SourceProperties getSourceProperties();

  List<String> getSensitiveParamKeys();

  boolean testConnection();

  Set<ConnectorCapability> getCapabilities();

  <T> Optional<T> capability(Class<T> capabilityType);

  default boolean hasCapability(ConnectorCapability capability) {
    return getCapabilities().contains(capability);
  }

  String getExperimentUnitsTableQuery(ExperimentUnitsQueryParams params);

  QueryJob<Void> runExperimentUnitsQuery(String sql);

  String getExperimentMetricQuery(ExperimentMetricQueryParams params);

  QueryJob<ExperimentMetricRow> runExperimentMetricQuery(String sql);

  String getExperimentFactMetricsQuery(ExperimentFactMetricsQueryParams params);

  QueryJob<FactMetricsRow> runExperimentFactMetricsQuery(String sql);

  String getExperimentAggregateUnitsQuery(ExperimentAggregateUnitsQueryParams params);

  QueryJob<AggregateUnitsRow> runExperimentAggregateUnitsQuery(String sql);

  String getMetricValueQuery(MetricValueParams params);

  QueryJob<MetricValueRow> runMetricValueQuery(String sql);

  String getMetricAnalysisQuery(MetricAnalysisParams params);

  QueryJob<MetricAnalysisRow> runMetricAnalysisQuery(String sql);

  String getPastExperimentQuery(PastExperimentParams params);

  QueryJob<PastExperimentRow> runPastExperimentQuery(String sql);

  String getDimensionSlicesQuery(DimensionSlicesQueryParams params);

  QueryJob<DimensionSliceRow> runDimensionSlicesQuery(String sql);

  String getDropUnitsTableQuery(DropTableQueryParams params);

  QueryJob<Void> runDropTableQuery(String sql);

  String generateTablePath(String tableName);

  String getExperimentPipelineCreateUnitsQuery(ExperimentPipelineUnitsParams params);

  QueryJob<Void> runExperimentPipelineCreateUnitsQuery(String sql);

  String getExperimentPipelineUnitsQuery(ExperimentPipelineUnitsParams params);

  QueryJob<Void> runExperimentPipelineUnitsQuery(String sql);

  String getExperimentPipelineTrimMetricsQuery(ExperimentPipelineTrimMetricsParams params);

  QueryJob<Void> runExperimentPipelineTrimMetricsQuery(String sql);

  String getExperimentPipelineFactMetricsQuery(ExperimentPipelineFactMetricsParams params);

  QueryJob<Void> runExperimentPipelineFactMetricsQuery(String sql);

  String getExperimentPipelineStatisticsQuery(ExperimentPipelineFactMetricsParams params);

  QueryJob<FactMetricsRow> runExperimentPipelineStatisticsQuery(String sql);

  @Override
  void close();
}
