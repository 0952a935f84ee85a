package org.experiment.analysis.warehouse.jdbc;

import static org.experiment.analysis.warehouse.jdbc.RowValues.getBoolean;
import static org.experiment.analysis.warehouse.jdbc.RowValues.getDouble;
import static org.experiment.analysis.warehouse.jdbc.RowValues.getInstant;
import static org.experiment.analysis.warehouse.jdbc.RowValues.getLong;
import static org.experiment.analysis.warehouse.jdbc.RowValues.getNullableDouble;
import static org.experiment.analysis.warehouse.jdbc.RowValues.getString;

import java.util.Map;
import java.util.Set;
import org.experiment.analysis.datamodel.query.MetricAnalysisSettings;
import org.experiment.analysis.datamodel.rows.AggregateUnitsRow;
import org.experiment.analysis.datamodel.rows.ColumnTopValuesRow;
import org.experiment.analysis.datamodel.rows.DimensionSliceRow;
import org.experiment.analysis.datamodel.rows.ExperimentMetricRow;
import org.experiment.analysis.datamodel.rows.FactMetricsRow;
import org.experiment.analysis.datamodel.rows.MetricAnalysisRow;
import org.experiment.analysis.datamodel.rows.MetricValueRow;
import org.experiment.analysis.datamodel.rows.PastExperimentRow;

public class RowMappers {
  private static final Set<String> FACT_METRICS_KEY_COLUMNS =
      Set.of("dimension", "variation", "users", "count");

  public static final RowMapper<Void> NONE = row -> null;

  public static final RowMapper<ExperimentMetricRow> EXPERIMENT_METRIC =
      row ->
          ExperimentMetricRow.builder()
              .dimension(getString(row, "dimension"))
              .variation(getString(row, "variation"))
              .users(getLong(row, "users"))
              .count(getLong(row, "count"))
              .mainCapValue(getNullableDouble(row, "main_cap_value"))
              .mainSum(getDouble(row, "main_sum"))
              .mainSumSquares(getDouble(row, "main_sum_squares"))
              .denominatorCapValue(getNullableDouble(row, "denominator_cap_value"))
              .denominatorSum(getNullableDouble(row, "denominator_sum"))
              .denominatorSumSquares(getNullableDouble(row, "denominator_sum_squares"))
              .mainDenominatorSumProduct(getNullableDouble(row, "main_denominator_sum_product"))
              .covariateSum(getNullableDouble(row, "covariate_sum"))
              .covariateSumSquares(getNullableDouble(row, "covariate_sum_squares"))
              .mainCovariateSumProduct(getNullableDouble(row, "main_covariate_sum_product"))
              .quantile(getNullableDouble(row, "quantile"))
              .quantileN(getNullableDouble(row, "quantile_n"))
              .quantileLower(getNullableDouble(row, "quantile_lower"))
              .quantileUpper(getNullableDouble(row, "quantile_upper"))
              .quantileNstar(getNullableDouble(row, "quantile_nstar"))
              .build();

  public static final RowMapper<FactMetricsRow> FACT_METRICS =
      row -> {
        FactMetricsRow.FactMetricsRowBuilder builder =
            FactMetricsRow.builder()
                .dimension(getString(row, "dimension"))
                .variation(getString(row, "variation"))
                .users(getLong(row, "users"))
                .count(getLong(row, "count"));
        for (Map.Entry<String, Object> column : row.entrySet()) {
          if (!FACT_METRICS_KEY_COLUMNS.contains(column.getKey()) && column.getValue() != null) {
            builder.value(column.getKey(), column.getValue());
          }
        }
        return builder.build();
      };

  public static final RowMapper<MetricValueRow> METRIC_VALUE =
      row ->
          MetricValueRow.builder()
              .date(getString(row, "date"))
              .count(getLong(row, "count"))
              .mainSum(getDouble(row, "main_sum"))
              .mainSumSquares(getDouble(row, "main_sum_squares"))
              .build();

  public static final RowMapper<MetricAnalysisRow> METRIC_ANALYSIS =
      row -> {
        MetricAnalysisRow.MetricAnalysisRowBuilder builder =
            MetricAnalysisRow.builder()
                .date(getString(row, "date"))
                .dataType(getString(row, "data_type"))
                .capped(getBoolean(row, "capped"))
                .units(getLong(row, "units"))
                .mainSum(getDouble(row, "main_sum"))
                .mainSumSquares(getDouble(row, "main_sum_squares"))
                .denominatorSum(getNullableDouble(row, "denominator_sum"))
                .denominatorSumSquares(getNullableDouble(row, "denominator_sum_squares"))
                .mainDenominatorSumProduct(getNullableDouble(row, "main_denominator_sum_product"))
                .valueMin(getNullableDouble(row, "value_min"))
                .valueMax(getNullableDouble(row, "value_max"))
                .binWidth(getNullableDouble(row, "bin_width"));
        for (int i = 0; i < MetricAnalysisSettings.MAX_BINS; i++) {
          String column = "units_bin_" + i;
          if (row.get(column) != null) {
            builder.unitsBin(getLong(row, column));
          }
        }
        return builder.build();
      };

  public static final RowMapper<PastExperimentRow> PAST_EXPERIMENT =
      row ->
          PastExperimentRow.builder()
              .exposureQuery(getString(row, "exposure_query"))
              .experimentId(getString(row, "experiment_id"))
              .experimentName(getString(row, "experiment_name"))
              .variationId(getString(row, "variation_id"))
              .variationName(getString(row, "variation_name"))
              .startDate(getInstant(row, "start_date"))
              .endDate(getInstant(row, "end_date"))
              .users(getLong(row, "users"))
              .latestData(getInstant(row, "latest_data"))
              .build();

  public static final RowMapper<DimensionSliceRow> DIMENSION_SLICE =
      row ->
          DimensionSliceRow.builder()
              .dimensionValue(getString(row, "dimension_value"))
              .dimensionName(getString(row, "dimension_name"))
              .units(getLong(row, "units"))
              .totalUnits(getLong(row, "total_units"))
              .build();

  public static final RowMapper<AggregateUnitsRow> AGGREGATE_UNITS =
      row ->
          AggregateUnitsRow.builder()
              .variation(getString(row, "variation"))
              .dimensionValue(getString(row, "dimension_value"))
              .dimensionName(getString(row, "dimension_name"))
              .units(getLong(row, "units"))
              .build();

  public static final RowMapper<ColumnTopValuesRow> COLUMN_TOP_VALUES =
      row ->
          ColumnTopValuesRow.builder()
              .value(getString(row, "value"))
              .count(getLong(row, "count"))
              .build();

  public static final RowMapper<Map<String, Object>> RAW = row -> row;
}
