package org.experiment.analysis.warehouse.compiler;

import com.google.common.base.Preconditions;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.experiment.analysis.datamodel.dimension.ExperimentDimension;
import org.experiment.analysis.datamodel.experiment.ExperimentSnapshotSettings;
import org.experiment.analysis.datamodel.experiment.ExposureQuery;
import org.experiment.analysis.datamodel.metric.ColumnRef;
import org.experiment.analysis.datamodel.metric.FactMetric;
import org.experiment.analysis.datamodel.metric.FactMetricData;
import org.experiment.analysis.datamodel.metric.FactTable;
import org.experiment.analysis.datamodel.metric.QuantileType;
import org.experiment.analysis.datamodel.query.ColumnTopValuesParams;
import org.experiment.analysis.datamodel.query.DimensionSlicesQueryParams;
import org.experiment.analysis.datamodel.query.DropTableQueryParams;
import org.experiment.analysis.datamodel.query.ExperimentAggregateUnitsQueryParams;
import org.experiment.analysis.datamodel.query.ExperimentBaseQueryParams;
import org.experiment.analysis.datamodel.query.ExperimentFactMetricsQueryParams;
import org.experiment.analysis.datamodel.query.ExperimentMetricQueryParams;
import org.experiment.analysis.datamodel.query.ExperimentPipelineFactMetricsParams;
import org.experiment.analysis.datamodel.query.ExperimentPipelineTrimMetricsParams;
import org.experiment.analysis.datamodel.query.ExperimentPipelineUnitsParams;
import org.experiment.analysis.datamodel.query.ExperimentUnitsQueryParams;
import org.experiment.analysis.datamodel.query.MetricAnalysisParams;
import org.experiment.analysis.datamodel.query.MetricAnalysisSettings;
import org.experiment.analysis.datamodel.query.MetricValueParams;
import org.experiment.analysis.datamodel.query.PastExperimentParams;
import org.experiment.analysis.datamodel.query.TestQueryParams;

/**
 * Compiles query parameters into SQL text for one {@link SqlDialect}. Compilation is a pure
 * function of its inputs: no clock reads, no randomness, no state carried between calls.
 */
public class SqlQueryCompiler {
  public static final String METRICS_TABLE_SUFFIX = "_metrics";
  public static final String STATEMENT_SEPARATOR = ";\n";
  static final int PAST_EXPERIMENT_MIN_UNITS = 5;
  static final int MAX_DIMENSION_SLICES = 20;

  private final SqlDialect dialect;
  private final SqlTemplates templates;
  private final ExperimentUnitsSql unitsSql;
  private final FactMetricsSql factMetricsSql;

  public SqlQueryCompiler(SqlDialect dialect) {
    this.dialect = dialect;
    this.templates = new SqlTemplates(dialect);
    this.unitsSql = new ExperimentUnitsSql(dialect, templates);
    this.factMetricsSql = new FactMetricsSql(dialect, unitsSql);
  }

  public SqlDialect getDialect() {
    return dialect;
  }

  public static String metricsTableName(String unitsTableName) {
    return unitsTableName + METRICS_TABLE_SUFFIX;
  }

  public String getExperimentUnitsTableQuery(ExperimentUnitsQueryParams params) {
    Preconditions.checkArgument(
        params.getUnitsTableFullName() != null, "unitsTableFullName is required");
    CommonTableExpressions ctes = new CommonTableExpressions();
    unitsSql.addExperimentUnits(ctes, params, params.getSettings().getStartDate());
    return "CREATE TABLE "
        + params.getUnitsTableFullName()
        + " AS (\n"
        + ctes.render("SELECT * FROM __experimentUnits")
        + "\n)";
  }

  public String getExperimentMetricQuery(ExperimentMetricQueryParams params) {
    List<FactMetricData> metrics =
        FactMetricDataFactory.create(List.of(params.getMetric()), params.getSettings());
    return compileFactMetrics(params, metrics, params.isUseUnitsTable(), false);
  }

  public String getExperimentFactMetricsQuery(ExperimentFactMetricsQueryParams params) {
    Preconditions.checkArgument(!params.getMetrics().isEmpty(), "at least one metric is required");
    List<FactMetricData> metrics =
        FactMetricDataFactory.create(params.getMetrics(), params.getSettings());
    return compileFactMetrics(params, metrics, params.isUseUnitsTable(), true);
  }

  private String compileFactMetrics(
      ExperimentBaseQueryParams params,
      List<FactMetricData> metrics,
      boolean useUnitsTable,
      boolean prefixColumns) {
    CommonTableExpressions ctes = new CommonTableExpressions();
    String unitsSource = unitsSource(ctes, params, useUnitsTable);
    unitsSql.addUnits(ctes, params, unitsSource, maxHoursToConvert(metrics));
    String select =
        factMetricsSql.aggregate(
            ctes,
            metrics,
            factMetricsSql.factTableSource(params.getSettings(), params.getFactTables()),
            prefixColumns);
    return ctes.render(select);
  }

  public String getExperimentAggregateUnitsQuery(ExperimentAggregateUnitsQueryParams params) {
    CommonTableExpressions ctes = new CommonTableExpressions();
    String unitsSource = unitsSource(ctes, params, params.isUseUnitsTable());

    List<String> selects = new ArrayList<>();
    selects.add(
        "SELECT variation, '' AS dimension_value, '' AS dimension_name, COUNT(*) AS units\nFROM "
            + unitsSource
            + "\nGROUP BY variation");
    for (int i = 0; i < params.getDimensions().size(); i++) {
      String column = "dim_" + i;
      selects.add(
          "SELECT variation, COALESCE("
              + column
              + ", "
              + dialect.escapeLiteral(ExperimentUnitsSql.NULL_DIMENSION)
              + ") AS dimension_value, "
              + dialect.escapeLiteral(
                  ExperimentUnitsSql.dimensionName(params.getDimensions().get(i)))
              + " AS dimension_name, COUNT(*) AS units\nFROM "
              + unitsSource
              + "\nGROUP BY variation, "
              + column);
    }
    return ctes.render(
        "SELECT * FROM (\n"
            + String.join("\nUNION ALL\n", selects)
            + "\n) agg\nORDER BY dimension_name, dimension_value, variation");
  }

  public String getMetricValueQuery(MetricValueParams params) {
    FactMetric metric = params.getMetric();
    CommonTableExpressions ctes = new CommonTableExpressions();
    String factCte =
        factTableCte(
            ctes, params.getFactTables(), metric.getNumerator(), params.getUserIdType(),
            params.getFrom(), params.getTo());
    if (params.getSegment() != null) {
      unitsSql.addSegment(ctes, params.getSegment(), params.getFrom(), params.getTo());
    }

    String dateColumn = dialect.dateTrunc("f.timestamp");
    StringBuilder userMetric = new StringBuilder("SELECT f.unit_id");
    if (params.isIncludeByDate()) {
      userMetric.append(", ").append(dateColumn).append(" AS metric_date");
    }
    userMetric
        .append(",\n  ")
        .append(factMetricsSql.aggregate(metric.getNumerator(), "1 = 1", "f."))
        .append(" AS value\nFROM ")
        .append(factCte)
        .append(" f");
    if (params.getSegment() != null) {
      userMetric.append("\nWHERE f.unit_id IN (SELECT s.unit_id FROM __segment s)");
    }
    userMetric.append("\nGROUP BY f.unit_id");
    if (params.isIncludeByDate()) {
      userMetric.append(", ").append(dateColumn);
    }
    ctes.add("__userMetric", userMetric.toString());

    String value = cappedUnitValue(ctes, metric, "__userMetric", "value");
    String date =
        params.isIncludeByDate()
            ? dialect.formatDate("um.metric_date")
            : "CAST(NULL AS " + dialect.stringType() + ")";
    return ctes.render(
        "SELECT "
            + date
            + " AS date,\n  COUNT(*) AS count,\n  SUM("
            + value
            + ") AS main_sum,\n  SUM("
            + value
            + " * "
            + value
            + ") AS main_sum_squares\nFROM __userMetric um"
            + (metric.getCapping().isPercentileCapped() ? "\nCROSS JOIN __capValue cap" : "")
            + (params.isIncludeByDate()
                ? "\nGROUP BY um.metric_date\nORDER BY um.metric_date"
                : ""));
  }

  public String getMetricAnalysisQuery(MetricAnalysisParams params) {
    MetricAnalysisSettings settings = params.getSettings();
    FactMetric metric = params.getMetric();
    int numBins = settings.getNumBins();
    CommonTableExpressions ctes = new CommonTableExpressions();

    String factCte =
        factTableCte(
            ctes, params.getFactTables(), metric.getNumerator(), settings.getUserIdType(),
            settings.getStartDate(), settings.getEndDate());
    String denominatorCte =
        metric.isRatio()
            ? factTableCte(
                ctes, params.getFactTables(), metric.getDenominator(), settings.getUserIdType(),
                settings.getStartDate(), settings.getEndDate())
            : null;
    if (params.getSegment() != null) {
      unitsSql.addSegment(
          ctes, params.getSegment(), settings.getStartDate(), settings.getEndDate());
    }
    String segmentFilter =
        params.getSegment() != null
            ? "\nWHERE f.unit_id IN (SELECT s.unit_id FROM __segment s)"
            : "";

    ctes.add(
        "__userMetricDates",
        "SELECT f.unit_id, "
            + dialect.dateTrunc("f.timestamp")
            + " AS metric_date,\n  "
            + factMetricsSql.aggregate(metric.getNumerator(), "1 = 1", "f.")
            + " AS value\nFROM "
            + factCte
            + " f"
            + segmentFilter
            + "\nGROUP BY f.unit_id, "
            + dialect.dateTrunc("f.timestamp"));
    ctes.add(
        "__userMetricOverall",
        "SELECT f.unit_id,\n  "
            + factMetricsSql.aggregate(metric.getNumerator(), "1 = 1", "f.")
            + " AS value\nFROM "
            + factCte
            + " f"
            + segmentFilter
            + "\nGROUP BY f.unit_id");
    if (metric.isRatio()) {
      ctes.add(
          "__userDenominator",
          "SELECT f.unit_id,\n  "
              + factMetricsSql.aggregate(metric.getDenominator(), "1 = 1", "f.")
              + " AS denominator\nFROM "
              + denominatorCte
              + " f"
              + segmentFilter
              + "\nGROUP BY f.unit_id");
    }

    String value = cappedUnitValue(ctes, metric, "__userMetricOverall", "value");
    StringBuilder capped =
        new StringBuilder("SELECT um.unit_id, ").append(value).append(" AS value");
    if (metric.isRatio()) {
      capped.append(", COALESCE(ud.denominator, 0) AS denominator");
    }
    capped.append("\nFROM __userMetricOverall um");
    if (metric.getCapping().isPercentileCapped()) {
      capped.append("\nCROSS JOIN __capValue cap");
    }
    if (metric.isRatio()) {
      capped.append("\nLEFT JOIN __userDenominator ud ON ud.unit_id = um.unit_id");
    }
    ctes.add("__capped", capped.toString());
    ctes.add(
        "__stats",
        "SELECT MIN(value) AS value_min, MAX(value) AS value_max,\n  (MAX(value) - MIN(value)) / "
            + numBins
            + ".0 AS bin_width\nFROM __capped");

    List<String> bins = new ArrayList<>();
    for (int i = 0; i < numBins; i++) {
      bins.add("SUM(CASE WHEN bin = " + i + " THEN 1 ELSE 0 END) AS units_bin_" + i);
    }
    ctes.add(
        "__histogram",
        "SELECT\n  "
            + String.join(",\n  ", bins)
            + "\nFROM (\n  SELECT CASE WHEN s.bin_width = 0 THEN 0 ELSE LEAST("
            + (numBins - 1)
            + ", FLOOR((c.value - s.value_min) / s.bin_width)) END AS bin\n"
            + "  FROM __capped c\n  CROSS JOIN __stats s\n) b");

    String nullFloat = "CAST(NULL AS " + dialect.floatType() + ")";
    boolean cappedFlag = metric.getCapping().isPercentileCapped()
        || metric.getCapping().isAbsoluteCapped();

    List<String> overall = new ArrayList<>();
    overall.add("CAST(NULL AS " + dialect.stringType() + ") AS date");
    overall.add("'overall' AS data_type");
    overall.add((cappedFlag ? "TRUE" : "FALSE") + " AS capped");
    overall.add("COUNT(*) AS units");
    overall.add("SUM(c.value) AS main_sum");
    overall.add("SUM(c.value * c.value) AS main_sum_squares");
    if (metric.isRatio()) {
      overall.add("SUM(c.denominator) AS denominator_sum");
      overall.add("SUM(c.denominator * c.denominator) AS denominator_sum_squares");
      overall.add("SUM(c.value * c.denominator) AS main_denominator_sum_product");
    }
    overall.add("MAX(s.value_min) AS value_min");
    overall.add("MAX(s.value_max) AS value_max");
    overall.add("MAX(s.bin_width) AS bin_width");
    for (int i = 0; i < numBins; i++) {
      overall.add("MAX(h.units_bin_" + i + ") AS units_bin_" + i);
    }

    List<String> daily = new ArrayList<>();
    daily.add(dialect.formatDate("d.metric_date") + " AS date");
    daily.add("'date' AS data_type");
    daily.add((cappedFlag ? "TRUE" : "FALSE") + " AS capped");
    daily.add("COUNT(*) AS units");
    daily.add("SUM(d.value) AS main_sum");
    daily.add("SUM(d.value * d.value) AS main_sum_squares");
    int padding = overall.size() - daily.size();
    for (int i = 0; i < padding; i++) {
      daily.add(nullFloat);
    }

    return ctes.render(
        "SELECT\n  "
            + String.join(",\n  ", overall)
            + "\nFROM __capped c\nCROSS JOIN __stats s\nCROSS JOIN __histogram h"
            + "\nUNION ALL\nSELECT\n  "
            + String.join(",\n  ", daily)
            + "\nFROM __userMetricDates d\nGROUP BY d.metric_date");
  }

  public String getPastExperimentQuery(PastExperimentParams params) {
    Preconditions.checkArgument(
        !params.getExposureQueries().isEmpty(), "at least one exposure query is required");
    CommonTableExpressions ctes = new CommonTableExpressions();
    List<String> exposures = new ArrayList<>();
    for (int i = 0; i < params.getExposureQueries().size(); i++) {
      ExposureQuery exposureQuery = params.getExposureQueries().get(i);
      String name = "__exposures" + i;
      ctes.add(
          name,
          "SELECT "
              + dialect.escapeLiteral(exposureQuery.getId())
              + " AS exposure_query,\n  "
              + dialect.castToString("e.experiment_id")
              + " AS experiment_id,\n  "
              + dialect.castToString("e.variation_id")
              + " AS variation_id,\n  e.timestamp AS timestamp,\n  e."
              + exposureQuery.getUserIdType()
              + " AS unit_id\nFROM (\n  "
              + templates
                  .compile(exposureQuery.getSql(), params.getFrom(), null)
                  .replace("\n", "\n  ")
              + "\n) e\nWHERE e.timestamp > "
              + dialect.toTimestamp(params.getFrom()));
      exposures.add("SELECT * FROM " + name);
    }
    ctes.add("__exposures", String.join("\nUNION ALL\n", exposures));
    ctes.add(
        "__variations",
        "SELECT exposure_query, experiment_id, variation_id,\n"
            + "  MIN(timestamp) AS start_date,\n"
            + "  MAX(timestamp) AS end_date,\n"
            + "  COUNT(DISTINCT unit_id) AS users\n"
            + "FROM __exposures\nGROUP BY exposure_query, experiment_id, variation_id");
    String nullString = "CAST(NULL AS " + dialect.stringType() + ")";
    return ctes.render(
        "SELECT exposure_query, experiment_id, "
            + nullString
            + " AS experiment_name, variation_id, "
            + nullString
            + " AS variation_name,\n"
            + "  start_date, end_date, users,\n"
            + "  MAX(end_date) OVER (PARTITION BY exposure_query, experiment_id) AS latest_data\n"
            + "FROM __variations\nWHERE users >= "
            + PAST_EXPERIMENT_MIN_UNITS
            + "\nORDER BY start_date DESC, experiment_id, variation_id");
  }

  public String getDimensionSlicesQuery(DimensionSlicesQueryParams params) {
    Preconditions.checkArgument(!params.getDimensions().isEmpty(), "no dimensions requested");
    ExposureQuery exposureQuery = params.getExposureQuery();
    Instant end = params.getEndDate();
    Instant start = end.minus(Duration.ofDays(params.getLookbackDays()));
    CommonTableExpressions ctes = new CommonTableExpressions();

    StringBuilder exposures =
        new StringBuilder("SELECT e.").append(exposureQuery.getUserIdType()).append(" AS unit_id");
    for (int i = 0; i < params.getDimensions().size(); i++) {
      exposures
          .append(",\n  ")
          .append(dialect.castToString("e." + params.getDimensions().get(i).getId()))
          .append(" AS dim_")
          .append(i);
    }
    exposures
        .append("\nFROM (\n  ")
        .append(templates.compile(exposureQuery.getSql(), start, end).replace("\n", "\n  "))
        .append("\n) e\nWHERE e.timestamp >= ")
        .append(dialect.toTimestamp(start))
        .append(" AND e.timestamp <= ")
        .append(dialect.toTimestamp(end));
    ctes.add("__exposures", exposures.toString());
    ctes.add("__total", "SELECT COUNT(DISTINCT unit_id) AS total_units FROM __exposures");

    List<String> slices = new ArrayList<>();
    for (int i = 0; i < params.getDimensions().size(); i++) {
      ExperimentDimension dimension = params.getDimensions().get(i);
      String name = "__dim_" + i;
      ctes.add(
          name,
          "SELECT dim_"
              + i
              + " AS dimension_value, "
              + dialect.escapeLiteral(dimension.getId())
              + " AS dimension_name, COUNT(DISTINCT unit_id) AS units,\n"
              + "  ROW_NUMBER() OVER (ORDER BY COUNT(DISTINCT unit_id) DESC, dim_"
              + i
              + ") AS rn\nFROM __exposures\nGROUP BY dim_"
              + i);
      slices.add(
          "SELECT dimension_value, dimension_name, units FROM "
              + name
              + " WHERE rn <= "
              + MAX_DIMENSION_SLICES);
    }
    return ctes.render(
        "SELECT d.dimension_value, d.dimension_name, d.units, t.total_units\nFROM (\n"
            + String.join("\nUNION ALL\n", slices)
            + "\n) d\nCROSS JOIN __total t\n"
            + "ORDER BY d.dimension_name, d.units DESC, d.dimension_value");
  }

  public String getDropUnitsTableQuery(DropTableQueryParams params) {
    return "DROP TABLE IF EXISTS " + params.getFullTablePath();
  }

  public String getExperimentPipelineCreateUnitsQuery(ExperimentPipelineUnitsParams params) {
    String tableName = params.getTableName();
    return unitsSql.createUnitsTable(tableName, params)
        + STATEMENT_SEPARATOR
        + "CREATE TABLE IF NOT EXISTS "
        + metricsTableName(tableName)
        + " (\n  unit_id "
        + dialect.stringType()
        + ",\n  metric_id "
        + dialect.stringType()
        + ",\n  metric_date "
        + dialect.timestampType()
        + ",\n  value "
        + dialect.floatType()
        + ",\n  denominator_value "
        + dialect.floatType()
        + ",\n  covariate_value "
        + dialect.floatType()
        + "\n)";
  }

  public String getExperimentPipelineUnitsQuery(ExperimentPipelineUnitsParams params) {
    ExperimentSnapshotSettings settings = params.getSettings();
    Instant exposureFrom =
        params.getLookbackDate().isAfter(settings.getStartDate())
            ? params.getLookbackDate()
            : settings.getStartDate();
    CommonTableExpressions ctes = new CommonTableExpressions();
    unitsSql.addExperimentUnits(ctes, params, exposureFrom);
    List<String> columns = ExperimentUnitsSql.unitColumns(params);
    return "INSERT INTO "
        + params.getTableName()
        + " ("
        + String.join(", ", columns)
        + ")\n"
        + ctes.render(
            "SELECT "
                + columns.stream().map(c -> "eu." + c).collect(Collectors.joining(", "))
                + "\nFROM __experimentUnits eu\nWHERE NOT EXISTS (\n  SELECT 1 FROM "
                + params.getTableName()
                + " existing WHERE existing.unit_id = eu.unit_id\n)");
  }

  public String getExperimentPipelineTrimMetricsQuery(ExperimentPipelineTrimMetricsParams params) {
    return "DELETE FROM "
        + metricsTableName(params.getTableName())
        + "\nWHERE metric_date < "
        + dialect.toTimestamp(params.getLookbackDate());
  }

  /**
   * One delete plus insert script per metric group. Rows of the group's metrics at or after the
   * lookback date are replaced; a unit's value is stored per day so that later runs only touch
   * recent days.
   */
  public String getExperimentPipelineFactMetricsQuery(ExperimentPipelineFactMetricsParams params) {
    Preconditions.checkArgument(!params.getMetricGroups().isEmpty(), "no metric groups");
    List<String> statements = new ArrayList<>();
    for (List<FactMetric> group : params.getMetricGroups()) {
      statements.addAll(pipelineFactMetricsGroup(params, group));
    }
    return String.join(STATEMENT_SEPARATOR, statements);
  }

  private List<String> pipelineFactMetricsGroup(
      ExperimentPipelineFactMetricsParams params, List<FactMetric> group) {
    ExperimentSnapshotSettings settings = params.getSettings();
    String metricsTable = metricsTableName(params.getTableName());
    String userIdType = settings.getExposureQuery().getUserIdType();
    List<FactMetricData> metrics = FactMetricDataFactory.create(group, settings);

    double maxRegressionHours = 0;
    for (FactMetricData metric : metrics) {
      maxRegressionHours = Math.max(maxRegressionHours, metric.getRegressionAdjustmentHours());
    }
    Instant factStart =
        params
            .getLookbackDate()
            .minus(Duration.ofSeconds(Math.round(maxRegressionHours * 3600)));

    String delete =
        "DELETE FROM "
            + metricsTable
            + "\nWHERE metric_id IN ("
            + group.stream()
                .map(FactMetric::getId)
                .map(dialect::escapeLiteral)
                .collect(Collectors.joining(", "))
            + ")\n  AND metric_date >= "
            + dialect.toTimestamp(params.getLookbackDate());

    CommonTableExpressions ctes = new CommonTableExpressions();
    List<String> selects = new ArrayList<>();
    for (FactMetricData metric : metrics) {
      FactMetric factMetric = metric.getMetric();
      String numeratorCte =
          factTableCte(
              ctes, params.getFactTables(), factMetric.getNumerator(), userIdType, factStart,
              metric.getMetricEnd());
      if (metric.getQuantileMetric() == QuantileType.EVENT) {
        selects.add(pipelineEventRows(params.getTableName(), numeratorCte, metric, settings));
      } else {
        selects.add(
            pipelineUnitRows(
                params.getTableName(), numeratorCte, metric, factMetric.getNumerator(), false,
                settings));
      }
      if (metric.isRatioMetric()) {
        String denominatorCte =
            factTableCte(
                ctes, params.getFactTables(), factMetric.getDenominator(), userIdType, factStart,
                metric.getMetricEnd());
        selects.add(
            pipelineUnitRows(
                params.getTableName(), denominatorCte, metric, factMetric.getDenominator(), true,
                settings));
      }
    }

    String insert =
        "INSERT INTO "
            + metricsTable
            + " (unit_id, metric_id, metric_date, value, denominator_value, covariate_value)\n"
            + ctes.render(String.join("\nUNION ALL\n", selects));
    return List.of(delete, insert);
  }

  private String pipelineUnitRows(
      String unitsTable,
      String factCte,
      FactMetricData metric,
      ColumnRef column,
      boolean denominator,
      ExperimentSnapshotSettings settings) {
    String nullFloat = "CAST(NULL AS " + dialect.floatType() + ")";
    String window = factMetricsSql.windowCondition(metric, settings);
    String aggregated = factMetricsSql.aggregate(column, window, "f.");
    String covariate =
        !denominator && metric.isRegressionAdjusted()
            ? factMetricsSql.aggregate(column, factMetricsSql.covariateCondition(metric), "f.")
            : nullFloat;
    String date = dialect.dateTrunc("f.timestamp");
    return "SELECT u.unit_id, "
        + dialect.escapeLiteral(metric.getId())
        + " AS metric_id, "
        + date
        + " AS metric_date,\n  "
        + (denominator ? nullFloat : dialect.ensureFloat(aggregated))
        + ",\n  "
        + (denominator ? dialect.ensureFloat(aggregated) : nullFloat)
        + ",\n  "
        + (covariate.equals(nullFloat) ? covariate : dialect.ensureFloat(covariate))
        + "\nFROM "
        + unitsTable
        + " u\nJOIN "
        + factCte
        + " f ON f.unit_id = u.unit_id\nGROUP BY u.unit_id, "
        + date;
  }

  private String pipelineEventRows(
      String unitsTable,
      String factCte,
      FactMetricData metric,
      ExperimentSnapshotSettings settings) {
    ColumnRef numerator = metric.getMetric().getNumerator();
    String value = factMetricsSql.rowValue(numerator, "f.");
    String nullFloat = "CAST(NULL AS " + dialect.floatType() + ")";
    return "SELECT u.unit_id, "
        + dialect.escapeLiteral(metric.getId())
        + " AS metric_id, f.timestamp AS metric_date,\n  "
        + dialect.ensureFloat(value)
        + ", "
        + nullFloat
        + ", "
        + nullFloat
        + "\nFROM "
        + unitsTable
        + " u\nJOIN "
        + factCte
        + " f ON f.unit_id = u.unit_id\nWHERE "
        + factMetricsSql.windowCondition(metric, settings)
        + factMetricsSql.rowFilters(numerator, " AND ")
        + " AND "
        + value
        + " IS NOT NULL";
  }

  public String getExperimentPipelineStatisticsQuery(ExperimentPipelineFactMetricsParams params) {
    List<FactMetric> all =
        params.getMetricGroups().stream().flatMap(List::stream).collect(Collectors.toList());
    Preconditions.checkArgument(!all.isEmpty(), "no metrics");
    List<FactMetricData> metrics = FactMetricDataFactory.create(all, params.getSettings());
    CommonTableExpressions ctes = new CommonTableExpressions();
    unitsSql.addUnits(ctes, params, params.getTableName(), maxHoursToConvert(metrics));
    String select =
        factMetricsSql.aggregate(
            ctes,
            metrics,
            factMetricsSql.metricsTableSource(metricsTableName(params.getTableName())),
            true);
    return ctes.render(select);
  }

  public String getColumnTopValuesQuery(ColumnTopValuesParams params) {
    FactTable factTable = params.getFactTable();
    return "SELECT "
        + dialect.castToString("f." + params.getColumn())
        + " AS value, COUNT(*) AS count\nFROM (\n  "
        + factTable.getSql().replace("\n", "\n  ")
        + "\n) f\nGROUP BY "
        + dialect.castToString("f." + params.getColumn())
        + "\nORDER BY count DESC, value\nLIMIT "
        + params.getLimit();
  }

  public String getTestQuery(TestQueryParams params) {
    Instant end = params.getEndDate();
    Instant start = end.minus(Duration.ofDays(params.getTestDays()));
    return dialect.limit(
        "SELECT * FROM (\n  "
            + templates
                .compile(params.getQuery(), start, end, params.getTemplateVariables())
                .replace("\n", "\n  ")
            + "\n) test_query",
        params.getLimit());
  }

  public String getTestValidityQuery(String query, Instant endDate, Map<String, String> variables) {
    return dialect.limit(
        "SELECT * FROM (\n  "
            + templates
                .compile(query, endDate.minus(Duration.ofDays(30)), endDate, variables)
                .replace("\n", "\n  ")
            + "\n) validity_query",
        1);
  }

  private String unitsSource(
      CommonTableExpressions ctes, ExperimentBaseQueryParams params, boolean useUnitsTable) {
    if (useUnitsTable) {
      Preconditions.checkArgument(
          params.getUnitsTableFullName() != null, "unitsTableFullName is required");
      return params.getUnitsTableFullName();
    }
    unitsSql.addExperimentUnits(ctes, params, params.getSettings().getStartDate());
    return "__experimentUnits";
  }

  private String factTableCte(
      CommonTableExpressions ctes,
      Map<String, FactTable> factTables,
      ColumnRef column,
      String userIdType,
      Instant start,
      Instant end) {
    FactTable factTable = factTables.get(column.getFactTableId());
    if (factTable == null) {
      throw new IllegalArgumentException("Unknown fact table " + column.getFactTableId());
    }
    return unitsSql.addFactTable(ctes, factTable, userIdType, start, end);
  }

  /** Adds {@code __capValue} if needed and returns the capped value expression. */
  private String cappedUnitValue(
      CommonTableExpressions ctes, FactMetric metric, String source, String column) {
    String value = "COALESCE(" + column + ", 0)";
    if (metric.getCapping().isPercentileCapped()) {
      ctes.add(
          "__capValue",
          "SELECT "
              + dialect.percentileCapValue(column, metric.getCapping().getValue())
              + " AS value_cap\nFROM "
              + source
              + (metric.getCapping().isIgnoreZeros() ? "\nWHERE " + column + " <> 0" : ""));
      value = "COALESCE(LEAST(" + column + ", cap.value_cap), 0)";
    } else if (metric.getCapping().isAbsoluteCapped()) {
      value = "COALESCE(LEAST(" + column + ", " + metric.getCapping().getValue() + "), 0)";
    }
    if (metric.isBinomial()) {
      value = "CASE WHEN " + value + " > 0 THEN 1 ELSE 0 END";
    }
    return value;
  }

  private static double maxHoursToConvert(List<FactMetricData> metrics) {
    double max = 0;
    for (FactMetricData metric : metrics) {
      max = Math.max(max, metric.getMaxHoursToConvert());
    }
    return max;
  }
}
