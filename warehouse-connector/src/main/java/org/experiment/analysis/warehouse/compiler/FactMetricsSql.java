package org.experiment.analysis.warehouse.compiler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.experiment.analysis.datamodel.experiment.AttributionModel;
import org.experiment.analysis.datamodel.experiment.ExperimentSnapshotSettings;
import org.experiment.analysis.datamodel.metric.CappingSettings;
import org.experiment.analysis.datamodel.metric.ColumnAggregation;
import org.experiment.analysis.datamodel.metric.ColumnRef;
import org.experiment.analysis.datamodel.metric.FactMetric;
import org.experiment.analysis.datamodel.metric.FactMetricData;
import org.experiment.analysis.datamodel.metric.FactTable;
import org.experiment.analysis.datamodel.metric.MetricWindow;
import org.experiment.analysis.datamodel.metric.QuantileSettings;
import org.experiment.analysis.datamodel.metric.QuantileType;
import org.experiment.analysis.datamodel.metric.WindowType;

/**
 * Per-metric SQL: unit level values, capping, quantile estimation and the final aggregation per
 * (variation, dimension).
 *
 * <p>Every metric {@code mN} contributes a CTE {@code __mN} with the columns {@code unit_id},
 * {@code mN_value}, {@code mN_denominator} and {@code mN_covariate}. Where those values come from
 * is decided by a {@link MetricValueSource}.
 */
class FactMetricsSql {
  // z value of the two sided 95% interval used for quantile bounds
  private static final double QUANTILE_Z = 1.96;

  private final SqlDialect dialect;
  private final ExperimentUnitsSql unitsSql;

  FactMetricsSql(SqlDialect dialect, ExperimentUnitsSql unitsSql) {
    this.dialect = dialect;
    this.unitsSql = unitsSql;
  }

  interface MetricValueSource {
    /** Adds {@code __<alias>} with one row per unit. */
    void addUnitValues(CommonTableExpressions ctes, FactMetricData metric);

    /** Adds {@code __<alias>_events} with one row per event, for event quantiles. */
    void addEventValues(CommonTableExpressions ctes, FactMetricData metric);
  }

  /** Reads metric values straight from fact tables, joined to {@code __units}. */
  MetricValueSource factTableSource(
      ExperimentSnapshotSettings settings, Map<String, FactTable> factTables) {
    return new MetricValueSource() {
      @Override
      public void addUnitValues(CommonTableExpressions ctes, FactMetricData metric) {
        String alias = metric.getAlias();
        FactMetric factMetric = metric.getMetric();
        String userIdType = settings.getExposureQuery().getUserIdType();

        String numeratorCte =
            addFactTable(ctes, factTables, factMetric.getNumerator(), userIdType, metric);
        StringBuilder numerator =
            new StringBuilder("SELECT u.unit_id,\n  ")
                .append(
                    aggregate(
                        factMetric.getNumerator(), windowCondition(metric, settings), "f."))
                .append(" AS ")
                .append(alias)
                .append("_value");
        if (metric.isRegressionAdjusted()) {
          numerator
              .append(",\n  ")
              .append(
                  aggregate(
                      factMetric.getNumerator(),
                      covariateCondition(metric),
                      "f."))
              .append(" AS ")
              .append(alias)
              .append("_covariate");
        }
        numerator
            .append("\nFROM __units u\nJOIN ")
            .append(numeratorCte)
            .append(" f ON f.unit_id = u.unit_id\nGROUP BY u.unit_id");
        ctes.add("__" + alias + "_num", numerator.toString());

        if (metric.isRatioMetric()) {
          String denominatorCte =
              addFactTable(ctes, factTables, factMetric.getDenominator(), userIdType, metric);
          ctes.add(
              "__" + alias + "_den",
              "SELECT u.unit_id,\n  "
                  + aggregate(
                      factMetric.getDenominator(), windowCondition(metric, settings), "f.")
                  + " AS "
                  + alias
                  + "_denominator\nFROM __units u\nJOIN "
                  + denominatorCte
                  + " f ON f.unit_id = u.unit_id\nGROUP BY u.unit_id");
        }

        StringBuilder combined =
            new StringBuilder("SELECT u.unit_id,\n  n.")
                .append(alias)
                .append("_value,\n  ")
                .append(metric.isRatioMetric() ? "d." + alias + "_denominator" : nullFloat())
                .append(" AS ")
                .append(alias)
                .append("_denominator,\n  ")
                .append(metric.isRegressionAdjusted() ? "n." + alias + "_covariate" : nullFloat())
                .append(" AS ")
                .append(alias)
                .append("_covariate\nFROM __units u\nLEFT JOIN __")
                .append(alias)
                .append("_num n ON n.unit_id = u.unit_id");
        if (metric.isRatioMetric()) {
          combined
              .append("\nLEFT JOIN __")
              .append(alias)
              .append("_den d ON d.unit_id = u.unit_id");
        }
        ctes.add("__" + alias, combined.toString());
      }

      @Override
      public void addEventValues(CommonTableExpressions ctes, FactMetricData metric) {
        ColumnRef numerator = metric.getMetric().getNumerator();
        String factCte =
            addFactTable(
                ctes, factTables, numerator, settings.getExposureQuery().getUserIdType(), metric);
        String value = "f." + numerator.getColumn();
        ctes.add(
            "__" + metric.getAlias() + "_events",
            "SELECT u.variation, u.dimension, "
                + dialect.ensureFloat(value)
                + " AS value\nFROM __units u\nJOIN "
                + factCte
                + " f ON f.unit_id = u.unit_id\nWHERE "
                + windowCondition(metric, settings)
                + rowFilters(numerator, " AND ")
                + "\n  AND "
                + value
                + " IS NOT NULL");
      }
    };
  }

  /** Reads per-unit values back from a pipeline metrics table. */
  MetricValueSource metricsTableSource(String metricsTable) {
    return new MetricValueSource() {
      @Override
      public void addUnitValues(CommonTableExpressions ctes, FactMetricData metric) {
        String alias = metric.getAlias();
        ColumnRef numerator = metric.getMetric().getNumerator();
        String reaggregate =
            numerator.isDistinctUsers() || numerator.getAggregation() == ColumnAggregation.MAX
                ? "MAX"
                : "SUM";
        ctes.add(
            "__" + alias,
            "SELECT m.unit_id,\n  "
                + reaggregate
                + "(m.value) AS "
                + alias
                + "_value,\n  SUM(m.denominator_value) AS "
                + alias
                + "_denominator,\n  SUM(m.covariate_value) AS "
                + alias
                + "_covariate\nFROM "
                + metricsTable
                + " m\nWHERE m.metric_id = "
                + dialect.escapeLiteral(metric.getId())
                + "\nGROUP BY m.unit_id");
      }

      @Override
      public void addEventValues(CommonTableExpressions ctes, FactMetricData metric) {
        ctes.add(
            "__" + metric.getAlias() + "_events",
            "SELECT u.variation, u.dimension, m.value AS value\nFROM __units u\nJOIN "
                + metricsTable
                + " m ON m.unit_id = u.unit_id\nWHERE m.metric_id = "
                + dialect.escapeLiteral(metric.getId())
                + " AND m.value IS NOT NULL");
      }
    };
  }

  /**
   * Adds every per-metric CTE and returns the final select. With {@code prefixColumns} statistic
   * columns are named {@code <alias>_main_sum}, otherwise {@code main_sum}.
   */
  String aggregate(
      CommonTableExpressions ctes,
      List<FactMetricData> metrics,
      MetricValueSource source,
      boolean prefixColumns) {
    for (FactMetricData metric : metrics) {
      source.addUnitValues(ctes, metric);
      addCappedValues(ctes, metric);
      if (metric.isQuantile()) {
        if (metric.getQuantileMetric() == QuantileType.EVENT) {
          source.addEventValues(ctes, metric);
        }
        addQuantileStatistics(ctes, metric);
      }
    }

    List<String> columns = new ArrayList<>();
    columns.add("u.variation AS variation");
    columns.add("u.dimension AS dimension");
    columns.add("COUNT(*) AS users");
    columns.add("COUNT(*) AS count");
    StringBuilder joins = new StringBuilder();
    for (FactMetricData metric : metrics) {
      String alias = metric.getAlias();
      String prefix = prefixColumns ? alias + "_" : "";
      String c = "c_" + alias;
      String value = c + "." + alias + "_value";
      if (metric.isPercentileCapped()) {
        columns.add("MAX(" + c + "." + alias + "_value_cap) AS " + prefix + "main_cap_value");
      }
      columns.add("SUM(" + value + ") AS " + prefix + "main_sum");
      columns.add("SUM(" + value + " * " + value + ") AS " + prefix + "main_sum_squares");
      if (metric.isRatioMetric()) {
        String denominator = c + "." + alias + "_denominator";
        columns.add("SUM(" + denominator + ") AS " + prefix + "denominator_sum");
        columns.add(
            "SUM(" + denominator + " * " + denominator + ") AS "
                + prefix
                + "denominator_sum_squares");
        columns.add(
            "SUM(" + value + " * " + denominator + ") AS "
                + prefix
                + "main_denominator_sum_product");
      }
      if (metric.isRegressionAdjusted()) {
        String covariate = c + "." + alias + "_covariate";
        columns.add("SUM(" + covariate + ") AS " + prefix + "covariate_sum");
        columns.add(
            "SUM(" + covariate + " * " + covariate + ") AS " + prefix + "covariate_sum_squares");
        columns.add(
            "SUM(" + value + " * " + covariate + ") AS " + prefix + "main_covariate_sum_product");
      }
      joins
          .append("\nLEFT JOIN __")
          .append(alias)
          .append("_c ")
          .append(c)
          .append(" ON ")
          .append(c)
          .append(".unit_id = u.unit_id");
      if (metric.isQuantile()) {
        String q = "q_" + alias;
        for (String statistic :
            List.of(
                "quantile", "quantile_n", "quantile_lower", "quantile_upper", "quantile_nstar")) {
          columns.add("MAX(" + q + "." + statistic + ") AS " + prefix + statistic);
        }
        joins
            .append("\nLEFT JOIN __")
            .append(alias)
            .append("_q ")
            .append(q)
            .append(" ON ")
            .append(q)
            .append(".variation = u.variation AND ")
            .append(q)
            .append(".dimension = u.dimension");
      }
    }

    return "SELECT\n  "
        + String.join(",\n  ", columns)
        + "\nFROM __units u"
        + joins
        + "\nGROUP BY u.variation, u.dimension\nORDER BY u.variation, u.dimension";
  }

  private void addCappedValues(CommonTableExpressions ctes, FactMetricData metric) {
    String alias = metric.getAlias();
    CappingSettings capping = metric.getMetric().getCapping();
    if (metric.isPercentileCapped()) {
      StringBuilder cap =
          new StringBuilder("SELECT\n  ")
              .append(dialect.percentileCapValue(alias + "_value", capping.getValue()))
              .append(" AS ")
              .append(alias)
              .append("_value_cap");
      if (metric.isRatioMetric()) {
        cap.append(",\n  ")
            .append(dialect.percentileCapValue(alias + "_denominator", capping.getValue()))
            .append(" AS ")
            .append(alias)
            .append("_denominator_cap");
      }
      cap.append("\nFROM __").append(alias);
      if (capping.isIgnoreZeros()) {
        cap.append("\nWHERE ").append(alias).append("_value <> 0");
      }
      ctes.add("__" + alias + "_cap", cap.toString());
    }

    StringBuilder capped =
        new StringBuilder("SELECT\n  u.unit_id,\n  u.variation,\n  u.dimension,\n  ")
            .append(metric.getCapCoalesceMetric())
            .append(" AS ")
            .append(alias)
            .append("_value");
    if (metric.isRatioMetric()) {
      capped
          .append(",\n  ")
          .append(metric.getCapCoalesceDenominator())
          .append(" AS ")
          .append(alias)
          .append("_denominator");
    }
    if (metric.isRegressionAdjusted()) {
      capped
          .append(",\n  ")
          .append(metric.getCapCoalesceCovariate())
          .append(" AS ")
          .append(alias)
          .append("_covariate");
    }
    if (metric.isPercentileCapped()) {
      capped.append(",\n  ").append(alias).append("_value_cap");
    }
    capped
        .append("\nFROM __units u\nLEFT JOIN __")
        .append(alias)
        .append(" ON __")
        .append(alias)
        .append(".unit_id = u.unit_id");
    if (metric.isPercentileCapped()) {
      capped.append("\nCROSS JOIN __").append(alias).append("_cap");
    }
    ctes.add("__" + alias + "_c", capped.toString());
  }

  /**
   * Rank based quantile estimate: the value at rank {@code ceil(n * q)} with a normal
   * approximation interval around that rank for the lower and upper bounds.
   */
  private void addQuantileStatistics(CommonTableExpressions ctes, FactMetricData metric) {
    String alias = metric.getAlias();
    QuantileSettings settings = metric.getMetric().getQuantileSettings();
    double q = settings.getQuantile();
    String source =
        metric.getQuantileMetric() == QuantileType.EVENT
            ? "SELECT variation, dimension, value FROM __" + alias + "_events"
            : "SELECT variation, dimension, " + alias + "_value AS value FROM __" + alias + "_c";

    ctes.add(
        "__" + alias + "_qrank",
        "SELECT variation, dimension, value,\n"
            + "  ROW_NUMBER() OVER (PARTITION BY variation, dimension ORDER BY value) AS rn,\n"
            + "  COUNT(*) OVER (PARTITION BY variation, dimension) AS n\n"
            + "FROM (\n  "
            + source
            + "\n) qs"
            + (settings.isIgnoreZeros() ? "\nWHERE value <> 0" : ""));

    String spread = QUANTILE_Z + " * SQRT(n * " + q + " * (1 - " + q + "))";
    ctes.add(
        "__" + alias + "_q",
        "SELECT variation, dimension,\n"
            + "  MIN(CASE WHEN rn >= CEIL(n * "
            + q
            + ") THEN value END) AS quantile,\n"
            + "  MAX(n) AS quantile_n,\n"
            + "  MIN(CASE WHEN rn >= GREATEST(1, FLOOR(n * "
            + q
            + " - "
            + spread
            + ")) THEN value END) AS quantile_lower,\n"
            + "  MIN(CASE WHEN rn >= LEAST(n, CEIL(n * "
            + q
            + " + "
            + spread
            + ")) THEN value END) AS quantile_upper,\n"
            + "  MAX(n) AS quantile_nstar\n"
            + "FROM __"
            + alias
            + "_qrank\nGROUP BY variation, dimension");
  }

  private String addFactTable(
      CommonTableExpressions ctes,
      Map<String, FactTable> factTables,
      ColumnRef column,
      String userIdType,
      FactMetricData metric) {
    FactTable factTable = factTables.get(column.getFactTableId());
    if (factTable == null) {
      throw new IllegalArgumentException(
          "Unknown fact table " + column.getFactTableId() + " for metric " + metric.getId());
    }
    return unitsSql.addFactTable(
        ctes, factTable, userIdType, metric.getMetricStart(), metric.getMetricEnd());
  }

  /** Unit level aggregation of a column, counting only rows that match {@code condition}. */
  String aggregate(ColumnRef column, String condition, String tablePrefix) {
    String when = condition + rowFilters(column, " AND ");
    if (column.isCount()) {
      return "COUNT(CASE WHEN " + when + " THEN 1 END)";
    }
    if (column.isDistinctUsers()) {
      return "MAX(CASE WHEN " + when + " THEN 1 ELSE 0 END)";
    }
    String value = "CASE WHEN " + when + " THEN " + tablePrefix + column.getColumn() + " END";
    switch (column.getAggregation()) {
      case MAX:
        return "MAX(" + value + ")";
      case COUNT_DISTINCT:
        return "COUNT(DISTINCT " + value + ")";
      case SUM:
      default:
        return "SUM(" + dialect.ensureFloat(value) + ")";
    }
  }

  /** Row level value of a column, used where rows are stored before unit aggregation. */
  String rowValue(ColumnRef column, String tablePrefix) {
    if (column.isCount() || column.isDistinctUsers()) {
      return "1";
    }
    return tablePrefix + column.getColumn();
  }

  String rowFilters(ColumnRef column, String leadingSeparator) {
    if (column.getRowFilters().isEmpty()) {
      return "";
    }
    return leadingSeparator
        + column.getRowFilters().stream()
            .map(filter -> "(" + filter + ")")
            .collect(Collectors.joining(" AND "));
  }

  /** Rows counted towards a unit's metric value, relative to its first exposure. */
  String windowCondition(FactMetricData metric, ExperimentSnapshotSettings settings) {
    MetricWindow window = metric.getMetric().getWindow();
    String firstExposure = "u.first_exposure_timestamp";
    StringBuilder condition =
        new StringBuilder("f.timestamp >= ")
            .append(dialect.addHours(firstExposure, window.getDelayHours()));
    if (window.getType() == WindowType.CONVERSION
        && settings.getAttributionModel() == AttributionModel.FIRST_EXPOSURE) {
      condition
          .append(" AND f.timestamp <= ")
          .append(
              dialect.addHours(firstExposure, window.getDelayHours() + window.getWindowHours()));
    } else if (window.getType() == WindowType.LOOKBACK) {
      condition
          .append(" AND f.timestamp >= ")
          .append(
              dialect.addHours(
                  dialect.toTimestamp(settings.getEndDate()), -window.getWindowHours()));
    }
    Instant end = metric.getMetricEnd();
    condition.append(" AND f.timestamp <= ").append(dialect.toTimestamp(end));
    return condition.toString();
  }

  String covariateCondition(FactMetricData metric) {
    String firstExposure = "u.first_exposure_timestamp";
    return "f.timestamp >= "
        + dialect.addHours(firstExposure, -metric.getRegressionAdjustmentHours())
        + " AND f.timestamp < "
        + firstExposure;
  }

  private String nullFloat() {
    return "CAST(NULL AS " + dialect.floatType() + ")";
  }
}
