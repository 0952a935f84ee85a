package org.experiment.analysis.warehouse.compiler;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.experiment.analysis.datamodel.dimension.ActivationDimension;
import org.experiment.analysis.datamodel.dimension.DateDimension;
import org.experiment.analysis.datamodel.dimension.Dimension;
import org.experiment.analysis.datamodel.dimension.DimensionVisitor;
import org.experiment.analysis.datamodel.dimension.ExperimentDimension;
import org.experiment.analysis.datamodel.dimension.UserDimension;
import org.experiment.analysis.datamodel.experiment.ExperimentSnapshotSettings;
import org.experiment.analysis.datamodel.experiment.ExposureQuery;
import org.experiment.analysis.datamodel.experiment.Segment;
import org.experiment.analysis.datamodel.experiment.Variation;
import org.experiment.analysis.datamodel.metric.FactMetric;
import org.experiment.analysis.datamodel.metric.FactTable;
import org.experiment.analysis.datamodel.query.ExperimentBaseQueryParams;
import org.experiment.analysis.datamodel.rows.AggregateUnitsRow;

/**
 * Builds the exposure side of experiment queries: one row per unit with its variation, first
 * exposure timestamp and one {@code dim_<n>} column per requested dimension.
 */
class ExperimentUnitsSql {
  static final String MULTIPLE_EXPOSURES = AggregateUnitsRow.MULTIPLE_EXPOSURES;
  static final String NULL_DIMENSION = "__NULL_DIMENSION";
  static final String OTHER_SLICE = "__Other__";

  private final SqlDialect dialect;
  private final SqlTemplates templates;

  ExperimentUnitsSql(SqlDialect dialect, SqlTemplates templates) {
    this.dialect = dialect;
    this.templates = templates;
  }

  static String dimensionName(Dimension dimension) {
    return dimension.accept(
        new DimensionVisitor<String>() {
          @Override
          public String visitUser(UserDimension dimension) {
            return "dim_" + dimension.getDimension().getId();
          }

          @Override
          public String visitExperiment(ExperimentDimension dimension) {
            return "dim_exp_" + dimension.getId();
          }

          @Override
          public String visitDate(DateDimension dimension) {
            return "dim_pre_date";
          }

          @Override
          public String visitActivation(ActivationDimension dimension) {
            return "dim_pre_activation";
          }
        });
  }

  static boolean hasActivationFilter(ExperimentBaseQueryParams params) {
    return params.getActivationMetric() != null
        && params.getDimensions().stream().noneMatch(d -> d instanceof ActivationDimension);
  }

  /** Column list of a materialised units table, in table order. */
  static List<String> unitColumns(ExperimentBaseQueryParams params) {
    List<String> columns =
        new ArrayList<>(List.of("unit_id", "variation", "first_exposure_timestamp"));
    for (int i = 0; i < params.getDimensions().size(); i++) {
      columns.add("dim_" + i);
    }
    if (params.getActivationMetric() != null) {
      columns.add("activated");
    }
    return columns;
  }

  String createUnitsTable(String tableName, ExperimentBaseQueryParams params) {
    List<String> columns = new ArrayList<>();
    columns.add("unit_id " + dialect.stringType());
    columns.add("variation " + dialect.stringType());
    columns.add("first_exposure_timestamp " + dialect.timestampType());
    for (int i = 0; i < params.getDimensions().size(); i++) {
      columns.add("dim_" + i + " " + dialect.stringType());
    }
    if (params.getActivationMetric() != null) {
      columns.add("activated INTEGER");
    }
    return "CREATE TABLE IF NOT EXISTS "
        + tableName
        + " (\n  "
        + String.join(",\n  ", columns)
        + "\n)";
  }

  /**
   * Adds a CTE for a fact table with the user id aliased to {@code unit_id}, bounded by the given
   * timestamps. Returns the CTE name. Callers asking for the same fact table and bounds share one
   * CTE; other bounds get a numbered CTE of their own.
   */
  String addFactTable(
      CommonTableExpressions ctes,
      FactTable factTable,
      String userIdType,
      Instant start,
      Instant end) {
    Map<String, String> variables = new LinkedHashMap<>();
    if (factTable.getEventName() != null) {
      variables.put("eventName", factTable.getEventName());
    }
    StringBuilder body =
        new StringBuilder("SELECT f.*, f.")
            .append(userIdType)
            .append(" AS unit_id\nFROM (\n  ")
            .append(
                templates.compile(factTable.getSql(), start, end, variables).replace("\n", "\n  "))
            .append("\n) f\nWHERE f.timestamp >= ")
            .append(dialect.toTimestamp(start));
    if (end != null) {
      body.append(" AND f.timestamp <= ").append(dialect.toTimestamp(end));
    }

    String baseName = "__f_" + sanitize(factTable.getId());
    String name = baseName;
    for (int i = 1; ctes.contains(name); i++) {
      if (ctes.get(name).equals(body.toString())) {
        return name;
      }
      name = baseName + "_" + i;
    }
    ctes.add(name, body.toString());
    return name;
  }

  void addSegment(CommonTableExpressions ctes, Segment segment, Instant start, Instant end) {
    ctes.add(
        "__segment",
        "SELECT DISTINCT s."
            + segment.getUserIdType()
            + " AS unit_id\nFROM (\n  "
            + templates.compile(segment.getSql(), start, end).replace("\n", "\n  ")
            + "\n) s");
  }

  /**
   * Adds {@code __rawExperiment} and {@code __experimentUnits}, reading exposures from {@code
   * exposureFrom} (usually the experiment start, or a pipeline lookback date) to the end date.
   */
  void addExperimentUnits(
      CommonTableExpressions ctes, ExperimentBaseQueryParams params, Instant exposureFrom) {
    ExperimentSnapshotSettings settings = params.getSettings();
    ExposureQuery exposureQuery = settings.getExposureQuery();
    List<Dimension> dimensions = params.getDimensions();

    StringBuilder raw =
        new StringBuilder("SELECT\n  e.")
            .append(exposureQuery.getUserIdType())
            .append(" AS unit_id,\n  e.timestamp AS timestamp,\n  ")
            .append(dialect.castToString("e.variation_id"))
            .append(" AS variation_id");
    for (int i = 0; i < dimensions.size(); i++) {
      if (dimensions.get(i) instanceof ExperimentDimension) {
        ExperimentDimension dimension = (ExperimentDimension) dimensions.get(i);
        raw.append(",\n  ")
            .append(dialect.castToString("e." + dimension.getId()))
            .append(" AS exp_dim_")
            .append(i);
      }
    }
    raw.append("\nFROM (\n  ")
        .append(
            templates
                .compile(
                    exposureQuery.getSql(),
                    settings.getStartDate(),
                    settings.getEndDate(),
                    Map.of("experimentId", settings.getExperimentId()))
                .replace("\n", "\n  "))
        .append("\n) e\nWHERE e.experiment_id = ")
        .append(dialect.escapeLiteral(settings.getExperimentId()))
        .append("\n  AND e.timestamp >= ")
        .append(dialect.toTimestamp(exposureFrom))
        .append("\n  AND e.timestamp <= ")
        .append(dialect.toTimestamp(settings.getEndDate()));
    if (settings.getQueryFilter() != null && !settings.getQueryFilter().isEmpty()) {
      raw.append("\n  AND (").append(settings.getQueryFilter()).append(")");
    }
    ctes.add("__rawExperiment", raw.toString());

    if (params.getSegment() != null) {
      addSegment(ctes, params.getSegment(), settings.getStartDate(), settings.getEndDate());
    }

    List<String> joins = new ArrayList<>();
    for (int i = 0; i < dimensions.size(); i++) {
      if (dimensions.get(i) instanceof UserDimension) {
        UserDimension dimension = (UserDimension) dimensions.get(i);
        ctes.add(
            "__dim_" + i,
            "SELECT d."
                + dimension.getDimension().getUserIdType()
                + " AS unit_id, MAX("
                + dialect.castToString("d.value")
                + ") AS value\nFROM (\n  "
                + templates
                    .compile(
                        dimension.getDimension().getSql(),
                        settings.getStartDate(),
                        settings.getEndDate())
                    .replace("\n", "\n  ")
                + "\n) d\nGROUP BY d."
                + dimension.getDimension().getUserIdType());
        joins.add("LEFT JOIN __dim_" + i + " d" + i + " ON d" + i + ".unit_id = r.unit_id");
      }
    }

    FactMetric activationMetric = params.getActivationMetric();
    if (activationMetric == null
        && dimensions.stream().anyMatch(d -> d instanceof ActivationDimension)) {
      throw new IllegalArgumentException("Activation dimension requires an activation metric");
    }
    if (activationMetric != null) {
      FactTable factTable =
          params.getFactTables().get(activationMetric.getNumerator().getFactTableId());
      if (factTable == null) {
        throw new IllegalArgumentException(
            "Unknown fact table for activation metric " + activationMetric.getId());
      }
      String factCte =
          addFactTable(
              ctes,
              factTable,
              exposureQuery.getUserIdType(),
              settings.getStartDate(),
              settings.getEndDate());
      List<String> filters = activationMetric.getNumerator().getRowFilters();
      ctes.add(
          "__activation",
          "SELECT f.unit_id, MAX(f.timestamp) AS activation_timestamp\nFROM "
              + factCte
              + " f"
              + (filters.isEmpty()
                  ? ""
                  : "\nWHERE "
                      + filters.stream()
                          .map(f -> "(" + f + ")")
                          .collect(Collectors.joining(" AND ")))
              + "\nGROUP BY f.unit_id");
      joins.add("LEFT JOIN __activation a ON a.unit_id = r.unit_id");
    }

    StringBuilder units =
        new StringBuilder("SELECT\n  r.unit_id AS unit_id,\n  ")
            .append("CASE WHEN COUNT(DISTINCT r.variation_id) > 1 THEN ")
            .append(dialect.escapeLiteral(MULTIPLE_EXPOSURES))
            .append(" ELSE MAX(r.variation_id) END AS variation,\n")
            .append("  MIN(r.timestamp) AS first_exposure_timestamp");
    for (int i = 0; i < dimensions.size(); i++) {
      units
          .append(",\n  ")
          .append(dimensionExpression(dimensions.get(i), i))
          .append(" AS dim_")
          .append(i);
    }
    if (activationMetric != null) {
      units.append(",\n  ").append(activatedExpression()).append(" AS activated");
    }
    units.append("\nFROM __rawExperiment r");
    for (String join : joins) {
      units.append('\n').append(join);
    }
    if (params.getSegment() != null) {
      units.append("\nWHERE r.unit_id IN (SELECT s.unit_id FROM __segment s)");
    }
    units.append("\nGROUP BY r.unit_id");
    ctes.add("__experimentUnits", units.toString());
  }

  /**
   * Adds {@code __units}: the analysable units with a single {@code dimension} column taken from
   * the first requested dimension.
   */
  void addUnits(
      CommonTableExpressions ctes,
      ExperimentBaseQueryParams params,
      String unitsSource,
      double maxHoursToConvert) {
    ExperimentSnapshotSettings settings = params.getSettings();
    String dimension =
        params.getDimensions().isEmpty()
            ? "'All'"
            : "COALESCE(eu.dim_0, " + dialect.escapeLiteral(NULL_DIMENSION) + ")";

    StringBuilder units =
        new StringBuilder(
                "SELECT eu.unit_id, eu.variation, eu.first_exposure_timestamp, ")
            .append(dimension)
            .append(" AS dimension\nFROM ")
            .append(unitsSource)
            .append(" eu\nWHERE eu.variation <> ")
            .append(dialect.escapeLiteral(MULTIPLE_EXPOSURES));
    if (!settings.getVariations().isEmpty()) {
      units
          .append("\n  AND eu.variation IN (")
          .append(
              settings.getVariations().stream()
                  .map(Variation::getId)
                  .map(dialect::escapeLiteral)
                  .collect(Collectors.joining(", ")))
          .append(")");
    }
    if (hasActivationFilter(params)) {
      units.append("\n  AND eu.activated = 1");
    }
    if (settings.isSkipPartialData() && maxHoursToConvert > 0) {
      units
          .append("\n  AND eu.first_exposure_timestamp <= ")
          .append(
              dialect.addHours(
                  dialect.toTimestamp(settings.getEndDate()), -maxHoursToConvert));
    }
    ctes.add("__units", units.toString());
  }

  private String dimensionExpression(Dimension dimension, int index) {
    return dimension.accept(
        new DimensionVisitor<String>() {
          @Override
          public String visitUser(UserDimension dimension) {
            return "MAX(d" + index + ".value)";
          }

          @Override
          public String visitExperiment(ExperimentDimension dimension) {
            String value = "MIN(r.exp_dim_" + index + ")";
            if (dimension.getSpecifiedSlices().isEmpty()) {
              return value;
            }
            return "CASE WHEN "
                + value
                + " IN ("
                + dimension.getSpecifiedSlices().stream()
                    .map(dialect::escapeLiteral)
                    .collect(Collectors.joining(", "))
                + ") THEN "
                + value
                + " ELSE "
                + dialect.escapeLiteral(OTHER_SLICE)
                + " END";
          }

          @Override
          public String visitDate(DateDimension dimension) {
            return dialect.formatDate(dialect.dateTrunc("MIN(r.timestamp)"));
          }

          @Override
          public String visitActivation(ActivationDimension dimension) {
            return "CASE WHEN "
                + activatedExpression()
                + " = 1 THEN 'Activated' ELSE 'Not Activated' END";
          }
        });
  }

  private String activatedExpression() {
    return "MAX(CASE WHEN a.activation_timestamp >= r.timestamp THEN 1 ELSE 0 END)";
  }

  static String sanitize(String id) {
    return id.replaceAll("[^A-Za-z0-9_]", "_");
  }
}
