package org.experiment.analysis.warehouse.compiler;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.lang3.StringUtils;

/**
 * Replaces {@code {{name}}} placeholders in user supplied SQL. Dates are rendered in UTC so that
 * the same inputs always produce the same text.
 */
public class SqlTemplates {
  private final SqlDialect dialect;

  public SqlTemplates(SqlDialect dialect) {
    this.dialect = dialect;
  }

  public String compile(
      String sql, Instant startDate, Instant endDate, Map<String, String> extraVariables) {
    Map<String, String> variables = new LinkedHashMap<>();
    if (startDate != null) {
      variables.put("startDateUnix", String.valueOf(startDate.getEpochSecond()));
      variables.put("startDate", dialect.formatTimestamp(startDate));
      variables.put("startYear", dialect.formatTimestamp(startDate).substring(0, 4));
    }
    if (endDate != null) {
      variables.put("endDateUnix", String.valueOf(endDate.getEpochSecond()));
      variables.put("endDate", dialect.formatTimestamp(endDate));
      variables.put("endYear", dialect.formatTimestamp(endDate).substring(0, 4));
    }
    variables.putAll(extraVariables);

    String compiled = sql;
    for (Map.Entry<String, String> variable : variables.entrySet()) {
      compiled =
          StringUtils.replace(compiled, "{{" + variable.getKey() + "}}", variable.getValue());
      compiled =
          StringUtils.replace(compiled, "{{ " + variable.getKey() + " }}", variable.getValue());
    }
    return compiled;
  }

  public String compile(String sql, Instant startDate, Instant endDate) {
    return compile(sql, startDate, endDate, Map.of());
  }
}
