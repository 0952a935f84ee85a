package org.experiment.analysis.datamodel.metric;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Reference to a column of a fact table together with the aggregation applied per unit. Two
 * special column names are understood: {@link #COUNT} counts fact rows and {@link
 * #DISTINCT_USERS} yields 1 for every unit with at least one matching row.
 */
@Value
@Builder
@Jacksonized
public class ColumnRef {
  public static final String COUNT = "$$count";
  public static final String DISTINCT_USERS = "$$distinctUsers";

  String factTableId;
  String column;
  @Builder.Default ColumnAggregation aggregation = ColumnAggregation.SUM;
  @Singular List<String> rowFilters;

  public boolean isCount() {
    return COUNT.equals(column);
  }

  public boolean isDistinctUsers() {
    return DISTINCT_USERS.equals(column);
  }
}
