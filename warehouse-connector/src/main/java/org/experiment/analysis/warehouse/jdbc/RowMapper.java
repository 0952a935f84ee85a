package org.experiment.analysis.warehouse.jdbc;

import java.util.Map;

/** Maps one result row, keyed by lower case column label, to a typed row. */
@FunctionalInterface
public interface RowMapper<T> {
  T map(Map<String, Object> row);
}
