package org.experiment.analysis.warehouse.compiler;

public class DuckDbDialect extends SqlDialect {

  @Override
  public String formatDialect() {
    return "duckdb";
  }

  @Override
  public String floatType() {
    return "DOUBLE";
  }

  @Override
  public String formatDate(String column) {
    return "strftime(" + column + ", '%Y-%m-%d')";
  }
}
