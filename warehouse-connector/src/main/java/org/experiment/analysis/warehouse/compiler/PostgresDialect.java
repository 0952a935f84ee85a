package org.experiment.analysis.warehouse.compiler;

public class PostgresDialect extends SqlDialect {
  private final boolean redshift;

  public PostgresDialect() {
    this(false);
  }

  public PostgresDialect(boolean redshift) {
    this.redshift = redshift;
  }

  @Override
  public String formatDialect() {
    return redshift ? "redshift" : "postgresql";
  }

  @Override
  public String floatType() {
    return redshift ? "FLOAT" : "DOUBLE PRECISION";
  }

  @Override
  public String stringType() {
    return redshift ? "VARCHAR(256)" : "VARCHAR";
  }

  @Override
  public String formatDate(String column) {
    return "to_char(" + column + ", 'YYYY-MM-DD')";
  }
}
