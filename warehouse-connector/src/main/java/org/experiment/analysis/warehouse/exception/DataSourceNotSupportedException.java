package org.experiment.analysis.warehouse.exception;

public class DataSourceNotSupportedException extends RuntimeException {

  public DataSourceNotSupportedException(String message) {
    super(message);
  }
}
