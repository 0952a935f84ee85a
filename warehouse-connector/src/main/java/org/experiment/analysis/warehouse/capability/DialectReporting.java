package org.experiment.analysis.warehouse.capability;

public interface DialectReporting {

  String getFormatDialect();
}
