package org.experiment.analysis.warehouse.exception;

import java.util.List;

/** Required connection parameters are absent from the datasource configuration. */
public class MissingDatasourceParamsException extends RuntimeException {
  private final List<String> missingParams;

  public MissingDatasourceParamsException(String datasourceId, List<String> missingParams) {
    super(
        "Datasource "
            + datasourceId
            + " is missing required connection params: "
            + String.join(", ", missingParams));
    this.missingParams = List.copyOf(missingParams);
  }

  public List<String> getMissingParams() {
    return missingParams;
  }
}
