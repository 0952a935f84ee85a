package org.experiment.analysis.datamodel.rows;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InformationSchemaTable {
  String databaseName;
  String schemaName;
  String tableName;
  String path;
  int numOfColumns;
}
