package org.experiment.analysis.datamodel.rows;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InformationSchemaColumn {
  String columnName;
  String dataType;
}
