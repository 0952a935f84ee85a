package org.experiment.analysis.datamodel.query;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DropTableQueryParams {
  String fullTablePath;
}
