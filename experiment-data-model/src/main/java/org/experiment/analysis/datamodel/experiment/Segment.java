package org.experiment.analysis.datamodel.experiment;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class Segment {
  String id;
  String sql;
  String userIdType;
}
