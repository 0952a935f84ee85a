package org.experiment.analysis.datamodel.experiment;

import lombok.Builder;
import lombok.Value;

/** User attribute definition: SQL returning {@code <userIdType>, value}. */
@Value
@Builder
public class DimensionDefinition {
  String id;
  String name;
  String sql;
  String userIdType;
}
