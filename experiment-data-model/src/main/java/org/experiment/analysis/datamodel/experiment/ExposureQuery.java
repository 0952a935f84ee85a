package org.experiment.analysis.datamodel.experiment;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * SQL returning one row per exposure with columns {@code <userIdType>}, {@code timestamp},
 * {@code experiment_id}, {@code variation_id} and one column per listed dimension.
 */
@Value
@Builder
@Jacksonized
public class ExposureQuery {
  String id;
  String name;
  String userIdType;
  String sql;
  @Singular List<String> dimensions;
}
