package org.experiment.analysis.datamodel.metric;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** A warehouse table (or SQL snippet) holding event-level fact rows. */
@Value
@Builder
@Jacksonized
public class FactTable {
  String id;
  String name;
  String sql;
  @Singular List<String> userIdTypes;
  String eventName;
}
