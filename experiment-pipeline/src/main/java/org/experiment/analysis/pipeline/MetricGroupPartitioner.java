package org.experiment.analysis.pipeline;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.experiment.analysis.datamodel.metric.FactMetric;

/**
 * Splits metrics into the groups computed by one statement each. Metrics reading the same fact
 * table share a group so that the table is scanned once, up to {@code maxGroupSize} metrics.
 */
public class MetricGroupPartitioner {
  public static final int DEFAULT_MAX_GROUP_SIZE = 20;

  private final int maxGroupSize;

  public MetricGroupPartitioner() {
    this(DEFAULT_MAX_GROUP_SIZE);
  }

  public MetricGroupPartitioner(int maxGroupSize) {
    Preconditions.checkArgument(maxGroupSize > 0, "maxGroupSize must be positive");
    this.maxGroupSize = maxGroupSize;
  }

  public List<List<FactMetric>> partition(List<FactMetric> metrics) {
    Map<String, List<FactMetric>> byFactTable = new LinkedHashMap<>();
    for (FactMetric metric : metrics) {
      byFactTable
          .computeIfAbsent(metric.getNumerator().getFactTableId(), k -> new ArrayList<>())
          .add(metric);
    }

    List<List<FactMetric>> groups = new ArrayList<>();
    for (List<FactMetric> sameTable : byFactTable.values()) {
      for (List<FactMetric> group : Lists.partition(sameTable, maxGroupSize)) {
        groups.add(List.copyOf(group));
      }
    }
    return groups;
  }
}
