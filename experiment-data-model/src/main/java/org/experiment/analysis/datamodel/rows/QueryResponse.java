package org.experiment.analysis.datamodel.rows;

import java.util.List;
import java.util.Optional;
import lombok.Value;

@Value
public class QueryResponse<T> {
  List<T> rows;
  QueryStatistics statistics;

  public QueryResponse(List<T> rows, QueryStatistics statistics) {
    this.rows = List.copyOf(rows);
    this.statistics = statistics;
  }

  public static <T> QueryResponse<T> empty(QueryStatistics statistics) {
    return new QueryResponse<>(List.of(), statistics);
  }

  public Optional<QueryStatistics> getStatisticsIfPresent() {
    return Optional.ofNullable(statistics);
  }
}
