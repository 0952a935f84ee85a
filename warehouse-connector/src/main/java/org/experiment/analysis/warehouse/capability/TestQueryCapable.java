package org.experiment.analysis.warehouse.capability;

import java.time.Instant;
import java.util.Map;
import org.experiment.analysis.datamodel.query.TestQueryParams;
import org.experiment.analysis.datamodel.rows.TestQueryResult;

public interface TestQueryCapable {

  String getTestQuery(TestQueryParams params);

  String getTestValidityQuery(String query, Instant endDate, Map<String, String> variables);

  TestQueryResult runTestQuery(String sql);
}
