package org.experiment.analysis.warehouse.capability;

import org.experiment.analysis.datamodel.query.ColumnTopValuesParams;
import org.experiment.analysis.datamodel.rows.ColumnTopValuesRow;
import org.experiment.analysis.warehouse.QueryJob;

public interface ColumnTopValuesCapable {

  String getColumnTopValuesQuery(ColumnTopValuesParams params);

  QueryJob<ColumnTopValuesRow> runColumnTopValuesQuery(String sql);
}
