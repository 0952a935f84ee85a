package org.experiment.analysis.warehouse.capability;

import java.util.List;
import java.util.Map;
import org.experiment.analysis.datamodel.rows.InformationSchemaColumn;
import org.experiment.analysis.datamodel.rows.InformationSchemaTable;

public interface SchemaInspectable {

  List<InformationSchemaTable> getInformationSchema();

  List<InformationSchemaColumn> getTableColumns(String databaseName, String schema, String table);

  List<Map<String, Object>> getTableData(String databaseName, String schema, String table);
}
