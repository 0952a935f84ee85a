package org.experiment.analysis.warehouse;

import org.experiment.analysis.warehouse.capability.AutoMetricDiscoverable;
import org.experiment.analysis.warehouse.capability.ColumnTopValuesCapable;
import org.experiment.analysis.warehouse.capability.DialectReporting;
import org.experiment.analysis.warehouse.capability.QueryCancellable;
import org.experiment.analysis.warehouse.capability.SchemaInspectable;
import org.experiment.analysis.warehouse.capability.TestQueryCapable;

/** Optional connector features, each backed by one capability interface. */
public enum ConnectorCapability {
  SCHEMA_INSPECTION(SchemaInspectable.class),
  COLUMN_TOP_VALUES(ColumnTopValuesCapable.class),
  AUTO_METRICS(AutoMetricDiscoverable.class),
  TEST_QUERY(TestQueryCapable.class),
  QUERY_CANCELLATION(QueryCancellable.class),
  FORMAT_DIALECT(DialectReporting.class);

  private final Class<?> capabilityType;

  ConnectorCapability(Class<?> capabilityType) {
    this.capabilityType = capabilityType;
  }

  public Class<?> getCapabilityType() {
    return capabilityType;
  }
}
