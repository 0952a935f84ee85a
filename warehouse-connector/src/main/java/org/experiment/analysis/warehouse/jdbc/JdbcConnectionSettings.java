package org.experiment.analysis.warehouse.jdbc;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/** Connection parameters for one JDBC datasource. */
@Value
@Builder
public class JdbcConnectionSettings {
  String jdbcUrl;
  String driverClassName;
  String user;
  @ToString.Exclude String password;
  /** Schema used to qualify bare table names. */
  String defaultSchema;
  @Builder.Default int maxPoolSize = 4;
  @Builder.Default long connectionTimeoutMs = 30_000;
}
