package org.experiment.analysis.warehouse.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class HikariDataSourceFactory {
  private static final Logger LOGGER = LoggerFactory.getLogger(HikariDataSourceFactory.class);

  private HikariDataSourceFactory() {}

  public static HikariDataSource create(String datasourceId, JdbcConnectionSettings settings) {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(settings.getJdbcUrl());
    if (settings.getDriverClassName() != null) {
      config.setDriverClassName(settings.getDriverClassName());
    }
    if (settings.getUser() != null) {
      config.setUsername(settings.getUser());
      config.setPassword(settings.getPassword());
    }
    config.setMaximumPoolSize(settings.getMaxPoolSize());
    config.setMinimumIdle(Math.min(1, settings.getMaxPoolSize()));
    config.setConnectionTimeout(settings.getConnectionTimeoutMs());
    config.setPoolName("warehouse-" + datasourceId);

    LOGGER.info(
        "Initialized connection pool for datasource {} (url: {}, max size: {})",
        datasourceId,
        settings.getJdbcUrl(),
        settings.getMaxPoolSize());
    return new HikariDataSource(config);
  }
}
