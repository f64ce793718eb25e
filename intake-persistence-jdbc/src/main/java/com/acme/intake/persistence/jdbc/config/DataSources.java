package com.acme.intake.persistence.jdbc.config;

import com.acme.intake.config.ConnectionConfig;
import com.acme.intake.config.Dialect;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/** Builds HikariCP pools from connection settings. */
public final class DataSources {

  private DataSources() {}

  /**
   * @param socketTimeoutSeconds read timeout for PostgreSQL sockets, so a dead server cannot
   *     block a worker forever; ignored for H2
   */
  public static HikariDataSource create(
      ConnectionConfig connection, String poolName, int socketTimeoutSeconds) {
    HikariConfig config = new HikariConfig();
    config.setPoolName(poolName);
    config.setJdbcUrl(connection.getJdbcUrl());
    config.setUsername(connection.getUsername());
    config.setPassword(connection.getPassword());
    config.setMaximumPoolSize(connection.getMaxPoolSize());
    config.setConnectionTimeout(connection.getConnectTimeout().toMillis());
    config.setInitializationFailTimeout(-1);

    if (connection.getDialect() == Dialect.POSTGRESQL) {
      long connectSeconds = Math.max(1, connection.getConnectTimeout().toSeconds());
      config.addDataSourceProperty("connectTimeout", String.valueOf(connectSeconds));
      config.addDataSourceProperty("socketTimeout", String.valueOf(socketTimeoutSeconds));
      config.addDataSourceProperty("ApplicationName", poolName);
    }
    return new HikariDataSource(config);
  }
}
