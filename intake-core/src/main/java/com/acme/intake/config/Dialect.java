package com.acme.intake.config;

import com.acme.intake.core.ConfigException;

/** Supported SQL dialects. The property value selects the matching repository beans. */
public enum Dialect {
  H2("H2"),
  POSTGRESQL("PostgreSQL");

  private final String propertyValue;

  Dialect(String propertyValue) {
    this.propertyValue = propertyValue;
  }

  public String propertyValue() {
    return propertyValue;
  }

  public static Dialect fromJdbcUrl(String jdbcUrl) {
    if (jdbcUrl == null) {
      throw new ConfigException("JDBC URL is not set");
    }
    if (jdbcUrl.startsWith("jdbc:h2:")) {
      return H2;
    }
    if (jdbcUrl.startsWith("jdbc:postgresql:")) {
      return POSTGRESQL;
    }
    throw new ConfigException("Unsupported JDBC URL: " + jdbcUrl);
  }
}
