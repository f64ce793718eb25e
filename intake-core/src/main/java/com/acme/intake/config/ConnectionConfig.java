package com.acme.intake.config;

import java.time.Duration;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/** Where and how to open a connection pool. */
@Value
@Builder(toBuilder = true)
public class ConnectionConfig {

  String jdbcUrl;
  String username;

  @ToString.Exclude
  String password;

  @Builder.Default
  int maxPoolSize = 5;

  @Builder.Default
  Duration connectTimeout = Duration.ofSeconds(10);

  public Dialect getDialect() {
    return Dialect.fromJdbcUrl(jdbcUrl);
  }
}
